/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.agentloop.core.transcript;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered, append-mostly log of a conversation. Owned by a single loop. Methods are synchronized only so that
 * observers on other threads get consistent snapshots; all mutations come from the owning loop.
 */
@Slf4j
public class Transcript {
    private final List<TranscriptItem> items = new ArrayList<>();

    public Transcript() {
    }

    public Transcript(Collection<? extends TranscriptItem> initialItems) {
        items.addAll(initialItems);
    }

    public synchronized void append(TranscriptItem item) {
        items.add(item);
    }

    public synchronized void appendAll(Collection<? extends TranscriptItem> newItems) {
        items.addAll(newItems);
    }

    /**
     * Replaces the full content. Used only when compacting.
     */
    public synchronized void replaceAll(Collection<? extends TranscriptItem> newItems) {
        items.clear();
        items.addAll(newItems);
    }

    public synchronized void clear() {
        items.clear();
    }

    public synchronized List<TranscriptItem> items() {
        return List.copyOf(items);
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized boolean isEmpty() {
        return items.isEmpty();
    }

    public synchronized Optional<TranscriptItem> last() {
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(items.size() - 1));
    }

    public synchronized boolean lastIsReasoning() {
        return !items.isEmpty() && items.get(items.size() - 1) instanceof ReasoningItem;
    }

    /**
     * @return Call ids that already have an output somewhere in the transcript
     */
    public synchronized Set<String> answeredCallIds() {
        return items.stream()
                .filter(ToolCallOutput.class::isInstance)
                .map(item -> ((ToolCallOutput) item).getCallId())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @return Provider ids of reasoning and tool call items already recorded
     */
    public synchronized Set<String> providerItemIds() {
        return items.stream()
                .map(item -> item.accept(new TranscriptVisitorAdapter<String>(null) {
                    @Override
                    public String visit(ReasoningItem reasoningItem) {
                        return reasoningItem.getId();
                    }

                    @Override
                    public String visit(ToolCall toolCall) {
                        return toolCall.getId();
                    }
                }))
                .filter(id -> id != null && !id.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Tool calls that do not have an output yet, in transcript order
     */
    public synchronized List<ToolCall> pendingToolCalls() {
        final var calls = new LinkedHashMap<String, ToolCall>();
        for (var item : items) {
            if (item instanceof ToolCall toolCall) {
                calls.putIfAbsent(toolCall.getCallId(), toolCall);
            }
            else if (item instanceof ToolCallOutput output) {
                calls.remove(output.getCallId());
            }
        }
        return List.copyOf(calls.values());
    }

    /**
     * Tool calls that would be rejected by the model if the transcript was sent as is. A call that is the very
     * last item is still being worked on and is not reported.
     */
    public synchronized List<ToolCall> unpairedToolCalls() {
        final var pending = new ArrayList<>(pendingToolCalls());
        if (!items.isEmpty() && items.get(items.size() - 1) instanceof ToolCall lastCall) {
            pending.removeIf(call -> call.getCallId().equals(lastCall.getCallId()));
        }
        if (!pending.isEmpty()) {
            log.debug("Found unpaired tool calls: {}", pending.stream().map(ToolCall::getCallId).toList());
        }
        return List.copyOf(pending);
    }
}
