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

package com.phonepe.agentloop.core.compaction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.agentloop.core.errors.AgentLoopException;
import com.phonepe.agentloop.core.errors.ErrorType;
import com.phonepe.agentloop.core.model.ModelClient;
import com.phonepe.agentloop.core.model.ModelRequest;
import com.phonepe.agentloop.core.model.ModelResponse;
import com.phonepe.agentloop.core.model.ModelSettings;
import com.phonepe.agentloop.core.model.ToolChoice;
import com.phonepe.agentloop.core.transcript.AssistantText;
import com.phonepe.agentloop.core.transcript.ToolCall;
import com.phonepe.agentloop.core.transcript.ToolCallOutput;
import com.phonepe.agentloop.core.transcript.Transcript;
import com.phonepe.agentloop.core.transcript.TranscriptItem;
import com.phonepe.agentloop.core.transcript.UserText;
import com.phonepe.agentloop.core.utils.AgentLoopUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Replaces the older part of a transcript with a model generated summary.
 * <p>
 * The most recent items are kept verbatim. The split point is moved back if it would separate a tool call from its
 * output. If fewer than {@link #MIN_PREFIX_ITEMS} items would be summarized, nothing is done.
 */
@Slf4j
public class TranscriptCompactor {
    public static final int MIN_PREFIX_ITEMS = 3;

    private static final TypeReference<List<TranscriptItem>> ITEM_LIST_TYPE = new TypeReference<>() {
    };

    private final ModelClient modelClient;
    private final ModelSettings modelSettings;
    private final ObjectMapper mapper;
    private final CompactionPrompts prompts;

    @Builder
    public TranscriptCompactor(
            @NonNull ModelClient modelClient,
            @NonNull ModelSettings modelSettings,
            @NonNull ObjectMapper mapper,
            CompactionPrompts prompts) {
        this.modelClient = modelClient;
        this.modelSettings = modelSettings;
        this.mapper = mapper;
        this.prompts = Objects.requireNonNullElseGet(prompts, CompactionPrompts::defaults);
    }

    /**
     * Compact the transcript in place
     *
     * @param transcript      Transcript to compact
     * @param keepRecentTurns Number of most recent items to keep as is
     * @return Result. The transcript is left untouched when {@link CompactionResult#isCompacted()} is false.
     * @throws AgentLoopException with {@link ErrorType#COMPACTION_FAILURE} if the summary could not be generated
     */
    public CompactionResult compact(@NonNull Transcript transcript, int keepRecentTurns) {
        return compact(transcript, keepRecentTurns, future -> {
        });
    }

    /**
     * Same as {@link #compact(Transcript, int)}, handing the summary request to the caller before waiting on it so
     * that the caller can cancel it
     *
     * @param modelCallTracker Receives the future of the summary request
     */
    public CompactionResult compact(
            @NonNull Transcript transcript,
            int keepRecentTurns,
            @NonNull Consumer<CompletableFuture<ModelResponse>> modelCallTracker) {
        final var items = transcript.items();
        final var boundary = boundary(items, keepRecentTurns);
        if (boundary < MIN_PREFIX_ITEMS) {
            log.info("Compaction skipped. Only {} items available to compact out of {}", Math.max(boundary, 0),
                     items.size());
            return CompactionResult.skipped(items.size());
        }
        final var prefix = items.subList(0, boundary);
        final var recent = items.subList(boundary, items.size());
        final var summary = summarize(prefix, modelCallTracker);
        final var compacted = new ArrayList<TranscriptItem>(recent.size() + 1);
        compacted.add(UserText.of(summary));
        compacted.addAll(recent);
        transcript.replaceAll(compacted);
        log.info("Transcript compacted. Summarized {} items, kept {} recent items", prefix.size(), recent.size());
        return CompactionResult.builder()
                .compacted(true)
                .compactedItems(prefix.size())
                .keptItems(recent.size())
                .build();
    }

    /**
     * Index of the first item to keep. Never splits a call from an output that follows it.
     */
    static int boundary(List<TranscriptItem> items, int keepRecentTurns) {
        var boundary = items.size() - keepRecentTurns;
        if (boundary < 1) {
            return boundary;
        }
        final var callPositions = new HashMap<String, Integer>();
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof ToolCall call) {
                callPositions.putIfAbsent(call.getCallId(), i);
            }
        }
        var moved = true;
        while (moved && boundary > 0) {
            moved = false;
            for (int i = boundary; i < items.size(); i++) {
                if (items.get(i) instanceof ToolCallOutput output) {
                    final var callPosition = callPositions.get(output.getCallId());
                    if (null != callPosition && callPosition < boundary) {
                        boundary = callPosition;
                        moved = true;
                    }
                }
            }
        }
        return boundary;
    }

    private String summarize(
            List<TranscriptItem> prefix,
            Consumer<CompletableFuture<ModelResponse>> modelCallTracker) {
        final var request = ModelRequest.builder()
                .requestId(AgentLoopUtils.newId("compaction"))
                .item(UserText.of(prompts.renderConversation(render(prefix))))
                .instructions(prompts.getInstructions())
                .settings(modelSettings)
                .toolChoice(ToolChoice.NONE)
                .parallelToolCalls(false)
                .build();
        final CompletableFuture<ModelResponse> future;
        try {
            future = Objects.requireNonNull(modelClient.sample(request), "Model client returned no future");
        }
        catch (RuntimeException e) {
            log.error("Error generating transcript summary: {}", AgentLoopUtils.errorMessage(e));
            throw new AgentLoopException(ErrorType.COMPACTION_FAILURE, e, AgentLoopUtils.errorMessage(e));
        }
        modelCallTracker.accept(future);
        final ModelResponse response;
        try {
            response = Objects.requireNonNull(future.get(), "Model client returned no response");
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for summary");
        }
        catch (CancellationException e) {
            log.error("Summary request was cancelled");
            throw new AgentLoopException(ErrorType.COMPACTION_FAILURE, e, "summary request was cancelled");
        }
        catch (ExecutionException | CompletionException | NullPointerException e) {
            final var cause = AgentLoopUtils.unwrap(e);
            log.error("Error generating transcript summary: {}", AgentLoopUtils.errorMessage(cause));
            throw new AgentLoopException(ErrorType.COMPACTION_FAILURE, cause, AgentLoopUtils.errorMessage(cause));
        }
        return response.getOutput()
                .stream()
                .filter(AssistantText.class::isInstance)
                .map(item -> ((AssistantText) item).getText())
                .filter(text -> !Strings.isNullOrEmpty(text))
                .findFirst()
                .orElseThrow(() -> new AgentLoopException(ErrorType.COMPACTION_FAILURE,
                                                          "model response has no assistant text"));
    }

    private String render(List<TranscriptItem> prefix) {
        try {
            return mapper.writerFor(ITEM_LIST_TYPE)
                    .withDefaultPrettyPrinter()
                    .writeValueAsString(prefix);
        }
        catch (JsonProcessingException e) {
            throw new AgentLoopException(ErrorType.SERIALIZATION_ERROR, e, e.getOriginalMessage());
        }
    }
}
