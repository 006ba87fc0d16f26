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

package com.phonepe.agentloop.core.handlers;

import com.phonepe.agentloop.core.handlers.decisions.LoopDecision;
import com.phonepe.agentloop.core.model.ModelRequest;
import com.phonepe.agentloop.core.transcript.AssistantText;
import com.phonepe.agentloop.core.transcript.ReasoningItem;
import com.phonepe.agentloop.core.transcript.SystemText;
import com.phonepe.agentloop.core.transcript.ToolCall;
import com.phonepe.agentloop.core.transcript.ToolCallOutput;
import com.phonepe.agentloop.core.transcript.TranscriptItem;
import com.phonepe.agentloop.core.transcript.UserText;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps everything it is told. Never influences the loop.
 */
public class RecordingHandler implements LoopHandler {
    private final List<TranscriptItem> items = new CopyOnWriteArrayList<>();
    private final List<ModelRequest> requests = new CopyOnWriteArrayList<>();
    private final List<ResponseInfo> responses = new CopyOnWriteArrayList<>();
    private final List<Boolean> compactions = new CopyOnWriteArrayList<>();
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();
    private final List<LoopContext> polls = new CopyOnWriteArrayList<>();

    @Override
    public LoopDecision onBeforeSample(LoopContext context) {
        polls.add(context);
        return LoopHandler.super.onBeforeSample(context);
    }

    @Override
    public void onModelRequest(ModelRequest request) {
        requests.add(request);
    }

    @Override
    public void onResponse(ResponseInfo response) {
        responses.add(response);
    }

    @Override
    public void onReasoning(ReasoningItem item) {
        items.add(item);
    }

    @Override
    public void onSystemText(SystemText item) {
        items.add(item);
    }

    @Override
    public void onUserText(UserText item) {
        items.add(item);
    }

    @Override
    public void onAssistantText(AssistantText item) {
        items.add(item);
    }

    @Override
    public void onToolCall(ToolCall item) {
        items.add(item);
    }

    @Override
    public void onToolResult(ToolCallOutput item) {
        items.add(item);
    }

    @Override
    public void onCompactionComplete(boolean compacted) {
        compactions.add(compacted);
    }

    @Override
    public void onError(Throwable error) {
        errors.add(error);
    }

    public List<TranscriptItem> items() {
        return List.copyOf(items);
    }

    public <T extends TranscriptItem> List<T> items(Class<T> type) {
        return items.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    public List<ModelRequest> requests() {
        return List.copyOf(requests);
    }

    public List<ResponseInfo> responses() {
        return List.copyOf(responses);
    }

    public List<Boolean> compactions() {
        return List.copyOf(compactions);
    }

    public List<Throwable> errors() {
        return List.copyOf(errors);
    }

    public List<LoopContext> polls() {
        return List.copyOf(polls);
    }
}
