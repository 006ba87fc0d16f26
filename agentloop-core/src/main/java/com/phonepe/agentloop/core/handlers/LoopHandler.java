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
import com.phonepe.agentloop.core.transcript.UserText;

/**
 * Observer and controller of an {@link com.phonepe.agentloop.core.loop.AgentLoop}. All hooks are no-op by default,
 * implementations override only what they need.
 * <p>
 * Hooks are called synchronously on the thread driving the loop, in registration order. They must not block.
 * Exceptions thrown from any hook other than {@link #onError(Throwable)} fail the run.
 */
public interface LoopHandler {

    /**
     * Called before every sampling step.
     *
     * @param context Snapshot of the run
     * @return What the loop should do. The first handler returning something other than
     * {@link com.phonepe.agentloop.core.handlers.decisions.NoAction} wins.
     */
    default LoopDecision onBeforeSample(LoopContext context) {
        return LoopDecision.noAction();
    }

    /**
     * Called right before a request is sent to the model
     */
    default void onModelRequest(ModelRequest request) {
    }

    /**
     * Called once per model response, before any of the output items are dispatched
     */
    default void onResponse(ResponseInfo response) {
    }

    default void onReasoning(ReasoningItem item) {
    }

    default void onSystemText(SystemText item) {
    }

    default void onUserText(UserText item) {
    }

    default void onAssistantText(AssistantText item) {
    }

    default void onToolCall(ToolCall item) {
    }

    default void onToolResult(ToolCallOutput item) {
    }

    /**
     * Called after a compaction attempt
     *
     * @param compacted false if compaction was skipped because there was not enough to compact
     */
    default void onCompactionComplete(boolean compacted) {
    }

    /**
     * Called when a run fails. The error is rethrown by the loop after all handlers have seen it.
     */
    default void onError(Throwable error) {
    }
}
