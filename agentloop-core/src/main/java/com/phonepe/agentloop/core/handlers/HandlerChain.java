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

import com.phonepe.agentloop.core.errors.ParameterValidationError;
import com.phonepe.agentloop.core.handlers.decisions.LoopDecision;
import com.phonepe.agentloop.core.handlers.decisions.NoAction;
import com.phonepe.agentloop.core.model.ModelRequest;
import com.phonepe.agentloop.core.transcript.AssistantText;
import com.phonepe.agentloop.core.transcript.ReasoningItem;
import com.phonepe.agentloop.core.transcript.SystemText;
import com.phonepe.agentloop.core.transcript.ToolCall;
import com.phonepe.agentloop.core.transcript.ToolCallOutput;
import com.phonepe.agentloop.core.transcript.TranscriptItem;
import com.phonepe.agentloop.core.transcript.TranscriptItemVisitor;
import com.phonepe.agentloop.core.transcript.UserText;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Ordered set of handlers registered on a loop
 */
@Slf4j
public class HandlerChain {
    private final List<LoopHandler> handlers;

    public HandlerChain(List<? extends LoopHandler> handlers) {
        if (null == handlers || handlers.isEmpty()) {
            throw new ParameterValidationError("At least one handler is required to control the loop");
        }
        if (handlers.stream().anyMatch(Objects::isNull)) {
            throw new ParameterValidationError("Handler list must not contain nulls");
        }
        this.handlers = List.copyOf(handlers);
    }

    public List<LoopHandler> handlers() {
        return handlers;
    }

    /**
     * Poll handlers in registration order. The first decision that is not NoAction is returned and the remaining
     * handlers are not consulted.
     */
    public LoopDecision decideBeforeSample(LoopContext context) {
        for (var handler : handlers) {
            final var decision = Objects.requireNonNullElse(handler.onBeforeSample(context), LoopDecision.noAction());
            if (!(decision instanceof NoAction)) {
                log.debug("Handler {} decided {}", handler.getClass().getSimpleName(), decision.getType());
                return decision;
            }
        }
        return LoopDecision.noAction();
    }

    public void modelRequest(ModelRequest request) {
        fanOut(handler -> handler.onModelRequest(request));
    }

    public void response(ResponseInfo response) {
        fanOut(handler -> handler.onResponse(response));
    }

    /**
     * Dispatch the hook that matches the type of the item
     */
    public void itemAdded(TranscriptItem item) {
        item.accept(new TranscriptItemVisitor<Void>() {
            @Override
            public Void visit(SystemText systemText) {
                fanOut(handler -> handler.onSystemText(systemText));
                return null;
            }

            @Override
            public Void visit(UserText userText) {
                fanOut(handler -> handler.onUserText(userText));
                return null;
            }

            @Override
            public Void visit(AssistantText assistantText) {
                fanOut(handler -> handler.onAssistantText(assistantText));
                return null;
            }

            @Override
            public Void visit(ReasoningItem reasoningItem) {
                fanOut(handler -> handler.onReasoning(reasoningItem));
                return null;
            }

            @Override
            public Void visit(ToolCall toolCall) {
                fanOut(handler -> handler.onToolCall(toolCall));
                return null;
            }

            @Override
            public Void visit(ToolCallOutput toolCallOutput) {
                fanOut(handler -> handler.onToolResult(toolCallOutput));
                return null;
            }
        });
    }

    public void compactionComplete(boolean compacted) {
        fanOut(handler -> handler.onCompactionComplete(compacted));
    }

    /**
     * Errors raised by handlers while being told about another error are logged and dropped, the original error
     * is the one that matters.
     */
    public void error(Throwable error) {
        for (var handler : handlers) {
            try {
                handler.onError(error);
            }
            catch (Exception e) {
                log.error("Handler {} failed while processing error {}: {}",
                          handler.getClass().getSimpleName(), error.getMessage(), e.getMessage());
            }
        }
    }

    private void fanOut(Consumer<LoopHandler> hook) {
        handlers.forEach(hook);
    }
}
