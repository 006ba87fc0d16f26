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

/**
 * Visitor that returns a default value for every item type. Override only the types of interest.
 */
public class TranscriptVisitorAdapter<T> implements TranscriptItemVisitor<T> {
    private final T defaultValue;

    public TranscriptVisitorAdapter(T defaultValue) {
        this.defaultValue = defaultValue;
    }

    @Override
    public T visit(SystemText systemText) {
        return defaultValue;
    }

    @Override
    public T visit(UserText userText) {
        return defaultValue;
    }

    @Override
    public T visit(AssistantText assistantText) {
        return defaultValue;
    }

    @Override
    public T visit(ReasoningItem reasoningItem) {
        return defaultValue;
    }

    @Override
    public T visit(ToolCall toolCall) {
        return defaultValue;
    }

    @Override
    public T visit(ToolCallOutput toolCallOutput) {
        return defaultValue;
    }
}
