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

import com.phonepe.agentloop.core.tools.ToolResult;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of a tool call. Exactly one exists for every {@link ToolCall} that is sent back to the model.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolCallOutput extends TranscriptItem {
    String callId;
    ToolResult result;

    @Builder
    @Jacksonized
    public ToolCallOutput(String itemId, Long timestamp, @NonNull String callId, @NonNull ToolResult result) {
        super(TranscriptItemType.TOOL_CALL_OUTPUT, itemId, timestamp);
        this.callId = callId;
        this.result = result;
    }

    public static ToolCallOutput of(String callId, ToolResult result) {
        return new ToolCallOutput(null, null, callId, result);
    }

    @Override
    public <T> T accept(TranscriptItemVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
