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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Tool invocation requested by the model
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolCall extends TranscriptItem {
    /**
     * Call id as received from the model. Outputs are paired to calls using this.
     */
    String callId;

    /**
     * Name of the tool to be called
     */
    String name;

    /**
     * Raw argument text as generated by the model. Not guaranteed to be valid JSON.
     */
    String arguments;

    /**
     * Provider assigned item id, if any
     */
    String id;

    @Builder
    @Jacksonized
    public ToolCall(
            String itemId,
            Long timestamp,
            @NonNull String callId,
            @NonNull String name,
            String arguments,
            String id) {
        super(TranscriptItemType.TOOL_CALL, itemId, timestamp);
        this.callId = callId;
        this.name = name;
        this.arguments = arguments;
        this.id = id;
    }

    @Override
    public <T> T accept(TranscriptItemVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
