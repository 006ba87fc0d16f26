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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.phonepe.agentloop.core.utils.AgentLoopUtils;
import lombok.Data;

import java.util.Objects;

/**
 * A single immutable entry in the conversation log driving a run
 */
@Data
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "itemType")
@JsonSubTypes({
        @JsonSubTypes.Type(name = TranscriptItemType.Values.SYSTEM_TEXT, value = SystemText.class),
        @JsonSubTypes.Type(name = TranscriptItemType.Values.USER_TEXT, value = UserText.class),
        @JsonSubTypes.Type(name = TranscriptItemType.Values.ASSISTANT_TEXT, value = AssistantText.class),
        @JsonSubTypes.Type(name = TranscriptItemType.Values.REASONING, value = ReasoningItem.class),
        @JsonSubTypes.Type(name = TranscriptItemType.Values.TOOL_CALL, value = ToolCall.class),
        @JsonSubTypes.Type(name = TranscriptItemType.Values.TOOL_CALL_OUTPUT, value = ToolCallOutput.class),
})
public abstract class TranscriptItem {
    private final TranscriptItemType itemType;
    private final String itemId;
    private final long timestamp;

    protected TranscriptItem(TranscriptItemType itemType, String itemId, Long timestamp) {
        this.itemType = itemType;
        this.itemId = Objects.requireNonNullElseGet(itemId, () -> AgentLoopUtils.newId("item"));
        this.timestamp = Objects.requireNonNullElseGet(timestamp, System::currentTimeMillis);
    }

    public abstract <T> T accept(TranscriptItemVisitor<T> visitor);
}
