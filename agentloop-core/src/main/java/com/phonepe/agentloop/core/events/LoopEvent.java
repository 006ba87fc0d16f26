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

package com.phonepe.agentloop.core.events;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;

import java.util.Objects;
import java.util.UUID;

/**
 * Append-only record of something that happened in a loop. Persistence layers subscribe to these through the
 * {@link EventBus}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = LoopEventType.Values.ITEM_APPENDED, value = TranscriptItemAppendedEvent.class),
        @JsonSubTypes.Type(name = LoopEventType.Values.STATE_CHANGED, value = LoopStateChangedEvent.class),
        @JsonSubTypes.Type(name = LoopEventType.Values.MODEL_RESPONSE_RECEIVED,
                value = ModelResponseReceivedEvent.class),
        @JsonSubTypes.Type(name = LoopEventType.Values.TOOL_CALLED, value = ToolCalledEvent.class),
        @JsonSubTypes.Type(name = LoopEventType.Values.TOOL_CALL_COMPLETED, value = ToolCallCompletedEvent.class),
        @JsonSubTypes.Type(name = LoopEventType.Values.TOOL_CALL_APPROVAL_DENIED,
                value = ToolCallApprovalDeniedEvent.class),
        @JsonSubTypes.Type(name = LoopEventType.Values.APPROVAL_REQUESTED, value = ApprovalRequestedEvent.class),
        @JsonSubTypes.Type(name = LoopEventType.Values.APPROVAL_RESOLVED, value = ApprovalResolvedEvent.class),
        @JsonSubTypes.Type(name = LoopEventType.Values.PENDING_APPROVALS_CHANGED,
                value = PendingApprovalsChangedEvent.class),
        @JsonSubTypes.Type(name = LoopEventType.Values.COMPACTION_COMPLETED, value = CompactionCompletedEvent.class),
})
@Data
public abstract class LoopEvent {
    private final LoopEventType type;
    private final String eventId;
    /**
     * Name of the loop that emitted this. Null for events from components shared across loops.
     */
    private final String loopName;
    private final String runId;
    private final long timestamp;

    protected LoopEvent(LoopEventType type, String eventId, String loopName, String runId, Long timestamp) {
        this.type = type;
        this.eventId = Objects.requireNonNullElseGet(eventId, () -> UUID.randomUUID().toString());
        this.loopName = loopName;
        this.runId = runId;
        this.timestamp = Objects.requireNonNullElseGet(timestamp, System::currentTimeMillis);
    }

    public abstract <T> T accept(final LoopEventVisitor<T> visitor);
}
