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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A tool call was denied by policy or by an approver
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolCallApprovalDeniedEvent extends LoopEvent {
    String callId;
    String toolName;
    String code;
    boolean abort;
    String reason;

    @Builder
    @Jacksonized
    public ToolCallApprovalDeniedEvent(
            String eventId,
            String loopName,
            String runId,
            Long timestamp,
            String callId,
            String toolName,
            String code,
            boolean abort,
            String reason) {
        super(LoopEventType.TOOL_CALL_APPROVAL_DENIED, eventId, loopName, runId, timestamp);
        this.callId = callId;
        this.toolName = toolName;
        this.code = code;
        this.abort = abort;
        this.reason = reason;
    }

    @Override
    public <T> T accept(LoopEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
