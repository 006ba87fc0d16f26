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

import com.phonepe.agentloop.core.approval.ApprovalDecision;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An external decision arrived for a parked tool call
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ApprovalResolvedEvent extends LoopEvent {
    String callId;
    ApprovalDecision decision;

    @Builder
    @Jacksonized
    public ApprovalResolvedEvent(
            String eventId,
            String loopName,
            String runId,
            Long timestamp,
            String callId,
            ApprovalDecision decision) {
        super(LoopEventType.APPROVAL_RESOLVED, eventId, loopName, runId, timestamp);
        this.callId = callId;
        this.decision = decision;
    }

    @Override
    public <T> T accept(LoopEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
