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
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of the calls waiting for approval, sent whenever the set changes
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PendingApprovalsChangedEvent extends LoopEvent {
    int pendingCount;
    List<String> summaries;

    @Builder
    @Jacksonized
    public PendingApprovalsChangedEvent(
            String eventId,
            String loopName,
            String runId,
            Long timestamp,
            int pendingCount,
            @Singular List<String> summaries) {
        super(LoopEventType.PENDING_APPROVALS_CHANGED, eventId, loopName, runId, timestamp);
        this.pendingCount = pendingCount;
        this.summaries = List.copyOf(Objects.requireNonNullElseGet(summaries, List::of));
    }

    @Override
    public <T> T accept(LoopEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
