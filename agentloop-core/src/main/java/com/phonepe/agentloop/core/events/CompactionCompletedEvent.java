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
 * A compaction attempt finished
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CompactionCompletedEvent extends LoopEvent {
    boolean compacted;
    int compactedItems;
    int keptItems;

    @Builder
    @Jacksonized
    public CompactionCompletedEvent(
            String eventId,
            String loopName,
            String runId,
            Long timestamp,
            boolean compacted,
            int compactedItems,
            int keptItems) {
        super(LoopEventType.COMPACTION_COMPLETED, eventId, loopName, runId, timestamp);
        this.compacted = compacted;
        this.compactedItems = compactedItems;
        this.keptItems = keptItems;
    }

    @Override
    public <T> T accept(LoopEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
