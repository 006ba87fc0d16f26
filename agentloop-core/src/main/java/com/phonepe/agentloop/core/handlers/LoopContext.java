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

import com.phonepe.agentloop.core.model.UsageStats;
import com.phonepe.agentloop.core.transcript.ReasoningItem;
import com.phonepe.agentloop.core.transcript.TranscriptItem;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Read only view of a run handed to handlers when they are asked for a decision
 */
@Value
@Builder
public class LoopContext {
    String loopName;
    String runId;
    /**
     * Number of sampling steps already taken in this run
     */
    int step;
    /**
     * Transcript snapshot at the time of the poll
     */
    @Singular
    List<TranscriptItem> items;
    @NonNull
    UsageStats usage;

    public boolean lastItemIsReasoning() {
        return !items.isEmpty() && items.get(items.size() - 1) instanceof ReasoningItem;
    }
}
