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

package com.phonepe.agentloop.core.compaction;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a compaction attempt
 */
@Value
@Builder
public class CompactionResult {
    /**
     * False if nothing was changed because there was not enough history to summarize
     */
    boolean compacted;
    /**
     * Number of items replaced by the summary
     */
    int compactedItems;
    /**
     * Number of recent items kept verbatim
     */
    int keptItems;

    public static CompactionResult skipped(int size) {
        return new CompactionResult(false, 0, size);
    }
}
