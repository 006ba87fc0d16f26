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

package com.phonepe.agentloop.core.loop;

import com.phonepe.agentloop.core.model.UsageStats;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a run that did not fail
 */
@Value
@Builder
public class RunResult {
    String runId;
    /**
     * Either {@link LoopState#FINISHED} or {@link LoopState#ABORTED}
     */
    LoopState state;
    /**
     * Assistant text produced during this run, joined with new lines
     */
    String text;
    /**
     * Set when a handler aborted the run with a reason
     */
    String abortReason;
    UsageStats usage;
}
