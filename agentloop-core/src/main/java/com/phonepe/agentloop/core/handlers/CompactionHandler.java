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

import com.phonepe.agentloop.core.errors.ParameterValidationError;
import com.phonepe.agentloop.core.handlers.decisions.LoopDecision;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Asks for compaction once the tokens reported by the model since the last compaction go over a threshold.
 * <p>
 * A skipped compaction keeps the counter as is. The handler then waits for the next response before asking
 * again, so that a transcript too short to compact does not keep the loop from sampling.
 */
@Slf4j
public class CompactionHandler implements LoopHandler {
    private final long thresholdTokens;
    private final int keepRecentTurns;

    @Getter
    private long cumulativeTokens;
    private boolean compactionPending;
    private boolean waitingForResponse;

    public CompactionHandler(long thresholdTokens, int keepRecentTurns) {
        if (thresholdTokens <= 0) {
            throw new ParameterValidationError("Compaction threshold must be positive, got %d", thresholdTokens);
        }
        if (keepRecentTurns <= 0) {
            throw new ParameterValidationError("keepRecentTurns must be positive, got %d", keepRecentTurns);
        }
        this.thresholdTokens = thresholdTokens;
        this.keepRecentTurns = keepRecentTurns;
    }

    @Override
    public LoopDecision onBeforeSample(LoopContext context) {
        if (cumulativeTokens <= thresholdTokens || compactionPending || waitingForResponse) {
            return LoopDecision.noAction();
        }
        //Reasoning blocks are only valid next to the response that produced them
        if (context.lastItemIsReasoning()) {
            log.debug("Deferring compaction as last transcript item is a reasoning block");
            return LoopDecision.noAction();
        }
        log.info("Token usage {} is over threshold {}. Requesting compaction keeping {} recent items",
                 cumulativeTokens, thresholdTokens, keepRecentTurns);
        compactionPending = true;
        return LoopDecision.compact(keepRecentTurns);
    }

    @Override
    public void onResponse(ResponseInfo response) {
        waitingForResponse = false;
        if (null != response.getUsage()) {
            cumulativeTokens += response.getUsage().getTotalTokens();
        }
    }

    @Override
    public void onCompactionComplete(boolean compacted) {
        compactionPending = false;
        if (compacted) {
            cumulativeTokens = 0;
        }
        else {
            waitingForResponse = true;
        }
    }
}
