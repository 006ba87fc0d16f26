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

/**
 * Aborts the run once the model has responded the given number of times
 */
public class MaxTurnsHandler implements LoopHandler {
    private final int maxTurns;
    @Getter
    private int turns;

    public MaxTurnsHandler(int maxTurns) {
        if (maxTurns <= 0) {
            throw new ParameterValidationError("maxTurns must be positive, got %d", maxTurns);
        }
        this.maxTurns = maxTurns;
    }

    @Override
    public void onResponse(ResponseInfo response) {
        turns++;
    }

    @Override
    public LoopDecision onBeforeSample(LoopContext context) {
        if (turns >= maxTurns) {
            return LoopDecision.abort("Reached maximum of %d turns".formatted(maxTurns));
        }
        return LoopDecision.noAction();
    }
}
