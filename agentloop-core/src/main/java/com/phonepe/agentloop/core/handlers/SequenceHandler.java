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

import com.phonepe.agentloop.core.handlers.decisions.LoopDecision;

import java.util.List;

/**
 * Returns a fixed list of decisions, one per poll, then NoAction forever
 */
public class SequenceHandler implements LoopHandler {
    private final List<LoopDecision> decisions;
    private int index;

    public SequenceHandler(List<? extends LoopDecision> decisions) {
        this.decisions = List.copyOf(decisions);
    }

    public SequenceHandler(LoopDecision... decisions) {
        this(List.of(decisions));
    }

    @Override
    public LoopDecision onBeforeSample(LoopContext context) {
        if (index >= decisions.size()) {
            return LoopDecision.noAction();
        }
        return decisions.get(index++);
    }
}
