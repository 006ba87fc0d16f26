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

package com.phonepe.agentloop.core.handlers.decisions;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * End the run without sampling again. The run finishes in the ABORTED state.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Abort extends LoopDecision {
    /**
     * Optional, reported back in the run result
     */
    String reason;

    @Builder
    @Jacksonized
    public Abort(String reason) {
        super(LoopDecisionType.ABORT);
        this.reason = reason;
    }

    @Override
    public <T> T accept(LoopDecisionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
