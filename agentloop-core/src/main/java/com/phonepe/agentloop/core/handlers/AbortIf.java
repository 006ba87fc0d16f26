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
import lombok.NonNull;

import java.util.function.BooleanSupplier;

/**
 * Aborts the run as soon as the condition holds. Register after any bootstrap handlers, the order matters.
 */
public class AbortIf implements LoopHandler {
    private final BooleanSupplier condition;
    private final String reason;

    public AbortIf(@NonNull BooleanSupplier condition) {
        this(condition, null);
    }

    public AbortIf(@NonNull BooleanSupplier condition, String reason) {
        this.condition = condition;
        this.reason = reason;
    }

    @Override
    public LoopDecision onBeforeSample(LoopContext context) {
        return condition.getAsBoolean() ? LoopDecision.abort(reason) : LoopDecision.noAction();
    }
}
