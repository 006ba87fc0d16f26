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

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Sample next, but force the model to call at least one tool
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RequireAnyTool extends LoopDecision {
    public static final RequireAnyTool INSTANCE = new RequireAnyTool();

    public RequireAnyTool() {
        super(LoopDecisionType.REQUIRE_ANY_TOOL);
    }

    @Override
    public <T> T accept(LoopDecisionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
