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

package com.phonepe.agentloop.core.approval;

import lombok.NonNull;

/**
 * Returns the same decision for every call
 */
public class StaticPolicyBackend implements PolicyBackend {
    private final PolicyEvaluation evaluation;

    public StaticPolicyBackend(@NonNull PolicyDecision decision) {
        this.evaluation = new PolicyEvaluation(decision, "Static policy: " + decision.name());
    }

    public static StaticPolicyBackend allowAll() {
        return new StaticPolicyBackend(PolicyDecision.ALLOW);
    }

    @Override
    public PolicyEvaluation evaluate(PolicyRequest request) {
        return evaluation;
    }
}
