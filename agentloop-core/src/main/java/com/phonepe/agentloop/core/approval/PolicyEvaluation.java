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
import lombok.Value;

/**
 * Result of a policy evaluation
 */
@Value
public class PolicyEvaluation {
    @NonNull
    PolicyDecision decision;
    String rationale;

    public static PolicyEvaluation allow() {
        return new PolicyEvaluation(PolicyDecision.ALLOW, null);
    }

    public static PolicyEvaluation ask(String rationale) {
        return new PolicyEvaluation(PolicyDecision.ASK, rationale);
    }

    public static PolicyEvaluation denyContinue(String rationale) {
        return new PolicyEvaluation(PolicyDecision.DENY_CONTINUE, rationale);
    }

    public static PolicyEvaluation denyAbort(String rationale) {
        return new PolicyEvaluation(PolicyDecision.DENY_ABORT, rationale);
    }

    public static PolicyEvaluation of(PolicyDecision decision) {
        return new PolicyEvaluation(decision, null);
    }
}
