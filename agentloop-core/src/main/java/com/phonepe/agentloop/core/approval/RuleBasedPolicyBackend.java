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

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;

/**
 * Looks up the decision by tool name, falling back to a default for unknown tools
 */
@Slf4j
public class RuleBasedPolicyBackend implements PolicyBackend {
    private final Map<String, PolicyDecision> rules;
    private final PolicyDecision defaultDecision;

    @Builder
    public RuleBasedPolicyBackend(@Singular Map<String, PolicyDecision> rules, PolicyDecision defaultDecision) {
        this.rules = Map.copyOf(Objects.requireNonNullElseGet(rules, Map::of));
        this.defaultDecision = Objects.requireNonNullElse(defaultDecision, PolicyDecision.ASK);
    }

    @Override
    public PolicyEvaluation evaluate(@NonNull PolicyRequest request) {
        final var rule = rules.get(request.getToolKey());
        if (null == rule) {
            log.debug("No rule for tool {}, using default decision {}", request.getToolKey(), defaultDecision);
            return new PolicyEvaluation(defaultDecision, "No rule for tool " + request.getToolKey());
        }
        return new PolicyEvaluation(rule, "Rule for tool " + request.getToolKey());
    }
}
