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

package com.phonepe.agentloop.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Generation parameters sent with every request
 */
@Value
@Builder
@With
@Jacksonized
public class ModelSettings {
    /**
     * Model name as understood by the client
     */
    String model;

    ReasoningEffort reasoningEffort;

    Integer maxOutputTokens;

    Float temperature;

    /**
     * Whether the model may request multiple tool calls in one response. Also decides whether the loop runs the
     * calls of one step concurrently. Defaults to true.
     */
    Boolean parallelToolCalls;

    public boolean parallelToolCallsEnabled() {
        return !Boolean.FALSE.equals(parallelToolCalls);
    }
}
