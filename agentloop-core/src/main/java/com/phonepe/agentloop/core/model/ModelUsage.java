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
import lombok.extern.jackson.Jacksonized;

/**
 * Token accounting reported by the model for one response
 */
@Value
@Builder
@Jacksonized
public class ModelUsage {
    String model;
    int inputTokens;
    int cachedInputTokens;
    int outputTokens;
    int reasoningTokens;
    int totalTokens;

    public static ModelUsage empty(String model) {
        return ModelUsage.builder().model(model).build();
    }
}
