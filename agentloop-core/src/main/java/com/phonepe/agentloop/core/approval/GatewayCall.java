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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A validated tool call on its way through the gateway
 */
@Value
@Builder
public class GatewayCall {
    @NonNull
    String callId;
    @NonNull
    String toolName;
    /**
     * Arguments as produced by the model
     */
    String rawArguments;
    /**
     * Parsed argument object
     */
    @NonNull
    JsonNode arguments;
    String loopName;
    String runId;
}
