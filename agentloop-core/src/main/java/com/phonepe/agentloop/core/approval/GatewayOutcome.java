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

import com.phonepe.agentloop.core.tools.ToolResult;
import lombok.NonNull;
import lombok.Value;

/**
 * What the gateway decided and produced for one call
 */
@Value
public class GatewayOutcome {
    @NonNull
    String callId;
    @NonNull
    ToolResult result;
    @NonNull
    ToolCallState finalState;
    /**
     * Set when the run has to end after the current step
     */
    boolean abortRequested;

    public static GatewayOutcome completed(String callId, ToolResult result) {
        return new GatewayOutcome(callId, result, ToolCallState.COMPLETED, false);
    }

    public static GatewayOutcome denied(String callId, ToolResult result, boolean abort) {
        return new GatewayOutcome(callId, result, ToolCallState.DENIED, abort);
    }

    public static GatewayOutcome aborted(String callId) {
        return new GatewayOutcome(callId, ToolResult.aborted(), ToolCallState.DENIED, true);
    }
}
