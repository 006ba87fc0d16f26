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

import com.google.common.base.Strings;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A tool call parked for an external decision
 */
@Value
@Builder
public class ApprovalRequest {
    private static final int SUMMARY_ARGS_LENGTH = 80;

    @NonNull
    String callId;
    @NonNull
    String toolKey;
    /**
     * Raw argument text of the call
     */
    String arguments;
    /**
     * Name of the loop the call belongs to
     */
    String loopName;
    String runId;
    long requestedAt;

    /**
     * One line description for approver UIs
     */
    public String summary() {
        final var args = Strings.nullToEmpty(arguments);
        final var shortArgs = args.length() > SUMMARY_ARGS_LENGTH
                ? args.substring(0, SUMMARY_ARGS_LENGTH) + "..."
                : args;
        return "%s(%s) [%s]".formatted(toolKey, shortArgs, callId);
    }
}
