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

package com.phonepe.agentloop.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Failures that end a run in the ERROR state
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", false),
    MODEL_CALL_FAILURE("Model call failed with error: %s", true),
    MAX_STEPS_EXCEEDED("Run exceeded the maximum of %d sampling steps", false),
    ORPHANED_TOOL_CALL("Transcript has tool calls without outputs: %s", false),
    INVALID_HANDLER_DECISION("Handler returned an invalid decision: %s", false),
    COMPACTION_FAILURE("Transcript compaction failed: %s", true),
    RUN_CANCELLED("Run %s was cancelled", false),
    SERIALIZATION_ERROR("Error serializing object to JSON. Error: %s", false),
    GENERIC_FAILURE("Run failed with error: %s", false),
    ;

    private final String message;
    private final boolean retryable;
}
