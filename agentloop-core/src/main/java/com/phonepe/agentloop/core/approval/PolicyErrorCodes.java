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
import com.google.common.base.Strings;
import com.phonepe.agentloop.core.tools.ContentBlock;
import com.phonepe.agentloop.core.tools.TextBlock;
import com.phonepe.agentloop.core.tools.ToolResult;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Codes and messages reserved for outputs produced by the gateway itself. Tool backends are not allowed to emit
 * these.
 */
@UtilityClass
public class PolicyErrorCodes {
    /**
     * Key set to true in the structured content of every gateway produced output
     */
    public static final String STAMP_KEY = "policy_gateway";

    public static final String CODE_KEY = "code";

    public static final String POLICY_DENIED_CONTINUE = "POLICY_DENIED_CONTINUE";
    public static final String POLICY_DENIED_ABORT = "POLICY_DENIED_ABORT";
    public static final String POLICY_EVALUATOR_ERROR = "POLICY_EVALUATOR_ERROR";
    public static final String POLICY_BACKEND_RESERVED_MISUSE = "POLICY_BACKEND_RESERVED_MISUSE";

    public static final String POLICY_DENIED_CONTINUE_MESSAGE = "Tool call denied by policy";
    public static final String POLICY_DENIED_ABORT_MESSAGE = "Tool call denied by policy, run aborted";
    public static final String POLICY_EVALUATOR_ERROR_MESSAGE = "Policy evaluator failed";
    public static final String POLICY_BACKEND_RESERVED_MISUSE_MESSAGE
            = "Tool backend returned a reserved policy error";

    private static final Set<String> RESERVED_CODES = Set.of(POLICY_DENIED_CONTINUE,
                                                             POLICY_DENIED_ABORT,
                                                             POLICY_EVALUATOR_ERROR);

    private static final Set<String> RESERVED_MESSAGES = Set.of(POLICY_DENIED_CONTINUE_MESSAGE,
                                                                POLICY_DENIED_ABORT_MESSAGE,
                                                                POLICY_EVALUATOR_ERROR_MESSAGE);

    public static boolean isReservedCode(String code) {
        return RESERVED_CODES.contains(code);
    }

    /**
     * Checks whether an error result that did not come from the gateway carries any of the gateway's signals. The
     * stamp and reserved codes are looked up in the structured content; messages must match a reserved message
     * exactly, either as the whole text or as the first text block. Successful results are never flagged.
     */
    public static boolean carriesReservedSignal(ToolResult result) {
        if (!result.isError()) {
            return false;
        }
        final var structured = result.getStructuredContent();
        if (null != structured && structured.isObject()) {
            if (structured.path(STAMP_KEY).asBoolean(false)) {
                return true;
            }
            if (isReservedCode(structured.path(CODE_KEY).asText(null))) {
                return true;
            }
        }
        if (RESERVED_MESSAGES.contains(result.getText().strip())) {
            return true;
        }
        return Objects.requireNonNullElseGet(result.getContent(), List::<ContentBlock>of)
                .stream()
                .filter(TextBlock.class::isInstance)
                .map(block -> ((TextBlock) block).getText().strip())
                .findFirst()
                .filter(RESERVED_MESSAGES::contains)
                .isPresent();
    }

    /**
     * Checks the message of an exception thrown by a tool backend. Backends often wrap the original message, so any
     * occurrence of a reserved message counts.
     */
    public static boolean mentionsReservedMessage(String message) {
        return !Strings.isNullOrEmpty(message) && RESERVED_MESSAGES.stream().anyMatch(message::contains);
    }

    public static String codeOf(ToolResult result) {
        final JsonNode structured = result.getStructuredContent();
        if (null == structured || !structured.isObject()) {
            return null;
        }
        return structured.path(CODE_KEY).asText(null);
    }
}
