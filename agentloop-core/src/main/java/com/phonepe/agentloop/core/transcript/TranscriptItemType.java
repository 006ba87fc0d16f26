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

package com.phonepe.agentloop.core.transcript;

import lombok.Getter;
import lombok.experimental.UtilityClass;

/**
 * Kinds of items that can appear in a transcript
 */
@Getter
public enum TranscriptItemType {
    SYSTEM_TEXT(Values.SYSTEM_TEXT),
    USER_TEXT(Values.USER_TEXT),
    ASSISTANT_TEXT(Values.ASSISTANT_TEXT),
    REASONING(Values.REASONING),
    TOOL_CALL(Values.TOOL_CALL),
    TOOL_CALL_OUTPUT(Values.TOOL_CALL_OUTPUT),
    ;

    private final String type;

    TranscriptItemType(String type) {
        this.type = type;
    }

    @UtilityClass
    public static final class Values {
        public static final String SYSTEM_TEXT = "SYSTEM_TEXT";
        public static final String USER_TEXT = "USER_TEXT";
        public static final String ASSISTANT_TEXT = "ASSISTANT_TEXT";
        public static final String REASONING = "REASONING";
        public static final String TOOL_CALL = "TOOL_CALL";
        public static final String TOOL_CALL_OUTPUT = "TOOL_CALL_OUTPUT";
    }
}
