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

package com.phonepe.agentloop.core.handlers.decisions;

import lombok.experimental.UtilityClass;

/**
 * Kinds of decisions a handler can take before a sampling step
 */
public enum LoopDecisionType {
    NO_ACTION,
    ABORT,
    COMPACT,
    INJECT_ITEMS,
    REQUIRE_ANY_TOOL,
    ;

    @UtilityClass
    public static final class Values {
        public static final String NO_ACTION = "NO_ACTION";
        public static final String ABORT = "ABORT";
        public static final String COMPACT = "COMPACT";
        public static final String INJECT_ITEMS = "INJECT_ITEMS";
        public static final String REQUIRE_ANY_TOOL = "REQUIRE_ANY_TOOL";
    }
}
