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

package com.phonepe.agentloop.core.events;

import lombok.Getter;
import lombok.experimental.UtilityClass;

/**
 * The different event types emitted by the loop
 */
@Getter
public enum LoopEventType {
    ITEM_APPENDED(Values.ITEM_APPENDED),
    STATE_CHANGED(Values.STATE_CHANGED),
    MODEL_RESPONSE_RECEIVED(Values.MODEL_RESPONSE_RECEIVED),
    TOOL_CALLED(Values.TOOL_CALLED),
    TOOL_CALL_COMPLETED(Values.TOOL_CALL_COMPLETED),
    TOOL_CALL_APPROVAL_DENIED(Values.TOOL_CALL_APPROVAL_DENIED),
    APPROVAL_REQUESTED(Values.APPROVAL_REQUESTED),
    APPROVAL_RESOLVED(Values.APPROVAL_RESOLVED),
    PENDING_APPROVALS_CHANGED(Values.PENDING_APPROVALS_CHANGED),
    COMPACTION_COMPLETED(Values.COMPACTION_COMPLETED),
    ;

    private final String type;

    LoopEventType(String type) {
        this.type = type;
    }

    @UtilityClass
    public static final class Values {
        public static final String ITEM_APPENDED = "ITEM_APPENDED";
        public static final String STATE_CHANGED = "STATE_CHANGED";
        public static final String MODEL_RESPONSE_RECEIVED = "MODEL_RESPONSE_RECEIVED";
        public static final String TOOL_CALLED = "TOOL_CALLED";
        public static final String TOOL_CALL_COMPLETED = "TOOL_CALL_COMPLETED";
        public static final String TOOL_CALL_APPROVAL_DENIED = "TOOL_CALL_APPROVAL_DENIED";
        public static final String APPROVAL_REQUESTED = "APPROVAL_REQUESTED";
        public static final String APPROVAL_RESOLVED = "APPROVAL_RESOLVED";
        public static final String PENDING_APPROVALS_CHANGED = "PENDING_APPROVALS_CHANGED";
        public static final String COMPACTION_COMPLETED = "COMPACTION_COMPLETED";
    }
}
