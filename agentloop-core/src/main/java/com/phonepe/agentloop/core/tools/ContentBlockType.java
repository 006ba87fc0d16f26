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

package com.phonepe.agentloop.core.tools;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.experimental.UtilityClass;

/**
 * Content block kinds a tool can return
 */
@Getter
public enum ContentBlockType {
    TEXT(Values.TEXT),
    IMAGE(Values.IMAGE),
    ;

    @JsonValue
    private final String type;

    ContentBlockType(String type) {
        this.type = type;
    }

    @UtilityClass
    public static final class Values {
        public static final String TEXT = "text";
        public static final String IMAGE = "image";
    }
}
