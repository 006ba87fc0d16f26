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

package com.phonepe.agentloop.toolbox.mcp.config;

import lombok.Getter;
import lombok.experimental.UtilityClass;

/**
 * Transports supported for MCP servers
 */
@Getter
public enum McpServerType {

    STDIO(Values.STDIO_TEXT),
    SSE(Values.SSE_TEXT),
    ;
    private final String value;

    McpServerType(String value) {
        this.value = value;
    }

    @UtilityClass
    public static final class Values {
        public static final String STDIO_TEXT = "stdio";
        public static final String SSE_TEXT = "sse";
    }
}
