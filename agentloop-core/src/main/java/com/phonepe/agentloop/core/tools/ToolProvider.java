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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A source of tools. Implementations must never let an exception escape {@link #callTool(String, JsonNode)};
 * failures are reported as error results.
 */
public interface ToolProvider {
    /**
     * Name of the provider, used in logs and error messages
     */
    String name();

    List<ToolSchema> listTools();

    /**
     * Invoke a tool
     *
     * @param toolName  Name as listed by {@link #listTools()}
     * @param arguments Argument object, never null
     * @return Result, with {@link ToolResult#isError()} set on failure
     */
    ToolResult callTool(String toolName, JsonNode arguments);
}
