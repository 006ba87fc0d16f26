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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.util.Set;

/**
 * Config for a single MCP server
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = McpServerType.Values.STDIO_TEXT, value = McpStdioServerConfig.class),
        @JsonSubTypes.Type(name = McpServerType.Values.SSE_TEXT, value = McpSseServerConfig.class),
})
@Data
@RequiredArgsConstructor
public abstract class McpServerConfig {

    private final McpServerType type;
    /**
     * Names of the server's tools to expose. Empty or missing exposes all of them.
     */
    private final Set<String> exposedTools;

    public abstract <T> T accept(final McpServerConfigVisitor<T> visitor);
}
