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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.agentloop.core.errors.ParameterValidationError;
import com.phonepe.agentloop.core.utils.AgentLoopUtils;
import com.phonepe.agentloop.core.utils.JsonUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-process table of tools backed by plain java functions.
 * <p>
 * Typed tools get their input schema generated from the argument class. Handlers may return a {@link ToolResult},
 * a {@link String} (sent as text) or any other object (sent as structured content).
 */
@Slf4j
public class FunctionToolProvider implements ToolProvider {
    private record FunctionTool(ToolSchema schema, Function<JsonNode, Object> handler) {
    }

    private final String name;
    private final ObjectMapper mapper;
    private final Map<String, FunctionTool> tools = new LinkedHashMap<>();

    public FunctionToolProvider(@NonNull String name, @NonNull ObjectMapper mapper) {
        this.name = name;
        this.mapper = mapper;
    }

    /**
     * Register a tool whose arguments bind to a java type
     */
    public <A> FunctionToolProvider register(
            @NonNull String toolName,
            String description,
            @NonNull Class<A> argumentType,
            @NonNull Function<A, Object> handler) {
        final var schema = ToolSchema.builder()
                .name(toolName)
                .description(Strings.nullToEmpty(description))
                .inputSchema(JsonUtils.schema(argumentType))
                .build();
        return register(schema, arguments -> {
            final A boundArgs;
            try {
                boundArgs = mapper.treeToValue(arguments, argumentType);
            }
            catch (Exception e) {
                return ToolResult.error("Invalid arguments for tool %s: %s",
                                        toolName, AgentLoopUtils.errorMessage(e));
            }
            return handler.apply(boundArgs);
        });
    }

    /**
     * Register a tool that takes no arguments
     */
    public FunctionToolProvider register(
            @NonNull String toolName,
            String description,
            @NonNull Supplier<Object> handler) {
        final var schema = ToolSchema.builder()
                .name(toolName)
                .description(Strings.nullToEmpty(description))
                .inputSchema(JsonUtils.emptyObjectSchema(mapper))
                .build();
        return register(schema, arguments -> handler.get());
    }

    /**
     * Register a tool with a hand written schema that works on the raw argument tree
     */
    public FunctionToolProvider register(@NonNull ToolSchema schema, @NonNull Function<JsonNode, Object> handler) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(schema.getName()), "Tool name is required");
        if (tools.containsKey(schema.getName())) {
            throw new ParameterValidationError("Tool %s is already registered in provider %s",
                                               schema.getName(), name);
        }
        tools.put(schema.getName(), new FunctionTool(schema, handler));
        log.debug("Registered tool {} in provider {}", schema.getName(), name);
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<ToolSchema> listTools() {
        return tools.values().stream().map(FunctionTool::schema).toList();
    }

    @Override
    public ToolResult callTool(String toolName, JsonNode arguments) {
        final var tool = tools.get(toolName);
        if (null == tool) {
            return ToolResult.error("Unknown tool: %s", toolName);
        }
        try {
            log.debug("Calling function tool {} with arguments: {}", toolName, arguments);
            return toResult(tool.handler().apply(arguments));
        }
        catch (Exception e) {
            log.error("Error calling function tool {}: {}", toolName, AgentLoopUtils.errorMessage(e));
            return ToolResult.error("Tool call failed: %s", AgentLoopUtils.errorMessage(e));
        }
    }

    private ToolResult toResult(Object value) {
        if (value instanceof ToolResult toolResult) {
            return toolResult;
        }
        if (value instanceof String text) {
            return ToolResult.text(text);
        }
        if (null == value) {
            return ToolResult.builder().build();
        }
        return ToolResult.ofStructured(mapper, value);
    }
}
