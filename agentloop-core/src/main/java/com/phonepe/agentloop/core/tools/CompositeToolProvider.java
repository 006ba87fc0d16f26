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
import com.phonepe.agentloop.core.errors.ParameterValidationError;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates multiple providers behind one name space. Tool names must be unique across all providers; a clash is
 * reported when the composite is built.
 */
@Slf4j
public class CompositeToolProvider implements ToolProvider {
    private final String name;
    private final List<ToolProvider> upstreams;
    private final Map<String, ToolProvider> toolOwners = new LinkedHashMap<>();
    private final List<ToolSchema> schemas = new ArrayList<>();

    public CompositeToolProvider(@NonNull String name, @NonNull List<? extends ToolProvider> upstreams) {
        this.name = name;
        this.upstreams = List.copyOf(upstreams);
        for (var upstream : this.upstreams) {
            for (var schema : upstream.listTools()) {
                final var existing = toolOwners.putIfAbsent(schema.getName(), upstream);
                if (null != existing) {
                    throw new ParameterValidationError("Tool %s is exposed by both %s and %s",
                                                       schema.getName(), existing.name(), upstream.name());
                }
                schemas.add(schema);
            }
        }
        log.info("Composite tool provider {} created with {} tools from {} providers",
                 name, toolOwners.size(), this.upstreams.size());
    }

    public CompositeToolProvider(@NonNull String name, ToolProvider... upstreams) {
        this(name, List.of(upstreams));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<ToolSchema> listTools() {
        return List.copyOf(schemas);
    }

    @Override
    public ToolResult callTool(String toolName, JsonNode arguments) {
        final var owner = toolOwners.get(toolName);
        if (null == owner) {
            return ToolResult.error("Unknown tool: %s", toolName);
        }
        return owner.callTool(toolName, arguments);
    }

    public List<ToolProvider> upstreams() {
        return upstreams;
    }
}
