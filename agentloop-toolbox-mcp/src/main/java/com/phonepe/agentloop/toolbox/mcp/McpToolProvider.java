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

package com.phonepe.agentloop.toolbox.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.agentloop.core.tools.ContentBlock;
import com.phonepe.agentloop.core.tools.ImageBlock;
import com.phonepe.agentloop.core.tools.TextBlock;
import com.phonepe.agentloop.core.tools.ToolProvider;
import com.phonepe.agentloop.core.tools.ToolResult;
import com.phonepe.agentloop.core.tools.ToolSchema;
import com.phonepe.agentloop.core.utils.AgentLoopUtils;
import com.phonepe.agentloop.core.utils.JsonUtils;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Exposes the tools of an MCP server as a {@link ToolProvider}.
 * <p>
 * Tool names are prefixed with the server name so that tools from multiple servers can be composed. Tools are
 * listed from the server once, on first use.
 */
@Slf4j
public class McpToolProvider implements ToolProvider, AutoCloseable {
    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private record KnownTool(String serverToolName, ToolSchema schema) {
    }

    private final String name;
    private final McpSyncClient mcpClient;
    private final ObjectMapper mapper;
    private final Set<String> exposedTools = new CopyOnWriteArraySet<>();
    private volatile Map<String, KnownTool> knownTools;

    @Builder
    public McpToolProvider(
            @NonNull String name,
            @NonNull McpSyncClient mcpClient,
            @NonNull ObjectMapper mapper,
            @Singular Set<String> exposedTools) {
        this.name = name;
        this.mcpClient = mcpClient;
        this.mapper = mapper;
        this.exposeTools(exposedTools);
    }

    /**
     * Name under which a server tool is exposed to the model
     */
    public static String toolId(String serverName, String toolName) {
        return String.join("_", serverName, toolName)
                .replaceAll("[\\s\\p{Punct}]", "_")
                .toLowerCase();
    }

    /**
     * Restrict the exposed tools. Names are the tool names as reported by the server.
     */
    public McpToolProvider exposeTools(String... toolNames) {
        return exposeTools(Arrays.asList(toolNames));
    }

    public McpToolProvider exposeTools(Collection<String> toolNames) {
        exposedTools.addAll(Objects.requireNonNullElseGet(toolNames, List::of));
        return this;
    }

    public McpToolProvider exposeAllTools() {
        exposedTools.clear();
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<ToolSchema> listTools() {
        return tools().values()
                .stream()
                .filter(this::isExposed)
                .map(KnownTool::schema)
                .toList();
    }

    @Override
    public ToolResult callTool(String toolName, JsonNode arguments) {
        final var tool = tools().get(toolName);
        if (null == tool || !isExposed(tool)) {
            return ToolResult.error("Unknown tool: %s", toolName);
        }
        log.debug("Calling MCP tool {} on server {} with arguments: {}", tool.serverToolName(), name, arguments);
        try {
            final Map<String, Object> callArguments = null == arguments || arguments.isNull()
                    ? Map.of()
                    : mapper.convertValue(arguments, ARGUMENTS_TYPE);
            final var response = mcpClient.callTool(new McpSchema.CallToolRequest(tool.serverToolName(),
                                                                                  callArguments));
            return toToolResult(response);
        }
        catch (Exception e) {
            final var message = AgentLoopUtils.errorMessage(e);
            log.error("Error calling MCP tool {} on server {}: {}", tool.serverToolName(), name, message);
            return ToolResult.error("Error calling MCP tool %s: %s", tool.serverToolName(), message);
        }
    }

    @Override
    public void close() {
        mcpClient.close();
    }

    private boolean isExposed(KnownTool tool) {
        return exposedTools.isEmpty() || exposedTools.contains(tool.serverToolName());
    }

    private Map<String, KnownTool> tools() {
        var loaded = knownTools;
        if (null == loaded) {
            synchronized (this) {
                loaded = knownTools;
                if (null == loaded) {
                    loaded = loadTools();
                    knownTools = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<String, KnownTool> loadTools() {
        log.debug("Loading tools from MCP server: {}", name);
        final var tools = new LinkedHashMap<String, KnownTool>();
        for (var toolDef : mcpClient.listTools().tools()) {
            final var id = toolId(name, toolDef.name());
            final var inputSchema = null == toolDef.inputSchema()
                    ? JsonUtils.emptyObjectSchema(mapper)
                    : mapper.<JsonNode>valueToTree(toolDef.inputSchema());
            tools.put(id, new KnownTool(toolDef.name(),
                                        ToolSchema.builder()
                                                .name(id)
                                                .description(Objects.requireNonNullElseGet(toolDef.description(),
                                                                                           toolDef::name))
                                                .inputSchema(inputSchema)
                                                .build()));
        }
        log.info("Loaded {} tools from MCP server {}: {}", tools.size(), name, tools.keySet());
        return Collections.unmodifiableMap(tools);
    }

    private ToolResult toToolResult(McpSchema.CallToolResult response) {
        final var blocks = new ArrayList<ContentBlock>();
        for (var content : Objects.requireNonNullElseGet(response.content(), List::<McpSchema.Content>of)) {
            blocks.add(toContentBlock(content));
        }
        return ToolResult.builder()
                .content(blocks)
                .error(Boolean.TRUE.equals(response.isError()))
                .build();
    }

    private static ContentBlock toContentBlock(McpSchema.Content content) {
        if (content instanceof McpSchema.TextContent text) {
            return new TextBlock(Strings.nullToEmpty(text.text()));
        }
        if (content instanceof McpSchema.ImageContent image) {
            return new ImageBlock(image.data(), image.mimeType());
        }
        if (content instanceof McpSchema.EmbeddedResource embedded) {
            final var resource = embedded.resource();
            if (resource instanceof McpSchema.TextResourceContents textResource) {
                return new TextBlock(Strings.nullToEmpty(textResource.text()));
            }
            return new TextBlock("[binary resource %s of type %s]".formatted(resource.uri(), resource.mimeType()));
        }
        return new TextBlock("[unsupported content of type %s]".formatted(content.type()));
    }
}
