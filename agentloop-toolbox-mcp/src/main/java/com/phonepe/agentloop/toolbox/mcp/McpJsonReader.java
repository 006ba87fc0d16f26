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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.agentloop.core.tools.CompositeToolProvider;
import com.phonepe.agentloop.toolbox.mcp.config.McpConfiguration;
import com.phonepe.agentloop.toolbox.mcp.config.McpServerConfig;
import com.phonepe.agentloop.toolbox.mcp.config.McpServerConfigVisitor;
import com.phonepe.agentloop.toolbox.mcp.config.McpSseServerConfig;
import com.phonepe.agentloop.toolbox.mcp.config.McpStdioServerConfig;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import lombok.SneakyThrows;
import lombok.Value;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Load MCP servers from an mcp.json style configuration into tool providers
 */
@Slf4j
@UtilityClass
public class McpJsonReader {
    public static final String PROVIDER_NAME = "mcp";

    @Value
    public static class LoadedMcpData {
        String name;
        McpServerConfig serverConfig;
        McpSyncClient client;
    }

    @SneakyThrows
    public static McpConfiguration readConfiguration(final Path filePath, final ObjectMapper mapper) {
        return mapper.readValue(Files.readAllBytes(filePath), McpConfiguration.class);
    }

    /**
     * Connect to all servers listed in the file
     *
     * @param filePath Path to the configuration file
     * @param mapper   ObjectMapper to use for serialization/deserialization
     * @return A provider exposing the tools of all servers
     */
    public static CompositeToolProvider loadFile(final Path filePath, final ObjectMapper mapper) {
        return loadServers(readConfiguration(filePath, mapper), mapper);
    }

    public static CompositeToolProvider loadServers(final McpConfiguration config, final ObjectMapper mapper) {
        final var providers = new ArrayList<McpToolProvider>();
        loadServers(config, mapper, loaded -> providers.add(
                McpToolProvider.builder()
                        .name(loaded.getName())
                        .mcpClient(loaded.getClient())
                        .mapper(mapper)
                        .exposedTools(Objects.requireNonNullElseGet(loaded.getServerConfig().getExposedTools(),
                                                                    Set::of))
                        .build()));
        return new CompositeToolProvider(PROVIDER_NAME, providers);
    }

    /**
     * Connect to all servers in the configuration and invoke the handler for each of them
     *
     * @param config  MCP configuration containing server definitions
     * @param mapper  ObjectMapper to use for serialization/deserialization
     * @param handler Consumer to handle each connected server
     */
    public static void loadServers(
            final McpConfiguration config,
            final ObjectMapper mapper,
            final Consumer<LoadedMcpData> handler) {
        Objects.requireNonNullElseGet(config.getMcpServers(), Map::<String, McpServerConfig>of)
                .forEach((name, serverConfig) -> handler.accept(createMcpClient(mapper, name, serverConfig)));
    }

    /**
     * Create and initialize a client for a single server
     */
    public static LoadedMcpData createMcpClient(
            final ObjectMapper mapper,
            final String name,
            final McpServerConfig serverConfig) {
        final var transport = serverConfig.accept(new McpServerConfigVisitor<McpClientTransport>() {
            @Override
            public McpClientTransport visit(McpStdioServerConfig stdioServerConfig) {
                final var serverParameters = ServerParameters.builder(stdioServerConfig.getCommand())
                        .args(Objects.requireNonNullElseGet(stdioServerConfig.getArgs(), List::of))
                        .env(Objects.requireNonNullElseGet(stdioServerConfig.getEnv(), Map::of))
                        .build();
                return new StdioClientTransport(serverParameters, mapper);
            }

            @Override
            public McpClientTransport visit(McpSseServerConfig sseServerConfig) {
                final var timeout = Objects.requireNonNullElse(sseServerConfig.getTimeout(), 5_000);
                return HttpClientSseClientTransport.builder(sseServerConfig.getUrl())
                        .objectMapper(mapper)
                        .customizeClient(builder -> builder.connectTimeout(Duration.ofMillis(timeout)))
                        .build();
            }
        });
        final var client = McpClient.sync(transport).build();
        client.initialize();
        log.info("Connected to MCP server {} over {}", name, serverConfig.getType().getValue());
        return new LoadedMcpData(name, serverConfig, client);
    }
}
