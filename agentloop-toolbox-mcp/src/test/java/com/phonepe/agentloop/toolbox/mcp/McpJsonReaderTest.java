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

import com.phonepe.agentloop.core.utils.JsonUtils;
import com.phonepe.agentloop.toolbox.mcp.config.McpServerType;
import com.phonepe.agentloop.toolbox.mcp.config.McpSseServerConfig;
import com.phonepe.agentloop.toolbox.mcp.config.McpStdioServerConfig;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests {@link McpJsonReader}
 */
class McpJsonReaderTest {

    @Test
    @SneakyThrows
    void testReadConfiguration() {
        final var path = Path.of(Objects.requireNonNull(getClass().getResource("/mcp.json")).toURI());

        final var config = McpJsonReader.readConfiguration(path, JsonUtils.createMapper());

        assertEquals(2, config.getMcpServers().size());
        final var everything = assertInstanceOf(McpStdioServerConfig.class, config.getMcpServers().get("everything"));
        assertEquals(McpServerType.STDIO, everything.getType());
        assertEquals("npx", everything.getCommand());
        assertEquals(List.of("-y", "@modelcontextprotocol/server-everything"), everything.getArgs());
        assertEquals(Map.of("LOG_LEVEL", "debug"), everything.getEnv());
        assertEquals(Set.of("echo", "add"), everything.getExposedTools());

        final var remote = assertInstanceOf(McpSseServerConfig.class, config.getMcpServers().get("remote"));
        assertEquals("http://localhost:3001", remote.getUrl());
        assertEquals(2_000, remote.getTimeout());
        assertNull(remote.getExposedTools());
    }

    @Test
    @SneakyThrows
    void testEmptyConfiguration(@TempDir Path tempDir) {
        final var path = tempDir.resolve("mcp.json");
        Files.writeString(path, "{\"mcpServers\": {}}");
        final var mapper = JsonUtils.createMapper();

        final var provider = McpJsonReader.loadFile(path, mapper);

        assertEquals(McpJsonReader.PROVIDER_NAME, provider.name());
        assertEquals(0, provider.listTools().size());
    }
}
