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
import com.phonepe.agentloop.core.utils.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompositeToolProviderTest {

    @Test
    void testRoutesToOwner() {
        final var mapper = JsonUtils.createMapper();
        final var first = new FunctionToolProvider("first", mapper).register("a", "A", () -> "from first");
        final var second = new FunctionToolProvider("second", mapper).register("b", "B", () -> "from second");
        final var composite = new CompositeToolProvider("all", first, second);

        assertEquals(2, composite.listTools().size());
        assertEquals("from first", composite.callTool("a", mapper.createObjectNode()).getText());
        assertEquals("from second", composite.callTool("b", mapper.createObjectNode()).getText());
        final var unknown = composite.callTool("c", mapper.createObjectNode());
        assertTrue(unknown.isError());
    }

    @Test
    void testDuplicateNamesRejected() {
        final var mapper = JsonUtils.createMapper();
        final var first = new FunctionToolProvider("first", mapper).register("a", "A", () -> "1");
        final var second = new FunctionToolProvider("second", mapper).register("a", "A", () -> "2");
        final var error = assertThrows(ParameterValidationError.class,
                                       () -> new CompositeToolProvider("all", first, second));
        assertEquals("Tool a is exposed by both first and second", error.getMessage());
    }

    @Test
    void testSafeProviderConvertsExceptions() {
        final var mapper = JsonUtils.createMapper();
        final ToolProvider throwing = new ToolProvider() {
            @Override
            public String name() {
                return "throwing";
            }

            @Override
            public List<ToolSchema> listTools() {
                return List.of();
            }

            @Override
            public ToolResult callTool(String toolName, JsonNode arguments) {
                throw new IllegalStateException("backend down");
            }
        };
        final var result = ToolProviders.safe(throwing).callTool("x", mapper.createObjectNode());
        assertTrue(result.isError());
        assertEquals("Tool call failed: backend down", result.getText());
    }
}
