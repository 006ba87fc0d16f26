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
import com.phonepe.agentloop.core.utils.AgentLoopUtils;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Wraps providers that may throw so that the loop only ever sees error results
 */
@Slf4j
@UtilityClass
public class ToolProviders {

    public static ToolProvider safe(ToolProvider provider) {
        if (provider instanceof SafeToolProvider) {
            return provider;
        }
        return new SafeToolProvider(provider);
    }

    private static final class SafeToolProvider implements ToolProvider {
        private final ToolProvider delegate;

        private SafeToolProvider(ToolProvider delegate) {
            this.delegate = delegate;
        }

        @Override
        public String name() {
            return delegate.name();
        }

        @Override
        public List<ToolSchema> listTools() {
            return delegate.listTools();
        }

        @Override
        public ToolResult callTool(String toolName, JsonNode arguments) {
            try {
                final var result = delegate.callTool(toolName, arguments);
                if (null == result) {
                    return ToolResult.error("Tool %s returned no result", toolName);
                }
                return result;
            }
            catch (Exception e) {
                final var message = AgentLoopUtils.errorMessage(e);
                log.error("Error calling tool {} on provider {}: {}", toolName, delegate.name(), message);
                return ToolResult.error("Tool call failed: %s", message);
            }
        }
    }
}
