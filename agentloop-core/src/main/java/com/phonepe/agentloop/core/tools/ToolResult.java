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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.agentloop.core.errors.StructuredContentException;
import com.phonepe.agentloop.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of a tool invocation. Errors are carried as data, never as exceptions.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class ToolResult {
    public static final String ABORTED_MESSAGE = "tool execution aborted";

    private static final ObjectMapper DEFAULT_MAPPER = JsonUtils.createMapper();

    @Singular("contentBlock")
    List<ContentBlock> content;

    /**
     * Optional typed payload
     */
    JsonNode structuredContent;

    @JsonProperty("isError")
    boolean error;

    public static ToolResult text(String text) {
        return ToolResult.builder().contentBlock(new TextBlock(text)).build();
    }

    public static ToolResult error(String message) {
        return ToolResult.builder().contentBlock(new TextBlock(message)).error(true).build();
    }

    /**
     * Output synthesized for calls that never ran because the run was aborted or cancelled
     */
    public static ToolResult aborted() {
        return error(ABORTED_MESSAGE);
    }

    public static ToolResult error(String format, Object... args) {
        return error(format.formatted(args));
    }

    /**
     * Wraps a structured payload. The JSON form is also added as text for models that ignore structured content.
     */
    public static ToolResult ofStructured(ObjectMapper mapper, Object payload) {
        final var node = payload instanceof JsonNode jsonNode ? jsonNode : mapper.valueToTree(payload);
        return ToolResult.builder()
                .contentBlock(new TextBlock(JsonUtils.toJson(mapper, node)))
                .structuredContent(node)
                .build();
    }

    /**
     * All text blocks joined with new lines
     */
    @JsonIgnore
    public String getText() {
        return Objects.requireNonNullElseGet(content, List::<ContentBlock>of)
                .stream()
                .filter(TextBlock.class::isInstance)
                .map(block -> ((TextBlock) block).getText())
                .collect(Collectors.joining("\n"));
    }

    /**
     * Binds the structured payload to the given type.
     *
     * @throws StructuredContentException if this is an error result, has no payload or the payload does not bind
     */
    public <T> T structured(Class<T> type) {
        return structured(DEFAULT_MAPPER, type);
    }

    public <T> T structured(ObjectMapper mapper, Class<T> type) {
        if (error) {
            throw new StructuredContentException("Cannot extract structured content from an error result: "
                                                         + getText());
        }
        if (null == structuredContent || structuredContent.isNull() || structuredContent.isMissingNode()) {
            throw new StructuredContentException("Tool result has no structured content");
        }
        try {
            return mapper.treeToValue(structuredContent, type);
        }
        catch (Exception e) {
            throw new StructuredContentException("Structured content could not be read as "
                                                         + type.getSimpleName(), e);
        }
    }
}
