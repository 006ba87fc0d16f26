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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Removes NUL characters from tool output. Many stores reject them in JSON documents.
 */
@Slf4j
@UtilityClass
public class ToolResultSanitizer {
    private static final char NUL = '\u0000';

    public static ToolResult sanitize(final ToolResult result, final ObjectMapper mapper) {
        final var removed = new AtomicInteger();
        final var content = new ArrayList<ContentBlock>();
        for (var block : result.getContent()) {
            content.add(block.accept(new ContentBlockVisitor<ContentBlock>() {
                @Override
                public ContentBlock visit(TextBlock textBlock) {
                    return new TextBlock(strip(textBlock.getText(), removed));
                }

                @Override
                public ContentBlock visit(ImageBlock imageBlock) {
                    return imageBlock;
                }
            }));
        }
        final var structured = null == result.getStructuredContent()
                ? null
                : strip(result.getStructuredContent(), mapper, removed);
        if (removed.get() == 0) {
            return result;
        }
        log.warn("Removed {} null byte(s) from tool output", removed.get());
        content.add(0, new TextBlock("NOTE: %d null byte(s) removed from tool output".formatted(removed.get())));
        return result.toBuilder()
                .clearContent()
                .content(content)
                .structuredContent(structured)
                .build();
    }

    private static String strip(String value, AtomicInteger counter) {
        if (value.indexOf(NUL) < 0) {
            return value;
        }
        final var builder = new StringBuilder(value.length());
        for (var ch : value.toCharArray()) {
            if (ch == NUL) {
                counter.incrementAndGet();
            }
            else {
                builder.append(ch);
            }
        }
        return builder.toString();
    }

    private static JsonNode strip(JsonNode node, ObjectMapper mapper, AtomicInteger counter) {
        if (node.isTextual()) {
            return new TextNode(strip(node.textValue(), counter));
        }
        if (node.isArray()) {
            final ArrayNode copy = mapper.createArrayNode();
            node.forEach(child -> copy.add(strip(child, mapper, counter)));
            return copy;
        }
        if (node.isObject()) {
            final ObjectNode copy = mapper.createObjectNode();
            node.fields().forEachRemaining(field -> copy.set(strip(field.getKey(), counter),
                                                             strip(field.getValue(), mapper, counter)));
            return copy;
        }
        return node;
    }
}
