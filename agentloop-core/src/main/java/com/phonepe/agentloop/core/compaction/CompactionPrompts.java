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

package com.phonepe.agentloop.core.compaction;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.apache.commons.text.StringSubstitutor;

import java.util.Map;

/**
 * Prompts used to summarize older parts of a transcript
 */
@Value
@Builder
@With
public class CompactionPrompts {
    public static final String CONVERSATION_VARIABLE = "conversation";

    public static final String DEFAULT_INSTRUCTIONS = """
            You are compacting the history of a conversation between a user, an assistant and the tools the \
            assistant called. The history is given to you as a JSON list of transcript items.
            Write a summary that lets the assistant continue the work without the original history:
            - State the goal of the user and any constraints or preferences they expressed.
            - List what has been done so far, including the tools called and the relevant parts of their results.
            - Keep file names, identifiers, numbers and decisions exactly as they appear.
            - Note anything that is still open or was about to be done next.
            Reply with the summary only. Do not call tools.
            """;

    public static final String DEFAULT_CONVERSATION_TEMPLATE = """
            Summarize the following conversation history:

            ${conversation}
            """;

    /**
     * System level instructions for the summarization request
     */
    @Builder.Default
    String instructions = DEFAULT_INSTRUCTIONS;

    /**
     * User message carrying the rendered history. Must contain the ${conversation} placeholder.
     */
    @Builder.Default
    String conversationTemplate = DEFAULT_CONVERSATION_TEMPLATE;

    public static CompactionPrompts defaults() {
        return CompactionPrompts.builder().build();
    }

    public String renderConversation(String conversation) {
        return StringSubstitutor.replace(conversationTemplate, Map.of(CONVERSATION_VARIABLE, conversation));
    }
}
