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

package com.phonepe.agentloop.core.model;

import com.phonepe.agentloop.core.transcript.TranscriptItem;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output items of one model response. Items can be {@link com.phonepe.agentloop.core.transcript.AssistantText},
 * {@link com.phonepe.agentloop.core.transcript.ReasoningItem}, {@link com.phonepe.agentloop.core.transcript.ToolCall}
 * or inline {@link com.phonepe.agentloop.core.transcript.ToolCallOutput}s for calls the provider ran itself.
 */
@Value
@Builder
public class ModelResponse {
    @NonNull
    String responseId;

    @Singular("item")
    List<TranscriptItem> output;

    ModelUsage usage;
}
