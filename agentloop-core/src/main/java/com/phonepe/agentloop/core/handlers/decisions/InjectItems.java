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

package com.phonepe.agentloop.core.handlers.decisions;

import com.phonepe.agentloop.core.transcript.TranscriptItem;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * Append items to the transcript instead of sampling this iteration. Injected tool calls are executed like calls
 * coming from the model.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class InjectItems extends LoopDecision {
    List<TranscriptItem> items;

    @Builder
    @Jacksonized
    public InjectItems(@Singular List<TranscriptItem> items) {
        super(LoopDecisionType.INJECT_ITEMS);
        this.items = List.copyOf(Objects.requireNonNullElseGet(items, List::of));
    }

    @Override
    public <T> T accept(LoopDecisionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
