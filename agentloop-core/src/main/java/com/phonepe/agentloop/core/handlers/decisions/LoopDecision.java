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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.phonepe.agentloop.core.transcript.TranscriptItem;
import lombok.Data;

import java.util.List;

/**
 * What a handler wants the loop to do before the next sampling step. When multiple handlers are registered, the
 * first decision that is not {@link NoAction} wins.
 */
@Data
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = LoopDecisionType.Values.NO_ACTION, value = NoAction.class),
        @JsonSubTypes.Type(name = LoopDecisionType.Values.ABORT, value = Abort.class),
        @JsonSubTypes.Type(name = LoopDecisionType.Values.COMPACT, value = Compact.class),
        @JsonSubTypes.Type(name = LoopDecisionType.Values.INJECT_ITEMS, value = InjectItems.class),
        @JsonSubTypes.Type(name = LoopDecisionType.Values.REQUIRE_ANY_TOOL, value = RequireAnyTool.class),
})
public abstract class LoopDecision {
    private final LoopDecisionType type;

    protected LoopDecision(LoopDecisionType type) {
        this.type = type;
    }

    public abstract <T> T accept(final LoopDecisionVisitor<T> visitor);

    public static LoopDecision noAction() {
        return NoAction.INSTANCE;
    }

    public static LoopDecision abort() {
        return new Abort(null);
    }

    public static LoopDecision abort(String reason) {
        return new Abort(reason);
    }

    public static LoopDecision compact(int keepRecentTurns) {
        return new Compact(keepRecentTurns);
    }

    public static LoopDecision inject(List<? extends TranscriptItem> items) {
        return new InjectItems(List.copyOf(items));
    }

    public static LoopDecision inject(TranscriptItem... items) {
        return new InjectItems(List.of(items));
    }

    public static LoopDecision requireAnyTool() {
        return RequireAnyTool.INSTANCE;
    }
}
