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

package com.phonepe.agentloop.core.transcript;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * A reasoning block emitted by the model. Only valid inside the context of the response that produced it.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ReasoningItem extends TranscriptItem {
    /**
     * Provider assigned id, used to detect replays
     */
    String id;

    List<String> summary;

    /**
     * Opaque provider payload, forwarded as is
     */
    String encryptedContent;

    /**
     * Id of the model response this block was generated in
     */
    String responseId;

    @Builder
    @Jacksonized
    public ReasoningItem(
            String itemId,
            Long timestamp,
            String id,
            @Singular("summaryLine") List<String> summary,
            String encryptedContent,
            String responseId) {
        super(TranscriptItemType.REASONING, itemId, timestamp);
        this.id = id;
        this.summary = List.copyOf(Objects.requireNonNullElseGet(summary, List::of));
        this.encryptedContent = encryptedContent;
        this.responseId = responseId;
    }

    @Override
    public <T> T accept(TranscriptItemVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
