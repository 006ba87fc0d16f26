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
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * System instructions kept inside the transcript
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SystemText extends TranscriptItem {
    String text;

    @Builder
    @Jacksonized
    public SystemText(String itemId, Long timestamp, @NonNull String text) {
        super(TranscriptItemType.SYSTEM_TEXT, itemId, timestamp);
        this.text = text;
    }

    public static SystemText of(String text) {
        return new SystemText(null, null, text);
    }

    @Override
    public <T> T accept(TranscriptItemVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
