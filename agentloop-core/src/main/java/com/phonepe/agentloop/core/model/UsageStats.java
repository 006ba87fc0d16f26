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

import lombok.Data;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Token usage accumulated across the responses of a run
 */
@Data
public class UsageStats {
    private final AtomicInteger requestsUsed = new AtomicInteger(0);
    private final AtomicInteger inputTokens = new AtomicInteger(0);
    private final AtomicInteger cachedInputTokens = new AtomicInteger(0);
    private final AtomicInteger outputTokens = new AtomicInteger(0);
    private final AtomicInteger reasoningTokens = new AtomicInteger(0);
    private final AtomicInteger totalTokens = new AtomicInteger(0);

    public UsageStats record(final ModelUsage usage) {
        requestsUsed.incrementAndGet();
        if (null == usage) {
            return this;
        }
        inputTokens.addAndGet(usage.getInputTokens());
        cachedInputTokens.addAndGet(usage.getCachedInputTokens());
        outputTokens.addAndGet(usage.getOutputTokens());
        reasoningTokens.addAndGet(usage.getReasoningTokens());
        totalTokens.addAndGet(usage.getTotalTokens());
        return this;
    }
}
