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

package com.phonepe.agentloop.core.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.agentloop.core.compaction.CompactionPrompts;
import com.phonepe.agentloop.core.events.EventBus;
import com.phonepe.agentloop.core.model.ModelClient;
import com.phonepe.agentloop.core.model.ModelSettings;
import com.phonepe.agentloop.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Everything a loop needs apart from its tools and handlers. Built once and shared across loops if needed.
 */
@Value
@Builder
@With
public class AgentLoopSetup {
    /**
     * The object mapper to use for serialization and argument parsing. If not provided, a default one is created.
     */
    ObjectMapper mapper;

    /**
     * Client for the LLM. Mandatory.
     */
    ModelClient modelClient;

    /**
     * Settings sent with every request. Parallel tool execution follows
     * {@link ModelSettings#parallelToolCallsEnabled()}.
     */
    ModelSettings modelSettings;

    /**
     * Drives runs started with {@link AgentLoop#runAsync()}. A cached thread pool is created if not provided.
     */
    ExecutorService executorService;

    /**
     * Runs tool calls, including calls parked for approval. Kept apart from {@link #executorService} because a run
     * blocks its thread while its tool calls execute. A cached thread pool is created if not provided. A bounded pool
     * passed here must have room for {@link #maxParallelToolCalls} calls of every loop sharing it.
     */
    ExecutorService toolExecutorService;

    /**
     * Bus to publish loop events on. A new bus is created if not provided.
     */
    EventBus eventBus;

    /**
     * Upper bound on tool calls of one step running at the same time
     */
    int maxParallelToolCalls;

    /**
     * Time after which a single tool call is failed
     */
    Duration toolCallTimeout;

    /**
     * Maximum number of sampling steps in one run. 0 means unlimited.
     */
    int maxSamplingSteps;

    /**
     * Instructions sent as the instructions field of every request
     */
    String instructions;

    CompactionPrompts compactionPrompts;

    public AgentLoopSetup(
            ObjectMapper mapper,
            ModelClient modelClient,
            ModelSettings modelSettings,
            ExecutorService executorService,
            ExecutorService toolExecutorService,
            EventBus eventBus,
            int maxParallelToolCalls,
            Duration toolCallTimeout,
            int maxSamplingSteps,
            String instructions,
            CompactionPrompts compactionPrompts) {
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.modelClient = modelClient;
        this.modelSettings = Objects.requireNonNullElseGet(modelSettings, () -> ModelSettings.builder().build());
        this.executorService = Objects.requireNonNullElseGet(executorService, Executors::newCachedThreadPool);
        this.toolExecutorService = Objects.requireNonNullElseGet(toolExecutorService,
                                                                 Executors::newCachedThreadPool);
        this.eventBus = Objects.requireNonNullElseGet(eventBus, EventBus::new);
        this.maxParallelToolCalls = maxParallelToolCalls > 0 ? maxParallelToolCalls : 8;
        this.toolCallTimeout = Objects.requireNonNullElse(toolCallTimeout, Duration.ofMinutes(5));
        this.maxSamplingSteps = Math.max(0, maxSamplingSteps);
        this.instructions = instructions;
        this.compactionPrompts = Objects.requireNonNullElseGet(compactionPrompts, CompactionPrompts::defaults);
    }
}
