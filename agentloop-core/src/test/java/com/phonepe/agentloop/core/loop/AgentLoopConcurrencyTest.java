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
import com.google.common.util.concurrent.Uninterruptibles;
import com.phonepe.agentloop.core.approval.ApprovalDecision;
import com.phonepe.agentloop.core.approval.ApprovalGateway;
import com.phonepe.agentloop.core.approval.PolicyBackend;
import com.phonepe.agentloop.core.approval.PolicyDecision;
import com.phonepe.agentloop.core.approval.PolicyErrorCodes;
import com.phonepe.agentloop.core.approval.PolicyEvaluation;
import com.phonepe.agentloop.core.approval.RuleBasedPolicyBackend;
import com.phonepe.agentloop.core.approval.StaticPolicyBackend;
import com.phonepe.agentloop.core.approval.ToolCallState;
import com.phonepe.agentloop.core.errors.AgentLoopException;
import com.phonepe.agentloop.core.errors.ErrorType;
import com.phonepe.agentloop.core.events.ApprovalRequestedEvent;
import com.phonepe.agentloop.core.events.EventBus;
import com.phonepe.agentloop.core.events.LoopEvent;
import com.phonepe.agentloop.core.handlers.RecordingHandler;
import com.phonepe.agentloop.core.model.ModelResponse;
import com.phonepe.agentloop.core.model.ModelSettings;
import com.phonepe.agentloop.core.tools.FunctionToolProvider;
import com.phonepe.agentloop.core.tools.ToolResult;
import com.phonepe.agentloop.core.transcript.ToolCallOutput;
import com.phonepe.agentloop.core.transcript.UserText;
import com.phonepe.agentloop.core.utils.JsonUtils;
import com.phonepe.agentloop.core.utils.ScriptedModelClient;
import com.phonepe.agentloop.core.utils.TestUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentLoopConcurrencyTest {
    private ObjectMapper mapper;
    private EventBus eventBus;
    private List<LoopEvent> events;
    private ExecutorService executorService;
    private ExecutorService toolExecutorService;
    private ScriptedModelClient model;
    private RecordingHandler recorder;
    private AtomicInteger toolCalls;
    private final AtomicInteger concurrent = new AtomicInteger();
    private final AtomicInteger maxConcurrent = new AtomicInteger();

    @BeforeEach
    void setUp() {
        mapper = JsonUtils.createMapper();
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.onEvent().connect(events::add);
        executorService = Executors.newCachedThreadPool();
        toolExecutorService = Executors.newCachedThreadPool();
        model = new ScriptedModelClient();
        recorder = new RecordingHandler();
        toolCalls = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
        toolExecutorService.shutdownNow();
    }

    @Test
    void testRunSuspendsUntilApproved() {
        model.respond(TestUtils.toolCallResponse("c1", "write", "{}"))
                .respond(TestUtils.textResponse("written"));
        final var loop = loop(setup(), new StaticPolicyBackend(PolicyDecision.ASK));
        loop.processMessage(UserText.of("write the file"));
        final var hub = loop.getGateway().getApprovalHub();

        final var run = loop.runAsync();
        await().atMost(Duration.ofSeconds(5)).until(() -> hub.pendingCount() == 1);

        assertTrue(loop.isRunning());
        assertEquals(LoopState.EXECUTING_TOOLS, loop.state());
        assertThrows(IllegalStateException.class, loop::run);
        assertThrows(IllegalStateException.class, () -> loop.processMessage(UserText.of("hurry")));
        assertThrows(IllegalStateException.class, loop::abortPendingToolCalls);
        assertEquals("c1", hub.pending().get(0).getCallId());

        assertTrue(hub.resolve("c1", ApprovalDecision.APPROVE));
        final var result = run.join();

        assertEquals(LoopState.FINISHED, result.getState());
        assertEquals("written", result.getText());
        assertEquals(1, toolCalls.get());
        await().atMost(Duration.ofSeconds(5))
                .until(() -> events.stream().anyMatch(ApprovalRequestedEvent.class::isInstance));
    }

    @Test
    void testCancelWhileWaitingForApproval() {
        model.respond(TestUtils.response(10,
                                         TestUtils.toolCall("c1", "write", "{}"),
                                         TestUtils.toolCall("c2", "write", "{}")));
        final var loop = loop(setup(), new StaticPolicyBackend(PolicyDecision.ASK));
        loop.processMessage(UserText.of("write the files"));
        final var hub = loop.getGateway().getApprovalHub();

        final var run = loop.runAsync();
        await().atMost(Duration.ofSeconds(5)).until(() -> hub.pendingCount() == 2);
        assertTrue(loop.cancel());

        final var error = assertThrows(CompletionException.class, run::join);
        final var cause = assertInstanceOf(AgentLoopException.class, error.getCause());
        assertEquals(ErrorType.RUN_CANCELLED, cause.getErrorType());
        assertEquals(LoopState.ABORTED, loop.state());
        assertFalse(loop.isRunning());
        assertEquals(0, hub.pendingCount());
        assertEquals(0, toolCalls.get());
        final var outputs = outputs(loop);
        assertEquals(2, outputs.size());
        outputs.forEach(output -> assertEquals(ToolResult.ABORTED_MESSAGE, output.getResult().getText()));
        assertEquals(1, recorder.errors().size());
        assertFalse(loop.cancel());
    }

    @Test
    void testCancelDuringPolicyEvaluationLeavesNothingBehind() {
        model.respond(TestUtils.toolCallResponse("c1", "write", "{}"))
                .respond(TestUtils.textResponse("never"));
        final var evaluating = new CountDownLatch(1);
        final var release = new CountDownLatch(1);
        final var loop = loop(setup(), request -> {
            evaluating.countDown();
            Uninterruptibles.awaitUninterruptibly(release);
            return PolicyEvaluation.ask("needs a human");
        });
        loop.processMessage(UserText.of("write the file"));
        final var hub = loop.getGateway().getApprovalHub();

        final var run = loop.runAsync();
        Uninterruptibles.awaitUninterruptibly(evaluating);
        assertTrue(loop.cancel());
        release.countDown();

        final var error = assertThrows(CompletionException.class, run::join);
        assertEquals(ErrorType.RUN_CANCELLED, ((AgentLoopException) error.getCause()).getErrorType());
        await().pollDelay(Duration.ofMillis(200))
                .atMost(Duration.ofSeconds(5))
                .until(() -> hub.pendingCount() == 0 && loop.getGateway().state("c1").isEmpty());
        assertEquals(0, toolCalls.get());
        assertEquals(1, model.callCount());
        assertEquals(ToolResult.ABORTED_MESSAGE, outputs(loop).get(0).getResult().getText());
    }

    @Test
    void testCancelStopsSequentialCalls() {
        model.respond(TestUtils.response(10,
                                         TestUtils.toolCall("c1", "slow", "{}"),
                                         TestUtils.toolCall("c2", "fast", "{}")))
                .respond(TestUtils.textResponse("never"));
        final var setup = setup().withModelSettings(ModelSettings.builder().parallelToolCalls(false).build());
        final var loop = loop(setup, StaticPolicyBackend.allowAll());
        loop.processMessage(UserText.of("go"));

        final var run = loop.runAsync();
        await().atMost(Duration.ofSeconds(5))
                .until(() -> loop.getGateway().state("c1").orElse(null) == ToolCallState.EXECUTING);
        assertTrue(loop.cancel());

        final var error = assertThrows(CompletionException.class, run::join);
        assertEquals(ErrorType.RUN_CANCELLED, ((AgentLoopException) error.getCause()).getErrorType());
        //Only the slow call may finish in the background
        await().during(Duration.ofMillis(600))
                .atMost(Duration.ofSeconds(2))
                .until(() -> toolCalls.get() <= 1);
        final var outputs = outputs(loop);
        assertEquals(2, outputs.size());
        assertEquals(ToolResult.ABORTED_MESSAGE, outputs.get(1).getResult().getText());
    }

    @Test
    void testRunAsyncOnSingleThreadPool() {
        model.respond(TestUtils.toolCallResponse("c1", "fast", "{}"))
                .respond(TestUtils.textResponse("done"));
        final var singleThread = Executors.newFixedThreadPool(1);
        try {
            final var loop = loop(setup().withExecutorService(singleThread), StaticPolicyBackend.allowAll());
            loop.processMessage(UserText.of("go"));

            final var run = loop.runAsync();
            await().atMost(Duration.ofSeconds(5)).until(run::isDone);

            assertEquals(LoopState.FINISHED, run.join().getState());
            assertEquals(1, toolCalls.get());
        }
        finally {
            singleThread.shutdownNow();
        }
    }

    @Test
    void testCancelWhileSampling() {
        final var pendingResponse = new CompletableFuture<ModelResponse>();
        model.respondWith(pendingResponse);
        final var loop = loop(setup(), StaticPolicyBackend.allowAll());
        loop.processMessage(UserText.of("hi"));

        final var run = loop.runAsync();
        await().atMost(Duration.ofSeconds(5)).until(() -> model.callCount() == 1);
        loop.cancel();

        final var error = assertThrows(CompletionException.class, run::join);
        assertEquals(ErrorType.RUN_CANCELLED, ((AgentLoopException) error.getCause()).getErrorType());
        assertTrue(pendingResponse.isCancelled());
        assertEquals(LoopState.ABORTED, loop.state());
        assertEquals(1, loop.transcript().size());
    }

    @Test
    void testParallelOutputsInCallOrder() {
        model.respond(TestUtils.response(10,
                                         TestUtils.toolCall("c1", "slow", "{}"),
                                         TestUtils.toolCall("c2", "fast", "{}"),
                                         TestUtils.toolCall("c3", "fast", "{}")))
                .respond(TestUtils.textResponse("done"));
        final var loop = loop(setup(), StaticPolicyBackend.allowAll());
        loop.processMessage(UserText.of("go"));

        assertEquals(LoopState.FINISHED, loop.run().getState());

        final var outputs = outputs(loop);
        assertEquals(List.of("c1", "c2", "c3"), outputs.stream().map(ToolCallOutput::getCallId).toList());
        assertEquals("slow done", outputs.get(0).getResult().getText());
        assertEquals(3, toolCalls.get());
    }

    @Test
    void testSequentialAbortFillsRemainingCalls() {
        model.respond(TestUtils.response(10,
                                         TestUtils.toolCall("c1", "fast", "{}"),
                                         TestUtils.toolCall("c2", "write", "{}"),
                                         TestUtils.toolCall("c3", "fast", "{}")))
                .respond(TestUtils.textResponse("never"));
        final var setup = setup().withModelSettings(ModelSettings.builder().parallelToolCalls(false).build());
        final var loop = loop(setup, RuleBasedPolicyBackend.builder()
                .rule("write", PolicyDecision.DENY_ABORT)
                .defaultDecision(PolicyDecision.ALLOW)
                .build());
        loop.processMessage(UserText.of("go"));

        final var result = loop.run();

        assertEquals(LoopState.ABORTED, result.getState());
        assertEquals(1, model.callCount());
        assertEquals(1, toolCalls.get());
        final var outputs = outputs(loop);
        assertEquals(3, outputs.size());
        assertFalse(outputs.get(0).getResult().isError());
        assertEquals(PolicyErrorCodes.POLICY_DENIED_ABORT, PolicyErrorCodes.codeOf(outputs.get(1).getResult()));
        assertEquals(ToolResult.ABORTED_MESSAGE, outputs.get(2).getResult().getText());
        assertFalse(model.requests().get(0).isParallelToolCalls());
    }

    @Test
    void testToolTimeout() {
        model.respond(TestUtils.toolCallResponse("c1", "sleepy", "{}"))
                .respond(TestUtils.textResponse("moving on"));
        final var loop = loop(setup().withToolCallTimeout(Duration.ofMillis(200)), StaticPolicyBackend.allowAll());
        loop.processMessage(UserText.of("go"));

        assertEquals(LoopState.FINISHED, loop.run().getState());

        final var output = outputs(loop).get(0);
        assertTrue(output.getResult().isError());
        assertEquals("Tool sleepy timed out after 200 ms", output.getResult().getText());
    }

    @Test
    void testConcurrencyLimit() {
        model.respond(TestUtils.response(10,
                                         TestUtils.toolCall("c1", "counted", "{}"),
                                         TestUtils.toolCall("c2", "counted", "{}"),
                                         TestUtils.toolCall("c3", "counted", "{}"),
                                         TestUtils.toolCall("c4", "counted", "{}")))
                .respond(TestUtils.textResponse("done"));
        final var loop = loop(setup().withMaxParallelToolCalls(2), StaticPolicyBackend.allowAll());
        loop.processMessage(UserText.of("go"));

        assertEquals(LoopState.FINISHED, loop.run().getState());
        assertEquals(4, toolCalls.get());
        assertTrue(maxConcurrent.get() <= 2);
    }

    private static List<ToolCallOutput> outputs(AgentLoop loop) {
        return loop.transcript()
                .stream()
                .filter(ToolCallOutput.class::isInstance)
                .map(ToolCallOutput.class::cast)
                .toList();
    }

    private AgentLoopSetup setup() {
        return AgentLoopSetup.builder()
                .mapper(mapper)
                .modelClient(model)
                .eventBus(eventBus)
                .executorService(executorService)
                .toolExecutorService(toolExecutorService)
                .build();
    }

    private AgentLoop loop(AgentLoopSetup setup, PolicyBackend policyBackend) {
        return AgentLoop.builder()
                .name("concurrency-test")
                .setup(setup)
                .toolProvider(tools())
                .handler(recorder)
                .gateway(ApprovalGateway.builder()
                                 .policyBackend(policyBackend)
                                 .eventBus(eventBus)
                                 .mapper(mapper)
                                 .build())
                .build();
    }

    private FunctionToolProvider tools() {
        return new FunctionToolProvider("test-tools", mapper)
                .register("write", "Write a file", () -> {
                    toolCalls.incrementAndGet();
                    return Map.of("written", true);
                })
                .register("fast", "Returns at once", () -> {
                    toolCalls.incrementAndGet();
                    return "fast done";
                })
                .register("slow", "Takes a while", this::slow)
                .register("sleepy", "Takes too long", this::sleepy)
                .register("counted", "Tracks concurrency", this::counted);
    }

    @SneakyThrows
    private Object slow() {
        Thread.sleep(300);
        toolCalls.incrementAndGet();
        return "slow done";
    }

    @SneakyThrows
    private Object sleepy() {
        Thread.sleep(5_000);
        return "woke up";
    }

    @SneakyThrows
    private Object counted() {
        final var now = concurrent.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
        Thread.sleep(100);
        concurrent.decrementAndGet();
        toolCalls.incrementAndGet();
        return "counted";
    }
}
