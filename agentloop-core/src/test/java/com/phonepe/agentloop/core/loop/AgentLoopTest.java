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
import com.phonepe.agentloop.core.approval.ApprovalGateway;
import com.phonepe.agentloop.core.approval.PolicyDecision;
import com.phonepe.agentloop.core.approval.PolicyErrorCodes;
import com.phonepe.agentloop.core.approval.StaticPolicyBackend;
import com.phonepe.agentloop.core.errors.AgentLoopException;
import com.phonepe.agentloop.core.errors.ErrorType;
import com.phonepe.agentloop.core.errors.ParameterValidationError;
import com.phonepe.agentloop.core.events.CompactionCompletedEvent;
import com.phonepe.agentloop.core.events.EventBus;
import com.phonepe.agentloop.core.events.LoopEvent;
import com.phonepe.agentloop.core.events.LoopStateChangedEvent;
import com.phonepe.agentloop.core.events.TranscriptItemAppendedEvent;
import com.phonepe.agentloop.core.handlers.CompactionHandler;
import com.phonepe.agentloop.core.handlers.LoopContext;
import com.phonepe.agentloop.core.handlers.LoopHandler;
import com.phonepe.agentloop.core.handlers.RecordingHandler;
import com.phonepe.agentloop.core.handlers.SequenceHandler;
import com.phonepe.agentloop.core.handlers.decisions.LoopDecision;
import com.phonepe.agentloop.core.model.ModelResponse;
import com.phonepe.agentloop.core.model.ModelSettings;
import com.phonepe.agentloop.core.model.ToolChoice;
import com.phonepe.agentloop.core.tools.FunctionToolProvider;
import com.phonepe.agentloop.core.tools.ToolResult;
import com.phonepe.agentloop.core.transcript.AssistantText;
import com.phonepe.agentloop.core.transcript.ReasoningItem;
import com.phonepe.agentloop.core.transcript.ToolCall;
import com.phonepe.agentloop.core.transcript.ToolCallOutput;
import com.phonepe.agentloop.core.transcript.TranscriptItem;
import com.phonepe.agentloop.core.transcript.UserText;
import com.phonepe.agentloop.core.utils.JsonUtils;
import com.phonepe.agentloop.core.utils.ScriptedModelClient;
import com.phonepe.agentloop.core.utils.TestUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentLoopTest {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EchoArgs {
        private String text;
    }

    private ObjectMapper mapper;
    private EventBus eventBus;
    private List<LoopEvent> events;
    private AtomicInteger echoCalls;
    private ScriptedModelClient model;
    private RecordingHandler recorder;

    @BeforeEach
    void setUp() {
        mapper = JsonUtils.createMapper();
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.onEvent().connect(events::add);
        echoCalls = new AtomicInteger();
        model = new ScriptedModelClient();
        recorder = new RecordingHandler();
    }

    @Test
    void testTextResponseFinishesRun() {
        model.respond(TestUtils.textResponse("hello"));
        final var loop = loop(setup(), recorder);
        loop.processMessage(UserText.of("hi"));

        final var result = loop.run();

        assertEquals(LoopState.FINISHED, result.getState());
        assertEquals(LoopState.FINISHED, loop.state());
        assertEquals("hello", result.getText());
        assertEquals(2, loop.transcript().size());
        assertEquals("hello", assertInstanceOf(AssistantText.class, loop.transcript().get(1)).getText());
        assertEquals(1, model.callCount());
        assertEquals(10, result.getUsage().getTotalTokens().get());
        assertEquals(2, recorder.items().size());
        assertEquals(1, recorder.requests().size());
        assertEquals(1, recorder.responses().size());
        await().atMost(Duration.ofSeconds(5))
                .until(() -> events.stream()
                        .anyMatch(event -> event instanceof LoopStateChangedEvent stateChanged
                                && stateChanged.getTo() == LoopState.FINISHED));
    }

    @Test
    void testToolCallThenAnswer() {
        model.respond(TestUtils.toolCallResponse("c1", "echo", "{\"text\":\"hi\"}"))
                .respond(TestUtils.textResponse("done"));
        final var loop = loop(setup(), recorder);
        loop.processMessage(UserText.of("run tool"));

        final var result = loop.run();

        assertEquals(LoopState.FINISHED, result.getState());
        assertEquals("done", result.getText());
        final var items = loop.transcript();
        assertEquals(4, items.size());
        assertInstanceOf(UserText.class, items.get(0));
        assertEquals("echo", assertInstanceOf(ToolCall.class, items.get(1)).getName());
        final var output = assertInstanceOf(ToolCallOutput.class, items.get(2));
        assertEquals("c1", output.getCallId());
        assertEquals("hi", output.getResult().getStructuredContent().get("echo").asText());
        assertInstanceOf(AssistantText.class, items.get(3));

        //Second request carries the output of the call
        final var secondRequest = model.requests().get(1);
        assertEquals(3, secondRequest.getItems().size());
        assertInstanceOf(ToolCallOutput.class, secondRequest.getItems().get(2));
        assertEquals("echo", secondRequest.getTools().get(0).getName());
        assertEquals(1, echoCalls.get());
    }

    @Test
    void testDenyAbortEndsRunWithoutSamplingAgain() {
        model.respond(TestUtils.toolCallResponse("c1", "echo", "{\"text\":\"hi\"}"))
                .respond(TestUtils.textResponse("never"));
        final var setup = setup();
        final var loop = AgentLoop.builder()
                .name("deny-loop")
                .setup(setup)
                .toolProvider(tools())
                .handler(recorder)
                .gateway(ApprovalGateway.builder()
                                 .policyBackend(new StaticPolicyBackend(PolicyDecision.DENY_ABORT))
                                 .eventBus(eventBus)
                                 .mapper(mapper)
                                 .build())
                .build();
        loop.processMessage(UserText.of("run tool"));

        final var result = loop.run();

        assertEquals(LoopState.ABORTED, result.getState());
        assertEquals(1, model.callCount());
        assertEquals(0, echoCalls.get());
        final var items = loop.transcript();
        assertEquals(3, items.size());
        final var output = assertInstanceOf(ToolCallOutput.class, items.get(2));
        assertTrue(output.getResult().isError());
        assertEquals(PolicyErrorCodes.POLICY_DENIED_ABORT, PolicyErrorCodes.codeOf(output.getResult()));
    }

    @Test
    void testCompactionDuringRun() {
        model.respond(TestUtils.response(150, TestUtils.toolCall("c1", "echo", "{\"text\":\"x\"}")))
                .respond(TestUtils.textResponse("summary of the chat"))
                .respond(TestUtils.textResponse("done"));
        final var compaction = new CompactionHandler(100, 2);
        final var loop = loop(setup(), compaction, recorder);
        loop.insertTranscriptItems(List.of(UserText.of("q1"),
                                           AssistantText.of("a1"),
                                           UserText.of("q2"),
                                           AssistantText.of("a2")));
        loop.processMessage(UserText.of("q3"));

        final var result = loop.run();

        assertEquals(LoopState.FINISHED, result.getState());
        assertEquals(3, model.callCount());
        assertEquals(List.of(true), recorder.compactions());
        assertEquals(10, compaction.getCumulativeTokens());
        final var items = loop.transcript();
        assertEquals(4, items.size());
        assertEquals("summary of the chat", assertInstanceOf(UserText.class, items.get(0)).getText());
        assertInstanceOf(ToolCall.class, items.get(1));
        assertInstanceOf(ToolCallOutput.class, items.get(2));
        assertEquals("done", assertInstanceOf(AssistantText.class, items.get(3)).getText());
        //Request after compaction only carries the compacted transcript
        assertEquals(3, model.requests().get(2).getItems().size());
        await().atMost(Duration.ofSeconds(5))
                .until(() -> events.stream().anyMatch(CompactionCompletedEvent.class::isInstance));
    }

    @Test
    void testReasoningOnlyResponseSamplesAgain() {
        model.respond(TestUtils.response(5, TestUtils.reasoning("rs_1", "thinking")))
                .respond(TestUtils.textResponse("ok"));
        final var loop = loop(setup(), recorder);
        loop.processMessage(UserText.of("hi"));

        final var result = loop.run();

        assertEquals(LoopState.FINISHED, result.getState());
        assertEquals("ok", result.getText());
        assertEquals(2, model.callCount());
        final var reasoning = recorder.items(ReasoningItem.class);
        assertEquals(1, reasoning.size());
        assertEquals(2, model.requests().size());
        assertTrue(model.requests().get(1).getItems().stream().anyMatch(ReasoningItem.class::isInstance));
        assertTrue(reasoning.get(0).getResponseId().startsWith("resp_"));
    }

    @Test
    void testStaleReasoningNotSentBack() {
        model.respond(TestUtils.response(10,
                                         TestUtils.reasoning("rs_1", "thinking"),
                                         TestUtils.toolCall("c1", "echo", "{\"text\":\"a\"}")))
                .respond(TestUtils.textResponse("first"))
                .respond(TestUtils.textResponse("second"));
        final var loop = loop(setup(), recorder);
        loop.processMessage(UserText.of("hi"));
        assertEquals(LoopState.FINISHED, loop.run().getState());
        loop.processMessage(UserText.of("again"));
        assertEquals("second", loop.run().getText());

        assertTrue(hasReasoning(model.requests().get(1).getItems()));
        assertFalse(hasReasoning(model.requests().get(2).getItems()));
        assertTrue(hasReasoning(loop.transcript()));
    }

    @Test
    void testRestoredReasoningWithoutResponseIdNotSent() {
        model.respond(TestUtils.textResponse("ok"));
        final var loop = loop(setup(), recorder);
        loop.insertTranscriptItems(List.of(UserText.of("hi"),
                                           TestUtils.reasoning("rs_1", "thinking"),
                                           AssistantText.of("hello"),
                                           UserText.of("and now?")));

        assertEquals("ok", loop.run().getText());

        final var sent = model.requests().get(0).getItems();
        assertFalse(hasReasoning(sent));
        assertEquals(3, sent.size());
        assertTrue(hasReasoning(loop.transcript()));
    }

    @Test
    void testRepeatedProviderItemsSkipped() {
        final var call = ToolCall.builder()
                .id("fc_1")
                .callId("c1")
                .name("echo")
                .arguments("{\"text\":\"a\"}")
                .build();
        model.respond(TestUtils.response(10, call))
                .respond(TestUtils.response(10, call, AssistantText.of("done")));
        final var loop = loop(setup(), recorder);
        loop.processMessage(UserText.of("hi"));

        assertEquals(LoopState.FINISHED, loop.run().getState());
        assertEquals(1, loop.transcript().stream().filter(ToolCall.class::isInstance).count());
        assertEquals(1, echoCalls.get());
    }

    @Test
    void testFirstRegisteredDecisionWins() {
        final var loop = loop(setup(),
                              new SequenceHandler(LoopDecision.abort("stop")),
                              new SequenceHandler(LoopDecision.compact(2)),
                              recorder);
        loop.processMessage(UserText.of("hi"));

        final var result = loop.run();

        assertEquals(LoopState.ABORTED, result.getState());
        assertEquals("stop", result.getAbortReason());
        assertEquals(0, model.callCount());
        assertTrue(recorder.compactions().isEmpty());
    }

    @Test
    void testCompactWhileReasoningIsInvalid() {
        final var loop = loop(setup(), new SequenceHandler(LoopDecision.compact(1)), recorder);
        loop.insertTranscriptItems(List.of(UserText.of("hi"), TestUtils.reasoning("rs_1", "thinking")));

        final var error = assertThrows(AgentLoopException.class, loop::run);

        assertEquals(ErrorType.INVALID_HANDLER_DECISION, error.getErrorType());
        assertEquals(LoopState.ERROR, loop.state());
        assertEquals(1, recorder.errors().size());
        assertEquals(0, model.callCount());
    }

    @Test
    void testInjectedToolCallIsExecuted() {
        model.respond(TestUtils.textResponse("done"));
        final var loop = loop(setup(),
                              new SequenceHandler(LoopDecision.inject(
                                      TestUtils.toolCall("c1", "echo", "{\"text\":\"injected\"}"))),
                              recorder);
        loop.processMessage(UserText.of("hi"));

        final var result = loop.run();

        assertEquals(LoopState.FINISHED, result.getState());
        assertEquals(1, echoCalls.get());
        final var items = loop.transcript();
        assertEquals(4, items.size());
        assertInstanceOf(ToolCallOutput.class, items.get(2));
        assertEquals(3, model.requests().get(0).getItems().size());
    }

    @Test
    void testInjectAfterAnswerKeepsRunGoing() {
        model.respond(TestUtils.textResponse("I am done"))
                .respond(TestUtils.textResponse("really done"));
        final var loop = loop(setup(),
                              new LoopHandler() {
                                  private boolean redirected;

                                  @Override
                                  public LoopDecision onBeforeSample(LoopContext context) {
                                      if (!redirected && !context.getItems().isEmpty()
                                              && context.getItems().get(context.getItems().size() - 1)
                                              instanceof AssistantText) {
                                          redirected = true;
                                          return LoopDecision.inject(UserText.of("Check your work"));
                                      }
                                      return LoopDecision.noAction();
                                  }
                              },
                              recorder);
        loop.processMessage(UserText.of("hi"));

        final var result = loop.run();

        assertEquals(LoopState.FINISHED, result.getState());
        assertEquals(2, model.callCount());
        assertEquals("I am done\nreally done", result.getText());
        assertEquals(4, loop.transcript().size());
    }

    @Test
    void testRequireAnyToolSetsToolChoice() {
        model.respond(TestUtils.toolCallResponse("c1", "echo", "{\"text\":\"x\"}"))
                .respond(TestUtils.textResponse("done"));
        final var loop = loop(setup(), new SequenceHandler(LoopDecision.requireAnyTool()), recorder);
        loop.processMessage(UserText.of("hi"));

        assertEquals(LoopState.FINISHED, loop.run().getState());
        assertEquals(ToolChoice.REQUIRED, model.requests().get(0).getToolChoice());
        assertEquals(ToolChoice.AUTO, model.requests().get(1).getToolChoice());
    }

    @Test
    void testInvalidArgumentsReportedToModel() {
        model.respond(TestUtils.response(10,
                                         TestUtils.toolCall("c1", "echo", "{not json"),
                                         TestUtils.toolCall("c2", "echo", "[1, 2]"),
                                         TestUtils.toolCall("c3", "echo", "")))
                .respond(TestUtils.textResponse("done"));
        final var loop = loop(setup(), recorder);
        loop.processMessage(UserText.of("hi"));

        assertEquals(LoopState.FINISHED, loop.run().getState());

        final var outputs = recorder.items(ToolCallOutput.class);
        assertEquals(3, outputs.size());
        assertTrue(outputs.get(0).getResult().isError());
        assertTrue(outputs.get(0).getResult().getText().startsWith("Invalid JSON in tool arguments: "));
        assertEquals("Tool arguments must be a JSON object, got array", outputs.get(1).getResult().getText());
        //Empty arguments are an empty object, the text field is just null
        assertFalse(outputs.get(2).getResult().isError());
        assertEquals(1, echoCalls.get());
    }

    @Test
    void testPendingCallsExecutedOnResume() {
        model.respond(TestUtils.textResponse("resumed"));
        final var loop = loop(setup(), recorder);
        loop.insertTranscriptItems(List.of(UserText.of("hi"),
                                           TestUtils.toolCall("c1", "echo", "{\"text\":\"saved\"}")));
        assertTrue(recorder.items().isEmpty());

        final var result = loop.run();

        assertEquals(LoopState.FINISHED, result.getState());
        assertEquals(1, echoCalls.get());
        assertInstanceOf(ToolCallOutput.class, model.requests().get(0).getItems().get(2));
    }

    @Test
    void testAbortPendingToolCallsIsIdempotent() {
        final var loop = loop(setup(), recorder);
        loop.insertTranscriptItems(List.of(UserText.of("hi"),
                                           TestUtils.toolCall("c1", "echo", "{}"),
                                           TestUtils.toolCall("c2", "echo", "{}")));

        assertEquals(2, loop.abortPendingToolCalls());
        assertEquals(0, loop.abortPendingToolCalls());

        final var outputs = loop.transcript()
                .stream()
                .filter(ToolCallOutput.class::isInstance)
                .map(ToolCallOutput.class::cast)
                .toList();
        assertEquals(2, outputs.size());
        assertEquals(ToolResult.ABORTED_MESSAGE, outputs.get(0).getResult().getText());
        assertEquals(0, echoCalls.get());
    }

    @Test
    void testMaxStepsExceeded() {
        model.respond(TestUtils.toolCallResponse("c1", "echo", "{\"text\":\"x\"}"))
                .respond(TestUtils.textResponse("never"));
        final var loop = loop(setup().withMaxSamplingSteps(1), recorder);
        loop.processMessage(UserText.of("hi"));

        final var error = assertThrows(AgentLoopException.class, loop::run);

        assertEquals(ErrorType.MAX_STEPS_EXCEEDED, error.getErrorType());
        assertEquals(LoopState.ERROR, loop.state());
        assertEquals(1, model.callCount());
        assertEquals(List.of(error), recorder.errors());
    }

    @Test
    void testModelFailure() {
        model.fail(new IllegalStateException("service unavailable"));
        final var loop = loop(setup(), recorder);
        loop.processMessage(UserText.of("hi"));

        final var error = assertThrows(AgentLoopException.class, loop::run);

        assertEquals(ErrorType.MODEL_CALL_FAILURE, error.getErrorType());
        assertTrue(error.getMessage().contains("service unavailable"));
        assertTrue(error.isRetryable());
        assertEquals(LoopState.ERROR, loop.state());
        assertEquals(1, recorder.errors().size());
        assertFalse(loop.isRunning());

        //Loop can be run again after a failure
        model.respond(TestUtils.textResponse("back"));
        assertEquals("back", loop.run().getText());
    }

    @Test
    void testCompactTranscriptOnIdleLoop() {
        model.respond(TestUtils.textResponse("summary"));
        final var loop = loop(setup(), recorder);
        loop.insertTranscriptItems(List.of(UserText.of("q1"),
                                           AssistantText.of("a1"),
                                           UserText.of("q2"),
                                           AssistantText.of("a2")));

        final var result = loop.compactTranscript(1);

        assertTrue(result.isCompacted());
        assertEquals(List.of(true), recorder.compactions());
        assertEquals(2, loop.transcript().size());
        assertFalse(loop.compactTranscript(5).isCompacted());
        assertEquals(List.of(true, false), recorder.compactions());
    }

    @Test
    void testCancelDuringCompaction() {
        final var pendingSummary = new CompletableFuture<ModelResponse>();
        model.respondWith(pendingSummary);
        final var loop = loop(setup(), new SequenceHandler(LoopDecision.compact(1)), recorder);
        loop.insertTranscriptItems(List.of(UserText.of("q1"),
                                           AssistantText.of("a1"),
                                           UserText.of("q2"),
                                           AssistantText.of("a2")));

        final var run = loop.runAsync();
        await().atMost(Duration.ofSeconds(5)).until(() -> model.callCount() == 1);
        assertTrue(loop.cancel());

        final var error = assertThrows(CompletionException.class, run::join);
        assertEquals(ErrorType.RUN_CANCELLED, ((AgentLoopException) error.getCause()).getErrorType());
        assertTrue(pendingSummary.isCancelled());
        assertEquals(LoopState.ABORTED, loop.state());
        assertEquals(4, loop.transcript().size());
        assertTrue(recorder.compactions().isEmpty());
    }

    @Test
    void testSummaryCancelledByProviderFailsCompaction() {
        model.respondWith(CompletableFuture.failedFuture(new CancellationException("provider shut down")));
        final var loop = loop(setup(), new SequenceHandler(LoopDecision.compact(1)), recorder);
        loop.insertTranscriptItems(List.of(UserText.of("q1"),
                                           AssistantText.of("a1"),
                                           UserText.of("q2"),
                                           AssistantText.of("a2")));

        final var error = assertThrows(AgentLoopException.class, loop::run);

        assertEquals(ErrorType.COMPACTION_FAILURE, error.getErrorType());
        assertEquals(LoopState.ERROR, loop.state());
        assertEquals(4, loop.transcript().size());
    }

    @Test
    void testInvalidUsage() {
        final var setup = setup();
        assertThrows(ParameterValidationError.class,
                     () -> AgentLoop.builder().setup(setup.withModelClient(null)).handler(recorder).build());
        assertThrows(ParameterValidationError.class, () -> AgentLoop.builder().setup(setup).build());

        final var loop = loop(setup, recorder);
        assertThrows(ParameterValidationError.class,
                     () -> loop.processMessage(TestUtils.toolCall("c1", "echo", "{}")));
        assertEquals("agent-loop-test", loop.getName());
        assertTrue(loop.transcript().isEmpty());
    }

    @Test
    void testEventsPublishedForItems() {
        model.respond(TestUtils.textResponse("hello"));
        final var loop = loop(setup(), recorder);
        loop.processMessage(UserText.of("hi"));
        loop.run();

        await().atMost(Duration.ofSeconds(5))
                .until(() -> events.stream().filter(TranscriptItemAppendedEvent.class::isInstance).count() == 2);
    }

    private static boolean hasReasoning(List<TranscriptItem> items) {
        return items.stream().anyMatch(ReasoningItem.class::isInstance);
    }

    private AgentLoopSetup setup() {
        return AgentLoopSetup.builder()
                .mapper(mapper)
                .modelClient(model)
                .modelSettings(ModelSettings.builder().build())
                .eventBus(eventBus)
                .build();
    }

    private AgentLoop loop(AgentLoopSetup setup, LoopHandler... handlers) {
        return AgentLoop.builder()
                .name("agent-loop-test")
                .setup(setup)
                .toolProvider(tools())
                .handlers(List.of(handlers))
                .build();
    }

    private FunctionToolProvider tools() {
        return new FunctionToolProvider("test-tools", mapper)
                .register("echo", "Echo the text back", EchoArgs.class, args -> {
                    echoCalls.incrementAndGet();
                    return Map.of("echo", String.valueOf(args.getText()));
                });
    }
}
