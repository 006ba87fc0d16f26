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

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.phonepe.agentloop.core.approval.ApprovalGateway;
import com.phonepe.agentloop.core.approval.StaticPolicyBackend;
import com.phonepe.agentloop.core.compaction.CompactionResult;
import com.phonepe.agentloop.core.compaction.TranscriptCompactor;
import com.phonepe.agentloop.core.errors.AgentLoopException;
import com.phonepe.agentloop.core.errors.ErrorType;
import com.phonepe.agentloop.core.errors.ParameterValidationError;
import com.phonepe.agentloop.core.events.CompactionCompletedEvent;
import com.phonepe.agentloop.core.events.LoopStateChangedEvent;
import com.phonepe.agentloop.core.events.ModelResponseReceivedEvent;
import com.phonepe.agentloop.core.events.TranscriptItemAppendedEvent;
import com.phonepe.agentloop.core.handlers.HandlerChain;
import com.phonepe.agentloop.core.handlers.LoopContext;
import com.phonepe.agentloop.core.handlers.LoopHandler;
import com.phonepe.agentloop.core.handlers.ResponseInfo;
import com.phonepe.agentloop.core.handlers.decisions.Abort;
import com.phonepe.agentloop.core.handlers.decisions.Compact;
import com.phonepe.agentloop.core.handlers.decisions.InjectItems;
import com.phonepe.agentloop.core.handlers.decisions.LoopDecisionVisitor;
import com.phonepe.agentloop.core.handlers.decisions.NoAction;
import com.phonepe.agentloop.core.handlers.decisions.RequireAnyTool;
import com.phonepe.agentloop.core.model.ModelRequest;
import com.phonepe.agentloop.core.model.ModelResponse;
import com.phonepe.agentloop.core.model.ToolChoice;
import com.phonepe.agentloop.core.model.UsageStats;
import com.phonepe.agentloop.core.tools.CompositeToolProvider;
import com.phonepe.agentloop.core.tools.ToolProvider;
import com.phonepe.agentloop.core.tools.ToolProviders;
import com.phonepe.agentloop.core.tools.ToolResult;
import com.phonepe.agentloop.core.transcript.AssistantText;
import com.phonepe.agentloop.core.transcript.ReasoningItem;
import com.phonepe.agentloop.core.transcript.SystemText;
import com.phonepe.agentloop.core.transcript.ToolCall;
import com.phonepe.agentloop.core.transcript.ToolCallOutput;
import com.phonepe.agentloop.core.transcript.Transcript;
import com.phonepe.agentloop.core.transcript.TranscriptItem;
import com.phonepe.agentloop.core.transcript.TranscriptVisitorAdapter;
import com.phonepe.agentloop.core.transcript.UserText;
import com.phonepe.agentloop.core.utils.AgentLoopUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a model through a conversation with tool calls.
 * <p>
 * Every iteration the handlers are polled for a decision. Unless they decide otherwise, the model is sampled with
 * the full transcript, the response is recorded, and every tool call in it is run through the
 * {@link ApprovalGateway}. Outputs are recorded in call order before the model is sampled again, so a transcript
 * sent to the model never carries a tool call without its output.
 * <p>
 * A run finishes once the model has answered without calling tools and no handler wants to continue. Handlers can
 * abort it at any poll, and a tool call denied with abort ends it after the step.
 * <p>
 * One loop owns one transcript, which outlives runs. Only one run can be active at a time and all transcript
 * changes are made by the thread driving the run. {@link #cancel()} is the only method meant to be called from
 * other threads while a run is active.
 */
@Slf4j
public class AgentLoop {
    private enum Step {
        SAMPLE,
        SAMPLE_WITH_TOOLS_REQUIRED,
        EXECUTE_TOOLS,
        FINISH,
        ABORT,
    }

    /**
     * Mutable state of a single run
     */
    private static final class RunContext {
        private final String runId;
        private final UsageStats usage = new UsageStats();
        private final List<String> textChunks = new ArrayList<>();
        private int step;
        private boolean awaitingFinish;
        private String abortReason;

        private RunContext(String runId) {
            this.runId = runId;
        }
    }

    @Getter
    private final String name;
    private final AgentLoopSetup setup;
    private final ToolProvider toolProvider;
    private final HandlerChain handlers;
    @Getter
    private final ApprovalGateway gateway;
    private final Transcript transcript = new Transcript();
    private final TranscriptCompactor compactor;
    private final ToolCallExecutor toolExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile LoopState state = LoopState.IDLE;
    private volatile boolean cancelRequested;
    private volatile CompletableFuture<ModelResponse> currentModelCall;
    private volatile String currentRunId;
    private String latestResponseId;

    @Builder
    public AgentLoop(
            String name,
            @NonNull AgentLoopSetup setup,
            ToolProvider toolProvider,
            @Singular List<LoopHandler> handlers,
            ApprovalGateway gateway) {
        if (null == setup.getModelClient()) {
            throw new ParameterValidationError("A model client is required to run a loop");
        }
        this.name = Objects.requireNonNullElse(name, "agent-loop");
        this.setup = setup;
        this.toolProvider = ToolProviders.safe(Objects.requireNonNullElseGet(
                toolProvider, () -> new CompositeToolProvider("no-tools", List.of())));
        this.handlers = new HandlerChain(handlers);
        this.gateway = Objects.requireNonNullElseGet(
                gateway,
                () -> ApprovalGateway.builder()
                        .policyBackend(StaticPolicyBackend.allowAll())
                        .eventBus(setup.getEventBus())
                        .mapper(setup.getMapper())
                        .build());
        this.compactor = TranscriptCompactor.builder()
                .modelClient(setup.getModelClient())
                .modelSettings(setup.getModelSettings())
                .mapper(setup.getMapper())
                .prompts(setup.getCompactionPrompts())
                .build();
        this.toolExecutor = new ToolCallExecutor(this.toolProvider, this.gateway, setup);
    }

    /**
     * Record a message coming from the user side of the conversation and tell handlers about it. Does not sample.
     *
     * @param item A {@link UserText}, {@link SystemText} or {@link AssistantText}
     */
    public void processMessage(@NonNull TranscriptItem item) {
        ensureIdle("process a message");
        if (!(item instanceof UserText || item instanceof SystemText || item instanceof AssistantText)) {
            throw new ParameterValidationError("Only text messages can be processed, got %s", item.getItemType());
        }
        append(item, null);
    }

    /**
     * Append an item as is, without notifying handlers or publishing events. Used to restore a saved conversation.
     */
    public void insertTranscriptItem(@NonNull TranscriptItem item) {
        insertTranscriptItems(List.of(item));
    }

    public void insertTranscriptItems(@NonNull Collection<? extends TranscriptItem> items) {
        ensureIdle("insert transcript items");
        transcript.appendAll(items);
    }

    /**
     * Run the loop on the calling thread until it finishes or is aborted.
     *
     * @return Result of the run
     * @throws AgentLoopException    if the run failed or was cancelled
     * @throws IllegalStateException if a run is already active on this loop
     */
    public RunResult run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A run is already active on loop " + name);
        }
        final var run = new RunContext(AgentLoopUtils.newId("run"));
        currentRunId = run.runId;
        cancelRequested = false;
        toolExecutor.reset();
        final var stopwatch = Stopwatch.createStarted();
        log.info("Starting run {} on loop {}", run.runId, name);
        try {
            final var result = drive(run);
            log.info("Run {} on loop {} ended in state {} after {} steps in {} ms",
                     run.runId, name, result.getState(), run.step, stopwatch.elapsed(TimeUnit.MILLISECONDS));
            return result;
        }
        catch (CancellationException e) {
            log.info("Run {} on loop {} was cancelled", run.runId, name);
            final var error = new AgentLoopException(ErrorType.RUN_CANCELLED, e, run.runId);
            abortPending(run.runId);
            handlers.error(error);
            transition(run.runId, LoopState.ABORTED, "Run cancelled");
            throw error;
        }
        catch (AgentLoopException e) {
            throw fail(run, e);
        }
        catch (Exception e) {
            throw fail(run, new AgentLoopException(ErrorType.GENERIC_FAILURE, e, AgentLoopUtils.errorMessage(e)));
        }
        finally {
            currentModelCall = null;
            currentRunId = null;
            cancelRequested = false;
            running.set(false);
        }
    }

    /**
     * Same as {@link #run()}, on the setup's executor
     */
    public CompletableFuture<RunResult> runAsync() {
        return CompletableFuture.supplyAsync(this::run, setup.getExecutorService());
    }

    /**
     * Stop the active run. The model call in flight is cancelled, calls waiting for approval are abandoned and every
     * tool call without an output gets an aborted output. The run then fails with
     * {@link ErrorType#RUN_CANCELLED}.
     *
     * @return true if a run was active
     */
    public boolean cancel() {
        if (!running.get()) {
            return false;
        }
        log.info("Cancelling run {} on loop {}", currentRunId, name);
        cancelRequested = true;
        final var modelCall = currentModelCall;
        if (null != modelCall) {
            modelCall.cancel(true);
        }
        toolExecutor.cancelAll();
        return true;
    }

    /**
     * Give every tool call that has no output yet an aborted output. The tool provider is not called. Calling this
     * again does not create duplicate outputs.
     *
     * @return Number of outputs created
     */
    public int abortPendingToolCalls() {
        ensureIdle("abort pending tool calls");
        return abortPending(null);
    }

    /**
     * Summarize all but the most recent items of the transcript
     *
     * @param keepRecentTurns Number of most recent items to keep verbatim
     * @return Result of the attempt
     */
    public CompactionResult compactTranscript(int keepRecentTurns) {
        ensureIdle("compact the transcript");
        return compact(null, keepRecentTurns);
    }

    /**
     * @return Snapshot of the transcript
     */
    public List<TranscriptItem> transcript() {
        return transcript.items();
    }

    public LoopState state() {
        return state;
    }

    public boolean isRunning() {
        return running.get();
    }

    private RunResult drive(RunContext run) {
        transition(run.runId, LoopState.SAMPLING, "Run started");
        //Calls restored without outputs are executed before anything else
        if (!executePendingToolCalls(run)) {
            return complete(run, LoopState.ABORTED);
        }
        while (true) {
            checkCancelled();
            final var step = handlers.decideBeforeSample(context(run)).accept(new DecisionProcessor(run));
            switch (step) {
                case FINISH -> {
                    return complete(run, LoopState.FINISHED);
                }
                case ABORT -> {
                    return complete(run, LoopState.ABORTED);
                }
                case EXECUTE_TOOLS -> {
                    if (!executePendingToolCalls(run)) {
                        return complete(run, LoopState.ABORTED);
                    }
                }
                case SAMPLE, SAMPLE_WITH_TOOLS_REQUIRED -> {
                    sample(run, step == Step.SAMPLE_WITH_TOOLS_REQUIRED ? ToolChoice.REQUIRED : ToolChoice.AUTO);
                    if (!executePendingToolCalls(run)) {
                        return complete(run, LoopState.ABORTED);
                    }
                }
            }
        }
    }

    /**
     * Turns the winning decision of a poll into the next step. Compaction is followed by one more poll; a second
     * compaction request in the same iteration is ignored.
     */
    private final class DecisionProcessor implements LoopDecisionVisitor<Step> {
        private final RunContext run;
        private boolean compacted;

        private DecisionProcessor(RunContext run) {
            this.run = run;
        }

        @Override
        public Step visit(NoAction noAction) {
            return run.awaitingFinish ? Step.FINISH : Step.SAMPLE;
        }

        @Override
        public Step visit(Abort abort) {
            log.info("Run {} aborted by handler. Reason: {}", run.runId, abort.getReason());
            run.abortReason = abort.getReason();
            return Step.ABORT;
        }

        @Override
        public Step visit(Compact compact) {
            if (compacted) {
                log.warn("Ignoring repeated compaction request in run {}", run.runId);
                return visit(NoAction.INSTANCE);
            }
            if (transcript.lastIsReasoning()) {
                throw new AgentLoopException(ErrorType.INVALID_HANDLER_DECISION,
                                             "compaction requested while the last transcript item is a reasoning "
                                                     + "block");
            }
            compacted = true;
            AgentLoop.this.compact(run.runId, compact.getKeepRecentTurns());
            return handlers.decideBeforeSample(context(run)).accept(this);
        }

        @Override
        public Step visit(InjectItems injectItems) {
            log.debug("Injecting {} items into run {}", injectItems.getItems().size(), run.runId);
            injectItems.getItems().forEach(item -> append(item, run.runId));
            run.awaitingFinish = false;
            return Step.EXECUTE_TOOLS;
        }

        @Override
        public Step visit(RequireAnyTool requireAnyTool) {
            return Step.SAMPLE_WITH_TOOLS_REQUIRED;
        }
    }

    private void sample(RunContext run, ToolChoice toolChoice) {
        final var maxSteps = setup.getMaxSamplingSteps();
        if (maxSteps > 0 && run.step >= maxSteps) {
            throw new AgentLoopException(ErrorType.MAX_STEPS_EXCEEDED, maxSteps);
        }
        final var orphans = transcript.unpairedToolCalls();
        if (!orphans.isEmpty()) {
            throw new AgentLoopException(ErrorType.ORPHANED_TOOL_CALL,
                                         orphans.stream().map(ToolCall::getCallId).toList());
        }
        transition(run.runId, LoopState.SAMPLING, null);
        final var request = buildRequest(toolChoice);
        handlers.modelRequest(request);
        log.debug("Sending request {} for step {} of run {} with {} items",
                  request.getRequestId(), run.step, run.runId, request.getItems().size());
        final var stopwatch = Stopwatch.createStarted();
        final var response = awaitResponse(request);
        run.step++;
        run.usage.record(response.getUsage());
        latestResponseId = response.getResponseId();
        setup.getEventBus().notify(ModelResponseReceivedEvent.builder()
                                           .loopName(name)
                                           .runId(run.runId)
                                           .requestId(request.getRequestId())
                                           .responseId(response.getResponseId())
                                           .usage(response.getUsage())
                                           .elapsedTime(Duration.ofMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS)))
                                           .build());
        handlers.response(ResponseInfo.builder()
                                  .responseId(response.getResponseId())
                                  .requestId(request.getRequestId())
                                  .model(setup.getModelClient().model())
                                  .usage(response.getUsage())
                                  .build());
        processOutput(run, response);
    }

    private ModelRequest buildRequest(ToolChoice toolChoice) {
        final var responseId = latestResponseId;
        //Reasoning can only be sent back along with the response that produced it
        final var items = transcript.items()
                .stream()
                .filter(item -> !(item instanceof ReasoningItem reasoning)
                        || (null != reasoning.getResponseId() && reasoning.getResponseId().equals(responseId)))
                .toList();
        final var settings = setup.getModelSettings();
        return ModelRequest.builder()
                .requestId(AgentLoopUtils.newId("req"))
                .items(items)
                .instructions(setup.getInstructions())
                .settings(settings)
                .tools(toolProvider.listTools())
                .toolChoice(toolChoice)
                .parallelToolCalls(settings.parallelToolCallsEnabled())
                .build();
    }

    private ModelResponse awaitResponse(ModelRequest request) {
        final CompletableFuture<ModelResponse> future;
        try {
            future = Objects.requireNonNull(setup.getModelClient().sample(request),
                                            "Model client returned no future");
        }
        catch (RuntimeException e) {
            log.error("Error calling model: {}", AgentLoopUtils.errorMessage(e));
            throw new AgentLoopException(ErrorType.MODEL_CALL_FAILURE, e, AgentLoopUtils.errorMessage(e));
        }
        trackModelCall(future);
        try {
            return Objects.requireNonNull(future.get(), "Model client returned no response");
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for model response");
        }
        catch (CancellationException e) {
            if (cancelRequested) {
                throw e;
            }
            throw new AgentLoopException(ErrorType.MODEL_CALL_FAILURE, e, "model call was cancelled");
        }
        catch (ExecutionException | NullPointerException e) {
            final var cause = AgentLoopUtils.unwrap(e);
            log.error("Error calling model: {}", AgentLoopUtils.errorMessage(cause));
            throw new AgentLoopException(ErrorType.MODEL_CALL_FAILURE, cause, AgentLoopUtils.errorMessage(cause));
        }
        finally {
            currentModelCall = null;
        }
    }

    private void processOutput(RunContext run, ModelResponse response) {
        final var knownIds = transcript.providerItemIds();
        var hasToolCalls = false;
        var hasContent = false;
        for (var item : response.getOutput()) {
            final var providerId = item.accept(new TranscriptVisitorAdapter<String>(null) {
                @Override
                public String visit(ReasoningItem reasoningItem) {
                    return reasoningItem.getId();
                }

                @Override
                public String visit(ToolCall toolCall) {
                    return toolCall.getId();
                }
            });
            if (!Strings.isNullOrEmpty(providerId) && knownIds.contains(providerId)) {
                log.debug("Skipping item {} already present in the transcript", providerId);
                continue;
            }
            var recorded = item;
            if (item instanceof ReasoningItem reasoning) {
                recorded = withResponseId(reasoning, response.getResponseId());
            }
            else {
                hasContent = true;
                if (item instanceof AssistantText text) {
                    run.textChunks.add(text.getText());
                }
                else if (item instanceof ToolCall) {
                    hasToolCalls = true;
                }
            }
            append(recorded, run.runId);
        }
        run.awaitingFinish = hasContent && !hasToolCalls;
        if (!hasContent) {
            log.debug("Response {} carried only reasoning. Sampling again", response.getResponseId());
        }
    }

    /**
     * @return false if the run has to be aborted
     */
    private boolean executePendingToolCalls(RunContext run) {
        final var pending = transcript.pendingToolCalls();
        if (pending.isEmpty()) {
            return true;
        }
        transition(run.runId, LoopState.EXECUTING_TOOLS, null);
        final var result = toolExecutor.execute(pending,
                                                setup.getModelSettings().parallelToolCallsEnabled(),
                                                name,
                                                run.runId);
        result.outputs().forEach(output -> append(output, run.runId));
        checkCancelled();
        if (result.abortRequested()) {
            run.abortReason = Objects.requireNonNullElse(run.abortReason, "Tool call requested abort");
            return false;
        }
        return true;
    }

    private void trackModelCall(CompletableFuture<ModelResponse> future) {
        currentModelCall = future;
        if (cancelRequested) {
            future.cancel(true);
        }
    }

    private CompactionResult compact(String runId, int keepRecentTurns) {
        final CompactionResult result;
        try {
            result = compactor.compact(transcript, keepRecentTurns, this::trackModelCall);
        }
        catch (AgentLoopException e) {
            //A cancelled run reports the cancellation, not the summary that could not be completed
            checkCancelled();
            throw e;
        }
        finally {
            currentModelCall = null;
        }
        setup.getEventBus().notify(CompactionCompletedEvent.builder()
                                           .loopName(name)
                                           .runId(runId)
                                           .compacted(result.isCompacted())
                                           .compactedItems(result.getCompactedItems())
                                           .keptItems(result.getKeptItems())
                                           .build());
        handlers.compactionComplete(result.isCompacted());
        return result;
    }

    private int abortPending(String runId) {
        final var pending = transcript.pendingToolCalls();
        pending.forEach(call -> append(ToolCallOutput.of(call.getCallId(), ToolResult.aborted()), runId));
        if (!pending.isEmpty()) {
            log.info("Synthesized aborted outputs for {} pending tool calls on loop {}", pending.size(), name);
        }
        return pending.size();
    }

    private AgentLoopException fail(RunContext run, AgentLoopException error) {
        log.error("Run {} on loop {} failed: {}", run.runId, name, error.getMessage());
        abortPending(run.runId);
        handlers.error(error);
        transition(run.runId, LoopState.ERROR, error.getMessage());
        return error;
    }

    private RunResult complete(RunContext run, LoopState finalState) {
        transition(run.runId, finalState, run.abortReason);
        return RunResult.builder()
                .runId(run.runId)
                .state(finalState)
                .text(String.join("\n", run.textChunks))
                .abortReason(run.abortReason)
                .usage(run.usage)
                .build();
    }

    private void append(TranscriptItem item, String runId) {
        transcript.append(item);
        setup.getEventBus().notify(TranscriptItemAppendedEvent.builder()
                                           .loopName(name)
                                           .runId(runId)
                                           .item(item)
                                           .build());
        handlers.itemAdded(item);
    }

    private LoopContext context(RunContext run) {
        return LoopContext.builder()
                .loopName(name)
                .runId(run.runId)
                .step(run.step)
                .items(transcript.items())
                .usage(run.usage)
                .build();
    }

    private void transition(String runId, LoopState to, String reason) {
        final var from = state;
        if (from == to) {
            return;
        }
        state = to;
        log.debug("Loop {} moved from {} to {}", name, from, to);
        setup.getEventBus().notify(LoopStateChangedEvent.builder()
                                           .loopName(name)
                                           .runId(runId)
                                           .from(from)
                                           .to(to)
                                           .reason(reason)
                                           .build());
    }

    private void checkCancelled() {
        if (cancelRequested) {
            throw new CancellationException("Run cancelled");
        }
    }

    private void ensureIdle(String action) {
        if (running.get()) {
            throw new IllegalStateException("Cannot %s while a run is active on loop %s".formatted(action, name));
        }
    }

    private static ReasoningItem withResponseId(ReasoningItem reasoning, String responseId) {
        if (null != reasoning.getResponseId()) {
            return reasoning;
        }
        return ReasoningItem.builder()
                .itemId(reasoning.getItemId())
                .timestamp(reasoning.getTimestamp())
                .id(reasoning.getId())
                .summary(reasoning.getSummary())
                .encryptedContent(reasoning.getEncryptedContent())
                .responseId(responseId)
                .build();
    }
}
