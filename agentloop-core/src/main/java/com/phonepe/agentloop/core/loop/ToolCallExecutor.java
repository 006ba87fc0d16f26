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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.agentloop.core.approval.ApprovalGateway;
import com.phonepe.agentloop.core.approval.GatewayCall;
import com.phonepe.agentloop.core.approval.GatewayOutcome;
import com.phonepe.agentloop.core.tools.ToolProvider;
import com.phonepe.agentloop.core.tools.ToolResult;
import com.phonepe.agentloop.core.tools.ToolResultSanitizer;
import com.phonepe.agentloop.core.transcript.ToolCall;
import com.phonepe.agentloop.core.transcript.ToolCallOutput;
import com.phonepe.agentloop.core.utils.AgentLoopUtils;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.Timeout;
import dev.failsafe.TimeoutExceededException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Runs the tool calls of one step through the approval gateway.
 * <p>
 * Raw arguments are validated before the gateway sees the call. Outputs are always returned in the order of the
 * calls, whatever the order of completion. Once a call asks for the run to be aborted, calls that have not started
 * yet are not started and get a synthesized aborted output; calls parked for approval are abandoned.
 * <p>
 * After {@link #cancelAll()} no further call of the current step is started, parked or invoked until
 * {@link #reset()} is called for the next run.
 */
@Slf4j
class ToolCallExecutor {

    /**
     * Outputs of a step, one per call, in call order
     */
    record StepResult(List<ToolCallOutput> outputs, boolean abortRequested) {
    }

    private final ToolProvider toolProvider;
    private final ApprovalGateway gateway;
    private final ObjectMapper mapper;
    private final ExecutorService executorService;
    private final int maxParallelToolCalls;
    private final Timeout<ToolResult> timeout;
    private final Duration toolCallTimeout;
    private final Map<String, CompletableFuture<GatewayOutcome>> active = new ConcurrentHashMap<>();
    private volatile boolean cancelled;

    ToolCallExecutor(ToolProvider toolProvider, ApprovalGateway gateway, AgentLoopSetup setup) {
        this.toolProvider = toolProvider;
        this.gateway = gateway;
        this.mapper = setup.getMapper();
        this.executorService = setup.getToolExecutorService();
        this.maxParallelToolCalls = setup.getMaxParallelToolCalls();
        this.toolCallTimeout = setup.getToolCallTimeout();
        this.timeout = Timeout.<ToolResult>builder(toolCallTimeout)
                .withInterrupt()
                .build();
    }

    StepResult execute(List<ToolCall> calls, boolean parallel, String loopName, String runId) {
        if (calls.isEmpty()) {
            return new StepResult(List.of(), false);
        }
        log.debug("Executing {} tool calls {}", calls.size(), parallel ? "in parallel" : "sequentially");
        final var stopped = new AtomicBoolean(false);
        final Map<String, GatewayOutcome> outcomes;
        try {
            outcomes = parallel
                    ? executeParallel(calls, loopName, runId, stopped)
                    : executeSequential(calls, loopName, runId, stopped);
        }
        finally {
            gateway.forget(calls.stream().map(ToolCall::getCallId).toList());
        }
        final var outputs = new ArrayList<ToolCallOutput>(calls.size());
        var abortRequested = false;
        for (var call : calls) {
            final var outcome = outcomes.get(call.getCallId());
            final ToolResult result;
            if (null == outcome) {
                result = ToolResult.aborted();
                abortRequested = true;
            }
            else {
                result = outcome.getResult();
                abortRequested |= outcome.isAbortRequested();
            }
            outputs.add(ToolCallOutput.of(call.getCallId(), ToolResultSanitizer.sanitize(result, mapper)));
        }
        return new StepResult(outputs, abortRequested);
    }

    /**
     * Cancel everything in flight. Calls already inside a tool provider run to completion in the background, their
     * results are dropped.
     *
     * @return Call ids that were in flight
     */
    Set<String> cancelAll() {
        cancelled = true;
        final var callIds = Set.copyOf(active.keySet());
        if (!callIds.isEmpty()) {
            gateway.getApprovalHub().abandon(callIds);
            active.values().forEach(future -> future.cancel(true));
            log.info("Cancelled {} in-flight tool calls", callIds.size());
        }
        return callIds;
    }

    /**
     * Arm the executor for a new run
     */
    void reset() {
        cancelled = false;
    }

    private Map<String, GatewayOutcome> executeSequential(
            List<ToolCall> calls,
            String loopName,
            String runId,
            AtomicBoolean stopped) {
        final var outcomes = new LinkedHashMap<String, GatewayOutcome>();
        for (var call : calls) {
            checkCancelled();
            final var outcome = await(call, submit(call, loopName, runId, stopped));
            outcomes.put(call.getCallId(), outcome);
            if (outcome.isAbortRequested()) {
                log.info("Tool call {} requested abort. Skipping {} remaining calls",
                         call.getCallId(), calls.size() - outcomes.size());
                break;
            }
        }
        return outcomes;
    }

    private Map<String, GatewayOutcome> executeParallel(
            List<ToolCall> calls,
            String loopName,
            String runId,
            AtomicBoolean stopped) {
        final var permits = new Semaphore(maxParallelToolCalls);
        final var futures = new LinkedHashMap<String, CompletableFuture<GatewayOutcome>>();
        for (var call : calls) {
            try {
                permits.acquire();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while scheduling tool calls");
            }
            if (cancelled) {
                permits.release();
                throw new CancellationException("Run cancelled");
            }
            if (stopped.get()) {
                permits.release();
                break;
            }
            final var future = submit(call, loopName, runId, stopped);
            future.whenComplete((outcome, error) -> {
                permits.release();
                if (null != outcome && outcome.isAbortRequested() && stopped.compareAndSet(false, true)) {
                    log.info("Tool call {} requested abort. Abandoning pending approvals of this step",
                             outcome.getCallId());
                    gateway.getApprovalHub().abandon(calls.stream().map(ToolCall::getCallId).toList());
                }
            });
            futures.put(call.getCallId(), future);
        }
        final var outcomes = new LinkedHashMap<String, GatewayOutcome>();
        for (var call : calls) {
            final var future = futures.get(call.getCallId());
            if (null != future) {
                outcomes.put(call.getCallId(), await(call, future));
            }
        }
        return outcomes;
    }

    private CompletableFuture<GatewayOutcome> submit(
            ToolCall call,
            String loopName,
            String runId,
            AtomicBoolean stopped) {
        final BooleanSupplier stopCheck = () -> cancelled || stopped.get();
        final var future = CompletableFuture.supplyAsync(() -> runThroughGateway(call, loopName, runId, stopCheck),
                                                         executorService);
        active.put(call.getCallId(), future);
        future.whenComplete((outcome, error) -> active.remove(call.getCallId()));
        return future;
    }

    private GatewayOutcome await(ToolCall call, CompletableFuture<GatewayOutcome> future) {
        try {
            return future.join();
        }
        catch (CompletionException e) {
            //Gateway handles all tool failures, anything reaching here is a bug in a collaborator
            final var message = AgentLoopUtils.errorMessage(e);
            log.error("Error executing tool call {} to {}: {}", call.getCallId(), call.getName(), message);
            return GatewayOutcome.completed(call.getCallId(), ToolResult.error("Tool call failed: %s", message));
        }
    }

    private void checkCancelled() {
        if (cancelled) {
            throw new CancellationException("Run cancelled");
        }
    }

    private GatewayOutcome runThroughGateway(
            ToolCall call,
            String loopName,
            String runId,
            BooleanSupplier stopCheck) {
        final var callId = call.getCallId();
        final JsonNode arguments;
        try {
            arguments = parseArguments(call.getArguments());
        }
        catch (InvalidArgumentsException e) {
            log.info("Rejecting tool call {} to {}: {}", callId, call.getName(), e.getMessage());
            return GatewayOutcome.completed(callId, ToolResult.error(e.getMessage()));
        }
        return gateway.execute(GatewayCall.builder()
                                       .callId(callId)
                                       .toolName(call.getName())
                                       .rawArguments(call.getArguments())
                                       .arguments(arguments)
                                       .loopName(loopName)
                                       .runId(runId)
                                       .build(),
                               () -> invokeWithTimeout(call.getName(), arguments),
                               stopCheck);
    }

    private ToolResult invokeWithTimeout(String toolName, JsonNode arguments) {
        try {
            return Failsafe.with(timeout).get(() -> toolProvider.callTool(toolName, arguments));
        }
        catch (TimeoutExceededException e) {
            //Clear any interrupt raised by the timeout so that the pool thread can be reused
            Thread.interrupted();
            log.error("Tool call to {} timed out after {}", toolName, toolCallTimeout);
            return ToolResult.error("Tool %s timed out after %d ms", toolName, toolCallTimeout.toMillis());
        }
        catch (FailsafeException e) {
            final var message = AgentLoopUtils.errorMessage(e);
            log.error("Error calling tool {}: {}", toolName, message);
            return ToolResult.error("Tool call failed: %s", message);
        }
    }

    private JsonNode parseArguments(String rawArguments) {
        if (Strings.isNullOrEmpty(rawArguments) || rawArguments.isBlank()) {
            return mapper.createObjectNode();
        }
        final JsonNode parsed;
        try {
            parsed = mapper.readTree(rawArguments);
        }
        catch (JsonProcessingException e) {
            throw new InvalidArgumentsException("Invalid JSON in tool arguments: "
                                                        + e.getOriginalMessage().toLowerCase());
        }
        if (null == parsed || parsed.isMissingNode()) {
            return mapper.createObjectNode();
        }
        if (!parsed.isObject()) {
            throw new InvalidArgumentsException("Tool arguments must be a JSON object, got "
                                                        + parsed.getNodeType().name().toLowerCase());
        }
        return parsed;
    }

    private static final class InvalidArgumentsException extends RuntimeException {
        private InvalidArgumentsException(String message) {
            super(message);
        }
    }
}
