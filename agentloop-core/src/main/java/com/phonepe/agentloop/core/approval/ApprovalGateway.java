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

package com.phonepe.agentloop.core.approval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.phonepe.agentloop.core.events.EventBus;
import com.phonepe.agentloop.core.events.LoopEvent;
import com.phonepe.agentloop.core.events.ToolCallApprovalDeniedEvent;
import com.phonepe.agentloop.core.events.ToolCallCompletedEvent;
import com.phonepe.agentloop.core.events.ToolCalledEvent;
import com.phonepe.agentloop.core.tools.TextBlock;
import com.phonepe.agentloop.core.tools.ToolResult;
import com.phonepe.agentloop.core.utils.AgentLoopUtils;
import com.phonepe.agentloop.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Mediates every tool invocation through a policy decision.
 * <p>
 * Per call: REQUESTED, then depending on the policy either EXECUTING and COMPLETED, DENIED, or PENDING_APPROVAL
 * until the {@link ApprovalHub} delivers a decision. Denials and evaluator failures are returned as error results
 * stamped with {@link PolicyErrorCodes#STAMP_KEY}. Results coming from the tool backend are passed through as is,
 * unless they try to pass off as a gateway denial, in which case they are replaced with a misuse error.
 * <p>
 * Calls are independent of each other; all state is kept per call id. A caller can stop a call with the
 * cancellation check passed to {@link #execute(GatewayCall, Supplier, BooleanSupplier)}. Once the check returns true
 * the call is not evaluated, parked or invoked any more and ends with an aborted outcome.
 */
@Slf4j
public class ApprovalGateway {
    private final PolicyBackend policyBackend;
    @Getter
    private final ApprovalHub approvalHub;
    private final EventBus eventBus;
    private final ObjectMapper mapper;
    private final Map<String, ToolCallState> callStates = new ConcurrentHashMap<>();
    private final AtomicInteger inflight = new AtomicInteger(0);

    @Builder
    public ApprovalGateway(
            @NonNull PolicyBackend policyBackend,
            ApprovalHub approvalHub,
            EventBus eventBus,
            ObjectMapper mapper) {
        this.policyBackend = policyBackend;
        this.eventBus = eventBus;
        this.approvalHub = Objects.requireNonNullElseGet(approvalHub, () -> new ApprovalHub(eventBus));
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    /**
     * Run a call through policy and, if allowed, through the invoker. Blocks while the call waits for approval.
     *
     * @param call    The call
     * @param invoker Performs the actual tool call
     * @return Outcome with the result to be recorded for the call
     */
    public GatewayOutcome execute(@NonNull GatewayCall call, @NonNull Supplier<ToolResult> invoker) {
        return execute(call, invoker, () -> false);
    }

    /**
     * Same as {@link #execute(GatewayCall, Supplier)}, for calls that can be stopped by their owner.
     *
     * @param cancelled Checked before the policy is consulted, right after an approval request is registered and
     *                  before the tool is invoked
     */
    public GatewayOutcome execute(
            @NonNull GatewayCall call,
            @NonNull Supplier<ToolResult> invoker,
            @NonNull BooleanSupplier cancelled) {
        final var callId = call.getCallId();
        if (cancelled.getAsBoolean()) {
            return cancelledOutcome(call);
        }
        callStates.put(callId, ToolCallState.REQUESTED);
        final PolicyEvaluation evaluation;
        try {
            evaluation = Objects.requireNonNull(
                    policyBackend.evaluate(PolicyRequest.builder()
                                                   .callId(callId)
                                                   .toolKey(call.getToolName())
                                                   .arguments(call.getArguments())
                                                   .build()),
                    "Policy backend returned no evaluation");
        }
        catch (Exception e) {
            final var message = AgentLoopUtils.errorMessage(e);
            log.warn("Policy evaluation failed for call {} to {}: {}", callId, call.getToolName(), message);
            return deny(call,
                        PolicyErrorCodes.POLICY_EVALUATOR_ERROR,
                        PolicyErrorCodes.POLICY_EVALUATOR_ERROR_MESSAGE,
                        "%s: %s".formatted(AgentLoopUtils.rootCause(e).getClass().getSimpleName(), message),
                        false);
        }
        log.debug("Policy decision for call {} to {}: {}", callId, call.getToolName(), evaluation.getDecision());
        return switch (evaluation.getDecision()) {
            case ALLOW -> run(call, invoker, cancelled);
            case DENY_CONTINUE -> denyContinue(call, evaluation.getRationale());
            case DENY_ABORT -> denyAbort(call, evaluation.getRationale());
            case ASK -> awaitApproval(call, invoker, cancelled);
        };
    }

    public Optional<ToolCallState> state(String callId) {
        return Optional.ofNullable(callStates.get(callId));
    }

    /**
     * @return Number of tool calls currently inside the tool backend
     */
    public int inflightCount() {
        return inflight.get();
    }

    /**
     * Forget per call state, for example after the owning run ended
     */
    public void forget(Iterable<String> callIds) {
        callIds.forEach(callStates::remove);
    }

    private GatewayOutcome awaitApproval(
            GatewayCall call,
            Supplier<ToolResult> invoker,
            BooleanSupplier cancelled) {
        final var callId = call.getCallId();
        transition(callId, ToolCallState.PENDING_APPROVAL);
        final var pendingDecision = approvalHub.awaitDecision(ApprovalRequest.builder()
                                                                      .callId(callId)
                                                                      .toolKey(call.getToolName())
                                                                      .arguments(call.getRawArguments())
                                                                      .loopName(call.getLoopName())
                                                                      .runId(call.getRunId())
                                                                      .requestedAt(System.currentTimeMillis())
                                                                      .build());
        //The owner may have given up on the call before the request got registered
        if (cancelled.getAsBoolean()) {
            approvalHub.abandon(List.of(callId));
        }
        final ApprovalDecision decision;
        try {
            decision = pendingDecision.join();
        }
        catch (CancellationException | CompletionException e) {
            log.info("Approval for call {} to {} was abandoned", callId, call.getToolName());
            transition(callId, ToolCallState.DENIED);
            return GatewayOutcome.aborted(callId);
        }
        return switch (decision) {
            case APPROVE -> run(call, invoker, cancelled);
            case DENY_CONTINUE -> denyContinue(call, "Denied by approver");
            case DENY_ABORT -> denyAbort(call, "Denied by approver");
        };
    }

    private GatewayOutcome run(GatewayCall call, Supplier<ToolResult> invoker, BooleanSupplier cancelled) {
        final var callId = call.getCallId();
        if (cancelled.getAsBoolean()) {
            return cancelledOutcome(call);
        }
        transition(callId, ToolCallState.EXECUTING);
        publish(new ToolCalledEvent(null, call.getLoopName(), call.getRunId(), null, callId, call.getToolName()));
        final var stopwatch = Stopwatch.createStarted();
        inflight.incrementAndGet();
        ToolResult result;
        var reservedInFailure = false;
        try {
            result = Objects.requireNonNullElseGet(invoker.get(),
                                                   () -> ToolResult.error("Tool %s returned no result",
                                                                          call.getToolName()));
        }
        catch (Exception e) {
            final var message = AgentLoopUtils.errorMessage(e);
            log.error("Error calling tool {} for call {}: {}", call.getToolName(), callId, message);
            result = ToolResult.error("Tool call failed: %s", message);
            reservedInFailure = PolicyErrorCodes.mentionsReservedMessage(message);
        }
        finally {
            inflight.decrementAndGet();
        }
        if (reservedInFailure || PolicyErrorCodes.carriesReservedSignal(result)) {
            log.warn("Tool backend for {} returned a reserved policy signal for call {}. Remapping to misuse error.",
                     call.getToolName(), callId);
            result = misuseResult(call, result);
        }
        transition(callId, ToolCallState.COMPLETED);
        publish(new ToolCallCompletedEvent(null,
                                           call.getLoopName(),
                                           call.getRunId(),
                                           null,
                                           callId,
                                           call.getToolName(),
                                           result.isError(),
                                           result.isError() ? result.getText() : null,
                                           Duration.ofMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS))));
        return GatewayOutcome.completed(callId, result);
    }

    private GatewayOutcome denyContinue(GatewayCall call, String reason) {
        return deny(call,
                    PolicyErrorCodes.POLICY_DENIED_CONTINUE,
                    PolicyErrorCodes.POLICY_DENIED_CONTINUE_MESSAGE,
                    reason,
                    false);
    }

    private GatewayOutcome denyAbort(GatewayCall call, String reason) {
        return deny(call,
                    PolicyErrorCodes.POLICY_DENIED_ABORT,
                    PolicyErrorCodes.POLICY_DENIED_ABORT_MESSAGE,
                    reason,
                    true);
    }

    private GatewayOutcome deny(GatewayCall call, String code, String message, String reason, boolean abort) {
        final var callId = call.getCallId();
        log.info("Tool call {} to {} denied with code {}. Reason: {}", callId, call.getToolName(), code, reason);
        transition(callId, ToolCallState.DENIED);
        publish(new ToolCallApprovalDeniedEvent(null,
                                                call.getLoopName(),
                                                call.getRunId(),
                                                null,
                                                callId,
                                                call.getToolName(),
                                                code,
                                                abort,
                                                reason));
        return GatewayOutcome.denied(callId, stampedError(call, code, message, reason, null), abort);
    }

    private GatewayOutcome cancelledOutcome(GatewayCall call) {
        log.info("Tool call {} to {} was cancelled before it could run", call.getCallId(), call.getToolName());
        callStates.remove(call.getCallId());
        return GatewayOutcome.aborted(call.getCallId());
    }

    /**
     * States of calls that have been forgotten are not brought back
     */
    private void transition(String callId, ToolCallState state) {
        callStates.computeIfPresent(callId, (id, current) -> state);
    }

    private ToolResult misuseResult(GatewayCall call, ToolResult original) {
        return stampedError(call,
                            PolicyErrorCodes.POLICY_BACKEND_RESERVED_MISUSE,
                            PolicyErrorCodes.POLICY_BACKEND_RESERVED_MISUSE_MESSAGE,
                            null,
                            Objects.requireNonNullElse(PolicyErrorCodes.codeOf(original), "unknown"));
    }

    private ToolResult stampedError(
            GatewayCall call,
            String code,
            String message,
            String reason,
            String backendCode) {
        final var data = mapper.createObjectNode();
        data.put(PolicyErrorCodes.STAMP_KEY, true);
        data.put(PolicyErrorCodes.CODE_KEY, code);
        data.put("name", call.getToolName());
        if (!Strings.isNullOrEmpty(reason)) {
            data.put("reason", reason);
        }
        if (!Strings.isNullOrEmpty(backendCode)) {
            data.put("backend_code", backendCode);
        }
        final var text = Strings.isNullOrEmpty(reason) ? message : "%s. Reason: %s".formatted(message, reason);
        return ToolResult.builder()
                .contentBlock(new TextBlock(text))
                .structuredContent(data)
                .error(true)
                .build();
    }

    private void publish(LoopEvent event) {
        if (null != eventBus) {
            eventBus.notify(event);
        }
    }
}
