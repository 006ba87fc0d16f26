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

import com.phonepe.agentloop.core.events.ApprovalRequestedEvent;
import com.phonepe.agentloop.core.events.ApprovalResolvedEvent;
import com.phonepe.agentloop.core.events.EventBus;
import com.phonepe.agentloop.core.events.LoopEvent;
import com.phonepe.agentloop.core.events.PendingApprovalsChangedEvent;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds tool calls parked for an external decision. Every call gets its own single-assignment slot keyed by call
 * id; slots are independent of each other and there is no lock shared across calls. A parked call waits until it
 * is resolved or abandoned, there is no timeout.
 * <p>
 * A hub can be shared by several loops. Changes to the pending set are broadcast on the {@link EventBus} so that
 * approver UIs can react.
 */
@Slf4j
public class ApprovalHub {
    private record PendingApproval(ApprovalRequest request, CompletableFuture<ApprovalDecision> decision) {
    }

    private final Map<String, PendingApproval> pending = new ConcurrentHashMap<>();
    private final EventBus eventBus;

    public ApprovalHub() {
        this(null);
    }

    public ApprovalHub(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * Park a call
     *
     * @param request The call to be approved
     * @return Future that completes with the decision, or is cancelled if the request is abandoned
     * @throws IllegalStateException if a request with the same call id is already pending
     */
    public CompletableFuture<ApprovalDecision> awaitDecision(@NonNull ApprovalRequest request) {
        final var future = new CompletableFuture<ApprovalDecision>();
        final var existing = pending.putIfAbsent(request.getCallId(), new PendingApproval(request, future));
        if (null != existing) {
            throw new IllegalStateException("An approval is already pending for call " + request.getCallId());
        }
        log.info("Tool call {} to {} is waiting for approval", request.getCallId(), request.getToolKey());
        publish(new ApprovalRequestedEvent(null,
                                           request.getLoopName(),
                                           request.getRunId(),
                                           null,
                                           request.getCallId(),
                                           request.getToolKey(),
                                           request.getArguments()));
        publishPendingChanged();
        return future;
    }

    /**
     * Deliver a decision. Only the request with exactly this call id is affected.
     *
     * @return true if a pending request was resolved, false if nothing was pending for the call id
     */
    public boolean resolve(@NonNull String callId, @NonNull ApprovalDecision decision) {
        final var entry = pending.remove(callId);
        if (null == entry) {
            log.warn("Ignoring decision {} for call {} as nothing is pending for it", decision, callId);
            return false;
        }
        log.info("Tool call {} to {} resolved with decision {}", callId, entry.request().getToolKey(), decision);
        final var completed = entry.decision().complete(decision);
        publish(new ApprovalResolvedEvent(null,
                                          entry.request().getLoopName(),
                                          entry.request().getRunId(),
                                          null,
                                          callId,
                                          decision));
        publishPendingChanged();
        return completed;
    }

    /**
     * Drop pending requests without a decision. Waiters see a {@link CancellationException}. Requests for other
     * call ids are not touched.
     *
     * @return Number of requests that were actually abandoned
     */
    public int abandon(@NonNull Collection<String> callIds) {
        var count = 0;
        for (var callId : callIds) {
            final var entry = pending.remove(callId);
            if (null != entry) {
                entry.decision().completeExceptionally(
                        new CancellationException("Approval for call " + callId + " was abandoned"));
                count++;
            }
        }
        if (count > 0) {
            log.info("Abandoned {} pending approvals", count);
            publishPendingChanged();
        }
        return count;
    }

    public List<ApprovalRequest> pending() {
        return pending.values()
                .stream()
                .map(PendingApproval::request)
                .sorted(Comparator.comparingLong(ApprovalRequest::getRequestedAt)
                                .thenComparing(ApprovalRequest::getCallId))
                .toList();
    }

    public Optional<ApprovalRequest> pending(String callId) {
        return Optional.ofNullable(pending.get(callId)).map(PendingApproval::request);
    }

    public int pendingCount() {
        return pending.size();
    }

    private void publishPendingChanged() {
        final var snapshot = pending();
        publish(PendingApprovalsChangedEvent.builder()
                        .pendingCount(snapshot.size())
                        .summaries(snapshot.stream().map(ApprovalRequest::summary).toList())
                        .build());
    }

    private void publish(LoopEvent event) {
        if (null != eventBus) {
            eventBus.notify(event);
        }
    }
}
