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
import com.phonepe.agentloop.core.events.EventBus;
import com.phonepe.agentloop.core.events.LoopEvent;
import com.phonepe.agentloop.core.events.PendingApprovalsChangedEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApprovalHubTest {

    @Test
    void testResolveCompletesWaiter() {
        final var hub = new ApprovalHub();
        final var future = hub.awaitDecision(request("c1", 1L));
        assertEquals(1, hub.pendingCount());
        assertTrue(hub.pending("c1").isPresent());
        assertTrue(hub.resolve("c1", ApprovalDecision.APPROVE));
        assertEquals(ApprovalDecision.APPROVE, future.join());
        assertEquals(0, hub.pendingCount());
        assertFalse(hub.resolve("c1", ApprovalDecision.APPROVE));
    }

    @Test
    void testDuplicateCallIdRejected() {
        final var hub = new ApprovalHub();
        hub.awaitDecision(request("c1", 1L));
        assertThrows(IllegalStateException.class, () -> hub.awaitDecision(request("c1", 2L)));
    }

    @Test
    void testPendingSortedByRequestTime() {
        final var hub = new ApprovalHub();
        hub.awaitDecision(request("late", 20L));
        hub.awaitDecision(request("early", 10L));
        assertEquals(List.of("early", "late"),
                     hub.pending().stream().map(ApprovalRequest::getCallId).toList());
    }

    @Test
    void testAbandonCancelsOnlyNamedCalls() {
        final var hub = new ApprovalHub();
        final var abandoned = hub.awaitDecision(request("c1", 1L));
        final var kept = hub.awaitDecision(request("c2", 2L));
        assertEquals(1, hub.abandon(List.of("c1")));
        assertThrows(CancellationException.class, abandoned::join);
        assertFalse(kept.isDone());
        assertEquals(1, hub.pendingCount());
    }

    @Test
    void testEventsPublished() {
        final var eventBus = new EventBus();
        final var events = new CopyOnWriteArrayList<LoopEvent>();
        eventBus.onEvent().connect(events::add);
        final var hub = new ApprovalHub(eventBus);

        hub.awaitDecision(request("c1", 1L));
        hub.resolve("c1", ApprovalDecision.DENY_CONTINUE);

        await().atMost(Duration.ofSeconds(5))
                .until(() -> events.stream().filter(PendingApprovalsChangedEvent.class::isInstance).count() == 2);
        assertTrue(events.stream().anyMatch(ApprovalRequestedEvent.class::isInstance));
        final var counts = events.stream()
                .filter(PendingApprovalsChangedEvent.class::isInstance)
                .map(event -> ((PendingApprovalsChangedEvent) event).getPendingCount())
                .sorted()
                .toList();
        assertEquals(List.of(0, 1), counts);
    }

    @Test
    void testSummaryTruncatesArguments() {
        final var request = ApprovalRequest.builder()
                .callId("c1")
                .toolKey("write")
                .arguments("x".repeat(100))
                .build();
        assertEquals("write(" + "x".repeat(80) + "...) [c1]", request.summary());
    }

    private static ApprovalRequest request(String callId, long requestedAt) {
        return ApprovalRequest.builder()
                .callId(callId)
                .toolKey("write")
                .arguments("{\"path\":\"a.txt\"}")
                .loopName("test-loop")
                .runId("run-1")
                .requestedAt(requestedAt)
                .build();
    }
}
