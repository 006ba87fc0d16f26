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

package com.phonepe.agentloop.core.events;

/**
 * To handle specific event types
 */
public interface LoopEventVisitor<T> {
    T visit(TranscriptItemAppendedEvent itemAppended);

    T visit(LoopStateChangedEvent stateChanged);

    T visit(ModelResponseReceivedEvent responseReceived);

    T visit(ToolCalledEvent toolCalled);

    T visit(ToolCallCompletedEvent toolCallCompleted);

    T visit(ToolCallApprovalDeniedEvent approvalDenied);

    T visit(ApprovalRequestedEvent approvalRequested);

    T visit(ApprovalResolvedEvent approvalResolved);

    T visit(PendingApprovalsChangedEvent pendingApprovalsChanged);

    T visit(CompactionCompletedEvent compactionCompleted);
}
