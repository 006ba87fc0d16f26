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

package com.phonepe.agentloop.core.handlers;

import com.phonepe.agentloop.core.errors.ParameterValidationError;
import com.phonepe.agentloop.core.handlers.decisions.Abort;
import com.phonepe.agentloop.core.handlers.decisions.InjectItems;
import com.phonepe.agentloop.core.handlers.decisions.LoopDecision;
import com.phonepe.agentloop.core.handlers.decisions.NoAction;
import com.phonepe.agentloop.core.handlers.decisions.RequireAnyTool;
import com.phonepe.agentloop.core.model.UsageStats;
import com.phonepe.agentloop.core.transcript.AssistantText;
import com.phonepe.agentloop.core.transcript.UserText;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BuiltInHandlersTest {
    private static final LoopContext CONTEXT = LoopContext.builder()
            .loopName("test")
            .runId("run-1")
            .usage(new UsageStats())
            .build();

    @Test
    void testCaptureText() {
        final var handler = new CaptureTextHandler();
        assertFalse(handler.hasText());
        assertThrows(IllegalStateException.class, handler::take);

        assertInstanceOf(NoAction.class, handler.onBeforeSample(CONTEXT));
        handler.onAssistantText(AssistantText.of("the answer"));
        assertInstanceOf(Abort.class, handler.onBeforeSample(CONTEXT));
        assertInstanceOf(NoAction.class, handler.onBeforeSample(CONTEXT));
        assertEquals("the answer", handler.take());
        assertThrows(IllegalStateException.class, handler::take);
    }

    @Test
    void testFinishOnText() {
        final var handler = new FinishOnTextMessageHandler();
        assertInstanceOf(NoAction.class, handler.onBeforeSample(CONTEXT));
        handler.onAssistantText(AssistantText.of("done"));
        final var abort = assertInstanceOf(Abort.class, handler.onBeforeSample(CONTEXT));
        assertNull(abort.getReason());
    }

    @Test
    void testRedirectInjectsReminder() {
        final var handler = new RedirectOnTextMessageHandler("Use the tools to finish the task");
        handler.onAssistantText(AssistantText.of("I am done"));
        final var inject = assertInstanceOf(InjectItems.class, handler.onBeforeSample(CONTEXT));
        assertEquals(1, inject.getItems().size());
        assertEquals("Use the tools to finish the task",
                     assertInstanceOf(UserText.class, inject.getItems().get(0)).getText());
        assertInstanceOf(NoAction.class, handler.onBeforeSample(CONTEXT));
    }

    @Test
    void testMaxTurns() {
        final var handler = new MaxTurnsHandler(2);
        handler.onResponse(ResponseInfo.builder().responseId("r1").build());
        assertInstanceOf(NoAction.class, handler.onBeforeSample(CONTEXT));
        handler.onResponse(ResponseInfo.builder().responseId("r2").build());
        final var abort = assertInstanceOf(Abort.class, handler.onBeforeSample(CONTEXT));
        assertEquals("Reached maximum of 2 turns", abort.getReason());
        assertEquals(2, handler.getTurns());
        assertThrows(ParameterValidationError.class, () -> new MaxTurnsHandler(0));
    }

    @Test
    void testAbortIf() {
        final var flag = new AtomicBoolean();
        final var handler = new AbortIf(flag::get, "stopped by operator");
        assertInstanceOf(NoAction.class, handler.onBeforeSample(CONTEXT));
        flag.set(true);
        assertEquals("stopped by operator", assertInstanceOf(Abort.class, handler.onBeforeSample(CONTEXT)).getReason());
    }

    @Test
    void testSequenceRunsOutToNoAction() {
        final var handler = new SequenceHandler(LoopDecision.requireAnyTool());
        assertInstanceOf(RequireAnyTool.class, handler.onBeforeSample(CONTEXT));
        assertInstanceOf(NoAction.class, handler.onBeforeSample(CONTEXT));
    }
}
