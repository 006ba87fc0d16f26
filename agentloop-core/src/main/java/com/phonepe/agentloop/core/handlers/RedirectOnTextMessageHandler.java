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

import com.phonepe.agentloop.core.handlers.decisions.LoopDecision;
import com.phonepe.agentloop.core.transcript.AssistantText;
import com.phonepe.agentloop.core.transcript.UserText;
import lombok.NonNull;

/**
 * For non-interactive agents. Whenever the assistant answers with text instead of calling tools, a reminder is
 * injected as a user message.
 */
public class RedirectOnTextMessageHandler implements LoopHandler {
    private final String reminder;
    private boolean textSeen;

    public RedirectOnTextMessageHandler(@NonNull String reminder) {
        this.reminder = reminder;
    }

    @Override
    public void onAssistantText(AssistantText item) {
        textSeen = true;
    }

    @Override
    public LoopDecision onBeforeSample(LoopContext context) {
        if (textSeen) {
            textSeen = false;
            return LoopDecision.inject(UserText.of(reminder));
        }
        return LoopDecision.noAction();
    }
}
