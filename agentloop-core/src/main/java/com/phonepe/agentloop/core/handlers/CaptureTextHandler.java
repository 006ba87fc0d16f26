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

/**
 * Like {@link FinishOnTextMessageHandler}, but keeps the text so that the caller can pick it up after the run.
 * Used for sub agents that exchange messages with a parent.
 */
public class CaptureTextHandler implements LoopHandler {
    private String captured;
    private boolean textSeen;

    @Override
    public void onAssistantText(AssistantText item) {
        captured = item.getText();
        textSeen = true;
    }

    @Override
    public LoopDecision onBeforeSample(LoopContext context) {
        if (textSeen) {
            textSeen = false;
            return LoopDecision.abort();
        }
        return LoopDecision.noAction();
    }

    /**
     * Returns the captured text and clears it
     *
     * @throws IllegalStateException if nothing was captured, for example because the run was aborted by some
     *                               other handler before the assistant said anything
     */
    public String take() {
        if (null == captured) {
            throw new IllegalStateException("No text captured. Run ended before the assistant produced any text");
        }
        final var text = captured;
        captured = null;
        return text;
    }

    public boolean hasText() {
        return null != captured;
    }
}
