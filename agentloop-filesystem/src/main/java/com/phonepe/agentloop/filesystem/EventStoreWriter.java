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

package com.phonepe.agentloop.filesystem;

import com.phonepe.agentloop.core.events.EventBus;
import com.phonepe.agentloop.core.events.LoopEvent;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists every event published on an {@link EventBus} into a {@link FileSystemEventStore}.
 * Failures are logged and do not reach the loop that published the event.
 */
@Slf4j
public class EventStoreWriter {
    private final FileSystemEventStore store;

    private EventStoreWriter(FileSystemEventStore store) {
        this.store = store;
    }

    public static EventStoreWriter connect(@NonNull EventBus eventBus, @NonNull FileSystemEventStore store) {
        final var writer = new EventStoreWriter(store);
        eventBus.onEvent().connect(writer::write);
        log.info("Event store writer connected to event bus");
        return writer;
    }

    private void write(LoopEvent event) {
        try {
            store.append(event);
            log.debug("Stored event {} of type {} for run {}", event.getEventId(), event.getType(), event.getRunId());
        }
        catch (Exception e) {
            log.error("Failed to store event {} of type {}: {}", event.getEventId(), event.getType(), e.getMessage());
        }
    }
}
