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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.agentloop.core.events.LoopEvent;
import com.phonepe.agentloop.core.events.LoopEventType;
import com.phonepe.agentloop.core.events.LoopStateChangedEvent;
import com.phonepe.agentloop.core.events.PendingApprovalsChangedEvent;
import com.phonepe.agentloop.core.events.ToolCallCompletedEvent;
import com.phonepe.agentloop.core.events.TranscriptItemAppendedEvent;
import com.phonepe.agentloop.core.loop.LoopState;
import com.phonepe.agentloop.core.transcript.UserText;
import com.phonepe.agentloop.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemEventStoreTest {

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;

    @BeforeEach
    void setup() {
        mapper = JsonUtils.createMapper();
    }

    @Test
    void testAppendAndRead() {
        final var store = store();
        store.append(stateChanged("run-1", LoopState.IDLE, LoopState.SAMPLING));
        store.append(itemAppended("run-1", "hello"));
        store.append(stateChanged("run-2", LoopState.IDLE, LoopState.SAMPLING));

        final var runOne = store.readEvents("run-1");
        assertEquals(2, runOne.size());
        assertEquals(LoopEventType.STATE_CHANGED, runOne.get(0).getType());
        assertEquals(LoopEventType.ITEM_APPENDED, runOne.get(1).getType());
        assertEquals(1, store.readEvents("run-2").size());
        assertTrue(store.readEvents("run-3").isEmpty());
        assertEquals(List.of("run-1", "run-2"), List.copyOf(store.runIds()));
        assertEquals(3, store.size());
    }

    @Test
    void testEventsOutsideRun() {
        final var store = store();
        store.append(PendingApprovalsChangedEvent.builder()
                             .pendingCount(1)
                             .build());
        store.append(stateChanged("run-1", LoopState.IDLE, LoopState.SAMPLING));

        assertEquals(1, store.readEvents(null).size());
        assertEquals(1, store.readEvents("").size());
        assertEquals(List.of("run-1"), List.copyOf(store.runIds()));
        assertEquals(2, store.readAll().size());
    }

    @Test
    void testReadByEventClass() {
        final var store = store();
        store.appendAll(List.of(stateChanged("run-1", LoopState.IDLE, LoopState.SAMPLING),
                                itemAppended("run-1", "first"),
                                itemAppended("run-1", "second"),
                                stateChanged("run-1", LoopState.SAMPLING, LoopState.FINISHED)));

        final var items = store.readEvents("run-1", TranscriptItemAppendedEvent.class);
        assertEquals(2, items.size());
        assertEquals("second", ((UserText) items.get(1).getItem()).getText());
        final var states = store.readEvents("run-1", LoopStateChangedEvent.class);
        assertEquals(LoopState.FINISHED, states.get(1).getTo());
    }

    @Test
    @SneakyThrows
    void testReloadFromDisk() {
        final var store = store();
        store.append(stateChanged("run-1", LoopState.IDLE, LoopState.SAMPLING));
        store.append(itemAppended("run-1", "persist me"));
        store.append(ToolCallCompletedEvent.builder()
                             .runId("run-1")
                             .callId("call_1")
                             .toolName("echo")
                             .elapsedTime(Duration.ofMillis(250))
                             .build());

        final var lines = Files.readAllLines(tempDir.resolve(FileSystemEventStore.EVENTS_FILE_NAME),
                                             StandardCharsets.UTF_8);
        assertEquals(3, lines.size());

        final var reloaded = store();
        final var events = reloaded.readEvents("run-1");
        assertEquals(3, events.size());
        assertEquals(store.readEvents("run-1").get(0).getEventId(), events.get(0).getEventId());
        final var item = assertInstanceOf(TranscriptItemAppendedEvent.class, events.get(1));
        assertEquals("persist me", assertInstanceOf(UserText.class, item.getItem()).getText());
        final var completed = assertInstanceOf(ToolCallCompletedEvent.class, events.get(2));
        assertEquals("echo", completed.getToolName());
        assertEquals(Duration.ofMillis(250), completed.getElapsedTime());
    }

    @Test
    void testPurge() {
        final var store = store();
        store.append(stateChanged("run-1", LoopState.IDLE, LoopState.SAMPLING));
        assertTrue(store.purge());
        assertEquals(0, store.size());
        assertTrue(store.runIds().isEmpty());
        assertFalse(Files.exists(tempDir.resolve(FileSystemEventStore.EVENTS_FILE_NAME)));
        assertFalse(store.purge());

        store.append(stateChanged("run-2", LoopState.IDLE, LoopState.SAMPLING));
        assertEquals(1, store().size());
    }

    @Test
    void testAppendEmptyListIsNoop() {
        final var store = store();
        store.appendAll(List.of());
        assertEquals(0, store.size());
        assertFalse(Files.exists(tempDir.resolve(FileSystemEventStore.EVENTS_FILE_NAME)));
    }

    @Test
    void testCreatesMissingDirectory() {
        final var dir = tempDir.resolve("nested").resolve("events");
        final var store = FileSystemEventStore.builder()
                .eventDir(dir.toString())
                .objectMapper(mapper)
                .build();
        store.append(stateChanged("run-1", LoopState.IDLE, LoopState.SAMPLING));
        assertTrue(Files.exists(dir.resolve(FileSystemEventStore.EVENTS_FILE_NAME)));
    }

    @Test
    @SneakyThrows
    void testCorruptFileFailsLoad() {
        Files.writeString(tempDir.resolve(FileSystemEventStore.EVENTS_FILE_NAME), "{not json}\n");
        final var error = assertThrows(IllegalStateException.class, this::store);
        assertTrue(error.getMessage().contains("line 1"));
    }

    private FileSystemEventStore store() {
        return FileSystemEventStore.builder()
                .eventDir(tempDir.toString())
                .objectMapper(mapper)
                .build();
    }

    private static LoopEvent stateChanged(String runId, LoopState from, LoopState to) {
        return LoopStateChangedEvent.builder()
                .loopName("test-loop")
                .runId(runId)
                .from(from)
                .to(to)
                .build();
    }

    private static LoopEvent itemAppended(String runId, String text) {
        return TranscriptItemAppendedEvent.builder()
                .loopName("test-loop")
                .runId(runId)
                .item(UserText.of(text))
                .build();
    }
}
