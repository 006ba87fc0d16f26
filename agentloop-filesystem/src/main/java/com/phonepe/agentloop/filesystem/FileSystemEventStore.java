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
import com.google.common.base.Strings;
import com.phonepe.agentloop.core.events.LoopEvent;
import com.phonepe.agentloop.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.StampedLock;

/**
 * Disk based store for loop events.
 * Implementation:
 * - All events go to a jsonl file called events.jsonl in the provided directory, one event per line
 * - Events are kept in arrival order
 * - Everything in the file is read in one shot at startup and served from memory afterwards
 * - Events are indexed by run id. Events emitted outside a run (no run id) are only part of {@link #readAll()}
 * - Writes are appended to the file first and committed to memory after the write succeeds
 */
@Slf4j
public class FileSystemEventStore {

    public static final String EVENTS_FILE_NAME = "events.jsonl";

    private final List<LoopEvent> events = new ArrayList<>();

    private final Map<String, List<LoopEvent>> eventsByRun = new LinkedHashMap<>();

    private final StampedLock lock = new StampedLock();

    private final ObjectMapper objectMapper;

    private final Path filePath;

    @Builder
    public FileSystemEventStore(@NonNull String eventDir, @NonNull ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.filePath = FileUtils.ensurePath(eventDir, true, true).resolve(EVENTS_FILE_NAME);
        readEventsFromFile().forEach(this::index);
        log.info("Loaded {} events for {} runs from {}", events.size(), eventsByRun.size(), filePath);
    }

    public void append(@NonNull LoopEvent event) {
        appendAll(List.of(event));
    }

    /**
     * Appends the events to the file in a single write and then makes them visible to readers.
     * Writes are expected to be small and spaced out, so there is no batching or background flushing.
     */
    @SneakyThrows
    public void appendAll(@NonNull List<? extends LoopEvent> newEvents) {
        if (newEvents.isEmpty()) {
            return;
        }
        final var data = new ByteArrayOutputStream();
        for (final var event : newEvents) {
            data.write((objectMapper.writeValueAsString(event) + System.lineSeparator())
                               .getBytes(StandardCharsets.UTF_8));
        }
        final var stamp = lock.writeLock();
        try {
            if (!FileUtils.write(filePath, data.toByteArray(), true)) {
                throw new IllegalStateException("Failed to write events to file: " + filePath);
            }
            newEvents.forEach(this::index);
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Events recorded for a run, oldest first
     *
     * @param runId Run id. Null or empty returns the events recorded outside any run.
     */
    public List<LoopEvent> readEvents(String runId) {
        final var stamp = lock.readLock();
        try {
            if (Strings.isNullOrEmpty(runId)) {
                return events.stream()
                        .filter(event -> Strings.isNullOrEmpty(event.getRunId()))
                        .toList();
            }
            return List.copyOf(eventsByRun.getOrDefault(runId, List.of()));
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * Events of a given class recorded for a run, oldest first
     */
    public <T extends LoopEvent> List<T> readEvents(String runId, @NonNull Class<T> eventClass) {
        return readEvents(runId)
                .stream()
                .filter(eventClass::isInstance)
                .map(eventClass::cast)
                .toList();
    }

    public List<LoopEvent> readAll() {
        final var stamp = lock.readLock();
        try {
            return List.copyOf(events);
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * @return Ids of all runs that have events, in the order their first event was stored
     */
    public Set<String> runIds() {
        final var stamp = lock.readLock();
        try {
            return new LinkedHashSet<>(eventsByRun.keySet());
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    public int size() {
        final var stamp = lock.readLock();
        try {
            return events.size();
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * Deletes the backing file and clears everything held in memory
     */
    @SneakyThrows
    public boolean purge() {
        final var stamp = lock.writeLock();
        try {
            events.clear();
            eventsByRun.clear();
            final var deleted = Files.deleteIfExists(filePath);
            log.info("Purged event store at {}", filePath);
            return deleted;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    private void index(LoopEvent event) {
        events.add(event);
        if (!Strings.isNullOrEmpty(event.getRunId())) {
            eventsByRun.computeIfAbsent(event.getRunId(), id -> new ArrayList<>()).add(event);
        }
    }

    @SneakyThrows
    private List<LoopEvent> readEventsFromFile() {
        if (!Files.exists(filePath)) {
            return List.of();
        }
        if (!Files.isRegularFile(filePath) || !Files.isReadable(filePath)) {
            throw new IllegalArgumentException("Event file is not a readable file: " + filePath);
        }
        final var loaded = new ArrayList<LoopEvent>();
        final var lineNumber = new AtomicInteger();
        try (final var lines = Files.lines(filePath, StandardCharsets.UTF_8)) {
            lines.forEach(line -> {
                lineNumber.incrementAndGet();
                if (line.isBlank()) {
                    return;
                }
                try {
                    loaded.add(objectMapper.readValue(line, LoopEvent.class));
                }
                catch (Exception e) {
                    throw new IllegalStateException(
                            "Failed to read event at line %d of %s".formatted(lineNumber.get(), filePath), e);
                }
            });
        }
        return loaded;
    }
}
