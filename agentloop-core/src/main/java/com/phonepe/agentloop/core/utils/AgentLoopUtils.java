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

package com.phonepe.agentloop.core.utils;

import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 *
 */
@UtilityClass
public class AgentLoopUtils {

    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Strips the wrappers added by {@link java.util.concurrent.CompletableFuture} plumbing
     */
    public static Throwable unwrap(final Throwable throwable) {
        var current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static String errorMessage(final Throwable throwable) {
        final var root = rootCause(throwable);
        return Objects.requireNonNullElseGet(root.getMessage(), () -> root.getClass().getSimpleName());
    }

    public static <T, R> R getIfNotNull(T value, Function<T, R> mapper, R defaultValue) {
        return null == value ? defaultValue : mapper.apply(value);
    }

    public static String newId(final String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }
}
