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

package com.phonepe.agentloop.filesystem.utils;

import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Makes sure the given path is a usable directory. Creates it when asked to.
     *
     * @param path              Directory path
     * @param createIfNotExists Create the directory (and parents) if it is missing
     * @param writeCheck        Fail if the directory exists but is not writable
     * @return Absolute, normalized path of the directory
     * @throws IllegalArgumentException if the path is not a directory or lacks the required permissions
     */
    public static Path ensurePath(String path, boolean createIfNotExists, boolean writeCheck) {
        final var absolutePath = Path.of(path).toAbsolutePath().normalize();
        if (Files.exists(absolutePath)) {
            if (!Files.isDirectory(absolutePath)
                    || !Files.isReadable(absolutePath)
                    || (writeCheck && !Files.isWritable(absolutePath))) {
                throw new IllegalArgumentException(
                        "Sanity check for %s failed. Please check it is a directory with the required permissions"
                                .formatted(absolutePath));
            }
            return absolutePath;
        }
        if (!createIfNotExists) {
            throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
        }
        try {
            Files.createDirectories(absolutePath);
            log.info("Created directory {}", absolutePath);
        }
        catch (Exception e) {
            throw new IllegalArgumentException("Failed to create directory: " + absolutePath, e);
        }
        return absolutePath;
    }

    /**
     * Writes data to a file, creating it if needed.
     *
     * @param filePath Target file
     * @param data     Bytes to write
     * @param append   Append to the file if true, truncate it otherwise
     * @return true once the data has been written
     */
    @SneakyThrows
    public static boolean write(Path filePath, byte[] data, boolean append) {
        final StandardOpenOption[] options = append
                ? new StandardOpenOption[]{
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND
                }
                : new StandardOpenOption[]{
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING
                };
        Files.write(filePath, data, options);
        return true;
    }
}
