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

package com.phonepe.finorch.filesystem.utils;

import com.phonepe.finorch.core.errors.PersistenceException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

@UtilityClass
@Slf4j
public class FileUtils {
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    /**
     * Ensures that the provided path exists and is a readable, writable directory. If the path does not exist and
     * createIfNotExists is true, it will attempt to create the directory.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is not a usable directory, or does not exist and creation was
     *                                  not requested.
     * @throws PersistenceException     If the directory could not be created.
     */
    public static Path ensurePath(String path, boolean createIfNotExists) {
        final var absolutePath = Path.of(path).toAbsolutePath().normalize();
        if (Files.exists(absolutePath)) {
            if (!Files.isDirectory(absolutePath)
                    || !Files.isReadable(absolutePath)
                    || !Files.isWritable(absolutePath)) {
                throw new IllegalArgumentException(
                        "Sanity check for %s Failed. Please check it exists and has the required permissions"
                                .formatted(absolutePath));
            }
        }
        else if (createIfNotExists) {
            try {
                Files.createDirectories(absolutePath);
            }
            catch (IOException e) {
                throw new PersistenceException("Failed to create directory: " + absolutePath, e);
            }
        }
        else {
            throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
        }
        return absolutePath;
    }

    /**
     * Writes data to a temporary file in the target directory and moves it over the target. Readers see either the
     * old contents or the new ones, never a partial file.
     *
     * @param filePath The path of the file to write to.
     * @param data     The byte array data to write.
     * @throws IOException if the data could not be written or moved into place
     */
    public static void writeAtomically(Path filePath, byte[] data) throws IOException {
        final var directory = filePath.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        final var temp = Files.createTempFile(directory, "." + filePath.getFileName(), ".tmp");
        try {
            Files.write(temp, data);
            try {
                Files.move(temp, filePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
            catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", filePath);
                Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * @return File contents, empty if the file does not exist
     */
    public static Optional<byte[]> readIfExists(Path filePath) throws IOException {
        if (!Files.exists(filePath, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(filePath));
    }

    /**
     * Puts a file back to an earlier state. Null contents mean the file did not exist before.
     */
    public static void restore(Path filePath, byte[] previousContents) throws IOException {
        if (previousContents == null) {
            Files.deleteIfExists(filePath);
        }
        else {
            writeAtomically(filePath, previousContents);
        }
    }

    /**
     * Checks that an id can be used as a single path segment: no separators, no leading dot.
     */
    public static boolean isSafeName(String name) {
        return name != null && SAFE_NAME.matcher(name).matches();
    }
}
