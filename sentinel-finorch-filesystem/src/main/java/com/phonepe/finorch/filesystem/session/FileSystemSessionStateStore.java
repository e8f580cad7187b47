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

package com.phonepe.finorch.filesystem.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.finorch.core.errors.PersistenceException;
import com.phonepe.finorch.core.session.SessionState;
import com.phonepe.finorch.core.session.SessionStateStore;
import com.phonepe.finorch.core.utils.JsonUtils;
import com.phonepe.finorch.filesystem.utils.FileUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;

/**
 * Stores each session's state as {@code <session_id>.json} under a directory, with a bounded cache of recently
 * used sessions in front of it
 */
@Slf4j
public class FileSystemSessionStateStore implements SessionStateStore {
    public static final int DEFAULT_CACHE_SIZE = 256;

    private static final String JSON_SUFFIX = ".json";

    private final Path sessionRoot;
    private final ObjectMapper mapper;
    private final Map<String, SessionState> cache;
    private final StampedLock cacheLock = new StampedLock();

    public FileSystemSessionStateStore(@NonNull String sessionDir, ObjectMapper mapper) {
        this(sessionDir, mapper, DEFAULT_CACHE_SIZE);
    }

    public FileSystemSessionStateStore(@NonNull String sessionDir, ObjectMapper mapper, int cacheSize) {
        final var maxEntries = cacheSize > 0 ? cacheSize : DEFAULT_CACHE_SIZE;
        this.cache = new LinkedHashMap<>(maxEntries, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SessionState> eldest) {
                return size() > maxEntries;
            }
        };
        this.sessionRoot = FileUtils.ensurePath(sessionDir, true);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    @Override
    public Optional<SessionState> load(@NonNull String sessionId) {
        final var file = sessionFile(sessionId);
        //Access ordered map, so even a cache hit modifies it
        final var stamp = cacheLock.writeLock();
        try {
            var state = cache.get(sessionId);
            if (state == null) {
                state = readFile(sessionId, file);
                if (state == null) {
                    return Optional.empty();
                }
                cache.put(sessionId, state);
            }
            return Optional.of(copy(state));
        }
        finally {
            cacheLock.unlockWrite(stamp);
        }
    }

    @Override
    public SessionState save(@NonNull SessionState state) {
        final var sessionId = Objects.requireNonNull(state.getSessionId(),
                                                     "Session id is required to save session state");
        final var file = sessionFile(sessionId);
        final var snapshot = copy(state);
        final var stamp = cacheLock.writeLock();
        try {
            FileUtils.writeAtomically(file, mapper.writeValueAsBytes(snapshot));
            cache.put(sessionId, snapshot);
        }
        catch (IOException e) {
            throw new PersistenceException("Could not save state of session " + sessionId, e);
        }
        finally {
            cacheLock.unlockWrite(stamp);
        }
        log.debug("Saved state for session {} to {}", sessionId, file);
        return state;
    }

    @Override
    public boolean delete(@NonNull String sessionId) {
        final var file = sessionFile(sessionId);
        final var stamp = cacheLock.writeLock();
        try {
            cache.remove(sessionId);
            return Files.deleteIfExists(file);
        }
        catch (IOException e) {
            throw new PersistenceException("Could not delete state of session " + sessionId, e);
        }
        finally {
            cacheLock.unlockWrite(stamp);
        }
    }

    private SessionState readFile(String sessionId, Path file) {
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            return null;
        }
        try {
            return mapper.readValue(file.toFile(), SessionState.class);
        }
        catch (IOException e) {
            throw new PersistenceException("Could not read state of session " + sessionId, e);
        }
    }

    private Path sessionFile(String sessionId) {
        if (!FileUtils.isSafeName(sessionId)) {
            throw new IllegalArgumentException("Session id cannot be used as a file name: " + sessionId);
        }
        return sessionRoot.resolve(sessionId + JSON_SUFFIX);
    }

    private SessionState copy(SessionState state) {
        return JsonUtils.deepCopy(mapper, state, SessionState.class);
    }
}
