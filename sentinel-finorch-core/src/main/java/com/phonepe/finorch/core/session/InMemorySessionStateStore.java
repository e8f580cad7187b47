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

package com.phonepe.finorch.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.finorch.core.utils.JsonUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps session state in a map for the lifetime of the process
 */
@Slf4j
public class InMemorySessionStateStore implements SessionStateStore {
    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;

    public InMemorySessionStateStore() {
        this(null);
    }

    public InMemorySessionStateStore(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    @Override
    public Optional<SessionState> load(@NonNull String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId))
                .map(this::copy);
    }

    @Override
    public SessionState save(@NonNull SessionState state) {
        Objects.requireNonNull(state.getSessionId(), "Session id is required to save session state");
        sessions.put(state.getSessionId(), copy(state));
        log.debug("Saved state for session {}", state.getSessionId());
        return state;
    }

    @Override
    public boolean delete(@NonNull String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    private SessionState copy(SessionState state) {
        return JsonUtils.deepCopy(mapper, state, SessionState.class);
    }
}
