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

import java.util.Optional;

/**
 * Storage for {@link SessionState}. Implementations hand out independent copies: changes made by a caller become
 * visible to others only once saved, and no two sessions ever share a mutable object.
 */
public interface SessionStateStore {
    Optional<SessionState> load(String sessionId);

    SessionState save(SessionState state);

    boolean delete(String sessionId);

    /**
     * Returns the stored state, or a fresh unsaved one stamped with the given creation time
     */
    default SessionState loadOrCreate(String sessionId, long createdAt) {
        return load(sessionId).orElseGet(() -> new SessionState(sessionId, createdAt));
    }

    default SessionState loadOrCreate(String sessionId) {
        return loadOrCreate(sessionId, System.currentTimeMillis());
    }
}
