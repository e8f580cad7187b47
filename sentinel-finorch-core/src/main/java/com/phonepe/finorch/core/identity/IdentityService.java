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

package com.phonepe.finorch.core.identity;

import com.phonepe.finorch.core.session.SessionState;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Explicit identity changes on a session: login with a claimed user id, logout and status lookup.
 * Validation itself is delegated to the {@link IdentityGate}.
 */
@Slf4j
public class IdentityService {
    private final IdentityGate gate;

    public IdentityService(@NonNull IdentityGate gate) {
        this.gate = gate;
    }

    /**
     * Records the claimed id and confirms it if it passes the gate. A rejected claim leaves the session
     * explicitly unconfirmed, so the next turn asks for an identity again.
     */
    public GateOutcome login(@NonNull SessionState state, String claimedUserId) {
        final var userId = claimedUserId == null ? null : claimedUserId.strip();
        if (state.hasConfirmedIdentity() && !Objects.equals(userId, state.getUserId())) {
            //Switching users, drop everything tied to the previous one
            clearUserScopedState(state);
        }
        state.setUserId(userId);
        state.setIdentityConfirmed(true);
        final var outcome = gate.check(state);
        if (!outcome.passed()) {
            state.setIdentityConfirmed(false);
            return outcome;
        }
        log.info("Session {} logged in as {}", state.getSessionId(), userId);
        return outcome;
    }

    public void logout(@NonNull SessionState state) {
        log.info("Session {} logging out user {}", state.getSessionId(), state.getUserId());
        state.setUserId(null);
        state.setIdentityConfirmed(false);
        clearUserScopedState(state);
    }

    public LoginStatus status(@NonNull SessionState state) {
        return new LoginStatus(state.hasConfirmedIdentity(), state.getUserId());
    }

    private static void clearUserScopedState(SessionState state) {
        state.setActivePlan(null);
        state.setTransfer(null);
        state.setAdvisoryEnrolled(null);
    }
}
