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

import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.repository.Repository;
import com.phonepe.finorch.core.session.SessionState;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a turn may proceed to domain logic. This is a pure function of the session state and the
 * repository contents; it never modifies the session and can be run any number of times.
 */
@Slf4j
public class IdentityGate {
    private final Repository repository;

    public IdentityGate(@NonNull Repository repository) {
        this.repository = repository;
    }

    public GateOutcome check(@NonNull SessionState state) {
        if (!state.hasConfirmedIdentity()) {
            log.debug("Identity not confirmed for session {}", state.getSessionId());
            return GateOutcome.askForIdentity();
        }
        final var userId = state.getUserId();
        if (userId == null || userId.isBlank()) {
            return reject(state, ErrorType.MISSING, userId);
        }
        if (!UserIds.isWellFormed(userId)) {
            return reject(state, ErrorType.INVALID_FORMAT, userId);
        }
        if (!repository.userExists(userId)) {
            return reject(state, ErrorType.USER_NOT_FOUND, userId);
        }
        if (!repository.hasAccountsRecord(userId)) {
            return reject(state, ErrorType.ACCOUNTS_NOT_FOUND, userId);
        }
        return GateOutcome.pass();
    }

    private static GateOutcome reject(SessionState state, ErrorType reason, String userId) {
        log.warn("Rejecting user id {} for session {}. Reason: {}", userId, state.getSessionId(), reason);
        return GateOutcome.rejected(reason, userId);
    }
}
