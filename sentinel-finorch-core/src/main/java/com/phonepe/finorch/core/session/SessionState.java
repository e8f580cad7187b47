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

import com.phonepe.finorch.core.plan.Plan;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.experimental.Accessors;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the orchestration layer remembers about one conversation. Absence is modelled with null so that
 * "never set" stays distinguishable from an explicit false.
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
public class SessionState {
    private String sessionId;
    private String userId;
    private Boolean identityConfirmed;
    private Plan activePlan;
    private TransferState transfer;
    private Boolean advisoryEnrolled;
    private Map<String, String> preferences = new HashMap<>();
    private long createdAt;
    private long updatedAt;

    public SessionState(@NonNull String sessionId, long createdAt) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public boolean hasConfirmedIdentity() {
        return Boolean.TRUE.equals(identityConfirmed);
    }

    public boolean hasActivePlan() {
        return activePlan != null;
    }

    public boolean hasTransferInProgress() {
        return transfer != null && transfer.isInProgress();
    }

    public Optional<String> preference(String key) {
        return Optional.ofNullable(preferences.get(key));
    }

    public SessionState setPreference(@NonNull String key, @NonNull String value) {
        preferences.put(key, value);
        return this;
    }

    public boolean hasPreference(String key) {
        return preferences.containsKey(key);
    }
}
