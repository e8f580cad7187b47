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

package com.phonepe.finorch.filesystem.repository;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.finorch.core.model.Account;
import com.phonepe.finorch.core.model.TransactionRecord;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * A transfer commit that has been started but not yet confirmed complete. Holds the account row before and after
 * the transfer, so recovery can tell whether the entry still applies and applying it twice has the same effect as
 * applying it once.
 */
@Value
@Builder
@Jacksonized
public class JournalEntry {
    public enum Status {
        /**
         * Commit in flight. Rolled forward on recovery.
         */
        COMMITTING,
        /**
         * Commit failed and was reported as such, but the previous files could not be restored. Rolled back on
         * recovery.
         */
        ROLLING_BACK,
    }

    String transferId;
    String userId;
    Account previousAccount;
    Account account;
    TransactionRecord record;
    @With
    Status status;
    long createdAt;

    @JsonIgnore
    public boolean isRollingBack() {
        return status == Status.ROLLING_BACK;
    }
}
