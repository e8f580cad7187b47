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

package com.phonepe.finorch.core.transfer;

import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.model.Payee;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * What happened on one interaction with the {@link TransferSaga}
 */
@Value
@Builder(access = AccessLevel.PACKAGE)
public class TransferOutcome {
    public enum Status {
        AWAITING_INPUT,
        COMPLETED,
        ABORTED,
        FAILED,
    }

    Status status;
    TransferStage stage;
    InputKind awaiting;
    FinOrchError error;

    String payeeId;
    String payeeName;
    String accountId;
    BigDecimal amount;
    String currency;

    /**
     * Payees to choose from: the matching payees while a choice is pending, or every payee when none matched
     */
    List<Payee> payees;
    /**
     * Account ids to choose from when the given source account was not found
     */
    List<String> accountIds;
    TransferReceipt receipt;

    public boolean isAwaitingInput() {
        return status == Status.AWAITING_INPUT;
    }

    public String getTransferId() {
        return receipt == null ? null : receipt.getTransferId();
    }
}
