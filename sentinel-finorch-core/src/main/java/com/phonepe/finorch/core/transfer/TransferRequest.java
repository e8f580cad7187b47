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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A fully confirmed transfer, ready for {@link TransferLedger#commit(TransferRequest)}
 */
@Value
@Builder
public class TransferRequest {
    @NonNull
    String userId;
    @NonNull
    String accountId;
    String payeeId;
    @NonNull
    String payeeName;
    BigDecimal amount;
    /**
     * Requested currency. Null means the account's own currency.
     */
    String currency;
    String reference;
}
