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

import com.phonepe.finorch.core.utils.Parameters;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Values supplied by the caller on one turn of a transfer. Every field is optional. Currency codes are
 * upper-cased, account currencies are compared exactly.
 */
@Value
@Builder
public class TransferInput {
    public static final TransferInput EMPTY = TransferInput.builder().build();

    String payeeQuery;
    String payeeId;
    String accountId;
    BigDecimal amount;
    String currency;
    String reference;
    /**
     * Answer to whichever confirmation the transfer is currently waiting on
     */
    Boolean confirm;
    boolean cancel;

    public static TransferInput fromParameters(Map<String, Object> params) {
        return TransferInput.builder()
                .payeeQuery(Parameters.string(params, "payee_query")
                                    .or(() -> Parameters.string(params, "payee"))
                                    .orElse(null))
                .payeeId(Parameters.string(params, "payee_id").orElse(null))
                .accountId(Parameters.string(params, "account_id").orElse(null))
                .amount(Parameters.decimal(params, "amount").orElse(null))
                .currency(Parameters.string(params, "currency")
                                  .map(code -> code.toUpperCase(Locale.ROOT))
                                  .orElse(null))
                .reference(Parameters.string(params, "reference").orElse(null))
                .confirm(Parameters.bool(params, "confirm").orElse(null))
                .cancel(Parameters.bool(params, "cancel").orElse(false))
                .build();
    }
}
