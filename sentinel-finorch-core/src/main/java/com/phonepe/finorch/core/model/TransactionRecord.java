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

package com.phonepe.finorch.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One posted entry in an account's transaction list. Amount is signed, debits are negative.
 */
@Value
@Builder
@Jacksonized
public class TransactionRecord {
    String id;
    LocalDate date;
    String description;
    String category;
    BigDecimal amount;
    String currency;
    String method;
    String status;
    /**
     * Account spendable balance right after this record was applied
     */
    BigDecimal runningBalance;
    String counterparty;
}
