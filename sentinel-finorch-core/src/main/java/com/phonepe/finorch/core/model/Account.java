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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A ledger row for one of the user's accounts
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class Account {
    public static final String DEFAULT_CURRENCY = "INR";

    String accountId;
    String type;
    String currency;
    BigDecimal balance;
    /**
     * Spendable figure. When present this is authoritative, ledger balance is only a fallback.
     */
    BigDecimal availableBalance;
    String nickname;
    Instant lastUpdated;

    @JsonIgnore
    public BigDecimal spendable() {
        return Objects.requireNonNullElse(availableBalance, Objects.requireNonNullElse(balance, BigDecimal.ZERO));
    }

    @JsonIgnore
    public String currencyOrDefault() {
        return Objects.requireNonNullElse(currency, DEFAULT_CURRENCY);
    }
}
