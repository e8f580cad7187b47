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
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A position in a stock, mutual fund or other instrument
 */
@Value
@Builder
@Jacksonized
public class Holding {
    String holdingId;
    String assetType;
    String symbol;
    String name;
    BigDecimal units;
    BigDecimal averageCost;
    BigDecimal currentPrice;
    String currency;

    @JsonIgnore
    public BigDecimal marketValue() {
        return zeroIfNull(units).multiply(zeroIfNull(currentPrice));
    }

    @JsonIgnore
    public BigDecimal costBasis() {
        return zeroIfNull(units).multiply(zeroIfNull(averageCost));
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return Objects.requireNonNullElse(value, BigDecimal.ZERO);
    }
}
