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

package com.phonepe.finorch.core.handlers;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Transactions over a trailing window, grouped by one attribute
 */
@Value
@Builder
public class TransactionSummary {
    @Value
    public static class Group {
        String key;
        BigDecimal total;
        int count;
    }

    int days;
    String groupBy;
    BigDecimal totalCredits;
    BigDecimal totalDebits;
    int transactionCount;
    /**
     * Sorted by absolute total, largest first
     */
    @Singular
    List<Group> groups;
}
