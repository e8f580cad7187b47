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

import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.errors.FinOrchException;
import com.phonepe.finorch.core.utils.Parameters;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Narrowing criteria shared by bank and card transaction listings. Unset criteria match everything.
 * Amount bounds apply to the magnitude, so a minimum of 100 matches a debit of -150. Category and payment medium
 * matching ignores case.
 */
@Value
@Builder
public class TransactionFilter {
    LocalDate startDate;
    LocalDate endDate;
    @Builder.Default
    Set<String> categories = Set.of();
    BigDecimal minAmount;
    BigDecimal maxAmount;
    @Builder.Default
    Set<String> paymentMediums = Set.of();

    /**
     * Reads start_date, end_date, categories, min_amount, max_amount and payment_mediums
     *
     * @throws FinOrchException with {@link ErrorType#INVALID_PARAMETER} for malformed values or inverted ranges
     */
    public static TransactionFilter from(Map<String, Object> params) {
        final var filter = TransactionFilter.builder()
                .startDate(Parameters.date(params, "start_date").orElse(null))
                .endDate(Parameters.date(params, "end_date").orElse(null))
                .categories(lowerCase(Parameters.strings(params, "categories")))
                .minAmount(Parameters.decimal(params, "min_amount").orElse(null))
                .maxAmount(Parameters.decimal(params, "max_amount").orElse(null))
                .paymentMediums(lowerCase(Parameters.strings(params, "payment_mediums")))
                .build();
        if (filter.startDate != null && filter.endDate != null && filter.endDate.isBefore(filter.startDate)) {
            throw new FinOrchException(FinOrchError.error(ErrorType.INVALID_PARAMETER, "end_date"));
        }
        if (filter.minAmount != null && filter.maxAmount != null && filter.maxAmount.compareTo(filter.minAmount) < 0) {
            throw new FinOrchException(FinOrchError.error(ErrorType.INVALID_PARAMETER, "max_amount"));
        }
        return filter;
    }

    public boolean matches(LocalDate date, String category, BigDecimal amount, String paymentMedium) {
        if ((startDate != null || endDate != null) && date == null) {
            return false;
        }
        if (startDate != null && date.isBefore(startDate)) {
            return false;
        }
        if (endDate != null && date.isAfter(endDate)) {
            return false;
        }
        if (!categories.isEmpty() && (category == null || !categories.contains(category.toLowerCase(Locale.ROOT)))) {
            return false;
        }
        if (!paymentMediums.isEmpty()
                && (paymentMedium == null || !paymentMediums.contains(paymentMedium.toLowerCase(Locale.ROOT)))) {
            return false;
        }
        final var magnitude = amount == null ? BigDecimal.ZERO : amount.abs();
        return (minAmount == null || magnitude.compareTo(minAmount) >= 0)
                && (maxAmount == null || magnitude.compareTo(maxAmount) <= 0);
    }

    private static Set<String> lowerCase(List<String> values) {
        return values.stream()
                .map(String::strip)
                .filter(value -> !value.isEmpty())
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
