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

package com.phonepe.finorch.core.routing;

import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Verticals a request can be routed to
 */
@Getter
public enum Domain {
    BANKING(Set.of("banking", "bank", "accounts", "account")),
    CARDS(Set.of("cards", "card", "credit_card", "credit_cards")),
    INVESTMENTS(Set.of("investments", "investment", "stocks", "mutual_fund", "mutual_funds", "holdings")),
    CROSS_DOMAIN(Set.of("cross_domain", "aggregation", "aggregate", "portfolio_analysis")),
    ADVISORY(Set.of("advisory", "advisor")),
    FUNDS_TRANSFER(Set.of("funds_transfer", "transfer", "money_transfer")),
    GENERAL_KNOWLEDGE(Set.of("general_knowledge", "general", "knowledge")),
    OUT_OF_SCOPE(Set.of("out_of_scope")),
    ;

    private final Set<String> labels;

    Domain(Set<String> labels) {
        this.labels = labels;
    }

    /**
     * Lenient lookup of a handler label as produced by a planner. Separators and common suffixes like
     * "_agent" or "_tool" are ignored, so "banking_agent" and "Funds-Transfer" both resolve.
     */
    public static Optional<Domain> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        final var normalized = normalize(label);
        return Arrays.stream(values())
                .filter(domain -> domain.labels.contains(normalized))
                .findFirst();
    }

    private static String normalize(String label) {
        var value = label.strip()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[\\s-]+", "_");
        boolean stripped;
        do {
            stripped = false;
            for (final var suffix : new String[]{"_tool", "_agent", "_handler"}) {
                if (value.endsWith(suffix)) {
                    value = value.substring(0, value.length() - suffix.length());
                    stripped = true;
                }
            }
        } while (stripped);
        return value;
    }
}
