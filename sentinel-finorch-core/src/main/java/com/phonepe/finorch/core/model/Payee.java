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

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A saved transfer counterparty
 */
@Value
@Builder
@Jacksonized
public class Payee {
    String payeeId;
    String name;
    List<String> alias;
    String bank;
    String accountNumber;

    /**
     * Case-insensitive substring match against name and every alias. Blank queries match nothing.
     */
    public boolean matches(String query) {
        final var normalized = Objects.requireNonNullElse(query, "").strip().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return false;
        }
        if (name != null && name.toLowerCase(Locale.ROOT).contains(normalized)) {
            return true;
        }
        return alias != null && alias.stream()
                .filter(Objects::nonNull)
                .anyMatch(a -> a.toLowerCase(Locale.ROOT).contains(normalized));
    }
}
