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

package com.phonepe.finorch.core.utils;

import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.errors.FinOrchException;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed reads over the loosely typed parameter maps produced by intent resolution.
 * Malformed values raise {@link ErrorType#INVALID_PARAMETER}.
 */
@UtilityClass
public class Parameters {

    public static Optional<String> string(Map<String, Object> params, String name) {
        return Optional.ofNullable(params)
                .map(p -> p.get(name))
                .map(Object::toString)
                .map(String::strip)
                .filter(value -> !value.isEmpty());
    }

    public static int integer(Map<String, Object> params, String name, int defaultValue) {
        final var raw = params == null ? null : params.get(name);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(raw.toString().strip());
        }
        catch (NumberFormatException e) {
            throw invalid(name, e);
        }
    }

    public static Optional<BigDecimal> decimal(Map<String, Object> params, String name) {
        final var raw = params == null ? null : params.get(name);
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        try {
            return Optional.of(new BigDecimal(raw.toString().strip()));
        }
        catch (NumberFormatException e) {
            throw invalid(name, e);
        }
    }

    /**
     * Reads an ISO date such as 2025-06-01
     */
    public static Optional<LocalDate> date(Map<String, Object> params, String name) {
        final var raw = params == null ? null : params.get(name);
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof LocalDate localDate) {
            return Optional.of(localDate);
        }
        try {
            return Optional.of(LocalDate.parse(raw.toString().strip()));
        }
        catch (DateTimeParseException e) {
            throw invalid(name, e);
        }
    }

    public static Optional<Boolean> bool(Map<String, Object> params, String name) {
        final var raw = params == null ? null : params.get(name);
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Boolean b) {
            return Optional.of(b);
        }
        final var text = raw.toString().strip().toLowerCase();
        return switch (text) {
            case "true", "yes", "y" -> Optional.of(true);
            case "false", "no", "n" -> Optional.of(false);
            default -> throw invalid(name, null);
        };
    }

    public static List<String> strings(Map<String, Object> params, String name) {
        final var raw = params == null ? null : params.get(name);
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof Collection<?> values) {
            return values.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
        }
        return List.of(raw.toString());
    }

    private static FinOrchException invalid(String name, Throwable cause) {
        final var error = FinOrchError.error(ErrorType.INVALID_PARAMETER, name);
        return cause == null ? new FinOrchException(error) : new FinOrchException(error, cause);
    }
}
