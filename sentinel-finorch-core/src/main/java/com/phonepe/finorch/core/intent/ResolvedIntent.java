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

package com.phonepe.finorch.core.intent;

import com.phonepe.finorch.core.routing.Domain;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Objects;

/**
 * Structured result of resolving free-form input
 */
@Value
public class ResolvedIntent {
    Domain domain;
    /**
     * Extracted parameters, for example "operation", "account_id" or "amount"
     */
    Map<String, Object> parameters;
    double confidence;

    @Builder
    @Jacksonized
    public ResolvedIntent(Domain domain, Map<String, Object> parameters, double confidence) {
        this.domain = Objects.requireNonNullElse(domain, Domain.OUT_OF_SCOPE);
        this.parameters = Objects.requireNonNullElseGet(parameters, Map::of);
        this.confidence = confidence;
    }

    public static ResolvedIntent outOfScope() {
        return new ResolvedIntent(Domain.OUT_OF_SCOPE, Map.of(), 1.0);
    }
}
