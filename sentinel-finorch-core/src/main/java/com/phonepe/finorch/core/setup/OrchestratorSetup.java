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

package com.phonepe.finorch.core.setup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.finorch.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Tunables shared by the gate, router, saga and orchestrator. Anything left unset falls back to a default.
 */
@Value
@With
public class OrchestratorSetup {
    public static final double DEFAULT_MIN_INTENT_CONFIDENCE = 0.5;
    public static final Duration DEFAULT_TRANSFER_IDLE_TIMEOUT = Duration.ofMinutes(15);
    public static final Set<String> DEFAULT_REVOLVING_CREDIT_TYPES = Set.of("CREDIT_CARD");
    public static final String DEFAULT_TRANSFER_METHOD = "NEFT";
    public static final String DEFAULT_TRANSFER_CATEGORY = "Transfer";
    public static final int DEFAULT_LOCK_STRIPES = 64;
    public static final OrchestratorSetup DEFAULT = OrchestratorSetup.builder().build();

    /**
     * Mapper used for copies and serialization. Must use snake_case naming, see {@link JsonUtils#createMapper()}.
     */
    ObjectMapper mapper;

    /**
     * Source of time for ids, record dates and idle expiry
     */
    Clock clock;

    /**
     * Resolved intents below this confidence are treated as out of scope
     */
    double minIntentConfidence;

    /**
     * A suspended transfer with no interaction for this long is discarded on the next turn
     */
    Duration transferIdleTimeout;

    /**
     * Account types whose ledger balance is left untouched by a transfer. Only available balance moves for these.
     */
    Set<String> revolvingCreditTypes;

    String transferMethod;

    String transferCategory;

    /**
     * Number of lock stripes used for per-account and per-session serialization
     */
    int lockStripes;

    @Builder
    public OrchestratorSetup(
            ObjectMapper mapper,
            Clock clock,
            double minIntentConfidence,
            Duration transferIdleTimeout,
            Set<String> revolvingCreditTypes,
            String transferMethod,
            String transferCategory,
            int lockStripes) {
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.minIntentConfidence = minIntentConfidence <= 0 ? DEFAULT_MIN_INTENT_CONFIDENCE : minIntentConfidence;
        this.transferIdleTimeout = Objects.requireNonNullElse(transferIdleTimeout, DEFAULT_TRANSFER_IDLE_TIMEOUT);
        this.revolvingCreditTypes = Objects.requireNonNullElse(revolvingCreditTypes, DEFAULT_REVOLVING_CREDIT_TYPES);
        this.transferMethod = Objects.requireNonNullElse(transferMethod, DEFAULT_TRANSFER_METHOD);
        this.transferCategory = Objects.requireNonNullElse(transferCategory, DEFAULT_TRANSFER_CATEGORY);
        this.lockStripes = lockStripes <= 0 ? DEFAULT_LOCK_STRIPES : lockStripes;
    }
}
