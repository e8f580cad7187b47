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

package com.phonepe.finorch.core.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.errors.FinOrchException;
import com.phonepe.finorch.core.session.SessionState;
import com.phonepe.finorch.core.utils.JsonUtils;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Hands a {@link Plan} from the planning phase to the execution phase through the session state
 */
@Slf4j
public class PlanStore {
    private final ObjectMapper mapper;

    public PlanStore(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    /**
     * Validates the plan and makes it the session's active plan, replacing any earlier one
     *
     * @throws FinOrchException with {@link ErrorType#INVALID_PLAN} if step numbering is broken
     */
    public void store(@NonNull SessionState state, @NonNull Plan plan) {
        plan.validate()
                .ifPresent(problem -> {
                    throw new FinOrchException(FinOrchError.error(ErrorType.INVALID_PLAN, problem));
                });
        state.setActivePlan(plan);
        log.debug("Stored plan with {} steps for session {}", plan.getSteps().size(), state.getSessionId());
    }

    public Optional<Plan> retrieve(@NonNull SessionState state) {
        return Optional.ofNullable(state.getActivePlan());
    }

    /**
     * Removes and returns the active plan. A plan is executed at most once.
     */
    public Optional<Plan> consume(@NonNull SessionState state) {
        final var plan = state.getActivePlan();
        state.setActivePlan(null);
        return Optional.ofNullable(plan);
    }

    @SneakyThrows
    public String toJson(@NonNull Plan plan) {
        return mapper.writeValueAsString(plan);
    }

    /**
     * Reads a plan in its wire form: {@code {"user_query": ..., "steps": [{"step", "description", "query",
     * "target"}]}}
     *
     * @throws FinOrchException with {@link ErrorType#INVALID_PLAN} for malformed json or broken numbering
     */
    public Plan fromJson(@NonNull String json) {
        final Plan plan;
        try {
            plan = mapper.readValue(json, Plan.class);
        }
        catch (JsonProcessingException e) {
            throw new FinOrchException(FinOrchError.error(ErrorType.INVALID_PLAN, e.getOriginalMessage()), e);
        }
        plan.validate()
                .ifPresent(problem -> {
                    throw new FinOrchException(FinOrchError.error(ErrorType.INVALID_PLAN, problem));
                });
        return plan;
    }
}
