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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * An ordered list of steps produced once for a user request. A plan with no steps is an explicit refusal and is
 * different from having no plan at all.
 */
@Value
@Builder
@Jacksonized
public class Plan {
    String userQuery;
    @Singular
    List<PlanStep> steps;

    public static Plan refusal(String userQuery) {
        return Plan.builder()
                .userQuery(userQuery)
                .build();
    }

    @JsonIgnore
    public boolean isRefusal() {
        return steps.isEmpty();
    }

    /**
     * Checks that steps are numbered 1..n with no gaps, in order.
     *
     * @return Description of the first problem found, empty if the plan is well formed
     */
    public Optional<String> validate() {
        for (int i = 0; i < steps.size(); i++) {
            final var step = steps.get(i);
            if (step == null) {
                return Optional.of("step at position %d is null".formatted(i + 1));
            }
            if (step.getStep() != i + 1) {
                return Optional.of("expected step %d at position %d but found %d"
                                           .formatted(i + 1, i + 1, step.getStep()));
            }
        }
        return Optional.empty();
    }
}
