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

import com.phonepe.finorch.core.routing.HandlerResult;
import lombok.Value;

import java.util.List;

/**
 * Default synthesizer. Collects step outputs as is, without adding any text of its own.
 */
public class StructuredResponseSynthesizer implements ResponseSynthesizer {

    @Value
    public static class StructuredResponse {
        String userQuery;
        int succeeded;
        int failed;
        List<StepResult> steps;
    }

    @Override
    public Object synthesize(Plan plan, List<StepResult> stepResults) {
        final var succeeded = (int) stepResults.stream()
                .filter(result -> result.getResult().getStatus() == HandlerResult.Status.OK
                        || result.getResult().getStatus() == HandlerResult.Status.AWAITING_INPUT)
                .count();
        return new StructuredResponse(plan.getUserQuery(),
                                      succeeded,
                                      stepResults.size() - succeeded,
                                      List.copyOf(stepResults));
    }
}
