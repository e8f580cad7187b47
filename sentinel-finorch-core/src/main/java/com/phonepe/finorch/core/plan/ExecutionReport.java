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

import com.phonepe.finorch.core.errors.FinOrchError;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of executing a stored plan
 */
@Value
@Builder
public class ExecutionReport {
    public enum Status {
        /**
         * Every step produced a result
         */
        COMPLETED,
        /**
         * Some steps failed or were out of scope
         */
        PARTIAL,
        FAILED,
        /**
         * The plan had no steps
         */
        REFUSED,
        NO_PLAN,
    }

    String userQuery;
    Status status;
    @Singular
    List<StepResult> stepResults;
    Object response;
    FinOrchError error;
}
