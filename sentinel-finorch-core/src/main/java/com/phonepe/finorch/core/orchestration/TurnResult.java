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

package com.phonepe.finorch.core.orchestration;

import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.identity.GateOutcome;
import com.phonepe.finorch.core.plan.ExecutionReport;
import com.phonepe.finorch.core.plan.Plan;
import com.phonepe.finorch.core.routing.HandlerResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TurnResult {
    String sessionId;
    TurnStatus status;
    GateOutcome gateOutcome;
    /**
     * The plan made for this turn, if planning ran
     */
    Plan plan;
    ExecutionReport report;
    /**
     * Result of continuing a suspended funds transfer
     */
    HandlerResult transfer;
    FinOrchError error;
}
