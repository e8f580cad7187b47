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

import com.phonepe.finorch.core.errors.ErrorCategory;
import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.intent.IntentResolver;
import com.phonepe.finorch.core.routing.DomainRouter;
import com.phonepe.finorch.core.routing.HandlerResult;
import com.phonepe.finorch.core.session.SessionState;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the session's active plan step by step through the {@link DomainRouter}, then consumes it
 */
@Slf4j
public class PlanExecutor {
    private final PlanStore planStore;
    private final DomainRouter router;
    private final IntentResolver intentResolver;
    private final ResponseSynthesizer synthesizer;

    /**
     * @param intentResolver Used only to pull parameters out of step queries. May be null, in which case steps run
     *                       with no parameters. Resolutions below the router's confidence threshold contribute
     *                       none either.
     * @param synthesizer    Builds the report response. Defaults to {@link StructuredResponseSynthesizer}.
     */
    public PlanExecutor(
            @NonNull PlanStore planStore,
            @NonNull DomainRouter router,
            IntentResolver intentResolver,
            ResponseSynthesizer synthesizer) {
        this.planStore = planStore;
        this.router = router;
        this.intentResolver = intentResolver;
        this.synthesizer = Objects.requireNonNullElseGet(synthesizer, StructuredResponseSynthesizer::new);
    }

    public ExecutionReport execute(@NonNull SessionState state) {
        final var plan = planStore.retrieve(state).orElse(null);
        if (plan == null) {
            log.debug("No plan stored for session {}", state.getSessionId());
            return ExecutionReport.builder()
                    .status(ExecutionReport.Status.NO_PLAN)
                    .error(FinOrchError.error(ErrorType.NO_PLAN_FOUND))
                    .build();
        }
        planStore.consume(state);
        if (plan.isRefusal()) {
            log.info("Plan for session {} refuses the request", state.getSessionId());
            return ExecutionReport.builder()
                    .userQuery(plan.getUserQuery())
                    .status(ExecutionReport.Status.REFUSED)
                    .error(FinOrchError.error(ErrorType.PLAN_REFUSED))
                    .build();
        }
        final var steps = plan.getSteps()
                .stream()
                .sorted(Comparator.comparingInt(PlanStep::getStep))
                .toList();
        final var priorResults = new ArrayList<HandlerResult>();
        final var stepResults = new ArrayList<StepResult>();
        for (final var step : steps) {
            final var result = router.route(step, parameters(state, step), state, List.copyOf(priorResults));
            log.debug("Session {} step {} ({}) finished with {}",
                      state.getSessionId(), step.getStep(), step.getTarget(), result.getStatus());
            priorResults.add(result);
            stepResults.add(new StepResult(step.getStep(), step.getDescription(), step.getTarget(), result));
            if (isIdentityFailure(result)) {
                log.warn("Stopping plan for session {} at step {}: {}",
                         state.getSessionId(), step.getStep(), result.getError().getMessage());
                break;
            }
        }
        return ExecutionReport.builder()
                .userQuery(plan.getUserQuery())
                .status(status(stepResults))
                .stepResults(stepResults)
                .response(synthesizer.synthesize(plan, stepResults))
                .build();
    }

    private Map<String, Object> parameters(SessionState state, PlanStep step) {
        if (intentResolver == null) {
            return Map.of();
        }
        return router.parameters(intentResolver.resolve(state, step.getQuery()));
    }

    private static boolean isIdentityFailure(HandlerResult result) {
        return result.getStatus() == HandlerResult.Status.FAILED
                && result.getError() != null
                && result.getError().getErrorType().getCategory() == ErrorCategory.IDENTITY;
    }

    private static ExecutionReport.Status status(List<StepResult> stepResults) {
        final var succeeded = stepResults.stream()
                .map(StepResult::getResult)
                .filter(result -> result.isOk() || result.getStatus() == HandlerResult.Status.AWAITING_INPUT)
                .count();
        if (succeeded == stepResults.size()) {
            return ExecutionReport.Status.COMPLETED;
        }
        return succeeded == 0 ? ExecutionReport.Status.FAILED : ExecutionReport.Status.PARTIAL;
    }
}
