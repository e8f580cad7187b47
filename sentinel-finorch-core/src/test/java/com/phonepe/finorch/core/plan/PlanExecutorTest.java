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

import com.phonepe.finorch.core.TestData;
import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.handlers.BankingHandler;
import com.phonepe.finorch.core.handlers.CrossDomainHandler;
import com.phonepe.finorch.core.handlers.CrossDomainReport;
import com.phonepe.finorch.core.handlers.InvestmentsHandler;
import com.phonepe.finorch.core.intent.IntentResolver;
import com.phonepe.finorch.core.intent.ResolvedIntent;
import com.phonepe.finorch.core.routing.Domain;
import com.phonepe.finorch.core.routing.DomainRouter;
import com.phonepe.finorch.core.routing.HandlerResult;
import com.phonepe.finorch.core.utils.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlanExecutorTest {
    private PlanStore planStore;
    private DomainRouter router;
    private IntentResolver resolver;

    @BeforeEach
    void setUp() {
        final var setup = TestData.setup();
        planStore = new PlanStore(JsonUtils.createMapper());
        router = new DomainRouter(TestData.repository(),
                                  setup,
                                  List.of(new BankingHandler(setup),
                                          new InvestmentsHandler(setup),
                                          new CrossDomainHandler(setup)));
        resolver = (state, input) -> switch (input) {
            case "show balance of all accounts" -> ResolvedIntent.builder()
                    .domain(Domain.BANKING)
                    .parameters(Map.of("operation", "balance"))
                    .confidence(0.9)
                    .build();
            case "summarize my holdings" -> ResolvedIntent.builder()
                    .domain(Domain.INVESTMENTS)
                    .parameters(Map.of("operation", "holdings_summary"))
                    .confidence(0.9)
                    .build();
            default -> ResolvedIntent.outOfScope();
        };
    }

    @Test
    void testNoPlanProducesNoActions() {
        final var mockRouter = mock(DomainRouter.class);
        final var executor = new PlanExecutor(planStore, mockRouter, resolver, null);
        final var report = executor.execute(TestData.session(TestData.ALICE));
        assertAll(
                () -> assertEquals(ExecutionReport.Status.NO_PLAN, report.getStatus()),
                () -> assertEquals(ErrorType.NO_PLAN_FOUND, report.getError().getErrorType()),
                () -> assertTrue(report.getStepResults().isEmpty())
        );
        verify(mockRouter, never()).route(any(PlanStep.class), any(), any(), any());
        verify(mockRouter, never()).dispatch(any(), any());
    }

    @Test
    void testEmptyPlanIsRefusedWithoutActions() {
        final var mockRouter = mock(DomainRouter.class);
        final var mockResolver = mock(IntentResolver.class);
        final var executor = new PlanExecutor(planStore, mockRouter, mockResolver, null);
        final var state = TestData.session(TestData.ALICE);
        planStore.store(state, Plan.refusal("write me a poem"));
        final var report = executor.execute(state);
        assertAll(
                () -> assertEquals(ExecutionReport.Status.REFUSED, report.getStatus()),
                () -> assertEquals(ErrorType.PLAN_REFUSED, report.getError().getErrorType()),
                () -> assertEquals("write me a poem", report.getUserQuery()),
                () -> assertNull(state.getActivePlan())
        );
        verify(mockRouter, never()).route(any(PlanStep.class), any(), any(), any());
        verify(mockResolver, never()).resolve(any(), anyString());
    }

    @Test
    void testLowConfidenceParametersAreIgnored() {
        final IntentResolver unsure = (state, input) -> ResolvedIntent.builder()
                .domain(Domain.BANKING)
                .parameters(Map.of("operation", "close_all_accounts"))
                .confidence(0.1)
                .build();
        final var executor = new PlanExecutor(planStore, router, unsure, null);
        final var state = TestData.session(TestData.ALICE);
        planStore.store(state, Plan.builder()
                .userQuery("what do I have")
                .step(PlanStep.builder()
                              .step(1)
                              .description("List accounts")
                              .query("what do I have")
                              .target("banking")
                              .build())
                .build());
        final var result = executor.execute(state).getStepResults().get(0).getResult();
        assertAll(
                () -> assertEquals(HandlerResult.Status.OK, result.getStatus()),
                () -> assertEquals(2, ((List<?>) result.getData()).size())
        );
    }

    @Test
    void testStepsRunInOrderAndPlanIsConsumed() {
        final var executor = new PlanExecutor(planStore, router, resolver, null);
        final var state = TestData.session(TestData.ALICE);
        planStore.store(state, PlanStoreTest.twoStepPlan());
        final var report = executor.execute(state);
        assertAll(
                () -> assertEquals(ExecutionReport.Status.COMPLETED, report.getStatus()),
                () -> assertEquals(2, report.getStepResults().size()),
                () -> assertEquals(1, report.getStepResults().get(0).getStep()),
                () -> assertEquals(Domain.BANKING, report.getStepResults().get(0).getResult().getDomain()),
                () -> assertEquals(Domain.INVESTMENTS, report.getStepResults().get(1).getResult().getDomain()),
                () -> assertNull(state.getActivePlan()),
                () -> assertTrue(report.getResponse()
                                         instanceof StructuredResponseSynthesizer.StructuredResponse)
        );
        final var second = executor.execute(state);
        assertEquals(ExecutionReport.Status.NO_PLAN, second.getStatus());
    }

    @Test
    void testLaterStepsSeeEarlierResults() {
        final var executor = new PlanExecutor(planStore, router, resolver, null);
        final var state = TestData.session(TestData.ALICE);
        final var plan = Plan.builder()
                .userQuery("Give me my overall financial picture")
                .steps(PlanStoreTest.twoStepPlan().getSteps())
                .step(PlanStep.builder()
                              .step(3)
                              .description("Combine")
                              .query("combine the results")
                              .target("cross_domain")
                              .build())
                .build();
        planStore.store(state, plan);
        final var report = executor.execute(state);
        final var combined = (CrossDomainReport) report.getStepResults().get(2).getResult().getData();
        assertAll(
                () -> assertEquals(ExecutionReport.Status.COMPLETED, report.getStatus()),
                () -> assertEquals(2, combined.getContributingSteps()),
                () -> assertEquals(List.of(Domain.BANKING, Domain.INVESTMENTS), combined.getDomains())
        );
    }

    @Test
    void testUnknownTargetMakesReportPartial() {
        final var executor = new PlanExecutor(planStore, router, resolver, null);
        final var state = TestData.session(TestData.ALICE);
        final var plan = Plan.builder()
                .userQuery("balance and weather")
                .step(PlanStoreTest.twoStepPlan().getSteps().get(0))
                .step(PlanStep.builder()
                              .step(2)
                              .description("Weather")
                              .query("what is the weather")
                              .target("weather_agent")
                              .build())
                .build();
        planStore.store(state, plan);
        final var report = executor.execute(state);
        assertAll(
                () -> assertEquals(ExecutionReport.Status.PARTIAL, report.getStatus()),
                () -> assertEquals(HandlerResult.Status.OUT_OF_SCOPE,
                                   report.getStepResults().get(1).getResult().getStatus())
        );
    }

    @Test
    void testCustomSynthesizerIsUsed() {
        final var synthesizer = mock(ResponseSynthesizer.class);
        when(synthesizer.synthesize(any(), any())).thenReturn("All good");
        final var executor = new PlanExecutor(planStore, router, resolver, synthesizer);
        final var state = TestData.session(TestData.ALICE);
        planStore.store(state, PlanStoreTest.twoStepPlan());
        assertEquals("All good", executor.execute(state).getResponse());
    }
}
