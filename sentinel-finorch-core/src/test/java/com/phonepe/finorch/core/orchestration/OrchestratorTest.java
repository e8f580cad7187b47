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

import com.phonepe.finorch.core.TestData;
import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.identity.GateOutcome;
import com.phonepe.finorch.core.intent.IntentResolver;
import com.phonepe.finorch.core.intent.ResolvedIntent;
import com.phonepe.finorch.core.plan.ExecutionReport;
import com.phonepe.finorch.core.plan.Plan;
import com.phonepe.finorch.core.plan.PlanStep;
import com.phonepe.finorch.core.plan.Planner;
import com.phonepe.finorch.core.repository.InMemoryRepository;
import com.phonepe.finorch.core.routing.Domain;
import com.phonepe.finorch.core.routing.HandlerResult;
import com.phonepe.finorch.core.session.InMemorySessionStateStore;
import com.phonepe.finorch.core.transfer.InputKind;
import com.phonepe.finorch.core.transfer.TransferOutcome;
import com.phonepe.finorch.core.transfer.TransferStage;
import com.phonepe.finorch.core.utils.Money;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class OrchestratorTest {
    private InMemoryRepository repository;
    private InMemorySessionStateStore sessionStore;
    private Orchestrator orchestrator;

    /**
     * Keyword driven stand-in for a language model planner
     */
    private static Plan plan(String input) {
        final var lower = input.toLowerCase();
        if (lower.contains("send") || lower.contains("transfer")) {
            return Plan.builder()
                    .userQuery(input)
                    .step(PlanStep.builder()
                                  .step(1)
                                  .description("Start a transfer")
                                  .query(input)
                                  .target("funds_transfer_agent")
                                  .build())
                    .build();
        }
        if (lower.contains("balance")) {
            return Plan.builder()
                    .userQuery(input)
                    .step(PlanStep.builder()
                                  .step(1)
                                  .description("Fetch balances")
                                  .query("balance")
                                  .target("banking")
                                  .build())
                    .build();
        }
        return Plan.refusal(input);
    }

    /**
     * Keyword driven stand-in for a language model intent resolver
     */
    private static ResolvedIntent resolve(String input) {
        final var lower = input.toLowerCase().strip();
        if (lower.startsWith("send")) {
            return intent(Map.of("payee_query", "bob"));
        }
        if (lower.equals("balance")) {
            return intent(Map.of("operation", "balance"));
        }
        return switch (lower) {
            case "yes" -> intent(Map.of("confirm", true));
            case "no" -> intent(Map.of("confirm", false));
            case "from chk-1" -> intent(Map.of("account_id", "CHK-1"));
            case "400 rupees" -> intent(Map.of("amount", "400"));
            case "stop" -> intent(Map.of("cancel", true));
            case "i guess" -> ResolvedIntent.builder()
                    .domain(Domain.FUNDS_TRANSFER)
                    .parameters(Map.of("confirm", true))
                    .confidence(0.1)
                    .build();
            default -> ResolvedIntent.outOfScope();
        };
    }

    private static ResolvedIntent intent(Map<String, Object> params) {
        return ResolvedIntent.builder()
                .domain(Domain.FUNDS_TRANSFER)
                .parameters(params)
                .confidence(0.9)
                .build();
    }

    @BeforeEach
    void setUp() {
        repository = TestData.repository();
        sessionStore = new InMemorySessionStateStore();
        orchestrator = Orchestrator.builder()
                .repository(repository)
                .sessionStore(sessionStore)
                .planner((state, input) -> plan(input))
                .intentResolver((state, input) -> resolve(input))
                .setup(TestData.setup())
                .build();
    }

    private TurnResult turn(String sessionId, String input) {
        return orchestrator.process(TurnRequest.builder().sessionId(sessionId).input(input).build());
    }

    private TurnResult login(String sessionId, String userId) {
        return orchestrator.process(TurnRequest.builder().sessionId(sessionId).identityClaim(userId).build());
    }

    @Test
    void testFirstTurnAsksForIdentityAndDoesNoWork() {
        final var planner = mock(Planner.class);
        final var resolver = mock(IntentResolver.class);
        final var gated = Orchestrator.builder()
                .repository(repository)
                .planner(planner)
                .intentResolver(resolver)
                .build();
        final var result = gated.process(TurnRequest.builder().sessionId("s1").input("what is my balance").build());
        assertAll(
                () -> assertEquals(TurnStatus.IDENTITY_REQUIRED, result.getStatus()),
                () -> assertEquals(GateOutcome.Type.ASK_FOR_IDENTITY, result.getGateOutcome().getType()),
                () -> assertNull(result.getReport())
        );
        verify(planner, never()).plan(any(), anyString());
        verify(resolver, never()).resolve(any(), anyString());
    }

    @Test
    void testRejectedLoginIsRecoverable() {
        final var rejected = login("s1", "ghost123");
        final var accepted = login("s1", TestData.ALICE);
        assertAll(
                () -> assertEquals(TurnStatus.IDENTITY_REJECTED, rejected.getStatus()),
                () -> assertEquals(ErrorType.USER_NOT_FOUND, rejected.getError().getErrorType()),
                () -> assertEquals(TurnStatus.IDENTIFIED, accepted.getStatus()),
                () -> assertTrue(sessionStore.load("s1").orElseThrow().hasConfirmedIdentity())
        );
    }

    @Test
    void testPlanIsExecutedAndConsumed() {
        login("s1", TestData.ALICE);
        final var result = turn("s1", "What is my balance?");
        assertAll(
                () -> assertEquals(TurnStatus.EXECUTED, result.getStatus()),
                () -> assertEquals(1, result.getPlan().getSteps().size()),
                () -> assertEquals(ExecutionReport.Status.COMPLETED, result.getReport().getStatus()),
                () -> assertEquals(Domain.BANKING,
                                   result.getReport().getStepResults().get(0).getResult().getDomain()),
                () -> assertFalse(sessionStore.load("s1").orElseThrow().hasActivePlan())
        );
    }

    @Test
    void testRefusedRequest() {
        login("s1", TestData.ALICE);
        final var result = turn("s1", "Tell me a joke");
        assertAll(
                () -> assertEquals(TurnStatus.EXECUTED, result.getStatus()),
                () -> assertEquals(ExecutionReport.Status.REFUSED, result.getReport().getStatus()),
                () -> assertEquals(ErrorType.PLAN_REFUSED, result.getError().getErrorType())
        );
    }

    @Test
    void testInvalidPlanIsReported() {
        final var broken = Orchestrator.builder()
                .repository(repository)
                .planner((state, input) -> Plan.builder()
                        .userQuery(input)
                        .step(PlanStep.builder().step(2).description("x").query("x").target("banking").build())
                        .build())
                .build();
        broken.process(TurnRequest.builder().sessionId("s1").identityClaim(TestData.ALICE).build());
        final var result = broken.process(TurnRequest.builder().sessionId("s1").input("balance").build());
        assertAll(
                () -> assertEquals(TurnStatus.PLAN_INVALID, result.getStatus()),
                () -> assertEquals(ErrorType.INVALID_PLAN, result.getError().getErrorType())
        );
    }

    @Test
    void testMissingPlanIsReported() {
        final var silent = Orchestrator.builder()
                .repository(repository)
                .planner((state, input) -> null)
                .build();
        silent.process(TurnRequest.builder().sessionId("s1").identityClaim(TestData.ALICE).build());
        final var result = silent.process(TurnRequest.builder().sessionId("s1").input("balance").build());
        assertAll(
                () -> assertEquals(TurnStatus.PLAN_INVALID, result.getStatus()),
                () -> assertEquals(ErrorType.INVALID_PLAN, result.getError().getErrorType()),
                () -> assertNull(result.getPlan())
        );
    }

    @Test
    void testTransferSpansTurns() {
        login("s1", TestData.ALICE);
        final var started = turn("s1", "Send money to Bob");
        final var startOutcome = (TransferOutcome) started.getReport().getStepResults().get(0).getResult().getData();
        assertAll(
                () -> assertEquals(HandlerResult.Status.AWAITING_INPUT,
                                   started.getReport().getStepResults().get(0).getResult().getStatus()),
                () -> assertEquals(InputKind.PAYEE_CONFIRMATION, startOutcome.getAwaiting()),
                () -> assertTrue(sessionStore.load("s1").orElseThrow().hasTransferInProgress())
        );
        assertEquals(TurnStatus.TRANSFER_CONTINUED, turn("s1", "yes").getStatus());
        turn("s1", "from CHK-1");
        turn("s1", "yes");
        turn("s1", "400 rupees");
        final var done = turn("s1", "yes");
        final var outcome = (TransferOutcome) done.getTransfer().getData();
        assertAll(
                () -> assertEquals(TransferOutcome.Status.COMPLETED, outcome.getStatus()),
                () -> assertEquals(Money.of(600),
                                   repository.getAccount(TestData.ALICE, "CHK-1").orElseThrow().getAvailableBalance()),
                () -> assertFalse(sessionStore.load("s1").orElseThrow().hasTransferInProgress())
        );
        assertEquals(TurnStatus.EXECUTED, turn("s1", "balance please").getStatus());
    }

    @Test
    void testUnsureConfirmationDoesNotCommit() {
        login("s1", TestData.ALICE);
        turn("s1", "Send money to Bob");
        turn("s1", "yes");
        turn("s1", "from CHK-1");
        turn("s1", "yes");
        turn("s1", "400 rupees");
        final var unsure = turn("s1", "i guess");
        final var outcome = (TransferOutcome) unsure.getTransfer().getData();
        final var state = sessionStore.load("s1").orElseThrow();
        assertAll(
                () -> assertEquals(TurnStatus.TRANSFER_CONTINUED, unsure.getStatus()),
                () -> assertEquals(TransferOutcome.Status.AWAITING_INPUT, outcome.getStatus()),
                () -> assertEquals(InputKind.TRANSFER_CONFIRMATION, outcome.getAwaiting()),
                () -> assertEquals(TransferStage.CONFIRM_TRANSFER, state.getTransfer().getStage()),
                () -> assertNull(state.getTransfer().getConfirmed()),
                () -> assertEquals(Money.of(1000),
                                   repository.getAccount(TestData.ALICE, "CHK-1").orElseThrow().getAvailableBalance())
        );
    }

    @Test
    void testLogoutDropsTransfer() {
        login("s1", TestData.ALICE);
        turn("s1", "Send money to Bob");
        final var result = orchestrator.process(TurnRequest.builder().sessionId("s1").logout(true).build());
        final var state = sessionStore.load("s1").orElseThrow();
        assertAll(
                () -> assertEquals(TurnStatus.LOGGED_OUT, result.getStatus()),
                () -> assertNull(state.getTransfer()),
                () -> assertFalse(state.hasConfirmedIdentity()),
                () -> assertEquals(TurnStatus.IDENTITY_REQUIRED, turn("s1", "yes").getStatus())
        );
    }

    @Test
    void testSessionsAreIsolated() {
        login("s1", TestData.ALICE);
        turn("s1", "Send money to Bob");
        assertAll(
                () -> assertEquals(TurnStatus.IDENTITY_REQUIRED, turn("s2", "yes").getStatus()),
                () -> assertNull(sessionStore.load("s2").orElseThrow().getTransfer())
        );
    }

    @Test
    @SneakyThrows
    void testParallelSessions() {
        final var sessions = List.of("p1", "p2", "p3", "p4");
        final var executor = Executors.newFixedThreadPool(sessions.size());
        final var start = new CountDownLatch(1);
        try {
            final var futures = new ArrayList<Future<TurnResult>>();
            for (final var sessionId : sessions) {
                futures.add(executor.submit(() -> {
                    start.await();
                    login(sessionId, TestData.ALICE);
                    return turn(sessionId, "balance");
                }));
            }
            start.countDown();
            await().atMost(10, TimeUnit.SECONDS).until(() -> futures.stream().allMatch(Future::isDone));
            for (final var future : futures) {
                assertEquals(TurnStatus.EXECUTED, future.get().getStatus());
            }
        }
        finally {
            executor.shutdownNow();
        }
    }
}
