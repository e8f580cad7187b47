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

import com.google.common.util.concurrent.Striped;
import com.phonepe.finorch.core.errors.ErrorCategory;
import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.errors.FinOrchException;
import com.phonepe.finorch.core.handlers.AdvisoryHandler;
import com.phonepe.finorch.core.handlers.BankingHandler;
import com.phonepe.finorch.core.handlers.CardsHandler;
import com.phonepe.finorch.core.handlers.CrossDomainHandler;
import com.phonepe.finorch.core.handlers.FundsTransferHandler;
import com.phonepe.finorch.core.handlers.GeneralKnowledgeHandler;
import com.phonepe.finorch.core.handlers.InvestmentsHandler;
import com.phonepe.finorch.core.handlers.KnowledgeSource;
import com.phonepe.finorch.core.identity.GateOutcome;
import com.phonepe.finorch.core.identity.IdentityGate;
import com.phonepe.finorch.core.identity.IdentityService;
import com.phonepe.finorch.core.intent.IntentResolver;
import com.phonepe.finorch.core.plan.PlanExecutor;
import com.phonepe.finorch.core.plan.PlanStore;
import com.phonepe.finorch.core.plan.Planner;
import com.phonepe.finorch.core.plan.ResponseSynthesizer;
import com.phonepe.finorch.core.repository.Repository;
import com.phonepe.finorch.core.routing.Domain;
import com.phonepe.finorch.core.routing.DomainRouter;
import com.phonepe.finorch.core.routing.HandlerRequest;
import com.phonepe.finorch.core.session.InMemorySessionStateStore;
import com.phonepe.finorch.core.session.SessionState;
import com.phonepe.finorch.core.session.SessionStateStore;
import com.phonepe.finorch.core.setup.OrchestratorSetup;
import com.phonepe.finorch.core.transfer.TransferLedger;
import com.phonepe.finorch.core.transfer.TransferSaga;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Processes user turns: identity first, then either continuation of a suspended transfer or a fresh
 * plan-then-execute cycle. Turns of one session never overlap; different sessions run in parallel.
 */
@Slf4j
public class Orchestrator {
    @Getter
    private final OrchestratorSetup setup;
    private final SessionStateStore sessionStore;
    private final IdentityGate gate;
    private final IdentityService identityService;
    private final Planner planner;
    private final PlanStore planStore;
    private final PlanExecutor planExecutor;
    @Getter
    private final DomainRouter router;
    private final IntentResolver intentResolver;
    private final Striped<Lock> sessionLocks;

    /**
     * @param router Routing table. When absent every built-in handler is registered against the repository.
     */
    @Builder
    public Orchestrator(
            @NonNull Repository repository,
            @NonNull Planner planner,
            SessionStateStore sessionStore,
            IntentResolver intentResolver,
            KnowledgeSource knowledgeSource,
            ResponseSynthesizer responseSynthesizer,
            DomainRouter router,
            OrchestratorSetup setup) {
        this.setup = Objects.requireNonNullElse(setup, OrchestratorSetup.DEFAULT);
        this.sessionStore = Objects.requireNonNullElseGet(
                sessionStore, () -> new InMemorySessionStateStore(this.setup.getMapper()));
        this.gate = new IdentityGate(repository);
        this.identityService = new IdentityService(gate);
        this.planner = planner;
        this.planStore = new PlanStore(this.setup.getMapper());
        this.router = Objects.requireNonNullElseGet(
                router, () -> defaultRouter(repository, this.setup, knowledgeSource));
        this.intentResolver = intentResolver;
        this.planExecutor = new PlanExecutor(planStore, this.router, intentResolver, responseSynthesizer);
        this.sessionLocks = Striped.lock(this.setup.getLockStripes());
    }

    public TurnResult process(@NonNull TurnRequest request) {
        final var sessionId = request.getSessionId();
        final var lock = sessionLocks.get(sessionId);
        lock.lock();
        try {
            final var state = sessionStore.loadOrCreate(sessionId, setup.getClock().millis());
            try {
                return processTurn(request, state);
            }
            finally {
                state.setUpdatedAt(setup.getClock().millis());
                sessionStore.save(state);
            }
        }
        finally {
            lock.unlock();
        }
    }

    private TurnResult processTurn(TurnRequest request, SessionState state) {
        final var result = TurnResult.builder().sessionId(state.getSessionId());
        final var input = Objects.requireNonNullElse(request.getInput(), "").strip();
        if (request.isLogout()) {
            identityService.logout(state);
            if (input.isEmpty()) {
                return result.status(TurnStatus.LOGGED_OUT).build();
            }
        }
        final var gateOutcome = request.getIdentityClaim() != null
                ? identityService.login(state, request.getIdentityClaim())
                : gate.check(state);
        result.gateOutcome(gateOutcome);
        if (!gateOutcome.passed()) {
            return result
                    .status(gateOutcome.getType() == GateOutcome.Type.ASK_FOR_IDENTITY
                            ? TurnStatus.IDENTITY_REQUIRED
                            : TurnStatus.IDENTITY_REJECTED)
                    .error(gateOutcome.getError())
                    .build();
        }
        if (input.isEmpty()) {
            return result.status(TurnStatus.IDENTIFIED).build();
        }
        if (state.hasTransferInProgress()) {
            log.debug("Session {} continuing transfer at stage {}",
                      state.getSessionId(), state.getTransfer().getStage());
            final var transfer = router.dispatch(Domain.FUNDS_TRANSFER,
                                                 HandlerRequest.builder()
                                                         .session(state)
                                                         .query(input)
                                                         .parameters(parameters(state, input))
                                                         .build());
            return result.status(TurnStatus.TRANSFER_CONTINUED)
                    .transfer(transfer)
                    .error(transfer.getError())
                    .build();
        }
        final var plan = planner.plan(state, input);
        if (plan == null) {
            log.warn("Planner returned no plan for session {}", state.getSessionId());
            return result.status(TurnStatus.PLAN_INVALID)
                    .error(FinOrchError.error(ErrorType.INVALID_PLAN, "planner returned no plan"))
                    .build();
        }
        result.plan(plan);
        try {
            planStore.store(state, plan);
        }
        catch (FinOrchException e) {
            if (e.getErrorType().getCategory() != ErrorCategory.PLAN) {
                throw e;
            }
            log.warn("Discarding plan for session {}: {}", state.getSessionId(), e.getMessage());
            return result.status(TurnStatus.PLAN_INVALID)
                    .error(e.getError())
                    .build();
        }
        final var report = planExecutor.execute(state);
        return result.status(TurnStatus.EXECUTED)
                .report(report)
                .error(report.getError())
                .build();
    }

    private Map<String, Object> parameters(SessionState state, String input) {
        if (intentResolver == null) {
            return Map.of();
        }
        return router.parameters(intentResolver.resolve(state, input));
    }

    private static DomainRouter defaultRouter(
            Repository repository,
            OrchestratorSetup setup,
            KnowledgeSource knowledgeSource) {
        final var saga = new TransferSaga(new TransferLedger(repository, setup), setup);
        return new DomainRouter(repository,
                                setup,
                                List.of(new BankingHandler(setup),
                                        new CardsHandler(setup),
                                        new InvestmentsHandler(setup),
                                        new CrossDomainHandler(setup),
                                        new AdvisoryHandler(setup),
                                        new FundsTransferHandler(setup, saga),
                                        new GeneralKnowledgeHandler(setup, knowledgeSource)));
    }
}
