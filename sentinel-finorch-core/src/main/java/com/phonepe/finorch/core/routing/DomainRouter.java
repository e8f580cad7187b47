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

package com.phonepe.finorch.core.routing;

import com.phonepe.finorch.core.errors.FinOrchException;
import com.phonepe.finorch.core.intent.ResolvedIntent;
import com.phonepe.finorch.core.plan.PlanStep;
import com.phonepe.finorch.core.repository.Repository;
import com.phonepe.finorch.core.session.SessionState;
import com.phonepe.finorch.core.setup.OrchestratorSetup;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Dispatches a resolved intent or a plan step to exactly one {@link DomainHandler}. Anything that cannot be
 * placed confidently in a registered vertical comes back as an out of scope result.
 */
@Slf4j
public class DomainRouter {
    private final Map<Domain, DomainHandler> handlers = new EnumMap<>(Domain.class);
    private final Repository repository;
    private final OrchestratorSetup setup;

    public DomainRouter(@NonNull Repository repository, OrchestratorSetup setup, Collection<DomainHandler> handlers) {
        this.repository = repository;
        this.setup = Objects.requireNonNullElse(setup, OrchestratorSetup.DEFAULT);
        Objects.requireNonNullElseGet(handlers, List::<DomainHandler>of).forEach(this::register);
    }

    public DomainRouter register(@NonNull DomainHandler handler) {
        if (handler.domain() == Domain.OUT_OF_SCOPE) {
            throw new IllegalArgumentException("No handler can be registered for " + Domain.OUT_OF_SCOPE);
        }
        final var existing = handlers.putIfAbsent(handler.domain(), handler);
        if (existing != null) {
            throw new IllegalArgumentException("Handler already registered for domain " + handler.domain());
        }
        return this;
    }

    public Optional<DomainHandler> handler(Domain domain) {
        return Optional.ofNullable(handlers.get(domain));
    }

    /**
     * Routes a resolved intent. Low confidence, an explicit out of scope domain or a domain without a handler all
     * produce an out of scope result.
     */
    public HandlerResult route(
            @NonNull ResolvedIntent intent,
            @NonNull SessionState session,
            String input,
            List<HandlerResult> priorResults) {
        if (intent.getConfidence() < setup.getMinIntentConfidence()) {
            log.debug("Intent {} confidence {} is below threshold {}",
                      intent.getDomain(), intent.getConfidence(), setup.getMinIntentConfidence());
            return HandlerResult.outOfScope("could not classify request confidently");
        }
        return dispatch(intent.getDomain(),
                        HandlerRequest.builder()
                                .session(session)
                                .query(input)
                                .parameters(intent.getParameters())
                                .priorResults(Objects.requireNonNullElseGet(priorResults, List::of))
                                .build());
    }

    /**
     * Parameters of a resolved intent that are confident enough to act on. Below the configured threshold
     * nothing is taken from the resolution.
     */
    public Map<String, Object> parameters(ResolvedIntent intent) {
        if (intent == null) {
            return Map.of();
        }
        if (intent.getConfidence() < setup.getMinIntentConfidence()) {
            log.debug("Ignoring parameters of intent {} with confidence {} below threshold {}",
                      intent.getDomain(), intent.getConfidence(), setup.getMinIntentConfidence());
            return Map.of();
        }
        return intent.getParameters();
    }

    /**
     * Routes a plan step. The step's target decides the handler; parameters come from resolving the step query.
     */
    public HandlerResult route(
            @NonNull PlanStep step,
            Map<String, Object> parameters,
            @NonNull SessionState session,
            List<HandlerResult> priorResults) {
        final var domain = Domain.fromLabel(step.getTarget()).orElse(null);
        if (domain == null) {
            log.debug("Step {} has unknown target {}", step.getStep(), step.getTarget());
            return HandlerResult.outOfScope("no handler for target " + step.getTarget());
        }
        return dispatch(domain,
                        HandlerRequest.builder()
                                .session(session)
                                .query(step.getQuery())
                                .parameters(Objects.requireNonNullElseGet(parameters, Map::of))
                                .priorResults(Objects.requireNonNullElseGet(priorResults, List::of))
                                .build());
    }

    public HandlerResult dispatch(@NonNull Domain domain, @NonNull HandlerRequest request) {
        final var handler = handlers.get(domain);
        if (handler == null) {
            return HandlerResult.outOfScope("no handler registered for " + domain);
        }
        final var scoped = new ScopedRepository(repository,
                                                domain,
                                                handler.readScope(),
                                                request.getSession().getUserId());
        log.debug("Dispatching to {} for session {}", domain, request.getSession().getSessionId());
        try {
            return handler.handle(request.withRepository(scoped));
        }
        catch (FinOrchException e) {
            log.warn("Handler for {} failed: [{}] {}", domain, e.getErrorType(), e.getMessage());
            return HandlerResult.failed(domain, e.getError());
        }
    }
}
