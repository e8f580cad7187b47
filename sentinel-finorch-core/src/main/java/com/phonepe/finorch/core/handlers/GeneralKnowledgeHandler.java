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

package com.phonepe.finorch.core.handlers;

import com.phonepe.finorch.core.repository.RecordType;
import com.phonepe.finorch.core.routing.Domain;
import com.phonepe.finorch.core.routing.HandlerRequest;
import com.phonepe.finorch.core.routing.HandlerResult;
import com.phonepe.finorch.core.setup.OrchestratorSetup;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;

@Slf4j
public class GeneralKnowledgeHandler extends BaseDomainHandler {
    private final KnowledgeSource knowledgeSource;

    /**
     * @param knowledgeSource Source of answers. Null means every question is reported as out of scope.
     */
    public GeneralKnowledgeHandler(OrchestratorSetup setup, KnowledgeSource knowledgeSource) {
        super(setup);
        this.knowledgeSource = knowledgeSource;
    }

    @Override
    public Domain domain() {
        return Domain.GENERAL_KNOWLEDGE;
    }

    @Override
    public Set<RecordType> readScope() {
        return EnumSet.noneOf(RecordType.class);
    }

    @Override
    public HandlerResult handle(HandlerRequest request) {
        if (knowledgeSource == null) {
            return HandlerResult.outOfScope("no knowledge source configured");
        }
        return knowledgeSource.answer(request.getQuery())
                .map(answer -> HandlerResult.ok(domain(), answer))
                .orElseGet(() -> {
                    log.debug("No answer found for query in session {}", request.getSession().getSessionId());
                    return HandlerResult.outOfScope("no answer available");
                });
    }
}
