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

import java.util.EnumSet;
import java.util.Set;

/**
 * Combines the outputs of earlier plan steps. Reads no records of its own.
 */
public class CrossDomainHandler extends BaseDomainHandler {

    public CrossDomainHandler(OrchestratorSetup setup) {
        super(setup);
    }

    @Override
    public Domain domain() {
        return Domain.CROSS_DOMAIN;
    }

    @Override
    public Set<RecordType> readScope() {
        return EnumSet.noneOf(RecordType.class);
    }

    @Override
    public HandlerResult handle(HandlerRequest request) {
        final var contributions = request.getPriorResults()
                .stream()
                .filter(HandlerResult::isOk)
                .map(result -> new CrossDomainReport.Contribution(result.getDomain(), result.getData()))
                .toList();
        final var domains = contributions.stream()
                .map(CrossDomainReport.Contribution::getDomain)
                .distinct()
                .toList();
        return HandlerResult.ok(domain(), new CrossDomainReport(contributions.size(), domains, contributions));
    }
}
