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

import com.phonepe.finorch.core.model.AdvisoryEnrollment;
import com.phonepe.finorch.core.repository.RecordType;
import com.phonepe.finorch.core.routing.Domain;
import com.phonepe.finorch.core.routing.HandlerRequest;
import com.phonepe.finorch.core.routing.HandlerResult;
import com.phonepe.finorch.core.setup.OrchestratorSetup;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;

/**
 * Portfolio advisory. Enrollment is looked up on every call and remembered in the session.
 */
@Slf4j
public class AdvisoryHandler extends BaseDomainHandler {

    public AdvisoryHandler(OrchestratorSetup setup) {
        super(setup);
    }

    @Override
    public Domain domain() {
        return Domain.ADVISORY;
    }

    @Override
    public Set<RecordType> readScope() {
        return EnumSet.of(RecordType.ADVISORY, RecordType.HOLDINGS);
    }

    @Override
    public HandlerResult handle(HandlerRequest request) {
        final var repository = request.getRepository();
        final var enrollment = repository.advisoryEnrollment()
                .filter(AdvisoryEnrollment::isEnrolled)
                .orElse(null);
        request.getSession().setAdvisoryEnrolled(enrollment != null);
        if (enrollment == null) {
            log.debug("User {} is not enrolled for advisory", repository.getUserId());
            return HandlerResult.ok(domain(), new AdvisoryReport(false, null, null));
        }
        return HandlerResult.ok(domain(),
                                new AdvisoryReport(true,
                                                   enrollment.getAdvisor(),
                                                   PortfolioSummary.of(repository.holdings())));
    }
}
