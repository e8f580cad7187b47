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

import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.errors.FinOrchException;
import com.phonepe.finorch.core.routing.DomainHandler;
import com.phonepe.finorch.core.routing.HandlerRequest;
import com.phonepe.finorch.core.setup.OrchestratorSetup;
import com.phonepe.finorch.core.utils.Parameters;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Common plumbing for handlers that pick an operation from the resolved parameters
 */
public abstract class BaseDomainHandler implements DomainHandler {
    public static final String OPERATION = "operation";

    protected final OrchestratorSetup setup;

    protected BaseDomainHandler(OrchestratorSetup setup) {
        this.setup = Objects.requireNonNullElse(setup, OrchestratorSetup.DEFAULT);
    }

    /**
     * Reads the "operation" parameter. Matching ignores case and treats spaces and hyphens as underscores.
     *
     * @throws FinOrchException with {@link ErrorType#UNSUPPORTED_OPERATION} for names the handler does not know
     */
    protected <E extends Enum<E>> E operation(HandlerRequest request, Class<E> type, E defaultOperation) {
        final var raw = Parameters.string(request.getParameters(), OPERATION).orElse(null);
        if (raw == null) {
            return defaultOperation;
        }
        final var normalized = raw.toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        try {
            return Enum.valueOf(type, normalized);
        }
        catch (IllegalArgumentException e) {
            throw new FinOrchException(FinOrchError.error(ErrorType.UNSUPPORTED_OPERATION, raw, domain()), e);
        }
    }

    protected LocalDate today() {
        return LocalDate.now(setup.getClock());
    }
}
