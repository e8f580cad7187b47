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
import com.phonepe.finorch.core.transfer.TransferInput;
import com.phonepe.finorch.core.transfer.TransferOutcome;
import com.phonepe.finorch.core.transfer.TransferSaga;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;

/**
 * Entry point for funds transfers. Starts a transfer or feeds input to the one suspended in the session.
 * The data of every result is the {@link TransferOutcome}.
 */
@Slf4j
public class FundsTransferHandler extends BaseDomainHandler {
    private final TransferSaga saga;

    public FundsTransferHandler(OrchestratorSetup setup, @NonNull TransferSaga saga) {
        super(setup);
        this.saga = saga;
    }

    @Override
    public Domain domain() {
        return Domain.FUNDS_TRANSFER;
    }

    @Override
    public Set<RecordType> readScope() {
        return EnumSet.of(RecordType.ACCOUNTS, RecordType.PAYEES, RecordType.TRANSACTIONS);
    }

    @Override
    public HandlerResult handle(HandlerRequest request) {
        final var session = request.getSession();
        final var input = TransferInput.fromParameters(request.getParameters());
        final TransferOutcome outcome;
        if (input.isCancel()) {
            outcome = saga.cancel(session);
        }
        else if (session.hasTransferInProgress()) {
            outcome = saga.advance(session, request.getRepository(), input);
        }
        else {
            outcome = saga.start(session, request.getRepository(), input);
        }
        log.debug("Transfer for session {} is now {} at {}", session.getSessionId(), outcome.getStatus(),
                  outcome.getStage());
        return switch (outcome.getStatus()) {
            case AWAITING_INPUT -> HandlerResult.awaitingInput(domain(), outcome);
            case COMPLETED -> HandlerResult.ok(domain(), outcome);
            case ABORTED, FAILED -> HandlerResult.failed(domain(), outcome.getError(), outcome);
        };
    }
}
