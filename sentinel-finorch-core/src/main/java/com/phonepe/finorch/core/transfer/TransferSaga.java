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

package com.phonepe.finorch.core.transfer;

import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.errors.FinOrchException;
import com.phonepe.finorch.core.errors.PersistenceException;
import com.phonepe.finorch.core.model.Account;
import com.phonepe.finorch.core.model.Payee;
import com.phonepe.finorch.core.routing.ScopedRepository;
import com.phonepe.finorch.core.session.SessionState;
import com.phonepe.finorch.core.session.TransferState;
import com.phonepe.finorch.core.setup.OrchestratorSetup;
import com.phonepe.finorch.core.utils.Money;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives a funds transfer through its stages, one interaction at a time. All progress lives in
 * {@link SessionState#getTransfer()}, so the saga itself is stateless and can be shared.
 * <p>
 * Captured values (payee, source account, amount, reference) may arrive early and are kept until their stage
 * runs. Confirmations are only accepted for the question the saga is currently suspended on, so no confirmation
 * is ever implied by input that arrived before the question was asked.
 */
@Slf4j
public class TransferSaga {
    private final TransferLedger ledger;
    private final OrchestratorSetup setup;

    public TransferSaga(@NonNull TransferLedger ledger, OrchestratorSetup setup) {
        this.ledger = ledger;
        this.setup = Objects.requireNonNullElse(setup, OrchestratorSetup.DEFAULT);
    }

    /**
     * Starts a new transfer, replacing any finished one in the session. If a transfer is already in progress the
     * input is applied to it instead.
     */
    public TransferOutcome start(
            @NonNull SessionState state,
            @NonNull ScopedRepository repository,
            @NonNull TransferInput input) {
        if (state.hasTransferInProgress()) {
            return advance(state, repository, input);
        }
        final var now = setup.getClock().millis();
        final var transfer = new TransferState()
                .setStage(TransferStage.IDENTIFY_USER)
                .setStartedAt(now)
                .setLastActivityAt(now);
        state.setTransfer(transfer);
        log.debug("Starting transfer for session {}", state.getSessionId());
        absorb(transfer, input);
        return run(state, repository, transfer);
    }

    /**
     * Applies caller input to the suspended transfer and runs it until it suspends again or finishes
     */
    public TransferOutcome advance(
            @NonNull SessionState state,
            @NonNull ScopedRepository repository,
            @NonNull TransferInput input) {
        final var transfer = state.getTransfer();
        if (transfer == null || !transfer.isInProgress()) {
            return start(state, repository, input);
        }
        final var now = setup.getClock().millis();
        if (now - transfer.getLastActivityAt() > setup.getTransferIdleTimeout().toMillis()) {
            log.info("Transfer for session {} idle since {}, discarding", state.getSessionId(),
                     transfer.getLastActivityAt());
            return abort(transfer, FinOrchError.error(ErrorType.TRANSFER_EXPIRED), null, null);
        }
        if (input.isCancel()) {
            return cancel(state);
        }
        transfer.setLastActivityAt(now);
        absorb(transfer, input);
        return run(state, repository, transfer);
    }

    public TransferOutcome cancel(@NonNull SessionState state) {
        final var transfer = state.getTransfer();
        if (transfer == null || !transfer.isInProgress()) {
            return TransferOutcome.builder()
                    .status(TransferOutcome.Status.ABORTED)
                    .stage(TransferStage.ABORTED)
                    .error(FinOrchError.error(ErrorType.CANCELLED))
                    .build();
        }
        log.info("Transfer for session {} cancelled at stage {}", state.getSessionId(), transfer.getStage());
        return abort(transfer, FinOrchError.error(ErrorType.CANCELLED), null, null);
    }

    private void absorb(TransferState transfer, TransferInput input) {
        final var stage = transfer.getStage();
        final var awaiting = transfer.getAwaiting();
        if (notAfter(stage, TransferStage.CAPTURE_PAYEE)
                && transfer.getPayeeQuery() == null
                && transfer.getPayeeId() == null) {
            transfer.setPayeeQuery(input.getPayeeQuery());
            transfer.setPayeeId(input.getPayeeId());
        }
        if (awaiting == InputKind.PAYEE_CONFIRMATION
                && transfer.getPayeeId() == null
                && input.getPayeeId() != null
                && transfer.getPayeeCandidates().contains(input.getPayeeId())) {
            transfer.setPayeeId(input.getPayeeId());
        }
        if (notAfter(stage, TransferStage.CAPTURE_SOURCE_ACCOUNT) && transfer.getAccountId() == null) {
            transfer.setAccountId(input.getAccountId());
        }
        if (notAfter(stage, TransferStage.CHECK_BALANCE) && transfer.getAmount() == null) {
            transfer.setAmount(input.getAmount());
            if (transfer.getCurrency() == null) {
                transfer.setCurrency(input.getCurrency());
            }
        }
        if (notAfter(stage, TransferStage.CONFIRM_TRANSFER) && transfer.getReference() == null) {
            transfer.setReference(input.getReference());
        }
        if (awaiting != null && awaiting.isConfirmation() && input.getConfirm() != null) {
            switch (awaiting) {
                case PAYEE_CONFIRMATION -> {
                    //With several candidates a yes only counts once one of them has been picked
                    if (transfer.getPayeeId() != null || !input.getConfirm()) {
                        transfer.setPayeeConfirmed(input.getConfirm());
                    }
                }
                case ACCOUNT_CONFIRMATION -> transfer.setAccountConfirmed(input.getConfirm());
                case TRANSFER_CONFIRMATION -> transfer.setConfirmed(input.getConfirm());
                default -> log.debug("Ignoring confirmation while awaiting {}", awaiting);
            }
        }
    }

    private TransferOutcome run(SessionState state, ScopedRepository repository, TransferState transfer) {
        while (true) {
            final var stage = transfer.getStage();
            log.debug("Session {} transfer at stage {}", state.getSessionId(), stage);
            final var outcome = switch (stage) {
                case IDENTIFY_USER -> identifyUser(state, transfer);
                case CAPTURE_PAYEE -> capturePayee(transfer);
                case RESOLVE_PAYEE -> resolvePayee(repository, transfer);
                case CAPTURE_SOURCE_ACCOUNT -> captureSourceAccount(transfer);
                case VALIDATE_SOURCE_ACCOUNT -> validateSourceAccount(repository, transfer);
                case CHECK_BALANCE -> checkBalance(repository, transfer);
                case CONFIRM_TRANSFER -> confirmTransfer(transfer);
                case COMMIT_TRANSFER -> Optional.of(commitTransfer(state, transfer));
                case REPORT_RESULT, COMPLETED, ABORTED ->
                        throw new IllegalStateException("Transfer cannot run from stage " + stage);
            };
            if (outcome.isPresent()) {
                return outcome.get();
            }
        }
    }

    private Optional<TransferOutcome> identifyUser(SessionState state, TransferState transfer) {
        if (!state.hasConfirmedIdentity()) {
            return Optional.of(abort(transfer, FinOrchError.error(ErrorType.IDENTITY_REQUIRED), null, null));
        }
        return moveTo(transfer, TransferStage.CAPTURE_PAYEE);
    }

    private Optional<TransferOutcome> capturePayee(TransferState transfer) {
        if (transfer.getPayeeQuery() == null && transfer.getPayeeId() == null) {
            return Optional.of(suspend(transfer, InputKind.PAYEE, null, null));
        }
        return moveTo(transfer, TransferStage.RESOLVE_PAYEE);
    }

    private Optional<TransferOutcome> resolvePayee(ScopedRepository repository, TransferState transfer) {
        final var payees = repository.payees();
        final var query = transfer.getPayeeQuery();
        final var matches = query != null
                            ? payees.stream().filter(payee -> payee.matches(query)).toList()
                            : payees.stream()
                                    .filter(payee -> Objects.equals(payee.getPayeeId(), transfer.getPayeeId()))
                                    .toList();
        if (matches.isEmpty()) {
            return Optional.of(abort(transfer,
                                     FinOrchError.error(ErrorType.NOT_FOUND,
                                                        Objects.requireNonNullElse(query, transfer.getPayeeId())),
                                     payees,
                                     null));
        }
        transfer.setPayeeCandidates(matches.stream().map(Payee::getPayeeId).toList());
        if (transfer.getPayeeId() != null && !transfer.getPayeeCandidates().contains(transfer.getPayeeId())) {
            transfer.setPayeeId(null);
        }
        if (transfer.getPayeeId() == null && matches.size() == 1) {
            transfer.setPayeeId(matches.get(0).getPayeeId());
        }
        if (Boolean.FALSE.equals(transfer.getPayeeConfirmed())) {
            return Optional.of(abort(transfer, FinOrchError.error(ErrorType.PAYEE_NOT_CONFIRMED), null, null));
        }
        if (transfer.getPayeeId() == null) {
            return Optional.of(suspend(transfer, InputKind.PAYEE_CONFIRMATION, matches, null));
        }
        final var selected = matches.stream()
                .filter(payee -> payee.getPayeeId().equals(transfer.getPayeeId()))
                .findFirst()
                .orElseThrow();
        transfer.setPayeeName(selected.getName());
        if (transfer.getPayeeConfirmed() == null) {
            return Optional.of(suspend(transfer, InputKind.PAYEE_CONFIRMATION, List.of(selected), null));
        }
        return moveTo(transfer, TransferStage.CAPTURE_SOURCE_ACCOUNT);
    }

    private Optional<TransferOutcome> captureSourceAccount(TransferState transfer) {
        if (transfer.getAccountId() == null) {
            return Optional.of(suspend(transfer, InputKind.SOURCE_ACCOUNT, null, null));
        }
        return moveTo(transfer, TransferStage.VALIDATE_SOURCE_ACCOUNT);
    }

    private Optional<TransferOutcome> validateSourceAccount(ScopedRepository repository, TransferState transfer) {
        if (repository.account(transfer.getAccountId()).isEmpty()) {
            final var accountIds = repository.accounts()
                    .stream()
                    .map(Account::getAccountId)
                    .toList();
            return Optional.of(abort(transfer,
                                     FinOrchError.error(ErrorType.NOT_FOUND, transfer.getAccountId()),
                                     null,
                                     accountIds));
        }
        if (Boolean.FALSE.equals(transfer.getAccountConfirmed())) {
            return Optional.of(abort(transfer, FinOrchError.error(ErrorType.ACCOUNT_NOT_CONFIRMED), null, null));
        }
        if (transfer.getAccountConfirmed() == null) {
            return Optional.of(suspend(transfer, InputKind.ACCOUNT_CONFIRMATION, null, null));
        }
        return moveTo(transfer, TransferStage.CHECK_BALANCE);
    }

    private Optional<TransferOutcome> checkBalance(ScopedRepository repository, TransferState transfer) {
        if (transfer.getAmount() == null) {
            return Optional.of(suspend(transfer, InputKind.AMOUNT, null, null));
        }
        transfer.setAmount(Money.of(transfer.getAmount()));
        if (!Money.isPositive(transfer.getAmount())) {
            return Optional.of(abort(transfer, FinOrchError.error(ErrorType.INVALID_AMOUNT), null, null));
        }
        final var account = repository.account(transfer.getAccountId()).orElse(null);
        if (account == null) {
            return Optional.of(abort(transfer,
                                     FinOrchError.error(ErrorType.ACCOUNT_NOT_FOUND, transfer.getAccountId()),
                                     null,
                                     null));
        }
        final var accountCurrency = account.currencyOrDefault();
        if (transfer.getCurrency() != null && !transfer.getCurrency().equals(accountCurrency)) {
            return Optional.of(abort(transfer,
                                     FinOrchError.error(ErrorType.CURRENCY_MISMATCH,
                                                        transfer.getCurrency(),
                                                        accountCurrency),
                                     null,
                                     null));
        }
        transfer.setCurrency(accountCurrency);
        if (transfer.getAmount().compareTo(account.spendable()) > 0) {
            return Optional.of(abort(transfer,
                                     FinOrchError.error(ErrorType.INSUFFICIENT_FUNDS, account.getAccountId()),
                                     null,
                                     null));
        }
        return moveTo(transfer, TransferStage.CONFIRM_TRANSFER);
    }

    private Optional<TransferOutcome> confirmTransfer(TransferState transfer) {
        if (Boolean.FALSE.equals(transfer.getConfirmed())) {
            return Optional.of(abort(transfer, FinOrchError.error(ErrorType.TRANSFER_NOT_CONFIRMED), null, null));
        }
        if (transfer.getConfirmed() == null) {
            return Optional.of(suspend(transfer, InputKind.TRANSFER_CONFIRMATION, null, null));
        }
        return moveTo(transfer, TransferStage.COMMIT_TRANSFER);
    }

    private TransferOutcome commitTransfer(SessionState state, TransferState transfer) {
        final TransferReceipt receipt;
        try {
            receipt = ledger.commit(TransferRequest.builder()
                                            .userId(state.getUserId())
                                            .accountId(transfer.getAccountId())
                                            .payeeId(transfer.getPayeeId())
                                            .payeeName(transfer.getPayeeName())
                                            .amount(transfer.getAmount())
                                            .currency(transfer.getCurrency())
                                            .reference(transfer.getReference())
                                            .build());
        }
        catch (PersistenceException e) {
            transfer.setStage(TransferStage.REPORT_RESULT);
            return fail(transfer, e.getError());
        }
        catch (FinOrchException e) {
            return abort(transfer, e.getError(), null, null);
        }
        transfer.setTransferId(receipt.getTransferId());
        transfer.setStage(TransferStage.REPORT_RESULT);
        return reportResult(transfer, receipt);
    }

    private TransferOutcome reportResult(TransferState transfer, TransferReceipt receipt) {
        transfer.setStage(TransferStage.COMPLETED);
        transfer.setAwaiting(null);
        return snapshot(transfer)
                .status(TransferOutcome.Status.COMPLETED)
                .receipt(receipt)
                .build();
    }

    private static Optional<TransferOutcome> moveTo(TransferState transfer, TransferStage next) {
        transfer.setStage(next);
        transfer.setAwaiting(null);
        return Optional.empty();
    }

    private static TransferOutcome suspend(
            TransferState transfer,
            InputKind kind,
            List<Payee> payees,
            List<String> accountIds) {
        transfer.setAwaiting(kind);
        return snapshot(transfer)
                .status(TransferOutcome.Status.AWAITING_INPUT)
                .awaiting(kind)
                .payees(payees)
                .accountIds(accountIds)
                .build();
    }

    private static TransferOutcome abort(
            TransferState transfer,
            FinOrchError error,
            List<Payee> payees,
            List<String> accountIds) {
        log.debug("Transfer aborted at stage {}: {}", transfer.getStage(), error.getErrorType());
        transfer.setStage(TransferStage.ABORTED);
        transfer.setAwaiting(null);
        transfer.setFailure(error.getErrorType());
        return snapshot(transfer)
                .status(TransferOutcome.Status.ABORTED)
                .error(error)
                .payees(payees)
                .accountIds(accountIds)
                .build();
    }

    private static TransferOutcome fail(TransferState transfer, FinOrchError error) {
        transfer.setStage(TransferStage.ABORTED);
        transfer.setAwaiting(null);
        transfer.setFailure(error.getErrorType());
        return snapshot(transfer)
                .status(TransferOutcome.Status.FAILED)
                .error(error)
                .build();
    }

    private static TransferOutcome.TransferOutcomeBuilder snapshot(TransferState transfer) {
        return TransferOutcome.builder()
                .stage(transfer.getStage())
                .payeeId(transfer.getPayeeId())
                .payeeName(transfer.getPayeeName())
                .accountId(transfer.getAccountId())
                .amount(transfer.getAmount())
                .currency(transfer.getCurrency());
    }

    private static boolean notAfter(TransferStage stage, TransferStage reference) {
        return stage.ordinal() <= reference.ordinal();
    }
}
