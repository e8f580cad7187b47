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

import com.google.common.util.concurrent.Striped;
import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.errors.FinOrchException;
import com.phonepe.finorch.core.errors.PersistenceException;
import com.phonepe.finorch.core.model.Account;
import com.phonepe.finorch.core.model.TransactionRecord;
import com.phonepe.finorch.core.repository.Repository;
import com.phonepe.finorch.core.setup.OrchestratorSetup;
import com.phonepe.finorch.core.utils.Money;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Applies confirmed transfers to the repository. Commits against the same account are serialized, and every check
 * is repeated under the lock against freshly read data, so concurrent transfers can never overdraw an account.
 */
@Slf4j
public class TransferLedger {
    public static final String POSTED = "POSTED";

    private final Repository repository;
    private final OrchestratorSetup setup;
    private final Striped<Lock> accountLocks;

    public TransferLedger(@NonNull Repository repository, OrchestratorSetup setup) {
        this.repository = repository;
        this.setup = Objects.requireNonNullElse(setup, OrchestratorSetup.DEFAULT);
        this.accountLocks = Striped.lock(this.setup.getLockStripes());
    }

    /**
     * Debits the source account and records the transfer.
     *
     * @return Receipt with the new transfer id and the posted record
     * @throws FinOrchException     with {@link ErrorType#INVALID_AMOUNT}, {@link ErrorType#ACCOUNT_NOT_FOUND},
     *                              {@link ErrorType#CURRENCY_MISMATCH} or {@link ErrorType#INSUFFICIENT_FUNDS}.
     *                              Nothing is written in these cases.
     * @throws PersistenceException if the repository could not store the change
     */
    public TransferReceipt commit(@NonNull TransferRequest request) {
        final var amount = Money.of(request.getAmount());
        if (!Money.isPositive(amount)) {
            throw rejected(ErrorType.INVALID_AMOUNT);
        }
        final var lock = accountLocks.get(request.getUserId() + ":" + request.getAccountId());
        lock.lock();
        try {
            final var account = repository.getAccount(request.getUserId(), request.getAccountId())
                    .orElseThrow(() -> rejected(ErrorType.ACCOUNT_NOT_FOUND, request.getAccountId()));
            final var currency = account.currencyOrDefault();
            if (request.getCurrency() != null && !request.getCurrency().equals(currency)) {
                throw rejected(ErrorType.CURRENCY_MISMATCH, request.getCurrency(), currency);
            }
            final var spendable = account.spendable();
            if (amount.compareTo(spendable) > 0) {
                throw rejected(ErrorType.INSUFFICIENT_FUNDS, account.getAccountId());
            }
            final var transferId = TransferIds.next(setup.getClock());
            final var now = Instant.now(setup.getClock());
            final var updated = debit(account, amount, now);
            final var record = TransactionRecord.builder()
                    .id(transferId)
                    .date(LocalDate.now(setup.getClock()))
                    .description(request.getReference() != null
                                 ? request.getReference()
                                 : "Transfer to " + request.getPayeeName())
                    .category(setup.getTransferCategory())
                    .amount(amount.negate())
                    .currency(currency)
                    .method(setup.getTransferMethod())
                    .status(POSTED)
                    .runningBalance(Money.of(spendable.subtract(amount)))
                    .counterparty(request.getPayeeName())
                    .build();
            try {
                repository.commitTransfer(request.getUserId(), updated, record);
            }
            catch (PersistenceException e) {
                log.error("Could not persist transfer {} from account {}: {}",
                          transferId, account.getAccountId(), e.getMessage(), e);
                throw e;
            }
            log.info("Transfer {} of {} {} from account {} to {} committed",
                     transferId, amount, currency, account.getAccountId(), request.getPayeeName());
            return new TransferReceipt(transferId,
                                       account.getAccountId(),
                                       request.getPayeeName(),
                                       amount,
                                       currency,
                                       updated.spendable(),
                                       record);
        }
        finally {
            lock.unlock();
        }
    }

    private Account debit(Account account, BigDecimal amount, Instant now) {
        final var builder = account.toBuilder()
                .availableBalance(Money.of(account.spendable().subtract(amount)))
                .lastUpdated(now);
        final var revolving = account.getType() != null
                && setup.getRevolvingCreditTypes()
                .stream()
                .anyMatch(type -> type.equalsIgnoreCase(account.getType()));
        if (!revolving && account.getBalance() != null) {
            builder.balance(Money.of(account.getBalance().subtract(amount)));
        }
        return builder.build();
    }

    private static FinOrchException rejected(ErrorType errorType, Object... args) {
        log.warn("Transfer rejected: {}", errorType);
        return new FinOrchException(FinOrchError.error(errorType, args));
    }
}
