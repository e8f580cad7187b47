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

import com.google.common.annotations.VisibleForTesting;
import com.phonepe.finorch.core.errors.ScopeViolationException;
import com.phonepe.finorch.core.model.Account;
import com.phonepe.finorch.core.model.AdvisoryEnrollment;
import com.phonepe.finorch.core.model.Card;
import com.phonepe.finorch.core.model.CardPayment;
import com.phonepe.finorch.core.model.CardTransaction;
import com.phonepe.finorch.core.model.Holding;
import com.phonepe.finorch.core.model.InvestmentTransaction;
import com.phonepe.finorch.core.model.Payee;
import com.phonepe.finorch.core.model.SipPlan;
import com.phonepe.finorch.core.model.TransactionRecord;
import com.phonepe.finorch.core.repository.RecordType;
import com.phonepe.finorch.core.repository.Repository;
import lombok.Getter;
import lombok.NonNull;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of a {@link Repository} bound to one user and restricted to the record types a handler declared.
 */
public class ScopedRepository {
    private final Repository repository;
    @Getter
    private final Domain domain;
    private final Set<RecordType> scope;
    @Getter
    private final String userId;

    public ScopedRepository(
            @NonNull Repository repository,
            @NonNull Domain domain,
            @NonNull Set<RecordType> scope,
            String userId) {
        this.repository = repository;
        this.domain = domain;
        this.scope = scope.isEmpty() ? EnumSet.noneOf(RecordType.class) : EnumSet.copyOf(scope);
        this.userId = userId;
    }

    public List<Account> accounts() {
        require(RecordType.ACCOUNTS);
        return repository.listAccounts(userId);
    }

    public Optional<Account> account(String accountId) {
        require(RecordType.ACCOUNTS);
        return repository.getAccount(userId, accountId);
    }

    public List<TransactionRecord> transactions(String accountId) {
        require(RecordType.TRANSACTIONS);
        return repository.listTransactions(userId, accountId);
    }

    public List<Payee> payees() {
        require(RecordType.PAYEES);
        return repository.listPayees(userId);
    }

    public List<Card> cards() {
        require(RecordType.CARDS);
        return repository.listCards(userId);
    }

    public List<CardPayment> cardPayments() {
        require(RecordType.CARD_PAYMENTS);
        return repository.listCardPayments(userId);
    }

    public List<CardTransaction> cardTransactions() {
        require(RecordType.CARD_TRANSACTIONS);
        return repository.listCardTransactions(userId);
    }

    public List<Holding> holdings() {
        require(RecordType.HOLDINGS);
        return repository.listHoldings(userId);
    }

    public List<InvestmentTransaction> investmentTransactions() {
        require(RecordType.INVESTMENT_TRANSACTIONS);
        return repository.listInvestmentTransactions(userId);
    }

    public List<SipPlan> sipPlans() {
        require(RecordType.SIP_PLANS);
        return repository.listSipPlans(userId);
    }

    public Optional<AdvisoryEnrollment> advisoryEnrollment() {
        require(RecordType.ADVISORY);
        return repository.advisoryEnrollment(userId);
    }

    @VisibleForTesting
    boolean allows(RecordType recordType) {
        return scope.contains(recordType);
    }

    private void require(RecordType recordType) {
        if (!allows(recordType)) {
            throw new ScopeViolationException(domain, recordType);
        }
    }
}
