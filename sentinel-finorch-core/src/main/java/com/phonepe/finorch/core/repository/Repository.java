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

package com.phonepe.finorch.core.repository;

import com.phonepe.finorch.core.errors.PersistenceException;
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

import java.util.List;
import java.util.Optional;

/**
 * Access to per-user records. Implementations are shared across sessions and must be thread safe.
 * Write methods throw {@link PersistenceException} on I/O failure.
 */
public interface Repository {

    boolean userExists(String userId);

    /**
     * @return true if the user has an accounts listing at all (even an empty one)
     */
    boolean hasAccountsRecord(String userId);

    List<Account> listAccounts(String userId);

    default Optional<Account> getAccount(String userId, String accountId) {
        return listAccounts(userId).stream()
                .filter(account -> account.getAccountId().equals(accountId))
                .findFirst();
    }

    List<Payee> listPayees(String userId);

    /**
     * @return transactions for the account, newest first
     */
    List<TransactionRecord> listTransactions(String userId, String accountId);

    /**
     * Prepends a record to the account's transaction list
     */
    void appendTransaction(String userId, String accountId, TransactionRecord record);

    /**
     * Replaces the stored account having the same account id
     */
    void updateAccount(String userId, Account account);

    /**
     * Applies a transfer as one unit: the record is prepended to the account's transaction list and the account row
     * is replaced. Either both changes are visible afterwards or neither is.
     *
     * @param userId         Owner of the account
     * @param updatedAccount Account row after the transfer
     * @param record         Transaction record to prepend
     */
    void commitTransfer(String userId, Account updatedAccount, TransactionRecord record);

    List<Card> listCards(String userId);

    List<CardPayment> listCardPayments(String userId);

    /**
     * @return card purchases and refunds across all cards, in stored order
     */
    List<CardTransaction> listCardTransactions(String userId);

    List<Holding> listHoldings(String userId);

    /**
     * @return stock and mutual fund transactions, in stored order
     */
    List<InvestmentTransaction> listInvestmentTransactions(String userId);

    List<SipPlan> listSipPlans(String userId);

    Optional<AdvisoryEnrollment> advisoryEnrollment(String userId);
}
