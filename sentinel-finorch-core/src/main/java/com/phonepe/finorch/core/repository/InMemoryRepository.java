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
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Repository held entirely in memory. Each user's data is guarded by its own monitor, so a transfer commit is
 * atomic with respect to every other read or write for the same user.
 */
@Slf4j
public class InMemoryRepository implements Repository {

    private static final class UserData {
        private List<Account> accounts;
        private final List<Payee> payees = new ArrayList<>();
        private final Map<String, LinkedList<TransactionRecord>> transactions = new ConcurrentHashMap<>();
        private final List<Card> cards = new ArrayList<>();
        private final List<CardPayment> cardPayments = new ArrayList<>();
        private final List<CardTransaction> cardTransactions = new ArrayList<>();
        private final List<Holding> holdings = new ArrayList<>();
        private final List<InvestmentTransaction> investmentTransactions = new ArrayList<>();
        private final List<SipPlan> sipPlans = new ArrayList<>();
        private AdvisoryEnrollment advisory;
    }

    private final Map<String, UserData> users = new ConcurrentHashMap<>();

    public InMemoryRepository addUser(@NonNull String userId, @NonNull UserRecords records) {
        final var data = new UserData();
        data.accounts = records.getAccounts() == null ? null : new ArrayList<>(records.getAccounts());
        data.payees.addAll(records.getPayees());
        records.getTransactions().forEach((accountId, txns) -> data.transactions.put(accountId,
                                                                                      new LinkedList<>(txns)));
        data.cards.addAll(records.getCards());
        data.cardPayments.addAll(records.getCardPayments());
        data.cardTransactions.addAll(records.getCardTransactions());
        data.holdings.addAll(records.getHoldings());
        data.investmentTransactions.addAll(records.getInvestmentTransactions());
        data.sipPlans.addAll(records.getSipPlans());
        data.advisory = records.getAdvisory();
        users.put(userId, data);
        return this;
    }

    @Override
    public boolean userExists(String userId) {
        return userId != null && users.containsKey(userId);
    }

    @Override
    public boolean hasAccountsRecord(String userId) {
        return read(userId, data -> data.accounts != null, false);
    }

    @Override
    public List<Account> listAccounts(String userId) {
        return read(userId, data -> data.accounts == null ? List.of() : List.copyOf(data.accounts), List.of());
    }

    @Override
    public List<Payee> listPayees(String userId) {
        return read(userId, data -> List.copyOf(data.payees), List.of());
    }

    @Override
    public List<TransactionRecord> listTransactions(String userId, String accountId) {
        return read(userId,
                    data -> List.copyOf(data.transactions.getOrDefault(accountId, new LinkedList<>())),
                    List.of());
    }

    @Override
    public void appendTransaction(String userId, String accountId, TransactionRecord record) {
        final var data = existing(userId);
        synchronized (data) {
            data.transactions.computeIfAbsent(accountId, id -> new LinkedList<>()).addFirst(record);
        }
    }

    @Override
    public void updateAccount(String userId, Account account) {
        final var data = existing(userId);
        synchronized (data) {
            replaceAccount(userId, data, account);
        }
    }

    @Override
    public void commitTransfer(String userId, Account updatedAccount, TransactionRecord record) {
        final var data = existing(userId);
        synchronized (data) {
            //Account is checked first so that a failure leaves nothing behind
            replaceAccount(userId, data, updatedAccount);
            data.transactions.computeIfAbsent(updatedAccount.getAccountId(), id -> new LinkedList<>())
                    .addFirst(record);
        }
        log.debug("Committed transfer {} on account {} for user {}",
                  record.getId(), updatedAccount.getAccountId(), userId);
    }

    @Override
    public List<Card> listCards(String userId) {
        return read(userId, data -> List.copyOf(data.cards), List.of());
    }

    @Override
    public List<CardPayment> listCardPayments(String userId) {
        return read(userId, data -> List.copyOf(data.cardPayments), List.of());
    }

    @Override
    public List<CardTransaction> listCardTransactions(String userId) {
        return read(userId, data -> List.copyOf(data.cardTransactions), List.of());
    }

    @Override
    public List<Holding> listHoldings(String userId) {
        return read(userId, data -> List.copyOf(data.holdings), List.of());
    }

    @Override
    public List<InvestmentTransaction> listInvestmentTransactions(String userId) {
        return read(userId, data -> List.copyOf(data.investmentTransactions), List.of());
    }

    @Override
    public List<SipPlan> listSipPlans(String userId) {
        return read(userId, data -> List.copyOf(data.sipPlans), List.of());
    }

    @Override
    public Optional<AdvisoryEnrollment> advisoryEnrollment(String userId) {
        return read(userId, data -> Optional.ofNullable(data.advisory), Optional.empty());
    }

    private <T> T read(String userId, Function<UserData, T> reader, T defaultValue) {
        final var data = userId == null ? null : users.get(userId);
        if (data == null) {
            return defaultValue;
        }
        synchronized (data) {
            return reader.apply(data);
        }
    }

    private UserData existing(String userId) {
        final var data = userId == null ? null : users.get(userId);
        if (data == null) {
            throw new PersistenceException("No records exist for user " + userId);
        }
        return data;
    }

    private static void replaceAccount(String userId, UserData data, Account account) {
        final var accounts = Objects.requireNonNullElseGet(data.accounts, ArrayList<Account>::new);
        final var index = indexOf(accounts, account.getAccountId());
        if (index < 0) {
            throw new PersistenceException("Account %s does not exist for user %s"
                                                   .formatted(account.getAccountId(), userId));
        }
        accounts.set(index, account);
        data.accounts = accounts;
    }

    private static int indexOf(List<Account> accounts, String accountId) {
        for (int i = 0; i < accounts.size(); i++) {
            if (accounts.get(i).getAccountId().equals(accountId)) {
                return i;
            }
        }
        return -1;
    }
}
