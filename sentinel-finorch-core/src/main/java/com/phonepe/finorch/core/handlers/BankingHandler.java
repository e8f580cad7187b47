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
import com.phonepe.finorch.core.model.Account;
import com.phonepe.finorch.core.model.TransactionRecord;
import com.phonepe.finorch.core.repository.RecordType;
import com.phonepe.finorch.core.routing.Domain;
import com.phonepe.finorch.core.routing.HandlerRequest;
import com.phonepe.finorch.core.routing.HandlerResult;
import com.phonepe.finorch.core.routing.ScopedRepository;
import com.phonepe.finorch.core.setup.OrchestratorSetup;
import com.phonepe.finorch.core.utils.Money;
import com.phonepe.finorch.core.utils.Parameters;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Accounts, balances and transaction history. Transaction listings and summaries take the filters read by
 * {@link TransactionFilter}.
 */
@Slf4j
public class BankingHandler extends BaseDomainHandler {
    public static final int DEFAULT_DAYS = 30;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 50;

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    public enum Operation {
        LIST_ACCOUNTS,
        BALANCE,
        RECENT_TRANSACTIONS,
        TRANSACTION_SUMMARY,
    }

    public BankingHandler(OrchestratorSetup setup) {
        super(setup);
    }

    @Override
    public Domain domain() {
        return Domain.BANKING;
    }

    @Override
    public Set<RecordType> readScope() {
        return EnumSet.of(RecordType.ACCOUNTS, RecordType.TRANSACTIONS);
    }

    @Override
    public HandlerResult handle(HandlerRequest request) {
        final var operation = operation(request, Operation.class, Operation.LIST_ACCOUNTS);
        final var params = request.getParameters();
        final var repository = request.getRepository();
        log.debug("Banking operation {} for user {}", operation, repository.getUserId());
        return switch (operation) {
            case LIST_ACCOUNTS -> listAccounts(repository, Parameters.string(params, "account_type").orElse(null));
            case BALANCE -> balances(repository, Parameters.strings(params, "account_ids"));
            case RECENT_TRANSACTIONS -> recentTransactions(repository, params);
            case TRANSACTION_SUMMARY -> summary(repository, params);
        };
    }

    private HandlerResult listAccounts(ScopedRepository repository, String accountType) {
        final var accounts = repository.accounts()
                .stream()
                .filter(account -> accountType == null || accountType.equalsIgnoreCase(account.getType()))
                .toList();
        return HandlerResult.ok(domain(), accounts);
    }

    private HandlerResult balances(ScopedRepository repository, List<String> accountIds) {
        final var accounts = repository.accounts();
        final var known = accounts.stream().map(Account::getAccountId).toList();
        final var missing = accountIds.stream()
                .filter(id -> !known.contains(id))
                .findFirst();
        if (missing.isPresent()) {
            return HandlerResult.failed(domain(), FinOrchError.error(ErrorType.ACCOUNT_NOT_FOUND, missing.get()));
        }
        final var balances = accounts.stream()
                .filter(account -> accountIds.isEmpty() || accountIds.contains(account.getAccountId()))
                .map(account -> new AccountBalance(account.getAccountId(),
                                                   account.getType(),
                                                   account.currencyOrDefault(),
                                                   account.getBalance(),
                                                   account.spendable()))
                .toList();
        return HandlerResult.ok(domain(), balances);
    }

    private HandlerResult recentTransactions(ScopedRepository repository, Map<String, Object> params) {
        final var days = Math.max(1, Parameters.integer(params, "days", DEFAULT_DAYS));
        final var limit = Math.min(MAX_LIMIT, Math.max(1, Parameters.integer(params, "limit", DEFAULT_LIMIT)));
        final var accountIds = accountIds(params);
        final var missing = missingAccount(repository, accountIds);
        if (missing.isPresent()) {
            return HandlerResult.failed(domain(), FinOrchError.error(ErrorType.ACCOUNT_NOT_FOUND, missing.get()));
        }
        final var records = window(repository, accountIds, days, TransactionFilter.from(params))
                .stream()
                .limit(limit)
                .toList();
        return HandlerResult.ok(domain(), records);
    }

    private HandlerResult summary(ScopedRepository repository, Map<String, Object> params) {
        final var days = Math.max(1, Parameters.integer(params, "days", DEFAULT_DAYS));
        final var groupBy = Parameters.string(params, "group_by")
                .map(value -> value.toLowerCase(Locale.ROOT))
                .orElse("category");
        final Function<TransactionRecord, String> classifier = switch (groupBy) {
            case "category" -> txn -> Objects.requireNonNullElse(txn.getCategory(), "Uncategorized");
            case "month" -> txn -> txn.getDate() == null ? "Unknown" : txn.getDate().format(MONTH_FORMAT);
            case "method" -> txn -> Objects.requireNonNullElse(txn.getMethod(), "Unknown");
            default -> null;
        };
        if (classifier == null) {
            return HandlerResult.failed(domain(), FinOrchError.error(ErrorType.INVALID_PARAMETER, "group_by"));
        }
        final var accountIds = accountIds(params);
        final var missing = missingAccount(repository, accountIds);
        if (missing.isPresent()) {
            return HandlerResult.failed(domain(), FinOrchError.error(ErrorType.ACCOUNT_NOT_FOUND, missing.get()));
        }
        final var records = window(repository, accountIds, days, TransactionFilter.from(params));
        final var totals = new LinkedHashMap<String, BigDecimal>();
        final var counts = new LinkedHashMap<String, Integer>();
        var credits = BigDecimal.ZERO;
        var debits = BigDecimal.ZERO;
        for (final var txn : records) {
            final var amount = Objects.requireNonNullElse(txn.getAmount(), BigDecimal.ZERO);
            final var key = classifier.apply(txn);
            totals.merge(key, amount, BigDecimal::add);
            counts.merge(key, 1, Integer::sum);
            if (amount.signum() >= 0) {
                credits = credits.add(amount);
            }
            else {
                debits = debits.add(amount.negate());
            }
        }
        final var groups = totals.entrySet()
                .stream()
                .map(entry -> new TransactionSummary.Group(entry.getKey(),
                                                           Money.of(entry.getValue()),
                                                           counts.get(entry.getKey())))
                .sorted(Comparator.comparing((TransactionSummary.Group group) -> group.getTotal().abs())
                                .reversed())
                .toList();
        return HandlerResult.ok(domain(),
                                TransactionSummary.builder()
                                        .days(days)
                                        .groupBy(groupBy)
                                        .totalCredits(Money.of(credits))
                                        .totalDebits(Money.of(debits))
                                        .transactionCount(records.size())
                                        .groups(groups)
                                        .build());
    }

    /**
     * Accounts named by account_id and account_ids together. Empty means all accounts.
     */
    private static List<String> accountIds(Map<String, Object> params) {
        final var accountIds = new ArrayList<>(Parameters.strings(params, "account_ids"));
        Parameters.string(params, "account_id")
                .filter(id -> !accountIds.contains(id))
                .ifPresent(accountIds::add);
        return accountIds;
    }

    private static Optional<String> missingAccount(ScopedRepository repository, List<String> accountIds) {
        return accountIds.stream()
                .filter(id -> repository.account(id).isEmpty())
                .findFirst();
    }

    /**
     * Transactions matching the filter, newest first. All accounts are merged when no account id is given.
     * Without an explicit start_date only the last {@code days} days are considered.
     */
    private List<TransactionRecord> window(
            ScopedRepository repository,
            List<String> accountIds,
            int days,
            TransactionFilter filter) {
        final var from = filter.getStartDate() != null ? null : today().minusDays(days);
        final var ids = !accountIds.isEmpty()
                        ? accountIds
                        : repository.accounts().stream().map(Account::getAccountId).toList();
        return ids.stream()
                .flatMap(id -> repository.transactions(id).stream())
                .filter(txn -> from == null || txn.getDate() == null || !txn.getDate().isBefore(from))
                .filter(txn -> filter.matches(txn.getDate(), txn.getCategory(), txn.getAmount(), txn.getMethod()))
                .sorted(Comparator.comparing(TransactionRecord::getDate,
                                             Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }
}
