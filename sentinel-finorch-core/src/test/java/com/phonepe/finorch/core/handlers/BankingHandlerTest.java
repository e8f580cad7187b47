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

import com.phonepe.finorch.core.TestData;
import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchException;
import com.phonepe.finorch.core.model.Account;
import com.phonepe.finorch.core.model.TransactionRecord;
import com.phonepe.finorch.core.repository.InMemoryRepository;
import com.phonepe.finorch.core.routing.HandlerResult;
import com.phonepe.finorch.core.utils.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BankingHandlerTest {
    private InMemoryRepository repository;
    private BankingHandler handler;

    @BeforeEach
    void setUp() {
        repository = TestData.repository();
        handler = new BankingHandler(TestData.setup());
    }

    private HandlerResult run(Map<String, Object> params) {
        return handler.handle(TestData.request(handler, repository, TestData.session(TestData.ALICE), params));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testListAccountsWithTypeFilter() {
        final var all = (List<Account>) run(Map.of("operation", "LIST_ACCOUNTS")).getData();
        final var cards = (List<Account>) run(Map.of("operation", "list accounts",
                                                     "account_type", "credit_card")).getData();
        assertAll(
                () -> assertEquals(2, all.size()),
                () -> assertEquals(1, cards.size()),
                () -> assertEquals("CC-1", cards.get(0).getAccountId())
        );
    }

    @Test
    @SuppressWarnings("unchecked")
    void testBalances() {
        final var result = run(Map.of("operation", "balance", "account_ids", List.of("CHK-1")));
        final var balances = (List<AccountBalance>) result.getData();
        assertAll(
                () -> assertTrue(result.isOk()),
                () -> assertEquals(1, balances.size()),
                () -> assertEquals(Money.of(1000), Money.of(balances.get(0).getAvailableBalance())),
                () -> assertEquals("INR", balances.get(0).getCurrency())
        );
    }

    @Test
    void testBalanceOfUnknownAccountFails() {
        final var result = run(Map.of("operation", "balance", "account_ids", List.of("CHK-1", "NOPE-7")));
        assertAll(
                () -> assertEquals(HandlerResult.Status.FAILED, result.getStatus()),
                () -> assertEquals(ErrorType.ACCOUNT_NOT_FOUND, result.getError().getErrorType()),
                () -> assertTrue(result.getError().getMessage().contains("NOPE-7"))
        );
    }

    @Test
    @SuppressWarnings("unchecked")
    void testRecentTransactionsAreWindowedAndNewestFirst() {
        final var records = (List<TransactionRecord>) run(Map.of("operation", "recent_transactions",
                                                                 "account_id", "CHK-1")).getData();
        assertEquals(List.of("TXN-3", "TXN-2", "TXN-1"), records.stream().map(TransactionRecord::getId).toList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testRecentTransactionsLimitAndWiderWindow() {
        final var limited = (List<TransactionRecord>) run(Map.of("operation", "recent_transactions",
                                                                 "limit", 2)).getData();
        final var wide = (List<TransactionRecord>) run(Map.of("operation", "recent_transactions",
                                                              "days", "365",
                                                              "limit", "500")).getData();
        assertAll(
                () -> assertEquals(List.of("TXN-3", "TXN-2"),
                                   limited.stream().map(TransactionRecord::getId).toList()),
                () -> assertEquals(4, wide.size())
        );
    }

    @Test
    void testSummaryByCategorySortedByMagnitude() {
        final var summary = (TransactionSummary) run(Map.of("operation", "transaction_summary")).getData();
        assertAll(
                () -> assertEquals("category", summary.getGroupBy()),
                () -> assertEquals(3, summary.getTransactionCount()),
                () -> assertEquals(List.of("Income", "Groceries", "Utilities"),
                                   summary.getGroups().stream().map(TransactionSummary.Group::getKey).toList()),
                () -> assertEquals(Money.of(5000), summary.getTotalCredits()),
                () -> assertEquals(Money.of(230), summary.getTotalDebits())
        );
    }

    @Test
    void testSummaryByMonthAndMethod() {
        final var byMonth = (TransactionSummary) run(Map.of("operation", "transaction_summary",
                                                            "group_by", "month")).getData();
        final var byMethod = (TransactionSummary) run(Map.of("operation", "transaction_summary",
                                                             "group_by", "METHOD")).getData();
        assertAll(
                () -> assertEquals("2025-06", byMonth.getGroups().get(0).getKey()),
                () -> assertEquals(Money.of("4850.00"), byMonth.getGroups().get(0).getTotal()),
                () -> assertEquals("NEFT", byMethod.getGroups().get(0).getKey()),
                () -> assertEquals(2, byMethod.getGroups().get(1).getCount())
        );
    }

    @Test
    void testSummaryWithUnknownGrouping() {
        final var result = run(Map.of("operation", "transaction_summary", "group_by", "weekday"));
        assertEquals(ErrorType.INVALID_PARAMETER, result.getError().getErrorType());
    }

    @SuppressWarnings("unchecked")
    private List<String> ids(Map<String, Object> params) {
        final var result = run(params);
        assertTrue(result.isOk());
        return ((List<TransactionRecord>) result.getData()).stream().map(TransactionRecord::getId).toList();
    }

    @Test
    void testRecentTransactionsFilters() {
        assertAll(
                () -> assertEquals(List.of("TXN-3", "TXN-1"),
                                   ids(Map.of("operation", "recent_transactions",
                                              "categories", List.of("groceries", "Utilities")))),
                () -> assertEquals(List.of("TXN-3", "TXN-2"),
                                   ids(Map.of("operation", "recent_transactions", "min_amount", 100))),
                () -> assertEquals(List.of("TXN-3"),
                                   ids(Map.of("operation", "recent_transactions",
                                              "min_amount", "100",
                                              "max_amount", "1000"))),
                () -> assertEquals(List.of("TXN-1"),
                                   ids(Map.of("operation", "recent_transactions",
                                              "start_date", "2025-05-01",
                                              "end_date", "2025-05-31")))
        );
    }

    @Test
    void testStartDateReachesPastDefaultWindow() {
        assertEquals(List.of("TXN-2", "TXN-0"),
                     ids(Map.of("operation", "recent_transactions",
                                "account_ids", List.of("CHK-1"),
                                "payment_mediums", List.of("neft"),
                                "start_date", "2025-01-01")));
    }

    @Test
    void testSummaryHonoursFilters() {
        final var summary = (TransactionSummary) run(Map.of("operation", "transaction_summary",
                                                            "categories", "Income")).getData();
        assertAll(
                () -> assertEquals(1, summary.getTransactionCount()),
                () -> assertEquals(Money.of(5000), summary.getTotalCredits()),
                () -> assertEquals(Money.of(0), summary.getTotalDebits())
        );
    }

    @Test
    void testMalformedFiltersAreRejected() {
        assertAll(
                () -> assertEquals(ErrorType.INVALID_PARAMETER,
                                   assertThrows(FinOrchException.class,
                                                () -> run(Map.of("operation", "recent_transactions",
                                                                 "start_date", "2025-06-10",
                                                                 "end_date", "2025-06-01")))
                                           .getErrorType()),
                () -> assertEquals(ErrorType.INVALID_PARAMETER,
                                   assertThrows(FinOrchException.class,
                                                () -> run(Map.of("operation", "recent_transactions",
                                                                 "start_date", "first of june")))
                                           .getErrorType()),
                () -> assertEquals(ErrorType.INVALID_PARAMETER,
                                   assertThrows(FinOrchException.class,
                                                () -> run(Map.of("operation", "recent_transactions",
                                                                 "min_amount", "500",
                                                                 "max_amount", "50")))
                                           .getErrorType())
        );
    }

    @Test
    void testUnknownAccountInListFails() {
        final var result = run(Map.of("operation", "recent_transactions", "account_ids", List.of("CHK-1", "NOPE-7")));
        assertEquals(ErrorType.ACCOUNT_NOT_FOUND, result.getError().getErrorType());
    }
}
