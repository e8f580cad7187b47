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

import com.phonepe.finorch.core.TestData;
import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchException;
import com.phonepe.finorch.core.errors.PersistenceException;
import com.phonepe.finorch.core.repository.InMemoryRepository;
import com.phonepe.finorch.core.repository.Repository;
import com.phonepe.finorch.core.utils.Money;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TransferLedgerTest {

    private static TransferRequest request(String amount) {
        return TransferRequest.builder()
                .userId(TestData.ALICE)
                .accountId("CHK-1")
                .payeeId("P-1")
                .payeeName("Bob Kumar")
                .amount(new BigDecimal(amount))
                .build();
    }

    private static BigDecimal available(Repository repository) {
        return repository.getAccount(TestData.ALICE, "CHK-1").orElseThrow().getAvailableBalance();
    }

    @Test
    void testCommitDebitsAccountAndRecordsTransfer() {
        final var repository = TestData.repository();
        final var ledger = new TransferLedger(repository, TestData.setup());
        final var receipt = ledger.commit(request("400"));
        final var account = repository.getAccount(TestData.ALICE, "CHK-1").orElseThrow();
        final var head = repository.listTransactions(TestData.ALICE, "CHK-1").get(0);
        assertAll(
                () -> assertTrue(TransferIds.isTransferId(receipt.getTransferId())),
                () -> assertTrue(receipt.getTransferId().startsWith("T-FT-20250615100000-")),
                () -> assertEquals(Money.of(600), account.getAvailableBalance()),
                () -> assertEquals(Money.of(600), account.getBalance()),
                () -> assertEquals(TestData.NOW, account.getLastUpdated()),
                () -> assertEquals(receipt.getTransferId(), head.getId()),
                () -> assertEquals(Money.of(-400), head.getAmount()),
                () -> assertEquals(Money.of(600), head.getRunningBalance()),
                () -> assertEquals("Bob Kumar", head.getCounterparty()),
                () -> assertEquals("Transfer to Bob Kumar", head.getDescription()),
                () -> assertEquals("Transfer", head.getCategory()),
                () -> assertEquals("NEFT", head.getMethod()),
                () -> assertEquals("POSTED", head.getStatus()),
                () -> assertEquals("INR", head.getCurrency()),
                () -> assertEquals(5, repository.listTransactions(TestData.ALICE, "CHK-1").size())
        );
    }

    @Test
    void testReferenceBecomesDescription() {
        final var repository = TestData.repository();
        final var ledger = new TransferLedger(repository, TestData.setup());
        final var receipt = ledger.commit(TransferRequest.builder()
                                                  .userId(TestData.ALICE)
                                                  .accountId("CHK-1")
                                                  .payeeName("Carol Dsouza")
                                                  .amount(new BigDecimal("10.50"))
                                                  .reference("Dinner split")
                                                  .build());
        assertEquals("Dinner split", receipt.getRecord().getDescription());
    }

    @Test
    void testInsufficientFundsWritesNothing() {
        final var repository = TestData.repository();
        final var ledger = new TransferLedger(repository, TestData.setup());
        final var error = assertThrows(FinOrchException.class, () -> ledger.commit(request("1500")));
        assertAll(
                () -> assertEquals(ErrorType.INSUFFICIENT_FUNDS, error.getErrorType()),
                () -> assertEquals(new BigDecimal("1000.00"), available(repository)),
                () -> assertEquals(4, repository.listTransactions(TestData.ALICE, "CHK-1").size())
        );
    }

    @Test
    void testWholeBalanceCanBeSpent() {
        final var repository = TestData.repository();
        new TransferLedger(repository, TestData.setup()).commit(request("1000"));
        assertEquals(Money.of(0), available(repository));
    }

    @Test
    void testNonPositiveAmountsAreRejected() {
        final var repository = mock(Repository.class);
        final var ledger = new TransferLedger(repository, TestData.setup());
        assertAll(
                () -> assertEquals(ErrorType.INVALID_AMOUNT,
                                   assertThrows(FinOrchException.class, () -> ledger.commit(request("0")))
                                           .getErrorType()),
                () -> assertEquals(ErrorType.INVALID_AMOUNT,
                                   assertThrows(FinOrchException.class, () -> ledger.commit(request("-5")))
                                           .getErrorType()),
                () -> assertEquals(ErrorType.INVALID_AMOUNT,
                                   assertThrows(FinOrchException.class, () -> ledger.commit(request("0.004")))
                                           .getErrorType())
        );
        verify(repository, never()).commitTransfer(anyString(), any(), any());
    }

    @Test
    void testSubCentAmountWritesNothing() {
        final var repository = TestData.repository();
        final var ledger = new TransferLedger(repository, TestData.setup());
        final var error = assertThrows(FinOrchException.class, () -> ledger.commit(request("0.004")));
        assertAll(
                () -> assertEquals(ErrorType.INVALID_AMOUNT, error.getErrorType()),
                () -> assertEquals(new BigDecimal("1000.00"), available(repository)),
                () -> assertEquals(4, repository.listTransactions(TestData.ALICE, "CHK-1").size())
        );
    }

    @Test
    void testCurrencyCodesAreComparedExactly() {
        final var repository = TestData.repository();
        final var ledger = new TransferLedger(repository, TestData.setup());
        final var error = assertThrows(FinOrchException.class,
                                       () -> ledger.commit(TransferRequest.builder()
                                                                   .userId(TestData.ALICE)
                                                                   .accountId("CHK-1")
                                                                   .payeeName("Bob Kumar")
                                                                   .amount(BigDecimal.TEN)
                                                                   .currency("inr")
                                                                   .build()));
        assertAll(
                () -> assertEquals(ErrorType.CURRENCY_MISMATCH, error.getErrorType()),
                () -> assertEquals(new BigDecimal("1000.00"), available(repository)),
                () -> assertEquals("INR",
                                   TransferInput.fromParameters(Map.of("currency", " inr ")).getCurrency())
        );
    }

    @Test
    void testCurrencyMismatchAndUnknownAccount() {
        final var repository = TestData.repository();
        final var ledger = new TransferLedger(repository, TestData.setup());
        final var mismatch = assertThrows(FinOrchException.class,
                                          () -> ledger.commit(TransferRequest.builder()
                                                                      .userId(TestData.ALICE)
                                                                      .accountId("CHK-1")
                                                                      .payeeName("Bob Kumar")
                                                                      .amount(BigDecimal.TEN)
                                                                      .currency("USD")
                                                                      .build()));
        final var unknown = assertThrows(FinOrchException.class,
                                         () -> ledger.commit(TransferRequest.builder()
                                                                     .userId(TestData.ALICE)
                                                                     .accountId("CHK-404")
                                                                     .payeeName("Bob Kumar")
                                                                     .amount(BigDecimal.TEN)
                                                                     .build()));
        assertAll(
                () -> assertEquals(ErrorType.CURRENCY_MISMATCH, mismatch.getErrorType()),
                () -> assertEquals(ErrorType.ACCOUNT_NOT_FOUND, unknown.getErrorType()),
                () -> assertEquals(new BigDecimal("1000.00"), available(repository))
        );
    }

    @Test
    void testRevolvingCreditKeepsLedgerBalance() {
        final var repository = TestData.repository();
        new TransferLedger(repository, TestData.setup()).commit(TransferRequest.builder()
                                                                        .userId(TestData.ALICE)
                                                                        .accountId("CC-1")
                                                                        .payeeName("Dave Rao")
                                                                        .amount(new BigDecimal("500"))
                                                                        .build());
        final var account = repository.getAccount(TestData.ALICE, "CC-1").orElseThrow();
        assertAll(
                () -> assertEquals(Money.of(2500), account.getAvailableBalance()),
                () -> assertEquals(Money.of(-2000), account.getBalance())
        );
    }

    @Test
    void testPersistenceFailurePropagates() {
        final var repository = mock(Repository.class);
        when(repository.getAccount(TestData.ALICE, "CHK-1")).thenReturn(Optional.of(TestData.checking("1000.00")));
        doThrow(new PersistenceException("disk full"))
                .when(repository).commitTransfer(anyString(), any(), any());
        final var ledger = new TransferLedger(repository, TestData.setup());
        final var error = assertThrows(PersistenceException.class, () -> ledger.commit(request("100")));
        assertEquals(ErrorType.PERSISTENCE_FAILURE, error.getErrorType());
    }

    @Test
    @SneakyThrows
    void testConcurrentTransfersNeverOverdraw() {
        final var repository = TestData.repository("500.00");
        final var ledger = new TransferLedger(repository, TestData.setup());
        final var executor = Executors.newFixedThreadPool(2);
        final var start = new CountDownLatch(1);
        final var failures = new ConcurrentLinkedQueue<ErrorType>();
        try {
            final var futures = new ArrayList<Future<TransferReceipt>>();
            for (int i = 0; i < 2; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        return ledger.commit(request("300"));
                    }
                    catch (FinOrchException e) {
                        failures.add(e.getErrorType());
                        return null;
                    }
                }));
            }
            start.countDown();
            final var receipts = new ArrayList<TransferReceipt>();
            for (final var future : futures) {
                final var receipt = future.get(10, TimeUnit.SECONDS);
                if (receipt != null) {
                    receipts.add(receipt);
                }
            }
            assertAll(
                    () -> assertEquals(1, receipts.size()),
                    () -> assertEquals(List.of(ErrorType.INSUFFICIENT_FUNDS), List.copyOf(failures)),
                    () -> assertEquals(Money.of(200), available(repository)),
                    () -> assertEquals(5, repository.listTransactions(TestData.ALICE, "CHK-1").size())
            );
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testIdFormat() {
        final var id = TransferIds.next(TestData.clock());
        assertAll(
                () -> assertTrue(TransferIds.isTransferId(id)),
                () -> assertTrue(id.startsWith("T-FT-20250615100000-")),
                () -> assertFalse(TransferIds.isTransferId("TXN-1"))
        );
    }

    @Test
    void testRejectedTransferLeavesAccountUntouched() {
        final InMemoryRepository repository = TestData.repository();
        final var ledger = new TransferLedger(repository, TestData.setup());
        assertThrows(FinOrchException.class, () -> ledger.commit(request("99999")));
        assertNull(repository.getAccount(TestData.ALICE, "CHK-1").orElseThrow().getLastUpdated());
    }
}
