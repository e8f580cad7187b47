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
import com.phonepe.finorch.core.model.Card;
import com.phonepe.finorch.core.model.CardPayment;
import com.phonepe.finorch.core.model.CardTransaction;
import com.phonepe.finorch.core.repository.InMemoryRepository;
import com.phonepe.finorch.core.routing.HandlerResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CardsHandlerTest {
    private InMemoryRepository repository;
    private CardsHandler handler;

    @BeforeEach
    void setUp() {
        repository = TestData.repository();
        handler = new CardsHandler(TestData.setup());
    }

    private HandlerResult run(Map<String, Object> params) {
        return handler.handle(TestData.request(handler, repository, TestData.session(TestData.ALICE), params));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testListCardsIsDefault() {
        final var cards = (List<Card>) run(Map.of()).getData();
        assertEquals(List.of("CARD-1", "CARD-2"), cards.stream().map(Card::getCardId).toList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testPaymentHistory() {
        final var all = (List<CardPayment>) run(Map.of("operation", "payment_history")).getData();
        final var forCard = (List<CardPayment>) run(Map.of("operation", "payment_history",
                                                           "card_id", "CARD-1")).getData();
        assertAll(
                () -> assertEquals(List.of("PAY-2", "PAY-1", "PAY-3"),
                                   all.stream().map(CardPayment::getPaymentId).toList()),
                () -> assertEquals(List.of("PAY-1", "PAY-3"),
                                   forCard.stream().map(CardPayment::getPaymentId).toList())
        );
    }

    @Test
    void testPaymentHistoryForUnknownCard() {
        final var result = run(Map.of("operation", "payment_history", "card_id", "CARD-404"));
        assertAll(
                () -> assertEquals(HandlerResult.Status.FAILED, result.getStatus()),
                () -> assertEquals(ErrorType.NOT_FOUND, result.getError().getErrorType())
        );
    }

    @SuppressWarnings("unchecked")
    private List<String> transactionIds(Map<String, Object> params) {
        return ((List<CardTransaction>) run(params).getData()).stream()
                .map(CardTransaction::getTransactionId)
                .toList();
    }

    @Test
    void testCardTransactionsNewestFirst() {
        assertEquals(List.of("CT-1", "CT-2", "CT-4", "CT-3"),
                     transactionIds(Map.of("operation", "card_transactions")));
    }

    @Test
    void testCardTransactionFilters() {
        assertAll(
                () -> assertEquals(List.of("CT-1", "CT-4"),
                                   transactionIds(Map.of("operation", "card_transactions",
                                                         "card_id", "CARD-1",
                                                         "categories", List.of("shopping")))),
                () -> assertEquals(List.of("CT-1", "CT-3"),
                                   transactionIds(Map.of("operation", "card_transactions", "min_amount", "1000"))),
                () -> assertEquals(List.of("CT-2"),
                                   transactionIds(Map.of("operation", "card_transactions",
                                                         "payment_mediums", "pos"))),
                () -> assertEquals(List.of("CT-2", "CT-4"),
                                   transactionIds(Map.of("operation", "card_transactions",
                                                         "start_date", "2025-06-01",
                                                         "end_date", "2025-06-10"))),
                () -> assertEquals(List.of("CT-1"),
                                   transactionIds(Map.of("operation", "card_transactions", "limit", 1)))
        );
    }

    @Test
    void testCardTransactionsForUnknownCard() {
        final var result = run(Map.of("operation", "card transactions", "card_id", "CARD-404"));
        assertEquals(ErrorType.NOT_FOUND, result.getError().getErrorType());
    }
}
