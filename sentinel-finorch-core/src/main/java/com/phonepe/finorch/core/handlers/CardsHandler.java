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
import com.phonepe.finorch.core.model.CardPayment;
import com.phonepe.finorch.core.model.CardTransaction;
import com.phonepe.finorch.core.repository.RecordType;
import com.phonepe.finorch.core.routing.Domain;
import com.phonepe.finorch.core.routing.HandlerRequest;
import com.phonepe.finorch.core.routing.HandlerResult;
import com.phonepe.finorch.core.routing.ScopedRepository;
import com.phonepe.finorch.core.setup.OrchestratorSetup;
import com.phonepe.finorch.core.utils.Parameters;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Credit cards, payments made towards them and the purchases charged to them
 */
@Slf4j
public class CardsHandler extends BaseDomainHandler {
    public enum Operation {
        LIST_CARDS,
        PAYMENT_HISTORY,
        CARD_TRANSACTIONS,
    }

    public CardsHandler(OrchestratorSetup setup) {
        super(setup);
    }

    @Override
    public Domain domain() {
        return Domain.CARDS;
    }

    @Override
    public Set<RecordType> readScope() {
        return EnumSet.of(RecordType.CARDS, RecordType.CARD_PAYMENTS, RecordType.CARD_TRANSACTIONS);
    }

    @Override
    public HandlerResult handle(HandlerRequest request) {
        final var operation = operation(request, Operation.class, Operation.LIST_CARDS);
        final var repository = request.getRepository();
        final var params = request.getParameters();
        log.debug("Cards operation {} for user {}", operation, repository.getUserId());
        return switch (operation) {
            case LIST_CARDS -> HandlerResult.ok(domain(), repository.cards());
            case PAYMENT_HISTORY -> paymentHistory(repository, Parameters.string(params, "card_id").orElse(null));
            case CARD_TRANSACTIONS -> cardTransactions(repository, params);
        };
    }

    private HandlerResult paymentHistory(ScopedRepository repository, String cardId) {
        if (unknownCard(repository, cardId)) {
            return HandlerResult.failed(domain(), FinOrchError.error(ErrorType.NOT_FOUND, cardId));
        }
        final var payments = repository.cardPayments()
                .stream()
                .filter(payment -> cardId == null || cardId.equals(payment.getCardId()))
                .sorted(Comparator.comparing(CardPayment::getDate,
                                             Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        return HandlerResult.ok(domain(), payments);
    }

    /**
     * Purchases and refunds, newest first, narrowed by card_id and the {@link TransactionFilter} parameters
     */
    private HandlerResult cardTransactions(ScopedRepository repository, Map<String, Object> params) {
        final var cardId = Parameters.string(params, "card_id").orElse(null);
        if (unknownCard(repository, cardId)) {
            return HandlerResult.failed(domain(), FinOrchError.error(ErrorType.NOT_FOUND, cardId));
        }
        final var limit = Math.min(BankingHandler.MAX_LIMIT,
                                   Math.max(1, Parameters.integer(params, "limit", BankingHandler.MAX_LIMIT)));
        final var filter = TransactionFilter.from(params);
        final var transactions = repository.cardTransactions()
                .stream()
                .filter(txn -> cardId == null || cardId.equals(txn.getCardId()))
                .filter(txn -> filter.matches(txn.getDate(), txn.getCategory(), txn.getAmount(),
                                              txn.getPaymentMedium()))
                .sorted(Comparator.comparing(CardTransaction::getDate,
                                             Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .toList();
        return HandlerResult.ok(domain(), transactions);
    }

    private static boolean unknownCard(ScopedRepository repository, String cardId) {
        return cardId != null && repository.cards().stream().noneMatch(card -> cardId.equals(card.getCardId()));
    }
}
