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

import com.phonepe.finorch.core.model.InvestmentTransaction;
import com.phonepe.finorch.core.model.SipPlan;
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
 * Stock and mutual fund holdings, their transactions and SIP plans
 */
@Slf4j
public class InvestmentsHandler extends BaseDomainHandler {
    public enum Operation {
        LIST_HOLDINGS,
        HOLDINGS_SUMMARY,
        STOCK_TRANSACTIONS,
        MUTUAL_FUND_TRANSACTIONS,
        SIP_PLANS,
    }

    public static final String STOCK = "STOCK";
    public static final String MUTUAL_FUND = "MUTUAL_FUND";

    public InvestmentsHandler(OrchestratorSetup setup) {
        super(setup);
    }

    @Override
    public Domain domain() {
        return Domain.INVESTMENTS;
    }

    @Override
    public Set<RecordType> readScope() {
        return EnumSet.of(RecordType.HOLDINGS, RecordType.INVESTMENT_TRANSACTIONS, RecordType.SIP_PLANS);
    }

    @Override
    public HandlerResult handle(HandlerRequest request) {
        final var operation = operation(request, Operation.class, Operation.HOLDINGS_SUMMARY);
        final var repository = request.getRepository();
        log.debug("Investments operation {} for user {}", operation, repository.getUserId());
        return switch (operation) {
            case LIST_HOLDINGS -> {
                final var assetType = Parameters.string(request.getParameters(), "asset_type").orElse(null);
                yield HandlerResult.ok(domain(),
                                       repository.holdings()
                                               .stream()
                                               .filter(holding -> assetType == null
                                                       || assetType.equalsIgnoreCase(holding.getAssetType()))
                                               .toList());
            }
            case HOLDINGS_SUMMARY -> HandlerResult.ok(domain(), PortfolioSummary.of(repository.holdings()));
            case STOCK_TRANSACTIONS -> transactions(repository, STOCK, request.getParameters());
            case MUTUAL_FUND_TRANSACTIONS -> transactions(repository, MUTUAL_FUND, request.getParameters());
            case SIP_PLANS -> sipPlans(repository, Parameters.string(request.getParameters(), "status").orElse(null));
        };
    }

    /**
     * Transactions of one asset type, newest first. Takes symbol, start_date and end_date.
     */
    private HandlerResult transactions(ScopedRepository repository, String assetType, Map<String, Object> params) {
        final var symbol = Parameters.string(params, "symbol").orElse(null);
        final var from = Parameters.date(params, "start_date").orElse(null);
        final var to = Parameters.date(params, "end_date").orElse(null);
        final var transactions = repository.investmentTransactions()
                .stream()
                .filter(txn -> assetType.equalsIgnoreCase(txn.getAssetType()))
                .filter(txn -> symbol == null || symbol.equalsIgnoreCase(txn.getSymbol()))
                .filter(txn -> from == null || (txn.getDate() != null && !txn.getDate().isBefore(from)))
                .filter(txn -> to == null || (txn.getDate() != null && !txn.getDate().isAfter(to)))
                .sorted(Comparator.comparing(InvestmentTransaction::getDate,
                                             Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        return HandlerResult.ok(domain(), transactions);
    }

    private HandlerResult sipPlans(ScopedRepository repository, String status) {
        return HandlerResult.ok(domain(),
                                repository.sipPlans()
                                        .stream()
                                        .filter(plan -> status == null || status.equalsIgnoreCase(plan.getStatus()))
                                        .sorted(Comparator.comparing(SipPlan::getNextDate,
                                                                     Comparator.nullsLast(Comparator.naturalOrder())))
                                        .toList());
    }
}
