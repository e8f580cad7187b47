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
import com.phonepe.finorch.core.model.Holding;
import com.phonepe.finorch.core.model.InvestmentTransaction;
import com.phonepe.finorch.core.model.SipPlan;
import com.phonepe.finorch.core.repository.InMemoryRepository;
import com.phonepe.finorch.core.routing.HandlerResult;
import com.phonepe.finorch.core.utils.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;

class InvestmentsHandlerTest {
    private InMemoryRepository repository;
    private InvestmentsHandler handler;

    @BeforeEach
    void setUp() {
        repository = TestData.repository();
        handler = new InvestmentsHandler(TestData.setup());
    }

    private HandlerResult run(Map<String, Object> params) {
        return handler.handle(TestData.request(handler, repository, TestData.session(TestData.ALICE), params));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testListHoldingsByAssetType() {
        final var stocks = (List<Holding>) run(Map.of("operation", "list_holdings",
                                                      "asset_type", "stock")).getData();
        assertEquals(List.of("INFY", "TCS"), stocks.stream().map(Holding::getSymbol).toList());
    }

    @Test
    void testSummaryPerAssetTypeAndTotal() {
        final var summary = (PortfolioSummary) run(Map.of()).getData();
        final var mutualFunds = summary.getAssetTypes().get(0);
        final var stocks = summary.getAssetTypes().get(1);
        assertAll(
                () -> assertEquals(Money.of(38000), summary.getTotalMarketValue()),
                () -> assertEquals(Money.of(36500), summary.getTotalCostBasis()),
                () -> assertEquals(Money.of(1500), summary.getTotalUnrealizedGain()),
                () -> assertEquals("MUTUAL_FUND", mutualFunds.getAssetType()),
                () -> assertEquals(Money.of(1000), mutualFunds.getUnrealizedGain()),
                () -> assertEquals("STOCK", stocks.getAssetType()),
                () -> assertEquals(2, stocks.getHoldings()),
                () -> assertEquals(Money.of(500), stocks.getUnrealizedGain())
        );
    }

    @SuppressWarnings("unchecked")
    private List<String> tradeIds(Map<String, Object> params) {
        return ((List<InvestmentTransaction>) run(params).getData()).stream()
                .map(InvestmentTransaction::getTransactionId)
                .toList();
    }

    @Test
    void testTransactionsPerAssetType() {
        assertAll(
                () -> assertEquals(List.of("IT-1", "IT-2", "IT-4"),
                                   tradeIds(Map.of("operation", "stock_transactions"))),
                () -> assertEquals(List.of("IT-3"), tradeIds(Map.of("operation", "mutual_fund_transactions"))),
                () -> assertEquals(List.of("IT-1", "IT-4"),
                                   tradeIds(Map.of("operation", "stock_transactions", "symbol", "infy"))),
                () -> assertEquals(List.of("IT-1", "IT-2"),
                                   tradeIds(Map.of("operation", "stock_transactions",
                                                   "start_date", "2025-05-01")))
        );
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSipPlansByNextDate() {
        final var all = (List<SipPlan>) run(Map.of("operation", "sip_plans")).getData();
        final var active = (List<SipPlan>) run(Map.of("operation", "sip plans", "status", "active")).getData();
        assertAll(
                () -> assertEquals(List.of("SIP-3", "SIP-2", "SIP-1"), all.stream().map(SipPlan::getSipId).toList()),
                () -> assertEquals(List.of("SIP-3", "SIP-1"), active.stream().map(SipPlan::getSipId).toList())
        );
    }
}
