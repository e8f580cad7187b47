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

import com.phonepe.finorch.core.model.Holding;
import com.phonepe.finorch.core.utils.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Market value, cost basis and unrealized gain per asset type and in total
 */
@Value
public class PortfolioSummary {
    @Value
    public static class AssetTypeSummary {
        String assetType;
        int holdings;
        BigDecimal marketValue;
        BigDecimal costBasis;
        BigDecimal unrealizedGain;
    }

    List<AssetTypeSummary> assetTypes;
    BigDecimal totalMarketValue;
    BigDecimal totalCostBasis;
    BigDecimal totalUnrealizedGain;

    public static PortfolioSummary of(Collection<Holding> holdings) {
        final var byType = new TreeMap<String, List<Holding>>();
        holdings.forEach(holding -> byType.computeIfAbsent(Objects.requireNonNullElse(holding.getAssetType(),
                                                                                       "OTHER"),
                                                           type -> new ArrayList<>())
                .add(holding));
        final var summaries = byType.entrySet()
                .stream()
                .map(entry -> {
                    final var market = total(entry.getValue(), true);
                    final var cost = total(entry.getValue(), false);
                    return new AssetTypeSummary(entry.getKey(),
                                                entry.getValue().size(),
                                                market,
                                                cost,
                                                market.subtract(cost));
                })
                .toList();
        final var market = total(holdings, true);
        final var cost = total(holdings, false);
        return new PortfolioSummary(summaries, market, cost, market.subtract(cost));
    }

    private static BigDecimal total(Collection<Holding> holdings, boolean marketValue) {
        return Money.of(holdings.stream()
                                .map(holding -> marketValue ? holding.marketValue() : holding.costBasis())
                                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }
}
