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
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Seed data for one user in an {@link InMemoryRepository}. A null account list means the user has no accounts
 * record at all.
 */
@Value
@Builder
public class UserRecords {
    List<Account> accounts;
    @Singular
    List<Payee> payees;
    @Singular
    Map<String, List<TransactionRecord>> transactions;
    @Singular
    List<Card> cards;
    @Singular
    List<CardPayment> cardPayments;
    @Singular
    List<CardTransaction> cardTransactions;
    @Singular
    List<Holding> holdings;
    @Singular
    List<InvestmentTransaction> investmentTransactions;
    @Singular
    List<SipPlan> sipPlans;
    AdvisoryEnrollment advisory;
}
