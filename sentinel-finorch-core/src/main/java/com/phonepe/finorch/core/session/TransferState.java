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

package com.phonepe.finorch.core.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.transfer.InputKind;
import com.phonepe.finorch.core.transfer.TransferStage;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Scratch state of an in-flight funds transfer. Confirmation flags are nullable: null means the question has not
 * been answered yet, false means the caller said no.
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
public class TransferState {
    private TransferStage stage;
    /**
     * Input the transfer is suspended on. Null while running or once finished.
     */
    private InputKind awaiting;
    private String payeeQuery;
    private List<String> payeeCandidates = new ArrayList<>();
    private String payeeId;
    private String payeeName;
    private Boolean payeeConfirmed;
    private String accountId;
    private Boolean accountConfirmed;
    private BigDecimal amount;
    private String currency;
    private String reference;
    private Boolean confirmed;
    private String transferId;
    private ErrorType failure;
    private long startedAt;
    private long lastActivityAt;

    @JsonIgnore
    public boolean isInProgress() {
        return stage != null && !stage.isTerminal();
    }
}
