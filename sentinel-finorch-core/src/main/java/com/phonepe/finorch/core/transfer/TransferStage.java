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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Stages of the funds transfer saga, in the order they run
 */
@Getter
@AllArgsConstructor
public enum TransferStage {
    IDENTIFY_USER(false),
    CAPTURE_PAYEE(false),
    RESOLVE_PAYEE(false),
    CAPTURE_SOURCE_ACCOUNT(false),
    VALIDATE_SOURCE_ACCOUNT(false),
    CHECK_BALANCE(false),
    CONFIRM_TRANSFER(false),
    COMMIT_TRANSFER(false),
    REPORT_RESULT(false),
    COMPLETED(true),
    ABORTED(true),
    ;

    private final boolean terminal;
}
