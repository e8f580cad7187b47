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

package com.phonepe.finorch.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * All outcome codes surfaced by the orchestration layer
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", ErrorCategory.NONE),

    MISSING("No user id has been provided", ErrorCategory.IDENTITY),
    INVALID_FORMAT("User id %s is not in a valid format", ErrorCategory.IDENTITY),
    USER_NOT_FOUND("No user found with id %s", ErrorCategory.IDENTITY),
    ACCOUNTS_NOT_FOUND("No accounts found for user %s", ErrorCategory.IDENTITY),
    IDENTITY_REQUIRED("A confirmed identity is required for this operation", ErrorCategory.IDENTITY),

    NO_PLAN_FOUND("No plan found in session. Please create a plan first", ErrorCategory.PLAN),
    INVALID_PLAN("Plan is invalid: %s", ErrorCategory.PLAN),
    PLAN_REFUSED("Request is outside the scope of this assistant", ErrorCategory.PLAN),

    OUT_OF_SCOPE("Request is out of scope: %s", ErrorCategory.ROUTING),
    SCOPE_VIOLATION("Handler %s attempted to read %s records", ErrorCategory.ROUTING),
    UNSUPPORTED_OPERATION("Operation %s is not supported by %s", ErrorCategory.ROUTING),
    INVALID_PARAMETER("Invalid value for parameter %s", ErrorCategory.ROUTING),

    INVALID_AMOUNT("Transfer amount must be greater than zero", ErrorCategory.VALIDATION),
    ACCOUNT_NOT_FOUND("Account %s not found", ErrorCategory.VALIDATION),
    CURRENCY_MISMATCH("Requested currency %s does not match account currency %s", ErrorCategory.VALIDATION),
    INSUFFICIENT_FUNDS("Insufficient funds in account %s", ErrorCategory.VALIDATION),
    NOT_FOUND("No match found for %s", ErrorCategory.VALIDATION),
    PAYEE_NOT_CONFIRMED("Payee was not confirmed", ErrorCategory.VALIDATION),
    ACCOUNT_NOT_CONFIRMED("Source account was not confirmed", ErrorCategory.VALIDATION),
    TRANSFER_NOT_CONFIRMED("Transfer was not confirmed", ErrorCategory.VALIDATION),
    TRANSFER_EXPIRED("Transfer was idle for too long and has been discarded", ErrorCategory.VALIDATION),
    CANCELLED("Transfer was cancelled", ErrorCategory.VALIDATION),

    PERSISTENCE_FAILURE("Could not persist changes: %s", ErrorCategory.PERSISTENCE),
    COMMIT_PENDING("Transfer %s could not be confirmed and will be applied on recovery", ErrorCategory.PERSISTENCE),
    ;

    private final String message;
    private final ErrorCategory category;

    public boolean isRecoverable() {
        return category != ErrorCategory.PERSISTENCE;
    }
}
