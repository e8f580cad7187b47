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

package com.phonepe.finorch.core.routing;

import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Output of a single handler invocation
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HandlerResult {
    public enum Status {
        OK,
        AWAITING_INPUT,
        OUT_OF_SCOPE,
        FAILED,
    }

    Domain domain;
    Status status;
    Object data;
    FinOrchError error;

    public static HandlerResult ok(Domain domain, Object data) {
        return new HandlerResult(domain, Status.OK, data, null);
    }

    public static HandlerResult awaitingInput(Domain domain, Object data) {
        return new HandlerResult(domain, Status.AWAITING_INPUT, data, null);
    }

    public static HandlerResult outOfScope(String reason) {
        return new HandlerResult(Domain.OUT_OF_SCOPE,
                                 Status.OUT_OF_SCOPE,
                                 null,
                                 FinOrchError.error(ErrorType.OUT_OF_SCOPE, reason));
    }

    public static HandlerResult failed(Domain domain, FinOrchError error) {
        return new HandlerResult(domain, Status.FAILED, null, error);
    }

    public static HandlerResult failed(Domain domain, FinOrchError error, Object data) {
        return new HandlerResult(domain, Status.FAILED, data, error);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
