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

package com.phonepe.finorch.core.identity;

import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of running the {@link IdentityGate}. Only {@link Type#PASS} lets a turn reach domain logic.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GateOutcome {
    private static final GateOutcome PASS = new GateOutcome(Type.PASS, null);

    public enum Type {
        PASS,
        ASK_FOR_IDENTITY,
        REJECTED,
    }

    Type type;
    FinOrchError error;

    public static GateOutcome pass() {
        return PASS;
    }

    public static GateOutcome askForIdentity() {
        return new GateOutcome(Type.ASK_FOR_IDENTITY, FinOrchError.error(ErrorType.MISSING));
    }

    public static GateOutcome rejected(ErrorType reason, String userId) {
        return new GateOutcome(Type.REJECTED, FinOrchError.error(reason, userId));
    }

    public boolean passed() {
        return type == Type.PASS;
    }

    public ErrorType reason() {
        return error == null ? null : error.getErrorType();
    }
}
