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

import lombok.Value;

/**
 * A structured, user facing error
 */
@Value
public class FinOrchError {
    ErrorType errorType;
    String message;

    public static FinOrchError success() {
        return new FinOrchError(ErrorType.SUCCESS, ErrorType.SUCCESS.getMessage());
    }

    public static FinOrchError error(ErrorType errorType, Object... args) {
        return new FinOrchError(errorType, String.format(errorType.getMessage(), args));
    }

    public static FinOrchError error(ErrorType errorType, Throwable throwable) {
        var cause = throwable.getCause();
        var message = throwable.getMessage();
        while (cause != null) {
            message = cause.getMessage();
            cause = cause.getCause();
        }
        return FinOrchError.error(errorType, message);
    }
}
