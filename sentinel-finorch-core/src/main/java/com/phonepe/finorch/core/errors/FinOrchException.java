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

import lombok.Getter;

/**
 * Raised when a component cannot produce a structured outcome and has to bail out
 */
@Getter
public class FinOrchException extends RuntimeException {
    private final transient FinOrchError error;

    public FinOrchException(FinOrchError error) {
        super(error.getMessage());
        this.error = error;
    }

    public FinOrchException(FinOrchError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public ErrorType getErrorType() {
        return error.getErrorType();
    }
}
