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

import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

@UtilityClass
public class UserIds {
    /**
     * 3 to 32 characters, alphanumeric first, then alphanumerics plus '.', '_' and '-'
     */
    private static final Pattern USER_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{2,31}");

    public static boolean isWellFormed(String userId) {
        return userId != null && USER_ID_PATTERN.matcher(userId).matches();
    }
}
