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

import com.phonepe.finorch.core.repository.RecordType;

import java.util.Set;

/**
 * A bounded-scope handler for one {@link Domain}. Handlers must not call other handlers; cross-domain work is
 * expressed as multiple plan steps.
 */
public interface DomainHandler {
    Domain domain();

    /**
     * @return Record types this handler may read. Reads outside this set fail with a scope violation.
     */
    Set<RecordType> readScope();

    HandlerResult handle(HandlerRequest request);
}
