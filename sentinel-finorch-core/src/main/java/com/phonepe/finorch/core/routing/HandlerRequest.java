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

import com.phonepe.finorch.core.session.SessionState;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Map;

/**
 * Everything a handler gets to see for one invocation
 */
@Value
@Builder
@With
public class HandlerRequest {
    @NonNull
    SessionState session;
    /**
     * The query text for this invocation. For plan steps, the step's query.
     */
    String query;
    @Builder.Default
    Map<String, Object> parameters = Map.of();
    /**
     * Results of earlier steps of the same plan, in step order
     */
    @Builder.Default
    List<HandlerResult> priorResults = List.of();
    /**
     * Read access restricted to the handler's vertical. Filled in by the router.
     */
    ScopedRepository repository;
}
