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

package com.phonepe.finorch.core.plan;

import com.phonepe.finorch.core.session.SessionState;

/**
 * Produces a {@link Plan} for a user request. Provided by the host application. Planning must be free of side
 * effects: no domain actions, no session changes. Returning a plan with no steps refuses the request. A null
 * plan is treated as an invalid one.
 */
@FunctionalInterface
public interface Planner {
    Plan plan(SessionState state, String userInput);
}
