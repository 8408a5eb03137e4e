/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.convoy.workflow.action;

import dev.mars.convoy.workflow.ExecutionContext;

import java.util.Map;

/**
 * A leaf step implementation, resolved by step type through {@link ActionRegistry}.
 * <p>
 * The config map has already been interpolated against the run's variables. Implementations
 * report ordinary failures with {@link ActionResult#failure(String)}; any exception thrown is
 * converted into a failed step result by the engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
@FunctionalInterface
public interface Action {

    ActionResult execute(ExecutionContext context, Map<String, Object> config) throws Exception;
}
