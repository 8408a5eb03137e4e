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

package dev.mars.convoy.workflow.debug;

import dev.mars.convoy.core.StepResult;

import java.util.List;
import java.util.Optional;

/**
 * Result of a debug controller call. Unsuccessful outcomes carry an error and, when the
 * session exists, its state.
 *
 * @param stepResults results of the steps executed by this call, in order
 */
public record DebugOutcome(boolean success, String error, DebugSnapshot state, List<StepResult> stepResults) {

    public DebugOutcome {
        stepResults = stepResults != null ? List.copyOf(stepResults) : List.of();
    }

    public static DebugOutcome ok(DebugSnapshot state) {
        return new DebugOutcome(true, null, state, List.of());
    }

    public static DebugOutcome ok(DebugSnapshot state, List<StepResult> stepResults) {
        return new DebugOutcome(true, null, state, stepResults);
    }

    public static DebugOutcome failure(String error) {
        return new DebugOutcome(false, error, null, List.of());
    }

    public static DebugOutcome failure(String error, DebugSnapshot state, List<StepResult> stepResults) {
        return new DebugOutcome(false, error, state, stepResults);
    }

    public Optional<DebugSnapshot> getState() {
        return Optional.ofNullable(state);
    }

    /**
     * The result of the last step this call executed.
     */
    public Optional<StepResult> lastResult() {
        return stepResults.isEmpty() ? Optional.empty() : Optional.of(stepResults.get(stepResults.size() - 1));
    }
}
