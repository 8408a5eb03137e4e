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

import dev.mars.convoy.core.ExecutionStatus;
import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.StepResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of a debug session for presentation layers.
 *
 * @param currentStep the next step to execute, null once all steps ran
 * @param error the failure message once the session failed, otherwise null
 */
public record DebugSnapshot(String debugId,
                            String workflowId,
                            String workflowName,
                            ExecutionStatus status,
                            int currentStepIndex,
                            int totalSteps,
                            Step currentStep,
                            Map<String, Object> variables,
                            List<StepResult> results,
                            Set<String> breakpoints,
                            String error,
                            Instant createdAt,
                            Instant updatedAt) {

    public boolean completed() {
        return status == ExecutionStatus.COMPLETED;
    }
}
