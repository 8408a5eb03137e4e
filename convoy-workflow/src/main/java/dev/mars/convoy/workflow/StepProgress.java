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

package dev.mars.convoy.workflow;

import dev.mars.convoy.core.Step;

/**
 * Progress through a workflow's top-level steps.
 *
 * @param currentStep one-based index of the step about to run
 * @param totalSteps number of top-level steps
 * @param percentage completed share before this step, 0 to 100
 * @param step the step about to run
 */
public record StepProgress(int currentStep, int totalSteps, int percentage, Step step) {

    public String action() {
        return step.getType();
    }
}
