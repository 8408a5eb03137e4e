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
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.workflow.action.ActionRegistry;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural validation of a workflow before it is registered.
 * <p>
 * Missing identifiers and duplicate step ids are errors. A step type that is neither a
 * control-flow type nor a registered action is only a warning, since actions may be
 * registered after the workflow and unknown types fail at run time.
 */
public class WorkflowValidator {

    private final ActionRegistry actionRegistry;

    public WorkflowValidator(ActionRegistry actionRegistry) {
        this.actionRegistry = Objects.requireNonNull(actionRegistry, "Action registry cannot be null");
    }

    public ValidationResult validate(Workflow workflow) {
        ValidationResult result = new ValidationResult();
        if (workflow == null) {
            result.addError("Workflow cannot be null");
            return result;
        }
        if (isBlank(workflow.getId())) {
            result.addError("id", "Workflow must have an ID");
        }
        if (isBlank(workflow.getName())) {
            result.addError("name", "Workflow must have a name");
        }
        if (workflow.getSteps().isEmpty()) {
            result.addError("steps", "Workflow must have steps");
        }
        validateSteps(workflow.getSteps(), "steps", new HashSet<>(), result);
        return result;
    }

    private void validateSteps(List<Step> steps, String path, Set<String> seenIds, ValidationResult result) {
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            String stepPath = path + "[" + i + "]";
            if (isBlank(step.getId())) {
                result.addError(stepPath, "Step must have an ID");
            } else if (!seenIds.add(step.getId())) {
                result.addError(stepPath, "Duplicate step ID '" + step.getId() + "'");
            }
            if (isBlank(step.getType())) {
                result.addError(stepPath, "Step must have a type");
            } else if (!StepTypes.isControlFlow(step.getType()) && !actionRegistry.hasAction(step.getType())) {
                result.addWarning(stepPath, "Unknown step type '" + step.getType() + "'");
            }

            validateSteps(step.getThenSteps(), stepPath + ".then", seenIds, result);
            validateSteps(step.getElseSteps(), stepPath + ".else", seenIds, result);
            validateSteps(step.getBody(), stepPath + ".body", seenIds, result);
            validateSteps(step.getTrySteps(), stepPath + ".try", seenIds, result);
            validateSteps(step.getCatchSteps(), stepPath + ".catch", seenIds, result);
            validateSteps(step.getFinallySteps(), stepPath + ".finally", seenIds, result);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
