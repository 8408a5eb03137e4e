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

package dev.mars.convoy.core.exceptions;

/**
 * Exception thrown when a workflow run fails: a step failed outside a try block,
 * a stop step requested failure, or a nested block re-raised its error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class WorkflowExecutionException extends ConvoyException {

    private final String stepId;
    private final String stepName;

    public WorkflowExecutionException(String message) {
        this(null, null, message);
    }

    public WorkflowExecutionException(String stepId, String stepName, String message) {
        super(message);
        this.stepId = stepId;
        this.stepName = stepName;
    }

    public WorkflowExecutionException(String stepId, String stepName, String message, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
        this.stepName = stepName;
    }

    public String getStepId() {
        return stepId;
    }

    public String getStepName() {
        return stepName;
    }
}
