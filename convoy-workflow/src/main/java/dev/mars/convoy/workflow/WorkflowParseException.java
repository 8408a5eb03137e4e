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

/**
 * Exception thrown when a workflow definition cannot be parsed or fails validation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class WorkflowParseException extends Exception {

    private final String workflowName;
    private final int lineNumber;
    private final String fieldPath;
    private final ValidationResult validationResult;

    public WorkflowParseException(String message) {
        this(null, -1, null, message, null, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, -1, null, message, cause, null);
    }

    public WorkflowParseException(String workflowName, String fieldPath, String message) {
        this(workflowName, -1, fieldPath, message, null, null);
    }

    public WorkflowParseException(String workflowName, int lineNumber, String fieldPath, String message, Throwable cause) {
        this(workflowName, lineNumber, fieldPath, message, cause, null);
    }

    /**
     * A definition that parsed but failed validation; the message lists the errors.
     */
    public WorkflowParseException(String workflowName, ValidationResult validationResult) {
        this(workflowName, -1, null, "Invalid workflow: " + validationResult.getErrorSummary(), null, validationResult);
    }

    private WorkflowParseException(String workflowName, int lineNumber, String fieldPath, String message,
                                   Throwable cause, ValidationResult validationResult) {
        super(message, cause);
        this.workflowName = workflowName;
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
        this.validationResult = validationResult;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (workflowName != null) {
            sb.append("Workflow '").append(workflowName).append("': ");
        }
        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }
        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }
        sb.append(super.getMessage());
        return sb.toString();
    }
}
