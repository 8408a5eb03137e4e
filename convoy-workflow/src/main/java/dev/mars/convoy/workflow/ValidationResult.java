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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Errors and warnings collected while validating a workflow definition.
 * Errors reject the definition; warnings (such as an unknown step type) do not.
 */
public class ValidationResult {

    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();

    public void addError(String message) {
        addError(null, message);
    }

    public void addError(String fieldPath, String message) {
        errors.add(new ValidationIssue(Severity.ERROR, fieldPath, message));
    }

    public void addWarning(String fieldPath, String message) {
        warnings.add(new ValidationIssue(Severity.WARNING, fieldPath, message));
    }

    public void merge(ValidationResult other) {
        errors.addAll(other.errors);
        warnings.addAll(other.warnings);
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * All error messages joined with "; ".
     */
    public String getErrorSummary() {
        return errors.stream().map(ValidationIssue::toString).collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() +
               ", errors=" + errors.size() +
               ", warnings=" + warnings.size() + "}";
    }

    public enum Severity {
        ERROR, WARNING
    }

    /**
     * A single validation error or warning, optionally tied to a field path such as {@code steps[2].body[0].type}.
     */
    public record ValidationIssue(Severity severity, String fieldPath, String message) {

        public ValidationIssue {
            Objects.requireNonNull(severity, "Severity cannot be null");
            Objects.requireNonNull(message, "Message cannot be null");
        }

        @Override
        public String toString() {
            return fieldPath != null ? "[" + fieldPath + "] " + message : message;
        }
    }
}
