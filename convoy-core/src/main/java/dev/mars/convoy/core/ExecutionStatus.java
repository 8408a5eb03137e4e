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

package dev.mars.convoy.core;

import java.util.Locale;

/**
 * Enumeration of workflow execution statuses.
 */
public enum ExecutionStatus {

    /**
     * Execution is created but has not started.
     */
    PENDING,

    /**
     * Execution is currently running.
     */
    RUNNING,

    /**
     * Execution is paused between steps (debug sessions only).
     */
    PAUSED,

    /**
     * Execution completed successfully, including an early successful stop.
     */
    COMPLETED,

    /**
     * Execution failed.
     */
    FAILED,

    /**
     * Execution was cancelled from outside.
     */
    STOPPED;

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }

    /**
     * Checks if the status represents an active state.
     */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    /**
     * Checks if the status represents a successful completion.
     */
    public boolean isSuccessful() {
        return this == COMPLETED;
    }

    /**
     * Lower-case wire value, e.g. {@code completed}.
     */
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
