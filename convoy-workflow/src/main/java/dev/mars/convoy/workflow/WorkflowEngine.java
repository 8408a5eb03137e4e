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

import dev.mars.convoy.core.Execution;
import dev.mars.convoy.core.ExecutionStatus;
import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.StepResult;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.core.exceptions.WorkflowExecutionException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for executing workflow step trees.
 */
public interface WorkflowEngine {

    /**
     * Runs a workflow to completion on the calling thread.
     *
     * @param workflow the workflow to run
     * @param options parameters, profile, page and error behaviour for this run
     * @return the finished execution; never throws for step failures
     */
    Execution execute(Workflow workflow, RunOptions options);

    /**
     * Runs a workflow on the engine's worker pool.
     *
     * @param workflow the workflow to run
     * @param options run options
     * @return future completing with the finished execution
     */
    CompletableFuture<Execution> executeAsync(Workflow workflow, RunOptions options);

    /**
     * Builds the context a run would use without executing anything.
     * Used by debug sessions that drive steps one at a time.
     */
    ExecutionContext createContext(Workflow workflow, RunOptions options);

    /**
     * Executes one step (and its children) against a context, appending the results.
     *
     * @param step the step to execute
     * @param context the run context
     * @param continueOnError whether a failed child lets its sequence continue
     * @return the step's own result
     * @throws WorkflowExecutionException when the step fails and the failure propagates
     */
    StepResult executeStep(Step step, ExecutionContext context, boolean continueOnError)
            throws WorkflowExecutionException;

    /**
     * Gets the status of a running execution.
     *
     * @param executionId the execution ID
     * @return the status, empty if the execution is not active
     */
    Optional<ExecutionStatus> getStatus(String executionId);

    /**
     * Requests cancellation of a running execution. The run stops before its next step.
     *
     * @param executionId the execution ID
     * @return true if a running execution was found
     */
    boolean cancel(String executionId);

    /**
     * Snapshot of the executions currently running.
     */
    List<Execution> getActiveExecutions();

    /**
     * Shuts down the engine and cleans up resources.
     */
    void shutdown();
}
