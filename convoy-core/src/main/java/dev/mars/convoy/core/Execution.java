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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The record of one workflow run.
 * <p>
 * Created at run start and mutated only by the executor that owns the run; other threads
 * may read it at any time. Once the status is terminal the execution no longer changes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class Execution {

    private final String executionId;
    private final String workflowId;
    private final String workflowName;
    private final List<StepResult> results;
    private volatile ExecutionStatus status;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile String error;

    public Execution(String executionId, String workflowId, String workflowName) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowId = workflowId;
        this.workflowName = workflowName;
        this.results = new CopyOnWriteArrayList<>();
        this.status = ExecutionStatus.PENDING;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Snapshot of the results recorded so far, in execution order.
     */
    public List<StepResult> getResults() {
        return List.copyOf(results);
    }

    public Duration getDuration() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(startedAt, end);
    }

    public boolean isRunning() {
        return status == ExecutionStatus.RUNNING;
    }

    public boolean isSuccessful() {
        return status == ExecutionStatus.COMPLETED;
    }

    public synchronized void start() {
        if (status != ExecutionStatus.PENDING) {
            throw new IllegalStateException("Execution " + executionId + " already started: " + status);
        }
        this.startedAt = Instant.now();
        this.status = ExecutionStatus.RUNNING;
    }

    public void addResult(StepResult result) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + executionId + " is already " + status.getValue());
        }
        results.add(Objects.requireNonNull(result, "Result cannot be null"));
    }

    public synchronized void pause() {
        if (status == ExecutionStatus.RUNNING) {
            this.status = ExecutionStatus.PAUSED;
        }
    }

    public synchronized void resume() {
        if (status == ExecutionStatus.PAUSED) {
            this.status = ExecutionStatus.RUNNING;
        }
    }

    public void complete() {
        finish(ExecutionStatus.COMPLETED, null);
    }

    public void fail(String error) {
        finish(ExecutionStatus.FAILED, error);
    }

    public void stop(String reason) {
        finish(ExecutionStatus.STOPPED, reason);
    }

    private synchronized void finish(ExecutionStatus finalStatus, String error) {
        if (status.isTerminal()) {
            return;
        }
        if (startedAt == null) {
            startedAt = Instant.now();
        }
        this.error = error;
        this.completedAt = Instant.now();
        this.status = finalStatus;
    }

    @Override
    public String toString() {
        return "Execution{" +
               "executionId='" + executionId + '\'' +
               ", workflowId='" + workflowId + '\'' +
               ", status=" + status +
               ", results=" + results.size() +
               ", error='" + error + '\'' +
               '}';
    }
}
