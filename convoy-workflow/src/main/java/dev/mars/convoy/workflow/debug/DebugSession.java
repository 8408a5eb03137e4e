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
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.workflow.ExecutionContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A paused, steppable run of one workflow. The session's status is the status of its
 * underlying execution. Callers synchronize on the session while mutating it.
 */
public class DebugSession {

    private final String id;
    private final Workflow workflow;
    private final ExecutionContext context;
    private final Set<String> breakpoints;
    private final List<StepResult> results = new ArrayList<>();
    private final Instant createdAt;
    private Instant updatedAt;
    private int currentStepIndex;

    DebugSession(String id, ExecutionContext context, Collection<String> breakpoints) {
        this.id = id;
        this.context = context;
        this.workflow = context.getWorkflow();
        this.breakpoints = new LinkedHashSet<>(breakpoints != null ? breakpoints : List.of());
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public ExecutionContext getContext() {
        return context;
    }

    public ExecutionStatus getStatus() {
        return context.getExecution().getStatus();
    }

    public boolean isFinished() {
        return getStatus().isTerminal();
    }

    public int getCurrentStepIndex() {
        return currentStepIndex;
    }

    public int getTotalSteps() {
        return workflow.getSteps().size();
    }

    /**
     * The step the next {@code step()} call will execute, or null once all steps ran.
     */
    public Step getCurrentStep() {
        return currentStepIndex < getTotalSteps() ? workflow.getSteps().get(currentStepIndex) : null;
    }

    public synchronized Set<String> getBreakpoints() {
        return Set.copyOf(breakpoints);
    }

    public List<StepResult> getResults() {
        return List.copyOf(results);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    synchronized boolean hasBreakpoint(String stepId) {
        return stepId != null && breakpoints.contains(stepId);
    }

    synchronized void setBreakpoint(String stepId, boolean enabled) {
        if (enabled) {
            breakpoints.add(stepId);
        } else {
            breakpoints.remove(stepId);
        }
        touch();
    }

    void recordResult(StepResult result) {
        results.add(result);
        currentStepIndex++;
        touch();
    }

    void touch() {
        updatedAt = Instant.now();
    }

    public synchronized DebugSnapshot snapshot() {
        return new DebugSnapshot(id, workflow.getId(), workflow.getName(), getStatus(), currentStepIndex,
                getTotalSteps(), getCurrentStep(), context.getVariables().getAll(), getResults(),
                getBreakpoints(), context.getExecution().getError().orElse(null), createdAt, updatedAt);
    }
}
