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
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.variables.VariableStore;
import dev.mars.convoy.workflow.action.BrowserPage;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime state of one workflow run: its variables, page handle, result trace and
 * cancellation flag, plus the engine that owns it for nested workflow calls.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class ExecutionContext {

    private final String executionId;
    private final Workflow workflow;
    private final VariableStore variables;
    private final BrowserPage page;
    private final Map<String, Object> profile;
    private final Execution execution;
    private final WorkflowEngine engine;
    private final RunOptions options;
    private final ExecutionContext parent;
    private final Instant startTime;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    ExecutionContext(String executionId, Workflow workflow, VariableStore variables,
                     RunOptions options, WorkflowEngine engine) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflow = Objects.requireNonNull(workflow, "Workflow cannot be null");
        this.variables = Objects.requireNonNull(variables, "Variables cannot be null");
        this.options = Objects.requireNonNull(options, "Run options cannot be null");
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.page = options.getPage();
        this.profile = options.getProfile();
        this.parent = options.getParent();
        this.execution = new Execution(executionId, workflow.getId(), workflow.getName());
        this.startTime = Instant.now();
    }

    public String getExecutionId() {
        return executionId;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public VariableStore getVariables() {
        return variables;
    }

    public Optional<BrowserPage> getPage() {
        return Optional.ofNullable(page);
    }

    public Map<String, Object> getProfile() {
        return profile;
    }

    public Execution getExecution() {
        return execution;
    }

    public WorkflowEngine getEngine() {
        return engine;
    }

    public RunOptions getOptions() {
        return options;
    }

    public int getDepth() {
        return options.getDepth();
    }

    public Instant getStartTime() {
        return startTime;
    }

    /**
     * Request prompt cancellation; checked before every step.
     */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * True once this run, or the run that is waiting on it, has been cancelled.
     */
    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    // Variable shortcuts for actions
    public String interpolate(String template) {
        return variables.interpolate(template);
    }

    public Object interpolateObject(Object value) {
        return variables.interpolateObject(value);
    }

    public Object evaluate(String expression) {
        return variables.evaluate(expression);
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "executionId='" + executionId + '\'' +
               ", workflowId='" + workflow.getId() + '\'' +
               ", depth=" + getDepth() +
               ", cancelled=" + isCancelled() +
               '}';
    }
}
