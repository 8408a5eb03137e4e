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

import dev.mars.convoy.config.ConvoyConfiguration;
import dev.mars.convoy.core.Execution;
import dev.mars.convoy.core.ExecutionStatus;
import dev.mars.convoy.core.Ids;
import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.StepResult;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.core.exceptions.WorkflowExecutionException;
import dev.mars.convoy.variables.VariableStore;
import dev.mars.convoy.workflow.action.ActionRegistry;
import dev.mars.convoy.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Default {@link WorkflowEngine}. Runs execute on the caller's thread; {@link #executeAsync}
 * and detached {@code call-workflow} steps use a cached worker pool.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class SimpleWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimpleWorkflowEngine.class);

    private final ActionRegistry actionRegistry;
    private final WorkflowRegistry workflowRegistry;
    private final StepInterpreter interpreter;
    private final WorkflowMetrics metrics;
    private final ExecutorService executorService;
    private final Map<String, ExecutionContext> activeExecutions;
    private volatile boolean shutdown = false;

    public SimpleWorkflowEngine() {
        this(ActionRegistry.withBuiltIns(), null, new ConvoyConfiguration());
    }

    /**
     * @param actionRegistry resolves non-control-flow step types
     * @param workflowRegistry resolves {@code call-workflow} targets; may be null when nested calls are not used
     * @param configuration loop limits, call depth and metrics switch
     */
    public SimpleWorkflowEngine(ActionRegistry actionRegistry, WorkflowRegistry workflowRegistry,
                                ConvoyConfiguration configuration) {
        this.actionRegistry = Objects.requireNonNull(actionRegistry, "Action registry cannot be null");
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.workflowRegistry = workflowRegistry;
        this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;
        this.interpreter = new StepInterpreter(actionRegistry, workflowRegistry, configuration, metrics);
        this.executorService = Executors.newCachedThreadPool();
        this.activeExecutions = new ConcurrentHashMap<>();
    }

    @Override
    public Execution execute(Workflow workflow, RunOptions options) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        if (shutdown) {
            throw new IllegalStateException("Workflow engine is shutdown");
        }
        return run(createContext(workflow, options != null ? options : RunOptions.defaults()));
    }

    @Override
    public CompletableFuture<Execution> executeAsync(Workflow workflow, RunOptions options) {
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        return CompletableFuture.supplyAsync(() -> execute(workflow, options), executorService);
    }

    @Override
    public ExecutionContext createContext(Workflow workflow, RunOptions options) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        Objects.requireNonNull(options, "Run options cannot be null");
        String executionId = options.getExecutionId() != null ? options.getExecutionId() : Ids.next("exec");

        Map<String, Object> initial = new LinkedHashMap<>(workflow.getVariables());
        initial.putAll(options.getParameters());
        VariableStore variables = new VariableStore(initial);
        variables.setProfile(options.getProfile());
        variables.setSession(options.getSession());

        return new ExecutionContext(executionId, workflow, variables, options, this);
    }

    @Override
    public StepResult executeStep(Step step, ExecutionContext context, boolean continueOnError)
            throws WorkflowExecutionException {
        Objects.requireNonNull(step, "Step cannot be null");
        Objects.requireNonNull(context, "Context cannot be null");
        return interpreter.executeStep(step, context, continueOnError);
    }

    private Execution run(ExecutionContext context) {
        Execution execution = context.getExecution();
        Workflow workflow = context.getWorkflow();
        String executionId = context.getExecutionId();

        activeExecutions.put(executionId, context);
        execution.start();
        if (metrics != null) {
            metrics.recordWorkflowStarted(workflow.getId());
        }
        logger.info("Starting workflow execution {} for workflow {} ({} steps)",
                executionId, workflow.getId(), workflow.getSteps().size());

        try {
            Optional<StepResult.Signal> signal = interpreter.executeSteps(workflow.getSteps(), context,
                    context.getOptions().isContinueOnError(), context.getOptions().getProgressListener());
            if (context.isCancelled()) {
                execution.stop("Execution cancelled");
            } else {
                if (signal.isPresent() && signal.get() instanceof StepResult.Stop stop) {
                    logger.info("Workflow execution {} stopped early: {}", executionId, stop.message());
                }
                execution.complete();
            }
        } catch (WorkflowExecutionException e) {
            if (context.isCancelled()) {
                execution.stop("Execution cancelled");
            } else {
                logger.error("Workflow execution {} failed: {}", executionId, e.getMessage());
                logger.debug("Workflow execution failure details for {}", executionId, e);
                execution.fail(e.getMessage());
            }
        } catch (RuntimeException e) {
            logger.error("Workflow execution {} failed unexpectedly: {}", executionId, e.getMessage());
            logger.debug("Workflow execution failure details for {}", executionId, e);
            execution.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            activeExecutions.remove(executionId);
            recordOutcome(workflow, execution);
        }

        logger.info("Workflow execution {} finished with status {} in {} ms",
                executionId, execution.getStatus(), execution.getDuration().toMillis());
        return execution;
    }

    private void recordOutcome(Workflow workflow, Execution execution) {
        if (metrics == null) {
            return;
        }
        switch (execution.getStatus()) {
            case COMPLETED:
                metrics.recordWorkflowCompleted(workflow.getId(), execution.getDuration().toMillis() / 1000.0);
                break;
            case STOPPED:
                metrics.recordWorkflowStopped(workflow.getId());
                break;
            default:
                metrics.recordWorkflowFailed(workflow.getId(), execution.getError().orElse(null));
        }
    }

    @Override
    public Optional<ExecutionStatus> getStatus(String executionId) {
        ExecutionContext context = activeExecutions.get(executionId);
        return context != null ? Optional.of(context.getExecution().getStatus()) : Optional.empty();
    }

    @Override
    public boolean cancel(String executionId) {
        ExecutionContext context = activeExecutions.get(executionId);
        if (context != null && context.getExecution().isRunning()) {
            logger.info("Cancelling workflow execution: {}", executionId);
            context.cancel();
            return true;
        }
        return false;
    }

    @Override
    public List<Execution> getActiveExecutions() {
        return activeExecutions.values().stream()
                .map(ExecutionContext::getExecution)
                .collect(Collectors.toList());
    }

    public ActionRegistry getActionRegistry() {
        return actionRegistry;
    }

    public Optional<WorkflowRegistry> getWorkflowRegistry() {
        return Optional.ofNullable(workflowRegistry);
    }

    @Override
    public void shutdown() {
        shutdown = true;
        activeExecutions.values().forEach(ExecutionContext::cancel);
        executorService.shutdown();
        logger.info("SimpleWorkflowEngine shutdown initiated");
    }
}
