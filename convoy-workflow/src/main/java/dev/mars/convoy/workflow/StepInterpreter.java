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
import dev.mars.convoy.core.Ids;
import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.StepResult;
import dev.mars.convoy.core.StepResult.Signal;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.core.exceptions.WorkflowExecutionException;
import dev.mars.convoy.variables.LoopContext;
import dev.mars.convoy.variables.ValueConversions;
import dev.mars.convoy.variables.VariableStore;
import dev.mars.convoy.workflow.action.Action;
import dev.mars.convoy.workflow.action.ActionRegistry;
import dev.mars.convoy.workflow.action.ActionResult;
import dev.mars.convoy.workflow.action.BrowserPage;
import dev.mars.convoy.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a step tree for one run.
 * <p>
 * Every executed step, nested or not, appends its result to the run's {@link Execution}
 * in completion order. Break, continue and stop travel upward as {@link Signal} results;
 * failures travel upward as {@link WorkflowExecutionException} until a try-catch step or a
 * sequence running with {@code continueOnError} absorbs them.
 */
final class StepInterpreter {

    private static final Logger logger = LoggerFactory.getLogger(StepInterpreter.class);

    private final ActionRegistry actionRegistry;
    private final WorkflowRegistry workflowRegistry;
    private final ConvoyConfiguration configuration;
    private final ConditionEvaluator conditionEvaluator;
    private final WorkflowMetrics metrics;

    StepInterpreter(ActionRegistry actionRegistry, WorkflowRegistry workflowRegistry,
                    ConvoyConfiguration configuration, WorkflowMetrics metrics) {
        this.actionRegistry = actionRegistry;
        this.workflowRegistry = workflowRegistry;
        this.configuration = configuration;
        this.conditionEvaluator = new ConditionEvaluator();
        this.metrics = metrics;
    }

    Optional<Signal> executeSteps(List<Step> steps, ExecutionContext context, boolean continueOnError)
            throws WorkflowExecutionException {
        return executeSteps(steps, context, continueOnError, null);
    }

    /**
     * Runs a sequence in order.
     *
     * @return the signal that cut the sequence short, if any
     * @throws WorkflowExecutionException on a failed stop, on a failed step when
     *         {@code continueOnError} is false, or when the run has been cancelled
     */
    Optional<Signal> executeSteps(List<Step> steps, ExecutionContext context, boolean continueOnError,
                                  StepProgressListener progressListener) throws WorkflowExecutionException {
        int total = steps.size();
        for (int i = 0; i < total; i++) {
            Step step = steps.get(i);
            if (context.isCancelled()) {
                throw new WorkflowExecutionException(step.getId(), step.getName(), "Execution cancelled");
            }
            if (progressListener != null) {
                notifyProgress(progressListener, context, new StepProgress(i + 1, total, i * 100 / total, step));
            }

            StepResult result = executeStep(step, context, continueOnError);

            Optional<Signal> signal = result.signal();
            if (signal.isPresent()) {
                if (signal.get() instanceof StepResult.Stop stop && stop.failed()) {
                    String message = stop.message() != null && !stop.message().isEmpty()
                            ? stop.message()
                            : "Workflow stopped with status failed";
                    throw new WorkflowExecutionException(step.getId(), step.getName(), message);
                }
                return signal;
            }
            if (!result.success() && !continueOnError) {
                String error = result.error().orElse("unknown error");
                throw new WorkflowExecutionException(step.getId(), step.getName(),
                        "Step \"" + step.getDisplayName() + "\" failed: " + error);
            }
        }
        return Optional.empty();
    }

    StepResult executeStep(Step step, ExecutionContext context, boolean continueOnError)
            throws WorkflowExecutionException {
        logger.debug("[{}] Executing step {} ({})", context.getExecutionId(), step.getDisplayName(), step.getType());
        StepResult result = dispatch(step, context, continueOnError);
        context.getExecution().addResult(result);
        if (metrics != null) {
            metrics.recordStepExecuted(step.getType(), result.success());
        }
        if (!result.success()) {
            logger.debug("[{}] Step {} failed: {}", context.getExecutionId(), step.getDisplayName(),
                    result.error().orElse("unknown error"));
        }
        return result;
    }

    private StepResult dispatch(Step step, ExecutionContext context, boolean continueOnError)
            throws WorkflowExecutionException {
        String type = step.getType() != null ? step.getType() : "";
        switch (type) {
            case StepTypes.CONDITION:
                return executeCondition(step, context, continueOnError);
            case StepTypes.LOOP_COUNT:
                return executeCountLoop(step, context, continueOnError);
            case StepTypes.LOOP_ARRAY:
                return executeArrayLoop(step, context, continueOnError);
            case StepTypes.LOOP_ELEMENTS:
                return executeElementsLoop(step, context, continueOnError);
            case StepTypes.LOOP_WHILE:
                return executeWhileLoop(step, context, continueOnError);
            case StepTypes.TRY_CATCH:
                return executeTryCatch(step, context);
            case StepTypes.BREAK:
                return new StepResult.Break(step.getId());
            case StepTypes.CONTINUE:
                return new StepResult.Continue(step.getId());
            case StepTypes.STOP:
                return executeStop(step, context);
            case StepTypes.LOG:
                return executeLog(step, context);
            case StepTypes.COMMENT:
                return StepResult.success(step.getId(), Map.of());
            case StepTypes.CALL_WORKFLOW:
                return executeCallWorkflow(step, context);
            default:
                return executeAction(step, context);
        }
    }

    // ---------------------------------------------------------------- condition

    private StepResult executeCondition(Step step, ExecutionContext context, boolean continueOnError)
            throws WorkflowExecutionException {
        boolean conditionResult = conditionEvaluator.evaluate(step.getConfig(), context);
        List<Step> branch = conditionResult ? step.getThenSteps() : step.getElseSteps();
        Optional<Signal> escaped = executeSteps(branch, context, continueOnError);
        return new StepResult.ConditionBranch(step.getId(), conditionResult,
                conditionResult ? "then" : "else", escaped.orElse(null));
    }

    // ---------------------------------------------------------------- loops

    private StepResult executeCountLoop(Step step, ExecutionContext context, boolean continueOnError)
            throws WorkflowExecutionException {
        VariableStore variables = context.getVariables();
        int requested = ValueConversions.toInt(configValue(step, context, "count"), 0);
        int count = clamp(requested, step);
        String variable = variableName(step, "i");

        LoopRun loop = new LoopRun();
        for (int i = 0; i < count && !loop.done(); i++) {
            loop.iterations++;
            Optional<Signal> signal;
            try (VariableStore.LoopScope scope = variables.enterLoop(new LoopContext(i, count, i))) {
                variables.declareLocal(variable, i);
                signal = executeSteps(step.getBody(), context, continueOnError);
            }
            loop.accept(signal);
        }
        return loop.result(step, "count");
    }

    private StepResult executeArrayLoop(Step step, ExecutionContext context, boolean continueOnError)
            throws WorkflowExecutionException {
        VariableStore variables = context.getVariables();
        Object source = step.getConfigValue("array");
        Optional<List<Object>> resolved = resolveArray(source, variables);
        if (resolved.isEmpty()) {
            return StepResult.failure(step.getId(), source + " is not an array");
        }
        List<Object> items = resolved.get();
        int count = items.size();
        if (step.getConfigValue("maxItems") != null) {
            int maxItems = ValueConversions.toInt(configValue(step, context, "maxItems"), count);
            if (maxItems >= 0 && maxItems < count) {
                count = maxItems;
            }
        }
        count = clamp(count, step);
        String variable = variableName(step, "item");
        String indexVariable = step.getConfigValue("indexVariable") != null
                ? step.getConfigValue("indexVariable").toString()
                : null;

        LoopRun loop = new LoopRun();
        for (int i = 0; i < count && !loop.done(); i++) {
            loop.iterations++;
            Object item = items.get(i);
            Optional<Signal> signal;
            try (VariableStore.LoopScope scope = variables.enterLoop(new LoopContext(i, count, item))) {
                variables.declareLocal(variable, item);
                if (indexVariable != null) {
                    variables.declareLocal(indexVariable, i);
                }
                signal = executeSteps(step.getBody(), context, continueOnError);
            }
            loop.accept(signal);
        }
        return loop.result(step, "array");
    }

    private Optional<List<Object>> resolveArray(Object source, VariableStore variables) {
        if (source instanceof String text) {
            Optional<List<Object>> interpolated = ValueConversions.toList(variables.interpolateValue(text));
            if (interpolated.isPresent()) {
                return interpolated;
            }
            return variables.lookup(text.trim()).flatMap(ValueConversions::toList);
        }
        return ValueConversions.toList(source);
    }

    private StepResult executeElementsLoop(Step step, ExecutionContext context, boolean continueOnError)
            throws WorkflowExecutionException {
        Optional<BrowserPage> page = context.getPage();
        if (page.isEmpty()) {
            return StepResult.failure(step.getId(), "No browser page attached");
        }
        VariableStore variables = context.getVariables();
        String selector = variables.interpolate(stringConfig(step, "selector"));
        if (selector == null || selector.isBlank()) {
            return StepResult.failure(step.getId(), "loop-elements requires a selector");
        }

        int count;
        try {
            count = page.get().count(selector);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepResult.failure(step.getId(), "Interrupted while counting elements");
        } catch (Exception e) {
            logger.debug("Counting elements for '{}' failed", selector, e);
            return StepResult.failure(step.getId(), "Failed to count elements for '" + selector + "': " + e.getMessage());
        }
        if (step.getConfigValue("maxItems") != null) {
            int maxItems = ValueConversions.toInt(configValue(step, context, "maxItems"), count);
            if (maxItems >= 0 && maxItems < count) {
                count = maxItems;
            }
        }
        count = clamp(count, step);
        String variable = variableName(step, "element");

        LoopRun loop = new LoopRun();
        for (int i = 0; i < count && !loop.done(); i++) {
            loop.iterations++;
            Map<String, Object> element = new LinkedHashMap<>();
            element.put("index", i);
            element.put("selector", selector);
            Optional<Signal> signal;
            try (VariableStore.LoopScope scope = variables.enterLoop(new LoopContext(i, count, element))) {
                variables.declareLocal(variable, element);
                signal = executeSteps(step.getBody(), context, continueOnError);
            }
            loop.accept(signal);
        }
        return loop.result(step, "elements");
    }

    private StepResult executeWhileLoop(Step step, ExecutionContext context, boolean continueOnError)
            throws WorkflowExecutionException {
        VariableStore variables = context.getVariables();
        // re-evaluated each iteration, so kept raw
        String condition = stringConfig(step, "condition");
        int requested = step.getConfigValue("maxIterations") != null
                ? ValueConversions.toInt(configValue(step, context, "maxIterations"), configuration.getWhileMaxIterations())
                : configuration.getWhileMaxIterations();
        int maxIterations = clamp(requested, step);
        String variable = variableName(step, "iteration");

        LoopRun loop = new LoopRun();
        while (!loop.done()) {
            if (!variables.evaluateCondition(condition)) {
                break;
            }
            if (loop.iterations >= maxIterations) {
                logger.warn("[{}] While loop {} reached its limit of {} iterations",
                        context.getExecutionId(), step.getDisplayName(), maxIterations);
                break;
            }
            int index = loop.iterations++;
            Optional<Signal> signal;
            try (VariableStore.LoopScope scope = variables.enterLoop(new LoopContext(index, -1, null))) {
                variables.declareLocal(variable, index);
                signal = executeSteps(step.getBody(), context, continueOnError);
            }
            loop.accept(signal);
        }
        return loop.result(step, "while");
    }

    private int clamp(int requested, Step step) {
        int hardLimit = configuration.getLoopHardLimit();
        if (requested > hardLimit) {
            logger.warn("Loop {} requested {} iterations, limited to {}", step.getDisplayName(), requested, hardLimit);
            return hardLimit;
        }
        return Math.max(requested, 0);
    }

    private static String variableName(Step step, String defaultName) {
        Object name = step.getConfigValue("variable");
        if (name == null) {
            name = step.getConfigValue("variableName");
        }
        return name != null && !name.toString().isBlank() ? name.toString() : defaultName;
    }

    /**
     * Iteration bookkeeping shared by the four loop kinds.
     */
    private static final class LoopRun {
        int iterations;
        boolean broken;
        StepResult.Stop escaped;

        void accept(Optional<Signal> signal) {
            if (signal.isEmpty()) {
                return;
            }
            if (signal.get() instanceof StepResult.Break) {
                broken = true;
            } else if (signal.get() instanceof StepResult.Stop stop) {
                escaped = stop;
            }
        }

        boolean done() {
            return broken || escaped != null;
        }

        StepResult result(Step step, String loopType) {
            logger.debug("Loop {} ({}) finished after {} iterations", step.getDisplayName(), loopType, iterations);
            return new StepResult.LoopDescriptor(step.getId(), loopType, iterations, broken, escaped);
        }
    }

    // ---------------------------------------------------------------- try-catch

    private StepResult executeTryCatch(Step step, ExecutionContext context) throws WorkflowExecutionException {
        String errorVariable = step.getConfigValue("errorVariable") != null
                ? context.interpolate(step.getConfigValue("errorVariable").toString())
                : "error";
        Object continueSetting = step.getConfigValue("continueOnError");
        boolean blockContinues = continueSetting == null || ValueConversions.isTruthy(continueSetting);

        Optional<Signal> trySignal;
        try {
            trySignal = executeSteps(step.getTrySteps(), context, false);
        } catch (WorkflowExecutionException e) {
            if (context.isCancelled()) {
                throw e;
            }
            logger.debug("[{}] Try block {} caught: {}", context.getExecutionId(), step.getDisplayName(), e.getMessage());
            context.getVariables().set(errorVariable, errorDetails(e));

            WorkflowExecutionException catchFailure = null;
            Optional<Signal> catchSignal = Optional.empty();
            try {
                catchSignal = executeSteps(step.getCatchSteps(), context, false);
            } catch (WorkflowExecutionException catchError) {
                catchFailure = catchError;
            }
            Optional<Signal> finallySignal = executeSteps(step.getFinallySteps(), context, false);

            if (!blockContinues) {
                if (catchFailure != null) {
                    e.addSuppressed(catchFailure);
                }
                throw e;
            }
            if (catchFailure != null) {
                throw catchFailure;
            }
            Signal escaped = catchSignal.or(() -> finallySignal).orElse(null);
            return new StepResult.TryCatch(step.getId(), true, e.getMessage(), escaped);
        }

        Optional<Signal> finallySignal = executeSteps(step.getFinallySteps(), context, false);
        return new StepResult.TryCatch(step.getId(), false, null, trySignal.or(() -> finallySignal).orElse(null));
    }

    private static Map<String, Object> errorDetails(WorkflowExecutionException e) {
        StringWriter stack = new StringWriter();
        e.printStackTrace(new PrintWriter(stack));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message", e.getMessage());
        details.put("stepId", e.getStepId());
        details.put("stack", stack.toString());
        return details;
    }

    // ---------------------------------------------------------------- leaf control steps

    private StepResult executeStop(Step step, ExecutionContext context) {
        String status = stringConfig(step, "status");
        boolean failed = "failed".equalsIgnoreCase(context.interpolate(status));
        String message = step.getConfigValue("message") != null ? context.interpolate(stringConfig(step, "message")) : "";
        logger.info("[{}] Stop step {} reached with status {}{}", context.getExecutionId(), step.getDisplayName(),
                failed ? "failed" : "success", message.isEmpty() ? "" : ": " + message);
        return new StepResult.Stop(step.getId(), failed, message);
    }

    private StepResult executeLog(Step step, ExecutionContext context) {
        String message = context.interpolate(stringConfig(step, "message"));
        String level = step.getConfigValue("level") != null ? stringConfig(step, "level").toLowerCase() : "info";
        String workflowName = context.getWorkflow().getName();
        switch (level) {
            case "error":
                logger.error("[{}] {}", workflowName, message);
                break;
            case "warn":
            case "warning":
                logger.warn("[{}] {}", workflowName, message);
                break;
            case "debug":
                logger.debug("[{}] {}", workflowName, message);
                break;
            default:
                logger.info("[{}] {}", workflowName, message);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        data.put("level", level);
        return StepResult.success(step.getId(), data);
    }

    // ---------------------------------------------------------------- nested workflows

    private StepResult executeCallWorkflow(Step step, ExecutionContext context) {
        String workflowId = context.interpolate(stringConfig(step, "workflowId"));
        if (workflowId == null || workflowId.isBlank()) {
            return StepResult.failure(step.getId(), "call-workflow requires a workflowId");
        }
        if (workflowRegistry == null) {
            return StepResult.failure(step.getId(), "Workflow registry not available");
        }
        int maxDepth = configuration.getCallMaxDepth();
        if (context.getDepth() >= maxDepth) {
            return StepResult.failure(step.getId(), "Maximum workflow call depth of " + maxDepth + " exceeded");
        }
        Optional<Workflow> target = workflowRegistry.get(workflowId);
        if (target.isEmpty()) {
            return StepResult.failure(step.getId(), "Workflow not found: " + workflowId);
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        if (step.getConfigValue("parameters") != null) {
            Object interpolated = context.interpolateObject(step.getConfigValue("parameters"));
            if (interpolated instanceof Map<?, ?> map) {
                map.forEach((key, value) -> parameters.put(String.valueOf(key), value));
            } else {
                return StepResult.failure(step.getId(), "call-workflow parameters must be a map");
            }
        }
        Object waitSetting = configValue(step, context, "waitForCompletion");
        boolean waitForCompletion = waitSetting == null || ValueConversions.isTruthy(waitSetting);

        String childExecutionId = Ids.next("exec");
        RunOptions.Builder childOptions = context.getOptions().toBuilder()
                .executionId(childExecutionId)
                .parameters(parameters)
                .progressListener(null)
                .depth(context.getDepth() + 1);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workflowId", workflowId);
        data.put("executionId", childExecutionId);

        if (!waitForCompletion) {
            context.getEngine().executeAsync(target.get(), childOptions.parent(null).build())
                    .whenComplete((execution, error) -> {
                        if (error != null) {
                            logger.warn("Detached workflow {} ({}) could not run: {}",
                                    workflowId, childExecutionId, error.getMessage());
                        }
                    });
            data.put("started", true);
            return StepResult.success(step.getId(), data);
        }

        Execution child = context.getEngine().execute(target.get(), childOptions.parent(context).build());
        data.put("status", child.getStatus().getValue());
        if (child.isSuccessful()) {
            return StepResult.success(step.getId(), data);
        }
        data.put("error", "Called workflow " + workflowId + " " + child.getStatus().getValue()
                + child.getError().map(error -> ": " + error).orElse(""));
        return new StepResult.Normal(step.getId(), false, Instant.now(), data);
    }

    // ---------------------------------------------------------------- actions

    private StepResult executeAction(Step step, ExecutionContext context) {
        Optional<Action> action = actionRegistry.getAction(step.getType());
        if (action.isEmpty()) {
            logger.warn("[{}] Unknown action type '{}' for step {}", context.getExecutionId(),
                    step.getType(), step.getDisplayName());
            return StepResult.failure(step.getId(), "Unknown action type: " + step.getType());
        }
        try {
            Map<String, Object> config = context.getVariables().interpolateConfig(step.getConfig());
            ActionResult result = action.get().execute(context, config);
            if (result == null) {
                return StepResult.failure(step.getId(), "Action " + step.getType() + " returned no result");
            }
            if (result.success()) {
                return StepResult.success(step.getId(), result.data());
            }
            Map<String, Object> data = new LinkedHashMap<>(result.data());
            data.putIfAbsent("error", "Action " + step.getType() + " failed");
            return new StepResult.Normal(step.getId(), false, Instant.now(), data);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepResult.failure(step.getId(), "Interrupted");
        } catch (Exception e) {
            logger.debug("Action {} threw", step.getType(), e);
            return StepResult.failure(step.getId(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    // ---------------------------------------------------------------- helpers

    private Object configValue(Step step, ExecutionContext context, String key) {
        Object value = step.getConfigValue(key);
        return value instanceof String text ? context.getVariables().interpolateValue(text) : value;
    }

    private static String stringConfig(Step step, String key) {
        Object value = step.getConfigValue(key);
        return value != null ? value.toString() : null;
    }

    private static void notifyProgress(StepProgressListener listener, ExecutionContext context, StepProgress progress) {
        try {
            listener.onProgress(context.getExecutionId(), progress);
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed for {}: {}", context.getExecutionId(), e.getMessage());
        }
    }
}
