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

package dev.mars.convoy.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for workflow executions.
 *
 * Provides:
 * - convoy.executions.active (gauge) - Executions currently inside the interpreter
 * - convoy.executions.started (counter) - Executions started, by workflow
 * - convoy.executions.completed (counter) - Executions that finished every step
 * - convoy.executions.failed (counter) - Failed executions, by failure kind
 * - convoy.executions.stopped (counter) - Executions cancelled from outside
 * - convoy.steps.executed (counter) - Steps run, by step type
 * - convoy.steps.failed (counter) - Steps that failed, by step type
 * - convoy.executions.duration.seconds (histogram) - Duration of completed executions
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "convoy-workflow";

    private static final AttributeKey<String> WORKFLOW = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> STEP_TYPE = AttributeKey.stringKey("step.type");
    private static final AttributeKey<String> FAILURE_KIND = AttributeKey.stringKey("failure.kind");

    private static WorkflowMetrics instance;

    private final LongCounter executionsStarted;
    private final LongCounter executionsCompleted;
    private final LongCounter executionsFailed;
    private final LongCounter executionsStopped;
    private final LongCounter stepsExecuted;
    private final LongCounter stepsFailed;
    private final DoubleHistogram executionDuration;
    private final AtomicLong running = new AtomicLong();

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        executionsStarted = counter(meter, "convoy.executions.started", "Workflow executions started");
        executionsCompleted = counter(meter, "convoy.executions.completed", "Workflow executions that ran to the end");
        executionsFailed = counter(meter, "convoy.executions.failed", "Workflow executions ended by an error");
        executionsStopped = counter(meter, "convoy.executions.stopped", "Workflow executions cancelled by a caller");
        stepsExecuted = counter(meter, "convoy.steps.executed", "Workflow steps run");
        stepsFailed = counter(meter, "convoy.steps.failed", "Workflow steps that reported failure");

        executionDuration = meter.histogramBuilder("convoy.executions.duration.seconds")
                .setDescription("Wall-clock time of completed workflow executions")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("convoy.executions.active")
                .setDescription("Workflow executions currently running")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(running.get()));

        logger.info("Workflow metrics registered under meter {}", METER_NAME);
    }

    private static LongCounter counter(Meter meter, String name, String description) {
        return meter.counterBuilder(name).setDescription(description).setUnit("1").build();
    }

    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordWorkflowStarted(String workflowId) {
        running.incrementAndGet();
        executionsStarted.add(1, Attributes.of(WORKFLOW, workflowId));
    }

    public void recordWorkflowCompleted(String workflowId, double durationSeconds) {
        running.decrementAndGet();
        Attributes workflow = Attributes.of(WORKFLOW, workflowId);
        executionsCompleted.add(1, workflow);
        executionDuration.record(durationSeconds, workflow);
    }

    /**
     * @param error the execution error; only its kind is recorded, never the message itself
     */
    public void recordWorkflowFailed(String workflowId, String error) {
        running.decrementAndGet();
        executionsFailed.add(1, Attributes.of(WORKFLOW, workflowId, FAILURE_KIND, failureKind(error)));
    }

    public void recordWorkflowStopped(String workflowId) {
        running.decrementAndGet();
        executionsStopped.add(1, Attributes.of(WORKFLOW, workflowId));
    }

    public void recordStepExecuted(String stepType, boolean success) {
        Attributes type = Attributes.of(STEP_TYPE, stepType != null ? stepType : "unknown");
        stepsExecuted.add(1, type);
        if (!success) {
            stepsFailed.add(1, type);
        }
    }

    public long getActiveWorkflows() {
        return running.get();
    }

    static String failureKind(String error) {
        if (error == null) {
            return "unknown";
        }
        String lower = error.toLowerCase(Locale.ROOT);
        if (lower.contains("timeout")) {
            return "timeout";
        }
        if (lower.contains("call depth") || lower.contains("not found")) {
            return "configuration";
        }
        return lower.startsWith("step \"") ? "step" : "other";
    }
}
