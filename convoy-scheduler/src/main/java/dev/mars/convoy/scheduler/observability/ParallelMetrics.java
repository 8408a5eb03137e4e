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

package dev.mars.convoy.scheduler.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for parallel profile runs and scheduled triggers.
 *
 * Provides:
 * - convoy.parallel.slots.active (gauge) - Slots currently running
 * - convoy.parallel.slots.started (counter) - Slots started
 * - convoy.parallel.slots.succeeded (counter) - Slots whose run completed
 * - convoy.parallel.slots.failed (counter) - Slots that failed for good
 * - convoy.parallel.slots.retried (counter) - Slots re-queued for another attempt
 * - convoy.parallel.slot.duration.seconds (histogram) - Slot duration distribution
 * - convoy.scheduler.runs (counter) - Schedule triggers by outcome
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0 (OpenTelemetry)
 */
public class ParallelMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ParallelMetrics.class);
    private static final String METER_NAME = "convoy-scheduler";

    private static ParallelMetrics instance;

    private final LongCounter slotsStarted;
    private final LongCounter slotsSucceeded;
    private final LongCounter slotsFailed;
    private final LongCounter slotsRetried;
    private final LongCounter scheduleRuns;
    private final DoubleHistogram slotDuration;

    private final AtomicLong activeSlots = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");

    private ParallelMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        slotsStarted = meter.counterBuilder("convoy.parallel.slots.started")
                .setDescription("Number of slots started")
                .setUnit("1")
                .build();

        slotsSucceeded = meter.counterBuilder("convoy.parallel.slots.succeeded")
                .setDescription("Number of slots whose run completed")
                .setUnit("1")
                .build();

        slotsFailed = meter.counterBuilder("convoy.parallel.slots.failed")
                .setDescription("Number of slots that failed after retries")
                .setUnit("1")
                .build();

        slotsRetried = meter.counterBuilder("convoy.parallel.slots.retried")
                .setDescription("Number of slot runs re-queued for retry")
                .setUnit("1")
                .build();

        scheduleRuns = meter.counterBuilder("convoy.scheduler.runs")
                .setDescription("Number of schedule triggers")
                .setUnit("1")
                .build();

        slotDuration = meter.histogramBuilder("convoy.parallel.slot.duration.seconds")
                .setDescription("Slot duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("convoy.parallel.slots.active")
                .setDescription("Number of currently running slots")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeSlots.get()));

        logger.info("ParallelMetrics initialized");
    }

    public static synchronized ParallelMetrics getInstance() {
        if (instance == null) {
            instance = new ParallelMetrics();
        }
        return instance;
    }

    public void recordSlotStarted(String workflowId) {
        slotsStarted.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
        activeSlots.incrementAndGet();
    }

    public void recordSlotSucceeded(String workflowId, double durationSeconds) {
        Attributes attrs = Attributes.of(WORKFLOW_ID_KEY, workflowId);
        slotsSucceeded.add(1, attrs);
        slotDuration.record(durationSeconds, attrs);
    }

    public void recordSlotFailed(String workflowId, double durationSeconds) {
        Attributes attrs = Attributes.of(WORKFLOW_ID_KEY, workflowId);
        slotsFailed.add(1, attrs);
        slotDuration.record(durationSeconds, attrs);
    }

    public void recordSlotRetried(String workflowId) {
        slotsRetried.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
    }

    public void recordSlotEnded() {
        activeSlots.decrementAndGet();
    }

    public void recordScheduleRun(String workflowId, String outcome) {
        scheduleRuns.add(1, Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId != null ? workflowId : "unknown")
                .put(OUTCOME_KEY, outcome)
                .build());
    }

    public long getActiveSlots() {
        return activeSlots.get();
    }
}
