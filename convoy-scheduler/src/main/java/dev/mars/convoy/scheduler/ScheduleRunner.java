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

package dev.mars.convoy.scheduler;

import dev.mars.convoy.config.ConvoyConfiguration;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.retry.RetryPolicy;
import dev.mars.convoy.scheduler.batch.BatchRunner;
import dev.mars.convoy.scheduler.batch.ProfileRunResult;
import dev.mars.convoy.scheduler.observability.ParallelMetrics;
import dev.mars.convoy.scheduler.parallel.CompletedRun;
import dev.mars.convoy.scheduler.parallel.FailedRun;
import dev.mars.convoy.scheduler.parallel.ParallelExecutor;
import dev.mars.convoy.scheduler.parallel.ParallelOptions;
import dev.mars.convoy.scheduler.parallel.ParallelStatus;
import dev.mars.convoy.scheduler.profile.Profile;
import dev.mars.convoy.scheduler.profile.ProfileDirectory;
import dev.mars.convoy.scheduler.profile.ProfileRunner;
import dev.mars.convoy.workflow.WorkflowParseException;
import dev.mars.convoy.workflow.WorkflowRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Default {@link ScheduleExecutor}. Resolves the schedule's workflow, preferring the registry over
 * the stored snapshot, and its profiles, then runs them through the parallel executor when the
 * schedule asks for more than one concurrent slot, otherwise one after another through
 * {@link BatchRunner}. A missing profile fails only that profile.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-11
 * @version 1.0
 */
public class ScheduleRunner implements ScheduleExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleRunner.class);

    private final WorkflowRegistry workflows;
    private final ProfileDirectory profiles;
    private final ProfileRunner runner;
    private final ConvoyConfiguration configuration;

    public ScheduleRunner(WorkflowRegistry workflows, ProfileDirectory profiles, ProfileRunner runner,
                          ConvoyConfiguration configuration) {
        this.workflows = Objects.requireNonNull(workflows, "Workflow registry cannot be null");
        this.profiles = Objects.requireNonNull(profiles, "Profile directory cannot be null");
        this.runner = Objects.requireNonNull(runner, "Profile runner cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
    }

    @Override
    public ScheduleRunResult execute(Schedule schedule) throws InterruptedException {
        Optional<Workflow> workflow = resolveWorkflow(schedule);
        if (workflow.isEmpty()) {
            logger.error("Schedule {} cannot run: workflow {} not found", schedule.getId(), schedule.getWorkflowId());
            return ScheduleRunResult.failure("Workflow not found: " + schedule.getWorkflowId());
        }

        Map<String, ProfileRunResult> outcomes = new LinkedHashMap<>();
        List<Profile> resolved = new ArrayList<>();
        for (String profileId : schedule.getProfileIds()) {
            Optional<Profile> profile = profiles.find(profileId);
            if (profile.isPresent()) {
                resolved.add(profile.get());
                outcomes.put(profileId, null);
            } else {
                logger.warn("Schedule {}: profile {} not found", schedule.getId(), profileId);
                outcomes.put(profileId, ProfileRunResult.failure(profileId, "Profile not found"));
            }
        }

        if (!resolved.isEmpty()) {
            List<ProfileRunResult> results = schedule.getParallel().runsInParallel()
                    ? runParallel(schedule, workflow.get(), resolved)
                    : runSequential(schedule, workflow.get(), resolved);
            results.forEach(result -> outcomes.put(result.profileId(), result));
        }

        List<ProfileRunResult> ordered = outcomes.values().stream().filter(Objects::nonNull).toList();
        return ScheduleRunResult.of(ordered);
    }

    private Optional<Workflow> resolveWorkflow(Schedule schedule) {
        if (schedule.getWorkflowId() != null) {
            Optional<Workflow> registered = workflows.get(schedule.getWorkflowId());
            if (registered.isPresent()) {
                return registered;
            }
        }
        return Optional.ofNullable(schedule.getWorkflow());
    }

    private RetryPolicy retryPolicyFor(Schedule schedule) {
        return configuration.getRetryPolicy().toBuilder()
                .maxRetries(schedule.getMaxRetries())
                .build();
    }

    private List<ProfileRunResult> runParallel(Schedule schedule, Workflow workflow, List<Profile> targets) {
        ParallelOptions options = ParallelOptions.builder(configuration)
                .maxConcurrent(schedule.getParallel().maxConcurrent())
                .timeoutMs(schedule.getTimeoutMs())
                .retryPolicy(retryPolicyFor(schedule))
                .stopOnError(false)
                .build();
        ParallelMetrics metrics = configuration.isMetricsEnabled() ? ParallelMetrics.getInstance() : null;
        ParallelExecutor executor = new ParallelExecutor(runner, options, metrics);
        ParallelStatus status;
        try {
            status = executor.start(workflow, targets);
        } finally {
            executor.shutdown();
        }

        List<ProfileRunResult> results = new ArrayList<>();
        for (CompletedRun run : status.completed()) {
            results.add(ProfileRunResult.success(run.profileId(), run.execution().getExecutionId(), run.durationMs()));
        }
        for (FailedRun run : status.failed()) {
            results.add(ProfileRunResult.failure(run.profileId(), run.error(), null, run.durationMs()));
        }
        return results;
    }

    private List<ProfileRunResult> runSequential(Schedule schedule, Workflow workflow, List<Profile> targets)
            throws InterruptedException {
        BatchRunner batch = new BatchRunner(runner, 0, configuration.getDelayBetweenMs(),
                schedule.getTimeoutMs(), retryPolicyFor(schedule));
        return batch.run(workflow, targets).results();
    }

    /**
     * A load hook for {@link Scheduler} that registers each schedule's workflow snapshot.
     */
    public Consumer<Schedule> workflowRegistrar() {
        return schedule -> {
            if (schedule.getWorkflow() == null) {
                return;
            }
            try {
                workflows.register(schedule.getWorkflow());
                logger.info("Registered workflow {} from schedule {}", schedule.getWorkflow().getId(), schedule.getId());
            } catch (WorkflowParseException e) {
                logger.warn("Failed to register workflow {} from schedule {}: {}",
                        schedule.getWorkflowId(), schedule.getId(), e.getMessage());
            }
        };
    }
}
