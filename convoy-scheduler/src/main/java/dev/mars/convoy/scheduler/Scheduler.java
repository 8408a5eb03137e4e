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
import dev.mars.convoy.core.Ids;
import dev.mars.convoy.core.exceptions.InvalidCronExpressionException;
import dev.mars.convoy.core.exceptions.ScheduleNotFoundException;
import dev.mars.convoy.scheduler.cron.CronSupport;
import dev.mars.convoy.scheduler.observability.ParallelMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Cron-driven scheduler. Keeps the schedule set in memory, persists every change through a
 * {@link ScheduleRepository}, and checks once per interval for enabled schedules whose next fire
 * time has arrived. Each trigger runs on a separate worker thread; a schedule that is still
 * executing is not triggered again.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-11
 * @version 1.0
 */
public class Scheduler {

    private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);

    private static final String DEFAULT_NAME = "Unnamed Schedule";
    private static final int UPCOMING_LIMIT = 5;

    private final ScheduleRepository repository;
    private final ScheduleExecutor executor;
    private final ConvoyConfiguration configuration;
    private final Clock clock;
    private final ParallelMetrics metrics;

    private final Map<String, Schedule> schedules = new ConcurrentHashMap<>();
    private final Set<String> executing = ConcurrentHashMap.newKeySet();
    private final ExecutorService runPool;

    private volatile Consumer<Schedule> onScheduleLoaded;
    private ScheduledExecutorService timer;
    private volatile boolean running;

    public Scheduler(ScheduleRepository repository, ScheduleExecutor executor, ConvoyConfiguration configuration) {
        this(repository, executor, configuration, Clock.systemDefaultZone(),
                configuration.isMetricsEnabled() ? ParallelMetrics.getInstance() : null);
    }

    public Scheduler(ScheduleRepository repository, ScheduleExecutor executor, ConvoyConfiguration configuration,
                     Clock clock, ParallelMetrics metrics) {
        this.repository = Objects.requireNonNull(repository, "Repository cannot be null");
        this.executor = Objects.requireNonNull(executor, "Schedule executor cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.metrics = metrics;
        AtomicInteger threadCount = new AtomicInteger();
        this.runPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "convoy-schedule-run-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Called for each schedule read from the repository, typically to register its workflow snapshot.
     */
    public void setOnScheduleLoaded(Consumer<Schedule> onScheduleLoaded) {
        this.onScheduleLoaded = onScheduleLoaded;
    }

    public void init() {
        load();
        start();
    }

    /**
     * Replaces the in-memory set with the repository contents, recomputing every next fire time.
     */
    public void load() {
        List<Schedule> stored;
        try {
            stored = repository.loadAll();
        } catch (IOException e) {
            logger.error("Failed to load schedules: {}", e.getMessage(), e);
            return;
        }

        schedules.clear();
        Instant now = clock.instant();
        for (Schedule schedule : stored) {
            Schedule refreshed = schedule.toBuilder().nextRun(computeNextRun(schedule.getCron(), now)).build();
            schedules.put(refreshed.getId(), refreshed);
            Consumer<Schedule> hook = onScheduleLoaded;
            if (hook != null) {
                try {
                    hook.accept(refreshed);
                } catch (RuntimeException e) {
                    logger.warn("Load hook failed for schedule {}: {}", refreshed.getId(), e.getMessage());
                }
            }
        }
        logger.info("Loaded {} schedules", schedules.size());
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "convoy-scheduler");
            t.setDaemon(true);
            return t;
        });
        long interval = configuration.getSchedulerCheckIntervalMs();
        timer.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        logger.info("Scheduler started, checking every {}ms", interval);

        for (Schedule schedule : schedules.values()) {
            if (schedule.isEnabled() && schedule.isRunOnStart()) {
                logger.info("Running schedule {} on start", schedule.getId());
                submit(schedule.getId());
            }
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        timer.shutdownNow();
        timer = null;
        logger.info("Scheduler stopped");
    }

    public void shutdown() {
        stop();
        runPool.shutdown();
        try {
            if (!runPool.awaitTermination(30, TimeUnit.SECONDS)) {
                runPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            runPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    private void tick() {
        try {
            checkSchedules(clock.instant());
        } catch (RuntimeException e) {
            logger.error("Schedule check failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Triggers every enabled schedule whose next fire time falls in the minute of {@code now} or earlier.
     *
     * @return ids of the schedules triggered
     */
    public List<String> checkSchedules(Instant now) {
        Instant minute = now.truncatedTo(ChronoUnit.MINUTES);
        List<String> triggered = new ArrayList<>();
        for (Schedule schedule : schedules.values()) {
            if (!schedule.isEnabled() || schedule.getNextRun() == null || executing.contains(schedule.getId())) {
                continue;
            }
            if (!schedule.getNextRun().truncatedTo(ChronoUnit.MINUTES).isAfter(minute)) {
                logger.info("Schedule {} is due", schedule.getId());
                triggered.add(schedule.getId());
                submit(schedule.getId());
            }
        }
        return triggered;
    }

    private Future<ScheduleRunResult> submit(String scheduleId) {
        return runPool.submit(() -> executeSchedule(scheduleId));
    }

    /**
     * Runs one schedule synchronously.
     *
     * @return the run result, or empty when the schedule is gone or already executing
     */
    Optional<ScheduleRunResult> executeSchedule(String scheduleId) throws InterruptedException {
        if (!executing.add(scheduleId)) {
            logger.debug("Schedule {} is already executing", scheduleId);
            return Optional.empty();
        }
        try {
            Schedule schedule = schedules.get(scheduleId);
            if (schedule == null) {
                return Optional.empty();
            }

            Instant started = clock.instant();
            schedule = replace(schedule.toBuilder()
                    .lastRun(started)
                    .lastStatus(ScheduleRunStatus.RUNNING)
                    .nextRun(computeNextRun(schedule.getCron(), started))
                    .build());
            persist();
            logger.info("Executing schedule {} ({})", schedule.getId(), schedule.getName());

            ScheduleRunResult result;
            boolean interrupted = false;
            try {
                result = executor.execute(schedule);
            } catch (InterruptedException e) {
                interrupted = true;
                logger.warn("Schedule {} interrupted", scheduleId);
                result = ScheduleRunResult.failure("Schedule execution interrupted");
            } catch (RuntimeException e) {
                logger.error("Schedule {} failed: {}", scheduleId, e.getMessage(), e);
                result = ScheduleRunResult.failure(e.getMessage());
            }

            Schedule current = schedules.getOrDefault(scheduleId, schedule);
            boolean succeeded = result.status() == ScheduleRunStatus.SUCCESS;
            replace(current.toBuilder()
                    .lastStatus(result.status())
                    .lastError(succeeded ? null : result.error())
                    .runCount(current.getRunCount() + 1)
                    .successCount(current.getSuccessCount() + (succeeded ? 1 : 0))
                    .failureCount(current.getFailureCount() + (succeeded ? 0 : 1))
                    .build());
            persist();

            if (metrics != null) {
                metrics.recordScheduleRun(current.getWorkflowId(), result.status().name().toLowerCase());
            }
            logger.info("Schedule {} finished with status {}", scheduleId, result.status());
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return Optional.of(result);
        } finally {
            executing.remove(scheduleId);
        }
    }

    /**
     * Writes only if the schedule has not been deleted meanwhile.
     */
    private Schedule replace(Schedule schedule) {
        schedules.computeIfPresent(schedule.getId(), (id, existing) -> schedule);
        return schedule;
    }

    private Instant computeNextRun(String cron, Instant after) {
        if (cron == null) {
            return null;
        }
        return CronSupport.nextRun(cron, after).orElse(null);
    }

    public Schedule createSchedule(ScheduleRequest request) throws InvalidCronExpressionException {
        Objects.requireNonNull(request, "Schedule request cannot be null");
        if (request.getWorkflowId() == null || request.getWorkflowId().isBlank()) {
            throw new IllegalArgumentException("Workflow ID is required");
        }
        if (request.getCron() == null || request.getCron().isBlank()) {
            throw new IllegalArgumentException("Cron expression is required");
        }
        CronSupport.validate(request.getCron());

        Instant now = clock.instant();
        Schedule.Builder builder = Schedule.builder()
                .id(Ids.next("schedule"))
                .name(request.getName() != null && !request.getName().isBlank() ? request.getName() : DEFAULT_NAME)
                .description(request.getDescription())
                .workflowId(request.getWorkflowId())
                .workflowName(request.getWorkflowName())
                .workflow(request.getWorkflow())
                .profileIds(request.getProfileIds())
                .cron(request.getCron())
                .cronDescription(CronSupport.describe(request.getCron()))
                .nextRun(computeNextRun(request.getCron(), now))
                .createdAt(now)
                .updatedAt(now);
        if (request.getEnabled() != null) {
            builder.enabled(request.getEnabled());
        }
        if (request.getRunOnStart() != null) {
            builder.runOnStart(request.getRunOnStart());
        }
        if (request.getMaxRetries() != null) {
            builder.maxRetries(request.getMaxRetries());
        }
        if (request.getTimeoutMs() != null) {
            builder.timeoutMs(request.getTimeoutMs());
        }
        if (request.getParallel() != null) {
            builder.parallel(request.getParallel());
        }

        Schedule schedule = builder.build();
        schedules.put(schedule.getId(), schedule);
        persist();
        logger.info("Created schedule {} ({}) for workflow {}", schedule.getId(), schedule.getName(), schedule.getWorkflowId());
        return schedule;
    }

    /**
     * Applies the non-null fields of {@code request}. Changing the cron recomputes its description and next run.
     */
    public Schedule updateSchedule(String id, ScheduleRequest request)
            throws ScheduleNotFoundException, InvalidCronExpressionException {
        Schedule existing = requireSchedule(id);
        Schedule.Builder builder = existing.toBuilder().updatedAt(clock.instant());

        if (request.getCron() != null && !request.getCron().equals(existing.getCron())) {
            CronSupport.validate(request.getCron());
            builder.cron(request.getCron())
                    .cronDescription(CronSupport.describe(request.getCron()))
                    .nextRun(computeNextRun(request.getCron(), clock.instant()));
        }
        if (request.getName() != null) {
            builder.name(request.getName());
        }
        if (request.getDescription() != null) {
            builder.description(request.getDescription());
        }
        if (request.getWorkflowId() != null) {
            builder.workflowId(request.getWorkflowId());
        }
        if (request.getWorkflowName() != null) {
            builder.workflowName(request.getWorkflowName());
        }
        if (request.getWorkflow() != null) {
            builder.workflow(request.getWorkflow());
        }
        if (request.getProfileIds() != null) {
            builder.profileIds(request.getProfileIds());
        }
        if (request.getEnabled() != null) {
            builder.enabled(request.getEnabled());
        }
        if (request.getRunOnStart() != null) {
            builder.runOnStart(request.getRunOnStart());
        }
        if (request.getMaxRetries() != null) {
            builder.maxRetries(request.getMaxRetries());
        }
        if (request.getTimeoutMs() != null) {
            builder.timeoutMs(request.getTimeoutMs());
        }
        if (request.getParallel() != null) {
            builder.parallel(request.getParallel());
        }

        Schedule updated = builder.build();
        schedules.put(id, updated);
        persist();
        logger.info("Updated schedule {}", id);
        return updated;
    }

    public boolean deleteSchedule(String id) {
        Schedule removed = schedules.remove(id);
        if (removed == null) {
            return false;
        }
        persist();
        logger.info("Deleted schedule {}", id);
        return true;
    }

    public Optional<Schedule> getSchedule(String id) {
        return Optional.ofNullable(schedules.get(id));
    }

    public List<Schedule> listSchedules() {
        return schedules.values().stream()
                .sorted(Comparator.comparing(Schedule::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public Schedule enableSchedule(String id) throws ScheduleNotFoundException {
        return setEnabled(id, true);
    }

    public Schedule disableSchedule(String id) throws ScheduleNotFoundException {
        return setEnabled(id, false);
    }

    private Schedule setEnabled(String id, boolean enabled) throws ScheduleNotFoundException {
        Schedule existing = requireSchedule(id);
        Instant now = clock.instant();
        Schedule.Builder builder = existing.toBuilder().enabled(enabled).updatedAt(now);
        if (enabled) {
            builder.nextRun(computeNextRun(existing.getCron(), now));
        }
        Schedule updated = builder.build();
        schedules.put(id, updated);
        persist();
        logger.info("{} schedule {}", enabled ? "Enabled" : "Disabled", id);
        return updated;
    }

    /**
     * Triggers a schedule immediately on a worker thread, regardless of its enabled flag.
     */
    public Future<ScheduleRunResult> runNow(String id) throws ScheduleNotFoundException {
        requireSchedule(id);
        logger.info("Manual run requested for schedule {}", id);
        return runPool.submit(() -> executeSchedule(id)
                .orElseGet(() -> ScheduleRunResult.failure("Schedule is already executing")));
    }

    public SchedulerStatus getStatus() {
        List<Schedule> enabled = schedules.values().stream().filter(Schedule::isEnabled).toList();
        List<SchedulerStatus.UpcomingRun> upcoming = enabled.stream()
                .filter(s -> s.getNextRun() != null)
                .sorted(Comparator.comparing(Schedule::getNextRun))
                .limit(UPCOMING_LIMIT)
                .map(s -> new SchedulerStatus.UpcomingRun(s.getId(), s.getName(), s.getNextRun(), s.getCronDescription()))
                .toList();
        return new SchedulerStatus(running, schedules.size(), enabled.size(), upcoming, clock.instant());
    }

    private Schedule requireSchedule(String id) throws ScheduleNotFoundException {
        Schedule schedule = schedules.get(id);
        if (schedule == null) {
            throw new ScheduleNotFoundException(id);
        }
        return schedule;
    }

    private synchronized void persist() {
        try {
            repository.saveAll(new ArrayList<>(schedules.values()));
        } catch (IOException e) {
            logger.warn("Failed to persist schedules: {}", e.getMessage(), e);
        }
    }
}
