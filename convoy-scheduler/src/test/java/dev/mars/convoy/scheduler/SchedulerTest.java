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
import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.core.exceptions.InvalidCronExpressionException;
import dev.mars.convoy.core.exceptions.ScheduleNotFoundException;
import dev.mars.convoy.scheduler.batch.ProfileRunResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for Scheduler: schedule CRUD, persistence, due checks and run bookkeeping.
 */
class SchedulerTest {

    private static final Instant NOW = Instant.parse("2025-11-10T09:00:30Z");

    @TempDir
    Path dataDir;

    private final MutableClock clock = new MutableClock(NOW);
    private final AtomicInteger executions = new AtomicInteger();
    private final AtomicReference<ScheduleRunResult> nextResult = new AtomicReference<>(
            ScheduleRunResult.of(List.of(ProfileRunResult.success("p1", "exec-1", 10))));

    private JsonFileScheduleRepository repository;
    private ConvoyConfiguration configuration;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty(ConvoyConfiguration.METRICS_ENABLED, "false");
        properties.setProperty(ConvoyConfiguration.SCHEDULER_CHECK_INTERVAL_MS, "600000");
        configuration = new ConvoyConfiguration(properties);
        repository = new JsonFileScheduleRepository(dataDir);
        scheduler = newScheduler(schedule -> {
            executions.incrementAndGet();
            return nextResult.get();
        });
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private Scheduler newScheduler(ScheduleExecutor executor) {
        return new Scheduler(repository, executor, configuration, clock, null);
    }

    private static ScheduleRequest.Builder request() {
        return ScheduleRequest.builder()
                .workflowId("wf")
                .profileIds(List.of("p1"))
                .cron("* * * * *");
    }

    private ScheduleRunResult runNow(String id) throws Exception {
        return scheduler.runNow(id).get(5, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("Creating and updating")
    class Crud {

        @Test
        void testCreateAppliesDefaults() throws Exception {
            Schedule schedule = scheduler.createSchedule(request().build());

            assertThat(schedule.getId()).matches("schedule-\\d+-[0-9a-z]{9}");
            assertEquals("Unnamed Schedule", schedule.getName());
            assertEquals("Every minute", schedule.getCronDescription());
            assertEquals(Instant.parse("2025-11-10T09:01:00Z"), schedule.getNextRun());
            assertEquals(NOW, schedule.getCreatedAt());
            assertEquals(Schedule.DEFAULT_TIMEOUT_MS, schedule.getTimeoutMs());
            assertTrue(schedule.isEnabled());
            assertFalse(schedule.isRunOnStart());
            assertEquals(0, schedule.getRunCount());
            assertThat(repository.loadAll()).extracting(Schedule::getId).containsExactly(schedule.getId());
        }

        @Test
        void testWorkflowNameIsTakenFromSnapshot() throws Exception {
            Workflow snapshot = Workflow.builder().id("wf").name("Check inbox")
                    .step(Step.builder().id("s").type("wait-time").build()).build();

            Schedule schedule = scheduler.createSchedule(request().workflow(snapshot).build());

            assertEquals("Check inbox", schedule.getWorkflowName());
            assertEquals(snapshot, schedule.getWorkflow());
        }

        @Test
        void testRequiredFields() {
            assertThrows(IllegalArgumentException.class,
                    () -> scheduler.createSchedule(request().workflowId(null).build()));
            assertThrows(IllegalArgumentException.class,
                    () -> scheduler.createSchedule(request().cron(" ").build()));
            assertThrows(InvalidCronExpressionException.class,
                    () -> scheduler.createSchedule(request().cron("every day").build()));
            assertThat(scheduler.listSchedules()).isEmpty();
        }

        @Test
        void testUpdateChangesOnlyGivenFields() throws Exception {
            Schedule created = scheduler.createSchedule(request().name("Original").maxRetries(1).build());
            clock.set(NOW.plusSeconds(3600));

            Schedule updated = scheduler.updateSchedule(created.getId(),
                    ScheduleRequest.builder().cron("0 */2 * * *").timeoutMs(1000).build());

            assertEquals("Original", updated.getName());
            assertEquals(1, updated.getMaxRetries());
            assertEquals(1000, updated.getTimeoutMs());
            assertEquals("Every 2 hours", updated.getCronDescription());
            assertThat(updated.getNextRun()).isAfter(NOW.plusSeconds(3600));
            assertEquals(NOW.plusSeconds(3600), updated.getUpdatedAt());
            assertEquals(NOW, updated.getCreatedAt());
        }

        @Test
        void testUpdateRejectsInvalidCron() throws Exception {
            Schedule created = scheduler.createSchedule(request().build());

            assertThrows(InvalidCronExpressionException.class,
                    () -> scheduler.updateSchedule(created.getId(), ScheduleRequest.builder().cron("* *").build()));
            assertEquals("* * * * *", scheduler.getSchedule(created.getId()).orElseThrow().getCron());
        }

        @Test
        void testUnknownScheduleOperations() {
            ScheduleNotFoundException error = assertThrows(ScheduleNotFoundException.class,
                    () -> scheduler.updateSchedule("missing", ScheduleRequest.builder().build()));
            assertEquals("Schedule not found: missing", error.getMessage());
            assertThrows(ScheduleNotFoundException.class, () -> scheduler.runNow("missing"));
            assertThrows(ScheduleNotFoundException.class, () -> scheduler.enableSchedule("missing"));
            assertFalse(scheduler.deleteSchedule("missing"));
        }

        @Test
        void testDeleteRemovesFromStore() throws Exception {
            Schedule created = scheduler.createSchedule(request().build());

            assertTrue(scheduler.deleteSchedule(created.getId()));

            assertTrue(scheduler.getSchedule(created.getId()).isEmpty());
            assertThat(repository.loadAll()).isEmpty();
        }

        @Test
        void testListIsOrderedByCreation() throws Exception {
            Schedule first = scheduler.createSchedule(request().name("first").build());
            clock.set(NOW.plusSeconds(5));
            Schedule second = scheduler.createSchedule(request().name("second").build());

            assertThat(scheduler.listSchedules()).extracting(Schedule::getId)
                    .containsExactly(first.getId(), second.getId());
        }
    }

    @Nested
    @DisplayName("Running")
    class Running {

        @Test
        void testRunNowUpdatesCounters() throws Exception {
            Schedule created = scheduler.createSchedule(request().build());

            ScheduleRunResult result = runNow(created.getId());

            assertTrue(result.success());
            Schedule schedule = scheduler.getSchedule(created.getId()).orElseThrow();
            assertEquals(ScheduleRunStatus.SUCCESS, schedule.getLastStatus());
            assertEquals(NOW, schedule.getLastRun());
            assertNull(schedule.getLastError());
            assertEquals(1, schedule.getRunCount());
            assertEquals(1, schedule.getSuccessCount());
            assertEquals(0, schedule.getFailureCount());
            assertEquals(1, repository.loadAll().get(0).getRunCount());
        }

        @Test
        @DisplayName("partial result counts as a failure")
        void testPartialRun() throws Exception {
            nextResult.set(ScheduleRunResult.of(List.of(
                    ProfileRunResult.success("p1", "exec-1", 10),
                    ProfileRunResult.failure("p2", "Profile not found"))));
            Schedule created = scheduler.createSchedule(request().build());

            runNow(created.getId());

            Schedule schedule = scheduler.getSchedule(created.getId()).orElseThrow();
            assertEquals(ScheduleRunStatus.PARTIAL, schedule.getLastStatus());
            assertEquals("Some executions failed", schedule.getLastError());
            assertEquals(0, schedule.getSuccessCount());
            assertEquals(1, schedule.getFailureCount());
        }

        @Test
        void testExecutorExceptionBecomesFailure() throws Exception {
            scheduler.shutdown();
            scheduler = newScheduler(schedule -> {
                throw new IllegalStateException("engine offline");
            });
            Schedule created = scheduler.createSchedule(request().build());

            ScheduleRunResult result = runNow(created.getId());

            assertEquals(ScheduleRunStatus.FAILED, result.status());
            Schedule schedule = scheduler.getSchedule(created.getId()).orElseThrow();
            assertEquals("engine offline", schedule.getLastError());
            assertEquals(1, schedule.getFailureCount());
        }

        @Test
        void testInterruptedRunIsRecordedAsFailure() throws Exception {
            scheduler.shutdown();
            scheduler = newScheduler(schedule -> {
                throw new InterruptedException("stopping");
            });
            Schedule created = scheduler.createSchedule(request().build());

            ScheduleRunResult result = scheduler.executeSchedule(created.getId()).orElseThrow();

            assertTrue(Thread.interrupted());
            assertEquals(ScheduleRunStatus.FAILED, result.status());
            Schedule schedule = scheduler.getSchedule(created.getId()).orElseThrow();
            assertEquals(ScheduleRunStatus.FAILED, schedule.getLastStatus());
            assertEquals("Schedule execution interrupted", schedule.getLastError());
            assertEquals(1, schedule.getRunCount());
            assertEquals(1, schedule.getFailureCount());
            assertThat(repository.loadAll()).singleElement()
                    .extracting(Schedule::getLastStatus)
                    .isEqualTo(ScheduleRunStatus.FAILED);
        }

        @Test
        @DisplayName("an executing schedule is not triggered again")
        void testNoReentry() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch entered = new CountDownLatch(1);
            scheduler.shutdown();
            scheduler = newScheduler(schedule -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return nextResult.get();
            });
            Schedule created = scheduler.createSchedule(request().build());

            Future<ScheduleRunResult> first = scheduler.runNow(created.getId());
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertEquals(ScheduleRunStatus.RUNNING, scheduler.getSchedule(created.getId()).orElseThrow().getLastStatus());

            ScheduleRunResult second = scheduler.runNow(created.getId()).get(5, TimeUnit.SECONDS);
            assertEquals("Schedule is already executing", second.error());
            assertThat(scheduler.checkSchedules(NOW.plusSeconds(120))).isEmpty();

            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS).success());
            assertEquals(1, scheduler.getSchedule(created.getId()).orElseThrow().getRunCount());
        }
    }

    @Nested
    @DisplayName("Due checks")
    class DueChecks {

        @Test
        void testScheduleFiresInItsMinute() throws Exception {
            Schedule created = scheduler.createSchedule(request().build());

            assertThat(scheduler.checkSchedules(NOW.plusSeconds(10))).isEmpty();
            assertThat(scheduler.checkSchedules(Instant.parse("2025-11-10T09:01:00.500Z")))
                    .containsExactly(created.getId());

            await().atMost(Duration.ofSeconds(5)).until(() -> executions.get() == 1);
        }

        @Test
        void testOverdueScheduleFires() throws Exception {
            Schedule created = scheduler.createSchedule(request().build());

            assertThat(scheduler.checkSchedules(NOW.plusSeconds(3600))).containsExactly(created.getId());
        }

        @Test
        void testDisabledScheduleDoesNotFire() throws Exception {
            Schedule created = scheduler.createSchedule(request().enabled(false).build());

            assertThat(scheduler.checkSchedules(NOW.plusSeconds(3600))).isEmpty();

            scheduler.enableSchedule(created.getId());
            assertThat(scheduler.checkSchedules(NOW.plusSeconds(3600))).containsExactly(created.getId());
        }

        @Test
        void testRunOnStart() throws Exception {
            scheduler.createSchedule(request().runOnStart(true).build());
            scheduler.createSchedule(request().build());

            scheduler.start();

            assertTrue(scheduler.isRunning());
            await().atMost(Duration.ofSeconds(5)).until(() -> executions.get() == 1);
            scheduler.stop();
            assertFalse(scheduler.isRunning());
        }
    }

    @Nested
    @DisplayName("Persistence and status")
    class PersistenceAndStatus {

        @Test
        void testReloadRecomputesNextRunAndCallsHook() throws Exception {
            Workflow snapshot = Workflow.builder().id("wf").name("Snapshot")
                    .step(Step.builder().id("s").type("wait-time").build()).build();
            Schedule created = scheduler.createSchedule(request().workflow(snapshot).build());

            clock.set(Instant.parse("2025-11-12T14:30:10Z"));
            List<Schedule> seen = Collections.synchronizedList(new ArrayList<>());
            Scheduler reloaded = newScheduler(schedule -> nextResult.get());
            reloaded.setOnScheduleLoaded(schedule -> {
                seen.add(schedule);
                throw new IllegalStateException("hook failure is logged");
            });
            try {
                reloaded.load();

                Schedule schedule = reloaded.getSchedule(created.getId()).orElseThrow();
                assertEquals(Instant.parse("2025-11-12T14:31:00Z"), schedule.getNextRun());
                assertThat(seen).extracting(Schedule::getId).containsExactly(created.getId());
                assertEquals("Snapshot", seen.get(0).getWorkflow().getName());
            } finally {
                reloaded.shutdown();
            }
        }

        @Test
        void testStatusListsUpcomingEnabledSchedules() throws Exception {
            for (int i = 0; i < 6; i++) {
                scheduler.createSchedule(request().name("s" + i).cron("0 " + (10 + i) + " * * *").build());
            }
            scheduler.createSchedule(request().name("off").enabled(false).build());

            SchedulerStatus status = scheduler.getStatus();

            assertFalse(status.running());
            assertEquals(7, status.totalSchedules());
            assertEquals(6, status.enabledSchedules());
            assertThat(status.upcoming()).hasSize(5);
            assertThat(status.upcoming()).extracting(SchedulerStatus.UpcomingRun::nextRun).isSorted();
            assertThat(status.upcoming()).extracting(SchedulerStatus.UpcomingRun::name).doesNotContain("off");
            assertEquals(NOW, status.serverTime());
        }
    }

    private static final class MutableClock extends Clock {

        private volatile Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void set(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
