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

package dev.mars.convoy.scheduler.parallel;

import dev.mars.convoy.config.ConvoyConfiguration;
import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.retry.RetryPolicy;
import dev.mars.convoy.retry.RetryStrategy;
import dev.mars.convoy.scheduler.profile.Profile;
import dev.mars.convoy.scheduler.profile.ProfileRunner;
import dev.mars.convoy.scheduler.profile.ProfileSession;
import dev.mars.convoy.scheduler.profile.ProfileSessionProvider;
import dev.mars.convoy.workflow.SimpleWorkflowEngine;
import dev.mars.convoy.workflow.action.ActionRegistry;
import dev.mars.convoy.workflow.action.ActionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for ParallelExecutor: concurrency bound, retries, failure annotation and run control.
 */
class ParallelExecutorTest {

    @Mock
    private ProfileSessionProvider sessionProvider;

    @Mock
    private ProfileSession session;

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final List<ParallelEvent> events = Collections.synchronizedList(new ArrayList<>());

    private SimpleWorkflowEngine engine;
    private ProfileRunner runner;
    private ParallelExecutor executor;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        when(sessionProvider.open(any())).thenReturn(session);

        ActionRegistry actions = ActionRegistry.withBuiltIns();
        actions.register("track", (context, config) -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(Long.parseLong(String.valueOf(config.getOrDefault("sleep", "100"))));
            } finally {
                active.decrementAndGet();
            }
            return ActionResult.success();
        });
        actions.register("flaky", (context, config) -> {
            String profileId = String.valueOf(context.getProfile().get("id"));
            int attempt = attempts.computeIfAbsent(profileId, id -> new AtomicInteger()).incrementAndGet();
            return attempt == 1 ? ActionResult.failure("Target closed") : ActionResult.success();
        });
        actions.register("fail", (context, config) -> ActionResult.failure("Invalid selector"));
        actions.register("closed", (context, config) -> {
            String profileId = String.valueOf(context.getProfile().get("id"));
            attempts.computeIfAbsent(profileId, id -> new AtomicInteger()).incrementAndGet();
            return ActionResult.failure("Target closed");
        });

        Properties properties = new Properties();
        properties.setProperty(ConvoyConfiguration.METRICS_ENABLED, "false");
        engine = new SimpleWorkflowEngine(actions, null, new ConvoyConfiguration(properties));
        runner = new ProfileRunner(engine, sessionProvider);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (executor != null) {
            executor.shutdown();
        }
        engine.shutdown();
        mocks.close();
    }

    private ParallelExecutor executor(ParallelOptions.Builder options) {
        executor = new ParallelExecutor(runner, options.build(), null);
        executor.subscribe(events::add);
        return executor;
    }

    private static ParallelOptions.Builder options(int maxConcurrent) {
        return ParallelOptions.builder()
                .maxConcurrent(maxConcurrent)
                .delayBetweenMs(0)
                .pausePollMs(50)
                .timeoutMs(10_000)
                .retryPolicy(RetryPolicy.none());
    }

    private static Workflow workflow(Step step) {
        return Workflow.builder().id("wf").name("Parallel workflow").step(step).build();
    }

    private static Step step(String type) {
        return Step.builder().id(type).type(type).build();
    }

    private static List<Profile> profiles(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> Profile.of("p" + i, "Profile " + i)).toList();
    }

    private static Workflow slowWorkflow() {
        return workflow(Step.builder().id("wait").type("wait-time").config("duration", 10).build());
    }

    @Nested
    @DisplayName("Dispatching")
    class Dispatching {

        @Test
        @DisplayName("never runs more slots than the concurrency limit")
        void testConcurrencyLimit() throws Exception {
            ParallelStatus status = executor(options(2)).start(workflow(step("track")), profiles(5));

            assertThat(maxActive.get()).isLessThanOrEqualTo(2);
            assertEquals(5, status.completedCount());
            assertEquals(0, status.failedCount());
            assertEquals(100, status.progress());
            assertFalse(status.running());
            assertThat(status.completed()).extracting(CompletedRun::profileId)
                    .containsExactlyInAnyOrder("p1", "p2", "p3", "p4", "p5");
            verify(sessionProvider, times(5)).open(any());
            verify(session, times(5)).close();
        }

        @Test
        @DisplayName("stagger delay spaces out slot starts")
        void testDelayBetweenStarts() {
            long started = System.currentTimeMillis();
            executor(options(3).delayBetweenMs(150)).start(workflow(step("track")), profiles(3));

            assertThat(System.currentTimeMillis() - started).isGreaterThanOrEqualTo(300);
        }

        @Test
        @DisplayName("emits started first and completed last")
        void testEventOrder() {
            executor(options(1)).start(workflow(step("track")), profiles(2));

            assertThat(events.get(0)).isInstanceOf(ParallelEvent.Started.class);
            assertThat(events.get(events.size() - 1)).isInstanceOf(ParallelEvent.Completed.class);
            assertThat(events).filteredOn(ParallelEvent.SlotSucceeded.class::isInstance).hasSize(2);
            assertThat(events).filteredOn(ParallelEvent.SlotEnded.class::isInstance).hasSize(2);
        }

        @Test
        void testEmptyProfileListFinishesImmediately() {
            ParallelStatus status = executor(options(2)).start(workflow(step("track")), List.of());

            assertEquals(0, status.totalProfiles());
            assertEquals(0, status.progress());
        }

        @Test
        void testStartWhileRunningIsRejected() {
            ParallelExecutor parallel = executor(options(1));
            CompletableFuture<ParallelStatus> run = CompletableFuture.supplyAsync(
                    () -> parallel.start(slowWorkflow(), profiles(1)));
            await().atMost(Duration.ofSeconds(5)).until(() -> parallel.getStatus().activeCount() == 1);

            IllegalStateException error = assertThrows(IllegalStateException.class,
                    () -> parallel.start(slowWorkflow(), profiles(1)));
            assertEquals("Executor is already running", error.getMessage());

            parallel.stop();
            run.join();
        }

        @Test
        void testAddProfilesRequiresRunningExecutor() {
            ParallelExecutor parallel = executor(options(1));

            assertThrows(IllegalStateException.class, () -> parallel.addProfiles(profiles(1)));
        }
    }

    @Nested
    @DisplayName("Failures and retries")
    class Failures {

        @Test
        @DisplayName("retryable failure succeeds on the next attempt")
        void testRetryableFailureIsRetried() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxRetries(2)
                    .strategy(RetryStrategy.FIXED)
                    .baseDelayMs(20)
                    .jitter(false)
                    .build();

            ParallelStatus status = executor(options(2).retryPolicy(policy)).start(workflow(step("flaky")), profiles(2));

            assertEquals(2, status.completedCount());
            assertEquals(0, status.failedCount());
            assertEquals(0, status.retryingCount());
            assertThat(attempts.get("p1").get()).isEqualTo(2);
            assertThat(events).filteredOn(ParallelEvent.SlotRetrying.class::isInstance)
                    .extracting(e -> ((ParallelEvent.SlotRetrying) e).retryCount())
                    .containsExactly(1, 1);
        }

        @Test
        @DisplayName("exhausted retries are recorded once as a failure")
        void testRetriesExhausted() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxRetries(2)
                    .strategy(RetryStrategy.FIXED)
                    .baseDelayMs(10)
                    .jitter(false)
                    .build();

            ParallelStatus status = executor(options(1).retryPolicy(policy)).start(workflow(step("closed")), profiles(1));

            assertEquals(0, status.completedCount());
            assertEquals(1, status.failedCount());
            assertEquals(0, status.retryingCount());
            assertEquals(2, status.failed().get(0).retryCount());
            assertThat(status.failed().get(0).originalError()).contains("Target closed");
            assertThat(attempts.get("p1").get()).isEqualTo(3);
            assertThat(events).filteredOn(ParallelEvent.SlotRetrying.class::isInstance)
                    .extracting(e -> ((ParallelEvent.SlotRetrying) e).retryCount())
                    .containsExactly(1, 2);
        }

        @Test
        @DisplayName("non-retryable failure is annotated with the failing step")
        void testFailureAnnotation() {
            Step broken = Step.builder().id("broken").name("Broken").type("fail").build();

            ParallelStatus status = executor(options(1)).start(workflow(broken), profiles(1));

            assertEquals(1, status.failedCount());
            FailedRun failure = status.failed().get(0);
            assertEquals("p1", failure.profileId());
            assertEquals("Step \"Broken\" failed: Invalid selector", failure.originalError());
            assertEquals("[Step 1/1: Broken] Step \"Broken\" failed: Invalid selector", failure.error());
            assertEquals(0, failure.failedStep().index());
            assertEquals("fail", failure.failedStep().type());
            assertEquals(0, failure.retryCount());
        }

        @Test
        void testSessionOpenFailureFailsOnlyThatProfile() throws Exception {
            Profile broken = Profile.of("bad", "Broken profile");
            when(sessionProvider.open(broken)).thenThrow(new IllegalStateException("browser unavailable"));

            List<Profile> targets = new ArrayList<>(profiles(2));
            targets.add(broken);
            ParallelStatus status = executor(options(3)).start(workflow(step("track")), targets);

            assertEquals(2, status.completedCount());
            assertEquals(1, status.failedCount());
            assertThat(status.failed().get(0).error()).endsWith("browser unavailable");
        }

        @Test
        @DisplayName("stop-on-error halts the run after the first failure")
        void testStopOnError() {
            ParallelStatus status = executor(options(1).stopOnError(true)).start(workflow(step("fail")), profiles(3));

            assertEquals(1, status.failedCount());
            assertEquals(0, status.completedCount());
            assertFalse(status.running());
            assertThat(events).anyMatch(ParallelEvent.Stopped.class::isInstance);
        }
    }

    @Nested
    @DisplayName("Run control")
    class RunControl {

        @Test
        void testPauseHoldsQueueUntilResume() {
            ParallelExecutor parallel = executor(options(1));
            Workflow workflow = workflow(Step.builder().id("track").type("track").config("sleep", "200").build());
            CompletableFuture<ParallelStatus> run = CompletableFuture.supplyAsync(
                    () -> parallel.start(workflow, profiles(3)));
            await().atMost(Duration.ofSeconds(5)).until(() -> parallel.getStatus().activeCount() == 1);

            assertTrue(parallel.pause());
            assertFalse(parallel.pause());
            await().atMost(Duration.ofSeconds(5)).until(() -> parallel.getStatus().completedCount() == 1);
            await().during(Duration.ofMillis(400)).atMost(Duration.ofSeconds(2))
                    .until(() -> parallel.getStatus().activeCount() == 0);
            assertTrue(parallel.getStatus().paused());

            assertTrue(parallel.resume());
            ParallelStatus status = run.join();
            assertEquals(3, status.completedCount());
        }

        @Test
        @DisplayName("stop releases active sessions without recording outcomes")
        void testStopReleasesSlots() throws Exception {
            ParallelExecutor parallel = executor(options(2));
            CompletableFuture<ParallelStatus> run = CompletableFuture.supplyAsync(
                    () -> parallel.start(slowWorkflow(), profiles(3)));
            await().atMost(Duration.ofSeconds(5)).until(() -> parallel.getStatus().activeCount() == 2);

            assertTrue(parallel.stop());
            ParallelStatus status = run.get(5, TimeUnit.SECONDS);

            assertEquals(0, status.completedCount());
            assertEquals(0, status.failedCount());
            assertEquals(1, status.queuedCount());
            verify(session, times(2)).close();
            assertFalse(parallel.stop());
        }

        @Test
        @DisplayName("skipped slot fails without retry")
        void testSkipSlot() throws Exception {
            RetryPolicy retryEverything = RetryPolicy.builder().maxRetries(3).addRetryableRegex(".").build();
            ParallelExecutor parallel = executor(options(1).retryPolicy(retryEverything));
            CompletableFuture<ParallelStatus> run = CompletableFuture.supplyAsync(
                    () -> parallel.start(slowWorkflow(), profiles(1)));
            await().atMost(Duration.ofSeconds(5)).until(() -> parallel.getStatus().activeCount() == 1);

            String slotId = parallel.getStatus().slots().get(0).slotId();
            assertTrue(parallel.skipSlot(slotId));
            ParallelStatus status = run.get(5, TimeUnit.SECONDS);

            assertEquals(1, status.failedCount());
            assertEquals("Skipped by user", status.failed().get(0).originalError());
            assertEquals(0, status.failed().get(0).retryCount());
            assertFalse(parallel.skipSlot("slot-unknown"));
        }

        @Test
        void testAddAndRemoveQueuedProfiles() {
            ParallelExecutor parallel = executor(options(1));
            Workflow workflow = workflow(Step.builder().id("track").type("track").config("sleep", "300").build());
            CompletableFuture<ParallelStatus> run = CompletableFuture.supplyAsync(
                    () -> parallel.start(workflow, profiles(1)));
            await().atMost(Duration.ofSeconds(5)).until(() -> parallel.getStatus().activeCount() == 1);

            parallel.addProfiles(List.of(Profile.of("extra", "Extra"), Profile.of("dropped", "Dropped")));
            assertTrue(parallel.removeFromQueue("dropped"));
            assertFalse(parallel.removeFromQueue("dropped"));

            ParallelStatus status = run.join();
            assertThat(status.completed()).extracting(CompletedRun::profileId).containsExactlyInAnyOrder("p1", "extra");
            assertThat(events).anyMatch(ParallelEvent.QueueUpdated.class::isInstance);
        }

        @Test
        void testUpdateConfigRaisesConcurrency() {
            ParallelExecutor parallel = executor(options(1));
            parallel.updateConfig(options(4).build());

            assertEquals(4, parallel.getOptions().getMaxConcurrent());
            parallel.start(workflow(step("track")), profiles(4));
            assertThat(maxActive.get()).isLessThanOrEqualTo(4);
        }
    }
}
