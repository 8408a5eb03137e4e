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

package dev.mars.convoy.scheduler.batch;

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
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for BatchRunner.
 */
class BatchRunnerTest {

    @Mock
    private ProfileSessionProvider sessionProvider;

    @Mock
    private ProfileSession session;

    private final List<String> visited = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger flakyCalls = new AtomicInteger();
    private SimpleWorkflowEngine engine;
    private ProfileRunner runner;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        when(sessionProvider.open(any())).thenReturn(session);

        ActionRegistry actions = ActionRegistry.withBuiltIns();
        actions.register("visit", (context, config) -> {
            visited.add(String.valueOf(context.getProfile().get("id")));
            return ActionResult.success();
        });
        actions.register("flaky", (context, config) -> flakyCalls.incrementAndGet() < 3
                ? ActionResult.failure("Navigation timeout")
                : ActionResult.success());
        actions.register("reject", (context, config) -> ActionResult.failure("Access denied"));

        Properties properties = new Properties();
        properties.setProperty(ConvoyConfiguration.METRICS_ENABLED, "false");
        engine = new SimpleWorkflowEngine(actions, null, new ConvoyConfiguration(properties));
        runner = new ProfileRunner(engine, sessionProvider);
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.shutdown();
        mocks.close();
    }

    private static Workflow workflow(String type) {
        return Workflow.builder().id("batch").name("Batch").step(Step.builder().id("s").type(type).build()).build();
    }

    @Test
    void testRunsProfilesInOrder() throws Exception {
        List<Profile> profiles = List.of(Profile.of("a", "A"), Profile.of("b", "B"), Profile.of("c", "C"));

        BatchResult result = new BatchRunner(runner, 0, 0, 5_000).run(workflow("visit"), profiles);

        assertTrue(result.success());
        assertEquals(3, result.successCount());
        assertThat(visited).containsExactly("a", "b", "c");
        assertThat(result.results()).allSatisfy(r -> assertThat(r.executionId()).startsWith("exec-"));
        verify(session, times(3)).close();
    }

    @Test
    void testFailureIsReportedPerProfile() throws Exception {
        BatchResult result = new BatchRunner(runner, 0, 0, 5_000)
                .run(workflow("reject"), List.of(Profile.of("a", "A")));

        assertFalse(result.success());
        assertEquals("Some executions failed", result.error());
        assertEquals("Step \"s\" failed: Access denied", result.results().get(0).error());
    }

    @Test
    void testEmptyProfileList() throws Exception {
        BatchResult result = new BatchRunner(runner, 0, 0, 5_000).run(workflow("visit"), List.of());

        assertFalse(result.success());
        assertEquals("No profiles to run", result.error());
    }

    @Test
    void testRetryableFailureIsRetried() throws Exception {
        RetryPolicy policy = RetryPolicy.builder()
                .maxRetries(3)
                .strategy(RetryStrategy.FIXED)
                .baseDelayMs(10)
                .jitter(false)
                .build();

        BatchResult result = new BatchRunner(runner, 0, 0, 5_000, policy)
                .run(workflow("flaky"), List.of(Profile.of("a", "A")));

        assertTrue(result.success());
        assertEquals(3, flakyCalls.get());
        verify(sessionProvider, times(3)).open(any());
    }

    @Test
    void testTimeoutFailsProfile() throws Exception {
        Workflow slow = Workflow.builder().id("slow").name("Slow")
                .step(Step.builder().id("wait").type("wait-time").config("duration", 10).build())
                .build();

        BatchResult result = new BatchRunner(runner, 0, 0, 200).run(slow, List.of(Profile.of("a", "A")));

        assertFalse(result.success());
        assertEquals("Execution timeout after 200ms", result.results().get(0).error());
    }

    @Test
    void testSessionOpenFailure() throws Exception {
        when(sessionProvider.open(any())).thenThrow(new IllegalStateException("profile locked"));

        BatchResult result = new BatchRunner(runner, 0, 0, 5_000).run(workflow("visit"), List.of(Profile.of("a", "A")));

        assertEquals("profile locked", result.results().get(0).error());
        assertThat(visited).isEmpty();
    }

    @Test
    void testInvalidDelayRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BatchRunner(runner, 500, 100, 5_000));
    }
}
