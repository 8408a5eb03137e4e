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

package dev.mars.convoy.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle tests for {@link Execution} and the {@link StepResult} variants.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
class ExecutionTest {

    @Test
    void testLifecycleToCompletion() {
        Execution execution = new Execution("exec-1", "wf-1", "Workflow");
        assertEquals(ExecutionStatus.PENDING, execution.getStatus());

        execution.start();
        assertTrue(execution.isRunning());
        execution.addResult(StepResult.success("s1", java.util.Map.of()));
        execution.complete();

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertTrue(execution.isSuccessful());
        assertEquals(1, execution.getResults().size());
        assertNotNull(execution.getCompletedAt());
        assertEquals(Optional.empty(), execution.getError());
    }

    @Test
    void testTerminalStateIsFinal() {
        Execution execution = new Execution("exec-1", "wf-1", "Workflow");
        execution.start();
        execution.fail("boom");
        execution.complete();

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals("boom", execution.getError().orElseThrow());
        assertThrows(IllegalStateException.class, () -> execution.addResult(StepResult.failure("s2", "late")));
    }

    @Test
    void testStartTwiceFails() {
        Execution execution = new Execution("exec-1", "wf-1", "Workflow");
        execution.start();

        assertThrows(IllegalStateException.class, execution::start);
    }

    @Test
    void testPauseAndResume() {
        Execution execution = new Execution("exec-1", "wf-1", "Workflow");
        execution.start();
        execution.pause();
        assertEquals(ExecutionStatus.PAUSED, execution.getStatus());
        execution.resume();
        assertEquals(ExecutionStatus.RUNNING, execution.getStatus());
        execution.stop("cancelled");
        assertEquals(ExecutionStatus.STOPPED, execution.getStatus());
    }

    @Test
    void testSignalsAreSuccessfulResults() {
        StepResult.Break brk = new StepResult.Break("b1");
        StepResult.Stop stop = new StepResult.Stop("s1", true, "halt");

        assertTrue(brk.success());
        assertEquals(Optional.of(brk), brk.signal());
        assertTrue(stop.failed());
        assertEquals("failed", stop.status());
        assertTrue(StepResult.success("x", java.util.Map.of()).signal().isEmpty());
        assertEquals("nope", StepResult.failure("x", "nope").error().orElseThrow());
    }

    @Test
    void testStepBuilderKeepsChildren() {
        Step step = Step.builder().id("c1").type("condition")
                .then(Step.builder().id("t1").type("log").build())
                .otherwise(Step.builder().id("e1").type("log").build())
                .build();

        assertEquals(List.of("t1"), step.getThenSteps().stream().map(Step::getId).toList());
        assertEquals(2, step.getChildren().size());
        assertEquals("c1", step.getDisplayName());
    }
}
