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

package dev.mars.convoy.workflow.debug;

import dev.mars.convoy.config.ConvoyConfiguration;
import dev.mars.convoy.core.ExecutionStatus;
import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.workflow.RunOptions;
import dev.mars.convoy.workflow.SimpleWorkflowEngine;
import dev.mars.convoy.workflow.action.ActionRegistry;
import dev.mars.convoy.workflow.action.ActionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for DebugController stepping, breakpoints and session lifecycle.
 */
class DebugControllerTest {

    private final List<Object> recorded = new ArrayList<>();
    private SimpleWorkflowEngine engine;
    private DebugController controller;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        ActionRegistry actions = ActionRegistry.withBuiltIns();
        actions.register("record", (context, config) -> {
            recorded.add(config.get("value"));
            return ActionResult.success();
        });
        actions.register("fail", (context, config) -> ActionResult.failure("broken"));
        Properties properties = new Properties();
        properties.setProperty(ConvoyConfiguration.METRICS_ENABLED, "false");
        engine = new SimpleWorkflowEngine(actions, null, new ConvoyConfiguration(properties));
        controller = new DebugController(engine);

        workflow = Workflow.builder().id("wf").name("Debuggable")
                .variable("greeting", "hi")
                .step(record("s0", "{{greeting}}"))
                .step(record("s1", "one"))
                .step(record("s2", "two"))
                .step(record("s3", "three"))
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private static Step record(String id, Object value) {
        return Step.builder().id(id).type("record").config("value", value).build();
    }

    private String start(Workflow target, String... breakpoints) {
        DebugOutcome outcome = controller.startDebug(target, RunOptions.defaults(), List.of(breakpoints));
        assertThat(outcome.success()).isTrue();
        return outcome.state().debugId();
    }

    @Test
    void startCreatesPausedSession() {
        String id = start(workflow);

        DebugSnapshot state = controller.getState(id).state();
        assertThat(id).matches("debug-\\d+-[0-9a-z]{9}");
        assertThat(state.status()).isEqualTo(ExecutionStatus.PAUSED);
        assertThat(state.currentStepIndex()).isZero();
        assertThat(state.totalSteps()).isEqualTo(4);
        assertThat(state.currentStep().getId()).isEqualTo("s0");
        assertThat(recorded).isEmpty();
    }

    @Nested
    @DisplayName("Stepping")
    class Stepping {

        @Test
        void eachStepAdvancesByExactlyOne() {
            String id = start(workflow);

            for (int expected = 1; expected <= 4; expected++) {
                DebugOutcome outcome = controller.step(id);
                assertThat(outcome.success()).isTrue();
                assertThat(outcome.state().currentStepIndex()).isEqualTo(expected);
                assertThat(outcome.state().completed()).isEqualTo(expected == 4);
                assertThat(recorded).hasSize(expected);
            }
            assertThat(controller.getState(id).state().status()).isEqualTo(ExecutionStatus.COMPLETED);
        }

        @Test
        void steppingAFinishedSessionIsUnsuccessful() {
            String id = start(workflow);
            controller.continueToBreakpoint(id);

            DebugOutcome outcome = controller.step(id);

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.error()).isEqualTo("Debug session already finished");
        }

        @Test
        void unknownSessionIsUnsuccessful() {
            DebugOutcome outcome = controller.step("debug-missing");

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.error()).isEqualTo("Debug session not found");
            assertThat(outcome.getState()).isEmpty();
        }

        @Test
        void failingStepFailsTheSession() {
            Workflow failing = Workflow.builder().id("f").name("Failing")
                    .step(record("a", "a"))
                    .step(Step.builder().id("b").name("Broken step").type("fail").build())
                    .step(record("c", "c"))
                    .build();
            String id = start(failing);

            controller.step(id);
            DebugOutcome outcome = controller.step(id);

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.error()).isEqualTo("Step \"Broken step\" failed: broken");
            assertThat(outcome.state().status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(controller.step(id).success()).isFalse();
        }

        @Test
        void stopStepCompletesTheSession() {
            Workflow stopping = Workflow.builder().id("s").name("Stopping")
                    .step(Step.builder().id("halt").type("stop").build())
                    .step(record("never", "never"))
                    .build();
            String id = start(stopping);

            DebugOutcome outcome = controller.step(id);

            assertThat(outcome.success()).isTrue();
            assertThat(outcome.state().status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(recorded).isEmpty();
        }

        @Test
        void variablesSetWhilePausedAreSeenByTheNextStep() {
            String id = start(workflow);

            controller.setVariable(id, "greeting", "changed");
            controller.step(id);

            assertThat(recorded).containsExactly("changed");
            assertThat(controller.getState(id).state().variables()).containsEntry("greeting", "changed");
        }
    }

    @Nested
    @DisplayName("Breakpoints")
    class Breakpoints {

        @Test
        void continueRunsToNextBreakpoint() {
            String id = start(workflow, "s2");

            DebugOutcome outcome = controller.continueToBreakpoint(id);

            assertThat(outcome.success()).isTrue();
            assertThat(outcome.stepResults()).hasSize(2);
            assertThat(outcome.state().status()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(outcome.state().currentStep().getId()).isEqualTo("s2");
        }

        @Test
        void continueFromABreakpointMovesPastIt() {
            String id = start(workflow, "s2");
            controller.continueToBreakpoint(id);

            DebugOutcome outcome = controller.continueToBreakpoint(id);

            assertThat(outcome.state().status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(recorded).containsExactly("hi", "one", "two", "three");
        }

        @Test
        void breakpointOnFirstStepIsNotHitByContinue() {
            String id = start(workflow, "s0");

            DebugOutcome outcome = controller.continueToBreakpoint(id);

            assertThat(outcome.state().completed()).isTrue();
        }

        @Test
        void breakpointsCanBeToggled() {
            String id = start(workflow);

            controller.setBreakpoint(id, "s3", true);
            assertThat(controller.getState(id).state().breakpoints()).isEqualTo(Set.of("s3"));

            controller.setBreakpoint(id, "s3", false);
            DebugOutcome outcome = controller.continueToBreakpoint(id);
            assertThat(outcome.state().completed()).isTrue();
        }
    }

    @Test
    void stopAndCleanupEndTheSession() {
        String id = start(workflow);
        controller.step(id);

        DebugOutcome stopped = controller.stop(id);
        assertThat(stopped.state().status()).isEqualTo(ExecutionStatus.STOPPED);
        assertThat(controller.step(id).success()).isFalse();

        assertThat(controller.listSessions()).extracting(DebugSnapshot::debugId).containsExactly(id);
        assertThat(controller.cleanup(id)).isTrue();
        assertThat(controller.listSessions()).isEmpty();
        assertThat(controller.getState(id).success()).isFalse();
    }

    @Test
    void sessionsAreIndependent() {
        String first = start(workflow);
        String second = start(workflow);

        controller.step(first);
        controller.step(first);
        controller.step(second);

        assertThat(controller.getState(first).state().currentStepIndex()).isEqualTo(2);
        assertThat(controller.getState(second).state().currentStepIndex()).isEqualTo(1);
        assertThat(Map.of("first", first, "second", second)).doesNotContainValue(null);
    }
}
