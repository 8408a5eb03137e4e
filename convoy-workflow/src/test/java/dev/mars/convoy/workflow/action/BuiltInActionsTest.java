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

package dev.mars.convoy.workflow.action;

import dev.mars.convoy.config.ConvoyConfiguration;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.workflow.ExecutionContext;
import dev.mars.convoy.workflow.RunOptions;
import dev.mars.convoy.workflow.SimpleWorkflowEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the built-in actions registered by {@link ActionRegistry#withBuiltIns()}.
 */
class BuiltInActionsTest {

    private SimpleWorkflowEngine engine;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty(ConvoyConfiguration.METRICS_ENABLED, "false");
        engine = new SimpleWorkflowEngine(ActionRegistry.withBuiltIns(), null, new ConvoyConfiguration(properties));
        Workflow workflow = Workflow.builder().id("actions").name("Actions").build();
        context = engine.createContext(workflow, RunOptions.defaults());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    void registryExposesBuiltInTypes() {
        ActionRegistry registry = engine.getActionRegistry();

        assertThat(registry.getActionTypes())
                .contains(SetVariableAction.TYPE, WaitTimeAction.TYPE, ArrayPushAction.TYPE, RandomNumberAction.TYPE);
        assertFalse(registry.hasAction("click"));
        assertThat(registry.getAction("click")).isEmpty();
    }

    @Nested
    @DisplayName("set-variable")
    class SetVariable {

        private final SetVariableAction action = new SetVariableAction();

        @Test
        void storesStringByDefault() {
            ActionResult result = action.execute(context, Map.of("name", "city", "value", "Lisbon"));

            assertTrue(result.success());
            assertEquals("Lisbon", context.getVariables().get("city"));
            assertThat(result.data()).containsEntry("variable", "city");
        }

        @ParameterizedTest
        @CsvSource({"true, true", "1, true", "false, false", "yes, false"})
        void convertsBooleans(String raw, boolean expected) {
            action.execute(context, Map.of("name", "flag", "value", raw, "type", "boolean"));

            assertEquals(expected, context.getVariables().get("flag"));
        }

        @Test
        void convertsNumbersAndJson() {
            action.execute(context, Map.of("name", "n", "value", "42.5", "type", "number"));
            action.execute(context, Map.of("name", "obj", "value", "{\"a\": [1, 2]}", "type", "json"));
            action.execute(context, Map.of("name", "bad", "value", "{not json", "type", "json"));

            assertEquals(42.5, context.getVariables().get("n"));
            assertThat(context.getVariables().get("obj")).isEqualTo(Map.of("a", List.of(1, 2)));
            assertEquals("{not json", context.getVariables().get("bad"));
        }

        @Test
        void requiresName() {
            ActionResult result = action.execute(context, Map.of("value", "x"));

            assertFalse(result.success());
            assertThat(result.data()).containsEntry("error", "Variable name is required");
        }
    }

    @Nested
    @DisplayName("array-push")
    class ArrayPush {

        private final ArrayPushAction action = new ArrayPushAction();

        @Test
        void startsAndExtendsList() {
            action.execute(context, Map.of("variable", "seen", "value", "a"));
            ActionResult result = action.execute(context, Map.of("array", "seen", "value", "b"));

            assertThat(context.getVariables().get("seen")).isEqualTo(List.of("a", "b"));
            assertThat(result.data()).containsEntry("length", 2);
        }

        @Test
        void replacesNonListVariable() {
            context.getVariables().set("seen", 7);

            action.execute(context, Map.of("variable", "seen", "value", "x"));

            assertThat(context.getVariables().get("seen")).isEqualTo(List.of("x"));
        }
    }

    @Nested
    @DisplayName("random-number")
    class RandomNumber {

        private final RandomNumberAction action = new RandomNumberAction();

        @RepeatedTest(20)
        void wholeNumbersStayInRange() {
            action.execute(context, Map.of("min", 5, "max", 10, "variable", "r"));

            Object value = context.getVariables().get("r");
            assertThat(value).isInstanceOf(Long.class);
            assertThat((Long) value).isBetween(5L, 9L);
        }

        @Test
        void roundsToRequestedDecimals() {
            ActionResult result = action.execute(context, Map.of("min", 0, "max", 1, "decimals", 2));

            double number = ((Number) result.data().get("number")).doubleValue();
            assertThat(number).isBetween(0.0, 1.0);
            assertEquals(number, Math.round(number * 100) / 100.0, 1e-9);
        }

        @Test
        void rejectsInvertedRange() {
            assertFalse(action.execute(context, Map.of("min", 10, "max", 1)).success());
        }
    }

    @Nested
    @DisplayName("wait-time")
    class WaitTime {

        private final WaitTimeAction action = new WaitTimeAction();

        @Test
        void waitsForDuration() throws Exception {
            long start = System.currentTimeMillis();

            ActionResult result = action.execute(context, Map.of("duration", 0.2));

            assertThat(System.currentTimeMillis() - start).isGreaterThanOrEqualTo(190);
            assertThat(result.data()).containsEntry("duration", 200L);
        }

        @Test
        void endsEarlyWhenCancelled() {
            CompletableFuture<ActionResult> wait = CompletableFuture.supplyAsync(() -> {
                try {
                    return action.execute(context, Map.of("duration", 30));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            });

            context.cancel();

            await().atMost(Duration.ofSeconds(2)).until(wait::isDone);
            assertTrue(wait.join().success());
        }
    }
}
