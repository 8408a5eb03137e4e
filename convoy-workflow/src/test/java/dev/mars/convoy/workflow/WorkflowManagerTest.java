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

package dev.mars.convoy.workflow;

import dev.mars.convoy.config.ConvoyConfiguration;
import dev.mars.convoy.core.Execution;
import dev.mars.convoy.core.ExecutionStatus;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.core.exceptions.WorkflowNotFoundException;
import dev.mars.convoy.workflow.action.ActionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for WorkflowManager.
 */
class WorkflowManagerTest {

    private static final String SLOW_WORKFLOW = """
            id: slow
            name: Slow
            steps:
              - id: wait
                type: wait-time
                config:
                  duration: 10
            """;

    private WorkflowManager manager;

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty(ConvoyConfiguration.METRICS_ENABLED, "false");
        manager = WorkflowManager.create(ActionRegistry.withBuiltIns(), new ConvoyConfiguration(properties));
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void testRegisterFromYamlAndExecute() throws Exception {
        Workflow workflow = manager.registerFromString("""
                id: greet
                name: Greet
                variables:
                  who: world
                steps:
                  - id: set
                    type: set-variable
                    config:
                      name: greeting
                      value: "Hello {{who}}"
                  - id: say
                    type: log
                    config:
                      message: "{{greeting}}"
                """);

        Execution execution = manager.executeWorkflow(workflow.getId(), RunOptions.defaults());

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertThat(execution.getExecutionId()).matches("exec-\\d+-[0-9a-z]{9}");
        assertThat(execution.getResults().get(1).data()).containsEntry("message", "Hello world");
        assertThat(manager.listWorkflows()).extracting(Workflow::getId).containsExactly("greet");
    }

    @Test
    void testUnknownWorkflowThrows() {
        WorkflowNotFoundException e = assertThrows(WorkflowNotFoundException.class,
                () -> manager.executeWorkflow("ghost", RunOptions.defaults()));

        assertEquals("ghost", e.getWorkflowId());
    }

    @Test
    void testInvalidDefinitionIsNotRegistered() {
        assertThrows(WorkflowParseException.class, () -> manager.registerFromString("""
                id: broken
                name: Broken
                steps:
                  - type: log
                """));

        assertThat(manager.getWorkflow("broken")).isEmpty();
    }

    @Test
    void testRunningExecutionsCanBeStopped() throws Exception {
        manager.registerFromString(SLOW_WORKFLOW);

        CompletableFuture<Execution> future = manager.executeWorkflowAsync("slow", RunOptions.defaults());
        await().atMost(Duration.ofSeconds(5)).until(() -> manager.listRunningExecutions().size() == 1);

        String executionId = manager.listRunningExecutions().get(0).getExecutionId();
        assertTrue(manager.stopExecution(executionId));

        Execution execution = future.get();
        assertEquals(ExecutionStatus.STOPPED, execution.getStatus());
        assertThat(manager.listRunningExecutions()).isEmpty();
        assertThat(manager.stopExecution(executionId)).isFalse();
    }

    @Test
    void testDeleteWorkflow() throws Exception {
        manager.registerFromString(SLOW_WORKFLOW);

        assertTrue(manager.deleteWorkflow("slow"));
        assertThat(manager.getWorkflow("slow")).isEmpty();
    }
}
