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

import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.workflow.action.ActionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for InMemoryWorkflowRegistry and the validation it applies.
 */
class InMemoryWorkflowRegistryTest {

    private InMemoryWorkflowRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryWorkflowRegistry(new WorkflowValidator(ActionRegistry.withBuiltIns()));
    }

    private static Step step(String id, String type) {
        return Step.builder().id(id).type(type).build();
    }

    @Test
    void registersAndListsWorkflows() throws WorkflowParseException {
        registry.register(Workflow.builder().id("b").name("B").step(step("s1", "log")).build());
        registry.register(Workflow.builder().id("a").name("A").step(step("s1", "comment")).build());

        assertThat(registry.list()).extracting(Workflow::getId).containsExactly("a", "b");
        assertThat(registry.get("a")).isPresent();
        assertThat(registry.get("missing")).isEmpty();
    }

    @Test
    void deleteRemovesWorkflow() throws WorkflowParseException {
        registry.register(Workflow.builder().id("a").name("A").step(step("s1", "log")).build());

        assertThat(registry.delete("a")).isTrue();
        assertThat(registry.delete("a")).isFalse();
        assertThat(registry.get("a")).isEmpty();
    }

    @Test
    void rejectsMissingIdentifiers() {
        Workflow workflow = Workflow.builder().name(" ").build();

        assertThatThrownBy(() -> registry.register(workflow))
                .isInstanceOf(WorkflowParseException.class)
                .hasMessageContaining("Workflow must have an ID")
                .hasMessageContaining("Workflow must have a name")
                .hasMessageContaining("Workflow must have steps");
    }

    @Test
    void rejectsNestedStepsWithoutIdOrType() {
        Workflow workflow = Workflow.builder().id("w").name("W")
                .step(Step.builder().id("loop").type("loop-count")
                        .body(Step.builder().type("log").build(), Step.builder().id("x").build())
                        .build())
                .build();

        assertThatThrownBy(() -> registry.register(workflow))
                .isInstanceOfSatisfying(WorkflowParseException.class, e -> {
                    ValidationResult result = e.getValidationResult();
                    assertThat(result.getErrors()).extracting(ValidationResult.ValidationIssue::fieldPath)
                            .containsExactly("steps[0].body[0]", "steps[0].body[1]");
                });
    }

    @Test
    void rejectsDuplicateStepIdsAcrossBranches() {
        Workflow workflow = Workflow.builder().id("w").name("W")
                .step(Step.builder().id("cond").type("condition")
                        .then(step("dup", "log"))
                        .otherwise(step("dup", "log"))
                        .build())
                .build();

        assertThatThrownBy(() -> registry.register(workflow))
                .hasMessageContaining("Duplicate step ID 'dup'");
    }

    @Test
    void unknownStepTypeIsOnlyAWarning() throws WorkflowParseException {
        Workflow workflow = Workflow.builder().id("w").name("W").step(step("s1", "click")).build();

        ValidationResult result = new WorkflowValidator(ActionRegistry.withBuiltIns()).validate(workflow);
        registry.register(workflow);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).singleElement()
                .satisfies(issue -> assertThat(issue.message()).contains("Unknown step type 'click'"));
        assertThat(registry.get("w")).isPresent();
    }
}
