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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, ordered tree of steps with initial variable declarations.
 * Instances are immutable; changing a workflow means registering a new definition.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Workflow {

    private final String id;
    private final String name;
    private final String description;
    private final Map<String, Object> variables;
    private final List<Step> steps;

    @JsonCreator
    public Workflow(@JsonProperty("id") String id,
                    @JsonProperty("name") String name,
                    @JsonProperty("description") String description,
                    @JsonProperty("variables") Map<String, Object> variables,
                    @JsonProperty("steps") List<Step> steps) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.variables = variables != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(variables))
                : Map.of();
        this.steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Workflow workflow = (Workflow) o;
        return Objects.equals(id, workflow.id) &&
               Objects.equals(name, workflow.name) &&
               Objects.equals(description, workflow.description) &&
               Objects.equals(variables, workflow.variables) &&
               Objects.equals(steps, workflow.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, variables, steps);
    }

    @Override
    public String toString() {
        return "Workflow{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", steps=" + steps.size() +
               '}';
    }

    /**
     * Builder for Workflow.
     */
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private final Map<String, Object> variables = new LinkedHashMap<>();
        private final List<Step> steps = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder variable(String name, Object value) {
            this.variables.put(name, value);
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            if (variables != null) {
                this.variables.putAll(variables);
            }
            return this;
        }

        public Builder step(Step step) {
            this.steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder steps(List<Step> steps) {
            if (steps != null) {
                steps.forEach(this::step);
            }
            return this;
        }

        public Workflow build() {
            return new Workflow(id, name, description, variables, steps);
        }
    }
}
