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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a workflow step tree.
 * <p>
 * A step is either a leaf action, resolved by its {@code type} against the action registry,
 * or a control-flow construct whose children live in the type-specific lists:
 * {@code then}/{@code else} for conditions, {@code body} for loops and
 * {@code try}/{@code catch}/{@code finally} for exception steps.
 * Config values are templates and are interpolated against the run's variables before use.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Step {

    private final String id;
    private final String type;
    private final String name;
    private final Map<String, Object> config;
    private final List<Step> thenSteps;
    private final List<Step> elseSteps;
    private final List<Step> body;
    private final List<Step> trySteps;
    private final List<Step> catchSteps;
    private final List<Step> finallySteps;

    @JsonCreator
    public Step(@JsonProperty("id") String id,
                @JsonProperty("type") String type,
                @JsonProperty("name") String name,
                @JsonProperty("config") Map<String, Object> config,
                @JsonProperty("then") List<Step> thenSteps,
                @JsonProperty("else") List<Step> elseSteps,
                @JsonProperty("body") List<Step> body,
                @JsonProperty("try") List<Step> trySteps,
                @JsonProperty("catch") List<Step> catchSteps,
                @JsonProperty("finally") List<Step> finallySteps) {
        this.id = id;
        this.type = type;
        this.name = name;
        // config values may be null
        this.config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Map.of();
        this.thenSteps = copyOf(thenSteps);
        this.elseSteps = copyOf(elseSteps);
        this.body = copyOf(body);
        this.trySteps = copyOf(trySteps);
        this.catchSteps = copyOf(catchSteps);
        this.finallySteps = copyOf(finallySteps);
    }

    private static List<Step> copyOf(List<Step> steps) {
        return steps != null ? List.copyOf(steps) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    @JsonProperty("then")
    public List<Step> getThenSteps() {
        return thenSteps;
    }

    @JsonProperty("else")
    public List<Step> getElseSteps() {
        return elseSteps;
    }

    public List<Step> getBody() {
        return body;
    }

    @JsonProperty("try")
    public List<Step> getTrySteps() {
        return trySteps;
    }

    @JsonProperty("catch")
    public List<Step> getCatchSteps() {
        return catchSteps;
    }

    @JsonProperty("finally")
    public List<Step> getFinallySteps() {
        return finallySteps;
    }

    /**
     * Name for logs and error messages: the step name when set, otherwise its id.
     */
    @JsonIgnore
    public String getDisplayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return id;
    }

    /**
     * All direct children across every branch list, in declaration order.
     */
    @JsonIgnore
    public List<Step> getChildren() {
        List<Step> children = new ArrayList<>();
        children.addAll(thenSteps);
        children.addAll(elseSteps);
        children.addAll(body);
        children.addAll(trySteps);
        children.addAll(catchSteps);
        children.addAll(finallySteps);
        return children;
    }

    public Object getConfigValue(String key) {
        return config.get(key);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Step step = (Step) o;
        return Objects.equals(id, step.id) &&
               Objects.equals(type, step.type) &&
               Objects.equals(name, step.name) &&
               Objects.equals(config, step.config) &&
               Objects.equals(thenSteps, step.thenSteps) &&
               Objects.equals(elseSteps, step.elseSteps) &&
               Objects.equals(body, step.body) &&
               Objects.equals(trySteps, step.trySteps) &&
               Objects.equals(catchSteps, step.catchSteps) &&
               Objects.equals(finallySteps, step.finallySteps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, name, config, thenSteps, elseSteps, body, trySteps, catchSteps, finallySteps);
    }

    @Override
    public String toString() {
        return "Step{" +
               "id='" + id + '\'' +
               ", type='" + type + '\'' +
               ", name='" + name + '\'' +
               ", config=" + config +
               '}';
    }

    /**
     * Builder for Step.
     */
    public static class Builder {
        private String id;
        private String type;
        private String name;
        private final Map<String, Object> config = new LinkedHashMap<>();
        private final List<Step> thenSteps = new ArrayList<>();
        private final List<Step> elseSteps = new ArrayList<>();
        private final List<Step> body = new ArrayList<>();
        private final List<Step> trySteps = new ArrayList<>();
        private final List<Step> catchSteps = new ArrayList<>();
        private final List<Step> finallySteps = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder config(String key, Object value) {
            this.config.put(key, value);
            return this;
        }

        public Builder config(Map<String, Object> config) {
            if (config != null) {
                this.config.putAll(config);
            }
            return this;
        }

        public Builder then(Step... steps) {
            this.thenSteps.addAll(List.of(steps));
            return this;
        }

        public Builder otherwise(Step... steps) {
            this.elseSteps.addAll(List.of(steps));
            return this;
        }

        public Builder body(Step... steps) {
            this.body.addAll(List.of(steps));
            return this;
        }

        public Builder tryBlock(Step... steps) {
            this.trySteps.addAll(List.of(steps));
            return this;
        }

        public Builder catchBlock(Step... steps) {
            this.catchSteps.addAll(List.of(steps));
            return this;
        }

        public Builder finallyBlock(Step... steps) {
            this.finallySteps.addAll(List.of(steps));
            return this;
        }

        public Builder thenSteps(List<Step> steps) {
            this.thenSteps.addAll(steps);
            return this;
        }

        public Builder elseSteps(List<Step> steps) {
            this.elseSteps.addAll(steps);
            return this;
        }

        public Builder bodySteps(List<Step> steps) {
            this.body.addAll(steps);
            return this;
        }

        public Builder trySteps(List<Step> steps) {
            this.trySteps.addAll(steps);
            return this;
        }

        public Builder catchSteps(List<Step> steps) {
            this.catchSteps.addAll(steps);
            return this;
        }

        public Builder finallySteps(List<Step> steps) {
            this.finallySteps.addAll(steps);
            return this;
        }

        public Step build() {
            return new Step(id, type, name, config, thenSteps, elseSteps, body, trySteps, catchSteps, finallySteps);
        }
    }
}
