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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of executing one step.
 * <p>
 * Control flow is carried by the variant, not by exceptions: {@link Break}, {@link Continue}
 * and {@link Stop} are successful results that the parent sequence interprets.
 * Composite results ({@link ConditionBranch}, {@link LoopDescriptor}, {@link TryCatch}) carry
 * any signal that escaped their children so it can keep travelling upward.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public sealed interface StepResult
        permits StepResult.Normal, StepResult.ConditionBranch, StepResult.LoopDescriptor,
                StepResult.TryCatch, StepResult.Signal {

    String stepId();

    boolean success();

    Instant timestamp();

    /**
     * Free-form payload for presentation layers.
     */
    Map<String, Object> data();

    /**
     * The control signal this result passes to its parent sequence, if any.
     */
    Optional<Signal> signal();

    default Optional<String> error() {
        Object error = data().get("error");
        return error != null ? Optional.of(error.toString()) : Optional.empty();
    }

    static Normal success(String stepId, Map<String, Object> data) {
        return new Normal(stepId, true, Instant.now(), data);
    }

    static Normal failure(String stepId, String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        return new Normal(stepId, false, Instant.now(), data);
    }

    /**
     * Control signals: break, continue and stop.
     */
    sealed interface Signal extends StepResult permits Break, Continue, Stop {

        @Override
        default boolean success() {
            return true;
        }

        @Override
        default Optional<Signal> signal() {
            return Optional.of(this);
        }
    }

    /**
     * Result of a leaf action or a step with no control-flow meaning.
     */
    record Normal(String stepId, boolean success, Instant timestamp, Map<String, Object> data)
            implements StepResult {

        public Normal {
            Objects.requireNonNull(timestamp, "Timestamp cannot be null");
            data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        }

        @Override
        public Optional<Signal> signal() {
            return Optional.empty();
        }
    }

    record Break(String stepId, Instant timestamp) implements Signal {

        public Break(String stepId) {
            this(stepId, Instant.now());
        }

        @Override
        public Map<String, Object> data() {
            return Map.of("break", true);
        }
    }

    record Continue(String stepId, Instant timestamp) implements Signal {

        public Continue(String stepId) {
            this(stepId, Instant.now());
        }

        @Override
        public Map<String, Object> data() {
            return Map.of("continue", true);
        }
    }

    /**
     * Ends the whole run; a failed stop fails the run with {@code message}.
     */
    record Stop(String stepId, Instant timestamp, boolean failed, String message) implements Signal {

        public Stop(String stepId, boolean failed, String message) {
            this(stepId, Instant.now(), failed, message);
        }

        public String status() {
            return failed ? "failed" : "success";
        }

        @Override
        public Map<String, Object> data() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("stop", true);
            data.put("status", status());
            data.put("message", message);
            return data;
        }
    }

    /**
     * A condition step: which branch ran, plus any signal escaping that branch.
     */
    record ConditionBranch(String stepId, Instant timestamp, boolean conditionResult, String branch,
                           Signal escaped) implements StepResult {

        public ConditionBranch(String stepId, boolean conditionResult, String branch, Signal escaped) {
            this(stepId, Instant.now(), conditionResult, branch, escaped);
        }

        @Override
        public boolean success() {
            return true;
        }

        @Override
        public Map<String, Object> data() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("conditionResult", conditionResult);
            data.put("branch", branch);
            return data;
        }

        @Override
        public Optional<Signal> signal() {
            return Optional.ofNullable(escaped);
        }
    }

    /**
     * A finished loop. Break and continue are consumed by the loop; only a stop escapes.
     */
    record LoopDescriptor(String stepId, Instant timestamp, String loopType, int iterations,
                          boolean broken, Stop escaped) implements StepResult {

        public LoopDescriptor(String stepId, String loopType, int iterations, boolean broken, Stop escaped) {
            this(stepId, Instant.now(), loopType, iterations, broken, escaped);
        }

        @Override
        public boolean success() {
            return true;
        }

        @Override
        public Map<String, Object> data() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("loopType", loopType);
            data.put("iterations", iterations);
            data.put("broken", broken);
            return data;
        }

        @Override
        public Optional<Signal> signal() {
            return Optional.ofNullable(escaped);
        }
    }

    /**
     * A try/catch/finally block that completed, with or without catching an error.
     */
    record TryCatch(String stepId, Instant timestamp, boolean caught, String caughtError,
                    Signal escaped) implements StepResult {

        public TryCatch(String stepId, boolean caught, String caughtError, Signal escaped) {
            this(stepId, Instant.now(), caught, caughtError, escaped);
        }

        @Override
        public boolean success() {
            return true;
        }

        @Override
        public Map<String, Object> data() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("caught", caught);
            if (caughtError != null) {
                data.put("caughtError", caughtError);
            }
            return data;
        }

        @Override
        public Optional<Signal> signal() {
            return Optional.ofNullable(escaped);
        }
    }
}
