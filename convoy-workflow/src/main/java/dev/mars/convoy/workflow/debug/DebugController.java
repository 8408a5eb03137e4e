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

import dev.mars.convoy.core.Execution;
import dev.mars.convoy.core.Ids;
import dev.mars.convoy.core.Step;
import dev.mars.convoy.core.StepResult;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.core.exceptions.WorkflowExecutionException;
import dev.mars.convoy.workflow.ExecutionContext;
import dev.mars.convoy.workflow.RunOptions;
import dev.mars.convoy.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Steps through a workflow's top-level steps one at a time.
 * <p>
 * Every call returns a {@link DebugOutcome}; unknown or finished sessions yield an
 * unsuccessful outcome rather than an exception. Exactly one step executes between two
 * paused observations of a session.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
public class DebugController {

    private static final Logger logger = LoggerFactory.getLogger(DebugController.class);

    static final String SESSION_NOT_FOUND = "Debug session not found";
    static final String SESSION_FINISHED = "Debug session already finished";

    private final WorkflowEngine engine;
    private final DebugSessionRegistry sessions;

    public DebugController(WorkflowEngine engine) {
        this(engine, new DebugSessionRegistry());
    }

    public DebugController(WorkflowEngine engine, DebugSessionRegistry sessions) {
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.sessions = Objects.requireNonNull(sessions, "Session registry cannot be null");
    }

    /**
     * Creates a paused session positioned before the first step.
     */
    public DebugOutcome startDebug(Workflow workflow, RunOptions options, Collection<String> breakpoints) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        String debugId = Ids.next("debug");
        RunOptions runOptions = (options != null ? options : RunOptions.defaults()).toBuilder()
                .executionId(debugId)
                .build();
        ExecutionContext context = engine.createContext(workflow, runOptions);
        DebugSession session = sessions.create(new DebugSession(debugId, context, breakpoints));

        Execution execution = context.getExecution();
        execution.start();
        if (workflow.getSteps().isEmpty()) {
            execution.complete();
        } else {
            execution.pause();
        }
        logger.info("Started debug session {} for workflow {}", debugId, workflow.getId());
        return DebugOutcome.ok(session.snapshot());
    }

    /**
     * Executes exactly the current step and advances by one.
     */
    public DebugOutcome step(String debugId) {
        Optional<DebugSession> found = sessions.get(debugId);
        if (found.isEmpty()) {
            return DebugOutcome.failure(SESSION_NOT_FOUND);
        }
        DebugSession session = found.get();
        synchronized (session) {
            if (session.isFinished()) {
                return DebugOutcome.failure(SESSION_FINISHED, session.snapshot(), List.of());
            }
            return stepLocked(session);
        }
    }

    private DebugOutcome stepLocked(DebugSession session) {
        ExecutionContext context = session.getContext();
        Execution execution = context.getExecution();
        Step step = session.getCurrentStep();
        if (step == null) {
            execution.complete();
            session.touch();
            return DebugOutcome.ok(session.snapshot());
        }

        execution.resume();
        boolean continueOnError = context.getOptions().isContinueOnError();
        StepResult result;
        try {
            result = engine.executeStep(step, context, continueOnError);
        } catch (WorkflowExecutionException e) {
            logger.debug("Debug session {} failed at step {}", session.getId(), step.getDisplayName(), e);
            execution.fail(e.getMessage());
            session.touch();
            return DebugOutcome.failure(e.getMessage(), session.snapshot(), List.of());
        }
        session.recordResult(result);

        Optional<StepResult.Signal> signal = result.signal();
        if (signal.isPresent() && signal.get() instanceof StepResult.Stop stop) {
            if (stop.failed()) {
                execution.fail(stop.message());
                return DebugOutcome.failure(stop.message(), session.snapshot(), List.of(result));
            }
            execution.complete();
            return DebugOutcome.ok(session.snapshot(), List.of(result));
        }
        if (!result.success() && !continueOnError) {
            String error = "Step \"" + step.getDisplayName() + "\" failed: " + result.error().orElse("unknown error");
            execution.fail(error);
            return DebugOutcome.failure(error, session.snapshot(), List.of(result));
        }

        if (session.getCurrentStepIndex() >= session.getTotalSteps()) {
            execution.complete();
            logger.info("Debug session {} completed", session.getId());
        } else {
            execution.pause();
        }
        return DebugOutcome.ok(session.snapshot(), List.of(result));
    }

    /**
     * Steps until the session finishes or reaches a step with a breakpoint.
     * The breakpoint check is skipped at index 0 and for the step the call resumes from.
     */
    public DebugOutcome continueToBreakpoint(String debugId) {
        Optional<DebugSession> found = sessions.get(debugId);
        if (found.isEmpty()) {
            return DebugOutcome.failure(SESSION_NOT_FOUND);
        }
        DebugSession session = found.get();
        synchronized (session) {
            if (session.isFinished()) {
                return DebugOutcome.failure(SESSION_FINISHED, session.snapshot(), List.of());
            }
            List<StepResult> executed = new ArrayList<>();
            boolean resuming = true;
            while (!session.isFinished()) {
                Step next = session.getCurrentStep();
                if (!resuming && next != null && session.getCurrentStepIndex() > 0 && session.hasBreakpoint(next.getId())) {
                    logger.debug("Debug session {} hit breakpoint at {}", session.getId(), next.getId());
                    break;
                }
                resuming = false;
                DebugOutcome outcome = stepLocked(session);
                executed.addAll(outcome.stepResults());
                if (!outcome.success()) {
                    return DebugOutcome.failure(outcome.error(), session.snapshot(), executed);
                }
            }
            return DebugOutcome.ok(session.snapshot(), executed);
        }
    }

    public DebugOutcome stop(String debugId) {
        Optional<DebugSession> found = sessions.get(debugId);
        if (found.isEmpty()) {
            return DebugOutcome.failure(SESSION_NOT_FOUND);
        }
        DebugSession session = found.get();
        synchronized (session) {
            session.getContext().cancel();
            session.getContext().getExecution().stop("Stopped by user");
            session.touch();
            logger.info("Debug session {} stopped", debugId);
            return DebugOutcome.ok(session.snapshot());
        }
    }

    public DebugOutcome getState(String debugId) {
        return sessions.get(debugId)
                .map(session -> DebugOutcome.ok(session.snapshot()))
                .orElseGet(() -> DebugOutcome.failure(SESSION_NOT_FOUND));
    }

    public DebugOutcome setBreakpoint(String debugId, String stepId, boolean enabled) {
        Optional<DebugSession> found = sessions.get(debugId);
        if (found.isEmpty()) {
            return DebugOutcome.failure(SESSION_NOT_FOUND);
        }
        if (stepId == null || stepId.isBlank()) {
            return DebugOutcome.failure("Step id is required");
        }
        found.get().setBreakpoint(stepId, enabled);
        return DebugOutcome.ok(found.get().snapshot());
    }

    /**
     * Writes into the live variable store; the next step sees the value.
     */
    public DebugOutcome setVariable(String debugId, String name, Object value) {
        Optional<DebugSession> found = sessions.get(debugId);
        if (found.isEmpty()) {
            return DebugOutcome.failure(SESSION_NOT_FOUND);
        }
        if (name == null || name.isBlank()) {
            return DebugOutcome.failure("Variable name is required");
        }
        DebugSession session = found.get();
        synchronized (session) {
            session.getContext().getVariables().set(name, value);
            session.touch();
            return DebugOutcome.ok(session.snapshot());
        }
    }

    /**
     * Removes the session; an unfinished session is stopped first.
     */
    public boolean cleanup(String debugId) {
        Optional<DebugSession> removed = sessions.dispose(debugId);
        removed.ifPresent(session -> {
            synchronized (session) {
                session.getContext().cancel();
                session.getContext().getExecution().stop("Session disposed");
            }
            logger.debug("Disposed debug session {}", debugId);
        });
        return removed.isPresent();
    }

    public List<DebugSnapshot> listSessions() {
        return sessions.list().stream().map(DebugSession::snapshot).collect(Collectors.toList());
    }
}
