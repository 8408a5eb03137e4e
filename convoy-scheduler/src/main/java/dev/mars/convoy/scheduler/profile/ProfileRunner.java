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

package dev.mars.convoy.scheduler.profile;

import dev.mars.convoy.core.Execution;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.core.exceptions.ExecutionTimeoutException;
import dev.mars.convoy.core.exceptions.WorkflowExecutionException;
import dev.mars.convoy.workflow.RunOptions;
import dev.mars.convoy.workflow.StepProgressListener;
import dev.mars.convoy.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one workflow for one profile inside that profile's session, bounded by a timeout.
 * Shared by the parallel executor and the sequential batch runner.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public class ProfileRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProfileRunner.class);

    private final WorkflowEngine engine;
    private final ProfileSessionProvider sessionProvider;

    public ProfileRunner(WorkflowEngine engine, ProfileSessionProvider sessionProvider) {
        this.engine = Objects.requireNonNull(engine, "Workflow engine cannot be null");
        this.sessionProvider = Objects.requireNonNull(sessionProvider, "Session provider cannot be null");
    }

    public ProfileSession openSession(Profile profile) throws Exception {
        ProfileSession session = sessionProvider.open(profile);
        if (session == null) {
            throw new IllegalStateException("Session provider returned no session for profile " + profile.id());
        }
        return session;
    }

    /**
     * Execute the workflow and wait for it. On timeout the run is cancelled and
     * {@link ExecutionTimeoutException} is thrown; a non-positive timeout waits indefinitely.
     *
     * @return the finished execution, whatever its status
     */
    public Execution run(Workflow workflow, Profile profile, ProfileSession session, String executionId,
                         long timeoutMs, StepProgressListener progressListener)
            throws ExecutionTimeoutException, WorkflowExecutionException, InterruptedException {
        RunOptions options = RunOptions.builder()
                .executionId(executionId)
                .profile(profile.toVariables())
                .session(session != null ? session.session() : null)
                .page(session != null ? session.page() : null)
                .progressListener(progressListener)
                .build();

        CompletableFuture<Execution> future = engine.executeAsync(workflow, options);
        try {
            return timeoutMs > 0 ? future.get(timeoutMs, TimeUnit.MILLISECONDS) : future.get();
        } catch (TimeoutException e) {
            engine.cancel(executionId);
            logger.warn("Run {} for profile {} timed out after {}ms", executionId, profile.id(), timeoutMs);
            throw new ExecutionTimeoutException(timeoutMs);
        } catch (InterruptedException e) {
            engine.cancel(executionId);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new WorkflowExecutionException(null, null, "Workflow run failed: " + cause.getMessage(), cause);
        }
    }

    public boolean cancel(String executionId) {
        return engine.cancel(executionId);
    }

    /**
     * Close a session, logging rather than propagating a failure to close.
     */
    public void release(ProfileSession session, String profileId) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (Exception e) {
            logger.warn("Failed to close session for profile {}: {}", profileId, e.getMessage());
            logger.debug("Session close failure", e);
        }
    }

    public WorkflowEngine getEngine() {
        return engine;
    }
}
