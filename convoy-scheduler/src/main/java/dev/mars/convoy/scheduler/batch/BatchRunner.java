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

package dev.mars.convoy.scheduler.batch;

import dev.mars.convoy.core.Execution;
import dev.mars.convoy.core.ExecutionStatus;
import dev.mars.convoy.core.Ids;
import dev.mars.convoy.core.Workflow;
import dev.mars.convoy.retry.RetryManager;
import dev.mars.convoy.retry.RetryPolicy;
import dev.mars.convoy.scheduler.profile.Profile;
import dev.mars.convoy.scheduler.profile.ProfileRunner;
import dev.mars.convoy.scheduler.profile.ProfileSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Runs a workflow over profiles one after another, pausing a random delay between runs.
 * A failed profile is retried per the retry policy; once retries are exhausted its failure
 * is recorded and the batch moves on to the next profile.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-11
 * @version 1.0
 */
public class BatchRunner {

    private static final Logger logger = LoggerFactory.getLogger(BatchRunner.class);

    private final ProfileRunner runner;
    private final long delayMinMs;
    private final long delayMaxMs;
    private final long timeoutMs;
    private final RetryManager retryManager;

    public BatchRunner(ProfileRunner runner, long delayMinMs, long delayMaxMs, long timeoutMs) {
        this(runner, delayMinMs, delayMaxMs, timeoutMs, RetryPolicy.none());
    }

    public BatchRunner(ProfileRunner runner, long delayMinMs, long delayMaxMs, long timeoutMs,
                       RetryPolicy retryPolicy) {
        this.runner = Objects.requireNonNull(runner, "Profile runner cannot be null");
        if (delayMinMs < 0 || delayMaxMs < delayMinMs) {
            throw new IllegalArgumentException("Delay range must satisfy 0 <= delayMin <= delayMax");
        }
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
        this.timeoutMs = timeoutMs;
        this.retryManager = new RetryManager(Objects.requireNonNull(retryPolicy, "Retry policy cannot be null"));
    }

    public BatchResult run(Workflow workflow, List<Profile> profiles) throws InterruptedException {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        logger.info("Starting batch run of workflow {} over {} profiles", workflow.getId(), profiles.size());

        List<ProfileRunResult> results = new ArrayList<>();
        for (int i = 0; i < profiles.size(); i++) {
            if (i > 0) {
                pause();
            }
            results.add(runOne(workflow, profiles.get(i)));
        }

        BatchResult result = BatchResult.of(results);
        logger.info("Batch run of workflow {} finished: {} succeeded, {} failed",
                workflow.getId(), result.successCount(), result.failureCount());
        return result;
    }

    private ProfileRunResult runOne(Workflow workflow, Profile profile) throws InterruptedException {
        int attempt = 0;
        while (true) {
            ProfileRunResult result = attempt(workflow, profile);
            if (result.success() || !retryManager.shouldRetry(result.error(), attempt)) {
                return result;
            }
            long delay = retryManager.getDelay(attempt);
            attempt++;
            logger.warn("Run on profile {} failed, retry {} in {}ms: {}", profile.id(), attempt, delay, result.error());
            TimeUnit.MILLISECONDS.sleep(delay);
        }
    }

    private ProfileRunResult attempt(Workflow workflow, Profile profile) throws InterruptedException {
        String executionId = Ids.next("exec");
        long start = System.currentTimeMillis();
        ProfileSession session = null;
        try {
            session = runner.openSession(profile);
            Execution execution = runner.run(workflow, profile, session, executionId, timeoutMs, null);
            long duration = System.currentTimeMillis() - start;
            if (execution.getStatus() == ExecutionStatus.COMPLETED) {
                logger.info("Workflow {} completed on profile {}", workflow.getId(), profile.getDisplayName());
                return ProfileRunResult.success(profile.id(), executionId, duration);
            }
            String error = execution.getError().orElse("Workflow " + execution.getStatus().getValue());
            logger.warn("Workflow {} failed on profile {}: {}", workflow.getId(), profile.getDisplayName(), error);
            return ProfileRunResult.failure(profile.id(), error, executionId, duration);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            logger.warn("Run on profile {} failed: {}", profile.id(), e.getMessage());
            logger.debug("Batch run failure", e);
            return ProfileRunResult.failure(profile.id(), e.getMessage(), executionId,
                    System.currentTimeMillis() - start);
        } finally {
            runner.release(session, profile.id());
        }
    }

    private void pause() throws InterruptedException {
        long delay = delayMaxMs > delayMinMs
                ? ThreadLocalRandom.current().nextLong(delayMinMs, delayMaxMs + 1)
                : delayMinMs;
        if (delay > 0) {
            TimeUnit.MILLISECONDS.sleep(delay);
        }
    }
}
