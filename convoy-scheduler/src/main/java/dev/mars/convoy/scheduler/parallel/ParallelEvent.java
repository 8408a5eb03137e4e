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

package dev.mars.convoy.scheduler.parallel;

import dev.mars.convoy.core.Execution;
import dev.mars.convoy.scheduler.profile.Profile;
import dev.mars.convoy.workflow.StepProgress;

/**
 * Lifecycle and progress notifications published by {@link ParallelExecutor}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public sealed interface ParallelEvent {

    record Started(String workflowId, String workflowName, int totalProfiles, int maxConcurrent)
            implements ParallelEvent {
    }

    record SlotStarted(String slotId, Profile profile) implements ParallelEvent {
    }

    record Progress(String slotId, Profile profile, StepProgress progress) implements ParallelEvent {
    }

    record SlotSucceeded(String slotId, Profile profile, Execution execution) implements ParallelEvent {
    }

    record SlotRetrying(String slotId, Profile profile, String error, FailedRun.FailedStep failedStep,
                        int retryCount, long delayMs) implements ParallelEvent {
    }

    record SlotFailed(String slotId, Profile profile, String error, FailedRun.FailedStep failedStep)
            implements ParallelEvent {
    }

    record SlotEnded(String slotId, Profile profile) implements ParallelEvent {
    }

    record SlotSkipped(String slotId) implements ParallelEvent {
    }

    record QueueUpdated(int queueSize) implements ParallelEvent {
    }

    record Paused() implements ParallelEvent {
    }

    record Resumed() implements ParallelEvent {
    }

    record Stopped() implements ParallelEvent {
    }

    record Completed(ParallelStatus status) implements ParallelEvent {
    }
}
