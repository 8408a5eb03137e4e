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

import java.util.List;

/**
 * Aggregate view of a parallel run, derived on request.
 *
 * @param totalProfiles completed + failed + queued + active + awaiting a retry delay
 * @param progress finished profiles as a percentage of the total
 * @param etaMs average time per finished profile times the profiles still to go, 0 before the first finishes
 */
public record ParallelStatus(boolean running,
                             boolean paused,
                             int totalProfiles,
                             int completedCount,
                             int failedCount,
                             int queuedCount,
                             int activeCount,
                             int retryingCount,
                             int progress,
                             long elapsedMs,
                             long etaMs,
                             List<SlotSnapshot> slots,
                             List<CompletedRun> completed,
                             List<FailedRun> failed,
                             List<QueuedProfile> queue) {

    public ParallelStatus {
        slots = List.copyOf(slots);
        completed = List.copyOf(completed);
        failed = List.copyOf(failed);
        queue = List.copyOf(queue);
    }

    public int finishedCount() {
        return completedCount + failedCount;
    }
}
