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

import dev.mars.convoy.core.Ids;
import dev.mars.convoy.queue.QueueItem;
import dev.mars.convoy.scheduler.profile.Profile;
import dev.mars.convoy.scheduler.profile.ProfileSession;
import dev.mars.convoy.workflow.StepProgress;

import java.time.Instant;

/**
 * One profile's run inside the parallel executor. Progress fields are written by the
 * engine's progress callback and read by status snapshots, so they are volatile.
 */
final class Slot {

    private final String slotId;
    private final QueueItem<Profile> item;
    private final String executionId;
    private final Instant startTime;

    private volatile SlotStatus status = SlotStatus.STARTING;
    private volatile ProfileSession session;
    private volatile int progress;
    private volatile int currentStep;
    private volatile int totalSteps;
    private volatile StepProgress lastProgress;
    private volatile boolean skipped;
    private boolean released;

    Slot(QueueItem<Profile> item, int totalSteps) {
        this.slotId = Ids.next("slot");
        this.item = item;
        this.executionId = Ids.next("exec");
        this.startTime = Instant.now();
        this.totalSteps = totalSteps;
    }

    String getSlotId() {
        return slotId;
    }

    QueueItem<Profile> getItem() {
        return item;
    }

    Profile getProfile() {
        return item.getPayload();
    }

    String getExecutionId() {
        return executionId;
    }

    long elapsedMs() {
        return System.currentTimeMillis() - startTime.toEpochMilli();
    }

    /**
     * Hand the opened session to the slot.
     *
     * @return false when the slot was already released, in which case the caller still owns the session
     */
    synchronized boolean attach(ProfileSession session) {
        if (released) {
            return false;
        }
        this.session = session;
        this.status = SlotStatus.RUNNING;
        return true;
    }

    /**
     * Take the session back for closing. Returns it at most once.
     */
    synchronized ProfileSession release() {
        released = true;
        ProfileSession current = session;
        session = null;
        return current;
    }

    void update(StepProgress stepProgress) {
        this.lastProgress = stepProgress;
        this.progress = stepProgress.percentage();
        this.currentStep = stepProgress.currentStep();
        this.totalSteps = stepProgress.totalSteps();
    }

    /**
     * The top-level step the slot was on, or null before the first progress report.
     */
    StepProgress getLastProgress() {
        return lastProgress;
    }

    int getCurrentStep() {
        return currentStep;
    }

    int getTotalSteps() {
        return totalSteps;
    }

    boolean isSkipped() {
        return skipped;
    }

    void markSkipped() {
        this.skipped = true;
    }

    SlotSnapshot snapshot() {
        StepProgress current = lastProgress;
        return new SlotSnapshot(slotId, getProfile().id(), getProfile().name(), progress, currentStep, totalSteps,
                current != null ? current.action() : null, status, startTime);
    }
}
