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

package dev.mars.convoy.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import dev.mars.convoy.core.Workflow;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A persisted binding of a workflow to a set of profiles, fired on a cron cadence.
 * Carries a snapshot of the workflow so the schedule can run after a restart, and the
 * counters and last-run fields the scheduler maintains. Instances are immutable; the
 * scheduler replaces them through {@link #toBuilder()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-11
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = Schedule.Builder.class)
public final class Schedule {

    public static final long DEFAULT_TIMEOUT_MS = 300_000;

    private final String id;
    private final String name;
    private final String description;
    private final String workflowId;
    private final String workflowName;
    private final Workflow workflow;
    private final List<String> profileIds;
    private final String cron;
    private final String cronDescription;
    private final boolean enabled;
    private final boolean runOnStart;
    private final int maxRetries;
    private final long timeoutMs;
    private final ParallelSettings parallel;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant lastRun;
    private final ScheduleRunStatus lastStatus;
    private final String lastError;
    private final Instant nextRun;
    private final long runCount;
    private final long successCount;
    private final long failureCount;

    private Schedule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Schedule ID cannot be null");
        this.name = builder.name;
        this.description = builder.description != null ? builder.description : "";
        this.workflowId = builder.workflowId;
        this.workflowName = builder.workflowName != null ? builder.workflowName : "";
        this.workflow = builder.workflow;
        this.profileIds = builder.profileIds != null ? List.copyOf(builder.profileIds) : List.of();
        this.cron = builder.cron;
        this.cronDescription = builder.cronDescription;
        this.enabled = builder.enabled;
        this.runOnStart = builder.runOnStart;
        this.maxRetries = Math.max(0, builder.maxRetries);
        this.timeoutMs = builder.timeoutMs > 0 ? builder.timeoutMs : DEFAULT_TIMEOUT_MS;
        this.parallel = builder.parallel != null ? builder.parallel : ParallelSettings.sequential();
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.lastRun = builder.lastRun;
        this.lastStatus = builder.lastStatus;
        this.lastError = builder.lastError;
        this.nextRun = builder.nextRun;
        this.runCount = builder.runCount;
        this.successCount = builder.successCount;
        this.failureCount = builder.failureCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
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

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public List<String> getProfileIds() {
        return profileIds;
    }

    public String getCron() {
        return cron;
    }

    public String getCronDescription() {
        return cronDescription;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isRunOnStart() {
        return runOnStart;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public ParallelSettings getParallel() {
        return parallel;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public ScheduleRunStatus getLastStatus() {
        return lastStatus;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getNextRun() {
        return nextRun;
    }

    public long getRunCount() {
        return runCount;
    }

    public long getSuccessCount() {
        return successCount;
    }

    public long getFailureCount() {
        return failureCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schedule schedule = (Schedule) o;
        return Objects.equals(id, schedule.id) && Objects.equals(updatedAt, schedule.updatedAt)
                && runCount == schedule.runCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, updatedAt, runCount);
    }

    @Override
    public String toString() {
        return "Schedule{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", workflowId='" + workflowId + '\'' +
                ", cron='" + cron + '\'' +
                ", enabled=" + enabled +
                ", nextRun=" + nextRun +
                ", runCount=" + runCount +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private String workflowId;
        private String workflowName;
        private Workflow workflow;
        private List<String> profileIds;
        private String cron;
        private String cronDescription;
        private boolean enabled = true;
        private boolean runOnStart;
        private int maxRetries;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private ParallelSettings parallel;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant lastRun;
        private ScheduleRunStatus lastStatus;
        private String lastError;
        private Instant nextRun;
        private long runCount;
        private long successCount;
        private long failureCount;

        public Builder() {
        }

        private Builder(Schedule existing) {
            this.id = existing.id;
            this.name = existing.name;
            this.description = existing.description;
            this.workflowId = existing.workflowId;
            this.workflowName = existing.workflowName;
            this.workflow = existing.workflow;
            this.profileIds = existing.profileIds;
            this.cron = existing.cron;
            this.cronDescription = existing.cronDescription;
            this.enabled = existing.enabled;
            this.runOnStart = existing.runOnStart;
            this.maxRetries = existing.maxRetries;
            this.timeoutMs = existing.timeoutMs;
            this.parallel = existing.parallel;
            this.createdAt = existing.createdAt;
            this.updatedAt = existing.updatedAt;
            this.lastRun = existing.lastRun;
            this.lastStatus = existing.lastStatus;
            this.lastError = existing.lastError;
            this.nextRun = existing.nextRun;
            this.runCount = existing.runCount;
            this.successCount = existing.successCount;
            this.failureCount = existing.failureCount;
        }

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

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder workflow(Workflow workflow) {
            this.workflow = workflow;
            return this;
        }

        public Builder profileIds(List<String> profileIds) {
            this.profileIds = profileIds;
            return this;
        }

        public Builder cron(String cron) {
            this.cron = cron;
            return this;
        }

        public Builder cronDescription(String cronDescription) {
            this.cronDescription = cronDescription;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder runOnStart(boolean runOnStart) {
            this.runOnStart = runOnStart;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder parallel(ParallelSettings parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder lastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Builder lastStatus(ScheduleRunStatus lastStatus) {
            this.lastStatus = lastStatus;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder nextRun(Instant nextRun) {
            this.nextRun = nextRun;
            return this;
        }

        public Builder runCount(long runCount) {
            this.runCount = runCount;
            return this;
        }

        public Builder successCount(long successCount) {
            this.successCount = successCount;
            return this;
        }

        public Builder failureCount(long failureCount) {
            this.failureCount = failureCount;
            return this;
        }

        public Schedule build() {
            return new Schedule(this);
        }
    }
}
