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

import dev.mars.convoy.core.Workflow;

import java.util.List;

/**
 * Input for creating or updating a schedule. On update only the non-null fields are applied.
 */
public final class ScheduleRequest {

    private final String name;
    private final String description;
    private final String workflowId;
    private final String workflowName;
    private final Workflow workflow;
    private final List<String> profileIds;
    private final String cron;
    private final Boolean enabled;
    private final Boolean runOnStart;
    private final Integer maxRetries;
    private final Long timeoutMs;
    private final ParallelSettings parallel;

    private ScheduleRequest(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.workflow = builder.workflow;
        this.workflowId = builder.workflowId != null || workflow == null ? builder.workflowId : workflow.getId();
        this.workflowName = builder.workflowName != null || workflow == null ? builder.workflowName : workflow.getName();
        this.profileIds = builder.profileIds != null ? List.copyOf(builder.profileIds) : null;
        this.cron = builder.cron;
        this.enabled = builder.enabled;
        this.runOnStart = builder.runOnStart;
        this.maxRetries = builder.maxRetries;
        this.timeoutMs = builder.timeoutMs;
        this.parallel = builder.parallel;
    }

    public static Builder builder() {
        return new Builder();
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

    public Boolean getEnabled() {
        return enabled;
    }

    public Boolean getRunOnStart() {
        return runOnStart;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public ParallelSettings getParallel() {
        return parallel;
    }

    public static class Builder {
        private String name;
        private String description;
        private String workflowId;
        private String workflowName;
        private Workflow workflow;
        private List<String> profileIds;
        private String cron;
        private Boolean enabled;
        private Boolean runOnStart;
        private Integer maxRetries;
        private Long timeoutMs;
        private ParallelSettings parallel;

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

        /**
         * Snapshot stored with the schedule. Also supplies the workflow id and name when those are unset.
         */
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

        public ScheduleRequest build() {
            return new ScheduleRequest(this);
        }
    }
}
