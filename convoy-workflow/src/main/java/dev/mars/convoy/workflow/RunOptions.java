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

package dev.mars.convoy.workflow;

import dev.mars.convoy.workflow.action.BrowserPage;

import java.util.Map;

/**
 * Per-run inputs: parameters merged over the workflow's variables, the profile and session
 * data visible to templates, the page handle, and error and progress behaviour.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class RunOptions {

    private final String executionId;
    private final Map<String, Object> parameters;
    private final Map<String, Object> profile;
    private final Map<String, Object> session;
    private final BrowserPage page;
    private final boolean continueOnError;
    private final StepProgressListener progressListener;
    private final int depth;
    private final ExecutionContext parent;

    private RunOptions(Builder builder) {
        this.executionId = builder.executionId;
        this.parameters = builder.parameters != null ? Map.copyOf(builder.parameters) : Map.of();
        this.profile = builder.profile != null ? builder.profile : Map.of();
        this.session = builder.session != null ? builder.session : Map.of();
        this.page = builder.page;
        this.continueOnError = builder.continueOnError;
        this.progressListener = builder.progressListener;
        this.depth = builder.depth;
        this.parent = builder.parent;
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public String getExecutionId() {
        return executionId;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Map<String, Object> getProfile() {
        return profile;
    }

    public Map<String, Object> getSession() {
        return session;
    }

    public BrowserPage getPage() {
        return page;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public StepProgressListener getProgressListener() {
        return progressListener;
    }

    public int getDepth() {
        return depth;
    }

    ExecutionContext getParent() {
        return parent;
    }

    public static class Builder {
        private String executionId;
        private Map<String, Object> parameters;
        private Map<String, Object> profile;
        private Map<String, Object> session;
        private BrowserPage page;
        private boolean continueOnError;
        private StepProgressListener progressListener;
        private int depth;
        private ExecutionContext parent;

        public Builder() {
        }

        private Builder(RunOptions existing) {
            this.executionId = existing.executionId;
            this.parameters = existing.parameters;
            this.profile = existing.profile;
            this.session = existing.session;
            this.page = existing.page;
            this.continueOnError = existing.continueOnError;
            this.progressListener = existing.progressListener;
            this.depth = existing.depth;
            this.parent = existing.parent;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder profile(Map<String, Object> profile) {
            this.profile = profile;
            return this;
        }

        public Builder session(Map<String, Object> session) {
            this.session = session;
            return this;
        }

        public Builder page(BrowserPage page) {
            this.page = page;
            return this;
        }

        /**
         * Whether a failed top-level step lets the run continue. Defaults to {@code false}.
         */
        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder progressListener(StepProgressListener progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        public Builder depth(int depth) {
            this.depth = depth;
            return this;
        }

        Builder parent(ExecutionContext parent) {
            this.parent = parent;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
