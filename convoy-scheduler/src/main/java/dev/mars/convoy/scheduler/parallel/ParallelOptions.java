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

import dev.mars.convoy.config.ConvoyConfiguration;
import dev.mars.convoy.queue.QueueMode;
import dev.mars.convoy.retry.RetryPolicy;

import java.util.Objects;

/**
 * Settings for one parallel run. Unset builder values come from {@link ConvoyConfiguration}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public final class ParallelOptions {

    private final int maxConcurrent;
    private final long delayBetweenMs;
    private final long timeoutMs;
    private final boolean stopOnError;
    private final QueueMode queueMode;
    private final RetryPolicy retryPolicy;
    private final long pausePollMs;

    private ParallelOptions(Builder builder) {
        if (builder.maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        this.maxConcurrent = builder.maxConcurrent;
        this.delayBetweenMs = Math.max(0, builder.delayBetweenMs);
        this.timeoutMs = builder.timeoutMs;
        this.stopOnError = builder.stopOnError;
        this.queueMode = Objects.requireNonNull(builder.queueMode, "Queue mode cannot be null");
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "Retry policy cannot be null");
        this.pausePollMs = Math.max(10, builder.pausePollMs);
    }

    public static ParallelOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder(new ConvoyConfiguration());
    }

    public static Builder builder(ConvoyConfiguration configuration) {
        return new Builder(configuration);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public long getDelayBetweenMs() {
        return delayBetweenMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public boolean isStopOnError() {
        return stopOnError;
    }

    public QueueMode getQueueMode() {
        return queueMode;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public long getPausePollMs() {
        return pausePollMs;
    }

    @Override
    public String toString() {
        return "ParallelOptions{" +
                "maxConcurrent=" + maxConcurrent +
                ", delayBetweenMs=" + delayBetweenMs +
                ", timeoutMs=" + timeoutMs +
                ", stopOnError=" + stopOnError +
                ", queueMode=" + queueMode +
                ", retryPolicy=" + retryPolicy +
                '}';
    }

    public static class Builder {
        private int maxConcurrent;
        private long delayBetweenMs;
        private long timeoutMs;
        private boolean stopOnError;
        private QueueMode queueMode;
        private RetryPolicy retryPolicy;
        private long pausePollMs;

        private Builder(ConvoyConfiguration configuration) {
            this.maxConcurrent = configuration.getMaxConcurrent();
            this.delayBetweenMs = configuration.getDelayBetweenMs();
            this.timeoutMs = configuration.getExecutionTimeoutMs();
            this.stopOnError = configuration.isStopOnError();
            this.queueMode = configuration.getQueueMode();
            this.retryPolicy = configuration.getRetryPolicy();
            this.pausePollMs = configuration.getPausePollMs();
        }

        private Builder(ParallelOptions existing) {
            this.maxConcurrent = existing.maxConcurrent;
            this.delayBetweenMs = existing.delayBetweenMs;
            this.timeoutMs = existing.timeoutMs;
            this.stopOnError = existing.stopOnError;
            this.queueMode = existing.queueMode;
            this.retryPolicy = existing.retryPolicy;
            this.pausePollMs = existing.pausePollMs;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder delayBetweenMs(long delayBetweenMs) {
            this.delayBetweenMs = delayBetweenMs;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder stopOnError(boolean stopOnError) {
            this.stopOnError = stopOnError;
            return this;
        }

        public Builder queueMode(QueueMode queueMode) {
            this.queueMode = queueMode;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder pausePollMs(long pausePollMs) {
            this.pausePollMs = pausePollMs;
            return this;
        }

        public ParallelOptions build() {
            return new ParallelOptions(this);
        }
    }
}
