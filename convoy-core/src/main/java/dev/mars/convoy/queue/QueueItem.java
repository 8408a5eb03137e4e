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

package dev.mars.convoy.queue;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of work waiting in an {@link ExecutionQueue}.
 * Items are immutable; retries and priority changes produce new instances.
 *
 * @param <T> the payload type, typically a profile
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public final class QueueItem<T> {

    private final String id;
    private final T payload;
    private final QueuePriority priority;
    private final Instant addedAt;
    private final int retryCount;

    private QueueItem(Builder<T> builder) {
        this.id = Objects.requireNonNull(builder.id, "Item ID cannot be null");
        this.payload = Objects.requireNonNull(builder.payload, "Payload cannot be null");
        this.priority = Objects.requireNonNull(builder.priority, "Priority cannot be null");
        this.addedAt = Objects.requireNonNull(builder.addedAt, "Added time cannot be null");
        this.retryCount = Math.max(0, builder.retryCount);
    }

    public String getId() {
        return id;
    }

    public T getPayload() {
        return payload;
    }

    public QueuePriority getPriority() {
        return priority;
    }

    public Instant getAddedAt() {
        return addedAt;
    }

    public int getRetryCount() {
        return retryCount;
    }

    /**
     * How long this item has been waiting since it was last added.
     */
    public long getAgeMs() {
        return Instant.now().toEpochMilli() - addedAt.toEpochMilli();
    }

    /**
     * Create a new item with incremented retry count.
     */
    public QueueItem<T> withRetry() {
        return new Builder<>(this).retryCount(retryCount + 1).build();
    }

    /**
     * Create a new item with updated priority.
     */
    public QueueItem<T> withPriority(QueuePriority newPriority) {
        return new Builder<>(this).priority(newPriority).build();
    }

    QueueItem<T> withAddedAt(Instant newAddedAt) {
        return new Builder<>(this).addedAt(newAddedAt).build();
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public static <T> QueueItem<T> of(String id, T payload) {
        return QueueItem.<T>builder().id(id).payload(payload).build();
    }

    public static <T> QueueItem<T> of(String id, T payload, QueuePriority priority) {
        return QueueItem.<T>builder().id(id).payload(payload).priority(priority).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueItem<?> queueItem = (QueueItem<?>) o;
        return Objects.equals(id, queueItem.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "QueueItem{" +
                "id='" + id + '\'' +
                ", priority=" + priority +
                ", addedAt=" + addedAt +
                ", retryCount=" + retryCount +
                '}';
    }

    /**
     * Builder for QueueItem.
     */
    public static class Builder<T> {
        private String id;
        private T payload;
        private QueuePriority priority;
        private Instant addedAt;
        private int retryCount;

        public Builder() {
            this.priority = QueuePriority.NORMAL;
            this.addedAt = Instant.now();
            this.retryCount = 0;
        }

        public Builder(QueueItem<T> existing) {
            this.id = existing.id;
            this.payload = existing.payload;
            this.priority = existing.priority;
            this.addedAt = existing.addedAt;
            this.retryCount = existing.retryCount;
        }

        public Builder<T> id(String id) {
            this.id = id;
            return this;
        }

        public Builder<T> payload(T payload) {
            this.payload = payload;
            return this;
        }

        public Builder<T> priority(QueuePriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder<T> addedAt(Instant addedAt) {
            this.addedAt = addedAt;
            return this;
        }

        public Builder<T> retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public QueueItem<T> build() {
            return new QueueItem<>(this);
        }
    }
}
