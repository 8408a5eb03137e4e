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

import java.util.Locale;

/**
 * Priority of an item waiting in an {@link ExecutionQueue}.
 * Lower rank is dispatched first in priority mode; equal ranks keep arrival order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public enum QueuePriority {

    /**
     * Dispatched before everything else.
     */
    CRITICAL(1),

    HIGH(2),

    /**
     * The default priority.
     */
    NORMAL(3),

    LOW(4),

    /**
     * Dispatched only when nothing else is waiting.
     */
    IDLE(5);

    private final int rank;

    QueuePriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isHigherThan(QueuePriority other) {
        return this.rank < other.rank;
    }

    /**
     * Parse a priority from its name or numeric rank, case-insensitive.
     * Blank values map to {@link #NORMAL}.
     *
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static QueuePriority fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return NORMAL;
        }

        String trimmed = value.trim().toUpperCase(Locale.ROOT);
        for (QueuePriority priority : values()) {
            if (priority.name().equals(trimmed) || String.valueOf(priority.rank).equals(trimmed)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown queue priority: " + value);
    }
}
