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
 * Ordering discipline deciding which pending item is dispatched next.
 */
public enum QueueMode {

    /** Append, take from the front. */
    FIFO,

    /** Prepend, take from the front. */
    LIFO,

    /** Take a uniformly random item. */
    RANDOM,

    /** Insertion-sorted by priority rank, arrival order within a rank. */
    PRIORITY;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static QueueMode fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return FIFO;
        }
        try {
            return QueueMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown queue mode: " + value, e);
        }
    }
}
