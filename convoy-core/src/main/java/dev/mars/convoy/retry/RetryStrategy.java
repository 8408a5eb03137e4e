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

package dev.mars.convoy.retry;

import java.util.Locale;

/**
 * Backoff shape used to space out retry attempts.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public enum RetryStrategy {

    /**
     * Never retry.
     */
    NONE,

    /**
     * Always wait the base delay.
     */
    FIXED,

    /**
     * Wait {@code baseDelay * (retryCount + 1)}.
     */
    LINEAR,

    /**
     * Wait {@code baseDelay * 2^retryCount}.
     */
    EXPONENTIAL;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a strategy name, case-insensitive. Blank values map to {@link #EXPONENTIAL}.
     *
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static RetryStrategy fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return EXPONENTIAL;
        }
        try {
            return RetryStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown retry strategy: " + value, e);
        }
    }
}
