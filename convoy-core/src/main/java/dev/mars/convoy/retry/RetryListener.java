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

/**
 * Callbacks from {@link RetryManager#execute(java.util.concurrent.Callable, RetryListener)}.
 */
public interface RetryListener {

    /**
     * Called for every failed attempt, before the retry decision.
     *
     * @param error the failure
     * @param retryCount retries already made (0 for the first attempt)
     */
    default void onError(Exception error, int retryCount) {
    }

    /**
     * Called when a retry has been scheduled.
     *
     * @param error the failure being retried
     * @param retryCount the number of the retry about to run (1-based)
     * @param maxRetries the configured budget
     * @param delayMs the wait before the retry
     */
    default void onRetry(Exception error, int retryCount, int maxRetries, long delayMs) {
    }
}
