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

import java.util.List;

/**
 * Display view of a retry budget at a given retry count.
 *
 * @param currentRetry retries already made
 * @param maxRetries configured budget
 * @param strategy backoff shape
 * @param nextDelayMs delay before the next retry, or {@code null} when none remains
 * @param allDelaysMs delay for each retry in the budget
 * @param willRetry whether budget remains
 */
public record RetryInfo(int currentRetry,
                        int maxRetries,
                        RetryStrategy strategy,
                        Long nextDelayMs,
                        List<Long> allDelaysMs,
                        boolean willRetry) {

    public RetryInfo {
        allDelaysMs = List.copyOf(allDelaysMs);
    }
}
