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

/**
 * A profile whose run failed for good, after any retries.
 *
 * @param error the message annotated with the failed step, {@code [Step i/n: name] message}
 * @param originalError the message as raised
 */
public record FailedRun(String profileId,
                        String profileName,
                        String error,
                        String originalError,
                        FailedStep failedStep,
                        int retryCount,
                        long durationMs) {

    /**
     * The top-level step a failed run was on.
     *
     * @param index zero-based step index
     */
    public record FailedStep(int index, String id, String name, String type) {
    }
}
