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

package dev.mars.convoy.scheduler.batch;

/**
 * Outcome of one profile in a batch or scheduled run.
 *
 * @param executionId null when the run never started, e.g. for an unknown profile
 */
public record ProfileRunResult(String profileId, boolean success, String error, String executionId, long durationMs) {

    public static ProfileRunResult success(String profileId, String executionId, long durationMs) {
        return new ProfileRunResult(profileId, true, null, executionId, durationMs);
    }

    public static ProfileRunResult failure(String profileId, String error) {
        return new ProfileRunResult(profileId, false, error, null, 0);
    }

    public static ProfileRunResult failure(String profileId, String error, String executionId, long durationMs) {
        return new ProfileRunResult(profileId, false, error, executionId, durationMs);
    }
}
