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

package dev.mars.convoy.scheduler;

import dev.mars.convoy.scheduler.batch.ProfileRunResult;

import java.util.List;

/**
 * Result of one schedule trigger across its profiles.
 */
public record ScheduleRunResult(boolean success, ScheduleRunStatus status, List<ProfileRunResult> results, String error) {

    public ScheduleRunResult {
        results = List.copyOf(results);
    }

    /**
     * Success when every profile succeeded, partial when only some did, failed otherwise.
     */
    public static ScheduleRunResult of(List<ProfileRunResult> results) {
        long succeeded = results.stream().filter(ProfileRunResult::success).count();
        if (!results.isEmpty() && succeeded == results.size()) {
            return new ScheduleRunResult(true, ScheduleRunStatus.SUCCESS, results, null);
        }
        ScheduleRunStatus status = succeeded > 0 ? ScheduleRunStatus.PARTIAL : ScheduleRunStatus.FAILED;
        String error = results.isEmpty() ? "No profiles to run" : "Some executions failed";
        return new ScheduleRunResult(false, status, results, error);
    }

    public static ScheduleRunResult failure(String error) {
        return new ScheduleRunResult(false, ScheduleRunStatus.FAILED, List.of(), error);
    }
}
