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

import java.util.List;

/**
 * Per-profile outcomes of a batch run. {@code success} holds only when every profile succeeded.
 */
public record BatchResult(boolean success, List<ProfileRunResult> results, String error) {

    public BatchResult {
        results = List.copyOf(results);
    }

    public static BatchResult of(List<ProfileRunResult> results) {
        boolean allSucceeded = !results.isEmpty() && results.stream().allMatch(ProfileRunResult::success);
        String error = null;
        if (results.isEmpty()) {
            error = "No profiles to run";
        } else if (!allSucceeded) {
            error = "Some executions failed";
        }
        return new BatchResult(allSucceeded, results, error);
    }

    public long successCount() {
        return results.stream().filter(ProfileRunResult::success).count();
    }

    public long failureCount() {
        return results.size() - successCount();
    }
}
