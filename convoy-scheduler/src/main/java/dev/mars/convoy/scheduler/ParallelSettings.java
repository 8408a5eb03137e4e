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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether a schedule fans out across its profiles, and how wide.
 */
public record ParallelSettings(boolean enabled, int maxConcurrent) {

    @JsonCreator
    public ParallelSettings(@JsonProperty("enabled") boolean enabled,
                            @JsonProperty("maxConcurrent") int maxConcurrent) {
        this.enabled = enabled;
        this.maxConcurrent = Math.max(1, maxConcurrent);
    }

    public static ParallelSettings sequential() {
        return new ParallelSettings(false, 1);
    }

    public static ParallelSettings of(int maxConcurrent) {
        return new ParallelSettings(true, maxConcurrent);
    }

    public boolean runsInParallel() {
        return enabled && maxConcurrent > 1;
    }
}
