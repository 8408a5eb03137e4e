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

import java.time.Instant;
import java.util.List;

/**
 * Overall scheduler state with the next five enabled schedules by fire time.
 */
public record SchedulerStatus(boolean running,
                              int totalSchedules,
                              int enabledSchedules,
                              List<UpcomingRun> upcoming,
                              Instant serverTime) {

    public SchedulerStatus {
        upcoming = List.copyOf(upcoming);
    }

    public record UpcomingRun(String id, String name, Instant nextRun, String cronDescription) {
    }
}
