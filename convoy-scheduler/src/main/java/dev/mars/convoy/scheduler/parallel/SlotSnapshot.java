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

import java.time.Instant;

/**
 * Point-in-time view of an active slot.
 *
 * @param currentStep one-based top-level step, 0 before the first step starts
 */
public record SlotSnapshot(String slotId,
                           String profileId,
                           String profileName,
                           int progress,
                           int currentStep,
                           int totalSteps,
                           String currentAction,
                           SlotStatus status,
                           Instant startTime) {
}
