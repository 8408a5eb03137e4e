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

package dev.mars.convoy.queue;

import java.util.Map;

/**
 * Point-in-time summary of a queue.
 *
 * @param total number of pending items
 * @param mode current ordering mode
 * @param byPriority pending items per priority, every priority present
 * @param oldestItemAgeMs wait time of the longest-waiting item, 0 when empty
 */
public record QueueStats(int total, QueueMode mode, Map<QueuePriority, Integer> byPriority, long oldestItemAgeMs) {

    public QueueStats {
        byPriority = Map.copyOf(byPriority);
    }
}
