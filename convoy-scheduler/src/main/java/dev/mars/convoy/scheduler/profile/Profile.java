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

package dev.mars.convoy.scheduler.profile;

import dev.mars.convoy.queue.QueuePriority;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An isolated browser identity that a workflow runs under. The attributes are
 * opaque to the scheduler and are handed to the session provider and to the
 * run's {@code profile.*} variables.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public record Profile(String id, String name, QueuePriority priority, Map<String, Object> attributes) {

    public Profile {
        Objects.requireNonNull(id, "Profile ID cannot be null");
        priority = priority != null ? priority : QueuePriority.NORMAL;
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static Profile of(String id, String name) {
        return new Profile(id, name, QueuePriority.NORMAL, Map.of());
    }

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    /**
     * The variables a run sees under {@code profile.*}: the attributes plus id and name.
     */
    public Map<String, Object> toVariables() {
        Map<String, Object> variables = new LinkedHashMap<>(attributes);
        variables.put("id", id);
        if (name != null) {
            variables.put("name", name);
        }
        return variables;
    }
}
