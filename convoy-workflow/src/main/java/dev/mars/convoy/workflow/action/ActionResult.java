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

package dev.mars.convoy.workflow.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of an {@link Action}: a success flag plus a free-form payload.
 */
public record ActionResult(boolean success, Map<String, Object> data) {

    public ActionResult {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public static ActionResult success() {
        return new ActionResult(true, Map.of());
    }

    public static ActionResult success(Map<String, Object> data) {
        return new ActionResult(true, data);
    }

    public static ActionResult failure(String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        return new ActionResult(false, data);
    }
}
