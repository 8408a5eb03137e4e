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

import dev.mars.convoy.variables.ValueConversions;
import dev.mars.convoy.workflow.ExecutionContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code array-push}: appends {@code value} to the list variable named by {@code variable}
 * (or {@code array}), starting a new list when the variable is missing or not a list.
 */
public class ArrayPushAction implements Action {

    public static final String TYPE = "array-push";

    @Override
    public ActionResult execute(ExecutionContext context, Map<String, Object> config) {
        Object target = config.containsKey("variable") ? config.get("variable") : config.get("array");
        if (target == null || target.toString().isBlank()) {
            return ActionResult.failure("Array variable name is required");
        }
        String name = target.toString();

        List<Object> list = new ArrayList<>(ValueConversions.toList(context.getVariables().get(name)).orElse(List.of()));
        list.add(config.get("value"));
        context.getVariables().set(name, list);

        return ActionResult.success(Map.of("variable", name, "length", list.size()));
    }
}
