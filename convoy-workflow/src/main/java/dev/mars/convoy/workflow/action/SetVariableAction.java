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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code set-variable}: stores {@code value} under {@code name}, converted per {@code type}
 * ({@code string}, {@code number}, {@code boolean} or {@code json}).
 */
public class SetVariableAction implements Action {

    public static final String TYPE = "set-variable";

    @Override
    public ActionResult execute(ExecutionContext context, Map<String, Object> config) {
        Object nameValue = config.get("name");
        if (nameValue == null || nameValue.toString().isBlank()) {
            return ActionResult.failure("Variable name is required");
        }
        String name = nameValue.toString();
        Object raw = config.get("value");
        String type = config.getOrDefault("type", "string").toString();

        Object value;
        switch (type) {
            case "number":
                value = ValueConversions.toNumber(raw).orElse(Double.NaN);
                break;
            case "boolean":
                value = raw instanceof Boolean ? raw : isTrueText(ValueConversions.toDisplayString(raw));
                break;
            case "json":
                value = raw instanceof String ? parseOrKeep((String) raw) : raw;
                break;
            case "string":
            default:
                value = raw instanceof String || raw == null ? raw : keepStructured(raw);
                break;
        }

        context.getVariables().set(name, value);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("variable", name);
        data.put("value", value);
        return ActionResult.success(data);
    }

    private static boolean isTrueText(String text) {
        return "true".equals(text) || "1".equals(text);
    }

    private static Object parseOrKeep(String text) {
        Optional<Object> parsed = ValueConversions.parseJson(text);
        return parsed.orElse(text);
    }

    private static Object keepStructured(Object raw) {
        return raw instanceof Map || raw instanceof List ? raw : ValueConversions.toDisplayString(raw);
    }
}
