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

package dev.mars.convoy.variables;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loose conversions between the value types that flow through workflow variables:
 * strings from templates, numbers, booleans, and JSON-shaped maps and lists.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class ValueConversions {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ValueConversions() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * String form used by interpolation: JSON for maps, lists and arrays, whole doubles without
     * a trailing {@code .0}, {@code toString()} for everything else.
     */
    public static String toDisplayString(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
            return String.valueOf(d);
        }
        if (value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
            return toJson(value);
        }
        return value.toString();
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be written as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse JSON text into maps, lists and scalars.
     *
     * @return empty if the text is not valid JSON
     */
    public static Optional<Object> parseJson(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(MAPPER.readValue(text, Object.class));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Numeric view of a value; strings are parsed leniently.
     *
     * @return empty when the value has no numeric reading
     */
    public static Optional<Double> toNumber(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return Optional.of(b ? 1.0 : 0.0);
        }
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static int toInt(Object value, int defaultValue) {
        return toNumber(value).map(Double::intValue).orElse(defaultValue);
    }

    /**
     * False for {@code null}, {@code false}, zero, the empty string, "false" and "0"; true otherwise.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0 && !Double.isNaN(n.doubleValue());
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            return !trimmed.isEmpty() && !"false".equalsIgnoreCase(trimmed) && !"0".equals(trimmed);
        }
        return true;
    }

    /**
     * List view of a value: lists as-is, arrays copied, JSON array text parsed.
     *
     * @return empty when the value is not list-shaped
     */
    public static Optional<List<Object>> toList(Object value) {
        if (value instanceof List<?> list) {
            return Optional.of(Collections.unmodifiableList(new ArrayList<Object>(list)));
        }
        if (value instanceof Object[] array) {
            return Optional.of(Arrays.asList(array));
        }
        if (value instanceof String s && s.trim().startsWith("[")) {
            return parseJson(s)
                    .filter(List.class::isInstance)
                    .map(parsed -> Collections.unmodifiableList(new ArrayList<Object>((List<?>) parsed)));
        }
        return Optional.empty();
    }
}
