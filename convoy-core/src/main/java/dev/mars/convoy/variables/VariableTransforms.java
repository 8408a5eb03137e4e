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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import static dev.mars.convoy.variables.ValueConversions.toDisplayString;
import static dev.mars.convoy.variables.ValueConversions.toNumber;

/**
 * Named value filters applied by template pipes, e.g. {@code {{name | uppercase | truncate:10}}}.
 * Arguments follow the name, separated by colons.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class VariableTransforms {

    private static final Logger logger = LoggerFactory.getLogger(VariableTransforms.class);

    private static final Pattern WORD_START = Pattern.compile("\\b\\w");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * A single filter.
     */
    @FunctionalInterface
    public interface Transform {
        Object apply(Object value, List<String> args);
    }

    private final Map<String, Transform> transforms = new HashMap<>();
    private final ZoneId zone;

    public VariableTransforms() {
        this(ZoneId.systemDefault());
    }

    public VariableTransforms(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "Zone cannot be null");
        registerStringTransforms();
        registerNumberTransforms();
        registerDateTransforms();
        registerEncodingTransforms();
        registerCollectionTransforms();
        registerBooleanTransforms();
    }

    public void register(String name, Transform transform) {
        transforms.put(Objects.requireNonNull(name, "Transform name cannot be null"),
                Objects.requireNonNull(transform, "Transform cannot be null"));
    }

    public boolean has(String name) {
        return transforms.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(transforms.keySet()));
    }

    /**
     * Apply the named transform. Unknown names leave the value unchanged.
     */
    public Object apply(String name, Object value, List<String> args) {
        Transform transform = transforms.get(name);
        if (transform == null) {
            logger.debug("Unknown transform '{}' ignored", name);
            return value;
        }
        return transform.apply(value, args != null ? args : List.of());
    }

    private void registerStringTransforms() {
        register("uppercase", (v, a) -> toDisplayString(v).toUpperCase(Locale.ROOT));
        register("lowercase", (v, a) -> toDisplayString(v).toLowerCase(Locale.ROOT));
        register("capitalize", (v, a) -> WORD_START.matcher(toDisplayString(v))
                .replaceAll(match -> match.group().toUpperCase(Locale.ROOT)));
        register("trim", (v, a) -> toDisplayString(v).trim());
        register("truncate", (v, a) -> {
            String text = toDisplayString(v);
            int length = intArg(a, 0, 50);
            return text.length() > length ? text.substring(0, length) + "..." : text;
        });
        register("split", (v, a) -> {
            String delimiter = arg(a, 0, ",");
            List<String> parts = Arrays.asList(toDisplayString(v).split(Pattern.quote(delimiter), -1));
            if (a.size() > 1) {
                int index = intArg(a, 1, 0);
                return index >= 0 && index < parts.size() ? parts.get(index) : null;
            }
            return parts;
        });
        register("replace", (v, a) -> {
            String text = toDisplayString(v);
            String search = arg(a, 0, "");
            String replacement = arg(a, 1, "");
            if (search.isEmpty()) {
                return text;
            }
            try {
                return Pattern.compile(search).matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
            } catch (PatternSyntaxException e) {
                return text.replace(search, replacement);
            }
        });
        register("regex", (v, a) -> {
            Matcher matcher = Pattern.compile(arg(a, 0, ".*")).matcher(toDisplayString(v));
            if (!matcher.find()) {
                return null;
            }
            int group = intArg(a, 1, 0);
            return group <= matcher.groupCount() ? matcher.group(group) : matcher.group();
        });
        register("length", (v, a) -> {
            if (v instanceof Collection<?> c) {
                return c.size();
            }
            return toDisplayString(v).length();
        });
        register("reverse", (v, a) -> {
            if (v instanceof List<?> list) {
                List<Object> reversed = new ArrayList<>(list);
                Collections.reverse(reversed);
                return reversed;
            }
            return new StringBuilder(toDisplayString(v)).reverse().toString();
        });
    }

    private void registerNumberTransforms() {
        register("round", (v, a) -> toNumber(v).map(n -> {
            int decimals = intArg(a, 0, 0);
            if (decimals <= 0) {
                return (Object) Math.round(n);
            }
            return (Object) BigDecimal.valueOf(n).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
        }).orElse(v));
        register("floor", (v, a) -> toNumber(v).map(n -> (Object) (long) Math.floor(n)).orElse(v));
        register("ceil", (v, a) -> toNumber(v).map(n -> (Object) (long) Math.ceil(n)).orElse(v));
        register("abs", (v, a) -> toNumber(v).map(n -> (Object) Math.abs(n)).orElse(v));
        register("pad", (v, a) -> {
            String text = toDisplayString(v);
            int width = intArg(a, 0, text.length());
            String padding = arg(a, 1, "0");
            if (padding.isEmpty() || text.length() >= width) {
                return text;
            }
            StringBuilder sb = new StringBuilder();
            while (sb.length() + text.length() < width) {
                sb.append(padding.charAt(0));
            }
            return sb.append(text).toString();
        });
        register("number", (v, a) -> toNumber(v).map(n -> (Object) n).orElse(v));
        register("int", (v, a) -> toNumber(v).map(n -> (Object) n.longValue()).orElse(v));
    }

    private void registerDateTransforms() {
        register("date", (v, a) -> formatTemporal(v, DATE));
        register("time", (v, a) -> formatTemporal(v, TIME));
        register("datetime", (v, a) -> formatTemporal(v, DATETIME));
        register("format", (v, a) -> {
            String pattern = arg(a, 0, "YYYY-MM-DD").replace("YYYY", "yyyy").replace("YY", "yy").replace("DD", "dd");
            return formatTemporal(v, DateTimeFormatter.ofPattern(pattern));
        });
    }

    private void registerEncodingTransforms() {
        register("urlencode", (v, a) -> URLEncoder.encode(toDisplayString(v), StandardCharsets.UTF_8).replace("+", "%20"));
        register("urldecode", (v, a) -> URLDecoder.decode(toDisplayString(v), StandardCharsets.UTF_8));
        register("base64", (v, a) -> Base64.getEncoder()
                .encodeToString(toDisplayString(v).getBytes(StandardCharsets.UTF_8)));
        register("base64decode", (v, a) -> {
            try {
                return new String(Base64.getDecoder().decode(toDisplayString(v)), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                logger.debug("base64decode left invalid input unchanged: {}", e.getMessage());
                return v;
            }
        });
        register("stringify", (v, a) -> ValueConversions.toJson(v));
        register("jsonparse", (v, a) -> ValueConversions.parseJson(toDisplayString(v)).orElse(v));
    }

    private void registerCollectionTransforms() {
        register("first", (v, a) -> v instanceof List<?> list ? (list.isEmpty() ? null : list.get(0)) : v);
        register("last", (v, a) -> v instanceof List<?> list ? (list.isEmpty() ? null : list.get(list.size() - 1)) : v);
        register("join", (v, a) -> {
            if (v instanceof Collection<?> c) {
                String delimiter = arg(a, 0, ", ");
                return c.stream().map(ValueConversions::toDisplayString).collect(Collectors.joining(delimiter));
            }
            return v;
        });
        register("count", (v, a) -> v instanceof Collection<?> c ? c.size() : 1);
        register("keys", (v, a) -> v instanceof Map<?, ?> m ? new ArrayList<Object>(m.keySet()) : List.of());
        register("values", (v, a) -> v instanceof Map<?, ?> m ? new ArrayList<Object>(m.values()) : List.of(v));
    }

    private void registerBooleanTransforms() {
        register("bool", (v, a) -> ValueConversions.isTruthy(v));
        register("not", (v, a) -> !ValueConversions.isTruthy(v));
        register("default", (v, a) -> v == null || "".equals(v) ? arg(a, 0, "") : v);
    }

    private Object formatTemporal(Object value, DateTimeFormatter formatter) {
        LocalDateTime dateTime = toDateTime(value);
        return dateTime != null ? formatter.format(dateTime) : value;
    }

    private LocalDateTime toDateTime(Object value) {
        if (value instanceof Number n) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(n.longValue()), zone);
        }
        String text = toDisplayString(value).trim();
        if (text.matches("-?\\d+")) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(Long.parseLong(text)), zone);
        }
        try {
            return LocalDateTime.ofInstant(Instant.parse(text), zone);
        } catch (DateTimeParseException e) {
            logger.debug("Not a date value: {}", text);
            return null;
        }
    }

    private static String arg(List<String> args, int index, String defaultValue) {
        return index < args.size() ? args.get(index) : defaultValue;
    }

    private static int intArg(List<String> args, int index, int defaultValue) {
        return index < args.size() ? ValueConversions.toInt(args.get(index), defaultValue) : defaultValue;
    }
}
