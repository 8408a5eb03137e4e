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

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named values for one workflow run.
 * <p>
 * A base map holds workflow variables. Each running loop pushes an overlay frame holding its
 * {@link LoopContext} and the names it declares; lookups search the innermost frame first.
 * Templates use {@code {{ path | transform:arg }}} placeholders, where a path may be dotted and
 * indexed ({@code items[0].title}) or address {@code profile.*}, {@code session.*} and
 * {@code loop.*}. Unresolved placeholders are left as literal text.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class VariableStore {

    private static final Logger logger = LoggerFactory.getLogger(VariableStore.class);

    private static final Pattern NUMERIC_TEXT = Pattern.compile("-?\\d+(\\.\\d+)?");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^}]+)\\}\\}");
    private static final Pattern SEGMENT = Pattern.compile("([^.\\[\\]]+)|\\[(\\d+)\\]");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Map<String, Object> variables = new LinkedHashMap<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final VariableTransforms transforms;
    private final ExpressionEvaluator evaluator;
    private final Clock clock;

    private Map<String, Object> profile = Map.of();
    private Map<String, Object> session = Map.of();

    public VariableStore() {
        this(Map.of());
    }

    public VariableStore(Map<String, Object> initial) {
        this(initial, new VariableTransforms(), new ExpressionEvaluator(), Clock.systemDefaultZone());
    }

    public VariableStore(Map<String, Object> initial, VariableTransforms transforms,
                         ExpressionEvaluator evaluator, Clock clock) {
        this.transforms = Objects.requireNonNull(transforms, "Transforms cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        if (initial != null) {
            variables.putAll(initial);
        }
    }

    // ---------------------------------------------------------------- values

    /**
     * Write {@code name}. The innermost loop frame that already declares the name receives it,
     * otherwise the base map does.
     */
    public synchronized void set(String name, Object value) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        for (Frame frame : frames) {
            if (frame.locals.containsKey(name)) {
                frame.locals.put(name, value);
                return;
            }
        }
        variables.put(name, value);
    }

    /**
     * Declare {@code name} in the innermost loop frame, or in the base map outside loops.
     */
    public synchronized void declareLocal(String name, Object value) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        Frame frame = frames.peekFirst();
        if (frame != null) {
            frame.locals.put(name, value);
        } else {
            variables.put(name, value);
        }
    }

    public synchronized Object get(String path) {
        return lookup(path).orElse(null);
    }

    public synchronized Optional<Object> lookup(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = SEGMENT.matcher(path.trim());
        List<Object> segments = new ArrayList<>();
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                segments.add(matcher.group(1).trim());
            } else {
                try {
                    segments.add(Integer.parseInt(matcher.group(2)));
                } catch (NumberFormatException e) {
                    logger.debug("Index out of range in path '{}'", path);
                    return Optional.empty();
                }
            }
        }
        if (segments.isEmpty() || !(segments.get(0) instanceof String)) {
            return Optional.empty();
        }

        Optional<Object> root = resolveRoot((String) segments.get(0));
        if (root.isEmpty()) {
            return Optional.empty();
        }
        Object current = root.get();
        for (Object segment : segments.subList(1, segments.size())) {
            current = descend(current, segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    public synchronized boolean has(String name) {
        return lookup(name).isPresent();
    }

    public synchronized void delete(String name) {
        for (Frame frame : frames) {
            if (frame.locals.containsKey(name)) {
                frame.locals.remove(name);
                return;
            }
        }
        variables.remove(name);
    }

    /**
     * Remove every value and loop frame. Profile and session data stay attached.
     */
    public synchronized void clear() {
        variables.clear();
        frames.clear();
    }

    /**
     * Snapshot of visible values: base variables overlaid by loop locals, plus {@code profile},
     * {@code session} and {@code loop} when present.
     */
    public synchronized Map<String, Object> getAll() {
        Map<String, Object> all = new LinkedHashMap<>(variables);
        Iterator<Frame> outermostFirst = frames.descendingIterator();
        while (outermostFirst.hasNext()) {
            all.putAll(outermostFirst.next().locals);
        }
        if (!profile.isEmpty()) {
            all.put("profile", profile);
        }
        if (!session.isEmpty()) {
            all.put("session", session);
        }
        Frame frame = frames.peekFirst();
        if (frame != null) {
            all.put("loop", frame.context.toMap());
        }
        return all;
    }

    public synchronized void setProfile(Map<String, Object> profile) {
        this.profile = profile != null ? new LinkedHashMap<>(profile) : Map.of();
    }

    public synchronized void setSession(Map<String, Object> session) {
        this.session = session != null ? new LinkedHashMap<>(session) : Map.of();
    }

    // ---------------------------------------------------------------- loop scopes

    public synchronized void pushLoop(LoopContext context) {
        frames.push(new Frame(Objects.requireNonNull(context, "Loop context cannot be null")));
    }

    public synchronized void popLoop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("No loop scope to pop");
        }
        frames.pop();
    }

    /**
     * Push a loop frame for use in try-with-resources; closing pops it.
     */
    public LoopScope enterLoop(LoopContext context) {
        pushLoop(context);
        return this::popLoop;
    }

    public synchronized int loopDepth() {
        return frames.size();
    }

    public synchronized Optional<LoopContext> currentLoop() {
        Frame frame = frames.peekFirst();
        return frame != null ? Optional.of(frame.context) : Optional.empty();
    }

    /**
     * Handle returned by {@link #enterLoop(LoopContext)}.
     */
    @FunctionalInterface
    public interface LoopScope extends AutoCloseable {
        @Override
        void close();
    }

    // ---------------------------------------------------------------- templates

    /**
     * Replace every resolvable placeholder with its display string.
     */
    public synchronized String interpolate(String template) {
        if (template == null) {
            return null;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Optional<Object> value = resolvePlaceholder(matcher.group(1));
            String replacement = value.map(ValueConversions::toDisplayString).orElse(matcher.group());
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Like {@link #interpolate(String)}, but a template that is exactly one resolvable
     * placeholder yields the raw value.
     */
    public synchronized Object interpolateValue(String template) {
        if (template == null) {
            return null;
        }
        Matcher matcher = PLACEHOLDER.matcher(template.trim());
        if (matcher.matches()) {
            Optional<Object> value = resolvePlaceholder(matcher.group(1));
            if (value.isPresent()) {
                return value.get();
            }
        }
        return interpolate(template);
    }

    /**
     * Interpolate strings found anywhere inside maps and lists.
     */
    public synchronized Object interpolateObject(Object value) {
        if (value instanceof String) {
            return interpolateValue((String) value);
        }
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), interpolateObject(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<?>) value) {
                copy.add(interpolateObject(element));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public synchronized Map<String, Object> interpolateConfig(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) interpolateObject(config);
    }

    // ---------------------------------------------------------------- expressions

    public Object evaluate(String expression) {
        return evaluate(expression, Boolean.FALSE);
    }

    /**
     * Evaluate an expression whose placeholders are bound as typed values.
     *
     * @return the result, or {@code fallback} when the expression cannot be evaluated
     */
    public synchronized Object evaluate(String expression, Object fallback) {
        if (expression == null || expression.isBlank()) {
            return fallback;
        }
        try {
            Optional<Boolean> comparison = evaluator.evaluateSimpleComparison(expression, this::interpolate);
            if (comparison.isPresent()) {
                return comparison.get();
            }
            Map<String, Object> bindings = new HashMap<>();
            String spel = bindPlaceholders(expression, bindings);
            return evaluator.evaluate(spel, bindings, interpolate(expression), fallback);
        } catch (RuntimeException e) {
            logger.warn("Failed to evaluate expression '{}': {}", expression, e.getMessage());
            return fallback;
        }
    }

    public boolean evaluateCondition(String expression) {
        return ValueConversions.isTruthy(evaluate(expression, Boolean.FALSE));
    }

    public VariableTransforms getTransforms() {
        return transforms;
    }

    // ---------------------------------------------------------------- internals

    private Optional<Object> resolvePlaceholder(String body) {
        String[] pipes = body.split("\\|");
        String path = pipes[0].trim();
        Object value = lookup(path).orElse(null);
        if (pipes.length == 1) {
            return Optional.ofNullable(value);
        }
        for (int i = 1; i < pipes.length; i++) {
            String pipe = pipes[i].trim();
            if (pipe.isEmpty()) {
                continue;
            }
            List<String> parts = splitArguments(pipe);
            value = transforms.apply(parts.get(0), value, parts.subList(1, parts.size()));
        }
        return Optional.ofNullable(value);
    }

    private static List<String> splitArguments(String pipe) {
        List<String> parts = new ArrayList<>();
        for (String part : pipe.split(":", -1)) {
            String arg = part.trim();
            if (arg.length() >= 2 && (arg.startsWith("'") && arg.endsWith("'")
                    || arg.startsWith("\"") && arg.endsWith("\""))) {
                arg = arg.substring(1, arg.length() - 1);
            }
            parts.add(arg);
        }
        return parts;
    }

    /**
     * Rewrite placeholders as SpEL variable references. Placeholders inside a quoted string
     * literal are inlined as escaped text instead.
     */
    private String bindPlaceholders(String expression, Map<String, Object> bindings) {
        Matcher matcher = PLACEHOLDER.matcher(expression);
        StringBuilder spel = new StringBuilder();
        int last = 0;
        char quote = 0;
        while (matcher.find()) {
            String literal = expression.substring(last, matcher.start());
            quote = trackQuote(literal, quote);
            spel.append(literal);

            Optional<Object> value = resolvePlaceholder(matcher.group(1));
            if (value.isEmpty()) {
                spel.append(matcher.group());
            } else if (quote != 0) {
                String text = ValueConversions.toDisplayString(value.get());
                spel.append(text.replace(String.valueOf(quote), String.valueOf(quote) + quote));
            } else {
                String name = "v" + bindings.size();
                bindings.put(name, bindingValue(value.get()));
                spel.append('#').append(name);
            }
            last = matcher.end();
        }
        spel.append(expression.substring(last));
        return spel.toString();
    }

    /**
     * Numeric and boolean text is bound as a number or boolean so it compares with literals.
     */
    private static Object bindingValue(Object value) {
        if (!(value instanceof String text)) {
            return value;
        }
        String trimmed = text.trim();
        if ("true".equals(trimmed) || "false".equals(trimmed)) {
            return Boolean.valueOf(trimmed);
        }
        if (!NUMERIC_TEXT.matcher(trimmed).matches()) {
            return value;
        }
        try {
            return Long.valueOf(trimmed);
        } catch (NumberFormatException e) {
            return Double.valueOf(trimmed);
        }
    }

    private static char trackQuote(String text, char quote) {
        char state = quote;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (state == 0 && (c == '\'' || c == '"')) {
                state = c;
            } else if (c == state) {
                state = 0;
            }
        }
        return state;
    }

    private Optional<Object> resolveRoot(String name) {
        for (Frame frame : frames) {
            if (frame.locals.containsKey(name)) {
                return Optional.ofNullable(frame.locals.get(name));
            }
        }
        if (variables.containsKey(name)) {
            return Optional.ofNullable(variables.get(name));
        }
        switch (name) {
            case "loop":
                Frame frame = frames.peekFirst();
                return frame != null ? Optional.of(frame.context.toMap()) : Optional.empty();
            case "profile":
                return profile.isEmpty() ? Optional.empty() : Optional.of(profile);
            case "session":
                return session.isEmpty() ? Optional.empty() : Optional.of(session);
            default:
                return builtIn(name);
        }
    }

    private Optional<Object> builtIn(String name) {
        Instant now = clock.instant();
        ZonedDateTime local = now.atZone(clock.getZone());
        switch (name) {
            case "timestamp":
                return Optional.of(now.toEpochMilli());
            case "date":
                return Optional.of(DATE.format(local));
            case "time":
                return Optional.of(TIME.format(local));
            case "datetime":
                return Optional.of(now.toString());
            case "random":
                return Optional.of(ThreadLocalRandom.current().nextInt(1_000_000));
            case "uuid":
                return Optional.of(UUID.randomUUID().toString());
            default:
                return Optional.empty();
        }
    }

    private static Object descend(Object current, Object segment) {
        if (segment instanceof Integer) {
            int index = (Integer) segment;
            Optional<List<Object>> list = ValueConversions.toList(current);
            if (list.isPresent() && index >= 0 && index < list.get().size()) {
                return list.get().get(index);
            }
            return null;
        }
        if (current instanceof Map) {
            return ((Map<?, ?>) current).get(segment);
        }
        if (current instanceof String) {
            Optional<Object> parsed = ValueConversions.parseJson((String) current);
            if (parsed.isPresent() && parsed.get() instanceof Map) {
                return ((Map<?, ?>) parsed.get()).get(segment);
            }
        }
        if ("length".equals(segment)) {
            Optional<List<Object>> list = ValueConversions.toList(current);
            if (list.isPresent()) {
                return list.get().size();
            }
            if (current instanceof String) {
                return ((String) current).length();
            }
        }
        return null;
    }

    private static final class Frame {
        private final LoopContext context;
        private final Map<String, Object> locals = new HashMap<>();

        private Frame(LoopContext context) {
            this.context = context;
        }
    }

    @Override
    public synchronized String toString() {
        return "VariableStore{variables=" + variables.keySet() + ", loopDepth=" + frames.size() + "}";
    }

    Map<String, Object> baseVariables() {
        return Collections.unmodifiableMap(variables);
    }
}
