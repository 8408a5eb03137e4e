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
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Evaluates workflow expressions.
 * <p>
 * A single comparison between plain operands, such as {@code {{count}} == 5}, is compared
 * as text, numerically when both sides are numbers, so string values read from a page match
 * numeric and boolean literals. Anything else is tried as Spring Expression Language with template values bound as
 * read-only variables ({@code #v0}, {@code #v1}, ...). Text SpEL rejects, such as
 * {@code Alice == Bob} with bare words, falls back to a comparison evaluator over the
 * interpolated text that understands {@code == != >= <= > <}, boolean literals and numbers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class ExpressionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private static final String[] OPERATORS = {"==", "!=", ">=", "<=", ">", "<"};

    private static final String STRUCTURAL = "()&|!+*/%?:[]=#$,;^";

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private static final Pattern KEYWORD = Pattern.compile(
            "(?i)\\b(and|or|not|matches|between|instanceof|eq|ne|lt|gt|le|ge|div|mod)\\b");

    private final ExpressionParser parser = new SpelExpressionParser();

    /**
     * Compare a single-operator expression over plain operands. Operands are template
     * placeholders, numbers, quoted literals or bare words; each side is interpolated on its
     * own and quotes around a side are removed.
     *
     * @return the comparison result, or empty when the expression is not a simple comparison
     */
    public Optional<Boolean> evaluateSimpleComparison(String expression, UnaryOperator<String> interpolator) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }
        String masked = mask(expression);
        int operatorIndex = -1;
        String operator = null;
        int i = 0;
        while (i < masked.length()) {
            char c = masked.charAt(i);
            String pair = i + 1 < masked.length() ? masked.substring(i, i + 2) : "";
            if (pair.equals("==") || pair.equals("!=") || pair.equals(">=") || pair.equals("<=")) {
                if (operator != null) {
                    return Optional.empty();
                }
                operator = pair;
                operatorIndex = i;
                i += 2;
                continue;
            }
            if (c == '<' || c == '>') {
                if (operator != null) {
                    return Optional.empty();
                }
                operator = String.valueOf(c);
                operatorIndex = i;
            } else if (STRUCTURAL.indexOf(c) >= 0) {
                return Optional.empty();
            }
            i++;
        }
        if (operator == null) {
            return Optional.empty();
        }

        int rightStart = operatorIndex + operator.length();
        if (!isPlainOperand(masked.substring(0, operatorIndex))
                || !isPlainOperand(masked.substring(rightStart))) {
            return Optional.empty();
        }
        String left = operandText(expression.substring(0, operatorIndex), interpolator);
        String right = operandText(expression.substring(rightStart), interpolator);
        return Optional.of(compare(left, operator, right));
    }

    /**
     * @param spelText the expression with template values replaced by variable references
     * @param bindings values for those variable references
     * @param interpolatedText the same expression with template values inlined as text
     * @param fallback returned when nothing can be evaluated
     */
    public Object evaluate(String spelText, Map<String, Object> bindings, String interpolatedText, Object fallback) {
        Objects.requireNonNull(bindings, "Bindings cannot be null");
        if (spelText == null || spelText.isBlank()) {
            return fallback;
        }

        try {
            SimpleEvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding().build();
            bindings.forEach(context::setVariable);
            return parser.parseExpression(spelText).getValue(context);
        } catch (ParseException | EvaluationException e) {
            logger.debug("Expression '{}' is not SpEL ({}), using comparison evaluator", spelText, e.getMessage());
        }

        try {
            return evaluateComparison(interpolatedText, fallback);
        } catch (RuntimeException e) {
            logger.warn("Failed to evaluate expression '{}': {}", interpolatedText, e.getMessage());
            return fallback;
        }
    }

    private static boolean isPlainOperand(String maskedSide) {
        String side = maskedSide.trim();
        if (side.isEmpty() || KEYWORD.matcher(side).find()) {
            return false;
        }
        return side.indexOf('-') < 0 || NUMBER.matcher(side).matches();
    }

    private static String operandText(String side, UnaryOperator<String> interpolator) {
        String text = side.trim();
        if (text.length() >= 2) {
            char first = text.charAt(0);
            if ((first == '\'' || first == '"') && text.charAt(text.length() - 1) == first) {
                text = text.substring(1, text.length() - 1);
            }
        }
        return interpolator.apply(text);
    }

    /**
     * Blank out placeholders and quoted literals so only the expression structure remains.
     * Quote characters themselves are kept.
     */
    private static String mask(String expression) {
        StringBuilder masked = new StringBuilder(expression.length());
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (expression.startsWith("{{", i)) {
                int end = expression.indexOf("}}", i + 2);
                int stop = end < 0 ? expression.length() : end + 2;
                masked.append("x".repeat(stop - i));
                i = stop;
            } else if (c == '\'' || c == '"') {
                int end = expression.indexOf(c, i + 1);
                if (end < 0) {
                    masked.append(expression.substring(i));
                    break;
                }
                masked.append(c).append("x".repeat(end - i - 1)).append(c);
                i = end + 1;
            } else {
                masked.append(c);
                i++;
            }
        }
        return masked.toString();
    }

    Object evaluateComparison(String text, Object fallback) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        String expression = text.trim();

        for (String operator : OPERATORS) {
            int index = expression.indexOf(operator);
            if (index >= 0) {
                String left = expression.substring(0, index).trim();
                String right = expression.substring(index + operator.length()).trim();
                return compare(left, operator, right);
            }
        }

        if ("true".equals(expression)) {
            return Boolean.TRUE;
        }
        if ("false".equals(expression)) {
            return Boolean.FALSE;
        }
        Optional<Double> number = ValueConversions.toNumber(expression);
        if (number.isPresent()) {
            return number.get();
        }
        return expression;
    }

    /**
     * Binary comparison used by both expressions and {@code compare} conditions.
     * Ordering operators compare numerically and are false when either side is not a number.
     */
    public static boolean compare(Object leftValue, String operator, Object rightValue) {
        String left = ValueConversions.toDisplayString(leftValue);
        String right = ValueConversions.toDisplayString(rightValue);
        Optional<Double> leftNumber = ValueConversions.toNumber(left);
        Optional<Double> rightNumber = ValueConversions.toNumber(right);
        boolean numeric = leftNumber.isPresent() && rightNumber.isPresent();

        switch (operator) {
            case "==":
                return numeric ? leftNumber.get().equals(rightNumber.get()) : left.equals(right);
            case "!=":
                return numeric ? !leftNumber.get().equals(rightNumber.get()) : !left.equals(right);
            case "<":
                return numeric && leftNumber.get() < rightNumber.get();
            case ">":
                return numeric && leftNumber.get() > rightNumber.get();
            case "<=":
                return numeric && leftNumber.get() <= rightNumber.get();
            case ">=":
                return numeric && leftNumber.get() >= rightNumber.get();
            case "contains":
                return left.contains(right);
            case "startsWith":
                return left.startsWith(right);
            case "endsWith":
                return left.endsWith(right);
            default:
                throw new IllegalArgumentException("Unknown comparison operator: " + operator);
        }
    }
}
