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

package dev.mars.convoy.workflow;

import dev.mars.convoy.variables.ExpressionEvaluator;
import dev.mars.convoy.variables.ValueConversions;
import dev.mars.convoy.variables.VariableStore;
import dev.mars.convoy.workflow.action.BrowserPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Evaluates the configuration of a {@code condition} step to a boolean.
 * <p>
 * Page checks ({@code element-exists}, {@code element-visible}, {@code text-contains},
 * {@code url-contains}) are false when no page is attached or the page call fails.
 * Unknown condition types are false. {@code negate} is applied last.
 */
public class ConditionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ConditionEvaluator.class);

    public boolean evaluate(Map<String, Object> config, ExecutionContext context) {
        String conditionType = stringValue(config.get("conditionType"));
        boolean result = evaluateType(conditionType, config, context);
        if (ValueConversions.isTruthy(config.get("negate"))) {
            result = !result;
        }
        logger.debug("Condition {} evaluated to {}", conditionType, result);
        return result;
    }

    private boolean evaluateType(String conditionType, Map<String, Object> config, ExecutionContext context) {
        VariableStore variables = context.getVariables();
        if (conditionType == null) {
            logger.warn("Condition step has no conditionType");
            return false;
        }
        switch (conditionType) {
            case "compare": {
                Object left = interpolated(variables, config.get("left"));
                Object right = interpolated(variables, config.get("right"));
                String operator = config.get("operator") != null ? config.get("operator").toString() : "==";
                try {
                    return ExpressionEvaluator.compare(left, operator, right);
                } catch (IllegalArgumentException e) {
                    logger.warn("Condition compare failed: {}", e.getMessage());
                    return false;
                }
            }
            case "expression":
                return variables.evaluateCondition(stringValue(config.get("expression")));
            case "element-exists":
            case "element-visible":
            case "text-contains":
            case "url-contains":
                return evaluatePageCondition(conditionType, config, context);
            default:
                logger.warn("Unknown condition type '{}', evaluating to false", conditionType);
                return false;
        }
    }

    private boolean evaluatePageCondition(String conditionType, Map<String, Object> config, ExecutionContext context) {
        Optional<BrowserPage> attached = context.getPage();
        if (attached.isEmpty()) {
            logger.debug("No page attached, condition {} is false", conditionType);
            return false;
        }
        BrowserPage page = attached.get();
        VariableStore variables = context.getVariables();
        try {
            switch (conditionType) {
                case "element-exists":
                    return page.count(variables.interpolate(stringValue(config.get("selector")))) > 0;
                case "element-visible":
                    return page.isVisible(variables.interpolate(stringValue(config.get("selector"))));
                case "text-contains": {
                    String text = variables.interpolate(stringValue(config.get("text")));
                    String selector = config.get("selector") != null
                            ? variables.interpolate(config.get("selector").toString())
                            : "body";
                    String content = page.textContent(selector);
                    return content != null && text != null && content.contains(text);
                }
                default: {
                    String pattern = variables.interpolate(stringValue(config.get("urlPattern")));
                    String url = page.url();
                    return url != null && pattern != null && url.contains(pattern);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while evaluating condition {}", conditionType);
            return false;
        } catch (Exception e) {
            logger.debug("Page check {} failed, evaluating to false", conditionType, e);
            return false;
        }
    }

    private static Object interpolated(VariableStore variables, Object value) {
        return value instanceof String s ? variables.interpolateValue(s) : value;
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }
}
