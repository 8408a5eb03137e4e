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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link VariableStore}: lookups, loop scoping, interpolation, transforms and expressions.
 */
class VariableStoreTest {

    private VariableStore store;

    @BeforeEach
    void setUp() {
        Map<String, Object> initial = new LinkedHashMap<>();
        initial.put("name", "Alice");
        initial.put("count", 3);
        initial.put("user", Map.of("email", "alice@example.com", "tags", List.of("a", "b")));
        initial.put("items", List.of(Map.of("title", "First"), Map.of("title", "Second")));
        store = new VariableStore(initial, new VariableTransforms(ZoneOffset.UTC), new ExpressionEvaluator(),
                Clock.fixed(Instant.parse("2025-03-04T05:06:07Z"), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        void resolvesDottedAndIndexedPaths() {
            assertThat(store.get("user.email")).isEqualTo("alice@example.com");
            assertThat(store.get("user.tags[1]")).isEqualTo("b");
            assertThat(store.get("items[1].title")).isEqualTo("Second");
            assertThat(store.get("items.length")).isEqualTo(2);
            assertThat(store.get("items[5].title")).isNull();
            assertThat(store.get("items[99999999999].title")).isNull();
            assertThat(store.has("missing")).isFalse();
        }

        @Test
        void resolvesProfileAndSessionData() {
            store.setProfile(Map.of("id", "p-1", "name", "Profile One"));
            store.setSession(Map.of("token", "abc"));

            assertThat(store.get("profile.name")).isEqualTo("Profile One");
            assertThat(store.get("session.token")).isEqualTo("abc");
            assertThat(store.getAll()).containsKeys("profile", "session");
        }

        @Test
        void builtInsYieldToUserVariables() {
            assertThat(store.get("date")).isEqualTo("2025-03-04");
            assertThat(store.get("time")).isEqualTo("05:06:07");
            assertThat(store.get("timestamp")).isEqualTo(Instant.parse("2025-03-04T05:06:07Z").toEpochMilli());
            assertThat((String) store.get("uuid")).hasSize(36);

            store.set("date", "user value");
            assertThat(store.get("date")).isEqualTo("user value");
        }

        @Test
        void deleteAndClear() {
            store.delete("name");
            assertThat(store.has("name")).isFalse();

            store.clear();
            assertThat(store.has("count")).isFalse();
        }
    }

    @Nested
    @DisplayName("Loop scopes")
    class LoopScopes {

        @Test
        @DisplayName("a name shadowed inside a loop is restored afterwards")
        void shadowedNameIsRestored() {
            try (VariableStore.LoopScope scope = store.enterLoop(new LoopContext(0, 2, "x"))) {
                store.declareLocal("name", "Inner");
                assertThat(store.get("name")).isEqualTo("Inner");
            }

            assertThat(store.get("name")).isEqualTo("Alice");
        }

        @Test
        @DisplayName("a name first declared inside a loop is absent afterwards")
        void loopLocalIsRemoved() {
            store.pushLoop(new LoopContext(0, 1, null));
            store.declareLocal("item", "value");
            store.popLoop();

            assertThat(store.has("item")).isFalse();
        }

        @Test
        void setUpdatesOuterVariablesFromInsideLoop() {
            store.pushLoop(new LoopContext(0, 1, null));
            store.set("count", 10);
            store.popLoop();

            assertThat(store.get("count")).isEqualTo(10);
        }

        @Test
        void scopeIsReleasedWhenBodyThrows() {
            assertThatThrownBy(() -> {
                try (VariableStore.LoopScope scope = store.enterLoop(new LoopContext(0, 1, null))) {
                    store.declareLocal("temp", 1);
                    throw new IllegalStateException("body failed");
                }
            }).isInstanceOf(IllegalStateException.class);

            assertThat(store.loopDepth()).isZero();
            assertThat(store.has("temp")).isFalse();
        }

        @Test
        void exposesLoopContext() {
            store.pushLoop(new LoopContext(2, 3, "c"));

            assertThat(store.get("loop.index")).isEqualTo(2);
            assertThat(store.get("loop.last")).isEqualTo(true);
            assertThat(store.get("loop.first")).isEqualTo(false);
            assertThat(store.interpolate("{{loop.item}}")).isEqualTo("c");

            store.popLoop();
            assertThat(store.has("loop")).isFalse();
        }

        @Test
        void popWithoutPushFails() {
            assertThatThrownBy(store::popLoop).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Interpolation")
    class Interpolation {

        @Test
        void replacesPlaceholders() {
            assertThat(store.interpolate("Hello {{ name }}, you have {{count}} items"))
                    .isEqualTo("Hello Alice, you have 3 items");
        }

        @Test
        void leavesUnresolvedPlaceholdersLiteral() {
            assertThat(store.interpolate("Hi {{nobody}}")).isEqualTo("Hi {{nobody}}");
        }

        @Test
        void stringifiesCollectionsAsJson() {
            assertThat(store.interpolate("{{user.tags}}")).isEqualTo("[\"a\",\"b\"]");
        }

        @Test
        void singlePlaceholderKeepsType() {
            assertThat(store.interpolateValue("{{count}}")).isEqualTo(3);
            assertThat(store.interpolateValue("{{user.tags}}")).isEqualTo(List.of("a", "b"));
            assertThat(store.interpolateValue("n={{count}}")).isEqualTo("n=3");
        }

        @Test
        void interpolatesNestedStructures() {
            Map<String, Object> config = Map.of(
                    "url", "https://example.com/{{name}}",
                    "headers", List.of("X-User: {{user.email}}"),
                    "retries", 2);

            Map<String, Object> result = store.interpolateConfig(config);

            assertThat(result.get("url")).isEqualTo("https://example.com/Alice");
            assertThat(result.get("headers")).isEqualTo(List.of("X-User: alice@example.com"));
            assertThat(result.get("retries")).isEqualTo(2);
        }

        @ParameterizedTest
        @CsvSource(delimiter = ';', value = {
                "{{name | uppercase}};ALICE",
                "{{name | lowercase | reverse}};ecila",
                "{{name | truncate:3}};Ali...",
                "{{user.email | split:@:1}};example.com",
                "{{user.email | replace:example:test}};alice@test.com",
                "{{user.tags | join:-}};a-b",
                "{{user.tags | first}};a",
                "{{items | count}};2",
                "{{missing | default:none}};none",
                "{{count | pad:5:0}};00003",
                "{{name | base64}};QWxpY2U=",
                "{{name | unknownTransform}};Alice"
        })
        void appliesTransforms(String template, String expected) {
            assertThat(store.interpolate(template)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        void evaluatesComparisonsWithTypedValues() {
            assertThat(store.evaluateCondition("{{count}} > 2")).isTrue();
            assertThat(store.evaluateCondition("{{count}} >= 4")).isFalse();
            assertThat(store.evaluateCondition("{{name}} == 'Alice'")).isTrue();
        }

        @Test
        void comparesStringValuesWithLiterals() {
            store.set("total", "5");
            store.set("flag", "true");

            assertThat(store.evaluateCondition("{{total}} == 5")).isTrue();
            assertThat(store.evaluateCondition("{{total}} != 5")).isFalse();
            assertThat(store.evaluateCondition("{{total}} >= 5.0")).isTrue();
            assertThat(store.evaluateCondition("{{flag}} == true")).isTrue();
            assertThat(store.evaluateCondition("{{total}} == 5 && {{flag}} == true")).isTrue();
        }

        @Test
        void leavesOversizedIndexesUnresolved() {
            assertThat(store.interpolate("Item: {{items[99999999999]}}")).isEqualTo("Item: {{items[99999999999]}}");
        }

        @Test
        void evaluatesQuotedPlaceholders() {
            assertThat(store.evaluateCondition("'{{name}}' == 'Alice'")).isTrue();
        }

        @Test
        void evaluatesArithmetic() {
            assertThat(store.evaluate("{{count}} * 2")).isEqualTo(6);
        }

        @Test
        void fallsBackToSimpleComparisonForBareWords() {
            store.set("status", "ready");

            assertThat(store.evaluateCondition("{{status}} == ready")).isTrue();
            assertThat(store.evaluateCondition("{{status}} != ready")).isFalse();
        }

        @Test
        void returnsFallbackForBlankExpressions() {
            assertThat(store.evaluate("  ", "fallback")).isEqualTo("fallback");
            assertThat(store.evaluateCondition(null)).isFalse();
        }

        @Test
        void truthinessFollowsConventions() {
            assertThat(store.evaluateCondition("true")).isTrue();
            assertThat(store.evaluateCondition("0")).isFalse();
            assertThat(store.evaluateCondition("false")).isFalse();
        }
    }
}
