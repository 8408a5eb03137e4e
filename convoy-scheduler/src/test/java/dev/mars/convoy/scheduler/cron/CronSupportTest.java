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

package dev.mars.convoy.scheduler.cron;

import dev.mars.convoy.core.exceptions.InvalidCronExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CronSupport.
 */
class CronSupportTest {

    @Nested
    @DisplayName("Descriptions")
    class Descriptions {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "* * * * *     | Every minute",
                "*/5 * * * *   | Every 5 minutes",
                "0 * * * *     | Every hour",
                "0 */6 * * *   | Every 6 hours",
                "0 0 * * *     | Every day at midnight",
                "30 9 * * *    | Daily at 09:30",
                "0 9 * * 1-5   | Weekdays at 09:00",
                "0 18 * * 0    | Weekly on Sunday at 18:00",
                "15 8 * * 3    | Weekly on Wednesday at 08:15",
                "0 0 1 * *     | Monthly on day 1 at 00:00",
                "0 9 1,15 * *  | 0 9 1,15 * *"
        })
        void testDescribe(String expression, String expected) {
            assertEquals(expected, CronSupport.describe(expression));
        }

        @Test
        void testNonStandardShapeIsReturnedUnchanged() {
            assertEquals("0 0 9 * * *", CronSupport.describe("0 0 9 * * *"));
            assertEquals("", CronSupport.describe(null));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest
        @ValueSource(strings = {"* * * * *", "*/15 9-17 * * 1-5", "0 0 9 * * MON", "@daily"})
        void testValidExpressions(String expression) {
            assertTrue(CronSupport.isValid(expression));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "* * *", "61 * * * *", "not a cron"})
        void testInvalidExpressions(String expression) {
            assertFalse(CronSupport.isValid(expression));
        }

        @Test
        void testWrongFieldCountMessage() {
            InvalidCronExpressionException error = assertThrows(InvalidCronExpressionException.class,
                    () -> CronSupport.validate("* * *"));

            assertEquals("Invalid cron expression '* * *': Expected 5 fields but found 3", error.getMessage());
            assertEquals("* * *", error.getExpression());
        }
    }

    @Nested
    @DisplayName("Next run")
    class NextRun {

        @Test
        void testNextRunIsStrictlyAfter() {
            Instant after = Instant.parse("2025-11-10T09:00:00Z");

            assertThat(CronSupport.nextRun("0 9 * * *", after, ZoneOffset.UTC))
                    .contains(Instant.parse("2025-11-11T09:00:00Z"));
        }

        @Test
        void testWeekdayExpressionSkipsWeekend() {
            // 2025-11-15 is a Saturday
            Instant after = Instant.parse("2025-11-15T10:00:00Z");

            assertThat(CronSupport.nextRun("0 9 * * 1-5", after, ZoneOffset.UTC))
                    .contains(Instant.parse("2025-11-17T09:00:00Z"));
        }

        @Test
        void testEveryFiveMinutes() {
            Instant after = Instant.parse("2025-11-10T09:07:30Z");

            assertThat(CronSupport.nextRun("*/5 * * * *", after, ZoneOffset.UTC))
                    .contains(Instant.parse("2025-11-10T09:10:00Z"));
        }

        @Test
        void testInvalidExpressionHasNoNextRun() {
            assertThat(CronSupport.nextRun("bogus", Instant.now())).isEmpty();
        }
    }

    @Test
    void testPresetsAreAllValid() {
        assertThat(CronSupport.presets()).hasSize(16)
                .allSatisfy(preset -> assertTrue(CronSupport.isValid(preset.value()), preset.label()));
    }
}
