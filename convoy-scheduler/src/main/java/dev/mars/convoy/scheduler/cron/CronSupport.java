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
import org.springframework.scheduling.support.CronExpression;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cron parsing, next-fire calculation and descriptions.
 * <p>
 * Schedules use standard 5-field expressions ({@code minute hour day-of-month month day-of-week}).
 * They are evaluated with Spring's {@link CronExpression} after prefixing a seconds field of
 * {@code 0}. Six-field expressions and Spring macros such as {@code @daily} are passed through as-is.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-11
 * @version 1.0
 */
public final class CronSupport {

    private static final Pattern NUMBER = Pattern.compile("\\d{1,2}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<CronPreset> PRESETS = List.of(
            new CronPreset("Every minute", "* * * * *"),
            new CronPreset("Every 5 minutes", "*/5 * * * *"),
            new CronPreset("Every 15 minutes", "*/15 * * * *"),
            new CronPreset("Every 30 minutes", "*/30 * * * *"),
            new CronPreset("Every hour", "0 * * * *"),
            new CronPreset("Every 2 hours", "0 */2 * * *"),
            new CronPreset("Every 6 hours", "0 */6 * * *"),
            new CronPreset("Daily at midnight", "0 0 * * *"),
            new CronPreset("Daily at 6 AM", "0 6 * * *"),
            new CronPreset("Daily at 9 AM", "0 9 * * *"),
            new CronPreset("Daily at 12 PM", "0 12 * * *"),
            new CronPreset("Daily at 6 PM", "0 18 * * *"),
            new CronPreset("Weekdays at 9 AM", "0 9 * * 1-5"),
            new CronPreset("Weekly (Sunday)", "0 0 * * 0"),
            new CronPreset("Weekly (Monday)", "0 9 * * 1"),
            new CronPreset("First of month", "0 0 1 * *")
    );

    private CronSupport() {
    }

    public static CronExpression parse(String expression) throws InvalidCronExpressionException {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "Expression is required");
        }
        String trimmed = expression.trim();
        String springExpression;
        if (trimmed.startsWith("@")) {
            springExpression = trimmed;
        } else {
            int fields = WHITESPACE.split(trimmed).length;
            if (fields == 5) {
                springExpression = "0 " + trimmed;
            } else if (fields == 6) {
                springExpression = trimmed;
            } else {
                throw new InvalidCronExpressionException(expression, "Expected 5 fields but found " + fields);
            }
        }
        try {
            return CronExpression.parse(springExpression);
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(expression, e);
        }
    }

    public static void validate(String expression) throws InvalidCronExpressionException {
        parse(expression);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    /**
     * The first fire time strictly after {@code after}, in the given zone.
     *
     * @return empty when the expression is invalid or never fires
     */
    public static Optional<Instant> nextRun(String expression, Instant after, ZoneId zone) {
        try {
            ZonedDateTime next = parse(expression).next(after.atZone(zone));
            return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
        } catch (InvalidCronExpressionException e) {
            return Optional.empty();
        }
    }

    public static Optional<Instant> nextRun(String expression, Instant after) {
        return nextRun(expression, after, ZoneId.systemDefault());
    }

    /**
     * A human-readable description for common shapes; anything else is returned unchanged.
     */
    public static String describe(String expression) {
        if (expression == null) {
            return "";
        }
        String trimmed = expression.trim();
        String[] parts = WHITESPACE.split(trimmed);
        if (parts.length != 5) {
            return trimmed;
        }
        String minute = parts[0];
        String hour = parts[1];
        String dayOfMonth = parts[2];
        String month = parts[3];
        String dayOfWeek = parts[4];

        switch (trimmed) {
            case "* * * * *":
                return "Every minute";
            case "0 * * * *":
                return "Every hour";
            case "0 0 * * *":
                return "Every day at midnight";
            default:
                break;
        }

        boolean anyDay = "*".equals(dayOfMonth) && "*".equals(month) && "*".equals(dayOfWeek);
        if (minute.startsWith("*/") && "*".equals(hour) && anyDay) {
            return "Every " + minute.substring(2) + " minutes";
        }
        if ("0".equals(minute) && hour.startsWith("*/") && anyDay) {
            return "Every " + hour.substring(2) + " hours";
        }
        if (!NUMBER.matcher(minute).matches() || !NUMBER.matcher(hour).matches()) {
            return trimmed;
        }

        String time = String.format("%02d:%02d", Integer.parseInt(hour), Integer.parseInt(minute));
        if (anyDay) {
            return "Daily at " + time;
        }
        if ("*".equals(dayOfMonth) && "*".equals(month)) {
            if ("1-5".equals(dayOfWeek)) {
                return "Weekdays at " + time;
            }
            if (NUMBER.matcher(dayOfWeek).matches() && Integer.parseInt(dayOfWeek) <= 7) {
                return "Weekly on " + dayName(Integer.parseInt(dayOfWeek)) + " at " + time;
            }
        }
        if (NUMBER.matcher(dayOfMonth).matches() && "*".equals(month) && "*".equals(dayOfWeek)) {
            return "Monthly on day " + Integer.parseInt(dayOfMonth) + " at " + time;
        }
        return trimmed;
    }

    public static List<CronPreset> presets() {
        return PRESETS;
    }

    // Cron counts Sunday as 0 or 7
    private static String dayName(int cronDay) {
        DayOfWeek day = cronDay == 0 || cronDay == 7 ? DayOfWeek.SUNDAY : DayOfWeek.of(cronDay);
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
