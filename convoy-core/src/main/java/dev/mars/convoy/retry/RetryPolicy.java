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

package dev.mars.convoy.retry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable retry configuration: how many times, how long to wait, and which errors qualify.
 * <p>
 * Errors are classified by their message. A plain pattern matches as a case-insensitive
 * substring; regex patterns are matched with {@link java.util.regex.Matcher#find()}.
 * The classification is heuristic: any message containing "timeout" is treated as transient.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 1000;
    public static final long DEFAULT_MAX_DELAY_MS = 60000;

    public static final List<String> DEFAULT_RETRYABLE_PATTERNS = List.of(
            "timeout",
            "TimeoutError",
            "network_error",
            "NetworkError",
            "ECONNREFUSED",
            "ECONNRESET",
            "ETIMEDOUT",
            "element_not_found",
            "ElementNotFound",
            "Navigation timeout",
            "net::ERR_",
            "Target closed",
            "Session closed",
            "Context destroyed"
    );

    private final int maxRetries;
    private final RetryStrategy strategy;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final boolean jitter;
    private final List<String> retryablePatterns;
    private final List<Pattern> retryableRegexes;

    private RetryPolicy(Builder builder) {
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative: " + builder.maxRetries);
        }
        if (builder.baseDelayMs < 0 || builder.maxDelayMs < 0) {
            throw new IllegalArgumentException("Retry delays cannot be negative");
        }
        this.maxRetries = builder.maxRetries;
        this.strategy = Objects.requireNonNull(builder.strategy, "Strategy cannot be null");
        this.baseDelayMs = builder.baseDelayMs;
        this.maxDelayMs = builder.maxDelayMs;
        this.jitter = builder.jitter;
        this.retryablePatterns = List.copyOf(builder.retryablePatterns);
        this.retryableRegexes = List.copyOf(builder.retryableRegexes);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public RetryStrategy getStrategy() {
        return strategy;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public boolean isJitter() {
        return jitter;
    }

    public List<String> getRetryablePatterns() {
        return retryablePatterns;
    }

    public List<Pattern> getRetryableRegexes() {
        return retryableRegexes;
    }

    /**
     * Whether the message matches any configured pattern.
     */
    public boolean matches(String errorMessage) {
        if (errorMessage == null) {
            return false;
        }
        String lower = errorMessage.toLowerCase(Locale.ROOT);
        for (String pattern : retryablePatterns) {
            if (lower.contains(pattern.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        for (Pattern regex : retryableRegexes) {
            if (regex.matcher(errorMessage).find()) {
                return true;
            }
        }
        return false;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 3 retries, exponential from 1s, capped at 60s, with jitter.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static RetryPolicy aggressive() {
        return builder()
                .maxRetries(5)
                .strategy(RetryStrategy.EXPONENTIAL)
                .baseDelayMs(500)
                .maxDelayMs(30000)
                .build();
    }

    public static RetryPolicy standard() {
        return builder()
                .maxRetries(3)
                .strategy(RetryStrategy.EXPONENTIAL)
                .baseDelayMs(1000)
                .maxDelayMs(60000)
                .build();
    }

    public static RetryPolicy conservative() {
        return builder()
                .maxRetries(2)
                .strategy(RetryStrategy.LINEAR)
                .baseDelayMs(2000)
                .maxDelayMs(120000)
                .build();
    }

    public static RetryPolicy none() {
        return builder()
                .maxRetries(0)
                .strategy(RetryStrategy.NONE)
                .build();
    }

    /**
     * Look up a preset by name: {@code aggressive}, {@code standard}, {@code conservative} or {@code none}.
     *
     * @throws IllegalArgumentException for an unknown preset name
     */
    public static RetryPolicy preset(String name) {
        String key = name != null ? name.trim().toLowerCase(Locale.ROOT) : "";
        switch (key) {
            case "aggressive":
                return aggressive();
            case "standard":
                return standard();
            case "conservative":
                return conservative();
            case "none":
                return none();
            default:
                throw new IllegalArgumentException("Unknown retry preset: " + name);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxRetries == that.maxRetries &&
               baseDelayMs == that.baseDelayMs &&
               maxDelayMs == that.maxDelayMs &&
               jitter == that.jitter &&
               strategy == that.strategy &&
               retryablePatterns.equals(that.retryablePatterns) &&
               retryableRegexes.stream().map(Pattern::pattern).toList()
                       .equals(that.retryableRegexes.stream().map(Pattern::pattern).toList());
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, strategy, baseDelayMs, maxDelayMs, jitter, retryablePatterns);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
               "maxRetries=" + maxRetries +
               ", strategy=" + strategy +
               ", baseDelayMs=" + baseDelayMs +
               ", maxDelayMs=" + maxDelayMs +
               ", jitter=" + jitter +
               '}';
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private RetryStrategy strategy = RetryStrategy.EXPONENTIAL;
        private long baseDelayMs = DEFAULT_BASE_DELAY_MS;
        private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
        private boolean jitter = true;
        private List<String> retryablePatterns = new ArrayList<>(DEFAULT_RETRYABLE_PATTERNS);
        private List<Pattern> retryableRegexes = new ArrayList<>();

        public Builder() {
        }

        public Builder(RetryPolicy existing) {
            this.maxRetries = existing.maxRetries;
            this.strategy = existing.strategy;
            this.baseDelayMs = existing.baseDelayMs;
            this.maxDelayMs = existing.maxDelayMs;
            this.jitter = existing.jitter;
            this.retryablePatterns = new ArrayList<>(existing.retryablePatterns);
            this.retryableRegexes = new ArrayList<>(existing.retryableRegexes);
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder strategy(RetryStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder baseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
            return this;
        }

        public Builder maxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * Replace the substring patterns.
         */
        public Builder retryablePatterns(List<String> patterns) {
            this.retryablePatterns = new ArrayList<>(Objects.requireNonNull(patterns, "Patterns cannot be null"));
            return this;
        }

        public Builder addRetryablePattern(String pattern) {
            this.retryablePatterns.add(Objects.requireNonNull(pattern, "Pattern cannot be null"));
            return this;
        }

        public Builder addRetryableRegex(String regex) {
            this.retryableRegexes.add(Pattern.compile(regex));
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
