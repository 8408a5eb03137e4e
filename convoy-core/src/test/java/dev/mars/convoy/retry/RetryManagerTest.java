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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RetryManager}: classification, backoff shapes and the retrying wrapper.
 */
class RetryManagerTest {

    private static RetryPolicy.Builder fast() {
        return RetryPolicy.builder().baseDelayMs(1).maxDelayMs(5).jitter(false);
    }

    @Nested
    @DisplayName("getDelay")
    class Delays {

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 2, 5})
        @DisplayName("fixed strategy always returns the base delay")
        void fixedDelay(int retryCount) {
            RetryManager manager = new RetryManager(RetryPolicy.builder()
                    .strategy(RetryStrategy.FIXED).baseDelayMs(2000).jitter(false).build());

            assertThat(manager.getDelay(retryCount)).isEqualTo(2000);
        }

        @Test
        @DisplayName("linear strategy grows by the base delay")
        void linearDelay() {
            RetryManager manager = new RetryManager(RetryPolicy.builder()
                    .strategy(RetryStrategy.LINEAR).baseDelayMs(1000).jitter(false).build());

            assertThat(manager.getDelay(0)).isEqualTo(1000);
            assertThat(manager.getDelay(2)).isEqualTo(3000);
        }

        @Test
        @DisplayName("exponential strategy doubles without jitter")
        void exponentialWithoutJitter() {
            RetryManager manager = new RetryManager(RetryPolicy.builder()
                    .strategy(RetryStrategy.EXPONENTIAL).baseDelayMs(1000).jitter(false).build());

            assertThat(manager.getDelay(2)).isEqualTo(4000);
        }

        @Test
        @DisplayName("exponential strategy stays within twenty percent with jitter")
        void exponentialWithJitter() {
            RetryManager manager = new RetryManager(RetryPolicy.builder()
                    .strategy(RetryStrategy.EXPONENTIAL).baseDelayMs(1000).jitter(true).build());

            for (int i = 0; i < 200; i++) {
                assertThat(manager.getDelay(2)).isBetween(3200L, 4800L);
            }
        }

        @Test
        @DisplayName("delays are capped at the maximum")
        void cappedDelay() {
            RetryManager manager = new RetryManager(RetryPolicy.builder()
                    .strategy(RetryStrategy.EXPONENTIAL).baseDelayMs(1000).maxDelayMs(5000).jitter(false).build());

            assertThat(manager.getDelay(10)).isEqualTo(5000);
        }
    }

    @Nested
    @DisplayName("shouldRetry")
    class Classification {

        private final RetryManager manager = new RetryManager(RetryPolicy.builder().maxRetries(3).build());

        @Test
        void retriesMatchingErrorsWithinBudget() {
            assertThat(manager.shouldRetry("Navigation timeout of 30000 ms exceeded", 0)).isTrue();
            assertThat(manager.shouldRetry("net::ERR_CONNECTION_RESET", 2)).isTrue();
            assertThat(manager.shouldRetry(new IOException("Target closed"), 1)).isTrue();
        }

        @Test
        void neverRetriesOnceBudgetIsSpent() {
            assertThat(manager.shouldRetry("timeout", 3)).isFalse();
            assertThat(manager.shouldRetry("timeout", 4)).isFalse();
        }

        @Test
        void ignoresNonMatchingErrors() {
            assertThat(manager.shouldRetry("Invalid selector", 0)).isFalse();
            assertThat(manager.shouldRetry((String) null, 0)).isFalse();
        }

        @Test
        void noneStrategyNeverRetries() {
            RetryManager none = new RetryManager(RetryPolicy.none());

            assertThat(none.shouldRetry("timeout", 0)).isFalse();
        }

        @Test
        void regexPatternsAreMatched() {
            RetryManager custom = new RetryManager(RetryPolicy.builder()
                    .retryablePatterns(List.of())
                    .addRetryableRegex("HTTP 5\\d\\d")
                    .build());

            assertThat(custom.shouldRetry("Upstream returned HTTP 503", 0)).isTrue();
            assertThat(custom.shouldRetry("Upstream returned HTTP 404", 0)).isFalse();
        }
    }

    @Nested
    @DisplayName("execute")
    class Execute {

        @Test
        void retriesUntilSuccess() throws Exception {
            RetryManager manager = new RetryManager(fast().maxRetries(3).build());
            AtomicInteger attempts = new AtomicInteger();
            List<Integer> retries = new ArrayList<>();

            String result = manager.execute(() -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new IOException("ECONNRESET");
                }
                return "done";
            }, new RetryListener() {
                @Override
                public void onRetry(Exception error, int retryCount, int maxRetries, long delayMs) {
                    retries.add(retryCount);
                }
            });

            assertThat(result).isEqualTo("done");
            assertThat(attempts.get()).isEqualTo(3);
            assertThat(retries).hasSize(2);
        }

        @Test
        void rethrowsNonRetryableErrorsImmediately() {
            RetryManager manager = new RetryManager(fast().maxRetries(3).build());
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> manager.execute(() -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("bad selector");
            })).isInstanceOf(IllegalStateException.class).hasMessage("bad selector");
            assertThat(attempts.get()).isEqualTo(1);
        }

        @Test
        void rethrowsAfterExhaustingRetries() {
            RetryManager manager = new RetryManager(fast().maxRetries(2).build());
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> manager.execute(() -> {
                attempts.incrementAndGet();
                throw new IOException("timeout");
            })).isInstanceOf(IOException.class);
            assertThat(attempts.get()).isEqualTo(3);
        }
    }

    @Test
    void retryInfoDescribesRemainingAttempts() {
        RetryManager manager = new RetryManager(RetryPolicy.builder()
                .maxRetries(3).strategy(RetryStrategy.EXPONENTIAL).baseDelayMs(1000).jitter(false).build());

        RetryInfo info = manager.getRetryInfo(1);

        assertThat(info.currentRetry()).isEqualTo(1);
        assertThat(info.maxRetries()).isEqualTo(3);
        assertThat(info.willRetry()).isTrue();
        assertThat(info.nextDelayMs()).isEqualTo(2000L);
        assertThat(info.allDelaysMs()).containsExactly(1000L, 2000L, 4000L);

        assertThat(manager.getRetryInfo(3).willRetry()).isFalse();
    }

    @Test
    void presetsResolveByName() {
        assertThat(RetryPolicy.preset("aggressive").getMaxRetries()).isEqualTo(5);
        assertThat(RetryPolicy.preset("conservative").getStrategy()).isEqualTo(RetryStrategy.LINEAR);
        assertThat(RetryPolicy.preset("none").getMaxRetries()).isZero();
    }
}
