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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Decides whether a failure is worth retrying and how long to wait before the next attempt.
 * <p>
 * The policy may be swapped with {@link #updatePolicy(RetryPolicy)}; a running parallel
 * execution reads it but never writes it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class RetryManager {

    private static final Logger logger = LoggerFactory.getLogger(RetryManager.class);

    private static final double JITTER_RATIO = 0.2;

    private volatile RetryPolicy policy;
    private final Random random;

    public RetryManager() {
        this(RetryPolicy.defaults());
    }

    public RetryManager(RetryPolicy policy) {
        this(policy, new Random());
    }

    public RetryManager(RetryPolicy policy, Random random) {
        this.policy = Objects.requireNonNull(policy, "Retry policy cannot be null");
        this.random = Objects.requireNonNull(random, "Random cannot be null");
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public void updatePolicy(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Retry policy cannot be null");
        logger.debug("Retry policy updated: {}", policy);
    }

    /**
     * False once {@code retryCount} reaches the budget or the strategy is NONE; otherwise
     * true iff the error message matches a retryable pattern.
     */
    public boolean shouldRetry(Throwable error, int retryCount) {
        return shouldRetry(messageOf(error), retryCount);
    }

    public boolean shouldRetry(String errorMessage, int retryCount) {
        RetryPolicy current = policy;
        if (retryCount >= current.getMaxRetries()) {
            return false;
        }
        if (current.getStrategy() == RetryStrategy.NONE) {
            return false;
        }
        return current.matches(errorMessage);
    }

    public boolean isRetryableError(String errorMessage) {
        return policy.matches(errorMessage);
    }

    /**
     * Backoff delay before retry number {@code retryCount + 1}, capped at the policy maximum
     * and jittered by up to 20% either way when jitter is enabled.
     */
    public long getDelay(int retryCount) {
        RetryPolicy current = policy;
        double delay;
        switch (current.getStrategy()) {
            case NONE:
                return 0;
            case FIXED:
                delay = current.getBaseDelayMs();
                break;
            case LINEAR:
                delay = (double) current.getBaseDelayMs() * (retryCount + 1);
                break;
            case EXPONENTIAL:
            default:
                delay = current.getBaseDelayMs() * Math.pow(2, retryCount);
                break;
        }

        delay = Math.min(delay, current.getMaxDelayMs());

        if (current.isJitter()) {
            double jitterRange = delay * JITTER_RATIO;
            delay += (random.nextDouble() * jitterRange * 2) - jitterRange;
        }

        return Math.round(delay);
    }

    public RetryInfo getRetryInfo(int retryCount) {
        RetryPolicy current = policy;
        List<Long> delays = new ArrayList<>();
        for (int i = 0; i < current.getMaxRetries(); i++) {
            delays.add(getDelay(i));
        }
        boolean willRetry = retryCount < current.getMaxRetries();
        return new RetryInfo(
                retryCount,
                current.getMaxRetries(),
                current.getStrategy(),
                willRetry ? getDelay(retryCount) : null,
                delays,
                willRetry);
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        return execute(operation, new RetryListener() {
        });
    }

    /**
     * Invoke {@code operation}, retrying retryable failures with backoff until the budget runs out.
     * The last failure is rethrown unchanged.
     */
    public <T> T execute(Callable<T> operation, RetryListener listener) throws Exception {
        Objects.requireNonNull(operation, "Operation cannot be null");
        Objects.requireNonNull(listener, "Listener cannot be null");

        int retryCount = 0;
        while (true) {
            try {
                return operation.call();
            } catch (Exception e) {
                listener.onError(e, retryCount);

                if (!shouldRetry(e, retryCount)) {
                    throw e;
                }

                long delay = getDelay(retryCount);
                logger.warn("Attempt {} failed, retrying in {}ms: {}", retryCount + 1, delay, e.getMessage());
                listener.onRetry(e, retryCount + 1, policy.getMaxRetries(), delay);

                sleep(delay);
                retryCount++;
            }
        }
    }

    /**
     * Wrap a callable so every call goes through {@link #execute(Callable, RetryListener)}.
     */
    public <T> Callable<T> wrap(Callable<T> operation, RetryListener listener) {
        return () -> execute(operation, listener);
    }

    static String messageOf(Throwable error) {
        if (error == null) {
            return "";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }

    private static void sleep(long delayMs) throws InterruptedException {
        if (delayMs > 0) {
            TimeUnit.MILLISECONDS.sleep(delayMs);
        }
    }

    @Override
    public String toString() {
        return "RetryManager{policy=" + policy + '}';
    }
}
