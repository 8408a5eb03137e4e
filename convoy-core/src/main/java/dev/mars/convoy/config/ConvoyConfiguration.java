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

package dev.mars.convoy.config;

import dev.mars.convoy.queue.QueueMode;
import dev.mars.convoy.retry.RetryPolicy;
import dev.mars.convoy.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for Convoy.
 * Layers built-in defaults, the first readable {@code convoy.properties} file and
 * {@code convoy.*} system properties, in that order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class ConvoyConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(ConvoyConfiguration.class);

    public static final String PARALLEL_MAX_CONCURRENT = "convoy.parallel.max.concurrent";
    public static final String PARALLEL_DELAY_BETWEEN_MS = "convoy.parallel.delay.between.ms";
    public static final String PARALLEL_TIMEOUT_MS = "convoy.parallel.timeout.ms";
    public static final String PARALLEL_STOP_ON_ERROR = "convoy.parallel.stop.on.error";
    public static final String PARALLEL_QUEUE_MODE = "convoy.parallel.queue.mode";
    public static final String PARALLEL_PAUSE_POLL_MS = "convoy.parallel.pause.poll.ms";
    public static final String RETRY_MAX = "convoy.retry.max";
    public static final String RETRY_STRATEGY = "convoy.retry.strategy";
    public static final String RETRY_BASE_DELAY_MS = "convoy.retry.base.delay.ms";
    public static final String RETRY_MAX_DELAY_MS = "convoy.retry.max.delay.ms";
    public static final String RETRY_JITTER = "convoy.retry.jitter";
    public static final String WHILE_MAX_ITERATIONS = "convoy.workflow.while.max.iterations";
    public static final String LOOP_HARD_LIMIT = "convoy.workflow.loop.hard.limit";
    public static final String CALL_MAX_DEPTH = "convoy.workflow.call.max.depth";
    public static final String SCHEDULER_CHECK_INTERVAL_MS = "convoy.scheduler.check.interval.ms";
    public static final String SCHEDULER_DATA_DIR = "convoy.scheduler.data.dir";
    public static final String METRICS_ENABLED = "convoy.monitoring.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_MAX_CONCURRENT = 3;
    private static final long DEFAULT_DELAY_BETWEEN_MS = 1000;
    private static final long DEFAULT_TIMEOUT_MS = 300000; // 5 minutes
    private static final long DEFAULT_PAUSE_POLL_MS = 500;
    private static final int DEFAULT_WHILE_MAX_ITERATIONS = 100;
    private static final int DEFAULT_LOOP_HARD_LIMIT = 10000;
    private static final int DEFAULT_CALL_MAX_DEPTH = 10;
    private static final long DEFAULT_CHECK_INTERVAL_MS = 60000;
    private static final String DEFAULT_DATA_DIR = "./data";

    private final Properties properties;

    public ConvoyConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public ConvoyConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Parallel execution
    public int getMaxConcurrent() {
        return Math.max(1, getIntProperty(PARALLEL_MAX_CONCURRENT, DEFAULT_MAX_CONCURRENT));
    }

    public long getDelayBetweenMs() {
        return getLongProperty(PARALLEL_DELAY_BETWEEN_MS, DEFAULT_DELAY_BETWEEN_MS);
    }

    public long getExecutionTimeoutMs() {
        return getLongProperty(PARALLEL_TIMEOUT_MS, DEFAULT_TIMEOUT_MS);
    }

    public boolean isStopOnError() {
        return getBooleanProperty(PARALLEL_STOP_ON_ERROR, false);
    }

    public QueueMode getQueueMode() {
        String value = getStringProperty(PARALLEL_QUEUE_MODE, QueueMode.FIFO.getValue());
        try {
            return QueueMode.fromString(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid queue mode for property {}: {}. Using default: fifo", PARALLEL_QUEUE_MODE, value);
            return QueueMode.FIFO;
        }
    }

    public long getPausePollMs() {
        return getLongProperty(PARALLEL_PAUSE_POLL_MS, DEFAULT_PAUSE_POLL_MS);
    }

    // Retry
    public RetryPolicy getRetryPolicy() {
        RetryStrategy strategy;
        String value = getStringProperty(RETRY_STRATEGY, RetryStrategy.EXPONENTIAL.getValue());
        try {
            strategy = RetryStrategy.fromString(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid retry strategy for property {}: {}. Using default: exponential", RETRY_STRATEGY, value);
            strategy = RetryStrategy.EXPONENTIAL;
        }
        return RetryPolicy.builder()
                .maxRetries(getIntProperty(RETRY_MAX, RetryPolicy.DEFAULT_MAX_RETRIES))
                .strategy(strategy)
                .baseDelayMs(getLongProperty(RETRY_BASE_DELAY_MS, RetryPolicy.DEFAULT_BASE_DELAY_MS))
                .maxDelayMs(getLongProperty(RETRY_MAX_DELAY_MS, RetryPolicy.DEFAULT_MAX_DELAY_MS))
                .jitter(getBooleanProperty(RETRY_JITTER, true))
                .build();
    }

    // Workflow engine
    public int getWhileMaxIterations() {
        return getIntProperty(WHILE_MAX_ITERATIONS, DEFAULT_WHILE_MAX_ITERATIONS);
    }

    public int getLoopHardLimit() {
        return getIntProperty(LOOP_HARD_LIMIT, DEFAULT_LOOP_HARD_LIMIT);
    }

    public int getCallMaxDepth() {
        return getIntProperty(CALL_MAX_DEPTH, DEFAULT_CALL_MAX_DEPTH);
    }

    // Scheduler
    public long getSchedulerCheckIntervalMs() {
        return getLongProperty(SCHEDULER_CHECK_INTERVAL_MS, DEFAULT_CHECK_INTERVAL_MS);
    }

    public Path getDataDirectory() {
        return Paths.get(getStringProperty(SCHEDULER_DATA_DIR, DEFAULT_DATA_DIR));
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(PARALLEL_MAX_CONCURRENT, String.valueOf(DEFAULT_MAX_CONCURRENT));
        properties.setProperty(PARALLEL_DELAY_BETWEEN_MS, String.valueOf(DEFAULT_DELAY_BETWEEN_MS));
        properties.setProperty(PARALLEL_TIMEOUT_MS, String.valueOf(DEFAULT_TIMEOUT_MS));
        properties.setProperty(PARALLEL_STOP_ON_ERROR, "false");
        properties.setProperty(PARALLEL_QUEUE_MODE, QueueMode.FIFO.getValue());
        properties.setProperty(PARALLEL_PAUSE_POLL_MS, String.valueOf(DEFAULT_PAUSE_POLL_MS));
        properties.setProperty(RETRY_MAX, String.valueOf(RetryPolicy.DEFAULT_MAX_RETRIES));
        properties.setProperty(RETRY_STRATEGY, RetryStrategy.EXPONENTIAL.getValue());
        properties.setProperty(RETRY_BASE_DELAY_MS, String.valueOf(RetryPolicy.DEFAULT_BASE_DELAY_MS));
        properties.setProperty(RETRY_MAX_DELAY_MS, String.valueOf(RetryPolicy.DEFAULT_MAX_DELAY_MS));
        properties.setProperty(RETRY_JITTER, "true");
        properties.setProperty(WHILE_MAX_ITERATIONS, String.valueOf(DEFAULT_WHILE_MAX_ITERATIONS));
        properties.setProperty(LOOP_HARD_LIMIT, String.valueOf(DEFAULT_LOOP_HARD_LIMIT));
        properties.setProperty(CALL_MAX_DEPTH, String.valueOf(DEFAULT_CALL_MAX_DEPTH));
        properties.setProperty(SCHEDULER_CHECK_INTERVAL_MS, String.valueOf(DEFAULT_CHECK_INTERVAL_MS));
        properties.setProperty(SCHEDULER_DATA_DIR, DEFAULT_DATA_DIR);
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "convoy.properties",
                "config/convoy.properties",
                System.getProperty("user.home") + "/.convoy/convoy.properties",
                "/etc/convoy/convoy.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("convoy.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("convoy."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "ConvoyConfiguration{" +
                "maxConcurrent=" + getMaxConcurrent() +
                ", queueMode=" + getQueueMode() +
                ", retryMax=" + getIntProperty(RETRY_MAX, RetryPolicy.DEFAULT_MAX_RETRIES) +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
