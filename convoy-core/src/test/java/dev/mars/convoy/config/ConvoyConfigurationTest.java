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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ConvoyConfiguration.
 * Validates defaults, explicit properties, system property overrides and malformed values.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
class ConvoyConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(ConvoyConfiguration.PARALLEL_MAX_CONCURRENT);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaults() {
        ConvoyConfiguration config = new ConvoyConfiguration(new Properties());

        assertEquals(3, config.getMaxConcurrent());
        assertEquals(1000, config.getDelayBetweenMs());
        assertEquals(300000, config.getExecutionTimeoutMs());
        assertFalse(config.isStopOnError());
        assertEquals(QueueMode.FIFO, config.getQueueMode());
        assertEquals(500, config.getPausePollMs());
        assertEquals(100, config.getWhileMaxIterations());
        assertEquals(10000, config.getLoopHardLimit());
        assertEquals(10, config.getCallMaxDepth());
        assertEquals(60000, config.getSchedulerCheckIntervalMs());
        assertEquals(Paths.get("./data"), config.getDataDirectory());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testDefaultRetryPolicy() {
        RetryPolicy policy = new ConvoyConfiguration(new Properties()).getRetryPolicy();

        assertEquals(3, policy.getMaxRetries());
        assertEquals(RetryStrategy.EXPONENTIAL, policy.getStrategy());
        assertEquals(1000, policy.getBaseDelayMs());
        assertEquals(60000, policy.getMaxDelayMs());
        assertTrue(policy.isJitter());
    }

    // ========== Custom Properties Tests ==========

    @Test
    void testCustomProperties() {
        Properties properties = new Properties();
        properties.setProperty(ConvoyConfiguration.PARALLEL_MAX_CONCURRENT, "7");
        properties.setProperty(ConvoyConfiguration.PARALLEL_QUEUE_MODE, "priority");
        properties.setProperty(ConvoyConfiguration.RETRY_STRATEGY, "linear");
        properties.setProperty(ConvoyConfiguration.RETRY_JITTER, "false");

        ConvoyConfiguration config = new ConvoyConfiguration(properties);

        assertEquals(7, config.getMaxConcurrent());
        assertEquals(QueueMode.PRIORITY, config.getQueueMode());
        assertEquals(RetryStrategy.LINEAR, config.getRetryPolicy().getStrategy());
        assertFalse(config.getRetryPolicy().isJitter());
    }

    @Test
    void testMalformedValuesFallBackToDefaults() {
        Properties properties = new Properties();
        properties.setProperty(ConvoyConfiguration.PARALLEL_MAX_CONCURRENT, "lots");
        properties.setProperty(ConvoyConfiguration.PARALLEL_TIMEOUT_MS, "soon");
        properties.setProperty(ConvoyConfiguration.PARALLEL_QUEUE_MODE, "sideways");
        properties.setProperty(ConvoyConfiguration.RETRY_STRATEGY, "sometimes");

        ConvoyConfiguration config = new ConvoyConfiguration(properties);

        assertEquals(3, config.getMaxConcurrent());
        assertEquals(300000, config.getExecutionTimeoutMs());
        assertEquals(QueueMode.FIFO, config.getQueueMode());
        assertEquals(RetryStrategy.EXPONENTIAL, config.getRetryPolicy().getStrategy());
    }

    @Test
    void testMaxConcurrentIsAtLeastOne() {
        Properties properties = new Properties();
        properties.setProperty(ConvoyConfiguration.PARALLEL_MAX_CONCURRENT, "0");

        assertEquals(1, new ConvoyConfiguration(properties).getMaxConcurrent());
    }

    // ========== Override Tests ==========

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(ConvoyConfiguration.PARALLEL_MAX_CONCURRENT, "9");

        ConvoyConfiguration config = new ConvoyConfiguration();

        assertEquals(9, config.getMaxConcurrent());
    }

    @Test
    void testSetProperty() {
        ConvoyConfiguration config = new ConvoyConfiguration(new Properties());
        config.setProperty(ConvoyConfiguration.LOOP_HARD_LIMIT, "50");

        assertEquals(50, config.getLoopHardLimit());
        assertEquals("50", config.getProperty(ConvoyConfiguration.LOOP_HARD_LIMIT));
        assertEquals("fallback", config.getProperty("convoy.unknown", "fallback"));
    }
}
