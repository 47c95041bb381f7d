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

package dev.mars.sequor.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for SequorConfiguration.
 * Validates default values, overrides and type conversion.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
class SequorConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("sequor.engine.max.retries");
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testEngineDefaults() {
        SequorConfiguration config = new SequorConfiguration(new Properties());

        assertEquals(10, config.getMaxConcurrentExecutions());
        assertEquals("basic", config.getDefaultStrategy());
        assertEquals(300000, config.getDefaultTimeoutMs());
        assertEquals(3, config.getMaxRetries());
        assertEquals(5000, config.getRetryDelayMs());
        assertEquals(100, config.getQueueMaxSize());
    }

    @Test
    void testResourceDefaults() {
        SequorConfiguration config = new SequorConfiguration(new Properties());

        assertEquals(512, config.getResourceMaxMemoryMb());
        assertEquals(80.0, config.getResourceMaxCpuPercent());
        assertEquals(5, config.getResourceMaxConcurrent());
        assertEquals(100.0, config.getSchedulerPoolCpu());
        assertEquals(8192, config.getSchedulerPoolMemoryMb());
        assertEquals(100000, config.getSchedulerPoolDiskMb());
    }

    @Test
    void testCacheAndMonitorDefaults() {
        SequorConfiguration config = new SequorConfiguration(new Properties());

        assertTrue(config.isCacheEnabled());
        assertEquals(1000, config.getCacheMaxSize());
        assertEquals(3600000, config.getCacheTtlMs());
        assertEquals(100, config.getCacheMinSizeBytes());
        assertEquals(86400000, config.getMetricsRetentionMs());
        assertEquals(0.1, config.getMonitorErrorRateThreshold());
        assertEquals(50, config.getMonitorQueueSizeThreshold());
        assertEquals(100, config.getMonitorMaxAlerts());
    }

    // ========== Override Tests ==========

    @Test
    void testPropertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(SequorConfiguration.ENGINE_DEFAULT_STRATEGY, "smart");
        props.setProperty(SequorConfiguration.RESOURCE_MAX_MEMORY_MB, "1024");
        props.setProperty(SequorConfiguration.CACHE_ENABLED, "false");

        SequorConfiguration config = new SequorConfiguration(props);

        assertEquals("smart", config.getDefaultStrategy());
        assertEquals(1024, config.getResourceMaxMemoryMb());
        assertFalse(config.isCacheEnabled());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty("sequor.engine.max.retries", "7");

        SequorConfiguration config = new SequorConfiguration();

        assertEquals(7, config.getMaxRetries());
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty(SequorConfiguration.QUEUE_MAX_SIZE, "many");
        props.setProperty(SequorConfiguration.CACHE_TTL_MS, "forever");
        props.setProperty(SequorConfiguration.MONITOR_CPU_THRESHOLD_PERCENT, "high");

        SequorConfiguration config = new SequorConfiguration(props);

        assertEquals(100, config.getQueueMaxSize());
        assertEquals(3600000, config.getCacheTtlMs());
        assertEquals(90.0, config.getMonitorCpuThresholdPercent());
    }

    @Test
    void testSetPropertyAndToProperties() {
        SequorConfiguration config = new SequorConfiguration(new Properties());
        config.setProperty("sequor.custom", "value");

        assertEquals("value", config.getProperty("sequor.custom"));
        assertEquals("fallback", config.getProperty("sequor.missing", "fallback"));
        assertEquals("value", config.toProperties().getProperty("sequor.custom"));
    }
}
