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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the Sequor engine.
 * Values are layered: built-in defaults, then the first readable properties file,
 * then a classpath {@code sequor.properties}, then system properties starting with {@code sequor.}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class SequorConfiguration {
    private static final Logger logger = Logger.getLogger(SequorConfiguration.class.getName());

    public static final String ENGINE_MAX_CONCURRENT = "sequor.engine.max.concurrent";
    public static final String ENGINE_DEFAULT_STRATEGY = "sequor.engine.default.strategy";
    public static final String ENGINE_DEFAULT_TIMEOUT_MS = "sequor.engine.default.timeout.ms";
    public static final String ENGINE_MAX_RETRIES = "sequor.engine.max.retries";
    public static final String ENGINE_RETRY_DELAY_MS = "sequor.engine.retry.delay.ms";
    public static final String ENGINE_WORKER_THREADS = "sequor.engine.worker.threads";
    public static final String QUEUE_MAX_SIZE = "sequor.queue.max.size";
    public static final String SCHEDULER_POOL_CPU = "sequor.scheduler.pool.cpu";
    public static final String SCHEDULER_POOL_MEMORY_MB = "sequor.scheduler.pool.memory.mb";
    public static final String SCHEDULER_POOL_DISK_MB = "sequor.scheduler.pool.disk.mb";
    public static final String RESOURCE_MAX_MEMORY_MB = "sequor.resource.max.memory.mb";
    public static final String RESOURCE_MAX_CPU_PERCENT = "sequor.resource.max.cpu.percent";
    public static final String RESOURCE_MAX_CONCURRENT = "sequor.resource.max.concurrent";
    public static final String RESOURCE_TIMEOUT_MS = "sequor.resource.timeout.ms";
    public static final String RESOURCE_MONITOR_INTERVAL_MS = "sequor.resource.monitor.interval.ms";
    public static final String CACHE_ENABLED = "sequor.cache.enabled";
    public static final String CACHE_MAX_SIZE = "sequor.cache.max.size";
    public static final String CACHE_TTL_MS = "sequor.cache.ttl.ms";
    public static final String CACHE_CLEANUP_INTERVAL_MS = "sequor.cache.cleanup.interval.ms";
    public static final String CACHE_MIN_SIZE_BYTES = "sequor.cache.min.size.bytes";
    public static final String CACHE_MIN_COMPLEXITY = "sequor.cache.min.complexity";
    public static final String METRICS_RETENTION_MS = "sequor.metrics.retention.ms";
    public static final String METRICS_MAX_HISTORY = "sequor.metrics.max.history";
    public static final String METRICS_COLLECTION_INTERVAL_MS = "sequor.metrics.collection.interval.ms";
    public static final String MONITOR_EXECUTION_TIME_THRESHOLD_MS = "sequor.monitor.execution.time.threshold.ms";
    public static final String MONITOR_STALL_TIMEOUT_MS = "sequor.monitor.stall.timeout.ms";
    public static final String MONITOR_MEMORY_THRESHOLD_PERCENT = "sequor.monitor.memory.threshold.percent";
    public static final String MONITOR_CPU_THRESHOLD_PERCENT = "sequor.monitor.cpu.threshold.percent";
    public static final String MONITOR_ERROR_RATE_THRESHOLD = "sequor.monitor.error.rate.threshold";
    public static final String MONITOR_QUEUE_SIZE_THRESHOLD = "sequor.monitor.queue.size.threshold";
    public static final String MONITOR_MAX_ALERTS = "sequor.monitor.max.alerts";
    public static final String OPTIMIZATION_ENABLED = "sequor.optimization.enabled";
    public static final String PREDICTION_ENABLED = "sequor.prediction.enabled";

    // Default configuration values
    private static final int DEFAULT_MAX_CONCURRENT = 10;
    private static final String DEFAULT_STRATEGY = "basic";
    private static final long DEFAULT_TIMEOUT_MS = 300000;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 5000;
    private static final int DEFAULT_WORKER_THREADS = 10;
    private static final int DEFAULT_QUEUE_MAX_SIZE = 100;
    private static final double DEFAULT_POOL_CPU = 100;
    private static final long DEFAULT_POOL_MEMORY_MB = 8192;
    private static final long DEFAULT_POOL_DISK_MB = 100000;
    private static final long DEFAULT_RESOURCE_MAX_MEMORY_MB = 512;
    private static final double DEFAULT_RESOURCE_MAX_CPU_PERCENT = 80;
    private static final int DEFAULT_RESOURCE_MAX_CONCURRENT = 5;
    private static final long DEFAULT_RESOURCE_TIMEOUT_MS = 300000;
    private static final long DEFAULT_RESOURCE_MONITOR_INTERVAL_MS = 5000;
    private static final int DEFAULT_CACHE_MAX_SIZE = 1000;
    private static final long DEFAULT_CACHE_TTL_MS = 3600000; // 1 hour
    private static final long DEFAULT_CACHE_CLEANUP_INTERVAL_MS = 300000;
    private static final int DEFAULT_CACHE_MIN_SIZE_BYTES = 100;
    private static final int DEFAULT_CACHE_MIN_COMPLEXITY = 1;
    private static final long DEFAULT_METRICS_RETENTION_MS = 86400000; // 24 hours
    private static final int DEFAULT_METRICS_MAX_HISTORY = 10000;
    private static final long DEFAULT_METRICS_COLLECTION_INTERVAL_MS = 10000;
    private static final long DEFAULT_MONITOR_EXECUTION_TIME_THRESHOLD_MS = 300000;
    private static final long DEFAULT_MONITOR_STALL_TIMEOUT_MS = 300000;
    private static final double DEFAULT_MONITOR_MEMORY_THRESHOLD = 80;
    private static final double DEFAULT_MONITOR_CPU_THRESHOLD = 90;
    private static final double DEFAULT_MONITOR_ERROR_RATE_THRESHOLD = 0.1;
    private static final int DEFAULT_MONITOR_QUEUE_SIZE_THRESHOLD = 50;
    private static final int DEFAULT_MONITOR_MAX_ALERTS = 100;

    private final Properties properties;

    public SequorConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public SequorConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Engine Configuration
    public int getMaxConcurrentExecutions() {
        return getIntProperty(ENGINE_MAX_CONCURRENT, DEFAULT_MAX_CONCURRENT);
    }

    public String getDefaultStrategy() {
        return getStringProperty(ENGINE_DEFAULT_STRATEGY, DEFAULT_STRATEGY);
    }

    public long getDefaultTimeoutMs() {
        return getLongProperty(ENGINE_DEFAULT_TIMEOUT_MS, DEFAULT_TIMEOUT_MS);
    }

    public int getMaxRetries() {
        return getIntProperty(ENGINE_MAX_RETRIES, DEFAULT_MAX_RETRIES);
    }

    public long getRetryDelayMs() {
        return getLongProperty(ENGINE_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS);
    }

    public int getWorkerThreads() {
        return getIntProperty(ENGINE_WORKER_THREADS, DEFAULT_WORKER_THREADS);
    }

    // Queue and Scheduler Configuration
    public int getQueueMaxSize() {
        return getIntProperty(QUEUE_MAX_SIZE, DEFAULT_QUEUE_MAX_SIZE);
    }

    public double getSchedulerPoolCpu() {
        return getDoubleProperty(SCHEDULER_POOL_CPU, DEFAULT_POOL_CPU);
    }

    public long getSchedulerPoolMemoryMb() {
        return getLongProperty(SCHEDULER_POOL_MEMORY_MB, DEFAULT_POOL_MEMORY_MB);
    }

    public long getSchedulerPoolDiskMb() {
        return getLongProperty(SCHEDULER_POOL_DISK_MB, DEFAULT_POOL_DISK_MB);
    }

    // Resource Configuration
    public long getResourceMaxMemoryMb() {
        return getLongProperty(RESOURCE_MAX_MEMORY_MB, DEFAULT_RESOURCE_MAX_MEMORY_MB);
    }

    public double getResourceMaxCpuPercent() {
        return getDoubleProperty(RESOURCE_MAX_CPU_PERCENT, DEFAULT_RESOURCE_MAX_CPU_PERCENT);
    }

    public int getResourceMaxConcurrent() {
        return getIntProperty(RESOURCE_MAX_CONCURRENT, DEFAULT_RESOURCE_MAX_CONCURRENT);
    }

    public long getResourceTimeoutMs() {
        return getLongProperty(RESOURCE_TIMEOUT_MS, DEFAULT_RESOURCE_TIMEOUT_MS);
    }

    public long getResourceMonitorIntervalMs() {
        return getLongProperty(RESOURCE_MONITOR_INTERVAL_MS, DEFAULT_RESOURCE_MONITOR_INTERVAL_MS);
    }

    // Cache Configuration
    public boolean isCacheEnabled() {
        return getBooleanProperty(CACHE_ENABLED, true);
    }

    public int getCacheMaxSize() {
        return getIntProperty(CACHE_MAX_SIZE, DEFAULT_CACHE_MAX_SIZE);
    }

    public long getCacheTtlMs() {
        return getLongProperty(CACHE_TTL_MS, DEFAULT_CACHE_TTL_MS);
    }

    public long getCacheCleanupIntervalMs() {
        return getLongProperty(CACHE_CLEANUP_INTERVAL_MS, DEFAULT_CACHE_CLEANUP_INTERVAL_MS);
    }

    public int getCacheMinSizeBytes() {
        return getIntProperty(CACHE_MIN_SIZE_BYTES, DEFAULT_CACHE_MIN_SIZE_BYTES);
    }

    public int getCacheMinComplexity() {
        return getIntProperty(CACHE_MIN_COMPLEXITY, DEFAULT_CACHE_MIN_COMPLEXITY);
    }

    // Metrics and Monitoring Configuration
    public long getMetricsRetentionMs() {
        return getLongProperty(METRICS_RETENTION_MS, DEFAULT_METRICS_RETENTION_MS);
    }

    public int getMetricsMaxHistory() {
        return getIntProperty(METRICS_MAX_HISTORY, DEFAULT_METRICS_MAX_HISTORY);
    }

    public long getMetricsCollectionIntervalMs() {
        return getLongProperty(METRICS_COLLECTION_INTERVAL_MS, DEFAULT_METRICS_COLLECTION_INTERVAL_MS);
    }

    public long getMonitorExecutionTimeThresholdMs() {
        return getLongProperty(MONITOR_EXECUTION_TIME_THRESHOLD_MS, DEFAULT_MONITOR_EXECUTION_TIME_THRESHOLD_MS);
    }

    public long getMonitorStallTimeoutMs() {
        return getLongProperty(MONITOR_STALL_TIMEOUT_MS, DEFAULT_MONITOR_STALL_TIMEOUT_MS);
    }

    public double getMonitorMemoryThresholdPercent() {
        return getDoubleProperty(MONITOR_MEMORY_THRESHOLD_PERCENT, DEFAULT_MONITOR_MEMORY_THRESHOLD);
    }

    public double getMonitorCpuThresholdPercent() {
        return getDoubleProperty(MONITOR_CPU_THRESHOLD_PERCENT, DEFAULT_MONITOR_CPU_THRESHOLD);
    }

    public double getMonitorErrorRateThreshold() {
        return getDoubleProperty(MONITOR_ERROR_RATE_THRESHOLD, DEFAULT_MONITOR_ERROR_RATE_THRESHOLD);
    }

    public int getMonitorQueueSizeThreshold() {
        return getIntProperty(MONITOR_QUEUE_SIZE_THRESHOLD, DEFAULT_MONITOR_QUEUE_SIZE_THRESHOLD);
    }

    public int getMonitorMaxAlerts() {
        return getIntProperty(MONITOR_MAX_ALERTS, DEFAULT_MONITOR_MAX_ALERTS);
    }

    // Learning Configuration
    public boolean isOptimizationEnabled() {
        return getBooleanProperty(OPTIMIZATION_ENABLED, true);
    }

    public boolean isPredictionEnabled() {
        return getBooleanProperty(PREDICTION_ENABLED, true);
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

    /**
     * Copy of the effective properties.
     */
    public Properties toProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
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
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid decimal value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
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
        properties.setProperty(ENGINE_MAX_CONCURRENT, String.valueOf(DEFAULT_MAX_CONCURRENT));
        properties.setProperty(ENGINE_DEFAULT_STRATEGY, DEFAULT_STRATEGY);
        properties.setProperty(ENGINE_DEFAULT_TIMEOUT_MS, String.valueOf(DEFAULT_TIMEOUT_MS));
        properties.setProperty(ENGINE_MAX_RETRIES, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(ENGINE_RETRY_DELAY_MS, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(ENGINE_WORKER_THREADS, String.valueOf(DEFAULT_WORKER_THREADS));
        properties.setProperty(QUEUE_MAX_SIZE, String.valueOf(DEFAULT_QUEUE_MAX_SIZE));
        properties.setProperty(SCHEDULER_POOL_CPU, String.valueOf(DEFAULT_POOL_CPU));
        properties.setProperty(SCHEDULER_POOL_MEMORY_MB, String.valueOf(DEFAULT_POOL_MEMORY_MB));
        properties.setProperty(SCHEDULER_POOL_DISK_MB, String.valueOf(DEFAULT_POOL_DISK_MB));
        properties.setProperty(RESOURCE_MAX_MEMORY_MB, String.valueOf(DEFAULT_RESOURCE_MAX_MEMORY_MB));
        properties.setProperty(RESOURCE_MAX_CPU_PERCENT, String.valueOf(DEFAULT_RESOURCE_MAX_CPU_PERCENT));
        properties.setProperty(RESOURCE_MAX_CONCURRENT, String.valueOf(DEFAULT_RESOURCE_MAX_CONCURRENT));
        properties.setProperty(RESOURCE_TIMEOUT_MS, String.valueOf(DEFAULT_RESOURCE_TIMEOUT_MS));
        properties.setProperty(RESOURCE_MONITOR_INTERVAL_MS, String.valueOf(DEFAULT_RESOURCE_MONITOR_INTERVAL_MS));
        properties.setProperty(CACHE_ENABLED, "true");
        properties.setProperty(CACHE_MAX_SIZE, String.valueOf(DEFAULT_CACHE_MAX_SIZE));
        properties.setProperty(CACHE_TTL_MS, String.valueOf(DEFAULT_CACHE_TTL_MS));
        properties.setProperty(CACHE_CLEANUP_INTERVAL_MS, String.valueOf(DEFAULT_CACHE_CLEANUP_INTERVAL_MS));
        properties.setProperty(CACHE_MIN_SIZE_BYTES, String.valueOf(DEFAULT_CACHE_MIN_SIZE_BYTES));
        properties.setProperty(CACHE_MIN_COMPLEXITY, String.valueOf(DEFAULT_CACHE_MIN_COMPLEXITY));
        properties.setProperty(METRICS_RETENTION_MS, String.valueOf(DEFAULT_METRICS_RETENTION_MS));
        properties.setProperty(METRICS_MAX_HISTORY, String.valueOf(DEFAULT_METRICS_MAX_HISTORY));
        properties.setProperty(METRICS_COLLECTION_INTERVAL_MS, String.valueOf(DEFAULT_METRICS_COLLECTION_INTERVAL_MS));
        properties.setProperty(MONITOR_EXECUTION_TIME_THRESHOLD_MS, String.valueOf(DEFAULT_MONITOR_EXECUTION_TIME_THRESHOLD_MS));
        properties.setProperty(MONITOR_STALL_TIMEOUT_MS, String.valueOf(DEFAULT_MONITOR_STALL_TIMEOUT_MS));
        properties.setProperty(MONITOR_MEMORY_THRESHOLD_PERCENT, String.valueOf(DEFAULT_MONITOR_MEMORY_THRESHOLD));
        properties.setProperty(MONITOR_CPU_THRESHOLD_PERCENT, String.valueOf(DEFAULT_MONITOR_CPU_THRESHOLD));
        properties.setProperty(MONITOR_ERROR_RATE_THRESHOLD, String.valueOf(DEFAULT_MONITOR_ERROR_RATE_THRESHOLD));
        properties.setProperty(MONITOR_QUEUE_SIZE_THRESHOLD, String.valueOf(DEFAULT_MONITOR_QUEUE_SIZE_THRESHOLD));
        properties.setProperty(MONITOR_MAX_ALERTS, String.valueOf(DEFAULT_MONITOR_MAX_ALERTS));
        properties.setProperty(OPTIMIZATION_ENABLED, "true");
        properties.setProperty(PREDICTION_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "sequor.properties",
                "config/sequor.properties",
                System.getProperty("user.home") + "/.sequor/sequor.properties",
                "/etc/sequor/sequor.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    break;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("sequor.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("sequor."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "SequorConfiguration{" +
                "maxConcurrentExecutions=" + getMaxConcurrentExecutions() +
                ", defaultStrategy='" + getDefaultStrategy() + '\'' +
                ", maxRetries=" + getMaxRetries() +
                ", cacheEnabled=" + isCacheEnabled() +
                '}';
    }
}
