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

package dev.mars.sequor.workflow.monitoring;

import dev.mars.sequor.config.SequorConfiguration;

import java.time.Duration;

/**
 * Alerting thresholds for {@link ExecutionMonitor}.
 */
public class MonitorThresholds {

    private final Duration executionTime;
    private final Duration stallTimeout;
    private final double memoryPercent;
    private final double cpuPercent;
    private final double errorRate;
    private final int queueSize;
    private final int stepErrorCount;
    private final double stepFailureFraction;
    private final double degradationFactor;
    private final int maxAlerts;

    private MonitorThresholds(Builder builder) {
        this.executionTime = builder.executionTime;
        this.stallTimeout = builder.stallTimeout;
        this.memoryPercent = builder.memoryPercent;
        this.cpuPercent = builder.cpuPercent;
        this.errorRate = builder.errorRate;
        this.queueSize = builder.queueSize;
        this.stepErrorCount = builder.stepErrorCount;
        this.stepFailureFraction = builder.stepFailureFraction;
        this.degradationFactor = builder.degradationFactor;
        this.maxAlerts = builder.maxAlerts;
    }

    public static MonitorThresholds defaults() {
        return builder().build();
    }

    public static MonitorThresholds fromConfiguration(SequorConfiguration configuration) {
        return builder()
                .executionTime(Duration.ofMillis(configuration.getMonitorExecutionTimeThresholdMs()))
                .stallTimeout(Duration.ofMillis(configuration.getMonitorStallTimeoutMs()))
                .memoryPercent(configuration.getMonitorMemoryThresholdPercent())
                .cpuPercent(configuration.getMonitorCpuThresholdPercent())
                .errorRate(configuration.getMonitorErrorRateThreshold())
                .queueSize(configuration.getMonitorQueueSizeThreshold())
                .maxAlerts(configuration.getMonitorMaxAlerts())
                .build();
    }

    public Duration getExecutionTime() {
        return executionTime;
    }

    public Duration getStallTimeout() {
        return stallTimeout;
    }

    public double getMemoryPercent() {
        return memoryPercent;
    }

    public double getCpuPercent() {
        return cpuPercent;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public int getQueueSize() {
        return queueSize;
    }

    /**
     * Step failures within one execution that raise an error-threshold alert.
     */
    public int getStepErrorCount() {
        return stepErrorCount;
    }

    public double getStepFailureFraction() {
        return stepFailureFraction;
    }

    /**
     * Fraction above the per-workflow average duration that counts as degradation.
     */
    public double getDegradationFactor() {
        return degradationFactor;
    }

    public int getMaxAlerts() {
        return maxAlerts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration executionTime = Duration.ofMinutes(5);
        private Duration stallTimeout = Duration.ofMinutes(5);
        private double memoryPercent = 80.0;
        private double cpuPercent = 90.0;
        private double errorRate = 0.1;
        private int queueSize = 50;
        private int stepErrorCount = 3;
        private double stepFailureFraction = 0.5;
        private double degradationFactor = 0.3;
        private int maxAlerts = 100;

        public Builder executionTime(Duration executionTime) {
            this.executionTime = executionTime;
            return this;
        }

        public Builder stallTimeout(Duration stallTimeout) {
            this.stallTimeout = stallTimeout;
            return this;
        }

        public Builder memoryPercent(double memoryPercent) {
            this.memoryPercent = memoryPercent;
            return this;
        }

        public Builder cpuPercent(double cpuPercent) {
            this.cpuPercent = cpuPercent;
            return this;
        }

        public Builder errorRate(double errorRate) {
            this.errorRate = errorRate;
            return this;
        }

        public Builder queueSize(int queueSize) {
            this.queueSize = queueSize;
            return this;
        }

        public Builder stepErrorCount(int stepErrorCount) {
            this.stepErrorCount = stepErrorCount;
            return this;
        }

        public Builder stepFailureFraction(double stepFailureFraction) {
            this.stepFailureFraction = stepFailureFraction;
            return this;
        }

        public Builder degradationFactor(double degradationFactor) {
            this.degradationFactor = degradationFactor;
            return this;
        }

        public Builder maxAlerts(int maxAlerts) {
            this.maxAlerts = maxAlerts;
            return this;
        }

        public MonitorThresholds build() {
            if (maxAlerts <= 0) {
                throw new IllegalArgumentException("maxAlerts must be positive");
            }
            if (stepErrorCount <= 0) {
                throw new IllegalArgumentException("stepErrorCount must be positive");
            }
            return new MonitorThresholds(this);
        }
    }
}
