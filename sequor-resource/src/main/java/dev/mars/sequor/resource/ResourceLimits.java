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

package dev.mars.sequor.resource;

import dev.mars.sequor.config.SequorConfiguration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Absolute limits enforced by a {@link ResourceManager}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public final class ResourceLimits {

    private final long maxMemoryMb;
    private final double maxCpuPercent;
    private final int maxConcurrentExecutions;
    private final long timeoutMs;

    private ResourceLimits(Builder builder) {
        if (builder.maxMemoryMb <= 0) {
            throw new IllegalArgumentException("Memory limit must be positive: " + builder.maxMemoryMb);
        }
        if (builder.maxCpuPercent <= 0) {
            throw new IllegalArgumentException("CPU limit must be positive: " + builder.maxCpuPercent);
        }
        if (builder.maxConcurrentExecutions <= 0) {
            throw new IllegalArgumentException("Concurrency limit must be positive: " + builder.maxConcurrentExecutions);
        }
        this.maxMemoryMb = builder.maxMemoryMb;
        this.maxCpuPercent = builder.maxCpuPercent;
        this.maxConcurrentExecutions = builder.maxConcurrentExecutions;
        this.timeoutMs = builder.timeoutMs;
    }

    public static ResourceLimits defaults() {
        return new Builder().build();
    }

    public static ResourceLimits fromConfiguration(SequorConfiguration configuration) {
        return new Builder()
                .maxMemoryMb(configuration.getResourceMaxMemoryMb())
                .maxCpuPercent(configuration.getResourceMaxCpuPercent())
                .maxConcurrentExecutions(configuration.getResourceMaxConcurrent())
                .timeoutMs(configuration.getResourceTimeoutMs())
                .build();
    }

    public long getMaxMemoryMb() {
        return maxMemoryMb;
    }

    public double getMaxCpuPercent() {
        return maxCpuPercent;
    }

    public int getMaxConcurrentExecutions() {
        return maxConcurrentExecutions;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("memory", maxMemoryMb);
        map.put("cpu", maxCpuPercent);
        map.put("concurrent", maxConcurrentExecutions);
        map.put("timeout", timeoutMs);
        return map;
    }

    public Builder toBuilder() {
        return new Builder()
                .maxMemoryMb(maxMemoryMb)
                .maxCpuPercent(maxCpuPercent)
                .maxConcurrentExecutions(maxConcurrentExecutions)
                .timeoutMs(timeoutMs);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ResourceLimits{memory=" + maxMemoryMb + "MB, cpu=" + maxCpuPercent +
               "%, concurrent=" + maxConcurrentExecutions + ", timeout=" + timeoutMs + "ms}";
    }

    public static class Builder {
        private long maxMemoryMb = 512;
        private double maxCpuPercent = 80.0;
        private int maxConcurrentExecutions = 5;
        private long timeoutMs = 300000;

        public Builder maxMemoryMb(long maxMemoryMb) {
            this.maxMemoryMb = maxMemoryMb;
            return this;
        }

        public Builder maxCpuPercent(double maxCpuPercent) {
            this.maxCpuPercent = maxCpuPercent;
            return this;
        }

        public Builder maxConcurrentExecutions(int maxConcurrentExecutions) {
            this.maxConcurrentExecutions = maxConcurrentExecutions;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public ResourceLimits build() {
            return new ResourceLimits(this);
        }
    }
}
