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

package dev.mars.sequor.workflow.optimization;

import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.StepType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Static per-step-type profiles shared by the analyzer and the step optimizer: complexity weights,
 * baseline resources and expected durations, with the parameter adjustments applied to them.
 */
final class StepProfiles {

    static final String PARAM_BATCH_SIZE = "batchSize";
    static final String PARAM_PARALLEL = "parallel";
    static final String PARAM_RETRIES = "retries";
    static final String PARAM_TIMEOUT = "timeout";

    static final long MAX_MEMORY_MB = 1024;
    static final double MAX_CPU_PERCENT = 80;
    static final long MAX_TIMEOUT_MS = 600_000;

    private static final int DEFAULT_COMPLEXITY = 2;
    private static final ResourceEstimate DEFAULT_RESOURCES = new ResourceEstimate(64, 10, 60_000);
    private static final long DEFAULT_DURATION_MS = 30_000;

    private static final Map<StepType, Integer> COMPLEXITY = new EnumMap<>(StepType.class);
    private static final Map<StepType, ResourceEstimate> RESOURCES = new EnumMap<>(StepType.class);
    private static final Map<StepType, Long> DURATIONS = new EnumMap<>(StepType.class);

    static {
        COMPLEXITY.put(StepType.SETUP, 1);
        COMPLEXITY.put(StepType.VALIDATION, 2);
        COMPLEXITY.put(StepType.ANALYSIS, 4);
        COMPLEXITY.put(StepType.PROCESSING, 3);
        COMPLEXITY.put(StepType.TESTING, 3);
        COMPLEXITY.put(StepType.DEPLOYMENT, 4);
        COMPLEXITY.put(StepType.CLEANUP, 1);

        RESOURCES.put(StepType.SETUP, new ResourceEstimate(32, 5, 30_000));
        RESOURCES.put(StepType.ANALYSIS, new ResourceEstimate(128, 20, 300_000));
        RESOURCES.put(StepType.PROCESSING, new ResourceEstimate(256, 30, 180_000));
        RESOURCES.put(StepType.TESTING, new ResourceEstimate(96, 15, 120_000));
        RESOURCES.put(StepType.DEPLOYMENT, new ResourceEstimate(64, 10, 240_000));
        RESOURCES.put(StepType.CLEANUP, new ResourceEstimate(32, 5, 30_000));

        DURATIONS.put(StepType.SETUP, 15_000L);
        DURATIONS.put(StepType.ANALYSIS, 120_000L);
        DURATIONS.put(StepType.PROCESSING, 90_000L);
        DURATIONS.put(StepType.TESTING, 60_000L);
        DURATIONS.put(StepType.DEPLOYMENT, 180_000L);
        DURATIONS.put(StepType.CLEANUP, 15_000L);
    }

    private StepProfiles() {
    }

    /**
     * Type weight plus log10(batchSize), one for parallel and half a point per retry, rounded.
     */
    static long complexity(StepMetadata metadata) {
        double complexity = COMPLEXITY.getOrDefault(metadata.getType(), DEFAULT_COMPLEXITY);
        long batchSize = metadata.getLongParameter(PARAM_BATCH_SIZE, 0);
        if (batchSize > 0) {
            complexity += Math.log10(batchSize);
        }
        if (metadata.getBooleanParameter(PARAM_PARALLEL)) {
            complexity += 1;
        }
        long retries = metadata.getLongParameter(PARAM_RETRIES, 0);
        if (retries > 0) {
            complexity += retries * 0.5;
        }
        return Math.round(complexity);
    }

    /**
     * Baseline for the step type, scaled for batch size and parallelism and capped.
     */
    static ResourceEstimate resources(StepMetadata metadata) {
        ResourceEstimate base = RESOURCES.getOrDefault(metadata.getType(), DEFAULT_RESOURCES);
        long memory = base.getMemoryMb();
        double cpu = base.getCpuPercent();
        long timeout = base.getTimeoutMs();

        long batchSize = metadata.getLongParameter(PARAM_BATCH_SIZE, 0);
        if (batchSize > 0) {
            memory = Math.min(memory * (long) Math.ceil(batchSize / 100.0), MAX_MEMORY_MB);
        }
        if (metadata.getBooleanParameter(PARAM_PARALLEL)) {
            cpu = Math.min(cpu * 2, MAX_CPU_PERCENT);
        }
        long requestedTimeout = metadata.getLongParameter(PARAM_TIMEOUT, 0);
        if (requestedTimeout > 0) {
            timeout = Math.min(requestedTimeout, MAX_TIMEOUT_MS);
        }
        return new ResourceEstimate(memory, cpu, timeout);
    }

    static long longValue(Object value, long defaultValue) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    static long expectedDurationMs(StepType type) {
        return DURATIONS.getOrDefault(type, DEFAULT_DURATION_MS);
    }

    /**
     * Rough load figure: batch size in hundreds, ×1.5 when parallel, plus the timeout in minutes.
     */
    static long resourceIntensity(StepMetadata metadata) {
        double intensity = 1;
        long batchSize = metadata.getLongParameter(PARAM_BATCH_SIZE, 0);
        if (batchSize > 0) {
            intensity += batchSize / 100.0;
        }
        if (metadata.getBooleanParameter(PARAM_PARALLEL)) {
            intensity *= 1.5;
        }
        long timeout = metadata.getLongParameter(PARAM_TIMEOUT, 0);
        if (timeout > 0) {
            intensity += timeout / 60_000.0;
        }
        return Math.round(intensity);
    }
}
