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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lifetime aggregates over every execution that has ended.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class AggregatedMetrics {

    private final long totalExecutions;
    private final long successfulExecutions;
    private final long failedExecutions;
    private final double averageExecutionTimeMs;
    private final double averageStepTimeMs;
    private final long totalSteps;
    private final long throughput;
    private final long retries;
    private final long cacheHits;
    private final long cacheMisses;
    private final Map<String, Long> errorsByKind;
    private final long lastUpdated;

    AggregatedMetrics(long totalExecutions, long successfulExecutions, long failedExecutions,
                      double averageExecutionTimeMs, double averageStepTimeMs, long totalSteps,
                      long throughput, long retries, long cacheHits, long cacheMisses,
                      Map<String, Long> errorsByKind, long lastUpdated) {
        this.totalExecutions = totalExecutions;
        this.successfulExecutions = successfulExecutions;
        this.failedExecutions = failedExecutions;
        this.averageExecutionTimeMs = averageExecutionTimeMs;
        this.averageStepTimeMs = averageStepTimeMs;
        this.totalSteps = totalSteps;
        this.throughput = throughput;
        this.retries = retries;
        this.cacheHits = cacheHits;
        this.cacheMisses = cacheMisses;
        this.errorsByKind = Map.copyOf(errorsByKind);
        this.lastUpdated = lastUpdated;
    }

    public long getTotalExecutions() {
        return totalExecutions;
    }

    public long getSuccessfulExecutions() {
        return successfulExecutions;
    }

    public long getFailedExecutions() {
        return failedExecutions;
    }

    public double getAverageExecutionTimeMs() {
        return averageExecutionTimeMs;
    }

    public double getAverageStepTimeMs() {
        return averageStepTimeMs;
    }

    public long getTotalSteps() {
        return totalSteps;
    }

    /**
     * Executions that ended within the trailing minute.
     */
    public long getThroughput() {
        return throughput;
    }

    public long getRetries() {
        return retries;
    }

    public long getCacheHits() {
        return cacheHits;
    }

    public long getCacheMisses() {
        return cacheMisses;
    }

    public Map<String, Long> getErrorsByKind() {
        return errorsByKind;
    }

    public long getLastUpdated() {
        return lastUpdated;
    }

    /**
     * Failed over total, in the range 0-1.
     */
    public double getErrorRate() {
        return totalExecutions > 0 ? (double) failedExecutions / totalExecutions : 0.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalExecutions", totalExecutions);
        map.put("successfulExecutions", successfulExecutions);
        map.put("failedExecutions", failedExecutions);
        map.put("averageExecutionTimeMs", averageExecutionTimeMs);
        map.put("averageStepTimeMs", averageStepTimeMs);
        map.put("totalSteps", totalSteps);
        map.put("errorRate", getErrorRate());
        map.put("throughput", throughput);
        map.put("retries", retries);
        map.put("cacheHits", cacheHits);
        map.put("cacheMisses", cacheMisses);
        map.put("errorsByKind", errorsByKind);
        map.put("lastUpdated", lastUpdated);
        return map;
    }
}
