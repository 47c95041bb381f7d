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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Estimated resource needs of a step or workflow.
 */
public final class ResourceEstimate {

    private static final double COST_PER_MB = 0.001;
    private static final double COST_PER_CPU_PERCENT = 0.01;
    private static final double COST_PER_SECOND = 0.0001;

    private final long memoryMb;
    private final double cpuPercent;
    private final long timeoutMs;

    public ResourceEstimate(long memoryMb, double cpuPercent, long timeoutMs) {
        this.memoryMb = memoryMb;
        this.cpuPercent = cpuPercent;
        this.timeoutMs = timeoutMs;
    }

    public static ResourceEstimate none() {
        return new ResourceEstimate(0, 0, 0);
    }

    public long getMemoryMb() {
        return memoryMb;
    }

    public double getCpuPercent() {
        return cpuPercent;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    /**
     * Notional cost, rounded to cents.
     */
    public double getEstimatedCost() {
        double cost = memoryMb * COST_PER_MB + cpuPercent * COST_PER_CPU_PERCENT + (timeoutMs / 1000.0) * COST_PER_SECOND;
        return Math.round(cost * 100) / 100.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("memoryMb", memoryMb);
        map.put("cpuPercent", cpuPercent);
        map.put("timeoutMs", timeoutMs);
        map.put("estimatedCost", getEstimatedCost());
        return map;
    }

    @Override
    public String toString() {
        return "ResourceEstimate{memory=" + memoryMb + "MB, cpu=" + cpuPercent + "%, timeout=" + timeoutMs + "ms}";
    }
}
