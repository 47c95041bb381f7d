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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One reading of host memory and CPU.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class SystemResourceSnapshot {

    private static final SystemResourceSnapshot EMPTY = new SystemResourceSnapshot(0, 0, 0, 0);

    private final long totalMemoryMb;
    private final long usedMemoryMb;
    private final double cpuUsagePercent;
    private final double loadAverage;

    public SystemResourceSnapshot(long totalMemoryMb, long usedMemoryMb, double cpuUsagePercent, double loadAverage) {
        this.totalMemoryMb = totalMemoryMb;
        this.usedMemoryMb = usedMemoryMb;
        this.cpuUsagePercent = cpuUsagePercent;
        this.loadAverage = loadAverage;
    }

    /**
     * Reading used when the host cannot be sampled.
     */
    public static SystemResourceSnapshot empty() {
        return EMPTY;
    }

    public long getTotalMemoryMb() {
        return totalMemoryMb;
    }

    public long getUsedMemoryMb() {
        return usedMemoryMb;
    }

    public long getFreeMemoryMb() {
        return Math.max(0, totalMemoryMb - usedMemoryMb);
    }

    public double getMemoryUsagePercent() {
        return totalMemoryMb > 0 ? (double) usedMemoryMb / totalMemoryMb * 100.0 : 0.0;
    }

    public double getCpuUsagePercent() {
        return cpuUsagePercent;
    }

    public double getLoadAverage() {
        return loadAverage;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalMemory", totalMemoryMb);
        map.put("usedMemory", usedMemoryMb);
        map.put("freeMemory", getFreeMemoryMb());
        map.put("memoryUsage", Math.round(getMemoryUsagePercent()));
        map.put("cpuUsage", Math.round(cpuUsagePercent));
        map.put("loadAverage", loadAverage);
        return map;
    }
}
