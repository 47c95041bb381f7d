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

package dev.mars.sequor.workflow.scheduler;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Scheduler-level capacity an execution needs while it runs: CPU percent, memory and disk in MB.
 */
public final class ResourceRequirements {

    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";
    public static final String DISK = "disk";

    private final double cpuPercent;
    private final double memoryMb;
    private final double diskMb;

    public ResourceRequirements(double cpuPercent, double memoryMb, double diskMb) {
        if (cpuPercent < 0 || memoryMb < 0 || diskMb < 0) {
            throw new IllegalArgumentException("Resource requirements cannot be negative");
        }
        this.cpuPercent = cpuPercent;
        this.memoryMb = memoryMb;
        this.diskMb = diskMb;
    }

    public double getCpuPercent() {
        return cpuPercent;
    }

    public double getMemoryMb() {
        return memoryMb;
    }

    public double getDiskMb() {
        return diskMb;
    }

    /**
     * Amount of the named pool resource ({@link #CPU}, {@link #MEMORY} or {@link #DISK}).
     */
    public double get(String resource) {
        switch (resource) {
            case CPU:
                return cpuPercent;
            case MEMORY:
                return memoryMb;
            case DISK:
                return diskMb;
            default:
                throw new IllegalArgumentException("Unknown resource: " + resource);
        }
    }

    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(CPU, cpuPercent);
        map.put(MEMORY, memoryMb);
        map.put(DISK, diskMb);
        return map;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "ResourceRequirements{cpu=%.1f%%, memory=%.0fMB, disk=%.0fMB}",
                cpuPercent, memoryMb, diskMb);
    }
}
