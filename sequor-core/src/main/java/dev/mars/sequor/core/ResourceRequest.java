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

package dev.mars.sequor.core;

import java.util.Objects;

/**
 * Memory, CPU and time an execution asks the resource manager to reserve.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class ResourceRequest {

    public static final long DEFAULT_MEMORY_MB = 64;
    public static final double DEFAULT_CPU_PERCENT = 10.0;

    private final long memoryMb;
    private final double cpuPercent;
    private final Long timeoutMs;

    private ResourceRequest(long memoryMb, double cpuPercent, Long timeoutMs) {
        if (memoryMb < 0) {
            throw new IllegalArgumentException("Memory requirement cannot be negative: " + memoryMb);
        }
        if (cpuPercent < 0) {
            throw new IllegalArgumentException("CPU requirement cannot be negative: " + cpuPercent);
        }
        this.memoryMb = memoryMb;
        this.cpuPercent = cpuPercent;
        this.timeoutMs = timeoutMs;
    }

    public static ResourceRequest of(long memoryMb, double cpuPercent) {
        return new ResourceRequest(memoryMb, cpuPercent, null);
    }

    public static ResourceRequest of(long memoryMb, double cpuPercent, long timeoutMs) {
        return new ResourceRequest(memoryMb, cpuPercent, timeoutMs);
    }

    public static ResourceRequest defaults() {
        return new ResourceRequest(DEFAULT_MEMORY_MB, DEFAULT_CPU_PERCENT, null);
    }

    public long getMemoryMb() {
        return memoryMb;
    }

    public double getCpuPercent() {
        return cpuPercent;
    }

    /**
     * Requested timeout, or null to use the resource manager's default.
     */
    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public ResourceRequest withTimeout(long timeoutMs) {
        return new ResourceRequest(memoryMb, cpuPercent, timeoutMs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceRequest that = (ResourceRequest) o;
        return memoryMb == that.memoryMb &&
               Double.compare(that.cpuPercent, cpuPercent) == 0 &&
               Objects.equals(timeoutMs, that.timeoutMs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(memoryMb, cpuPercent, timeoutMs);
    }

    @Override
    public String toString() {
        return "ResourceRequest{memoryMb=" + memoryMb + ", cpuPercent=" + cpuPercent + ", timeoutMs=" + timeoutMs + '}';
    }
}
