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

import java.time.Instant;
import java.util.Objects;

/**
 * Memory and CPU held by one execution between allocation and release.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class ResourceAllocation {

    private final String executionId;
    private final long memoryMb;
    private final double cpuPercent;
    private final long timeoutMs;
    private final Instant allocatedAt;

    public ResourceAllocation(String executionId, long memoryMb, double cpuPercent, long timeoutMs, Instant allocatedAt) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.memoryMb = memoryMb;
        this.cpuPercent = cpuPercent;
        this.timeoutMs = timeoutMs;
        this.allocatedAt = allocatedAt != null ? allocatedAt : Instant.now();
    }

    public String getExecutionId() {
        return executionId;
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

    public Instant getAllocatedAt() {
        return allocatedAt;
    }

    /**
     * Whether the allocation has been held longer than its timeout.
     */
    public boolean isOverdue(Instant now) {
        return timeoutMs > 0 && now.toEpochMilli() - allocatedAt.toEpochMilli() > timeoutMs;
    }

    @Override
    public String toString() {
        return "ResourceAllocation{" +
               "executionId='" + executionId + '\'' +
               ", memoryMb=" + memoryMb +
               ", cpuPercent=" + cpuPercent +
               ", allocatedAt=" + allocatedAt +
               '}';
    }
}
