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

import dev.mars.sequor.core.ResourceRequest;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Budget of memory, CPU and concurrent executions shared by all running executions.
 * <p>
 * {@link #validateRequest(ResourceRequest)} checks a request against the absolute limits and is
 * used at admission; {@link #canAllocate(ResourceRequest)} checks it against the current usage and
 * is used when picking the next execution to run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public interface ResourceManager {

    /**
     * Reserve resources for an execution.
     *
     * @param executionId the execution id
     * @param request memory and CPU to reserve; null means the defaults
     * @return the allocation
     * @throws WorkflowExecutionException of kind RESOURCE when the request does not fit the
     *         current usage or the id already holds an allocation
     */
    ResourceAllocation allocateResources(String executionId, ResourceRequest request) throws WorkflowExecutionException;

    /**
     * Release the resources held by an execution. Idempotent.
     *
     * @return true when an allocation was held and has been released
     */
    boolean releaseResources(String executionId);

    ResourceValidationResult validateRequest(ResourceRequest request);

    boolean canAllocate(ResourceRequest request);

    Optional<ResourceAllocation> getAllocation(String executionId);

    int getActiveAllocationCount();

    /**
     * Sample the host, record efficiency and raise violations for dimensions above threshold.
     * Violations are logged and passed to the registered handlers.
     */
    List<ResourceViolation> checkResourceUsage();

    void addViolationHandler(Consumer<ResourceViolation> handler);

    /**
     * Expected wait in milliseconds before a request could be hosted, from the current pressure.
     */
    long estimateWaitTime(ResourceRequest request);

    void updateResourceLimits(ResourceLimits limits);

    ResourceLimits getResourceLimits();

    ResourceUtilization getResourceStatus();

    ResourceStatistics getResourceStatistics();

    EfficiencyMetrics getEfficiencyMetrics();

    /**
     * Release every allocation.
     *
     * @return number of allocations released
     */
    int releaseAll();

    void shutdown();

    class ResourceValidationResult {
        private final boolean allowed;
        private final String reason;
        private final List<String> violations;
        private final String resourceType;
        private final Number required;
        private final Number available;

        public ResourceValidationResult(boolean allowed, String reason, List<String> violations,
                                        String resourceType, Number required, Number available) {
            this.allowed = allowed;
            this.reason = reason;
            this.violations = violations;
            this.resourceType = resourceType;
            this.required = required;
            this.available = available;
        }

        public boolean isAllowed() { return allowed; }
        public String getReason() { return reason; }
        public List<String> getViolations() { return violations; }
        public String getResourceType() { return resourceType; }
        public Number getRequired() { return required; }
        public Number getAvailable() { return available; }

        public static ResourceValidationResult allowed() {
            return new ResourceValidationResult(true, "Request allowed", List.of(), null, null, null);
        }

        public static ResourceValidationResult denied(String reason, List<String> violations,
                                                      String resourceType, Number required, Number available) {
            return new ResourceValidationResult(false, reason, violations, resourceType, required, available);
        }

        /**
         * The denial as a RESOURCE error.
         */
        public WorkflowExecutionException toException() {
            return WorkflowExecutionException.resource(resourceType, required, available, reason);
        }
    }

    class ResourceUtilization {
        private final long allocatedMemoryMb;
        private final double allocatedCpuPercent;
        private final int activeAllocations;
        private final ResourceLimits limits;
        private final SystemResourceSnapshot system;

        public ResourceUtilization(long allocatedMemoryMb, double allocatedCpuPercent, int activeAllocations,
                                   ResourceLimits limits, SystemResourceSnapshot system) {
            this.allocatedMemoryMb = allocatedMemoryMb;
            this.allocatedCpuPercent = allocatedCpuPercent;
            this.activeAllocations = activeAllocations;
            this.limits = limits;
            this.system = system;
        }

        public long getAllocatedMemoryMb() { return allocatedMemoryMb; }
        public double getAllocatedCpuPercent() { return allocatedCpuPercent; }
        public int getActiveAllocations() { return activeAllocations; }
        public ResourceLimits getLimits() { return limits; }
        public SystemResourceSnapshot getSystem() { return system; }

        public double getMemoryUtilization() {
            return (double) allocatedMemoryMb / limits.getMaxMemoryMb() * 100.0;
        }

        public double getCpuUtilization() {
            return allocatedCpuPercent / limits.getMaxCpuPercent() * 100.0;
        }

        public double getConcurrentUtilization() {
            return (double) activeAllocations / limits.getMaxConcurrentExecutions() * 100.0;
        }

        public double getMaxUtilization() {
            return Math.max(getMemoryUtilization(), Math.max(getCpuUtilization(), getConcurrentUtilization()));
        }

        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("memory", dimension(allocatedMemoryMb, limits.getMaxMemoryMb(), getMemoryUtilization()));
            map.put("cpu", dimension(allocatedCpuPercent, limits.getMaxCpuPercent(), getCpuUtilization()));
            map.put("concurrent", dimension(activeAllocations, limits.getMaxConcurrentExecutions(),
                    getConcurrentUtilization()));
            map.put("system", system.toMap());
            return map;
        }

        private static Map<String, Object> dimension(Number used, Number limit, double percentage) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("used", used);
            map.put("limit", limit);
            map.put("percentage", percentage);
            return map;
        }
    }

    class ResourceStatistics {
        private final int currentAllocations;
        private final long totalAllocations;
        private final long totalRejections;
        private final double averageMemoryMb;
        private final double averageCpuPercent;
        private final double averageDurationMs;
        private final long peakMemoryMb;
        private final double peakCpuPercent;
        private final int peakConcurrent;
        private final ResourceLimits limits;

        public ResourceStatistics(int currentAllocations, long totalAllocations, long totalRejections,
                                  double averageMemoryMb, double averageCpuPercent, double averageDurationMs,
                                  long peakMemoryMb, double peakCpuPercent, int peakConcurrent,
                                  ResourceLimits limits) {
            this.currentAllocations = currentAllocations;
            this.totalAllocations = totalAllocations;
            this.totalRejections = totalRejections;
            this.averageMemoryMb = averageMemoryMb;
            this.averageCpuPercent = averageCpuPercent;
            this.averageDurationMs = averageDurationMs;
            this.peakMemoryMb = peakMemoryMb;
            this.peakCpuPercent = peakCpuPercent;
            this.peakConcurrent = peakConcurrent;
            this.limits = limits;
        }

        public int getCurrentAllocations() { return currentAllocations; }
        public long getTotalAllocations() { return totalAllocations; }
        public long getTotalRejections() { return totalRejections; }
        public double getAverageMemoryMb() { return averageMemoryMb; }
        public double getAverageCpuPercent() { return averageCpuPercent; }
        public double getAverageDurationMs() { return averageDurationMs; }
        public long getPeakMemoryMb() { return peakMemoryMb; }
        public double getPeakCpuPercent() { return peakCpuPercent; }
        public int getPeakConcurrent() { return peakConcurrent; }
        public ResourceLimits getLimits() { return limits; }
    }

    class EfficiencyMetrics {
        private final long memoryEfficiency;
        private final long cpuEfficiency;
        private final long overallEfficiency;

        public EfficiencyMetrics(long memoryEfficiency, long cpuEfficiency, long overallEfficiency) {
            this.memoryEfficiency = memoryEfficiency;
            this.cpuEfficiency = cpuEfficiency;
            this.overallEfficiency = overallEfficiency;
        }

        public long getMemoryEfficiency() { return memoryEfficiency; }
        public long getCpuEfficiency() { return cpuEfficiency; }
        public long getOverallEfficiency() { return overallEfficiency; }
    }
}
