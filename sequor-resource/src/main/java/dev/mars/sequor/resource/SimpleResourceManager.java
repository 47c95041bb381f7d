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
import dev.mars.sequor.core.ResourceRequest;
import dev.mars.sequor.core.exceptions.ErrorKind;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.resource.observability.ResourceMetrics;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.ToDoubleFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory implementation of {@link ResourceManager}.
 * All accounting changes happen under a single lock so that the sum of live allocations
 * always equals the reported usage.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class SimpleResourceManager implements ResourceManager {

    private static final Logger logger = Logger.getLogger(SimpleResourceManager.class.getName());

    private static final double MEMORY_VIOLATION_PERCENT = 90.0;
    private static final double CPU_VIOLATION_PERCENT = 90.0;
    private static final double CONCURRENT_VIOLATION_PERCENT = 95.0;
    private static final int MAX_HISTORY = 1000;
    private static final AtomicLong POOL_COUNTER = new AtomicLong(0);

    private final String poolName;
    private final SystemResourceSampler sampler;
    private final Map<String, ResourceAllocation> allocations = new ConcurrentHashMap<>();
    private final Deque<ReleasedAllocation> history = new ArrayDeque<>();
    private final List<Consumer<ResourceViolation>> violationHandlers = new CopyOnWriteArrayList<>();
    private final AtomicLong totalAllocations = new AtomicLong(0);
    private final AtomicLong totalRejections = new AtomicLong(0);
    private final ResourceMetrics metrics = ResourceMetrics.getInstance();
    private final Object lock = new Object();

    private volatile ResourceLimits limits;
    private long allocatedMemoryMb;
    private double allocatedCpuPercent;
    private long peakMemoryMb;
    private double peakCpuPercent;
    private int peakConcurrent;

    public SimpleResourceManager() {
        this(ResourceLimits.defaults(), new HostResourceSampler());
    }

    public SimpleResourceManager(SequorConfiguration configuration) {
        this(ResourceLimits.fromConfiguration(configuration), new HostResourceSampler());
    }

    public SimpleResourceManager(ResourceLimits limits) {
        this(limits, new HostResourceSampler());
    }

    public SimpleResourceManager(ResourceLimits limits, SystemResourceSampler sampler) {
        this.limits = limits != null ? limits : ResourceLimits.defaults();
        this.sampler = sampler != null ? sampler : new HostResourceSampler();
        this.poolName = "pool-" + POOL_COUNTER.incrementAndGet();
        metrics.registerUsageGauges(poolName,
                this::getAllocatedMemoryMb,
                this::getAllocatedCpuPercent,
                () -> (long) allocations.size());
        logger.info("Resource manager initialized with " + this.limits);
    }

    @Override
    public ResourceAllocation allocateResources(String executionId, ResourceRequest request)
            throws WorkflowExecutionException {
        if (executionId == null || executionId.isBlank()) {
            throw WorkflowExecutionException.validation("executionId", "Execution ID is required for allocation");
        }
        ResourceRequest effective = request != null ? request : ResourceRequest.defaults();

        ResourceAllocation allocation;
        synchronized (lock) {
            if (allocations.containsKey(executionId)) {
                totalRejections.incrementAndGet();
                throw WorkflowExecutionException.builder(ErrorKind.RESOURCE,
                                "Resources already allocated for execution: " + executionId)
                        .executionId(executionId)
                        .detail(WorkflowExecutionException.DETAIL_RESOURCE_TYPE, "allocation")
                        .build();
            }

            ResourceValidationResult availability = checkAvailability(effective);
            if (!availability.isAllowed()) {
                totalRejections.incrementAndGet();
                metrics.recordRejection(poolName, availability.getResourceType());
                logger.warning("Resource allocation denied for " + executionId + ": " + availability.getReason());
                throw availability.toException().toBuilder().executionId(executionId).build();
            }

            long timeout = effective.getTimeoutMs() != null ? effective.getTimeoutMs() : limits.getTimeoutMs();
            allocation = new ResourceAllocation(executionId, effective.getMemoryMb(), effective.getCpuPercent(),
                    timeout, Instant.now());
            allocations.put(executionId, allocation);
            allocatedMemoryMb += allocation.getMemoryMb();
            allocatedCpuPercent += allocation.getCpuPercent();
            peakMemoryMb = Math.max(peakMemoryMb, allocatedMemoryMb);
            peakCpuPercent = Math.max(peakCpuPercent, allocatedCpuPercent);
            peakConcurrent = Math.max(peakConcurrent, allocations.size());
            totalAllocations.incrementAndGet();
        }

        metrics.recordAllocation(poolName, allocation.getMemoryMb(), allocation.getCpuPercent());
        logger.info("Allocated resources for " + executionId + ": " + allocation.getMemoryMb() + "MB, " +
                allocation.getCpuPercent() + "% CPU");
        return allocation;
    }

    @Override
    public boolean releaseResources(String executionId) {
        if (executionId == null) {
            return false;
        }
        ResourceAllocation allocation;
        synchronized (lock) {
            allocation = allocations.remove(executionId);
            if (allocation == null) {
                return false;
            }
            allocatedMemoryMb -= allocation.getMemoryMb();
            allocatedCpuPercent -= allocation.getCpuPercent();
            if (allocations.isEmpty()) {
                // Drop accumulated floating point drift
                allocatedCpuPercent = 0.0;
            }
            history.addLast(new ReleasedAllocation(allocation, Instant.now()));
            while (history.size() > MAX_HISTORY) {
                history.removeFirst();
            }
        }

        metrics.recordRelease(poolName);
        logger.fine("Released resources for " + executionId);
        return true;
    }

    @Override
    public ResourceValidationResult validateRequest(ResourceRequest request) {
        ResourceRequest effective = request != null ? request : ResourceRequest.defaults();
        ResourceLimits current = limits;
        List<String> violations = new ArrayList<>();
        String resourceType = null;
        Number required = null;
        Number available = null;

        if (effective.getMemoryMb() > current.getMaxMemoryMb()) {
            violations.add("Memory request exceeds limit: " + effective.getMemoryMb() + "MB > " +
                    current.getMaxMemoryMb() + "MB");
            resourceType = "memory";
            required = effective.getMemoryMb();
            available = current.getMaxMemoryMb();
        }
        if (effective.getCpuPercent() > current.getMaxCpuPercent()) {
            violations.add("CPU request exceeds limit: " + effective.getCpuPercent() + "% > " +
                    current.getMaxCpuPercent() + "%");
            if (resourceType == null) {
                resourceType = "cpu";
                required = effective.getCpuPercent();
                available = current.getMaxCpuPercent();
            }
        }

        if (violations.isEmpty()) {
            return ResourceValidationResult.allowed();
        }
        return ResourceValidationResult.denied(violations.get(0), violations, resourceType, required, available);
    }

    @Override
    public boolean canAllocate(ResourceRequest request) {
        ResourceRequest effective = request != null ? request : ResourceRequest.defaults();
        synchronized (lock) {
            return checkAvailability(effective).isAllowed();
        }
    }

    @Override
    public Optional<ResourceAllocation> getAllocation(String executionId) {
        return Optional.ofNullable(allocations.get(executionId));
    }

    @Override
    public int getActiveAllocationCount() {
        return allocations.size();
    }

    @Override
    public List<ResourceViolation> checkResourceUsage() {
        ResourceUtilization utilization = getResourceStatus();
        List<ResourceViolation> violations = new ArrayList<>();

        double memory = utilization.getMemoryUtilization();
        if (memory > MEMORY_VIOLATION_PERCENT) {
            violations.add(new ResourceViolation(ResourceViolation.Type.MEMORY, ResourceViolation.Severity.HIGH,
                    memory, String.format(Locale.ROOT, "Memory usage is %.1f%%", memory),
                    topConsumer(ResourceAllocation::getMemoryMb)));
        }
        double cpu = utilization.getCpuUtilization();
        if (cpu > CPU_VIOLATION_PERCENT) {
            violations.add(new ResourceViolation(ResourceViolation.Type.CPU, ResourceViolation.Severity.HIGH,
                    cpu, String.format(Locale.ROOT, "CPU usage is %.1f%%", cpu),
                    topConsumer(ResourceAllocation::getCpuPercent)));
        }
        double concurrent = utilization.getConcurrentUtilization();
        if (concurrent > CONCURRENT_VIOLATION_PERCENT) {
            violations.add(new ResourceViolation(ResourceViolation.Type.CONCURRENT, ResourceViolation.Severity.MEDIUM,
                    concurrent, String.format(Locale.ROOT, "Concurrent executions at %.1f%%", concurrent), null));
        }

        for (ResourceViolation violation : violations) {
            handleViolation(violation);
        }
        return violations;
    }

    @Override
    public void addViolationHandler(Consumer<ResourceViolation> handler) {
        if (handler != null) {
            violationHandlers.add(handler);
        }
    }

    @Override
    public long estimateWaitTime(ResourceRequest request) {
        ResourceUtilization utilization = currentUtilization(SystemResourceSnapshot.empty());
        double pressure = utilization.getMaxUtilization() / 100.0;

        if (pressure < 0.5) {
            return 0;
        } else if (pressure < 0.8) {
            return 5000;
        } else if (pressure < 0.95) {
            return 30000;
        }
        return 120000;
    }

    @Override
    public void updateResourceLimits(ResourceLimits newLimits) {
        if (newLimits == null) {
            return;
        }
        synchronized (lock) {
            this.limits = newLimits;
        }
        logger.info("Resource limits updated: " + newLimits);
    }

    @Override
    public ResourceLimits getResourceLimits() {
        return limits;
    }

    @Override
    public ResourceUtilization getResourceStatus() {
        return currentUtilization(sampler.sample());
    }

    @Override
    public ResourceStatistics getResourceStatistics() {
        synchronized (lock) {
            double averageMemory = allocations.values().stream()
                    .mapToLong(ResourceAllocation::getMemoryMb)
                    .average()
                    .orElse(0.0);
            double averageCpu = allocations.values().stream()
                    .mapToDouble(ResourceAllocation::getCpuPercent)
                    .average()
                    .orElse(0.0);
            double averageDuration = history.stream()
                    .mapToLong(ReleasedAllocation::getDurationMs)
                    .average()
                    .orElse(0.0);

            return new ResourceStatistics(
                    allocations.size(),
                    totalAllocations.get(),
                    totalRejections.get(),
                    averageMemory,
                    averageCpu,
                    averageDuration,
                    peakMemoryMb,
                    peakCpuPercent,
                    peakConcurrent,
                    limits);
        }
    }

    @Override
    public EfficiencyMetrics getEfficiencyMetrics() {
        SystemResourceSnapshot snapshot = sampler.sample();
        long memory;
        double cpu;
        synchronized (lock) {
            memory = allocatedMemoryMb;
            cpu = allocatedCpuPercent;
        }

        double memoryEfficiency = snapshot.getTotalMemoryMb() > 0
                ? (double) memory / snapshot.getTotalMemoryMb() * 100.0 : 0.0;
        double cpuEfficiency = snapshot.getCpuUsagePercent() > 0
                ? cpu / snapshot.getCpuUsagePercent() * 100.0 : 0.0;

        return new EfficiencyMetrics(
                Math.round(memoryEfficiency),
                Math.round(cpuEfficiency),
                Math.round((memoryEfficiency + cpuEfficiency) / 2.0));
    }

    @Override
    public int releaseAll() {
        List<String> executionIds = new ArrayList<>(allocations.keySet());
        int released = 0;
        for (String executionId : executionIds) {
            if (releaseResources(executionId)) {
                released++;
            }
        }
        if (released > 0) {
            logger.info("Released " + released + " outstanding allocations");
        }
        return released;
    }

    @Override
    public void shutdown() {
        logger.info("Shutting down resource manager");
        releaseAll();
        metrics.unregisterUsageGauges(poolName);
    }

    long getAllocatedMemoryMb() {
        synchronized (lock) {
            return allocatedMemoryMb;
        }
    }

    double getAllocatedCpuPercent() {
        synchronized (lock) {
            return allocatedCpuPercent;
        }
    }

    // Caller must hold the lock
    private ResourceValidationResult checkAvailability(ResourceRequest request) {
        ResourceLimits current = limits;

        long requiredMemory = request.getMemoryMb();
        if (allocatedMemoryMb + requiredMemory > current.getMaxMemoryMb()) {
            return ResourceValidationResult.denied(
                    "Insufficient memory: " + allocatedMemoryMb + "MB + " + requiredMemory + "MB > " +
                            current.getMaxMemoryMb() + "MB",
                    List.of("memory"), "memory", requiredMemory,
                    Math.max(0, current.getMaxMemoryMb() - allocatedMemoryMb));
        }

        double requiredCpu = request.getCpuPercent();
        if (allocatedCpuPercent + requiredCpu > current.getMaxCpuPercent()) {
            return ResourceValidationResult.denied(
                    "Insufficient CPU: " + allocatedCpuPercent + "% + " + requiredCpu + "% > " +
                            current.getMaxCpuPercent() + "%",
                    List.of("cpu"), "cpu", requiredCpu,
                    Math.max(0.0, current.getMaxCpuPercent() - allocatedCpuPercent));
        }

        if (allocations.size() >= current.getMaxConcurrentExecutions()) {
            return ResourceValidationResult.denied(
                    "Maximum concurrent executions reached: " + allocations.size() + " >= " +
                            current.getMaxConcurrentExecutions(),
                    List.of("concurrent"), "concurrent", 1,
                    Math.max(0, current.getMaxConcurrentExecutions() - allocations.size()));
        }

        return ResourceValidationResult.allowed();
    }

    private ResourceUtilization currentUtilization(SystemResourceSnapshot snapshot) {
        synchronized (lock) {
            return new ResourceUtilization(allocatedMemoryMb, allocatedCpuPercent, allocations.size(), limits, snapshot);
        }
    }

    private String topConsumer(ToDoubleFunction<ResourceAllocation> dimension) {
        return allocations.values().stream()
                .max(Comparator.comparingDouble(dimension))
                .map(ResourceAllocation::getExecutionId)
                .orElse(null);
    }

    private void handleViolation(ResourceViolation violation) {
        metrics.recordViolation(poolName, violation.getType().name().toLowerCase());
        if (violation.getTopConsumer() != null) {
            logger.warning("Resource violation: " + violation.getMessage() +
                    " (top consumer: " + violation.getTopConsumer() + ")");
        } else {
            logger.warning("Resource violation: " + violation.getMessage() +
                    " (active executions: " + allocations.size() + ")");
        }

        for (Consumer<ResourceViolation> handler : violationHandlers) {
            try {
                handler.accept(violation);
            } catch (RuntimeException e) {
                logger.warning("Violation handler failed: " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Violation handler failure", e);
                }
            }
        }
    }

    private static final class ReleasedAllocation {
        private final ResourceAllocation allocation;
        private final Instant releasedAt;

        private ReleasedAllocation(ResourceAllocation allocation, Instant releasedAt) {
            this.allocation = allocation;
            this.releasedAt = releasedAt;
        }

        long getDurationMs() {
            return releasedAt.toEpochMilli() - allocation.getAllocatedAt().toEpochMilli();
        }
    }
}
