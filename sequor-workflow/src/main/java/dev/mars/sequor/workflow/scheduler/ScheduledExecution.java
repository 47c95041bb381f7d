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

import dev.mars.sequor.workflow.ExecutionContext;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An execution admitted by the {@link ExecutionScheduler}. Mutable state is only
 * changed by the scheduler while it holds its lock.
 */
public final class ScheduledExecution {

    private final String executionId;
    private final ExecutionContext context;
    private final Instant scheduledAt;
    private final long sequence;
    private final int priority;
    private final long estimatedDurationMs;
    private final ResourceRequirements requirements;
    private final List<String> dependencies;
    private final Map<String, Object> constraints;

    private volatile ScheduledExecutionStatus status = ScheduledExecutionStatus.SCHEDULED;
    private volatile int retryCount;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private boolean reserved;

    ScheduledExecution(ExecutionContext context, Instant scheduledAt, long sequence, int priority,
                       long estimatedDurationMs, ResourceRequirements requirements,
                       List<String> dependencies, Map<String, Object> constraints) {
        this.executionId = context.getExecutionId();
        this.context = context;
        this.scheduledAt = scheduledAt;
        this.sequence = sequence;
        this.priority = priority;
        this.estimatedDurationMs = estimatedDurationMs;
        this.requirements = requirements;
        this.dependencies = List.copyOf(dependencies);
        this.constraints = Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
    }

    public String getExecutionId() {
        return executionId;
    }

    public ExecutionContext getContext() {
        return context;
    }

    public Instant getScheduledAt() {
        return scheduledAt;
    }

    long getSequence() {
        return sequence;
    }

    public int getPriority() {
        return priority;
    }

    public long getEstimatedDurationMs() {
        return estimatedDurationMs;
    }

    public ResourceRequirements getRequirements() {
        return requirements;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public Map<String, Object> getConstraints() {
        return constraints;
    }

    public ScheduledExecutionStatus getStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    boolean isReserved() {
        return reserved;
    }

    void markRunning(Instant now) {
        status = ScheduledExecutionStatus.RUNNING;
        startedAt = now;
        reserved = true;
    }

    void resetForRetry() {
        status = ScheduledExecutionStatus.SCHEDULED;
        retryCount++;
        reserved = false;
    }

    void finish(ScheduledExecutionStatus terminal, Instant now) {
        status = terminal;
        finishedAt = now;
        reserved = false;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("executionId", executionId);
        map.put("workflowName", context.getWorkflowName());
        map.put("status", status.name());
        map.put("priority", priority);
        map.put("scheduledAt", scheduledAt.toString());
        map.put("estimatedDurationMs", estimatedDurationMs);
        map.put("requirements", requirements.toMap());
        map.put("dependencies", dependencies);
        map.put("retryCount", retryCount);
        return map;
    }

    @Override
    public String toString() {
        return "ScheduledExecution{" +
               "executionId='" + executionId + '\'' +
               ", status=" + status +
               ", priority=" + priority +
               ", dependencies=" + dependencies +
               '}';
    }
}
