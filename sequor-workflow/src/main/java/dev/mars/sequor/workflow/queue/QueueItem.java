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

package dev.mars.sequor.workflow.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An execution waiting in the {@link ExecutionQueue}.
 * Items are immutable; the queue hands out copies carrying the arrival sequence
 * and retry bookkeeping.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public final class QueueItem {

    private final String executionId;
    private final String workflowName;
    private final int priority;
    private final Instant enqueuedAt;
    private final Instant availableAt;
    private final int retryCount;
    private final Integer maxRetries;
    private final Duration retryDelay;
    private final String lastError;
    private final long sequence;

    private QueueItem(Builder builder) {
        this.executionId = Objects.requireNonNull(builder.executionId, "Execution ID cannot be null");
        this.workflowName = builder.workflowName;
        this.priority = builder.priority;
        this.enqueuedAt = Objects.requireNonNull(builder.enqueuedAt, "Enqueue time cannot be null");
        this.availableAt = builder.availableAt != null ? builder.availableAt : builder.enqueuedAt;
        this.retryCount = Math.max(0, builder.retryCount);
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.lastError = builder.lastError;
        this.sequence = builder.sequence;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public int getPriority() {
        return priority;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public Instant getAvailableAt() {
        return availableAt;
    }

    public int getRetryCount() {
        return retryCount;
    }

    /**
     * Per-item retry limit, or null to use the queue default.
     */
    public Integer getMaxRetries() {
        return maxRetries;
    }

    /**
     * Per-item retry delay, or null to use the queue default.
     */
    public Duration getRetryDelay() {
        return retryDelay;
    }

    public String getLastError() {
        return lastError;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * Check whether the item may be dequeued at the given instant.
     */
    public boolean isAvailable(Instant now) {
        return !availableAt.isAfter(now);
    }

    public long getWaitTimeMs(Instant now) {
        return Math.max(0, now.toEpochMilli() - enqueuedAt.toEpochMilli());
    }

    QueueItem withSequence(long newSequence) {
        return new Builder(this).sequence(newSequence).build();
    }

    QueueItem withRetry(Instant nextAvailableAt, String error) {
        return new Builder(this)
                .retryCount(retryCount + 1)
                .availableAt(nextAvailableAt)
                .lastError(error)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueItem queueItem = (QueueItem) o;
        return Objects.equals(executionId, queueItem.executionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId);
    }

    @Override
    public String toString() {
        return "QueueItem{" +
                "executionId='" + executionId + '\'' +
                ", workflowName='" + workflowName + '\'' +
                ", priority=" + priority +
                ", retryCount=" + retryCount +
                ", availableAt=" + availableAt +
                '}';
    }

    public static Builder builder(String executionId) {
        return new Builder().executionId(executionId);
    }

    public static class Builder {
        private String executionId;
        private String workflowName;
        private int priority = 1;
        private Instant enqueuedAt;
        private Instant availableAt;
        private int retryCount;
        private Integer maxRetries;
        private Duration retryDelay;
        private String lastError;
        private long sequence;

        public Builder() {
            this.enqueuedAt = Instant.now();
        }

        public Builder(QueueItem existing) {
            this.executionId = existing.executionId;
            this.workflowName = existing.workflowName;
            this.priority = existing.priority;
            this.enqueuedAt = existing.enqueuedAt;
            this.availableAt = existing.availableAt;
            this.retryCount = existing.retryCount;
            this.maxRetries = existing.maxRetries;
            this.retryDelay = existing.retryDelay;
            this.lastError = existing.lastError;
            this.sequence = existing.sequence;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder enqueuedAt(Instant enqueuedAt) {
            this.enqueuedAt = enqueuedAt;
            return this;
        }

        public Builder availableAt(Instant availableAt) {
            this.availableAt = availableAt;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public QueueItem build() {
            return new QueueItem(this);
        }
    }
}
