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

package dev.mars.sequor.workflow;

import dev.mars.sequor.core.ExecutionOptions;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.exceptions.ErrorKind;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.workflow.cache.ExecutionCache;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything a strategy needs to know about one attempt of an execution: its identity, the
 * workflow and shared context, the caller's options and the cooperative cancellation flag.
 * The cancellation flag is shared by every attempt of the same execution.
 */
public class ExecutionContext {

    private final String executionId;
    private final Workflow workflow;
    private final WorkflowContext workflowContext;
    private final ExecutionOptions options;
    private final Instant submittedAt;
    private final int attempt;
    private final AtomicBoolean cancelled;
    private final StepExecutionListener listener;
    private final ExecutionCache stepCache;

    private ExecutionContext(Builder builder) {
        this.executionId = Objects.requireNonNull(builder.executionId, "Execution ID cannot be null");
        this.workflow = builder.workflow;
        this.workflowContext = builder.workflowContext;
        this.options = builder.options != null ? builder.options : ExecutionOptions.defaults();
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.attempt = Math.max(1, builder.attempt);
        this.cancelled = builder.cancelled != null ? builder.cancelled : new AtomicBoolean(false);
        this.listener = builder.listener != null ? builder.listener : StepExecutionListener.NO_OP;
        this.stepCache = builder.stepCache;
    }

    public String getExecutionId() {
        return executionId;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public WorkflowContext getWorkflowContext() {
        return workflowContext;
    }

    public ExecutionOptions getOptions() {
        return options;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    /**
     * One-based attempt number.
     */
    public int getAttempt() {
        return attempt;
    }

    public StepExecutionListener getListener() {
        return listener;
    }

    /**
     * Cache used for cacheable steps, or null when step caching is off.
     */
    public ExecutionCache getStepCache() {
        return stepCache;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Request cooperative cancellation.
     *
     * @return true when this call changed the flag
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    /**
     * Throws when cancellation was requested. Strategies call this between steps.
     */
    public void checkNotCancelled() throws WorkflowExecutionException {
        if (cancelled.get()) {
            throw WorkflowExecutionException.builder(ErrorKind.STRATEGY_EXECUTION, "Execution cancelled: " + executionId)
                    .executionId(executionId)
                    .workflowName(getWorkflowName())
                    .detail(WorkflowExecutionException.DETAIL_CANCELLED, true)
                    .retryable(false)
                    .build();
        }
    }

    public String getWorkflowName() {
        return workflow != null ? workflow.getName() : null;
    }

    public ExecutionContext withAttempt(int newAttempt) {
        return new Builder(this).attempt(newAttempt).build();
    }

    /**
     * Same execution, different workflow body; used after optimization.
     */
    public ExecutionContext withWorkflow(Workflow newWorkflow) {
        return new Builder(this).workflow(newWorkflow).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionContext that = (ExecutionContext) o;
        return Objects.equals(executionId, that.executionId) && attempt == that.attempt;
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId, attempt);
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "executionId='" + executionId + '\'' +
               ", workflow='" + getWorkflowName() + '\'' +
               ", attempt=" + attempt +
               ", submittedAt=" + submittedAt +
               '}';
    }

    public static class Builder {
        private String executionId;
        private Workflow workflow;
        private WorkflowContext workflowContext;
        private ExecutionOptions options;
        private Instant submittedAt;
        private int attempt = 1;
        private AtomicBoolean cancelled;
        private StepExecutionListener listener;
        private ExecutionCache stepCache;

        public Builder() {
        }

        private Builder(ExecutionContext existing) {
            this.executionId = existing.executionId;
            this.workflow = existing.workflow;
            this.workflowContext = existing.workflowContext;
            this.options = existing.options;
            this.submittedAt = existing.submittedAt;
            this.attempt = existing.attempt;
            this.cancelled = existing.cancelled;
            this.listener = existing.listener;
            this.stepCache = existing.stepCache;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflow(Workflow workflow) {
            this.workflow = workflow;
            return this;
        }

        public Builder workflowContext(WorkflowContext workflowContext) {
            this.workflowContext = workflowContext;
            return this;
        }

        public Builder options(ExecutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder listener(StepExecutionListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder stepCache(ExecutionCache stepCache) {
            this.stepCache = stepCache;
            return this;
        }

        public ExecutionContext build() {
            if (executionId == null) {
                executionId = UUID.randomUUID().toString();
            }
            return new ExecutionContext(this);
        }
    }
}
