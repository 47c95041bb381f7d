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
import dev.mars.sequor.core.ExecutionResult;
import dev.mars.sequor.core.ExecutionStatus;
import dev.mars.sequor.core.ResourceRequest;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.workflow.optimization.Prediction;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * An accepted execution as tracked by the engine, from submission until it reaches a terminal
 * state. The workflow is the one that runs, which is the optimized copy when optimization was
 * requested; the submitted workflow is kept for caching and learning.
 */
public class Execution {

    private final ExecutionContext executionContext;
    private final Workflow submittedWorkflow;
    private final String strategyName;
    private final ResourceRequest resourceRequest;
    private final Duration timeout;
    private final Prediction prediction;
    private final Instant submittedAt;
    private final CompletableFuture<ExecutionResult> future = new CompletableFuture<>();

    private ExecutionStatus status = ExecutionStatus.QUEUED;
    private Instant startedAt;
    private Instant endedAt;
    private int retryCount;
    private Future<?> runningTask;
    private Future<?> timeoutTask;

    Execution(ExecutionContext executionContext, Workflow submittedWorkflow, String strategyName,
              ResourceRequest resourceRequest, Duration timeout, Prediction prediction) {
        this.executionContext = executionContext;
        this.submittedWorkflow = submittedWorkflow;
        this.strategyName = strategyName;
        this.resourceRequest = resourceRequest;
        this.timeout = timeout;
        this.prediction = prediction;
        this.submittedAt = executionContext.getSubmittedAt();
    }

    public String getId() {
        return executionContext.getExecutionId();
    }

    public Workflow getWorkflow() {
        return executionContext.getWorkflow();
    }

    public Workflow getSubmittedWorkflow() {
        return submittedWorkflow;
    }

    public String getWorkflowName() {
        return submittedWorkflow.getName();
    }

    public WorkflowContext getContext() {
        return executionContext.getWorkflowContext();
    }

    public ExecutionOptions getOptions() {
        return executionContext.getOptions();
    }

    public ExecutionContext getExecutionContext() {
        return executionContext;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public ResourceRequest getResourceRequest() {
        return resourceRequest;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Prediction getPrediction() {
        return prediction;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public CompletableFuture<ExecutionResult> getFuture() {
        return future;
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getEndedAt() {
        return endedAt;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    public boolean isCancelled() {
        return executionContext.isCancelled();
    }

    /**
     * Context for the next attempt; attempts are numbered from one.
     */
    synchronized ExecutionContext nextAttempt() {
        return executionContext.withAttempt(retryCount + 1);
    }

    synchronized void markRunning() {
        status = ExecutionStatus.RUNNING;
        if (startedAt == null) {
            startedAt = Instant.now();
        }
    }

    /**
     * Remembers the worker task and timeout timer of the given attempt while that attempt is still
     * the running one; otherwise the timer is cancelled straight away.
     */
    synchronized void attachAttempt(int attempt, Future<?> task, Future<?> timer) {
        if (status != ExecutionStatus.RUNNING || attempt != retryCount + 1) {
            timer.cancel(false);
            return;
        }
        runningTask = task;
        timeoutTask = timer;
    }

    /**
     * Back to the queue for another attempt.
     */
    synchronized boolean requeue() {
        if (status != ExecutionStatus.RUNNING) {
            return false;
        }
        status = ExecutionStatus.QUEUED;
        retryCount++;
        detachAttempt();
        return true;
    }

    /**
     * Moves to a terminal state once; later calls lose.
     *
     * @return true when this call made the transition
     */
    synchronized boolean finish(ExecutionStatus terminal) {
        if (status.isTerminal()) {
            return false;
        }
        status = terminal;
        endedAt = Instant.now();
        detachAttempt();
        return true;
    }

    /**
     * Interrupts the running attempt, if any.
     */
    synchronized void interrupt() {
        if (runningTask != null) {
            runningTask.cancel(true);
        }
    }

    private void detachAttempt() {
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }
        runningTask = null;
        timeoutTask = null;
    }

    /**
     * Elapsed time since the first attempt started, or since submission when it never ran.
     */
    public synchronized long getDurationMs() {
        Instant from = startedAt != null ? startedAt : submittedAt;
        Instant to = endedAt != null ? endedAt : Instant.now();
        return Duration.between(from, to).toMillis();
    }

    public synchronized Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("executionId", getId());
        map.put("workflowName", getWorkflowName());
        map.put("strategy", strategyName);
        map.put("status", status.name());
        map.put("retryCount", retryCount);
        map.put("submittedAt", submittedAt.toString());
        if (startedAt != null) {
            map.put("startedAt", startedAt.toString());
        }
        if (endedAt != null) {
            map.put("endedAt", endedAt.toString());
        }
        return map;
    }

    @Override
    public String toString() {
        return "Execution{" +
               "id='" + getId() + '\'' +
               ", workflow='" + getWorkflowName() + '\'' +
               ", status=" + getStatus() +
               ", retryCount=" + getRetryCount() +
               '}';
    }
}
