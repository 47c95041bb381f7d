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

package dev.mars.sequor.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the Sequor workflow engine.
 *
 * Provides:
 * - sequor.workflow.active (gauge) - Currently running executions
 * - sequor.workflow.queue.depth (gauge) - Executions waiting in the queue
 * - sequor.workflow.total (counter) - Executions started
 * - sequor.workflow.completed (counter) - Successfully completed executions
 * - sequor.workflow.failed (counter) - Failed executions
 * - sequor.workflow.cancelled (counter) - Cancelled executions
 * - sequor.workflow.retried (counter) - Executions re-queued for retry
 * - sequor.workflow.steps.total (counter) - Steps executed
 * - sequor.workflow.steps.failed (counter) - Failed steps
 * - sequor.workflow.cache.hits / misses (counters) - Result cache lookups
 * - sequor.workflow.duration.seconds (histogram) - Execution duration distribution
 *
 * With no SDK installed the API is a no-op, so recording is always safe.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "sequor-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter executionsTotal;
    private final LongCounter executionsCompleted;
    private final LongCounter executionsFailed;
    private final LongCounter executionsCancelled;
    private final LongCounter executionsRetried;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final LongCounter cacheHits;
    private final LongCounter cacheMisses;

    private final DoubleHistogram executionDuration;

    private final AtomicLong activeExecutions = new AtomicLong(0);
    private volatile LongSupplier queueDepth = () -> 0L;

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> STRATEGY_KEY = AttributeKey.stringKey("execution.strategy");
    private static final AttributeKey<String> STEP_TYPE_KEY = AttributeKey.stringKey("step.type");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");
    private static final AttributeKey<String> CACHE_LEVEL_KEY = AttributeKey.stringKey("cache.level");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        executionsTotal = meter.counterBuilder("sequor.workflow.total")
                .setDescription("Total number of workflow executions started")
                .setUnit("1")
                .build();

        executionsCompleted = meter.counterBuilder("sequor.workflow.completed")
                .setDescription("Number of successfully completed workflow executions")
                .setUnit("1")
                .build();

        executionsFailed = meter.counterBuilder("sequor.workflow.failed")
                .setDescription("Number of failed workflow executions")
                .setUnit("1")
                .build();

        executionsCancelled = meter.counterBuilder("sequor.workflow.cancelled")
                .setDescription("Number of cancelled workflow executions")
                .setUnit("1")
                .build();

        executionsRetried = meter.counterBuilder("sequor.workflow.retried")
                .setDescription("Number of executions re-queued for retry")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("sequor.workflow.steps.total")
                .setDescription("Total number of workflow steps executed")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("sequor.workflow.steps.failed")
                .setDescription("Number of failed workflow steps")
                .setUnit("1")
                .build();

        cacheHits = meter.counterBuilder("sequor.workflow.cache.hits")
                .setDescription("Result cache hits")
                .setUnit("1")
                .build();

        cacheMisses = meter.counterBuilder("sequor.workflow.cache.misses")
                .setDescription("Result cache misses")
                .setUnit("1")
                .build();

        executionDuration = meter.histogramBuilder("sequor.workflow.duration.seconds")
                .setDescription("Workflow execution duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("sequor.workflow.active")
                .setDescription("Number of currently running workflow executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeExecutions.get()));

        meter.gaugeBuilder("sequor.workflow.queue.depth")
                .setDescription("Number of executions waiting in the queue")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(queueDepth.getAsLong()));

        logger.info("WorkflowMetrics initialized");
    }

    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    /**
     * Bind the queue depth gauge to a live source. The latest binding wins.
     */
    public void bindQueueDepth(LongSupplier source) {
        this.queueDepth = source != null ? source : () -> 0L;
    }

    public void recordExecutionStarted(String workflowName, String strategy) {
        executionsTotal.add(1, attributes(workflowName, strategy));
        activeExecutions.incrementAndGet();
    }

    public void recordExecutionCompleted(String workflowName, String strategy, double durationSeconds) {
        decrementActive();
        Attributes attrs = attributes(workflowName, strategy);
        executionsCompleted.add(1, attrs);
        executionDuration.record(durationSeconds, attrs);
    }

    public void recordExecutionFailed(String workflowName, String strategy, String failureReason) {
        decrementActive();
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STRATEGY_KEY, strategy)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        executionsFailed.add(1, attrs);
    }

    /**
     * Record a cancellation. {@code wasRunning} is false for executions cancelled while still queued.
     */
    public void recordExecutionCancelled(String workflowName, String strategy, boolean wasRunning) {
        if (wasRunning) {
            decrementActive();
        }
        executionsCancelled.add(1, attributes(workflowName, strategy));
    }

    /**
     * Record an execution handed back to the queue after a failed attempt.
     */
    public void recordExecutionRetried(String workflowName, String strategy) {
        decrementActive();
        executionsRetried.add(1, attributes(workflowName, strategy));
    }

    public void recordStepExecuted(String workflowName, String stepType) {
        stepsTotal.add(1, Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STEP_TYPE_KEY, stepType)
                .build());
    }

    public void recordStepFailed(String workflowName, String stepType, String failureReason) {
        stepsFailed.add(1, Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STEP_TYPE_KEY, stepType)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build());
    }

    public void recordCacheHit(String level) {
        cacheHits.add(1, Attributes.of(CACHE_LEVEL_KEY, level));
    }

    public void recordCacheMiss(String level) {
        cacheMisses.add(1, Attributes.of(CACHE_LEVEL_KEY, level));
    }

    public long getActiveExecutions() {
        return activeExecutions.get();
    }

    private void decrementActive() {
        activeExecutions.updateAndGet(current -> Math.max(0, current - 1));
    }

    private static Attributes attributes(String workflowName, String strategy) {
        return Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STRATEGY_KEY, strategy != null ? strategy : "unknown")
                .build();
    }
}
