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

package dev.mars.sequor.workflow.monitoring;

import dev.mars.sequor.config.SequorConfiguration;
import dev.mars.sequor.core.ExecutionResult;
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * In-memory execution and step metrics.
 *
 * <p>Keeps one record per execution from {@link #recordExecutionStart} until it ages out through
 * {@link #cleanup()}, and lifetime aggregates that survive cleanup. Thread-safe.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class ExecutionMetrics {

    private static final Logger logger = Logger.getLogger(ExecutionMetrics.class.getName());
    static final long REAL_TIME_WINDOW_MS = 60_000;

    private final Object lock = new Object();
    private final Map<String, ExecutionRecord> records = new HashMap<>();
    private final long retentionMs;
    private final int maxHistory;

    private long totalExecutions;
    private long successfulExecutions;
    private long failedExecutions;
    private long totalExecutionTimeMs;
    private long totalSteps;
    private long totalStepTimeMs;
    private long totalRetries;
    private long cacheHits;
    private long cacheMisses;
    private final Map<String, Long> errorsByKind = new LinkedHashMap<>();
    private long lastUpdated = System.currentTimeMillis();

    public ExecutionMetrics() {
        this(Duration.ofHours(24), 10_000);
    }

    public ExecutionMetrics(SequorConfiguration configuration) {
        this(Duration.ofMillis(configuration.getMetricsRetentionMs()), configuration.getMetricsMaxHistory());
    }

    public ExecutionMetrics(Duration retention, int maxHistory) {
        if (maxHistory <= 0) {
            throw new IllegalArgumentException("maxHistory must be positive");
        }
        this.retentionMs = retention.toMillis();
        this.maxHistory = maxHistory;
    }

    public void recordExecutionStart(String executionId, String workflowName, int stepCount) {
        long now = System.currentTimeMillis();
        synchronized (lock) {
            records.put(executionId, new ExecutionRecord(executionId, workflowName, stepCount, now));
        }
        logger.fine("Metrics: execution " + executionId + " started (" + workflowName + ", " + stepCount + " steps)");
    }

    /**
     * Close the record for an execution and fold it into the aggregates.
     * A second end for the same execution is ignored.
     */
    public void recordExecutionEnd(String executionId, ExecutionResult result) {
        long now = System.currentTimeMillis();
        synchronized (lock) {
            ExecutionRecord record = records.get(executionId);
            if (record == null) {
                logger.warning("No metrics record for execution " + executionId);
                return;
            }
            if (record.isEnded()) {
                return;
            }
            record.endTime = now;
            record.durationMs = now - record.startTime;
            record.success = result != null && result.isSuccess();

            totalExecutions++;
            if (record.success) {
                successfulExecutions++;
            } else {
                failedExecutions++;
            }
            totalExecutionTimeMs += record.durationMs;
            lastUpdated = now;
        }
    }

    public void recordStepStart(String executionId, int index, String name, StepType type) {
        long now = System.currentTimeMillis();
        synchronized (lock) {
            ExecutionRecord record = records.get(executionId);
            if (record != null) {
                record.steps.put(index, new ExecutionRecord.StepRecord(index, name, type, now));
            }
        }
    }

    public void recordStepEnd(String executionId, StepResult result) {
        long now = System.currentTimeMillis();
        synchronized (lock) {
            ExecutionRecord record = records.get(executionId);
            if (record == null) {
                return;
            }
            record.endStep(result, now);
            totalSteps++;
            totalStepTimeMs += result.getDurationMs();
            lastUpdated = now;
        }
    }

    public void recordError(String executionId, WorkflowExecutionException error) {
        long now = System.currentTimeMillis();
        synchronized (lock) {
            errorsByKind.merge(error.getKind().name(), 1L, Long::sum);
            ExecutionRecord record = records.get(executionId);
            if (record != null) {
                record.errors.add(new ExecutionRecord.ErrorRecord(error.getKind(), error.getMessage(),
                        error.getStepIndex(), now));
            }
        }
        logger.fine("Metrics: " + error.getKind() + " error recorded for " + executionId);
    }

    public void recordRetry(String executionId) {
        synchronized (lock) {
            totalRetries++;
            ExecutionRecord record = records.get(executionId);
            if (record != null) {
                record.retryAttempts++;
            }
        }
    }

    /**
     * Count a cache hit. The execution id may be null for lookups made before an execution exists.
     */
    public void recordCacheHit(String executionId) {
        synchronized (lock) {
            cacheHits++;
            ExecutionRecord record = executionId != null ? records.get(executionId) : null;
            if (record != null) {
                record.cacheHits++;
            }
        }
    }

    public void recordCacheMiss(String executionId) {
        synchronized (lock) {
            cacheMisses++;
            ExecutionRecord record = executionId != null ? records.get(executionId) : null;
            if (record != null) {
                record.cacheMisses++;
            }
        }
    }

    public AggregatedMetrics getAggregatedMetrics() {
        long now = System.currentTimeMillis();
        synchronized (lock) {
            long throughput = records.values().stream()
                    .filter(r -> r.isEnded() && now - r.endTime < REAL_TIME_WINDOW_MS)
                    .count();
            return new AggregatedMetrics(
                    totalExecutions,
                    successfulExecutions,
                    failedExecutions,
                    totalExecutions > 0 ? (double) totalExecutionTimeMs / totalExecutions : 0.0,
                    totalSteps > 0 ? (double) totalStepTimeMs / totalSteps : 0.0,
                    totalSteps,
                    throughput,
                    totalRetries,
                    cacheHits,
                    cacheMisses,
                    errorsByKind,
                    lastUpdated);
        }
    }

    public RealTimeMetrics getRealTimeMetrics() {
        long now = System.currentTimeMillis();
        synchronized (lock) {
            int active = 0;
            int recent = 0;
            int recentFailed = 0;
            long recentDuration = 0;
            for (ExecutionRecord record : records.values()) {
                if (!record.isEnded()) {
                    active++;
                } else if (now - record.endTime < REAL_TIME_WINDOW_MS) {
                    recent++;
                    recentDuration += record.durationMs;
                    if (!record.success) {
                        recentFailed++;
                    }
                }
            }
            return new RealTimeMetrics(active, recent,
                    recent > 0 ? (double) recentDuration / recent : 0.0,
                    recent > 0 ? (double) recentFailed / recent : 0.0);
        }
    }

    public Optional<ExecutionSummary> getExecutionSummary(String executionId) {
        long now = System.currentTimeMillis();
        synchronized (lock) {
            ExecutionRecord record = records.get(executionId);
            return record != null ? Optional.of(new ExecutionSummary(record, now)) : Optional.empty();
        }
    }

    public List<Map<String, Object>> getErrors(String executionId) {
        synchronized (lock) {
            ExecutionRecord record = records.get(executionId);
            List<Map<String, Object>> errors = new ArrayList<>();
            if (record != null) {
                for (ExecutionRecord.ErrorRecord error : record.errors) {
                    errors.add(error.toMap());
                }
            }
            return errors;
        }
    }

    /**
     * Summary of stored records and both metric views, used by the engine's system report.
     */
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("aggregated", getAggregatedMetrics().toMap());
        summary.put("realTime", getRealTimeMetrics().toMap());
        summary.put("storedExecutions", size());
        return summary;
    }

    /**
     * Drop ended records older than the retention window, then cap the store at {@code maxHistory},
     * keeping running executions and the most recently ended ones.
     *
     * @return number of records removed
     */
    public int cleanup() {
        long cutoff = System.currentTimeMillis() - retentionMs;
        int removed = 0;
        synchronized (lock) {
            Iterator<ExecutionRecord> iterator = records.values().iterator();
            while (iterator.hasNext()) {
                ExecutionRecord record = iterator.next();
                if (record.isEnded() && record.endTime < cutoff) {
                    iterator.remove();
                    removed++;
                }
            }

            if (records.size() > maxHistory) {
                List<ExecutionRecord> ordered = new ArrayList<>(records.values());
                ordered.sort(Comparator.comparingLong(ExecutionMetrics::recency).reversed());
                for (ExecutionRecord record : ordered.subList(maxHistory, ordered.size())) {
                    records.remove(record.executionId);
                    removed++;
                }
            }
        }
        if (removed > 0) {
            logger.fine("Metrics cleanup removed " + removed + " execution records");
        }
        return removed;
    }

    public int size() {
        synchronized (lock) {
            return records.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            records.clear();
            errorsByKind.clear();
            totalExecutions = 0;
            successfulExecutions = 0;
            failedExecutions = 0;
            totalExecutionTimeMs = 0;
            totalSteps = 0;
            totalStepTimeMs = 0;
            totalRetries = 0;
            cacheHits = 0;
            cacheMisses = 0;
            lastUpdated = System.currentTimeMillis();
        }
        logger.info("Execution metrics cleared");
    }

    private static long recency(ExecutionRecord record) {
        return record.isEnded() ? record.endTime : Long.MAX_VALUE;
    }
}
