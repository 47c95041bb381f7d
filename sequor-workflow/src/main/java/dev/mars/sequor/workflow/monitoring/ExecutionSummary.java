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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-execution roll-up. Rates are percentages in the range 0-100.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class ExecutionSummary {

    private final String executionId;
    private final String workflowName;
    private final long durationMs;
    private final boolean finished;
    private final int stepCount;
    private final int completedSteps;
    private final int failedSteps;
    private final int cacheHits;
    private final int cacheMisses;
    private final int retryAttempts;
    private final int errorCount;
    private final double averageStepDurationMs;

    ExecutionSummary(ExecutionRecord record, long now) {
        this.executionId = record.executionId;
        this.workflowName = record.workflowName;
        this.durationMs = record.isEnded() ? record.durationMs : now - record.startTime;
        this.finished = record.isEnded();
        this.stepCount = record.stepCount;
        this.completedSteps = record.completedSteps;
        this.failedSteps = record.failedSteps;
        this.cacheHits = record.cacheHits;
        this.cacheMisses = record.cacheMisses;
        this.retryAttempts = record.retryAttempts;
        this.errorCount = record.errors.size();
        this.averageStepDurationMs = record.averageStepDurationMs();
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public boolean isFinished() {
        return finished;
    }

    public int getStepCount() {
        return stepCount;
    }

    public int getCompletedSteps() {
        return completedSteps;
    }

    public int getFailedSteps() {
        return failedSteps;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public double getAverageStepDurationMs() {
        return averageStepDurationMs;
    }

    public double getSuccessRate() {
        return stepCount > 0 ? completedSteps * 100.0 / stepCount : 0.0;
    }

    public double getCacheHitRate() {
        int lookups = cacheHits + cacheMisses;
        return lookups > 0 ? cacheHits * 100.0 / lookups : 0.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("executionId", executionId);
        map.put("workflowName", workflowName);
        map.put("durationMs", durationMs);
        map.put("finished", finished);
        map.put("stepCount", stepCount);
        map.put("completedSteps", completedSteps);
        map.put("failedSteps", failedSteps);
        map.put("successRate", getSuccessRate());
        map.put("cacheHitRate", getCacheHitRate());
        map.put("retryAttempts", retryAttempts);
        map.put("errorCount", errorCount);
        map.put("averageStepDurationMs", averageStepDurationMs);
        return map;
    }
}
