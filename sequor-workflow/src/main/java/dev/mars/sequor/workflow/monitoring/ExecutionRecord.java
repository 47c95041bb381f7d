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

import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.exceptions.ErrorKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable per-execution record kept by {@link ExecutionMetrics}. All access happens under the metrics lock.
 */
final class ExecutionRecord {

    static final class StepRecord {
        final int index;
        final String name;
        final StepType type;
        final long startTime;
        long endTime;
        long durationMs;
        boolean success;
        boolean fromCache;

        StepRecord(int index, String name, StepType type, long startTime) {
            this.index = index;
            this.name = name;
            this.type = type;
            this.startTime = startTime;
        }
    }

    static final class ErrorRecord {
        final ErrorKind kind;
        final String message;
        final Integer stepIndex;
        final long timestamp;

        ErrorRecord(ErrorKind kind, String message, Integer stepIndex, long timestamp) {
            this.kind = kind;
            this.message = message;
            this.stepIndex = stepIndex;
            this.timestamp = timestamp;
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("kind", kind.name());
            map.put("message", message);
            if (stepIndex != null) {
                map.put("stepIndex", stepIndex);
            }
            map.put("timestamp", timestamp);
            return map;
        }
    }

    final String executionId;
    final String workflowName;
    final int stepCount;
    final long startTime;
    long endTime;
    long durationMs;
    boolean success;
    int completedSteps;
    int failedSteps;
    int cacheHits;
    int cacheMisses;
    int retryAttempts;
    final Map<Integer, StepRecord> steps = new LinkedHashMap<>();
    final List<ErrorRecord> errors = new ArrayList<>();

    ExecutionRecord(String executionId, String workflowName, int stepCount, long startTime) {
        this.executionId = executionId;
        this.workflowName = workflowName;
        this.stepCount = stepCount;
        this.startTime = startTime;
    }

    boolean isEnded() {
        return endTime > 0;
    }

    void endStep(StepResult result, long now) {
        StepRecord step = steps.get(result.getIndex());
        if (step == null) {
            step = new StepRecord(result.getIndex(), result.getName(), result.getType(), now - result.getDurationMs());
            steps.put(result.getIndex(), step);
        }
        step.endTime = now;
        step.durationMs = result.getDurationMs();
        step.success = result.isSuccessful();
        step.fromCache = result.isFromCache();
        if (step.success) {
            completedSteps++;
        } else {
            failedSteps++;
        }
    }

    double averageStepDurationMs() {
        long total = 0;
        int count = 0;
        for (StepRecord step : steps.values()) {
            if (step.endTime > 0) {
                total += step.durationMs;
                count++;
            }
        }
        return count > 0 ? (double) total / count : 0.0;
    }
}
