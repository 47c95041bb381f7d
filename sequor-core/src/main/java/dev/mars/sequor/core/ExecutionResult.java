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

package dev.mars.sequor.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable result of one workflow execution.
 * <p>
 * A result with {@code success=false} is a normal outcome (a step failed); errors that abort
 * the execution altogether surface as a {@code WorkflowExecutionException} instead.
 * {@code output} holds the data written by the steps, keyed by step name, or the return value
 * of {@link Workflow#execute(WorkflowContext)} for workflows without steps.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public final class ExecutionResult {

    private final String executionId;
    private final String workflowName;
    private final String strategy;
    private final boolean success;
    private final long durationMs;
    private final long completedAt;
    private final List<StepResult> stepResults;
    private final Map<String, Object> output;
    private final Map<String, Object> metadata;
    private final String error;
    private final boolean fromCache;

    private ExecutionResult(Builder builder) {
        this.executionId = builder.executionId;
        this.workflowName = Objects.requireNonNull(builder.workflowName, "Workflow name cannot be null");
        this.strategy = builder.strategy;
        this.success = builder.success;
        this.durationMs = builder.durationMs;
        this.completedAt = builder.completedAt > 0 ? builder.completedAt : System.currentTimeMillis();
        this.stepResults = List.copyOf(builder.stepResults);
        this.output = Collections.unmodifiableMap(new LinkedHashMap<>(builder.output));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.error = builder.error;
        this.fromCache = builder.fromCache;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getStrategy() {
        return strategy;
    }

    public boolean isSuccess() {
        return success;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public long getCompletedAt() {
        return completedAt;
    }

    public List<StepResult> getStepResults() {
        return stepResults;
    }

    public Map<String, Object> getOutput() {
        return output;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getError() {
        return error;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    @JsonIgnore
    public List<StepResult> getSuccessfulSteps() {
        return stepResults.stream()
                .filter(StepResult::isSuccessful)
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public List<StepResult> getFailedSteps() {
        return stepResults.stream()
                .filter(step -> step.getStatus() == StepStatus.FAILED)
                .collect(Collectors.toList());
    }

    public ExecutionResult withExecutionId(String executionId) {
        return toBuilder().executionId(executionId).build();
    }

    /**
     * Copy served from cache for a new execution: new id, zero duration.
     */
    public ExecutionResult asCachedFor(String executionId) {
        return toBuilder()
                .executionId(executionId)
                .durationMs(0)
                .completedAt(System.currentTimeMillis())
                .fromCache(true)
                .build();
    }

    public ExecutionResult withMetadata(String key, Object value) {
        return toBuilder().metadata(key, value).build();
    }

    /**
     * Flattened summary for logging and reporting.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("executionId", executionId);
        map.put("workflowName", workflowName);
        map.put("strategy", strategy);
        map.put("success", success);
        map.put("durationMs", durationMs);
        map.put("totalSteps", stepResults.size());
        map.put("successfulSteps", getSuccessfulSteps().size());
        map.put("failedSteps", getFailedSteps().size());
        map.put("fromCache", fromCache);
        if (error != null) {
            map.put("error", error);
        }
        if (!metadata.isEmpty()) {
            map.put("metadata", metadata);
        }
        return map;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .executionId(executionId)
                .workflowName(workflowName)
                .strategy(strategy)
                .success(success)
                .durationMs(durationMs)
                .completedAt(completedAt)
                .stepResults(stepResults)
                .output(output)
                .error(error)
                .fromCache(fromCache);
        builder.metadata.putAll(metadata);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
               "executionId='" + executionId + '\'' +
               ", workflowName='" + workflowName + '\'' +
               ", strategy='" + strategy + '\'' +
               ", success=" + success +
               ", durationMs=" + durationMs +
               ", steps=" + stepResults.size() +
               ", fromCache=" + fromCache +
               '}';
    }

    /**
     * Builder for ExecutionResult.
     */
    public static class Builder {
        private String executionId;
        private String workflowName;
        private String strategy;
        private boolean success;
        private long durationMs;
        private long completedAt;
        private final List<StepResult> stepResults = new ArrayList<>();
        private final Map<String, Object> output = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String error;
        private boolean fromCache;

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder strategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder completedAt(long completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder stepResults(List<StepResult> stepResults) {
            this.stepResults.clear();
            if (stepResults != null) {
                this.stepResults.addAll(stepResults);
            }
            return this;
        }

        public Builder stepResult(StepResult stepResult) {
            this.stepResults.add(stepResult);
            return this;
        }

        public Builder output(Map<String, Object> output) {
            this.output.clear();
            if (output != null) {
                this.output.putAll(output);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder fromCache(boolean fromCache) {
            this.fromCache = fromCache;
            return this;
        }

        public ExecutionResult build() {
            return new ExecutionResult(this);
        }
    }
}
