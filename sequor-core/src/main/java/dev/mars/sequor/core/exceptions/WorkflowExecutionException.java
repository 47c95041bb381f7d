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

package dev.mars.sequor.core.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exception raised for every failure of a workflow execution.
 * <p>
 * The failure is identified by its {@link ErrorKind} and carries a contextual
 * payload: the execution id, the workflow name, the step index and name where
 * applicable, and kind-specific details (for example {@code resourceType},
 * {@code required} and {@code available} for {@link ErrorKind#RESOURCE}).
 * Callers are expected to switch on {@link #getKind()} rather than on subclasses.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class WorkflowExecutionException extends SequorException {

    private static final long serialVersionUID = 1L;

    public static final String DETAIL_RESOURCE_TYPE = "resourceType";
    public static final String DETAIL_REQUIRED = "required";
    public static final String DETAIL_AVAILABLE = "available";
    public static final String DETAIL_TIMEOUT_SCOPE = "timeoutScope";
    public static final String DETAIL_TIMEOUT_MS = "timeoutMs";
    public static final String DETAIL_DEPENDENCY_ID = "dependencyId";
    public static final String DETAIL_CIRCULAR = "circular";
    public static final String DETAIL_ATTEMPT = "attempt";
    public static final String DETAIL_MAX_ATTEMPTS = "maxAttempts";
    public static final String DETAIL_STRATEGY = "strategy";
    public static final String DETAIL_SERVICE = "service";
    public static final String DETAIL_FIELD = "field";
    public static final String DETAIL_REASON = "reason";
    public static final String DETAIL_CANCELLED = "cancelled";

    private final ErrorKind kind;
    private final String executionId;
    private final String workflowName;
    private final Integer stepIndex;
    private final String stepName;
    private final boolean retryable;
    private final Map<String, Object> details;

    private WorkflowExecutionException(Builder builder) {
        super(builder.message, builder.cause);
        this.kind = Objects.requireNonNull(builder.kind, "Error kind cannot be null");
        this.executionId = builder.executionId;
        this.workflowName = builder.workflowName;
        this.stepIndex = builder.stepIndex;
        this.stepName = builder.stepName;
        this.retryable = builder.retryable != null ? builder.retryable : builder.kind.isRetryableByDefault();
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public Integer getStepIndex() {
        return stepIndex;
    }

    public String getStepName() {
        return stepName;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Object getDetail(String key) {
        return details.get(key);
    }

    public boolean isCancellation() {
        return Boolean.TRUE.equals(details.get(DETAIL_CANCELLED));
    }

    /**
     * Returns a copy of this exception with the execution coordinates filled in.
     * Values already present are kept.
     */
    public WorkflowExecutionException withExecution(String executionId, String workflowName) {
        if (Objects.equals(this.executionId, executionId) && Objects.equals(this.workflowName, workflowName)) {
            return this;
        }
        Builder builder = toBuilder();
        if (builder.executionId == null) {
            builder.executionId = executionId;
        }
        if (builder.workflowName == null) {
            builder.workflowName = workflowName;
        }
        WorkflowExecutionException copy = builder.build();
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    /**
     * Flattens the error into a map suitable for results, logs and alerts.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("kind", kind.getValue());
        map.put("message", getMessage());
        map.put("retryable", retryable);
        if (executionId != null) {
            map.put("executionId", executionId);
        }
        if (workflowName != null) {
            map.put("workflowName", workflowName);
        }
        if (stepIndex != null) {
            map.put("stepIndex", stepIndex);
        }
        if (stepName != null) {
            map.put("stepName", stepName);
        }
        if (!details.isEmpty()) {
            map.put("details", new LinkedHashMap<>(details));
        }
        return map;
    }

    @Override
    public String toString() {
        return "WorkflowExecutionException{" +
                "kind=" + kind +
                ", message='" + getMessage() + '\'' +
                ", executionId='" + executionId + '\'' +
                ", workflowName='" + workflowName + '\'' +
                (stepName != null ? ", step=" + stepIndex + ":" + stepName : "") +
                '}';
    }

    public Builder toBuilder() {
        Builder builder = new Builder(kind, getMessage())
                .cause(getCause())
                .executionId(executionId)
                .workflowName(workflowName)
                .step(stepIndex, stepName)
                .retryable(retryable);
        builder.details.putAll(details);
        return builder;
    }

    public static Builder builder(ErrorKind kind, String message) {
        return new Builder(kind, message);
    }

    // Factory methods, one per error kind

    public static WorkflowExecutionException strategyFailure(String strategy, String message, Throwable cause) {
        return builder(ErrorKind.STRATEGY_EXECUTION, message)
                .detail(DETAIL_STRATEGY, strategy)
                .cause(cause)
                .build();
    }

    public static WorkflowExecutionException stepFailure(int stepIndex, String stepName, int attempt,
                                                         int maxAttempts, String message, Throwable cause) {
        return builder(ErrorKind.STEP_EXECUTION, message)
                .step(stepIndex, stepName)
                .detail(DETAIL_ATTEMPT, attempt)
                .detail(DETAIL_MAX_ATTEMPTS, maxAttempts)
                .retryable(attempt < maxAttempts)
                .cause(cause)
                .build();
    }

    public static WorkflowExecutionException timeout(TimeoutScope scope, long timeoutMs, String message) {
        return builder(ErrorKind.TIMEOUT, message)
                .detail(DETAIL_TIMEOUT_SCOPE, scope.name().toLowerCase())
                .detail(DETAIL_TIMEOUT_MS, timeoutMs)
                .build();
    }

    public static WorkflowExecutionException resource(String resourceType, Number required, Number available,
                                                      String message) {
        return builder(ErrorKind.RESOURCE, message)
                .detail(DETAIL_RESOURCE_TYPE, resourceType)
                .detail(DETAIL_REQUIRED, required)
                .detail(DETAIL_AVAILABLE, available)
                .build();
    }

    public static WorkflowExecutionException dependency(String dependencyId, boolean circular, String message) {
        return builder(ErrorKind.DEPENDENCY, message)
                .detail(DETAIL_DEPENDENCY_ID, dependencyId)
                .detail(DETAIL_CIRCULAR, circular)
                .build();
    }

    public static WorkflowExecutionException validation(String field, String message) {
        return builder(ErrorKind.VALIDATION, message)
                .detail(DETAIL_FIELD, field)
                .build();
    }

    public static WorkflowExecutionException optimization(String message, Throwable cause) {
        return builder(ErrorKind.OPTIMIZATION, message).cause(cause).build();
    }

    public static WorkflowExecutionException cache(String message, Throwable cause) {
        return builder(ErrorKind.CACHE, message).cause(cause).build();
    }

    public static WorkflowExecutionException monitoring(String message, Throwable cause) {
        return builder(ErrorKind.MONITORING, message).cause(cause).build();
    }

    public static WorkflowExecutionException queue(String executionId, String message) {
        return builder(ErrorKind.QUEUE, message).executionId(executionId).build();
    }

    public static WorkflowExecutionException scheduler(String executionId, String reason, String message) {
        return builder(ErrorKind.SCHEDULER, message)
                .executionId(executionId)
                .detail(DETAIL_REASON, reason)
                .build();
    }

    public static WorkflowExecutionException context(String message, Throwable cause) {
        return builder(ErrorKind.CONTEXT, message).cause(cause).build();
    }

    public static WorkflowExecutionException result(String message) {
        return builder(ErrorKind.RESULT, message).build();
    }

    public static WorkflowExecutionException externalService(String service, int attempt, int maxAttempts,
                                                             String message, Throwable cause) {
        return builder(ErrorKind.EXTERNAL_SERVICE, message)
                .detail(DETAIL_SERVICE, service)
                .detail(DETAIL_ATTEMPT, attempt)
                .detail(DETAIL_MAX_ATTEMPTS, maxAttempts)
                .retryable(attempt < maxAttempts)
                .cause(cause)
                .build();
    }

    public static WorkflowExecutionException configuration(String key, String message) {
        return builder(ErrorKind.CONFIGURATION, message)
                .detail(DETAIL_FIELD, key)
                .build();
    }

    /**
     * What a {@link ErrorKind#TIMEOUT} applies to.
     */
    public enum TimeoutScope {
        EXECUTION,
        STEP,
        RESOURCE
    }

    /**
     * Builder for WorkflowExecutionException.
     */
    public static class Builder {
        private final ErrorKind kind;
        private final String message;
        private Throwable cause;
        private String executionId;
        private String workflowName;
        private Integer stepIndex;
        private String stepName;
        private Boolean retryable;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(ErrorKind kind, String message) {
            this.kind = kind;
            this.message = message;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder step(Integer stepIndex, String stepName) {
            this.stepIndex = stepIndex;
            this.stepName = stepName;
            return this;
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder detail(String key, Object value) {
            if (value != null) {
                this.details.put(key, value);
            }
            return this;
        }

        public WorkflowExecutionException build() {
            return new WorkflowExecutionException(this);
        }
    }
}
