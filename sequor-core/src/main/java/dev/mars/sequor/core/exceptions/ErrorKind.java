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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of failure kinds an execution can report.
 * Every error raised by the engine carries exactly one of these kinds, and
 * unrecognised errors are mapped onto the closest kind by {@link ErrorClassifier}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public enum ErrorKind {

    STRATEGY_EXECUTION("strategy_execution", "Execution strategy failed", false),
    STEP_EXECUTION("step_execution", "Workflow step failed", true),
    TIMEOUT("timeout", "Operation exceeded its time limit", true),
    RESOURCE("resource", "Insufficient resources", false),
    DEPENDENCY("dependency", "Dependency missing or circular", false),
    VALIDATION("validation", "Invalid workflow, context or options", false),
    OPTIMIZATION("optimization", "Workflow optimization failed", false),
    CACHE("cache", "Result cache failure", false),
    MONITORING("monitoring", "Monitoring failure", false),
    QUEUE("queue", "Execution queue rejected the request", false),
    SCHEDULER("scheduler", "Execution could not be scheduled", false),
    CONTEXT("context", "Workflow context failure", false),
    RESULT("result", "Invalid execution result", false),
    EXTERNAL_SERVICE("external_service", "External collaborator failed", true),
    CONFIGURATION("configuration", "Invalid configuration", false);

    private final String value;
    private final String description;
    private final boolean retryable;

    ErrorKind(String value, String description, boolean retryable) {
        this.value = value;
        this.description = description;
        this.retryable = retryable;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether errors of this kind are retryable unless the raiser says otherwise.
     */
    public boolean isRetryableByDefault() {
        return retryable;
    }

    public static ErrorKind fromValue(String value) {
        for (ErrorKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown error kind: " + value);
    }
}
