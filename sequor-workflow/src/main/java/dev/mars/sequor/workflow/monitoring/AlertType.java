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

/**
 * Kinds of alert raised by {@link ExecutionMonitor}, each with its fixed severity.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public enum AlertType {
    EXECUTION_TIMEOUT("execution_timeout", AlertSeverity.CRITICAL),
    EXECUTION_STALLED("execution_stalled", AlertSeverity.WARNING),
    MEMORY_EXCEEDED("memory_exceeded", AlertSeverity.WARNING),
    CPU_EXCEEDED("cpu_exceeded", AlertSeverity.WARNING),
    ERROR_THRESHOLD("error_threshold", AlertSeverity.ERROR),
    ERROR_RATE("error_rate", AlertSeverity.ERROR),
    STEP_FAILURE("step_failure", AlertSeverity.ERROR),
    PERFORMANCE_DEGRADATION("performance_degradation", AlertSeverity.WARNING),
    QUEUE_BACKLOG("queue_backlog", AlertSeverity.WARNING),
    RESOURCE_SHORTAGE("resource_shortage", AlertSeverity.WARNING);

    private final String value;
    private final AlertSeverity severity;

    AlertType(String value, AlertSeverity severity) {
        this.value = value;
        this.severity = severity;
    }

    public String getValue() {
        return value;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }
}
