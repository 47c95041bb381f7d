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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable alert raised by the execution monitor.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class Alert {

    private final AlertType type;
    private final String message;
    private final String executionId;
    private final Map<String, Object> data;
    private final Instant timestamp;

    public Alert(AlertType type, String message, String executionId, Map<String, Object> data) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.message = message;
        this.executionId = executionId;
        this.data = data != null ? Map.copyOf(data) : Map.of();
        this.timestamp = Instant.now();
    }

    public AlertType getType() {
        return type;
    }

    public AlertSeverity getSeverity() {
        return type.getSeverity();
    }

    public String getMessage() {
        return message;
    }

    /**
     * Execution the alert concerns, or null for system-level alerts.
     */
    public String getExecutionId() {
        return executionId;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.getValue());
        map.put("severity", getSeverity().name());
        map.put("message", message);
        if (executionId != null) {
            map.put("executionId", executionId);
        }
        if (!data.isEmpty()) {
            map.put("data", data);
        }
        map.put("timestamp", timestamp.toString());
        return map;
    }

    @Override
    public String toString() {
        return "Alert{" + type.getValue() + ", " + getSeverity() + ", '" + message + "'}";
    }
}
