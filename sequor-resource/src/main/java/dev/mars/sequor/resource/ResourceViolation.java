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

package dev.mars.sequor.resource;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A budget dimension running above its warning threshold.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class ResourceViolation {

    public enum Type {
        MEMORY,
        CPU,
        CONCURRENT
    }

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH
    }

    private final Type type;
    private final Severity severity;
    private final double utilizationPercent;
    private final String message;
    private final String topConsumer;
    private final Instant timestamp;

    public ResourceViolation(Type type, Severity severity, double utilizationPercent, String message,
                             String topConsumer) {
        this.type = Objects.requireNonNull(type, "Violation type cannot be null");
        this.severity = Objects.requireNonNull(severity, "Violation severity cannot be null");
        this.utilizationPercent = utilizationPercent;
        this.message = message;
        this.topConsumer = topConsumer;
        this.timestamp = Instant.now();
    }

    public Type getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getUtilizationPercent() {
        return utilizationPercent;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Execution holding the largest share of the violated dimension, or null for concurrency.
     */
    public String getTopConsumer() {
        return topConsumer;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.name().toLowerCase());
        map.put("severity", severity.name().toLowerCase());
        map.put("utilization", utilizationPercent);
        map.put("message", message);
        if (topConsumer != null) {
            map.put("topConsumer", topConsumer);
        }
        map.put("timestamp", timestamp.toString());
        return map;
    }

    @Override
    public String toString() {
        return "ResourceViolation{" + type + "/" + severity + ": " + message + '}';
    }
}
