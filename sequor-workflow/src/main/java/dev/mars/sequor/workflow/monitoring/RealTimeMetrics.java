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
 * Figures over the trailing one-minute window.
 */
public class RealTimeMetrics {

    private final int activeExecutions;
    private final int executionsPerMinute;
    private final double averageResponseTimeMs;
    private final double errorRate;

    RealTimeMetrics(int activeExecutions, int executionsPerMinute, double averageResponseTimeMs, double errorRate) {
        this.activeExecutions = activeExecutions;
        this.executionsPerMinute = executionsPerMinute;
        this.averageResponseTimeMs = averageResponseTimeMs;
        this.errorRate = errorRate;
    }

    public int getActiveExecutions() {
        return activeExecutions;
    }

    public int getExecutionsPerMinute() {
        return executionsPerMinute;
    }

    public double getAverageResponseTimeMs() {
        return averageResponseTimeMs;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("activeExecutions", activeExecutions);
        map.put("executionsPerMinute", executionsPerMinute);
        map.put("averageResponseTimeMs", averageResponseTimeMs);
        map.put("errorRate", errorRate);
        return map;
    }
}
