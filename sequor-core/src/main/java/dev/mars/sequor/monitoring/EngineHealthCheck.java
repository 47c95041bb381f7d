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

package dev.mars.sequor.monitoring;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Health of the execution engine, built from the figures the engine reports about its queue,
 * resource budget, workers and alerts.
 *
 * <p>Each figure is judged here: the queue and the resource budget are degraded once they reach
 * the pressure threshold, the workers are down when the engine no longer accepts work, and the
 * monitor is degraded while it holds critical alerts. The overall status is DOWN when the engine
 * does not accept work, DEGRADED when any component is not UP, otherwise UP.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class EngineHealthCheck {

    public static final double DEFAULT_PRESSURE_PERCENT = 90.0;

    public static final String QUEUE = "queue";
    public static final String RESOURCES = "resources";
    public static final String WORKERS = "workers";
    public static final String MONITOR = "monitor";

    public enum Status {
        UP,
        DEGRADED,
        DOWN
    }

    /**
     * Judged state of one part of the engine.
     */
    public static final class Component {
        private final String name;
        private final Status status;
        private final String message;
        private final Map<String, Object> details;

        private Component(String name, Status status, String message, Map<String, Object> details) {
            this.name = name;
            this.status = status;
            this.message = message;
            this.details = Collections.unmodifiableMap(details);
        }

        public String getName() {
            return name;
        }

        public Status getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }

        public Map<String, Object> getDetails() {
            return details;
        }

        public boolean isHealthy() {
            return status == Status.UP;
        }

        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("component", name);
            map.put("status", status.name());
            if (message != null) {
                map.put("message", message);
            }
            map.put("details", new LinkedHashMap<>(details));
            return map;
        }
    }

    private final Instant timestamp;
    private final double pressurePercent;
    private final int queued;
    private final int queueCapacity;
    private final double memoryUtilization;
    private final double cpuUtilization;
    private final int activeAllocations;
    private final boolean acceptingWork;
    private final int activeExecutions;
    private final int runningExecutions;
    private final int maxConcurrent;
    private final int monitoredExecutions;
    private final int criticalAlerts;
    private final String lastCriticalAlert;
    private final List<Component> components;
    private final Status status;

    private EngineHealthCheck(Builder builder) {
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.pressurePercent = builder.pressurePercent;
        this.queued = builder.queued;
        this.queueCapacity = builder.queueCapacity;
        this.memoryUtilization = builder.memoryUtilization;
        this.cpuUtilization = builder.cpuUtilization;
        this.activeAllocations = builder.activeAllocations;
        this.acceptingWork = builder.acceptingWork;
        this.activeExecutions = builder.activeExecutions;
        this.runningExecutions = builder.runningExecutions;
        this.maxConcurrent = builder.maxConcurrent;
        this.monitoredExecutions = builder.monitoredExecutions;
        this.criticalAlerts = builder.criticalAlerts;
        this.lastCriticalAlert = builder.lastCriticalAlert;
        this.components = List.of(queueHealth(), resourceHealth(), workerHealth(), monitorHealth());
        this.status = deriveStatus();
    }

    private Component queueHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("queued", queued);
        details.put("capacity", queueCapacity);
        details.put("utilization", getQueueUtilization());
        if (getQueueUtilization() >= pressurePercent) {
            return new Component(QUEUE, Status.DEGRADED, String.format(Locale.ROOT,
                    "Queue is %.0f%% full", getQueueUtilization()), details);
        }
        return new Component(QUEUE, Status.UP, null, details);
    }

    private Component resourceHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("activeAllocations", activeAllocations);
        details.put("memoryUtilization", memoryUtilization);
        details.put("cpuUtilization", cpuUtilization);
        if (getResourcePressure() >= pressurePercent) {
            String limit = memoryUtilization >= cpuUtilization ? "memory" : "cpu";
            return new Component(RESOURCES, Status.DEGRADED, String.format(Locale.ROOT,
                    "Resource budget at %.0f%% of its %s limit", getResourcePressure(), limit), details);
        }
        return new Component(RESOURCES, Status.UP, null, details);
    }

    private Component workerHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("running", runningExecutions);
        details.put("maxConcurrent", maxConcurrent);
        if (!acceptingWork) {
            return new Component(WORKERS, Status.DOWN, "Workers are shut down", details);
        }
        return new Component(WORKERS, Status.UP, null, details);
    }

    private Component monitorHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("monitored", monitoredExecutions);
        details.put("criticalAlerts", criticalAlerts);
        if (criticalAlerts > 0) {
            return new Component(MONITOR, Status.DEGRADED,
                    lastCriticalAlert != null ? lastCriticalAlert : criticalAlerts + " critical alerts", details);
        }
        return new Component(MONITOR, Status.UP, null, details);
    }

    private Status deriveStatus() {
        if (!acceptingWork) {
            return Status.DOWN;
        }
        return components.stream().allMatch(Component::isHealthy) ? Status.UP : Status.DEGRADED;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isHealthy() {
        return status == Status.UP;
    }

    /**
     * Why the engine is not UP, or null when it is.
     */
    public String getMessage() {
        if (!acceptingWork) {
            return "Execution engine is shut down";
        }
        String problems = components.stream()
                .filter(component -> !component.isHealthy())
                .map(Component::getMessage)
                .collect(Collectors.joining("; "));
        return problems.isEmpty() ? null : problems;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public List<Component> getComponents() {
        return components;
    }

    public Component getComponent(String name) {
        for (Component component : components) {
            if (component.getName().equals(name)) {
                return component;
            }
        }
        throw new IllegalArgumentException("Unknown component: " + name);
    }

    public double getQueueUtilization() {
        return queueCapacity > 0 ? (double) queued / queueCapacity * 100.0 : 0.0;
    }

    public double getResourcePressure() {
        return Math.max(memoryUtilization, cpuUtilization);
    }

    public int getCriticalAlerts() {
        return criticalAlerts;
    }

    public int getActiveExecutions() {
        return activeExecutions;
    }

    public int getRunningExecutions() {
        return runningExecutions;
    }

    public boolean isAcceptingWork() {
        return acceptingWork;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.name());
        map.put("timestamp", timestamp.toString());
        String message = getMessage();
        if (message != null) {
            map.put("message", message);
        }
        List<Map<String, Object>> componentMaps = new ArrayList<>();
        components.forEach(component -> componentMaps.add(component.toMap()));
        map.put("components", componentMaps);

        Map<String, Object> system = new LinkedHashMap<>();
        system.put("activeExecutions", activeExecutions);
        system.put("runningExecutions", runningExecutions);
        system.put("queueSize", queued);
        map.put("system", system);

        long healthy = components.stream().filter(Component::isHealthy).count();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalComponents", components.size());
        summary.put("healthyComponents", healthy);
        summary.put("unhealthyComponents", components.size() - healthy);
        map.put("summary", summary);
        return map;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Instant timestamp;
        private double pressurePercent = DEFAULT_PRESSURE_PERCENT;
        private int queued;
        private int queueCapacity;
        private double memoryUtilization;
        private double cpuUtilization;
        private int activeAllocations;
        private boolean acceptingWork = true;
        private int activeExecutions;
        private int runningExecutions;
        private int maxConcurrent;
        private int monitoredExecutions;
        private int criticalAlerts;
        private String lastCriticalAlert;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Utilization, in percent, at which the queue and the resource budget count as degraded.
         */
        public Builder pressurePercent(double pressurePercent) {
            this.pressurePercent = pressurePercent;
            return this;
        }

        public Builder queue(int queued, int capacity) {
            this.queued = queued;
            this.queueCapacity = capacity;
            return this;
        }

        public Builder resources(double memoryUtilization, double cpuUtilization, int activeAllocations) {
            this.memoryUtilization = memoryUtilization;
            this.cpuUtilization = cpuUtilization;
            this.activeAllocations = activeAllocations;
            return this;
        }

        public Builder workers(boolean acceptingWork, int runningExecutions, int maxConcurrent) {
            this.acceptingWork = acceptingWork;
            this.runningExecutions = runningExecutions;
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder activeExecutions(int activeExecutions) {
            this.activeExecutions = activeExecutions;
            return this;
        }

        public Builder alerts(int monitoredExecutions, int criticalAlerts, String lastCriticalAlert) {
            this.monitoredExecutions = monitoredExecutions;
            this.criticalAlerts = criticalAlerts;
            this.lastCriticalAlert = lastCriticalAlert;
            return this;
        }

        public EngineHealthCheck build() {
            return new EngineHealthCheck(this);
        }
    }
}
