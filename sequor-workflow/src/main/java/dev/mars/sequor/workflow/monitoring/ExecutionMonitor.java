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

import dev.mars.sequor.config.SequorConfiguration;
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Watches running executions and system figures and raises {@link Alert}s.
 *
 * <p>Per-execution alerts (timeout, stall, error threshold, step failure fraction) fire at most once
 * per condition until the condition clears. System alerts are rate-limited per type. The alert list
 * keeps the newest {@code maxAlerts} entries.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class ExecutionMonitor {

    private static final Logger logger = Logger.getLogger(ExecutionMonitor.class.getName());
    static final long SYSTEM_ALERT_COOLDOWN_MS = 60_000;
    private static final int STATUS_RECENT_ALERTS = 10;
    private static final int BASELINE_MIN_SAMPLES = 3;

    private static final class Monitored {
        final String executionId;
        final String workflowName;
        final int stepCount;
        final long startTime;
        long lastUpdate;
        int completedSteps;
        int failedSteps;
        boolean timeoutAlerted;
        boolean stallAlerted;
        boolean errorThresholdAlerted;
        boolean stepFailureAlerted;

        Monitored(String executionId, String workflowName, int stepCount, long now) {
            this.executionId = executionId;
            this.workflowName = workflowName;
            this.stepCount = stepCount;
            this.startTime = now;
            this.lastUpdate = now;
        }
    }

    private static final class Baseline {
        long count;
        long totalDurationMs;

        double average() {
            return count > 0 ? (double) totalDurationMs / count : 0.0;
        }
    }

    private final Object lock = new Object();
    private final Map<String, Monitored> active = new LinkedHashMap<>();
    private final Map<String, Baseline> baselines = new HashMap<>();
    private final Deque<Alert> alerts = new ArrayDeque<>();
    private final Map<AlertType, Long> lastSystemAlert = new EnumMap<>(AlertType.class);
    private volatile MonitorThresholds thresholds;
    private volatile boolean enabled = true;
    private long completedCount;
    private long failedCount;

    public ExecutionMonitor() {
        this(MonitorThresholds.defaults());
    }

    public ExecutionMonitor(SequorConfiguration configuration) {
        this(MonitorThresholds.fromConfiguration(configuration));
    }

    public ExecutionMonitor(MonitorThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public void startMonitoring(String executionId, String workflowName) {
        startMonitoring(executionId, workflowName, 0);
    }

    public void startMonitoring(String executionId, String workflowName, int stepCount) {
        if (!enabled) {
            return;
        }
        synchronized (lock) {
            active.put(executionId, new Monitored(executionId, workflowName, stepCount, System.currentTimeMillis()));
        }
        logger.fine("Monitoring execution " + executionId + " (" + workflowName + ")");
    }

    /**
     * Record progress for an execution. Failed steps are counted through {@link #recordStepFailure};
     * skipped steps count as progress only.
     */
    public void updateProgress(String executionId, StepResult step) {
        if (!enabled) {
            return;
        }
        if (step != null && step.getStatus() == StepStatus.FAILED) {
            recordStepFailure(executionId, step.getIndex(), step.getName(), step.getError());
            return;
        }
        synchronized (lock) {
            Monitored monitored = active.get(executionId);
            if (monitored == null) {
                return;
            }
            monitored.lastUpdate = System.currentTimeMillis();
            monitored.stallAlerted = false;
            if (step != null && step.getStatus() == StepStatus.COMPLETED) {
                monitored.completedSteps++;
            }
        }
    }

    /**
     * Count a failed step and raise an alert when the execution reaches the error threshold
     * or when at least the configured fraction of its steps has failed.
     */
    public void recordStepFailure(String executionId, int stepIndex, String stepName, String error) {
        if (!enabled) {
            return;
        }
        List<Alert> raised = new ArrayList<>();
        synchronized (lock) {
            Monitored monitored = active.get(executionId);
            if (monitored == null) {
                return;
            }
            monitored.lastUpdate = System.currentTimeMillis();
            monitored.stallAlerted = false;
            monitored.failedSteps++;

            MonitorThresholds current = thresholds;
            if (!monitored.errorThresholdAlerted && monitored.failedSteps >= current.getStepErrorCount()) {
                monitored.errorThresholdAlerted = true;
                raised.add(alert(AlertType.ERROR_THRESHOLD,
                        "Error threshold exceeded for execution " + executionId, executionId,
                        Map.of("errorCount", monitored.failedSteps, "threshold", current.getStepErrorCount())));
            }
            if (!monitored.stepFailureAlerted && monitored.stepCount > 0) {
                double fraction = (double) monitored.failedSteps / monitored.stepCount;
                if (fraction >= current.getStepFailureFraction()) {
                    monitored.stepFailureAlerted = true;
                    raised.add(alert(AlertType.STEP_FAILURE,
                            "Step failure rate exceeded threshold for execution " + executionId, executionId,
                            Map.of("failureRate", fraction, "threshold", current.getStepFailureFraction(),
                                    "lastFailedStep", stepName != null ? stepName : "step-" + stepIndex)));
                }
            }
            raised.forEach(this::store);
        }
        raised.forEach(ExecutionMonitor::log);
        if (error != null) {
            logger.fine("Step " + stepIndex + " of " + executionId + " failed: " + error);
        }
    }

    /**
     * Stop watching an execution and fold its duration into the workflow's baseline.
     * A run that is slower than the baseline by more than the degradation factor raises an alert.
     */
    public void stopMonitoring(String executionId, boolean success) {
        Alert degradation = null;
        synchronized (lock) {
            Monitored monitored = active.remove(executionId);
            if (monitored == null) {
                return;
            }
            if (success) {
                completedCount++;
            } else {
                failedCount++;
            }
            long duration = System.currentTimeMillis() - monitored.startTime;
            Baseline baseline = baselines.computeIfAbsent(monitored.workflowName, name -> new Baseline());
            double average = baseline.average();
            if (baseline.count >= BASELINE_MIN_SAMPLES && average > 0
                    && duration > average * (1 + thresholds.getDegradationFactor())) {
                degradation = alert(AlertType.PERFORMANCE_DEGRADATION,
                        "Execution " + executionId + " of " + monitored.workflowName + " was slower than its baseline",
                        executionId, Map.of("durationMs", duration, "baselineMs", average));
                store(degradation);
            }
            baseline.count++;
            baseline.totalDurationMs += duration;
        }
        if (degradation != null) {
            log(degradation);
        }
    }

    /**
     * Look for stalled executions (no progress within the stall timeout) and executions running
     * longer than the execution time threshold.
     *
     * @return alerts raised by this check
     */
    public List<Alert> checkExecutions() {
        if (!enabled) {
            return List.of();
        }
        long now = System.currentTimeMillis();
        List<Alert> raised = new ArrayList<>();
        synchronized (lock) {
            MonitorThresholds current = thresholds;
            for (Monitored monitored : active.values()) {
                long sinceUpdate = now - monitored.lastUpdate;
                if (!monitored.stallAlerted && sinceUpdate > current.getStallTimeout().toMillis()) {
                    monitored.stallAlerted = true;
                    raised.add(alert(AlertType.EXECUTION_STALLED,
                            "Execution " + monitored.executionId + " appears to be stalled", monitored.executionId,
                            Map.of("timeSinceUpdateMs", sinceUpdate, "stallTimeoutMs", current.getStallTimeout().toMillis())));
                }
                long running = now - monitored.startTime;
                if (!monitored.timeoutAlerted && running > current.getExecutionTime().toMillis()) {
                    monitored.timeoutAlerted = true;
                    raised.add(alert(AlertType.EXECUTION_TIMEOUT,
                            "Execution " + monitored.executionId + " exceeded time threshold", monitored.executionId,
                            Map.of("durationMs", running, "thresholdMs", current.getExecutionTime().toMillis())));
                }
            }
            raised.forEach(this::store);
        }
        raised.forEach(ExecutionMonitor::log);
        return raised;
    }

    /**
     * Compare system figures with the thresholds. Each alert type fires at most once per cooldown period.
     *
     * @param memoryPercent memory utilization, 0-100
     * @param cpuPercent    cpu utilization, 0-100
     * @param errorRate     recent failed fraction, 0-1
     * @param queueSize     executions waiting in the queue
     * @return alerts raised by this check
     */
    public List<Alert> checkSystem(double memoryPercent, double cpuPercent, double errorRate, int queueSize) {
        if (!enabled) {
            return List.of();
        }
        MonitorThresholds current = thresholds;
        List<Alert> candidates = new ArrayList<>();
        if (memoryPercent > current.getMemoryPercent()) {
            candidates.add(alert(AlertType.MEMORY_EXCEEDED,
                    String.format(Locale.ROOT, "Memory usage %.1f%% exceeded threshold", memoryPercent), null,
                    Map.of("value", memoryPercent, "threshold", current.getMemoryPercent())));
        }
        if (cpuPercent > current.getCpuPercent()) {
            candidates.add(alert(AlertType.CPU_EXCEEDED,
                    String.format(Locale.ROOT, "CPU usage %.1f%% exceeded threshold", cpuPercent), null,
                    Map.of("value", cpuPercent, "threshold", current.getCpuPercent())));
        }
        if (errorRate > current.getErrorRate()) {
            candidates.add(alert(AlertType.ERROR_RATE,
                    String.format(Locale.ROOT, "Error rate %.2f exceeded threshold", errorRate), null,
                    Map.of("value", errorRate, "threshold", current.getErrorRate())));
        }
        if (queueSize > current.getQueueSize()) {
            candidates.add(alert(AlertType.QUEUE_BACKLOG,
                    "Queue backlog of " + queueSize + " executions exceeded threshold", null,
                    Map.of("value", queueSize, "threshold", current.getQueueSize())));
        }

        long now = System.currentTimeMillis();
        List<Alert> raised = new ArrayList<>();
        synchronized (lock) {
            for (Alert candidate : candidates) {
                Long last = lastSystemAlert.get(candidate.getType());
                if (last == null || now - last >= SYSTEM_ALERT_COOLDOWN_MS) {
                    lastSystemAlert.put(candidate.getType(), now);
                    store(candidate);
                    raised.add(candidate);
                }
            }
        }
        raised.forEach(ExecutionMonitor::log);
        return raised;
    }

    /**
     * Raise an alert from outside the monitor, for example a resource shortage seen by the engine.
     */
    public Alert raiseAlert(AlertType type, String message, String executionId, Map<String, Object> data) {
        Alert alert = alert(type, message, executionId, data);
        synchronized (lock) {
            store(alert);
        }
        log(alert);
        return alert;
    }

    public List<Alert> getAlerts() {
        synchronized (lock) {
            return new ArrayList<>(alerts);
        }
    }

    public List<Alert> getAlerts(AlertSeverity minimum) {
        List<Alert> filtered = new ArrayList<>();
        for (Alert alert : getAlerts()) {
            if (alert.getSeverity().isAtLeast(minimum)) {
                filtered.add(alert);
            }
        }
        return filtered;
    }

    public void clearAlerts() {
        synchronized (lock) {
            alerts.clear();
            lastSystemAlert.clear();
        }
    }

    public boolean isMonitoring(String executionId) {
        synchronized (lock) {
            return active.containsKey(executionId);
        }
    }

    public int getActiveCount() {
        synchronized (lock) {
            return active.size();
        }
    }

    /**
     * Snapshot of monitor state with the ten most recent alerts, newest last.
     */
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        synchronized (lock) {
            status.put("enabled", enabled);
            status.put("activeExecutions", active.size());
            status.put("completedExecutions", completedCount);
            status.put("failedExecutions", failedCount);
            status.put("alertCount", alerts.size());
            List<Map<String, Object>> recent = new ArrayList<>();
            int skip = Math.max(0, alerts.size() - STATUS_RECENT_ALERTS);
            int position = 0;
            for (Alert alert : alerts) {
                if (position++ >= skip) {
                    recent.add(alert.toMap());
                }
            }
            status.put("recentAlerts", recent);
        }
        MonitorThresholds current = thresholds;
        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("executionTimeMs", current.getExecutionTime().toMillis());
        limits.put("stallTimeoutMs", current.getStallTimeout().toMillis());
        limits.put("memoryPercent", current.getMemoryPercent());
        limits.put("cpuPercent", current.getCpuPercent());
        limits.put("errorRate", current.getErrorRate());
        limits.put("queueSize", current.getQueueSize());
        status.put("thresholds", limits);
        return status;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public MonitorThresholds getThresholds() {
        return thresholds;
    }

    public void updateThresholds(MonitorThresholds thresholds) {
        this.thresholds = thresholds;
        synchronized (lock) {
            trim();
        }
    }

    public void clear() {
        synchronized (lock) {
            active.clear();
            baselines.clear();
            alerts.clear();
            lastSystemAlert.clear();
        }
    }

    private static Alert alert(AlertType type, String message, String executionId, Map<String, Object> data) {
        return new Alert(type, message, executionId, data);
    }

    // Caller must hold the lock
    private void store(Alert alert) {
        alerts.addLast(alert);
        trim();
    }

    private void trim() {
        int max = thresholds.getMaxAlerts();
        while (alerts.size() > max) {
            alerts.removeFirst();
        }
    }

    private static void log(Alert alert) {
        logger.warning("Alert [" + alert.getSeverity() + "] " + alert.getType().getValue() + ": " + alert.getMessage());
    }
}
