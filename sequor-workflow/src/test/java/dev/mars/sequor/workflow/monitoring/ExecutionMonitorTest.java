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
import dev.mars.sequor.core.StepStatus;
import dev.mars.sequor.core.StepType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisplayName("ExecutionMonitor")
class ExecutionMonitorTest {

    private ExecutionMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new ExecutionMonitor();
    }

    private static StepResult step(int index, StepStatus status) {
        return StepResult.builder()
                .index(index)
                .name("step-" + index)
                .type(StepType.PROCESSING)
                .status(status)
                .error(status == StepStatus.FAILED ? "failed" : null)
                .build();
    }

    @Nested
    @DisplayName("Step failures")
    class StepFailures {

        @Test
        @DisplayName("Three failures raise one error-threshold alert")
        void errorThreshold() {
            monitor.startMonitoring("e1", "wf", 10);

            monitor.recordStepFailure("e1", 0, "a", "x");
            monitor.recordStepFailure("e1", 1, "b", "x");
            assertThat(monitor.getAlerts()).isEmpty();

            monitor.recordStepFailure("e1", 2, "c", "x");
            monitor.recordStepFailure("e1", 3, "d", "x");

            assertThat(monitor.getAlerts())
                    .extracting(Alert::getType)
                    .containsExactly(AlertType.ERROR_THRESHOLD);
            assertThat(monitor.getAlerts().get(0).getSeverity()).isEqualTo(AlertSeverity.ERROR);
        }

        @Test
        @DisplayName("Half the steps failing raises a step-failure alert")
        void failureFraction() {
            monitor.startMonitoring("e1", "wf", 2);

            monitor.updateProgress("e1", step(0, StepStatus.COMPLETED));
            monitor.updateProgress("e1", step(1, StepStatus.FAILED));

            assertThat(monitor.getAlerts())
                    .extracting(Alert::getType)
                    .containsExactly(AlertType.STEP_FAILURE);
            assertThat(monitor.getAlerts().get(0).getExecutionId()).isEqualTo("e1");
        }

        @Test
        @DisplayName("Unknown executions are ignored")
        void unknownExecution() {
            monitor.recordStepFailure("ghost", 0, "a", "x");

            assertThat(monitor.getAlerts()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Execution checks")
    class ExecutionChecks {

        @Test
        @DisplayName("A silent execution is reported as stalled and over time, once each")
        void stallAndTimeout() {
            ExecutionMonitor fast = new ExecutionMonitor(MonitorThresholds.builder()
                    .stallTimeout(Duration.ofMillis(50))
                    .executionTime(Duration.ofMillis(50))
                    .build());
            fast.startMonitoring("slow", "wf", 3);

            await().atMost(Duration.ofSeconds(2))
                    .until(() -> !fast.checkExecutions().isEmpty());

            assertThat(fast.getAlerts())
                    .extracting(Alert::getType)
                    .containsExactlyInAnyOrder(AlertType.EXECUTION_STALLED, AlertType.EXECUTION_TIMEOUT);
            assertThat(fast.getAlerts(AlertSeverity.CRITICAL))
                    .extracting(Alert::getType)
                    .containsExactly(AlertType.EXECUTION_TIMEOUT);
            assertThat(fast.checkExecutions()).isEmpty();
        }

        @Test
        @DisplayName("Progress clears the stall condition")
        void progressResetsStall() throws InterruptedException {
            ExecutionMonitor fast = new ExecutionMonitor(MonitorThresholds.builder()
                    .stallTimeout(Duration.ofMillis(40))
                    .executionTime(Duration.ofHours(1))
                    .build());
            fast.startMonitoring("e1", "wf", 3);

            Thread.sleep(60);
            assertThat(fast.checkExecutions()).hasSize(1);

            fast.updateProgress("e1", step(0, StepStatus.COMPLETED));
            assertThat(fast.checkExecutions()).isEmpty();

            Thread.sleep(60);
            assertThat(fast.checkExecutions()).hasSize(1);
        }

        @Test
        @DisplayName("Stopped executions are no longer checked")
        void stopMonitoring() {
            monitor.startMonitoring("e1", "wf");
            assertThat(monitor.isMonitoring("e1")).isTrue();

            monitor.stopMonitoring("e1", true);

            assertThat(monitor.isMonitoring("e1")).isFalse();
            assertThat(monitor.getStatus()).containsEntry("completedExecutions", 1L);
        }
    }

    @Nested
    @DisplayName("System checks")
    class SystemChecks {

        @Test
        @DisplayName("Each breached threshold raises its own alert")
        void thresholds() {
            List<Alert> raised = monitor.checkSystem(85.0, 95.0, 0.2, 60);

            assertThat(raised)
                    .extracting(Alert::getType)
                    .containsExactly(AlertType.MEMORY_EXCEEDED, AlertType.CPU_EXCEEDED,
                            AlertType.ERROR_RATE, AlertType.QUEUE_BACKLOG);
            assertThat(raised.get(0).getSeverity()).isEqualTo(AlertSeverity.WARNING);
            assertThat(raised.get(2).getSeverity()).isEqualTo(AlertSeverity.ERROR);
        }

        @Test
        @DisplayName("Healthy figures raise nothing")
        void healthy() {
            assertThat(monitor.checkSystem(50.0, 50.0, 0.0, 3)).isEmpty();
        }

        @Test
        @DisplayName("Repeated breaches are rate limited")
        void cooldown() {
            assertThat(monitor.checkSystem(99.0, 0.0, 0.0, 0)).hasSize(1);
            assertThat(monitor.checkSystem(99.0, 0.0, 0.0, 0)).isEmpty();
            assertThat(monitor.getAlerts()).hasSize(1);
        }
    }

    @Test
    @DisplayName("Alert store keeps the newest entries and status shows the last ten")
    void alertRetention() {
        ExecutionMonitor bounded = new ExecutionMonitor(MonitorThresholds.builder().maxAlerts(15).build());
        for (int i = 0; i < 20; i++) {
            bounded.raiseAlert(AlertType.RESOURCE_SHORTAGE, "shortage " + i, null, Map.of("index", i));
        }

        List<Alert> alerts = bounded.getAlerts();
        assertThat(alerts).hasSize(15);
        assertThat(alerts.get(0).getMessage()).isEqualTo("shortage 5");

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> recent = (List<Map<String, Object>>) bounded.getStatus().get("recentAlerts");
        assertThat(recent).hasSize(10);
        assertThat(recent.get(9)).containsEntry("message", "shortage 19");

        bounded.clearAlerts();
        assertThat(bounded.getAlerts()).isEmpty();
    }

    @Test
    @DisplayName("Disabled monitor records nothing")
    void disabled() {
        monitor.setEnabled(false);
        monitor.startMonitoring("e1", "wf", 1);

        assertThat(monitor.isMonitoring("e1")).isFalse();
        assertThat(monitor.checkSystem(100.0, 100.0, 1.0, 1000)).isEmpty();
    }
}
