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

import dev.mars.sequor.core.ExecutionResult;
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepStatus;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.exceptions.ErrorKind;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ExecutionMetrics")
class ExecutionMetricsTest {

    private ExecutionMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new ExecutionMetrics();
    }

    private static ExecutionResult result(boolean success) {
        return ExecutionResult.builder().workflowName("wf").success(success).build();
    }

    private static StepResult step(int index, StepStatus status, long durationMs) {
        return StepResult.builder()
                .index(index)
                .name("step-" + index)
                .type(StepType.PROCESSING)
                .status(status)
                .durationMs(durationMs)
                .build();
    }

    @Nested
    @DisplayName("Aggregation")
    class Aggregation {

        @Test
        @DisplayName("Executions and steps are aggregated across runs")
        void aggregatesAcrossExecutions() {
            metrics.recordExecutionStart("e1", "wf", 2);
            metrics.recordStepStart("e1", 0, "step-0", StepType.PROCESSING);
            metrics.recordStepEnd("e1", step(0, StepStatus.COMPLETED, 100));
            metrics.recordStepStart("e1", 1, "step-1", StepType.PROCESSING);
            metrics.recordStepEnd("e1", step(1, StepStatus.COMPLETED, 300));
            metrics.recordExecutionEnd("e1", result(true));

            metrics.recordExecutionStart("e2", "wf", 1);
            metrics.recordStepEnd("e2", step(0, StepStatus.FAILED, 200));
            metrics.recordExecutionEnd("e2", result(false));

            AggregatedMetrics aggregated = metrics.getAggregatedMetrics();
            assertThat(aggregated.getTotalExecutions()).isEqualTo(2);
            assertThat(aggregated.getSuccessfulExecutions()).isEqualTo(1);
            assertThat(aggregated.getFailedExecutions()).isEqualTo(1);
            assertThat(aggregated.getTotalSteps()).isEqualTo(3);
            assertThat(aggregated.getAverageStepTimeMs()).isCloseTo(200.0, within(0.001));
            assertThat(aggregated.getErrorRate()).isCloseTo(0.5, within(0.001));
            assertThat(aggregated.getThroughput()).isEqualTo(2);
        }

        @Test
        @DisplayName("A second end for the same execution is ignored")
        void secondEndIgnored() {
            metrics.recordExecutionStart("e1", "wf", 1);
            metrics.recordExecutionEnd("e1", result(true));
            metrics.recordExecutionEnd("e1", result(false));

            assertThat(metrics.getAggregatedMetrics().getTotalExecutions()).isEqualTo(1);
            assertThat(metrics.getAggregatedMetrics().getFailedExecutions()).isZero();
        }

        @Test
        @DisplayName("An end without a start is ignored")
        void endWithoutStartIgnored() {
            metrics.recordExecutionEnd("unknown", result(true));

            assertThat(metrics.getAggregatedMetrics().getTotalExecutions()).isZero();
        }

        @Test
        @DisplayName("Real-time figures cover active executions and the last minute")
        void realTime() {
            metrics.recordExecutionStart("running", "wf", 1);
            metrics.recordExecutionStart("done", "wf", 1);
            metrics.recordExecutionEnd("done", result(true));
            metrics.recordExecutionStart("broken", "wf", 1);
            metrics.recordExecutionEnd("broken", result(false));

            RealTimeMetrics realTime = metrics.getRealTimeMetrics();
            assertThat(realTime.getActiveExecutions()).isEqualTo(1);
            assertThat(realTime.getExecutionsPerMinute()).isEqualTo(2);
            assertThat(realTime.getErrorRate()).isCloseTo(0.5, within(0.001));
        }

        @Test
        @DisplayName("Cache counters work without a started execution")
        void cacheCountersWithoutExecution() {
            metrics.recordCacheHit(null);
            metrics.recordCacheMiss("not-started");

            AggregatedMetrics aggregated = metrics.getAggregatedMetrics();
            assertThat(aggregated.getCacheHits()).isEqualTo(1);
            assertThat(aggregated.getCacheMisses()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("A summary reports rates, retries and errors for one execution")
    void executionSummary() {
        metrics.recordExecutionStart("e1", "wf", 4);
        metrics.recordStepEnd("e1", step(0, StepStatus.COMPLETED, 10));
        metrics.recordStepEnd("e1", step(1, StepStatus.COMPLETED, 30));
        metrics.recordStepEnd("e1", step(2, StepStatus.FAILED, 20));
        metrics.recordCacheHit("e1");
        metrics.recordCacheMiss("e1");
        metrics.recordCacheMiss("e1");
        metrics.recordCacheMiss("e1");
        metrics.recordRetry("e1");
        metrics.recordError("e1", WorkflowExecutionException.stepFailure(2, "step-2", 1, 1, "boom", null));

        ExecutionSummary summary = metrics.getExecutionSummary("e1").orElseThrow();
        assertThat(summary.getSuccessRate()).isCloseTo(50.0, within(0.001));
        assertThat(summary.getCacheHitRate()).isCloseTo(25.0, within(0.001));
        assertThat(summary.getRetryAttempts()).isEqualTo(1);
        assertThat(summary.getErrorCount()).isEqualTo(1);
        assertThat(summary.getAverageStepDurationMs()).isCloseTo(20.0, within(0.001));
        assertThat(summary.isFinished()).isFalse();

        assertThat(metrics.getAggregatedMetrics().getErrorsByKind())
                .containsEntry(ErrorKind.STEP_EXECUTION.name(), 1L);
        assertThat(metrics.getErrors("e1")).hasSize(1);
        assertThat(metrics.getExecutionSummary("missing")).isEmpty();
    }

    @Nested
    @DisplayName("Cleanup")
    class Cleanup {

        @Test
        @DisplayName("Finished records past retention are dropped, aggregates stay")
        void dropsRecordsPastRetention() throws InterruptedException {
            ExecutionMetrics shortLived = new ExecutionMetrics(Duration.ofMillis(50), 100);
            shortLived.recordExecutionStart("old", "wf", 1);
            shortLived.recordExecutionEnd("old", result(true));
            shortLived.recordExecutionStart("running", "wf", 1);

            Thread.sleep(100);
            shortLived.recordExecutionStart("fresh", "wf", 1);
            shortLived.recordExecutionEnd("fresh", result(true));

            assertThat(shortLived.cleanup()).isEqualTo(1);
            assertThat(shortLived.getExecutionSummary("old")).isEmpty();
            assertThat(shortLived.getExecutionSummary("running")).isPresent();
            assertThat(shortLived.getExecutionSummary("fresh")).isPresent();
            assertThat(shortLived.getAggregatedMetrics().getTotalExecutions()).isEqualTo(2);
        }

        @Test
        @DisplayName("History is capped keeping the newest records")
        void capsHistoryKeepingNewest() throws InterruptedException {
            ExecutionMetrics capped = new ExecutionMetrics(Duration.ofHours(1), 2);
            for (int i = 0; i < 4; i++) {
                capped.recordExecutionStart("e" + i, "wf", 1);
                capped.recordExecutionEnd("e" + i, result(true));
                Thread.sleep(5);
            }

            assertThat(capped.cleanup()).isEqualTo(2);
            assertThat(capped.size()).isEqualTo(2);
            assertThat(capped.getExecutionSummary("e3")).isPresent();
            assertThat(capped.getExecutionSummary("e2")).isPresent();
            assertThat(capped.getExecutionSummary("e0")).isEmpty();
        }
    }

    @Test
    @DisplayName("Concurrent recording loses no executions")
    void concurrentRecording() throws InterruptedException {
        int threads = 16;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            final int threadId = t;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < perThread; i++) {
                        String id = "t" + threadId + "-" + i;
                        metrics.recordExecutionStart(id, "wf", 1);
                        metrics.recordStepEnd(id, step(0, StepStatus.COMPLETED, 1));
                        metrics.recordExecutionEnd(id, result(i % 2 == 0));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertThat(doneLatch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        AggregatedMetrics aggregated = metrics.getAggregatedMetrics();
        assertThat(aggregated.getTotalExecutions()).isEqualTo(threads * perThread);
        assertThat(aggregated.getSuccessfulExecutions()).isEqualTo(threads * perThread / 2);
        assertThat(aggregated.getTotalSteps()).isEqualTo(threads * perThread);
    }
}
