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

package dev.mars.sequor.workflow;

import dev.mars.sequor.config.SequorConfiguration;
import dev.mars.sequor.core.ExecutionOptions;
import dev.mars.sequor.core.ExecutionResult;
import dev.mars.sequor.core.ExecutionStatus;
import dev.mars.sequor.core.ResourceRequest;
import dev.mars.sequor.core.SimpleWorkflowContext;
import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.StepOutput;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.exceptions.ErrorKind;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.monitoring.EngineHealthCheck;
import dev.mars.sequor.resource.ResourceManager;
import dev.mars.sequor.resource.ResourceManager.ResourceValidationResult;
import dev.mars.sequor.workflow.TestWorkflows.TestStep;
import dev.mars.sequor.workflow.monitoring.Alert;
import dev.mars.sequor.workflow.monitoring.AlertType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SequentialExecutionEngine")
class SequentialExecutionEngineTest {

    private SequentialExecutionEngine engine;
    private WorkflowContext context;

    @BeforeEach
    void setUp() {
        engine = new SequentialExecutionEngine(configuration(Map.of()));
        context = SimpleWorkflowContext.of(Map.of("projectId", "p-42"));
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private static SequorConfiguration configuration(Map<String, String> overrides) {
        SequorConfiguration configuration = new SequorConfiguration();
        configuration.setProperty(SequorConfiguration.ENGINE_RETRY_DELAY_MS, "20");
        overrides.forEach(configuration::setProperty);
        return configuration;
    }

    private void restartWith(Map<String, String> overrides) {
        engine.shutdown();
        engine = new SequentialExecutionEngine(configuration(overrides));
    }

    private static ExecutionOptions.Builder options() {
        return ExecutionOptions.builder().useCache(false);
    }

    private static WorkflowExecutionException failureOf(CompletableFuture<ExecutionResult> future)
            throws Exception {
        try {
            ExecutionResult result = future.get(10, TimeUnit.SECONDS);
            throw new AssertionError("Expected the execution to fail but it returned " + result);
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(WorkflowExecutionException.class);
            return (WorkflowExecutionException) e.getCause();
        }
    }

    private String onlyActiveExecutionId() {
        await().atMost(Duration.ofSeconds(5)).until(() -> engine.getActiveExecutions().size() == 1);
        return (String) engine.getActiveExecutions().get(0).get("executionId");
    }

    @Nested
    @DisplayName("Running workflows")
    class RunningWorkflows {

        @Test
        @DisplayName("Runs a workflow to completion and forgets it afterwards")
        void runsToCompletion() throws Exception {
            Workflow workflow = TestWorkflows.workflow("build-service",
                    TestWorkflows.succeeding("checkout", StepType.SETUP),
                    TestWorkflows.succeeding("compile", StepType.PROCESSING),
                    TestWorkflows.succeeding("unit-tests", StepType.TESTING));

            ExecutionResult result = engine.executeWorkflow(workflow, context, options().build())
                    .get(10, TimeUnit.SECONDS);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getStepResults()).hasSize(3);
            assertThat(result.getStrategy()).isEqualTo("basic");
            assertThat(engine.getExecutionStatus(result.getExecutionId())).isEmpty();
            assertThat(engine.getActiveExecutions()).isEmpty();
        }

        @Test
        @DisplayName("Uses the requested strategy")
        void requestedStrategy() throws Exception {
            Workflow workflow = TestWorkflows.workflow("docs",
                    TestWorkflows.succeeding("api-docs", StepType.DOCUMENTATION),
                    TestWorkflows.succeeding("user-guide", StepType.DOCUMENTATION));

            ExecutionResult result = engine.executeWorkflow(workflow, context,
                    options().strategy("batch").build()).get(10, TimeUnit.SECONDS);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getStrategy()).isEqualTo("batch");
        }

        @Test
        @DisplayName("Null options fall back to defaults")
        void nullOptions() throws Exception {
            Workflow workflow = TestWorkflows.workflow("defaults",
                    TestWorkflows.succeeding("only", StepType.PROCESSING));

            ExecutionResult result = engine.executeWorkflow(workflow, context, null).get(10, TimeUnit.SECONDS);

            assertThat(result.isSuccess()).isTrue();
        }

        @Test
        @DisplayName("Lists the built-in strategies")
        void builtInStrategies() {
            assertThat(engine.getAvailableStrategies()).containsExactly("basic", "batch", "optimized", "smart");
        }
    }

    @Nested
    @DisplayName("Admission")
    class Admission {

        @Test
        @DisplayName("Unknown strategies are invalid")
        void unknownStrategy() {
            Workflow workflow = TestWorkflows.workflow("wf", TestWorkflows.succeeding("a", StepType.SETUP));

            assertThatThrownBy(() -> engine.executeWorkflow(workflow, context, options().strategy("turbo").build()))
                    .isInstanceOf(WorkflowExecutionException.class)
                    .extracting(e -> ((WorkflowExecutionException) e).getKind())
                    .isEqualTo(ErrorKind.VALIDATION);
        }

        @Test
        @DisplayName("A request above the memory limit is refused before queueing")
        void resourceLimit() {
            Workflow workflow = TestWorkflows.workflow("big", TestWorkflows.succeeding("a", StepType.PROCESSING));

            assertThatThrownBy(() -> engine.executeWorkflow(workflow, context,
                    options().resources(ResourceRequest.of(600, 10)).build()))
                    .isInstanceOf(WorkflowExecutionException.class)
                    .satisfies(e -> {
                        WorkflowExecutionException error = (WorkflowExecutionException) e;
                        assertThat(error.getKind()).isEqualTo(ErrorKind.RESOURCE);
                        assertThat(error.getDetail(WorkflowExecutionException.DETAIL_RESOURCE_TYPE))
                                .isEqualTo("memory");
                    });
            assertThat(engine.getActiveExecutions()).isEmpty();
        }

        @Test
        @DisplayName("A full queue rejects new submissions")
        void queueFull() throws Exception {
            restartWith(Map.of(
                    SequorConfiguration.ENGINE_MAX_CONCURRENT, "1",
                    SequorConfiguration.QUEUE_MAX_SIZE, "1"));
            Workflow slow = TestWorkflows.workflow("slow", TestWorkflows.sleeping("wait", StepType.PROCESSING, 10_000));

            engine.executeWorkflow(slow, context, options().build());
            String running = onlyActiveExecutionId();
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> engine.getExecutionStatus(running).orElse(null) == ExecutionStatus.RUNNING);

            engine.executeWorkflow(slow, context, options().build());

            assertThatThrownBy(() -> engine.executeWorkflow(slow, context, options().build()))
                    .isInstanceOf(WorkflowExecutionException.class)
                    .extracting(e -> ((WorkflowExecutionException) e).getKind())
                    .isEqualTo(ErrorKind.QUEUE);
            assertThat(engine.getActiveExecutions()).hasSize(2);
        }

        @Test
        @DisplayName("A stopped engine rejects new work")
        void rejectsAfterShutdown() throws Exception {
            engine.shutdown();
            Workflow workflow = TestWorkflows.workflow("late", TestWorkflows.succeeding("a", StepType.SETUP));

            assertThatThrownBy(() -> engine.executeWorkflow(workflow, context))
                    .isInstanceOf(WorkflowExecutionException.class)
                    .extracting(e -> ((WorkflowExecutionException) e).getKind())
                    .isEqualTo(ErrorKind.VALIDATION);
        }
    }

    @Nested
    @DisplayName("Failures and retries")
    class FailuresAndRetries {

        @Test
        @DisplayName("A failed attempt is retried through the queue")
        void retriesUntilSuccess() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            TestStep flaky = TestWorkflows.step("flaky", StepType.PROCESSING, ctx ->
                    calls.incrementAndGet() == 1 ? StepOutput.failure("connection reset") : StepOutput.success(Map.of()));
            Workflow workflow = TestWorkflows.workflow("flaky-build", flaky);

            ExecutionResult result = engine.executeWorkflow(workflow, context,
                    options().maxRetries(2).retryDelay(Duration.ofMillis(20)).build()).get(10, TimeUnit.SECONDS);

            assertThat(result.isSuccess()).isTrue();
            assertThat(flaky.getInvocations()).isEqualTo(2);
            assertThat(result.getMetadata()).containsEntry("retryCount", 1);
        }

        @Test
        @DisplayName("An unsuccessful result is returned once retries run out")
        void exhaustedRetries() throws Exception {
            TestStep broken = TestWorkflows.failing("deploy", StepType.DEPLOYMENT, "target unreachable");
            Workflow workflow = TestWorkflows.workflow("release", broken);

            ExecutionResult result = engine.executeWorkflow(workflow, context,
                    options().maxRetries(1).retryDelay(Duration.ofMillis(10)).build()).get(10, TimeUnit.SECONDS);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).contains("target unreachable");
            assertThat(broken.getInvocations()).isEqualTo(2);
            assertThat(engine.getActiveExecutions()).isEmpty();
        }

        @Test
        @DisplayName("An attempt over its time limit fails with a timeout")
        void timeout() throws Exception {
            Workflow workflow = TestWorkflows.workflow("stuck",
                    TestWorkflows.sleeping("hang", StepType.PROCESSING, 10_000));

            CompletableFuture<ExecutionResult> future = engine.executeWorkflow(workflow, context,
                    options().timeout(Duration.ofMillis(200)).maxRetries(0).build());

            WorkflowExecutionException error = failureOf(future);
            assertThat(error.getKind()).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(engine.getActiveExecutions()).isEmpty();
        }

        @Test
        @DisplayName("Dependents of a failed execution fail with a dependency error")
        void dependencyFailure() throws Exception {
            Workflow upstream = TestWorkflows.workflow("upstream",
                    TestWorkflows.sleeping("prepare", StepType.SETUP, 300),
                    TestWorkflows.failing("migrate", StepType.PROCESSING, "schema mismatch"));
            CompletableFuture<ExecutionResult> upstreamFuture =
                    engine.executeWorkflow(upstream, context, options().maxRetries(0).build());
            String upstreamId = onlyActiveExecutionId();

            TestStep never = TestWorkflows.succeeding("publish", StepType.DEPLOYMENT);
            CompletableFuture<ExecutionResult> downstream = engine.executeWorkflow(
                    TestWorkflows.workflow("downstream", never), context,
                    options().dependsOn(upstreamId).build());

            assertThat(upstreamFuture.get(10, TimeUnit.SECONDS).isSuccess()).isFalse();
            WorkflowExecutionException error = failureOf(downstream);
            assertThat(error.getKind()).isEqualTo(ErrorKind.DEPENDENCY);
            assertThat(error.getDetail(WorkflowExecutionException.DETAIL_DEPENDENCY_ID)).isEqualTo(upstreamId);
            assertThat(never.getInvocations()).isZero();
        }

        @Test
        @DisplayName("A dependent runs after its dependency completes")
        void dependencyOrder() throws Exception {
            StringBuffer order = new StringBuffer();
            Workflow first = TestWorkflows.workflow("first", TestWorkflows.step("a", StepType.SETUP, ctx -> {
                Thread.sleep(200);
                order.append("first;");
                return StepOutput.success(Map.of());
            }));
            Workflow second = TestWorkflows.workflow("second", TestWorkflows.step("b", StepType.SETUP, ctx -> {
                order.append("second;");
                return StepOutput.success(Map.of());
            }));

            CompletableFuture<ExecutionResult> firstFuture = engine.executeWorkflow(first, context, options().build());
            String firstId = onlyActiveExecutionId();
            CompletableFuture<ExecutionResult> secondFuture = engine.executeWorkflow(second, context,
                    options().dependsOn(firstId).build());

            assertThat(secondFuture.get(10, TimeUnit.SECONDS).isSuccess()).isTrue();
            assertThat(firstFuture.get(10, TimeUnit.SECONDS).isSuccess()).isTrue();
            assertThat(order.toString()).isEqualTo("first;second;");
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("A queued execution is cancelled without running")
        void cancelQueued() throws Exception {
            restartWith(Map.of(SequorConfiguration.ENGINE_MAX_CONCURRENT, "1"));
            engine.executeWorkflow(TestWorkflows.workflow("blocker",
                    TestWorkflows.sleeping("wait", StepType.PROCESSING, 10_000)), context, options().build());
            String blockerId = onlyActiveExecutionId();
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> engine.getExecutionStatus(blockerId).orElse(null) == ExecutionStatus.RUNNING);

            TestStep waiting = TestWorkflows.succeeding("never", StepType.PROCESSING);
            CompletableFuture<ExecutionResult> queued = engine.executeWorkflow(
                    TestWorkflows.workflow("queued", waiting), context, options().build());
            String queuedId = engine.getActiveExecutions().stream()
                    .map(map -> (String) map.get("executionId"))
                    .filter(id -> !id.equals(blockerId))
                    .collect(Collectors.toList()).get(0);

            assertThat(engine.cancelExecution(queuedId)).isTrue();

            assertThat(failureOf(queued).isCancellation()).isTrue();
            assertThat(engine.getExecutionStatus(queuedId)).isEmpty();
            assertThat(engine.cancelExecution(queuedId)).isFalse();
            assertThat(waiting.getInvocations()).isZero();
        }

        @Test
        @DisplayName("A running execution stops at the next step boundary")
        void cancelRunning() throws Exception {
            TestStep after = TestWorkflows.succeeding("after", StepType.TESTING);
            CompletableFuture<ExecutionResult> future = engine.executeWorkflow(TestWorkflows.workflow("long",
                    TestWorkflows.sleeping("before", StepType.PROCESSING, 500), after), context, options().build());
            String id = onlyActiveExecutionId();
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> engine.getExecutionStatus(id).orElse(null) == ExecutionStatus.RUNNING);

            assertThat(engine.cancelExecution(id)).isTrue();

            assertThat(failureOf(future).isCancellation()).isTrue();
            assertThat(after.getInvocations()).isZero();
        }

        @Test
        @DisplayName("Unknown ids cannot be cancelled")
        void cancelUnknown() {
            assertThat(engine.cancelExecution("missing")).isFalse();
            assertThat(engine.cancelExecution(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("A repeated workflow is served from the cache")
        void cacheHit() throws Exception {
            restartWith(Map.of(
                    SequorConfiguration.CACHE_MIN_SIZE_BYTES, "0",
                    SequorConfiguration.CACHE_MIN_COMPLEXITY, "0"));
            TestStep report = TestWorkflows.succeeding("report", StepType.DOCUMENTATION,
                    Map.of("pages", 12, "format", "html"));
            Workflow workflow = TestWorkflows.workflow("reporting", report);
            ExecutionOptions cached = ExecutionOptions.builder().useCache(true).build();

            ExecutionResult first = engine.executeWorkflow(workflow, context, cached).get(10, TimeUnit.SECONDS);
            CompletableFuture<ExecutionResult> second = engine.executeWorkflow(workflow, context, cached);

            assertThat(second).isDone();
            ExecutionResult hit = second.get();
            assertThat(hit.isFromCache()).isTrue();
            assertThat(hit.getExecutionId()).isNotEqualTo(first.getExecutionId());
            assertThat(report.getInvocations()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Resource manager collaboration")
    class ResourceCollaboration {

        @Mock
        private ResourceManager resourceManager;

        private AutoCloseable mocks;
        private SequentialExecutionEngine guarded;

        @BeforeEach
        void setUp() {
            mocks = MockitoAnnotations.openMocks(this);
            when(resourceManager.validateRequest(any())).thenReturn(ResourceValidationResult.allowed());
            guarded = new SequentialExecutionEngine(configuration(Map.of()), resourceManager);
        }

        @AfterEach
        void tearDown() throws Exception {
            guarded.shutdown();
            mocks.close();
        }

        @Test
        @DisplayName("Executions wait in the queue until resources free up")
        void waitsForResources() throws Exception {
            when(resourceManager.canAllocate(any())).thenReturn(false);
            TestStep step = TestWorkflows.succeeding("index", StepType.PROCESSING);

            CompletableFuture<ExecutionResult> future = guarded.executeWorkflow(
                    TestWorkflows.workflow("indexing", step), context, options().build());
            await().atMost(Duration.ofSeconds(5)).until(() -> guarded.getActiveExecutions().size() == 1);
            String id = (String) guarded.getActiveExecutions().get(0).get("executionId");

            await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2))
                    .until(() -> guarded.getExecutionStatus(id).orElse(null) == ExecutionStatus.QUEUED);
            verify(resourceManager, never()).allocateResources(any(), any());
            assertThat(step.getInvocations()).isZero();

            when(resourceManager.canAllocate(any())).thenReturn(true);

            assertThat(future.get(10, TimeUnit.SECONDS).isSuccess()).isTrue();
            verify(resourceManager).allocateResources(eq(id), any());
            verify(resourceManager).releaseResources(id);
        }
    }

    @Nested
    @DisplayName("Step monitoring")
    class StepMonitoring {

        private List<Alert> stepAlerts() {
            return engine.getAlerts().stream()
                    .filter(alert -> alert.getType() == AlertType.STEP_FAILURE
                            || alert.getType() == AlertType.ERROR_THRESHOLD)
                    .collect(Collectors.toList());
        }

        @Test
        @DisplayName("One failed step out of four stays below the alert thresholds")
        void singleFailureCountedOnce() throws Exception {
            Workflow workflow = TestWorkflows.workflow("nightly",
                    TestWorkflows.succeeding("a", StepType.PROCESSING),
                    TestWorkflows.succeeding("b", StepType.PROCESSING),
                    TestWorkflows.succeeding("c", StepType.PROCESSING),
                    TestWorkflows.failing("d", StepType.DEPLOYMENT, "rejected"));

            ExecutionResult result = engine.executeWorkflow(workflow, context,
                    options().maxRetries(0).build()).get(10, TimeUnit.SECONDS);

            assertThat(result.isSuccess()).isFalse();
            assertThat(stepAlerts()).isEmpty();
        }

        @Test
        @DisplayName("A disabled step is not a failure")
        void skippedStepIsNotAFailure() throws Exception {
            TestStep disabled = TestWorkflows.step(StepMetadata.builder()
                    .name("x")
                    .type(StepType.CLEANUP)
                    .attribute(StepMetadata.ATTR_DISABLED, true)
                    .build(), ctx -> StepOutput.success(Map.of()));
            Workflow workflow = TestWorkflows.workflow("partial",
                    TestWorkflows.succeeding("a", StepType.PROCESSING), disabled);

            ExecutionResult result = engine.executeWorkflow(workflow, context, options().build())
                    .get(10, TimeUnit.SECONDS);

            assertThat(result.isSuccess()).isTrue();
            assertThat(disabled.getInvocations()).isZero();
            assertThat(stepAlerts()).isEmpty();
        }

        @Test
        @DisplayName("Half the steps failing raises one alert with the true failure rate")
        void failureRateAlert() throws Exception {
            Workflow workflow = TestWorkflows.workflow("half",
                    TestWorkflows.succeeding("a", StepType.PROCESSING),
                    TestWorkflows.failing("b", StepType.DEPLOYMENT, "rejected"));

            engine.executeWorkflow(workflow, context, options().maxRetries(0).build()).get(10, TimeUnit.SECONDS);

            assertThat(stepAlerts()).singleElement().satisfies(alert -> {
                assertThat(alert.getType()).isEqualTo(AlertType.STEP_FAILURE);
                assertThat(alert.getData()).containsEntry("failureRate", 0.5)
                        .containsEntry("lastFailedStep", "b");
            });
        }
    }

    @Nested
    @DisplayName("Reporting")
    class Reporting {

        @Test
        @DisplayName("A fresh engine is healthy")
        void healthy() {
            EngineHealthCheck health = engine.getHealthStatus();

            assertThat(health.getStatus()).isEqualTo(EngineHealthCheck.Status.UP);
            assertThat(health.getComponents())
                    .extracting(EngineHealthCheck.Component::getName)
                    .containsExactly("queue", "resources", "workers", "monitor");
        }

        @Test
        @DisplayName("A full queue degrades health")
        void degradedWhenQueueFull() throws Exception {
            restartWith(Map.of(
                    SequorConfiguration.ENGINE_MAX_CONCURRENT, "1",
                    SequorConfiguration.QUEUE_MAX_SIZE, "1"));
            Workflow slow = TestWorkflows.workflow("slow", TestWorkflows.sleeping("wait", StepType.PROCESSING, 10_000));

            engine.executeWorkflow(slow, context, options().build());
            String running = onlyActiveExecutionId();
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> engine.getExecutionStatus(running).orElse(null) == ExecutionStatus.RUNNING);
            engine.executeWorkflow(slow, context, options().build());

            EngineHealthCheck health = engine.getHealthStatus();

            assertThat(health.getStatus()).isEqualTo(EngineHealthCheck.Status.DEGRADED);
            assertThat(health.getComponent(EngineHealthCheck.QUEUE).getStatus())
                    .isEqualTo(EngineHealthCheck.Status.DEGRADED);
            assertThat(health.getQueueUtilization()).isEqualTo(100.0);
            assertThat(health.getRunningExecutions()).isEqualTo(1);
        }

        @Test
        @DisplayName("A stopped engine reports down")
        void downAfterShutdown() {
            engine.shutdown();

            assertThat(engine.getHealthStatus().getStatus()).isEqualTo(EngineHealthCheck.Status.DOWN);
            assertThat(engine.isShutdown()).isTrue();
        }

        @Test
        @DisplayName("System metrics cover every collaborator")
        void systemMetrics() throws Exception {
            engine.executeWorkflow(TestWorkflows.workflow("metered",
                    TestWorkflows.succeeding("a", StepType.PROCESSING)), context, options().build())
                    .get(10, TimeUnit.SECONDS);

            Map<String, Object> metrics = engine.getSystemMetrics();

            assertThat(metrics).containsKeys("activeExecutions", "queue", "scheduler", "resources", "cache",
                    "aggregated", "realTime", "monitor", "strategies");
            assertThat(metrics.get("activeExecutions")).isEqualTo(0);
            assertThat(engine.getExecutionMetrics().getAggregatedMetrics().getTotalExecutions()).isEqualTo(1);
        }
    }
}
