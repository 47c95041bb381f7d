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

package dev.mars.sequor.workflow.strategy;

import dev.mars.sequor.core.ExecutionResult;
import dev.mars.sequor.core.SimpleWorkflowContext;
import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.StepOutput;
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.workflow.ExecutionContext;
import dev.mars.sequor.workflow.TestWorkflows;
import dev.mars.sequor.workflow.TestWorkflows.TestStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OptimizedExecutionStrategy")
class OptimizedExecutionStrategyTest {

    private OptimizedExecutionStrategy strategy;
    private WorkflowContext context;

    @BeforeEach
    void setUp() {
        strategy = new OptimizedExecutionStrategy(2, Duration.ZERO);
        context = new SimpleWorkflowContext();
    }

    private static ExecutionContext execution(Workflow workflow) {
        return ExecutionContext.builder().executionId("exec-opt").workflow(workflow).build();
    }

    private static TestStep recording(String name, StepType type, List<String> order) {
        return TestWorkflows.step(name, type, ctx -> {
            order.add(name);
            return StepOutput.success(Map.of("step", name));
        });
    }

    @Nested
    @DisplayName("Step list optimization")
    class StepList {

        @Test
        @DisplayName("Steps run in phase order and keep their declared indices")
        void reordersByPhase() throws Exception {
            List<String> order = new ArrayList<>();
            Workflow workflow = TestWorkflows.workflow("unordered",
                    recording("teardown", StepType.CLEANUP, order),
                    recording("bootstrap", StepType.SETUP, order),
                    recording("verify", StepType.TESTING, order));

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isTrue();
            assertThat(order).containsExactly("bootstrap", "verify", "teardown");
            assertThat(result.getStepResults()).extracting(StepResult::getIndex).containsExactly(1, 2, 0);
            assertThat((List<String>) result.getMetadata().get("optimizations"))
                    .containsExactly(OptimizedExecutionStrategy.OPT_REORDERING);
        }

        @Test
        @DisplayName("A step never moves ahead of a step it depends on")
        void respectsStepDependencies() throws Exception {
            List<String> order = new ArrayList<>();
            TestStep cleanupFirst = TestWorkflows.step(
                    StepMetadata.builder().name("purge").type(StepType.CLEANUP).build(),
                    ctx -> {
                        order.add("purge");
                        return StepOutput.success();
                    });
            TestStep setupAfter = TestWorkflows.step(
                    StepMetadata.builder().name("init").type(StepType.SETUP).dependsOn("purge").build(),
                    ctx -> {
                        order.add("init");
                        return StepOutput.success();
                    });
            Workflow workflow = TestWorkflows.workflow("dependent", cleanupFirst, setupAfter);

            strategy.execute(workflow, context, execution(workflow));

            assertThat(order).containsExactly("purge", "init");
        }

        @Test
        @DisplayName("Repeated steps of the same type and name run once")
        void removesDuplicates() throws Exception {
            TestStep build = TestWorkflows.succeeding("build", StepType.PROCESSING);
            Workflow workflow = TestWorkflows.workflow("duplicated", build, build);

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isTrue();
            assertThat(build.getInvocations()).isEqualTo(1);
            assertThat(result.getMetadata())
                    .containsEntry("originalStepCount", 2)
                    .containsEntry("optimizedStepCount", 1);
            assertThat((List<String>) result.getMetadata().get("optimizations"))
                    .contains(OptimizedExecutionStrategy.OPT_STEP_COUNT_CHANGE);
        }

        @Test
        @DisplayName("Each successful step's summary is written to the context")
        void writesStepResultsToContext() throws Exception {
            Workflow workflow = TestWorkflows.workflow("context",
                    TestWorkflows.succeeding("prepare", StepType.SETUP),
                    TestWorkflows.succeeding("run", StepType.PROCESSING));

            strategy.execute(workflow, context, execution(workflow));

            assertThat(context.get("step_0_result")).isInstanceOf(Map.class);
            assertThat((Map<String, Object>) context.get("step_1_result")).containsEntry("stepName", "run");
            assertThat(strategy.getExecutionHistorySize()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("A failing testing step is retried until it passes")
        void retriesTestingSteps() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            TestStep flaky = TestWorkflows.step("integration", StepType.TESTING, ctx ->
                    calls.incrementAndGet() == 1 ? StepOutput.failure("connection reset") : StepOutput.success());
            Workflow workflow = TestWorkflows.workflow("flaky", flaky);

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isTrue();
            assertThat(flaky.getInvocations()).isEqualTo(2);
            assertThat(result.getStepResults().get(0).getAttempts()).isEqualTo(2);
            assertThat(result.getMetadata()).containsEntry("retryAttempts", 1);
        }

        @Test
        @DisplayName("Retries stop at the retry limit")
        void stopsAtRetryLimit() throws Exception {
            TestStep broken = TestWorkflows.failing("integration", StepType.TESTING, "timeout talking to service");
            Workflow workflow = TestWorkflows.workflow("broken", broken);

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isFalse();
            assertThat(broken.getInvocations()).isEqualTo(3);
            assertThat(strategy.getStatistics()).containsEntry("stepRetries", 2L);
        }

        @Test
        @DisplayName("Permanent failures are not retried")
        void doesNotRetryPermanentFailures() throws Exception {
            TestStep denied = TestWorkflows.failing("integration", StepType.TESTING, "Permission denied for /var/run");
            Workflow workflow = TestWorkflows.workflow("denied", denied);

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isFalse();
            assertThat(denied.getInvocations()).isEqualTo(1);
        }

        @Test
        @DisplayName("Only testing steps are retried")
        void doesNotRetryOtherTypes() throws Exception {
            TestStep failing = TestWorkflows.failing("compile", StepType.PROCESSING, "flaky compiler");
            Workflow workflow = TestWorkflows.workflow("other", failing);

            strategy.execute(workflow, context, execution(workflow));

            assertThat(failing.getInvocations()).isEqualTo(1);
        }

        @Test
        @DisplayName("Non-retryable messages are matched case-insensitively")
        void classifiesPermanentMessages() {
            assertThat(OptimizedExecutionStrategy.isNonRetryable("Syntax Error at line 3")).isTrue();
            assertThat(OptimizedExecutionStrategy.isNonRetryable("File NOT FOUND")).isTrue();
            assertThat(OptimizedExecutionStrategy.isNonRetryable("connection refused")).isFalse();
            assertThat(OptimizedExecutionStrategy.isNonRetryable(null)).isFalse();
        }
    }
}
