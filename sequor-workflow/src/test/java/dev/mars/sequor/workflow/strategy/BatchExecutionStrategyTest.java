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
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.StepOutput;
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.workflow.ExecutionContext;
import dev.mars.sequor.workflow.TestWorkflows;
import dev.mars.sequor.workflow.TestWorkflows.TestStep;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BatchExecutionStrategy")
class BatchExecutionStrategyTest {

    private BatchExecutionStrategy strategy;
    private WorkflowContext context;

    @BeforeEach
    void setUp() {
        strategy = new BatchExecutionStrategy();
        context = new SimpleWorkflowContext();
    }

    @AfterEach
    void tearDown() {
        strategy.shutdown();
    }

    private static ExecutionContext execution(Workflow workflow) {
        return ExecutionContext.builder().executionId("exec-batch").workflow(workflow).build();
    }

    private static Step withResource(String name, String resource) {
        return TestWorkflows.step(StepMetadata.builder().name(name).type(StepType.DOCUMENTATION).resource(resource).build(),
                ctx -> StepOutput.success(Map.of("step", name)));
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("A small workflow forms a single batch")
        void smallWorkflowSingleBatch() {
            List<Step> steps = List.of(
                    TestWorkflows.succeeding("a", StepType.SETUP),
                    TestWorkflows.succeeding("b", StepType.TESTING),
                    TestWorkflows.succeeding("c", StepType.CLEANUP));

            assertThat(strategy.createBatches(steps)).containsExactly(List.of(0, 1, 2));
        }

        @Test
        @DisplayName("A large workflow is grouped by type and chunked")
        void largeWorkflowGroupedAndChunked() {
            BatchExecutionStrategy small = new BatchExecutionStrategy(3, 2, true);
            try {
                List<Step> steps = List.of(
                        TestWorkflows.succeeding("p1", StepType.PROCESSING),
                        TestWorkflows.succeeding("t1", StepType.TESTING),
                        TestWorkflows.succeeding("p2", StepType.PROCESSING),
                        TestWorkflows.succeeding("t2", StepType.TESTING),
                        TestWorkflows.succeeding("p3", StepType.PROCESSING),
                        TestWorkflows.succeeding("t3", StepType.TESTING),
                        TestWorkflows.succeeding("p4", StepType.PROCESSING));

                assertThat(small.createBatches(steps))
                        .containsExactly(List.of(0, 2, 4), List.of(6), List.of(1, 3, 5));
            } finally {
                small.shutdown();
            }
        }

        @Test
        @DisplayName("Steps sharing a resource cannot run side by side")
        void sharedResourceForcesSequential() {
            assertThat(BatchExecutionStrategy.canRunInParallel(List.of(
                    withResource("a", "db"), withResource("b", "db")))).isFalse();
            assertThat(BatchExecutionStrategy.canRunInParallel(List.of(
                    withResource("a", "db"), withResource("b", "cache")))).isTrue();
        }

        @Test
        @DisplayName("A heavy batch runs sequentially")
        void heavyBatchSequential() {
            assertThat(BatchExecutionStrategy.canRunInParallel(List.of(
                    TestWorkflows.succeeding("d1", StepType.DEPLOYMENT),
                    TestWorkflows.succeeding("d2", StepType.DEPLOYMENT),
                    TestWorkflows.succeeding("d3", StepType.DEPLOYMENT)))).isFalse();
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @Test
        @DisplayName("Independent light steps run in parallel")
        void independentStepsInParallel() throws Exception {
            Workflow workflow = TestWorkflows.workflow("docs",
                    TestWorkflows.succeeding("readme", StepType.DOCUMENTATION),
                    TestWorkflows.succeeding("changelog", StepType.DOCUMENTATION));

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getStepResults()).allMatch(StepResult::isParallel)
                    .extracting(StepResult::getIndex)
                    .containsExactly(0, 1);
            assertThat(result.getMetadata()).containsEntry("batchCount", 1);
            assertThat(context.get("batch_0_result")).isNotNull();
        }

        @Test
        @DisplayName("A failed batch stops the run and writes no batch result")
        void failedBatchStops() throws Exception {
            BatchExecutionStrategy sequential = new BatchExecutionStrategy(2, 2, false);
            try {
                TestStep second = TestWorkflows.succeeding("second", StepType.PROCESSING);
                TestStep later = TestWorkflows.succeeding("later", StepType.TESTING);
                Workflow workflow = TestWorkflows.workflow("failing",
                        TestWorkflows.failing("first", StepType.PROCESSING, "bad input"), second, later);

                ExecutionResult result = sequential.execute(workflow, context, execution(workflow));

                assertThat(result.isSuccess()).isFalse();
                assertThat(result.getError()).isEqualTo("Step 'first' failed: bad input");
                assertThat(second.getInvocations()).isZero();
                assertThat(later.getInvocations()).isZero();
                assertThat(context.get("batch_0_result")).isNull();
            } finally {
                sequential.shutdown();
            }
        }

        @Test
        @DisplayName("Statistics count batches run")
        void statisticsCountBatches() throws Exception {
            Workflow workflow = TestWorkflows.workflow("stats",
                    TestWorkflows.succeeding("a", StepType.DOCUMENTATION),
                    TestWorkflows.succeeding("b", StepType.DOCUMENTATION));

            strategy.execute(workflow, context, execution(workflow));

            assertThat(strategy.getStatistics())
                    .containsEntry("batchesRun", 1L)
                    .containsEntry("parallelBatches", 1L);
            assertThat(strategy.getBatchHistory()).hasSize(1);
        }
    }
}
