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
import dev.mars.sequor.core.StepStatus;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.exceptions.ErrorKind;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.workflow.ExecutionContext;
import dev.mars.sequor.workflow.StepExecutionListener;
import dev.mars.sequor.workflow.TestWorkflows;
import dev.mars.sequor.workflow.TestWorkflows.TestStep;
import dev.mars.sequor.workflow.cache.ExecutionCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BasicExecutionStrategy")
class BasicExecutionStrategyTest {

    private BasicExecutionStrategy strategy;
    private WorkflowContext context;

    @BeforeEach
    void setUp() {
        strategy = new BasicExecutionStrategy();
        context = SimpleWorkflowContext.of(Map.of("projectId", "p-1"));
    }

    private static ExecutionContext execution(Workflow workflow) {
        return ExecutionContext.builder().executionId("exec-basic").workflow(workflow).build();
    }

    @Nested
    @DisplayName("Sequencing")
    class Sequencing {

        @Test
        @DisplayName("Runs every step in declared order")
        void runsAllSteps() throws Exception {
            List<String> order = new ArrayList<>();
            Workflow workflow = TestWorkflows.workflow("ordered",
                    TestWorkflows.step("first", StepType.SETUP, ctx -> {
                        order.add("first");
                        return StepOutput.success(Map.of("n", 1));
                    }),
                    TestWorkflows.step("second", StepType.PROCESSING, ctx -> {
                        order.add("second");
                        return StepOutput.success(Map.of("n", 2));
                    }));

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getStrategy()).isEqualTo(BasicExecutionStrategy.NAME);
            assertThat(order).containsExactly("first", "second");
            assertThat(result.getStepResults()).extracting(StepResult::getIndex).containsExactly(0, 1);
            assertThat(result.getOutput()).containsEntry("second", Map.of("n", 2));
            assertThat(result.getMetadata()).containsEntry(AbstractExecutionStrategy.META_COMPLETED_STEPS, 2);
        }

        @Test
        @DisplayName("Stops at the first failed step")
        void stopsAtFirstFailure() throws Exception {
            TestStep third = TestWorkflows.succeeding("publish", StepType.DEPLOYMENT);
            Workflow workflow = TestWorkflows.workflow("failing",
                    TestWorkflows.succeeding("prepare", StepType.SETUP),
                    TestWorkflows.failing("compile", StepType.PROCESSING, "compiler crashed"),
                    third);

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getStepResults()).hasSize(2);
            assertThat(result.getStepResults().get(1).getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(result.getError()).isEqualTo("Step 'compile' failed: compiler crashed");
            assertThat(third.getInvocations()).isZero();
        }

        @Test
        @DisplayName("A throwing step becomes a failed step result")
        void throwingStepFails() throws Exception {
            Workflow workflow = TestWorkflows.workflow("throwing",
                    TestWorkflows.throwing("explode", StepType.PROCESSING, new IllegalStateException("kaboom")));

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getStepResults().get(0).getError()).isEqualTo("kaboom");
        }

        @Test
        @DisplayName("Disabled steps are skipped without running")
        void skipsDisabledSteps() throws Exception {
            TestStep disabled = TestWorkflows.step(StepMetadata.builder()
                            .name("lint")
                            .type(StepType.VALIDATION)
                            .attribute(StepMetadata.ATTR_DISABLED, true)
                            .build(),
                    ctx -> StepOutput.success());
            Workflow workflow = TestWorkflows.workflow("with-disabled",
                    disabled, TestWorkflows.succeeding("build", StepType.PROCESSING));

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getStepResults().get(0).getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(disabled.getInvocations()).isZero();
        }

        @Test
        @DisplayName("A workflow without steps runs its body")
        void runsWorkflowBody() throws Exception {
            Workflow workflow = TestWorkflows.bodyOnly("body", Map.of("answer", 42));

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput()).containsEntry("answer", 42);
            assertThat(result.getStepResults()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Collaborators")
    class Collaborators {

        @Test
        @DisplayName("Cacheable steps are served from the step cache on the second run")
        void usesStepCache() throws Exception {
            TestStep cacheable = TestWorkflows.step(StepMetadata.builder()
                            .name("scan")
                            .type(StepType.ANALYSIS)
                            .attribute(StepMetadata.ATTR_CACHEABLE, true)
                            .build(),
                    ctx -> StepOutput.success(Map.of("files", 12)));
            Workflow workflow = TestWorkflows.workflow("cached", cacheable);
            ExecutionCache cache = new ExecutionCache();
            ExecutionContext first = ExecutionContext.builder().executionId("run-1").workflow(workflow).stepCache(cache).build();
            ExecutionContext second = ExecutionContext.builder().executionId("run-2").workflow(workflow).stepCache(cache).build();

            strategy.execute(workflow, context, first);
            ExecutionResult result = strategy.execute(workflow, context, second);

            assertThat(cacheable.getInvocations()).isEqualTo(1);
            assertThat(result.getStepResults().get(0).isFromCache()).isTrue();
            assertThat(result.getMetadata()).containsEntry(AbstractExecutionStrategy.META_CACHE_HITS, 1);
        }

        @Test
        @DisplayName("Listener sees start and end of every executed step")
        void notifiesListener() throws Exception {
            List<String> events = new ArrayList<>();
            StepExecutionListener listener = new StepExecutionListener() {
                @Override
                public void onStepStart(String executionId, int index, Step step) {
                    events.add("start:" + step.getMetadata().getName());
                }

                @Override
                public void onStepEnd(String executionId, StepResult result) {
                    events.add("end:" + result.getName());
                }
            };
            Workflow workflow = TestWorkflows.workflow("listened",
                    TestWorkflows.succeeding("a", StepType.SETUP),
                    TestWorkflows.succeeding("b", StepType.CLEANUP));

            strategy.execute(workflow, context,
                    ExecutionContext.builder().executionId("exec-l").workflow(workflow).listener(listener).build());

            assertThat(events).containsExactly("start:a", "end:a", "start:b", "end:b");
        }

        @Test
        @DisplayName("Cancellation between steps stops the run with a cancellation error")
        void cancelsBetweenSteps() {
            AtomicReference<ExecutionContext> holder = new AtomicReference<>();
            StepExecutionListener cancelAfterFirst = new StepExecutionListener() {
                @Override
                public void onStepEnd(String executionId, StepResult result) {
                    holder.get().cancel();
                }
            };
            TestStep second = TestWorkflows.succeeding("second", StepType.PROCESSING);
            Workflow workflow = TestWorkflows.workflow("cancelled",
                    TestWorkflows.succeeding("first", StepType.SETUP), second);
            holder.set(ExecutionContext.builder().executionId("exec-c").workflow(workflow).listener(cancelAfterFirst).build());

            assertThatThrownBy(() -> strategy.execute(workflow, context, holder.get()))
                    .isInstanceOfSatisfying(WorkflowExecutionException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.STRATEGY_EXECUTION);
                        assertThat(e.isCancellation()).isTrue();
                    });
            assertThat(second.getInvocations()).isZero();
        }
    }
}
