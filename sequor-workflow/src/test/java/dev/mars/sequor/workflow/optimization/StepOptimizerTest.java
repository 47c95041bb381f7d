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

package dev.mars.sequor.workflow.optimization;

import dev.mars.sequor.core.OptimizedStep;
import dev.mars.sequor.core.SimpleWorkflowContext;
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.StepOutput;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.workflow.TestWorkflows;
import dev.mars.sequor.workflow.TestWorkflows.TestStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StepOptimizer")
class StepOptimizerTest {

    private StepOptimizer optimizer;
    private WorkflowContext context;

    @BeforeEach
    void setUp() {
        optimizer = new StepOptimizer();
        context = new SimpleWorkflowContext();
    }

    private static TestStep step(String name, StepType type, Map<String, Object> parameters) {
        StepMetadata metadata = StepMetadata.builder().name(name).type(type).parameters(parameters).build();
        return TestWorkflows.step(metadata, ctx -> StepOutput.success(Map.of("step", name)));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> resources(Step step) {
        return (Map<String, Object>) step.getMetadata().getAttribute(StepMetadata.ATTR_RESOURCE_REQUIREMENTS);
    }

    @Nested
    @DisplayName("Rules")
    class Rules {

        @Test
        @DisplayName("Analysis steps get a capped timeout, parallelism and sized resources")
        void analysis() {
            Step optimized = optimizer.optimizeStep(
                    step("crunch", StepType.ANALYSIS, Map.of("timeout", 500_000)), context);

            StepMetadata metadata = optimized.getMetadata();
            assertThat(optimized).isInstanceOf(OptimizedStep.class);
            assertThat(metadata.getParameter("timeout")).isEqualTo(300_000L);
            assertThat(metadata.getParameter("parallel")).isEqualTo(true);
            assertThat(metadata.isOptimized()).isTrue();
            assertThat(metadata.getExecutionStrategy()).isEqualTo("parallel");
            assertThat(resources(optimized))
                    .containsEntry("memoryMb", 128L)
                    .containsEntry("cpuPercent", 40.0)
                    .containsEntry("timeoutMs", 300_000L);
        }

        @Test
        @DisplayName("Large processing batches run with the batch strategy")
        void processing() {
            Step optimized = optimizer.optimizeStep(
                    step("load", StepType.PROCESSING, Map.of("batchSize", 200)), context);

            StepMetadata metadata = optimized.getMetadata();
            assertThat(metadata.getParameter("retries")).isEqualTo(3L);
            assertThat(metadata.getExecutionStrategy()).isEqualTo("batch");
            assertThat(resources(optimized)).containsEntry("memoryMb", 512L);
        }

        @Test
        @DisplayName("Fast mode shortens timeouts")
        void fastMode() {
            context.set(StepOptimizer.FAST_MODE, true);

            Step optimized = optimizer.optimizeStep(step("check", StepType.TESTING, Map.of("timeout", 90_000)), context);

            assertThat(optimized.getMetadata().getParameter("timeout")).isEqualTo(30_000L);
            assertThat(resources(optimized)).containsEntry("timeoutMs", 30_000L);
        }

        @Test
        @DisplayName("Production mode enforces retries, rollback and a resource floor")
        void productionMode() {
            context.set(StepOptimizer.PRODUCTION_MODE, "true");

            Step optimized = optimizer.optimizeStep(step("ship", StepType.DEPLOYMENT, Map.of()), context);

            StepMetadata metadata = optimized.getMetadata();
            assertThat(metadata.getParameter("retries")).isEqualTo(3L);
            assertThat(metadata.getParameter("rollback")).isEqualTo(true);
            assertThat(metadata.getParameter("healthCheck")).isEqualTo(true);
            assertThat(metadata.getExecutionStrategy()).isEqualTo("rolling");
            assertThat(resources(optimized))
                    .containsEntry("memoryMb", 128L)
                    .containsEntry("cpuPercent", 15.0);
        }
    }

    @Nested
    @DisplayName("Learning")
    class Learning {

        @Test
        @DisplayName("Only rules that improve the step are recorded")
        void improvingRulesOnly() {
            optimizer.optimizeStep(step("crunch", StepType.ANALYSIS, Map.of("timeout", 500_000)), context);

            Map<String, Double> applied = optimizer.getAppliedRules("analysis_crunch_1.0");
            assertThat(applied).containsOnlyKeys(StepOptimizer.RULE_PARAMETERS);
            // duration drops from 500 s to 300 s
            assertThat(applied.get(StepOptimizer.RULE_PARAMETERS)).isEqualTo(40.0);
        }

        @Test
        @DisplayName("Steps that were not improved stay out of the history")
        void noImprovement() {
            optimizer.optimizeStep(step("prepare", StepType.SETUP, Map.of()), context);

            assertThat(optimizer.getAppliedRules("setup_prepare_1.0")).isEmpty();
            assertThat(optimizer.getStatistics()).containsEntry("historySize", 0);
        }
    }

    @Test
    @DisplayName("Cached optimizations wrap the step passed in")
    void cacheWrapsCurrentStep() throws Exception {
        TestStep first = step("crunch", StepType.ANALYSIS, Map.of());
        TestStep second = step("crunch", StepType.ANALYSIS, Map.of());

        Step optimizedFirst = optimizer.optimizeStep(first, context);
        Step optimizedSecond = optimizer.optimizeStep(second, context);

        assertThat(optimizedSecond.getMetadata()).isEqualTo(optimizedFirst.getMetadata());
        assertThat(((OptimizedStep) optimizedSecond).getOriginal()).isSameAs(second);

        optimizedSecond.execute(context);
        assertThat(second.getInvocations()).isEqualTo(1);
        assertThat(first.getInvocations()).isZero();
        assertThat(optimizer.getStatistics()).containsEntry("cacheSize", 1);
    }

    @Test
    @DisplayName("Disabled optimizer returns the step unchanged")
    void disabled() {
        optimizer.setEnabled(false);
        TestStep original = step("crunch", StepType.ANALYSIS, Map.of());

        assertThat(optimizer.optimizeStep(original, context)).isSameAs(original);
    }
}
