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
import static org.assertj.core.api.Assertions.within;

@DisplayName("SmartExecutionStrategy")
class SmartExecutionStrategyTest {

    private SmartExecutionStrategy strategy;
    private WorkflowContext context;

    @BeforeEach
    void setUp() {
        strategy = new SmartExecutionStrategy();
        context = new SimpleWorkflowContext();
    }

    @AfterEach
    void tearDown() {
        strategy.shutdown();
    }

    private static ExecutionContext execution(Workflow workflow) {
        return ExecutionContext.builder().executionId("exec-smart").workflow(workflow).build();
    }

    @Nested
    @DisplayName("Analysis")
    class Analysis {

        @Test
        @DisplayName("Complexity weighs step count, type diversity and heavy steps")
        void computesComplexity() {
            List<Step> light = List.of(
                    TestWorkflows.succeeding("a", StepType.PROCESSING),
                    TestWorkflows.succeeding("b", StepType.PROCESSING));
            List<Step> heavy = List.of(
                    TestWorkflows.succeeding("a", StepType.ANALYSIS),
                    TestWorkflows.succeeding("b", StepType.TESTING),
                    TestWorkflows.succeeding("c", StepType.DEPLOYMENT));

            assertThat(SmartExecutionStrategy.complexity(light)).isCloseTo(0.14, within(1e-9));
            assertThat(SmartExecutionStrategy.complexity(heavy)).isCloseTo(0.12 + 0.18 + 0.3, within(1e-9));
            assertThat(SmartExecutionStrategy.complexity(List.of())).isZero();
        }

        @Test
        @DisplayName("Duration estimate uses type defaults plus transition overhead")
        void estimatesDurationWithoutHistory() {
            List<Step> steps = List.of(
                    TestWorkflows.succeeding("a", StepType.SETUP),
                    TestWorkflows.succeeding("b", StepType.CLEANUP));

            assertThat(strategy.estimateDuration(steps)).isEqualTo(2500 + 1000 + 100);
        }

        @Test
        @DisplayName("Signature similarity is shared types over all distinct types")
        void measuresSimilarity() {
            assertThat(SmartExecutionStrategy.similarity("setup_testing", "setup_testing")).isEqualTo(1.0);
            assertThat(SmartExecutionStrategy.similarity("setup_testing", "setup_cleanup"))
                    .isCloseTo(1.0 / 3.0, within(1e-9));
        }

        @Test
        @DisplayName("Without history the confidence is the base value")
        void baseConfidence() {
            List<Step> steps = List.of(TestWorkflows.succeeding("a", StepType.PROCESSING));

            assertThat(strategy.confidence(steps, 0)).isEqualTo(0.5);
            assertThat(strategy.confidence(steps, 5)).isCloseTo(0.7, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Learning")
    class Learning {

        private final List<Step> steps = List.of(
                TestWorkflows.succeeding("extract", StepType.PROCESSING),
                TestWorkflows.succeeding("load", StepType.PROCESSING));

        private String choice() {
            return strategy.chooseApproach(strategy.analyze(steps));
        }

        @Test
        @DisplayName("A better approach on a similar workflow replaces the default choice")
        void historyChangesTheChoice() {
            assertThat(choice()).isEqualTo(SmartExecutionStrategy.APPROACH_ADAPTIVE);

            strategy.recordOutcome("etl_test", "processing_processing",
                    SmartExecutionStrategy.APPROACH_ADAPTIVE, false, 800, 2);
            strategy.recordOutcome("etl_test", "processing_processing",
                    BatchExecutionStrategy.NAME, true, 400, 2);

            assertThat(choice()).isEqualTo(BatchExecutionStrategy.NAME);
        }

        @Test
        @DisplayName("With equal success the faster approach wins")
        void fasterApproachWins() {
            strategy.recordOutcome("etl_test", "processing_processing",
                    SmartExecutionStrategy.APPROACH_ADAPTIVE, true, 2000, 2);
            strategy.recordOutcome("etl_test", "processing_processing",
                    BatchExecutionStrategy.NAME, true, 300, 2);

            assertThat(choice()).isEqualTo(BatchExecutionStrategy.NAME);
        }

        @Test
        @DisplayName("Unrelated workflows do not influence the choice")
        void dissimilarHistoryIgnored() {
            strategy.recordOutcome("cleanup_test", "cleanup_documentation",
                    BatchExecutionStrategy.NAME, true, 100, 2);

            assertThat(choice()).isEqualTo(SmartExecutionStrategy.APPROACH_ADAPTIVE);
        }

        @Test
        @DisplayName("A failing approach with nothing better on record gives way to an untried one")
        void failingApproachIsReplaced() {
            strategy.recordOutcome("etl_test", "processing_processing",
                    SmartExecutionStrategy.APPROACH_ADAPTIVE, false, 500, 1);

            assertThat(choice()).isEqualTo(BasicExecutionStrategy.NAME);
        }

        @Test
        @DisplayName("The approach that actually ran is what gets learned")
        void learnsExecutedApproach() throws Exception {
            Workflow workflow = TestWorkflows.workflow("etl", steps.toArray(new Step[0]));

            ExecutionResult first = strategy.execute(workflow, context, execution(workflow));

            assertThat(first.getMetadata()).containsEntry("approach", SmartExecutionStrategy.APPROACH_ADAPTIVE);
            SmartExecutionStrategy.Analysis analysis = strategy.analyze(steps);
            assertThat(analysis.similarPatterns).singleElement()
                    .satisfies(pattern -> assertThat(pattern).containsEntry("strategy",
                            SmartExecutionStrategy.APPROACH_ADAPTIVE));
            assertThat(analysis.learnedOutcomes).containsOnlyKeys(SmartExecutionStrategy.APPROACH_ADAPTIVE);
            assertThat(analysis.learnedOutcomes.get(SmartExecutionStrategy.APPROACH_ADAPTIVE).getSuccessRate())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @Test
        @DisplayName("A first run is adaptive and pairs cheap steps")
        void firstRunIsAdaptive() throws Exception {
            Workflow workflow = TestWorkflows.workflow("docs",
                    TestWorkflows.succeeding("readme", StepType.DOCUMENTATION),
                    TestWorkflows.succeeding("changelog", StepType.DOCUMENTATION));

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMetadata()).containsEntry("approach", SmartExecutionStrategy.APPROACH_ADAPTIVE);
            assertThat(result.getStepResults()).allMatch(StepResult::isParallel);
        }

        @Test
        @DisplayName("Without adaptive mode a first run is basic")
        void basicWhenAdaptiveDisabled() throws Exception {
            SmartExecutionStrategy plain = new SmartExecutionStrategy(true, false, true, 0.7, 100);
            try {
                Workflow workflow = TestWorkflows.workflow("plain",
                        TestWorkflows.succeeding("a", StepType.DOCUMENTATION),
                        TestWorkflows.succeeding("b", StepType.DOCUMENTATION));

                ExecutionResult result = plain.execute(workflow, context, execution(workflow));

                assertThat(result.getMetadata()).containsEntry("approach", BasicExecutionStrategy.NAME);
                assertThat(result.getStepResults()).noneMatch(StepResult::isParallel);
            } finally {
                plain.shutdown();
            }
        }

        @Test
        @DisplayName("Learned history raises confidence and switches to the recommended approach")
        void followsRecommendationOnceConfident() throws Exception {
            Workflow workflow = TestWorkflows.workflow("build",
                    TestWorkflows.succeeding("compile", StepType.PROCESSING),
                    TestWorkflows.succeeding("package", StepType.PROCESSING));

            strategy.execute(workflow, context, execution(workflow));
            ExecutionResult second = strategy.execute(workflow, context, execution(workflow));

            assertThat(strategy.getPatternCount()).isEqualTo(1);
            assertThat(strategy.getStepTypeStatistics().get("processing")).containsEntry("executions", 4L);
            assertThat(second.getMetadata()).containsEntry("approach", BatchExecutionStrategy.NAME);
            @SuppressWarnings("unchecked")
            Map<String, Object> analysis = (Map<String, Object>) second.getMetadata().get("analysis");
            assertThat((Double) analysis.get("confidence")).isCloseTo(0.9, within(1e-9));
            assertThat(second.getStepResults()).allMatch(StepResult::isParallel);
        }

        @Test
        @DisplayName("A failed step stops the run")
        void stopsOnFailure() throws Exception {
            TestStep after = TestWorkflows.succeeding("after", StepType.PROCESSING);
            Workflow workflow = TestWorkflows.workflow("failing",
                    TestWorkflows.failing("first", StepType.PROCESSING, "broken"), after);

            ExecutionResult result = strategy.execute(workflow, context, execution(workflow));

            assertThat(result.isSuccess()).isFalse();
            assertThat(after.getInvocations()).isZero();
            assertThat(strategy.getStepTypeStatistics().get("processing"))
                    .containsEntry("executions", 1L)
                    .containsEntry("successRate", 0.0);
        }

        @Test
        @DisplayName("Clearing learning resets statistics and patterns")
        void clearsLearning() throws Exception {
            Workflow workflow = TestWorkflows.workflow("clear", TestWorkflows.succeeding("a", StepType.SETUP));
            strategy.execute(workflow, context, execution(workflow));

            strategy.clearLearning();

            assertThat(strategy.getPatternCount()).isZero();
            assertThat(strategy.getStepTypeStatistics()).isEmpty();
        }
    }
}
