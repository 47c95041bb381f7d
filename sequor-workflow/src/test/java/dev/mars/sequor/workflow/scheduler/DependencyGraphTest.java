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

package dev.mars.sequor.workflow.scheduler;

import dev.mars.sequor.core.exceptions.ErrorKind;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DependencyGraph")
class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("A linear chain sorts in dependency order")
        void linearChain() throws Exception {
            graph.addExecution("a", Set.of());
            graph.addExecution("b", Set.of("a"));
            graph.addExecution("c", Set.of("b"));

            assertThat(graph.topologicalSort()).containsExactly("a", "b", "c");
            assertThat(graph.hasCycles()).isFalse();
        }

        @Test
        @DisplayName("Independent executions share a parallel batch")
        void parallelBatches() throws Exception {
            graph.addExecution("a", Set.of());
            graph.addExecution("b", Set.of());
            graph.addExecution("c", Set.of("a", "b"));
            graph.addExecution("d", Set.of("c"));

            List<List<String>> batches = graph.getParallelBatches();

            assertThat(batches).hasSize(3);
            assertThat(batches.get(0)).containsExactlyInAnyOrder("a", "b");
            assertThat(batches.get(1)).containsExactly("c");
            assertThat(batches.get(2)).containsExactly("d");
        }
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        @Test
        @DisplayName("A cycle is detected and blocks sorting")
        void detectsCycle() {
            graph.addExecution("a", Set.of("c"));
            graph.addExecution("b", Set.of("a"));
            graph.addExecution("c", Set.of("b"));

            assertThat(graph.hasCycles()).isTrue();
            assertThatThrownBy(graph::topologicalSort)
                    .isInstanceOfSatisfying(WorkflowExecutionException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.DEPENDENCY);
                        assertThat(e.getDetail(WorkflowExecutionException.DETAIL_CIRCULAR)).isEqualTo(Boolean.TRUE);
                    });
            assertThatThrownBy(graph::getParallelBatches).isInstanceOf(WorkflowExecutionException.class);
        }

        @Test
        @DisplayName("A prospective edge set is checked before it is added")
        void wouldCreateCycle() {
            graph.addExecution("a", Set.of());
            graph.addExecution("b", Set.of("a"));

            assertThat(graph.wouldCreateCycle("a", Set.of("b"))).isTrue();
            assertThat(graph.wouldCreateCycle("x", Set.of("x"))).isTrue();
            assertThat(graph.wouldCreateCycle("c", Set.of("a", "b"))).isFalse();
        }

        @Test
        @DisplayName("Validation reports self, unknown and circular dependencies")
        void validateReportsProblems() {
            graph.addExecution("a", Set.of("a"));
            graph.addExecution("b", Set.of("ghost"));

            List<String> problems = graph.validate();

            assertThat(problems).anyMatch(p -> p.contains("cannot depend on itself"))
                    .anyMatch(p -> p.contains("unknown execution ghost"))
                    .anyMatch(p -> p.contains("Circular"));
        }
    }

    @Nested
    @DisplayName("Edges")
    class Edges {

        @Test
        @DisplayName("Dependents are tracked in both directions")
        void bothDirections() {
            graph.addExecution("a", Set.of());
            graph.addExecution("b", Set.of("a"));
            graph.addExecution("c", Set.of("a"));

            assertThat(graph.getDependents("a")).containsExactlyInAnyOrder("b", "c");
            assertThat(graph.getDependencies("b")).containsExactly("a");

            graph.removeDependencies("b");

            assertThat(graph.getDependents("a")).containsExactly("c");
            assertThat(graph.contains("b")).isTrue();
            assertThat(graph.getDependencies("b")).isEmpty();
        }

        @Test
        @DisplayName("Removing an execution drops its edges")
        void removeExecution() {
            graph.addExecution("a", Set.of());
            graph.addExecution("b", Set.of("a"));

            graph.removeExecution("a");

            assertThat(graph.contains("a")).isFalse();
            assertThat(graph.getDependencies("b")).isEmpty();
            assertThat(graph.hasDependents("a")).isFalse();
            assertThat(graph.size()).isEqualTo(1);
        }
    }
}
