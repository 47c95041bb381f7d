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

import dev.mars.sequor.core.exceptions.WorkflowExecutionException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

/**
 * Dependency graph between scheduled executions, keyed by execution id.
 * Keeps both directions ("depends on" and "is depended on by") so the scheduler can
 * answer readiness and cleanup questions without scanning every node.
 * Not thread-safe; the owning {@link ExecutionScheduler} guards it.
 */
public class DependencyGraph {

    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();

    /**
     * Adds an execution and its dependency edges. Re-adding an id replaces its edges.
     *
     * @param executionId the execution id
     * @param dependsOn ids the execution waits for
     */
    public void addExecution(String executionId, Set<String> dependsOn) {
        Objects.requireNonNull(executionId, "Execution id cannot be null");
        removeDependencies(executionId);
        dependencies.put(executionId, new LinkedHashSet<>(dependsOn));
        for (String dependency : dependsOn) {
            dependents.computeIfAbsent(dependency, k -> new LinkedHashSet<>()).add(executionId);
        }
    }

    /**
     * Drops the outgoing edges of an execution but keeps the node, so executions
     * that depend on it can still see it.
     */
    public void removeDependencies(String executionId) {
        Set<String> previous = dependencies.get(executionId);
        if (previous == null) {
            return;
        }
        for (String dependency : previous) {
            Set<String> reverse = dependents.get(dependency);
            if (reverse != null) {
                reverse.remove(executionId);
                if (reverse.isEmpty()) {
                    dependents.remove(dependency);
                }
            }
        }
        previous.clear();
    }

    /**
     * Removes the node and every edge touching it.
     */
    public void removeExecution(String executionId) {
        removeDependencies(executionId);
        dependencies.remove(executionId);
        Set<String> waiting = dependents.remove(executionId);
        if (waiting != null) {
            for (String dependent : waiting) {
                Set<String> forward = dependencies.get(dependent);
                if (forward != null) {
                    forward.remove(executionId);
                }
            }
        }
    }

    public boolean contains(String executionId) {
        return dependencies.containsKey(executionId);
    }

    public Set<String> getDependencies(String executionId) {
        Set<String> result = dependencies.get(executionId);
        return result == null ? Set.of() : Set.copyOf(result);
    }

    public Set<String> getDependents(String executionId) {
        Set<String> result = dependents.get(executionId);
        return result == null ? Set.of() : Set.copyOf(result);
    }

    public boolean hasDependents(String executionId) {
        Set<String> result = dependents.get(executionId);
        return result != null && !result.isEmpty();
    }

    public int size() {
        return dependencies.size();
    }

    /**
     * Whether adding the given edges for {@code executionId} would close a cycle.
     */
    public boolean wouldCreateCycle(String executionId, Set<String> dependsOn) {
        if (dependsOn.contains(executionId)) {
            return true;
        }
        // a cycle exists when executionId is reachable from any of its new dependencies
        Set<String> visited = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>(dependsOn);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(executionId)) {
                return true;
            }
            if (visited.add(current)) {
                queue.addAll(dependencies.getOrDefault(current, Set.of()));
            }
        }
        return false;
    }

    /**
     * Orders executions so that every execution follows its dependencies (Kahn's algorithm).
     *
     * @return execution ids in dependency order
     * @throws WorkflowExecutionException of kind DEPENDENCY when the graph has a cycle
     */
    public List<String> topologicalSort() throws WorkflowExecutionException {
        Map<String, Integer> inDegree = calculateInDegree();
        Queue<String> queue = new ArrayDeque<>();
        List<String> result = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(current);
            for (String dependent : dependents.getOrDefault(current, Set.of())) {
                if (inDegree.computeIfPresent(dependent, (k, v) -> v - 1) == 0) {
                    queue.offer(dependent);
                }
            }
        }

        if (result.size() != dependencies.size()) {
            List<String> remaining = new ArrayList<>(dependencies.keySet());
            remaining.removeAll(result);
            throw WorkflowExecutionException.dependency(remaining.get(0), true,
                    "Circular dependency detected among executions: " + remaining);
        }
        return result;
    }

    public boolean hasCycles() {
        try {
            topologicalSort();
            return false;
        } catch (WorkflowExecutionException e) {
            return true;
        }
    }

    /**
     * Groups executions into waves that may run concurrently; each wave only depends on earlier waves.
     *
     * @throws WorkflowExecutionException of kind DEPENDENCY when the graph has a cycle
     */
    public List<List<String>> getParallelBatches() throws WorkflowExecutionException {
        List<List<String>> batches = new ArrayList<>();
        Map<String, Integer> inDegree = calculateInDegree();
        Set<String> processed = new LinkedHashSet<>();

        while (processed.size() < dependencies.size()) {
            List<String> currentBatch = new ArrayList<>();
            for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
                if (entry.getValue() == 0 && !processed.contains(entry.getKey())) {
                    currentBatch.add(entry.getKey());
                }
            }

            if (currentBatch.isEmpty()) {
                List<String> remaining = new ArrayList<>(dependencies.keySet());
                remaining.removeAll(processed);
                throw WorkflowExecutionException.dependency(remaining.get(0), true,
                        "Circular dependency detected - cannot create execution batches");
            }

            processed.addAll(currentBatch);
            batches.add(currentBatch);
            for (String id : currentBatch) {
                for (String dependent : dependents.getOrDefault(id, Set.of())) {
                    inDegree.computeIfPresent(dependent, (k, v) -> v - 1);
                }
            }
        }
        return batches;
    }

    /**
     * Lists consistency problems: dependencies on unknown executions, self-dependencies and cycles.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (dependency.equals(entry.getKey())) {
                    problems.add("Execution " + entry.getKey() + " cannot depend on itself");
                } else if (!dependencies.containsKey(dependency)) {
                    problems.add("Execution " + entry.getKey() + " depends on unknown execution " + dependency);
                }
            }
        }
        if (hasCycles()) {
            problems.add("Circular dependencies detected between executions");
        }
        return problems;
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            int degree = 0;
            for (String dependency : entry.getValue()) {
                if (dependencies.containsKey(dependency)) {
                    degree++;
                }
            }
            inDegree.put(entry.getKey(), degree);
        }
        return inDegree;
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "executions=" + dependencies.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
