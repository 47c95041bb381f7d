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

import dev.mars.sequor.config.SequorConfiguration;
import dev.mars.sequor.core.ExecutionOptions;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.workflow.ExecutionContext;
import dev.mars.sequor.workflow.optimization.ExecutionPredictor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Admits executions against a fixed CPU/memory/disk pool, tracks dependencies between
 * executions and decides which scheduled executions may start.
 *
 * <p>Capacity is checked against what is currently free when an execution is scheduled and
 * reserved when it is marked running. Every transition out of RUNNING gives the reservation
 * back exactly once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-30
 */
public class ExecutionScheduler {

    private static final Logger logger = Logger.getLogger(ExecutionScheduler.class.getName());

    public static final String REASON_INVALID = "invalid";
    public static final String REASON_DUPLICATE = "duplicate";
    public static final String REASON_CAPACITY = "capacity";
    public static final String REASON_DEPENDENCY = "dependency";
    public static final String REASON_NOT_READY = "not_ready";
    public static final String REASON_CONCURRENCY = "concurrency";
    public static final String REASON_UNKNOWN = "unknown";

    static final long BASE_STEP_DURATION_MS = 30_000L;

    private static final Comparator<ScheduledExecution> DISPATCH_ORDER =
            Comparator.comparingInt(ScheduledExecution::getPriority).reversed()
                    .thenComparingLong(ScheduledExecution::getSequence);

    private final Object lock = new Object();
    private final Map<String, ScheduledExecution> executions = new LinkedHashMap<>();
    private final DependencyGraph graph = new DependencyGraph();
    private final ResourcePool pool;
    private final Clock clock;

    private volatile ExecutionPredictor predictor;
    private int maxConcurrentExecutions;
    private long sequence;

    private long totalScheduled;
    private long totalExecuted;
    private long totalFailed;
    private long totalCancelled;
    private long totalSchedulingNanos;

    public ExecutionScheduler() {
        this(new SequorConfiguration());
    }

    public ExecutionScheduler(SequorConfiguration configuration) {
        this(configuration, Clock.systemUTC());
    }

    public ExecutionScheduler(SequorConfiguration configuration, Clock clock) {
        this.pool = new ResourcePool(configuration.getSchedulerPoolCpu(),
                configuration.getSchedulerPoolMemoryMb(), configuration.getSchedulerPoolDiskMb());
        this.maxConcurrentExecutions = configuration.getMaxConcurrentExecutions();
        this.clock = clock;
    }

    /**
     * Uses the predictor's duration estimate for workflows it has history for.
     */
    public void setPredictor(ExecutionPredictor predictor) {
        this.predictor = predictor;
    }

    public void updateConfiguration(SequorConfiguration configuration) {
        synchronized (lock) {
            this.maxConcurrentExecutions = configuration.getMaxConcurrentExecutions();
        }
        logger.info("Scheduler max concurrent executions set to " + configuration.getMaxConcurrentExecutions());
    }

    /**
     * Admits an execution.
     *
     * @param context the execution to schedule
     * @return the scheduled execution
     * @throws WorkflowExecutionException of kind SCHEDULER when the context is invalid, the id is
     *         already tracked, the requirements exceed the free pool or a dependency is unknown,
     *         self-referential, failed or cancelled
     */
    public ScheduledExecution schedule(ExecutionContext context) throws WorkflowExecutionException {
        long started = System.nanoTime();
        if (context == null || context.getExecutionId() == null || context.getWorkflow() == null) {
            throw WorkflowExecutionException.scheduler(context == null ? null : context.getExecutionId(),
                    REASON_INVALID, "Execution context must carry an execution id and a workflow");
        }
        String executionId = context.getExecutionId();
        Workflow workflow = context.getWorkflow();
        ExecutionOptions options = context.getOptions();

        List<String> dependencies = collectDependencies(workflow, options);
        ResourceRequirements requirements = calculateRequirements(workflow);
        long duration = estimateDuration(context);
        int priority = options.getEffectivePriority();

        synchronized (lock) {
            ScheduledExecution existing = executions.get(executionId);
            if (existing != null && !existing.getStatus().isTerminal()) {
                throw WorkflowExecutionException.scheduler(executionId, REASON_DUPLICATE,
                        "Execution " + executionId + " is already scheduled");
            }
            validateDependencies(executionId, dependencies);
            String shortfall = pool.shortfall(requirements);
            if (shortfall != null) {
                throw WorkflowExecutionException.scheduler(executionId, REASON_CAPACITY, shortfall);
            }

            ScheduledExecution scheduled = new ScheduledExecution(context, Instant.now(clock), sequence++,
                    priority, duration, requirements, dependencies, options.getConstraints());
            if (existing != null) {
                graph.removeExecution(executionId);
            }
            executions.put(executionId, scheduled);
            graph.addExecution(executionId, new LinkedHashSet<>(dependencies));
            totalScheduled++;
            totalSchedulingNanos += System.nanoTime() - started;

            logger.fine(String.format(Locale.ROOT, "Scheduled %s (priority %d, ~%d ms, %s, dependencies %s)",
                    executionId, priority, duration, requirements, dependencies));
            return scheduled;
        }
    }

    public Optional<ScheduledExecution> getExecution(String executionId) {
        synchronized (lock) {
            return Optional.ofNullable(executions.get(executionId));
        }
    }

    /**
     * Scheduled executions whose dependencies have all completed and whose requirements fit the
     * free pool, highest priority first, then in scheduling order.
     */
    public List<ScheduledExecution> getReadyExecutions() {
        synchronized (lock) {
            return executions.values().stream()
                    .filter(this::isReadyLocked)
                    .sorted(DISPATCH_ORDER)
                    .collect(Collectors.toList());
        }
    }

    public boolean isReady(String executionId) {
        synchronized (lock) {
            ScheduledExecution execution = executions.get(executionId);
            return execution != null && isReadyLocked(execution);
        }
    }

    /**
     * Scheduled executions that can never become ready because a dependency failed or was cancelled.
     */
    public List<ScheduledExecution> getBlockedExecutions() {
        synchronized (lock) {
            return executions.values().stream()
                    .filter(e -> e.getStatus() == ScheduledExecutionStatus.SCHEDULED)
                    .filter(e -> failedDependency(e) != null)
                    .sorted(DISPATCH_ORDER)
                    .collect(Collectors.toList());
        }
    }

    /**
     * The first failed or cancelled dependency of the execution, if any.
     */
    public Optional<String> getFailedDependency(String executionId) {
        synchronized (lock) {
            ScheduledExecution execution = executions.get(executionId);
            return execution == null ? Optional.empty() : Optional.ofNullable(failedDependency(execution));
        }
    }

    /**
     * Moves a ready execution to RUNNING and reserves its requirements.
     *
     * @throws WorkflowExecutionException of kind SCHEDULER when the execution is unknown, not
     *         ready, or the concurrency limit is reached
     */
    public ScheduledExecution markRunning(String executionId) throws WorkflowExecutionException {
        synchronized (lock) {
            ScheduledExecution execution = executions.get(executionId);
            if (execution == null) {
                throw WorkflowExecutionException.scheduler(executionId, REASON_UNKNOWN,
                        "Execution " + executionId + " is not scheduled");
            }
            if (!isReadyLocked(execution)) {
                throw WorkflowExecutionException.scheduler(executionId, REASON_NOT_READY,
                        "Execution " + executionId + " is not ready to run (" + execution.getStatus() + ")");
            }
            int running = countRunning();
            if (running >= maxConcurrentExecutions) {
                throw WorkflowExecutionException.scheduler(executionId, REASON_CONCURRENCY,
                        "Maximum concurrent executions reached: " + running + " of " + maxConcurrentExecutions);
            }
            pool.reserve(execution.getRequirements());
            execution.markRunning(Instant.now(clock));
            logger.fine("Execution " + executionId + " running, reserved " + execution.getRequirements());
            return execution;
        }
    }

    /**
     * Returns a running execution to SCHEDULED so it can be dispatched again.
     */
    public boolean releaseForRetry(String executionId) {
        synchronized (lock) {
            ScheduledExecution execution = executions.get(executionId);
            if (execution == null || execution.getStatus() != ScheduledExecutionStatus.RUNNING) {
                return false;
            }
            releaseReservation(execution);
            execution.resetForRetry();
            logger.fine("Execution " + executionId + " released for retry " + execution.getRetryCount());
            return true;
        }
    }

    public boolean markCompleted(String executionId) {
        return finish(executionId, ScheduledExecutionStatus.COMPLETED);
    }

    public boolean markFailed(String executionId) {
        return finish(executionId, ScheduledExecutionStatus.FAILED);
    }

    public boolean cancel(String executionId) {
        return finish(executionId, ScheduledExecutionStatus.CANCELLED);
    }

    /**
     * Removes terminal executions that no pending or running execution depends on.
     *
     * @return number of executions removed
     */
    public int cleanup() {
        synchronized (lock) {
            List<String> removable = executions.values().stream()
                    .filter(e -> e.getStatus().isTerminal())
                    .filter(e -> !graph.hasDependents(e.getExecutionId()))
                    .map(ScheduledExecution::getExecutionId)
                    .collect(Collectors.toList());
            for (String id : removable) {
                executions.remove(id);
                graph.removeExecution(id);
            }
            if (!removable.isEmpty()) {
                logger.fine("Scheduler cleanup removed " + removable.size() + " executions");
            }
            return removable.size();
        }
    }

    public SchedulerStatistics getStatistics() {
        synchronized (lock) {
            int running = countRunning();
            int pending = (int) executions.values().stream()
                    .filter(e -> e.getStatus() == ScheduledExecutionStatus.SCHEDULED)
                    .count();
            double averageMs = totalScheduled > 0 ? totalSchedulingNanos / 1_000_000.0 / totalScheduled : 0.0;
            return new SchedulerStatistics(totalScheduled, totalExecuted, totalFailed, totalCancelled,
                    averageMs, running, pending, executions.size());
        }
    }

    public Map<String, Map<String, Object>> getResourcePoolStatus() {
        synchronized (lock) {
            return pool.status();
        }
    }

    /**
     * Snapshot of the dependency graph ordering, useful for diagnostics.
     */
    public List<String> getDependencyOrder() throws WorkflowExecutionException {
        synchronized (lock) {
            return graph.topologicalSort();
        }
    }

    private boolean finish(String executionId, ScheduledExecutionStatus terminal) {
        synchronized (lock) {
            ScheduledExecution execution = executions.get(executionId);
            if (execution == null || execution.getStatus().isTerminal()) {
                return false;
            }
            releaseReservation(execution);
            execution.finish(terminal, Instant.now(clock));
            graph.removeDependencies(executionId);
            switch (terminal) {
                case COMPLETED:
                    totalExecuted++;
                    break;
                case FAILED:
                    totalFailed++;
                    break;
                default:
                    totalCancelled++;
                    break;
            }
            logger.fine("Execution " + executionId + " " + terminal.name().toLowerCase(Locale.ROOT));
            return true;
        }
    }

    private void releaseReservation(ScheduledExecution execution) {
        if (execution.isReserved()) {
            pool.release(execution.getRequirements());
        }
    }

    private boolean isReadyLocked(ScheduledExecution execution) {
        if (execution.getStatus() != ScheduledExecutionStatus.SCHEDULED) {
            return false;
        }
        for (String dependency : execution.getDependencies()) {
            ScheduledExecution upstream = executions.get(dependency);
            if (upstream == null || upstream.getStatus() != ScheduledExecutionStatus.COMPLETED) {
                return false;
            }
        }
        return pool.fits(execution.getRequirements());
    }

    private String failedDependency(ScheduledExecution execution) {
        for (String dependency : execution.getDependencies()) {
            ScheduledExecution upstream = executions.get(dependency);
            if (upstream != null && (upstream.getStatus() == ScheduledExecutionStatus.FAILED
                    || upstream.getStatus() == ScheduledExecutionStatus.CANCELLED)) {
                return dependency;
            }
        }
        return null;
    }

    private int countRunning() {
        int running = 0;
        for (ScheduledExecution execution : executions.values()) {
            if (execution.getStatus() == ScheduledExecutionStatus.RUNNING) {
                running++;
            }
        }
        return running;
    }

    private void validateDependencies(String executionId, List<String> dependencies)
            throws WorkflowExecutionException {
        for (String dependency : dependencies) {
            if (dependency.equals(executionId)) {
                throw dependencyRejection(executionId, dependency, "Execution " + executionId + " cannot depend on itself");
            }
            ScheduledExecution upstream = executions.get(dependency);
            if (upstream == null) {
                throw dependencyRejection(executionId, dependency, "Unknown dependency: " + dependency);
            }
            if (upstream.getStatus() == ScheduledExecutionStatus.FAILED
                    || upstream.getStatus() == ScheduledExecutionStatus.CANCELLED) {
                throw dependencyRejection(executionId, dependency,
                        "Dependency " + dependency + " is " + upstream.getStatus().name().toLowerCase(Locale.ROOT));
            }
        }
        if (graph.wouldCreateCycle(executionId, new LinkedHashSet<>(dependencies))) {
            throw dependencyRejection(executionId, dependencies.get(0),
                    "Dependencies of " + executionId + " would create a cycle");
        }
    }

    private static WorkflowExecutionException dependencyRejection(String executionId, String dependency,
                                                                  String message) {
        return WorkflowExecutionException.scheduler(executionId, REASON_DEPENDENCY, message).toBuilder()
                .detail(WorkflowExecutionException.DETAIL_DEPENDENCY_ID, dependency)
                .build();
    }

    static List<String> collectDependencies(Workflow workflow, ExecutionOptions options) {
        Set<String> merged = new LinkedHashSet<>();
        List<String> fromWorkflow = workflow.getDependencies();
        if (fromWorkflow != null) {
            merged.addAll(fromWorkflow);
        }
        merged.addAll(options.getDependencies());
        merged.remove(null);
        return new ArrayList<>(merged);
    }

    /**
     * Requirements scale with step count and are capped: cpu 5% per step up to 50,
     * memory 100 MB per step up to 2048, disk 50 MB per step up to 1000, adjusted by workflow type.
     */
    static ResourceRequirements calculateRequirements(Workflow workflow) {
        int steps = Math.max(1, workflow.getMetadata().getStepCount());
        double cpu = Math.min(steps * 5.0, 50.0);
        double memory = Math.min(steps * 100.0, 2048.0);
        double disk = Math.min(steps * 50.0, 1000.0);
        switch (workflowType(workflow)) {
            case "analysis":
                memory *= 1.5;
                break;
            case "testing":
                cpu *= 1.3;
                memory *= 1.2;
                break;
            case "deployment":
                disk *= 1.5;
                break;
            default:
                break;
        }
        return new ResourceRequirements(cpu, memory, disk);
    }

    long estimateDuration(ExecutionContext context) {
        Workflow workflow = context.getWorkflow();
        ExecutionPredictor current = predictor;
        if (current != null && current.hasHistory(workflow)) {
            return current.predict(workflow, context.getWorkflowContext()).getDurationMs();
        }
        return defaultDuration(workflow);
    }

    static long defaultDuration(Workflow workflow) {
        int steps = Math.max(1, workflow.getMetadata().getStepCount());
        double multiplier;
        switch (workflowType(workflow)) {
            case "analysis":
                multiplier = 1.5;
                break;
            case "testing":
                multiplier = 2.0;
                break;
            case "deployment":
                multiplier = 1.2;
                break;
            default:
                multiplier = 1.0;
                break;
        }
        return Math.round(steps * BASE_STEP_DURATION_MS * multiplier);
    }

    private static String workflowType(Workflow workflow) {
        String type = workflow.getMetadata().getType();
        return type == null ? "" : type.toLowerCase(Locale.ROOT);
    }
}
