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
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepStatus;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.exceptions.ErrorClassifier;
import dev.mars.sequor.core.exceptions.ErrorKind;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException.TimeoutScope;
import dev.mars.sequor.monitoring.EngineHealthCheck;
import dev.mars.sequor.resource.ResourceLimits;
import dev.mars.sequor.resource.ResourceManager;
import dev.mars.sequor.resource.ResourceManager.ResourceUtilization;
import dev.mars.sequor.resource.ResourceManager.ResourceValidationResult;
import dev.mars.sequor.resource.SimpleResourceManager;
import dev.mars.sequor.resource.SystemResourceSnapshot;
import dev.mars.sequor.workflow.cache.CacheOptions;
import dev.mars.sequor.workflow.cache.ExecutionCache;
import dev.mars.sequor.workflow.monitoring.Alert;
import dev.mars.sequor.workflow.monitoring.AlertSeverity;
import dev.mars.sequor.workflow.monitoring.ExecutionMetrics;
import dev.mars.sequor.workflow.monitoring.ExecutionMonitor;
import dev.mars.sequor.workflow.monitoring.MonitorThresholds;
import dev.mars.sequor.workflow.observability.WorkflowMetrics;
import dev.mars.sequor.workflow.optimization.ExecutionPredictor;
import dev.mars.sequor.workflow.optimization.Prediction;
import dev.mars.sequor.workflow.optimization.WorkflowAnalysis;
import dev.mars.sequor.workflow.optimization.WorkflowAnalyzer;
import dev.mars.sequor.workflow.optimization.WorkflowOptimizer;
import dev.mars.sequor.workflow.queue.ExecutionQueue;
import dev.mars.sequor.workflow.queue.QueueItem;
import dev.mars.sequor.workflow.queue.QueueStatistics;
import dev.mars.sequor.workflow.scheduler.ExecutionScheduler;
import dev.mars.sequor.workflow.scheduler.ScheduledExecution;
import dev.mars.sequor.workflow.strategy.BasicExecutionStrategy;
import dev.mars.sequor.workflow.strategy.BatchExecutionStrategy;
import dev.mars.sequor.workflow.strategy.ExecutionStrategy;
import dev.mars.sequor.workflow.strategy.OptimizedExecutionStrategy;
import dev.mars.sequor.workflow.strategy.SmartExecutionStrategy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Execution engine that admits workflows through resource checks, the cache, the scheduler and
 * the priority queue, then runs each one with its execution strategy on a bounded worker pool.
 *
 * <p>Dispatch is serialized: an item leaves the queue only when its dependencies are complete,
 * the resource manager can hold its request and the concurrency limit has room. Failed attempts go
 * back through the queue after their retry delay. Housekeeping (resource checks, stall detection,
 * cache and metrics cleanup, a periodic dispatch tick) runs on one scheduled thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-01
 */
public class SequentialExecutionEngine implements ExecutionEngine {

    private static final Logger logger = Logger.getLogger(SequentialExecutionEngine.class.getName());

    static final long DISPATCH_INTERVAL_MS = 1000;
    static final String CACHE_LEVEL_WORKFLOW = "workflow";
    static final String CACHE_LEVEL_STEP = "step";

    private static final long SHUTDOWN_WAIT_SECONDS = 10;
    private static final double DEGRADED_UTILIZATION_PERCENT = 90.0;

    private volatile SequorConfiguration configuration;
    private final ResourceManager resourceManager;
    private final ExecutionQueue queue;
    private final ExecutionScheduler scheduler;
    private final ExecutionCache cache;
    private final ExecutionMetrics metrics;
    private final ExecutionMonitor monitor;
    private final ExecutionPredictor predictor;
    private final WorkflowOptimizer optimizer;
    private final WorkflowAnalyzer analyzer;
    private final WorkflowMetrics telemetry;

    private final Map<String, ExecutionStrategy> strategies = new ConcurrentHashMap<>();
    private final Map<String, Execution> activeExecutions = new ConcurrentHashMap<>();
    private final StepExecutionListener stepTracker = new StepTracker();
    private final Object dispatchLock = new Object();
    private final AtomicInteger runningCount = new AtomicInteger();
    private final ExecutorService workerPool;
    private final ScheduledExecutorService maintenance;
    private volatile boolean shutdown = false;

    public SequentialExecutionEngine() {
        this(new SequorConfiguration());
    }

    public SequentialExecutionEngine(SequorConfiguration configuration) {
        this(configuration, new SimpleResourceManager(configuration));
    }

    public SequentialExecutionEngine(SequorConfiguration configuration, ResourceManager resourceManager) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.resourceManager = Objects.requireNonNull(resourceManager, "Resource manager cannot be null");
        this.queue = new ExecutionQueue(configuration);
        this.scheduler = new ExecutionScheduler(configuration);
        this.cache = new ExecutionCache(configuration);
        this.metrics = new ExecutionMetrics(configuration);
        this.monitor = new ExecutionMonitor(configuration);
        this.predictor = new ExecutionPredictor(configuration);
        this.optimizer = new WorkflowOptimizer(configuration);
        this.analyzer = new WorkflowAnalyzer(configuration);
        this.telemetry = WorkflowMetrics.getInstance();

        scheduler.setPredictor(predictor);
        telemetry.bindQueueDepth(() -> (long) queue.size());

        registerStrategy(new BasicExecutionStrategy());
        registerStrategy(new BatchExecutionStrategy());
        registerStrategy(new SmartExecutionStrategy());
        registerStrategy(new OptimizedExecutionStrategy());

        this.workerPool = Executors.newFixedThreadPool(Math.max(1, configuration.getWorkerThreads()),
                daemonThreads("sequor-worker"));
        this.maintenance = Executors.newSingleThreadScheduledExecutor(daemonThreads("sequor-maintenance"));
        startMaintenance();

        logger.info("Execution engine started with " + configuration.getWorkerThreads() + " workers, "
                + configuration.getMaxConcurrentExecutions() + " concurrent executions, default strategy "
                + configuration.getDefaultStrategy());
    }

    @Override
    public CompletableFuture<ExecutionResult> executeWorkflow(Workflow workflow, WorkflowContext context,
                                                              ExecutionOptions options)
            throws WorkflowExecutionException {
        if (shutdown) {
            throw WorkflowExecutionException.validation("engine", "Execution engine is shut down");
        }
        if (workflow == null || workflow.getMetadata() == null) {
            throw WorkflowExecutionException.validation("workflow", "Workflow is required");
        }
        String workflowName = workflow.getName();
        if (workflowName == null || workflowName.isBlank()) {
            throw WorkflowExecutionException.validation("workflow.name", "Workflow name is required");
        }
        if (context == null) {
            throw WorkflowExecutionException.validation("context", "Workflow context is required");
        }
        ExecutionOptions effective = options != null ? options : ExecutionOptions.defaults();
        ExecutionStrategy strategy = resolveStrategy(effective);
        String executionId = UUID.randomUUID().toString();

        ResourceRequest request = effective.getResources() != null
                ? effective.getResources() : ResourceRequest.defaults();
        ResourceValidationResult admission = resourceManager.validateRequest(request);
        if (!admission.isAllowed()) {
            logger.warning("Rejected workflow " + workflowName + ": " + admission.getReason());
            throw admission.toException().withExecution(executionId, workflowName);
        }

        if (effective.isUseCache()) {
            Optional<ExecutionResult> cached = cache.get(workflow, context);
            if (cached.isPresent()) {
                metrics.recordCacheHit(executionId);
                telemetry.recordCacheHit(CACHE_LEVEL_WORKFLOW);
                logger.info("Serving workflow " + workflowName + " from cache as execution " + executionId);
                return CompletableFuture.completedFuture(cached.get().asCachedFor(executionId));
            }
            metrics.recordCacheMiss(executionId);
            telemetry.recordCacheMiss(CACHE_LEVEL_WORKFLOW);
        }

        Workflow runnable = workflow;
        if (effective.isOptimize() && configuration.isOptimizationEnabled()) {
            runnable = optimizer.optimizeWorkflow(workflow, context);
        }
        Prediction prediction = predictor.predict(runnable, context);

        ExecutionContext executionContext = ExecutionContext.builder()
                .executionId(executionId)
                .workflow(runnable)
                .workflowContext(context)
                .options(effective)
                .listener(stepTracker)
                .stepCache(cache.isEnabled() ? cache : null)
                .build();
        Execution execution = new Execution(executionContext, workflow, strategy.getName(), request,
                timeoutOf(effective), prediction);

        ScheduledExecution scheduled = scheduler.schedule(executionContext);
        activeExecutions.put(executionId, execution);

        QueueItem item = QueueItem.builder(executionId)
                .workflowName(workflowName)
                .priority(scheduled.getPriority())
                .maxRetries(effective.getMaxRetries())
                .retryDelay(effective.getRetryDelay())
                .build();
        if (!queue.enqueue(item)) {
            activeExecutions.remove(executionId);
            scheduler.cancel(executionId);
            throw WorkflowExecutionException.queue(executionId,
                    "Execution queue is full (" + queue.getMaxSize() + " items)")
                    .withExecution(executionId, workflowName);
        }

        metrics.recordExecutionStart(executionId, workflowName, runnable.getSteps().size());
        logger.info("Accepted execution " + executionId + " of workflow " + workflowName + " (strategy "
                + strategy.getName() + ", priority " + scheduled.getPriority() + ")");
        requestDispatch();
        return execution.getFuture();
    }

    @Override
    public boolean cancelExecution(String executionId) {
        Execution execution = executionId != null ? activeExecutions.get(executionId) : null;
        if (execution == null || execution.getStatus().isTerminal()) {
            return false;
        }
        execution.getExecutionContext().cancel();
        logger.info("Cancelling execution " + executionId);
        synchronized (dispatchLock) {
            if (execution.getStatus() == ExecutionStatus.QUEUED) {
                finishCancelled(execution, false);
            }
        }
        // a running attempt stops at its next step boundary
        requestDispatch();
        return true;
    }

    @Override
    public Optional<ExecutionStatus> getExecutionStatus(String executionId) {
        Execution execution = executionId != null ? activeExecutions.get(executionId) : null;
        return execution != null ? Optional.of(execution.getStatus()) : Optional.empty();
    }

    @Override
    public Map<String, Object> getSystemMetrics() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("activeExecutions", activeExecutions.size());
        result.put("runningExecutions", runningCount.get());
        result.put("shutdown", shutdown);
        result.put("queue", queue.getStatistics().toMap());
        result.put("scheduler", scheduler.getStatistics().toMap());
        result.put("resources", resourceManager.getResourceStatus().toMap());
        result.put("cache", cache.getStatistics().toMap());
        result.put("aggregated", metrics.getAggregatedMetrics().toMap());
        result.put("realTime", metrics.getRealTimeMetrics().toMap());
        result.put("monitor", monitor.getStatus());
        result.put("prediction", predictor.getAccuracyStatistics());

        Map<String, Object> strategyStats = new LinkedHashMap<>();
        for (ExecutionStrategy strategy : strategies.values()) {
            strategyStats.put(strategy.getName(), strategy.getStatistics());
        }
        result.put("strategies", strategyStats);
        return result;
    }

    @Override
    public EngineHealthCheck getHealthStatus() {
        QueueStatistics queueStats = queue.getStatistics();
        ResourceUtilization usage = resourceManager.getResourceStatus();
        List<Alert> critical = monitor.getAlerts(AlertSeverity.CRITICAL);
        return EngineHealthCheck.builder()
                .pressurePercent(DEGRADED_UTILIZATION_PERCENT)
                .queue(queueStats.getQueued(), queueStats.getMaxSize())
                .resources(usage.getMemoryUtilization(), usage.getCpuUtilization(), usage.getActiveAllocations())
                .workers(!shutdown && !workerPool.isShutdown(), runningCount.get(),
                        configuration.getMaxConcurrentExecutions())
                .activeExecutions(activeExecutions.size())
                .alerts(monitor.getActiveCount(), critical.size(),
                        critical.isEmpty() ? null : critical.get(critical.size() - 1).getMessage())
                .build();
    }

    @Override
    public void registerStrategy(ExecutionStrategy strategy) {
        Objects.requireNonNull(strategy, "Strategy cannot be null");
        ExecutionStrategy previous = strategies.put(strategy.getName(), strategy);
        if (previous != null && previous != strategy) {
            logger.info("Replaced execution strategy " + strategy.getName());
            previous.shutdown();
        }
    }

    @Override
    public List<String> getAvailableStrategies() {
        return strategies.keySet().stream().sorted().collect(Collectors.toList());
    }

    @Override
    public void updateConfiguration(SequorConfiguration newConfiguration) {
        Objects.requireNonNull(newConfiguration, "Configuration cannot be null");
        this.configuration = newConfiguration;
        resourceManager.updateResourceLimits(ResourceLimits.fromConfiguration(newConfiguration));
        scheduler.updateConfiguration(newConfiguration);
        monitor.updateThresholds(MonitorThresholds.fromConfiguration(newConfiguration));
        cache.setEnabled(newConfiguration.isCacheEnabled());
        optimizer.setEnabled(newConfiguration.isOptimizationEnabled());
        predictor.setEnabled(newConfiguration.isPredictionEnabled());
        logger.info("Execution engine configuration updated: " + newConfiguration);
        requestDispatch();
    }

    @Override
    public void shutdown() {
        synchronized (dispatchLock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
        }
        logger.info("Shutting down execution engine with " + activeExecutions.size() + " active executions");
        maintenance.shutdownNow();

        for (Execution execution : new ArrayList<>(activeExecutions.values())) {
            boolean wasRunning = execution.getStatus() == ExecutionStatus.RUNNING;
            execution.getExecutionContext().cancel();
            execution.interrupt();
            finishCancelled(execution, wasRunning);
        }

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        strategies.values().forEach(ExecutionStrategy::shutdown);
        resourceManager.shutdown();
        queue.clear();
        scheduler.cleanup();
        cache.clear();
        optimizer.clearCache();
        metrics.clear();
        monitor.clear();
        predictor.clear();
        activeExecutions.clear();
        logger.info("Execution engine shut down");
    }

    public Map<String, Object> getQueueStatistics() {
        return queue.getStatistics().toMap();
    }

    public Map<String, Object> getSchedulerStatistics() {
        return scheduler.getStatistics().toMap();
    }

    public Map<String, Map<String, Object>> getResourcePoolStatus() {
        return scheduler.getResourcePoolStatus();
    }

    public ResourceUtilization getResourceStatus() {
        return resourceManager.getResourceStatus();
    }

    public Map<String, Object> getCacheStatistics() {
        return cache.getStatistics().toMap();
    }

    public List<Alert> getAlerts() {
        return monitor.getAlerts();
    }

    public ExecutionMetrics getExecutionMetrics() {
        return metrics;
    }

    /**
     * Snapshot of every execution that has not reached a terminal state.
     */
    public List<Map<String, Object>> getActiveExecutions() {
        return activeExecutions.values().stream()
                .map(Execution::toMap)
                .collect(Collectors.toList());
    }

    public WorkflowAnalysis analyzeWorkflow(Workflow workflow, WorkflowContext context) {
        return analyzer.analyzeWorkflow(workflow, context);
    }

    public Prediction predictExecution(Workflow workflow, WorkflowContext context) {
        return predictor.predict(workflow, context);
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Moves ready items from the queue onto workers until the queue yields nothing startable.
     */
    void dispatch() {
        if (shutdown) {
            return;
        }
        synchronized (dispatchLock) {
            failBlockedExecutions();
            while (!shutdown) {
                Optional<QueueItem> next = queue.dequeue(this::canStart);
                if (next.isEmpty() || !start(next.get())) {
                    return;
                }
            }
        }
    }

    private boolean canStart(QueueItem item) {
        Execution execution = activeExecutions.get(item.getExecutionId());
        return execution != null
                && runningCount.get() < configuration.getMaxConcurrentExecutions()
                && scheduler.isReady(item.getExecutionId())
                && resourceManager.canAllocate(execution.getResourceRequest());
    }

    /**
     * @return false when the item went back to the queue and dispatching should pause
     */
    private boolean start(QueueItem item) {
        String executionId = item.getExecutionId();
        Execution execution = activeExecutions.get(executionId);
        if (execution == null || execution.getStatus().isTerminal()) {
            queue.remove(executionId);
            return true;
        }

        ResourceValidationResult admission = resourceManager.validateRequest(execution.getResourceRequest());
        if (!admission.isAllowed()) {
            queue.markFailed(executionId, admission.getReason(), false);
            fail(execution, admission.toException().withExecution(executionId, execution.getWorkflowName()), null);
            return true;
        }

        try {
            resourceManager.allocateResources(executionId, execution.getResourceRequest());
        } catch (WorkflowExecutionException e) {
            logger.fine("Resources unavailable for " + executionId + ", returning it to the queue: "
                    + e.getMessage());
            queue.returnToQueue(executionId);
            return false;
        }
        try {
            scheduler.markRunning(executionId);
        } catch (WorkflowExecutionException e) {
            logger.fine("Scheduler refused to start " + executionId + ": " + e.getMessage());
            resourceManager.releaseResources(executionId);
            queue.returnToQueue(executionId);
            return false;
        }

        execution.markRunning();
        runningCount.incrementAndGet();
        launch(execution);
        return true;
    }

    private void launch(Execution execution) {
        String executionId = execution.getId();
        ExecutionContext attempt = execution.nextAttempt();
        int attemptNumber = attempt.getAttempt();
        ExecutionStrategy strategy = strategies.getOrDefault(execution.getStrategyName(),
                strategies.get(BasicExecutionStrategy.NAME));

        monitor.startMonitoring(executionId, execution.getWorkflowName(), execution.getWorkflow().getSteps().size());
        telemetry.recordExecutionStarted(execution.getWorkflowName(), execution.getStrategyName());
        logger.info("Starting execution " + executionId + " of " + execution.getWorkflowName()
                + " (attempt " + attemptNumber + ")");

        AtomicBoolean settled = new AtomicBoolean(false);
        Future<?> task = workerPool.submit(() -> {
            ExecutionResult result = null;
            Exception error = null;
            try {
                result = strategy.execute(execution.getWorkflow(), execution.getContext(), attempt);
            } catch (Exception e) {
                error = e;
            }
            if (settled.compareAndSet(false, true)) {
                onAttemptFinished(execution, attemptNumber, result, error);
            }
        });

        long timeoutMs = execution.getTimeout().toMillis();
        Future<?> timer = maintenance.schedule(() -> {
            if (settled.compareAndSet(false, true)) {
                logger.warning("Execution " + executionId + " timed out after " + timeoutMs + "ms");
                execution.interrupt();
                onAttemptFinished(execution, attemptNumber, null, WorkflowExecutionException.timeout(
                        TimeoutScope.EXECUTION, timeoutMs, "Execution timed out after " + timeoutMs + "ms"));
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        execution.attachAttempt(attemptNumber, task, timer);
    }

    private void onAttemptFinished(Execution execution, int attempt, ExecutionResult result, Exception error) {
        String executionId = execution.getId();
        resourceManager.releaseResources(executionId);
        runningCount.decrementAndGet();
        try {
            if (execution.getStatus().isTerminal()) {
                return;
            }
            if (execution.isCancelled()) {
                finishCancelled(execution, true);
                return;
            }
            if (error == null && result != null && result.isSuccess()) {
                complete(execution, result);
                return;
            }

            WorkflowExecutionException failure = error != null
                    ? ErrorClassifier.classify(error).withExecution(executionId, execution.getWorkflowName())
                    : null;
            String message = failure != null ? failure.getMessage()
                    : result != null ? result.getError() : "Execution produced no result";
            boolean retryable = failure == null || failure.isRetryable();
            if (failure != null) {
                metrics.recordError(executionId, failure);
            }
            monitor.stopMonitoring(executionId, false);

            synchronized (dispatchLock) {
                if (!shutdown && queue.markFailed(executionId, message, retryable)) {
                    execution.requeue();
                    scheduler.releaseForRetry(executionId);
                    metrics.recordRetry(executionId);
                    telemetry.recordExecutionRetried(execution.getWorkflowName(), execution.getStrategyName());
                    logger.warning("Execution " + executionId + " attempt " + attempt + " failed, retrying: "
                            + message);
                    scheduleDispatch(retryDelayOf(executionId));
                    return;
                }
            }
            fail(execution, failure, result);
        } finally {
            requestDispatch();
        }
    }

    private void complete(Execution execution, ExecutionResult result) {
        String executionId = execution.getId();
        ExecutionResult finalResult = execution.getRetryCount() > 0
                ? result.withMetadata("retryCount", execution.getRetryCount()) : result;
        if (!execution.finish(ExecutionStatus.COMPLETED)) {
            return;
        }

        if (execution.getOptions().isUseCache()) {
            cache.put(execution.getSubmittedWorkflow(), execution.getContext(), finalResult,
                    CacheOptions.fromExecutionOptions(execution.getOptions()));
        }
        predictor.recordActual(execution.getWorkflow(), execution.getContext(), execution.getPrediction(),
                finalResult.getDurationMs(), true);
        queue.markCompleted(executionId, finalResult);
        scheduler.markCompleted(executionId);
        metrics.recordExecutionEnd(executionId, finalResult);
        monitor.stopMonitoring(executionId, true);
        telemetry.recordExecutionCompleted(execution.getWorkflowName(), execution.getStrategyName(),
                finalResult.getDurationMs() / 1000.0);
        activeExecutions.remove(executionId);

        logger.info("Execution " + executionId + " of " + execution.getWorkflowName() + " completed in "
                + finalResult.getDurationMs() + "ms");
        execution.getFuture().complete(finalResult);
    }

    /**
     * Terminal failure. With an error the future completes exceptionally; otherwise it completes
     * with the unsuccessful result.
     */
    private void fail(Execution execution, WorkflowExecutionException failure, ExecutionResult result) {
        String executionId = execution.getId();
        scheduler.markFailed(executionId);
        queue.remove(executionId);
        if (!execution.finish(ExecutionStatus.FAILED)) {
            return;
        }

        String message = failure != null ? failure.getMessage()
                : result != null ? result.getError() : "Execution failed";
        predictor.recordActual(execution.getWorkflow(), execution.getContext(), execution.getPrediction(),
                execution.getDurationMs(), false);
        metrics.recordExecutionEnd(executionId, result != null ? result : failedResult(execution, message));
        monitor.stopMonitoring(executionId, false);
        telemetry.recordExecutionFailed(execution.getWorkflowName(), execution.getStrategyName(),
                failure != null ? failure.getKind().getValue() : "step_failure");
        activeExecutions.remove(executionId);

        logger.severe("Execution " + executionId + " of " + execution.getWorkflowName() + " failed: " + message);
        if (failure != null) {
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Failure details for execution " + executionId, failure);
            }
            execution.getFuture().completeExceptionally(failure);
        } else {
            execution.getFuture().complete(result);
        }
    }

    private void finishCancelled(Execution execution, boolean wasRunning) {
        String executionId = execution.getId();
        queue.remove(executionId);
        scheduler.cancel(executionId);
        if (!execution.finish(ExecutionStatus.CANCELLED)) {
            return;
        }

        WorkflowExecutionException error = WorkflowExecutionException
                .builder(ErrorKind.STRATEGY_EXECUTION, "Execution cancelled: " + executionId)
                .executionId(executionId)
                .workflowName(execution.getWorkflowName())
                .detail(WorkflowExecutionException.DETAIL_CANCELLED, true)
                .retryable(false)
                .build();
        metrics.recordError(executionId, error);
        metrics.recordExecutionEnd(executionId, failedResult(execution, error.getMessage()));
        monitor.stopMonitoring(executionId, false);
        telemetry.recordExecutionCancelled(execution.getWorkflowName(), execution.getStrategyName(), wasRunning);
        activeExecutions.remove(executionId);

        logger.info("Execution " + executionId + " cancelled" + (wasRunning ? " while running" : ""));
        execution.getFuture().completeExceptionally(error);
    }

    /**
     * Fails every queued execution whose dependency ended without completing, repeating until the
     * failure has reached all transitive dependents.
     */
    private void failBlockedExecutions() {
        List<ScheduledExecution> blocked = scheduler.getBlockedExecutions();
        while (!blocked.isEmpty()) {
            for (ScheduledExecution scheduled : blocked) {
                String executionId = scheduled.getExecutionId();
                String dependency = scheduler.getFailedDependency(executionId).orElse("unknown");
                Execution execution = activeExecutions.get(executionId);
                if (execution == null) {
                    scheduler.markFailed(executionId);
                    continue;
                }
                fail(execution, WorkflowExecutionException.dependency(dependency, false,
                                "Dependency " + dependency + " of execution " + executionId + " did not complete")
                        .withExecution(executionId, execution.getWorkflowName()), null);
            }
            blocked = scheduler.getBlockedExecutions();
        }
    }

    private ExecutionStrategy resolveStrategy(ExecutionOptions options) throws WorkflowExecutionException {
        if (options.getStrategy() != null) {
            ExecutionStrategy requested = strategies.get(options.getStrategy());
            if (requested == null) {
                throw WorkflowExecutionException.validation("strategy",
                        "Unknown execution strategy: " + options.getStrategy());
            }
            return requested;
        }
        ExecutionStrategy configured = strategies.get(configuration.getDefaultStrategy());
        if (configured == null) {
            logger.warning("Configured default strategy " + configuration.getDefaultStrategy()
                    + " is not registered, using " + BasicExecutionStrategy.NAME);
            return strategies.get(BasicExecutionStrategy.NAME);
        }
        return configured;
    }

    private Duration timeoutOf(ExecutionOptions options) {
        Duration timeout = options.getTimeout();
        if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
            return timeout;
        }
        return Duration.ofMillis(configuration.getDefaultTimeoutMs());
    }

    private Duration retryDelayOf(String executionId) {
        return queue.getItem(executionId)
                .map(QueueItem::getAvailableAt)
                .map(availableAt -> Duration.between(Instant.now(), availableAt))
                .filter(delay -> !delay.isNegative())
                .orElse(Duration.ZERO);
    }

    private static ExecutionResult failedResult(Execution execution, String error) {
        return ExecutionResult.builder()
                .executionId(execution.getId())
                .workflowName(execution.getWorkflowName())
                .strategy(execution.getStrategyName())
                .success(false)
                .durationMs(execution.getDurationMs())
                .error(error)
                .build();
    }

    private void requestDispatch() {
        if (shutdown) {
            return;
        }
        try {
            maintenance.execute(guarded("dispatch", this::dispatch));
        } catch (RejectedExecutionException e) {
            logger.fine("Dispatch not scheduled, maintenance executor is stopped");
        }
    }

    private void scheduleDispatch(Duration delay) {
        if (shutdown) {
            return;
        }
        try {
            maintenance.schedule(guarded("dispatch", this::dispatch), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.fine("Delayed dispatch not scheduled, maintenance executor is stopped");
        }
    }

    private void startMaintenance() {
        long checkInterval = Math.max(100, configuration.getResourceMonitorIntervalMs());
        long cleanupInterval = Math.max(1000, configuration.getCacheCleanupIntervalMs());
        maintenance.scheduleWithFixedDelay(guarded("health checks", this::runHealthChecks),
                checkInterval, checkInterval, TimeUnit.MILLISECONDS);
        maintenance.scheduleWithFixedDelay(guarded("cleanup", this::runCleanup),
                cleanupInterval, cleanupInterval, TimeUnit.MILLISECONDS);
        maintenance.scheduleWithFixedDelay(guarded("dispatch", this::dispatch),
                DISPATCH_INTERVAL_MS, DISPATCH_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    void runHealthChecks() {
        resourceManager.checkResourceUsage();
        monitor.checkExecutions();
        SystemResourceSnapshot system = resourceManager.getResourceStatus().getSystem();
        monitor.checkSystem(system.getMemoryUsagePercent(), system.getCpuUsagePercent(),
                metrics.getRealTimeMetrics().getErrorRate(), queue.size());
    }

    void runCleanup() {
        int removed = metrics.cleanup() + cache.cleanup() + scheduler.cleanup() + predictor.cleanup();
        if (removed > 0) {
            logger.fine("Maintenance removed " + removed + " expired entries");
        }
    }

    private static Runnable guarded(String task, Runnable body) {
        return () -> {
            try {
                body.run();
            } catch (RuntimeException e) {
                logger.warning("Maintenance task '" + task + "' failed: " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Maintenance task '" + task + "' failure details", e);
                }
            }
        };
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Feeds step events from the strategies into metrics, the monitor and telemetry.
     */
    private final class StepTracker implements StepExecutionListener {

        @Override
        public void onStepStart(String executionId, int index, Step step) {
            metrics.recordStepStart(executionId, index, step.getMetadata().getName(), step.getMetadata().getType());
        }

        @Override
        public void onStepEnd(String executionId, StepResult result) {
            metrics.recordStepEnd(executionId, result);
            // the monitor counts failed steps itself
            monitor.updateProgress(executionId, result);

            Execution execution = activeExecutions.get(executionId);
            String workflowName = execution != null ? execution.getWorkflowName() : "unknown";
            String stepType = result.getType() != null ? result.getType().getValue() : "unknown";
            if (result.isFromCache()) {
                metrics.recordCacheHit(executionId);
                telemetry.recordCacheHit(CACHE_LEVEL_STEP);
            } else if (result.getStatus() != StepStatus.SKIPPED) {
                telemetry.recordStepExecuted(workflowName, stepType);
            }
            if (result.getStatus() == StepStatus.FAILED) {
                telemetry.recordStepFailed(workflowName, stepType, "step_failure");
            }
        }
    }
}
