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
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.StepOutput;
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepStatus;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.exceptions.ErrorClassifier;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.workflow.ExecutionContext;
import dev.mars.sequor.workflow.cache.CacheOptions;
import dev.mars.sequor.workflow.cache.ExecutionCache;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Step plumbing shared by the built-in strategies: the step state machine, step cache lookups,
 * listener notification, parallel step groups and result assembly.
 */
public abstract class AbstractExecutionStrategy implements ExecutionStrategy {

    private static final Logger logger = Logger.getLogger(AbstractExecutionStrategy.class.getName());

    public static final String META_STEP_COUNT = "stepCount";
    public static final String META_COMPLETED_STEPS = "completedSteps";
    public static final String META_CACHE_HITS = "cacheHits";

    private final String name;

    protected AbstractExecutionStrategy(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Runs one step: pending → running → completed|failed, or served from the step cache
     * without running. Exceptions thrown by the step become a failed result.
     *
     * @throws WorkflowExecutionException when the running thread is interrupted
     */
    protected StepResult executeStep(Step step, int index, WorkflowContext context, ExecutionContext execution)
            throws WorkflowExecutionException {
        StepMetadata metadata = step.getMetadata();
        String executionId = execution.getExecutionId();
        long startTime = System.currentTimeMillis();

        if (metadata.isDisabled()) {
            StepResult skipped = StepResult.builder()
                    .index(index)
                    .name(metadata.getName())
                    .type(metadata.getType())
                    .status(StepStatus.SKIPPED)
                    .startTime(startTime)
                    .attempts(0)
                    .build();
            execution.getListener().onStepEnd(executionId, skipped);
            return skipped;
        }

        ExecutionCache cache = execution.getStepCache();
        boolean cacheable = cache != null && execution.getOptions().isUseCache() && metadata.isCacheable();
        if (cacheable) {
            Optional<StepResult> cached = cache.getStepResult(step, context);
            if (cached.isPresent()) {
                StepResult result = cached.get().asCached(index, startTime);
                logger.fine("Step '" + metadata.getName() + "' of " + executionId + " served from cache");
                execution.getListener().onStepEnd(executionId, result);
                return result;
            }
        }

        execution.getListener().onStepStart(executionId, index, step);
        StepResult.Builder builder = StepResult.builder()
                .index(index)
                .name(metadata.getName())
                .type(metadata.getType())
                .startTime(startTime);
        try {
            StepOutput output = step.execute(context);
            if (output == null) {
                builder.status(StepStatus.FAILED).error("Step returned no output");
            } else if (output.isSuccess()) {
                builder.status(StepStatus.COMPLETED).output(output.getData());
            } else {
                builder.status(StepStatus.FAILED).output(output.getData()).error(output.getMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ErrorClassifier.classify(e).toBuilder()
                    .executionId(executionId)
                    .step(index, metadata.getName())
                    .build();
        } catch (Exception e) {
            logger.warning("Step '" + metadata.getName() + "' of execution " + executionId + " threw: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Step exception details for: " + metadata.getName(), e);
            }
            builder.status(StepStatus.FAILED).error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        StepResult result = builder.durationMs(System.currentTimeMillis() - startTime).build();

        if (cacheable && result.isSuccessful()) {
            cache.putStepResult(step, context, result, CacheOptions.fromExecutionOptions(execution.getOptions()));
        }
        execution.getListener().onStepEnd(executionId, result);
        return result;
    }

    /**
     * Runs the steps concurrently on the given executor and waits for all of them.
     * Every step runs even when another fails; results are marked {@code parallel} and keep the
     * given order.
     */
    protected List<StepResult> executeParallel(List<Step> steps, List<Integer> indices, WorkflowContext context,
                                               ExecutionContext execution, ExecutorService executor)
            throws WorkflowExecutionException {
        List<Future<StepResult>> futures = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            int index = indices.get(i);
            futures.add(executor.submit(() -> executeStep(step, index, context, execution)));
        }

        List<StepResult> results = new ArrayList<>();
        WorkflowExecutionException failure = null;
        for (Future<StepResult> future : futures) {
            try {
                results.add(future.get().withParallel(true));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw ErrorClassifier.classify(e).toBuilder().executionId(execution.getExecutionId()).build();
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = ErrorClassifier.classify(e.getCause() != null ? e.getCause() : e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }

    /**
     * Runs a workflow that declares no steps through its whole-workflow body.
     */
    protected ExecutionResult executeBody(Workflow workflow, WorkflowContext context, ExecutionContext execution,
                                          long startTime) throws WorkflowExecutionException {
        execution.checkNotCancelled();
        ExecutionResult.Builder builder = ExecutionResult.builder()
                .executionId(execution.getExecutionId())
                .workflowName(workflow.getName())
                .strategy(name)
                .metadata(META_STEP_COUNT, 0);
        try {
            Map<String, Object> output = workflow.execute(context);
            builder.success(true).output(output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ErrorClassifier.classify(e).toBuilder().executionId(execution.getExecutionId()).build();
        } catch (WorkflowExecutionException e) {
            throw e;
        } catch (Exception e) {
            logger.warning("Workflow body of " + execution.getExecutionId() + " failed: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Workflow body exception details for: " + execution.getExecutionId(), e);
            }
            builder.success(false).error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        return builder.durationMs(System.currentTimeMillis() - startTime).build();
    }

    /**
     * Assembles the execution result. The run succeeds when every planned step ran and none failed.
     */
    protected ExecutionResult buildResult(Workflow workflow, ExecutionContext execution, long startTime,
                                          int plannedSteps, List<StepResult> results, Map<String, Object> metadata) {
        boolean anyFailed = results.stream().anyMatch(r -> r.getStatus() == StepStatus.FAILED);
        boolean success = !anyFailed && results.size() == plannedSteps;

        Map<String, Object> output = new LinkedHashMap<>();
        int cacheHits = 0;
        for (StepResult result : results) {
            if (result.isSuccessful()) {
                output.put(result.getName(), result.getOutput());
            }
            if (result.isFromCache()) {
                cacheHits++;
            }
        }

        ExecutionResult.Builder builder = ExecutionResult.builder()
                .executionId(execution.getExecutionId())
                .workflowName(workflow.getName())
                .strategy(name)
                .success(success)
                .durationMs(System.currentTimeMillis() - startTime)
                .stepResults(results)
                .output(output)
                .metadata(META_STEP_COUNT, plannedSteps)
                .metadata(META_COMPLETED_STEPS, (int) results.stream().filter(StepResult::isSuccessful).count())
                .metadata(META_CACHE_HITS, cacheHits)
                .metadata(metadata);
        if (!success) {
            builder.error(failureMessage(results));
        }
        return builder.build();
    }

    static String failureMessage(List<StepResult> results) {
        for (StepResult result : results) {
            if (result.getStatus() == StepStatus.FAILED) {
                return "Step '" + result.getName() + "' failed: " + result.getError();
            }
        }
        return "Execution stopped before all steps ran";
    }

    /**
     * Bounded daemon pool for parallel step groups.
     */
    protected static ExecutorService newStepPool(String prefix, int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    protected static List<Integer> range(int from, int count) {
        List<Integer> indices = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            indices.add(from + i);
        }
        return indices;
    }
}
