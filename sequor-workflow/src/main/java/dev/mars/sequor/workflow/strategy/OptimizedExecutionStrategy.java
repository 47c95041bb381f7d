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
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepStatus;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.exceptions.ErrorClassifier;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.workflow.ExecutionContext;
import dev.mars.sequor.workflow.optimization.WorkflowOptimizer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Sequential execution over a tidied step list: steps are put in phase order (setup, validation,
 * analysis, processing, testing, deployment, cleanup, then the rest) without moving a step ahead of
 * its dependencies, repeated {@code type_name} steps run once, and failing testing steps are
 * retried with a growing pause. Each successful step's result is written to the context as
 * {@code step_<i>_result}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-31
 */
public class OptimizedExecutionStrategy extends AbstractExecutionStrategy {

    private static final Logger logger = Logger.getLogger(OptimizedExecutionStrategy.class.getName());

    public static final String NAME = "optimized";
    public static final String STEP_RESULT_PREFIX = "step_";
    public static final String STEP_RESULT_SUFFIX = "_result";
    public static final String OPT_REORDERING = "reordering";
    public static final String OPT_STEP_COUNT_CHANGE = "step_count_change";

    static final int DEFAULT_MAX_RETRIES = 2;
    static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(1);
    static final int MAX_EXECUTION_HISTORY = 100;

    private static final List<String> NON_RETRYABLE = List.of(
            "permission denied", "not found", "invalid input", "syntax error", "validation failed");

    private final int maxRetries;
    private final Duration retryBackoff;
    private final Map<String, Map<String, Object>> executionHistory = new LinkedHashMap<>();
    private long stepRetries;

    public OptimizedExecutionStrategy() {
        this(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_BACKOFF);
    }

    public OptimizedExecutionStrategy(int maxRetries, Duration retryBackoff) {
        super(NAME);
        this.maxRetries = Math.max(0, maxRetries);
        this.retryBackoff = retryBackoff;
    }

    @Override
    public ExecutionResult execute(Workflow workflow, WorkflowContext context, ExecutionContext execution)
            throws WorkflowExecutionException {
        long startTime = System.currentTimeMillis();
        List<Step> original = workflow.getSteps();
        if (original.isEmpty()) {
            return executeBody(workflow, context, execution, startTime);
        }

        List<Step> steps = removeDuplicates(WorkflowOptimizer.reorderSteps(original));
        List<String> optimizations = appliedOptimizations(original, steps);
        if (!optimizations.isEmpty()) {
            logger.fine("Execution " + execution.getExecutionId() + " optimized: " + optimizations
                    + " (" + original.size() + " -> " + steps.size() + " steps)");
        }

        List<StepResult> results = new ArrayList<>();
        int retryAttempts = 0;
        for (int i = 0; i < steps.size(); i++) {
            execution.checkNotCancelled();
            Step step = steps.get(i);
            StepResult result = step.getMetadata().getType() == StepType.TESTING
                    ? executeWithRetry(step, declaredIndex(original, step), context, execution)
                    : executeStep(step, declaredIndex(original, step), context, execution);
            results.add(result);
            retryAttempts += Math.max(0, result.getAttempts() - 1);

            if (result.getStatus() == StepStatus.FAILED) {
                logger.warning("Step '" + result.getName() + "' failed in " + execution.getExecutionId()
                        + ", stopping: " + result.getError());
                break;
            }
            context.set(STEP_RESULT_PREFIX + i + STEP_RESULT_SUFFIX, summarize(result));
            learn(result);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("originalStepCount", original.size());
        metadata.put("optimizedStepCount", steps.size());
        metadata.put("optimizations", optimizations);
        metadata.put("retryAttempts", retryAttempts);
        return buildResult(workflow, execution, startTime, steps.size(), results, metadata);
    }

    /**
     * Runs a testing step, retrying a failure up to the retry limit. The pause before retry n
     * is {@code backoff * n}. Failures whose message marks them as permanent are not retried.
     */
    StepResult executeWithRetry(Step step, int index, WorkflowContext context, ExecutionContext execution)
            throws WorkflowExecutionException {
        StepResult result = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                execution.checkNotCancelled();
                pause(retryBackoff.multipliedBy(attempt), execution);
                synchronized (executionHistory) {
                    stepRetries++;
                }
            }
            result = executeStep(step, index, context, execution).toBuilder().attempts(attempt + 1).build();
            if (result.getStatus() != StepStatus.FAILED || isNonRetryable(result.getError())) {
                return result;
            }
            logger.fine("Testing step '" + result.getName() + "' failed on attempt " + (attempt + 1)
                    + ": " + result.getError());
        }
        return result;
    }

    static boolean isNonRetryable(String error) {
        if (error == null) {
            return false;
        }
        String lower = error.toLowerCase(Locale.ROOT);
        return NON_RETRYABLE.stream().anyMatch(lower::contains);
    }

    static List<Step> removeDuplicates(List<Step> steps) {
        Set<String> seen = new HashSet<>();
        List<Step> unique = new ArrayList<>();
        for (Step step : steps) {
            String key = step.getMetadata().getType().getValue() + "_" + step.getMetadata().getName();
            if (seen.add(key)) {
                unique.add(step);
            }
        }
        return unique;
    }

    private static List<String> appliedOptimizations(List<Step> original, List<Step> optimized) {
        List<String> applied = new ArrayList<>();
        if (original.size() != optimized.size()) {
            applied.add(OPT_STEP_COUNT_CHANGE);
        }
        List<Step> kept = new ArrayList<>();
        for (Step step : original) {
            if (optimized.contains(step)) {
                kept.add(step);
            }
        }
        if (!kept.equals(optimized)) {
            applied.add(OPT_REORDERING);
        }
        return applied;
    }

    private static int declaredIndex(List<Step> original, Step step) {
        for (int i = 0; i < original.size(); i++) {
            if (original.get(i) == step) {
                return i;
            }
        }
        return -1;
    }

    private static void pause(Duration delay, ExecutionContext execution) throws WorkflowExecutionException {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ErrorClassifier.classify(e).toBuilder().executionId(execution.getExecutionId()).build();
        }
    }

    private static Map<String, Object> summarize(StepResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("success", result.isSuccessful());
        summary.put("stepName", result.getName());
        summary.put("stepType", result.getType().getValue());
        summary.put("durationMs", result.getDurationMs());
        summary.put("fromCache", result.isFromCache());
        summary.put("attempts", result.getAttempts());
        summary.put("output", result.getOutput());
        return summary;
    }

    private void learn(StepResult result) {
        String key = result.getType().getValue() + "_" + result.getName();
        Map<String, Object> entry = new LinkedHashMap<>(summarize(result));
        entry.put("timestamp", Instant.now().toString());
        synchronized (executionHistory) {
            executionHistory.remove(key);
            executionHistory.put(key, entry);
            while (executionHistory.size() > MAX_EXECUTION_HISTORY) {
                executionHistory.remove(executionHistory.keySet().iterator().next());
            }
        }
    }

    public int getExecutionHistorySize() {
        synchronized (executionHistory) {
            return executionHistory.size();
        }
    }

    public void clearExecutionHistory() {
        synchronized (executionHistory) {
            executionHistory.clear();
        }
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("name", NAME);
        stats.put("maxRetries", maxRetries);
        stats.put("retryBackoffMs", retryBackoff.toMillis());
        synchronized (executionHistory) {
            stats.put("executionHistorySize", executionHistory.size());
            stats.put("stepRetries", stepRetries);
        }
        return stats;
    }
}
