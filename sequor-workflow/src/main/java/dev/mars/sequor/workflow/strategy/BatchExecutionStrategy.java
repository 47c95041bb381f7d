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
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepStatus;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.workflow.ExecutionContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Groups similar steps into batches and runs the batches in order. Within a batch, steps run
 * concurrently when they are independent and their combined load is small enough; otherwise they
 * run one by one and the batch stops at its first failure. A failed batch ends the run.
 *
 * <p>Workflows with no more steps than the batch size form a single batch in declared order.
 * Larger workflows are grouped by {@code type_resourceLevel_complexity} in order of first
 * appearance, and each group is split into chunks of the batch size.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-31
 */
public class BatchExecutionStrategy extends AbstractExecutionStrategy {

    private static final Logger logger = Logger.getLogger(BatchExecutionStrategy.class.getName());

    public static final String NAME = "batch";
    public static final String BATCH_RESULT_PREFIX = "batch_";
    public static final String BATCH_RESULT_SUFFIX = "_result";

    static final int DEFAULT_BATCH_SIZE = 5;
    static final int DEFAULT_MAX_PARALLEL = 3;
    static final long MAX_PARALLEL_MEMORY_MB = 2048;
    static final double MAX_PARALLEL_CPU_PERCENT = 200;
    static final int MAX_BATCH_HISTORY = 50;

    private final int batchSize;
    private final int maxParallel;
    private final boolean parallelEnabled;
    private final ExecutorService stepPool;
    private final Map<String, Map<String, Object>> batchHistory = new LinkedHashMap<>();
    private long batchesRun;
    private long parallelBatches;

    public BatchExecutionStrategy() {
        this(DEFAULT_BATCH_SIZE, DEFAULT_MAX_PARALLEL, true);
    }

    public BatchExecutionStrategy(int batchSize, int maxParallel, boolean parallelEnabled) {
        super(NAME);
        if (batchSize < 1 || maxParallel < 1) {
            throw new IllegalArgumentException("Batch size and max parallel must be positive");
        }
        this.batchSize = batchSize;
        this.maxParallel = maxParallel;
        this.parallelEnabled = parallelEnabled;
        this.stepPool = newStepPool("sequor-batch", maxParallel);
    }

    @Override
    public ExecutionResult execute(Workflow workflow, WorkflowContext context, ExecutionContext execution)
            throws WorkflowExecutionException {
        long startTime = System.currentTimeMillis();
        List<Step> steps = workflow.getSteps();
        if (steps.isEmpty()) {
            return executeBody(workflow, context, execution, startTime);
        }

        List<List<Integer>> batches = createBatches(steps);
        logger.fine("Execution " + execution.getExecutionId() + ": " + steps.size() + " steps in "
                + batches.size() + " batches " + batches.stream().map(List::size).collect(Collectors.toList()));

        List<StepResult> results = new ArrayList<>();
        List<Map<String, Object>> batchSummaries = new ArrayList<>();
        for (int b = 0; b < batches.size(); b++) {
            execution.checkNotCancelled();
            List<Integer> indices = batches.get(b);
            List<Step> batch = indices.stream().map(steps::get).collect(Collectors.toList());

            long batchStart = System.currentTimeMillis();
            boolean parallel = parallelEnabled && batch.size() > 1 && canRunInParallel(batch);
            List<StepResult> batchResults = parallel
                    ? executeParallel(batch, indices, context, execution, stepPool)
                    : executeSequential(batch, indices, context, execution);
            results.addAll(batchResults);

            boolean batchSuccess = batchResults.size() == batch.size()
                    && batchResults.stream().noneMatch(r -> r.getStatus() == StepStatus.FAILED);
            Map<String, Object> summary = summarize(b, batch, batchResults, parallel, batchSuccess,
                    System.currentTimeMillis() - batchStart);
            batchSummaries.add(summary);
            recordBatch(b, batch, summary, parallel);

            if (!batchSuccess) {
                logger.warning("Batch " + (b + 1) + " of " + batches.size() + " failed in "
                        + execution.getExecutionId() + ", stopping execution");
                break;
            }
            context.set(BATCH_RESULT_PREFIX + b + BATCH_RESULT_SUFFIX, summary);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("batchCount", batches.size());
        metadata.put("batchSizes", batches.stream().map(List::size).collect(Collectors.toList()));
        metadata.put("batches", batchSummaries);
        return buildResult(workflow, execution, startTime, steps.size(), results, metadata);
    }

    /**
     * Splits the steps into batches of step indices.
     */
    List<List<Integer>> createBatches(List<Step> steps) {
        List<List<Integer>> batches = new ArrayList<>();
        if (steps.size() <= batchSize) {
            batches.add(range(0, steps.size()));
            return batches;
        }
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            groups.computeIfAbsent(groupKey(steps.get(i).getMetadata()), k -> new ArrayList<>()).add(i);
        }
        for (List<Integer> group : groups.values()) {
            for (int from = 0; from < group.size(); from += batchSize) {
                batches.add(new ArrayList<>(group.subList(from, Math.min(from + batchSize, group.size()))));
            }
        }
        return batches;
    }

    static String groupKey(StepMetadata metadata) {
        return metadata.getType().getValue() + "_" + StepLoad.resourceLevel(metadata.getType())
                + "_" + StepLoad.complexity(metadata.getType());
    }

    /**
     * Steps may share a batch run when no two of them touch the same resource or name each other as
     * dependency, and their combined estimated load stays within 2048 MB and 200% CPU.
     */
    static boolean canRunInParallel(List<Step> batch) {
        for (int i = 0; i < batch.size(); i++) {
            for (int j = i + 1; j < batch.size(); j++) {
                if (related(batch.get(i).getMetadata(), batch.get(j).getMetadata())) {
                    return false;
                }
            }
        }
        long memory = 0;
        double cpu = 0;
        for (Step step : batch) {
            memory += StepLoad.memoryMb(step.getMetadata().getType());
            cpu += StepLoad.cpuPercent(step.getMetadata().getType());
        }
        return memory <= MAX_PARALLEL_MEMORY_MB && cpu <= MAX_PARALLEL_CPU_PERCENT;
    }

    private static boolean related(StepMetadata first, StepMetadata second) {
        for (String resource : first.getResources()) {
            if (second.getResources().contains(resource)) {
                return true;
            }
        }
        return first.getDependencies().contains(second.getName())
                || second.getDependencies().contains(first.getName());
    }

    private List<StepResult> executeSequential(List<Step> batch, List<Integer> indices, WorkflowContext context,
                                               ExecutionContext execution) throws WorkflowExecutionException {
        List<StepResult> results = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            if (i > 0) {
                execution.checkNotCancelled();
            }
            StepResult result = executeStep(batch.get(i), indices.get(i), context, execution);
            results.add(result);
            if (result.getStatus() == StepStatus.FAILED) {
                break;
            }
        }
        return results;
    }

    private static Map<String, Object> summarize(int batchIndex, List<Step> batch, List<StepResult> results,
                                                 boolean parallel, boolean success, long durationMs) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("batchIndex", batchIndex);
        summary.put("success", success);
        summary.put("batchSize", batch.size());
        summary.put("durationMs", durationMs);
        summary.put("parallel", parallel);
        summary.put("cacheHits", (int) results.stream().filter(StepResult::isFromCache).count());
        summary.put("stepTypes", batch.stream().map(s -> s.getMetadata().getType().getValue()).collect(Collectors.toList()));
        return summary;
    }

    private void recordBatch(int batchIndex, List<Step> batch, Map<String, Object> summary, boolean parallel) {
        String key = BATCH_RESULT_PREFIX + batchIndex + "_"
                + batch.stream().map(s -> s.getMetadata().getType().getValue()).collect(Collectors.joining("_"));
        Map<String, Object> entry = new LinkedHashMap<>(summary);
        entry.put("timestamp", Instant.now().toString());
        synchronized (batchHistory) {
            batchHistory.remove(key);
            batchHistory.put(key, entry);
            while (batchHistory.size() > MAX_BATCH_HISTORY) {
                String eldest = batchHistory.keySet().iterator().next();
                batchHistory.remove(eldest);
            }
            batchesRun++;
            if (parallel) {
                parallelBatches++;
            }
        }
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxParallel() {
        return maxParallel;
    }

    public List<Map<String, Object>> getBatchHistory() {
        synchronized (batchHistory) {
            return new ArrayList<>(batchHistory.values());
        }
    }

    public void clearBatchHistory() {
        synchronized (batchHistory) {
            batchHistory.clear();
        }
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("name", NAME);
        stats.put("batchSize", batchSize);
        stats.put("maxParallel", maxParallel);
        stats.put("parallelEnabled", parallelEnabled);
        synchronized (batchHistory) {
            stats.put("batchesRun", batchesRun);
            stats.put("parallelBatches", parallelBatches);
            stats.put("batchHistorySize", batchHistory.size());
        }
        return stats;
    }

    @Override
    public void shutdown() {
        stepPool.shutdownNow();
    }
}
