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
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.workflow.ExecutionContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Chooses how to run each workflow from what it has learned about earlier runs.
 *
 * <p>Before a run the workflow is scored for complexity, its duration is estimated from per-type
 * history, and similar step-type patterns are looked up. Together these give a recommended approach
 * and a confidence. Above the confidence threshold the recommendation is followed
 * ({@code basic}, {@code optimized}, {@code batch}; {@code smart} means adaptive). Below it the
 * run is adaptive: a step that is cheap and historically fast runs side by side with the step after it.
 * After every run the per-type statistics and the pattern database are updated.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-31
 */
public class SmartExecutionStrategy extends AbstractExecutionStrategy {

    private static final Logger logger = Logger.getLogger(SmartExecutionStrategy.class.getName());

    public static final String NAME = "smart";
    public static final String APPROACH_ADAPTIVE = "adaptive";

    static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
    static final double PATTERN_SIMILARITY_THRESHOLD = 0.7;
    static final int DEFAULT_MAX_HISTORY = 1000;
    static final int APPROACH_BATCH_SIZE = 3;
    static final long TRANSITION_OVERHEAD_MS = 100;
    static final long LONG_RUN_MS = 30_000;
    static final double MIN_LEARNED_SUCCESS_RATE = 0.5;

    private final boolean predictionEnabled;
    private final boolean adaptiveEnabled;
    private final boolean learningEnabled;
    private final double confidenceThreshold;
    private final int maxHistory;
    private final ExecutorService stepPool;

    private final Object lock = new Object();
    private final Map<StepType, TypeStats> typeStats = new EnumMap<>(StepType.class);
    private final Map<String, Pattern> patterns = new LinkedHashMap<>();
    private final Map<String, Long> approachCounts = new HashMap<>();

    static final class TypeStats {
        long executions;
        long totalDurationMs;
        long successes;

        double getAverageDurationMs() {
            return executions == 0 ? 0.0 : (double) totalDurationMs / executions;
        }

        double getSuccessRate() {
            return executions == 0 ? 0.0 : (double) successes / executions;
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("executions", executions);
            map.put("averageDurationMs", getAverageDurationMs());
            map.put("successRate", getSuccessRate());
            return map;
        }
    }

    /**
     * Runs, successes and total duration of one approach.
     */
    static final class Outcome {
        long runs;
        long successes;
        long totalDurationMs;

        void record(boolean success, long durationMs) {
            runs++;
            totalDurationMs += durationMs;
            if (success) {
                successes++;
            }
        }

        void add(Outcome other) {
            runs += other.runs;
            successes += other.successes;
            totalDurationMs += other.totalDurationMs;
        }

        double getSuccessRate() {
            return runs == 0 ? 0.0 : (double) successes / runs;
        }

        double getAverageDurationMs() {
            return runs == 0 ? 0.0 : (double) totalDurationMs / runs;
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("runs", runs);
            map.put("successRate", getSuccessRate());
            map.put("averageDurationMs", getAverageDurationMs());
            return map;
        }
    }

    // higher success rate first, then shorter average duration
    static final Comparator<Outcome> BEST_OUTCOME_FIRST = Comparator
            .comparingDouble(Outcome::getSuccessRate).reversed()
            .thenComparingDouble(Outcome::getAverageDurationMs);

    static final class Pattern {
        final String key;
        String signature;
        long durationMs;
        boolean success;
        int stepCount;
        String strategy;
        Instant recordedAt;
        final Map<String, Outcome> outcomes = new LinkedHashMap<>();

        Pattern(String key) {
            this.key = key;
        }
    }

    /**
     * Pre-run assessment of a workflow.
     */
    static final class Analysis {
        final double complexity;
        final long estimatedDurationMs;
        final String recommendation;
        final double confidence;
        final List<Map<String, Object>> similarPatterns;
        final Map<String, Outcome> learnedOutcomes;
        final int stepCount;

        Analysis(double complexity, long estimatedDurationMs, String recommendation, double confidence,
                 List<Map<String, Object>> similarPatterns, Map<String, Outcome> learnedOutcomes, int stepCount) {
            this.complexity = complexity;
            this.estimatedDurationMs = estimatedDurationMs;
            this.recommendation = recommendation;
            this.confidence = confidence;
            this.similarPatterns = similarPatterns;
            this.learnedOutcomes = learnedOutcomes;
            this.stepCount = stepCount;
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("complexity", complexity);
            map.put("estimatedDurationMs", estimatedDurationMs);
            map.put("recommendedStrategy", recommendation);
            map.put("confidence", confidence);
            map.put("similarPatterns", similarPatterns.size());
            Map<String, Object> learned = new LinkedHashMap<>();
            learnedOutcomes.forEach((approach, outcome) -> learned.put(approach, outcome.toMap()));
            map.put("learnedApproaches", learned);
            map.put("stepCount", stepCount);
            return map;
        }
    }

    public SmartExecutionStrategy() {
        this(true, true, true, DEFAULT_CONFIDENCE_THRESHOLD, DEFAULT_MAX_HISTORY);
    }

    public SmartExecutionStrategy(boolean predictionEnabled, boolean adaptiveEnabled, boolean learningEnabled,
                                  double confidenceThreshold, int maxHistory) {
        super(NAME);
        this.predictionEnabled = predictionEnabled;
        this.adaptiveEnabled = adaptiveEnabled;
        this.learningEnabled = learningEnabled;
        this.confidenceThreshold = confidenceThreshold;
        this.maxHistory = maxHistory;
        this.stepPool = newStepPool("sequor-smart", APPROACH_BATCH_SIZE);
    }

    @Override
    public ExecutionResult execute(Workflow workflow, WorkflowContext context, ExecutionContext execution)
            throws WorkflowExecutionException {
        long startTime = System.currentTimeMillis();
        List<Step> steps = workflow.getSteps();
        if (steps.isEmpty()) {
            return executeBody(workflow, context, execution, startTime);
        }

        Analysis analysis = analyze(steps);
        String approach = chooseApproach(analysis);
        synchronized (lock) {
            approachCounts.merge(approach, 1L, Long::sum);
        }
        logger.fine(String.format(Locale.ROOT, "Execution %s: complexity %.2f, ~%d ms, recommended %s (confidence %.2f), approach %s",
                execution.getExecutionId(), analysis.complexity, analysis.estimatedDurationMs,
                analysis.recommendation, analysis.confidence, approach));

        List<StepResult> results;
        switch (approach) {
            case BatchExecutionStrategy.NAME:
                results = runInBatches(steps, context, execution);
                break;
            case APPROACH_ADAPTIVE:
                results = runAdaptive(steps, context, execution);
                break;
            default:
                results = runSequential(steps, context, execution);
                break;
        }

        ExecutionResult result = buildResult(workflow, execution, startTime, steps.size(), results,
                Map.of("analysis", analysis.toMap(), "approach", approach));
        if (learningEnabled) {
            learn(workflow, results, approach, result.getDurationMs());
        }
        return result;
    }

    Analysis analyze(List<Step> steps) {
        double complexity = complexity(steps);
        long duration = estimateDuration(steps);
        String recommendation = recommend(steps, complexity, duration);
        String signature = signature(steps);
        List<Map<String, Object>> similar = findSimilarPatterns(signature);
        double confidence = confidence(steps, similar.size());
        return new Analysis(complexity, duration, recommendation, confidence, similar,
                learnedOutcomes(signature), steps.size());
    }

    /**
     * Complexity between 0 and 1: step count (40%), type diversity (30%) and resource-intensive
     * steps (30%).
     */
    static double complexity(List<Step> steps) {
        if (steps.isEmpty()) {
            return 0.0;
        }
        Set<StepType> types = new LinkedHashSet<>();
        int intensive = 0;
        for (Step step : steps) {
            StepType type = step.getMetadata().getType();
            types.add(type);
            if (type.isResourceIntensive()) {
                intensive++;
            }
        }
        double score = Math.min(steps.size() / 10.0, 1.0) * 0.4
                + Math.min(types.size() / 5.0, 1.0) * 0.3
                + Math.min(intensive / 3.0, 1.0) * 0.3;
        return Math.min(score, 1.0);
    }

    long estimateDuration(List<Step> steps) {
        if (steps.isEmpty()) {
            return 0;
        }
        long total = 0;
        synchronized (lock) {
            for (Step step : steps) {
                StepType type = step.getMetadata().getType();
                TypeStats stats = typeStats.get(type);
                total += stats != null && stats.executions > 0
                        ? Math.round(stats.getAverageDurationMs())
                        : StepLoad.expectedDurationMs(type);
            }
        }
        return total + (steps.size() - 1) * TRANSITION_OVERHEAD_MS;
    }

    String recommend(List<Step> steps, double complexity, long estimatedDurationMs) {
        boolean similarSteps = hasSimilarSteps(steps);
        if (predictionEnabled) {
            // feature scores, highest wins; ties keep the earlier entry
            Map<String, Double> scores = new LinkedHashMap<>();
            scores.put(BasicExecutionStrategy.NAME, 0.5);
            scores.put(OptimizedExecutionStrategy.NAME, estimatedDurationMs > LONG_RUN_MS ? 0.7 : 0.6);
            scores.put(BatchExecutionStrategy.NAME, similarSteps ? 0.9 : 0.7);
            scores.put(NAME, complexity > 0.7 ? 1.0 : 0.8);
            String best = null;
            double bestScore = -1;
            for (Map.Entry<String, Double> entry : scores.entrySet()) {
                if (entry.getValue() > bestScore) {
                    best = entry.getKey();
                    bestScore = entry.getValue();
                }
            }
            if (Math.min(bestScore, 1.0) > confidenceThreshold) {
                return best;
            }
        }
        if (complexity > 0.8) {
            return NAME;
        } else if (steps.size() > 5 && similarSteps) {
            return BatchExecutionStrategy.NAME;
        } else if (estimatedDurationMs > LONG_RUN_MS) {
            return OptimizedExecutionStrategy.NAME;
        }
        return BasicExecutionStrategy.NAME;
    }

    /**
     * Base 0.5, up to +0.3 for the share of step types with history, up to +0.2 for similar patterns.
     */
    double confidence(List<Step> steps, int similarPatterns) {
        double confidence = 0.5;
        if (!steps.isEmpty()) {
            int known = 0;
            synchronized (lock) {
                for (Step step : steps) {
                    if (typeStats.containsKey(step.getMetadata().getType())) {
                        known++;
                    }
                }
            }
            confidence += (double) known / steps.size() * 0.3;
        }
        if (similarPatterns > 0) {
            confidence += Math.min(similarPatterns * 0.1, 0.2);
        }
        return Math.min(confidence, 1.0);
    }

    String chooseApproach(Analysis analysis) {
        String approach;
        if (analysis.confidence > confidenceThreshold) {
            approach = NAME.equals(analysis.recommendation) ? APPROACH_ADAPTIVE : analysis.recommendation;
        } else {
            approach = adaptiveEnabled ? APPROACH_ADAPTIVE : BasicExecutionStrategy.NAME;
        }
        return preferLearned(approach, analysis.learnedOutcomes);
    }

    /**
     * Swap the chosen approach for the best one seen on similar workflows when history shows it did
     * worse. An approach with no history is kept so that it gets tried; a failing approach with nothing
     * better on record gives way to one that has not been tried yet.
     */
    String preferLearned(String chosen, Map<String, Outcome> learned) {
        Outcome current = learned.get(chosen);
        if (current == null) {
            return chosen;
        }
        Map.Entry<String, Outcome> best = learned.entrySet().stream()
                .min(Map.Entry.comparingByValue(BEST_OUTCOME_FIRST))
                .orElseThrow();
        if (!best.getKey().equals(chosen) && BEST_OUTCOME_FIRST.compare(best.getValue(), current) < 0) {
            return best.getKey();
        }
        if (current.getSuccessRate() < MIN_LEARNED_SUCCESS_RATE) {
            for (String candidate : untriedCandidates()) {
                if (!learned.containsKey(candidate)) {
                    return candidate;
                }
            }
        }
        return chosen;
    }

    private List<String> untriedCandidates() {
        return adaptiveEnabled
                ? List.of(BasicExecutionStrategy.NAME, BatchExecutionStrategy.NAME, APPROACH_ADAPTIVE)
                : List.of(BasicExecutionStrategy.NAME, BatchExecutionStrategy.NAME);
    }

    /**
     * Outcomes per approach summed over every learned pattern similar to the signature.
     */
    Map<String, Outcome> learnedOutcomes(String signature) {
        Map<String, Outcome> learned = new LinkedHashMap<>();
        synchronized (lock) {
            for (Pattern pattern : patterns.values()) {
                if (similarity(signature, pattern.signature) > PATTERN_SIMILARITY_THRESHOLD) {
                    pattern.outcomes.forEach((approach, outcome) ->
                            learned.computeIfAbsent(approach, a -> new Outcome()).add(outcome));
                }
            }
        }
        return learned;
    }

    List<Map<String, Object>> findSimilarPatterns(String signature) {
        List<Map<String, Object>> similar = new ArrayList<>();
        synchronized (lock) {
            for (Pattern pattern : patterns.values()) {
                double similarity = similarity(signature, pattern.signature);
                if (similarity > PATTERN_SIMILARITY_THRESHOLD) {
                    Map<String, Object> match = new LinkedHashMap<>();
                    match.put("pattern", pattern.key);
                    match.put("similarity", similarity);
                    match.put("strategy", pattern.strategy);
                    match.put("durationMs", pattern.durationMs);
                    match.put("success", pattern.success);
                    match.put("stepCount", pattern.stepCount);
                    match.put("recordedAt", pattern.recordedAt.toString());
                    Map<String, Object> approaches = new LinkedHashMap<>();
                    pattern.outcomes.forEach((approach, outcome) -> approaches.put(approach, outcome.toMap()));
                    match.put("approaches", approaches);
                    similar.add(match);
                }
            }
        }
        similar.sort(Comparator.comparingDouble((Map<String, Object> m) -> (Double) m.get("similarity")).reversed());
        return similar;
    }

    /**
     * Share of step types the two signatures have in common, over the distinct types of both.
     */
    static double similarity(String first, String second) {
        Set<String> firstTypes = new LinkedHashSet<>(Arrays.asList(first.split("_")));
        Set<String> secondTypes = new LinkedHashSet<>(Arrays.asList(second.split("_")));
        Set<String> union = new LinkedHashSet<>(firstTypes);
        union.addAll(secondTypes);
        firstTypes.retainAll(secondTypes);
        return union.isEmpty() ? 0.0 : (double) firstTypes.size() / union.size();
    }

    static String signature(List<Step> steps) {
        return steps.stream().map(s -> s.getMetadata().getType().getValue()).collect(Collectors.joining("_"));
    }

    static boolean hasSimilarSteps(List<Step> steps) {
        Set<StepType> seen = new LinkedHashSet<>();
        for (Step step : steps) {
            if (!seen.add(step.getMetadata().getType())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Success rate per millisecond of average duration once a type has history, otherwise the
     * type's prior.
     */
    double predictedPerformance(Step step) {
        StepType type = step.getMetadata().getType();
        synchronized (lock) {
            TypeStats stats = typeStats.get(type);
            if (stats != null && stats.executions > 0) {
                return stats.getSuccessRate() / Math.max(1.0, stats.getAverageDurationMs());
            }
        }
        return StepLoad.performance(type);
    }

    boolean pairsWithNext(Step step) {
        StepType type = step.getMetadata().getType();
        return predictedPerformance(step) > 0.8
                && StepLoad.memoryMb(type) < 256
                && StepLoad.cpuPercent(type) < 50;
    }

    private List<StepResult> runSequential(List<Step> steps, WorkflowContext context, ExecutionContext execution)
            throws WorkflowExecutionException {
        List<StepResult> results = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            execution.checkNotCancelled();
            StepResult result = executeStep(steps.get(i), i, context, execution);
            results.add(result);
            if (result.getStatus() == StepStatus.FAILED) {
                break;
            }
        }
        return results;
    }

    private List<StepResult> runInBatches(List<Step> steps, WorkflowContext context, ExecutionContext execution)
            throws WorkflowExecutionException {
        List<StepResult> results = new ArrayList<>();
        for (int from = 0; from < steps.size(); from += APPROACH_BATCH_SIZE) {
            execution.checkNotCancelled();
            int to = Math.min(from + APPROACH_BATCH_SIZE, steps.size());
            List<StepResult> batch = to - from == 1
                    ? List.of(executeStep(steps.get(from), from, context, execution))
                    : executeParallel(steps.subList(from, to), range(from, to - from), context, execution, stepPool);
            results.addAll(batch);
            if (batch.stream().anyMatch(r -> r.getStatus() == StepStatus.FAILED)) {
                break;
            }
        }
        return results;
    }

    private List<StepResult> runAdaptive(List<Step> steps, WorkflowContext context, ExecutionContext execution)
            throws WorkflowExecutionException {
        List<StepResult> results = new ArrayList<>();
        int i = 0;
        while (i < steps.size()) {
            execution.checkNotCancelled();
            List<StepResult> round;
            if (i < steps.size() - 1 && pairsWithNext(steps.get(i))) {
                round = executeParallel(steps.subList(i, i + 2), range(i, 2), context, execution, stepPool);
                i += 2;
            } else {
                round = List.of(executeStep(steps.get(i), i, context, execution));
                i++;
            }
            results.addAll(round);
            if (round.stream().anyMatch(r -> r.getStatus() == StepStatus.FAILED)) {
                break;
            }
        }
        return results;
    }

    private void learn(Workflow workflow, List<StepResult> results, String approach, long durationMs) {
        String key = workflow.getName() + "_" + workflow.getMetadata().getType();
        String ranSignature = results.stream().map(r -> r.getType().getValue()).collect(Collectors.joining("_"));
        boolean success = results.stream().noneMatch(r -> r.getStatus() == StepStatus.FAILED);
        recordOutcome(key, ranSignature, approach, success, durationMs, results.size());
        synchronized (lock) {
            for (StepResult result : results) {
                if (result.isFromCache() || result.getStatus() == StepStatus.SKIPPED) {
                    continue;
                }
                TypeStats stats = typeStats.computeIfAbsent(result.getType(), t -> new TypeStats());
                stats.executions++;
                stats.totalDurationMs += result.getDurationMs();
                if (result.isSuccessful()) {
                    stats.successes++;
                }
            }
        }
    }

    /**
     * Record how an approach did for a workflow. The workflow's pattern keeps one outcome per approach
     * and moves to the most recent end of the history.
     */
    void recordOutcome(String key, String signature, String approach, boolean success, long durationMs, int stepCount) {
        synchronized (lock) {
            Pattern pattern = patterns.remove(key);
            if (pattern == null) {
                pattern = new Pattern(key);
            }
            pattern.signature = signature;
            pattern.durationMs = durationMs;
            pattern.success = success;
            pattern.stepCount = stepCount;
            pattern.strategy = approach;
            pattern.recordedAt = Instant.now();
            pattern.outcomes.computeIfAbsent(approach, a -> new Outcome()).record(success, durationMs);
            patterns.put(key, pattern);
            while (patterns.size() > maxHistory) {
                patterns.remove(patterns.keySet().iterator().next());
            }
        }
    }

    public Map<String, Map<String, Object>> getStepTypeStatistics() {
        synchronized (lock) {
            Map<String, Map<String, Object>> snapshot = new LinkedHashMap<>();
            typeStats.forEach((type, stats) -> snapshot.put(type.getValue(), stats.toMap()));
            return snapshot;
        }
    }

    public int getPatternCount() {
        synchronized (lock) {
            return patterns.size();
        }
    }

    public void clearLearning() {
        synchronized (lock) {
            typeStats.clear();
            patterns.clear();
        }
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("name", NAME);
        stats.put("predictionEnabled", predictionEnabled);
        stats.put("adaptiveEnabled", adaptiveEnabled);
        stats.put("learningEnabled", learningEnabled);
        stats.put("confidenceThreshold", confidenceThreshold);
        synchronized (lock) {
            stats.put("stepTypesLearned", typeStats.size());
            stats.put("patternCount", patterns.size());
            stats.put("approaches", new LinkedHashMap<>(approachCounts));
        }
        return stats;
    }

    @Override
    public void shutdown() {
        stepPool.shutdownNow();
    }
}
