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

import dev.mars.sequor.config.SequorConfiguration;
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.workflow.cache.CacheKeyGenerator;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import static dev.mars.sequor.workflow.optimization.Recommendation.Level.HIGH;
import static dev.mars.sequor.workflow.optimization.Recommendation.Level.LOW;
import static dev.mars.sequor.workflow.optimization.Recommendation.Level.MEDIUM;

/**
 * Static analysis of a workflow before it runs.
 *
 * <p>Rules run in priority order: complexity, dependency, resource, performance and optimization
 * potential. A rule that throws is logged and skipped; the others still contribute. Analyses are
 * cached per workflow id and context fingerprint, and kept in a bounded learning history.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class WorkflowAnalyzer {

    private static final Logger logger = Logger.getLogger(WorkflowAnalyzer.class.getName());

    public static final String RULE_COMPLEXITY = "complexity";
    public static final String RULE_DEPENDENCY = "dependency";
    public static final String RULE_RESOURCE = "resource";
    public static final String RULE_PERFORMANCE = "performance";
    public static final String RULE_OPTIMIZATION_POTENTIAL = "optimization_potential";

    static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);
    static final int DEFAULT_MAX_CACHE_SIZE = 500;
    static final int MAX_HISTORY = 1000;
    static final double DISABLED_SCORE = 50.0;

    private static final int SIMPLIFICATION_STEP_COUNT = 20;
    private static final int REFACTORING_STEP_COUNT = 15;
    private static final long INTENSIVE_MEMORY_MB = 256;
    private static final double INTENSIVE_CPU_PERCENT = 30;
    private static final long TOTAL_MEMORY_LIMIT_MB = 2048;
    private static final double COST_LIMIT = 1.0;
    private static final long SLOW_STEP_MS = 60_000;
    private static final long SLOW_WORKFLOW_MS = 300_000;
    private static final double POTENTIAL_THRESHOLD = 0.5;
    private static final int MAX_STEP_POTENTIAL = 10;
    private static final int QUICK_WIN_POTENTIAL = 7;
    private static final int OPTIMIZATION_AREA_POTENTIAL = 5;
    private static final double COMPREHENSIVE_SCORE = 70;
    private static final double ARCHITECTURE_SCORE = 50;

    private static final class RegisteredRule {
        final String id;
        final int priority;
        final AnalysisRule rule;

        RegisteredRule(String id, int priority, AnalysisRule rule) {
            this.id = id;
            this.priority = priority;
            this.rule = rule;
        }
    }

    private static final class CachedAnalysis {
        final WorkflowAnalysis analysis;
        final long cachedAt;

        CachedAnalysis(WorkflowAnalysis analysis, long cachedAt) {
            this.analysis = analysis;
            this.cachedAt = cachedAt;
        }
    }

    private final Object lock = new Object();
    private final List<RegisteredRule> rules = new ArrayList<>();
    private final Map<String, CachedAnalysis> cache = new LinkedHashMap<>();
    private final Deque<WorkflowAnalysis> history = new ArrayDeque<>();
    private final CacheKeyGenerator keyGenerator = new CacheKeyGenerator();

    private final long cacheTtlMs;
    private final int maxCacheSize;
    private volatile boolean enabled;
    private volatile boolean learning;

    public WorkflowAnalyzer() {
        this(true, true, DEFAULT_CACHE_TTL, DEFAULT_MAX_CACHE_SIZE);
    }

    public WorkflowAnalyzer(SequorConfiguration configuration) {
        this(configuration.isOptimizationEnabled(), true, DEFAULT_CACHE_TTL, DEFAULT_MAX_CACHE_SIZE);
    }

    public WorkflowAnalyzer(boolean enabled, boolean learning, Duration cacheTtl, int maxCacheSize) {
        if (maxCacheSize < 1) {
            throw new IllegalArgumentException("maxCacheSize must be at least 1");
        }
        this.enabled = enabled;
        this.learning = learning;
        this.cacheTtlMs = cacheTtl.toMillis();
        this.maxCacheSize = maxCacheSize;

        registerRule(RULE_COMPLEXITY, 1, this::analyzeComplexity);
        registerRule(RULE_DEPENDENCY, 2, this::analyzeDependencies);
        registerRule(RULE_RESOURCE, 3, this::analyzeResources);
        registerRule(RULE_PERFORMANCE, 4, this::analyzePerformance);
        registerRule(RULE_OPTIMIZATION_POTENTIAL, 5, this::analyzeOptimizationPotential);
    }

    /**
     * Add or replace a rule. Lower priorities run first.
     */
    public void registerRule(String id, int priority, AnalysisRule rule) {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(rule, "rule cannot be null");
        synchronized (lock) {
            rules.removeIf(r -> r.id.equals(id));
            rules.add(new RegisteredRule(id, priority, rule));
            rules.sort(Comparator.comparingInt(r -> r.priority));
            cache.clear();
        }
    }

    public WorkflowAnalysis analyzeWorkflow(Workflow workflow, WorkflowContext context) {
        Objects.requireNonNull(workflow, "workflow cannot be null");
        Objects.requireNonNull(context, "context cannot be null");

        String workflowId = ExecutionPredictor.workflowId(workflow);
        List<StepMetadata> steps = stepMetadata(workflow);
        long now = System.currentTimeMillis();

        if (!enabled) {
            return new WorkflowAnalysis(workflowId, workflow.getName(), null, steps.size(), Map.of(), List.of(),
                    DISABLED_SCORE, List.of("Analysis disabled"), false, now);
        }

        String contextHash = keyGenerator.hashContext(context);
        String cacheKey = workflowId + "_" + contextHash;
        List<RegisteredRule> snapshot;
        synchronized (lock) {
            CachedAnalysis cached = cache.get(cacheKey);
            if (cached != null && now - cached.cachedAt < cacheTtlMs) {
                logger.fine("Using cached analysis for workflow " + workflowId);
                return cached.analysis;
            }
            snapshot = new ArrayList<>(rules);
        }

        Map<String, RuleResult> results = new LinkedHashMap<>();
        List<Recommendation> recommendations = new ArrayList<>();
        for (RegisteredRule registered : snapshot) {
            try {
                RuleResult result = registered.rule.analyze(steps, context);
                results.put(registered.id, result);
                recommendations.addAll(result.getRecommendations());
            } catch (RuntimeException e) {
                logger.warning("Analysis rule '" + registered.id + "' failed for workflow " + workflowId
                        + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Analysis rule failure", e);
                }
            }
        }
        recommendations.sort(Recommendation.RANKING);

        WorkflowAnalysis analysis = new WorkflowAnalysis(workflowId, workflow.getName(), contextHash, steps.size(),
                results, recommendations, optimizationScore(results), keyFindings(results), true, now);

        synchronized (lock) {
            if (!cache.containsKey(cacheKey) && cache.size() >= maxCacheSize) {
                Iterator<String> oldest = cache.keySet().iterator();
                oldest.next();
                oldest.remove();
            }
            cache.put(cacheKey, new CachedAnalysis(analysis, now));
            if (learning) {
                history.addLast(analysis);
                while (history.size() > MAX_HISTORY) {
                    history.removeFirst();
                }
            }
        }

        logger.fine("Analyzed workflow " + workflowId + ": " + recommendations.size() + " recommendations, score "
                + analysis.getOptimizationScore());
        return analysis;
    }

    public Map<String, Object> getStatistics() {
        synchronized (lock) {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("cacheSize", cache.size());
            stats.put("maxCacheSize", maxCacheSize);
            stats.put("historySize", history.size());
            stats.put("rulesCount", rules.size());
            stats.put("enabled", enabled);
            stats.put("learning", learning);
            return stats;
        }
    }

    public List<WorkflowAnalysis> getHistory() {
        synchronized (lock) {
            return new ArrayList<>(history);
        }
    }

    public void clearCache() {
        synchronized (lock) {
            cache.clear();
        }
    }

    public void clearHistory() {
        synchronized (lock) {
            history.clear();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setLearning(boolean learning) {
        this.learning = learning;
    }

    // Rules

    RuleResult analyzeComplexity(List<StepMetadata> steps, WorkflowContext context) {
        Map<String, Integer> stepTypes = new TreeMap<>();
        List<Long> complexities = new ArrayList<>();
        for (StepMetadata step : steps) {
            stepTypes.merge(step.getType().getValue(), 1, Integer::sum);
            complexities.add(StepProfiles.complexity(step));
        }

        double average = complexities.stream().mapToLong(Long::longValue).average().orElse(0.0);
        long max = complexities.stream().mapToLong(Long::longValue).max().orElse(0);
        List<Map<String, Object>> bottlenecks = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            if (complexities.get(i) > average * 2) {
                Map<String, Object> bottleneck = stepRef(i, steps.get(i));
                bottleneck.put("complexity", complexities.get(i));
                bottleneck.put("type", steps.get(i).getType().getValue());
                bottlenecks.add(bottleneck);
            }
        }

        RuleResult.Builder result = RuleResult.builder()
                .metric("totalSteps", steps.size())
                .metric("stepTypes", stepTypes)
                .metric("averageStepComplexity", average)
                .metric("maxStepComplexity", max)
                .metric("bottlenecks", bottlenecks);
        if (!bottlenecks.isEmpty()) {
            result.recommend(new Recommendation("complexity_reduction", HIGH, HIGH, MEDIUM,
                    "Consider breaking down " + bottlenecks.size() + " high-complexity steps"));
        }
        if (steps.size() > SIMPLIFICATION_STEP_COUNT) {
            result.recommend(new Recommendation("workflow_simplification", MEDIUM, MEDIUM, HIGH,
                    "Consider splitting workflow into smaller sub-workflows"));
        }
        return result.build();
    }

    RuleResult analyzeDependencies(List<StepMetadata> steps, WorkflowContext context) {
        Map<String, Integer> indexByName = new LinkedHashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            indexByName.putIfAbsent(steps.get(i).getName(), i);
        }

        // undirected adjacency over resolvable dependencies
        List<List<Integer>> links = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            links.add(new ArrayList<>());
        }
        List<Map<String, Object>> opportunities = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            StepMetadata step = steps.get(i);
            if (step.getDependencies().isEmpty()) {
                Map<String, Object> opportunity = stepRef(i, step);
                opportunity.put("reason", "No dependencies");
                opportunities.add(opportunity);
            }
            for (String dependency : step.getDependencies()) {
                Integer target = indexByName.get(dependency);
                if (target != null) {
                    links.get(i).add(target);
                    links.get(target).add(i);
                }
            }
        }

        List<List<Integer>> groups = new ArrayList<>();
        boolean[] visited = new boolean[steps.size()];
        for (int start = 0; start < steps.size(); start++) {
            if (visited[start]) {
                continue;
            }
            List<Integer> group = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            visited[start] = true;
            while (!queue.isEmpty()) {
                int current = queue.poll();
                group.add(current);
                for (int next : links.get(current)) {
                    if (!visited[next]) {
                        visited[next] = true;
                        queue.add(next);
                    }
                }
            }
            groups.add(group);
        }

        RuleResult.Builder result = RuleResult.builder()
                .metric("totalSteps", steps.size())
                .metric("parallelizationOpportunities", opportunities)
                .metric("independentGroups", groups);
        if (!opportunities.isEmpty()) {
            result.recommend(new Recommendation("parallelization", HIGH, HIGH, LOW,
                    "Found " + opportunities.size() + " steps that can run in parallel"));
        }
        if (groups.size() > 1) {
            result.recommend(new Recommendation("workflow_splitting", MEDIUM, MEDIUM, MEDIUM,
                    "Workflow can be split into " + groups.size() + " independent groups"));
        }
        return result.build();
    }

    RuleResult analyzeResources(List<StepMetadata> steps, WorkflowContext context) {
        long totalMemory = 0;
        double totalCpu = 0;
        long maxTimeout = 0;
        List<Map<String, Object>> intensive = new ArrayList<>();
        Map<String, Map<String, Object>> distribution = new TreeMap<>();

        for (int i = 0; i < steps.size(); i++) {
            StepMetadata step = steps.get(i);
            ResourceEstimate estimate = StepProfiles.resources(step);
            totalMemory += estimate.getMemoryMb();
            totalCpu += estimate.getCpuPercent();
            maxTimeout = Math.max(maxTimeout, estimate.getTimeoutMs());

            if (estimate.getMemoryMb() > INTENSIVE_MEMORY_MB || estimate.getCpuPercent() > INTENSIVE_CPU_PERCENT) {
                Map<String, Object> entry = stepRef(i, step);
                entry.put("resources", estimate.toMap());
                intensive.add(entry);
            }

            Map<String, Object> byType = distribution.computeIfAbsent(step.getType().getValue(), t -> {
                Map<String, Object> initial = new LinkedHashMap<>();
                initial.put("count", 0);
                initial.put("totalMemory", 0L);
                initial.put("totalCpu", 0.0);
                return initial;
            });
            byType.put("count", (Integer) byType.get("count") + 1);
            byType.put("totalMemory", (Long) byType.get("totalMemory") + estimate.getMemoryMb());
            byType.put("totalCpu", (Double) byType.get("totalCpu") + estimate.getCpuPercent());
        }

        ResourceEstimate total = new ResourceEstimate(totalMemory, totalCpu, maxTimeout);
        RuleResult.Builder result = RuleResult.builder()
                .metric("resourceRequirements", total.toMap())
                .metric("resourceIntensiveSteps", intensive)
                .metric("resourceDistribution", distribution)
                .metric("estimatedCost", total.getEstimatedCost());
        if (!intensive.isEmpty()) {
            result.recommend(new Recommendation("resource_optimization", HIGH, HIGH, MEDIUM,
                    "Found " + intensive.size() + " resource-intensive steps"));
        }
        if (totalMemory > TOTAL_MEMORY_LIMIT_MB) {
            result.recommend(new Recommendation("memory_optimization", MEDIUM, MEDIUM, MEDIUM,
                    "Consider optimizing memory usage"));
        }
        if (total.getEstimatedCost() > COST_LIMIT) {
            result.recommend(new Recommendation("cost_optimization", MEDIUM, MEDIUM, HIGH,
                    "Consider cost optimization strategies"));
        }
        return result.build();
    }

    RuleResult analyzePerformance(List<StepMetadata> steps, WorkflowContext context) {
        long totalTime = 0;
        List<Map<String, Object>> bottlenecks = new ArrayList<>();
        List<Map<String, Object>> opportunities = new ArrayList<>();

        for (int i = 0; i < steps.size(); i++) {
            StepMetadata step = steps.get(i);
            long estimatedTime = StepProfiles.expectedDurationMs(step.getType());
            long timeout = step.getLongParameter(StepProfiles.PARAM_TIMEOUT, 0);
            if (timeout > 0) {
                estimatedTime = Math.min(estimatedTime, timeout);
            }
            totalTime += estimatedTime;

            if (estimatedTime > SLOW_STEP_MS) {
                Map<String, Object> bottleneck = stepRef(i, step);
                bottleneck.put("estimatedTime", estimatedTime);
                bottlenecks.add(bottleneck);
            }
            double potential = performancePotential(step);
            if (potential > POTENTIAL_THRESHOLD) {
                Map<String, Object> opportunity = stepRef(i, step);
                opportunity.put("potential", potential);
                opportunities.add(opportunity);
            }
        }

        RuleResult.Builder result = RuleResult.builder()
                .metric("totalSteps", steps.size())
                .metric("estimatedExecutionTime", totalTime)
                .metric("performanceBottlenecks", bottlenecks)
                .metric("optimizationOpportunities", opportunities);
        if (!bottlenecks.isEmpty()) {
            result.recommend(new Recommendation("performance_optimization", HIGH, HIGH, MEDIUM,
                    "Found " + bottlenecks.size() + " performance bottlenecks"));
        }
        if (!opportunities.isEmpty()) {
            result.recommend(new Recommendation("step_optimization", MEDIUM, MEDIUM, LOW,
                    "Found " + opportunities.size() + " steps with optimization potential"));
        }
        if (totalTime > SLOW_WORKFLOW_MS) {
            result.recommend(new Recommendation("execution_time_optimization", MEDIUM, MEDIUM, HIGH,
                    "Consider optimizing for faster execution"));
        }
        return result.build();
    }

    RuleResult analyzeOptimizationPotential(List<StepMetadata> steps, WorkflowContext context) {
        int totalScore = 0;
        List<Map<String, Object>> quickWins = new ArrayList<>();
        List<Map<String, Object>> areas = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            StepMetadata step = steps.get(i);
            int potential = stepPotential(step);
            totalScore += potential;
            if (potential > QUICK_WIN_POTENTIAL) {
                Map<String, Object> quickWin = stepRef(i, step);
                quickWin.put("potential", potential);
                quickWins.add(quickWin);
            }
            if (potential > OPTIMIZATION_AREA_POTENTIAL) {
                Map<String, Object> area = stepRef(i, step);
                area.put("potential", potential);
                areas.add(area);
            }
        }
        double score = steps.isEmpty() ? 0.0 : totalScore * 100.0 / (MAX_STEP_POTENTIAL * steps.size());

        List<String> longTerm = new ArrayList<>();
        if (steps.size() > REFACTORING_STEP_COUNT) {
            longTerm.add("workflow_refactoring");
        }
        if (score < ARCHITECTURE_SCORE) {
            longTerm.add("architecture_review");
        }

        RuleResult.Builder result = RuleResult.builder()
                .metric("totalSteps", steps.size())
                .metric("optimizationScore", score)
                .metric("quickWins", quickWins)
                .metric("optimizationAreas", areas)
                .metric("longTermImprovements", longTerm);
        if (!quickWins.isEmpty()) {
            result.recommend(new Recommendation("quick_wins", HIGH, HIGH, LOW,
                    "Found " + quickWins.size() + " quick optimization wins"));
        }
        if (score < COMPREHENSIVE_SCORE) {
            result.recommend(new Recommendation("comprehensive_optimization", MEDIUM, HIGH, HIGH,
                    "Consider comprehensive workflow optimization"));
        }
        return result.build();
    }

    // Helpers

    static double performancePotential(StepMetadata step) {
        switch (step.getType()) {
            case ANALYSIS:
                return 0.7;
            case PROCESSING:
                return step.getLongParameter(StepProfiles.PARAM_BATCH_SIZE, 0) > 500 ? 0.6 : 0.0;
            case TESTING:
                return 0.5;
            case DEPLOYMENT:
                return 0.4;
            default:
                return 0.0;
        }
    }

    /**
     * Optimization potential of one step on a 0-10 scale.
     */
    static int stepPotential(StepMetadata step) {
        StepType type = step.getType();
        int score = 0;
        switch (type) {
            case ANALYSIS:
                score += 3;
                break;
            case PROCESSING:
                score += 2;
                if (step.getLongParameter(StepProfiles.PARAM_BATCH_SIZE, 0) > 500) {
                    score += 2;
                }
                break;
            case TESTING:
                score += 2;
                break;
            case DEPLOYMENT:
                score += 1;
                break;
            default:
                break;
        }
        if (!step.getBooleanParameter(StepProfiles.PARAM_PARALLEL)
                && (type == StepType.ANALYSIS || type == StepType.TESTING)) {
            score += 2;
        }
        if (step.getLongParameter(StepProfiles.PARAM_TIMEOUT, 0) > 300_000) {
            score += 1;
        }
        if (step.getLongParameter(StepProfiles.PARAM_RETRIES, 0) > 3) {
            score += 1;
        }
        return Math.min(score, MAX_STEP_POTENTIAL);
    }

    private static double optimizationScore(Map<String, RuleResult> results) {
        RuleResult potential = results.get(RULE_OPTIMIZATION_POTENTIAL);
        if (potential != null && potential.getMetric("optimizationScore") instanceof Number) {
            return ((Number) potential.getMetric("optimizationScore")).doubleValue();
        }
        return 0.0;
    }

    private static List<String> keyFindings(Map<String, RuleResult> results) {
        List<String> findings = new ArrayList<>();
        for (RuleResult result : results.values()) {
            int bottlenecks = result.countOf("bottlenecks");
            if (bottlenecks > 0) {
                findings.add(bottlenecks + " bottlenecks identified");
            }
            int opportunities = result.countOf("parallelizationOpportunities");
            if (opportunities > 0) {
                findings.add(opportunities + " parallelization opportunities");
            }
        }
        return findings;
    }

    private static List<StepMetadata> stepMetadata(Workflow workflow) {
        List<StepMetadata> metadata = new ArrayList<>();
        for (Step step : workflow.getSteps()) {
            metadata.add(step.getMetadata());
        }
        return metadata;
    }

    private static Map<String, Object> stepRef(int index, StepMetadata step) {
        Map<String, Object> ref = new LinkedHashMap<>();
        ref.put("stepIndex", index);
        ref.put("stepName", step.getName());
        return ref;
    }
}
