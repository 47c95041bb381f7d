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
import dev.mars.sequor.core.OptimizedStep;
import dev.mars.sequor.core.OptimizedWorkflow;
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.WorkflowMetadata;
import dev.mars.sequor.workflow.cache.CacheKeyGenerator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites the step list of a workflow before execution.
 *
 * <p>Rules run in order: reorder steps by phase while keeping declared dependencies ahead of their
 * dependents, remove redundant steps (duplicates, disabled steps and steps whose conditions the
 * context does not meet), then tune every remaining step through a {@link StepOptimizer}. Only
 * rules that changed the step list are reported in
 * {@link OptimizedWorkflow#getAppliedOptimizations()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class WorkflowOptimizer {

    private static final Logger logger = Logger.getLogger(WorkflowOptimizer.class.getName());

    public static final String RULE_REORDER = "reorder_steps";
    public static final String RULE_REMOVE_REDUNDANT = "remove_redundant_steps";
    public static final String RULE_PARAMETERS = "optimize_parameters";

    public static final String ATTR_OPTIMIZED = "optimized";
    public static final String ATTR_ORIGINAL_STEP_COUNT = "originalStepCount";

    static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);
    static final int DEFAULT_MAX_CACHE_SIZE = 1000;

    /**
     * Outcome of a run, replayable against the same step list: original step indices in their
     * new order and the metadata each one ends up with.
     */
    private static final class Plan {
        final List<Integer> order;
        final List<StepMetadata> metadata;
        final List<String> applied;
        final long createdAt;

        Plan(List<Integer> order, List<StepMetadata> metadata, List<String> applied, long createdAt) {
            this.order = order;
            this.metadata = metadata;
            this.applied = applied;
            this.createdAt = createdAt;
        }
    }

    private final Object lock = new Object();
    private final Map<String, BiFunction<List<Step>, WorkflowContext, List<Step>>> rules = new LinkedHashMap<>();
    private final Map<String, Plan> cache = new LinkedHashMap<>();
    private final Map<String, Long> ruleApplications = new HashMap<>();
    private final AtomicLong optimizations = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong stepsRemoved = new AtomicLong();
    private final CacheKeyGenerator keyGenerator = new CacheKeyGenerator();

    private final StepOptimizer stepOptimizer;
    private final long cacheTtlMs;
    private final int maxCacheSize;
    private volatile boolean enabled;

    public WorkflowOptimizer() {
        this(new StepOptimizer(), true, DEFAULT_CACHE_TTL, DEFAULT_MAX_CACHE_SIZE);
    }

    public WorkflowOptimizer(SequorConfiguration configuration) {
        this(new StepOptimizer(configuration), configuration.isOptimizationEnabled(), DEFAULT_CACHE_TTL,
                DEFAULT_MAX_CACHE_SIZE);
    }

    public WorkflowOptimizer(StepOptimizer stepOptimizer, boolean enabled, Duration cacheTtl, int maxCacheSize) {
        if (maxCacheSize < 1) {
            throw new IllegalArgumentException("maxCacheSize must be at least 1");
        }
        this.stepOptimizer = Objects.requireNonNull(stepOptimizer, "stepOptimizer cannot be null");
        this.enabled = enabled;
        this.cacheTtlMs = cacheTtl.toMillis();
        this.maxCacheSize = maxCacheSize;

        rules.put(RULE_REORDER, (steps, context) -> reorderSteps(steps));
        rules.put(RULE_REMOVE_REDUNDANT, WorkflowOptimizer::removeRedundantSteps);
        rules.put(RULE_PARAMETERS, this::optimizeParameters);
    }

    /**
     * @return an {@link OptimizedWorkflow} over {@code workflow}, or {@code workflow} itself when
     *         disabled or when it declares no steps
     */
    public Workflow optimizeWorkflow(Workflow workflow, WorkflowContext context) {
        Objects.requireNonNull(workflow, "workflow cannot be null");
        Objects.requireNonNull(context, "context cannot be null");
        List<Step> steps = workflow.getSteps();
        if (!enabled || steps.isEmpty()) {
            return workflow;
        }

        String workflowId = ExecutionPredictor.workflowId(workflow);
        String cacheKey = cacheKey(workflow, context);
        long now = System.currentTimeMillis();
        if (cacheKey != null) {
            Plan cached;
            synchronized (lock) {
                cached = cache.get(cacheKey);
            }
            if (cached != null && now - cached.createdAt < cacheTtlMs) {
                cacheHits.incrementAndGet();
                logger.fine("Using cached optimization for workflow " + workflowId);
                return replay(workflow, cached);
            }
        }

        List<Step> current = new ArrayList<>(steps);
        List<String> applied = new ArrayList<>();
        for (Map.Entry<String, BiFunction<List<Step>, WorkflowContext, List<Step>>> rule : rules.entrySet()) {
            try {
                List<Step> rewritten = rule.getValue().apply(current, context);
                if (changed(current, rewritten)) {
                    applied.add(rule.getKey());
                    synchronized (lock) {
                        ruleApplications.merge(rule.getKey(), 1L, Long::sum);
                    }
                }
                current = rewritten;
            } catch (RuntimeException e) {
                logger.warning("Workflow optimization rule '" + rule.getKey() + "' failed for " + workflowId
                        + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Workflow optimization rule failure", e);
                }
            }
        }

        Plan plan = toPlan(steps, current, applied, now);
        optimizations.incrementAndGet();
        stepsRemoved.addAndGet(steps.size() - current.size());
        if (cacheKey != null) {
            synchronized (lock) {
                if (!cache.containsKey(cacheKey) && cache.size() >= maxCacheSize) {
                    Iterator<String> oldest = cache.keySet().iterator();
                    oldest.next();
                    oldest.remove();
                }
                cache.put(cacheKey, plan);
            }
        }

        logger.fine("Optimized workflow " + workflowId + ": " + steps.size() + " -> " + current.size()
                + " steps, applied " + applied);
        return build(workflow, current, applied);
    }

    public Map<String, Object> getStatistics() {
        synchronized (lock) {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("enabled", enabled);
            stats.put("optimizations", optimizations.get());
            stats.put("cacheHits", cacheHits.get());
            stats.put("cacheSize", cache.size());
            stats.put("maxCacheSize", maxCacheSize);
            stats.put("stepsRemoved", stepsRemoved.get());
            stats.put("ruleApplications", new LinkedHashMap<>(ruleApplications));
            stats.put("stepOptimizer", stepOptimizer.getStatistics());
            return stats;
        }
    }

    public StepOptimizer getStepOptimizer() {
        return stepOptimizer;
    }

    public void clearCache() {
        synchronized (lock) {
            cache.clear();
        }
        stepOptimizer.clearCache();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    // Rules

    /**
     * Stable phase ordering (setup first, cleanup last, other types after) that never moves a step
     * ahead of a step it depends on. Steps caught in a dependency cycle keep their relative order
     * at the end.
     */
    public static List<Step> reorderSteps(List<Step> steps) {
        int n = steps.size();
        if (n <= 1) {
            return steps;
        }
        Map<String, Integer> indexByName = new HashMap<>();
        for (int i = 0; i < n; i++) {
            indexByName.putIfAbsent(steps.get(i).getMetadata().getName(), i);
        }
        List<List<Integer>> dependents = new ArrayList<>();
        int[] pending = new int[n];
        for (int i = 0; i < n; i++) {
            dependents.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            Set<Integer> seen = new HashSet<>();
            for (String dependency : steps.get(i).getMetadata().getDependencies()) {
                Integer target = indexByName.get(dependency);
                if (target != null && target != i && seen.add(target)) {
                    dependents.get(target).add(i);
                    pending[i]++;
                }
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>((a, b) -> {
            int byPhase = Integer.compare(steps.get(a).getMetadata().getType().getPhaseOrder(),
                    steps.get(b).getMetadata().getType().getPhaseOrder());
            return byPhase != 0 ? byPhase : Integer.compare(a, b);
        });
        for (int i = 0; i < n; i++) {
            if (pending[i] == 0) {
                ready.add(i);
            }
        }
        List<Step> ordered = new ArrayList<>(n);
        boolean[] placed = new boolean[n];
        while (!ready.isEmpty()) {
            int next = ready.poll();
            ordered.add(steps.get(next));
            placed[next] = true;
            for (int dependent : dependents.get(next)) {
                if (--pending[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (ordered.size() < n) {
            logger.warning("Dependency cycle among workflow steps; " + (n - ordered.size())
                    + " steps keep their declared order");
            for (int i = 0; i < n; i++) {
                if (!placed[i]) {
                    ordered.add(steps.get(i));
                }
            }
        }
        return ordered;
    }

    static List<Step> removeRedundantSteps(List<Step> steps, WorkflowContext context) {
        Set<String> seen = new HashSet<>();
        List<Step> kept = new ArrayList<>(steps.size());
        for (Step step : steps) {
            StepMetadata metadata = step.getMetadata();
            String key = metadata.getType().getValue() + "_" + metadata.getName() + "_" + metadata.getParameters();
            if (!seen.add(key)) {
                continue;
            }
            if (metadata.isDisabled() || !conditionsMet(metadata, context)) {
                continue;
            }
            kept.add(step);
        }
        return kept;
    }

    private List<Step> optimizeParameters(List<Step> steps, WorkflowContext context) {
        List<Step> optimized = new ArrayList<>(steps.size());
        for (Step step : steps) {
            optimized.add(stepOptimizer.optimizeStep(step, context));
        }
        return optimized;
    }

    static boolean conditionsMet(StepMetadata metadata, WorkflowContext context) {
        for (Map.Entry<String, Object> condition : metadata.getConditions().entrySet()) {
            if (!Objects.equals(context.getData(condition.getKey()), condition.getValue())) {
                return false;
            }
        }
        return true;
    }

    // Helpers

    private static boolean changed(List<Step> before, List<Step> after) {
        if (before.size() != after.size()) {
            return true;
        }
        for (int i = 0; i < before.size(); i++) {
            if (before.get(i) != after.get(i)
                    && !before.get(i).getMetadata().equals(after.get(i).getMetadata())) {
                return true;
            }
        }
        return false;
    }

    private static Plan toPlan(List<Step> original, List<Step> result, List<String> applied, long now) {
        Map<Step, Integer> indexOf = new IdentityHashMap<>();
        for (int i = 0; i < original.size(); i++) {
            indexOf.putIfAbsent(original.get(i), i);
        }
        List<Integer> order = new ArrayList<>(result.size());
        List<StepMetadata> metadata = new ArrayList<>(result.size());
        for (Step step : result) {
            Step source = step instanceof OptimizedStep ? ((OptimizedStep) step).getOriginal() : step;
            order.add(indexOf.get(source));
            metadata.add(step.getMetadata());
        }
        return new Plan(List.copyOf(order), List.copyOf(metadata), List.copyOf(applied), now);
    }

    private static Workflow replay(Workflow workflow, Plan plan) {
        List<Step> steps = workflow.getSteps();
        List<Step> rebuilt = new ArrayList<>(plan.order.size());
        for (int i = 0; i < plan.order.size(); i++) {
            Step source = steps.get(plan.order.get(i));
            StepMetadata metadata = plan.metadata.get(i);
            rebuilt.add(metadata.equals(source.getMetadata()) ? source : new OptimizedStep(source, metadata));
        }
        return build(workflow, rebuilt, plan.applied);
    }

    private static Workflow build(Workflow workflow, List<Step> steps, List<String> applied) {
        WorkflowMetadata metadata = workflow.getMetadata().toBuilder()
                .steps(steps)
                .attribute(ATTR_OPTIMIZED, true)
                .attribute(ATTR_ORIGINAL_STEP_COUNT, workflow.getSteps().size())
                .build();
        return new OptimizedWorkflow(workflow, metadata, applied);
    }

    /**
     * Null when the outcome depends on context entries outside the fingerprint, i.e. when any step
     * declares conditions.
     */
    private String cacheKey(Workflow workflow, WorkflowContext context) {
        List<StepMetadata> metadata = new ArrayList<>();
        for (Step step : workflow.getSteps()) {
            if (!step.getMetadata().getConditions().isEmpty()) {
                return null;
            }
            metadata.add(step.getMetadata());
        }
        return keyGenerator.hashWorkflow(workflow) + "_" + Integer.toHexString(metadata.hashCode())
                + "_" + keyGenerator.hashContext(context)
                + "_" + context.isEnabled(StepOptimizer.FAST_MODE)
                + "_" + context.isEnabled(StepOptimizer.PRODUCTION_MODE);
    }
}
