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
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.WorkflowContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tunes a single step before it runs.
 *
 * <p>Three rules are applied in order: parameter tuning, execution strategy hint and resource
 * right-sizing. Each rule rewrites the step metadata; a rule counts as applied only when it lowers
 * the step's complexity, expected duration or resource intensity. The context flags
 * {@code fastMode} and {@code productionMode} bias the tuning.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class StepOptimizer {

    private static final Logger logger = Logger.getLogger(StepOptimizer.class.getName());

    public static final String RULE_PARAMETERS = "parameter_optimization";
    public static final String RULE_EXECUTION_STRATEGY = "execution_strategy";
    public static final String RULE_RESOURCES = "resource_optimization";

    public static final String FAST_MODE = "fastMode";
    public static final String PRODUCTION_MODE = "productionMode";

    static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(30);
    static final int DEFAULT_MAX_CACHE_SIZE = 1000;
    static final int MAX_HISTORY = 1000;

    private static final long DEFAULT_DURATION_MS = 60_000;
    private static final long MAX_STEP_TIMEOUT_MS = 300_000;
    private static final long MAX_RETRIES = 5;

    private static final class Measure {
        final long complexity;
        final long durationMs;
        final long intensity;

        Measure(StepMetadata metadata) {
            this.complexity = StepProfiles.complexity(metadata);
            this.durationMs = metadata.getLongParameter(StepProfiles.PARAM_TIMEOUT, DEFAULT_DURATION_MS);
            this.intensity = StepProfiles.resourceIntensity(metadata);
        }

        boolean isImprovedBy(Measure after) {
            return after.complexity < complexity || after.durationMs < durationMs || after.intensity < intensity;
        }

        /**
         * Largest relative reduction across the three measures, in percent.
         */
        double improvementTo(Measure after) {
            return Math.max(reduction(complexity, after.complexity),
                    Math.max(reduction(durationMs, after.durationMs), reduction(intensity, after.intensity)));
        }

        private static double reduction(long before, long after) {
            return before > 0 ? (before - after) * 100.0 / before : 0.0;
        }
    }

    private static final class CachedStep {
        final StepMetadata metadata;
        final long cachedAt;

        CachedStep(StepMetadata metadata, long cachedAt) {
            this.metadata = metadata;
            this.cachedAt = cachedAt;
        }
    }

    private final Object lock = new Object();
    private final Map<String, BiFunction<StepMetadata, WorkflowContext, StepMetadata>> rules = new LinkedHashMap<>();
    private final Map<String, CachedStep> cache = new LinkedHashMap<>();
    private final Map<String, Map<String, Double>> history = new LinkedHashMap<>();

    private final long cacheTtlMs;
    private final int maxCacheSize;
    private volatile boolean enabled;
    private volatile boolean learning;

    public StepOptimizer() {
        this(true, true, DEFAULT_CACHE_TTL, DEFAULT_MAX_CACHE_SIZE);
    }

    public StepOptimizer(SequorConfiguration configuration) {
        this(configuration.isOptimizationEnabled(), true, DEFAULT_CACHE_TTL, DEFAULT_MAX_CACHE_SIZE);
    }

    public StepOptimizer(boolean enabled, boolean learning, Duration cacheTtl, int maxCacheSize) {
        if (maxCacheSize < 1) {
            throw new IllegalArgumentException("maxCacheSize must be at least 1");
        }
        this.enabled = enabled;
        this.learning = learning;
        this.cacheTtlMs = cacheTtl.toMillis();
        this.maxCacheSize = maxCacheSize;

        rules.put(RULE_PARAMETERS, StepOptimizer::tuneParameters);
        rules.put(RULE_EXECUTION_STRATEGY, StepOptimizer::chooseExecutionStrategy);
        rules.put(RULE_RESOURCES, StepOptimizer::sizeResources);
    }

    /**
     * @return an {@link OptimizedStep} wrapping {@code step}, or {@code step} itself when disabled
     */
    public Step optimizeStep(Step step, WorkflowContext context) {
        Objects.requireNonNull(step, "step cannot be null");
        Objects.requireNonNull(context, "context cannot be null");
        if (!enabled) {
            return step;
        }

        Step original = step instanceof OptimizedStep ? ((OptimizedStep) step).getOriginal() : step;
        StepMetadata metadata = step.getMetadata();
        String cacheKey = cacheKey(metadata, context);
        long now = System.currentTimeMillis();

        synchronized (lock) {
            CachedStep cached = cache.get(cacheKey);
            if (cached != null && now - cached.cachedAt < cacheTtlMs) {
                return new OptimizedStep(original, cached.metadata);
            }
        }

        StepMetadata optimized = metadata;
        Map<String, Double> applied = new LinkedHashMap<>();
        for (Map.Entry<String, BiFunction<StepMetadata, WorkflowContext, StepMetadata>> rule : rules.entrySet()) {
            try {
                Measure before = new Measure(optimized);
                StepMetadata candidate = rule.getValue().apply(optimized, context);
                Measure after = new Measure(candidate);
                if (before.isImprovedBy(after)) {
                    applied.put(rule.getKey(), before.improvementTo(after));
                }
                optimized = candidate;
            } catch (RuntimeException e) {
                logger.warning("Step optimization rule '" + rule.getKey() + "' failed for step "
                        + metadata.getName() + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Step optimization rule failure", e);
                }
            }
        }

        synchronized (lock) {
            if (!cache.containsKey(cacheKey) && cache.size() >= maxCacheSize) {
                Iterator<String> oldest = cache.keySet().iterator();
                oldest.next();
                oldest.remove();
            }
            cache.put(cacheKey, new CachedStep(optimized, now));
            if (learning && !applied.isEmpty()) {
                history.remove(metadata.getStepId());
                history.put(metadata.getStepId(), applied);
                Iterator<String> oldest = history.keySet().iterator();
                while (history.size() > MAX_HISTORY && oldest.hasNext()) {
                    oldest.next();
                    oldest.remove();
                }
            }
        }

        logger.fine("Optimized step " + metadata.getStepId() + ": " + applied.size() + " rules improved it");
        return new OptimizedStep(original, optimized);
    }

    /**
     * Rules that improved the step on its last optimization, with the improvement in percent.
     * Empty when the step was never improved.
     */
    public Map<String, Double> getAppliedRules(String stepId) {
        synchronized (lock) {
            Map<String, Double> applied = history.get(stepId);
            return applied != null ? Map.copyOf(applied) : Map.of();
        }
    }

    public List<String> getRuleNames() {
        return new ArrayList<>(rules.keySet());
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

    // Rules

    static StepMetadata tuneParameters(StepMetadata metadata, WorkflowContext context) {
        Map<String, Object> params = new LinkedHashMap<>(metadata.getParameters());
        switch (metadata.getType()) {
            case ANALYSIS:
                params.put(StepProfiles.PARAM_TIMEOUT,
                        Math.min(metadata.getLongParameter(StepProfiles.PARAM_TIMEOUT, 60_000), 300_000L));
                params.put(StepProfiles.PARAM_PARALLEL, true);
                break;
            case PROCESSING:
                params.put(StepProfiles.PARAM_BATCH_SIZE,
                        Math.max(metadata.getLongParameter(StepProfiles.PARAM_BATCH_SIZE, 100), 50L));
                params.put(StepProfiles.PARAM_RETRIES,
                        Math.min(metadata.getLongParameter(StepProfiles.PARAM_RETRIES, 3), MAX_RETRIES));
                break;
            case TESTING:
                params.put(StepProfiles.PARAM_TIMEOUT,
                        Math.min(metadata.getLongParameter(StepProfiles.PARAM_TIMEOUT, 30_000), 120_000L));
                params.put(StepProfiles.PARAM_PARALLEL, true);
                break;
            case DEPLOYMENT:
                params.put("rollback", !Boolean.FALSE.equals(params.get("rollback")));
                params.put("healthCheck", !Boolean.FALSE.equals(params.get("healthCheck")));
                break;
            default:
                if (metadata.hasParameter(StepProfiles.PARAM_TIMEOUT)) {
                    params.put(StepProfiles.PARAM_TIMEOUT,
                            Math.min(metadata.getLongParameter(StepProfiles.PARAM_TIMEOUT, 0), MAX_STEP_TIMEOUT_MS));
                }
                if (metadata.hasParameter(StepProfiles.PARAM_RETRIES)) {
                    params.put(StepProfiles.PARAM_RETRIES,
                            Math.min(metadata.getLongParameter(StepProfiles.PARAM_RETRIES, 0), MAX_RETRIES));
                }
                break;
        }

        if (context.isEnabled(FAST_MODE)) {
            params.put(StepProfiles.PARAM_TIMEOUT,
                    Math.min(StepProfiles.longValue(params.get(StepProfiles.PARAM_TIMEOUT), 60_000), 30_000L));
            params.put(StepProfiles.PARAM_PARALLEL, true);
        }
        if (context.isEnabled(PRODUCTION_MODE)) {
            params.put(StepProfiles.PARAM_RETRIES,
                    Math.max(StepProfiles.longValue(params.get(StepProfiles.PARAM_RETRIES), 1), 3L));
            params.put("rollback", true);
        }

        return metadata.toBuilder()
                .parameters(params)
                .attribute(StepMetadata.ATTR_OPTIMIZED, true)
                .build();
    }

    static StepMetadata chooseExecutionStrategy(StepMetadata metadata, WorkflowContext context) {
        String strategy;
        switch (metadata.getType()) {
            case ANALYSIS:
            case TESTING:
                strategy = metadata.getBooleanParameter(StepProfiles.PARAM_PARALLEL) ? "parallel" : "sequential";
                break;
            case PROCESSING:
                strategy = metadata.getLongParameter(StepProfiles.PARAM_BATCH_SIZE, 0) > 100 ? "batch" : "sequential";
                break;
            case DEPLOYMENT:
                strategy = "rolling";
                break;
            default:
                strategy = "sequential";
                break;
        }
        return metadata.toBuilder()
                .attribute(StepMetadata.ATTR_EXECUTION_STRATEGY, strategy)
                .attribute(StepMetadata.ATTR_OPTIMIZED, true)
                .build();
    }

    static StepMetadata sizeResources(StepMetadata metadata, WorkflowContext context) {
        ResourceEstimate estimate = StepProfiles.resources(metadata);
        long memory = estimate.getMemoryMb();
        double cpu = estimate.getCpuPercent();
        long timeout = estimate.getTimeoutMs();
        if (context.isEnabled(FAST_MODE)) {
            timeout = Math.min(timeout, 60_000);
            memory = Math.min(memory, 256);
        }
        if (context.isEnabled(PRODUCTION_MODE)) {
            memory = Math.max(memory, 128);
            cpu = Math.max(cpu, 15);
        }
        return metadata.toBuilder()
                .attribute(StepMetadata.ATTR_RESOURCE_REQUIREMENTS, new ResourceEstimate(memory, cpu, timeout).toMap())
                .attribute(StepMetadata.ATTR_OPTIMIZED, true)
                .build();
    }

    private static String cacheKey(StepMetadata metadata, WorkflowContext context) {
        return metadata.getStepId() + "|" + metadata.getParameters().hashCode()
                + "|fast=" + context.isEnabled(FAST_MODE)
                + "|production=" + context.isEnabled(PRODUCTION_MODE);
    }
}
