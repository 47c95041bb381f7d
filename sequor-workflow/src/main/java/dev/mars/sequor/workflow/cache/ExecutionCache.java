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

package dev.mars.sequor.workflow.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.sequor.config.SequorConfiguration;
import dev.mars.sequor.core.ExecutionResult;
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.WorkflowMetadata;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, TTL-based cache of execution results keyed by workflow and context fingerprints.
 * <p>
 * Results are admitted only when successful and large and structured enough to be worth
 * keeping. When the cache is full the least-recently-accessed entry is evicted. Cacheable
 * steps share the same store under a separate key space.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class ExecutionCache {

    private static final Logger logger = Logger.getLogger(ExecutionCache.class.getName());

    private final int maxSize;
    private final long defaultTtlMs;
    private final int defaultMinSizeBytes;
    private final int defaultMinComplexity;
    private final CacheKeyGenerator keyGenerator;
    private final ObjectMapper objectMapper;

    // Access-ordered: iteration starts at the least-recently-used entry
    private final LinkedHashMap<String, CacheEntry<?>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Object lock = new Object();

    private volatile boolean enabled = true;
    private long hits;
    private long misses;
    private long sets;
    private long rejections;
    private long evictions;
    private long stepHits;
    private long stepMisses;
    private long totalSizeBytes;

    public ExecutionCache() {
        this(1000, Duration.ofHours(1), 100, 1);
    }

    public ExecutionCache(SequorConfiguration configuration) {
        this(configuration.getCacheMaxSize(), Duration.ofMillis(configuration.getCacheTtlMs()),
                configuration.getCacheMinSizeBytes(), configuration.getCacheMinComplexity());
        this.enabled = configuration.isCacheEnabled();
    }

    public ExecutionCache(int maxSize, Duration defaultTtl, int defaultMinSizeBytes, int defaultMinComplexity) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.defaultTtlMs = Objects.requireNonNull(defaultTtl, "Default TTL cannot be null").toMillis();
        this.defaultMinSizeBytes = defaultMinSizeBytes;
        this.defaultMinComplexity = defaultMinComplexity;
        this.keyGenerator = new CacheKeyGenerator();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Look up a live result for the workflow and context.
     */
    public Optional<ExecutionResult> get(Workflow workflow, WorkflowContext context) {
        if (!enabled) {
            return Optional.empty();
        }
        String key = keyGenerator.workflowKey(workflow, context);
        Optional<ExecutionResult> result = lookup(key, ExecutionResult.class);
        synchronized (lock) {
            if (result.isPresent()) {
                hits++;
            } else {
                misses++;
            }
        }
        if (result.isPresent()) {
            logger.fine("Cache hit for workflow " + workflow.getName() + " (" + abbreviate(key) + ")");
        }
        return result;
    }

    /**
     * Store a result if it passes admission.
     *
     * @return true when the result was stored
     */
    public boolean put(Workflow workflow, WorkflowContext context, ExecutionResult result, CacheOptions options) {
        if (!enabled || result == null) {
            return false;
        }
        CacheOptions effective = options != null ? options : CacheOptions.defaults();
        String key = keyGenerator.workflowKey(workflow, context);

        String rejection = checkAdmission(result, effective);
        if (rejection != null) {
            synchronized (lock) {
                rejections++;
            }
            logger.fine("Result for " + workflow.getName() + " not cached: " + rejection);
            return false;
        }

        ExecutionResult prepared = ResultSanitizer.prepare(result, effective.isExcludeSensitive(), effective.isCompress());
        WorkflowMetadata metadata = workflow.getMetadata();
        store(new CacheEntry<>(key, CacheEntry.Kind.WORKFLOW, prepared, metadata.getName(), metadata.getVersion(),
                keyGenerator.hashContext(context), System.currentTimeMillis(), ttlOf(effective),
                sizeOf(prepared), effective.getValueScore()));
        return true;
    }

    /**
     * Look up a cached outcome of a single step.
     */
    public Optional<StepResult> getStepResult(Step step, WorkflowContext context) {
        if (!enabled) {
            return Optional.empty();
        }
        Optional<StepResult> result = lookup(keyGenerator.stepKey(step, context), StepResult.class);
        synchronized (lock) {
            if (result.isPresent()) {
                stepHits++;
            } else {
                stepMisses++;
            }
        }
        return result;
    }

    /**
     * Store the outcome of a successful step. Size and complexity thresholds do not apply to steps.
     */
    public boolean putStepResult(Step step, WorkflowContext context, StepResult result, CacheOptions options) {
        if (!enabled || result == null || !result.isSuccessful()) {
            return false;
        }
        CacheOptions effective = options != null ? options : CacheOptions.defaults();
        StepResult prepared = ResultSanitizer.prepare(result, effective.isExcludeSensitive(), effective.isCompress());
        String key = keyGenerator.stepKey(step, context);
        store(new CacheEntry<>(key, CacheEntry.Kind.STEP, prepared, step.getMetadata().getName(),
                step.getMetadata().getVersion(), keyGenerator.hashContext(context), System.currentTimeMillis(),
                ttlOf(effective), sizeOf(prepared), effective.getValueScore()));
        return true;
    }

    public boolean invalidate(String key) {
        synchronized (lock) {
            CacheEntry<?> removed = entries.remove(key);
            if (removed != null) {
                totalSizeBytes -= removed.getSizeBytes();
                return true;
            }
            return false;
        }
    }

    /**
     * Remove every entry matching the predicate.
     *
     * @return number of entries removed
     */
    public int invalidateEntries(Predicate<CacheEntry<?>> predicate) {
        int removed = 0;
        synchronized (lock) {
            Iterator<CacheEntry<?>> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                CacheEntry<?> entry = iterator.next();
                if (predicate.test(entry)) {
                    iterator.remove();
                    totalSizeBytes -= entry.getSizeBytes();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            logger.info("Invalidated " + removed + " cache entries");
        }
        return removed;
    }

    public int invalidateByWorkflow(String workflowName, String workflowVersion) {
        return invalidateEntries(entry -> entry.getKind() == CacheEntry.Kind.WORKFLOW
                && Objects.equals(entry.getWorkflowName(), workflowName)
                && Objects.equals(entry.getWorkflowVersion(), workflowVersion));
    }

    public int invalidateByAge(Duration maxAge) {
        long cutoff = System.currentTimeMillis() - maxAge.toMillis();
        return invalidateEntries(entry -> entry.getCreatedAt() < cutoff);
    }

    /**
     * Drop expired entries.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        long now = System.currentTimeMillis();
        int removed = invalidateEntries(entry -> entry.isExpired(now));
        if (removed > 0) {
            logger.fine("Cache cleanup removed " + removed + " expired entries");
        }
        return removed;
    }

    /**
     * Summaries of the newest entries, newest first.
     */
    public List<Map<String, Object>> getCacheEntries(int limit) {
        long now = System.currentTimeMillis();
        List<CacheEntry<?>> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(entries.values());
        }
        snapshot.sort(Comparator.comparingLong((CacheEntry<?> e) -> e.getCreatedAt()).reversed());
        List<Map<String, Object>> summaries = new ArrayList<>();
        for (CacheEntry<?> entry : snapshot) {
            if (summaries.size() >= limit) {
                break;
            }
            summaries.add(entry.toSummary(now));
        }
        return summaries;
    }

    public CacheStatistics getStatistics() {
        synchronized (lock) {
            return new CacheStatistics(entries.size(), maxSize, defaultTtlMs, hits, misses, sets, rejections,
                    evictions, stepHits, stepMisses, totalSizeBytes, enabled);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
            totalSizeBytes = 0;
        }
        logger.info("Execution cache cleared");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        if (!enabled) {
            clear();
        }
    }

    public String keyFor(Workflow workflow, WorkflowContext context) {
        return keyGenerator.workflowKey(workflow, context);
    }

    /**
     * Structural complexity of a result: one plus the number of keys and elements, counted recursively.
     */
    int complexityOf(Object value) {
        try {
            return complexity(objectMapper.valueToTree(value));
        } catch (IllegalArgumentException e) {
            logger.fine("Could not measure result complexity: " + e.getMessage());
            return 0;
        }
    }

    int sizeOf(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            logger.fine("Could not measure result size: " + e.getOriginalMessage());
            return 0;
        }
    }

    private String checkAdmission(ExecutionResult result, CacheOptions options) {
        if (!result.isSuccess()) {
            return "result is unsuccessful";
        }
        int minSize = options.getMinSizeBytes() != null ? options.getMinSizeBytes() : defaultMinSizeBytes;
        int size = sizeOf(result);
        if (size < minSize) {
            return "size " + size + " below " + minSize + " bytes";
        }
        int minComplexity = options.getMinComplexity() != null ? options.getMinComplexity() : defaultMinComplexity;
        int complexity = complexityOf(result);
        if (complexity < minComplexity) {
            return "complexity " + complexity + " below " + minComplexity;
        }
        return null;
    }

    private <V> Optional<V> lookup(String key, Class<V> type) {
        long now = System.currentTimeMillis();
        synchronized (lock) {
            CacheEntry<?> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                totalSizeBytes -= entry.getSizeBytes();
                return Optional.empty();
            }
            if (!type.isInstance(entry.getValue())) {
                return Optional.empty();
            }
            entry.recordHit(now);
            return Optional.of(type.cast(entry.getValue()));
        }
    }

    private void store(CacheEntry<?> entry) {
        synchronized (lock) {
            CacheEntry<?> previous = entries.remove(entry.getKey());
            if (previous != null) {
                totalSizeBytes -= previous.getSizeBytes();
            } else if (entries.size() >= maxSize) {
                evictLeastRecentlyUsed();
            }
            entries.put(entry.getKey(), entry);
            totalSizeBytes += entry.getSizeBytes();
            sets++;
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Cached " + entry.getKind().name().toLowerCase() + " result " + abbreviate(entry.getKey()) +
                    " (" + entry.getSizeBytes() + " bytes)");
        }
    }

    // Caller must hold the lock
    private void evictLeastRecentlyUsed() {
        Iterator<Map.Entry<String, CacheEntry<?>>> iterator = entries.entrySet().iterator();
        if (iterator.hasNext()) {
            Map.Entry<String, CacheEntry<?>> eldest = iterator.next();
            iterator.remove();
            totalSizeBytes -= eldest.getValue().getSizeBytes();
            evictions++;
            logger.fine("Evicted least recently used entry " + abbreviate(eldest.getKey()));
        }
    }

    private long ttlOf(CacheOptions options) {
        return options.getTtl() != null ? options.getTtl().toMillis() : defaultTtlMs;
    }

    private static int complexity(JsonNode node) {
        if (node == null || !node.isContainerNode()) {
            return 0;
        }
        int complexity = 1 + node.size();
        for (JsonNode child : node) {
            if (child.isContainerNode()) {
                complexity += complexity(child);
            }
        }
        return complexity;
    }

    private static String abbreviate(String key) {
        return key.length() > 20 ? key.substring(0, 20) + "..." : key;
    }
}
