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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A cached value with its bookkeeping. Access statistics are mutated under the cache lock.
 *
 * @param <V> the cached value type
 */
public final class CacheEntry<V> {

    public enum Kind {
        WORKFLOW,
        STEP
    }

    private final String key;
    private final Kind kind;
    private final V value;
    private final String workflowName;
    private final String workflowVersion;
    private final String contextHash;
    private final long createdAt;
    private final long ttlMs;
    private final int sizeBytes;
    private final double valueScore;
    private long lastAccessedAt;
    private long hitCount;

    CacheEntry(String key, Kind kind, V value, String workflowName, String workflowVersion,
               String contextHash, long createdAt, long ttlMs, int sizeBytes, double valueScore) {
        this.key = key;
        this.kind = kind;
        this.value = value;
        this.workflowName = workflowName;
        this.workflowVersion = workflowVersion;
        this.contextHash = contextHash;
        this.createdAt = createdAt;
        this.ttlMs = ttlMs;
        this.sizeBytes = sizeBytes;
        this.valueScore = valueScore;
        this.lastAccessedAt = createdAt;
    }

    public String getKey() {
        return key;
    }

    public Kind getKind() {
        return kind;
    }

    public V getValue() {
        return value;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getWorkflowVersion() {
        return workflowVersion;
    }

    public String getContextHash() {
        return contextHash;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getTtlMs() {
        return ttlMs;
    }

    public int getSizeBytes() {
        return sizeBytes;
    }

    public double getValueScore() {
        return valueScore;
    }

    public long getLastAccessedAt() {
        return lastAccessedAt;
    }

    public long getHitCount() {
        return hitCount;
    }

    public long getAgeMs(long now) {
        return now - createdAt;
    }

    /**
     * An entry is served only while its age is strictly below its TTL.
     */
    public boolean isExpired(long now) {
        return getAgeMs(now) >= ttlMs;
    }

    void recordHit(long now) {
        lastAccessedAt = now;
        hitCount++;
    }

    Map<String, Object> toSummary(long now) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("key", key.length() > 20 ? key.substring(0, 20) + "..." : key);
        summary.put("kind", kind.name().toLowerCase());
        summary.put("workflowName", workflowName);
        summary.put("workflowVersion", workflowVersion);
        summary.put("createdAt", createdAt);
        summary.put("ageMs", getAgeMs(now));
        summary.put("sizeBytes", sizeBytes);
        summary.put("hitCount", hitCount);
        return summary;
    }
}
