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

public final class CacheStatistics {

    private final int size;
    private final int maxSize;
    private final long ttlMs;
    private final long hits;
    private final long misses;
    private final long sets;
    private final long rejections;
    private final long evictions;
    private final long stepHits;
    private final long stepMisses;
    private final long totalSizeBytes;
    private final boolean enabled;

    CacheStatistics(int size, int maxSize, long ttlMs, long hits, long misses, long sets, long rejections,
                    long evictions, long stepHits, long stepMisses, long totalSizeBytes, boolean enabled) {
        this.size = size;
        this.maxSize = maxSize;
        this.ttlMs = ttlMs;
        this.hits = hits;
        this.misses = misses;
        this.sets = sets;
        this.rejections = rejections;
        this.evictions = evictions;
        this.stepHits = stepHits;
        this.stepMisses = stepMisses;
        this.totalSizeBytes = totalSizeBytes;
        this.enabled = enabled;
    }

    public int getSize() {
        return size;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getTtlMs() {
        return ttlMs;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getSets() {
        return sets;
    }

    public long getRejections() {
        return rejections;
    }

    public long getEvictions() {
        return evictions;
    }

    public long getStepHits() {
        return stepHits;
    }

    public long getStepMisses() {
        return stepMisses;
    }

    public long getTotalSizeBytes() {
        return totalSizeBytes;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Workflow-level hit rate between 0 and 1.
     */
    public double getHitRate() {
        long requests = hits + misses;
        return requests > 0 ? (double) hits / requests : 0.0;
    }

    public double getAverageSizeBytes() {
        return size > 0 ? (double) totalSizeBytes / size : 0.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("size", size);
        map.put("maxSize", maxSize);
        map.put("ttlMs", ttlMs);
        map.put("hits", hits);
        map.put("misses", misses);
        map.put("sets", sets);
        map.put("rejections", rejections);
        map.put("evictions", evictions);
        map.put("stepHits", stepHits);
        map.put("stepMisses", stepMisses);
        map.put("hitRate", getHitRate());
        map.put("totalSizeBytes", totalSizeBytes);
        map.put("averageSizeBytes", getAverageSizeBytes());
        map.put("enabled", enabled);
        return map;
    }

    @Override
    public String toString() {
        return "CacheStatistics" + toMap();
    }
}
