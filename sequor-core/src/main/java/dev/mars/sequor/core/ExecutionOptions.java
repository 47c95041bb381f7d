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

package dev.mars.sequor.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-call options for {@code executeWorkflow}.
 * Unset values (null) fall back to the engine configuration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public final class ExecutionOptions {

    private static final int BASE_PRIORITY = 1;
    private static final int CRITICAL_BOOST = 10;
    private static final int URGENT_BOOST = 3;

    private final String strategy;
    private final PriorityLevel priority;
    private final boolean critical;
    private final boolean urgent;
    private final Duration timeout;
    private final Duration cacheTtl;
    private final boolean useCache;
    private final boolean excludeSensitiveFromCache;
    private final boolean compressCache;
    private final Integer maxRetries;
    private final Duration retryDelay;
    private final List<String> dependencies;
    private final ResourceRequest resources;
    private final boolean optimize;
    private final Map<String, Object> constraints;

    private ExecutionOptions(Builder builder) {
        this.strategy = builder.strategy;
        this.priority = builder.priority != null ? builder.priority : PriorityLevel.NORMAL;
        this.critical = builder.critical;
        this.urgent = builder.urgent;
        this.timeout = builder.timeout;
        this.cacheTtl = builder.cacheTtl;
        this.useCache = builder.useCache;
        this.excludeSensitiveFromCache = builder.excludeSensitiveFromCache;
        this.compressCache = builder.compressCache;
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.dependencies = List.copyOf(builder.dependencies);
        this.resources = builder.resources;
        this.optimize = builder.optimize;
        this.constraints = Collections.unmodifiableMap(new LinkedHashMap<>(builder.constraints));
    }

    public static ExecutionOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Numeric priority used by the queue and the scheduler (higher runs first).
     * Starts at 1; critical adds 10, HIGH adds 5, urgent adds 3 and LOW subtracts 2.
     * Never below 1.
     */
    public int getEffectivePriority() {
        int value = BASE_PRIORITY;
        if (critical) {
            value += CRITICAL_BOOST;
        }
        if (urgent) {
            value += URGENT_BOOST;
        }
        value += priority.getAdjustment();
        return Math.max(BASE_PRIORITY, value);
    }

    public String getStrategy() {
        return strategy;
    }

    public PriorityLevel getPriority() {
        return priority;
    }

    public boolean isCritical() {
        return critical;
    }

    public boolean isUrgent() {
        return urgent;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public boolean isUseCache() {
        return useCache;
    }

    public boolean isExcludeSensitiveFromCache() {
        return excludeSensitiveFromCache;
    }

    public boolean isCompressCache() {
        return compressCache;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public ResourceRequest getResources() {
        return resources;
    }

    public boolean isOptimize() {
        return optimize;
    }

    public Map<String, Object> getConstraints() {
        return constraints;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .strategy(strategy)
                .priority(priority)
                .critical(critical)
                .urgent(urgent)
                .timeout(timeout)
                .cacheTtl(cacheTtl)
                .useCache(useCache)
                .excludeSensitiveFromCache(excludeSensitiveFromCache)
                .compressCache(compressCache)
                .retryDelay(retryDelay)
                .dependencies(dependencies)
                .resources(resources)
                .optimize(optimize)
                .constraints(constraints);
        builder.maxRetries = maxRetries;
        return builder;
    }

    @Override
    public String toString() {
        return "ExecutionOptions{" +
               "strategy='" + strategy + '\'' +
               ", priority=" + priority +
               ", critical=" + critical +
               ", urgent=" + urgent +
               ", timeout=" + timeout +
               ", useCache=" + useCache +
               ", maxRetries=" + maxRetries +
               ", dependencies=" + dependencies +
               '}';
    }

    /**
     * Builder for ExecutionOptions.
     */
    public static class Builder {
        private String strategy;
        private PriorityLevel priority = PriorityLevel.NORMAL;
        private boolean critical;
        private boolean urgent;
        private Duration timeout;
        private Duration cacheTtl;
        private boolean useCache = true;
        private boolean excludeSensitiveFromCache;
        private boolean compressCache;
        private Integer maxRetries;
        private Duration retryDelay;
        private final List<String> dependencies = new ArrayList<>();
        private ResourceRequest resources;
        private boolean optimize;
        private final Map<String, Object> constraints = new LinkedHashMap<>();

        public Builder strategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder priority(PriorityLevel priority) {
            this.priority = priority;
            return this;
        }

        public Builder critical(boolean critical) {
            this.critical = critical;
            return this;
        }

        public Builder urgent(boolean urgent) {
            this.urgent = urgent;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder useCache(boolean useCache) {
            this.useCache = useCache;
            return this;
        }

        public Builder excludeSensitiveFromCache(boolean excludeSensitiveFromCache) {
            this.excludeSensitiveFromCache = excludeSensitiveFromCache;
            return this;
        }

        public Builder compressCache(boolean compressCache) {
            this.compressCache = compressCache;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries cannot be negative: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies.clear();
            if (dependencies != null) {
                this.dependencies.addAll(dependencies);
            }
            return this;
        }

        public Builder dependsOn(String executionId) {
            this.dependencies.add(executionId);
            return this;
        }

        public Builder resources(ResourceRequest resources) {
            this.resources = resources;
            return this;
        }

        public Builder optimize(boolean optimize) {
            this.optimize = optimize;
            return this;
        }

        public Builder constraints(Map<String, Object> constraints) {
            this.constraints.clear();
            if (constraints != null) {
                this.constraints.putAll(constraints);
            }
            return this;
        }

        public Builder constraint(String key, Object value) {
            this.constraints.put(key, value);
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
