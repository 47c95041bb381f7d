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

import dev.mars.sequor.core.ExecutionOptions;

import java.time.Duration;

/**
 * Per-put caching options. Null values fall back to the cache defaults.
 */
public final class CacheOptions {

    private final Duration ttl;
    private final boolean excludeSensitive;
    private final boolean compress;
    private final Integer minSizeBytes;
    private final Integer minComplexity;
    private final double valueScore;

    private CacheOptions(Builder builder) {
        this.ttl = builder.ttl;
        this.excludeSensitive = builder.excludeSensitive;
        this.compress = builder.compress;
        this.minSizeBytes = builder.minSizeBytes;
        this.minComplexity = builder.minComplexity;
        this.valueScore = builder.valueScore;
    }

    public static CacheOptions defaults() {
        return new Builder().build();
    }

    public static CacheOptions fromExecutionOptions(ExecutionOptions options) {
        if (options == null) {
            return defaults();
        }
        return new Builder()
                .ttl(options.getCacheTtl())
                .excludeSensitive(options.isExcludeSensitiveFromCache())
                .compress(options.isCompressCache())
                .build();
    }

    public Duration getTtl() {
        return ttl;
    }

    public boolean isExcludeSensitive() {
        return excludeSensitive;
    }

    public boolean isCompress() {
        return compress;
    }

    public Integer getMinSizeBytes() {
        return minSizeBytes;
    }

    public Integer getMinComplexity() {
        return minComplexity;
    }

    public double getValueScore() {
        return valueScore;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration ttl;
        private boolean excludeSensitive;
        private boolean compress;
        private Integer minSizeBytes;
        private Integer minComplexity;
        private double valueScore = 1.0;

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder excludeSensitive(boolean excludeSensitive) {
            this.excludeSensitive = excludeSensitive;
            return this;
        }

        public Builder compress(boolean compress) {
            this.compress = compress;
            return this;
        }

        public Builder minSizeBytes(int minSizeBytes) {
            this.minSizeBytes = minSizeBytes;
            return this;
        }

        public Builder minComplexity(int minComplexity) {
            this.minComplexity = minComplexity;
            return this;
        }

        public Builder valueScore(double valueScore) {
            this.valueScore = valueScore;
            return this;
        }

        public CacheOptions build() {
            return new CacheOptions(this);
        }
    }
}
