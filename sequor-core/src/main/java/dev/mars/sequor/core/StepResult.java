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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of a single step within an execution.
 * <p>
 * Steps served from the step cache carry {@code fromCache=true} and were never run;
 * steps run concurrently with siblings carry {@code parallel=true}.
 * Times are epoch milliseconds so that results serialize without extra Jackson modules.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public final class StepResult {

    private final int index;
    private final String name;
    private final StepType type;
    private final StepStatus status;
    private final Map<String, Object> output;
    private final String error;
    private final long startTime;
    private final long durationMs;
    private final boolean fromCache;
    private final boolean parallel;
    private final int attempts;

    private StepResult(Builder builder) {
        this.index = builder.index;
        this.name = Objects.requireNonNull(builder.name, "Step name cannot be null");
        this.type = builder.type != null ? builder.type : StepType.CUSTOM;
        this.status = Objects.requireNonNull(builder.status, "Step status cannot be null");
        this.output = Collections.unmodifiableMap(new LinkedHashMap<>(builder.output));
        this.error = builder.error;
        this.startTime = builder.startTime;
        this.durationMs = builder.durationMs;
        this.fromCache = builder.fromCache;
        this.parallel = builder.parallel;
        this.attempts = builder.attempts;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public StepType getType() {
        return type;
    }

    public StepStatus getStatus() {
        return status;
    }

    public Map<String, Object> getOutput() {
        return output;
    }

    public String getError() {
        return error;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isSuccessful() {
        return status == StepStatus.COMPLETED;
    }

    public StepResult withParallel(boolean parallel) {
        return toBuilder().parallel(parallel).build();
    }

    /**
     * Copy of this result marked as served from cache, with zero duration.
     */
    public StepResult asCached(int index, long startTime) {
        return toBuilder()
                .index(index)
                .startTime(startTime)
                .durationMs(0)
                .fromCache(true)
                .attempts(0)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .index(index)
                .name(name)
                .type(type)
                .status(status)
                .output(output)
                .error(error)
                .startTime(startTime)
                .durationMs(durationMs)
                .fromCache(fromCache)
                .parallel(parallel)
                .attempts(attempts);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "StepResult{" +
               "index=" + index +
               ", name='" + name + '\'' +
               ", status=" + status +
               ", durationMs=" + durationMs +
               (fromCache ? ", fromCache" : "") +
               (parallel ? ", parallel" : "") +
               (error != null ? ", error='" + error + '\'' : "") +
               '}';
    }

    /**
     * Builder for StepResult.
     */
    public static class Builder {
        private int index;
        private String name;
        private StepType type;
        private StepStatus status;
        private final Map<String, Object> output = new LinkedHashMap<>();
        private String error;
        private long startTime;
        private long durationMs;
        private boolean fromCache;
        private boolean parallel;
        private int attempts = 1;

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(StepType type) {
            this.type = type;
            return this;
        }

        public Builder status(StepStatus status) {
            this.status = status;
            return this;
        }

        public Builder output(Map<String, Object> output) {
            this.output.clear();
            if (output != null) {
                this.output.putAll(output);
            }
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder startTime(long startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder fromCache(boolean fromCache) {
            this.fromCache = fromCache;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public StepResult build() {
            return new StepResult(this);
        }
    }
}
