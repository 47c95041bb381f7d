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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metrics and recommendations produced by a single {@link AnalysisRule}.
 */
public final class RuleResult {

    private final Map<String, Object> metrics;
    private final List<Recommendation> recommendations;

    private RuleResult(Builder builder) {
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metrics));
        this.recommendations = List.copyOf(builder.recommendations);
    }

    public Map<String, Object> getMetrics() {
        return metrics;
    }

    public Object getMetric(String name) {
        return metrics.get(name);
    }

    /**
     * Size of a collection-valued metric, zero when absent.
     */
    public int countOf(String name) {
        Object value = metrics.get(name);
        return value instanceof Collection ? ((Collection<?>) value).size() : 0;
    }

    public List<Recommendation> getRecommendations() {
        return recommendations;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Object> metrics = new LinkedHashMap<>();
        private final List<Recommendation> recommendations = new ArrayList<>();

        public Builder metric(String name, Object value) {
            metrics.put(name, value);
            return this;
        }

        public Builder recommend(Recommendation recommendation) {
            recommendations.add(recommendation);
            return this;
        }

        public RuleResult build() {
            return new RuleResult(this);
        }
    }
}
