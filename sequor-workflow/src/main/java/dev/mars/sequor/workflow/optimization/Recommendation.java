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

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A single improvement suggested by a {@link WorkflowAnalyzer} rule.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class Recommendation {

    public enum Level {
        HIGH(3), MEDIUM(2), LOW(1);

        private final int weight;

        Level(int weight) {
            this.weight = weight;
        }

        public int getWeight() {
            return weight;
        }

        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /** Highest priority first, then highest impact. */
    public static final Comparator<Recommendation> RANKING =
            Comparator.comparingInt((Recommendation r) -> r.priority.getWeight()).reversed()
                    .thenComparing(Comparator.comparingInt((Recommendation r) -> r.impact.getWeight()).reversed());

    private final String type;
    private final Level priority;
    private final Level impact;
    private final Level effort;
    private final String description;

    public Recommendation(String type, Level priority, Level impact, Level effort, String description) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.priority = Objects.requireNonNull(priority, "priority cannot be null");
        this.impact = Objects.requireNonNull(impact, "impact cannot be null");
        this.effort = Objects.requireNonNull(effort, "effort cannot be null");
        this.description = description;
    }

    public String getType() {
        return type;
    }

    public Level getPriority() {
        return priority;
    }

    public Level getImpact() {
        return impact;
    }

    public Level getEffort() {
        return effort;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("priority", priority.getValue());
        map.put("impact", impact.getValue());
        map.put("effort", effort.getValue());
        map.put("description", description);
        return map;
    }

    @Override
    public String toString() {
        return "Recommendation{" + type + ", priority=" + priority + ", impact=" + impact + "}";
    }
}
