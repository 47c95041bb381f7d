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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of {@link WorkflowAnalyzer#analyzeWorkflow}: per-rule results, ranked recommendations and
 * a summary with the optimization score (0-100, higher means more room for improvement).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class WorkflowAnalysis {

    private final String workflowId;
    private final String workflowName;
    private final String contextHash;
    private final int stepCount;
    private final Map<String, RuleResult> ruleResults;
    private final List<Recommendation> recommendations;
    private final double optimizationScore;
    private final List<String> keyFindings;
    private final boolean enabled;
    private final long analyzedAt;

    WorkflowAnalysis(String workflowId, String workflowName, String contextHash, int stepCount,
                     Map<String, RuleResult> ruleResults, List<Recommendation> recommendations,
                     double optimizationScore, List<String> keyFindings, boolean enabled, long analyzedAt) {
        this.workflowId = workflowId;
        this.workflowName = workflowName;
        this.contextHash = contextHash;
        this.stepCount = stepCount;
        this.ruleResults = Collections.unmodifiableMap(new LinkedHashMap<>(ruleResults));
        this.recommendations = List.copyOf(recommendations);
        this.optimizationScore = optimizationScore;
        this.keyFindings = List.copyOf(keyFindings);
        this.enabled = enabled;
        this.analyzedAt = analyzedAt;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getContextHash() {
        return contextHash;
    }

    public int getStepCount() {
        return stepCount;
    }

    public Map<String, RuleResult> getRuleResults() {
        return ruleResults;
    }

    public Optional<RuleResult> getRuleResult(String ruleId) {
        return Optional.ofNullable(ruleResults.get(ruleId));
    }

    /**
     * All recommendations, highest priority then highest impact first.
     */
    public List<Recommendation> getRecommendations() {
        return recommendations;
    }

    public int getTotalRecommendations() {
        return recommendations.size();
    }

    public int getHighPriorityRecommendations() {
        return (int) recommendations.stream()
                .filter(r -> r.getPriority() == Recommendation.Level.HIGH)
                .count();
    }

    public double getOptimizationScore() {
        return optimizationScore;
    }

    public List<String> getKeyFindings() {
        return keyFindings;
    }

    /**
     * False for the placeholder returned while analysis is switched off.
     */
    public boolean isEnabled() {
        return enabled;
    }

    public long getAnalyzedAt() {
        return analyzedAt;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalRecommendations", getTotalRecommendations());
        summary.put("highPriorityRecommendations", getHighPriorityRecommendations());
        summary.put("optimizationScore", optimizationScore);
        summary.put("keyFindings", keyFindings);

        List<Map<String, Object>> ranked = new ArrayList<>();
        for (Recommendation recommendation : recommendations) {
            ranked.add(recommendation.toMap());
        }

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("workflowId", workflowId);
        map.put("workflowName", workflowName);
        map.put("stepCount", stepCount);
        map.put("analyzedAt", analyzedAt);
        map.put("summary", summary);
        map.put("recommendations", ranked);
        return map;
    }

    @Override
    public String toString() {
        return "WorkflowAnalysis{" + workflowId + ", score=" + optimizationScore
                + ", recommendations=" + recommendations.size() + "}";
    }
}
