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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Predicted duration and resources for a workflow run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class Prediction {

    public static final String DEFAULT_METHOD = "default";

    private final String workflowId;
    private final String contextHash;
    private final long durationMs;
    private final double confidence;
    private final String method;
    private final int dataPoints;
    private final ResourceEstimate resources;
    private final Instant predictedAt;

    Prediction(String workflowId, String contextHash, long durationMs, double confidence, String method,
               int dataPoints, ResourceEstimate resources) {
        this.workflowId = workflowId;
        this.contextHash = contextHash;
        this.durationMs = durationMs;
        this.confidence = confidence;
        this.method = method;
        this.dataPoints = dataPoints;
        this.resources = resources;
        this.predictedAt = Instant.now();
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getContextHash() {
        return contextHash;
    }

    public long getDurationMs() {
        return durationMs;
    }

    /**
     * Confidence in the range 0-1.
     */
    public double getConfidence() {
        return confidence;
    }

    /**
     * Name of the model that produced the estimate, or {@link #DEFAULT_METHOD}.
     */
    public String getMethod() {
        return method;
    }

    public boolean isDefault() {
        return DEFAULT_METHOD.equals(method);
    }

    public int getDataPoints() {
        return dataPoints;
    }

    public ResourceEstimate getResources() {
        return resources;
    }

    public double getEstimatedCost() {
        return resources.getEstimatedCost();
    }

    public Instant getPredictedAt() {
        return predictedAt;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("workflowId", workflowId);
        map.put("durationMs", durationMs);
        map.put("confidence", confidence);
        map.put("method", method);
        map.put("dataPoints", dataPoints);
        map.put("resources", resources.toMap());
        map.put("predictedAt", predictedAt.toString());
        return map;
    }

    @Override
    public String toString() {
        return "Prediction{" + workflowId + ", " + durationMs + "ms, confidence=" + confidence + ", method=" + method + "}";
    }
}
