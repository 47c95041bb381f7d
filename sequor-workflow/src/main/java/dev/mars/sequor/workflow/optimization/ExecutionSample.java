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

/**
 * One observed execution, as remembered by {@link ExecutionPredictor}.
 * The similarity is relative to the context of the current prediction and is 1.0 when stored.
 */
public final class ExecutionSample {

    private final String workflowId;
    private final String contextHash;
    private final long durationMs;
    private final boolean success;
    private final int stepCount;
    private final long timestamp;
    private final double similarity;

    public ExecutionSample(String workflowId, String contextHash, long durationMs, boolean success,
                           int stepCount, long timestamp) {
        this(workflowId, contextHash, durationMs, success, stepCount, timestamp, 1.0);
    }

    private ExecutionSample(String workflowId, String contextHash, long durationMs, boolean success,
                            int stepCount, long timestamp, double similarity) {
        this.workflowId = workflowId;
        this.contextHash = contextHash;
        this.durationMs = durationMs;
        this.success = success;
        this.stepCount = stepCount;
        this.timestamp = timestamp;
        this.similarity = similarity;
    }

    ExecutionSample withSimilarity(double similarity) {
        return new ExecutionSample(workflowId, contextHash, durationMs, success, stepCount, timestamp, similarity);
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

    public boolean isSuccess() {
        return success;
    }

    public int getStepCount() {
        return stepCount;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getSimilarity() {
        return similarity;
    }
}
