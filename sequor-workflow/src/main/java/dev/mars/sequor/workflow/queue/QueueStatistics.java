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

package dev.mars.sequor.workflow.queue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time snapshot of {@link ExecutionQueue} counters.
 */
public final class QueueStatistics {

    private final int queued;
    private final int processing;
    private final int completed;
    private final int failed;
    private final long totalEnqueued;
    private final long totalCompleted;
    private final long totalFailed;
    private final long totalRetries;
    private final long totalRejected;
    private final double averageWaitTimeMs;
    private final int maxSize;

    public QueueStatistics(int queued, int processing, int completed, int failed,
                           long totalEnqueued, long totalCompleted, long totalFailed,
                           long totalRetries, long totalRejected, double averageWaitTimeMs, int maxSize) {
        this.queued = queued;
        this.processing = processing;
        this.completed = completed;
        this.failed = failed;
        this.totalEnqueued = totalEnqueued;
        this.totalCompleted = totalCompleted;
        this.totalFailed = totalFailed;
        this.totalRetries = totalRetries;
        this.totalRejected = totalRejected;
        this.averageWaitTimeMs = averageWaitTimeMs;
        this.maxSize = maxSize;
    }

    public int getQueued() {
        return queued;
    }

    public int getProcessing() {
        return processing;
    }

    /**
     * Completed items still held in the bounded history.
     */
    public int getCompleted() {
        return completed;
    }

    public int getFailed() {
        return failed;
    }

    public long getTotalEnqueued() {
        return totalEnqueued;
    }

    public long getTotalCompleted() {
        return totalCompleted;
    }

    public long getTotalFailed() {
        return totalFailed;
    }

    public long getTotalRetries() {
        return totalRetries;
    }

    public long getTotalRejected() {
        return totalRejected;
    }

    public double getAverageWaitTimeMs() {
        return averageWaitTimeMs;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public double getUtilization() {
        return maxSize > 0 ? (double) queued / maxSize * 100.0 : 0.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("queued", queued);
        map.put("processing", processing);
        map.put("completed", completed);
        map.put("failed", failed);
        map.put("totalEnqueued", totalEnqueued);
        map.put("totalCompleted", totalCompleted);
        map.put("totalFailed", totalFailed);
        map.put("totalRetries", totalRetries);
        map.put("totalRejected", totalRejected);
        map.put("averageWaitTimeMs", averageWaitTimeMs);
        map.put("maxSize", maxSize);
        return map;
    }

    @Override
    public String toString() {
        return "QueueStatistics" + toMap();
    }
}
