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

package dev.mars.sequor.workflow.scheduler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time snapshot of {@link ExecutionScheduler} counters.
 */
public final class SchedulerStatistics {

    private final long totalScheduled;
    private final long totalExecuted;
    private final long totalFailed;
    private final long totalCancelled;
    private final double averageSchedulingTimeMs;
    private final int running;
    private final int pending;
    private final int tracked;

    public SchedulerStatistics(long totalScheduled, long totalExecuted, long totalFailed, long totalCancelled,
                               double averageSchedulingTimeMs, int running, int pending, int tracked) {
        this.totalScheduled = totalScheduled;
        this.totalExecuted = totalExecuted;
        this.totalFailed = totalFailed;
        this.totalCancelled = totalCancelled;
        this.averageSchedulingTimeMs = averageSchedulingTimeMs;
        this.running = running;
        this.pending = pending;
        this.tracked = tracked;
    }

    public long getTotalScheduled() {
        return totalScheduled;
    }

    /**
     * Executions that reached COMPLETED.
     */
    public long getTotalExecuted() {
        return totalExecuted;
    }

    public long getTotalFailed() {
        return totalFailed;
    }

    public long getTotalCancelled() {
        return totalCancelled;
    }

    /**
     * Mean wall time spent admitting an execution in {@code schedule}.
     */
    public double getAverageSchedulingTimeMs() {
        return averageSchedulingTimeMs;
    }

    public int getRunning() {
        return running;
    }

    public int getPending() {
        return pending;
    }

    /**
     * All executions still held by the scheduler, terminal ones included.
     */
    public int getTracked() {
        return tracked;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalScheduled", totalScheduled);
        map.put("totalExecuted", totalExecuted);
        map.put("totalFailed", totalFailed);
        map.put("totalCancelled", totalCancelled);
        map.put("averageSchedulingTimeMs", averageSchedulingTimeMs);
        map.put("running", running);
        map.put("pending", pending);
        map.put("tracked", tracked);
        return map;
    }

    @Override
    public String toString() {
        return "SchedulerStatistics" + toMap();
    }
}
