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

/**
 * Enumeration of workflow execution statuses.
 */
public enum ExecutionStatus {

    /**
     * Accepted and waiting in the queue for a worker slot.
     */
    QUEUED,

    /**
     * Currently running on a worker.
     */
    RUNNING,

    /**
     * Finished successfully.
     */
    COMPLETED,

    /**
     * Finished unsuccessfully after exhausting retries.
     */
    FAILED,

    /**
     * Cancelled by the caller or by engine shutdown.
     */
    CANCELLED;

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if the status represents an active state.
     */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }

    /**
     * Checks if the status represents a successful completion.
     */
    public boolean isSuccessful() {
        return this == COMPLETED;
    }
}
