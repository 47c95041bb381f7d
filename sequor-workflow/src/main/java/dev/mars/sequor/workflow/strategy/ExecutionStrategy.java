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

package dev.mars.sequor.workflow.strategy;

import dev.mars.sequor.core.ExecutionResult;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.workflow.ExecutionContext;

import java.util.Map;

/**
 * A way of running the steps of a workflow.
 * <p>
 * A failing step is a normal outcome and yields a result with {@code success=false}. Errors
 * that abort the run as a whole, such as cancellation, are thrown.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-31
 */
public interface ExecutionStrategy {

    /**
     * Name the strategy is registered and selected under.
     */
    String getName();

    /**
     * Runs the workflow.
     *
     * @param workflow the workflow to run
     * @param context the shared workflow context, mutated by the steps
     * @param execution execution identity, options, cancellation flag and step listener
     * @return the outcome of the run
     * @throws WorkflowExecutionException when the run is aborted
     */
    ExecutionResult execute(Workflow workflow, WorkflowContext context, ExecutionContext execution)
            throws WorkflowExecutionException;

    /**
     * Strategy-specific counters and learning state sizes.
     */
    default Map<String, Object> getStatistics() {
        return Map.of("name", getName());
    }

    /**
     * Releases threads owned by the strategy. Called once by the engine on shutdown.
     */
    default void shutdown() {
    }
}
