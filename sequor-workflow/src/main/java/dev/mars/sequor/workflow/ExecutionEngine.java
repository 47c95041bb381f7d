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

package dev.mars.sequor.workflow;

import dev.mars.sequor.config.SequorConfiguration;
import dev.mars.sequor.core.ExecutionOptions;
import dev.mars.sequor.core.ExecutionResult;
import dev.mars.sequor.core.ExecutionStatus;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.monitoring.EngineHealthCheck;
import dev.mars.sequor.workflow.strategy.ExecutionStrategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Accepts workflows for execution and reports on them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-01
 */
public interface ExecutionEngine {

    /**
     * Submits a workflow for execution.
     *
     * <p>The returned future completes normally with the execution result, which may be
     * unsuccessful when a step failed and retries were exhausted. It completes exceptionally with a
     * {@link WorkflowExecutionException} when the execution errored, timed out or was cancelled.</p>
     *
     * @param workflow the workflow to run
     * @param context the shared context handed to every step
     * @param options execution options, or null for defaults
     * @return future of the execution result
     * @throws WorkflowExecutionException when the request is invalid, exceeds the resource limits,
     *         cannot be scheduled, or the queue is full
     */
    CompletableFuture<ExecutionResult> executeWorkflow(Workflow workflow, WorkflowContext context,
                                                       ExecutionOptions options) throws WorkflowExecutionException;

    default CompletableFuture<ExecutionResult> executeWorkflow(Workflow workflow, WorkflowContext context)
            throws WorkflowExecutionException {
        return executeWorkflow(workflow, context, ExecutionOptions.defaults());
    }

    /**
     * Cancels a queued or running execution.
     *
     * @param executionId the execution id
     * @return true if the execution was active and is now cancelled or cancelling
     */
    boolean cancelExecution(String executionId);

    /**
     * Status of an active execution. Finished executions are no longer tracked.
     */
    Optional<ExecutionStatus> getExecutionStatus(String executionId);

    Map<String, Object> getSystemMetrics();

    EngineHealthCheck getHealthStatus();

    void registerStrategy(ExecutionStrategy strategy);

    List<String> getAvailableStrategies();

    void updateConfiguration(SequorConfiguration configuration);

    /**
     * Cancels everything still active and stops the engine. Later submissions are rejected.
     */
    void shutdown();
}
