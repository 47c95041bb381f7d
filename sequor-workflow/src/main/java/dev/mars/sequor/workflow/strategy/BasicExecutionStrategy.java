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
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepResult;
import dev.mars.sequor.core.StepStatus;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import dev.mars.sequor.workflow.ExecutionContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Runs steps one after another in declared order and stops at the first failure.
 */
public class BasicExecutionStrategy extends AbstractExecutionStrategy {

    private static final Logger logger = Logger.getLogger(BasicExecutionStrategy.class.getName());

    public static final String NAME = "basic";

    public BasicExecutionStrategy() {
        super(NAME);
    }

    @Override
    public ExecutionResult execute(Workflow workflow, WorkflowContext context, ExecutionContext execution)
            throws WorkflowExecutionException {
        long startTime = System.currentTimeMillis();
        List<Step> steps = workflow.getSteps();
        if (steps.isEmpty()) {
            return executeBody(workflow, context, execution, startTime);
        }

        List<StepResult> results = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            execution.checkNotCancelled();
            StepResult result = executeStep(steps.get(i), i, context, execution);
            results.add(result);
            if (result.getStatus() == StepStatus.FAILED) {
                logger.warning("Step '" + result.getName() + "' failed in " + execution.getExecutionId()
                        + ", stopping: " + result.getError());
                break;
            }
        }
        return buildResult(workflow, execution, startTime, steps.size(), results, Map.of());
    }
}
