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

import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.WorkflowContext;

import java.util.List;

/**
 * One analysis pass of a {@link WorkflowAnalyzer}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
@FunctionalInterface
public interface AnalysisRule {

    /**
     * @param steps   metadata of the workflow's steps, in declared order
     * @param context the context the workflow is about to run with
     * @return metrics and recommendations of this rule
     */
    RuleResult analyze(List<StepMetadata> steps, WorkflowContext context);
}
