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

import java.util.List;
import java.util.Map;

/**
 * A workflow definition owned by the caller and read by the engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public interface Workflow {

    /**
     * Identity, version, type and ordered steps of this workflow.
     */
    WorkflowMetadata getMetadata();

    /**
     * Ids of executions that must complete before this workflow may run.
     */
    default List<String> getDependencies() {
        return List.of();
    }

    /**
     * Whole-workflow body, used when the workflow declares no steps.
     *
     * @param context the shared workflow context
     * @return output data of the workflow
     * @throws Exception any failure
     */
    default Map<String, Object> execute(WorkflowContext context) throws Exception {
        return Map.of();
    }

    default List<Step> getSteps() {
        return getMetadata().getSteps();
    }

    default String getName() {
        return getMetadata().getName();
    }
}
