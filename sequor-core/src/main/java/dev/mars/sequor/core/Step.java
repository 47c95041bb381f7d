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
 * A single unit of work within a workflow.
 * Implementations are supplied by the caller; the engine only reads the
 * metadata and invokes {@link #execute(WorkflowContext)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public interface Step {

    /**
     * Describes the step: type, name, parameters, dependencies and resources.
     */
    StepMetadata getMetadata();

    /**
     * Runs the step against the shared workflow context.
     *
     * @param context mutable key/value bag shared by all steps of the execution
     * @return the outcome of the step
     * @throws Exception any failure; the running strategy turns it into a failed step result
     */
    StepOutput execute(WorkflowContext context) throws Exception;
}
