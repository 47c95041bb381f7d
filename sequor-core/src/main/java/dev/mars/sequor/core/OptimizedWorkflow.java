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
import java.util.Objects;

/**
 * A workflow whose step list has been rewritten by an optimizer.
 * Dependencies and the whole-workflow body still come from the original.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class OptimizedWorkflow implements Workflow {

    private final Workflow original;
    private final WorkflowMetadata metadata;
    private final List<String> appliedOptimizations;

    public OptimizedWorkflow(Workflow original, WorkflowMetadata metadata, List<String> appliedOptimizations) {
        Objects.requireNonNull(original, "Original workflow cannot be null");
        this.original = original instanceof OptimizedWorkflow ? ((OptimizedWorkflow) original).getOriginal() : original;
        this.metadata = Objects.requireNonNull(metadata, "Workflow metadata cannot be null");
        this.appliedOptimizations = appliedOptimizations != null ? List.copyOf(appliedOptimizations) : List.of();
    }

    public Workflow getOriginal() {
        return original;
    }

    public List<String> getAppliedOptimizations() {
        return appliedOptimizations;
    }

    @Override
    public WorkflowMetadata getMetadata() {
        return metadata;
    }

    @Override
    public List<String> getDependencies() {
        return original.getDependencies();
    }

    @Override
    public Map<String, Object> execute(WorkflowContext context) throws Exception {
        return original.execute(context);
    }

    @Override
    public String toString() {
        return "OptimizedWorkflow{" + metadata + ", applied=" + appliedOptimizations + '}';
    }
}
