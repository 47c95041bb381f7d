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

import java.util.Objects;

/**
 * A step whose metadata has been rewritten by an optimizer.
 * Execution is delegated to the original step.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class OptimizedStep implements Step {

    private final Step original;
    private final StepMetadata metadata;

    public OptimizedStep(Step original, StepMetadata metadata) {
        Objects.requireNonNull(original, "Original step cannot be null");
        // Avoid wrapping wrappers
        this.original = original instanceof OptimizedStep ? ((OptimizedStep) original).getOriginal() : original;
        this.metadata = Objects.requireNonNull(metadata, "Step metadata cannot be null");
    }

    public Step getOriginal() {
        return original;
    }

    @Override
    public StepMetadata getMetadata() {
        return metadata;
    }

    @Override
    public StepOutput execute(WorkflowContext context) throws Exception {
        return original.execute(context);
    }

    @Override
    public String toString() {
        return "OptimizedStep{" + metadata + '}';
    }
}
