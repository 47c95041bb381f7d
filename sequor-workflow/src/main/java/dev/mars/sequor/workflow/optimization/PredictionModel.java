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

import java.util.List;

/**
 * A duration estimator over historical samples. Implementations are stateless.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public interface PredictionModel {

    /**
     * Unique model name, reported as the prediction method.
     */
    String getName();

    /**
     * Confidence the model has in its own estimates before data quality is taken into account.
     */
    double getBaseConfidence();

    /**
     * Estimate the duration of a run.
     *
     * @param samples   successful samples of the same workflow, most similar first; never empty
     * @param stepCount step count of the workflow being predicted
     * @return estimated duration in milliseconds
     */
    long predict(List<ExecutionSample> samples, int stepCount);
}
