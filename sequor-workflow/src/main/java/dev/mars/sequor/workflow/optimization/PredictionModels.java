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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The built-in prediction models.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class PredictionModels {

    public static final String AVERAGE = "average";
    public static final String LINEAR_REGRESSION = "linear_regression";
    public static final String STEP_COUNT_PATTERN = "pattern_based";
    public static final String WEIGHTED_AVERAGE = "weighted_average";

    static final int STEP_BUCKET_SIZE = 5;
    static final long WEIGHT_MAX_AGE_MS = 24L * 60 * 60 * 1000;

    private PredictionModels() {
    }

    public static List<PredictionModel> defaults() {
        return List.of(new Average(), new LinearRegression(), new StepCountPattern(), new WeightedAverage());
    }

    static long mean(List<ExecutionSample> samples) {
        long total = 0;
        for (ExecutionSample sample : samples) {
            total += sample.getDurationMs();
        }
        return Math.round((double) total / samples.size());
    }

    /**
     * Plain mean of observed durations.
     */
    public static final class Average implements PredictionModel {
        @Override
        public String getName() {
            return AVERAGE;
        }

        @Override
        public double getBaseConfidence() {
            return 0.7;
        }

        @Override
        public long predict(List<ExecutionSample> samples, int stepCount) {
            return mean(samples);
        }
    }

    /**
     * Least-squares fit of duration against step count, evaluated at the requested step count.
     * Falls back to the mean when every sample has the same step count.
     */
    public static final class LinearRegression implements PredictionModel {
        @Override
        public String getName() {
            return LINEAR_REGRESSION;
        }

        @Override
        public double getBaseConfidence() {
            return 0.8;
        }

        @Override
        public long predict(List<ExecutionSample> samples, int stepCount) {
            int n = samples.size();
            if (n < 2) {
                return mean(samples);
            }
            double sumX = 0;
            double sumY = 0;
            double sumXY = 0;
            double sumXX = 0;
            for (ExecutionSample sample : samples) {
                double x = sample.getStepCount();
                double y = sample.getDurationMs();
                sumX += x;
                sumY += y;
                sumXY += x * y;
                sumXX += x * x;
            }
            double denominator = n * sumXX - sumX * sumX;
            if (Math.abs(denominator) < 1e-9) {
                return mean(samples);
            }
            double slope = (n * sumXY - sumX * sumY) / denominator;
            double intercept = (sumY - slope * sumX) / n;
            return Math.max(0, Math.round(slope * stepCount + intercept));
        }
    }

    /**
     * Groups samples into step-count buckets of five and averages the bucket of the requested
     * step count, or the most populated bucket, when it holds at least two samples.
     */
    public static final class StepCountPattern implements PredictionModel {
        @Override
        public String getName() {
            return STEP_COUNT_PATTERN;
        }

        @Override
        public double getBaseConfidence() {
            return 0.85;
        }

        @Override
        public long predict(List<ExecutionSample> samples, int stepCount) {
            Map<Integer, List<ExecutionSample>> buckets = new LinkedHashMap<>();
            for (ExecutionSample sample : samples) {
                buckets.computeIfAbsent(bucket(sample.getStepCount()), b -> new ArrayList<>()).add(sample);
            }
            List<ExecutionSample> own = buckets.get(bucket(stepCount));
            if (own != null && own.size() >= 2) {
                return mean(own);
            }
            List<ExecutionSample> largest = null;
            for (List<ExecutionSample> group : buckets.values()) {
                if (group.size() >= 2 && (largest == null || group.size() > largest.size())) {
                    largest = group;
                }
            }
            return mean(largest != null ? largest : samples);
        }

        static int bucket(int stepCount) {
            return (stepCount / STEP_BUCKET_SIZE) * STEP_BUCKET_SIZE;
        }
    }

    /**
     * Mean weighted by recency (linear decay over a day, floor 0.1) and context similarity.
     */
    public static final class WeightedAverage implements PredictionModel {
        @Override
        public String getName() {
            return WEIGHTED_AVERAGE;
        }

        @Override
        public double getBaseConfidence() {
            return 0.75;
        }

        @Override
        public long predict(List<ExecutionSample> samples, int stepCount) {
            long now = System.currentTimeMillis();
            double weightedSum = 0;
            double totalWeight = 0;
            for (ExecutionSample sample : samples) {
                double ageWeight = Math.max(0.1, 1.0 - (double) (now - sample.getTimestamp()) / WEIGHT_MAX_AGE_MS);
                double similarityWeight = sample.getSimilarity() > 0 ? sample.getSimilarity() : 0.5;
                double weight = ageWeight * similarityWeight;
                weightedSum += sample.getDurationMs() * weight;
                totalWeight += weight;
            }
            return totalWeight > 0 ? Math.round(weightedSum / totalWeight) : 0;
        }
    }
}
