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

import dev.mars.sequor.config.SequorConfiguration;
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.WorkflowMetadata;
import dev.mars.sequor.workflow.cache.CacheKeyGenerator;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Predicts workflow duration and resource needs from execution history.
 *
 * <p>With fewer than {@code minDataPoints} successful samples of a workflow the predictor falls
 * back to a default of one second per step at confidence 0.5. Otherwise it uses the model with the
 * best recorded accuracy for that workflow, provided it beats the accuracy threshold, or the default
 * model. Accuracy is learned through {@link #recordActual}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class ExecutionPredictor {

    private static final Logger logger = Logger.getLogger(ExecutionPredictor.class.getName());

    static final int DEFAULT_MIN_DATA_POINTS = 5;
    static final double DEFAULT_ACCURACY_THRESHOLD = 0.8;
    static final int DEFAULT_MAX_HISTORY = 10_000;
    static final Duration DEFAULT_RETENTION = Duration.ofDays(7);
    static final long DEFAULT_MS_PER_STEP = 1000;
    static final double DEFAULT_CONFIDENCE = 0.5;
    static final double SIMILARITY_THRESHOLD = 0.5;

    private static final long BASE_MEMORY_MB = 32;
    private static final double BASE_CPU_PERCENT = 5;
    private static final long BASE_TIMEOUT_MS = 30_000;
    // memory, cpu, timeout multipliers
    private static final Map<StepType, double[]> STEP_MULTIPLIERS = new EnumMap<>(StepType.class);

    static {
        STEP_MULTIPLIERS.put(StepType.SETUP, new double[]{0.5, 0.5, 0.5});
        STEP_MULTIPLIERS.put(StepType.VALIDATION, new double[]{0.8, 0.8, 0.8});
        STEP_MULTIPLIERS.put(StepType.ANALYSIS, new double[]{2.0, 1.5, 2.0});
        STEP_MULTIPLIERS.put(StepType.PROCESSING, new double[]{1.5, 2.0, 1.5});
        STEP_MULTIPLIERS.put(StepType.TESTING, new double[]{1.2, 1.2, 1.0});
        STEP_MULTIPLIERS.put(StepType.DEPLOYMENT, new double[]{1.0, 1.0, 3.0});
        STEP_MULTIPLIERS.put(StepType.CLEANUP, new double[]{0.5, 0.5, 0.5});
    }

    private static final class AccuracyStats {
        long count;
        double total;

        void add(double accuracy) {
            count++;
            total += accuracy;
        }

        double average() {
            return count > 0 ? total / count : 0.0;
        }
    }

    private final Object lock = new Object();
    private final Deque<ExecutionSample> history = new ArrayDeque<>();
    private final Map<String, Map<String, AccuracyStats>> modelAccuracy = new HashMap<>();
    private final AccuracyStats overallAccuracy = new AccuracyStats();
    private final Map<String, PredictionModel> models = new LinkedHashMap<>();
    private final CacheKeyGenerator keyGenerator = new CacheKeyGenerator();

    private final int minDataPoints;
    private final double accuracyThreshold;
    private final int maxHistory;
    private final long retentionMs;
    private volatile boolean enabled;
    private volatile String defaultModel = PredictionModels.WEIGHTED_AVERAGE;

    public ExecutionPredictor() {
        this(true, DEFAULT_MIN_DATA_POINTS, DEFAULT_ACCURACY_THRESHOLD, DEFAULT_MAX_HISTORY, DEFAULT_RETENTION);
    }

    public ExecutionPredictor(SequorConfiguration configuration) {
        this(configuration.isPredictionEnabled(), DEFAULT_MIN_DATA_POINTS, DEFAULT_ACCURACY_THRESHOLD,
                DEFAULT_MAX_HISTORY, DEFAULT_RETENTION);
    }

    public ExecutionPredictor(boolean enabled, int minDataPoints, double accuracyThreshold, int maxHistory,
                              Duration retention) {
        if (minDataPoints < 1) {
            throw new IllegalArgumentException("minDataPoints must be at least 1");
        }
        this.enabled = enabled;
        this.minDataPoints = minDataPoints;
        this.accuracyThreshold = accuracyThreshold;
        this.maxHistory = maxHistory;
        this.retentionMs = retention.toMillis();
        for (PredictionModel model : PredictionModels.defaults()) {
            models.put(model.getName(), model);
        }
    }

    /**
     * Add or replace a model.
     */
    public void registerModel(PredictionModel model) {
        Objects.requireNonNull(model, "model cannot be null");
        synchronized (lock) {
            models.put(model.getName(), model);
        }
    }

    /**
     * Choose the model used when no model has proven itself for a workflow.
     */
    public void setDefaultModel(String name) {
        synchronized (lock) {
            if (!models.containsKey(name)) {
                throw new IllegalArgumentException("Unknown prediction model: " + name);
            }
            this.defaultModel = name;
        }
    }

    public List<String> getModelNames() {
        synchronized (lock) {
            return new ArrayList<>(models.keySet());
        }
    }

    public Prediction predict(Workflow workflow, WorkflowContext context) {
        WorkflowMetadata metadata = workflow.getMetadata();
        String workflowId = workflowId(workflow);
        String contextHash = keyGenerator.hashContext(context);
        ResourceEstimate resources = predictResources(workflow);
        if (!enabled) {
            return defaultPrediction(workflowId, contextHash, metadata.getStepCount(), resources);
        }

        try {
            List<ExecutionSample> samples;
            PredictionModel model;
            synchronized (lock) {
                samples = similarSamples(workflowId, contextHash);
                if (samples.size() < minDataPoints) {
                    logger.fine("Insufficient history for " + workflowId + ": " + samples.size() + " of " + minDataPoints);
                    return defaultPrediction(workflowId, contextHash, metadata.getStepCount(), resources);
                }
                model = selectModel(workflowId);
            }

            long duration = model.predict(samples, metadata.getStepCount());
            double dataQuality = Math.min(1.0, samples.size() / 10.0);
            double confidence = Math.min(1.0, dataQuality * model.getBaseConfidence());
            Prediction prediction = new Prediction(workflowId, contextHash, duration, confidence, model.getName(),
                    samples.size(), resources);
            logger.fine("Predicted " + prediction);
            return prediction;
        } catch (RuntimeException e) {
            logger.warning("Prediction failed for " + workflowId + ": " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Prediction failure", e);
            }
            return defaultPrediction(workflowId, contextHash, metadata.getStepCount(), resources);
        }
    }

    /**
     * Per-step estimate from a base of 32 MB, 5% CPU and 30 s scaled by the step type.
     */
    public ResourceEstimate predictStepResources(Step step) {
        double[] multipliers = STEP_MULTIPLIERS.getOrDefault(step.getMetadata().getType(),
                STEP_MULTIPLIERS.get(StepType.PROCESSING));
        return new ResourceEstimate(
                Math.round(BASE_MEMORY_MB * multipliers[0]),
                Math.round(BASE_CPU_PERCENT * multipliers[1]),
                Math.round(BASE_TIMEOUT_MS * multipliers[2]));
    }

    /**
     * Sum of step estimates with margins: memory +20%, cpu +10%, longest step timeout +50%.
     */
    public ResourceEstimate predictResources(Workflow workflow) {
        List<Step> steps = workflow.getMetadata().getSteps();
        if (steps.isEmpty()) {
            return new ResourceEstimate(BASE_MEMORY_MB, BASE_CPU_PERCENT, BASE_TIMEOUT_MS);
        }
        long memory = 0;
        double cpu = 0;
        long timeout = 0;
        for (Step step : steps) {
            ResourceEstimate estimate = predictStepResources(step);
            memory += estimate.getMemoryMb();
            cpu += estimate.getCpuPercent();
            timeout = Math.max(timeout, estimate.getTimeoutMs());
        }
        return new ResourceEstimate(
                (long) Math.ceil(memory * 1.2),
                Math.ceil(cpu * 1.1),
                (long) Math.ceil(timeout * 1.5));
    }

    /**
     * Reconcile a prediction with the observed outcome.
     */
    public void recordActual(Workflow workflow, WorkflowContext context, Prediction prediction,
                             long actualDurationMs, boolean success) {
        if (!enabled) {
            return;
        }
        String workflowId = workflowId(workflow);
        String contextHash = prediction != null ? prediction.getContextHash() : keyGenerator.hashContext(context);
        ExecutionSample sample = new ExecutionSample(workflowId, contextHash, actualDurationMs, success,
                workflow.getMetadata().getStepCount(), System.currentTimeMillis());

        synchronized (lock) {
            history.addLast(sample);
            if (prediction != null && success) {
                double accuracy = accuracy(prediction.getDurationMs(), actualDurationMs);
                overallAccuracy.add(accuracy);
                if (!prediction.isDefault()) {
                    modelAccuracy.computeIfAbsent(workflowId, id -> new HashMap<>())
                            .computeIfAbsent(prediction.getMethod(), m -> new AccuracyStats())
                            .add(accuracy);
                }
            }
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
        }
        logger.fine("Recorded " + actualDurationMs + "ms run of " + workflowId + (success ? "" : " (failed)"));
    }

    /**
     * True once enough successful samples exist for a model-based prediction.
     */
    public boolean hasHistory(Workflow workflow) {
        String workflowId = workflowId(workflow);
        synchronized (lock) {
            int count = 0;
            for (ExecutionSample sample : history) {
                if (sample.isSuccess() && sample.getWorkflowId().equals(workflowId) && ++count >= minDataPoints) {
                    return true;
                }
            }
            return false;
        }
    }

    public Map<String, Object> getAccuracyStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        synchronized (lock) {
            stats.put("enabled", enabled);
            stats.put("samples", history.size());
            stats.put("reconciledPredictions", overallAccuracy.count);
            stats.put("averageAccuracy", overallAccuracy.average());
            stats.put("accuracyThreshold", accuracyThreshold);
            stats.put("defaultModel", defaultModel);
            Map<String, Map<String, Double>> perWorkflow = new LinkedHashMap<>();
            modelAccuracy.forEach((workflowId, byModel) -> {
                Map<String, Double> averages = new LinkedHashMap<>();
                byModel.forEach((model, accuracy) -> averages.put(model, accuracy.average()));
                perWorkflow.put(workflowId, averages);
            });
            stats.put("modelAccuracy", perWorkflow);
        }
        return stats;
    }

    /**
     * Drop samples older than the retention window and cap the history.
     *
     * @return number of samples removed
     */
    public int cleanup() {
        long cutoff = System.currentTimeMillis() - retentionMs;
        int removed = 0;
        synchronized (lock) {
            Iterator<ExecutionSample> iterator = history.iterator();
            while (iterator.hasNext()) {
                if (iterator.next().getTimestamp() < cutoff) {
                    iterator.remove();
                    removed++;
                }
            }
            while (history.size() > maxHistory) {
                history.removeFirst();
                removed++;
            }
        }
        if (removed > 0) {
            logger.fine("Predictor cleanup removed " + removed + " samples");
        }
        return removed;
    }

    public int getSampleCount() {
        synchronized (lock) {
            return history.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            history.clear();
            modelAccuracy.clear();
            overallAccuracy.count = 0;
            overallAccuracy.total = 0;
        }
        logger.info("Prediction history cleared");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public static String workflowId(Workflow workflow) {
        WorkflowMetadata metadata = workflow.getMetadata();
        return metadata.getName() + "_" + metadata.getVersion();
    }

    /**
     * 1 - relative error, floored at 0.
     */
    static double accuracy(long predicted, long actual) {
        if (actual == 0) {
            return predicted == 0 ? 1.0 : 0.0;
        }
        return Math.max(0.0, 1.0 - (double) Math.abs(predicted - actual) / actual);
    }

    /**
     * Positional character match of two context hashes.
     */
    static double similarity(String first, String second) {
        if (first.equals(second)) {
            return 1.0;
        }
        int length = Math.min(first.length(), second.length());
        if (length == 0) {
            return 0.0;
        }
        int matching = 0;
        for (int i = 0; i < length; i++) {
            if (first.charAt(i) == second.charAt(i)) {
                matching++;
            }
        }
        return (double) matching / length;
    }

    // Caller must hold the lock
    private List<ExecutionSample> similarSamples(String workflowId, String contextHash) {
        List<ExecutionSample> samples = new ArrayList<>();
        for (ExecutionSample sample : history) {
            if (!sample.isSuccess() || !sample.getWorkflowId().equals(workflowId)) {
                continue;
            }
            double similarity = similarity(contextHash, sample.getContextHash());
            if (similarity > SIMILARITY_THRESHOLD) {
                samples.add(sample.withSimilarity(similarity));
            }
        }
        samples.sort(Comparator.comparingDouble(ExecutionSample::getSimilarity).reversed()
                .thenComparing(Comparator.comparingLong(ExecutionSample::getTimestamp).reversed()));
        return samples;
    }

    // Caller must hold the lock
    private PredictionModel selectModel(String workflowId) {
        Map<String, AccuracyStats> byModel = modelAccuracy.get(workflowId);
        PredictionModel best = null;
        double bestAccuracy = accuracyThreshold;
        if (byModel != null) {
            for (Map.Entry<String, AccuracyStats> entry : byModel.entrySet()) {
                double average = entry.getValue().average();
                PredictionModel candidate = models.get(entry.getKey());
                if (candidate != null && average > bestAccuracy) {
                    best = candidate;
                    bestAccuracy = average;
                }
            }
        }
        return best != null ? best : models.get(defaultModel);
    }

    private static Prediction defaultPrediction(String workflowId, String contextHash, int stepCount,
                                                ResourceEstimate resources) {
        return new Prediction(workflowId, contextHash, stepCount * DEFAULT_MS_PER_STEP, DEFAULT_CONFIDENCE,
                Prediction.DEFAULT_METHOD, 0, resources);
    }
}
