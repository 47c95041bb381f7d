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

import dev.mars.sequor.core.StepType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Static per-type load profile used by the batch and smart strategies to decide what may run
 * side by side.
 */
final class StepLoad {

    static final String LOW = "low";
    static final String MEDIUM = "medium";
    static final String HIGH = "high";

    private static final long DEFAULT_MEMORY_MB = 256;
    private static final double DEFAULT_CPU_PERCENT = 50;
    private static final double DEFAULT_PERFORMANCE = 0.8;
    private static final long DEFAULT_DURATION_MS = 3000;

    private static final Map<StepType, Profile> PROFILES = new EnumMap<>(StepType.class);

    static {
        PROFILES.put(StepType.ANALYSIS, new Profile(512, 80, HIGH, HIGH, 0.8, 5000));
        PROFILES.put(StepType.TESTING, new Profile(256, 60, MEDIUM, MEDIUM, 0.9, 3000));
        PROFILES.put(StepType.DEPLOYMENT, new Profile(1024, 70, HIGH, HIGH, 0.7, 8000));
        PROFILES.put(StepType.REFACTORING, new Profile(512, 75, MEDIUM, HIGH, 0.8, 4000));
        PROFILES.put(StepType.DOCUMENTATION, new Profile(128, 20, LOW, LOW, 0.95, 2000));
        PROFILES.put(StepType.VALIDATION, new Profile(128, 30, LOW, LOW, 0.9, 1500));
        PROFILES.put(StepType.SETUP, new Profile(256, 40, LOW, LOW, 0.85, 2500));
        PROFILES.put(StepType.CLEANUP, new Profile(128, 25, LOW, LOW, 0.95, 1000));
    }

    private static final class Profile {
        final long memoryMb;
        final double cpuPercent;
        final String resourceLevel;
        final String complexity;
        final double performance;
        final long durationMs;

        Profile(long memoryMb, double cpuPercent, String resourceLevel, String complexity,
                double performance, long durationMs) {
            this.memoryMb = memoryMb;
            this.cpuPercent = cpuPercent;
            this.resourceLevel = resourceLevel;
            this.complexity = complexity;
            this.performance = performance;
            this.durationMs = durationMs;
        }
    }

    private StepLoad() {
    }

    static long memoryMb(StepType type) {
        Profile profile = PROFILES.get(type);
        return profile != null ? profile.memoryMb : DEFAULT_MEMORY_MB;
    }

    static double cpuPercent(StepType type) {
        Profile profile = PROFILES.get(type);
        return profile != null ? profile.cpuPercent : DEFAULT_CPU_PERCENT;
    }

    static String resourceLevel(StepType type) {
        Profile profile = PROFILES.get(type);
        return profile != null ? profile.resourceLevel : MEDIUM;
    }

    static String complexity(StepType type) {
        Profile profile = PROFILES.get(type);
        return profile != null ? profile.complexity : MEDIUM;
    }

    /**
     * Prior success-per-time score for a type with no history, between 0 and 1.
     */
    static double performance(StepType type) {
        Profile profile = PROFILES.get(type);
        return profile != null ? profile.performance : DEFAULT_PERFORMANCE;
    }

    static long expectedDurationMs(StepType type) {
        Profile profile = PROFILES.get(type);
        return profile != null ? profile.durationMs : DEFAULT_DURATION_MS;
    }
}
