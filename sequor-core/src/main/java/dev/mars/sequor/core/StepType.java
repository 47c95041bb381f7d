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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The kind of work a workflow step performs.
 * Heuristics throughout the engine (resource estimates, phase ordering,
 * duration predictions) are keyed by step type.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public enum StepType {

    SETUP("setup", 1),
    VALIDATION("validation", 2),
    ANALYSIS("analysis", 3),
    PROCESSING("processing", 4),
    TESTING("testing", 5),
    DEPLOYMENT("deployment", 6),
    CLEANUP("cleanup", 7),
    REFACTORING("refactoring", 999),
    DOCUMENTATION("documentation", 999),
    CUSTOM("custom", 999);

    private final String value;
    private final int phaseOrder;

    StepType(String value, int phaseOrder) {
        this.value = value;
        this.phaseOrder = phaseOrder;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Position of this type in the canonical setup → cleanup pipeline.
     * Types outside the pipeline sort last.
     */
    public int getPhaseOrder() {
        return phaseOrder;
    }

    /**
     * Whether steps of this type are typically CPU or memory heavy.
     */
    public boolean isResourceIntensive() {
        return this == ANALYSIS || this == TESTING || this == DEPLOYMENT || this == REFACTORING;
    }

    /**
     * Lenient lookup: unknown or missing values map to {@link #CUSTOM}.
     */
    @JsonCreator
    public static StepType fromValue(String value) {
        if (value == null) {
            return CUSTOM;
        }
        for (StepType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return CUSTOM;
    }
}
