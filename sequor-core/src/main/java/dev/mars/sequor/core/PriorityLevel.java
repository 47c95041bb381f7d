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
 * Caller-declared priority of an execution.
 * Combined with the {@code critical} and {@code urgent} flags of
 * {@link ExecutionOptions} to produce the numeric queue priority.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public enum PriorityLevel {

    /**
     * Background work; lowers the computed priority by 2.
     */
    LOW(-2),

    /**
     * The default level.
     */
    NORMAL(0),

    /**
     * Expedited work; raises the computed priority by 5.
     */
    HIGH(5);

    private final int adjustment;

    PriorityLevel(int adjustment) {
        this.adjustment = adjustment;
    }

    public int getAdjustment() {
        return adjustment;
    }

    public static PriorityLevel fromString(String value) {
        if (value == null) {
            return NORMAL;
        }
        for (PriorityLevel level : values()) {
            if (level.name().equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        return NORMAL;
    }
}
