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

import java.util.Map;

/**
 * Mutable key/value bag threaded through every step of an execution.
 * Implementations must tolerate concurrent access from parallel steps.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public interface WorkflowContext {

    Object get(String key);

    void set(String key, Object value);

    /**
     * Snapshot of all entries.
     */
    Map<String, Object> getAll();

    boolean contains(String key);

    Object remove(String key);

    /**
     * Lookup used by optimizers for execution flags such as {@code fastMode}.
     * Defaults to {@link #get(String)}.
     */
    default Object getData(String key) {
        return get(key);
    }

    /**
     * Whether a flag entry is set to {@code true} (boolean or string form).
     */
    default boolean isEnabled(String key) {
        Object value = getData(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value instanceof String && Boolean.parseBoolean((String) value);
    }
}
