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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link WorkflowContext}.
 * Null values are not stored; setting a key to null removes it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class SimpleWorkflowContext implements WorkflowContext {

    private final Map<String, Object> data = new ConcurrentHashMap<>();

    public SimpleWorkflowContext() {
    }

    public SimpleWorkflowContext(Map<String, ?> initialData) {
        if (initialData != null) {
            initialData.forEach(this::set);
        }
    }

    public static SimpleWorkflowContext of(Map<String, ?> initialData) {
        return new SimpleWorkflowContext(initialData);
    }

    @Override
    public Object get(String key) {
        return data.get(key);
    }

    @Override
    public void set(String key, Object value) {
        Objects.requireNonNull(key, "Context key cannot be null");
        if (value == null) {
            data.remove(key);
        } else {
            data.put(key, value);
        }
    }

    @Override
    public Map<String, Object> getAll() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    @Override
    public boolean contains(String key) {
        return data.containsKey(key);
    }

    @Override
    public Object remove(String key) {
        return data.remove(key);
    }

    @Override
    public String toString() {
        return "SimpleWorkflowContext{keys=" + data.keySet() + '}';
    }
}
