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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a workflow step.
 * <p>
 * {@code dependencies} name other steps of the same workflow that must run first;
 * {@code resources} name shared resources (files, services, environments) the step
 * touches, so that two steps sharing a resource are never run concurrently.
 * Free-form {@code attributes} carry optimizer hints such as
 * {@code executionStrategy}, {@code disabled} or {@code conditions}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class StepMetadata {

    public static final String ATTR_DISABLED = "disabled";
    public static final String ATTR_CONDITIONS = "conditions";
    public static final String ATTR_EXECUTION_STRATEGY = "executionStrategy";
    public static final String ATTR_RESOURCE_REQUIREMENTS = "resourceRequirements";
    public static final String ATTR_OPTIMIZED = "optimized";
    public static final String ATTR_CACHEABLE = "cacheable";

    private final String name;
    private final StepType type;
    private final String version;
    private final String description;
    private final Map<String, Object> parameters;
    private final List<String> dependencies;
    private final List<String> resources;
    private final Map<String, Object> attributes;

    private StepMetadata(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Step name cannot be null");
        this.type = builder.type != null ? builder.type : StepType.CUSTOM;
        this.version = builder.version != null ? builder.version : "1.0";
        this.description = builder.description;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.dependencies = List.copyOf(builder.dependencies);
        this.resources = List.copyOf(builder.resources);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public String getName() {
        return name;
    }

    public StepType getType() {
        return type;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public List<String> getResources() {
        return resources;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getParameter(String key) {
        return parameters.get(key);
    }

    public boolean hasParameter(String key) {
        return parameters.get(key) != null;
    }

    /**
     * Numeric parameter lookup tolerant of strings and boxed types.
     */
    public long getLongParameter(String key, long defaultValue) {
        return toLong(parameters.get(key), defaultValue);
    }

    public boolean getBooleanParameter(String key) {
        return toBoolean(parameters.get(key));
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public boolean isDisabled() {
        return toBoolean(attributes.get(ATTR_DISABLED));
    }

    public boolean isOptimized() {
        return toBoolean(attributes.get(ATTR_OPTIMIZED));
    }

    public boolean isCacheable() {
        return toBoolean(attributes.get(ATTR_CACHEABLE)) || toBoolean(parameters.get(ATTR_CACHEABLE));
    }

    public String getExecutionStrategy() {
        Object strategy = attributes.get(ATTR_EXECUTION_STRATEGY);
        return strategy != null ? strategy.toString() : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getConditions() {
        Object conditions = attributes.get(ATTR_CONDITIONS);
        if (conditions instanceof Map) {
            return (Map<String, Object>) conditions;
        }
        return Map.of();
    }

    /**
     * Unique key of this step within a workflow: type, name and version.
     */
    public String getStepId() {
        return type.getValue() + "_" + name + "_" + version;
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .type(type)
                .version(version)
                .description(description)
                .parameters(parameters)
                .dependencies(dependencies)
                .resources(resources)
                .attributes(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    static long toLong(Object value, long defaultValue) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value instanceof String && Boolean.parseBoolean((String) value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepMetadata that = (StepMetadata) o;
        return Objects.equals(name, that.name) &&
               type == that.type &&
               Objects.equals(version, that.version) &&
               Objects.equals(parameters, that.parameters) &&
               Objects.equals(dependencies, that.dependencies) &&
               Objects.equals(resources, that.resources) &&
               Objects.equals(attributes, that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, version, parameters, dependencies, resources, attributes);
    }

    @Override
    public String toString() {
        return "StepMetadata{" +
               "name='" + name + '\'' +
               ", type=" + type +
               ", parameters=" + parameters +
               ", dependencies=" + dependencies +
               '}';
    }

    /**
     * Builder for StepMetadata.
     */
    public static class Builder {
        private String name;
        private StepType type;
        private String version;
        private String description;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final List<String> dependencies = new ArrayList<>();
        private final List<String> resources = new ArrayList<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(StepType type) {
            this.type = type;
            return this;
        }

        public Builder type(String type) {
            this.type = StepType.fromValue(type);
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters.clear();
            if (parameters != null) {
                this.parameters.putAll(parameters);
            }
            return this;
        }

        public Builder parameter(String key, Object value) {
            this.parameters.put(key, value);
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies.clear();
            if (dependencies != null) {
                this.dependencies.addAll(dependencies);
            }
            return this;
        }

        public Builder dependsOn(String stepName) {
            this.dependencies.add(stepName);
            return this;
        }

        public Builder resources(List<String> resources) {
            this.resources.clear();
            if (resources != null) {
                this.resources.addAll(resources);
            }
            return this;
        }

        public Builder resource(String resource) {
            this.resources.add(resource);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes.clear();
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public StepMetadata build() {
            return new StepMetadata(this);
        }
    }
}
