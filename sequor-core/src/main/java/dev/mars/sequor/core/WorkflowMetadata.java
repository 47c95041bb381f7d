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
 * Immutable description of a workflow: identity, version, type and its ordered steps.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class WorkflowMetadata {

    private final String id;
    private final String name;
    private final String version;
    private final String type;
    private final String description;
    private final List<Step> steps;
    private final Map<String, Object> attributes;

    private WorkflowMetadata(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Workflow name cannot be null");
        this.id = builder.id != null ? builder.id : builder.name;
        this.version = builder.version != null ? builder.version : "1.0.0";
        this.type = builder.type;
        this.description = builder.description;
        this.steps = List.copyOf(builder.steps);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public int getStepCount() {
        return steps.size();
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * Identity used by caches and learners: {@code name_version}.
     */
    public String getWorkflowKey() {
        return name + "_" + version;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .version(version)
                .type(type)
                .description(description)
                .steps(steps)
                .attributes(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "WorkflowMetadata{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", version='" + version + '\'' +
               ", steps=" + steps.size() +
               '}';
    }

    /**
     * Builder for WorkflowMetadata.
     */
    public static class Builder {
        private String id;
        private String name;
        private String version;
        private String type;
        private String description;
        private final List<Step> steps = new ArrayList<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder steps(List<? extends Step> steps) {
            this.steps.clear();
            if (steps != null) {
                this.steps.addAll(steps);
            }
            return this;
        }

        public Builder step(Step step) {
            this.steps.add(step);
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

        public WorkflowMetadata build() {
            return new WorkflowMetadata(this);
        }
    }
}
