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

package dev.mars.sequor.workflow.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.sequor.core.Step;
import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.core.WorkflowContext;
import dev.mars.sequor.core.WorkflowMetadata;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Builds cache fingerprints from workflows, steps and the cache-relevant part of a context.
 * Fingerprints are MD5 digests of canonical JSON, so equal inputs give equal keys
 * regardless of map insertion order. Values Jackson cannot write are fingerprinted from
 * a sorted text rendering instead, which still depends on every value in the input.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class CacheKeyGenerator {

    private static final Logger logger = Logger.getLogger(CacheKeyGenerator.class.getName());

    /**
     * Context keys that take part in the fingerprint. Everything else in the context is ignored.
     */
    public static final List<String> RELEVANT_CONTEXT_KEYS = List.of(
            "projectId", "userId", "environment", "mode", "version", "config", "settings", "parameters");

    private final ObjectMapper objectMapper;

    public CacheKeyGenerator() {
        this.objectMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String workflowKey(Workflow workflow, WorkflowContext context) {
        return hashWorkflow(workflow) + "_" + hashContext(context);
    }

    public String stepKey(Step step, WorkflowContext context) {
        return "step_" + hashStep(step) + "_" + hashContext(context);
    }

    public String hashWorkflow(Workflow workflow) {
        WorkflowMetadata metadata = workflow.getMetadata();
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("name", metadata.getName());
        canonical.put("version", metadata.getVersion());
        List<Map<String, Object>> steps = new ArrayList<>();
        for (Step step : metadata.getSteps()) {
            steps.add(describeStep(step.getMetadata(), false));
        }
        canonical.put("steps", steps);
        return digest(canonical, "workflow " + metadata.getName());
    }

    public String hashStep(Step step) {
        return digest(describeStep(step.getMetadata(), true), "step " + step.getMetadata().getName());
    }

    public String hashContext(WorkflowContext context) {
        if (context == null) {
            return digest(Map.of(), "context");
        }
        Map<String, Object> all = context.getAll();
        Map<String, Object> relevant = new LinkedHashMap<>();
        for (String key : RELEVANT_CONTEXT_KEYS) {
            Object value = all.get(key);
            if (value != null) {
                relevant.put(key, value);
            }
        }
        return digest(relevant, "context");
    }

    private static Map<String, Object> describeStep(StepMetadata metadata, boolean includeVersion) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("type", metadata.getType().getValue());
        description.put("name", metadata.getName());
        if (includeVersion) {
            description.put("version", metadata.getVersion());
        }
        description.put("parameters", metadata.getParameters());
        return description;
    }

    private String digest(Object value, String subject) {
        try {
            byte[] json = objectMapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
            return md5(json);
        } catch (JsonProcessingException e) {
            logger.fine("Fingerprinting " + subject + " from text: " + e.getOriginalMessage());
            StringBuilder text = new StringBuilder();
            appendCanonical(text, value);
            return md5(text.toString().getBytes(StandardCharsets.UTF_8));
        }
    }

    /**
     * Maps are written in key order, collections in iteration order, anything else by type and
     * {@code toString}.
     */
    static void appendCanonical(StringBuilder out, Object value) {
        if (value instanceof Map) {
            Map<String, Object> sorted = new TreeMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> sorted.put(String.valueOf(k), v));
            out.append('{');
            sorted.forEach((k, v) -> {
                out.append(k).append('=');
                appendCanonical(out, v);
                out.append(';');
            });
            out.append('}');
        } else if (value instanceof Collection) {
            out.append('[');
            for (Object element : (Collection<?>) value) {
                appendCanonical(out, element);
                out.append(';');
            }
            out.append(']');
        } else if (value == null) {
            out.append("null");
        } else {
            out.append(value.getClass().getName()).append(':').append(value);
        }
    }

    static String md5(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return bytesToHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }
}
