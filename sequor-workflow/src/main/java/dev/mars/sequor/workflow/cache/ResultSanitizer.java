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

import dev.mars.sequor.core.ExecutionResult;
import dev.mars.sequor.core.StepResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prepares results for storage: redacts sensitive keys and drops empty collections.
 * Inputs are never modified; every transformation returns new maps.
 */
final class ResultSanitizer {

    static final String REDACTED = "[REDACTED]";
    static final List<String> SENSITIVE_KEY_FRAGMENTS = List.of("password", "token", "secret", "key", "auth");

    private ResultSanitizer() {
    }

    static ExecutionResult prepare(ExecutionResult result, boolean excludeSensitive, boolean compress) {
        if (!excludeSensitive && !compress) {
            return result;
        }
        List<StepResult> steps = new ArrayList<>();
        for (StepResult step : result.getStepResults()) {
            steps.add(step.toBuilder()
                    .output(transform(step.getOutput(), excludeSensitive, compress))
                    .build());
        }
        // Fresh builder: toBuilder() would merge the untransformed metadata back in
        return ExecutionResult.builder()
                .executionId(result.getExecutionId())
                .workflowName(result.getWorkflowName())
                .strategy(result.getStrategy())
                .success(result.isSuccess())
                .durationMs(result.getDurationMs())
                .completedAt(result.getCompletedAt())
                .error(result.getError())
                .fromCache(result.isFromCache())
                .output(transform(result.getOutput(), excludeSensitive, compress))
                .metadata(transform(result.getMetadata(), excludeSensitive, compress))
                .stepResults(steps)
                .build();
    }

    static StepResult prepare(StepResult result, boolean excludeSensitive, boolean compress) {
        if (!excludeSensitive && !compress) {
            return result;
        }
        return result.toBuilder().output(transform(result.getOutput(), excludeSensitive, compress)).build();
    }

    static Map<String, Object> transform(Map<?, ?> source, boolean redact, boolean compress) {
        Map<String, Object> target = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (redact && isSensitive(key)) {
                target.put(key, REDACTED);
                continue;
            }
            if (compress && isEmptyContainer(value)) {
                continue;
            }
            target.put(key, transformValue(value, redact, compress));
        }
        return target;
    }

    private static Object transformValue(Object value, boolean redact, boolean compress) {
        if (value instanceof Map) {
            return transform((Map<?, ?>) value, redact, compress);
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(transformValue(item, redact, compress));
            }
            return items;
        }
        return value;
    }

    static boolean isSensitive(String key) {
        String normalized = key.toLowerCase(Locale.ROOT);
        for (String fragment : SENSITIVE_KEY_FRAGMENTS) {
            if (normalized.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isEmptyContainer(Object value) {
        return (value instanceof Collection && ((Collection<?>) value).isEmpty())
                || (value instanceof Map && ((Map<?, ?>) value).isEmpty());
    }
}
