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

package dev.mars.sequor.core.exceptions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary throwables onto the {@link ErrorKind} taxonomy.
 * Typed errors pass through unchanged; well-known JDK exceptions map by type;
 * anything else is classified by inspecting its message, falling back to
 * {@link ErrorKind#STRATEGY_EXECUTION}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class ErrorClassifier {

    // Checked in insertion order; the first keyword found wins
    private static final Map<ErrorKind, List<String>> MESSAGE_KEYWORDS = new LinkedHashMap<>();

    static {
        MESSAGE_KEYWORDS.put(ErrorKind.TIMEOUT, List.of("timeout", "timed out", "deadline"));
        MESSAGE_KEYWORDS.put(ErrorKind.RESOURCE, List.of("insufficient", "out of memory", "memory", "cpu", "resource"));
        MESSAGE_KEYWORDS.put(ErrorKind.DEPENDENCY, List.of("circular", "dependency", "depends on"));
        MESSAGE_KEYWORDS.put(ErrorKind.VALIDATION, List.of("invalid", "validation", "required", "must not", "cannot be null"));
        MESSAGE_KEYWORDS.put(ErrorKind.CACHE, List.of("cache"));
        MESSAGE_KEYWORDS.put(ErrorKind.QUEUE, List.of("queue"));
        MESSAGE_KEYWORDS.put(ErrorKind.SCHEDULER, List.of("schedul"));
        MESSAGE_KEYWORDS.put(ErrorKind.CONFIGURATION, List.of("config", "property", "setting"));
        MESSAGE_KEYWORDS.put(ErrorKind.CONTEXT, List.of("context"));
        MESSAGE_KEYWORDS.put(ErrorKind.RESULT, List.of("result"));
        MESSAGE_KEYWORDS.put(ErrorKind.EXTERNAL_SERVICE, List.of("connection", "network", "service", "http", "refused", "unavailable"));
        MESSAGE_KEYWORDS.put(ErrorKind.STEP_EXECUTION, List.of("step"));
        MESSAGE_KEYWORDS.put(ErrorKind.OPTIMIZATION, List.of("optimiz"));
        MESSAGE_KEYWORDS.put(ErrorKind.MONITORING, List.of("monitor", "metric"));
    }

    private ErrorClassifier() {
    }

    /**
     * Classify a throwable into a typed execution exception.
     *
     * @param error the raw error, never null
     * @return a typed exception; the same instance when already typed
     */
    public static WorkflowExecutionException classify(Throwable error) {
        Throwable root = unwrap(error);

        if (root instanceof WorkflowExecutionException) {
            return (WorkflowExecutionException) root;
        }
        if (root instanceof TimeoutException) {
            return WorkflowExecutionException.builder(ErrorKind.TIMEOUT, messageOf(root))
                    .detail(WorkflowExecutionException.DETAIL_TIMEOUT_SCOPE, "execution")
                    .cause(root)
                    .build();
        }
        if (root instanceof CancellationException || root instanceof InterruptedException) {
            return WorkflowExecutionException.builder(ErrorKind.STRATEGY_EXECUTION, "Execution cancelled: " + messageOf(root))
                    .detail(WorkflowExecutionException.DETAIL_CANCELLED, true)
                    .retryable(false)
                    .cause(root)
                    .build();
        }
        if (root instanceof IllegalArgumentException || root instanceof NullPointerException) {
            return WorkflowExecutionException.builder(ErrorKind.VALIDATION, messageOf(root))
                    .cause(root)
                    .build();
        }

        return WorkflowExecutionException.builder(classifyMessage(root.getMessage()), messageOf(root))
                .cause(root)
                .build();
    }

    /**
     * Classify an error message alone.
     */
    public static ErrorKind classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return ErrorKind.STRATEGY_EXECUTION;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<ErrorKind, List<String>> entry : MESSAGE_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (normalized.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return ErrorKind.STRATEGY_EXECUTION;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
