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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorClassifier Tests")
class ErrorClassifierTest {

    @Test
    @DisplayName("Typed errors pass through unchanged")
    void testTypedErrorPassesThrough() {
        WorkflowExecutionException original = WorkflowExecutionException.validation("workflow", "Workflow is required");

        assertThat(ErrorClassifier.classify(original)).isSameAs(original);
    }

    @Test
    @DisplayName("Wrapped typed errors are unwrapped")
    void testUnwrapsCompletionException() {
        WorkflowExecutionException original = WorkflowExecutionException.resource("memory", 600, 512, "Insufficient memory");

        WorkflowExecutionException classified = ErrorClassifier.classify(
                new CompletionException(new ExecutionException(original)));

        assertThat(classified).isSameAs(original);
    }

    @Test
    void testTimeoutExceptionMapsToTimeout() {
        WorkflowExecutionException classified = ErrorClassifier.classify(new TimeoutException("took too long"));

        assertThat(classified.getKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(classified.isRetryable()).isTrue();
        assertThat(classified.getCause()).isInstanceOf(TimeoutException.class);
    }

    @Test
    void testCancellationIsNotRetryable() {
        WorkflowExecutionException classified = ErrorClassifier.classify(new CancellationException());

        assertThat(classified.getKind()).isEqualTo(ErrorKind.STRATEGY_EXECUTION);
        assertThat(classified.isCancellation()).isTrue();
        assertThat(classified.isRetryable()).isFalse();
    }

    @Test
    void testIllegalArgumentMapsToValidation() {
        WorkflowExecutionException classified = ErrorClassifier.classify(new IllegalArgumentException("bad input"));

        assertThat(classified.getKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(classified.getMessage()).isEqualTo("bad input");
    }

    @ParameterizedTest
    @CsvSource({
            "Operation timed out after 30s, TIMEOUT",
            "Out of memory while loading, RESOURCE",
            "Circular dependency detected, DEPENDENCY",
            "Invalid parameter value, VALIDATION",
            "Cache backend unreachable, CACHE",
            "Queue is full, QUEUE",
            "Could not schedule execution, SCHEDULER",
            "Missing config entry, CONFIGURATION",
            "Connection refused by host, EXTERNAL_SERVICE",
            "Something odd happened, STRATEGY_EXECUTION"
    })
    void testMessageClassification(String message, ErrorKind expected) {
        assertThat(ErrorClassifier.classifyMessage(message)).isEqualTo(expected);
        assertThat(ErrorClassifier.classify(new RuntimeException(message)).getKind()).isEqualTo(expected);
    }

    @Test
    void testNullMessageFallsBackToStrategyExecution() {
        WorkflowExecutionException classified = ErrorClassifier.classify(new RuntimeException());

        assertThat(classified.getKind()).isEqualTo(ErrorKind.STRATEGY_EXECUTION);
        assertThat(classified.getMessage()).isEqualTo("RuntimeException");
    }
}
