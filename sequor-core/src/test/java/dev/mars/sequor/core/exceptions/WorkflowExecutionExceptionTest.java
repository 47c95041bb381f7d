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

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorkflowExecutionException.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
class WorkflowExecutionExceptionTest {

    @Test
    void testResourceErrorCarriesAmounts() {
        WorkflowExecutionException error = WorkflowExecutionException.resource(
                "memory", 600L, 512L, "Insufficient memory: 0 + 600 > 512");

        assertEquals(ErrorKind.RESOURCE, error.getKind());
        assertEquals("memory", error.getDetail(WorkflowExecutionException.DETAIL_RESOURCE_TYPE));
        assertEquals(600L, error.getDetail(WorkflowExecutionException.DETAIL_REQUIRED));
        assertEquals(512L, error.getDetail(WorkflowExecutionException.DETAIL_AVAILABLE));
        assertFalse(error.isRetryable());
        assertTrue(error instanceof SequorException);
    }

    @Test
    void testStepFailureRetryableUntilLastAttempt() {
        WorkflowExecutionException first = WorkflowExecutionException.stepFailure(1, "compile", 1, 3, "failed", null);
        WorkflowExecutionException last = WorkflowExecutionException.stepFailure(1, "compile", 3, 3, "failed", null);

        assertTrue(first.isRetryable());
        assertFalse(last.isRetryable());
        assertEquals(Integer.valueOf(1), first.getStepIndex());
        assertEquals("compile", first.getStepName());
    }

    @Test
    void testTimeoutScope() {
        WorkflowExecutionException error = WorkflowExecutionException.timeout(
                WorkflowExecutionException.TimeoutScope.STEP, 1000, "Step timed out");

        assertEquals(ErrorKind.TIMEOUT, error.getKind());
        assertEquals("step", error.getDetail(WorkflowExecutionException.DETAIL_TIMEOUT_SCOPE));
        assertEquals(1000L, error.getDetail(WorkflowExecutionException.DETAIL_TIMEOUT_MS));
        assertTrue(error.isRetryable());
    }

    @Test
    void testWithExecutionKeepsExistingValues() {
        WorkflowExecutionException error = WorkflowExecutionException.queue("exec-1", "Queue is full");

        WorkflowExecutionException enriched = error.withExecution("exec-2", "build");

        assertEquals("exec-1", enriched.getExecutionId());
        assertEquals("build", enriched.getWorkflowName());
        assertEquals(ErrorKind.QUEUE, enriched.getKind());
        assertNull(error.getWorkflowName());
    }

    @Test
    void testToMap() {
        WorkflowExecutionException error = WorkflowExecutionException.builder(ErrorKind.DEPENDENCY, "Missing dependency")
                .executionId("exec-9")
                .workflowName("deploy")
                .step(2, "migrate")
                .detail(WorkflowExecutionException.DETAIL_DEPENDENCY_ID, "exec-1")
                .detail("ignored", null)
                .build();

        Map<String, Object> map = error.toMap();

        assertEquals("dependency", map.get("kind"));
        assertEquals("Missing dependency", map.get("message"));
        assertEquals("exec-9", map.get("executionId"));
        assertEquals("deploy", map.get("workflowName"));
        assertEquals(2, map.get("stepIndex"));
        assertEquals("migrate", map.get("stepName"));
        @SuppressWarnings("unchecked")
        Map<String, Object> details = (Map<String, Object>) map.get("details");
        assertEquals("exec-1", details.get("dependencyId"));
        assertFalse(details.containsKey("ignored"));
    }

    @Test
    void testErrorKindFromValue() {
        assertEquals(ErrorKind.EXTERNAL_SERVICE, ErrorKind.fromValue("external_service"));
        assertEquals(ErrorKind.CACHE, ErrorKind.fromValue("CACHE"));
        assertThrows(IllegalArgumentException.class, () -> ErrorKind.fromValue("unknown"));
    }
}
