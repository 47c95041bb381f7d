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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExecutionResult and StepResult.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
class ExecutionResultTest {

    private ExecutionResult createResult() {
        StepResult first = StepResult.builder()
                .index(0)
                .name("setup")
                .type(StepType.SETUP)
                .status(StepStatus.COMPLETED)
                .output(Map.of("ready", true))
                .durationMs(12)
                .build();
        StepResult second = StepResult.builder()
                .index(1)
                .name("build")
                .type(StepType.PROCESSING)
                .status(StepStatus.FAILED)
                .error("compiler crashed")
                .durationMs(40)
                .build();

        return ExecutionResult.builder()
                .executionId("exec-1")
                .workflowName("pipeline")
                .strategy("basic")
                .success(false)
                .durationMs(60)
                .stepResults(List.of(first, second))
                .error("Step 1 failed: compiler crashed")
                .metadata("attempt", 1)
                .build();
    }

    @Test
    void testSuccessfulAndFailedSteps() {
        ExecutionResult result = createResult();

        assertEquals(1, result.getSuccessfulSteps().size());
        assertEquals("setup", result.getSuccessfulSteps().get(0).getName());
        assertEquals(1, result.getFailedSteps().size());
        assertEquals("build", result.getFailedSteps().get(0).getName());
    }

    @Test
    void testToMap() {
        Map<String, Object> map = createResult().toMap();

        assertEquals("exec-1", map.get("executionId"));
        assertEquals("pipeline", map.get("workflowName"));
        assertEquals(false, map.get("success"));
        assertEquals(2, map.get("totalSteps"));
        assertEquals(1, map.get("successfulSteps"));
        assertEquals(1, map.get("failedSteps"));
        assertEquals("Step 1 failed: compiler crashed", map.get("error"));
    }

    @Test
    void testAsCachedFor() {
        ExecutionResult cached = createResult().asCachedFor("exec-2");

        assertEquals("exec-2", cached.getExecutionId());
        assertEquals(0, cached.getDurationMs());
        assertTrue(cached.isFromCache());
        assertEquals(2, cached.getStepResults().size());
    }

    @Test
    void testStepResultCopies() {
        StepResult step = createResult().getStepResults().get(0);

        StepResult parallel = step.withParallel(true);
        StepResult cached = step.asCached(3, 1000L);

        assertTrue(parallel.isParallel());
        assertFalse(step.isParallel());
        assertTrue(cached.isFromCache());
        assertEquals(3, cached.getIndex());
        assertEquals(0, cached.getDurationMs());
        assertEquals(0, cached.getAttempts());
    }

    @Test
    void testSerializesWithJackson() throws Exception {
        String json = new ObjectMapper().writeValueAsString(createResult());

        assertTrue(json.contains("\"workflowName\":\"pipeline\""));
        assertTrue(json.contains("\"type\":\"processing\""));
        assertFalse(json.contains("successfulSteps"));
    }
}
