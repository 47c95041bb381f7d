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

package dev.mars.sequor.monitoring;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EngineHealthCheck.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
class EngineHealthCheckTest {

    private static EngineHealthCheck.Builder idle() {
        return EngineHealthCheck.builder()
                .queue(0, 100)
                .resources(0.0, 0.0, 0)
                .workers(true, 0, 10)
                .alerts(0, 0, null);
    }

    @Test
    void testIdleEngineIsUp() {
        EngineHealthCheck check = idle().build();

        assertEquals(EngineHealthCheck.Status.UP, check.getStatus());
        assertTrue(check.isHealthy());
        assertNull(check.getMessage());
        assertNotNull(check.getTimestamp());
        assertEquals(List.of("queue", "resources", "workers", "monitor"),
                check.getComponents().stream().map(EngineHealthCheck.Component::getName).collect(Collectors.toList()));
    }

    @Test
    void testQueueAtPressureThresholdIsDegraded() {
        EngineHealthCheck check = idle().queue(90, 100).build();

        assertEquals(EngineHealthCheck.Status.DEGRADED, check.getStatus());
        assertEquals(90.0, check.getQueueUtilization());
        EngineHealthCheck.Component queue = check.getComponent(EngineHealthCheck.QUEUE);
        assertEquals(EngineHealthCheck.Status.DEGRADED, queue.getStatus());
        assertEquals("Queue is 90% full", queue.getMessage());
        assertEquals("Queue is 90% full", check.getMessage());
    }

    @Test
    void testQueueBelowThresholdIsUp() {
        EngineHealthCheck check = idle().queue(89, 100).build();

        assertEquals(EngineHealthCheck.Status.UP, check.getStatus());
    }

    @Test
    void testResourcePressureUsesTheHigherUtilization() {
        EngineHealthCheck check = idle().resources(40.0, 95.0, 3).build();

        assertEquals(95.0, check.getResourcePressure());
        EngineHealthCheck.Component resources = check.getComponent(EngineHealthCheck.RESOURCES);
        assertEquals(EngineHealthCheck.Status.DEGRADED, resources.getStatus());
        assertTrue(resources.getMessage().contains("cpu"));
        assertEquals(3, resources.getDetails().get("activeAllocations"));
    }

    @Test
    void testCustomPressureThreshold() {
        EngineHealthCheck check = idle().pressurePercent(50.0).resources(60.0, 10.0, 1).build();

        assertEquals(EngineHealthCheck.Status.DEGRADED, check.getStatus());
        assertTrue(check.getComponent(EngineHealthCheck.RESOURCES).getMessage().contains("memory"));
    }

    @Test
    void testCriticalAlertsDegradeTheMonitor() {
        EngineHealthCheck check = idle().alerts(2, 1, "Memory usage 97.0% exceeded threshold").build();

        assertEquals(EngineHealthCheck.Status.DEGRADED, check.getStatus());
        assertEquals(1, check.getCriticalAlerts());
        assertEquals("Memory usage 97.0% exceeded threshold",
                check.getComponent(EngineHealthCheck.MONITOR).getMessage());
    }

    @Test
    void testStoppedEngineIsDownWhateverElseReports() {
        EngineHealthCheck check = idle().queue(95, 100).workers(false, 0, 10).build();

        assertEquals(EngineHealthCheck.Status.DOWN, check.getStatus());
        assertFalse(check.isAcceptingWork());
        assertEquals("Execution engine is shut down", check.getMessage());
        assertEquals(EngineHealthCheck.Status.DOWN, check.getComponent(EngineHealthCheck.WORKERS).getStatus());
    }

    @Test
    void testEmptyQueueCapacityHasNoUtilization() {
        EngineHealthCheck check = idle().queue(5, 0).build();

        assertEquals(0.0, check.getQueueUtilization());
        assertEquals(EngineHealthCheck.Status.UP, check.getStatus());
    }

    @Test
    void testUnknownComponent() {
        assertThrows(IllegalArgumentException.class, () -> idle().build().getComponent("cache"));
    }

    @Test
    void testToMap() {
        EngineHealthCheck check = idle()
                .timestamp(Instant.parse("2025-10-28T10:00:00Z"))
                .queue(95, 100)
                .workers(true, 2, 10)
                .activeExecutions(3)
                .build();

        Map<String, Object> map = check.toMap();

        assertEquals("DEGRADED", map.get("status"));
        assertEquals("2025-10-28T10:00:00Z", map.get("timestamp"));
        assertEquals("Queue is 95% full", map.get("message"));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> components = (List<Map<String, Object>>) map.get("components");
        assertEquals(4, components.size());
        assertEquals("queue", components.get(0).get("component"));

        @SuppressWarnings("unchecked")
        Map<String, Object> system = (Map<String, Object>) map.get("system");
        assertEquals(3, system.get("activeExecutions"));
        assertEquals(2, system.get("runningExecutions"));
        assertEquals(95, system.get("queueSize"));

        @SuppressWarnings("unchecked")
        Map<String, Object> summary = (Map<String, Object>) map.get("summary");
        assertEquals(4, summary.get("totalComponents"));
        assertEquals(3L, summary.get("healthyComponents"));
        assertEquals(1L, summary.get("unhealthyComponents"));
    }
}
