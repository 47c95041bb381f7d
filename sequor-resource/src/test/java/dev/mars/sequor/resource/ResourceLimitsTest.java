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

package dev.mars.sequor.resource;

import dev.mars.sequor.config.SequorConfiguration;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ResourceLimitsTest {

    @Test
    void testDefaults() {
        ResourceLimits limits = ResourceLimits.defaults();

        assertEquals(512, limits.getMaxMemoryMb());
        assertEquals(80.0, limits.getMaxCpuPercent(), 0.001);
        assertEquals(5, limits.getMaxConcurrentExecutions());
        assertEquals(300000, limits.getTimeoutMs());
    }

    @Test
    void testFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(SequorConfiguration.RESOURCE_MAX_MEMORY_MB, "2048");
        properties.setProperty(SequorConfiguration.RESOURCE_MAX_CONCURRENT, "12");

        ResourceLimits limits = ResourceLimits.fromConfiguration(new SequorConfiguration(properties));

        assertEquals(2048, limits.getMaxMemoryMb());
        assertEquals(12, limits.getMaxConcurrentExecutions());
        assertEquals(80.0, limits.getMaxCpuPercent(), 0.001);
    }

    @Test
    void testNonPositiveLimitsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ResourceLimits.builder().maxMemoryMb(0).build());
        assertThrows(IllegalArgumentException.class, () -> ResourceLimits.builder().maxCpuPercent(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ResourceLimits.builder().maxConcurrentExecutions(0).build());
    }

    @Test
    void testToBuilderKeepsOtherValues() {
        ResourceLimits limits = ResourceLimits.defaults().toBuilder().maxMemoryMb(1024).build();

        assertEquals(1024, limits.getMaxMemoryMb());
        assertEquals(5, limits.getMaxConcurrentExecutions());
    }

    @Test
    void testHostSamplerReturnsSaneSnapshot() {
        SystemResourceSnapshot snapshot = new HostResourceSampler().sample();

        assertTrue(snapshot.getTotalMemoryMb() >= 0);
        assertTrue(snapshot.getUsedMemoryMb() >= 0);
        assertTrue(snapshot.getCpuUsagePercent() >= 0.0);
    }
}
