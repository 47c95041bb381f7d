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

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Samples the local host through the platform {@link OperatingSystemMXBean}.
 * Physical memory and CPU load come from the {@code com.sun.management} extension when present;
 * otherwise JVM heap figures and the load average stand in.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public class HostResourceSampler implements SystemResourceSampler {

    private static final Logger logger = Logger.getLogger(HostResourceSampler.class.getName());
    private static final long MB = 1024L * 1024L;

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public SystemResourceSnapshot sample() {
        try {
            double loadAverage = Math.max(0, osBean.getSystemLoadAverage());
            if (osBean instanceof com.sun.management.OperatingSystemMXBean) {
                com.sun.management.OperatingSystemMXBean sunBean = (com.sun.management.OperatingSystemMXBean) osBean;
                long total = sunBean.getTotalMemorySize();
                long free = sunBean.getFreeMemorySize();
                double cpuLoad = sunBean.getCpuLoad();
                return new SystemResourceSnapshot(
                        total / MB,
                        (total - free) / MB,
                        cpuLoad >= 0 ? cpuLoad * 100.0 : 0.0,
                        loadAverage);
            }

            Runtime runtime = Runtime.getRuntime();
            long total = runtime.maxMemory();
            long used = runtime.totalMemory() - runtime.freeMemory();
            int processors = Math.max(1, osBean.getAvailableProcessors());
            double cpuEstimate = Math.min(100.0, loadAverage / processors * 100.0);
            return new SystemResourceSnapshot(total / MB, used / MB, cpuEstimate, loadAverage);
        } catch (RuntimeException e) {
            logger.warning("Failed to sample host resources: " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Host sampling failure", e);
            }
            return SystemResourceSnapshot.empty();
        }
    }
}
