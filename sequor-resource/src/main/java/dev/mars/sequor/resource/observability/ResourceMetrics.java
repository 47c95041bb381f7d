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

package dev.mars.sequor.resource.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for the Sequor resource module.
 *
 * Provides:
 * - sequor.resource.allocations (counter) - Successful allocations
 * - sequor.resource.rejections (counter) - Allocations denied by the limits
 * - sequor.resource.releases (counter) - Released allocations
 * - sequor.resource.violations (counter) - Usage violations raised by monitoring
 * - sequor.resource.allocated.memory (gauge) - Memory currently allocated per pool
 * - sequor.resource.allocated.cpu (gauge) - CPU percent currently allocated per pool
 * - sequor.resource.active (gauge) - Live allocations per pool
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class ResourceMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ResourceMetrics.class);
    private static final String METER_NAME = "sequor-resource";

    private static ResourceMetrics instance;

    private final LongCounter allocations;
    private final LongCounter rejections;
    private final LongCounter releases;
    private final LongCounter violations;

    // Gauge suppliers, registered by each resource manager
    private final ConcurrentHashMap<String, Supplier<Long>> memorySuppliers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Supplier<Double>> cpuSuppliers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Supplier<Long>> activeSuppliers = new ConcurrentHashMap<>();

    private static final AttributeKey<String> POOL_KEY = AttributeKey.stringKey("resource.pool");
    private static final AttributeKey<String> RESOURCE_TYPE_KEY = AttributeKey.stringKey("resource.type");

    private ResourceMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        allocations = meter.counterBuilder("sequor.resource.allocations")
                .setDescription("Number of successful resource allocations")
                .setUnit("1")
                .build();

        rejections = meter.counterBuilder("sequor.resource.rejections")
                .setDescription("Number of allocations denied by the resource limits")
                .setUnit("1")
                .build();

        releases = meter.counterBuilder("sequor.resource.releases")
                .setDescription("Number of released allocations")
                .setUnit("1")
                .build();

        violations = meter.counterBuilder("sequor.resource.violations")
                .setDescription("Number of resource usage violations")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("sequor.resource.allocated.memory")
                .setDescription("Memory currently allocated to executions")
                .setUnit("MBy")
                .ofLongs()
                .buildWithCallback(measurement -> {
                    for (Map.Entry<String, Supplier<Long>> entry : memorySuppliers.entrySet()) {
                        measurement.record(entry.getValue().get(), Attributes.of(POOL_KEY, entry.getKey()));
                    }
                });

        meter.gaugeBuilder("sequor.resource.allocated.cpu")
                .setDescription("CPU percent currently allocated to executions")
                .setUnit("%")
                .buildWithCallback(measurement -> {
                    for (Map.Entry<String, Supplier<Double>> entry : cpuSuppliers.entrySet()) {
                        measurement.record(entry.getValue().get(), Attributes.of(POOL_KEY, entry.getKey()));
                    }
                });

        meter.gaugeBuilder("sequor.resource.active")
                .setDescription("Number of live allocations")
                .ofLongs()
                .buildWithCallback(measurement -> {
                    for (Map.Entry<String, Supplier<Long>> entry : activeSuppliers.entrySet()) {
                        measurement.record(entry.getValue().get(), Attributes.of(POOL_KEY, entry.getKey()));
                    }
                });

        logger.info("ResourceMetrics initialized");
    }

    public static synchronized ResourceMetrics getInstance() {
        if (instance == null) {
            instance = new ResourceMetrics();
        }
        return instance;
    }

    public void recordAllocation(String pool, long memoryMb, double cpuPercent) {
        allocations.add(1, Attributes.of(POOL_KEY, pool));
        logger.debug("Allocation recorded on {}: {}MB, {}% CPU", pool, memoryMb, cpuPercent);
    }

    public void recordRejection(String pool, String resourceType) {
        rejections.add(1, Attributes.builder()
                .put(POOL_KEY, pool)
                .put(RESOURCE_TYPE_KEY, resourceType != null ? resourceType : "unknown")
                .build());
    }

    public void recordRelease(String pool) {
        releases.add(1, Attributes.of(POOL_KEY, pool));
    }

    public void recordViolation(String pool, String resourceType) {
        violations.add(1, Attributes.builder()
                .put(POOL_KEY, pool)
                .put(RESOURCE_TYPE_KEY, resourceType)
                .build());
    }

    /**
     * Register the observable usage of a resource pool.
     *
     * @param pool pool identifier used as the metric attribute
     * @param allocatedMemory supplier returning allocated memory in MB
     * @param allocatedCpu supplier returning allocated CPU percent
     * @param active supplier returning the number of live allocations
     */
    public void registerUsageGauges(String pool,
                                    Supplier<Long> allocatedMemory,
                                    Supplier<Double> allocatedCpu,
                                    Supplier<Long> active) {
        memorySuppliers.put(pool, allocatedMemory);
        cpuSuppliers.put(pool, allocatedCpu);
        activeSuppliers.put(pool, active);
    }

    public void unregisterUsageGauges(String pool) {
        memorySuppliers.remove(pool);
        cpuSuppliers.remove(pool);
        activeSuppliers.remove(pool);
    }
}
