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

package dev.mars.sequor.workflow.scheduler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed scheduler capacity for CPU, memory and disk with running reservations.
 * Not thread-safe; the owning {@link ExecutionScheduler} guards it.
 */
final class ResourcePool {

    private static final List<String> RESOURCES =
            List.of(ResourceRequirements.CPU, ResourceRequirements.MEMORY, ResourceRequirements.DISK);

    private static final Map<String, String> UNITS = Map.of(
            ResourceRequirements.CPU, "percentage",
            ResourceRequirements.MEMORY, "MB",
            ResourceRequirements.DISK, "MB");

    private final Map<String, Double> totals = new LinkedHashMap<>();
    private final Map<String, Double> reserved = new LinkedHashMap<>();

    ResourcePool(double cpuPercent, double memoryMb, double diskMb) {
        totals.put(ResourceRequirements.CPU, cpuPercent);
        totals.put(ResourceRequirements.MEMORY, memoryMb);
        totals.put(ResourceRequirements.DISK, diskMb);
        for (String resource : RESOURCES) {
            reserved.put(resource, 0.0);
        }
    }

    double available(String resource) {
        return totals.get(resource) - reserved.get(resource);
    }

    /**
     * @return a description of the first resource that does not fit, or null when all fit
     */
    String shortfall(ResourceRequirements requirements) {
        for (String resource : RESOURCES) {
            double required = requirements.get(resource);
            double available = available(resource);
            if (required > available) {
                return String.format(Locale.ROOT, "Insufficient %s: required %.1f, available %.1f",
                        resource, required, available);
            }
        }
        return null;
    }

    boolean fits(ResourceRequirements requirements) {
        return shortfall(requirements) == null;
    }

    void reserve(ResourceRequirements requirements) {
        for (String resource : RESOURCES) {
            reserved.merge(resource, requirements.get(resource), Double::sum);
        }
    }

    void release(ResourceRequirements requirements) {
        for (String resource : RESOURCES) {
            reserved.put(resource, Math.max(0.0, reserved.get(resource) - requirements.get(resource)));
        }
    }

    Map<String, Map<String, Object>> status() {
        Map<String, Map<String, Object>> status = new LinkedHashMap<>();
        for (String resource : RESOURCES) {
            double total = totals.get(resource);
            double allocated = reserved.get(resource);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("total", total);
            entry.put("allocated", allocated);
            entry.put("available", total - allocated);
            entry.put("utilization", total > 0 ? allocated / total * 100.0 : 0.0);
            entry.put("unit", UNITS.get(resource));
            status.put(resource, entry);
        }
        return status;
    }
}
