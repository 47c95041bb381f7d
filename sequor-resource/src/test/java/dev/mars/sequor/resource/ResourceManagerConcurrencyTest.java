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

import dev.mars.sequor.core.ResourceRequest;
import dev.mars.sequor.core.exceptions.ErrorKind;
import dev.mars.sequor.core.exceptions.WorkflowExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent stress tests for {@link SimpleResourceManager}.
 * Verifies that allocations never exceed the configured limits and that usage is conserved
 * when many threads allocate and release at the same time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
@DisplayName("Resource Manager Concurrency Tests")
class ResourceManagerConcurrencyTest {

    private static final int THREAD_COUNT = 16;
    private static final int OPERATIONS_PER_THREAD = 200;

    private SimpleResourceManager resourceManager;

    @BeforeEach
    void setUp() {
        resourceManager = new SimpleResourceManager(ResourceLimits.builder()
                .maxMemoryMb(512)
                .maxCpuPercent(80.0)
                .maxConcurrentExecutions(5)
                .build(), SystemResourceSnapshot::empty);
    }

    @AfterEach
    void tearDown() {
        resourceManager.shutdown();
    }

    @Test
    @DisplayName("Concurrent allocate and release never exceeds limits")
    void allocationsStayWithinLimits() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(THREAD_COUNT);
        AtomicInteger granted = new AtomicInteger();
        AtomicInteger denied = new AtomicInteger();
        AtomicInteger limitBreaches = new AtomicInteger();
        AtomicInteger unexpectedErrors = new AtomicInteger();

        for (int t = 0; t < THREAD_COUNT; t++) {
            final int threadId = t;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < OPERATIONS_PER_THREAD; i++) {
                        String executionId = "exec-" + threadId + "-" + i;
                        try {
                            resourceManager.allocateResources(executionId, ResourceRequest.of(100, 15.0));
                            granted.incrementAndGet();

                            ResourceManager.ResourceUtilization status = resourceManager.getResourceStatus();
                            if (status.getAllocatedMemoryMb() > 512
                                    || status.getAllocatedCpuPercent() > 80.0 + 0.0001
                                    || status.getActiveAllocations() > 5) {
                                limitBreaches.incrementAndGet();
                            }
                            resourceManager.releaseResources(executionId);
                        } catch (WorkflowExecutionException e) {
                            if (e.getKind() == ErrorKind.RESOURCE) {
                                denied.incrementAndGet();
                            } else {
                                unexpectedErrors.incrementAndGet();
                            }
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Timed out waiting for threads");
        executor.shutdown();

        assertEquals(0, limitBreaches.get());
        assertEquals(0, unexpectedErrors.get());
        assertEquals(THREAD_COUNT * OPERATIONS_PER_THREAD, granted.get() + denied.get());

        ResourceManager.ResourceUtilization finalStatus = resourceManager.getResourceStatus();
        assertEquals(0, finalStatus.getAllocatedMemoryMb());
        assertEquals(0.0, finalStatus.getAllocatedCpuPercent(), 0.0001);
        assertEquals(0, finalStatus.getActiveAllocations());

        ResourceManager.ResourceStatistics stats = resourceManager.getResourceStatistics();
        assertEquals(granted.get(), stats.getTotalAllocations());
        assertTrue(stats.getPeakMemoryMb() <= 512);
        assertTrue(stats.getPeakConcurrent() <= 5);
    }

    @Test
    @DisplayName("Only one of many racing allocations for the same id succeeds")
    void duplicateIdsRace() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(THREAD_COUNT);
        AtomicInteger granted = new AtomicInteger();

        for (int t = 0; t < THREAD_COUNT; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    resourceManager.allocateResources("shared", ResourceRequest.of(10, 1.0));
                    granted.incrementAndGet();
                } catch (WorkflowExecutionException e) {
                    // expected for all but one thread
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, granted.get());
        assertEquals(1, resourceManager.getActiveAllocationCount());
        assertEquals(10, resourceManager.getResourceStatus().getAllocatedMemoryMb());
    }
}
