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

package dev.mars.sequor.workflow.queue;

import dev.mars.sequor.config.SequorConfiguration;
import dev.mars.sequor.core.ExecutionResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Bounded priority queue of pending executions.
 * <p>
 * Items are ordered by priority (highest first) and then by arrival sequence. Failed items are
 * re-enqueued with an increasing retry count and become visible again only once their retry
 * delay has passed; after the retry limit is exhausted they move to the failed history.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class ExecutionQueue {

    private static final Logger logger = Logger.getLogger(ExecutionQueue.class.getName());

    private static final int MAX_HISTORY = 1000;

    static final Comparator<QueueItem> ORDERING = Comparator
            .comparingInt(QueueItem::getPriority).reversed()
            .thenComparingLong(QueueItem::getSequence);

    private final int maxSize;
    private final int defaultMaxRetries;
    private final Duration defaultRetryDelay;

    private final TreeSet<QueueItem> queued = new TreeSet<>(ORDERING);
    private final Map<String, QueueItem> queuedById = new HashMap<>();
    private final Map<String, QueueItem> processing = new HashMap<>();
    private final Deque<QueueItem> completed = new ArrayDeque<>();
    private final Deque<QueueItem> failed = new ArrayDeque<>();
    private final Object lock = new Object();

    private long sequence;
    private long totalEnqueued;
    private long totalCompleted;
    private long totalFailed;
    private long totalRetries;
    private long totalRejected;
    private long totalWaitTimeMs;
    private long totalDequeued;

    public ExecutionQueue() {
        this(100, 3, Duration.ofSeconds(5));
    }

    public ExecutionQueue(SequorConfiguration configuration) {
        this(configuration.getQueueMaxSize(), configuration.getMaxRetries(),
                Duration.ofMillis(configuration.getRetryDelayMs()));
    }

    public ExecutionQueue(int maxSize, int defaultMaxRetries, Duration defaultRetryDelay) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Queue size must be positive: " + maxSize);
        }
        if (defaultMaxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative: " + defaultMaxRetries);
        }
        this.maxSize = maxSize;
        this.defaultMaxRetries = defaultMaxRetries;
        this.defaultRetryDelay = defaultRetryDelay != null ? defaultRetryDelay : Duration.ZERO;
    }

    /**
     * Add an item to the queue.
     *
     * @return false when the queue is full or the execution is already queued or processing
     */
    public boolean enqueue(QueueItem item) {
        if (item == null) {
            throw new IllegalArgumentException("Queue item cannot be null");
        }
        synchronized (lock) {
            String executionId = item.getExecutionId();
            if (queuedById.containsKey(executionId) || processing.containsKey(executionId)) {
                logger.warning("Execution already in queue: " + executionId);
                return false;
            }
            if (queued.size() >= maxSize) {
                totalRejected++;
                logger.warning("Queue full (" + maxSize + "), rejected execution " + executionId);
                return false;
            }
            insert(item.withSequence(sequence++));
            totalEnqueued++;
        }
        logger.fine("Enqueued execution " + item.getExecutionId() + " with priority " + item.getPriority());
        return true;
    }

    public Optional<QueueItem> dequeue() {
        return dequeue(item -> true);
    }

    /**
     * Take the highest-priority available item that satisfies the filter and move it to processing.
     */
    public Optional<QueueItem> dequeue(Predicate<QueueItem> filter) {
        Instant now = Instant.now();
        synchronized (lock) {
            Iterator<QueueItem> iterator = queued.iterator();
            while (iterator.hasNext()) {
                QueueItem item = iterator.next();
                if (!item.isAvailable(now) || !filter.test(item)) {
                    continue;
                }
                iterator.remove();
                queuedById.remove(item.getExecutionId());
                processing.put(item.getExecutionId(), item);
                totalWaitTimeMs += item.getWaitTimeMs(now);
                totalDequeued++;
                return Optional.of(item);
            }
            return Optional.empty();
        }
    }

    /**
     * Highest-priority available item, without removing it.
     */
    public Optional<QueueItem> peek() {
        Instant now = Instant.now();
        synchronized (lock) {
            for (QueueItem item : queued) {
                if (item.isAvailable(now)) {
                    return Optional.of(item);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Put a processing item back in the queue without counting a retry, keeping its place in line.
     */
    public boolean returnToQueue(String executionId) {
        synchronized (lock) {
            QueueItem item = processing.remove(executionId);
            if (item == null) {
                return false;
            }
            insert(item);
            return true;
        }
    }

    public boolean markCompleted(String executionId, ExecutionResult result) {
        synchronized (lock) {
            QueueItem item = processing.remove(executionId);
            if (item == null) {
                return false;
            }
            totalCompleted++;
            addToHistory(completed, item);
        }
        logger.fine("Execution " + executionId + " completed" +
                (result != null ? " (success=" + result.isSuccess() + ")" : ""));
        return true;
    }

    /**
     * Record a failed attempt.
     *
     * @return true when the item was re-enqueued for another attempt
     */
    public boolean markFailed(String executionId, String error) {
        return markFailed(executionId, error, true);
    }

    /**
     * Record a failed attempt; a non-retryable failure goes straight to the failed set.
     *
     * @return true when the item was re-enqueued for another attempt
     */
    public boolean markFailed(String executionId, String error, boolean retryable) {
        synchronized (lock) {
            QueueItem item = processing.remove(executionId);
            if (item == null) {
                return false;
            }

            int maxRetries = item.getMaxRetries() != null ? item.getMaxRetries() : defaultMaxRetries;
            if (retryable && item.getRetryCount() < maxRetries) {
                Duration delay = item.getRetryDelay() != null ? item.getRetryDelay() : defaultRetryDelay;
                QueueItem retry = item.withRetry(Instant.now().plus(delay), error);
                insert(retry);
                totalRetries++;
                logger.info("Re-queued execution " + executionId + " for retry " + retry.getRetryCount() +
                        "/" + maxRetries + " in " + delay.toMillis() + "ms");
                return true;
            }

            totalFailed++;
            addToHistory(failed, new QueueItem.Builder(item).lastError(error).build());
            logger.warning("Execution " + executionId + " failed after " + (item.getRetryCount() + 1) +
                    " attempts: " + error);
            return false;
        }
    }

    /**
     * Remove a queued or processing item.
     */
    public boolean remove(String executionId) {
        synchronized (lock) {
            QueueItem item = queuedById.remove(executionId);
            if (item != null) {
                queued.remove(item);
                return true;
            }
            return processing.remove(executionId) != null;
        }
    }

    public boolean contains(String executionId) {
        synchronized (lock) {
            return queuedById.containsKey(executionId) || processing.containsKey(executionId);
        }
    }

    public Optional<QueueItem> getItem(String executionId) {
        synchronized (lock) {
            QueueItem item = queuedById.get(executionId);
            return Optional.ofNullable(item != null ? item : processing.get(executionId));
        }
    }

    public Optional<QueueItemStatus> getStatus(String executionId) {
        synchronized (lock) {
            if (queuedById.containsKey(executionId)) {
                return Optional.of(QueueItemStatus.QUEUED);
            }
            if (processing.containsKey(executionId)) {
                return Optional.of(QueueItemStatus.PROCESSING);
            }
            if (containsId(completed, executionId)) {
                return Optional.of(QueueItemStatus.COMPLETED);
            }
            if (containsId(failed, executionId)) {
                return Optional.of(QueueItemStatus.FAILED);
            }
            return Optional.empty();
        }
    }

    /**
     * Number of queued items, including those waiting for a retry delay.
     */
    public int size() {
        synchronized (lock) {
            return queued.size();
        }
    }

    public int processingCount() {
        synchronized (lock) {
            return processing.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Queued items in dequeue order.
     */
    public List<QueueItem> getQueuedItems() {
        synchronized (lock) {
            return new ArrayList<>(queued);
        }
    }

    public void clear() {
        synchronized (lock) {
            queued.clear();
            queuedById.clear();
            processing.clear();
            completed.clear();
            failed.clear();
        }
        logger.info("Execution queue cleared");
    }

    public QueueStatistics getStatistics() {
        synchronized (lock) {
            double averageWait = totalDequeued > 0 ? (double) totalWaitTimeMs / totalDequeued : 0.0;
            return new QueueStatistics(queued.size(), processing.size(), completed.size(), failed.size(),
                    totalEnqueued, totalCompleted, totalFailed, totalRetries, totalRejected, averageWait, maxSize);
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    private void insert(QueueItem item) {
        queued.add(item);
        queuedById.put(item.getExecutionId(), item);
    }

    private static void addToHistory(Deque<QueueItem> history, QueueItem item) {
        history.addLast(item);
        while (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
    }

    private static boolean containsId(Deque<QueueItem> history, String executionId) {
        for (QueueItem item : history) {
            if (item.getExecutionId().equals(executionId)) {
                return true;
            }
        }
        return false;
    }
}
