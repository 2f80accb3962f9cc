package dev.mars.packsync.transfer;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one {@code start} or {@code retryFailed} invocation: the queue of list positions it
 * will execute, its executor, and the cooperative cancel and halt flags.
 *
 * <p>The cancel flag and in-flight item id are safe to read and write from any thread. The queue
 * cursor is only touched from the runner's context.</p>
 */
class RunContext {
    private static final Logger logger = LoggerFactory.getLogger(RunContext.class);

    private final long runNumber;
    private final boolean retry;
    private final ItemExecutor executor;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile String inFlightItemId;
    private List<Integer> queue = List.of();
    private int cursor;
    private boolean halted;
    private Instant startedAt;
    private long baseBytes;

    RunContext(long runNumber, boolean retry, ItemExecutor executor) {
        this.runNumber = runNumber;
        this.retry = retry;
        this.executor = executor;
    }

    void begin(List<Integer> positions, Instant startedAt, long baseBytes) {
        this.queue = List.copyOf(positions);
        this.cursor = 0;
        this.startedAt = startedAt;
        this.baseBytes = baseBytes;
    }

    long getRunNumber() {
        return runNumber;
    }

    boolean isRetry() {
        return retry;
    }

    ItemExecutor getExecutor() {
        return executor;
    }

    Instant getStartedAt() {
        return startedAt;
    }

    /**
     * Bytes already credited when this run began; the rate only measures bytes moved since.
     */
    long getBaseBytes() {
        return baseBytes;
    }

    int getQueueSize() {
        return queue.size();
    }

    boolean hasNext() {
        return cursor < queue.size();
    }

    int next() {
        return queue.get(cursor++);
    }

    // Control flags
    boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Request cancellation and pass the signal on to the executor for the item in flight.
     *
     * @return true on the first request, false if already cancelled
     */
    boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        String itemId = inFlightItemId;
        if (itemId != null) {
            try {
                executor.cancel(itemId);
            } catch (RuntimeException e) {
                logger.warn("Executor cancel hook failed for item {}: {}", itemId, e.getMessage(), e);
            }
        }
        return true;
    }

    boolean isHalted() {
        return halted;
    }

    void halt() {
        this.halted = true;
    }

    boolean shouldContinue() {
        return !cancelled.get() && !halted && hasNext();
    }

    void setInFlight(String itemId) {
        this.inFlightItemId = itemId;
    }

    void clearInFlight() {
        this.inFlightItemId = null;
    }

    String getInFlightItemId() {
        return inFlightItemId;
    }
}
