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

package dev.mars.packsync.transfer.observability;

import dev.mars.packsync.core.FailureKind;
import dev.mars.packsync.core.OperationStatus;
import dev.mars.packsync.core.TransferOperation;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for transfer operations.
 *
 * Provides:
 * - packsync.operation.active (gauge) - Runs currently in progress
 * - packsync.operation.total (counter) - Runs started, including retries
 * - packsync.operation.completed / failed / cancelled (counters) - Terminal outcomes
 * - packsync.operation.retries (counter) - retryFailed invocations
 * - packsync.operation.duration.seconds (histogram) - Run duration distribution
 * - packsync.item.completed / failed (counters) - Item outcomes, failures tagged by failure.kind
 * - packsync.item.bytes.total (counter) - Bytes credited by completed items
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class TransferTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(TransferTelemetryMetrics.class);
    private static final String METER_NAME = "packsync-core";

    private static TransferTelemetryMetrics instance;

    private final LongCounter operationsTotal;
    private final LongCounter operationsCompleted;
    private final LongCounter operationsFailed;
    private final LongCounter operationsCancelled;
    private final LongCounter retryAttempts;
    private final LongCounter itemsCompleted;
    private final LongCounter itemsFailed;
    private final LongCounter bytesTransferred;

    private final DoubleHistogram operationDuration;

    private final AtomicLong activeOperations = new AtomicLong(0);

    private static final AttributeKey<String> OPERATION_KEY = AttributeKey.stringKey("operation");
    private static final AttributeKey<String> STATUS_KEY = AttributeKey.stringKey("status");
    private static final AttributeKey<String> FAILURE_KIND_KEY = AttributeKey.stringKey("failure.kind");

    private TransferTelemetryMetrics() {
        this(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    /**
     * Build the instruments on a specific meter; used with an SDK meter provider in tests.
     */
    public TransferTelemetryMetrics(Meter meter) {
        operationsTotal = meter.counterBuilder("packsync.operation.total")
                .setDescription("Number of transfer runs started")
                .setUnit("1")
                .build();

        operationsCompleted = meter.counterBuilder("packsync.operation.completed")
                .setDescription("Number of runs that completed every item")
                .setUnit("1")
                .build();

        operationsFailed = meter.counterBuilder("packsync.operation.failed")
                .setDescription("Number of runs that ended with failed items")
                .setUnit("1")
                .build();

        operationsCancelled = meter.counterBuilder("packsync.operation.cancelled")
                .setDescription("Number of runs cancelled before settling every item")
                .setUnit("1")
                .build();

        retryAttempts = meter.counterBuilder("packsync.operation.retries")
                .setDescription("Number of retry runs over failed items")
                .setUnit("1")
                .build();

        itemsCompleted = meter.counterBuilder("packsync.item.completed")
                .setDescription("Number of items transferred")
                .setUnit("1")
                .build();

        itemsFailed = meter.counterBuilder("packsync.item.failed")
                .setDescription("Number of item failures")
                .setUnit("1")
                .build();

        bytesTransferred = meter.counterBuilder("packsync.item.bytes.total")
                .setDescription("Bytes credited by completed items")
                .setUnit("By")
                .build();

        operationDuration = meter.histogramBuilder("packsync.operation.duration.seconds")
                .setDescription("Run duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("packsync.operation.active")
                .setDescription("Number of runs currently in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeOperations.get()));

        logger.debug("TransferTelemetryMetrics initialized");
    }

    public static synchronized TransferTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new TransferTelemetryMetrics();
        }
        return instance;
    }

    public void recordOperationStarted(TransferOperation operation, boolean retry) {
        Attributes attrs = operationAttributes(operation);
        operationsTotal.add(1, attrs);
        if (retry) {
            retryAttempts.add(1, attrs);
        }
        activeOperations.incrementAndGet();
    }

    public void recordItemCompleted(TransferOperation operation, long bytes) {
        Attributes attrs = operationAttributes(operation);
        itemsCompleted.add(1, attrs);
        if (bytes > 0) {
            bytesTransferred.add(bytes, attrs);
        }
    }

    public void recordItemFailed(TransferOperation operation, FailureKind kind) {
        Attributes attrs = Attributes.builder()
                .put(OPERATION_KEY, operation.getValue())
                .put(FAILURE_KIND_KEY, kind != null ? kind.getValue() : "unknown")
                .build();
        itemsFailed.add(1, attrs);
    }

    /**
     * Record the end of a run with its derived terminal status.
     */
    public void recordOperationFinished(TransferOperation operation, OperationStatus status,
                                        double durationSeconds) {
        activeOperations.decrementAndGet();

        Attributes attrs = operationAttributes(operation);
        switch (status) {
            case COMPLETED:
                operationsCompleted.add(1, attrs);
                break;
            case CANCELLED:
                operationsCancelled.add(1, attrs);
                break;
            default:
                operationsFailed.add(1, attrs);
                break;
        }
        operationDuration.record(Math.max(0.0, durationSeconds), Attributes.builder()
                .put(OPERATION_KEY, operation.getValue())
                .put(STATUS_KEY, status.getValue())
                .build());
    }

    public long getActiveOperations() {
        return activeOperations.get();
    }

    private static Attributes operationAttributes(TransferOperation operation) {
        return Attributes.of(OPERATION_KEY, operation.getValue());
    }
}
