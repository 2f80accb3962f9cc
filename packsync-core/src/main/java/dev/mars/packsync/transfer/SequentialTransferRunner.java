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

import dev.mars.packsync.config.PackSyncConfiguration;
import dev.mars.packsync.core.FailureKind;
import dev.mars.packsync.core.ItemProgress;
import dev.mars.packsync.core.ItemStatus;
import dev.mars.packsync.core.OperationProgress;
import dev.mars.packsync.core.OperationStatus;
import dev.mars.packsync.core.TransferItem;
import dev.mars.packsync.core.TransferOperation;
import dev.mars.packsync.core.exceptions.InvalidOperationStateException;
import dev.mars.packsync.transfer.observability.TransferTelemetryMetrics;
import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TransferRunner} that executes items one at a time on a single Vert.x context.
 *
 * <p>All run state (per-item progress, counts, errors, the rate estimator) is only touched from
 * the runner's context, so a run never needs locks. Callers on other threads see the latest
 * snapshot through a volatile reference, and {@link #cancel()} only flips an atomic flag that the
 * context checks before starting the next item.</p>
 *
 * <p>Executor results are hopped back onto the context before they are applied, whatever thread
 * the executor completed its future on.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class SequentialTransferRunner implements TransferRunner {
    private static final Logger logger = LoggerFactory.getLogger(SequentialTransferRunner.class);

    private final Context context;
    private final TransferOperation operation;
    private final FailureClassifier failureClassifier;
    private final RateEstimator rateEstimator;
    private final Clock clock;
    private final TransferTelemetryMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong runCounter = new AtomicLong(0);
    private final List<Handler<OperationProgress>> progressHandlers = new CopyOnWriteArrayList<>();
    private final List<Handler<ItemProgress>> itemHandlers = new CopyOnWriteArrayList<>();

    private volatile OperationProgress latest;
    private volatile RunContext activeRun;

    // Confined to the context while a run is active
    private List<TransferItem> items = List.of();
    private final List<ItemProgress> itemStates = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private int completedItems;
    private int failedItems;
    private long totalBytes;
    private long transferredBytes;
    private boolean canResume = true;
    private long sequence;
    private boolean metricsRecording;

    public SequentialTransferRunner(Vertx vertx, TransferOperation operation) {
        this(vertx, operation, PackSyncConfiguration.defaults());
    }

    public SequentialTransferRunner(Vertx vertx, TransferOperation operation, PackSyncConfiguration configuration) {
        this(vertx, operation, configuration, FailureClassifier.defaultClassifier(), Clock.systemUTC(),
                configuration.isMetricsEnabled() ? TransferTelemetryMetrics.getInstance() : null);
    }

    /**
     * @param metrics metrics sink, or {@code null} to record nothing
     */
    public SequentialTransferRunner(Vertx vertx, TransferOperation operation, PackSyncConfiguration configuration,
                                    FailureClassifier failureClassifier, Clock clock,
                                    TransferTelemetryMetrics metrics) {
        Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.operation = Objects.requireNonNull(operation, "Operation cannot be null");
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.failureClassifier = Objects.requireNonNull(failureClassifier, "Failure classifier cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.context = vertx.getOrCreateContext();
        this.rateEstimator = RateEstimator.fromConfiguration(configuration);
        this.metrics = metrics;

        logger.debug("SequentialTransferRunner created for {} operation (rate window={}, alpha={})",
                operation.getValue(), rateEstimator.getWindowSize(), rateEstimator.getAlpha());
    }

    @Override
    public Future<OperationProgress> start(List<TransferItem> items, ItemExecutor executor) {
        Objects.requireNonNull(items, "Items cannot be null");
        Objects.requireNonNull(executor, "Executor cannot be null");

        if (!running.compareAndSet(false, true)) {
            logger.warn("Rejected start of {} operation: a run is already in progress", operation.getValue());
            return Future.failedFuture(new InvalidOperationStateException(
                    operation.getValue(), OperationStatus.RUNNING, "start"));
        }

        List<TransferItem> runItems;
        try {
            runItems = List.copyOf(items);
        } catch (NullPointerException e) {
            running.set(false);
            return Future.failedFuture(new NullPointerException("Items cannot contain null elements"));
        }

        long runBytes;
        try {
            runBytes = totalSize(runItems);
        } catch (ArithmeticException e) {
            running.set(false);
            logger.warn("Rejected start of {} operation: total item size exceeds {} bytes",
                    operation.getValue(), Long.MAX_VALUE);
            return Future.failedFuture(new IllegalArgumentException(
                    "Total size of " + runItems.size() + " items exceeds " + Long.MAX_VALUE + " bytes", e));
        }

        RunContext run = new RunContext(runCounter.incrementAndGet(), false, executor);
        activeRun = run;
        Promise<OperationProgress> promise = Promise.promise();
        context.runOnContext(v -> guarded(run, promise, () -> beginRun(run, runItems, runBytes, promise)));
        return promise.future();
    }

    @Override
    public Future<OperationProgress> retryFailed(ItemExecutor executor) {
        Objects.requireNonNull(executor, "Executor cannot be null");

        if (!running.compareAndSet(false, true)) {
            logger.warn("Rejected retry of {} operation: a run is already in progress", operation.getValue());
            return Future.failedFuture(new InvalidOperationStateException(
                    operation.getValue(), OperationStatus.RUNNING, "retry failed items of"));
        }

        OperationProgress last = latest;
        if (last == null || !last.isRetryable()) {
            running.set(false);
            String detail;
            if (last == null) {
                detail = "no operation has run";
            } else if (!last.isFinished()) {
                detail = "the previous run has not finished";
            } else if (last.getFailedItems() == 0) {
                detail = "there are no failed items";
            } else {
                detail = "the previous run stopped on a fatal failure";
            }
            logger.warn("Rejected retry of {} operation: {}", operation.getValue(), detail);
            return Future.failedFuture(new InvalidOperationStateException(operation.getValue(),
                    last == null ? OperationStatus.IDLE : last.getStatus(), "retry failed items of", detail));
        }

        RunContext run = new RunContext(runCounter.incrementAndGet(), true, executor);
        activeRun = run;
        Promise<OperationProgress> promise = Promise.promise();
        context.runOnContext(v -> guarded(run, promise, () -> beginRetry(run, promise)));
        return promise.future();
    }

    @Override
    public boolean cancel() {
        RunContext run = activeRun;
        if (!running.get() || run == null) {
            logger.debug("Cancel requested for {} operation with no active run", operation.getValue());
            return false;
        }
        if (run.cancel()) {
            logger.info("Cancellation requested for {} run #{} (in flight: {})",
                    operation.getValue(), run.getRunNumber(), run.getInFlightItemId());
        }
        return true;
    }

    @Override
    public void reset() {
        if (running.get()) {
            logger.warn("Ignoring reset of {} operation while a run is in progress", operation.getValue());
            return;
        }
        latest = null;
        activeRun = null;
        items = List.of();
        itemStates.clear();
        errors.clear();
        completedItems = 0;
        failedItems = 0;
        totalBytes = 0;
        transferredBytes = 0;
        canResume = true;
        rateEstimator.reset();
        logger.debug("{} runner reset", operation.getValue());
    }

    @Override
    public Optional<OperationProgress> getProgress() {
        return Optional.ofNullable(latest);
    }

    @Override
    public OperationStatus getStatus() {
        OperationProgress snapshot = latest;
        return snapshot == null ? OperationStatus.IDLE : snapshot.getStatus();
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public TransferOperation getOperation() {
        return operation;
    }

    @Override
    public SequentialTransferRunner progressHandler(Handler<OperationProgress> handler) {
        progressHandlers.add(Objects.requireNonNull(handler, "Handler cannot be null"));
        return this;
    }

    @Override
    public SequentialTransferRunner itemHandler(Handler<ItemProgress> handler) {
        itemHandlers.add(Objects.requireNonNull(handler, "Handler cannot be null"));
        return this;
    }

    // Run lifecycle, always on the context

    private void beginRun(RunContext run, List<TransferItem> runItems, long runBytes,
                          Promise<OperationProgress> promise) {
        items = runItems;
        itemStates.clear();
        errors.clear();
        completedItems = 0;
        failedItems = 0;
        transferredBytes = 0;
        canResume = true;
        totalBytes = runBytes;
        List<Integer> positions = new ArrayList<>(runItems.size());
        for (int i = 0; i < runItems.size(); i++) {
            itemStates.add(ItemProgress.pending(runItems.get(i)));
            positions.add(i);
        }

        logger.info("Starting {} run #{}: {} items, {} bytes",
                operation.getValue(), run.getRunNumber(), runItems.size(), totalBytes);
        launch(run, positions, promise);
    }

    private void beginRetry(RunContext run, Promise<OperationProgress> promise) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < itemStates.size(); i++) {
            ItemProgress state = itemStates.get(i);
            if (state.getStatus() == ItemStatus.FAILED) {
                itemStates.set(i, state.requeued());
                positions.add(i);
            }
        }
        failedItems = 0;
        errors.clear();

        logger.info("Retrying {} failed items of {} operation (run #{}), {} already completed",
                positions.size(), operation.getValue(), run.getRunNumber(), completedItems);
        launch(run, positions, promise);
    }

    private void launch(RunContext run, List<Integer> positions, Promise<OperationProgress> promise) {
        run.begin(positions, clock.instant(), transferredBytes);
        rateEstimator.reset();
        if (metrics != null) {
            metrics.recordOperationStarted(operation, run.isRetry());
            metricsRecording = true;
        }

        if (!run.shouldContinue()) {
            finish(run, promise);
            return;
        }
        advance(run, promise);
    }

    private void advance(RunContext run, Promise<OperationProgress> promise) {
        int position = run.next();
        TransferItem item = items.get(position);
        itemStates.set(position, itemStates.get(position).inProgress());
        publish(run, item, false);
        execute(run, position, item, promise);
    }

    private void execute(RunContext run, int position, TransferItem item, Promise<OperationProgress> promise) {
        run.setInFlight(item.getId());
        logger.debug("Executing {} for item {} ({} bytes)", operation.getValue(), item.getId(), item.getSizeBytes());

        Future<Void> outcome;
        try {
            outcome = run.getExecutor().execute(item.getId());
            if (outcome == null) {
                outcome = Future.failedFuture(
                        new IllegalStateException("Executor returned no result for item " + item.getId()));
            }
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }

        outcome.onComplete(ar -> context.runOnContext(
                v -> guarded(run, promise, () -> settle(run, position, item, ar, promise))));
    }

    private void settle(RunContext run, int position, TransferItem item, AsyncResult<Void> result,
                        Promise<OperationProgress> promise) {
        run.clearInFlight();

        ItemProgress settled;
        if (result.succeeded()) {
            completedItems++;
            transferredBytes += item.getSizeBytes();
            settled = itemStates.get(position).completed();
            if (metrics != null) {
                metrics.recordItemCompleted(operation, item.getSizeBytes());
            }
            logger.debug("Item {} completed ({} bytes)", item.getId(), item.getSizeBytes());
        } else {
            FailureKind kind = failureClassifier.classify(result.cause());
            String error = failureClassifier.describe(result.cause());
            failedItems++;
            errors.add(error);
            settled = itemStates.get(position).failed(error, kind);
            if (kind == FailureKind.FATAL) {
                canResume = false;
                run.halt();
                logger.warn("Fatal failure on item {} of {} operation, stopping run: {}",
                        item.getId(), operation.getValue(), error);
            } else {
                logger.warn("Item {} of {} operation failed: {}", item.getId(), operation.getValue(), error);
            }
            if (metrics != null) {
                metrics.recordItemFailed(operation, kind);
            }
        }
        itemStates.set(position, settled);
        rateEstimator.record(elapsedSeconds(run), transferredBytes - run.getBaseBytes());
        notifyItemHandlers(settled);

        if (run.shouldContinue()) {
            advance(run, promise);
        } else {
            finish(run, promise);
        }
    }

    private void finish(RunContext run, Promise<OperationProgress> promise) {
        OperationProgress terminal = publish(run, null, true);
        OperationStatus status = terminal.getStatus();
        if (metrics != null) {
            metrics.recordOperationFinished(operation, status, terminal.getElapsedSeconds());
            metricsRecording = false;
        }
        logger.info("{} run #{} finished {}: {}/{} completed, {} failed, {} bytes in {}s",
                operation.getValue(), run.getRunNumber(), status.getValue(),
                terminal.getCompletedItems(), terminal.getTotalItems(), terminal.getFailedItems(),
                terminal.getTransferredBytes(), String.format("%.2f", terminal.getElapsedSeconds()));

        activeRun = null;
        running.set(false);
        promise.tryComplete(terminal);
    }

    /**
     * Runs one step of a run on the context. A step that throws ends the run: the promise fails and
     * the runner accepts new calls again, with the last published snapshot left in place.
     */
    private void guarded(RunContext run, Promise<OperationProgress> promise, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            logger.error("{} run #{} aborted by an unexpected error: {}",
                    operation.getValue(), run.getRunNumber(), e.getMessage(), e);
            run.clearInFlight();
            if (metricsRecording) {
                metricsRecording = false;
                metrics.recordOperationFinished(operation, OperationStatus.FAILED, elapsedSeconds(run));
            }
            if (activeRun == run) {
                activeRun = null;
            }
            running.set(false);
            promise.tryFail(e);
        }
    }

    private OperationProgress publish(RunContext run, TransferItem currentItem, boolean finished) {
        OptionalDouble eta = finished
                ? OptionalDouble.empty()
                : rateEstimator.estimateEtaSeconds(totalBytes - transferredBytes);

        OperationProgress snapshot = OperationProgress.builder(operation)
                .sequence(++sequence)
                .totalItems(items.size())
                .completedItems(completedItems)
                .failedItems(failedItems)
                .totalBytes(totalBytes)
                .transferredBytes(transferredBytes)
                .currentItem(currentItem)
                .bytesPerSecond(rateEstimator.getBytesPerSecond())
                .etaSeconds(eta)
                .elapsedSeconds(elapsedSeconds(run))
                .errors(errors)
                .canResume(canResume)
                .cancelled(run.isCancelled())
                .finished(finished)
                .items(itemStates)
                .build();
        latest = snapshot;

        for (Handler<OperationProgress> handler : progressHandlers) {
            try {
                handler.handle(snapshot);
            } catch (RuntimeException e) {
                logger.warn("Progress handler failed for {} snapshot #{}: {}",
                        operation.getValue(), snapshot.getSequence(), e.getMessage(), e);
            }
        }
        return snapshot;
    }

    private void notifyItemHandlers(ItemProgress itemProgress) {
        for (Handler<ItemProgress> handler : itemHandlers) {
            try {
                handler.handle(itemProgress);
            } catch (RuntimeException e) {
                logger.warn("Item handler failed for {}: {}", itemProgress.getItem().getId(), e.getMessage(), e);
            }
        }
    }

    private static long totalSize(List<TransferItem> runItems) {
        long bytes = 0;
        for (TransferItem item : runItems) {
            bytes = Math.addExact(bytes, item.getSizeBytes());
        }
        return bytes;
    }

    private double elapsedSeconds(RunContext run) {
        if (run.getStartedAt() == null) {
            return 0.0;
        }
        Duration elapsed = Duration.between(run.getStartedAt(), clock.instant());
        return elapsed.isNegative() ? 0.0 : elapsed.toNanos() / 1_000_000_000.0;
    }

    @Override
    public String toString() {
        OperationProgress snapshot = latest;
        return "SequentialTransferRunner{" +
                "operation=" + operation +
                ", running=" + running.get() +
                ", status=" + (snapshot == null ? OperationStatus.IDLE : snapshot.getStatus()) +
                '}';
    }
}
