package dev.mars.packsync.transfer.chain;

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
import dev.mars.packsync.core.OperationProgress;
import dev.mars.packsync.core.OperationStatus;
import dev.mars.packsync.core.TransferItem;
import dev.mars.packsync.core.TransferOperation;
import dev.mars.packsync.core.exceptions.InvalidOperationStateException;
import dev.mars.packsync.transfer.ItemExecutor;
import dev.mars.packsync.transfer.SequentialTransferRunner;
import dev.mars.packsync.transfer.TransferRunner;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs two transfer operations back to back as one caller-visible flow, typically a backup phase
 * followed by an optional cleanup phase that frees the local copies just pushed.
 *
 * <p>Phase 2 starts only when the caller asked for it, phase 1's outcome passes the
 * {@link CleanupPolicy}, and the {@link CleanupResolver} returns a non-empty set computed after
 * phase 1 settled. The transition is guarded by a {@link OneShotLatch} per phase-1 attempt.</p>
 *
 * <p>Progress observed through {@link #progressHandler(Handler)} is always the active phase's own
 * runner snapshot, tagged with its phase number.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class PhaseChain {
    private static final Logger logger = LoggerFactory.getLogger(PhaseChain.class);

    private final TransferRunner phase1Runner;
    private final TransferRunner phase2Runner;
    private final CleanupPolicy cleanupPolicy;
    private final List<Handler<PhaseProgress>> progressHandlers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean active = new AtomicBoolean(false);

    private volatile ChainState state = ChainState.IDLE;
    private volatile Attempt attempt;
    private volatile Throwable failureCause;

    // Captured by run() and reused when a failed phase 1 is retried
    private volatile boolean cleanupRequested;
    private volatile CleanupResolver cleanupResolver;
    private volatile ItemExecutor phase2Executor;

    public PhaseChain(Vertx vertx, TransferOperation phase1Operation, TransferOperation phase2Operation,
                      PackSyncConfiguration configuration) {
        this(new SequentialTransferRunner(vertx, phase1Operation, configuration),
                new SequentialTransferRunner(vertx, phase2Operation, configuration),
                configuration.getCleanupPolicy());
    }

    public PhaseChain(TransferRunner phase1Runner, TransferRunner phase2Runner, CleanupPolicy cleanupPolicy) {
        this.phase1Runner = Objects.requireNonNull(phase1Runner, "Phase 1 runner cannot be null");
        this.phase2Runner = Objects.requireNonNull(phase2Runner, "Phase 2 runner cannot be null");
        this.cleanupPolicy = Objects.requireNonNull(cleanupPolicy, "Cleanup policy cannot be null");
        if (phase1Runner == phase2Runner) {
            throw new IllegalArgumentException("Phases need separate runners");
        }

        phase1Runner.progressHandler(progress -> forward(new PhaseProgress(1, progress)));
        phase2Runner.progressHandler(progress -> forward(new PhaseProgress(2, progress)));
    }

    /**
     * Run phase 1 over {@code phase1Items}, then decide on and possibly run phase 2.
     *
     * @param phase1Items items for the first phase
     * @param phase1Executor executor for the first phase
     * @param cleanupRequested whether the caller opted into phase 2
     * @param cleanupResolver computes phase-2 items from current membership once phase 1 settled
     * @param phase2Executor executor for the second phase
     * @return a future completing with the terminal chain state
     */
    public Future<ChainState> run(List<TransferItem> phase1Items, ItemExecutor phase1Executor,
                                  boolean cleanupRequested, CleanupResolver cleanupResolver,
                                  ItemExecutor phase2Executor) {
        Objects.requireNonNull(phase1Items, "Phase 1 items cannot be null");
        Objects.requireNonNull(phase1Executor, "Phase 1 executor cannot be null");
        Objects.requireNonNull(cleanupResolver, "Cleanup resolver cannot be null");
        Objects.requireNonNull(phase2Executor, "Phase 2 executor cannot be null");

        if (!active.compareAndSet(false, true)) {
            logger.warn("Rejected chain run: chain is {}", state);
            return Future.failedFuture(new InvalidOperationStateException("phase chain", state, "run"));
        }

        this.cleanupRequested = cleanupRequested;
        this.cleanupResolver = cleanupResolver;
        this.phase2Executor = phase2Executor;
        this.failureCause = null;
        phase2Runner.reset();

        logger.info("Starting {} chain: {} phase 1 items, cleanup {}",
                phase1Runner.getOperation().getValue(), phase1Items.size(),
                cleanupRequested ? "requested" : "not requested");
        return startPhase1(() -> phase1Runner.start(phase1Items, phase1Executor));
    }

    /**
     * Retry the failed items of whichever phase failed. A successful phase-1 retry goes through the
     * cleanup decision again with a fresh latch.
     */
    public Future<ChainState> retryFailed(ItemExecutor executor) {
        Objects.requireNonNull(executor, "Executor cannot be null");

        ChainState current = state;
        TransferRunner runner = current == ChainState.PHASE1_FAILED ? phase1Runner
                : current == ChainState.PHASE2_FAILED ? phase2Runner : null;
        boolean retryable = runner != null
                && runner.getProgress().map(OperationProgress::isRetryable).orElse(false);
        if (!retryable) {
            logger.warn("Rejected chain retry: chain is {} with nothing retryable", current);
            return Future.failedFuture(new InvalidOperationStateException("phase chain", current,
                    "retry failed items of", "no retryable failures"));
        }
        if (!active.compareAndSet(false, true)) {
            return Future.failedFuture(new InvalidOperationStateException("phase chain", state,
                    "retry failed items of"));
        }

        failureCause = null;
        logger.info("Retrying failed items of phase {}", current.getPhase());
        if (runner == phase1Runner) {
            return startPhase1(() -> phase1Runner.retryFailed(executor));
        }

        Attempt retry = new Attempt();
        attempt = retry;
        transition(ChainState.PHASE2_RUNNING);
        phase2Runner.retryFailed(executor).onComplete(ar -> onPhase2Settled(retry, ar));
        return retry.promise.future();
    }

    /**
     * Cancel the active phase. A cancel that lands while the cleanup set is being resolved
     * prevents phase 2 from starting.
     *
     * @return true if the chain was active
     */
    public boolean cancel() {
        Attempt current = attempt;
        if (!active.get() || current == null) {
            return false;
        }
        current.cancelled.set(true);
        ChainState now = state;
        if (now == ChainState.PHASE2_RUNNING) {
            phase2Runner.cancel();
        } else if (now == ChainState.PHASE1_RUNNING) {
            phase1Runner.cancel();
        }
        logger.info("Chain cancellation requested in state {}", now);
        return true;
    }

    public void reset() {
        if (active.get()) {
            logger.warn("Ignoring chain reset while {}", state);
            return;
        }
        phase1Runner.reset();
        phase2Runner.reset();
        attempt = null;
        failureCause = null;
        state = ChainState.IDLE;
    }

    public ChainState getState() {
        return state;
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * Failure that was not an item failure, e.g. the cleanup resolver itself failing.
     */
    public Optional<Throwable> getFailureCause() {
        return Optional.ofNullable(failureCause);
    }

    /**
     * Snapshot of the phase the chain is in or last finished.
     */
    public Optional<PhaseProgress> getProgress() {
        if (state.getPhase() == 2) {
            Optional<OperationProgress> phase2 = phase2Runner.getProgress();
            if (phase2.isPresent()) {
                return phase2.map(progress -> new PhaseProgress(2, progress));
            }
        }
        return phase1Runner.getProgress().map(progress -> new PhaseProgress(1, progress));
    }

    public TransferRunner getPhase1Runner() {
        return phase1Runner;
    }

    public TransferRunner getPhase2Runner() {
        return phase2Runner;
    }

    public CleanupPolicy getCleanupPolicy() {
        return cleanupPolicy;
    }

    public PhaseChain progressHandler(Handler<PhaseProgress> handler) {
        progressHandlers.add(Objects.requireNonNull(handler, "Handler cannot be null"));
        return this;
    }

    private Future<ChainState> startPhase1(Supplier<Future<OperationProgress>> phase1) {
        Attempt next = new Attempt();
        attempt = next;
        transition(ChainState.PHASE1_RUNNING);
        phase1.get().onComplete(ar -> {
            if (ar.succeeded()) {
                onPhase1Settled(ar.result());
            } else {
                failureCause = ar.cause();
                logger.warn("Phase 1 could not run: {}", ar.cause().getMessage());
                finish(next, ChainState.PHASE1_FAILED);
            }
        });
        return next.promise.future();
    }

    /**
     * Phase-1 completion. Only the first delivery per attempt has any effect.
     */
    void onPhase1Settled(OperationProgress phase1Result) {
        Attempt current = attempt;
        if (current == null || !current.latch.tryFire()) {
            logger.debug("Ignoring repeated phase 1 completion (sequence {})", phase1Result.getSequence());
            return;
        }

        ChainState settled = phase1Result.getStatus() == OperationStatus.COMPLETED
                ? ChainState.PHASE1_COMPLETED : ChainState.PHASE1_FAILED;
        transition(settled);

        if (!cleanupRequested) {
            finish(current, settled);
            return;
        }
        if (current.cancelled.get() || !cleanupPolicy.permitsCleanupAfter(phase1Result)) {
            logger.info("Skipping cleanup phase after phase 1 ended {} (policy {})",
                    phase1Result.getStatus().getValue(), cleanupPolicy);
            finish(current, settled);
            return;
        }

        Future<List<TransferItem>> resolved;
        try {
            resolved = cleanupResolver.resolve(phase1Result);
            if (resolved == null) {
                resolved = Future.failedFuture(new IllegalStateException("Cleanup resolver returned no result"));
            }
        } catch (RuntimeException e) {
            resolved = Future.failedFuture(e);
        }

        resolved.onComplete(ar -> {
            if (ar.failed()) {
                failureCause = ar.cause();
                logger.warn("Could not resolve cleanup items: {}", ar.cause().getMessage(), ar.cause());
                finish(current, ChainState.PHASE2_FAILED);
            } else if (ar.result() == null || ar.result().isEmpty()) {
                logger.info("Nothing to clean up after phase 1");
                finish(current, settled);
            } else if (current.cancelled.get()) {
                logger.info("Chain cancelled before cleanup phase started");
                finish(current, settled);
            } else {
                startPhase2(current, ar.result());
            }
        });
    }

    private void startPhase2(Attempt current, List<TransferItem> items) {
        logger.info("Starting {} phase: {} items", phase2Runner.getOperation().getValue(), items.size());
        transition(ChainState.PHASE2_RUNNING);
        phase2Runner.start(items, phase2Executor).onComplete(ar -> onPhase2Settled(current, ar));
    }

    private void onPhase2Settled(Attempt current, AsyncResult<OperationProgress> result) {
        if (result.failed()) {
            failureCause = result.cause();
            logger.warn("Phase 2 could not run: {}", result.cause().getMessage());
            finish(current, ChainState.PHASE2_FAILED);
            return;
        }
        finish(current, result.result().getStatus() == OperationStatus.COMPLETED
                ? ChainState.PHASE2_COMPLETED : ChainState.PHASE2_FAILED);
    }

    private void finish(Attempt current, ChainState terminal) {
        transition(terminal);
        active.set(false);
        logger.info("Chain finished in state {}", terminal);
        current.promise.tryComplete(terminal);
    }

    private void transition(ChainState next) {
        ChainState previous = state;
        state = next;
        if (previous != next) {
            logger.debug("Chain state {} -> {}", previous, next);
        }
    }

    private void forward(PhaseProgress progress) {
        for (Handler<PhaseProgress> handler : progressHandlers) {
            try {
                handler.handle(progress);
            } catch (RuntimeException e) {
                logger.warn("Chain progress handler failed: {}", e.getMessage(), e);
            }
        }
    }

    private static final class Attempt {
        private final OneShotLatch latch = new OneShotLatch();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final Promise<ChainState> promise = Promise.promise();
    }
}
