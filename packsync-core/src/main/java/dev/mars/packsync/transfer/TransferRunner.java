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

import dev.mars.packsync.core.ItemProgress;
import dev.mars.packsync.core.OperationProgress;
import dev.mars.packsync.core.OperationStatus;
import dev.mars.packsync.core.TransferItem;
import dev.mars.packsync.core.TransferOperation;
import io.vertx.core.Future;
import io.vertx.core.Handler;

import java.util.List;
import java.util.Optional;

/**
 * Drives one bulk transfer operation over an ordered list of items.
 * Defines the contract for starting, observing, cancelling and retrying a run.
 */
public interface TransferRunner {

    /**
     * Start a run over {@code items}, executing them strictly one at a time in list order.
     * Registered progress handlers receive an initial snapshot and one after each item settles.
     *
     * @param items the items to transfer; may be empty, may contain duplicate ids
     * @param executor the capability that transfers one item
     * @return a future completing with the terminal snapshot, or failing with
     *         {@code InvalidOperationStateException} if a run is already in progress
     */
    Future<OperationProgress> start(List<TransferItem> items, ItemExecutor executor);

    /**
     * Request cancellation of the active run. The in-flight item is allowed to settle and no
     * further item is started.
     *
     * @return true if a run was active when the request was made, false otherwise
     */
    boolean cancel();

    /**
     * Re-run only the items that failed in the previous run. Completed items keep their credit
     * and are never re-executed.
     *
     * @param executor the capability that transfers one item
     * @return a future completing with the terminal snapshot, or failing with
     *         {@code InvalidOperationStateException} if nothing is retryable
     */
    Future<OperationProgress> retryFailed(ItemExecutor executor);

    /**
     * Return to the state where no operation has run. Ignored while a run is active.
     */
    void reset();

    /**
     * Latest published snapshot, or empty if no operation has run since construction or reset.
     */
    Optional<OperationProgress> getProgress();

    /**
     * Status of the latest snapshot, {@link OperationStatus#IDLE} if there is none.
     */
    OperationStatus getStatus();

    boolean isRunning();

    TransferOperation getOperation();

    /**
     * Register a handler for every published snapshot. Handlers run on the runner's context and
     * must not block.
     */
    TransferRunner progressHandler(Handler<OperationProgress> handler);

    /**
     * Register a handler called each time an item settles.
     */
    TransferRunner itemHandler(Handler<ItemProgress> handler);
}
