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

package dev.mars.packsync.service;

import dev.mars.packsync.config.PackSyncConfiguration;
import dev.mars.packsync.core.OperationProgress;
import dev.mars.packsync.core.TransferItem;
import dev.mars.packsync.core.TransferOperation;
import dev.mars.packsync.plan.TransferPlanner;
import dev.mars.packsync.transfer.ItemExecutor;
import dev.mars.packsync.transfer.SequentialTransferRunner;
import dev.mars.packsync.transfer.TransferRunner;
import dev.mars.packsync.transfer.chain.ChainState;
import dev.mars.packsync.transfer.chain.PhaseChain;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Pack-level transfer flows built on the runner and phase chain: push with optional cleanup, pull,
 * download of changed dependencies and bulk cleanup.
 *
 * <p>The service never decides blob membership itself. Item lists come from
 * {@link BackupGateway#blobStatuses(String)}, and the cleanup set of a push is fetched again after
 * the backup phase settled. Each flow has its own runner, exposed so callers can observe, cancel
 * and retry it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class PackTransferService {
    private static final Logger logger = LoggerFactory.getLogger(PackTransferService.class);

    private final BackupGateway gateway;
    private final PhaseChain pushChain;
    private final TransferRunner pullRunner;
    private final TransferRunner downloadRunner;
    private final TransferRunner cleanupRunner;

    public PackTransferService(Vertx vertx, BackupGateway gateway) {
        this(vertx, gateway, new PackSyncConfiguration());
    }

    public PackTransferService(Vertx vertx, BackupGateway gateway, PackSyncConfiguration configuration) {
        this.gateway = Objects.requireNonNull(gateway, "Backup gateway cannot be null");
        Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        Objects.requireNonNull(configuration, "Configuration cannot be null");

        this.pushChain = new PhaseChain(vertx, TransferOperation.BACKUP, TransferOperation.CLEANUP, configuration);
        this.pullRunner = new SequentialTransferRunner(vertx, TransferOperation.RESTORE, configuration);
        this.downloadRunner = new SequentialTransferRunner(vertx, TransferOperation.DOWNLOAD, configuration);
        this.cleanupRunner = new SequentialTransferRunner(vertx, TransferOperation.CLEANUP, configuration);

        logger.info("PackTransferService initialized (cleanup policy {})", pushChain.getCleanupPolicy());
    }

    /**
     * Back up every local-only blob of a pack, then optionally delete the local copies the backup
     * confirms it holds.
     */
    public Future<ChainState> pushPack(String packName, boolean cleanup) {
        Objects.requireNonNull(packName, "Pack name cannot be null");
        logger.info("Pushing pack '{}' (cleanup {})", packName, cleanup);

        return gateway.blobStatuses(packName).compose(statuses -> {
            List<TransferItem> items = TransferPlanner.backupItems(statuses);
            logger.debug("Pack '{}': {} blobs to back up, {} bytes", packName, items.size(),
                    TransferPlanner.bytesToBackup(statuses));
            return pushChain.run(items, executor(gateway::push), cleanup,
                    TransferPlanner.cleanupResolver(() -> gateway.blobStatuses(packName)),
                    executor(gateway::deleteLocal));
        });
    }

    /**
     * Restore every backup-only blob of a pack into local storage.
     */
    public Future<OperationProgress> pullPack(String packName) {
        Objects.requireNonNull(packName, "Pack name cannot be null");
        logger.info("Pulling pack '{}'", packName);

        return gateway.blobStatuses(packName)
                .compose(statuses -> pullRunner.start(TransferPlanner.restoreItems(statuses),
                        executor(gateway::restore)));
    }

    /**
     * Download dependency blobs that changed in an update. The caller supplies the list.
     */
    public Future<OperationProgress> downloadChanged(List<TransferItem> changedItems) {
        Objects.requireNonNull(changedItems, "Changed items cannot be null");
        logger.info("Downloading {} changed blobs", changedItems.size());
        return downloadRunner.start(changedItems, executor(gateway::download));
    }

    /**
     * Delete the local copy of every blob of a pack that is also on the backup.
     */
    public Future<OperationProgress> bulkCleanup(String packName) {
        Objects.requireNonNull(packName, "Pack name cannot be null");

        return gateway.blobStatuses(packName).compose(statuses -> {
            logger.info("Cleaning up pack '{}': {} bytes freeable", packName, TransferPlanner.freeableBytes(statuses));
            return cleanupRunner.start(TransferPlanner.cleanupItems(statuses), executor(gateway::deleteLocal));
        });
    }

    /**
     * Retry the failed items of the last push, in whichever phase they failed.
     */
    public Future<ChainState> retryPush() {
        ItemExecutor executor = pushChain.getState() == ChainState.PHASE2_FAILED
                ? executor(gateway::deleteLocal)
                : executor(gateway::push);
        return pushChain.retryFailed(executor);
    }

    public Future<OperationProgress> retryPull() {
        return pullRunner.retryFailed(executor(gateway::restore));
    }

    public Future<OperationProgress> retryDownload() {
        return downloadRunner.retryFailed(executor(gateway::download));
    }

    public PhaseChain getPushChain() {
        return pushChain;
    }

    public TransferRunner getPullRunner() {
        return pullRunner;
    }

    public TransferRunner getDownloadRunner() {
        return downloadRunner;
    }

    public TransferRunner getCleanupRunner() {
        return cleanupRunner;
    }

    private ItemExecutor executor(Function<String, Future<Void>> call) {
        return new ItemExecutor() {
            @Override
            public Future<Void> execute(String itemId) {
                return call.apply(itemId);
            }

            @Override
            public void cancel(String itemId) {
                gateway.cancel(itemId);
            }
        };
    }
}
