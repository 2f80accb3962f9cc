package dev.mars.packsync.plan;

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

import dev.mars.packsync.core.BlobLocation;
import dev.mars.packsync.core.PackBlobStatus;
import dev.mars.packsync.core.TransferItem;
import dev.mars.packsync.transfer.chain.CleanupResolver;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns blob membership into the item lists each operation works on.
 *
 * <ul>
 *   <li>backup: blobs only present locally</li>
 *   <li>restore: blobs only present on the backup</li>
 *   <li>cleanup: blobs present locally and confirmed on the backup</li>
 * </ul>
 *
 * Input order is preserved.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public final class TransferPlanner {

    private TransferPlanner() {
    }

    public static List<TransferItem> backupItems(List<PackBlobStatus> statuses) {
        return itemsAt(statuses, BlobLocation.LOCAL_ONLY);
    }

    public static List<TransferItem> restoreItems(List<PackBlobStatus> statuses) {
        return itemsAt(statuses, BlobLocation.BACKUP_ONLY);
    }

    public static List<TransferItem> cleanupItems(List<PackBlobStatus> statuses) {
        return itemsAt(statuses, BlobLocation.BOTH);
    }

    public static long bytesToBackup(List<PackBlobStatus> statuses) {
        return totalBytes(backupItems(statuses));
    }

    /**
     * Local bytes a cleanup would free right now.
     */
    public static long freeableBytes(List<PackBlobStatus> statuses) {
        return totalBytes(cleanupItems(statuses));
    }

    /**
     * A resolver that asks {@code source} for membership when phase 1 has settled, so the cleanup
     * set only contains blobs the backup confirms it holds at that point.
     */
    public static CleanupResolver cleanupResolver(BlobStatusSource source) {
        Objects.requireNonNull(source, "Blob status source cannot be null");
        return phase1Result -> source.fetchStatuses().map(TransferPlanner::cleanupItems);
    }

    private static List<TransferItem> itemsAt(List<PackBlobStatus> statuses, BlobLocation location) {
        Objects.requireNonNull(statuses, "Statuses cannot be null");
        return statuses.stream()
                .filter(status -> status.getLocation() == location)
                .map(PackBlobStatus::toTransferItem)
                .collect(Collectors.toList());
    }

    private static long totalBytes(List<TransferItem> items) {
        return items.stream().mapToLong(TransferItem::getSizeBytes).sum();
    }
}
