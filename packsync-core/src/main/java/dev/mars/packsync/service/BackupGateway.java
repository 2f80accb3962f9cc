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

import dev.mars.packsync.core.PackBlobStatus;
import io.vertx.core.Future;

import java.util.List;

/**
 * Operations of the backup store and local blob store the transfer service relies on.
 *
 * <p>{@link #push} must be idempotent per blob, so a retry after a partial failure cannot corrupt
 * the destination. {@link #deleteLocal} is only called for blobs the gateway itself reported as
 * present on both sides.</p>
 */
public interface BackupGateway {

    /**
     * Copy a local blob to the backup store.
     */
    Future<Void> push(String sha256);

    /**
     * Copy a backup blob into local storage.
     */
    Future<Void> restore(String sha256);

    /**
     * Fetch a blob from the remote catalog into local storage.
     */
    Future<Void> download(String sha256);

    /**
     * Delete the local copy of a blob.
     */
    Future<Void> deleteLocal(String sha256);

    /**
     * Current membership of every blob referenced by a pack.
     */
    Future<List<PackBlobStatus>> blobStatuses(String packName);

    /**
     * Cancellation signal for a call in flight; gateways that cannot interrupt keep the no-op.
     */
    default void cancel(String sha256) {
    }
}
