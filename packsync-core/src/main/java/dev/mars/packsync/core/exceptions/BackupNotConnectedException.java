package dev.mars.packsync.core.exceptions;

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

import dev.mars.packsync.core.FailureKind;

/**
 * Backup storage could not be reached for this item. Transient: the item can be retried once
 * the store is reachable again.
 */
public class BackupNotConnectedException extends TransferItemException {

    public BackupNotConnectedException(String itemId) {
        super(itemId, "Backup not connected", FailureKind.TRANSIENT);
    }

    public BackupNotConnectedException(String itemId, Throwable cause) {
        super(itemId, "Backup not connected", FailureKind.TRANSIENT, cause);
    }
}
