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

import dev.mars.packsync.core.OperationProgress;
import dev.mars.packsync.core.OperationStatus;

/**
 * Which phase-1 outcomes may be followed by the cleanup phase.
 */
public enum CleanupPolicy {

    /**
     * Clean up only after every phase-1 item completed. A phase 1 that ends failed never starts
     * phase 2. This is the default.
     */
    REQUIRE_SUCCESS,

    /**
     * Also clean up after a phase 1 that failed some items but completed at least one, as long as
     * it was not cancelled. The cleanup set is still resolved from current membership, so only
     * items confirmed on the backup are touched.
     *
     * <p>This relaxes the strict rule that a failed phase 1 never starts phase 2, and has to be
     * selected explicitly through {@code packsync.chain.cleanup.policy}.</p>
     */
    ALLOW_PARTIAL;

    public boolean permitsCleanupAfter(OperationProgress phase1) {
        OperationStatus status = phase1.getStatus();
        if (status == OperationStatus.COMPLETED) {
            return true;
        }
        return this == ALLOW_PARTIAL
                && status == OperationStatus.FAILED
                && !phase1.isCancelled()
                && phase1.getCompletedItems() > 0;
    }
}
