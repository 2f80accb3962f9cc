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

import dev.mars.packsync.core.FailureKind;
import dev.mars.packsync.core.exceptions.TransferItemException;

/**
 * Uses the {@link FailureKind} of the first {@link TransferItemException} in the cause chain.
 * Anything else is transient.
 */
public final class DefaultFailureClassifier implements FailureClassifier {

    static final DefaultFailureClassifier INSTANCE = new DefaultFailureClassifier();

    private static final int MAX_CAUSE_DEPTH = 16;

    private DefaultFailureClassifier() {
    }

    @Override
    public FailureKind classify(Throwable failure) {
        TransferItemException itemFailure = findItemException(failure);
        return itemFailure != null ? itemFailure.getKind() : FailureKind.TRANSIENT;
    }

    static TransferItemException findItemException(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof TransferItemException) {
                return (TransferItemException) current;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
