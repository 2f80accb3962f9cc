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
 * Decides whether an executor rejection is transient or fatal, and how it reads in the error list.
 */
@FunctionalInterface
public interface FailureClassifier {

    FailureKind classify(Throwable failure);

    /**
     * Message recorded for a failed item. Uses the bare reason of a {@link TransferItemException}
     * found in the cause chain, else the failure's own message.
     */
    default String describe(Throwable failure) {
        TransferItemException itemFailure = DefaultFailureClassifier.findItemException(failure);
        if (itemFailure != null && itemFailure.getReason() != null) {
            return itemFailure.getReason();
        }
        if (failure != null && failure.getMessage() != null) {
            return failure.getMessage();
        }
        if (failure != null && failure.getCause() != null && failure.getCause().getMessage() != null) {
            return failure.getCause().getMessage();
        }
        return "Unknown error";
    }

    static FailureClassifier defaultClassifier() {
        return DefaultFailureClassifier.INSTANCE;
    }
}
