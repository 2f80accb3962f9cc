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

import java.util.Objects;

/**
 * Rejection value for a single item's executor call.
 *
 * <p>The {@link FailureKind} decides what the runner does next: a {@link FailureKind#TRANSIENT}
 * failure is recorded and the queue moves on, a {@link FailureKind#FATAL} failure stops the
 * queue and makes the run non-resumable.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class TransferItemException extends PackSyncException {

    private final String itemId;
    private final String reason;
    private final FailureKind kind;

    public TransferItemException(String itemId, String reason, FailureKind kind) {
        super(reason);
        this.itemId = itemId;
        this.reason = reason;
        this.kind = Objects.requireNonNull(kind, "Failure kind cannot be null");
    }

    public TransferItemException(String itemId, String reason, FailureKind kind, Throwable cause) {
        super(reason, cause);
        this.itemId = itemId;
        this.reason = reason;
        this.kind = Objects.requireNonNull(kind, "Failure kind cannot be null");
    }

    public static TransferItemException transientFailure(String itemId, String reason) {
        return new TransferItemException(itemId, reason, FailureKind.TRANSIENT);
    }

    public static TransferItemException fatal(String itemId, String reason) {
        return new TransferItemException(itemId, reason, FailureKind.FATAL);
    }

    public String getItemId() {
        return itemId;
    }

    /**
     * The bare failure reason, as recorded in the progress error list.
     */
    public String getReason() {
        return reason;
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean isFatal() {
        return kind == FailureKind.FATAL;
    }

    @Override
    public String getMessage() {
        return String.format("Item %s failed (%s): %s", itemId, kind, reason);
    }
}
