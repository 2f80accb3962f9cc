package dev.mars.packsync.core;

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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Aggregate status of a transfer operation, derived from an {@link OperationProgress} snapshot.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * IDLE → RUNNING → {COMPLETED | FAILED | CANCELLED}
 *                      ↓ (retryFailed)
 *                   RUNNING
 * </pre>
 *
 * <p>The status is never stored alongside the counts. {@link OperationProgress#getStatus()}
 * computes it from the counts and the cancelled/finished flags, so a snapshot can never report
 * a status that disagrees with its numbers.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @see OperationProgress
 */
public enum OperationStatus {
    /**
     * No operation has run on the runner, or it was reset.
     */
    IDLE,

    /**
     * Items are still being executed: {@code completedItems + failedItems < totalItems} and the
     * loop has not ended.
     */
    RUNNING,

    /**
     * Every item settled successfully.
     */
    COMPLETED,

    /**
     * The loop ended with at least one failed item, or a fatal failure stopped it early.
     * Resumable only if {@link OperationProgress#isCanResume()} is still true.
     */
    FAILED,

    /**
     * The caller cancelled before every item settled. Items that never started are neither
     * completed nor failed.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isSuccessful() {
        return this == COMPLETED;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
