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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable status of one position in a run's item list.
 *
 * <p>The wrapped {@link TransferItem} is the caller's own instance, held by reference.</p>
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ItemProgress {

    @JsonUnwrapped
    private final TransferItem item;

    @JsonProperty("status")
    private final ItemStatus status;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("failure_kind")
    private final FailureKind failureKind;

    private ItemProgress(TransferItem item, ItemStatus status, String error, FailureKind failureKind) {
        this.item = Objects.requireNonNull(item, "Item cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.error = error;
        this.failureKind = failureKind;
    }

    public static ItemProgress pending(TransferItem item) {
        return new ItemProgress(item, ItemStatus.PENDING, null, null);
    }

    public ItemProgress inProgress() {
        return new ItemProgress(item, ItemStatus.IN_PROGRESS, null, null);
    }

    public ItemProgress completed() {
        return new ItemProgress(item, ItemStatus.COMPLETED, null, null);
    }

    public ItemProgress failed(String error, FailureKind failureKind) {
        return new ItemProgress(item, ItemStatus.FAILED,
                Objects.requireNonNull(error, "Error cannot be null"),
                Objects.requireNonNull(failureKind, "Failure kind cannot be null"));
    }

    public ItemProgress requeued() {
        return pending(item);
    }

    public TransferItem getItem() {
        return item;
    }

    public ItemStatus getStatus() {
        return status;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<FailureKind> getFailureKind() {
        return Optional.ofNullable(failureKind);
    }

    /**
     * Bytes credited for this position: the full size once completed, zero otherwise.
     */
    public long getBytesTransferred() {
        return status == ItemStatus.COMPLETED ? item.getSizeBytes() : 0;
    }

    @Override
    public String toString() {
        return "ItemProgress{" +
                "id='" + item.getId() + '\'' +
                ", status=" + status +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
