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
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One unit of work: a content-addressed blob to move.
 *
 * <p>Constructed by the caller before a run starts and never modified by the engine. The
 * {@code id} is the content address (a sha256 for pack blobs); {@code displayName} is only a
 * label. {@code sizeBytes} feeds progress and rate math and has no bearing on correctness.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class TransferItem {

    @JsonProperty("sha256")
    private final String id;

    @JsonProperty("display_name")
    private final String displayName;

    @JsonProperty("size_bytes")
    private final long sizeBytes;

    @JsonCreator
    public TransferItem(@JsonProperty("sha256") String id,
                        @JsonProperty("display_name") String displayName,
                        @JsonProperty("size_bytes") long sizeBytes) {
        this.id = Objects.requireNonNull(id, "Item ID cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Item ID cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Item size cannot be negative: " + sizeBytes);
        }
        this.displayName = displayName != null ? displayName : id;
        this.sizeBytes = sizeBytes;
    }

    public static TransferItem of(String id, long sizeBytes) {
        return new TransferItem(id, id, sizeBytes);
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransferItem that = (TransferItem) o;
        return sizeBytes == that.sizeBytes &&
                id.equals(that.id) &&
                displayName.equals(that.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, displayName, sizeBytes);
    }

    @Override
    public String toString() {
        return "TransferItem{" +
                "id='" + id + '\'' +
                ", displayName='" + displayName + '\'' +
                ", sizeBytes=" + sizeBytes +
                '}';
    }
}
