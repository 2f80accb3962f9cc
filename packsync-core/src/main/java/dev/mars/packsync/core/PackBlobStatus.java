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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Membership of one pack blob in local and backup storage, as reported by the store.
 *
 * <p>Only the planning layer reads this; the runner works on {@link TransferItem}s.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PackBlobStatus {

    private final String sha256;
    private final String displayName;
    private final long sizeBytes;
    private final BlobLocation location;

    @JsonCreator
    public PackBlobStatus(@JsonProperty("sha256") String sha256,
                          @JsonProperty("display_name") String displayName,
                          @JsonProperty("size_bytes") long sizeBytes,
                          @JsonProperty("location") BlobLocation location) {
        this.sha256 = Objects.requireNonNull(sha256, "sha256 cannot be null");
        this.displayName = displayName != null ? displayName : sha256;
        this.sizeBytes = Math.max(0, sizeBytes);
        this.location = Objects.requireNonNull(location, "Location cannot be null");
    }

    @JsonProperty("sha256")
    public String getSha256() {
        return sha256;
    }

    @JsonProperty("display_name")
    public String getDisplayName() {
        return displayName;
    }

    @JsonProperty("size_bytes")
    public long getSizeBytes() {
        return sizeBytes;
    }

    @JsonProperty("location")
    public BlobLocation getLocation() {
        return location;
    }

    @JsonIgnore
    public boolean isOnLocal() {
        return location.isOnLocal();
    }

    @JsonIgnore
    public boolean isOnBackup() {
        return location.isOnBackup();
    }

    public TransferItem toTransferItem() {
        return new TransferItem(sha256, displayName, sizeBytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackBlobStatus that = (PackBlobStatus) o;
        return sizeBytes == that.sizeBytes &&
                sha256.equals(that.sha256) &&
                displayName.equals(that.displayName) &&
                location == that.location;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sha256, displayName, sizeBytes, location);
    }

    @Override
    public String toString() {
        return "PackBlobStatus{" +
                "sha256='" + sha256 + '\'' +
                ", sizeBytes=" + sizeBytes +
                ", location=" + location +
                '}';
    }
}
