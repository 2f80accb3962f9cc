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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of an in-flight or finished transfer operation.
 *
 * <p>A runner builds a new instance every time it publishes, so observers can hold on to a
 * snapshot without seeing it change underneath them. Optional values are modelled as such:
 * an unknown ETA is {@link OptionalDouble#empty()}, never zero, and "no current item" is
 * {@link Optional#empty()}.</p>
 *
 * <h3>Invariants (checked by {@link Builder#build()}):</h3>
 * <ul>
 *   <li>{@code completedItems + failedItems <= totalItems}</li>
 *   <li>{@code transferredBytes <= totalBytes}</li>
 *   <li>{@code errors.size() == failedItems}</li>
 *   <li>{@code items.size() == totalItems}</li>
 * </ul>
 *
 * <h3>Status derivation:</h3>
 * <p>The status is computed, not stored. While the loop has not finished the operation is
 * {@link OperationStatus#RUNNING}. Once finished it is {@link OperationStatus#COMPLETED} when every
 * item completed, {@link OperationStatus#CANCELLED} when a cancel left items unprocessed, and
 * {@link OperationStatus#FAILED} otherwise.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * runner.progressHandler(progress -> {
 *     String eta = progress.getEtaSeconds().isPresent()
 *         ? String.format("%.0fs", progress.getEtaSeconds().getAsDouble())
 *         : "unknown";
 *     view.render(progress.getCompletedItems(), progress.getTotalItems(), eta);
 * });
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 * @see OperationStatus
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OperationProgress {

    @JsonProperty("operation")
    private final TransferOperation operation;

    @JsonProperty("sequence")
    private final long sequence;

    @JsonProperty("total_items")
    private final int totalItems;

    @JsonProperty("completed_items")
    private final int completedItems;

    @JsonProperty("failed_items")
    private final int failedItems;

    @JsonProperty("total_bytes")
    private final long totalBytes;

    @JsonProperty("transferred_bytes")
    private final long transferredBytes;

    @JsonProperty("current_item")
    private final TransferItem currentItem;

    @JsonProperty("bytes_per_second")
    private final double bytesPerSecond;

    @JsonProperty("eta_seconds")
    private final Double etaSeconds;

    @JsonProperty("elapsed_seconds")
    private final double elapsedSeconds;

    @JsonProperty("errors")
    private final List<String> errors;

    @JsonProperty("can_resume")
    private final boolean canResume;

    @JsonProperty("cancelled")
    private final boolean cancelled;

    @JsonProperty("finished")
    private final boolean finished;

    @JsonProperty("items")
    private final List<ItemProgress> items;

    private OperationProgress(Builder builder) {
        this.operation = Objects.requireNonNull(builder.operation, "Operation cannot be null");
        this.sequence = builder.sequence;
        this.totalItems = builder.totalItems;
        this.completedItems = builder.completedItems;
        this.failedItems = builder.failedItems;
        this.totalBytes = builder.totalBytes;
        this.transferredBytes = builder.transferredBytes;
        this.currentItem = builder.currentItem;
        this.bytesPerSecond = builder.bytesPerSecond;
        this.etaSeconds = builder.etaSeconds;
        this.elapsedSeconds = builder.elapsedSeconds;
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
        this.canResume = builder.canResume;
        this.cancelled = builder.cancelled;
        this.finished = builder.finished;
        this.items = Collections.unmodifiableList(new ArrayList<>(builder.items));
    }

    public TransferOperation getOperation() {
        return operation;
    }

    /**
     * Publish counter of the run that produced this snapshot; strictly increasing per runner.
     */
    public long getSequence() {
        return sequence;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public int getCompletedItems() {
        return completedItems;
    }

    public int getFailedItems() {
        return failedItems;
    }

    public int getSettledItems() {
        return completedItems + failedItems;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public long getTransferredBytes() {
        return transferredBytes;
    }

    public Optional<TransferItem> getCurrentItem() {
        return Optional.ofNullable(currentItem);
    }

    public double getBytesPerSecond() {
        return bytesPerSecond;
    }

    public OptionalDouble getEtaSeconds() {
        return etaSeconds == null ? OptionalDouble.empty() : OptionalDouble.of(etaSeconds);
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    public List<String> getErrors() {
        return errors;
    }

    public boolean isCanResume() {
        return canResume;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isFinished() {
        return finished;
    }

    public List<ItemProgress> getItems() {
        return items;
    }

    @JsonProperty("status")
    public OperationStatus getStatus() {
        if (!finished) {
            return OperationStatus.RUNNING;
        }
        if (completedItems == totalItems) {
            return OperationStatus.COMPLETED;
        }
        if (cancelled && getSettledItems() < totalItems) {
            return OperationStatus.CANCELLED;
        }
        return OperationStatus.FAILED;
    }

    /**
     * Whether a "retry failed" action makes sense for this snapshot.
     */
    public boolean isRetryable() {
        return finished && failedItems > 0 && canResume;
    }

    public List<TransferItem> getFailedItemList() {
        return itemsWithStatus(ItemStatus.FAILED);
    }

    public List<TransferItem> getPendingItems() {
        return itemsWithStatus(ItemStatus.PENDING);
    }

    public double getProgressFraction() {
        if (totalBytes > 0) {
            return (double) transferredBytes / totalBytes;
        }
        if (totalItems > 0) {
            return (double) completedItems / totalItems;
        }
        return finished ? 1.0 : 0.0;
    }

    private List<TransferItem> itemsWithStatus(ItemStatus status) {
        return items.stream()
                .filter(item -> item.getStatus() == status)
                .map(ItemProgress::getItem)
                .collect(Collectors.toList());
    }

    public static Builder builder(TransferOperation operation) {
        return new Builder().operation(operation);
    }

    public static class Builder {
        private TransferOperation operation;
        private long sequence;
        private int totalItems;
        private int completedItems;
        private int failedItems;
        private long totalBytes;
        private long transferredBytes;
        private TransferItem currentItem;
        private double bytesPerSecond;
        private Double etaSeconds;
        private double elapsedSeconds;
        private List<String> errors = List.of();
        private boolean canResume = true;
        private boolean cancelled;
        private boolean finished;
        private List<ItemProgress> items = List.of();

        public Builder operation(TransferOperation operation) {
            this.operation = operation;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder totalItems(int totalItems) {
            this.totalItems = totalItems;
            return this;
        }

        public Builder completedItems(int completedItems) {
            this.completedItems = completedItems;
            return this;
        }

        public Builder failedItems(int failedItems) {
            this.failedItems = failedItems;
            return this;
        }

        public Builder totalBytes(long totalBytes) {
            this.totalBytes = totalBytes;
            return this;
        }

        public Builder transferredBytes(long transferredBytes) {
            this.transferredBytes = transferredBytes;
            return this;
        }

        public Builder currentItem(TransferItem currentItem) {
            this.currentItem = currentItem;
            return this;
        }

        public Builder bytesPerSecond(double bytesPerSecond) {
            this.bytesPerSecond = bytesPerSecond;
            return this;
        }

        public Builder etaSeconds(OptionalDouble etaSeconds) {
            this.etaSeconds = etaSeconds.isPresent() ? etaSeconds.getAsDouble() : null;
            return this;
        }

        public Builder elapsedSeconds(double elapsedSeconds) {
            this.elapsedSeconds = elapsedSeconds;
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors = Objects.requireNonNull(errors, "Errors cannot be null");
            return this;
        }

        public Builder canResume(boolean canResume) {
            this.canResume = canResume;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder finished(boolean finished) {
            this.finished = finished;
            return this;
        }

        public Builder items(List<ItemProgress> items) {
            this.items = Objects.requireNonNull(items, "Items cannot be null");
            return this;
        }

        public OperationProgress build() {
            if (totalItems < 0 || completedItems < 0 || failedItems < 0) {
                throw new IllegalStateException("Item counts cannot be negative");
            }
            if (completedItems + failedItems > totalItems) {
                throw new IllegalStateException(String.format(
                        "Settled items exceed total: %d completed + %d failed > %d",
                        completedItems, failedItems, totalItems));
            }
            if (transferredBytes < 0 || transferredBytes > totalBytes) {
                throw new IllegalStateException(String.format(
                        "Transferred bytes %d outside [0, %d]", transferredBytes, totalBytes));
            }
            if (errors.size() != failedItems) {
                throw new IllegalStateException(String.format(
                        "Error count %d does not match failed items %d", errors.size(), failedItems));
            }
            if (items.size() != totalItems) {
                throw new IllegalStateException(String.format(
                        "Item list size %d does not match total items %d", items.size(), totalItems));
            }
            if (bytesPerSecond < 0 || (etaSeconds != null && etaSeconds < 0) || elapsedSeconds < 0) {
                throw new IllegalStateException("Rate, ETA and elapsed time cannot be negative");
            }
            return new OperationProgress(this);
        }
    }

    @Override
    public String toString() {
        return "OperationProgress{" +
                "operation=" + operation +
                ", status=" + getStatus() +
                ", completed=" + completedItems +
                ", failed=" + failedItems +
                ", total=" + totalItems +
                ", bytes=" + transferredBytes + "/" + totalBytes +
                ", rate=" + String.format("%.1f B/s", bytesPerSecond) +
                ", eta=" + (etaSeconds != null ? String.format("%.1fs", etaSeconds) : "unknown") +
                ", canResume=" + canResume +
                '}';
    }
}
