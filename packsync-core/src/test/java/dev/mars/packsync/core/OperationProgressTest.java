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

package dev.mars.packsync.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link OperationProgress}: builder invariants, status derivation and the JSON shape.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
@DisplayName("OperationProgress Tests")
class OperationProgressTest {

    private static final TransferItem A = TransferItem.of("a", 100);
    private static final TransferItem B = TransferItem.of("b", 200);

    private static OperationProgress.Builder twoItems() {
        return OperationProgress.builder(TransferOperation.BACKUP)
                .totalItems(2)
                .totalBytes(300)
                .items(List.of(ItemProgress.pending(A), ItemProgress.pending(B)));
    }

    private static OperationProgress.Builder oneFailed(boolean finished) {
        return twoItems()
                .completedItems(1)
                .failedItems(1)
                .transferredBytes(100)
                .errors(List.of("timeout"))
                .items(List.of(ItemProgress.pending(A).completed(),
                        ItemProgress.pending(B).failed("timeout", FailureKind.TRANSIENT)))
                .finished(finished);
    }

    @Nested
    @DisplayName("Status Derivation")
    class StatusTests {

        @Test
        @DisplayName("Should be running until the loop finishes")
        void testRunning() {
            assertThat(oneFailed(false).build().getStatus()).isEqualTo(OperationStatus.RUNNING);
        }

        @Test
        @DisplayName("Should be completed when every item completed")
        void testCompleted() {
            OperationProgress progress = twoItems()
                    .completedItems(2).transferredBytes(300)
                    .items(List.of(ItemProgress.pending(A).completed(), ItemProgress.pending(B).completed()))
                    .finished(true)
                    .build();

            assertThat(progress.getStatus()).isEqualTo(OperationStatus.COMPLETED);
            assertThat(progress.isRetryable()).isFalse();
            assertThat(progress.getProgressFraction()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should be failed when any item failed")
        void testFailed() {
            OperationProgress progress = oneFailed(true).build();

            assertThat(progress.getStatus()).isEqualTo(OperationStatus.FAILED);
            assertThat(progress.isRetryable()).isTrue();
            assertThat(progress.getFailedItemList()).containsExactly(B);
        }

        @Test
        @DisplayName("Should not be retryable after a fatal failure")
        void testNotResumable() {
            assertThat(oneFailed(true).canResume(false).build().isRetryable()).isFalse();
        }

        @Test
        @DisplayName("Should be cancelled when a cancel left items unprocessed")
        void testCancelled() {
            OperationProgress progress = twoItems()
                    .completedItems(1).transferredBytes(100)
                    .items(List.of(ItemProgress.pending(A).completed(), ItemProgress.pending(B)))
                    .cancelled(true)
                    .finished(true)
                    .build();

            assertThat(progress.getStatus()).isEqualTo(OperationStatus.CANCELLED);
            assertThat(progress.getPendingItems()).containsExactly(B);
            assertThat(OperationStatus.CANCELLED.isTerminal()).isTrue();
        }

        @Test
        @DisplayName("Empty finished operation is complete")
        void testEmpty() {
            OperationProgress progress = OperationProgress.builder(TransferOperation.CLEANUP)
                    .finished(true)
                    .build();

            assertThat(progress.getStatus()).isEqualTo(OperationStatus.COMPLETED);
            assertThat(progress.getProgressFraction()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Builder Invariants")
    class InvariantTests {

        @Test
        @DisplayName("Should reject more settled items than total")
        void testSettledExceedsTotal() {
            assertThatIllegalStateException().isThrownBy(() -> twoItems()
                    .completedItems(2).failedItems(1).errors(List.of("x")).build());
        }

        @Test
        @DisplayName("Should reject transferred bytes above the total")
        void testBytesExceedTotal() {
            assertThatIllegalStateException().isThrownBy(() -> twoItems().transferredBytes(301).build());
        }

        @Test
        @DisplayName("Should reject an error list that does not match the failure count")
        void testErrorCountMismatch() {
            assertThatIllegalStateException().isThrownBy(() -> twoItems().failedItems(1).build());
        }

        @Test
        @DisplayName("Should reject an item list that does not match the total")
        void testItemCountMismatch() {
            assertThatIllegalStateException().isThrownBy(() -> twoItems().totalItems(3).build());
        }

        @Test
        @DisplayName("Should reject negative rates")
        void testNegativeRate() {
            assertThatIllegalStateException().isThrownBy(() -> twoItems().bytesPerSecond(-1).build());
        }

        @Test
        @DisplayName("Should not be affected by later changes to the source lists")
        void testDefensiveCopies() {
            ArrayList<String> errors = new ArrayList<>(List.of("timeout"));
            OperationProgress progress = oneFailed(true).errors(errors).build();
            errors.add("later");

            assertThat(progress.getErrors()).containsExactly("timeout");
            assertThatThrownBy(() -> progress.getErrors().add("x"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("JSON Shape")
    class JsonTests {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        @DisplayName("Should serialize with snake_case fields and lowercase enums")
        void testSerialization() throws Exception {
            OperationProgress progress = oneFailed(false)
                    .sequence(4)
                    .currentItem(B)
                    .bytesPerSecond(50.0)
                    .etaSeconds(OptionalDouble.of(4.0))
                    .elapsedSeconds(2.0)
                    .build();

            JsonNode json = mapper.readTree(mapper.writeValueAsString(progress));

            assertThat(json.get("operation").asText()).isEqualTo("backup");
            assertThat(json.get("status").asText()).isEqualTo("running");
            assertThat(json.get("total_items").asInt()).isEqualTo(2);
            assertThat(json.get("completed_items").asInt()).isEqualTo(1);
            assertThat(json.get("transferred_bytes").asLong()).isEqualTo(100);
            assertThat(json.get("eta_seconds").asDouble()).isEqualTo(4.0);
            assertThat(json.get("can_resume").asBoolean()).isTrue();
            assertThat(json.get("current_item").get("sha256").asText()).isEqualTo("b");
            assertThat(json.get("errors").get(0).asText()).isEqualTo("timeout");

            JsonNode failed = json.get("items").get(1);
            assertThat(failed.get("sha256").asText()).isEqualTo("b");
            assertThat(failed.get("size_bytes").asLong()).isEqualTo(200);
            assertThat(failed.get("status").asText()).isEqualTo("failed");
            assertThat(failed.get("failure_kind").asText()).isEqualTo("transient");
        }

        @Test
        @DisplayName("Should omit an unknown ETA rather than report zero")
        void testUnknownEtaOmitted() throws Exception {
            OperationProgress progress = oneFailed(true).etaSeconds(OptionalDouble.empty()).build();

            JsonNode json = mapper.readTree(mapper.writeValueAsString(progress));

            assertThat(json.has("eta_seconds")).isFalse();
            assertThat(json.has("current_item")).isFalse();
            assertThat(progress.getEtaSeconds()).isEmpty();
        }

        @Test
        @DisplayName("Should read items and blob statuses from their wire form")
        void testDeserialization() throws Exception {
            TransferItem item = mapper.readValue("{\"sha256\":\"abc\",\"size_bytes\":42}", TransferItem.class);
            PackBlobStatus status = mapper.readValue(
                    "{\"sha256\":\"abc\",\"display_name\":\"w.bin\",\"size_bytes\":42,\"location\":\"both\"}",
                    PackBlobStatus.class);

            assertThat(item.getDisplayName()).isEqualTo("abc");
            assertThat(item.getSizeBytes()).isEqualTo(42);
            assertThat(status.getLocation()).isEqualTo(BlobLocation.BOTH);
            assertThat(status.toTransferItem()).isEqualTo(new TransferItem("abc", "w.bin", 42));
        }
    }
}
