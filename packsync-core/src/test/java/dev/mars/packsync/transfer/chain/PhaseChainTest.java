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

package dev.mars.packsync.transfer.chain;

import dev.mars.packsync.config.PackSyncConfiguration;
import dev.mars.packsync.core.FailureKind;
import dev.mars.packsync.core.ItemProgress;
import dev.mars.packsync.core.OperationProgress;
import dev.mars.packsync.core.OperationStatus;
import dev.mars.packsync.core.TransferItem;
import dev.mars.packsync.core.TransferOperation;
import dev.mars.packsync.core.exceptions.InvalidOperationStateException;
import dev.mars.packsync.core.exceptions.TransferItemException;
import dev.mars.packsync.simulator.ScriptedItemExecutor;
import dev.mars.packsync.transfer.SequentialTransferRunner;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link PhaseChain}: the backup then cleanup state machine, its single-trigger latch and
 * the cleanup policy.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
@DisplayName("PhaseChain Tests")
class PhaseChainTest {

    private static final TransferItem A = TransferItem.of("a", 100);
    private static final TransferItem B = TransferItem.of("b", 200);
    private static final TransferItem C = TransferItem.of("c", 300);

    private Vertx vertx;
    private ScriptedItemExecutor backup;
    private ScriptedItemExecutor cleanup;
    private AtomicInteger resolverCalls;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        backup = new ScriptedItemExecutor();
        cleanup = new ScriptedItemExecutor();
        resolverCalls = new AtomicInteger();
    }

    private PhaseChain chain(CleanupPolicy policy) {
        Properties properties = new Properties();
        properties.setProperty(PackSyncConfiguration.METRICS_ENABLED, "false");
        PackSyncConfiguration configuration = new PackSyncConfiguration(properties);
        return new PhaseChain(
                new SequentialTransferRunner(vertx, TransferOperation.BACKUP, configuration),
                new SequentialTransferRunner(vertx, TransferOperation.CLEANUP, configuration),
                policy);
    }

    private CleanupResolver resolving(List<TransferItem> items) {
        return phase1 -> {
            resolverCalls.incrementAndGet();
            return Future.succeededFuture(items);
        };
    }

    private static <T> T result(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    // ==================== State Machine ====================

    @Nested
    @DisplayName("State Machine")
    class StateMachineTests {

        @Test
        @DisplayName("Should run the cleanup phase after a successful backup phase")
        void testBothPhases() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);

            ChainState state = result(chain.run(List.of(A, B, C), backup, true, resolving(List.of(A, B)), cleanup));

            assertThat(state).isEqualTo(ChainState.PHASE2_COMPLETED);
            assertThat(chain.getState()).isEqualTo(ChainState.PHASE2_COMPLETED);
            assertThat(backup.getInvocations()).containsExactly("a", "b", "c");
            assertThat(cleanup.getInvocations()).containsExactly("a", "b");
            assertThat(chain.isActive()).isFalse();
        }

        @Test
        @DisplayName("Should resolve the cleanup set only after the backup phase settled")
        void testResolverSeesSettledPhase1() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            AtomicReference<OperationProgress> seen = new AtomicReference<>();
            AtomicInteger backupCallsAtResolve = new AtomicInteger(-1);

            result(chain.run(List.of(A, B, C), backup, true, phase1 -> {
                seen.set(phase1);
                backupCallsAtResolve.set(backup.getInvocations().size());
                return Future.succeededFuture(List.of(C));
            }, cleanup));

            assertThat(seen.get().isFinished()).isTrue();
            assertThat(seen.get().getStatus()).isEqualTo(OperationStatus.COMPLETED);
            assertThat(backupCallsAtResolve.get()).isEqualTo(3);
            assertThat(cleanup.getInvocations()).containsExactly("c");
        }

        @Test
        @DisplayName("Should stop after phase 1 when cleanup was not requested")
        void testCleanupNotRequested() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);

            ChainState state = result(chain.run(List.of(A), backup, false, resolving(List.of(A)), cleanup));

            assertThat(state).isEqualTo(ChainState.PHASE1_COMPLETED);
            assertThat(resolverCalls.get()).isZero();
            assertThat(cleanup.getInvocations()).isEmpty();
        }

        @Test
        @DisplayName("Should short-circuit to success when there is nothing to clean up")
        void testEmptyCleanupSet() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);

            ChainState state = result(chain.run(List.of(A, B), backup, true, resolving(List.of()), cleanup));

            assertThat(state).isEqualTo(ChainState.PHASE1_COMPLETED);
            assertThat(resolverCalls.get()).isEqualTo(1);
            assertThat(chain.getPhase2Runner().getProgress()).isEmpty();
            assertThat(cleanup.getInvocations()).isEmpty();
        }

        @Test
        @DisplayName("Should never start phase 2 after a failed phase 1")
        void testFailedPhase1() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            backup.failOnce("b", TransferItemException.transientFailure("b", "timeout"));

            ChainState state = result(chain.run(List.of(A, B, C), backup, true, resolving(List.of(A, C)), cleanup));

            assertThat(state).isEqualTo(ChainState.PHASE1_FAILED);
            assertThat(resolverCalls.get()).isZero();
            assertThat(cleanup.getInvocations()).isEmpty();
        }

        @Test
        @DisplayName("Should report phase 2 failures")
        void testFailedPhase2() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            cleanup.failOnce("a", TransferItemException.transientFailure("a", "locked"));

            ChainState state = result(chain.run(List.of(A), backup, true, resolving(List.of(A)), cleanup));

            assertThat(state).isEqualTo(ChainState.PHASE2_FAILED);
            assertThat(chain.getProgress()).hasValueSatisfying(progress -> {
                assertThat(progress.getPhase()).isEqualTo(2);
                assertThat(progress.getProgress().getErrors()).containsExactly("locked");
            });
            assertThat(chain.getFailureCause()).isEmpty();
        }

        @Test
        @DisplayName("Should fail phase 2 when the cleanup set cannot be resolved")
        void testResolverFailure() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            IllegalStateException lookupFailure = new IllegalStateException("backup unreachable");

            ChainState state = result(chain.run(List.of(A), backup, true,
                    phase1 -> Future.failedFuture(lookupFailure), cleanup));

            assertThat(state).isEqualTo(ChainState.PHASE2_FAILED);
            assertThat(chain.getFailureCause()).contains(lookupFailure);
            assertThat(cleanup.getInvocations()).isEmpty();
        }
    }

    // ==================== Single Trigger ====================

    @Nested
    @DisplayName("Single Trigger")
    class SingleTriggerTests {

        @Test
        @DisplayName("Phase-1 completion handler invoked twice triggers phase 2 exactly once")
        void testDoubleCompletionStartsPhase2Once() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            // Deliver the completion early from the progress stream; the runner delivers it again
            chain.getPhase1Runner().progressHandler(progress -> {
                if (progress.isFinished()) {
                    chain.onPhase1Settled(progress);
                }
            });

            ChainState state = result(chain.run(List.of(A, B), backup, true, resolving(List.of(A, B)), cleanup));

            assertThat(state).isEqualTo(ChainState.PHASE2_COMPLETED);
            assertThat(resolverCalls.get()).isEqualTo(1);
            assertThat(cleanup.getInvocations()).hasSize(2);
            assertThat(cleanup.invocationCount("a")).isEqualTo(1);
            assertThat(cleanup.invocationCount("b")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should ignore a late repeated completion after the chain finished")
        void testLateRepeatIgnored() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            result(chain.run(List.of(A), backup, true, resolving(List.of(A)), cleanup));
            OperationProgress phase1 = chain.getPhase1Runner().getProgress().orElseThrow();

            chain.onPhase1Settled(phase1);

            assertThat(chain.getState()).isEqualTo(ChainState.PHASE2_COMPLETED);
            assertThat(resolverCalls.get()).isEqualTo(1);
            assertThat(cleanup.getInvocations()).containsExactly("a");
        }
    }

    // ==================== Cleanup Policy ====================

    @Nested
    @DisplayName("Cleanup Policy")
    class CleanupPolicyTests {

        @Test
        @DisplayName("Should clean up after a partial backup when partial cleanup is allowed")
        void testAllowPartial() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.ALLOW_PARTIAL);
            backup.failOnce("b", TransferItemException.transientFailure("b", "timeout"));

            ChainState state = result(chain.run(List.of(A, B), backup, true, resolving(List.of(A)), cleanup));

            assertThat(state).isEqualTo(ChainState.PHASE2_COMPLETED);
            assertThat(cleanup.getInvocations()).containsExactly("a");
        }

        @Test
        @DisplayName("Should not clean up when the partial backup completed nothing")
        void testAllowPartialNothingCompleted() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.ALLOW_PARTIAL);
            backup.failOnce("a", TransferItemException.transientFailure("a", "timeout"));

            ChainState state = result(chain.run(List.of(A), backup, true, resolving(List.of(A)), cleanup));

            assertThat(state).isEqualTo(ChainState.PHASE1_FAILED);
            assertThat(resolverCalls.get()).isZero();
        }

        @Test
        @DisplayName("Should report phase 1 failed when a partial backup has nothing to clean")
        void testAllowPartialEmptySet() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.ALLOW_PARTIAL);
            backup.failOnce("b", TransferItemException.transientFailure("b", "timeout"));

            ChainState state = result(chain.run(List.of(A, B), backup, true, resolving(List.of()), cleanup));

            assertThat(state).isEqualTo(ChainState.PHASE1_FAILED);
        }

        @Test
        @DisplayName("Default configuration should never clean up after a failed phase 1")
        void testDefaultPolicyIsStrict() throws Exception {
            Properties properties = new Properties();
            properties.setProperty(PackSyncConfiguration.METRICS_ENABLED, "false");
            PhaseChain chain = new PhaseChain(vertx, TransferOperation.BACKUP, TransferOperation.CLEANUP,
                    new PackSyncConfiguration(properties));
            backup.failOnce("b", TransferItemException.transientFailure("b", "timeout"));

            ChainState state = result(chain.run(List.of(A, B, C), backup, true, resolving(List.of(A, C)), cleanup));

            assertThat(chain.getCleanupPolicy()).isEqualTo(CleanupPolicy.REQUIRE_SUCCESS);
            assertThat(state).isEqualTo(ChainState.PHASE1_FAILED);
            assertThat(resolverCalls.get()).isZero();
            assertThat(cleanup.getInvocations()).isEmpty();
        }

        @Test
        @DisplayName("Policies should judge phase 1 outcomes")
        void testPolicyDecisions() {
            OperationProgress partial = OperationProgress.builder(TransferOperation.BACKUP)
                    .totalItems(2).completedItems(1).failedItems(1)
                    .totalBytes(300).transferredBytes(100)
                    .errors(List.of("timeout"))
                    .items(List.of(
                            ItemProgress.pending(A).completed(),
                            ItemProgress.pending(B)
                                    .failed("timeout", FailureKind.TRANSIENT)))
                    .finished(true)
                    .build();

            assertThat(CleanupPolicy.REQUIRE_SUCCESS.permitsCleanupAfter(partial)).isFalse();
            assertThat(CleanupPolicy.ALLOW_PARTIAL.permitsCleanupAfter(partial)).isTrue();
        }
    }

    // ==================== Control ====================

    @Nested
    @DisplayName("Control And Retry")
    class ControlTests {

        @Test
        @DisplayName("Should forward each phase's own snapshots tagged with the phase")
        void testProgressForwarding() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            List<PhaseProgress> seen = new CopyOnWriteArrayList<>();
            chain.progressHandler(seen::add);

            result(chain.run(List.of(A, B, C), backup, true, resolving(List.of(C)), cleanup));

            assertThat(seen).extracting(PhaseProgress::getPhase).containsExactly(1, 1, 1, 1, 2, 2);
            PhaseProgress lastPhase2 = seen.get(seen.size() - 1);
            assertThat(lastPhase2.getProgress().getOperation()).isEqualTo(TransferOperation.CLEANUP);
            assertThat(lastPhase2.getProgress().getTotalItems()).isEqualTo(1);
            assertThat(lastPhase2.getProgress().getTotalBytes()).isEqualTo(300);
        }

        @Test
        @DisplayName("Should reject a second run while active")
        void testSecondRunRejected() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            backup.holdOnce("a");
            Future<ChainState> first = chain.run(List.of(A), backup, false, resolving(List.of()), cleanup);
            await().atMost(5, TimeUnit.SECONDS).until(() -> backup.isHeld("a"));

            assertThat(chain.getState()).isEqualTo(ChainState.PHASE1_RUNNING);
            assertThatThrownBy(() -> result(chain.run(List.of(B), backup, false, resolving(List.of()), cleanup)))
                    .hasCauseInstanceOf(InvalidOperationStateException.class);

            backup.release("a");
            assertThat(result(first)).isEqualTo(ChainState.PHASE1_COMPLETED);
        }

        @Test
        @DisplayName("Should not start phase 2 after phase 1 was cancelled")
        void testCancelDuringPhase1() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.ALLOW_PARTIAL);
            backup.holdOnce("a");
            Future<ChainState> run = chain.run(List.of(A, B), backup, true, resolving(List.of(A)), cleanup);
            await().atMost(5, TimeUnit.SECONDS).until(() -> backup.isHeld("a"));

            assertThat(chain.cancel()).isTrue();
            backup.release("a");

            assertThat(result(run)).isEqualTo(ChainState.PHASE1_FAILED);
            assertThat(chain.getPhase1Runner().getStatus()).isEqualTo(OperationStatus.CANCELLED);
            assertThat(cleanup.getInvocations()).isEmpty();
            assertThat(chain.cancel()).isFalse();
        }

        @Test
        @DisplayName("Should re-enter the cleanup decision after a successful phase 1 retry")
        void testRetryPhase1() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            backup.failOnce("b", TransferItemException.transientFailure("b", "timeout"));
            assertThat(result(chain.run(List.of(A, B), backup, true, resolving(List.of(A, B)), cleanup)))
                    .isEqualTo(ChainState.PHASE1_FAILED);

            ChainState retried = result(chain.retryFailed(backup));

            assertThat(retried).isEqualTo(ChainState.PHASE2_COMPLETED);
            assertThat(backup.invocationCount("a")).isEqualTo(1);
            assertThat(backup.invocationCount("b")).isEqualTo(2);
            assertThat(cleanup.getInvocations()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("Should retry the failed items of phase 2")
        void testRetryPhase2() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            cleanup.failOnce("b", TransferItemException.transientFailure("b", "locked"));
            assertThat(result(chain.run(List.of(A, B), backup, true, resolving(List.of(A, B)), cleanup)))
                    .isEqualTo(ChainState.PHASE2_FAILED);

            ChainState retried = result(chain.retryFailed(cleanup));

            assertThat(retried).isEqualTo(ChainState.PHASE2_COMPLETED);
            assertThat(cleanup.invocationCount("a")).isEqualTo(1);
            assertThat(cleanup.invocationCount("b")).isEqualTo(2);
            assertThat(backup.getInvocations()).hasSize(2);
        }

        @Test
        @DisplayName("Should reject retry when nothing failed")
        void testRetryRejected() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            result(chain.run(List.of(A), backup, false, resolving(List.of()), cleanup));

            assertThatThrownBy(() -> result(chain.retryFailed(backup)))
                    .hasCauseInstanceOf(InvalidOperationStateException.class);
        }

        @Test
        @DisplayName("Should return to idle on reset")
        void testReset() throws Exception {
            PhaseChain chain = chain(CleanupPolicy.REQUIRE_SUCCESS);
            result(chain.run(List.of(A), backup, true, resolving(List.of(A)), cleanup));

            chain.reset();

            assertThat(chain.getState()).isEqualTo(ChainState.IDLE);
            assertThat(chain.getProgress()).isEmpty();
            assertThat(chain.getPhase2Runner().getProgress()).isEmpty();
        }
    }
}
