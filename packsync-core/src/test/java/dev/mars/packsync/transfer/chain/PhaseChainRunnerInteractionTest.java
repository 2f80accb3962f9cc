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

import dev.mars.packsync.core.OperationProgress;
import dev.mars.packsync.core.OperationStatus;
import dev.mars.packsync.core.TransferItem;
import dev.mars.packsync.core.TransferOperation;
import dev.mars.packsync.core.exceptions.InvalidOperationStateException;
import dev.mars.packsync.transfer.ItemExecutor;
import dev.mars.packsync.transfer.TransferRunner;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Checks how {@link PhaseChain} drives its two runners, using mocked runners.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
@DisplayName("PhaseChain Runner Interaction Tests")
class PhaseChainRunnerInteractionTest {

    private TransferRunner mockPhase1;
    private TransferRunner mockPhase2;
    private ItemExecutor executor;
    private PhaseChain chain;

    @BeforeEach
    void setUp() {
        mockPhase1 = mock(TransferRunner.class);
        mockPhase2 = mock(TransferRunner.class);
        when(mockPhase1.getOperation()).thenReturn(TransferOperation.BACKUP);
        when(mockPhase2.getOperation()).thenReturn(TransferOperation.CLEANUP);
        executor = itemId -> Future.succeededFuture();
        chain = new PhaseChain(mockPhase1, mockPhase2, CleanupPolicy.REQUIRE_SUCCESS);
    }

    @Test
    void testRegistersForwardingHandlers() {
        verify(mockPhase1).progressHandler(any());
        verify(mockPhase2).progressHandler(any());
    }

    @Test
    void testRunnerRefusingToStartFailsPhase1() {
        InvalidOperationStateException refusal =
                new InvalidOperationStateException("backup", OperationStatus.RUNNING, "start");
        when(mockPhase1.start(anyList(), any())).thenReturn(Future.failedFuture(refusal));

        Future<ChainState> result = chain.run(List.of(TransferItem.of("a", 1)), executor, true,
                phase1 -> Future.succeededFuture(List.of()), executor);

        assertTrue(result.succeeded());
        assertEquals(ChainState.PHASE1_FAILED, result.result());
        assertSame(refusal, chain.getFailureCause().orElseThrow());
        verify(mockPhase2, never()).start(anyList(), any());
    }

    @Test
    void testRunResetsThePhase2Runner() {
        when(mockPhase1.start(anyList(), any())).thenReturn(Promise.<OperationProgress>promise().future());

        chain.run(List.of(), executor, false, phase1 -> Future.succeededFuture(List.of()), executor);

        verify(mockPhase2).reset();
        assertEquals(ChainState.PHASE1_RUNNING, chain.getState());
    }

    @Test
    void testCancelTargetsTheActivePhase() {
        when(mockPhase1.start(anyList(), any())).thenReturn(Promise.<OperationProgress>promise().future());
        chain.run(List.of(TransferItem.of("a", 1)), executor, true,
                phase1 -> Future.succeededFuture(List.of()), executor);

        assertTrue(chain.cancel());

        verify(mockPhase1).cancel();
        verify(mockPhase2, never()).cancel();
    }

    @Test
    void testCancelWhenIdle() {
        assertFalse(chain.cancel());
        verify(mockPhase1, never()).cancel();
    }

    @Test
    void testRejectsSharedRunner() {
        assertThrows(IllegalArgumentException.class,
                () -> new PhaseChain(mockPhase1, mockPhase1, CleanupPolicy.REQUIRE_SUCCESS));
    }
}
