package dev.mars.packsync.transfer.chain;

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

/**
 * States of a two-phase chain.
 *
 * <pre>
 * IDLE -&gt; PHASE1_RUNNING -&gt; PHASE1_COMPLETED -&gt; PHASE2_RUNNING -&gt; PHASE2_COMPLETED | PHASE2_FAILED
 *                         \-&gt; PHASE1_FAILED
 * </pre>
 *
 * <p>PHASE1_COMPLETED is terminal when cleanup was not requested or had nothing to do.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public enum ChainState {
    IDLE(0),
    PHASE1_RUNNING(1),
    PHASE1_COMPLETED(1),
    PHASE1_FAILED(1),
    PHASE2_RUNNING(2),
    PHASE2_COMPLETED(2),
    PHASE2_FAILED(2);

    private final int phase;

    ChainState(int phase) {
        this.phase = phase;
    }

    /**
     * Phase this state belongs to, {@code 0} for IDLE.
     */
    public int getPhase() {
        return phase;
    }

    public boolean isRunning() {
        return this == PHASE1_RUNNING || this == PHASE2_RUNNING;
    }

    public boolean isFailed() {
        return this == PHASE1_FAILED || this == PHASE2_FAILED;
    }
}
