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

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.packsync.core.OperationProgress;

import java.util.Objects;

/**
 * A runner snapshot tagged with the chain phase that produced it, so a presentation layer can show
 * "step 1 of 2". The snapshot itself is the phase runner's own, never merged across phases.
 */
public final class PhaseProgress {

    @JsonProperty("phase")
    private final int phase;

    @JsonProperty("progress")
    private final OperationProgress progress;

    public PhaseProgress(int phase, OperationProgress progress) {
        if (phase != 1 && phase != 2) {
            throw new IllegalArgumentException("Phase must be 1 or 2: " + phase);
        }
        this.phase = phase;
        this.progress = Objects.requireNonNull(progress, "Progress cannot be null");
    }

    public int getPhase() {
        return phase;
    }

    public OperationProgress getProgress() {
        return progress;
    }

    @Override
    public String toString() {
        return "PhaseProgress{phase=" + phase + ", progress=" + progress + '}';
    }
}
