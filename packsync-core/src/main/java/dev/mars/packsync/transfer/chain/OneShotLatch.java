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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A flag that can be fired once. Guards the phase-1 to phase-2 transition so a completion
 * delivered twice cannot start the cleanup phase twice.
 */
public final class OneShotLatch {

    private final AtomicBoolean fired = new AtomicBoolean(false);

    /**
     * @return true for the first caller only
     */
    public boolean tryFire() {
        return fired.compareAndSet(false, true);
    }

    public boolean hasFired() {
        return fired.get();
    }

    @Override
    public String toString() {
        return "OneShotLatch{fired=" + fired.get() + '}';
    }
}
