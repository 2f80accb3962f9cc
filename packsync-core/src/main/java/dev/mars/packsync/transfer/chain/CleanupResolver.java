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

import dev.mars.packsync.core.OperationProgress;
import dev.mars.packsync.core.TransferItem;
import io.vertx.core.Future;

import java.util.List;

/**
 * Computes the phase-2 item set once phase 1 has settled.
 *
 * <p>Implementations must read current membership at call time. A set captured before phase 1 ran
 * could name items whose push never happened.</p>
 */
@FunctionalInterface
public interface CleanupResolver {

    Future<List<TransferItem>> resolve(OperationProgress phase1Result);
}
