package dev.mars.packsync.transfer;

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

import io.vertx.core.Future;

/**
 * Caller-supplied capability that transfers one item.
 *
 * <p>The runner knows nothing about what the call does (an HTTP PUT to backup storage, a local
 * delete, a hash check). It only requires that the returned future eventually settles, and that
 * a failure can be classified by a {@link FailureClassifier}. Throwing from {@link #execute} or
 * returning {@code null} counts as that item failing.</p>
 */
@FunctionalInterface
public interface ItemExecutor {

    /**
     * Transfer the item with the given content address.
     *
     * @param itemId the item's id, e.g. a blob sha256
     * @return a future that succeeds when the item is done or fails with the reason it is not
     */
    Future<Void> execute(String itemId);

    /**
     * Cancellation signal for the in-flight call. Executors that cannot interrupt their work keep
     * the default no-op; the runner waits for the call to settle either way.
     *
     * @param itemId the id of the item whose call is in flight
     */
    default void cancel(String itemId) {
    }
}
