package dev.mars.packsync.core.exceptions;

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

import dev.mars.packsync.core.FailureKind;

/**
 * The destination does not have room for the blob. Always fatal: every later item in the
 * same queue would hit the same wall.
 */
public class InsufficientSpaceException extends TransferItemException {

    private final long requiredBytes;
    private final long availableBytes;

    public InsufficientSpaceException(String itemId, long requiredBytes, long availableBytes) {
        super(itemId, String.format("Not enough space: need %d bytes, have %d", requiredBytes, availableBytes),
                FailureKind.FATAL);
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }
}
