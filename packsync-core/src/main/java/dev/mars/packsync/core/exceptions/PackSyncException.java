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

/**
 * Base checked exception for the PackSync transfer engine.
 */
public class PackSyncException extends Exception {

    public PackSyncException(String message) {
        super(message);
    }

    public PackSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public PackSyncException(Throwable cause) {
        super(cause);
    }
}
