package dev.mars.packsync.core;

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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classification of an item failure.
 */
public enum FailureKind {
    /**
     * Network blip, timeout, temporarily unreachable store. Recorded, the queue continues and
     * the run stays resumable.
     */
    TRANSIENT,

    /**
     * Unrecoverable condition such as the destination running out of space. Stops the queue
     * and makes the whole run non-resumable.
     */
    FATAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
