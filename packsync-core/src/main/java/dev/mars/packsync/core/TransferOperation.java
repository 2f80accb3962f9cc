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
 * What a runner's item executor does. The engine treats every operation identically; the tag is
 * carried through snapshots, logs and metrics so the presentation layer can label the run.
 */
public enum TransferOperation {
    /** Local blob pushed to backup storage. */
    BACKUP,
    /** Backup blob pulled to local storage. */
    RESTORE,
    /** Blob fetched from its upstream source, e.g. after a pack update. */
    DOWNLOAD,
    /** Local copy deleted after it was confirmed on backup. */
    CLEANUP,
    /** Blob hash checked against its content address. */
    VERIFY;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
