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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where copies of a blob currently exist.
 */
public enum BlobLocation {
    LOCAL_ONLY(true, false),
    BACKUP_ONLY(false, true),
    BOTH(true, true),
    NOWHERE(false, false);

    private final boolean onLocal;
    private final boolean onBackup;

    BlobLocation(boolean onLocal, boolean onBackup) {
        this.onLocal = onLocal;
        this.onBackup = onBackup;
    }

    public boolean isOnLocal() {
        return onLocal;
    }

    public boolean isOnBackup() {
        return onBackup;
    }

    public static BlobLocation of(boolean onLocal, boolean onBackup) {
        if (onLocal) {
            return onBackup ? BOTH : LOCAL_ONLY;
        }
        return onBackup ? BACKUP_ONLY : NOWHERE;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BlobLocation fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
