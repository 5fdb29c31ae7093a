/*
 * LogMessageKeys.java
 *
 * This source file is part of the Strict Types open source project
 *
 * Copyright 2024 the Strict Types project authors
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

package org.stricttypes.logging;

import org.stricttypes.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the strict types core.
 * All keys are consolidated here so that collisions are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // general keys
    TITLE("ttl"),
    MESSAGE,
    ACTUAL,
    LIMIT,
    EXPECTED,
    ERROR_COUNT,
    // naming
    LIB_NAME,
    TYPE_NAME,
    FIELD_NAME,
    DEPENDENCY,
    IDENT,
    // identities
    SEM_ID,
    LIB_ID,
    SYS_ID,
    REFERENCED_BY,
    ID_TEXT,
    // counts
    TYPE_COUNT,
    LIB_COUNT,
    DEPENDENCY_COUNT,
    // codec
    TAG,
    OFFSET,
    RAW_BYTES,
    // layout
    DEPTH,
    PATH,
    ITEM_INDEX,
    CHILD_COUNT;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
