/*
 * LoggableException.java
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

package org.stricttypes.util;

import org.stricttypes.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every exception thrown by the strict types libraries. Besides the message, an instance carries
 * an ordered set of key/value pairs (the offending library, type name, id, index...) so that a caller can
 * log the failure in {@code key="value"} form and search for it later without parsing the message text.
 */
@SuppressWarnings("serial")
@API(API.Status.MAINTAINED)
public class LoggableException extends RuntimeException {
    private static final Object[] EMPTY_LOG_INFO = new Object[0];

    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with the given message and a flattened list of key/value pairs.
     *
     * @param msg error message
     * @param keyValues keys at even positions, values at odd positions
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     * @see #addLogInfo(Object...)
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(Throwable cause) {
        super(cause);
    }

    /**
     * Get the key/value pairs attached to this exception, in the order they were added.
     *
     * @return an unmodifiable view of the log information
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Attach one key/value pair. A key that is already present is overwritten but keeps its position.
     *
     * @param description the key
     * @param object the value
     * @return this exception
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull String description, @Nullable Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    /**
     * Attach a flattened list of key/value pairs, e.g. {@code ["k0", "v0", "k1", "v1"]}. Keys are
     * converted with {@link String#valueOf(Object)}, so enum keys can be passed directly. This is the
     * format produced by {@link #exportLogInfo()}.
     *
     * @param keyValue keys at even positions, values at odd positions
     * @return this exception
     * @throws IllegalArgumentException if {@code keyValue} has an odd number of elements
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object... keyValue) {
        if ((keyValue.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    /**
     * Flatten the log information into {@code [k0, v0, k1, v1, ...]}, the format accepted by
     * {@link #addLogInfo(Object...)} and by {@link #LoggableException(String, Object...)}.
     *
     * @return the flattened key/value pairs
     */
    @Nonnull
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return EMPTY_LOG_INFO;
        }
        final Object[] exported = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exported[i] = entry.getKey();
            exported[i + 1] = entry.getValue();
            i += 2;
        }
        return exported;
    }
}
