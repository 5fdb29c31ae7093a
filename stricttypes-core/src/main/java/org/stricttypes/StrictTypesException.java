/*
 * StrictTypesException.java
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

package org.stricttypes;

import org.stricttypes.annotation.API;
import org.stricttypes.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Root of the exceptions raised by the strict types core. Subclasses describe one failure kind each
 * (transpile, compile, collision, completeness, bounds, identity parsing, decoding, layout); all of them
 * carry the offending names, ids or indexes as log info.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class StrictTypesException extends LoggableException {

    public StrictTypesException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public StrictTypesException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public StrictTypesException(@Nonnull Throwable cause) {
        super(cause);
    }
}
