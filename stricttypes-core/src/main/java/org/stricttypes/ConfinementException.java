/*
 * ConfinementException.java
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
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * A bounded collection would exceed its hard limit: too many types in a type system, or a serialized form
 * that is too large. Nothing is truncated when this is thrown.
 */
@API(API.Status.UNSTABLE)
public class ConfinementException extends StrictTypesException {
    private static final long serialVersionUID = 1;

    private final long limit;
    private final long actual;

    public ConfinementException(@Nonnull String what, long actual, long limit) {
        super(what + " exceeds the limit of " + limit,
                LogMessageKeys.ACTUAL, actual,
                LogMessageKeys.LIMIT, limit);
        this.limit = limit;
        this.actual = actual;
    }

    public long getLimit() {
        return limit;
    }

    public long getActual() {
        return actual;
    }
}
