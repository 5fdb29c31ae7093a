/*
 * IdentityParseException.java
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

package org.stricttypes.id;

import org.stricttypes.StrictTypesException;
import org.stricttypes.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The text form of an identity is malformed: unknown prefix, invalid base58, wrong length, or a checksum or
 * mnemonic that does not match the payload.
 */
@API(API.Status.UNSTABLE)
public class IdentityParseException extends StrictTypesException {
    private static final long serialVersionUID = 1;

    public IdentityParseException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public IdentityParseException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}
