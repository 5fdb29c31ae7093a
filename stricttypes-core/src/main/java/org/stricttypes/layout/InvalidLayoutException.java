/*
 * InvalidLayoutException.java
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

package org.stricttypes.layout;

import org.stricttypes.StrictTypesException;
import org.stricttypes.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A {@link TypeLayout} whose items do not describe a single well formed tree.
 */
@API(API.Status.UNSTABLE)
public class InvalidLayoutException extends StrictTypesException {
    private static final long serialVersionUID = 1;

    public InvalidLayoutException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }
}
