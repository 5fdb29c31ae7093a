/*
 * TypeName.java
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

package org.stricttypes.ident;

import org.stricttypes.annotation.API;

import javax.annotation.Nonnull;

/**
 * Name of a type.
 */
@API(API.Status.STABLE)
public final class TypeName extends Ident {
    private TypeName(@Nonnull String value) {
        super(value);
    }

    @Nonnull
    public static TypeName of(@Nonnull String value) {
        return new TypeName(value);
    }
}
