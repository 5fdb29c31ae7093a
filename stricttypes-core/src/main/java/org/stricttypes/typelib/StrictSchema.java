/*
 * StrictSchema.java
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

package org.stricttypes.typelib;

import org.stricttypes.annotation.API;
import org.stricttypes.ast.Ty;
import org.stricttypes.ident.TypeName;

import javax.annotation.Nonnull;

/**
 * A data shape declared by a producer. {@link LibBuilder#transpile(StrictSchema)} registers the shape under its
 * type name, together with every schema it refers to through {@link TranspileRef#schema(StrictSchema)}.
 */
@API(API.Status.STABLE)
public interface StrictSchema {
    @Nonnull
    TypeName getTypeName();

    /**
     * Describe the shape with symbolic references to nested types.
     *
     * @return the symbolic type
     */
    @Nonnull
    Ty<TranspileRef> getSymbolicType();
}
