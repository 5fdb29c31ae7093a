/*
 * TypeCollisionException.java
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

package org.stricttypes.typesys;

import org.stricttypes.StrictTypesException;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Ty;
import org.stricttypes.id.SemId;
import org.stricttypes.ident.LibName;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Two imported libraries assign different structures to the same semantic id. Semantic ids are content hashes, so
 * this points at a library whose ids were not produced by the compiler rather than at a user mistake.
 */
@API(API.Status.UNSTABLE)
public class TypeCollisionException extends StrictTypesException {
    private static final long serialVersionUID = 1;

    @Nonnull
    private final transient SemId semId;

    public TypeCollisionException(@Nonnull SemId semId, @Nonnull Ty<SemId> existing, @Nonnull Ty<SemId> incoming, @Nonnull LibName lib) {
        super("type collision: semantic id is already assigned to a different type",
                LogMessageKeys.SEM_ID, semId,
                LogMessageKeys.LIB_NAME, lib,
                LogMessageKeys.EXPECTED, existing,
                LogMessageKeys.ACTUAL, incoming);
        this.semId = semId;
    }

    @Nonnull
    public SemId getSemId() {
        return semId;
    }
}
