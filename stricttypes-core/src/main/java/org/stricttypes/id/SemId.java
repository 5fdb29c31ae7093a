/*
 * SemId.java
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

import org.stricttypes.annotation.API;
import org.stricttypes.ast.Ty;
import org.stricttypes.codec.TyCodec;

import javax.annotation.Nonnull;

/**
 * Semantic identity of a single type: the tagged hash of the type's canonical encoding. Nested types are encoded
 * by their own semantic ids, so a semantic id covers the whole structure of a type and nothing else; names are
 * not part of it.
 */
@API(API.Status.STABLE)
public final class SemId extends CommitId {
    public static final String TAG = "urn:ubideco:strict-types:semid:v01";
    public static final String HRI = "semid";

    private SemId(@Nonnull byte[] bytes) {
        super(bytes);
    }

    @Nonnull
    public static SemId fromBytes(@Nonnull byte[] bytes) {
        return new SemId(bytes);
    }

    /**
     * Compute the semantic id of a compiled type.
     *
     * @param ty the type
     * @return its semantic id
     */
    @Nonnull
    public static SemId of(@Nonnull Ty<SemId> ty) {
        return new SemId(new CommitEngine(TAG).commit(TyCodec.encode(ty)).finish());
    }

    /**
     * Parse the text form of a semantic id.
     *
     * @param text the text
     * @return the id
     * @throws IdentityParseException if the text is not a valid semantic id
     * @see CommitId#parse(String, String)
     */
    @Nonnull
    public static SemId parse(@Nonnull String text) {
        return new SemId(parse(text, HRI));
    }

    @Nonnull
    @Override
    public String getHri() {
        return HRI;
    }
}
