/*
 * TypeSysId.java
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

import javax.annotation.Nonnull;

/**
 * Identity of a whole type system, committing to the ordered ids of its libraries and of its member types.
 */
@API(API.Status.STABLE)
public final class TypeSysId extends CommitId {
    public static final String TAG = "urn:ubideco:strict-types:sys:v02";
    public static final String HRI = "sts";

    private TypeSysId(@Nonnull byte[] bytes) {
        super(bytes);
    }

    @Nonnull
    public static TypeSysId fromBytes(@Nonnull byte[] bytes) {
        return new TypeSysId(bytes);
    }

    @Nonnull
    public static TypeSysId commit(@Nonnull byte[] canonicalContent) {
        return new TypeSysId(new CommitEngine(TAG).commit(canonicalContent).finish());
    }

    @Nonnull
    public static TypeSysId parse(@Nonnull String text) {
        return new TypeSysId(parse(text, HRI));
    }

    @Nonnull
    @Override
    public String getHri() {
        return HRI;
    }
}
