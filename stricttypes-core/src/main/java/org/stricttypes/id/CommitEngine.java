/*
 * CommitEngine.java
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

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import org.stricttypes.annotation.API;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;

/**
 * Tagged SHA-256 hashing. The engine is seeded with {@code SHA256(tag)} twice, so commitments made under
 * different tags live in separate domains: no content can produce the same id for two kinds of identity.
 *
 * <p>
 * An engine is single use: after {@link #finish()} it cannot take more content.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class CommitEngine {
    @Nonnull
    private final Hasher hasher;

    public CommitEngine(@Nonnull String tag) {
        final byte[] tagHash = Hashing.sha256().hashString(tag, StandardCharsets.US_ASCII).asBytes();
        this.hasher = Hashing.sha256().newHasher()
                .putBytes(tagHash)
                .putBytes(tagHash);
    }

    @Nonnull
    public CommitEngine commit(@Nonnull byte[] content) {
        hasher.putBytes(content);
        return this;
    }

    @Nonnull
    public byte[] finish() {
        return hasher.hash().asBytes();
    }
}
