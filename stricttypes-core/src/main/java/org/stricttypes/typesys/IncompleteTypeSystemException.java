/*
 * IncompleteTypeSystemException.java
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

import com.google.common.collect.ImmutableList;
import org.stricttypes.StrictTypesException;
import org.stricttypes.annotation.API;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * The imported libraries do not form a complete type system. Carries every unresolved reference, in a
 * deterministic order.
 */
@API(API.Status.UNSTABLE)
public class IncompleteTypeSystemException extends StrictTypesException {
    private static final long serialVersionUID = 1;

    @Nonnull
    private final transient List<ResolutionError> errors;

    public IncompleteTypeSystemException(@Nonnull List<ResolutionError> errors) {
        super("type system is incomplete",
                LogMessageKeys.ERROR_COUNT, errors.size(),
                LogMessageKeys.MESSAGE, errors.isEmpty() ? "" : errors.get(0).toString());
        this.errors = ImmutableList.copyOf(errors);
    }

    @Nonnull
    public List<ResolutionError> getErrors() {
        return errors;
    }
}
