/*
 * CompileException.java
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

import com.google.common.collect.ImmutableList;
import org.stricttypes.StrictTypesException;
import org.stricttypes.annotation.API;
import org.stricttypes.ident.LibName;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A symbolic library could not be compiled. {@link #getErrors()} lists every problem found.
 */
@API(API.Status.UNSTABLE)
public class CompileException extends StrictTypesException {
    private static final long serialVersionUID = 1;

    @Nonnull
    private final transient List<LibError> errors;

    public CompileException(@Nonnull LibName lib, @Nonnull List<LibError> errors) {
        super("unable to compile type library: " + errors.stream().map(LibError::toString).collect(Collectors.joining("; ")),
                LogMessageKeys.LIB_NAME, lib,
                LogMessageKeys.ERROR_COUNT, errors.size());
        this.errors = ImmutableList.copyOf(errors);
    }

    @Nonnull
    public List<LibError> getErrors() {
        return errors;
    }
}
