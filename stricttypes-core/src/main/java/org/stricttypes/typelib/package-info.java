/*
 * package-info.java
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

/**
 * Type libraries: declaring types with a {@link org.stricttypes.typelib.LibBuilder}, the symbolic stage
 * ({@link org.stricttypes.typelib.SymbolicLib}) and the compiled stage ({@link org.stricttypes.typelib.TypeLib}).
 *
 * <p>
 * The two stages are separate types. A symbolic library may still contain unresolved or inconsistent names;
 * everything in a compiled library refers to other types by semantic id only.
 * </p>
 */
package org.stricttypes.typelib;
