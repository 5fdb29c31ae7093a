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
 * Layouts of compiled types: the preorder flattening of a type's full structure ({@link org.stricttypes.layout.TypeTree},
 * {@link org.stricttypes.layout.TypeLayout}) and the tree rebuilt from it ({@link org.stricttypes.layout.TypeVesper}).
 */
package org.stricttypes.layout;
