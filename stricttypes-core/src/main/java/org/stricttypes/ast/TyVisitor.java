/*
 * TyVisitor.java
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

package org.stricttypes.ast;

import org.stricttypes.annotation.API;

import javax.annotation.Nonnull;

/**
 * Exhaustive dispatch over the variants of {@link Ty}. Adding a variant to {@code Ty} adds a method here, so every
 * visitor fails to compile until it handles it.
 *
 * @param <R> reference type of the visited types
 * @param <T> result type
 */
@API(API.Status.STABLE)
public interface TyVisitor<R, T> {
    T visitPrimitive(@Nonnull Ty.PrimitiveTy<R> ty);

    T visitUnicode(@Nonnull Ty.UnicodeTy<R> ty);

    T visitEnum(@Nonnull Ty.EnumTy<R> ty);

    T visitUnion(@Nonnull Ty.UnionTy<R> ty);

    T visitTuple(@Nonnull Ty.TupleTy<R> ty);

    T visitStruct(@Nonnull Ty.StructTy<R> ty);

    T visitArray(@Nonnull Ty.ArrayTy<R> ty);

    T visitList(@Nonnull Ty.ListTy<R> ty);

    T visitSet(@Nonnull Ty.SetTy<R> ty);

    T visitMap(@Nonnull Ty.MapTy<R> ty);

    T visitOptional(@Nonnull Ty.OptionalTy<R> ty);

    T visitRecursive(@Nonnull Ty.RecursiveTy<R> ty);
}
