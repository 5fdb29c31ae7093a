/*
 * TyCodec.java
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

package org.stricttypes.codec;

import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.ast.Field;
import org.stricttypes.ast.Primitive;
import org.stricttypes.ast.Sizing;
import org.stricttypes.ast.Ty;
import org.stricttypes.ast.TyVisitor;
import org.stricttypes.ast.UnionVariant;
import org.stricttypes.ast.Variant;
import org.stricttypes.id.SemId;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical encoding of {@link Ty}. A type is written as its one byte {@link Ty.Kind} tag followed by the
 * variant's content:
 *
 * <ul>
 *     <li>primitive: the primitive's code</li>
 *     <li>unicode: nothing</li>
 *     <li>enum: member count, then name and tag of each variant</li>
 *     <li>union: member count, then name, tag and payload reference of each variant</li>
 *     <li>tuple: member count, then each reference</li>
 *     <li>struct: member count, then name and reference of each field</li>
 *     <li>array: element reference, u16 length</li>
 *     <li>list and set: element reference, u16 minimum and u16 maximum size</li>
 *     <li>map: key reference, value reference, u16 minimum and u16 maximum size</li>
 *     <li>optional: inner reference</li>
 *     <li>recursive: one byte depth</li>
 * </ul>
 *
 * Member counts are single bytes. How references are written is up to the caller; compiled types write the 32
 * bytes of the referenced {@link SemId}.
 */
@API(API.Status.UNSTABLE)
public final class TyCodec {

    /**
     * Writes one nested type reference.
     * @param <R> reference type
     */
    @FunctionalInterface
    public interface RefWriter<R> {
        void write(@Nonnull StrictWriter writer, @Nonnull R ref);
    }

    /**
     * Reads one nested type reference.
     * @param <R> reference type
     */
    @FunctionalInterface
    public interface RefReader<R> {
        @Nonnull
        R read(@Nonnull StrictReader reader);
    }

    private static final RefWriter<SemId> SEM_ID_WRITER = StrictWriter::writeId;
    private static final RefReader<SemId> SEM_ID_READER = StrictReader::readSemId;

    private TyCodec() {
    }

    @Nonnull
    public static byte[] encode(@Nonnull Ty<SemId> ty) {
        final StrictWriter writer = new StrictWriter();
        write(writer, ty);
        return writer.toByteArray();
    }

    @Nonnull
    public static Ty<SemId> decode(@Nonnull byte[] bytes) {
        final StrictReader reader = new StrictReader(bytes);
        final Ty<SemId> ty = read(reader);
        reader.checkEnd();
        return ty;
    }

    public static void write(@Nonnull StrictWriter writer, @Nonnull Ty<SemId> ty) {
        write(writer, ty, SEM_ID_WRITER);
    }

    @Nonnull
    public static Ty<SemId> read(@Nonnull StrictReader reader) {
        return read(reader, SEM_ID_READER);
    }

    public static <R> void write(@Nonnull StrictWriter writer, @Nonnull Ty<R> ty, @Nonnull RefWriter<R> refs) {
        writer.writeU8(ty.getKind().getTag());
        ty.accept(new Writer<>(writer, refs));
    }

    @Nonnull
    public static <R> Ty<R> read(@Nonnull StrictReader reader, @Nonnull RefReader<R> refs) {
        final int offset = reader.getOffset();
        final int tag = reader.readU8();
        try {
            return readContent(reader, tag, refs);
        } catch (StrictTypesArgumentException e) {
            throw new DecodeException("invalid type definition", e)
                    .addLogInfo(LogMessageKeys.OFFSET.toString(), offset)
                    .addLogInfo(LogMessageKeys.TAG.toString(), tag);
        }
    }

    @Nonnull
    private static <R> Ty<R> readContent(@Nonnull StrictReader reader, int tag, @Nonnull RefReader<R> refs) {
        switch (Ty.Kind.fromTag(tag)) {
            case PRIMITIVE:
                final int code = reader.readU8();
                final Primitive primitive = Primitive.fromCode(code);
                if (primitive == null) {
                    throw reader.invalid("unknown primitive code", LogMessageKeys.ACTUAL, code);
                }
                return Ty.primitive(primitive);
            case UNICODE:
                return Ty.unicode();
            case ENUM: {
                final int count = reader.readU8();
                final List<Variant> variants = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    variants.add(Variant.of(reader.readFieldName(), reader.readU8()));
                }
                return Ty.enumerate(variants);
            }
            case UNION: {
                final int count = reader.readU8();
                final List<UnionVariant<R>> variants = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    variants.add(UnionVariant.of(reader.readFieldName(), reader.readU8(), refs.read(reader)));
                }
                return Ty.union(variants);
            }
            case TUPLE: {
                final int count = reader.readU8();
                final List<R> members = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    members.add(refs.read(reader));
                }
                return Ty.tuple(members);
            }
            case STRUCT: {
                final int count = reader.readU8();
                final List<Field<R>> fields = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    fields.add(Field.of(reader.readFieldName(), refs.read(reader)));
                }
                return Ty.struct(fields);
            }
            case ARRAY: {
                final R element = refs.read(reader);
                return Ty.array(element, reader.readU16());
            }
            case LIST: {
                final R element = refs.read(reader);
                return Ty.list(element, readSizing(reader));
            }
            case SET: {
                final R element = refs.read(reader);
                return Ty.set(element, readSizing(reader));
            }
            case MAP: {
                final R key = refs.read(reader);
                final R value = refs.read(reader);
                return Ty.map(key, value, readSizing(reader));
            }
            case OPTIONAL:
                return Ty.optional(refs.read(reader));
            case RECURSIVE:
                return Ty.recursive(reader.readU8());
            default:
                throw reader.invalid("unknown type tag", LogMessageKeys.TAG, tag);
        }
    }

    @Nonnull
    private static Sizing readSizing(@Nonnull StrictReader reader) {
        final int min = reader.readU16();
        final int max = reader.readU16();
        return Sizing.of(min, max);
    }

    private static void writeSizing(@Nonnull StrictWriter writer, @Nonnull Sizing sizing) {
        writer.writeU16(sizing.getMin());
        writer.writeU16(sizing.getMax());
    }

    private static class Writer<R> implements TyVisitor<R, Void> {
        @Nonnull
        private final StrictWriter writer;
        @Nonnull
        private final RefWriter<R> refs;

        Writer(@Nonnull StrictWriter writer, @Nonnull RefWriter<R> refs) {
            this.writer = writer;
            this.refs = refs;
        }

        @Override
        public Void visitPrimitive(@Nonnull Ty.PrimitiveTy<R> ty) {
            writer.writeU8(ty.getPrimitive().getCode());
            return null;
        }

        @Override
        public Void visitUnicode(@Nonnull Ty.UnicodeTy<R> ty) {
            return null;
        }

        @Override
        public Void visitEnum(@Nonnull Ty.EnumTy<R> ty) {
            writer.writeU8(ty.getVariants().size());
            for (Variant variant : ty.getVariants()) {
                writer.writeIdent(variant.getName());
                writer.writeU8(variant.getTag());
            }
            return null;
        }

        @Override
        public Void visitUnion(@Nonnull Ty.UnionTy<R> ty) {
            writer.writeU8(ty.getVariants().size());
            for (UnionVariant<R> variant : ty.getVariants()) {
                writer.writeIdent(variant.getName());
                writer.writeU8(variant.getTag());
                refs.write(writer, variant.getType());
            }
            return null;
        }

        @Override
        public Void visitTuple(@Nonnull Ty.TupleTy<R> ty) {
            writer.writeU8(ty.getMembers().size());
            for (R member : ty.getMembers()) {
                refs.write(writer, member);
            }
            return null;
        }

        @Override
        public Void visitStruct(@Nonnull Ty.StructTy<R> ty) {
            writer.writeU8(ty.getFields().size());
            for (Field<R> field : ty.getFields()) {
                writer.writeIdent(field.getName());
                refs.write(writer, field.getType());
            }
            return null;
        }

        @Override
        public Void visitArray(@Nonnull Ty.ArrayTy<R> ty) {
            refs.write(writer, ty.getElement());
            writer.writeU16(ty.getLength());
            return null;
        }

        @Override
        public Void visitList(@Nonnull Ty.ListTy<R> ty) {
            refs.write(writer, ty.getElement());
            writeSizing(writer, ty.getSizing());
            return null;
        }

        @Override
        public Void visitSet(@Nonnull Ty.SetTy<R> ty) {
            refs.write(writer, ty.getElement());
            writeSizing(writer, ty.getSizing());
            return null;
        }

        @Override
        public Void visitMap(@Nonnull Ty.MapTy<R> ty) {
            refs.write(writer, ty.getKey());
            refs.write(writer, ty.getValue());
            writeSizing(writer, ty.getSizing());
            return null;
        }

        @Override
        public Void visitOptional(@Nonnull Ty.OptionalTy<R> ty) {
            refs.write(writer, ty.getInner());
            return null;
        }

        @Override
        public Void visitRecursive(@Nonnull Ty.RecursiveTy<R> ty) {
            writer.writeU8(ty.getDepth());
            return null;
        }
    }
}
