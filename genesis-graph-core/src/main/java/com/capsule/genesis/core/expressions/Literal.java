/*
 * Literal.java
 *
 * This source file is part of the Genesis Graph open source project
 *
 * Copyright 2024-2026 the Genesis Graph project authors
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

package com.capsule.genesis.core.expressions;

import com.capsule.genesis.annotation.API;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A literal value: a 64-bit integer, a float, a string, a boolean or unit.
 *
 * <p>
 * Floats are kept as their source text and compare by string equality, so {@code 1.0} and {@code 1.00} are
 * different literals. This keeps hashing of float payloads exact.
 * </p>
 */
@API(API.Status.STABLE)
public final class Literal {
    /**
     * The kind of a literal.
     */
    public enum Kind {
        INT,
        FLOAT,
        STRING,
        BOOL,
        UNIT
    }

    @Nonnull
    public static final Literal UNIT = new Literal(Kind.UNIT, null);
    @Nonnull
    public static final Literal TRUE = new Literal(Kind.BOOL, Boolean.TRUE);
    @Nonnull
    public static final Literal FALSE = new Literal(Kind.BOOL, Boolean.FALSE);

    @Nonnull
    private final Kind kind;
    @Nullable
    private final Object value;

    private Literal(@Nonnull Kind kind, @Nullable Object value) {
        this.kind = kind;
        this.value = value;
    }

    @Nonnull
    public static Literal ofInt(long value) {
        return new Literal(Kind.INT, value);
    }

    @Nonnull
    public static Literal ofFloat(@Nonnull String text) {
        Preconditions.checkArgument(!text.isEmpty(), "float literal text must not be empty");
        return new Literal(Kind.FLOAT, text);
    }

    @Nonnull
    public static Literal ofString(@Nonnull String value) {
        return new Literal(Kind.STRING, Objects.requireNonNull(value));
    }

    @Nonnull
    public static Literal ofBool(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Get the underlying value: a {@link Long} for integers, the source text for floats, a {@link String} for strings,
     * a {@link Boolean} for booleans and {@code null} for unit.
     *
     * @return the value of this literal
     */
    @Nullable
    public Object getValue() {
        return value;
    }

    public long getIntValue() {
        checkKind(Kind.INT);
        return (Long)value;
    }

    @Nonnull
    public String getFloatText() {
        checkKind(Kind.FLOAT);
        return (String)value;
    }

    @Nonnull
    public String getStringValue() {
        checkKind(Kind.STRING);
        return (String)value;
    }

    public boolean getBoolValue() {
        checkKind(Kind.BOOL);
        return (Boolean)value;
    }

    private void checkKind(@Nonnull Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("literal is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Literal literal = (Literal)o;
        return kind == literal.kind && Objects.equals(value, literal.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING:
                return "\"" + value + "\"";
            case UNIT:
                return "()";
            default:
                return String.valueOf(value);
        }
    }
}
