/*
 * Expressions.java
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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Static factories for building {@link Expression} trees in code and tests.
 */
@API(API.Status.STABLE)
public class Expressions {

    @Nonnull
    public static VarExpression var(@Nonnull String name) {
        return new VarExpression(name);
    }

    @Nonnull
    public static LiteralExpression literal(@Nonnull Literal literal) {
        return new LiteralExpression(literal);
    }

    @Nonnull
    public static LiteralExpression intLiteral(long value) {
        return new LiteralExpression(Literal.ofInt(value));
    }

    @Nonnull
    public static LiteralExpression floatLiteral(@Nonnull String text) {
        return new LiteralExpression(Literal.ofFloat(text));
    }

    @Nonnull
    public static LiteralExpression stringLiteral(@Nonnull String value) {
        return new LiteralExpression(Literal.ofString(value));
    }

    @Nonnull
    public static LiteralExpression boolLiteral(boolean value) {
        return new LiteralExpression(Literal.ofBool(value));
    }

    @Nonnull
    public static LiteralExpression unit() {
        return new LiteralExpression(Literal.UNIT);
    }

    @Nonnull
    public static LambdaExpression lambda(@Nonnull String param, @Nonnull Expression body) {
        return new LambdaExpression(param, body);
    }

    /**
     * Build a curried application {@code (((function a1) a2) ...)}.
     *
     * @param function the applied function
     * @param arguments the arguments, at least one
     * @return the outermost application
     */
    @Nonnull
    public static ApplyExpression apply(@Nonnull Expression function, @Nonnull Expression... arguments) {
        if (arguments.length == 0) {
            throw new IllegalArgumentException("apply needs at least one argument");
        }
        ApplyExpression result = new ApplyExpression(function, arguments[0]);
        for (int i = 1; i < arguments.length; i++) {
            result = new ApplyExpression(result, arguments[i]);
        }
        return result;
    }

    @Nonnull
    public static LinearApplyExpression linearApply(@Nonnull Expression function, @Nonnull Expression argument) {
        return new LinearApplyExpression(function, argument);
    }

    @Nonnull
    public static LetExpression let(@Nonnull String name, @Nonnull Expression value, @Nonnull Expression body) {
        return new LetExpression(name, value, body);
    }

    @Nonnull
    public static MatchExpression match(@Nonnull Expression scrutinee, @Nonnull MatchArm... arms) {
        return new MatchExpression(scrutinee, Arrays.asList(arms));
    }

    @Nonnull
    public static TupleExpression tuple(@Nonnull Expression... elements) {
        return new TupleExpression(Arrays.asList(elements));
    }

    @Nonnull
    public static ListExpression list(@Nonnull Expression... elements) {
        return new ListExpression(Arrays.asList(elements));
    }

    @Nonnull
    public static Map.Entry<String, Expression> field(@Nonnull String name, @Nonnull Expression value) {
        return Maps.immutableEntry(name, value);
    }

    @SafeVarargs
    @Nonnull
    public static RecordExpression record(@Nonnull Map.Entry<String, Expression>... fields) {
        return new RecordExpression(ImmutableList.copyOf(fields));
    }

    @Nonnull
    public static RecordExpression record(@Nonnull List<Map.Entry<String, Expression>> fields) {
        return new RecordExpression(fields);
    }

    private Expressions() {
    }
}
