/*
 * Patterns.java
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

package com.capsule.genesis.core.patterns;

import com.capsule.genesis.annotation.API;
import com.capsule.genesis.core.expressions.Literal;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Map;

/**
 * Static factories for {@link Pattern}s.
 */
@API(API.Status.STABLE)
public class Patterns {

    @Nonnull
    public static WildcardPattern wildcard() {
        return WildcardPattern.INSTANCE;
    }

    @Nonnull
    public static VarPattern var(@Nonnull String name) {
        return new VarPattern(name);
    }

    @Nonnull
    public static LiteralPattern literal(@Nonnull Literal literal) {
        return new LiteralPattern(literal);
    }

    @Nonnull
    public static LiteralPattern intLiteral(long value) {
        return new LiteralPattern(Literal.ofInt(value));
    }

    @Nonnull
    public static BindPattern bind(@Nonnull String name, @Nonnull Pattern pattern) {
        return new BindPattern(name, pattern);
    }

    @Nonnull
    public static TuplePattern tuple(@Nonnull Pattern... elements) {
        return new TuplePattern(Arrays.asList(elements));
    }

    @Nonnull
    public static ListPattern list(@Nonnull Pattern... elements) {
        return new ListPattern(Arrays.asList(elements));
    }

    @Nonnull
    public static ConstructorPattern constructor(@Nonnull String name, @Nonnull Pattern... arguments) {
        return new ConstructorPattern(name, Arrays.asList(arguments));
    }

    @Nonnull
    public static Map.Entry<String, Pattern> field(@Nonnull String name, @Nonnull Pattern pattern) {
        return Maps.immutableEntry(name, pattern);
    }

    @SafeVarargs
    @Nonnull
    public static RecordPattern record(@Nonnull Map.Entry<String, Pattern>... fields) {
        return new RecordPattern(ImmutableList.copyOf(fields));
    }

    @Nonnull
    public static LambdaPattern lambda(@Nonnull Pattern paramPattern, @Nonnull Pattern bodyPattern) {
        return new LambdaPattern(paramPattern, bodyPattern);
    }

    @Nonnull
    public static ApplyPattern apply(@Nonnull Pattern functionPattern, @Nonnull Pattern argumentPattern) {
        return new ApplyPattern(functionPattern, argumentPattern);
    }

    private Patterns() {
    }
}
