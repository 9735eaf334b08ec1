/*
 * FreeVariablesTest.java
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

package com.capsule.genesis.core.substitution;

import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.expressions.MatchArm;
import com.capsule.genesis.core.patterns.Patterns;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Set;
import java.util.stream.Stream;

import static com.capsule.genesis.core.expressions.Expressions.apply;
import static com.capsule.genesis.core.expressions.Expressions.field;
import static com.capsule.genesis.core.expressions.Expressions.intLiteral;
import static com.capsule.genesis.core.expressions.Expressions.lambda;
import static com.capsule.genesis.core.expressions.Expressions.let;
import static com.capsule.genesis.core.expressions.Expressions.linearApply;
import static com.capsule.genesis.core.expressions.Expressions.list;
import static com.capsule.genesis.core.expressions.Expressions.match;
import static com.capsule.genesis.core.expressions.Expressions.record;
import static com.capsule.genesis.core.expressions.Expressions.tuple;
import static com.capsule.genesis.core.expressions.Expressions.var;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link FreeVariables}.
 */
public class FreeVariablesTest {

    static Stream<Arguments> freeVariables() {
        return Stream.of(
                Arguments.of(intLiteral(1), ImmutableSet.of()),
                Arguments.of(var("x"), ImmutableSet.of("x")),
                Arguments.of(lambda("x", apply(var("x"), var("y"))), ImmutableSet.of("y")),
                Arguments.of(lambda("x", lambda("y", apply(var("x"), var("y")))), ImmutableSet.of()),
                Arguments.of(linearApply(var("f"), var("g")), ImmutableSet.of("f", "g")),
                Arguments.of(let("x", var("x"), var("x")), ImmutableSet.of("x")),
                Arguments.of(let("x", intLiteral(0), apply(var("x"), var("z"))), ImmutableSet.of("z")),
                Arguments.of(match(var("s"),
                        new MatchArm(Patterns.constructor("Pair", Patterns.var("a"), Patterns.bind("b", Patterns.wildcard())),
                                apply(var("a"), var("g")), tuple(var("a"), var("b"), var("c")))),
                        ImmutableSet.of("c", "g", "s")),
                Arguments.of(match(var("a"), new MatchArm(Patterns.var("a"), var("a"))), ImmutableSet.of("a")),
                Arguments.of(tuple(var("b"), list(var("a"), record(field("k", var("c"))))), ImmutableSet.of("a", "b", "c"))
        );
    }

    @ParameterizedTest
    @MethodSource("freeVariables")
    public void computesFreeVariables(Expression expression, Set<String> expected) {
        assertEquals(expected, FreeVariables.freeVariables(expression));
        assertEquals(expected.isEmpty(), FreeVariables.isWellFormed(expression));
    }

    @ParameterizedTest
    @MethodSource("freeVariables")
    public void resultIsSorted(Expression expression, Set<String> expected) {
        assertEquals(ImmutableList.sortedCopyOf(expected), ImmutableList.copyOf(FreeVariables.freeVariables(expression)));
    }
}
