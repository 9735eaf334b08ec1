/*
 * ExpressionTest.java
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

import com.capsule.genesis.core.patterns.Patterns;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

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
import static com.capsule.genesis.core.expressions.Expressions.stringLiteral;
import static com.capsule.genesis.core.expressions.Expressions.tuple;
import static com.capsule.genesis.core.expressions.Expressions.var;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for the {@link Expression} model and the {@link Expressions} factories.
 */
public class ExpressionTest {

    static Stream<Arguments> equalPairs() {
        return Stream.of(
                Arguments.of(intLiteral(3), intLiteral(3)),
                Arguments.of(var("x"), var("x")),
                Arguments.of(lambda("x", apply(var("f"), var("x"))), lambda("x", apply(var("f"), var("x")))),
                Arguments.of(let("y", intLiteral(1), var("y")), let("y", intLiteral(1), var("y"))),
                Arguments.of(record(field("a", intLiteral(1)), field("b", var("z"))),
                        record(field("a", intLiteral(1)), field("b", var("z")))),
                Arguments.of(match(var("s"), new MatchArm(Patterns.var("p"), var("p"))),
                        match(var("s"), new MatchArm(Patterns.var("p"), var("p"))))
        );
    }

    @ParameterizedTest
    @MethodSource("equalPairs")
    public void structuralEquality(Expression left, Expression right) {
        assertThat(left, equalTo(right));
        assertThat(left.hashCode(), equalTo(right.hashCode()));
    }

    static Stream<Arguments> unequalPairs() {
        return Stream.of(
                Arguments.of(intLiteral(1), Expressions.floatLiteral("1.0")),
                Arguments.of(Expressions.floatLiteral("1.0"), Expressions.floatLiteral("1.00")),
                Arguments.of(stringLiteral("x"), var("x")),
                // alpha-equivalent terms are not equal
                Arguments.of(lambda("x", var("x")), lambda("y", var("y"))),
                Arguments.of(apply(var("f"), var("a")), linearApply(var("f"), var("a"))),
                Arguments.of(tuple(intLiteral(1)), list(intLiteral(1))),
                Arguments.of(record(field("a", intLiteral(1)), field("b", intLiteral(2))),
                        record(field("b", intLiteral(2)), field("a", intLiteral(1))))
        );
    }

    @ParameterizedTest
    @MethodSource("unequalPairs")
    public void structuralInequality(Expression left, Expression right) {
        assertThat(left, not(equalTo(right)));
        assertThat(right, not(equalTo(left)));
    }

    @Test
    public void applyIsCurriedLeftToRight() {
        Expression curried = apply(var("Pair"), intLiteral(1), intLiteral(2));
        Expression nested = new ApplyExpression(new ApplyExpression(var("Pair"), intLiteral(1)), intLiteral(2));
        assertThat(curried, equalTo(nested));
        assertThat(curried.toString(), equalTo("((Pair 1) 2)"));
        assertThrows(IllegalArgumentException.class, () -> apply(var("f")));
    }

    @Test
    public void linearApplication() {
        ApplicationExpression linear = linearApply(var("f"), var("a"));
        assertThat(linear.isLinear(), is(true));
        assertThat(apply(var("f"), var("a")).isLinear(), is(false));
        assertThat(linear.withChildren(var("g"), var("b")), instanceOf(LinearApplyExpression.class));
        assertThat(linear.toString(), equalTo("(f ⊸ a)"));
    }

    @Test
    public void recordFields() {
        RecordExpression r = record(field("name", stringLiteral("n")), field("age", intLiteral(4)));
        assertEquals(intLiteral(4), r.getField("age"));
        assertThat(r.getField("missing"), nullValue());
        assertThat(r.getChildren(), Matchers.<Expression>contains(stringLiteral("n"), intLiteral(4)));
        assertThrows(IllegalArgumentException.class,
                () -> record(field("a", intLiteral(1)), field("a", intLiteral(2))));
    }

    @Test
    public void matchChildrenIncludeGuards() {
        MatchExpression m = match(var("s"),
                new MatchArm(Patterns.var("p"), var("g"), var("b1")),
                new MatchArm(Patterns.wildcard(), var("b2")));
        assertThat(m.getChildren(), Matchers.<Expression>contains(var("s"), var("g"), var("b1"), var("b2")));
        assertThat(m.size(), equalTo(5));
    }

    @Test
    public void literals() {
        assertThat(Literal.ofInt(7).getIntValue(), equalTo(7L));
        assertThat(Literal.ofBool(true), equalTo(Literal.TRUE));
        assertThat(Literal.ofFloat("2.50").getFloatText(), equalTo("2.50"));
        assertThat(Literal.UNIT.getValue(), nullValue());
        assertThat(Literal.ofString("hi").toString(), equalTo("\"hi\""));
        assertThrows(IllegalStateException.class, () -> Literal.ofInt(1).getStringValue());
        assertThrows(IllegalArgumentException.class, () -> Literal.ofFloat(""));
    }
}
