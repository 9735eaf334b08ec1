/*
 * SubstitutionTest.java
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
import com.capsule.genesis.core.expressions.LambdaExpression;
import com.capsule.genesis.core.expressions.MatchArm;
import com.capsule.genesis.core.patterns.Pattern;
import com.capsule.genesis.core.patterns.Patterns;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.BeforeEach;
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
import static com.capsule.genesis.core.expressions.Expressions.tuple;
import static com.capsule.genesis.core.expressions.Expressions.var;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Substitution}.
 */
public class SubstitutionTest {
    private Substitution substitution;

    @BeforeEach
    public void setUp() {
        substitution = new Substitution(new FreshNameGenerator());
    }

    @Test
    public void replacesVariable() {
        assertEquals(intLiteral(1), substitution.substitute(var("x"), "x", intLiteral(1)));
        assertEquals(var("y"), substitution.substitute(var("y"), "x", intLiteral(1)));
        assertEquals(intLiteral(4), substitution.substitute(intLiteral(4), "x", intLiteral(1)));
    }

    @Test
    public void descendsIntoCompoundExpressions() {
        Expression expression = tuple(apply(var("f"), var("x")), list(var("x"), var("y")), record(field("k", var("x"))));
        Expression expected = tuple(apply(var("f"), intLiteral(1)), list(intLiteral(1), var("y")), record(field("k", intLiteral(1))));
        assertEquals(expected, substitution.substitute(expression, "x", intLiteral(1)));
    }

    @Test
    public void keepsLinearApplications() {
        assertEquals(linearApply(var("f"), intLiteral(1)),
                substitution.substitute(linearApply(var("f"), var("x")), "x", intLiteral(1)));
    }

    @Test
    public void lambdaShadowsVariable() {
        Expression shadowed = lambda("x", apply(var("x"), var("y")));
        assertEquals(shadowed, substitution.substitute(shadowed, "x", intLiteral(1)));
    }

    @Test
    public void lambdaAvoidsCapture() {
        Expression result = substitution.substitute(lambda("y", var("x")), "x", var("y"));
        assertEquals(lambda("y$0", var("y")), result);
        assertThat(FreeVariables.freeVariables(result), hasItem("y"));
    }

    @Test
    public void lambdaWithoutCaptureKeepsParameter() {
        assertEquals(lambda("z", apply(var("z"), var("y"))),
                substitution.substitute(lambda("z", apply(var("z"), var("x"))), "x", var("y")));
    }

    @Test
    public void freshNameAvoidsNamesInScope() {
        // y$0 already occurs free inside the body, so the renamed parameter must skip it
        Expression result = substitution.substitute(lambda("y", apply(var("x"), var("y$0"))), "x", var("y"));
        LambdaExpression lambda = (LambdaExpression)result;
        assertEquals("y$1", lambda.getParam());
        assertEquals(apply(var("y"), var("y$0")), lambda.getBody());
    }

    @Test
    public void binderFreeInReplacementIsRenamedEvenWithoutOccurrence() {
        assertEquals(lambda("y$0", var("y$0")), substitution.substitute(lambda("y", var("y")), "x", var("y")));
    }

    @Test
    public void letValueIsOutsideTheBinding() {
        assertEquals(let("x", intLiteral(1), var("x")),
                substitution.substitute(let("x", var("x"), var("x")), "x", intLiteral(1)));
    }

    @Test
    public void letAvoidsCapture() {
        assertEquals(let("y$0", var("y"), apply(var("y$0"), var("y"))),
                substitution.substitute(let("y", var("x"), apply(var("y"), var("x"))), "x", var("y")));
    }

    @Test
    public void matchArmShadowsVariable() {
        Expression expression = match(var("x"), new MatchArm(Patterns.var("x"), var("x")));
        assertEquals(match(intLiteral(1), new MatchArm(Patterns.var("x"), var("x"))),
                substitution.substitute(expression, "x", intLiteral(1)));
    }

    @Test
    public void matchArmAvoidsCapture() {
        Expression expression = match(var("s"),
                new MatchArm(Patterns.constructor("Some", Patterns.var("p")), var("p"), apply(var("p"), var("x"))));
        Expression expected = match(var("s"),
                new MatchArm(Patterns.constructor("Some", Patterns.var("p$0")), var("p$0"), apply(var("p$0"), var("p"))));
        assertEquals(expected, substitution.substitute(expression, "x", var("p")));
    }

    @Test
    public void matchGuardIsSubstituted() {
        Expression expression = match(var("s"), new MatchArm(Patterns.var("v"), apply(var("ok"), var("x")), var("v")));
        Expression expected = match(var("s"), new MatchArm(Patterns.var("v"), apply(var("ok"), intLiteral(2)), var("v")));
        assertEquals(expected, substitution.substitute(expression, "x", intLiteral(2)));
    }

    @Test
    public void substituteManyIsSequentialInNameOrder() {
        Expression expression = tuple(var("a"), var("b"));
        Expression result = substitution.substituteMany(expression, ImmutableMap.of("b", intLiteral(1), "a", var("b")));
        assertEquals(tuple(intLiteral(1), intLiteral(1)), result);
    }

    @Test
    public void substituteSimultaneouslyDoesNotRewriteReplacements() {
        Expression expression = tuple(var("a"), var("b"));
        Expression result = substitution.substituteSimultaneously(expression, ImmutableMap.of("b", intLiteral(1), "a", var("b")));
        assertEquals(tuple(var("b"), intLiteral(1)), result);
    }

    @Test
    public void substituteSimultaneouslyRespectsShadowingPerVariable() {
        Expression expression = lambda("a", tuple(var("a"), var("b")));
        Expression result = substitution.substituteSimultaneously(expression, ImmutableMap.of("a", intLiteral(1), "b", intLiteral(2)));
        assertEquals(lambda("a", tuple(var("a"), intLiteral(2))), result);
    }

    @Test
    public void substituteSimultaneouslyRenamesBinderFreeInAnyReplacement() {
        Expression expression = lambda("x", tuple(var("a"), var("b"), var("x")));
        Expression result = substitution.substituteSimultaneously(expression, ImmutableMap.of("a", var("x"), "b", intLiteral(1)));
        assertEquals(lambda("x$0", tuple(var("x"), intLiteral(1), var("x$0"))), result);
        assertTrue(FreeVariables.freeVariables(result).contains("x"));
    }

    @Test
    public void substituteSimultaneouslyWithNoBindingsIsIdentity() {
        Expression expression = lambda("x", var("y"));
        assertEquals(expression, substitution.substituteSimultaneously(expression, ImmutableMap.of()));
    }

    static Stream<Arguments> noFreeOccurrence() {
        return Stream.of(
                Arguments.of(intLiteral(3)),
                Arguments.of(var("y")),
                Arguments.of(lambda("x", var("x"))),
                Arguments.of(tuple(var("y"), lambda("z", var("z")))),
                Arguments.of(let("x", intLiteral(0), var("x"))),
                Arguments.of(match(var("y"), new MatchArm(Patterns.var("x"), var("x"))))
        );
    }

    @ParameterizedTest
    @MethodSource("noFreeOccurrence")
    public void substitutingAbsentVariableIsIdentity(Expression expression) {
        assertEquals(expression, substitution.substitute(expression, "x", intLiteral(9)));
    }

    @Test
    public void closedReplacementKeepsExpressionClosed() {
        Expression open = lambda("y", apply(var("x"), var("y")));
        Expression result = substitution.substitute(open, "x", lambda("z", var("z")));
        assertTrue(FreeVariables.isWellFormed(result));
        assertEquals(lambda("y", apply(lambda("z", var("z")), var("y"))), result);
    }

    @Test
    public void replacementFreeVariablesSurvive() {
        Expression result = substitution.substitute(lambda("a", lambda("b", var("x"))), "x", apply(var("a"), var("b")));
        assertEquals(ImmutableSet.of("a", "b"), FreeVariables.freeVariables(result));
        assertThat(FreeVariables.freeVariables(result), not(hasItem("x")));
    }

    @Test
    public void alphaRename() {
        Renamed<Expression> renamed = substitution.alphaRename(apply(var("x"), var("y")), "x", ImmutableSet.of());
        assertEquals("x$0", renamed.getNewName());
        assertEquals(apply(var("x$0"), var("y")), renamed.getResult());
    }

    @Test
    public void alphaRenamePattern() {
        Pattern pattern = Patterns.tuple(Patterns.var("a"), Patterns.bind("a", Patterns.wildcard()), Patterns.var("b"));
        Renamed<Pattern> renamed = substitution.alphaRenamePattern(pattern, "a", ImmutableSet.of("a$0"));
        assertEquals("a$1", renamed.getNewName());
        assertEquals(Patterns.tuple(Patterns.var("a$1"), Patterns.bind("a$1", Patterns.wildcard()), Patterns.var("b")),
                renamed.getResult());
    }
}
