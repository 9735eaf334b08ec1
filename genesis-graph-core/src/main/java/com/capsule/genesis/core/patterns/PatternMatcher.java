/*
 * PatternMatcher.java
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
import com.capsule.genesis.core.GenesisCoreException;
import com.capsule.genesis.core.expressions.ApplicationExpression;
import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.expressions.LambdaExpression;
import com.capsule.genesis.core.expressions.ListExpression;
import com.capsule.genesis.core.expressions.LiteralExpression;
import com.capsule.genesis.core.expressions.RecordExpression;
import com.capsule.genesis.core.expressions.TupleExpression;
import com.capsule.genesis.core.expressions.VarExpression;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * Structural matching of {@link Pattern}s against {@link Expression}s.
 *
 * <p>
 * A match either succeeds once or fails: there is no backtracking over alternative sub-matches, so the result of
 * {@link #matchPattern(Expression, Pattern)} holds zero or one {@link PatternBindings}. Sub-patterns are matched
 * left to right and a variable that is bound twice must bind structurally equal expressions both times.
 * </p>
 */
@API(API.Status.STABLE)
public class PatternMatcher {

    /**
     * Match an expression against a pattern.
     *
     * @param expression the expression
     * @param pattern the pattern
     * @return a list with the bindings of the match, or an empty list if the pattern does not match
     */
    @Nonnull
    public static List<PatternBindings> matchPattern(@Nonnull Expression expression, @Nonnull Pattern pattern) {
        PatternBindings.Builder bindings = PatternBindings.newBuilder();
        if (matchInternal(expression, pattern, bindings)) {
            return ImmutableList.of(bindings.build());
        }
        return ImmutableList.of();
    }

    public static boolean matches(@Nonnull Expression expression, @Nonnull Pattern pattern) {
        return !matchPattern(expression, pattern).isEmpty();
    }

    /**
     * Match an expression against each of several patterns independently.
     *
     * @param expression the expression
     * @param patterns the patterns, in order
     * @return the bindings of every pattern that matched, in pattern order
     */
    @Nonnull
    public static List<PatternBindings> matchAnyPattern(@Nonnull Expression expression, @Nonnull List<? extends Pattern> patterns) {
        ImmutableList.Builder<PatternBindings> results = ImmutableList.builder();
        for (Pattern pattern : patterns) {
            results.addAll(matchPattern(expression, pattern));
        }
        return results.build();
    }

    /**
     * Match each of several expressions against one pattern.
     *
     * @param expressions the expressions
     * @param pattern the pattern
     * @return one match result per expression, in expression order
     */
    @Nonnull
    public static List<List<PatternBindings>> matchPatternMany(@Nonnull List<? extends Expression> expressions, @Nonnull Pattern pattern) {
        ImmutableList.Builder<List<PatternBindings>> results = ImmutableList.builder();
        for (Expression expression : expressions) {
            results.add(matchPattern(expression, pattern));
        }
        return results.build();
    }

    private static boolean matchInternal(@Nonnull Expression expression, @Nonnull Pattern pattern,
                                         @Nonnull PatternBindings.Builder bindings) {
        if (pattern instanceof WildcardPattern) {
            return true;
        } else if (pattern instanceof VarPattern) {
            return bindings.bindOrCheck(((VarPattern)pattern).getName(), expression);
        } else if (pattern instanceof LiteralPattern) {
            return expression instanceof LiteralExpression
                   && ((LiteralExpression)expression).getLiteral().equals(((LiteralPattern)pattern).getLiteral());
        } else if (pattern instanceof BindPattern) {
            BindPattern bind = (BindPattern)pattern;
            return matchInternal(expression, bind.getPattern(), bindings)
                   && bindings.bindOrCheck(bind.getName(), expression);
        } else if (pattern instanceof TuplePattern) {
            return expression instanceof TupleExpression
                   && matchAll(((TupleExpression)expression).getElements(), ((TuplePattern)pattern).getElements(), bindings);
        } else if (pattern instanceof ListPattern) {
            return expression instanceof ListExpression
                   && matchAll(((ListExpression)expression).getElements(), ((ListPattern)pattern).getElements(), bindings);
        } else if (pattern instanceof ConstructorPattern) {
            return matchConstructor(expression, (ConstructorPattern)pattern, bindings);
        } else if (pattern instanceof RecordPattern) {
            return matchRecord(expression, (RecordPattern)pattern, bindings);
        } else if (pattern instanceof LambdaPattern) {
            return matchLambda(expression, (LambdaPattern)pattern, bindings);
        } else if (pattern instanceof ApplyPattern) {
            return matchApply(expression, (ApplyPattern)pattern, bindings);
        }
        throw new GenesisCoreException("unknown pattern kind: " + pattern.getClass().getSimpleName());
    }

    private static boolean matchAll(@Nonnull List<Expression> expressions, @Nonnull List<Pattern> patterns,
                                    @Nonnull PatternBindings.Builder bindings) {
        if (expressions.size() != patterns.size()) {
            return false;
        }
        for (int i = 0; i < expressions.size(); i++) {
            if (!matchInternal(expressions.get(i), patterns.get(i), bindings)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchConstructor(@Nonnull Expression expression, @Nonnull ConstructorPattern pattern,
                                            @Nonnull PatternBindings.Builder bindings) {
        CurriedApplications.Spine spine = CurriedApplications.unapply(expression);
        return pattern.getName().equals(spine.getHeadName())
               && matchAll(spine.getArguments(), pattern.getArguments(), bindings);
    }

    private static boolean matchRecord(@Nonnull Expression expression, @Nonnull RecordPattern pattern,
                                       @Nonnull PatternBindings.Builder bindings) {
        if (!(expression instanceof RecordExpression)) {
            return false;
        }
        RecordExpression record = (RecordExpression)expression;
        for (Map.Entry<String, Pattern> field : pattern.getFields()) {
            Expression value = record.getField(field.getKey());
            if (value == null || !matchInternal(value, field.getValue(), bindings)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchLambda(@Nonnull Expression expression, @Nonnull LambdaPattern pattern,
                                       @Nonnull PatternBindings.Builder bindings) {
        if (!(expression instanceof LambdaExpression)) {
            return false;
        }
        LambdaExpression lambda = (LambdaExpression)expression;
        return matchInternal(new VarExpression(lambda.getParam()), pattern.getParamPattern(), bindings)
               && matchInternal(lambda.getBody(), pattern.getBodyPattern(), bindings);
    }

    /**
     * Matches both plain and linear applications.
     */
    private static boolean matchApply(@Nonnull Expression expression, @Nonnull ApplyPattern pattern,
                                      @Nonnull PatternBindings.Builder bindings) {
        if (!(expression instanceof ApplicationExpression)) {
            return false;
        }
        ApplicationExpression application = (ApplicationExpression)expression;
        return matchInternal(application.getFunction(), pattern.getFunctionPattern(), bindings)
               && matchInternal(application.getArgument(), pattern.getArgumentPattern(), bindings);
    }

    private PatternMatcher() {
    }
}
