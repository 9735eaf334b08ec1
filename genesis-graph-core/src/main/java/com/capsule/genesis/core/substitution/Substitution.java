/*
 * Substitution.java
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

import com.capsule.genesis.annotation.API;
import com.capsule.genesis.core.GenesisCoreException;
import com.capsule.genesis.core.expressions.ApplicationExpression;
import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.expressions.LambdaExpression;
import com.capsule.genesis.core.expressions.LetExpression;
import com.capsule.genesis.core.expressions.ListExpression;
import com.capsule.genesis.core.expressions.LiteralExpression;
import com.capsule.genesis.core.expressions.MatchArm;
import com.capsule.genesis.core.expressions.MatchExpression;
import com.capsule.genesis.core.expressions.RecordExpression;
import com.capsule.genesis.core.expressions.TupleExpression;
import com.capsule.genesis.core.expressions.VarExpression;
import com.capsule.genesis.core.patterns.Pattern;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Capture-avoiding substitution over {@link Expression}s, of one variable or of several at once.
 *
 * <p>
 * Substitution stops at a binder that shadows the substituted variable. Whenever a binder (lambda parameter, let
 * name, or pattern variable of a match arm) occurs free in the replacement, the binder is first alpha-renamed to a
 * fresh name, whether or not the substituted variable actually occurs underneath it. Fresh names come from this
 * instance's {@link FreshNameGenerator}.
 * </p>
 */
@API(API.Status.STABLE)
public class Substitution {
    private static final Substitution STANDARD = new Substitution(FreshNameGenerator.shared());

    @Nonnull
    private final FreshNameGenerator freshNames;

    public Substitution(@Nonnull FreshNameGenerator freshNames) {
        this.freshNames = Objects.requireNonNull(freshNames);
    }

    /**
     * A substitution engine drawing names from {@link FreshNameGenerator#shared()}.
     * @return the standard engine
     */
    @Nonnull
    public static Substitution standard() {
        return STANDARD;
    }

    @Nonnull
    public FreshNameGenerator getFreshNames() {
        return freshNames;
    }

    /**
     * Replace every free occurrence of {@code var} in {@code expression} by {@code replacement}.
     *
     * @param expression the expression to substitute into
     * @param var the variable to replace
     * @param replacement the expression to put in its place
     * @return the substituted expression
     */
    @Nonnull
    public Expression substitute(@Nonnull Expression expression, @Nonnull String var, @Nonnull Expression replacement) {
        return substitute(expression, ImmutableMap.of(var, replacement), FreeVariables.freeVariables(replacement));
    }

    /**
     * Apply several substitutions one after the other, in ascending order of variable name. This is not a
     * simultaneous substitution: a replacement inserted by an earlier step is subject to later steps.
     *
     * @param expression the expression to substitute into
     * @param substitutions replacement per variable
     * @return the substituted expression
     */
    @Nonnull
    public Expression substituteMany(@Nonnull Expression expression, @Nonnull Map<String, ? extends Expression> substitutions) {
        Expression result = expression;
        for (Map.Entry<String, ? extends Expression> entry : new TreeMap<>(substitutions).entrySet()) {
            result = substitute(result, entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Replace the free occurrences of every variable in {@code substitutions} at once, in a single traversal.
     * Unlike {@link #substituteMany(Expression, Map)}, a replacement is never itself subject to another entry of
     * the map. A binder that occurs free in any of the replacements is alpha-renamed first.
     *
     * @param expression the expression to substitute into
     * @param substitutions replacement per variable
     * @return the substituted expression
     */
    @Nonnull
    public Expression substituteSimultaneously(@Nonnull Expression expression,
                                               @Nonnull Map<String, ? extends Expression> substitutions) {
        if (substitutions.isEmpty()) {
            return expression;
        }
        Map<String, Expression> copy = ImmutableSortedMap.copyOf(substitutions);
        return substitute(expression, copy, freeVariablesOf(copy));
    }

    /**
     * Rename the free occurrences of {@code oldName} in {@code expression} to a fresh name not in {@code avoid}.
     *
     * @param expression the scope of the binder being renamed
     * @param oldName the binder's current name
     * @param avoid names the fresh name must differ from
     * @return the fresh name and the renamed expression
     */
    @Nonnull
    public Renamed<Expression> alphaRename(@Nonnull Expression expression, @Nonnull String oldName, @Nonnull Set<String> avoid) {
        String newName = freshNames.fresh(oldName, avoid);
        return new Renamed<>(newName, substitute(expression, oldName, new VarExpression(newName)));
    }

    /**
     * Rename the introduction of {@code oldName} in {@code pattern} to a fresh name not in {@code avoid}.
     *
     * @param pattern the pattern
     * @param oldName the pattern variable's current name
     * @param avoid names the fresh name must differ from
     * @return the fresh name and the renamed pattern
     */
    @Nonnull
    public Renamed<Pattern> alphaRenamePattern(@Nonnull Pattern pattern, @Nonnull String oldName, @Nonnull Set<String> avoid) {
        String newName = freshNames.fresh(oldName, avoid);
        return new Renamed<>(newName, pattern.rename(oldName, newName));
    }

    @Nonnull
    private Expression substitute(@Nonnull Expression expression, @Nonnull Map<String, Expression> substitutions,
                                  @Nonnull Set<String> replacementFree) {
        if (expression instanceof LiteralExpression) {
            return expression;
        } else if (expression instanceof VarExpression) {
            Expression replacement = substitutions.get(((VarExpression)expression).getName());
            return replacement == null ? expression : replacement;
        } else if (expression instanceof LambdaExpression) {
            return substituteLambda((LambdaExpression)expression, substitutions, replacementFree);
        } else if (expression instanceof ApplicationExpression) {
            ApplicationExpression application = (ApplicationExpression)expression;
            return application.withChildren(substitute(application.getFunction(), substitutions, replacementFree),
                    substitute(application.getArgument(), substitutions, replacementFree));
        } else if (expression instanceof LetExpression) {
            return substituteLet((LetExpression)expression, substitutions, replacementFree);
        } else if (expression instanceof MatchExpression) {
            MatchExpression match = (MatchExpression)expression;
            Expression scrutinee = substitute(match.getScrutinee(), substitutions, replacementFree);
            ImmutableList.Builder<MatchArm> arms = ImmutableList.builder();
            for (MatchArm arm : match.getArms()) {
                arms.add(substituteArm(arm, substitutions, replacementFree));
            }
            return new MatchExpression(scrutinee, arms.build());
        } else if (expression instanceof TupleExpression) {
            return new TupleExpression(substituteAll(((TupleExpression)expression).getElements(), substitutions, replacementFree));
        } else if (expression instanceof ListExpression) {
            return new ListExpression(substituteAll(((ListExpression)expression).getElements(), substitutions, replacementFree));
        } else if (expression instanceof RecordExpression) {
            ImmutableList.Builder<Map.Entry<String, Expression>> fields = ImmutableList.builder();
            for (Map.Entry<String, Expression> field : ((RecordExpression)expression).getFields()) {
                fields.add(Maps.immutableEntry(field.getKey(), substitute(field.getValue(), substitutions, replacementFree)));
            }
            return new RecordExpression(fields.build());
        }
        throw new GenesisCoreException("unknown expression kind: " + expression.getClass().getSimpleName());
    }

    @Nonnull
    private ImmutableList<Expression> substituteAll(@Nonnull Iterable<Expression> expressions,
                                                    @Nonnull Map<String, Expression> substitutions,
                                                    @Nonnull Set<String> replacementFree) {
        ImmutableList.Builder<Expression> builder = ImmutableList.builder();
        for (Expression element : expressions) {
            builder.add(substitute(element, substitutions, replacementFree));
        }
        return builder.build();
    }

    @Nonnull
    private Expression substituteLambda(@Nonnull LambdaExpression lambda, @Nonnull Map<String, Expression> substitutions,
                                        @Nonnull Set<String> replacementFree) {
        String param = lambda.getParam();
        Map<String, Expression> inner = withoutNames(substitutions, ImmutableSet.of(param));
        if (inner.isEmpty()) {
            return lambda;
        }
        Set<String> innerFree = inner == substitutions ? replacementFree : freeVariablesOf(inner);
        if (innerFree.contains(param)) {
            Renamed<Expression> renamed = alphaRename(lambda.getBody(), param, avoidSet(lambda, inner, innerFree));
            return new LambdaExpression(renamed.getNewName(), substitute(renamed.getResult(), inner, innerFree));
        }
        return new LambdaExpression(param, substitute(lambda.getBody(), inner, innerFree));
    }

    @Nonnull
    private Expression substituteLet(@Nonnull LetExpression let, @Nonnull Map<String, Expression> substitutions,
                                     @Nonnull Set<String> replacementFree) {
        Expression value = substitute(let.getValue(), substitutions, replacementFree);
        String name = let.getName();
        Map<String, Expression> inner = withoutNames(substitutions, ImmutableSet.of(name));
        if (inner.isEmpty()) {
            return new LetExpression(name, value, let.getBody());
        }
        Set<String> innerFree = inner == substitutions ? replacementFree : freeVariablesOf(inner);
        if (innerFree.contains(name)) {
            Renamed<Expression> renamed = alphaRename(let.getBody(), name, avoidSet(let, inner, innerFree));
            return new LetExpression(renamed.getNewName(), value, substitute(renamed.getResult(), inner, innerFree));
        }
        return new LetExpression(name, value, substitute(let.getBody(), inner, innerFree));
    }

    @Nonnull
    private MatchArm substituteArm(@Nonnull MatchArm arm, @Nonnull Map<String, Expression> substitutions,
                                   @Nonnull Set<String> replacementFree) {
        SortedSet<String> patternVariables = arm.getPattern().getVariables();
        Map<String, Expression> inner = withoutNames(substitutions, patternVariables);
        if (inner.isEmpty()) {
            return arm;
        }
        Set<String> innerFree = inner == substitutions ? replacementFree : freeVariablesOf(inner);
        SortedSet<String> captures = new TreeSet<>(patternVariables);
        captures.retainAll(innerFree);

        Pattern pattern = arm.getPattern();
        Expression guard = arm.getGuard().orElse(null);
        Expression body = arm.getBody();
        if (!captures.isEmpty()) {
            Set<String> avoid = new TreeSet<>(FreeVariables.freeVariables(body));
            avoid.addAll(innerFree);
            avoid.addAll(inner.keySet());
            if (guard != null) {
                avoid.addAll(FreeVariables.freeVariables(guard));
            }
            for (String capture : captures) {
                Renamed<Pattern> renamed = alphaRenamePattern(pattern, capture, avoid);
                String newName = renamed.getNewName();
                avoid.add(newName);
                pattern = renamed.getResult();
                VarExpression fresh = new VarExpression(newName);
                if (guard != null) {
                    guard = substitute(guard, capture, fresh);
                }
                body = substitute(body, capture, fresh);
            }
        }
        return new MatchArm(pattern,
                guard == null ? null : substitute(guard, inner, innerFree),
                substitute(body, inner, innerFree));
    }

    /**
     * The substitutions still in force under binders for {@code names}. Returns the same map when no entry is
     * shadowed.
     */
    @Nonnull
    private static Map<String, Expression> withoutNames(@Nonnull Map<String, Expression> substitutions,
                                                        @Nonnull Set<String> names) {
        if (Collections.disjoint(substitutions.keySet(), names)) {
            return substitutions;
        }
        Map<String, Expression> remaining = new TreeMap<>(substitutions);
        remaining.keySet().removeAll(names);
        return remaining;
    }

    @Nonnull
    private static Set<String> freeVariablesOf(@Nonnull Map<String, Expression> substitutions) {
        Set<String> free = new TreeSet<>();
        for (Expression replacement : substitutions.values()) {
            free.addAll(FreeVariables.freeVariables(replacement));
        }
        return free;
    }

    @Nonnull
    private static Set<String> avoidSet(@Nonnull Expression binderExpression, @Nonnull Map<String, Expression> substitutions,
                                        @Nonnull Set<String> replacementFree) {
        Set<String> avoid = new TreeSet<>(FreeVariables.freeVariables(binderExpression));
        avoid.addAll(replacementFree);
        avoid.addAll(substitutions.keySet());
        return avoid;
    }
}
