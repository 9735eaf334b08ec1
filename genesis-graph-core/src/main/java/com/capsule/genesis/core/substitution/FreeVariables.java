/*
 * FreeVariables.java
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

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Free-variable analysis. Binders are lambda parameters, let names (scoping over the body only), and the
 * variables introduced by a match arm's pattern (scoping over that arm's guard and body).
 */
@API(API.Status.STABLE)
public class FreeVariables {

    /**
     * Get the variables occurring free in an expression.
     *
     * @param expression the expression
     * @return the free variable names, sorted
     */
    @Nonnull
    public static SortedSet<String> freeVariables(@Nonnull Expression expression) {
        SortedSet<String> free = new TreeSet<>();
        collect(expression, new HashSet<>(), free);
        return free;
    }

    /**
     * Whether an expression is closed, that is every variable occurrence is bound by an enclosing binder.
     *
     * @param expression the expression
     * @return {@code true} if the expression has no free variables
     */
    public static boolean isWellFormed(@Nonnull Expression expression) {
        return freeVariables(expression).isEmpty();
    }

    private static void collect(@Nonnull Expression expression, @Nonnull Set<String> bound, @Nonnull Set<String> free) {
        if (expression instanceof LiteralExpression) {
            return;
        } else if (expression instanceof VarExpression) {
            String name = ((VarExpression)expression).getName();
            if (!bound.contains(name)) {
                free.add(name);
            }
        } else if (expression instanceof LambdaExpression) {
            LambdaExpression lambda = (LambdaExpression)expression;
            collect(lambda.getBody(), extend(bound, lambda.getParam()), free);
        } else if (expression instanceof ApplicationExpression) {
            ApplicationExpression application = (ApplicationExpression)expression;
            collect(application.getFunction(), bound, free);
            collect(application.getArgument(), bound, free);
        } else if (expression instanceof LetExpression) {
            LetExpression let = (LetExpression)expression;
            collect(let.getValue(), bound, free);
            collect(let.getBody(), extend(bound, let.getName()), free);
        } else if (expression instanceof MatchExpression) {
            MatchExpression match = (MatchExpression)expression;
            collect(match.getScrutinee(), bound, free);
            for (MatchArm arm : match.getArms()) {
                Set<String> armBound = new HashSet<>(bound);
                arm.getPattern().collectVariables(armBound);
                arm.getGuard().ifPresent(guard -> collect(guard, armBound, free));
                collect(arm.getBody(), armBound, free);
            }
        } else if (expression instanceof TupleExpression || expression instanceof ListExpression
                   || expression instanceof RecordExpression) {
            for (Expression child : expression.getChildren()) {
                collect(child, bound, free);
            }
        } else {
            throw new GenesisCoreException("unknown expression kind: " + expression.getClass().getSimpleName());
        }
    }

    @Nonnull
    private static Set<String> extend(@Nonnull Set<String> bound, @Nonnull String name) {
        if (bound.contains(name)) {
            return bound;
        }
        Set<String> extended = new HashSet<>(bound);
        extended.add(name);
        return extended;
    }

    private FreeVariables() {
    }
}
