/*
 * CurriedApplications.java
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
import com.capsule.genesis.core.expressions.ApplyExpression;
import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.expressions.VarExpression;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Encoding of n-ary constructor applications as left-nested chains of {@link ApplyExpression}s:
 * {@code C a b c} is {@code (((C a) b) c)}. This is the only place that knows the encoding.
 * Only non-linear applications take part in a chain.
 */
@API(API.Status.EXPERIMENTAL)
public class CurriedApplications {

    /**
     * A decomposed application chain.
     */
    public static class Spine {
        @Nonnull
        private final Expression head;
        @Nonnull
        private final List<Expression> arguments;

        private Spine(@Nonnull Expression head, @Nonnull List<Expression> arguments) {
            this.head = head;
            this.arguments = arguments;
        }

        @Nonnull
        public Expression getHead() {
            return head;
        }

        /**
         * Get the arguments in source order, left to right.
         * @return the arguments
         */
        @Nonnull
        public List<Expression> getArguments() {
            return arguments;
        }

        /**
         * Get the head's name if the head is a variable.
         * @return the head variable's name or {@code null}
         */
        @Nullable
        public String getHeadName() {
            return head instanceof VarExpression ? ((VarExpression)head).getName() : null;
        }
    }

    /**
     * Walk the function positions of nested applications down to the innermost function.
     *
     * @param expression an expression
     * @return the spine; an expression that is not an application is its own head with no arguments
     */
    @Nonnull
    public static Spine unapply(@Nonnull Expression expression) {
        List<Expression> arguments = new ArrayList<>();
        Expression current = expression;
        while (current instanceof ApplyExpression) {
            ApplyExpression apply = (ApplyExpression)current;
            arguments.add(apply.getArgument());
            current = apply.getFunction();
        }
        Collections.reverse(arguments);
        return new Spine(current, ImmutableList.copyOf(arguments));
    }

    /**
     * Build {@code Var(name)} applied to the arguments.
     *
     * @param name the constructor name
     * @param arguments the arguments
     * @return the curried application, or the bare variable when there are no arguments
     */
    @Nonnull
    public static Expression apply(@Nonnull String name, @Nonnull List<? extends Expression> arguments) {
        Expression result = new VarExpression(name);
        for (Expression argument : arguments) {
            result = new ApplyExpression(result, argument);
        }
        return result;
    }

    private CurriedApplications() {
    }
}
