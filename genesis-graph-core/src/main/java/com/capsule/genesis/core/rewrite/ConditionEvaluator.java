/*
 * ConditionEvaluator.java
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

package com.capsule.genesis.core.rewrite;

import com.capsule.genesis.annotation.API;
import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.expressions.Literal;
import com.capsule.genesis.core.expressions.LiteralExpression;
import com.capsule.genesis.core.logging.LogMessageKeys;
import com.capsule.genesis.core.patterns.CurriedApplications;
import com.capsule.genesis.core.patterns.PatternBindings;
import com.capsule.genesis.core.substitution.Substitution;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates the condition of a {@link RewriteRule} against the bindings of a match.
 *
 * <p>
 * The bindings are substituted into the condition first, all at once. The result must then reduce to a boolean using only
 * these forms, written as curried applications of a variable:
 * </p>
 * <ul>
 *     <li>a boolean literal</li>
 *     <li>{@code not e}, {@code and a b}, {@code or a b} over booleans</li>
 *     <li>{@code eq a b} and {@code neq a b}, comparing the operands structurally without evaluating them</li>
 *     <li>{@code lt}, {@code le}, {@code gt} and {@code ge} over integer literals</li>
 * </ul>
 *
 * <p>
 * Anything else raises a {@link RuleApplicationFailedException}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class ConditionEvaluator {
    @Nonnull
    private final Substitution substitution;

    public ConditionEvaluator(@Nonnull Substitution substitution) {
        this.substitution = Objects.requireNonNull(substitution);
    }

    public boolean evaluate(@Nonnull Expression condition, @Nonnull PatternBindings bindings) {
        return evaluateBoolean(substitution.substituteSimultaneously(condition, bindings.asMap()));
    }

    private boolean evaluateBoolean(@Nonnull Expression expression) {
        if (expression instanceof LiteralExpression) {
            Literal literal = ((LiteralExpression)expression).getLiteral();
            if (literal.getKind() == Literal.Kind.BOOL) {
                return literal.getBoolValue();
            }
            throw notBoolean(expression);
        }
        CurriedApplications.Spine spine = CurriedApplications.unapply(expression);
        String operator = spine.getHeadName();
        List<Expression> operands = spine.getArguments();
        if (operator == null) {
            throw notBoolean(expression);
        }
        switch (operator) {
            case "not":
                checkArity(expression, operands, 1);
                return !evaluateBoolean(operands.get(0));
            case "and":
                checkArity(expression, operands, 2);
                return evaluateBoolean(operands.get(0)) && evaluateBoolean(operands.get(1));
            case "or":
                checkArity(expression, operands, 2);
                return evaluateBoolean(operands.get(0)) || evaluateBoolean(operands.get(1));
            case "eq":
                checkArity(expression, operands, 2);
                return operands.get(0).equals(operands.get(1));
            case "neq":
                checkArity(expression, operands, 2);
                return !operands.get(0).equals(operands.get(1));
            case "lt":
                checkArity(expression, operands, 2);
                return integer(operands.get(0)) < integer(operands.get(1));
            case "le":
                checkArity(expression, operands, 2);
                return integer(operands.get(0)) <= integer(operands.get(1));
            case "gt":
                checkArity(expression, operands, 2);
                return integer(operands.get(0)) > integer(operands.get(1));
            case "ge":
                checkArity(expression, operands, 2);
                return integer(operands.get(0)) >= integer(operands.get(1));
            default:
                throw notBoolean(expression);
        }
    }

    private static long integer(@Nonnull Expression expression) {
        if (expression instanceof LiteralExpression) {
            Literal literal = ((LiteralExpression)expression).getLiteral();
            if (literal.getKind() == Literal.Kind.INT) {
                return literal.getIntValue();
            }
        }
        throw new RuleApplicationFailedException("condition operand is not an integer literal",
                LogMessageKeys.CONDITION, expression);
    }

    private static void checkArity(@Nonnull Expression expression, @Nonnull List<Expression> operands, int expected) {
        if (operands.size() != expected) {
            throw new RuleApplicationFailedException("condition operator applied to wrong number of operands",
                    LogMessageKeys.CONDITION, expression,
                    LogMessageKeys.EXPECTED, expected,
                    LogMessageKeys.ACTUAL, operands.size());
        }
    }

    @Nonnull
    private static RuleApplicationFailedException notBoolean(@Nonnull Expression expression) {
        return new RuleApplicationFailedException("condition does not reduce to a boolean",
                LogMessageKeys.CONDITION, expression);
    }
}
