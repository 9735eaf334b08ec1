/*
 * ApplicationExpression.java
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
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Common base of {@link ApplyExpression} and {@link LinearApplyExpression}. Both variants follow the same
 * substitution and matching rules; they differ only in the usage discipline they promise to the caller.
 */
@API(API.Status.STABLE)
public abstract class ApplicationExpression implements Expression {
    @Nonnull
    private final Expression function;
    @Nonnull
    private final Expression argument;
    @Nonnull
    private final Supplier<Integer> hashCodeSupplier = Suppliers.memoize(this::computeHashCode);

    protected ApplicationExpression(@Nonnull Expression function, @Nonnull Expression argument) {
        this.function = Objects.requireNonNull(function);
        this.argument = Objects.requireNonNull(argument);
    }

    @Nonnull
    public Expression getFunction() {
        return function;
    }

    @Nonnull
    public Expression getArgument() {
        return argument;
    }

    /**
     * Whether this application consumes its argument exactly once.
     * @return {@code true} for linear applications
     */
    public abstract boolean isLinear();

    /**
     * Create an application of the same variant with new children.
     * @param newFunction the function
     * @param newArgument the argument
     * @return a new application of the same class
     */
    @Nonnull
    public abstract ApplicationExpression withChildren(@Nonnull Expression newFunction, @Nonnull Expression newArgument);

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return ImmutableList.of(function, argument);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ApplicationExpression that = (ApplicationExpression)o;
        return function.equals(that.function) && argument.equals(that.argument);
    }

    private int computeHashCode() {
        return Objects.hash(isLinear(), function, argument);
    }

    @Override
    public int hashCode() {
        return hashCodeSupplier.get();
    }
}
