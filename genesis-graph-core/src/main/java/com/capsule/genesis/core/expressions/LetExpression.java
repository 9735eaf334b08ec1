/*
 * LetExpression.java
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
import com.google.common.base.Preconditions;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A non-recursive binding {@code let name = value in body}. The name is bound in the body only; the value is
 * evaluated in the enclosing scope.
 */
@API(API.Status.STABLE)
public final class LetExpression implements Expression {
    @Nonnull
    private final String name;
    @Nonnull
    private final Expression value;
    @Nonnull
    private final Expression body;
    @Nonnull
    private final Supplier<Integer> hashCodeSupplier = Suppliers.memoize(this::computeHashCode);

    public LetExpression(@Nonnull String name, @Nonnull Expression value, @Nonnull Expression body) {
        Preconditions.checkArgument(!name.isEmpty(), "let name must not be empty");
        this.name = name;
        this.value = Objects.requireNonNull(value);
        this.body = Objects.requireNonNull(body);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Expression getValue() {
        return value;
    }

    @Nonnull
    public Expression getBody() {
        return body;
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return ImmutableList.of(value, body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LetExpression that = (LetExpression)o;
        return name.equals(that.name) && value.equals(that.value) && body.equals(that.body);
    }

    private int computeHashCode() {
        return Objects.hash(name, value, body);
    }

    @Override
    public int hashCode() {
        return hashCodeSupplier.get();
    }

    @Override
    public String toString() {
        return "(let " + name + " = " + value + " in " + body + ")";
    }
}
