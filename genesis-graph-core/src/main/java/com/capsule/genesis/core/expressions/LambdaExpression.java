/*
 * LambdaExpression.java
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

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A single-parameter function {@code λparam. body}. The parameter is bound in the body.
 */
@API(API.Status.STABLE)
public final class LambdaExpression implements Expression {
    @Nonnull
    private final String param;
    @Nonnull
    private final Expression body;
    @Nonnull
    private final Supplier<Integer> hashCodeSupplier = Suppliers.memoize(this::computeHashCode);

    public LambdaExpression(@Nonnull String param, @Nonnull Expression body) {
        Preconditions.checkArgument(!param.isEmpty(), "lambda parameter must not be empty");
        this.param = param;
        this.body = Objects.requireNonNull(body);
    }

    @Nonnull
    public String getParam() {
        return param;
    }

    @Nonnull
    public Expression getBody() {
        return body;
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return Collections.singletonList(body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LambdaExpression that = (LambdaExpression)o;
        return param.equals(that.param) && body.equals(that.body);
    }

    private int computeHashCode() {
        return Objects.hash(param, body);
    }

    @Override
    public int hashCode() {
        return hashCodeSupplier.get();
    }

    @Override
    public String toString() {
        return "(λ" + param + ". " + body + ")";
    }
}
