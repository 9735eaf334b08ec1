/*
 * LiteralExpression.java
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

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.List;

/**
 * An {@link Expression} holding a {@link Literal}.
 */
@API(API.Status.STABLE)
public final class LiteralExpression implements Expression {
    @Nonnull
    private final Literal literal;

    public LiteralExpression(@Nonnull Literal literal) {
        this.literal = literal;
    }

    @Nonnull
    public Literal getLiteral() {
        return literal;
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return literal.equals(((LiteralExpression)o).literal);
    }

    @Override
    public int hashCode() {
        return literal.hashCode();
    }

    @Override
    public String toString() {
        return literal.toString();
    }
}
