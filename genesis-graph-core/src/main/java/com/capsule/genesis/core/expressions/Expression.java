/*
 * Expression.java
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
import java.util.List;

/**
 * A term of the payload language stored in graph nodes: literals, variables, lambdas, (linear) applications,
 * let-bindings, pattern matches, tuples, lists and records.
 *
 * <p>
 * Expressions are immutable trees. Every compound expression exclusively owns its sub-expressions, so there is no
 * sharing and no cycles, and equality is deep structural equality. Binders are not normalized: two alpha-equivalent
 * expressions with different parameter names are not equal.
 * </p>
 */
@API(API.Status.STABLE)
public interface Expression {

    /**
     * Get the direct sub-expressions of this expression in evaluation order. For a {@link MatchExpression} this
     * includes the scrutinee followed by each arm's guard (if any) and body.
     *
     * @return the direct children
     */
    @Nonnull
    List<Expression> getChildren();

    /**
     * Get the number of expression nodes in this tree, counting this one.
     *
     * @return the size of the tree
     */
    default int size() {
        int size = 1;
        for (Expression child : getChildren()) {
            size += child.size();
        }
        return size;
    }
}
