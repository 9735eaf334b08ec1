/*
 * Pattern.java
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

import javax.annotation.Nonnull;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A structural pattern destructuring an {@link com.capsule.genesis.core.expressions.Expression}. Patterns mirror
 * the shape of expressions and are matched by {@link PatternMatcher}.
 */
@API(API.Status.STABLE)
public interface Pattern {

    /**
     * Add every variable name this pattern introduces to the given set. Both {@link VarPattern} names and
     * {@link BindPattern} names are introduced; constructor names are not.
     *
     * @param variables the set to add to
     */
    void collectVariables(@Nonnull Set<String> variables);

    /**
     * Get the variables introduced by this pattern, sorted by name.
     *
     * @return the sorted set of introduced names
     */
    @Nonnull
    default SortedSet<String> getVariables() {
        SortedSet<String> variables = new TreeSet<>();
        collectVariables(variables);
        return variables;
    }

    /**
     * Rename every introduction of variable {@code from} to {@code to}.
     *
     * @param from the name to replace
     * @param to the new name
     * @return a pattern with the variable renamed, possibly {@code this} if {@code from} is not introduced
     */
    @Nonnull
    Pattern rename(@Nonnull String from, @Nonnull String to);
}
