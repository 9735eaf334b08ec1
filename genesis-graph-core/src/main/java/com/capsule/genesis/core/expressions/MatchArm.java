/*
 * MatchArm.java
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
import com.capsule.genesis.core.patterns.Pattern;
import com.google.common.base.Suppliers;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * One arm of a {@link MatchExpression}: a pattern, an optional guard, and a body. Variables bound by the
 * pattern scope over both the guard and the body.
 */
@API(API.Status.STABLE)
public final class MatchArm {
    @Nonnull
    private final Pattern pattern;
    @Nullable
    private final Expression guard;
    @Nonnull
    private final Expression body;
    @Nonnull
    private final Supplier<Integer> hashCodeSupplier = Suppliers.memoize(this::computeHashCode);

    public MatchArm(@Nonnull Pattern pattern, @Nullable Expression guard, @Nonnull Expression body) {
        this.pattern = Objects.requireNonNull(pattern);
        this.guard = guard;
        this.body = Objects.requireNonNull(body);
    }

    public MatchArm(@Nonnull Pattern pattern, @Nonnull Expression body) {
        this(pattern, null, body);
    }

    @Nonnull
    public Pattern getPattern() {
        return pattern;
    }

    @Nonnull
    public Optional<Expression> getGuard() {
        return Optional.ofNullable(guard);
    }

    @Nonnull
    public Expression getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MatchArm that = (MatchArm)o;
        return pattern.equals(that.pattern) && Objects.equals(guard, that.guard) && body.equals(that.body);
    }

    private int computeHashCode() {
        return Objects.hash(pattern, guard, body);
    }

    @Override
    public int hashCode() {
        return hashCodeSupplier.get();
    }

    @Override
    public String toString() {
        return pattern + (guard == null ? "" : " if " + guard) + " => " + body;
    }
}
