/*
 * MatchExpression.java
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
import java.util.stream.Collectors;

/**
 * Pattern dispatch over a scrutinee with an ordered list of arms.
 */
@API(API.Status.STABLE)
public final class MatchExpression implements Expression {
    @Nonnull
    private final Expression scrutinee;
    @Nonnull
    private final List<MatchArm> arms;
    @Nonnull
    private final Supplier<Integer> hashCodeSupplier = Suppliers.memoize(this::computeHashCode);

    public MatchExpression(@Nonnull Expression scrutinee, @Nonnull List<MatchArm> arms) {
        this.scrutinee = Objects.requireNonNull(scrutinee);
        this.arms = ImmutableList.copyOf(arms);
    }

    @Nonnull
    public Expression getScrutinee() {
        return scrutinee;
    }

    @Nonnull
    public List<MatchArm> getArms() {
        return arms;
    }

    /**
     * The scrutinee followed by, for each arm, its guard (when present) and its body.
     * @return the sub-expressions of this match
     */
    @Nonnull
    @Override
    public List<Expression> getChildren() {
        ImmutableList.Builder<Expression> builder = ImmutableList.builder();
        builder.add(scrutinee);
        for (MatchArm arm : arms) {
            arm.getGuard().ifPresent(builder::add);
            builder.add(arm.getBody());
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MatchExpression that = (MatchExpression)o;
        return scrutinee.equals(that.scrutinee) && arms.equals(that.arms);
    }

    private int computeHashCode() {
        return Objects.hash(scrutinee, arms);
    }

    @Override
    public int hashCode() {
        return hashCodeSupplier.get();
    }

    @Override
    public String toString() {
        return "(match " + scrutinee + " { "
               + arms.stream().map(MatchArm::toString).collect(Collectors.joining("; ")) + " })";
    }
}
