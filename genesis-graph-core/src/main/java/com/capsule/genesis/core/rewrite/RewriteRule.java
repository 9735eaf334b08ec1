/*
 * RewriteRule.java
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
import com.capsule.genesis.core.patterns.Pattern;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * A rewrite rule: when {@link #getPattern() pattern} matches a node's data and the optional condition holds for
 * the match, the data is replaced by {@link #getReplacement() replacement} with the match's bindings substituted in.
 */
@API(API.Status.STABLE)
public final class RewriteRule {
    @Nonnull
    private final String id;
    private final int priority;
    @Nonnull
    private final Pattern pattern;
    @Nonnull
    private final Expression replacement;
    @Nullable
    private final Expression condition;

    public RewriteRule(@Nonnull String id, int priority, @Nonnull Pattern pattern, @Nonnull Expression replacement) {
        this(id, priority, pattern, replacement, null);
    }

    public RewriteRule(@Nonnull String id, int priority, @Nonnull Pattern pattern, @Nonnull Expression replacement,
                       @Nullable Expression condition) {
        Preconditions.checkArgument(!id.isEmpty(), "rule id must not be empty");
        this.id = id;
        this.priority = priority;
        this.pattern = Objects.requireNonNull(pattern);
        this.replacement = Objects.requireNonNull(replacement);
        this.condition = condition;
    }

    @Nonnull
    public RewriteRule withCondition(@Nonnull Expression newCondition) {
        return new RewriteRule(id, priority, pattern, replacement, newCondition);
    }

    @Nonnull
    public String getId() {
        return id;
    }

    public int getPriority() {
        return priority;
    }

    @Nonnull
    public Pattern getPattern() {
        return pattern;
    }

    @Nonnull
    public Expression getReplacement() {
        return replacement;
    }

    @Nonnull
    public Optional<Expression> getCondition() {
        return Optional.ofNullable(condition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RewriteRule that = (RewriteRule)o;
        return priority == that.priority && id.equals(that.id) && pattern.equals(that.pattern)
               && replacement.equals(that.replacement) && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, priority, pattern, replacement, condition);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("priority", priority)
                .add("pattern", pattern)
                .add("replacement", replacement)
                .add("condition", condition)
                .omitNullValues()
                .toString();
    }
}
