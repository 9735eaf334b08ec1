/*
 * PatternBindings.java
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
import com.capsule.genesis.core.GenesisCoreException;
import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.logging.LogMessageKeys;
import com.google.common.collect.ImmutableSortedMap;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The result of one successful pattern match: a mapping from variable name to the matched {@link Expression}.
 * Names are kept sorted, so iteration order is reproducible.
 */
@API(API.Status.STABLE)
public class PatternBindings {
    public static final PatternBindings EMPTY = new PatternBindings(ImmutableSortedMap.of());

    @Nonnull
    private final ImmutableSortedMap<String, Expression> values;

    private PatternBindings(@Nonnull ImmutableSortedMap<String, Expression> values) {
        this.values = values;
    }

    @Nonnull
    public static PatternBindings of(@Nonnull Map<String, ? extends Expression> values) {
        return new PatternBindings(ImmutableSortedMap.copyOf(values));
    }

    @Nonnull
    public Expression get(@Nonnull String name) {
        Expression value = values.get(name);
        if (value == null) {
            throw new GenesisCoreException("Missing binding", LogMessageKeys.VARIABLE, name);
        }
        return value;
    }

    public boolean containsBinding(@Nonnull String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Nonnull
    public SortedMap<String, Expression> asMap() {
        return values;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((PatternBindings)o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "PatternBindings(" + values + ")";
    }

    /**
     * A builder for {@link PatternBindings} that enforces consistent repeated bindings.
     */
    public static class Builder {
        @Nonnull
        private final SortedMap<String, Expression> values = new TreeMap<>();
        private boolean built;

        private Builder() {
        }

        /**
         * Bind a name, or check an existing binding of the same name.
         *
         * @param name the variable name
         * @param value the matched expression
         * @return {@code true} if the name was unbound or already bound to a structurally equal expression
         */
        public boolean bindOrCheck(@Nonnull String name, @Nonnull Expression value) {
            if (built) {
                throw new GenesisCoreException("Cannot change bindings after building");
            }
            Expression existing = values.get(name);
            if (existing != null) {
                return existing.equals(value);
            }
            values.put(name, Objects.requireNonNull(value));
            return true;
        }

        @Nonnull
        public Builder set(@Nonnull String name, @Nonnull Expression value) {
            if (values.containsKey(name)) {
                throw new GenesisCoreException("Duplicate binding", LogMessageKeys.VARIABLE, name);
            }
            bindOrCheck(name, value);
            return this;
        }

        @Nonnull
        public PatternBindings build() {
            built = true;
            return new PatternBindings(ImmutableSortedMap.copyOfSorted(values));
        }
    }
}
