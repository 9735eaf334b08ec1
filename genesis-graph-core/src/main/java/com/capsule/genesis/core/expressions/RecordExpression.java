/*
 * RecordExpression.java
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
import com.google.common.collect.Maps;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * A record of named fields. Field order is preserved and is part of structural equality; field names are
 * unique within a record.
 */
@API(API.Status.STABLE)
public final class RecordExpression implements Expression {
    @Nonnull
    private final List<Map.Entry<String, Expression>> fields;
    @Nonnull
    private final Supplier<Integer> hashCodeSupplier = Suppliers.memoize(this::computeHashCode);

    public RecordExpression(@Nonnull List<Map.Entry<String, Expression>> fields) {
        ImmutableList.Builder<Map.Entry<String, Expression>> builder = ImmutableList.builder();
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, Expression> field : fields) {
            Preconditions.checkArgument(seen.add(field.getKey()), "duplicate record field %s", field.getKey());
            builder.add(Maps.immutableEntry(field.getKey(), field.getValue()));
        }
        this.fields = builder.build();
    }

    @Nonnull
    public List<Map.Entry<String, Expression>> getFields() {
        return fields;
    }

    /**
     * Look up the value of a field.
     * @param name the field name
     * @return the field's value or {@code null} if the record has no such field
     */
    @Nullable
    public Expression getField(@Nonnull String name) {
        for (Map.Entry<String, Expression> field : fields) {
            if (field.getKey().equals(name)) {
                return field.getValue();
            }
        }
        return null;
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return fields.stream().map(Map.Entry::getValue).collect(ImmutableList.toImmutableList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return fields.equals(((RecordExpression)o).fields);
    }

    private int computeHashCode() {
        return 31 * RecordExpression.class.hashCode() + fields.hashCode();
    }

    @Override
    public int hashCode() {
        return hashCodeSupplier.get();
    }

    @Override
    public String toString() {
        return fields.stream().map(field -> field.getKey() + ": " + field.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
