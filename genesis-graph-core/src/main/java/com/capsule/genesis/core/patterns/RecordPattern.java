/*
 * RecordPattern.java
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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches a record containing at least the listed fields. Fields are looked up by name, so order does not matter,
 * and fields of the record that the pattern does not list are ignored.
 */
@API(API.Status.STABLE)
public final class RecordPattern implements Pattern {
    @Nonnull
    private final List<Map.Entry<String, Pattern>> fields;

    public RecordPattern(@Nonnull List<Map.Entry<String, Pattern>> fields) {
        ImmutableList.Builder<Map.Entry<String, Pattern>> builder = ImmutableList.builder();
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, Pattern> field : fields) {
            Preconditions.checkArgument(seen.add(field.getKey()), "duplicate record pattern field %s", field.getKey());
            builder.add(Maps.immutableEntry(field.getKey(), field.getValue()));
        }
        this.fields = builder.build();
    }

    @Nonnull
    public List<Map.Entry<String, Pattern>> getFields() {
        return fields;
    }

    @Override
    public void collectVariables(@Nonnull Set<String> variables) {
        for (Map.Entry<String, Pattern> field : fields) {
            field.getValue().collectVariables(variables);
        }
    }

    @Nonnull
    @Override
    public Pattern rename(@Nonnull String from, @Nonnull String to) {
        return new RecordPattern(fields.stream()
                .map(field -> Maps.immutableEntry(field.getKey(), field.getValue().rename(from, to)))
                .collect(Collectors.toList()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return fields.equals(((RecordPattern)o).fields);
    }

    @Override
    public int hashCode() {
        return 31 * RecordPattern.class.hashCode() + fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.stream().map(field -> field.getKey() + ": " + field.getValue())
                .collect(Collectors.joining(", ", "{", ", ..}"));
    }
}
