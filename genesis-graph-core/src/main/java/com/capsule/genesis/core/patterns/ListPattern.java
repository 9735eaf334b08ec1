/*
 * ListPattern.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches a list expression of exactly the same length, element by element.
 */
@API(API.Status.STABLE)
public final class ListPattern implements Pattern {
    @Nonnull
    private final List<Pattern> elements;

    public ListPattern(@Nonnull List<? extends Pattern> elements) {
        this.elements = ImmutableList.copyOf(elements);
    }

    @Nonnull
    public List<Pattern> getElements() {
        return elements;
    }

    @Override
    public void collectVariables(@Nonnull Set<String> variables) {
        for (Pattern element : elements) {
            element.collectVariables(variables);
        }
    }

    @Nonnull
    @Override
    public Pattern rename(@Nonnull String from, @Nonnull String to) {
        return new ListPattern(elements.stream().map(element -> element.rename(from, to)).collect(Collectors.toList()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return elements.equals(((ListPattern)o).elements);
    }

    @Override
    public int hashCode() {
        return 31 * ListPattern.class.hashCode() + elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
