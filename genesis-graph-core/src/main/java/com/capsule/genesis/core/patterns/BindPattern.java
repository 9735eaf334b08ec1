/*
 * BindPattern.java
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

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.Set;

/**
 * {@code name @ pattern}: matches the inner pattern and, on success, also binds the whole value to {@code name}.
 */
@API(API.Status.STABLE)
public final class BindPattern implements Pattern {
    @Nonnull
    private final String name;
    @Nonnull
    private final Pattern pattern;

    public BindPattern(@Nonnull String name, @Nonnull Pattern pattern) {
        Preconditions.checkArgument(!name.isEmpty(), "bind name must not be empty");
        this.name = name;
        this.pattern = Objects.requireNonNull(pattern);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public void collectVariables(@Nonnull Set<String> variables) {
        variables.add(name);
        pattern.collectVariables(variables);
    }

    @Nonnull
    @Override
    public Pattern rename(@Nonnull String from, @Nonnull String to) {
        return new BindPattern(name.equals(from) ? to : name, pattern.rename(from, to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BindPattern that = (BindPattern)o;
        return name.equals(that.name) && pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, pattern);
    }

    @Override
    public String toString() {
        return name + " @ " + pattern;
    }
}
