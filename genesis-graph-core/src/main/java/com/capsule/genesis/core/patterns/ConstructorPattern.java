/*
 * ConstructorPattern.java
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

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches a constructor application. With no arguments this matches exactly {@code Var(name)}; with {@code n}
 * arguments it matches a left-nested chain of {@code n} applications headed by {@code Var(name)}, see
 * {@link CurriedApplications}. The constructor name itself is not a bound variable.
 */
@API(API.Status.STABLE)
public final class ConstructorPattern implements Pattern {
    @Nonnull
    private final String name;
    @Nonnull
    private final List<Pattern> arguments;

    public ConstructorPattern(@Nonnull String name, @Nonnull List<? extends Pattern> arguments) {
        Preconditions.checkArgument(!name.isEmpty(), "constructor name must not be empty");
        this.name = name;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public List<Pattern> getArguments() {
        return arguments;
    }

    @Override
    public void collectVariables(@Nonnull Set<String> variables) {
        for (Pattern argument : arguments) {
            argument.collectVariables(variables);
        }
    }

    @Nonnull
    @Override
    public Pattern rename(@Nonnull String from, @Nonnull String to) {
        return new ConstructorPattern(name,
                arguments.stream().map(argument -> argument.rename(from, to)).collect(Collectors.toList()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConstructorPattern that = (ConstructorPattern)o;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return name;
        }
        return name + arguments.stream().map(Object::toString).collect(Collectors.joining(" ", " ", ""));
    }
}
