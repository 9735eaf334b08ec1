/*
 * VarPattern.java
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
import java.util.Set;

/**
 * Matches anything and binds it to a name. A name that occurs twice in one pattern must match structurally equal
 * expressions.
 */
@API(API.Status.STABLE)
public final class VarPattern implements Pattern {
    @Nonnull
    private final String name;

    public VarPattern(@Nonnull String name) {
        Preconditions.checkArgument(!name.isEmpty(), "pattern variable name must not be empty");
        this.name = name;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Override
    public void collectVariables(@Nonnull Set<String> variables) {
        variables.add(name);
    }

    @Nonnull
    @Override
    public Pattern rename(@Nonnull String from, @Nonnull String to) {
        return name.equals(from) ? new VarPattern(to) : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((VarPattern)o).name);
    }

    @Override
    public int hashCode() {
        return 31 * VarPattern.class.hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
