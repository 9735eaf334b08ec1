/*
 * Renamed.java
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

package com.capsule.genesis.core.substitution;

import com.capsule.genesis.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * The outcome of an alpha-renaming: the fresh name chosen and the renamed term.
 *
 * @param <T> the kind of term renamed
 */
@API(API.Status.STABLE)
public final class Renamed<T> {
    @Nonnull
    private final String newName;
    @Nonnull
    private final T result;

    public Renamed(@Nonnull String newName, @Nonnull T result) {
        this.newName = newName;
        this.result = result;
    }

    @Nonnull
    public String getNewName() {
        return newName;
    }

    @Nonnull
    public T getResult() {
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Renamed<?> renamed = (Renamed<?>)o;
        return newName.equals(renamed.newName) && result.equals(renamed.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(newName, result);
    }

    @Override
    public String toString() {
        return newName + " -> " + result;
    }
}
