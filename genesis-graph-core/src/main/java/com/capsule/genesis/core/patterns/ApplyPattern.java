/*
 * ApplyPattern.java
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

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.Set;

/**
 * Matches an application, linear or not, positionally on its function and argument.
 */
@API(API.Status.STABLE)
public final class ApplyPattern implements Pattern {
    @Nonnull
    private final Pattern functionPattern;
    @Nonnull
    private final Pattern argumentPattern;

    public ApplyPattern(@Nonnull Pattern functionPattern, @Nonnull Pattern argumentPattern) {
        this.functionPattern = Objects.requireNonNull(functionPattern);
        this.argumentPattern = Objects.requireNonNull(argumentPattern);
    }

    @Nonnull
    public Pattern getFunctionPattern() {
        return functionPattern;
    }

    @Nonnull
    public Pattern getArgumentPattern() {
        return argumentPattern;
    }

    @Override
    public void collectVariables(@Nonnull Set<String> variables) {
        functionPattern.collectVariables(variables);
        argumentPattern.collectVariables(variables);
    }

    @Nonnull
    @Override
    public Pattern rename(@Nonnull String from, @Nonnull String to) {
        return new ApplyPattern(functionPattern.rename(from, to), argumentPattern.rename(from, to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ApplyPattern that = (ApplyPattern)o;
        return functionPattern.equals(that.functionPattern) && argumentPattern.equals(that.argumentPattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ApplyPattern.class, functionPattern, argumentPattern);
    }

    @Override
    public String toString() {
        return "(" + functionPattern + " " + argumentPattern + ")";
    }
}
