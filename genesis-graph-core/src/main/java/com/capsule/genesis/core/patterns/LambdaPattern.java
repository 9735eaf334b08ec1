/*
 * LambdaPattern.java
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
 * Matches a lambda. The parameter pattern is matched against {@code Var(param)}, the body pattern against the body.
 */
@API(API.Status.STABLE)
public final class LambdaPattern implements Pattern {
    @Nonnull
    private final Pattern paramPattern;
    @Nonnull
    private final Pattern bodyPattern;

    public LambdaPattern(@Nonnull Pattern paramPattern, @Nonnull Pattern bodyPattern) {
        this.paramPattern = Objects.requireNonNull(paramPattern);
        this.bodyPattern = Objects.requireNonNull(bodyPattern);
    }

    @Nonnull
    public Pattern getParamPattern() {
        return paramPattern;
    }

    @Nonnull
    public Pattern getBodyPattern() {
        return bodyPattern;
    }

    @Override
    public void collectVariables(@Nonnull Set<String> variables) {
        paramPattern.collectVariables(variables);
        bodyPattern.collectVariables(variables);
    }

    @Nonnull
    @Override
    public Pattern rename(@Nonnull String from, @Nonnull String to) {
        return new LambdaPattern(paramPattern.rename(from, to), bodyPattern.rename(from, to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LambdaPattern that = (LambdaPattern)o;
        return paramPattern.equals(that.paramPattern) && bodyPattern.equals(that.bodyPattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(LambdaPattern.class, paramPattern, bodyPattern);
    }

    @Override
    public String toString() {
        return "(λ" + paramPattern + ". " + bodyPattern + ")";
    }
}
