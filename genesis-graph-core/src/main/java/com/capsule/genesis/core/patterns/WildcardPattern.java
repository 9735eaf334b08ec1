/*
 * WildcardPattern.java
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
import java.util.Set;

/**
 * Matches anything and binds nothing.
 */
@API(API.Status.STABLE)
public final class WildcardPattern implements Pattern {
    public static final WildcardPattern INSTANCE = new WildcardPattern();

    private WildcardPattern() {
    }

    @Override
    public void collectVariables(@Nonnull Set<String> variables) {
        // binds nothing
    }

    @Nonnull
    @Override
    public Pattern rename(@Nonnull String from, @Nonnull String to) {
        return this;
    }

    @Override
    public String toString() {
        return "_";
    }
}
