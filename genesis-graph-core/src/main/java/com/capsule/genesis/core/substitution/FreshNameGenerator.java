/*
 * FreshNameGenerator.java
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
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of fresh variable names of the form {@code base$N}. The counter only ever increases, so a generator never
 * hands out the same name twice. Thread-safe.
 */
@API(API.Status.STABLE)
public class FreshNameGenerator {
    private static final FreshNameGenerator SHARED = new FreshNameGenerator();

    @Nonnull
    private final AtomicLong counter;

    public FreshNameGenerator() {
        this(0L);
    }

    public FreshNameGenerator(long start) {
        this.counter = new AtomicLong(start);
    }

    /**
     * The process-wide generator used by {@link Substitution#standard()}.
     * @return the shared generator
     */
    @Nonnull
    public static FreshNameGenerator shared() {
        return SHARED;
    }

    @Nonnull
    public String fresh(@Nonnull String base) {
        return base + "$" + counter.getAndIncrement();
    }

    /**
     * Generate a fresh name that is also not a member of {@code avoid}.
     *
     * @param base the name the fresh one is derived from
     * @param avoid names that must not be returned
     * @return a fresh name
     */
    @Nonnull
    public String fresh(@Nonnull String base, @Nonnull Set<String> avoid) {
        String candidate = fresh(base);
        while (avoid.contains(candidate)) {
            candidate = fresh(base);
        }
        return candidate;
    }

    public long peek() {
        return counter.get();
    }
}
