/*
 * LoggableKeysAndValues.java
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

package com.capsule.genesis.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Something that carries structured context for log output: a static title plus keys and values. A failed edge
 * insertion, for instance, is reported as "adding edge would create a cycle" with {@code from} and {@code to} hashes
 * attached, so that all such failures can be searched for and their endpoints extracted later.
 *
 * @param <T> the implementing type, returned from the fluent {@code addLogInfo} methods
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the log information as a map, in the order it was added.
     *
     * @return all log information
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Add a single key/value pair. Keys are converted with {@link String#valueOf(Object)}, so enum constants such as
     * log message keys can be passed directly.
     *
     * @param key key of the pair
     * @param value value of the pair
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull Object key, Object value);

    /**
     * Add a flattened list of key/value pairs, every even element being a key and every odd element its value.
     * This is the format produced by {@link #exportLogInfo()}.
     *
     * @param keyValues flattened pairs
     * @return this object
     * @throws IllegalArgumentException if {@code keyValues} has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object... keyValues);

    /**
     * Flatten the log information into an array of alternating keys and values.
     *
     * @return flattened pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
