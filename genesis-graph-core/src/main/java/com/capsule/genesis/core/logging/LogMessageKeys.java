/*
 * LogMessageKeys.java
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

package com.capsule.genesis.core.logging;

import com.capsule.genesis.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the graph core and attached to its exceptions.
 * All keys live here so that collisions and inconsistent spellings are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // general keys
    TITLE("ttl"),
    MESSAGE,
    EXPECTED,
    ACTUAL,
    HASH_DOMAIN,

    // graph structure
    NODE_HASH,
    NODE_ID,
    ROOT_HASH,
    ROOT_REF,
    EDGE_FROM("from"),
    EDGE_TO("to"),
    EDGE_TYPE,
    NODE_COUNT,
    EDGE_COUNT,

    // serialization
    RAW_BYTES,
    TUPLE_TAG,

    // rewriting
    RULE_ID,
    RULE_SET,
    PRIORITY,
    REWRITES_APPLIED,
    PASS,
    MAX_PASSES,
    MODIFICATION_COUNT,
    CONDITION,

    // transactions
    TRANSACTION_ID,
    TRANSACTION_STATE,
    PRE_HASH,
    POST_HASH,

    // substitution
    VARIABLE,
    FRESH_NAME;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
