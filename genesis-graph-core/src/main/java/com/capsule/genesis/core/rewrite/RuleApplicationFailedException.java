/*
 * RuleApplicationFailedException.java
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

package com.capsule.genesis.core.rewrite;

import com.capsule.genesis.annotation.API;
import com.capsule.genesis.core.GenesisCoreException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when applying a rule set cannot complete, for instance because a rule condition does not reduce to a
 * boolean. The transaction that raised it has been rolled back.
 */
@API(API.Status.STABLE)
public class RuleApplicationFailedException extends GenesisCoreException {
    private static final long serialVersionUID = 1;

    public RuleApplicationFailedException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public RuleApplicationFailedException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}
