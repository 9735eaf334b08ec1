/*
 * TransactionStateException.java
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
import com.capsule.genesis.core.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Thrown when an operation is invoked on a {@link Transaction} that is no longer {@link TransactionState#OPEN open}.
 */
@API(API.Status.STABLE)
public abstract class TransactionStateException extends GenesisCoreException {
    private static final long serialVersionUID = 1;

    protected TransactionStateException(@Nonnull String msg, long transactionId, @Nonnull TransactionState state) {
        super(msg, LogMessageKeys.TRANSACTION_ID, transactionId, LogMessageKeys.TRANSACTION_STATE, state);
    }
}
