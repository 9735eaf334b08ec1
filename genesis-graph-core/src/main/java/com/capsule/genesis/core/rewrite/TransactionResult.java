/*
 * TransactionResult.java
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
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a committed rewrite transaction.
 */
@API(API.Status.STABLE)
public final class TransactionResult {
    @Nonnull
    private final String preHash;
    @Nonnull
    private final String postHash;
    private final int rewritesApplied;
    @Nonnull
    private final List<Modification> modifications;

    public TransactionResult(@Nonnull String preHash, @Nonnull String postHash, int rewritesApplied,
                             @Nonnull List<Modification> modifications) {
        this.preHash = Objects.requireNonNull(preHash);
        this.postHash = Objects.requireNonNull(postHash);
        this.rewritesApplied = rewritesApplied;
        this.modifications = ImmutableList.copyOf(modifications);
    }

    /**
     * Get the graph hash before the transaction began.
     * @return the pre-transaction hash
     */
    @Nonnull
    public String getPreHash() {
        return preHash;
    }

    /**
     * Get the graph hash at commit.
     * @return the post-transaction hash
     */
    @Nonnull
    public String getPostHash() {
        return postHash;
    }

    public int getRewritesApplied() {
        return rewritesApplied;
    }

    @Nonnull
    public List<Modification> getModifications() {
        return modifications;
    }

    public boolean isChanged() {
        return !preHash.equals(postHash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TransactionResult that = (TransactionResult)o;
        return rewritesApplied == that.rewritesApplied && preHash.equals(that.preHash)
               && postHash.equals(that.postHash) && modifications.equals(that.modifications);
    }

    @Override
    public int hashCode() {
        return Objects.hash(preHash, postHash, rewritesApplied, modifications);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("preHash", preHash)
                .add("postHash", postHash)
                .add("rewritesApplied", rewritesApplied)
                .add("modifications", modifications.size())
                .toString();
    }
}
