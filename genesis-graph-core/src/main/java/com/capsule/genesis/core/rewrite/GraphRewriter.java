/*
 * GraphRewriter.java
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
import com.capsule.genesis.core.graph.GenesisGraph;

import javax.annotation.Nonnull;

/**
 * Entry points for rewriting a graph with a {@link RuleSet}.
 */
@API(API.Status.STABLE)
public class GraphRewriter {

    @Nonnull
    public static Transaction beginTx(@Nonnull GenesisGraph graph, @Nonnull RuleSet ruleSet) {
        return Transaction.begin(graph, ruleSet);
    }

    /**
     * Apply a rule set once in its own transaction. On failure the transaction is rolled back and the failure
     * propagates; otherwise it is committed.
     *
     * @param graph the graph to rewrite
     * @param ruleSet the rules
     * @return the hashes before and after, the number of rewrites and the modification log
     */
    @Nonnull
    public static TransactionResult applyRulesetTransactionally(@Nonnull GenesisGraph graph, @Nonnull RuleSet ruleSet) {
        Transaction transaction = beginTx(graph, ruleSet);
        int rewrites = transaction.applyRuleset();
        return commit(transaction, rewrites);
    }

    /**
     * Like {@link #applyRulesetTransactionally(GenesisGraph, RuleSet)}, but repeats the rule set until nothing
     * changes.
     *
     * @param graph the graph to rewrite
     * @param ruleSet the rules
     * @return the hashes before and after, the total number of rewrites and the modification log
     */
    @Nonnull
    public static TransactionResult applyRulesetToFixpointTransactionally(@Nonnull GenesisGraph graph, @Nonnull RuleSet ruleSet) {
        Transaction transaction = beginTx(graph, ruleSet);
        int rewrites = transaction.applyRulesetToFixpoint();
        return commit(transaction, rewrites);
    }

    @Nonnull
    private static TransactionResult commit(@Nonnull Transaction transaction, int rewrites) {
        String preHash = transaction.getPreState().getContentHash();
        String postHash = transaction.commit();
        return new TransactionResult(preHash, postHash, rewrites, transaction.getModifications());
    }

    private GraphRewriter() {
    }
}
