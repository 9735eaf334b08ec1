/*
 * Transaction.java
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
import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.graph.EdgeType;
import com.capsule.genesis.core.graph.GenesisGraph;
import com.capsule.genesis.core.graph.GraphEdge;
import com.capsule.genesis.core.graph.GraphNode;
import com.capsule.genesis.core.graph.GraphSnapshot;
import com.capsule.genesis.core.logging.KeyValueLogMessage;
import com.capsule.genesis.core.logging.LogMessageKeys;
import com.capsule.genesis.core.patterns.PatternBindings;
import com.capsule.genesis.core.patterns.PatternMatcher;
import com.capsule.genesis.core.substitution.Substitution;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A rewrite transaction against a {@link GenesisGraph}.
 *
 * <p>
 * Beginning a transaction captures a {@link GraphSnapshot} of the graph. While {@link TransactionState#OPEN open}
 * the transaction may apply its {@link RuleSet} any number of times and make structural changes; each change is
 * recorded as a {@link Modification}. {@link #commit()} ends the transaction and returns the new graph hash.
 * {@link #rollback()} restores the snapshot and verifies that the restored graph hashes to the snapshot's hash.
 * A failure while applying rules rolls the transaction back before it propagates. Any operation on a committed or
 * rolled back transaction fails with a {@link TransactionStateException}.
 * </p>
 *
 * <p>
 * A transaction object is meant to be driven by one thread. Mutations take the graph's write lock, so concurrent
 * transactions on the same graph serialize.
 * </p>
 */
@API(API.Status.STABLE)
public class Transaction {
    private static final Logger LOGGER = LoggerFactory.getLogger(Transaction.class);
    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id;
    @Nonnull
    private final GenesisGraph graph;
    @Nonnull
    private final RuleSet ruleSet;
    @Nonnull
    private final GraphSnapshot preState;
    @Nonnull
    private final Substitution substitution;
    @Nonnull
    private final ConditionEvaluator conditionEvaluator;
    @Nonnull
    private final List<Modification> modifications = new ArrayList<>();
    @Nonnull
    private TransactionState state = TransactionState.OPEN;

    private Transaction(@Nonnull GenesisGraph graph, @Nonnull RuleSet ruleSet, @Nonnull GraphSnapshot preState,
                        @Nonnull Substitution substitution) {
        this.id = NEXT_ID.incrementAndGet();
        this.graph = Objects.requireNonNull(graph);
        this.ruleSet = Objects.requireNonNull(ruleSet);
        this.preState = Objects.requireNonNull(preState);
        this.substitution = Objects.requireNonNull(substitution);
        this.conditionEvaluator = new ConditionEvaluator(substitution);
    }

    @VisibleForTesting
    Transaction(@Nonnull GenesisGraph graph, @Nonnull RuleSet ruleSet, @Nonnull GraphSnapshot preState) {
        this(graph, ruleSet, preState, Substitution.standard());
    }

    /**
     * Begin a transaction, capturing the graph's current state under its read lock.
     *
     * @param graph the graph to rewrite
     * @param ruleSet the rules to apply
     * @return an open transaction
     */
    @Nonnull
    public static Transaction begin(@Nonnull GenesisGraph graph, @Nonnull RuleSet ruleSet) {
        return begin(graph, ruleSet, Substitution.standard());
    }

    @Nonnull
    public static Transaction begin(@Nonnull GenesisGraph graph, @Nonnull RuleSet ruleSet, @Nonnull Substitution substitution) {
        Transaction transaction = new Transaction(graph, ruleSet, graph.snapshot(), substitution);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("began transaction",
                    LogMessageKeys.TRANSACTION_ID, transaction.id,
                    LogMessageKeys.RULE_SET, ruleSet.getName(),
                    LogMessageKeys.PRE_HASH, transaction.preState.getContentHash()));
        }
        return transaction;
    }

    /**
     * Apply the rule set once to every node. Nodes are visited ordered by id; for each node the rules are tried in
     * rule set order and the first one whose pattern matches and whose condition holds replaces the node's data.
     * At most one rule fires per node, so a second call may rewrite further. A rewritten node keeps its hash key and
     * has its timestamp incremented.
     *
     * @return the number of nodes rewritten
     * @throws RuleApplicationFailedException if a rule cannot be applied; the transaction is rolled back first
     */
    public int applyRuleset() {
        checkOpen();
        try {
            return graph.doWithWriteLock(this::applyOnePass);
        } catch (RuntimeException failure) {
            throw rollbackAfterFailure(failure);
        }
    }

    /**
     * Apply the rule set repeatedly until a pass rewrites nothing.
     *
     * @return the total number of rewrites over all passes
     * @throws RuleApplicationFailedException if no fixed point is reached within
     * {@link com.capsule.genesis.core.GenesisConfiguration#getMaxRewritePasses()} passes, or a rule cannot be
     * applied; the transaction is rolled back first
     */
    public int applyRulesetToFixpoint() {
        int maxPasses = graph.getConfiguration().getMaxRewritePasses();
        int total = 0;
        for (int pass = 1; pass <= maxPasses; pass++) {
            int rewrites = applyRuleset();
            total += rewrites;
            if (rewrites == 0) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("rewriting reached a fixed point",
                            LogMessageKeys.TRANSACTION_ID, id,
                            LogMessageKeys.PASS, pass,
                            LogMessageKeys.REWRITES_APPLIED, total));
                }
                return total;
            }
        }
        throw rollbackAfterFailure(new RuleApplicationFailedException("rewriting did not reach a fixed point",
                LogMessageKeys.RULE_SET, ruleSet.getName(),
                LogMessageKeys.MAX_PASSES, maxPasses,
                LogMessageKeys.REWRITES_APPLIED, total));
    }

    private int applyOnePass() {
        int rewrites = 0;
        for (Map.Entry<String, GraphNode> entry : graph.nodesSortedById()) {
            String hash = entry.getKey();
            GraphNode node = entry.getValue();
            for (RewriteRule rule : ruleSet.getRules()) {
                Optional<GraphNode> rewritten = tryRule(rule, hash, node);
                if (rewritten.isPresent()) {
                    graph.updateNode(hash, rewritten.get());
                    modifications.add(Modification.nodeUpdated(hash, node, rewritten.get()));
                    rewrites++;
                    break;
                }
            }
        }
        return rewrites;
    }

    @Nonnull
    private Optional<GraphNode> tryRule(@Nonnull RewriteRule rule, @Nonnull String hash, @Nonnull GraphNode node) {
        List<PatternBindings> matches = PatternMatcher.matchPattern(node.getData(), rule.getPattern());
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        PatternBindings bindings = matches.get(0);
        Optional<Expression> condition = rule.getCondition();
        if (condition.isPresent()) {
            try {
                if (!conditionEvaluator.evaluate(condition.get(), bindings)) {
                    return Optional.empty();
                }
            } catch (RuleApplicationFailedException e) {
                e.addLogInfo(LogMessageKeys.RULE_ID, rule.getId(), LogMessageKeys.NODE_HASH, hash);
                throw e;
            }
        }
        Expression newData = substitution.substituteSimultaneously(rule.getReplacement(), bindings.asMap());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("rewrote node",
                    LogMessageKeys.TRANSACTION_ID, id,
                    LogMessageKeys.RULE_ID, rule.getId(),
                    LogMessageKeys.PRIORITY, rule.getPriority(),
                    LogMessageKeys.NODE_HASH, hash,
                    LogMessageKeys.NODE_ID, node.getId()));
        }
        return Optional.of(node.withData(newData)
                .withMetadata(node.getMetadata().withTimestamp(node.getMetadata().getTimestamp() + 1)));
    }

    /**
     * Insert a node as part of this transaction.
     *
     * @param node the node
     * @return the node's hash
     */
    @Nonnull
    public String insertNode(@Nonnull GraphNode node) {
        checkOpen();
        return graph.doWithWriteLock(() -> {
            String hash = graph.insertNode(node);
            modifications.add(Modification.nodeAdded(hash, node));
            return hash;
        });
    }

    /**
     * Link two nodes as part of this transaction.
     *
     * @param from the source hash
     * @param to the target hash
     * @param edgeType the edge type
     * @return the added edge
     */
    @Nonnull
    public GraphEdge linkNodes(@Nonnull String from, @Nonnull String to, @Nonnull EdgeType edgeType) {
        checkOpen();
        return graph.doWithWriteLock(() -> {
            GraphEdge edge = graph.linkNodes(from, to, edgeType);
            modifications.add(Modification.edgeAdded(edge));
            return edge;
        });
    }

    /**
     * Delete a node and its edges as part of this transaction. Each removed edge is logged before the node.
     *
     * @param hash the node's hash
     * @return the removed node
     */
    @Nonnull
    public GraphNode deleteNode(@Nonnull String hash) {
        checkOpen();
        return graph.doWithWriteLock(() -> {
            List<GraphEdge> touching = graph.getEdgesTouching(hash);
            GraphNode removed = graph.deleteNode(hash);
            for (GraphEdge edge : touching) {
                modifications.add(Modification.edgeRemoved(edge));
            }
            modifications.add(Modification.nodeRemoved(hash, removed));
            return removed;
        });
    }

    /**
     * Commit the transaction.
     *
     * @return the graph hash after the transaction
     */
    @Nonnull
    public String commit() {
        checkOpen();
        String postHash = graph.computeGraphHash();
        state = TransactionState.COMMITTED;
        LOGGER.info(KeyValueLogMessage.of("committed transaction",
                LogMessageKeys.TRANSACTION_ID, id,
                LogMessageKeys.RULE_SET, ruleSet.getName(),
                LogMessageKeys.PRE_HASH, preState.getContentHash(),
                LogMessageKeys.POST_HASH, postHash,
                LogMessageKeys.MODIFICATION_COUNT, modifications.size()));
        return postHash;
    }

    /**
     * Restore the graph to the state captured when the transaction began, then check that the restored graph
     * hashes to the captured hash. The transaction is rolled back even when that check fails.
     *
     * @throws HashMismatchException if the restored graph does not hash to the captured hash
     */
    public void rollback() {
        checkOpen();
        state = TransactionState.ROLLED_BACK;
        String restoredHash = graph.doWithWriteLock(() -> {
            graph.restore(preState);
            return graph.computeGraphHash();
        });
        if (!restoredHash.equals(preState.getContentHash())) {
            HashMismatchException mismatch = new HashMismatchException(preState.getContentHash(), restoredHash);
            mismatch.addLogInfo(LogMessageKeys.TRANSACTION_ID, id);
            LOGGER.error(KeyValueLogMessage.of("rollback restored a graph with the wrong hash",
                    LogMessageKeys.TRANSACTION_ID, id,
                    LogMessageKeys.EXPECTED, preState.getContentHash(),
                    LogMessageKeys.ACTUAL, restoredHash));
            throw mismatch;
        }
        LOGGER.info(KeyValueLogMessage.of("rolled back transaction",
                LogMessageKeys.TRANSACTION_ID, id,
                LogMessageKeys.RULE_SET, ruleSet.getName(),
                LogMessageKeys.PRE_HASH, restoredHash,
                LogMessageKeys.MODIFICATION_COUNT, modifications.size()));
    }

    /**
     * Roll back after a failure and return the exception to throw. If the rollback itself fails, that failure is
     * the one to throw, with the original failure attached as suppressed.
     */
    @Nonnull
    private RuntimeException rollbackAfterFailure(@Nonnull RuntimeException failure) {
        if (state != TransactionState.OPEN) {
            return failure;
        }
        LOGGER.warn(KeyValueLogMessage.of("transaction failed, rolling back",
                LogMessageKeys.TRANSACTION_ID, id,
                LogMessageKeys.RULE_SET, ruleSet.getName(),
                LogMessageKeys.MESSAGE, failure.getMessage()), failure);
        try {
            rollback();
        } catch (RuntimeException rollbackFailure) {
            rollbackFailure.addSuppressed(failure);
            return rollbackFailure;
        }
        return failure;
    }

    private void checkOpen() {
        if (state == TransactionState.COMMITTED) {
            throw new TransactionAlreadyCommittedException(id);
        }
        if (state == TransactionState.ROLLED_BACK) {
            throw new TransactionAlreadyRolledBackException(id);
        }
    }

    public long getId() {
        return id;
    }

    @Nonnull
    public GenesisGraph getGraph() {
        return graph;
    }

    @Nonnull
    public RuleSet getRuleSet() {
        return ruleSet;
    }

    @Nonnull
    public GraphSnapshot getPreState() {
        return preState;
    }

    /**
     * Get a copy of the changes made so far, oldest first.
     * @return the modification log
     */
    @Nonnull
    public List<Modification> getModifications() {
        return ImmutableList.copyOf(modifications);
    }

    @Nonnull
    public TransactionState getState() {
        return state;
    }

    public boolean isCommitted() {
        return state == TransactionState.COMMITTED;
    }

    public boolean isRolledBack() {
        return state == TransactionState.ROLLED_BACK;
    }
}
