/*
 * GraphRewriterTest.java
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

import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.expressions.LambdaExpression;
import com.capsule.genesis.core.graph.EdgeType;
import com.capsule.genesis.core.graph.GenesisGraph;
import com.capsule.genesis.core.graph.GraphNode;
import com.capsule.genesis.core.graph.NodeMetadata;
import com.capsule.genesis.core.patterns.Patterns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.capsule.genesis.core.expressions.Expressions.apply;
import static com.capsule.genesis.core.expressions.Expressions.intLiteral;
import static com.capsule.genesis.core.expressions.Expressions.lambda;
import static com.capsule.genesis.core.expressions.Expressions.var;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end tests for {@link GraphRewriter}.
 */
public class GraphRewriterTest {
    private GenesisGraph graph;
    private String root;

    @BeforeEach
    public void setUp() {
        graph = new GenesisGraph(GenesisGraph.createRootNode());
        root = graph.getRootHash();
    }

    private String addChild(String id, Expression data) {
        String hash = graph.insertNode(new GraphNode(id, root, data, NodeMetadata.EMPTY));
        graph.linkNodes(root, hash, EdgeType.DERIVATION);
        return hash;
    }

    private Expression dataOf(String hash) {
        return graph.getNode(hash).orElseThrow(AssertionError::new).getData();
    }

    @Test
    public void rewritesOnceThenConverges() {
        String child = addChild("child", var("x"));
        RuleSet rules = RuleSet.of("answer", new RewriteRule("x-to-42", 10, Patterns.constructor("x"), intLiteral(42)));

        TransactionResult first = GraphRewriter.applyRulesetTransactionally(graph, rules);
        assertEquals(1, first.getRewritesApplied());
        assertEquals(intLiteral(42), dataOf(child));
        assertTrue(first.isChanged());
        assertEquals(graph.computeGraphHash(), first.getPostHash());
        assertEquals(1, first.getModifications().size());

        TransactionResult second = GraphRewriter.applyRulesetTransactionally(graph, rules);
        assertEquals(0, second.getRewritesApplied());
        assertFalse(second.isChanged());
        assertEquals(first.getPostHash(), second.getPreHash());
    }

    @Test
    public void higherPriorityWins() {
        String child = addChild("child", var("x"));
        RuleSet rules = RuleSet.of("competing",
                new RewriteRule("low", 1, Patterns.constructor("x"), intLiteral(1)),
                new RewriteRule("high", 9, Patterns.constructor("x"), intLiteral(9)));
        assertEquals(1, GraphRewriter.applyRulesetTransactionally(graph, rules).getRewritesApplied());
        assertEquals(intLiteral(9), dataOf(child));
    }

    @Test
    public void equalPriorityFallsBackToRuleId() {
        String child = addChild("child", var("x"));
        RuleSet rules = RuleSet.of("tied",
                new RewriteRule("beta", 5, Patterns.constructor("x"), intLiteral(2)),
                new RewriteRule("alpha", 5, Patterns.constructor("x"), intLiteral(1)));
        GraphRewriter.applyRulesetTransactionally(graph, rules);
        assertEquals(intLiteral(1), dataOf(child));
    }

    @Test
    public void bindingsFlowIntoReplacement() {
        String child = addChild("child", apply(var("Pair"), intLiteral(1), intLiteral(2)));
        RewriteRule swap = new RewriteRule("swap", 1,
                Patterns.constructor("Pair", Patterns.var("a"), Patterns.var("b")),
                apply(var("Pair"), var("b"), var("a")),
                apply(var("lt"), var("a"), var("b")));

        TransactionResult result = GraphRewriter.applyRulesetToFixpointTransactionally(graph, RuleSet.of("sort", swap));
        assertEquals(1, result.getRewritesApplied());
        assertEquals(apply(var("Pair"), intLiteral(2), intLiteral(1)), dataOf(child));
    }

    @Test
    public void matchedValuesAreNotRewrittenByOtherBindings() {
        String child = addChild("child", apply(var("Pair"), var("b"), intLiteral(1)));
        RewriteRule swap = new RewriteRule("swap", 1,
                Patterns.constructor("Pair", Patterns.var("a"), Patterns.var("b")),
                apply(var("Pair"), var("b"), var("a")));

        TransactionResult result = GraphRewriter.applyRulesetTransactionally(graph, RuleSet.of("swap", swap));
        assertEquals(1, result.getRewritesApplied());
        assertEquals(apply(var("Pair"), intLiteral(1), var("b")), dataOf(child));
    }

    @Test
    public void conditionSeesMatchedValues() {
        String child = addChild("child", apply(var("Pair"), var("b"), intLiteral(1)));
        RewriteRule collapse = new RewriteRule("collapse", 1,
                Patterns.constructor("Pair", Patterns.var("a"), Patterns.var("b")),
                var("a"),
                apply(var("eq"), var("a"), var("b")));

        TransactionResult result = GraphRewriter.applyRulesetTransactionally(graph, RuleSet.of("collapse", collapse));
        assertEquals(0, result.getRewritesApplied());
        assertEquals(apply(var("Pair"), var("b"), intLiteral(1)), dataOf(child));
    }

    @Test
    public void replacementAvoidsCapture() {
        String child = addChild("child", apply(var("Const"), var("y")));
        RewriteRule rule = new RewriteRule("const", 1,
                Patterns.constructor("Const", Patterns.var("v")),
                lambda("y", var("v")));
        GraphRewriter.applyRulesetTransactionally(graph, RuleSet.of("k", rule));
        // the bound y must not capture the free y that was matched
        Expression rewritten = dataOf(child);
        assertThat(rewritten, instanceOf(LambdaExpression.class));
        LambdaExpression constant = (LambdaExpression)rewritten;
        assertEquals(var("y"), constant.getBody());
        assertNotEquals("y", constant.getParam());
    }

    @Test
    public void failureLeavesGraphUntouched() {
        String child = addChild("child", var("x"));
        String preHash = graph.computeGraphHash();
        RuleSet rules = RuleSet.of("bad",
                new RewriteRule("bad", 1, Patterns.constructor("x"), intLiteral(0), intLiteral(1)));
        assertThrows(RuleApplicationFailedException.class, () -> GraphRewriter.applyRulesetTransactionally(graph, rules));
        assertEquals(preHash, graph.computeGraphHash());
        assertEquals(var("x"), dataOf(child));
    }

    @Test
    public void explicitTransactionCanBeRolledBack() {
        addChild("child", var("x"));
        String preHash = graph.computeGraphHash();
        Transaction tx = GraphRewriter.beginTx(graph,
                RuleSet.of("answer", new RewriteRule("x-to-42", 10, Patterns.constructor("x"), intLiteral(42))));
        assertEquals(1, tx.applyRuleset());
        tx.rollback();
        assertEquals(preHash, graph.computeGraphHash());
    }
}
