/*
 * GenesisGraphTest.java
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

package com.capsule.genesis.core.graph;

import com.capsule.genesis.core.GenesisConfiguration;
import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.rewrite.HashMismatchException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.capsule.genesis.core.expressions.Expressions.apply;
import static com.capsule.genesis.core.expressions.Expressions.intLiteral;
import static com.capsule.genesis.core.expressions.Expressions.stringLiteral;
import static com.capsule.genesis.core.expressions.Expressions.var;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link GenesisGraph}.
 */
public class GenesisGraphTest {
    private GenesisGraph graph;
    private String root;

    @BeforeEach
    public void setUp() {
        graph = new GenesisGraph(GenesisGraph.createRootNode());
        root = graph.getRootHash();
    }

    private GraphNode node(String id, Expression data) {
        return new GraphNode(id, root, data, NodeMetadata.EMPTY);
    }

    private String insert(String id, long value) {
        return graph.insertNode(node(id, intLiteral(value)));
    }

    @Test
    public void rootIsSelfAnchored() {
        GraphNode rootNode = graph.getNode(root).orElseThrow(AssertionError::new);
        assertEquals(root, rootNode.getRootRef());
        assertEquals(GenesisGraph.ROOT_NODE_ID, rootNode.getId());
        assertEquals(root, ContentHashes.DEFAULT.rootHash(rootNode));
        assertThat(root, matchesPattern("[0-9a-f]{64}"));
        assertEquals(1, graph.getNodeCount());
        assertEquals(0, graph.getEdgeCount());
    }

    @Test
    public void rootHashIsStable() {
        assertEquals(root, new GenesisGraph(GenesisGraph.createRootNode()).getRootHash());
    }

    @Test
    public void hashDomainSeparatesGraphs() {
        GenesisConfiguration other = GenesisConfiguration.builder().setHashDomain("GlyphV2").build();
        GenesisGraph otherGraph = new GenesisGraph(GenesisGraph.createRootNode(other), other);
        assertNotEquals(root, otherGraph.getRootHash());
    }

    @Test
    public void rootMustBeAnchored() {
        GraphNode unanchored = new GraphNode("r", "not-a-hash", intLiteral(0), NodeMetadata.EMPTY);
        assertThrows(RootRefMismatchException.class, () -> new GenesisGraph(unanchored));
        GraphNode anchored = GenesisGraph.anchorRoot(unanchored, GenesisConfiguration.DEFAULT);
        assertEquals(anchored.getRootRef(), new GenesisGraph(anchored).getRootHash());
    }

    @Test
    public void insertReturnsContentHash() {
        GraphNode a = node("a", apply(var("f"), intLiteral(1)));
        String hash = graph.insertNode(a);
        assertEquals(ContentHashes.DEFAULT.nodeHash(a), hash);
        assertEquals(Optional.of(a), graph.getNode(hash));
        assertTrue(graph.containsNode(hash));
        assertEquals(2, graph.getNodeCount());
    }

    @Test
    public void insertRejectsDuplicates() {
        insert("a", 1);
        NodeAlreadyExistsException e = assertThrows(NodeAlreadyExistsException.class, () -> insert("a", 1));
        assertEquals(ContentHashes.DEFAULT.nodeHash(node("a", intLiteral(1))), e.getLogInfo().get("node_hash"));
        assertEquals(2, graph.getNodeCount());
    }

    @Test
    public void identicalDataUnderDifferentIdsHashesDifferently() {
        assertNotEquals(insert("a", 1), insert("b", 1));
    }

    @Test
    public void insertRejectsForeignRoot() {
        GraphNode foreign = new GraphNode("a", "0000", intLiteral(1), NodeMetadata.EMPTY);
        assertThrows(RootRefMismatchException.class, () -> graph.insertNode(foreign));
        assertEquals(1, graph.getNodeCount());
    }

    @Test
    public void linkRequiresBothEndpoints() {
        String a = insert("a", 1);
        assertThrows(NodeNotFoundException.class, () -> graph.linkNodes(a, "missing", EdgeType.DEPENDENCY));
        assertThrows(NodeNotFoundException.class, () -> graph.linkNodes("missing", a, EdgeType.DEPENDENCY));
        assertEquals(0, graph.getEdgeCount());
    }

    @Test
    public void selfLoopsAreForbidden() {
        String a = insert("a", 1);
        assertThrows(SelfLoopForbiddenException.class, () -> graph.linkNodes(a, a, EdgeType.REFERENCE));
    }

    @Test
    public void cyclesAreRejectedWithoutSideEffects() {
        String a = insert("a", 1);
        String b = insert("b", 2);
        graph.linkNodes(root, a, EdgeType.DERIVATION);
        graph.linkNodes(a, b, EdgeType.DEPENDENCY);
        String before = graph.computeGraphHash();
        CycleDetectedException e = assertThrows(CycleDetectedException.class, () -> graph.linkNodes(b, root, EdgeType.REFERENCE));
        assertEquals(b, e.getLogInfo().get("from"));
        assertEquals(2, graph.getEdgeCount());
        assertEquals(before, graph.computeGraphHash());
        assertTrue(graph.topologicalSort().isPresent());
    }

    @Test
    public void parallelEdgesAreAllowed() {
        String a = insert("a", 1);
        graph.linkNodes(root, a, EdgeType.DEPENDENCY);
        graph.linkNodes(root, a, EdgeType.DEPENDENCY);
        graph.linkNodes(root, a, EdgeType.REFERENCE);
        assertEquals(3, graph.getEdgeCount());
    }

    @Test
    public void deleteCascadesToEdges() {
        String a = insert("a", 1);
        String b = insert("b", 2);
        String c = insert("c", 3);
        graph.linkNodes(root, a, EdgeType.DERIVATION);
        graph.linkNodes(a, b, EdgeType.DEPENDENCY);
        graph.linkNodes(root, c, EdgeType.DERIVATION);
        GraphNode removed = graph.deleteNode(a);
        assertEquals("a", removed.getId());
        assertFalse(graph.containsNode(a));
        assertEquals(ImmutableList.of(new GraphEdge(root, c, EdgeType.DERIVATION)), graph.getEdges());
        assertTrue(graph.containsNode(b));
    }

    @Test
    public void deleteRejectsRootAndUnknownNodes() {
        assertThrows(InvalidRootHashException.class, () -> graph.deleteNode(root));
        assertThrows(NodeNotFoundException.class, () -> graph.deleteNode("missing"));
        assertEquals(1, graph.getNodeCount());
    }

    @Test
    public void topologicalSortPutsSourcesFirst() {
        String a = insert("a", 1);
        String b = insert("b", 2);
        String c = insert("c", 3);
        graph.linkNodes(root, a, EdgeType.DERIVATION);
        graph.linkNodes(a, b, EdgeType.DEPENDENCY);
        graph.linkNodes(c, b, EdgeType.DEPENDENCY);
        List<String> order = graph.topologicalSort().orElseThrow(AssertionError::new);
        assertThat(order, hasSize(4));
        for (GraphEdge edge : graph.getEdges()) {
            assertTrue(order.indexOf(edge.getFrom()) < order.indexOf(edge.getTo()), "edge " + edge + " points backwards");
        }
        assertEquals(b, order.get(3));
        assertEquals(order, graph.topologicalSort().orElseThrow(AssertionError::new));
    }

    @Test
    public void canonicalFormIgnoresInsertionOrder() {
        GraphNode a = node("a", intLiteral(1));
        GraphNode b = node("b", stringLiteral("two"));

        GenesisGraph first = new GenesisGraph(GenesisGraph.createRootNode());
        String a1 = first.insertNode(a);
        String b1 = first.insertNode(b);
        first.linkNodes(root, a1, EdgeType.DERIVATION);
        first.linkNodes(a1, b1, EdgeType.DEPENDENCY);

        GenesisGraph second = new GenesisGraph(GenesisGraph.createRootNode());
        String b2 = second.insertNode(b);
        String a2 = second.insertNode(a);
        second.linkNodes(a2, b2, EdgeType.DEPENDENCY);
        second.linkNodes(root, a2, EdgeType.DERIVATION);

        assertArrayEquals(first.canonicalSerialize(), second.canonicalSerialize());
        assertEquals(first.computeGraphHash(), second.computeGraphHash());
        assertEquals(first.topologicalSort(), second.topologicalSort());
    }

    @Test
    public void graphHashTracksContent() {
        String empty = graph.computeGraphHash();
        String a = insert("a", 1);
        String withNode = graph.computeGraphHash();
        assertNotEquals(empty, withNode);
        graph.linkNodes(root, a, EdgeType.REFERENCE);
        assertNotEquals(withNode, graph.computeGraphHash());
        graph.deleteNode(a);
        assertEquals(empty, graph.computeGraphHash());
    }

    @Test
    public void lineageIsShortestPathFromRoot() {
        String a = insert("a", 1);
        String b = insert("b", 2);
        String d = insert("d", 4);
        String orphan = insert("orphan", 5);
        graph.linkNodes(root, a, EdgeType.DERIVATION);
        graph.linkNodes(a, b, EdgeType.DERIVATION);
        graph.linkNodes(b, d, EdgeType.DERIVATION);
        assertEquals(Optional.of(ImmutableList.of(root, a, b, d)), graph.getLineage(d));
        graph.linkNodes(root, d, EdgeType.REFERENCE);
        assertEquals(Optional.of(ImmutableList.of(root, d)), graph.getLineage(d));
        assertEquals(Optional.of(ImmutableList.of(root)), graph.getLineage(root));
        assertEquals(Optional.empty(), graph.getLineage(orphan));
        assertEquals(Optional.empty(), graph.getLineage("missing"));
    }

    @Test
    public void nodesSortedById() {
        insert("c", 1);
        insert("a", 2);
        insert("b", 3);
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, GraphNode> entry : graph.nodesSortedById()) {
            ids.add(entry.getValue().getId());
        }
        assertThat(ids, contains("a", "b", "c", GenesisGraph.ROOT_NODE_ID));
    }

    @Test
    public void updateKeepsKey() {
        String a = insert("a", 1);
        GraphNode replacement = node("a", intLiteral(2));
        GraphNode previous = graph.updateNode(a, replacement);
        assertEquals(intLiteral(1), previous.getData());
        assertEquals(Optional.of(replacement), graph.getNode(a));
        assertThrows(NodeNotFoundException.class, () -> graph.updateNode("missing", replacement));
    }

    @Test
    public void recoverRestoresSnapshot() {
        String a = insert("a", 1);
        graph.linkNodes(root, a, EdgeType.DERIVATION);
        GraphSnapshot snapshot = graph.snapshot();
        assertEquals(graph.computeGraphHash(), snapshot.getContentHash());

        graph.deleteNode(a);
        insert("b", 2);
        assertNotEquals(snapshot.getContentHash(), graph.computeGraphHash());

        graph.recover(snapshot);
        assertEquals(snapshot.getContentHash(), graph.computeGraphHash());
        assertEquals(2, graph.getNodeCount());
        assertEquals(1, graph.getEdgeCount());
    }

    @Test
    public void recoverRejectsTamperedSnapshot() {
        String a = insert("a", 1);
        GraphSnapshot snapshot = graph.snapshot();
        Map<String, GraphNode> tamperedNodes = new HashMap<>(snapshot.getNodes());
        tamperedNodes.put(a, node("a", intLiteral(666)));
        GraphSnapshot tampered = new GraphSnapshot(snapshot.getRootHash(), tamperedNodes, snapshot.getEdges(),
                snapshot.getContentHash());

        insert("b", 2);
        String before = graph.computeGraphHash();
        assertThrows(HashMismatchException.class, () -> graph.recover(tampered));
        assertEquals(before, graph.computeGraphHash());
    }

    @Test
    public void snapshotSurvivesBytes() {
        String a = insert("a", 1);
        graph.linkNodes(root, a, EdgeType.DEPENDENCY);
        GraphSnapshot snapshot = graph.snapshot();
        GraphSnapshot decoded = GraphSnapshot.fromBytes(snapshot.toBytes());
        assertEquals(snapshot, decoded);
        decoded.verify();
    }

    @Test
    public void readOnlyViewsAreCopies() {
        Map<String, GraphNode> nodes = graph.getNodes();
        insert("a", 1);
        assertEquals(1, nodes.size());
        assertEquals(ImmutableMap.of(root, graph.getNode(root).orElseThrow(AssertionError::new)), nodes);
    }

    @Test
    public void concurrentInsertsAreAllApplied() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                final int value = i;
                futures.add(executor.submit(() -> {
                    String hash = insert("n" + value, value);
                    graph.linkNodes(root, hash, EdgeType.DERIVATION);
                    return hash;
                }));
            }
            for (Future<String> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }
        assertEquals(201, graph.getNodeCount());
        assertEquals(200, graph.getEdgeCount());
        assertTrue(graph.topologicalSort().isPresent());
    }
}
