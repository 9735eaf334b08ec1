/*
 * GraphTopologyTest.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link GraphTopology}.
 */
public class GraphTopologyTest {
    private static final Set<String> NODES = ImmutableSet.of("a", "b", "c", "d", "e");

    private static GraphEdge edge(String from, String to) {
        return new GraphEdge(from, to, EdgeType.DEPENDENCY);
    }

    @Test
    public void detectsCycles() {
        assertFalse(GraphTopology.hasCycle(NODES, ImmutableList.of()));
        assertFalse(GraphTopology.hasCycle(NODES, ImmutableList.of(edge("a", "b"), edge("b", "c"), edge("a", "c"))));
        assertTrue(GraphTopology.hasCycle(NODES, ImmutableList.of(edge("a", "b"), edge("b", "c"), edge("c", "a"))));
        assertTrue(GraphTopology.hasCycle(NODES, ImmutableList.of(edge("d", "e"), edge("e", "d"))));
    }

    @Test
    public void diamondIsNotACycle() {
        List<GraphEdge> diamond = ImmutableList.of(edge("a", "b"), edge("a", "c"), edge("b", "d"), edge("c", "d"));
        assertFalse(GraphTopology.hasCycle(NODES, diamond));
        assertFalse(GraphTopology.wouldCreateCycle(NODES, diamond, edge("a", "d")));
        assertTrue(GraphTopology.wouldCreateCycle(NODES, diamond, edge("d", "a")));
    }

    @Test
    public void wouldCreateCycleLeavesEdgesAlone() {
        List<GraphEdge> edges = new ArrayList<>(ImmutableList.of(edge("a", "b")));
        assertTrue(GraphTopology.wouldCreateCycle(NODES, edges, edge("b", "a")));
        assertEquals(ImmutableList.of(edge("a", "b")), edges);
    }

    @Test
    public void deepChainDoesNotOverflow() {
        List<String> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            nodes.add("n" + i);
            if (i > 0) {
                edges.add(edge("n" + (i - 1), "n" + i));
            }
        }
        assertFalse(GraphTopology.hasCycle(nodes, edges));
        assertTrue(GraphTopology.wouldCreateCycle(nodes, edges, edge("n19999", "n0")));
    }

    @Test
    public void topologicalSortPrefersSmallestReadyNode() {
        List<GraphEdge> edges = ImmutableList.of(edge("c", "a"), edge("e", "b"));
        assertEquals(Optional.of(ImmutableList.of("c", "a", "d", "e", "b")), GraphTopology.topologicalSort(NODES, edges));
    }

    @Test
    public void topologicalSortOfCycleIsEmpty() {
        assertEquals(Optional.empty(),
                GraphTopology.topologicalSort(NODES, ImmutableList.of(edge("a", "b"), edge("b", "a"))));
    }

    @Test
    public void topologicalSortCountsParallelEdges() {
        List<GraphEdge> edges = ImmutableList.of(edge("b", "a"), edge("b", "a"), new GraphEdge("b", "a", EdgeType.REFERENCE));
        assertEquals(Optional.of(ImmutableList.of("b", "a")),
                GraphTopology.topologicalSort(ImmutableSet.of("a", "b"), edges));
    }

    @Test
    public void shortestPathUsesBreadthFirstOrder() {
        List<GraphEdge> edges = ImmutableList.of(edge("a", "b"), edge("b", "d"), edge("a", "c"), edge("c", "d"));
        assertEquals(Optional.of(ImmutableList.of("a", "b", "d")), GraphTopology.shortestPath("a", "d", edges));
        assertEquals(Optional.of(ImmutableList.of("a")), GraphTopology.shortestPath("a", "a", edges));
        assertEquals(Optional.empty(), GraphTopology.shortestPath("b", "c", edges));
    }
}
