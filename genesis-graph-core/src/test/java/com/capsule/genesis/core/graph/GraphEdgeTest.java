/*
 * GraphEdgeTest.java
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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link GraphEdge} ordering.
 */
public class GraphEdgeTest {

    @Test
    public void canonicalOrder() {
        GraphEdge first = new GraphEdge("a", "b", EdgeType.DEPENDENCY);
        GraphEdge second = new GraphEdge("a", "b", EdgeType.DERIVATION);
        GraphEdge third = new GraphEdge("a", "c", EdgeType.DEPENDENCY);
        GraphEdge fourth = new GraphEdge("b", "a", EdgeType.REFERENCE);
        List<GraphEdge> edges = new ArrayList<>(ImmutableList.of(fourth, second, third, first));
        Collections.sort(edges);
        assertEquals(ImmutableList.of(first, second, third, fourth), edges);
    }

    @Test
    public void touches() {
        GraphEdge edge = new GraphEdge("a", "b", EdgeType.REFERENCE);
        assertTrue(edge.touches("a"));
        assertTrue(edge.touches("b"));
        assertFalse(edge.touches("c"));
    }
}
