/*
 * GraphTopology.java
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

import com.capsule.genesis.annotation.API;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Graph algorithms over a set of node hashes and a list of edges: cycle detection, deterministic topological
 * ordering and shortest lineage paths. The methods only read their arguments.
 */
@API(API.Status.INTERNAL)
public class GraphTopology {

    /**
     * Detect a cycle with a depth-first search that tracks the nodes on the current path.
     *
     * @param nodes all node hashes
     * @param edges the edges, whose endpoints must all be in {@code nodes}
     * @return {@code true} if some path leads from a node back to itself
     */
    public static boolean hasCycle(@Nonnull Collection<String> nodes, @Nonnull Collection<GraphEdge> edges) {
        Map<String, List<String>> adjacency = adjacency(edges);
        Set<String> visited = new HashSet<>();
        Set<String> onPath = new HashSet<>();
        for (String start : nodes) {
            if (visited.contains(start)) {
                continue;
            }
            Deque<Map.Entry<String, Iterator<String>>> stack = new ArrayDeque<>();
            visited.add(start);
            onPath.add(start);
            stack.push(Maps.immutableEntry(start, successors(adjacency, start).iterator()));
            while (!stack.isEmpty()) {
                Map.Entry<String, Iterator<String>> top = stack.peek();
                if (top.getValue().hasNext()) {
                    String next = top.getValue().next();
                    if (onPath.contains(next)) {
                        return true;
                    }
                    if (visited.add(next)) {
                        onPath.add(next);
                        stack.push(Maps.immutableEntry(next, successors(adjacency, next).iterator()));
                    }
                } else {
                    onPath.remove(top.getKey());
                    stack.pop();
                }
            }
        }
        return false;
    }

    /**
     * Whether adding {@code candidate} to {@code edges} would create a cycle. Neither argument is modified.
     *
     * @param nodes all node hashes
     * @param edges the current edges
     * @param candidate the edge to test
     * @return {@code true} if the extended edge set contains a cycle
     */
    public static boolean wouldCreateCycle(@Nonnull Collection<String> nodes, @Nonnull Collection<GraphEdge> edges,
                                           @Nonnull GraphEdge candidate) {
        List<GraphEdge> hypothetical = new ArrayList<>(edges.size() + 1);
        hypothetical.addAll(edges);
        hypothetical.add(candidate);
        return hasCycle(nodes, hypothetical);
    }

    /**
     * Order the nodes so that every edge points forward, using Kahn's algorithm. Among the nodes that are ready at
     * any step, the lexicographically smallest hash goes first, so a given graph always yields the same order.
     *
     * @param nodes all node hashes
     * @param edges the edges
     * @return the order, or empty if the edges contain a cycle
     */
    @Nonnull
    public static Optional<List<String>> topologicalSort(@Nonnull Collection<String> nodes, @Nonnull Collection<GraphEdge> edges) {
        Map<String, List<String>> adjacency = adjacency(edges);
        Map<String, Integer> inDegree = new HashMap<>();
        for (String node : nodes) {
            inDegree.put(node, 0);
        }
        for (GraphEdge edge : edges) {
            inDegree.merge(edge.getTo(), 1, Integer::sum);
        }
        TreeSet<String> ready = new TreeSet<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }
        ImmutableList.Builder<String> order = ImmutableList.builder();
        int emitted = 0;
        while (!ready.isEmpty()) {
            String node = ready.pollFirst();
            order.add(node);
            emitted++;
            for (String successor : successors(adjacency, node)) {
                int remaining = inDegree.merge(successor, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(successor);
                }
            }
        }
        return emitted == inDegree.size() ? Optional.of(order.build()) : Optional.empty();
    }

    /**
     * Find the shortest path from {@code root} to {@code target} by breadth-first search. Successors are visited in
     * edge insertion order, so among equally short paths the one using earlier edges wins.
     *
     * @param root the start of the path
     * @param target the end of the path
     * @param edges the edges
     * @return the path including both ends, or empty if {@code target} is not reachable
     */
    @Nonnull
    public static Optional<List<String>> shortestPath(@Nonnull String root, @Nonnull String target,
                                                      @Nonnull Collection<GraphEdge> edges) {
        Map<String, List<String>> adjacency = adjacency(edges);
        Map<String, String> parents = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(root);
        queue.add(root);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(target)) {
                List<String> path = new ArrayList<>();
                for (String node = current; node != null; node = parents.get(node)) {
                    path.add(node);
                }
                return Optional.of(ImmutableList.copyOf(path).reverse());
            }
            for (String successor : successors(adjacency, current)) {
                if (visited.add(successor)) {
                    parents.put(successor, current);
                    queue.add(successor);
                }
            }
        }
        return Optional.empty();
    }

    @Nonnull
    private static Map<String, List<String>> adjacency(@Nonnull Collection<GraphEdge> edges) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (GraphEdge edge : edges) {
            adjacency.computeIfAbsent(edge.getFrom(), ignored -> new ArrayList<>()).add(edge.getTo());
        }
        return adjacency;
    }

    @Nonnull
    private static List<String> successors(@Nonnull Map<String, List<String>> adjacency, @Nonnull String node) {
        return adjacency.getOrDefault(node, ImmutableList.of());
    }

    private GraphTopology() {
    }
}
