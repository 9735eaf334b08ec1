/*
 * GenesisGraph.java
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
import com.capsule.genesis.core.GenesisConfiguration;
import com.capsule.genesis.core.expressions.Expressions;
import com.capsule.genesis.core.logging.KeyValueLogMessage;
import com.capsule.genesis.core.logging.LogMessageKeys;
import com.capsule.genesis.core.serialization.GenesisTupleCodec;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * A content-addressed directed acyclic graph of {@link GraphNode}s.
 *
 * <p>
 * Nodes are keyed by their content hash as computed when they were inserted. The root node is stored under its
 * root hash and refers to itself; every other node must refer to that same root hash. Edges are typed, connect
 * existing nodes only, never form a self-loop and never close a cycle: a rejected edge leaves the graph untouched.
 * </p>
 *
 * <p>
 * All state is guarded by a single reader-writer lock. Readers run concurrently, writers exclusively. Callers that
 * need several operations to be atomic can group them with {@link #doWithReadLock(Supplier)} and
 * {@link #doWithWriteLock(Supplier)}; the lock is reentrant.
 * </p>
 */
@API(API.Status.STABLE)
public class GenesisGraph {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenesisGraph.class);

    public static final String ROOT_NODE_ID = "⊙₀";

    @Nonnull
    private final GenesisConfiguration configuration;
    @Nonnull
    private final ContentHashes hashes;
    @Nonnull
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Nonnull
    private Map<String, GraphNode> nodes;
    @Nonnull
    private List<GraphEdge> edges;
    @Nonnull
    private String rootHash;

    public GenesisGraph(@Nonnull GraphNode rootNode) {
        this(rootNode, GenesisConfiguration.DEFAULT);
    }

    /**
     * Create a graph holding only the given root.
     *
     * @param rootNode the root, whose root reference must be its own root hash
     * @param configuration the configuration
     * @throws RootRefMismatchException if the root is not self-anchored
     */
    public GenesisGraph(@Nonnull GraphNode rootNode, @Nonnull GenesisConfiguration configuration) {
        this.configuration = configuration;
        this.hashes = ContentHashes.forConfiguration(configuration);
        String computedRootHash = hashes.rootHash(rootNode);
        if (!computedRootHash.equals(rootNode.getRootRef())) {
            throw new RootRefMismatchException(computedRootHash, rootNode.getRootRef());
        }
        this.rootHash = computedRootHash;
        this.nodes = new HashMap<>();
        this.nodes.put(computedRootHash, rootNode);
        this.edges = new ArrayList<>();
    }

    /**
     * Build the canonical genesis root node for the default hash domain.
     * @return a self-anchored root node
     */
    @Nonnull
    public static GraphNode createRootNode() {
        return createRootNode(GenesisConfiguration.DEFAULT);
    }

    @Nonnull
    public static GraphNode createRootNode(@Nonnull GenesisConfiguration configuration) {
        GraphNode unanchored = new GraphNode(ROOT_NODE_ID, "", Expressions.intLiteral(0),
                new NodeMetadata(0L, 0, ImmutableList.of("genesis", "root")));
        return anchorRoot(unanchored, configuration);
    }

    /**
     * Make a node self-anchored by setting its root reference to its own root hash.
     * @param node a prospective root node
     * @param configuration the configuration whose hash domain is used
     * @return the anchored root node
     */
    @Nonnull
    public static GraphNode anchorRoot(@Nonnull GraphNode node, @Nonnull GenesisConfiguration configuration) {
        return node.withRootRef(ContentHashes.forConfiguration(configuration).rootHash(node));
    }

    @Nonnull
    public GenesisConfiguration getConfiguration() {
        return configuration;
    }

    @Nonnull
    public ContentHashes getContentHashes() {
        return hashes;
    }

    @Nonnull
    public String getRootHash() {
        return doWithReadLock(() -> rootHash);
    }

    @Nonnull
    public Optional<GraphNode> getNode(@Nonnull String hash) {
        return doWithReadLock(() -> Optional.ofNullable(nodes.get(hash)));
    }

    public boolean containsNode(@Nonnull String hash) {
        return doWithReadLock(() -> nodes.containsKey(hash));
    }

    /**
     * Get a copy of all nodes keyed by hash.
     * @return the nodes
     */
    @Nonnull
    public Map<String, GraphNode> getNodes() {
        return doWithReadLock(() -> ImmutableMap.copyOf(nodes));
    }

    /**
     * Get a copy of all edges in insertion order.
     * @return the edges
     */
    @Nonnull
    public List<GraphEdge> getEdges() {
        return doWithReadLock(() -> ImmutableList.copyOf(edges));
    }

    /**
     * Get the edges that start or end at the given node, in insertion order.
     * @param hash a node hash
     * @return the touching edges
     */
    @Nonnull
    public List<GraphEdge> getEdgesTouching(@Nonnull String hash) {
        return doWithReadLock(() -> edges.stream().filter(edge -> edge.touches(hash)).collect(ImmutableList.toImmutableList()));
    }

    public int getNodeCount() {
        return doWithReadLock(() -> nodes.size());
    }

    public int getEdgeCount() {
        return doWithReadLock(() -> edges.size());
    }

    /**
     * Insert a node under its content hash.
     *
     * @param node the node to insert
     * @return the node's hash
     * @throws RootRefMismatchException if the node does not refer to this graph's root
     * @throws NodeAlreadyExistsException if a node with the same hash is present
     */
    @Nonnull
    public String insertNode(@Nonnull GraphNode node) {
        return doWithWriteLock(() -> {
            if (!node.getRootRef().equals(rootHash)) {
                throw new RootRefMismatchException(rootHash, node.getRootRef());
            }
            String hash = hashes.nodeHash(node);
            if (nodes.containsKey(hash)) {
                throw new NodeAlreadyExistsException(hash);
            }
            nodes.put(hash, node);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("inserted node",
                        LogMessageKeys.NODE_HASH, hash,
                        LogMessageKeys.NODE_ID, node.getId()));
            }
            return hash;
        });
    }

    /**
     * Add a typed edge. The cycle check runs against the edge set as it would be, so a rejected edge never becomes
     * visible.
     *
     * @param from the source hash
     * @param to the target hash
     * @param edgeType the edge type
     * @return the added edge
     * @throws NodeNotFoundException if either endpoint is missing
     * @throws SelfLoopForbiddenException if {@code from} equals {@code to}
     * @throws CycleDetectedException if the edge would close a cycle
     */
    @Nonnull
    public GraphEdge linkNodes(@Nonnull String from, @Nonnull String to, @Nonnull EdgeType edgeType) {
        return doWithWriteLock(() -> {
            if (!nodes.containsKey(from)) {
                throw new NodeNotFoundException(from);
            }
            if (!nodes.containsKey(to)) {
                throw new NodeNotFoundException(to);
            }
            if (from.equals(to)) {
                throw new SelfLoopForbiddenException(from);
            }
            GraphEdge edge = new GraphEdge(from, to, edgeType);
            if (GraphTopology.wouldCreateCycle(nodes.keySet(), edges, edge)) {
                throw new CycleDetectedException(edge);
            }
            edges.add(edge);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("linked nodes",
                        LogMessageKeys.EDGE_FROM, from,
                        LogMessageKeys.EDGE_TO, to,
                        LogMessageKeys.EDGE_TYPE, edgeType));
            }
            return edge;
        });
    }

    /**
     * Remove a node and every edge that starts or ends at it.
     *
     * @param hash the node's hash
     * @return the removed node
     * @throws InvalidRootHashException if {@code hash} is the root
     * @throws NodeNotFoundException if there is no such node
     */
    @Nonnull
    public GraphNode deleteNode(@Nonnull String hash) {
        return doWithWriteLock(() -> {
            if (hash.equals(rootHash)) {
                throw new InvalidRootHashException(rootHash);
            }
            GraphNode removed = nodes.remove(hash);
            if (removed == null) {
                throw new NodeNotFoundException(hash);
            }
            int before = edges.size();
            edges.removeIf(edge -> edge.touches(hash));
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("deleted node",
                        LogMessageKeys.NODE_HASH, hash,
                        LogMessageKeys.EDGE_COUNT, before - edges.size()));
            }
            return removed;
        });
    }

    /**
     * Remove one occurrence of an edge.
     * @param edge the edge
     * @return whether the edge was present
     */
    public boolean removeEdge(@Nonnull GraphEdge edge) {
        return doWithWriteLock(() -> edges.remove(edge));
    }

    /**
     * Replace the node stored under an existing hash. The key is kept: a node's hash is its identity from the
     * time it was inserted. Used by the rewrite engine.
     *
     * @param hash the key of the node to replace
     * @param node the replacement
     * @return the previous node
     * @throws NodeNotFoundException if there is no such node
     */
    @API(API.Status.INTERNAL)
    @Nonnull
    public GraphNode updateNode(@Nonnull String hash, @Nonnull GraphNode node) {
        return doWithWriteLock(() -> {
            GraphNode previous = nodes.get(hash);
            if (previous == null) {
                throw new NodeNotFoundException(hash);
            }
            nodes.put(hash, node);
            return previous;
        });
    }

    /**
     * Order all node hashes so that every edge points forward.
     * @return the order, smallest ready hash first, or empty if the graph has a cycle
     */
    @Nonnull
    public Optional<List<String>> topologicalSort() {
        return doWithReadLock(() -> GraphTopology.topologicalSort(nodes.keySet(), edges));
    }

    /**
     * Encode the whole graph deterministically: root hash, nodes sorted by hash and edges sorted by
     * {@code (from, to, type)}. Insertion order never affects the bytes.
     *
     * @return the canonical bytes
     */
    @Nonnull
    public byte[] canonicalSerialize() {
        return doWithReadLock(() -> GenesisTupleCodec.encodeGraph(rootHash, nodes, edges).pack());
    }

    /**
     * Hash of the current graph state.
     * @return the graph hash
     */
    @Nonnull
    public String computeGraphHash() {
        return hashes.graphHash(canonicalSerialize());
    }

    /**
     * Get all nodes ordered by node id, ties broken by hash.
     * @return entries of hash and node
     */
    @Nonnull
    public List<Map.Entry<String, GraphNode>> nodesSortedById() {
        return doWithReadLock(() -> nodes.entrySet().stream()
                .map(entry -> Maps.immutableEntry(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparing((Map.Entry<String, GraphNode> entry) -> entry.getValue().getId())
                        .thenComparing(Map.Entry::getKey))
                .collect(ImmutableList.toImmutableList()));
    }

    /**
     * Find the shortest path of hashes from the root to a node.
     *
     * @param target the node's hash
     * @return the path starting at the root and ending at {@code target}, or empty if the node is unknown or not
     * reachable from the root
     */
    @Nonnull
    public Optional<List<String>> getLineage(@Nonnull String target) {
        return doWithReadLock(() -> {
            if (!nodes.containsKey(target)) {
                return Optional.empty();
            }
            return GraphTopology.shortestPath(rootHash, target, edges);
        });
    }

    /**
     * Capture the current state together with its graph hash.
     * @return a snapshot
     */
    @Nonnull
    public GraphSnapshot snapshot() {
        return doWithReadLock(() -> {
            byte[] bytes = GenesisTupleCodec.encodeGraph(rootHash, nodes, edges).pack();
            return new GraphSnapshot(rootHash, nodes, edges, hashes.graphHash(bytes));
        });
    }

    /**
     * Replace the whole state with the contents of a snapshot, without checking it. Callers verify the outcome
     * themselves, as {@link com.capsule.genesis.core.rewrite.Transaction#rollback()} does.
     *
     * @param snapshot the state to restore
     */
    @API(API.Status.INTERNAL)
    public void restore(@Nonnull GraphSnapshot snapshot) {
        doWithWriteLock(() -> {
            nodes = new HashMap<>(snapshot.getNodes());
            edges = new ArrayList<>(snapshot.getEdges());
            rootHash = snapshot.getRootHash();
            return null;
        });
    }

    /**
     * Hash-verified state recovery: check that the snapshot still hashes to its recorded content hash, then
     * replace the whole state with it.
     *
     * @param snapshot the state to recover
     * @throws com.capsule.genesis.core.rewrite.HashMismatchException if the snapshot fails verification
     */
    public void recover(@Nonnull GraphSnapshot snapshot) {
        snapshot.verify(hashes);
        restore(snapshot);
        LOGGER.info(KeyValueLogMessage.of("recovered graph from snapshot",
                LogMessageKeys.ROOT_HASH, snapshot.getRootHash(),
                LogMessageKeys.POST_HASH, snapshot.getContentHash(),
                LogMessageKeys.NODE_COUNT, snapshot.getNodes().size()));
    }

    /**
     * Run an operation while holding the read lock.
     *
     * @param operation the operation
     * @param <T> the result type
     * @return the result of {@code operation}
     */
    public <T> T doWithReadLock(@Nonnull Supplier<T> operation) {
        lock.readLock().lock();
        try {
            return operation.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Run an operation while holding the write lock.
     *
     * @param operation the operation
     * @param <T> the result type
     * @return the result of {@code operation}
     */
    public <T> T doWithWriteLock(@Nonnull Supplier<T> operation) {
        lock.writeLock().lock();
        try {
            return operation.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        return doWithReadLock(() -> "GenesisGraph(root=" + rootHash + ", nodes=" + nodes.size() + ", edges=" + edges.size() + ")");
    }
}
