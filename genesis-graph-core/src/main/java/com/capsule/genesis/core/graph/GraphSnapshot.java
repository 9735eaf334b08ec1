/*
 * GraphSnapshot.java
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
import com.capsule.genesis.core.rewrite.HashMismatchException;
import com.capsule.genesis.core.serialization.GenesisTupleCodec;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable copy of a graph's nodes, edges and root hash, together with the graph hash it had when captured.
 * Snapshots are plain values; they may be shared between threads and persisted with {@link #toBytes()}.
 */
@API(API.Status.STABLE)
public final class GraphSnapshot {
    @Nonnull
    private final String rootHash;
    @Nonnull
    private final ImmutableSortedMap<String, GraphNode> nodes;
    @Nonnull
    private final ImmutableList<GraphEdge> edges;
    @Nonnull
    private final String contentHash;

    public GraphSnapshot(@Nonnull String rootHash, @Nonnull Map<String, GraphNode> nodes,
                         @Nonnull List<GraphEdge> edges, @Nonnull String contentHash) {
        this.rootHash = Objects.requireNonNull(rootHash);
        this.nodes = ImmutableSortedMap.copyOf(nodes);
        this.edges = ImmutableList.copyOf(edges);
        this.contentHash = Objects.requireNonNull(contentHash);
    }

    @Nonnull
    public String getRootHash() {
        return rootHash;
    }

    /**
     * Get the captured nodes, keyed and sorted by hash.
     * @return the nodes
     */
    @Nonnull
    public Map<String, GraphNode> getNodes() {
        return nodes;
    }

    /**
     * Get the captured edges in their original insertion order.
     * @return the edges
     */
    @Nonnull
    public List<GraphEdge> getEdges() {
        return edges;
    }

    /**
     * Get the graph hash recorded when this snapshot was taken.
     * @return the recorded hash
     */
    @Nonnull
    public String getContentHash() {
        return contentHash;
    }

    /**
     * Recompute the graph hash of the captured state with the given hashes.
     * @param hashes hash functions of the graph's domain
     * @return the hash of the captured state
     */
    @Nonnull
    public String computeContentHash(@Nonnull ContentHashes hashes) {
        return hashes.graphHash(rootHash, nodes, edges);
    }

    /**
     * Check that the captured state still hashes to the recorded hash.
     *
     * @param hashes hash functions of the graph's domain
     * @throws HashMismatchException if the state was altered after capture
     */
    public void verify(@Nonnull ContentHashes hashes) {
        String actual = computeContentHash(hashes);
        if (!actual.equals(contentHash)) {
            throw new HashMismatchException(contentHash, actual);
        }
    }

    public void verify() {
        verify(ContentHashes.DEFAULT);
    }

    @Nonnull
    public byte[] toBytes() {
        return GenesisTupleCodec.encodeSnapshot(this).pack();
    }

    @Nonnull
    public static GraphSnapshot fromBytes(@Nonnull byte[] bytes) {
        return GenesisTupleCodec.snapshotFromBytes(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GraphSnapshot that = (GraphSnapshot)o;
        return rootHash.equals(that.rootHash) && nodes.equals(that.nodes)
               && edges.equals(that.edges) && contentHash.equals(that.contentHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootHash, nodes, edges, contentHash);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("rootHash", rootHash)
                .add("nodeCount", nodes.size())
                .add("edgeCount", edges.size())
                .add("contentHash", contentHash)
                .toString();
    }
}
