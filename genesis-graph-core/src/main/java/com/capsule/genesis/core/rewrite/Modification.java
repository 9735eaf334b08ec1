/*
 * Modification.java
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
import com.capsule.genesis.core.GenesisCoreException;
import com.capsule.genesis.core.graph.GenesisGraph;
import com.capsule.genesis.core.graph.GraphEdge;
import com.capsule.genesis.core.graph.GraphNode;
import com.capsule.genesis.core.graph.NodeNotFoundException;
import com.capsule.genesis.core.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * An entry in a {@link Transaction}'s modification log. The log records every change a transaction made, in
 * order, and can be replayed against another graph with {@link #applyTo(GenesisGraph)}.
 */
@API(API.Status.STABLE)
public abstract class Modification {

    /**
     * The kind of change.
     */
    public enum Kind {
        NODE_ADDED,
        NODE_REMOVED,
        NODE_UPDATED,
        EDGE_ADDED,
        EDGE_REMOVED
    }

    @Nonnull
    private final Kind kind;

    private Modification(@Nonnull Kind kind) {
        this.kind = kind;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Replay this change against a graph.
     *
     * @param graph the graph to change
     */
    public abstract void applyTo(@Nonnull GenesisGraph graph);

    @Nonnull
    public static NodeAdded nodeAdded(@Nonnull String hash, @Nonnull GraphNode node) {
        return new NodeAdded(hash, node);
    }

    @Nonnull
    public static NodeRemoved nodeRemoved(@Nonnull String hash, @Nonnull GraphNode node) {
        return new NodeRemoved(hash, node);
    }

    @Nonnull
    public static NodeUpdated nodeUpdated(@Nonnull String hash, @Nonnull GraphNode oldNode, @Nonnull GraphNode newNode) {
        return new NodeUpdated(hash, oldNode, newNode);
    }

    @Nonnull
    public static EdgeAdded edgeAdded(@Nonnull GraphEdge edge) {
        return new EdgeAdded(edge);
    }

    @Nonnull
    public static EdgeRemoved edgeRemoved(@Nonnull GraphEdge edge) {
        return new EdgeRemoved(edge);
    }

    /**
     * A node was inserted.
     */
    public static final class NodeAdded extends Modification {
        @Nonnull
        private final String hash;
        @Nonnull
        private final GraphNode node;

        private NodeAdded(@Nonnull String hash, @Nonnull GraphNode node) {
            super(Kind.NODE_ADDED);
            this.hash = hash;
            this.node = node;
        }

        @Nonnull
        public String getHash() {
            return hash;
        }

        @Nonnull
        public GraphNode getNode() {
            return node;
        }

        @Override
        public void applyTo(@Nonnull GenesisGraph graph) {
            String inserted = graph.insertNode(node);
            if (!inserted.equals(hash)) {
                throw new HashMismatchException(hash, inserted);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            NodeAdded that = (NodeAdded)o;
            return hash.equals(that.hash) && node.equals(that.node);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), hash, node);
        }

        @Override
        public String toString() {
            return "NodeAdded(" + hash + ")";
        }
    }

    /**
     * A node was deleted. Edges removed along with it are logged as separate {@link EdgeRemoved} entries just
     * before this one.
     */
    public static final class NodeRemoved extends Modification {
        @Nonnull
        private final String hash;
        @Nonnull
        private final GraphNode node;

        private NodeRemoved(@Nonnull String hash, @Nonnull GraphNode node) {
            super(Kind.NODE_REMOVED);
            this.hash = hash;
            this.node = node;
        }

        @Nonnull
        public String getHash() {
            return hash;
        }

        @Nonnull
        public GraphNode getNode() {
            return node;
        }

        @Override
        public void applyTo(@Nonnull GenesisGraph graph) {
            graph.deleteNode(hash);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            NodeRemoved that = (NodeRemoved)o;
            return hash.equals(that.hash) && node.equals(that.node);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), hash, node);
        }

        @Override
        public String toString() {
            return "NodeRemoved(" + hash + ")";
        }
    }

    /**
     * A node's content was replaced in place by a rewrite.
     */
    public static final class NodeUpdated extends Modification {
        @Nonnull
        private final String hash;
        @Nonnull
        private final GraphNode oldNode;
        @Nonnull
        private final GraphNode newNode;

        private NodeUpdated(@Nonnull String hash, @Nonnull GraphNode oldNode, @Nonnull GraphNode newNode) {
            super(Kind.NODE_UPDATED);
            this.hash = hash;
            this.oldNode = oldNode;
            this.newNode = newNode;
        }

        @Nonnull
        public String getHash() {
            return hash;
        }

        @Nonnull
        public GraphNode getOldNode() {
            return oldNode;
        }

        @Nonnull
        public GraphNode getNewNode() {
            return newNode;
        }

        /**
         * Replace the node, provided the graph still holds the node this update started from.
         *
         * @param graph the graph to change
         * @throws HashMismatchException if the current node differs from {@link #getOldNode()}
         */
        @Override
        public void applyTo(@Nonnull GenesisGraph graph) {
            graph.doWithWriteLock(() -> {
                GraphNode current = graph.getNode(hash).orElseThrow(() -> new NodeNotFoundException(hash));
                if (!current.equals(oldNode)) {
                    throw new HashMismatchException(graph.getContentHashes().nodeHash(oldNode),
                            graph.getContentHashes().nodeHash(current));
                }
                return graph.updateNode(hash, newNode);
            });
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            NodeUpdated that = (NodeUpdated)o;
            return hash.equals(that.hash) && oldNode.equals(that.oldNode) && newNode.equals(that.newNode);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), hash, oldNode, newNode);
        }

        @Override
        public String toString() {
            return "NodeUpdated(" + hash + ": " + oldNode.getData() + " => " + newNode.getData() + ")";
        }
    }

    /**
     * An edge was added.
     */
    public static final class EdgeAdded extends Modification {
        @Nonnull
        private final GraphEdge edge;

        private EdgeAdded(@Nonnull GraphEdge edge) {
            super(Kind.EDGE_ADDED);
            this.edge = edge;
        }

        @Nonnull
        public GraphEdge getEdge() {
            return edge;
        }

        @Override
        public void applyTo(@Nonnull GenesisGraph graph) {
            graph.linkNodes(edge.getFrom(), edge.getTo(), edge.getEdgeType());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return edge.equals(((EdgeAdded)o).edge);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), edge);
        }

        @Override
        public String toString() {
            return "EdgeAdded(" + edge + ")";
        }
    }

    /**
     * An edge was removed, as part of deleting one of its endpoints.
     */
    public static final class EdgeRemoved extends Modification {
        @Nonnull
        private final GraphEdge edge;

        private EdgeRemoved(@Nonnull GraphEdge edge) {
            super(Kind.EDGE_REMOVED);
            this.edge = edge;
        }

        @Nonnull
        public GraphEdge getEdge() {
            return edge;
        }

        @Override
        public void applyTo(@Nonnull GenesisGraph graph) {
            if (!graph.removeEdge(edge)) {
                throw new GenesisCoreException("Edge not found",
                        LogMessageKeys.EDGE_FROM, edge.getFrom(),
                        LogMessageKeys.EDGE_TO, edge.getTo(),
                        LogMessageKeys.EDGE_TYPE, edge.getEdgeType());
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return edge.equals(((EdgeRemoved)o).edge);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), edge);
        }

        @Override
        public String toString() {
            return "EdgeRemoved(" + edge + ")";
        }
    }
}
