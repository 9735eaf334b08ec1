/*
 * GraphNode.java
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
import com.capsule.genesis.core.expressions.Expression;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A node of a {@link GenesisGraph}: an identifier, the hash of the graph root it belongs to, an {@link Expression}
 * payload and {@link NodeMetadata}. Nodes are immutable; the rewrite engine replaces whole nodes.
 */
@API(API.Status.STABLE)
public final class GraphNode {
    @Nonnull
    private final String id;
    @Nonnull
    private final String rootRef;
    @Nonnull
    private final Expression data;
    @Nonnull
    private final NodeMetadata metadata;

    public GraphNode(@Nonnull String id, @Nonnull String rootRef, @Nonnull Expression data, @Nonnull NodeMetadata metadata) {
        Preconditions.checkArgument(!id.isEmpty(), "node id must not be empty");
        this.id = id;
        this.rootRef = Objects.requireNonNull(rootRef);
        this.data = Objects.requireNonNull(data);
        this.metadata = Objects.requireNonNull(metadata);
    }

    @Nonnull
    public String getId() {
        return id;
    }

    /**
     * Get the hash of the root node this node hangs off. For the root node itself this is its own hash.
     * @return the root reference
     */
    @Nonnull
    public String getRootRef() {
        return rootRef;
    }

    @Nonnull
    public Expression getData() {
        return data;
    }

    @Nonnull
    public NodeMetadata getMetadata() {
        return metadata;
    }

    @Nonnull
    public GraphNode withRootRef(@Nonnull String newRootRef) {
        return new GraphNode(id, newRootRef, data, metadata);
    }

    @Nonnull
    public GraphNode withData(@Nonnull Expression newData) {
        return new GraphNode(id, rootRef, newData, metadata);
    }

    @Nonnull
    public GraphNode withMetadata(@Nonnull NodeMetadata newMetadata) {
        return new GraphNode(id, rootRef, data, newMetadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GraphNode graphNode = (GraphNode)o;
        return id.equals(graphNode.id) && rootRef.equals(graphNode.rootRef)
               && data.equals(graphNode.data) && metadata.equals(graphNode.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, rootRef, data, metadata);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("rootRef", rootRef)
                .add("data", data)
                .add("metadata", metadata)
                .toString();
    }
}
