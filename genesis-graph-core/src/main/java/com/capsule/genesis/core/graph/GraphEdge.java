/*
 * GraphEdge.java
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

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.Objects;

/**
 * A typed directed edge between two node hashes. Edges order by {@code (from, to, edgeType)}, which is the order
 * they take in the canonical graph encoding.
 */
@API(API.Status.STABLE)
public final class GraphEdge implements Comparable<GraphEdge> {
    private static final Comparator<GraphEdge> CANONICAL_ORDER = Comparator.comparing(GraphEdge::getFrom)
            .thenComparing(GraphEdge::getTo)
            .thenComparing(GraphEdge::getEdgeType);

    @Nonnull
    private final String from;
    @Nonnull
    private final String to;
    @Nonnull
    private final EdgeType edgeType;

    public GraphEdge(@Nonnull String from, @Nonnull String to, @Nonnull EdgeType edgeType) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
        this.edgeType = Objects.requireNonNull(edgeType);
    }

    @Nonnull
    public String getFrom() {
        return from;
    }

    @Nonnull
    public String getTo() {
        return to;
    }

    @Nonnull
    public EdgeType getEdgeType() {
        return edgeType;
    }

    public boolean touches(@Nonnull String nodeHash) {
        return from.equals(nodeHash) || to.equals(nodeHash);
    }

    @Override
    public int compareTo(@Nonnull GraphEdge other) {
        return CANONICAL_ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GraphEdge graphEdge = (GraphEdge)o;
        return from.equals(graphEdge.from) && to.equals(graphEdge.to) && edgeType == graphEdge.edgeType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, edgeType);
    }

    @Override
    public String toString() {
        return from + " -[" + edgeType + "]-> " + to;
    }
}
