/*
 * NodeMetadata.java
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
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Bookkeeping attached to a {@link GraphNode}. The timestamp is a logical clock bumped on every rewrite of the node.
 */
@API(API.Status.STABLE)
public final class NodeMetadata {
    @Nonnull
    public static final NodeMetadata EMPTY = new NodeMetadata(0L, 0, ImmutableList.of());

    private final long timestamp;
    private final int lineageDepth;
    @Nonnull
    private final List<String> tags;

    public NodeMetadata(long timestamp, int lineageDepth, @Nonnull List<String> tags) {
        Preconditions.checkArgument(timestamp >= 0, "timestamp must not be negative");
        Preconditions.checkArgument(lineageDepth >= 0, "lineage depth must not be negative");
        this.timestamp = timestamp;
        this.lineageDepth = lineageDepth;
        this.tags = ImmutableList.copyOf(tags);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public int getLineageDepth() {
        return lineageDepth;
    }

    @Nonnull
    public List<String> getTags() {
        return tags;
    }

    @Nonnull
    public NodeMetadata withTimestamp(long newTimestamp) {
        return new NodeMetadata(newTimestamp, lineageDepth, tags);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NodeMetadata that = (NodeMetadata)o;
        return timestamp == that.timestamp && lineageDepth == that.lineageDepth && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, lineageDepth, tags);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("timestamp", timestamp)
                .add("lineageDepth", lineageDepth)
                .add("tags", tags)
                .toString();
    }
}
