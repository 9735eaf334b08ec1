/*
 * ContentHashes.java
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
import com.capsule.genesis.core.serialization.GenesisTupleCodec;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Domain-separated SHA-256 content hashes, rendered as lowercase hex.
 *
 * <p>
 * A hash is {@code sha256(prefix || canonicalBytes)} where the prefix is {@code <domain>:Node:},
 * {@code <domain>:Root:} or {@code <domain>:Graph:}. Distinct prefixes keep a node hash from ever being mistaken for
 * a root or graph hash of the same bytes.
 * </p>
 */
@API(API.Status.STABLE)
public class ContentHashes {
    public static final ContentHashes DEFAULT = new ContentHashes(GenesisConfiguration.DEFAULT_HASH_DOMAIN);

    private static final HashFunction SHA_256 = Hashing.sha256();

    @Nonnull
    private final String nodePrefix;
    @Nonnull
    private final String rootPrefix;
    @Nonnull
    private final String graphPrefix;

    public ContentHashes(@Nonnull String hashDomain) {
        this.nodePrefix = hashDomain + ":Node:";
        this.rootPrefix = hashDomain + ":Root:";
        this.graphPrefix = hashDomain + ":Graph:";
    }

    @Nonnull
    public static ContentHashes forConfiguration(@Nonnull GenesisConfiguration configuration) {
        return GenesisConfiguration.DEFAULT_HASH_DOMAIN.equals(configuration.getHashDomain())
               ? DEFAULT
               : new ContentHashes(configuration.getHashDomain());
    }

    /**
     * Hash of a non-root node over its full canonical encoding.
     * @param node the node
     * @return the node hash
     */
    @Nonnull
    public String nodeHash(@Nonnull GraphNode node) {
        return hash(nodePrefix, GenesisTupleCodec.nodeToBytes(node));
    }

    /**
     * Hash of a root node. The root reference is blanked before encoding, so that a root can carry its own hash.
     * @param rootNode the root node
     * @return the root hash
     */
    @Nonnull
    public String rootHash(@Nonnull GraphNode rootNode) {
        return hash(rootPrefix, GenesisTupleCodec.nodeToBytes(rootNode.withRootRef("")));
    }

    /**
     * Hash of a whole graph state over its canonical encoding.
     * @param rootHash the root hash
     * @param nodes the nodes by hash
     * @param edges the edges
     * @return the graph hash
     */
    @Nonnull
    public String graphHash(@Nonnull String rootHash, @Nonnull Map<String, GraphNode> nodes, @Nonnull List<GraphEdge> edges) {
        return graphHash(GenesisTupleCodec.encodeGraph(rootHash, nodes, edges).pack());
    }

    @Nonnull
    public String graphHash(@Nonnull byte[] canonicalGraphBytes) {
        return hash(graphPrefix, canonicalGraphBytes);
    }

    @Nonnull
    private static String hash(@Nonnull String prefix, @Nonnull byte[] bytes) {
        return SHA_256.newHasher()
                .putString(prefix, StandardCharsets.UTF_8)
                .putBytes(bytes)
                .hash()
                .toString();
    }
}
