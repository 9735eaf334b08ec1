/*
 * ContentHashesTest.java
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

import com.capsule.genesis.core.GenesisConfiguration;
import com.capsule.genesis.core.serialization.GenesisTupleCodec;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static com.capsule.genesis.core.expressions.Expressions.intLiteral;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Tests for {@link ContentHashes}.
 */
public class ContentHashesTest {
    private static final GraphNode NODE = new GraphNode("n", "r", intLiteral(1), NodeMetadata.EMPTY);

    @Test
    public void nodeHashIsDomainSeparatedSha256() {
        String expected = Hashing.sha256().newHasher()
                .putString("GlyphV1:Node:", StandardCharsets.UTF_8)
                .putBytes(GenesisTupleCodec.nodeToBytes(NODE))
                .hash()
                .toString();
        assertEquals(expected, ContentHashes.DEFAULT.nodeHash(NODE));
    }

    @Test
    public void prefixesSeparateHashKinds() {
        assertNotEquals(ContentHashes.DEFAULT.nodeHash(NODE.withRootRef("")), ContentHashes.DEFAULT.rootHash(NODE));
        assertNotEquals(ContentHashes.DEFAULT.nodeHash(NODE), new ContentHashes("Other").nodeHash(NODE));
    }

    @Test
    public void rootHashIgnoresRootReference() {
        assertEquals(ContentHashes.DEFAULT.rootHash(NODE), ContentHashes.DEFAULT.rootHash(NODE.withRootRef("anything")));
    }

    @Test
    public void graphHashMatchesCanonicalBytes() {
        byte[] bytes = GenesisTupleCodec.encodeGraph("r", ImmutableMap.of("h", NODE), ImmutableList.of()).pack();
        assertEquals(ContentHashes.DEFAULT.graphHash(bytes),
                ContentHashes.DEFAULT.graphHash("r", ImmutableMap.of("h", NODE), ImmutableList.of()));
    }

    @Test
    public void defaultDomainIsShared() {
        assertSame(ContentHashes.DEFAULT, ContentHashes.forConfiguration(GenesisConfiguration.DEFAULT));
    }
}
