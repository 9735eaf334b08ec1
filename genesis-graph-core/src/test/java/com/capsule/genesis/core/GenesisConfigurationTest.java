/*
 * GenesisConfigurationTest.java
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

package com.capsule.genesis.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link GenesisConfiguration}.
 */
public class GenesisConfigurationTest {

    @Test
    public void defaults() {
        assertEquals("GlyphV1", GenesisConfiguration.DEFAULT.getHashDomain());
        assertEquals(64, GenesisConfiguration.DEFAULT.getMaxRewritePasses());
        assertEquals(GenesisConfiguration.DEFAULT, GenesisConfiguration.builder().build());
    }

    @Test
    public void toBuilderCopies() {
        GenesisConfiguration custom = GenesisConfiguration.DEFAULT.toBuilder().setMaxRewritePasses(5).build();
        assertEquals(5, custom.getMaxRewritePasses());
        assertEquals("GlyphV1", custom.getHashDomain());
        assertNotEquals(GenesisConfiguration.DEFAULT, custom);
        assertEquals(custom, custom.toBuilder().build());
    }

    @Test
    public void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> GenesisConfiguration.builder().setMaxRewritePasses(0));
        assertThrows(IllegalArgumentException.class, () -> GenesisConfiguration.builder().setHashDomain(""));
        assertThrows(IllegalArgumentException.class, () -> GenesisConfiguration.builder().setHashDomain("a:b"));
    }
}
