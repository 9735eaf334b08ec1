/*
 * LoggableExceptionTest.java
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

package com.capsule.genesis.util;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link LoggableException}.
 */
public class LoggableExceptionTest {
    private enum Keys {
        NODE_HASH
    }

    @Test
    public void emptyLogInfo() {
        LoggableException e = new LoggableException("nothing attached");
        assertEquals(Collections.emptyMap(), e.getLogInfo());
        assertEquals(0, e.exportLogInfo().length);
        assertEquals("nothing attached", e.getMessageWithLogInfo());
    }

    @Test
    public void logInfoKeepsInsertionOrder() {
        LoggableException e = new LoggableException("edge rejected", "to", "b", "from", "a")
                .addLogInfo("edge_type", "Dependency");
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("to", "b");
        expected.put("from", "a");
        expected.put("edge_type", "Dependency");
        assertEquals(expected, e.getLogInfo());
        assertArrayEquals(new Object[]{"to", "b", "from", "a", "edge_type", "Dependency"}, e.exportLogInfo());
        assertEquals("edge rejected to=b from=a edge_type=Dependency", e.getMessageWithLogInfo());
    }

    @Test
    public void enumKeysAreStringified() {
        LoggableException e = new LoggableException("missing").addLogInfo(Keys.NODE_HASH, "abc");
        assertNotNull(e.getLogInfo());
        assertEquals(Collections.singletonMap("NODE_HASH", "abc"), e.getLogInfo());
    }

    @Test
    public void oddLogInfoValues() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd", "k1", "v1", "k2"));
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd in call").addLogInfo("k1", "v1", "k2"));
    }
}
