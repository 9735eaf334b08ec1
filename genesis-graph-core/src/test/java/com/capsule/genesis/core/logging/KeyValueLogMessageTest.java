/*
 * KeyValueLogMessageTest.java
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

package com.capsule.genesis.core.logging;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link KeyValueLogMessage}.
 */
public class KeyValueLogMessageTest {

    @Test
    public void keysAreSortedAndQuoted() {
        String message = KeyValueLogMessage.of("linked nodes",
                LogMessageKeys.EDGE_TO, "b",
                LogMessageKeys.EDGE_FROM, "a",
                LogMessageKeys.EDGE_TYPE, "DEPENDENCY");
        assertThat(message, equalTo("linked nodes edge_type=\"DEPENDENCY\" from=\"a\" to=\"b\""));
    }

    @Test
    public void sanitizesKeysAndValues() {
        KeyValueLogMessage message = KeyValueLogMessage.build("odd")
                .addKeyAndValue("a=b", "say \"hi\"");
        assertThat(message.getKeyValueMap(), hasEntry("ab", "say 'hi'"));
        assertThat(message.getStaticMessage(), equalTo("odd"));
    }

    @Test
    public void addsMapEntries() {
        KeyValueLogMessage message = KeyValueLogMessage.build("failed")
                .addKeysAndValues(ImmutableMap.of("node_hash", "abc", "expected", 1));
        assertThat(message.toString(), equalTo("failed expected=\"1\" node_hash=\"abc\""));
    }

    @Test
    public void nullValuesArePrinted() {
        assertThat(KeyValueLogMessage.of("m", LogMessageKeys.TITLE, null), equalTo("m ttl=\"null\""));
    }

    @Test
    public void rejectsUnpairedKeys() {
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("m", LogMessageKeys.TITLE));
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("m", null, "v"));
    }
}
