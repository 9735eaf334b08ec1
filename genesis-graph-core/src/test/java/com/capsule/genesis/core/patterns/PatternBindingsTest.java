/*
 * PatternBindingsTest.java
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

package com.capsule.genesis.core.patterns;

import com.capsule.genesis.core.GenesisCoreException;
import com.capsule.genesis.core.expressions.Expressions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PatternBindings}.
 */
public class PatternBindingsTest {

    @Test
    public void namesAreSorted() {
        PatternBindings bindings = PatternBindings.newBuilder()
                .set("z", Expressions.intLiteral(1))
                .set("a", Expressions.intLiteral(2))
                .set("m", Expressions.intLiteral(3))
                .build();
        assertEquals(ImmutableList.of("a", "m", "z"), ImmutableList.copyOf(bindings.asMap().keySet()));
        assertTrue(bindings.containsBinding("m"));
        assertFalse(bindings.containsBinding("b"));
        assertEquals(3, bindings.size());
    }

    @Test
    public void duplicateSetIsRejected() {
        PatternBindings.Builder builder = PatternBindings.newBuilder().set("x", Expressions.var("a"));
        assertThrows(GenesisCoreException.class, () -> builder.set("x", Expressions.var("a")));
    }

    @Test
    public void bindOrCheckRequiresEqualValues() {
        PatternBindings.Builder builder = PatternBindings.newBuilder();
        assertTrue(builder.bindOrCheck("x", Expressions.var("a")));
        assertTrue(builder.bindOrCheck("x", Expressions.var("a")));
        assertFalse(builder.bindOrCheck("x", Expressions.var("b")));
        assertEquals(PatternBindings.of(ImmutableMap.of("x", Expressions.var("a"))), builder.build());
        assertThrows(GenesisCoreException.class, () -> builder.bindOrCheck("y", Expressions.var("c")));
    }

    @Test
    public void missingBinding() {
        GenesisCoreException e = assertThrows(GenesisCoreException.class, () -> PatternBindings.EMPTY.get("nope"));
        assertEquals("nope", e.getLogInfo().get("variable"));
        assertTrue(PatternBindings.EMPTY.isEmpty());
    }
}
