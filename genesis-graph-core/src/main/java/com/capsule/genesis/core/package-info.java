/*
 * package-info.java
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

/**
 * A content-addressed, tamper-evident graph store with transactional, rule-based rewriting of node contents.
 *
 * <p>
 * Node payloads are {@link com.capsule.genesis.core.expressions.Expression expressions} of a small lambda calculus.
 * They live in a {@link com.capsule.genesis.core.graph.GenesisGraph} keyed by content hash. A
 * {@link com.capsule.genesis.core.rewrite.Transaction} rewrites them with a
 * {@link com.capsule.genesis.core.rewrite.RuleSet}, using the
 * {@link com.capsule.genesis.core.patterns.PatternMatcher pattern matcher} and the capture-avoiding
 * {@link com.capsule.genesis.core.substitution.Substitution substitution engine}.
 * </p>
 *
 * <p>
 * All failures are subclasses of {@link com.capsule.genesis.core.GenesisCoreException}.
 * </p>
 */
package com.capsule.genesis.core;
