/*
 * RuleSet.java
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

package com.capsule.genesis.core.rewrite;

import com.capsule.genesis.annotation.API;
import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.patterns.PatternMatcher;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * A named, immutable, ordered collection of {@link RewriteRule}s. Rules are kept sorted by priority, highest
 * first, with ties broken by ascending id, so the order is the same however the rules were registered.
 */
@API(API.Status.STABLE)
public class RuleSet {
    private static final Comparator<RewriteRule> RULE_ORDER = Comparator.comparingInt(RewriteRule::getPriority).reversed()
            .thenComparing(RewriteRule::getId);

    @Nonnull
    private final String name;
    @Nonnull
    private final List<RewriteRule> rules;

    public RuleSet(@Nonnull String name) {
        this(name, ImmutableList.of());
    }

    public RuleSet(@Nonnull String name, @Nonnull Collection<RewriteRule> rules) {
        this.name = Objects.requireNonNull(name);
        List<RewriteRule> sorted = new ArrayList<>(rules);
        sorted.sort(RULE_ORDER);
        this.rules = ImmutableList.copyOf(sorted);
    }

    @Nonnull
    public static RuleSet of(@Nonnull String name, @Nonnull RewriteRule... rules) {
        return new RuleSet(name, Arrays.asList(rules));
    }

    /**
     * Create a rule set with one more rule.
     * @param rule the rule to add
     * @return a new rule set
     */
    @Nonnull
    public RuleSet addRule(@Nonnull RewriteRule rule) {
        return addRules(ImmutableList.of(rule));
    }

    @Nonnull
    public RuleSet addRules(@Nonnull Collection<RewriteRule> moreRules) {
        return new RuleSet(name, ImmutableList.<RewriteRule>builder().addAll(rules).addAll(moreRules).build());
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Get the rules in application order.
     * @return the sorted rules
     */
    @Nonnull
    public List<RewriteRule> getRules() {
        return rules;
    }

    /**
     * Get the rules whose pattern matches the given expression, in application order. Conditions are not checked.
     * @param expression the expression
     * @return an iterator over the matching rules
     */
    @Nonnull
    public Iterator<RewriteRule> getRulesMatching(@Nonnull Expression expression) {
        return rules.stream().filter(rule -> PatternMatcher.matches(expression, rule.getPattern())).iterator();
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RuleSet ruleSet = (RuleSet)o;
        return name.equals(ruleSet.name) && rules.equals(ruleSet.rules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, rules);
    }

    @Override
    public String toString() {
        return "RuleSet(" + name + ", " + rules.size() + " rules)";
    }
}
