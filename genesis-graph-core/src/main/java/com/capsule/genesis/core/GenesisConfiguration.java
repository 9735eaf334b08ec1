/*
 * GenesisConfiguration.java
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

import com.capsule.genesis.annotation.API;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Settings shared by a {@link com.capsule.genesis.core.graph.GenesisGraph} and every transaction opened against it.
 */
@API(API.Status.UNSTABLE)
public class GenesisConfiguration {
    @Nonnull
    public static final String DEFAULT_HASH_DOMAIN = "GlyphV1";
    public static final int DEFAULT_MAX_REWRITE_PASSES = 64;

    @Nonnull
    public static final GenesisConfiguration DEFAULT = builder().build();

    @Nonnull
    private final String hashDomain;
    private final int maxRewritePasses;

    private GenesisConfiguration(@Nonnull String hashDomain, int maxRewritePasses) {
        this.hashDomain = hashDomain;
        this.maxRewritePasses = maxRewritePasses;
    }

    /**
     * Version tag mixed into every domain-separation prefix. Graphs hashed under different domains never share
     * hashes.
     * @return the hash domain
     */
    @Nonnull
    public String getHashDomain() {
        return hashDomain;
    }

    /**
     * Upper bound on the number of passes fixed-point rewriting may take before it gives up.
     * @return the maximum number of rewrite passes
     */
    public int getMaxRewritePasses() {
        return maxRewritePasses;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GenesisConfiguration that = (GenesisConfiguration)o;
        return maxRewritePasses == that.maxRewritePasses && hashDomain.equals(that.hashDomain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hashDomain, maxRewritePasses);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("hashDomain", hashDomain)
                .add("maxRewritePasses", maxRewritePasses)
                .toString();
    }

    /**
     * A builder for {@link GenesisConfiguration}.
     */
    public static class Builder {
        @Nonnull
        private String hashDomain = DEFAULT_HASH_DOMAIN;
        private int maxRewritePasses = DEFAULT_MAX_REWRITE_PASSES;

        private Builder() {
        }

        private Builder(@Nonnull GenesisConfiguration configuration) {
            this.hashDomain = configuration.hashDomain;
            this.maxRewritePasses = configuration.maxRewritePasses;
        }

        @Nonnull
        public Builder setHashDomain(@Nonnull String hashDomain) {
            Preconditions.checkArgument(!hashDomain.isEmpty(), "hash domain must not be empty");
            Preconditions.checkArgument(hashDomain.indexOf(':') < 0, "hash domain must not contain ':'");
            this.hashDomain = hashDomain;
            return this;
        }

        @Nonnull
        public Builder setMaxRewritePasses(int maxRewritePasses) {
            Preconditions.checkArgument(maxRewritePasses > 0, "max rewrite passes must be positive");
            this.maxRewritePasses = maxRewritePasses;
            return this;
        }

        @Nonnull
        public GenesisConfiguration build() {
            return new GenesisConfiguration(hashDomain, maxRewritePasses);
        }
    }
}
