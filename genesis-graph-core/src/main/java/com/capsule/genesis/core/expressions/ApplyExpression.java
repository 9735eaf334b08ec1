/*
 * ApplyExpression.java
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

package com.capsule.genesis.core.expressions;

import com.capsule.genesis.annotation.API;

import javax.annotation.Nonnull;

/**
 * Application of a function to an argument, {@code (func arg)}. Multi-argument calls are curried into a
 * left-nested chain of applications.
 */
@API(API.Status.STABLE)
public final class ApplyExpression extends ApplicationExpression {
    public ApplyExpression(@Nonnull Expression function, @Nonnull Expression argument) {
        super(function, argument);
    }

    @Override
    public boolean isLinear() {
        return false;
    }

    @Nonnull
    @Override
    public ApplyExpression withChildren(@Nonnull Expression newFunction, @Nonnull Expression newArgument) {
        return new ApplyExpression(newFunction, newArgument);
    }

    @Override
    public String toString() {
        return "(" + getFunction() + " " + getArgument() + ")";
    }
}
