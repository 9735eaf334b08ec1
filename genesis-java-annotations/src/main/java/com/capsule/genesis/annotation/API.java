/*
 * API.java
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

package com.capsule.genesis.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a public type, constructor, method or field of the Genesis graph core with the stability its callers can
 * rely on.
 *
 * <p>
 * Members inherit the status of their enclosing type unless they carry their own {@code API} annotation. Only the
 * operations marked {@link Status#STABLE} form the collaborator surface that signing, render, audio and physics
 * producers are allowed to call. A status may be raised at any time; it may only be lowered as described on each
 * {@link Status} constant.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, least stable first.
     */
    enum Status {
        /**
         * Public only so that another package of the graph core can reach it. May change without notice.
         */
        INTERNAL,

        /**
         * Scheduled for removal in the next minor release.
         */
        DEPRECATED,

        /**
         * New functionality whose shape has not settled, such as fixed-point rewriting. May change or disappear
         * without a version change.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release, but not before it.
         */
        UNSTABLE,

        /**
         * Part of the collaborator surface. Shall not change incompatibly before the next major release.
         */
        STABLE
    }
}
