/*
 * API.java
 *
 * This source file is part of the Strict Types open source project
 *
 * Copyright 2024 the Strict Types project authors
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

package org.stricttypes.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the stability of a public type, field, constructor or method of the strict types libraries.
 *
 * <p>
 * Members of an annotated type inherit the status of the type unless they carry their own annotation.
 * A status may only move towards {@link Status#STABLE} within a minor release. Anything that affects
 * the canonical encoding or the identity tags is {@link Status#STABLE} by definition, since changing it
 * changes every id ever computed.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the API element.
     * @return the stability status of the annotated element
     */
    Status value();

    /**
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Public only so that another package of the strict types libraries can reach it. Not for
         * external callers; may change in any release.
         */
        INTERNAL,

        /**
         * Work in progress. May change or disappear without a version bump.
         */
        EXPERIMENTAL,

        /**
         * May change with the next minor release.
         */
        UNSTABLE,

        /**
         * Changes only with the next major release.
         */
        MAINTAINED,

        /**
         * Part of the data format. Never changes in an incompatible way.
         */
        STABLE
    }
}
