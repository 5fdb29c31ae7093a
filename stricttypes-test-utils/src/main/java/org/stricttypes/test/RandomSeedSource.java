/*
 * RandomSeedSource.java
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

package org.stricttypes.test;

import org.junit.jupiter.params.provider.ArgumentsSource;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Provides random seeds ({@code long}) to {@link org.junit.jupiter.params.ParameterizedTest} tests.
 * The seed is part of the test display name, so a failing randomized case can be replayed by adding
 * its seed to {@link #value()}.
 */
@Target({ElementType.ANNOTATION_TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@ArgumentsSource(RandomSeedProvider.class)
public @interface RandomSeedSource {
    /**
     * Fixed seeds to run in addition to the generated ones.
     * @return the seeds to be used for the test
     */
    long[] value() default {};

    /**
     * Number of freshly generated seeds. Set the {@code tests.randomSeeds} system property to override
     * it for a longer soak run.
     * @return the number of generated seeds
     */
    int count() default 4;
}
