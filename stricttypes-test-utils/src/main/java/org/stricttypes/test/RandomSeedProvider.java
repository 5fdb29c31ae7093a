/*
 * RandomSeedProvider.java
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

import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.support.AnnotationConsumer;

import java.util.Arrays;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Backs {@link RandomSeedSource}: the fixed seeds first, then {@code count} random ones.
 */
public class RandomSeedProvider implements ArgumentsProvider, AnnotationConsumer<RandomSeedSource> {
    private static final String SEED_COUNT_PROPERTY = "tests.randomSeeds";

    private long[] fixedSeeds = new long[0];
    private int count;

    @Override
    public void accept(RandomSeedSource source) {
        fixedSeeds = Arrays.copyOf(source.value(), source.value().length);
        count = Integer.getInteger(SEED_COUNT_PROPERTY, source.count());
    }

    @Override
    public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
        final LongStream generated = ThreadLocalRandom.current().longs(Math.max(count, 0));
        final LongStream seeds = fixedSeeds.length == 0 && count <= 0
                                 ? LongStream.of(0xdeadc0deL)
                                 : LongStream.concat(Arrays.stream(fixedSeeds), generated);
        return seeds.mapToObj(Arguments::of);
    }
}
