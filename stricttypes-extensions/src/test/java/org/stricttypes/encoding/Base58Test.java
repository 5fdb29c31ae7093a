/*
 * Base58Test.java
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

package org.stricttypes.encoding;

import com.google.common.io.BaseEncoding;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Base58}.
 */
public class Base58Test {

    @ParameterizedTest
    @CsvSource({
            "61, 2g",
            "626262, a3gV",
            "636363, aPEr",
            "00000000000000000000, 1111111111",
            "0000287fb4cd, 11233QC4",
    })
    public void knownVectors(String hex, String encoded) {
        byte[] bytes = BaseEncoding.base16().lowerCase().decode(hex);
        assertEquals(encoded, Base58.encode(bytes));
        assertArrayEquals(bytes, Base58.decode(encoded));
    }

    @Test
    public void helloWorld() {
        assertEquals("2NEpo7TZRRrLZSi2U", Base58.encode("Hello World!".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    public void empty() {
        assertEquals("", Base58.encode(new byte[0]));
        assertEquals(0, Base58.decode("").length);
    }

    @Test
    public void randomPayloadsSurvive() {
        Random random = new Random(0x5eed);
        for (int i = 0; i < 100; i++) {
            byte[] bytes = new byte[random.nextInt(40)];
            random.nextBytes(bytes);
            if (bytes.length > 0 && random.nextBoolean()) {
                bytes[0] = 0;
            }
            assertArrayEquals(bytes, Base58.decode(Base58.encode(bytes)));
        }
    }

    @Test
    public void rejectsCharactersOutsideOfAlphabet() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Base58.decode("abc0def"));
        assertThat(e.getMessage(), containsString("position 3"));
        assertThrows(IllegalArgumentException.class, () -> Base58.decode("abcIdef"));
        assertThrows(IllegalArgumentException.class, () -> Base58.decode("é"));
    }
}
