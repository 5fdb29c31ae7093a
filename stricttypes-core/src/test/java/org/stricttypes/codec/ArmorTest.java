/*
 * ArmorTest.java
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

package org.stricttypes.codec;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Armor}.
 */
public class ArmorTest {
    private static final String TITLE = "TEST DATA";

    @Test
    public void roundTrip() {
        final byte[] data = new byte[500];
        new Random(7).nextBytes(data);
        final String text = Armor.armor(TITLE, "some-id", data);
        for (String line : text.split("\n")) {
            assertTrue(line.length() <= Armor.LINE_WIDTH, line);
        }
        final Armor.Armored armored = Armor.unarmor(TITLE, text);
        assertEquals("some-id", armored.getId());
        assertArrayEquals(data, armored.getData());
    }

    @Test
    public void toleratesSurroundingWhitespace() {
        final String text = "\n  " + Armor.armor(TITLE, "id", new byte[] {1, 2, 3}) + "\n\n";
        assertArrayEquals(new byte[] {1, 2, 3}, Armor.unarmor(TITLE, text).getData());
    }

    @Test
    public void wrongTitle() {
        final String text = Armor.armor("OTHER", "id", new byte[] {1});
        final DecodeException e = assertThrows(DecodeException.class, () -> Armor.unarmor(TITLE, text));
        assertThat(e.getMessage(), containsString("begin marker"));
    }

    @Test
    public void missingId() {
        final String text = Armor.armor(TITLE, "id", new byte[] {1}).replace("Id: id\n", "");
        assertThrows(DecodeException.class, () -> Armor.unarmor(TITLE, text));
    }

    @Test
    public void invalidPayload() {
        final String text = "-----BEGIN " + TITLE + "-----\nId: x\n\n!!!\n\n-----END " + TITLE + "-----\n";
        assertThrows(DecodeException.class, () -> Armor.unarmor(TITLE, text));
    }
}
