/*
 * ProquintTest.java
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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Proquint}.
 */
public class ProquintTest {
    @Test
    public void localhost() {
        assertEquals("lusab-babad", Proquint.encode(0x7F000001));
        assertEquals(0x7F000001, Proquint.decode("lusab-babad"));
    }

    @Test
    public void extremes() {
        assertEquals("babab-babab", Proquint.encode(0));
        assertEquals("zuzuz-zuzuz", Proquint.encode(-1));
        assertEquals(-1, Proquint.decode("zuzuz-zuzuz"));
    }

    @Test
    public void everyHalfWordSurvives() {
        for (int i = 0; i < 0x10000; i += 7) {
            int value = (i << 16) | (0xFFFF - i);
            assertEquals(value, Proquint.decode(Proquint.encode(value)));
        }
    }

    @Test
    public void malformed() {
        assertThrows(IllegalArgumentException.class, () -> Proquint.decode("lusab"));
        assertThrows(IllegalArgumentException.class, () -> Proquint.decode("lusab_babad"));
        assertThrows(IllegalArgumentException.class, () -> Proquint.decode("lusab-babax"));
        assertThrows(IllegalArgumentException.class, () -> Proquint.decode("lesab-babad"));
    }
}
