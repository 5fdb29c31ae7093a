/*
 * ByteArraysTest.java
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
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link ByteArrays}.
 */
public class ByteArraysTest {
    @Test
    public void printable() {
        assertEquals("abc", ByteArrays.loggable(new byte[]{'a', 'b', 'c'}));
        assertNull(ByteArrays.loggable(null));
    }

    @Test
    public void escapesLogSyntax() {
        assertEquals("a\\x3db\\x22\\\\\\x00\\xff", ByteArrays.loggable(new byte[]{'a', '=', 'b', '"', '\\', 0, (byte)0xFF}));
    }

    @Test
    public void prefix() {
        assertEquals("ab...", ByteArrays.loggablePrefix(new byte[]{'a', 'b', 'c'}, 2));
        assertEquals("abc", ByteArrays.loggablePrefix(new byte[]{'a', 'b', 'c'}, 3));
    }
}
