/*
 * KeyValueLogMessageTest.java
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

package org.stricttypes.logging;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link KeyValueLogMessage}.
 */
public class KeyValueLogMessageTest {

    @Test
    public void keysAreSorted() {
        assertEquals("compiled lib_name=\"Std\" type_count=\"7\"",
                KeyValueLogMessage.of("compiled", LogMessageKeys.TYPE_COUNT, 7, LogMessageKeys.LIB_NAME, "Std"));
    }

    @Test
    public void valuesAreSanitized() {
        final KeyValueLogMessage message = KeyValueLogMessage.build("msg", "a=b", "say \"hi\"").addKeyAndValue("c", null);
        assertEquals("say 'hi'", message.getKeyValueMap().get("ab"));
        assertEquals("null", message.getKeyValueMap().get("c"));
    }

    @Test
    public void longByteArraysAreTruncated() {
        final byte[] bytes = new byte[KeyValueLogMessage.MAX_LOGGED_BYTES * 2];
        Arrays.fill(bytes, (byte)'x');
        final String rendered = KeyValueLogMessage.build("data", LogMessageKeys.RAW_BYTES, bytes)
                .getKeyValueMap().get(LogMessageKeys.RAW_BYTES.toString());
        assertEquals(KeyValueLogMessage.MAX_LOGGED_BYTES + 3, rendered.length());
        assertThat(rendered, endsWith("..."));
    }

    @Test
    public void unbalancedKeysAndValues() {
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("msg", LogMessageKeys.SEM_ID));
    }
}
