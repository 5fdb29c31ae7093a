/*
 * LoggableExceptionTest.java
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

package org.stricttypes.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link LoggableException}.
 */
public class LoggableExceptionTest {
    private enum Key {
        LIB_NAME
    }

    @Test
    public void emptyLogInfo() {
        LoggableException e = new LoggableException("this has no k/v pairs");
        assertEquals(Collections.emptyMap(), e.getLogInfo());
        Object[] logInfoArray = e.exportLogInfo();
        assertNotNull(logInfoArray);
        assertEquals(0, logInfoArray.length);
    }

    @Test
    public void oneLogInfo() {
        LoggableException e = new LoggableException("this has one k/v pair")
                .addLogInfo("key", "value");
        assertEquals(Collections.singletonMap("key", "value"), e.getLogInfo());
        assertArrayEquals(new Object[]{"key", "value"}, e.exportLogInfo());
    }

    @Test
    public void logInfoKeepsInsertionOrder() {
        LoggableException e = new LoggableException("ordered", "k2", "v2", "k0", "v0", "k1", "v1");
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("k2", "v2");
        expected.put("k0", "v0");
        expected.put("k1", "v1");
        assertEquals(expected, e.getLogInfo());
        assertThat(Arrays.asList(e.exportLogInfo()), contains("k2", "v2", "k0", "v0", "k1", "v1"));
    }

    @Test
    public void enumKeysAreStringified() {
        LoggableException e = new LoggableException("enum key", Key.LIB_NAME, "Std");
        assertEquals(Collections.singletonMap("LIB_NAME", "Std"), e.getLogInfo());
    }

    @Test
    public void overwrittenKeyKeepsPosition() {
        LoggableException e = new LoggableException("overwrite", "a", 1, "b", 2).addLogInfo("a", 3);
        assertArrayEquals(new Object[]{"a", 3, "b", 2}, e.exportLogInfo());
    }

    @Test
    public void oddLogInfoValues() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd number of log info!", "k1", "v1", "k2"));
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd in call!").addLogInfo("k1", "v1", "k2"));
    }
}
