/*
 * Sizing.java
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

package org.stricttypes.ast;

import org.stricttypes.StrictTypesArgumentException;
import org.stricttypes.annotation.API;
import org.stricttypes.logging.LogMessageKeys;

/**
 * Bounds on the number of elements of a list, set or map. Both bounds are unsigned 16-bit values.
 */
@API(API.Status.STABLE)
public final class Sizing {
    public static final int MAX = 0xFFFF;

    public static final Sizing U8 = new Sizing(0, 0xFF);
    public static final Sizing U16 = new Sizing(0, MAX);
    public static final Sizing U8_NONEMPTY = new Sizing(1, 0xFF);
    public static final Sizing U16_NONEMPTY = new Sizing(1, MAX);

    private final int min;
    private final int max;

    private Sizing(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public static Sizing of(int min, int max) {
        if (min < 0 || max > MAX || min > max) {
            throw new StrictTypesArgumentException("invalid sizing",
                    "min", min,
                    "max", max,
                    LogMessageKeys.LIMIT, MAX);
        }
        return new Sizing(min, max);
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Sizing sizing = (Sizing)o;
        return min == sizing.min && max == sizing.max;
    }

    @Override
    public int hashCode() {
        return min * 31 + max;
    }

    /**
     * Render as a suffix of a collection expression: nothing for the full {@code 0..0xFFFF} range,
     * {@code " ^ min.."} when only the lower bound is set and {@code " ^ min..0xMAX"} otherwise.
     *
     * @return the sizing suffix
     */
    @Override
    public String toString() {
        if (max == MAX) {
            return min == 0 ? "" : " ^ " + min + "..";
        }
        return String.format(" ^ %d..0x%02x", min, max);
    }
}
