/*
 * StrictTypesConfig.java
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

package org.stricttypes;

import org.stricttypes.annotation.API;
import org.stricttypes.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Properties;

/**
 * Limits applied while assembling type systems. A configuration can only tighten the format's hard limits:
 * both the number of types and the size of the canonical encoding of a type system must stay below
 * {@value #HARD_LIMIT}.
 *
 * <p>
 * Instances are immutable; use {@link #newBuilder()} or {@link #toBuilder()} to derive a new one.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class StrictTypesConfig {
    /**
     * The largest number of types, and of bytes of canonical encoding, that any type system may hold.
     */
    public static final int HARD_LIMIT = (1 << 24) - 1;

    public static final String MAX_TYPES_PROPERTY = "stricttypes.typesys.max_types";
    public static final String MAX_SERIALIZED_SIZE_PROPERTY = "stricttypes.typesys.max_serialized_size";

    private static final StrictTypesConfig DEFAULT = newBuilder().build();

    private final int maxTypes;
    private final int maxSerializedSize;

    private StrictTypesConfig(@Nonnull Builder builder) {
        this.maxTypes = builder.maxTypes;
        this.maxSerializedSize = builder.maxSerializedSize;
    }

    /**
     * Get the configuration that applies the format's hard limits and nothing stricter.
     *
     * @return the default configuration
     */
    @Nonnull
    public static StrictTypesConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Get the maximum number of types a type system may contain.
     *
     * @return the maximum type count
     */
    public int getMaxTypes() {
        return maxTypes;
    }

    /**
     * Get the maximum size in bytes of the canonical encoding of a type system's members.
     *
     * @return the maximum serialized size
     */
    public int getMaxSerializedSize() {
        return maxSerializedSize;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Read a configuration from properties. Missing properties keep the default value.
     *
     * @param properties the properties to read
     * @return a configuration
     * @throws StrictTypesArgumentException if a property is not a number or exceeds the hard limit
     */
    @Nonnull
    public static StrictTypesConfig fromProperties(@Nonnull Properties properties) {
        final Builder builder = newBuilder();
        final String maxTypes = properties.getProperty(MAX_TYPES_PROPERTY);
        if (maxTypes != null) {
            builder.setMaxTypes(parseLimit(MAX_TYPES_PROPERTY, maxTypes));
        }
        final String maxSize = properties.getProperty(MAX_SERIALIZED_SIZE_PROPERTY);
        if (maxSize != null) {
            builder.setMaxSerializedSize(parseLimit(MAX_SERIALIZED_SIZE_PROPERTY, maxSize));
        }
        return builder.build();
    }

    @Nonnull
    public static StrictTypesConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static int parseLimit(@Nonnull String property, @Nonnull String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new StrictTypesArgumentException("configuration property is not a number", e)
                    .addLogInfo("property", property)
                    .addLogInfo(LogMessageKeys.ACTUAL.toString(), value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final StrictTypesConfig that = (StrictTypesConfig)o;
        return maxTypes == that.maxTypes && maxSerializedSize == that.maxSerializedSize;
    }

    @Override
    public int hashCode() {
        return 31 * maxTypes + maxSerializedSize;
    }

    @Override
    public String toString() {
        return "StrictTypesConfig{maxTypes=" + maxTypes + ", maxSerializedSize=" + maxSerializedSize + "}";
    }

    /**
     * A builder of {@link StrictTypesConfig}s.
     */
    public static class Builder {
        private int maxTypes = HARD_LIMIT;
        private int maxSerializedSize = HARD_LIMIT;

        private Builder() {
        }

        private Builder(@Nonnull StrictTypesConfig config) {
            this.maxTypes = config.maxTypes;
            this.maxSerializedSize = config.maxSerializedSize;
        }

        /**
         * Set the maximum number of types. The value must be positive and at most {@value #HARD_LIMIT}.
         *
         * @param maxTypes the maximum number of types
         * @return this builder
         */
        @Nonnull
        public Builder setMaxTypes(int maxTypes) {
            this.maxTypes = checkLimit(MAX_TYPES_PROPERTY, maxTypes);
            return this;
        }

        /**
         * Set the maximum size of the canonical encoding. The value must be positive and at most
         * {@value #HARD_LIMIT}.
         *
         * @param maxSerializedSize the maximum size in bytes
         * @return this builder
         */
        @Nonnull
        public Builder setMaxSerializedSize(int maxSerializedSize) {
            this.maxSerializedSize = checkLimit(MAX_SERIALIZED_SIZE_PROPERTY, maxSerializedSize);
            return this;
        }

        @Nonnull
        public StrictTypesConfig build() {
            return new StrictTypesConfig(this);
        }

        private static int checkLimit(@Nonnull String property, int value) {
            if (value <= 0 || value > HARD_LIMIT) {
                throw new StrictTypesArgumentException("limit must be positive and must not exceed the hard limit",
                        "property", property,
                        LogMessageKeys.ACTUAL, value,
                        LogMessageKeys.LIMIT, HARD_LIMIT);
            }
            return value;
        }
    }
}
