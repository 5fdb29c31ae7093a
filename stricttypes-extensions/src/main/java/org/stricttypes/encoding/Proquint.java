/*
 * Proquint.java
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

import org.stricttypes.annotation.API;

import javax.annotation.Nonnull;

/**
 * Pronounceable rendering of 32-bit values ("proquints"). Each 16-bit half becomes one five letter word of
 * alternating consonants and vowels, so {@code 0x7F000001} reads as {@code lusab-babad}. Used as a short,
 * human-checkable mnemonic next to base58 identifiers.
 */
@API(API.Status.STABLE)
public final class Proquint {
    private static final char[] CONSONANTS = "bdfghjklmnprstvz".toCharArray();
    private static final char[] VOWELS = "aiou".toCharArray();
    private static final char SEPARATOR = '-';
    private static final int WORD_LENGTH = 5;

    private Proquint() {
    }

    /**
     * Render a 32-bit value as two proquint words.
     *
     * @param value the value
     * @return the mnemonic, e.g. {@code lusab-babad}
     */
    @Nonnull
    public static String encode(int value) {
        final StringBuilder sb = new StringBuilder(2 * WORD_LENGTH + 1);
        appendWord(sb, (value >>> 16) & 0xFFFF);
        sb.append(SEPARATOR);
        appendWord(sb, value & 0xFFFF);
        return sb.toString();
    }

    /**
     * Parse two proquint words back into the 32-bit value.
     *
     * @param mnemonic the mnemonic
     * @return the value it encodes
     * @throws IllegalArgumentException if the text is not two well formed proquint words
     */
    public static int decode(@Nonnull String mnemonic) {
        if (mnemonic.length() != 2 * WORD_LENGTH + 1 || mnemonic.charAt(WORD_LENGTH) != SEPARATOR) {
            throw new IllegalArgumentException("mnemonic must consist of two five letter words: " + mnemonic);
        }
        return (parseWord(mnemonic, 0) << 16) | parseWord(mnemonic, WORD_LENGTH + 1);
    }

    private static void appendWord(@Nonnull StringBuilder sb, int word) {
        sb.append(CONSONANTS[(word >>> 12) & 0x0F]);
        sb.append(VOWELS[(word >>> 10) & 0x03]);
        sb.append(CONSONANTS[(word >>> 6) & 0x0F]);
        sb.append(VOWELS[(word >>> 4) & 0x03]);
        sb.append(CONSONANTS[word & 0x0F]);
    }

    private static int parseWord(@Nonnull String text, int offset) {
        int word = 0;
        for (int i = 0; i < WORD_LENGTH; i++) {
            final char c = text.charAt(offset + i);
            if (i % 2 == 0) {
                word = (word << 4) | indexOf(CONSONANTS, c, text);
            } else {
                word = (word << 2) | indexOf(VOWELS, c, text);
            }
        }
        return word;
    }

    private static int indexOf(@Nonnull char[] alphabet, char c, @Nonnull String text) {
        for (int i = 0; i < alphabet.length; i++) {
            if (alphabet[i] == c) {
                return i;
            }
        }
        throw new IllegalArgumentException("unexpected character '" + c + "' in mnemonic " + text);
    }
}
