/*
 * Copyright (c) 2026, RapidBench contributors.
 * All rights reserved.
 *
 * This file is part of RapidBench.
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
 *
 */

package com.rapidbench.netlist;

import java.util.Arrays;

/**
 * A complete truth table of a Boolean function of up to {@link #MAX_INPUTS}
 * inputs, stored as a bit-vector of 2^k bits. Bit i holds the function value
 * for the input assignment i, where input j contributes bit j of i (the first
 * input is the least significant).
 *
 * Bits beyond 2^k inside the last word are always zero.
 */
public class TruthTable {

    public static final int MAX_INPUTS = 15;

    private final int numInputs;

    private final long[] words;

    public TruthTable(int numInputs) {
        checkInputCount(numInputs);
        this.numInputs = numInputs;
        this.words = new long[wordCount(numInputs)];
    }

    private TruthTable(int numInputs, long[] words) {
        this.numInputs = numInputs;
        this.words = words;
    }

    /**
     * Creates a table from raw 64-bit words (least significant assignment first).
     * @param numInputs Number of inputs.
     * @param words The words, exactly {@link #wordCount(int)} of them.
     * @return The new table.
     */
    public static TruthTable fromWords(int numInputs, long[] words) {
        checkInputCount(numInputs);
        if (words.length != wordCount(numInputs)) {
            throw new IllegalArgumentException("Expected " + wordCount(numInputs) + " words for "
                    + numInputs + " inputs, got " + words.length);
        }
        if ((words[words.length - 1] & ~lastWordMask(numInputs)) != 0) {
            throw new IllegalArgumentException("Truth table has bits set beyond 2^" + numInputs);
        }
        return new TruthTable(numInputs, words.clone());
    }

    private static void checkInputCount(int numInputs) {
        if (numInputs < 0 || numInputs > MAX_INPUTS) {
            throw new IllegalArgumentException("Truth tables support 0 to " + MAX_INPUTS
                    + " inputs, got " + numInputs);
        }
    }

    /**
     * @param numInputs Number of inputs
     * @return The number of 64-bit words needed to store a table of that many inputs.
     */
    public static int wordCount(int numInputs) {
        return numInputs <= 6 ? 1 : 1 << (numInputs - 6);
    }

    static long lastWordMask(int numInputs) {
        return numInputs >= 6 ? -1L : (1L << (1 << numInputs)) - 1;
    }

    /**
     * @param numInputs Number of inputs
     * @return Number of hexadecimal digits a literal for this many inputs has,
     * that is 2^k/4 with a minimum of 1.
     */
    public static int hexDigitCount(int numInputs) {
        return Math.max(1, (1 << numInputs) / 4);
    }

    /** ASCII hexadecimal digit value, -1 for anything else */
    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return c - 'a' + 10;
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        return -1;
    }

    /**
     * Decodes a hexadecimal truth table literal. The literal is left-padded with
     * zeros to {@link #hexDigitCount(int)} digits; the rightmost digit holds
     * assignments 0 to 3.
     * @param hexDigits The digits, without the "0x" prefix.
     * @param numInputs Number of inputs of the function.
     * @return The decoded table.
     * @throws IllegalArgumentException if a character is not a hexadecimal digit,
     * or the literal encodes assignments beyond 2^numInputs.
     */
    public static TruthTable fromHex(String hexDigits, int numInputs) {
        TruthTable table = new TruthTable(numInputs);
        if (hexDigits.isEmpty()) {
            throw new IllegalArgumentException("Empty hexadecimal literal");
        }
        int nDigits = hexDigitCount(numInputs);
        int length = hexDigits.length();
        for (int i = 0; i < length; i++) {
            int digit = hexValue(hexDigits.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException("'" + hexDigits.charAt(i) + "' is not a hexadecimal digit");
            }
            if (length - i > nDigits && digit != 0) {
                throw new IllegalArgumentException("Literal 0x" + hexDigits + " has more than "
                        + nDigits + " significant digits for " + numInputs + " input(s)");
            }
        }
        int tableSize = table.size();
        for (int k = 0; k < nDigits && k < length; k++) {
            long digit = hexValue(hexDigits.charAt(length - 1 - k));
            if (tableSize < 4 && (digit >>> tableSize) != 0) {
                throw new IllegalArgumentException("Literal 0x" + hexDigits + " sets bits beyond 2^"
                        + numInputs);
            }
            table.words[k / 16] |= digit << ((k % 16) * 4);
        }
        return table;
    }

    public int getNumInputs() {
        return numInputs;
    }

    /**
     * @return The number of bits in this table, 2^k.
     */
    public int size() {
        return 1 << numInputs;
    }

    public boolean getBit(int assignment) {
        return ((words[assignment >>> 6] >>> (assignment & 63)) & 1L) != 0;
    }

    public void setBit(int assignment, boolean value) {
        if (assignment < 0 || assignment >= size()) {
            throw new IndexOutOfBoundsException("Assignment " + assignment + " outside of table with "
                    + size() + " bits");
        }
        if (value) {
            words[assignment >>> 6] |= 1L << (assignment & 63);
        } else {
            words[assignment >>> 6] &= ~(1L << (assignment & 63));
        }
    }

    /**
     * @return A copy of the underlying words.
     */
    public long[] getWords() {
        return words.clone();
    }

    long[] words() {
        return words;
    }

    public boolean isConst0() {
        for (long w : words) {
            if (w != 0) return false;
        }
        return true;
    }

    public boolean isConst1() {
        for (int i = 0; i < words.length - 1; i++) {
            if (words[i] != -1L) return false;
        }
        return words[words.length - 1] == lastWordMask(numInputs);
    }

    public int countOnes() {
        int count = 0;
        for (long w : words) {
            count += Long.bitCount(w);
        }
        return count;
    }

    /**
     * Checks whether the function depends on the given input.
     * @param input Input index.
     * @return True if some pair of assignments differing only in that input
     * yields different values.
     */
    public boolean dependsOn(int input) {
        int stride = 1 << input;
        for (int a = 0; a < size(); a++) {
            if ((a & stride) == 0 && getBit(a) != getBit(a | stride)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The canonical hexadecimal literal of this table without the "0x"
     * prefix, {@link #hexDigitCount(int)} digits long.
     */
    public String toHex() {
        int nDigits = hexDigitCount(numInputs);
        StringBuilder sb = new StringBuilder(nDigits);
        for (int k = nDigits - 1; k >= 0; k--) {
            int digit = (int) ((words[k / 16] >>> ((k % 16) * 4)) & 0xF);
            sb.append(Character.forDigit(digit, 16));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TruthTable that = (TruthTable) o;
        return numInputs == that.numInputs && Arrays.equals(words, that.words);
    }

    @Override
    public int hashCode() {
        return 31 * numInputs + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return "0x" + toHex();
    }
}
