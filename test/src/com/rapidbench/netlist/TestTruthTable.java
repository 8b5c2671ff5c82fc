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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestTruthTable {

    @ParameterizedTest
    @CsvSource({
            "0, 1",
            "1, 1",
            "2, 1",
            "3, 2",
            "4, 4",
            "6, 16",
            "7, 32",
            "15, 8192",
    })
    public void testHexDigitCount(int numInputs, int expected) {
        Assertions.assertEquals(expected, TruthTable.hexDigitCount(numInputs));
    }

    @ParameterizedTest
    @CsvSource({
            "8, 2, 8",
            "08, 2, 8",
            "0008, 2, 8",
            "1, 3, 01",
            "Ca, 3, ca",
            "0, 0, 0",
    })
    public void testFromHex(String digits, int numInputs, String expectedHex) {
        Assertions.assertEquals(expectedHex, TruthTable.fromHex(digits, numInputs).toHex());
    }

    @ParameterizedTest
    @CsvSource({
            "18, 2",
            "g, 2",
            "4, 1",
            "2, 0",
            "100, 3",
            "\uFF18, 2",
            "0\u0661, 2",
    })
    public void testBadHex(String digits, int numInputs) {
        Assertions.assertThrows(IllegalArgumentException.class, () -> TruthTable.fromHex(digits, numInputs));
    }

    @Test
    public void testEmptyHex() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> TruthTable.fromHex("", 2));
    }

    @Test
    public void testBits() {
        TruthTable and = TruthTable.fromHex("8", 2);
        Assertions.assertFalse(and.getBit(0));
        Assertions.assertFalse(and.getBit(1));
        Assertions.assertFalse(and.getBit(2));
        Assertions.assertTrue(and.getBit(3));
        Assertions.assertEquals(1, and.countOnes());
        Assertions.assertTrue(and.dependsOn(0));
        Assertions.assertTrue(and.dependsOn(1));
        Assertions.assertEquals("0x8", and.toString());

        TruthTable projection = TruthTable.fromHex("aa", 3);
        Assertions.assertTrue(projection.dependsOn(0));
        Assertions.assertFalse(projection.dependsOn(1));
        Assertions.assertFalse(projection.dependsOn(2));
    }

    @Test
    public void testConstants() {
        Assertions.assertTrue(TruthTable.fromHex("0", 3).isConst0());
        Assertions.assertTrue(TruthTable.fromHex("ff", 3).isConst1());
        Assertions.assertTrue(TruthTable.fromHex("3", 1).isConst1());
        Assertions.assertTrue(TruthTable.fromHex("1", 0).isConst1());
        Assertions.assertFalse(TruthTable.fromHex("7f", 3).isConst1());

        TruthTable wide = new TruthTable(8);
        for (int a = 0; a < wide.size(); a++) {
            wide.setBit(a, true);
        }
        Assertions.assertTrue(wide.isConst1());
        wide.setBit(200, false);
        Assertions.assertFalse(wide.isConst1());
        Assertions.assertEquals(255, wide.countOnes());
    }

    @Test
    public void testMultiWordHex() {
        String digits = "80000000000000000000000000000001";
        TruthTable table = TruthTable.fromHex(digits, 7);
        Assertions.assertTrue(table.getBit(0));
        Assertions.assertTrue(table.getBit(127));
        Assertions.assertEquals(2, table.countOnes());
        Assertions.assertEquals(digits, table.toHex());
        Assertions.assertEquals(2, table.getWords().length);
    }

    @Test
    public void testFromWords() {
        Assertions.assertEquals(TruthTable.fromHex("6", 2), TruthTable.fromWords(2, new long[] {6}));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TruthTable.fromWords(2, new long[] {0x16}));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TruthTable.fromWords(7, new long[] {0}));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new TruthTable(16));
    }

    @Test
    public void testSetBitOutOfRange() {
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> new TruthTable(2).setBit(4, true));
    }
}
