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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

public class TestTruthTableCollapser {

    private static TruthTable randomTable(int numInputs, long seed) {
        Random random = new Random(seed);
        TruthTable table = new TruthTable(numInputs);
        for (int a = 0; a < table.size(); a++) {
            table.setBit(a, random.nextBoolean());
        }
        return table;
    }

    public static Stream<Arguments> randomTables() {
        return IntStream.rangeClosed(0, 9).boxed()
                .flatMap(n -> IntStream.range(0, 8).mapToObj(seed -> Arguments.of(n, (long) (seed * 31 + n))));
    }

    @ParameterizedTest
    @MethodSource("randomTables")
    public void testCoverIsEquivalentAndIrredundant(int numInputs, long seed) {
        TruthTable table = randomTable(numInputs, seed);
        SopCover cover = TruthTableCollapser.toCover(table);
        Assertions.assertEquals(table, cover.toTruthTable());

        List<String> cubes = cover.getCubes();
        for (int i = 0; i < cubes.size(); i++) {
            List<String> fewer = new ArrayList<>(cubes);
            fewer.remove(i);
            SopCover reduced = new SopCover(numInputs, fewer, cover.isComplemented());
            Assertions.assertNotEquals(table, reduced.toTruthTable(), "cube " + cubes.get(i) + " is redundant");
        }
    }

    @Test
    public void testSparseWideTable() {
        TruthTable table = new TruthTable(12);
        table.setBit(0, true);
        table.setBit(4095, true);
        table.setBit(2048 + 64 + 1, true);
        SopCover cover = TruthTableCollapser.toCover(table);
        Assertions.assertFalse(cover.isComplemented());
        Assertions.assertEquals(3, cover.getCubeCount());
        Assertions.assertEquals(table, cover.toTruthTable());
    }

    @ParameterizedTest
    @CsvSource({
            // AND: one on-set cube
            "8, 2, false, 1",
            // NAND: one off-set cube beats two on-set cubes
            "7, 2, true, 1",
            // XOR: tie goes to the on-set
            "6, 2, false, 2",
            // OR: a single off-set cube
            "e, 2, true, 1",
            // MUX(s, a, b) = s ? a : b with s as input 0
            "d8, 3, false, 2",
    })
    public void testPhaseChoice(String hex, int numInputs, boolean complemented, int cubeCount) {
        SopCover cover = TruthTableCollapser.toCover(TruthTable.fromHex(hex, numInputs));
        Assertions.assertEquals(complemented, cover.isComplemented());
        Assertions.assertEquals(cubeCount, cover.getCubeCount());
    }

    @Test
    public void testAndCover() {
        SopCover cover = TruthTableCollapser.toCover(TruthTable.fromHex("8", 2));
        Assertions.assertEquals("11 1\n", cover.toString());
    }

    @Test
    public void testNandCover() {
        SopCover cover = TruthTableCollapser.toCover(TruthTable.fromHex("7", 2));
        Assertions.assertEquals("11 0\n", cover.toString());
    }

    @Test
    public void testConstantCovers() {
        SopCover zero = TruthTableCollapser.toCover(TruthTable.fromHex("0", 2));
        Assertions.assertEquals(0, zero.getCubeCount());
        Assertions.assertEquals(" 0\n", zero.toString());
        SopCover one = TruthTableCollapser.toCover(TruthTable.fromHex("f", 2));
        Assertions.assertTrue(one.isComplemented());
        Assertions.assertEquals(0, one.getCubeCount());
        Assertions.assertEquals(" 1\n", one.toString());
    }

    @Test
    public void testCollapseNetlist() {
        GateNetlist netlist = new GateNetlist();
        netlist.addPrimaryInput(netlist.getOrCreateNet("a"), 1);
        netlist.addPrimaryInput(netlist.getOrCreateNet("b"), 2);
        netlist.addPrimaryInput(netlist.getOrCreateNet("c"), 3);
        netlist.createNode("x", GateFunction.lut(TruthTable.fromHex("96", 3)), "a", "b", "c");
        netlist.createNode("y", GateFunction.of(GateType.AND), "x", "a");
        Assertions.assertTrue(netlist.hasTruthTables());

        Assertions.assertEquals(1, TruthTableCollapser.collapse(netlist));
        Assertions.assertFalse(netlist.hasTruthTables());
        GateNode x = netlist.getNet("x").getDriverNode();
        Assertions.assertEquals(GateType.SOP, x.getType());
        Assertions.assertEquals(4, x.getFunction().getCover().getCubeCount());
        Assertions.assertEquals("96", x.getFunction().toTruthTable(3).toHex());
        Assertions.assertEquals(GateType.AND, netlist.getNet("y").getDriverNode().getType());
        Assertions.assertEquals(0, TruthTableCollapser.collapse(netlist));
    }
}
