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
import java.util.Arrays;
import java.util.List;

import com.rapidbench.util.MessageGenerator;

/**
 * Converts truth-table (LUT) nodes into sum-of-products covers. Each table is
 * covered with an irredundant SOP computed by the Minato-Morreale recursion,
 * once for the on-set and once for the off-set; the smaller of the two
 * becomes the node's cover, the off-set one marked as complemented.
 */
public class TruthTableCollapser {

    private static final long[] VAR_MASKS = {
        0x5555555555555555L,
        0x3333333333333333L,
        0x0F0F0F0F0F0F0F0FL,
        0x00FF00FF00FF00FFL,
        0x0000FFFF0000FFFFL,
        0x00000000FFFFFFFFL,
    };

    private TruthTableCollapser() {
    }

    /**
     * Replaces the function of every LUT node of the netlist with an equivalent
     * SOP cover.
     * @param netlist The netlist to update in place.
     * @return The number of nodes converted.
     */
    public static int collapse(GateNetlist netlist) {
        int count = 0;
        for (GateNode node : netlist.getNodes()) {
            TruthTable table = node.getFunction().getTruthTable();
            if (table == null) continue;
            node.setFunction(GateFunction.sop(toCover(table)));
            count++;
        }
        if (count > 0) {
            MessageGenerator.verboseMessage("Converted " + count + " truth table node(s) of "
                    + netlist.getName() + " into covers");
        }
        return count;
    }

    /**
     * Computes an irredundant cover of a truth table, choosing the phase with
     * fewer cubes (the on-set on a tie).
     * @param table The function to cover.
     * @return The cover.
     */
    public static SopCover toCover(TruthTable table) {
        int n = table.getNumInputs();
        long[] on = expand(table);
        long[] off = complement(on);
        List<String> onCubes = isop(on, on, n);
        List<String> offCubes = isop(off, off, n);
        if (offCubes.size() < onCubes.size()) {
            return new SopCover(n, offCubes, true);
        }
        return new SopCover(n, onCubes, false);
    }

    /**
     * Widens a table to at least one full word, replicating small tables so that
     * the unused variables are don't-cares.
     */
    private static long[] expand(TruthTable table) {
        int n = table.getNumInputs();
        long[] words = table.getWords();
        if (n >= 6) return words;
        long w = words[0];
        for (int width = 1 << n; width < 64; width <<= 1) {
            w |= w << width;
        }
        return new long[] { w };
    }

    private static List<String> isop(long[] lower, long[] upper, int numInputs) {
        List<String> cubes = new ArrayList<>();
        char[] cube = new char[numInputs];
        Arrays.fill(cube, '-');
        isop(lower, upper, numInputs, cube, cubes);
        return cubes;
    }

    /**
     * Covers an incompletely specified function given as the interval [lower, upper].
     * @param varLimit Only variables below this index may still be split.
     * @param cube Literals fixed by the enclosing calls.
     * @param cubes Receives the cubes of the cover.
     * @return The function actually covered, between lower and upper.
     */
    private static long[] isop(long[] lower, long[] upper, int varLimit, char[] cube, List<String> cubes) {
        if (isZero(lower)) {
            return new long[lower.length];
        }
        if (isOnes(upper)) {
            cubes.add(new String(cube));
            return ones(lower.length);
        }
        int v = varLimit - 1;
        while (v >= 0 && !dependsOn(lower, v) && !dependsOn(upper, v)) {
            v--;
        }
        if (v < 0) {
            throw new IllegalStateException("Empty interval in cover computation");
        }
        long[] lower0 = cofactor(lower, v, false);
        long[] lower1 = cofactor(lower, v, true);
        long[] upper0 = cofactor(upper, v, false);
        long[] upper1 = cofactor(upper, v, true);

        cube[v] = '0';
        long[] r0 = isop(andNot(lower0, upper1), upper0, v, cube, cubes);
        cube[v] = '1';
        long[] r1 = isop(andNot(lower1, upper0), upper1, v, cube, cubes);
        cube[v] = '-';
        long[] lowerRest = or(andNot(lower0, r0), andNot(lower1, r1));
        long[] r2 = isop(lowerRest, and(upper0, upper1), v, cube, cubes);

        long[] result = new long[lower.length];
        for (int i = 0; i < result.length; i++) {
            long literal = literalWord(v, i);
            result[i] = (r0[i] & ~literal) | (r1[i] & literal) | r2[i];
        }
        return result;
    }

    private static long literalWord(int v, int wordIndex) {
        if (v < 6) return ~VAR_MASKS[v];
        return (wordIndex & (1 << (v - 6))) != 0 ? -1L : 0L;
    }

    private static long[] cofactor(long[] f, int v, boolean phase) {
        long[] result = new long[f.length];
        if (v < 6) {
            int shift = 1 << v;
            long mask = VAR_MASKS[v];
            for (int i = 0; i < f.length; i++) {
                if (phase) {
                    long hi = f[i] & ~mask;
                    result[i] = hi | (hi >>> shift);
                } else {
                    long lo = f[i] & mask;
                    result[i] = lo | (lo << shift);
                }
            }
        } else {
            int stride = 1 << (v - 6);
            for (int i = 0; i < f.length; i++) {
                if ((i & stride) != 0) continue;
                long w = phase ? f[i + stride] : f[i];
                result[i] = w;
                result[i + stride] = w;
            }
        }
        return result;
    }

    private static boolean dependsOn(long[] f, int v) {
        return !Arrays.equals(cofactor(f, v, false), cofactor(f, v, true));
    }

    private static boolean isZero(long[] f) {
        for (long w : f) {
            if (w != 0) return false;
        }
        return true;
    }

    private static boolean isOnes(long[] f) {
        for (long w : f) {
            if (w != -1L) return false;
        }
        return true;
    }

    private static long[] ones(int length) {
        long[] result = new long[length];
        Arrays.fill(result, -1L);
        return result;
    }

    private static long[] complement(long[] f) {
        long[] result = new long[f.length];
        for (int i = 0; i < f.length; i++) result[i] = ~f[i];
        return result;
    }

    private static long[] and(long[] a, long[] b) {
        long[] result = new long[a.length];
        for (int i = 0; i < a.length; i++) result[i] = a[i] & b[i];
        return result;
    }

    private static long[] or(long[] a, long[] b) {
        long[] result = new long[a.length];
        for (int i = 0; i < a.length; i++) result[i] = a[i] | b[i];
        return result;
    }

    private static long[] andNot(long[] a, long[] b) {
        long[] result = new long[a.length];
        for (int i = 0; i < a.length; i++) result[i] = a[i] & ~b[i];
        return result;
    }
}
