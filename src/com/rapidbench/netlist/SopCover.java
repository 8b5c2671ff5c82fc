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
import java.util.Collections;
import java.util.List;

/**
 * A two-level sum-of-products cover. Each cube is a string with one character
 * per input: '1' for the positive literal, '0' for the negative literal and
 * '-' when the input does not appear. A complemented cover describes the
 * off-set: the function is 0 where a cube matches and 1 elsewhere.
 *
 * The text form is the classic SOP notation, one cube per line followed by the
 * output phase, for example "0-1 1\n11- 1\n".
 */
public class SopCover {

    private final int numInputs;

    private final List<String> cubes;

    private final boolean complemented;

    public SopCover(int numInputs, List<String> cubes, boolean complemented) {
        for (String cube : cubes) {
            if (cube.length() != numInputs) {
                throw new IllegalArgumentException("Cube '" + cube + "' does not have " + numInputs + " literals");
            }
            for (int i = 0; i < cube.length(); i++) {
                char c = cube.charAt(i);
                if (c != '0' && c != '1' && c != '-') {
                    throw new IllegalArgumentException("Illegal literal '" + c + "' in cube '" + cube + "'");
                }
            }
        }
        this.numInputs = numInputs;
        this.cubes = Collections.unmodifiableList(new ArrayList<>(cubes));
        this.complemented = complemented;
    }

    public int getNumInputs() {
        return numInputs;
    }

    public List<String> getCubes() {
        return cubes;
    }

    public int getCubeCount() {
        return cubes.size();
    }

    public boolean isComplemented() {
        return complemented;
    }

    /**
     * Evaluates the cover for one input assignment.
     * @param assignment Input assignment, input j in bit j.
     * @return The function value.
     */
    public boolean evaluate(int assignment) {
        for (String cube : cubes) {
            if (matches(cube, assignment)) {
                return !complemented;
            }
        }
        return complemented;
    }

    private static boolean matches(String cube, int assignment) {
        for (int i = 0; i < cube.length(); i++) {
            char c = cube.charAt(i);
            if (c == '-') continue;
            boolean bit = ((assignment >>> i) & 1) != 0;
            if (bit != (c == '1')) {
                return false;
            }
        }
        return true;
    }

    public TruthTable toTruthTable() {
        TruthTable table = new TruthTable(numInputs);
        for (int a = 0; a < table.size(); a++) {
            if (evaluate(a)) {
                table.setBit(a, true);
            }
        }
        return table;
    }

    @Override
    public String toString() {
        char phase = complemented ? '0' : '1';
        if (cubes.isEmpty()) {
            return " " + (complemented ? '1' : '0') + "\n";
        }
        StringBuilder sb = new StringBuilder();
        for (String cube : cubes) {
            sb.append(cube).append(' ').append(phase).append('\n');
        }
        return sb.toString();
    }
}
