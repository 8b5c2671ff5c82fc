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

/**
 * Function tags a {@link GateNode} can carry. Primitive tags have fixed
 * semantics; {@link #LUT} nodes carry a {@link TruthTable} and {@link #SOP}
 * nodes a {@link SopCover}.
 */
public enum GateType {
    AND(1, -1),
    OR(1, -1),
    NAND(1, -1),
    NOR(1, -1),
    XOR(1, -1),
    XNOR(1, -1),
    BUFFER(1, 1),
    INVERTER(1, 1),
    /** MUX(s, a, b) selects a when s is 1 and b when s is 0 */
    MUX(3, 3),
    CONST0(0, 0),
    CONST1(0, 0),
    LUT(0, TruthTable.MAX_INPUTS),
    SOP(0, -1);

    private final int minInputs;
    private final int maxInputs;

    GateType(int minInputs, int maxInputs) {
        this.minInputs = minInputs;
        this.maxInputs = maxInputs;
    }

    public int getMinInputs() {
        return minInputs;
    }

    /**
     * @return The largest supported input count, or -1 if unbounded.
     */
    public int getMaxInputs() {
        return maxInputs;
    }

    public boolean acceptsInputCount(int count) {
        return count >= minInputs && (maxInputs < 0 || count <= maxInputs);
    }
}
