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

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * The function descriptor of a {@link GateNode}: a primitive tag, a truth
 * table ({@link GateType#LUT}) or a two-level cover ({@link GateType#SOP}).
 * Instances are immutable; primitive descriptors are shared.
 */
public final class GateFunction {

    private static final Map<GateType, GateFunction> primitives = new EnumMap<>(GateType.class);

    static {
        for (GateType type : GateType.values()) {
            if (type != GateType.LUT && type != GateType.SOP) {
                primitives.put(type, new GateFunction(type, null, null));
            }
        }
    }

    private final GateType type;

    private final TruthTable truthTable;

    private final SopCover cover;

    private GateFunction(GateType type, TruthTable truthTable, SopCover cover) {
        this.type = type;
        this.truthTable = truthTable;
        this.cover = cover;
    }

    /**
     * Gets the shared descriptor of a primitive gate type.
     * @param type Any type except {@link GateType#LUT} and {@link GateType#SOP}.
     * @return The descriptor.
     */
    public static GateFunction of(GateType type) {
        GateFunction f = primitives.get(type);
        if (f == null) {
            throw new IllegalArgumentException(type + " functions need a truth table or a cover");
        }
        return f;
    }

    public static GateFunction lut(TruthTable truthTable) {
        return new GateFunction(GateType.LUT, Objects.requireNonNull(truthTable), null);
    }

    public static GateFunction sop(SopCover cover) {
        return new GateFunction(GateType.SOP, null, Objects.requireNonNull(cover));
    }

    public GateType getType() {
        return type;
    }

    @Nullable
    public TruthTable getTruthTable() {
        return truthTable;
    }

    @Nullable
    public SopCover getCover() {
        return cover;
    }

    public boolean acceptsInputCount(int count) {
        if (type == GateType.LUT) return count == truthTable.getNumInputs();
        if (type == GateType.SOP) return count == cover.getNumInputs();
        return type.acceptsInputCount(count);
    }

    /**
     * Evaluates the function.
     * @param inputs Input values, in fanin order.
     * @return The output value.
     */
    public boolean evaluate(boolean[] inputs) {
        switch (type) {
            case AND:
                return all(inputs);
            case NAND:
                return !all(inputs);
            case OR:
                return any(inputs);
            case NOR:
                return !any(inputs);
            case XOR:
                return parity(inputs);
            case XNOR:
                return !parity(inputs);
            case BUFFER:
                return inputs[0];
            case INVERTER:
                return !inputs[0];
            case MUX:
                return inputs[0] ? inputs[1] : inputs[2];
            case CONST0:
                return false;
            case CONST1:
                return true;
            case LUT:
                return truthTable.getBit(toAssignment(inputs));
            case SOP:
                return cover.evaluate(toAssignment(inputs));
            default:
                throw new IllegalStateException("Unhandled gate type " + type);
        }
    }

    /**
     * Computes the complete truth table of this function.
     * @param numInputs The fanin count of the node carrying this function.
     * @return The table.
     */
    public TruthTable toTruthTable(int numInputs) {
        if (type == GateType.LUT) {
            return truthTable;
        }
        TruthTable table = new TruthTable(numInputs);
        boolean[] inputs = new boolean[numInputs];
        for (int a = 0; a < table.size(); a++) {
            for (int i = 0; i < numInputs; i++) {
                inputs[i] = ((a >>> i) & 1) != 0;
            }
            if (evaluate(inputs)) {
                table.setBit(a, true);
            }
        }
        return table;
    }

    private static int toAssignment(boolean[] inputs) {
        int a = 0;
        for (int i = 0; i < inputs.length; i++) {
            if (inputs[i]) a |= 1 << i;
        }
        return a;
    }

    private static boolean all(boolean[] inputs) {
        for (boolean b : inputs) {
            if (!b) return false;
        }
        return true;
    }

    private static boolean any(boolean[] inputs) {
        for (boolean b : inputs) {
            if (b) return true;
        }
        return false;
    }

    private static boolean parity(boolean[] inputs) {
        boolean p = false;
        for (boolean b : inputs) {
            p ^= b;
        }
        return p;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GateFunction that = (GateFunction) o;
        return type == that.type && Objects.equals(truthTable, that.truthTable)
                && Objects.equals(cover == null ? null : cover.toString(),
                                  that.cover == null ? null : that.cover.toString());
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, truthTable, cover == null ? null : cover.toString());
    }

    @Override
    public String toString() {
        if (type == GateType.LUT) return "LUT " + truthTable;
        if (type == GateType.SOP) return "SOP[" + cover.toString().trim().replace('\n', '|') + "]";
        return type.toString();
    }
}
