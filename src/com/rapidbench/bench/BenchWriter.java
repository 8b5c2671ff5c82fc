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

package com.rapidbench.bench;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.rapidbench.netlist.GateLatch;
import com.rapidbench.netlist.GateNet;
import com.rapidbench.netlist.GateNetlist;
import com.rapidbench.netlist.GateNode;
import com.rapidbench.netlist.TruthTable;
import com.rapidbench.util.MessageGenerator;

/**
 * Writes a normalized {@link GateNetlist} as circuit text: primary inputs,
 * primary outputs, latches, then one statement per node. Nodes must have at
 * most two inputs. Single-input nodes are written as BUFF or NOT and every
 * two-input node is written with the AND spelling.
 */
public class BenchWriter {

    private static final byte[] EXPORT_CONST_INPUT = "INPUT(".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPORT_CONST_OUTPUT = "OUTPUT(".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPORT_CONST_DFF = " = DFF(".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPORT_CONST_VDD = " = vdd\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPORT_CONST_GND = " = gnd\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPORT_CONST_BUFF = " = BUFF(".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPORT_CONST_NOT = " = NOT(".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPORT_CONST_AND = " = AND(".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPORT_CONST_SEP = ", ".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPORT_CONST_CLOSE = ")\n".getBytes(StandardCharsets.UTF_8);

    /** Width names are left-justified to in gate statements */
    public static final int NAME_COLUMN_WIDTH = 11;

    private static final TruthTable BUFFER_TABLE = TruthTable.fromWords(1, new long[] {0x2L});
    private static final TruthTable INVERTER_TABLE = TruthTable.fromWords(1, new long[] {0x1L});
    private static final TruthTable AND_TABLE = TruthTable.fromWords(2, new long[] {0x8L});

    private BenchWriter() {
    }

    /**
     * Checks that every node can be written.
     * @param netlist The netlist to check.
     * @return The number of two-input nodes that are not AND gates.
     * @throws BenchWritePreconditionException on the first node that cannot be written.
     */
    public static int checkWritable(GateNetlist netlist) {
        int nonAndCount = 0;
        for (GateNode node : netlist.getNodes()) {
            int fanin = node.getFaninCount();
            if (fanin > 2) {
                throw new BenchWritePreconditionException("ERROR: Node " + node.getName() + " has " + fanin
                        + " inputs, the netlist must be normalized to at most 2 inputs per node before writing");
            }
            if (fanin == 1) {
                TruthTable table = node.getFunction().toTruthTable(1);
                if (!table.equals(BUFFER_TABLE) && !table.equals(INVERTER_TABLE)) {
                    throw new BenchWritePreconditionException("ERROR: Single-input node " + node.getName()
                            + " is neither a buffer nor an inverter (" + node.getFunction() + ")");
                }
            } else if (fanin == 2 && !node.getFunction().toTruthTable(2).equals(AND_TABLE)) {
                nonAndCount++;
            }
        }
        return nonAndCount;
    }

    /**
     * Writes the netlist as circuit text. Nothing is written if the netlist
     * fails {@link #checkWritable(GateNetlist)}. The stream is closed afterwards.
     * @param netlist The netlist to write.
     * @param out Destination stream.
     * @throws IOException if writing fails.
     */
    public static void writeBench(GateNetlist netlist, OutputStream out) throws IOException {
        int nonAndCount = checkWritable(netlist);
        if (nonAndCount > 0) {
            MessageGenerator.warning(nonAndCount + " two-input node(s) of " + netlist.getName()
                    + " are not AND gates but are written as AND");
        }
        try (BufferedOutputStream os = new BufferedOutputStream(out)) {
            for (GateNet pi : netlist.getPrimaryInputs()) {
                os.write(EXPORT_CONST_INPUT);
                writeName(os, pi.getName());
                os.write(EXPORT_CONST_CLOSE);
            }
            for (GateNet po : netlist.getPrimaryOutputs()) {
                os.write(EXPORT_CONST_OUTPUT);
                writeName(os, po.getName());
                os.write(EXPORT_CONST_CLOSE);
            }
            for (GateLatch latch : netlist.getLatches()) {
                writePaddedName(os, latch.getOutput().getName());
                os.write(EXPORT_CONST_DFF);
                writeName(os, latch.getInput().getName());
                os.write(EXPORT_CONST_CLOSE);
            }
            for (GateNode node : netlist.getNodes()) {
                writeNode(os, node);
            }
        }
    }

    /**
     * Writes one node. Zero-input nodes are written as vdd, or as gnd when the
     * node is constant 0 so that the text reads back with the same function.
     */
    private static void writeNode(OutputStream os, GateNode node) throws IOException {
        writePaddedName(os, node.getName());
        switch (node.getFaninCount()) {
            case 0:
                boolean one = node.getFunction().toTruthTable(0).isConst1();
                os.write(one ? EXPORT_CONST_VDD : EXPORT_CONST_GND);
                return;
            case 1:
                boolean buffer = node.getFunction().toTruthTable(1).equals(BUFFER_TABLE);
                os.write(buffer ? EXPORT_CONST_BUFF : EXPORT_CONST_NOT);
                writeName(os, node.getInput(0).getName());
                os.write(EXPORT_CONST_CLOSE);
                return;
            default:
                os.write(EXPORT_CONST_AND);
                writeName(os, node.getInput(0).getName());
                os.write(EXPORT_CONST_SEP);
                writeName(os, node.getInput(1).getName());
                os.write(EXPORT_CONST_CLOSE);
        }
    }

    private static void writeName(OutputStream os, String name) throws IOException {
        os.write(name.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes a name left-justified to {@link #NAME_COLUMN_WIDTH} bytes of UTF-8.
     */
    private static void writePaddedName(OutputStream os, String name) throws IOException {
        byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        os.write(bytes);
        for (int i = bytes.length; i < NAME_COLUMN_WIDTH; i++) {
            os.write(' ');
        }
    }

    public static void writeBench(GateNetlist netlist, Path fileName) {
        try (OutputStream out = Files.newOutputStream(fileName)) {
            writeBench(netlist, out);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Failed to write circuit text file " + fileName, e);
        }
    }

    /**
     * @param netlist The netlist to write.
     * @return The circuit text of the netlist.
     */
    public static String writeBenchString(GateNetlist netlist) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            writeBench(netlist, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }
}
