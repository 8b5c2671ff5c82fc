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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.esotericsoftware.kryo.io.Input;
import com.rapidbench.util.FileTools;

/**
 * Reads the binary netlist cache written by {@link BinaryNetlistWriter}.
 */
public class BinaryNetlistReader {

    private static final GateType[] GATE_TYPES = GateType.values();

    private static final LatchInit[] LATCH_INITS = LatchInit.values();

    public static GateNetlist readBinaryNetlist(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return readBinaryNetlist(inputStream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads a binary netlist and creates a new GateNetlist from it.
     * @param inputStream Stream of compressed data; it is closed afterwards.
     * @return The newly created netlist.
     * @see BinaryNetlistWriter#writeBinaryNetlist(java.io.OutputStream, GateNetlist)
     */
    public static GateNetlist readBinaryNetlist(InputStream inputStream) {
        try (Input is = FileTools.getKryoZstdInputStream(inputStream)) {
            if (!BinaryNetlistWriter.NETLIST_BINARY_FILE_TAG.equals(is.readString())) {
                throw new RuntimeException("ERROR: Cannot recognize binary netlist format");
            }
            if (!BinaryNetlistWriter.NETLIST_BINARY_FILE_VERSION.equals(is.readString())) {
                throw new RuntimeException("ERROR: Unsupported binary netlist format version");
            }
            String[] strings = FileTools.readStringArray(is);
            GateNetlist netlist = new GateNetlist(strings[0]);

            int numNets = is.readInt();
            for (int i = 0; i < numNets; i++) {
                String name = strings[is.readInt()];
                int firstReference = is.readInt();
                GateNet net = netlist.getOrCreateNet(name);
                if (firstReference >= 0) {
                    net.noteReference(firstReference);
                }
            }
            int numInputs = is.readInt();
            for (int i = 0; i < numInputs; i++) {
                GateNet net = netlist.getOrCreateNet(strings[is.readInt()]);
                netlist.addPrimaryInput(net, is.readInt());
            }
            int numOutputs = is.readInt();
            for (int i = 0; i < numOutputs; i++) {
                netlist.addPrimaryOutput(netlist.getOrCreateNet(strings[is.readInt()]));
            }
            int numLatches = is.readInt();
            for (int i = 0; i < numLatches; i++) {
                GateNet output = netlist.getOrCreateNet(strings[is.readInt()]);
                GateNet input = netlist.getOrCreateNet(strings[is.readInt()]);
                LatchInit init = LATCH_INITS[is.readByte()];
                netlist.createLatch(output, input, init, is.readInt());
            }
            int constraints = is.readInt();
            for (int i = 0; i < constraints; i++) {
                netlist.incrementConstraintCount();
            }
            int numNodes = is.readInt();
            for (int i = 0; i < numNodes; i++) {
                readNode(is, strings, netlist);
            }
            return netlist;
        }
    }

    private static void readNode(Input is, String[] strings, GateNetlist netlist) {
        GateNet output = netlist.getOrCreateNet(strings[is.readInt()]);
        int line = is.readInt();
        GateType type = GATE_TYPES[is.readByte()];
        int fanin = is.readInt();
        List<GateNet> inputs = new ArrayList<>(fanin);
        for (int i = 0; i < fanin; i++) {
            inputs.add(netlist.getOrCreateNet(strings[is.readInt()]));
        }
        GateFunction function;
        if (type == GateType.LUT) {
            function = GateFunction.lut(TruthTable.fromWords(fanin, FileTools.readLongArray(is)));
        } else if (type == GateType.SOP) {
            boolean complemented = is.readBoolean();
            String[] cubes = FileTools.readStringArray(is);
            function = GateFunction.sop(new SopCover(fanin, Arrays.asList(cubes), complemented));
        } else {
            function = GateFunction.of(type);
        }
        netlist.createNode(output, inputs, function, line);
    }
}
