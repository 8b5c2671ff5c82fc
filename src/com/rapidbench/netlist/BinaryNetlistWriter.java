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
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import com.esotericsoftware.kryo.io.Output;
import com.rapidbench.util.FileTools;

/**
 * A writer for the binary netlist cache format.
 *
 * The cache stores a {@link GateNetlist} after parsing so that it can be
 * reloaded without re-reading and re-checking the circuit text. All names go
 * into a string table at the front of the file; the rest of the file refers
 * to nets by their index in that table.
 */
public class BinaryNetlistWriter {

    public static final String NETLIST_BINARY_FILE_TAG = "RAPIDBENCH_NETLIST_BINARY";
    public static final String NETLIST_BINARY_FILE_VERSION = "0.0.1";

    /**
     * Enumerates the netlist name followed by every net name, in net creation order.
     * @param netlist The netlist to include in the string map.
     * @return A new map from each name to its index in the string table.
     */
    public static Map<String, Integer> createStringMap(GateNetlist netlist) {
        Map<String, Integer> stringMap = new HashMap<>();
        stringMap.put(netlist.getName(), 0);
        for (GateNet net : netlist.getNets()) {
            stringMap.computeIfAbsent(net.getName(), v -> stringMap.size());
        }
        return stringMap;
    }

    public static void writeBinaryNetlist(Path path, GateNetlist netlist) {
        try (OutputStream outputStream = Files.newOutputStream(path)) {
            writeBinaryNetlist(outputStream, netlist);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Writes the netlist in the binary cache format. The stream is closed afterwards.
     * @param outputStream Destination of the compressed data.
     * @param netlist The netlist to write.
     * @see BinaryNetlistReader#readBinaryNetlist(java.io.InputStream)
     */
    public static void writeBinaryNetlist(OutputStream outputStream, GateNetlist netlist) {
        Map<String, Integer> stringMap = createStringMap(netlist);
        try (Output os = FileTools.getKryoZstdOutputStream(outputStream)) {
            os.writeString(NETLIST_BINARY_FILE_TAG);
            os.writeString(NETLIST_BINARY_FILE_VERSION);
            String[] strings = new String[stringMap.size()];
            for (Map.Entry<String, Integer> e : stringMap.entrySet()) {
                strings[e.getValue()] = e.getKey();
            }
            FileTools.writeStringArray(os, strings);

            os.writeInt(netlist.getNets().size());
            for (GateNet net : netlist.getNets()) {
                os.writeInt(stringMap.get(net.getName()));
                os.writeInt(net.getFirstReferenceLine());
            }
            os.writeInt(netlist.getPrimaryInputs().size());
            for (GateNet pi : netlist.getPrimaryInputs()) {
                os.writeInt(stringMap.get(pi.getName()));
                os.writeInt(pi.getDriverLine());
            }
            os.writeInt(netlist.getPrimaryOutputs().size());
            for (GateNet po : netlist.getPrimaryOutputs()) {
                os.writeInt(stringMap.get(po.getName()));
            }
            os.writeInt(netlist.getLatches().size());
            for (GateLatch latch : netlist.getLatches()) {
                os.writeInt(stringMap.get(latch.getOutput().getName()));
                os.writeInt(stringMap.get(latch.getInput().getName()));
                os.writeByte(latch.getInit().ordinal());
                os.writeInt(latch.getLine());
            }
            os.writeInt(netlist.getConstraintCount());
            os.writeInt(netlist.getNodes().size());
            for (GateNode node : netlist.getNodes()) {
                writeNode(node, os, stringMap);
            }
        }
    }

    private static void writeNode(GateNode node, Output os, Map<String, Integer> stringMap) {
        os.writeInt(stringMap.get(node.getName()));
        os.writeInt(node.getLine());
        os.writeByte(node.getType().ordinal());
        os.writeInt(node.getFaninCount());
        for (GateNet input : node.getInputs()) {
            os.writeInt(stringMap.get(input.getName()));
        }
        GateFunction function = node.getFunction();
        if (function.getType() == GateType.LUT) {
            FileTools.writeLongArray(os, function.getTruthTable().getWords());
        } else if (function.getType() == GateType.SOP) {
            SopCover cover = function.getCover();
            os.writeBoolean(cover.isComplemented());
            FileTools.writeStringArray(os, cover.getCubes().toArray(FileTools.emptyStringArray));
        }
    }
}
