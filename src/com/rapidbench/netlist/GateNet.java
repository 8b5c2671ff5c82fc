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

import org.jetbrains.annotations.Nullable;

/**
 * A named wire of a {@link GateNetlist}. A net has at most one driver (a
 * primary input, a node or a latch) and any number of consumers.
 */
public class GateNet {

    private final String name;

    private NetDriverType driverType = NetDriverType.NONE;

    private GateNode driverNode;

    private GateLatch driverLatch;

    private int driverLine = -1;

    /** Line of the first statement that mentioned this net, -1 if unknown */
    private int firstReferenceLine = -1;

    private final List<GateNode> fanouts = new ArrayList<>();

    private final List<GateLatch> latchFanouts = new ArrayList<>();

    private boolean primaryOutput;

    GateNet(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public NetDriverType getDriverType() {
        return driverType;
    }

    public boolean isDriven() {
        return driverType != NetDriverType.NONE;
    }

    public boolean isPrimaryInput() {
        return driverType == NetDriverType.PRIMARY_INPUT;
    }

    public boolean isPrimaryOutput() {
        return primaryOutput;
    }

    /**
     * @return The node driving this net, or null if it is not driven by a node.
     */
    @Nullable
    public GateNode getDriverNode() {
        return driverNode;
    }

    /**
     * @return The latch whose output this net is, or null.
     */
    @Nullable
    public GateLatch getDriverLatch() {
        return driverLatch;
    }

    /**
     * @return Line of the declaration driving this net, -1 if unknown or undriven.
     */
    public int getDriverLine() {
        return driverLine;
    }

    public int getFirstReferenceLine() {
        return firstReferenceLine;
    }

    /**
     * @return Nodes consuming this net, one entry per fanin edge.
     */
    public List<GateNode> getFanouts() {
        return Collections.unmodifiableList(fanouts);
    }

    public List<GateLatch> getLatchFanouts() {
        return Collections.unmodifiableList(latchFanouts);
    }

    void noteReference(int line) {
        if (firstReferenceLine < 0) {
            firstReferenceLine = line;
        }
    }

    void setDriver(NetDriverType type, GateNode node, GateLatch latch, int line) {
        if (driverType != NetDriverType.NONE) {
            throw new NetlistIntegrityException("ERROR: Net '" + name + "' is driven twice: "
                    + describeDriver() + " and again at " + lineText(line) + ".");
        }
        driverType = type;
        driverNode = node;
        driverLatch = latch;
        driverLine = line;
    }

    private String describeDriver() {
        String what = driverType == NetDriverType.PRIMARY_INPUT ? "as a primary input"
                : driverType == NetDriverType.LATCH ? "by a latch" : "by a gate";
        return what + " at " + lineText(driverLine);
    }

    static String lineText(int line) {
        return line < 0 ? "unknown line" : "line " + line;
    }

    void addFanout(GateNode node) {
        fanouts.add(node);
    }

    void addLatchFanout(GateLatch latch) {
        latchFanouts.add(latch);
    }

    void setPrimaryOutput(boolean primaryOutput) {
        this.primaryOutput = primaryOutput;
    }

    @Override
    public String toString() {
        return name;
    }
}
