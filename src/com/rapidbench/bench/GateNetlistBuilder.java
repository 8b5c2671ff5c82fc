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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.rapidbench.netlist.GateFunction;
import com.rapidbench.netlist.GateNet;
import com.rapidbench.netlist.GateNetlist;
import com.rapidbench.netlist.GateNode;
import com.rapidbench.netlist.GateType;
import com.rapidbench.netlist.LatchInit;
import com.rapidbench.netlist.NetlistIntegrityException;
import com.rapidbench.netlist.TruthTableCollapser;
import com.rapidbench.util.MessageGenerator;
import com.rapidbench.util.Params;

/**
 * Builds a {@link GateNetlist} from circuit text declarations.
 *
 * After the last statement, undriven constant nets get constant drivers,
 * every referenced net must have a driver, the combinational logic must be
 * acyclic and truth-table nodes are collapsed into covers.
 *
 * The reserved constant nets {@link #CONST0_NET} and {@link #CONST1_NET} are
 * not registered up front. They are created on first reference like any other
 * net, and only a referenced but undriven one gets a constant node, so a
 * netlist that never mentions them carries neither.
 */
public class GateNetlistBuilder implements BenchNetlistBuilder<GateNetlist> {

    public static final String CONST0_NET = "gnd";
    public static final String CONST1_NET = "vdd";
    public static final String LEGACY_CONST0_NET = "1";
    public static final String LEGACY_CONST1_NET = "2";

    private final GateNetlist netlist;

    private boolean numericConstantNets = Params.RB_BENCH_NUMERIC_CONSTANT_NETS;

    public GateNetlistBuilder(String netlistName) {
        netlist = new GateNetlist(netlistName);
    }

    /**
     * Sets whether undriven nets named "1" and "2" are tied to constant 0 and 1.
     * Defaults to {@link Params#RB_BENCH_NUMERIC_CONSTANT_NETS}.
     */
    public void setNumericConstantNets(boolean numericConstantNets) {
        this.numericConstantNets = numericConstantNets;
    }

    @Override
    public void addPrimaryInput(String name, int line) {
        netlist.addPrimaryInput(netlist.getOrCreateNet(name, line), line);
    }

    @Override
    public void addPrimaryOutput(String name, int line) {
        netlist.addPrimaryOutput(netlist.getOrCreateNet(name, line));
    }

    @Override
    public void addLatch(String output, String input, LatchInit init, int line) {
        GateNet in = netlist.getOrCreateNet(input, line);
        netlist.createLatch(netlist.getOrCreateNet(output, line), in, init, line);
    }

    @Override
    public void addScanFlop(String output, List<String> operands, int line) {
        addPrimaryInput(output, line);
        for (String operand : operands) {
            GateNet in = netlist.getOrCreateNet(operand, line);
            GateNet observed = netlist.getOrCreateNet(output + "_" + operand, line);
            netlist.createNode(observed, Collections.singletonList(in), GateFunction.of(GateType.BUFFER), line);
            netlist.addPrimaryOutput(observed);
        }
        netlist.incrementConstraintCount();
    }

    @Override
    public void addGate(String output, GateFunction function, List<String> inputs, int line) {
        GateNet out = netlist.getOrCreateNet(output, line);
        List<GateNet> in = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            in.add(netlist.getOrCreateNet(input, line));
        }
        netlist.createNode(out, in, function, line);
    }

    @Override
    public GateNetlist finish(String source) {
        addConstantDriver(CONST0_NET, GateType.CONST0, false);
        if (numericConstantNets) {
            addConstantDriver(LEGACY_CONST0_NET, GateType.CONST0, true);
        }
        addConstantDriver(CONST1_NET, GateType.CONST1, false);
        if (numericConstantNets) {
            addConstantDriver(LEGACY_CONST1_NET, GateType.CONST1, true);
        }

        for (GateNet net : netlist.getNets()) {
            if (net.isDriven()) continue;
            if (!net.getFanouts().isEmpty() || !net.getLatchFanouts().isEmpty() || net.isPrimaryOutput()) {
                throw new BenchParseException(source, net.getFirstReferenceLine(), net.getName(),
                        "Unresolved reference: net is not driven by an input, a gate, a latch or a constant");
            }
        }

        if (!netlist.isAcyclic()) {
            Set<String> names = new TreeSet<>();
            for (GateNode node : netlist.findCombinationalCycle()) {
                names.add(node.getName());
            }
            throw new NetlistIntegrityException("ERROR: " + source + ": Combinational cycle through nets "
                    + String.join(", ", names));
        }

        if (netlist.hasTruthTables()) {
            TruthTableCollapser.collapse(netlist);
        }
        return netlist;
    }

    private void addConstantDriver(String netName, GateType type, boolean warn) {
        GateNet net = netlist.getNet(netName);
        if (net == null || net.isDriven()) return;
        if (warn) {
            MessageGenerator.warning("Adding constant " + (type == GateType.CONST0 ? 0 : 1)
                    + " fanin to non-driven net \"" + netName + "\".");
        }
        netlist.createNode(net, Collections.<GateNet>emptyList(), GateFunction.of(type), -1);
    }
}
