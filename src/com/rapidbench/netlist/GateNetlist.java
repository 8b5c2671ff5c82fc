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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.Nullable;
import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;

/**
 * A gate-level netlist: named nets, gate nodes, latches and the ordered lists
 * of primary inputs and outputs. Nets are keyed by their exact name
 * (case-sensitive, no normalization).
 *
 * A netlist is populated by one owner at a time and is not thread safe.
 */
public class GateNetlist {

    private final String name;

    private final Map<String, GateNet> nets = new LinkedHashMap<>();

    private final List<GateNode> nodes = new ArrayList<>();

    private final List<GateNet> primaryInputs = new ArrayList<>();

    private final List<GateNet> primaryOutputs = new ArrayList<>();

    private final List<GateLatch> latches = new ArrayList<>();

    /** Number of scan flip-flops expanded into input/output constraints */
    private int constraintCount;

    public GateNetlist() {
        this("netlist");
    }

    public GateNetlist(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    //===================================================================================//
    /* Nets                                                                              */
    //===================================================================================//
    @Nullable
    public GateNet getNet(String netName) {
        return nets.get(netName);
    }

    public GateNet getOrCreateNet(String netName) {
        return nets.computeIfAbsent(netName, GateNet::new);
    }

    /**
     * Gets or creates a net, recording the line of its first mention.
     * @param netName Name of the net.
     * @param line Line of the statement mentioning the net.
     * @return The existing or new net.
     */
    public GateNet getOrCreateNet(String netName, int line) {
        GateNet net = getOrCreateNet(netName);
        net.noteReference(line);
        return net;
    }

    public Collection<GateNet> getNets() {
        return Collections.unmodifiableCollection(nets.values());
    }

    //===================================================================================//
    /* Primary inputs, outputs and latches                                               */
    //===================================================================================//
    public void addPrimaryInput(GateNet net, int line) {
        net.setDriver(NetDriverType.PRIMARY_INPUT, null, null, line);
        primaryInputs.add(net);
    }

    public void addPrimaryOutput(GateNet net) {
        net.setPrimaryOutput(true);
        primaryOutputs.add(net);
    }

    public GateLatch createLatch(GateNet output, GateNet input, LatchInit init, int line) {
        GateLatch latch = new GateLatch(output, input, init, line);
        output.setDriver(NetDriverType.LATCH, null, latch, line);
        input.addLatchFanout(latch);
        latches.add(latch);
        return latch;
    }

    public List<GateNet> getPrimaryInputs() {
        return Collections.unmodifiableList(primaryInputs);
    }

    public List<GateNet> getPrimaryOutputs() {
        return Collections.unmodifiableList(primaryOutputs);
    }

    public List<GateLatch> getLatches() {
        return Collections.unmodifiableList(latches);
    }

    public int getConstraintCount() {
        return constraintCount;
    }

    public void incrementConstraintCount() {
        constraintCount++;
    }

    //===================================================================================//
    /* Nodes                                                                             */
    //===================================================================================//
    /**
     * Creates a gate node driving the given output net.
     * @param output Net driven by the new node.
     * @param inputs Input nets in fanin order.
     * @param function Function of the node, which must accept inputs.size() inputs.
     * @param line Line of the declaration, -1 if unknown.
     * @return The new node.
     * @throws NetlistIntegrityException if output already has a driver.
     */
    public GateNode createNode(GateNet output, List<GateNet> inputs, GateFunction function, int line) {
        if (!function.acceptsInputCount(inputs.size())) {
            throw new IllegalArgumentException("Function " + function + " does not accept " + inputs.size()
                    + " inputs (node " + output.getName() + ")");
        }
        GateNode node = new GateNode(nodes.size(), output, inputs, function, line);
        output.setDriver(NetDriverType.NODE, node, null, line);
        for (GateNet input : inputs) {
            input.addFanout(node);
        }
        nodes.add(node);
        return node;
    }

    /**
     * Convenience method creating a node from net names, creating the nets as needed.
     * @param outputName Name of the driven net.
     * @param function Function of the node.
     * @param inputNames Names of the input nets in fanin order.
     * @return The new node.
     */
    public GateNode createNode(String outputName, GateFunction function, String... inputNames) {
        List<GateNet> inputs = new ArrayList<>(inputNames.length);
        for (String inputName : inputNames) {
            inputs.add(getOrCreateNet(inputName));
        }
        return createNode(getOrCreateNet(outputName), inputs, function, -1);
    }

    public List<GateNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * @return True if no node has more than two inputs, the precondition for
     * writing circuit text.
     */
    public boolean isNormalized() {
        for (GateNode node : nodes) {
            if (node.getFaninCount() > 2) return false;
        }
        return true;
    }

    public boolean hasTruthTables() {
        for (GateNode node : nodes) {
            if (node.getType() == GateType.LUT) return true;
        }
        return false;
    }

    //===================================================================================//
    /* Graph view                                                                        */
    //===================================================================================//
    /**
     * Builds the combinational graph: one vertex per node and an edge from each
     * node to every node consuming its output. Latches, primary inputs and
     * constants are sources and do not appear as vertices.
     * @return A new graph.
     */
    public Graph<GateNode, DefaultEdge> getCombinationalGraph() {
        Graph<GateNode, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (GateNode node : nodes) {
            graph.addVertex(node);
        }
        for (GateNode node : nodes) {
            for (GateNet input : node.getInputs()) {
                GateNode driver = input.getDriverNode();
                if (driver != null) {
                    graph.addEdge(driver, node);
                }
            }
        }
        return graph;
    }

    public boolean isAcyclic() {
        return !new CycleDetector<>(getCombinationalGraph()).detectCycles();
    }

    /**
     * @return The nodes participating in combinational cycles, empty if there are none.
     */
    public Set<GateNode> findCombinationalCycle() {
        CycleDetector<GateNode, DefaultEdge> cycleDetector = new CycleDetector<>(getCombinationalGraph());
        return cycleDetector.findCycles();
    }

    /**
     * @return All nodes ordered so that every node comes after the drivers of its inputs.
     * @throws NetlistIntegrityException if the netlist has a combinational cycle.
     */
    public List<GateNode> getTopologicalOrder() {
        Graph<GateNode, DefaultEdge> graph = getCombinationalGraph();
        if (new CycleDetector<>(graph).detectCycles()) {
            throw new NetlistIntegrityException("ERROR: Netlist " + name + " has a combinational cycle");
        }
        List<GateNode> order = new ArrayList<>(nodes.size());
        new TopologicalOrderIterator<>(graph).forEachRemaining(order::add);
        return order;
    }

    /**
     * Evaluates the combinational logic for one time step.
     * @param values Values of primary inputs and latch outputs by net name.
     * Missing latch outputs take their initial value (don't-care reads as 0);
     * missing primary inputs read as 0.
     * @return Values of all driven nets by name.
     */
    public Map<String, Boolean> evaluate(Map<String, Boolean> values) {
        Map<GateNet, Boolean> netValues = new HashMap<>();
        for (GateNet pi : primaryInputs) {
            netValues.put(pi, values.getOrDefault(pi.getName(), false));
        }
        for (GateLatch latch : latches) {
            boolean init = latch.getInit() == LatchInit.ONE;
            netValues.put(latch.getOutput(), values.getOrDefault(latch.getOutput().getName(), init));
        }
        for (GateNode node : getTopologicalOrder()) {
            boolean[] in = new boolean[node.getFaninCount()];
            for (int i = 0; i < in.length; i++) {
                Boolean v = netValues.get(node.getInput(i));
                if (v == null) {
                    throw new IllegalStateException("Net " + node.getInput(i).getName() + " has no value");
                }
                in[i] = v;
            }
            netValues.put(node.getOutput(), node.evaluate(in));
        }
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (GateNet net : nets.values()) {
            Boolean v = netValues.get(net);
            if (v != null) {
                result.put(net.getName(), v);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return name + " (" + primaryInputs.size() + " inputs, " + primaryOutputs.size() + " outputs, "
                + latches.size() + " latches, " + nodes.size() + " nodes)";
    }
}
