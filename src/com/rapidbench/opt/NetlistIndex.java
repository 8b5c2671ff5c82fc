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

package com.rapidbench.opt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rapidbench.netlist.GateLatch;
import com.rapidbench.netlist.GateNet;
import com.rapidbench.netlist.GateNetlist;
import com.rapidbench.netlist.GateNode;

/**
 * Numbers the signals of a netlist for cut enumeration. Indices 0 and 1 are
 * the constants, followed by primary inputs, latch outputs and gate outputs
 * in netlist order.
 */
public class NetlistIndex {

    public static final int CONST0_INDEX = 0;
    public static final int CONST1_INDEX = 1;
    public static final int FIRST_SIGNAL_INDEX = 2;

    private final Map<GateNet, Integer> indices = new HashMap<>();

    private final List<GateNet> nets = new ArrayList<>();

    public NetlistIndex(GateNetlist netlist) {
        nets.add(null);
        nets.add(null);
        for (GateNet pi : netlist.getPrimaryInputs()) {
            add(pi);
        }
        for (GateLatch latch : netlist.getLatches()) {
            add(latch.getOutput());
        }
        for (GateNode node : netlist.getNodes()) {
            add(node.getOutput());
        }
    }

    private void add(GateNet net) {
        indices.put(net, nets.size());
        nets.add(net);
    }

    /**
     * @param net A driven net of the netlist.
     * @return Its index.
     */
    public int getIndex(GateNet net) {
        Integer index = indices.get(net);
        if (index == null) {
            throw new IllegalArgumentException("Net " + net.getName() + " is not indexed");
        }
        return index;
    }

    public GateNet getNet(int index) {
        if (index < FIRST_SIGNAL_INDEX) {
            throw new IllegalArgumentException("Index " + index + " is a constant");
        }
        return nets.get(index);
    }

    /**
     * @return One more than the largest index.
     */
    public int size() {
        return nets.size();
    }

    /**
     * @return Net names keyed by the decimal text of their index, for matching
     * cut reports back to the netlist.
     */
    public Map<String, String> getIndexToNameMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = FIRST_SIGNAL_INDEX; i < nets.size(); i++) {
            map.put(Integer.toString(i), nets.get(i).getName());
        }
        return Collections.unmodifiableMap(map);
    }
}
