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
import java.util.List;

import com.rapidbench.netlist.GateLatch;
import com.rapidbench.netlist.GateNet;
import com.rapidbench.netlist.GateNetlist;
import com.rapidbench.netlist.GateNode;

/**
 * Enumerates cuts in topological order by merging the cuts of each node's
 * fanins. Dominated cuts are dropped, the smallest cuts are kept up to the
 * cut limit and every signal keeps its trivial cut last.
 */
public class BottomUpCutEnumerator implements CutEnumerator {

    @Override
    public NetlistCuts enumerateCuts(GateNetlist netlist, NetlistIndex index, CutEnumerationParams params) {
        NetlistCuts cuts = new NetlistCuts(index.size());
        for (GateNet pi : netlist.getPrimaryInputs()) {
            int i = index.getIndex(pi);
            cuts.setCuts(i, Collections.singletonList(Cut.of(i)));
        }
        for (GateLatch latch : netlist.getLatches()) {
            int i = index.getIndex(latch.getOutput());
            cuts.setCuts(i, Collections.singletonList(Cut.of(i)));
        }
        for (GateNode node : netlist.getTopologicalOrder()) {
            int i = index.getIndex(node.getOutput());
            List<Cut> result = new ArrayList<>();
            if (node.getFaninCount() <= params.getFaninLimit()) {
                List<Cut> merged = Collections.singletonList(Cut.empty());
                for (GateNet input : node.getInputs()) {
                    merged = mergeAll(merged, cuts.getCuts(index.getIndex(input)), params.getCutSize());
                }
                List<Cut> sorted = new ArrayList<>(merged);
                Collections.sort(sorted);
                for (Cut cut : sorted) {
                    if (result.size() >= params.getCutLimit() - 1) break;
                    if (!cut.isTrivialFor(i)) {
                        result.add(cut);
                    }
                }
            }
            result.add(Cut.of(i));
            cuts.setCuts(i, result);
        }
        return cuts;
    }

    private static List<Cut> mergeAll(List<Cut> partial, List<Cut> faninCuts, int cutSize) {
        List<Cut> merged = new ArrayList<>();
        for (Cut a : partial) {
            for (Cut b : faninCuts) {
                Cut c = a.merge(b);
                if (c.size() <= cutSize) {
                    addIrredundant(merged, c);
                }
            }
        }
        return merged;
    }

    /**
     * Adds a cut unless an existing cut dominates it, removing the existing cuts it dominates.
     */
    static void addIrredundant(List<Cut> cuts, Cut cut) {
        for (Cut existing : cuts) {
            if (existing.dominates(cut)) return;
        }
        cuts.removeIf(cut::dominates);
        cuts.add(cut);
    }
}
