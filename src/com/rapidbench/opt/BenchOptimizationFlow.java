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

import com.rapidbench.bench.BenchParser;
import com.rapidbench.bench.BenchWriter;
import com.rapidbench.netlist.GateNetlist;
import com.rapidbench.util.MessageGenerator;

/**
 * Text-in, text-out entry points: circuit text is parsed, handed to an
 * optimizer or a cut enumerator, and the result is returned as text.
 *
 * Parsing, optimizing and writing happen under the session lock, so calls
 * sharing a session are serialized.
 */
public class BenchOptimizationFlow {

    private BenchOptimizationFlow() {
    }

    /**
     * Parses circuit text, runs an optimizer on it and writes the result.
     * @param session Session the optimizer works in; it holds the optimized netlist afterwards.
     * @param optimizer The optimizer.
     * @param benchText Circuit text.
     * @param command Optimizer command script.
     * @return Circuit text of the optimized netlist.
     * @throws com.rapidbench.bench.BenchParseException if the text is malformed.
     * @throws NetlistOptimizationException if the optimizer fails or returns nothing.
     * @throws com.rapidbench.bench.BenchWritePreconditionException if the optimized
     * netlist is not normalized.
     */
    public static String transform(OptimizationSession session, NetlistOptimizer optimizer, String benchText,
                                   String command) {
        return session.runExclusive(() -> {
            long start = System.nanoTime();
            GateNetlist netlist = BenchParser.parseBenchString(benchText);
            session.setCurrentNetlist(netlist);
            GateNetlist optimized = optimizer.optimize(session, netlist, command);
            if (optimized == null) {
                throw new NetlistOptimizationException("ERROR: Optimizer returned no netlist for command '"
                        + command + "'");
            }
            session.setCurrentNetlist(optimized);
            String result = BenchWriter.writeBenchString(optimized);
            MessageGenerator.verboseMessage("Transformed " + netlist.getNodes().size() + " nodes into "
                    + optimized.getNodes().size() + " nodes in "
                    + MessageGenerator.formatRuntime(System.nanoTime() - start));
            return result;
        });
    }

    /**
     * Parses circuit text and enumerates the cuts of every signal.
     * @param benchText Circuit text.
     * @param enumerator The enumerator.
     * @param params Enumeration limits.
     * @return The cut report and the index-to-name map.
     */
    public static CutReport enumerateCuts(String benchText, CutEnumerator enumerator, CutEnumerationParams params) {
        GateNetlist netlist = BenchParser.parseBenchString(benchText);
        NetlistIndex index = new NetlistIndex(netlist);
        NetlistCuts cuts = enumerator.enumerateCuts(netlist, index, params);
        MessageGenerator.verboseMessage("Enumerated " + cuts.getTotalCutCount() + " cuts of "
                + netlist.getName() + " (" + params + ")");
        return new CutReport(CutReport.format(cuts, index), index.getIndexToNameMap());
    }

    public static CutReport enumerateCuts(String benchText) {
        return enumerateCuts(benchText, CutEnumerator.bottomUp(), CutEnumerationParams.defaults());
    }
}
