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

import java.util.List;

import com.rapidbench.netlist.GateFunction;
import com.rapidbench.netlist.LatchInit;

/**
 * Receives the declarations of circuit text in textual order and assembles a
 * graph from them. {@link BenchParser} has already checked the statement
 * syntax and the arity of every gate when a callback is made; the builder
 * owns net resolution and graph integrity.
 *
 * @param <T> The graph representation being built.
 */
public interface BenchNetlistBuilder<T> {

    void addPrimaryInput(String name, int line);

    void addPrimaryOutput(String name, int line);

    /**
     * Adds a latch whose output becomes valid one time step after its input.
     * @param output Net driven by the latch.
     * @param input Data input net.
     * @param init Initial value of the output.
     * @param line Line of the declaration.
     */
    void addLatch(String output, String input, LatchInit init, int line);

    /**
     * Adds a scan flip-flop declaration. The flop output becomes a primary
     * input; every operand is observed through a buffer driving a primary
     * output named {@code <output>_<operand>}.
     * @param output Net of the flop output.
     * @param operands The four flop operands in declaration order.
     * @param line Line of the declaration.
     */
    void addScanFlop(String output, List<String> operands, int line);

    /**
     * Adds a gate. The function accepts exactly inputs.size() inputs.
     * @param output Net driven by the gate.
     * @param function Function of the gate.
     * @param inputs Input net names in fanin order.
     * @param line Line of the declaration.
     */
    void addGate(String output, GateFunction function, List<String> inputs, int line);

    /**
     * Completes the graph once all statements have been read.
     * @param source Name of the parsed source, for diagnostics.
     * @return The finished graph.
     * @throws BenchParseException if a net is referenced but never driven.
     */
    T finish(String source);
}
