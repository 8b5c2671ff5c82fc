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

/**
 * A latch bridging two time steps: the output net carries the value the
 * input net had in the previous step.
 */
public class GateLatch {

    private final GateNet output;

    private final GateNet input;

    private final LatchInit init;

    private final int line;

    GateLatch(GateNet output, GateNet input, LatchInit init, int line) {
        this.output = output;
        this.input = input;
        this.init = init;
        this.line = line;
    }

    public GateNet getOutput() {
        return output;
    }

    public GateNet getInput() {
        return input;
    }

    public LatchInit getInit() {
        return init;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return output.getName() + " = DFF(" + input.getName() + ") init " + init;
    }
}
