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

/**
 * A gate instance: an output net, an ordered list of input nets and a
 * {@link GateFunction}. Input order is significant; the same net may appear
 * more than once.
 */
public class GateNode {

    private final int index;

    private final GateNet output;

    private final List<GateNet> inputs;

    private GateFunction function;

    private final int line;

    GateNode(int index, GateNet output, List<GateNet> inputs, GateFunction function, int line) {
        this.index = index;
        this.output = output;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.function = function;
        this.line = line;
    }

    /**
     * @return Position of this node in the netlist's node list.
     */
    public int getIndex() {
        return index;
    }

    public GateNet getOutput() {
        return output;
    }

    /**
     * @return Name of the output net, which is also the name of the node.
     */
    public String getName() {
        return output.getName();
    }

    public List<GateNet> getInputs() {
        return inputs;
    }

    public GateNet getInput(int i) {
        return inputs.get(i);
    }

    public int getFaninCount() {
        return inputs.size();
    }

    public GateFunction getFunction() {
        return function;
    }

    void setFunction(GateFunction function) {
        if (!function.acceptsInputCount(inputs.size())) {
            throw new IllegalArgumentException("Function " + function + " does not fit " + inputs.size()
                    + " inputs of node " + getName());
        }
        this.function = function;
    }

    public GateType getType() {
        return function.getType();
    }

    /**
     * @return Line of the declaration that created this node, -1 if unknown.
     */
    public int getLine() {
        return line;
    }

    public boolean evaluate(boolean[] inputValues) {
        return function.evaluate(inputValues);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getName()).append(" = ").append(function).append('(');
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(inputs.get(i).getName());
        }
        return sb.append(')').toString();
    }
}
