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

import com.rapidbench.netlist.GateNetlist;

/**
 * An external logic optimizer. It receives a complete netlist and returns a
 * transformed one, which may be an entirely new object. The input netlist
 * stays valid until the call returns.
 */
@FunctionalInterface
public interface NetlistOptimizer {

    /**
     * @param session The session the transform runs in; the caller holds its lock.
     * @param netlist The netlist to transform.
     * @param command Optimizer-specific command script.
     * @return The transformed netlist.
     * @throws NetlistOptimizationException if the optimizer fails.
     */
    GateNetlist optimize(OptimizationSession session, GateNetlist netlist, String command);

    /**
     * @return An optimizer returning its input unchanged.
     */
    static NetlistOptimizer identity() {
        return (session, netlist, command) -> netlist;
    }
}
