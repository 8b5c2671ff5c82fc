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
 * Computes the cuts of every signal of a complete netlist.
 */
public interface CutEnumerator {

    NetlistCuts enumerateCuts(GateNetlist netlist, NetlistIndex index, CutEnumerationParams params);

    /**
     * @return The bottom-up enumerator.
     */
    static CutEnumerator bottomUp() {
        return new BottomUpCutEnumerator();
    }
}
