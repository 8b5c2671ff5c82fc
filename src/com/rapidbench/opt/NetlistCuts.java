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

/**
 * The cuts of every signal of a netlist, by {@link NetlistIndex} index.
 * Read-only once enumeration has finished.
 */
public class NetlistCuts {

    private final List<List<Cut>> cuts;

    public NetlistCuts(int size) {
        cuts = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            cuts.add(Collections.<Cut>emptyList());
        }
    }

    void setCuts(int index, List<Cut> indexCuts) {
        cuts.set(index, Collections.unmodifiableList(new ArrayList<>(indexCuts)));
    }

    public List<Cut> getCuts(int index) {
        return cuts.get(index);
    }

    public int size() {
        return cuts.size();
    }

    public int getTotalCutCount() {
        int total = 0;
        for (List<Cut> c : cuts) {
            total += c.size();
        }
        return total;
    }
}
