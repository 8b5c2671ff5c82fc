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

import java.util.List;
import java.util.Map;

/**
 * The text form of enumerated cuts, one block per signal:
 * <pre>
 * Node: 5
 * { 2 3 }
 * { 5 }
 *
 * </pre>
 * paired with the map from index text to net name.
 */
public class CutReport {

    private final String text;

    private final Map<String, String> indexToName;

    public CutReport(String text, Map<String, String> indexToName) {
        this.text = text;
        this.indexToName = indexToName;
    }

    /**
     * Renders the cuts of every index from {@link NetlistIndex#FIRST_SIGNAL_INDEX} on.
     * @param cuts The enumerated cuts.
     * @param index The index the cuts refer to.
     * @return The report text.
     */
    public static String format(NetlistCuts cuts, NetlistIndex index) {
        StringBuilder sb = new StringBuilder();
        for (int i = NetlistIndex.FIRST_SIGNAL_INDEX; i < index.size(); i++) {
            sb.append("Node: ").append(i).append('\n');
            List<Cut> nodeCuts = cuts.getCuts(i);
            for (Cut cut : nodeCuts) {
                sb.append(cut).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String getText() {
        return text;
    }

    public Map<String, String> getIndexToName() {
        return indexToName;
    }
}
