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
 * Initial value of a latch at the first time step.
 */
public enum LatchInit {
    ZERO,
    ONE,
    DONT_CARE;

    /**
     * Derives the initial value from the character following "DFF" in a flip-flop
     * keyword: '0' and '1' select the value, anything else (including no
     * character at all) means don't-care.
     * @param keyword The flip-flop keyword, for example "DFF", "DFF0" or "DFF1".
     * @return The initial value tag.
     */
    public static LatchInit fromKeyword(String keyword) {
        if (keyword.length() > 3) {
            char c = keyword.charAt(3);
            if (c == '0') return ZERO;
            if (c == '1') return ONE;
        }
        return DONT_CARE;
    }
}
