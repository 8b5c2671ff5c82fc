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

import com.rapidbench.util.Params;

/**
 * Limits of cut enumeration.
 */
public class CutEnumerationParams {

    public static final int DEFAULT_CUT_SIZE = 5;
    public static final int DEFAULT_CUT_LIMIT = 25;
    public static final int DEFAULT_FANIN_LIMIT = 10000;

    /** Maximum number of leaves of a cut */
    private final int cutSize;
    /** Maximum number of cuts kept per node, including the trivial cut */
    private final int cutLimit;
    /** Nodes with more inputs only get their trivial cut */
    private final int faninLimit;

    public CutEnumerationParams(int cutSize, int cutLimit, int faninLimit) {
        if (cutSize < 1 || cutLimit < 1 || faninLimit < 0) {
            throw new IllegalArgumentException("Invalid cut enumeration limits: cut size " + cutSize
                    + ", cut limit " + cutLimit + ", fanin limit " + faninLimit);
        }
        this.cutSize = cutSize;
        this.cutLimit = cutLimit;
        this.faninLimit = faninLimit;
    }

    /**
     * @return The default limits, overridden by RB_CUT_SIZE, RB_CUT_LIMIT and
     * RB_CUT_FANIN_LIMIT where set.
     */
    public static CutEnumerationParams defaults() {
        return new CutEnumerationParams(
                Params.getParamOrDefaultIntSetting(Params.RB_CUT_SIZE_NAME, DEFAULT_CUT_SIZE),
                Params.getParamOrDefaultIntSetting(Params.RB_CUT_LIMIT_NAME, DEFAULT_CUT_LIMIT),
                Params.getParamOrDefaultIntSetting(Params.RB_CUT_FANIN_LIMIT_NAME, DEFAULT_FANIN_LIMIT));
    }

    public int getCutSize() {
        return cutSize;
    }

    public int getCutLimit() {
        return cutLimit;
    }

    public int getFaninLimit() {
        return faninLimit;
    }

    @Override
    public String toString() {
        return "cut size " + cutSize + ", cut limit " + cutLimit + ", fanin limit " + faninLimit;
    }
}
