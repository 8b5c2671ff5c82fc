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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Maps every byte value to its {@link CharClass}. Built once per parse from the
 * comment, stop and clean character sets; every other byte is
 * {@link CharClass#NORMAL}.
 */
public class CharClassTable {

    public static final String DEFAULT_COMMENT_CHARS = "#";
    public static final String DEFAULT_STOP_CHARS = "\n\r";
    public static final String DEFAULT_CLEAN_CHARS = " \t,()=";

    private static final CharClassTable BENCH = new CharClassTable(DEFAULT_COMMENT_CHARS, DEFAULT_STOP_CHARS,
            DEFAULT_CLEAN_CHARS);

    private final CharClass[] classes = new CharClass[256];

    /**
     * Creates a table. A character listed in more than one set takes the class of
     * the last set listing it, in the order comment, stop, clean.
     * @param commentChars Characters starting a comment.
     * @param stopChars Characters ending a statement.
     * @param cleanChars Characters separating tokens.
     */
    public CharClassTable(String commentChars, String stopChars, String cleanChars) {
        Arrays.fill(classes, CharClass.NORMAL);
        assign(commentChars, CharClass.COMMENT);
        assign(stopChars, CharClass.STOP);
        assign(cleanChars, CharClass.CLEAN);
    }

    /**
     * @return The shared table of the bench format.
     */
    public static CharClassTable bench() {
        return BENCH;
    }

    private void assign(String chars, CharClass charClass) {
        for (byte b : chars.getBytes(StandardCharsets.ISO_8859_1)) {
            classes[b & 0xFF] = charClass;
        }
    }

    public CharClass classify(byte b) {
        return classes[b & 0xFF];
    }

    public CharClass classify(int b) {
        return classes[b & 0xFF];
    }
}
