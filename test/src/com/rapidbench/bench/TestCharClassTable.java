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

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestCharClassTable {

    @ParameterizedTest
    @CsvSource({
            "35, COMMENT",   // #
            "10, STOP",      // \n
            "13, STOP",      // \r
            "32, CLEAN",     // space
            "9, CLEAN",      // \t
            "44, CLEAN",     // ,
            "40, CLEAN",     // (
            "41, CLEAN",     // )
            "61, CLEAN",     // =
            "97, NORMAL",    // a
            "48, NORMAL",    // 0
            "95, NORMAL",    // _
            "255, NORMAL",
    })
    public void testBenchDefaults(int b, CharClass expected) {
        Assertions.assertEquals(expected, CharClassTable.bench().classify(b));
        Assertions.assertEquals(expected, CharClassTable.bench().classify((byte) b));
    }

    @Test
    public void testEveryByteClassified() {
        CharClassTable table = new CharClassTable("#;", "\n", " \t");
        for (int b = 0; b < 256; b++) {
            Assertions.assertNotNull(table.classify(b));
        }
    }

    @Test
    public void testLaterSetsOverride() {
        CharClassTable table = new CharClassTable("#;", "\n;", " ;");
        Assertions.assertEquals(CharClass.CLEAN, table.classify(';'));
        Assertions.assertEquals(CharClass.COMMENT, table.classify('#'));
    }

    private static List<String> tokenize(String text, CharClassTable table) {
        BenchTokenizer tokenizer = new BenchTokenizer("test",
                new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), table, 64);
        List<String> tokens = new ArrayList<>();
        BenchToken t;
        while ((t = tokenizer.getOptionalNextToken()) != null) {
            tokens.add(t.text);
        }
        return tokens;
    }

    @Test
    public void testCommentCharactersOnlyMoveCommentBoundaries() {
        String text = "a b ; c # d\ne";
        CharClassTable hash = new CharClassTable("#", "\n\r", " \t,()=");
        CharClassTable semicolon = new CharClassTable(";", "\n\r", " \t,()=");
        Assertions.assertEquals(List.of("a", "b", ";", "c", "e"), tokenize(text, hash));
        Assertions.assertEquals(List.of("a", "b", "e"), tokenize(text, semicolon));
    }
}
