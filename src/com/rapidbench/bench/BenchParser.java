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
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.rapidbench.netlist.GateFunction;
import com.rapidbench.netlist.GateNetlist;
import com.rapidbench.netlist.GateType;
import com.rapidbench.netlist.LatchInit;
import com.rapidbench.netlist.TruthTable;
import com.rapidbench.util.MessageGenerator;

/**
 * A parser for circuit text in the bench format. It reads one statement at a
 * time, decides which declaration rule applies and hands the declaration to a
 * {@link BenchNetlistBuilder}. Any malformed statement aborts the parse with a
 * {@link BenchParseException} and the builder's partial graph is dropped.
 */
public class BenchParser implements AutoCloseable {

    public static final String INPUT = "INPUT";
    public static final String OUTPUT = "OUTPUT";
    public static final String DFF = "DFF";
    public static final String LUT = "LUT";
    public static final String HEX_PREFIX = "0x";
    public static final int SCAN_FLOP_OPERANDS = 4;

    private static final String DEFAULT_SOURCE = "<string>";

    private final BenchTokenizer tokenizer;

    private final String source;

    private int statementCount;

    public BenchParser(String source, InputStream in) {
        this.source = source;
        this.tokenizer = new BenchTokenizer(source, in);
    }

    public BenchParser(String source, InputStream in, CharClassTable charClasses, int maxTokenLength) {
        this.source = source;
        this.tokenizer = new BenchTokenizer(source, in, charClasses, maxTokenLength);
    }

    public BenchParser(Path fileName) throws IOException {
        this(fileName.toString(), Files.newInputStream(fileName));
    }

    /**
     * Parses the whole input.
     * @param builder Receives the declarations.
     * @param <T> Graph representation built.
     * @return The finished graph.
     */
    public <T> T parse(BenchNetlistBuilder<T> builder) {
        long start = System.nanoTime();
        List<BenchToken> statement;
        while ((statement = tokenizer.getOptionalNextStatement()) != null) {
            statementCount++;
            parseStatement(statement, builder);
        }
        T result = builder.finish(source);
        MessageGenerator.verboseMessage("Parsed " + statementCount + " statements of " + source + " in "
                + MessageGenerator.formatRuntime(System.nanoTime() - start));
        return result;
    }

    public GateNetlist parseGateNetlist() {
        return parse(new GateNetlistBuilder(netlistName(source)));
    }

    public static GateNetlist parseBenchString(String text) {
        InputStream in = new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
        try (BenchParser parser = new BenchParser(DEFAULT_SOURCE, in)) {
            return parser.parseGateNetlist();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static GateNetlist parseBenchFile(Path path) throws IOException {
        try (BenchParser parser = new BenchParser(path)) {
            return parser.parseGateNetlist();
        }
    }

    static String netlistName(String source) {
        if (DEFAULT_SOURCE.equals(source)) {
            return "bench";
        }
        String name = source;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * @return Number of statements read so far.
     */
    public int getStatementCount() {
        return statementCount;
    }

    private BenchParseException error(BenchToken token, String message) {
        return new BenchParseException(source, token, message);
    }

    private static List<String> texts(List<BenchToken> tokens, int from) {
        List<String> texts = new ArrayList<>(Math.max(0, tokens.size() - from));
        for (int i = from; i < tokens.size(); i++) {
            texts.add(tokens.get(i).text);
        }
        return texts;
    }

    protected <T> void parseStatement(List<BenchToken> statement, BenchNetlistBuilder<T> builder) {
        BenchToken first = statement.get(0);
        int line = first.line;
        if (statement.size() == 1) {
            throw error(first, "Wrong input file format: a statement needs at least two tokens");
        }
        if (INPUT.equals(first.text) || OUTPUT.equals(first.text)) {
            if (statement.size() != 2) {
                throw error(first, first.text + " takes exactly one net name, found " + (statement.size() - 1));
            }
            if (INPUT.equals(first.text)) {
                builder.addPrimaryInput(statement.get(1).text, line);
            } else {
                builder.addPrimaryOutput(statement.get(1).text, line);
            }
            return;
        }
        String type = statement.get(1).text;
        if (type.startsWith(DFF)) {
            parseFlop(statement, builder);
        } else if (LUT.equals(type)) {
            parseLut(statement, builder);
        } else {
            parsePrimitive(statement, builder);
        }
    }

    private <T> void parseFlop(List<BenchToken> statement, BenchNetlistBuilder<T> builder) {
        BenchToken output = statement.get(0);
        BenchToken type = statement.get(1);
        List<String> operands = texts(statement, 2);
        if (operands.size() == SCAN_FLOP_OPERANDS) {
            builder.addScanFlop(output.text, operands, output.line);
        } else if (operands.size() == 1) {
            builder.addLatch(output.text, operands.get(0), LatchInit.fromKeyword(type.text), output.line);
        } else {
            throw error(type, "Flip-flop needs 1 operand, or " + SCAN_FLOP_OPERANDS
                    + " for a scan flip-flop, found " + operands.size());
        }
    }

    private <T> void parseLut(List<BenchToken> statement, BenchNetlistBuilder<T> builder) {
        BenchToken output = statement.get(0);
        if (statement.size() < 3) {
            throw error(statement.get(1), "LUT declaration without a truth table");
        }
        BenchToken literal = statement.get(2);
        List<String> inputs = texts(statement, 3);
        int numInputs = inputs.size();
        if (numInputs > TruthTable.MAX_INPUTS) {
            throw error(literal, "Cannot read truth tables with more than " + TruthTable.MAX_INPUTS
                    + " inputs (" + numInputs + ")");
        }
        if (!literal.text.startsWith(HEX_PREFIX)) {
            throw error(literal, "The LUT signature does not look like a hexadecimal beginning with \""
                    + HEX_PREFIX + "\"");
        }
        TruthTable table;
        try {
            table = TruthTable.fromHex(literal.text.substring(HEX_PREFIX.length()), numInputs);
        } catch (IllegalArgumentException e) {
            throw error(literal, "Reading hexadecimal number has failed: " + e.getMessage());
        }

        List<String> noInputs = Collections.emptyList();
        if (table.isConst0()) {
            builder.addGate(output.text, GateFunction.of(GateType.CONST0), noInputs, output.line);
        } else if (numInputs == 1) {
            // 0x2 passes the input through, 0x1 inverts it
            if (table.getBit(1) && !table.getBit(0)) {
                builder.addGate(output.text, GateFunction.of(GateType.BUFFER), inputs, output.line);
            } else if (table.getBit(0) && !table.getBit(1)) {
                builder.addGate(output.text, GateFunction.of(GateType.INVERTER), inputs, output.line);
            } else {
                throw error(literal, "Truth table of single-input node is neither a buffer nor an inverter");
            }
        } else if (table.isConst1()) {
            builder.addGate(output.text, GateFunction.of(GateType.CONST1), noInputs, output.line);
        } else {
            builder.addGate(output.text, GateFunction.lut(table), inputs, output.line);
        }
    }

    private <T> void parsePrimitive(List<BenchToken> statement, BenchNetlistBuilder<T> builder) {
        BenchToken output = statement.get(0);
        BenchToken keyword = statement.get(1);
        GateType type = getPrimitiveType(keyword.text);
        if (type == null) {
            throw error(keyword, "Cannot determine gate type");
        }
        List<String> inputs = texts(statement, 2);
        if (!type.acceptsInputCount(inputs.size())) {
            throw error(keyword, "Gate " + type + " " + describeArity(type) + ", found " + inputs.size());
        }
        builder.addGate(output.text, GateFunction.of(type), inputs, output.line);
    }

    private static String describeArity(GateType type) {
        if (type.getMaxInputs() < 0) {
            return "needs at least " + type.getMinInputs() + " input(s)";
        }
        if (type.getMinInputs() == type.getMaxInputs()) {
            return "needs exactly " + type.getMinInputs() + " input(s)";
        }
        return "needs " + type.getMinInputs() + " to " + type.getMaxInputs() + " inputs";
    }

    /**
     * Maps a primitive gate keyword to its type. Matching is case-insensitive;
     * BUF, MUX, GND and VDD also match as prefixes (BUFF, MUX2, ...).
     * @param keyword The keyword of a declaration.
     * @return The type, or null if the keyword is unknown.
     */
    public static GateType getPrimitiveType(String keyword) {
        String k = keyword.toUpperCase(Locale.ROOT);
        switch (k) {
            case "AND":
                return GateType.AND;
            case "OR":
                return GateType.OR;
            case "NAND":
                return GateType.NAND;
            case "NOR":
                return GateType.NOR;
            case "XOR":
                return GateType.XOR;
            case "XNOR":
            case "NXOR":
                return GateType.XNOR;
            case "NOT":
                return GateType.INVERTER;
            default:
                break;
        }
        if (k.startsWith("BUF")) return GateType.BUFFER;
        if (k.startsWith("MUX")) return GateType.MUX;
        if (k.startsWith("GND")) return GateType.CONST0;
        if (k.startsWith("VDD")) return GateType.CONST1;
        return null;
    }

    public String getSource() {
        return source;
    }

    @Override
    public void close() throws IOException {
        tokenizer.close();
    }
}
