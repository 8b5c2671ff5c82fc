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
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.rapidbench.netlist.GateFunction;
import com.rapidbench.netlist.GateLatch;
import com.rapidbench.netlist.GateNet;
import com.rapidbench.netlist.GateNetlist;
import com.rapidbench.netlist.GateNode;
import com.rapidbench.netlist.GateType;
import com.rapidbench.netlist.LatchInit;
import com.rapidbench.netlist.NetDriverType;
import com.rapidbench.netlist.NetlistIntegrityException;
import com.rapidbench.netlist.TruthTable;

public class TestBenchParser {

    public static final String EXAMPLE = "INPUT(0)\nINPUT(1)\n2 = AND(0, 1)\n3 = NOT(0)\n4 = AND(3, 0)\n"
            + "5 = AND(2, 4)\nOUTPUT(5)";

    private static GateNetlist parse(String text) {
        return BenchParser.parseBenchString(text);
    }

    private static List<String> inputNames(GateNode node) {
        List<String> names = new ArrayList<>();
        for (GateNet net : node.getInputs()) {
            names.add(net.getName());
        }
        return names;
    }

    @Test
    public void testExample() {
        GateNetlist netlist = parse(EXAMPLE);
        Assertions.assertEquals(2, netlist.getPrimaryInputs().size());
        Assertions.assertEquals(1, netlist.getPrimaryOutputs().size());
        Assertions.assertEquals("5", netlist.getPrimaryOutputs().get(0).getName());
        Assertions.assertEquals(4, netlist.getNodes().size());
        Assertions.assertTrue(netlist.getLatches().isEmpty());

        GateNode n2 = netlist.getNet("2").getDriverNode();
        Assertions.assertEquals(GateType.AND, n2.getType());
        Assertions.assertEquals(List.of("0", "1"), inputNames(n2));
        GateNode n3 = netlist.getNet("3").getDriverNode();
        Assertions.assertEquals(GateType.INVERTER, n3.getType());
        Assertions.assertEquals(List.of("0"), inputNames(n3));
        GateNode n4 = netlist.getNet("4").getDriverNode();
        Assertions.assertEquals(GateType.AND, n4.getType());
        Assertions.assertEquals(List.of("3", "0"), inputNames(n4));
        GateNode n5 = netlist.getNet("5").getDriverNode();
        Assertions.assertEquals(GateType.AND, n5.getType());
        Assertions.assertEquals(List.of("2", "4"), inputNames(n5));

        Assertions.assertEquals(6, n5.getLine());
        Assertions.assertEquals(NetDriverType.PRIMARY_INPUT, netlist.getNet("0").getDriverType());
    }

    @Test
    public void testExampleWritten() {
        String expected = "INPUT(0)\n"
                + "INPUT(1)\n"
                + "OUTPUT(5)\n"
                + String.format("%-11s = AND(0, 1)\n", "2")
                + String.format("%-11s = NOT(0)\n", "3")
                + String.format("%-11s = AND(3, 0)\n", "4")
                + String.format("%-11s = AND(2, 4)\n", "5");
        Assertions.assertEquals(expected, BenchWriter.writeBenchString(parse(EXAMPLE)));
    }

    @Test
    public void testFixture() throws IOException {
        try (InputStream in = TestBenchParser.class.getResourceAsStream("/c17.bench");
             BenchParser parser = new BenchParser("c17.bench", in)) {
            GateNetlist netlist = parser.parseGateNetlist();
            Assertions.assertEquals("c17", netlist.getName());
            Assertions.assertEquals(13, parser.getStatementCount());
            Assertions.assertEquals(5, netlist.getPrimaryInputs().size());
            Assertions.assertEquals(2, netlist.getPrimaryOutputs().size());
            Assertions.assertEquals(6, netlist.getNodes().size());
            Assertions.assertEquals(16, netlist.getNet("10").getDriverLine());

            Map<String, Boolean> zeros = new HashMap<>();
            Map<String, Boolean> values = netlist.evaluate(zeros);
            Assertions.assertFalse(values.get("22"));
            Assertions.assertFalse(values.get("23"));

            Map<String, Boolean> ones = new HashMap<>();
            for (GateNet pi : netlist.getPrimaryInputs()) {
                ones.put(pi.getName(), true);
            }
            values = netlist.evaluate(ones);
            Assertions.assertTrue(values.get("22"));
            Assertions.assertFalse(values.get("23"));
        }
    }

    @ParameterizedTest
    @CsvSource({
            "0x8, 2, 8",
            "0x08, 2, 8",
            "0xe, 2, e",
            "0x6, 2, 6",
            "0xCA, 3, ca",
            "0x1, 3, 01",
            "0x8000, 4, 8000",
    })
    public void testLutCollapsed(String literal, int numInputs, String expectedHex) {
        StringBuilder sb = new StringBuilder();
        List<String> inputs = new ArrayList<>();
        for (int i = 0; i < numInputs; i++) {
            sb.append("INPUT(i").append(i).append(")\n");
            inputs.add("i" + i);
        }
        sb.append("y = LUT ").append(literal).append(" (").append(String.join(", ", inputs)).append(")\n");
        sb.append("OUTPUT(y)\n");
        GateNetlist netlist = parse(sb.toString());
        GateNode node = netlist.getNet("y").getDriverNode();
        Assertions.assertEquals(GateType.SOP, node.getType());
        Assertions.assertFalse(netlist.hasTruthTables());
        Assertions.assertEquals(expectedHex, node.getFunction().toTruthTable(numInputs).toHex());
    }

    @Test
    public void testLutAnd() {
        GateNetlist netlist = parse("INPUT(a)\nINPUT(b)\ny = LUT 0x8 (a, b)\nOUTPUT(y)\n");
        GateNode node = netlist.getNet("y").getDriverNode();
        Assertions.assertEquals(List.of("a", "b"), inputNames(node));
        Assertions.assertEquals(List.of("11"), node.getFunction().getCover().getCubes());
        Assertions.assertFalse(node.getFunction().getCover().isComplemented());
        Assertions.assertEquals("11 1\n", node.getFunction().getCover().toString());
    }

    @ParameterizedTest
    @CsvSource({
            "0x2, BUFFER, 1",
            "0x1, INVERTER, 1",
            "0x0, CONST0, 0",
    })
    public void testSingleInputLut(String literal, GateType expected, int fanin) {
        GateNetlist netlist = parse("INPUT(a)\ny = LUT " + literal + " (a)\nOUTPUT(y)\n");
        GateNode node = netlist.getNet("y").getDriverNode();
        Assertions.assertEquals(expected, node.getType());
        Assertions.assertEquals(fanin, node.getFaninCount());
    }

    @ParameterizedTest
    @CsvSource({
            "0xF, 2",
            "0xff, 3",
            "0x1, 0",
    })
    public void testConstantOneLut(String literal, int numInputs) {
        StringBuilder sb = new StringBuilder();
        List<String> inputs = new ArrayList<>();
        for (int i = 0; i < numInputs; i++) {
            sb.append("INPUT(i").append(i).append(")\n");
            inputs.add("i" + i);
        }
        sb.append("y = LUT ").append(literal).append(" (").append(String.join(", ", inputs)).append(")\n");
        GateNode node = parse(sb.toString()).getNet("y").getDriverNode();
        Assertions.assertEquals(GateType.CONST1, node.getType());
        Assertions.assertEquals(0, node.getFaninCount());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "y = LUT 0x3 (a)",
            "y = LUT 0x4 (a)",
            "y = LUT 0x12 (a)",
            "y = LUT 0xG (a)",
            "y = LUT 8 (a)",
            "y = LUT",
            "y = LUT 0x1ff (a, b)",
            // fullwidth and Arabic-Indic eights are not hexadecimal digits
            "y = LUT 0x\uFF18 (a, b)",
            "y = LUT 0x\u0668 (a, b)",
    })
    public void testBadLut(String statement) {
        BenchParseException e = Assertions.assertThrows(BenchParseException.class,
                () -> parse("INPUT(a)\nINPUT(b)\n" + statement + "\n"));
        Assertions.assertEquals(3, e.getLine());
        Assertions.assertTrue(e.getMessage().startsWith("ERROR: <string>:3: "));
    }

    @Test
    public void testLutTooManyInputs() {
        StringBuilder sb = new StringBuilder("y = LUT 0x1 (");
        for (int i = 0; i < 16; i++) {
            sb.append(i == 0 ? "" : ", ").append("i").append(i);
        }
        sb.append(")\n");
        BenchParseException e = Assertions.assertThrows(BenchParseException.class, () -> parse(sb.toString()));
        Assertions.assertTrue(e.getMessage().contains("more than 15 inputs (16)"));
    }

    @Test
    public void testUnresolvedReference() {
        BenchParseException e = Assertions.assertThrows(BenchParseException.class,
                () -> parse("y = AND(a, b)\nOUTPUT(y)\n"));
        Assertions.assertEquals(1, e.getLine());
        Assertions.assertEquals("a", e.getToken());
        Assertions.assertTrue(e.getMessage().contains("Unresolved reference"));
    }

    @Test
    public void testUndrivenOutput() {
        BenchParseException e = Assertions.assertThrows(BenchParseException.class,
                () -> parse("INPUT(a)\nOUTPUT(y)\n"));
        Assertions.assertEquals(2, e.getLine());
        Assertions.assertEquals("y", e.getToken());
    }

    @ParameterizedTest
    @CsvSource({
            "gnd, CONST0",
            "vdd, CONST1",
    })
    public void testConstantSynthesis(String constant, GateType expected) {
        GateNetlist netlist = parse("INPUT(a)\ny = AND(a, " + constant + ")\nOUTPUT(y)\n");
        GateNet net = netlist.getNet(constant);
        Assertions.assertTrue(net.isDriven());
        GateNode driver = net.getDriverNode();
        Assertions.assertEquals(expected, driver.getType());
        Assertions.assertEquals(0, driver.getFaninCount());
        Assertions.assertEquals(2, netlist.getNodes().size());
    }

    @Test
    public void testUnreferencedConstantsNotSynthesized() {
        GateNetlist netlist = parse("INPUT(a)\ny = NOT(a)\nOUTPUT(y)\n");
        Assertions.assertNull(netlist.getNet("gnd"));
        Assertions.assertNull(netlist.getNet("vdd"));
        Assertions.assertEquals(1, netlist.getNodes().size());
    }

    @Test
    public void testExplicitConstants() {
        GateNetlist netlist = parse("z = gnd\no = VDD\ny = AND(z, o)\nOUTPUT(y)\n");
        Assertions.assertEquals(GateType.CONST0, netlist.getNet("z").getDriverNode().getType());
        Assertions.assertEquals(GateType.CONST1, netlist.getNet("o").getDriverNode().getType());
        Assertions.assertFalse(netlist.evaluate(new HashMap<>()).get("y"));
    }

    @Test
    public void testNumericConstantNets() {
        String text = "INPUT(a)\ny = AND(a, 2)\nz = OR(a, 1)\nOUTPUT(y)\nOUTPUT(z)\n";
        Assertions.assertThrows(BenchParseException.class, () -> parseWithNumericConstants(text, false));

        GateNetlist netlist = parseWithNumericConstants(text, true);
        Assertions.assertEquals(GateType.CONST0, netlist.getNet("1").getDriverNode().getType());
        Assertions.assertEquals(GateType.CONST1, netlist.getNet("2").getDriverNode().getType());
    }

    private static GateNetlist parseWithNumericConstants(String text, boolean enabled) {
        GateNetlistBuilder builder = new GateNetlistBuilder("legacy");
        builder.setNumericConstantNets(enabled);
        InputStream in = new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
        return new BenchParser("legacy.bench", in).parse(builder);
    }

    @Test
    public void testErrorLineAfterCommentLine() {
        String text = "# header comment\nINPUT(a)\nINPUT(b)\ny = AND(a, b)\nz = FOO(a, b)\nOUTPUT(z)\n";
        BenchParseException e = Assertions.assertThrows(BenchParseException.class, () -> parse(text));
        Assertions.assertEquals(5, e.getLine());
        Assertions.assertEquals("FOO", e.getToken());
        Assertions.assertTrue(e.getMessage().contains("Cannot determine gate type"));
    }

    @Test
    public void testSingleTokenStatement() {
        BenchParseException e = Assertions.assertThrows(BenchParseException.class,
                () -> parse("INPUT(a)\n\nfoo\n"));
        Assertions.assertEquals(3, e.getLine());
    }

    @ParameterizedTest
    @ValueSource(strings = {"INPUT(a, b)", "OUTPUT(a, b)", "y = NOT(a, b)", "y = BUFF(a, b)", "y = MUX(a, b)",
            "y = AND()", "y = gnd(a)", "y = DFF(a, b)"})
    public void testWrongArity(String statement) {
        BenchParseException e = Assertions.assertThrows(BenchParseException.class,
                () -> parse("INPUT(a)\nINPUT(b)\n" + statement + "\n"));
        Assertions.assertEquals(3, e.getLine());
    }

    @ParameterizedTest
    @CsvSource({
            "and, AND",
            "Or, OR",
            "NAND, NAND",
            "nor, NOR",
            "xor, XOR",
            "XNOR, XNOR",
            "nxor, XNOR",
            "BUF, BUFFER",
            "BUFF, BUFFER",
            "not, INVERTER",
            "MUX, MUX",
            "mux21, MUX",
            "GND, CONST0",
            "vdd, CONST1",
    })
    public void testPrimitiveKeywords(String keyword, GateType expected) {
        Assertions.assertEquals(expected, BenchParser.getPrimitiveType(keyword));
    }

    @ParameterizedTest
    @ValueSource(strings = {"FOO", "AN", "NAN", "LUT4", "INV"})
    public void testUnknownKeywords(String keyword) {
        Assertions.assertNull(BenchParser.getPrimitiveType(keyword));
    }

    @Test
    public void testMux() {
        GateNetlist netlist = parse("INPUT(s)\nINPUT(a)\nINPUT(b)\ny = MUX(s, a, b)\nOUTPUT(y)\n");
        for (int v = 0; v < 8; v++) {
            boolean s = (v & 1) != 0;
            boolean a = (v & 2) != 0;
            boolean b = (v & 4) != 0;
            Map<String, Boolean> in = new HashMap<>();
            in.put("s", s);
            in.put("a", a);
            in.put("b", b);
            Assertions.assertEquals(s ? a : b, netlist.evaluate(in).get("y"));
        }
    }

    @ParameterizedTest
    @CsvSource({
            "DFF, DONT_CARE",
            "DFF0, ZERO",
            "DFF1, ONE",
            "DFFX, DONT_CARE",
    })
    public void testLatch(String keyword, LatchInit expected) {
        GateNetlist netlist = parse("INPUT(a)\nq = " + keyword + "(d)\nd = AND(a, q)\nOUTPUT(q)\n");
        Assertions.assertEquals(1, netlist.getLatches().size());
        GateLatch latch = netlist.getLatches().get(0);
        Assertions.assertEquals("q", latch.getOutput().getName());
        Assertions.assertEquals("d", latch.getInput().getName());
        Assertions.assertEquals(expected, latch.getInit());
        Assertions.assertEquals(2, latch.getLine());
        Assertions.assertTrue(netlist.isAcyclic());
    }

    @Test
    public void testScanFlop() {
        GateNetlist netlist = parse("INPUT(a)\nINPUT(b)\nINPUT(c)\nINPUT(e)\nq = DFFRSE(a, b, c, e)\n");
        Assertions.assertEquals(5, netlist.getPrimaryInputs().size());
        Assertions.assertEquals("q", netlist.getPrimaryInputs().get(4).getName());
        Assertions.assertEquals(4, netlist.getPrimaryOutputs().size());
        Assertions.assertEquals("q_a", netlist.getPrimaryOutputs().get(0).getName());
        Assertions.assertEquals("q_e", netlist.getPrimaryOutputs().get(3).getName());
        Assertions.assertEquals(4, netlist.getNodes().size());
        for (GateNode node : netlist.getNodes()) {
            Assertions.assertEquals(GateType.BUFFER, node.getType());
        }
        Assertions.assertEquals("c", netlist.getNet("q_c").getDriverNode().getInput(0).getName());
        Assertions.assertEquals(1, netlist.getConstraintCount());
        Assertions.assertTrue(netlist.getLatches().isEmpty());
    }

    @Test
    public void testDuplicateDriver() {
        NetlistIntegrityException e = Assertions.assertThrows(NetlistIntegrityException.class,
                () -> parse("INPUT(a)\ny = NOT(a)\ny = BUF(a)\n"));
        Assertions.assertTrue(e.getMessage().contains("line 2"));
        Assertions.assertTrue(e.getMessage().contains("line 3"));
    }

    @Test
    public void testInputDrivenByGate() {
        Assertions.assertThrows(NetlistIntegrityException.class,
                () -> parse("INPUT(a)\nINPUT(b)\na = NOT(b)\n"));
    }

    @Test
    public void testCombinationalCycle() {
        NetlistIntegrityException e = Assertions.assertThrows(NetlistIntegrityException.class,
                () -> parse("INPUT(a)\nx = AND(a, y)\ny = NOT(x)\nOUTPUT(y)\n"));
        Assertions.assertTrue(e.getMessage().contains("x, y"));
    }

    @Test
    public void testForwardReferences() {
        GateNetlist netlist = parse("OUTPUT(y)\ny = NOT(x)\nx = BUFF(a)\nINPUT(a)\n");
        List<GateNode> order = netlist.getTopologicalOrder();
        Assertions.assertEquals("x", order.get(0).getName());
        Assertions.assertEquals("y", order.get(1).getName());
    }

    @Test
    public void testLongChainWithSmallBuffer() {
        StringBuilder sb = new StringBuilder("INPUT(n0)\n");
        int length = 5000;
        for (int i = 1; i <= length; i++) {
            sb.append("n").append(i).append(" = NOT(n").append(i - 1).append(")\n");
        }
        sb.append("OUTPUT(n").append(length).append(")\n");
        InputStream in = new ByteArrayInputStream(sb.toString().getBytes(StandardCharsets.UTF_8));
        GateNetlist netlist = new BenchParser("chain.bench", in, CharClassTable.bench(), 16).parseGateNetlist();
        Assertions.assertEquals("chain", netlist.getName());
        Assertions.assertEquals(length, netlist.getNodes().size());
        Map<String, Boolean> in0 = new HashMap<>();
        in0.put("n0", true);
        Assertions.assertTrue(netlist.evaluate(in0).get("n" + length));
    }

    /**
     * Records the callbacks it receives, to check the parser independently of any graph.
     */
    private static class RecordingBuilder implements BenchNetlistBuilder<List<String>> {
        private final List<String> events = new ArrayList<>();

        @Override
        public void addPrimaryInput(String name, int line) {
            events.add(line + " PI " + name);
        }

        @Override
        public void addPrimaryOutput(String name, int line) {
            events.add(line + " PO " + name);
        }

        @Override
        public void addLatch(String output, String input, LatchInit init, int line) {
            events.add(line + " LATCH " + output + " " + input + " " + init);
        }

        @Override
        public void addScanFlop(String output, List<String> operands, int line) {
            events.add(line + " SCAN " + output + " " + operands);
        }

        @Override
        public void addGate(String output, GateFunction function, List<String> inputs, int line) {
            events.add(line + " GATE " + output + " " + function + " " + inputs);
        }

        @Override
        public List<String> finish(String source) {
            events.add("FINISH " + source);
            return events;
        }
    }

    @Test
    public void testGenericBuilder() {
        String text = "INPUT(a)\r\nq = DFF1(y)\r\ny = LUT 0x6 (a, q)\r\ns = DFFRSE(a, b, c, d)\r\n"
                + "c1 = LUT 0xf (a, q)\r\nOUTPUT(y)";
        InputStream in = new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
        List<String> events = new BenchParser("generic", in).parse(new RecordingBuilder());
        Assertions.assertEquals(List.of(
                "1 PI a",
                "2 LATCH q y ONE",
                "3 GATE y " + GateFunction.lut(TruthTable.fromHex("6", 2)) + " [a, q]",
                "4 SCAN s [a, b, c, d]",
                "5 GATE c1 CONST1 []",
                "6 PO y",
                "FINISH generic"), events);
    }

    @ParameterizedTest
    @CsvSource({
            "designs/c432.bench, c432",
            "c17.bench, c17",
            "C:\\work\\adder.v.bench, adder.v",
            "noext, noext",
    })
    public void testNetlistName(String source, String expected) {
        Assertions.assertEquals(expected, BenchParser.netlistName(source));
    }
}
