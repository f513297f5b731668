package com.chipsim.hdlgen.lowering;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.chipsim.hdlgen.diagnostics.DiagnosticKind;
import com.chipsim.hdlgen.model.ChipGraph;
import com.chipsim.hdlgen.model.ComponentInstance;
import com.chipsim.hdlgen.model.PinAddress;
import com.chipsim.hdlgen.model.TopLevelPin;
import com.chipsim.hdlgen.model.Wire;

import static com.chipsim.hdlgen.lowering.NetlistIndexerTest.instance;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for the lowering pass.
 */
class LoweringDriverTest {

    private final LoweringDriver driver = new LoweringDriver();

    @Test
    void testEightBitMuxLowersToBitSlicedParts() {
        LoweringResult result = driver.lower(eightBitMux());

        StringBuilder expected = new StringBuilder()
                .append("// Converted from Digital Logic Sim\n")
                .append("// Nand2tetris HDL\n")
                .append("// Original chip: MUX-16\n")
                .append("\n")
                .append("CHIP MUX16 {\n")
                .append("    IN a[8], b[8], sel;\n")
                .append("    OUT out[8];\n")
                .append("\n")
                .append("    PARTS:\n");
        for (int i = 0; i < 8; i++) {
            expected.append("    Mux(a=a[").append(i).append("], b=b[").append(i)
                    .append("], sel=sel, out=out[").append(i).append("]);\n");
        }
        expected.append("}\n");

        assertThat(result.getModuleName()).isEqualTo("MUX16");
        assertThat(result.getModuleText()).isEqualTo(expected.toString());
        assertThat(result.getWireIdentifiers()).isEmpty();
        assertThat(result.getDiagnostics()).isEmpty();
        assertThat(result.countStatements(PartStatus.RESOLVED)).isEqualTo(8);
    }

    @Test
    void testLoweringIsDeterministic() {
        ChipGraph graph = fanOutGraph();

        LoweringResult first = driver.lower(graph);
        LoweringResult second = driver.lower(graph);

        assertThat(second.getModuleText()).isEqualTo(first.getModuleText());
        assertThat(second.getDiagnostics()).isEqualTo(first.getDiagnostics());
        assertThat(second.getWireIdentifiers()).isEqualTo(first.getWireIdentifiers());
    }

    @Test
    void testParallelPinResolutionProducesSameText() {
        LoweringDriver parallel = new LoweringDriver(
                LoweringOptions.builder().parallelPinResolution(true).build());

        assertThat(parallel.lower(eightBitMux()).getModuleText())
                .isEqualTo(driver.lower(eightBitMux()).getModuleText());
    }

    @Test
    void testFanOutSharesOneInternalSignal() {
        LoweringResult result = driver.lower(fanOutGraph());

        assertThat(result.getStatements()).extracting(PartStatement::render).containsExactly(
                "Nand(a=a, b=b, out=w1);",
                "Not(in=w1, out=out);",
                "Not(in=w1);");
        assertThat(result.getWireIdentifiers()).containsExactly(entry(new PinAddress(10, 2), "w1"));
        assertThat(result.getDiagnostics()).isEmpty();
    }

    @Test
    void testBusInputsAreBitIndexedOnlyWhenInRange() {
        ChipGraph graph = ChipGraph.builder()
                .name("Slice")
                .inputPin(new TopLevelPin(1, "A", 8))
                .inputPin(new TopLevelPin(2, "B", 1))
                .instance(instance(10, "NOT"))
                .instance(instance(11, "NOT"))
                .instance(instance(12, "NOT"))
                .wire(Wire.of(1, 3, 10, 0))
                .wire(Wire.of(2, 5, 11, 0))
                .wire(Wire.of(1, 9, 12, 0))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getStatements()).extracting(PartStatement::render).containsExactly(
                "Not(in=a[3]);", "Not(in=b);", "Not(in=a);");
    }

    @Test
    void testDuplicateInputNamesAreSuffixed() {
        ChipGraph graph = ChipGraph.builder()
                .name("Twin")
                .inputPin(new TopLevelPin(1, "IN", 1))
                .inputPin(new TopLevelPin(2, "IN", 1))
                .outputPin(new TopLevelPin(3, "OUT", 1))
                .outputPin(new TopLevelPin(4, "OUT", 1))
                .instance(instance(10, "AND"))
                .wire(Wire.of(1, 0, 10, 0))
                .wire(Wire.of(2, 0, 10, 1))
                .wire(Wire.of(10, 2, 3, 0))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getModuleText())
                .contains("    IN in, in1;\n")
                .contains("    OUT out, out1;\n")
                .contains("    And(a=in, b=in1, out=out);\n");
    }

    @Test
    void testDuplicateOutputNamesCanBeKept() {
        ChipGraph graph = ChipGraph.builder()
                .name("Twin")
                .outputPin(new TopLevelPin(3, "OUT", 1))
                .outputPin(new TopLevelPin(4, "OUT", 1))
                .build();

        LoweringResult result = new LoweringDriver(
                LoweringOptions.builder().disambiguateOutputs(false).build()).lower(graph);

        assertThat(result.getModuleText()).contains("    OUT out, out;\n").contains("    IN ;\n");
    }

    @Test
    void testUnsupportedChipIsSkippedWithOneDiagnostic() {
        ChipGraph graph = ChipGraph.builder()
                .name("Bus")
                .inputPin(new TopLevelPin(1, "A", 8))
                .instance(instance(10, "8-1BIT"))
                .wire(Wire.of(1, 0, 10, 0))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getStatements()).singleElement().satisfies(s -> {
            assertThat(s.getStatus()).isEqualTo(PartStatus.SKIPPED);
            assertThat(s.render()).startsWith("// SKIPPED: 8-1BIT (").contains("sub-bus addressing");
        });
        assertThat(result.getModuleText()).doesNotContain("8-1BIT(");
        assertThat(result.getDiagnostics()).singleElement()
                .extracting(d -> d.getKind()).isEqualTo(DiagnosticKind.UNSUPPORTED_TYPE);
    }

    @Test
    void testPartReadingFromSkippedChipGetsUnknown() {
        ChipGraph graph = ChipGraph.builder()
                .name("Unpack")
                .inputPin(new TopLevelPin(1, "A", 8))
                .outputPin(new TopLevelPin(3, "O", 1))
                .instance(instance(10, "8-1BIT"))
                .instance(instance(11, "NOT"))
                .wire(Wire.of(1, 0, 10, 0))
                .wire(Wire.of(10, 0, 11, 0))
                .wire(Wire.of(11, 1, 3, 0))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getStatements()).extracting(PartStatement::render).last()
                .isEqualTo("Not(in=unknown, out=o);");
        assertThat(result.getWireIdentifiers()).isEmpty();
        assertThat(result.countDiagnostics(DiagnosticKind.UNSUPPORTED_TYPE)).isEqualTo(1);
        assertThat(result.getDiagnostics())
                .filteredOn(d -> d.getKind() == DiagnosticKind.SKIPPED_SOURCE)
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.getInstanceId()).isEqualTo(11);
                    assertThat(d.getMessage()).contains("skipped chip 8-1BIT (id 10)");
                });
    }

    @Test
    void testSuffixedInputNamesStayDistinctInParts() {
        ChipGraph graph = ChipGraph.builder()
                .name("Clash")
                .inputPin(new TopLevelPin(1, "IN", 1))
                .inputPin(new TopLevelPin(2, "IN1", 1))
                .inputPin(new TopLevelPin(3, "IN", 1))
                .instance(instance(10, "AND"))
                .wire(Wire.of(2, 0, 10, 0))
                .wire(Wire.of(3, 0, 10, 1))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getModuleText())
                .contains("    IN in, in1, in2;\n")
                .contains("    And(a=in1, b=in2);\n");
    }

    @Test
    void testUnconnectedInstanceBecomesStub() {
        ChipGraph graph = ChipGraph.builder()
                .name("Lonely")
                .instance(instance(10, "NAND"))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getStatements()).singleElement().satisfies(s -> {
            assertThat(s.getStatus()).isEqualTo(PartStatus.STUB);
            assertThat(s.render()).isEqualTo("Nand(); // no connections");
        });
        assertThat(result.countDiagnostics(DiagnosticKind.EMPTY_CONNECTIONS)).isEqualTo(1);
    }

    @Test
    void testUnknownOwnersRenderAsUnknown() {
        ChipGraph graph = ChipGraph.builder()
                .name("Dangling")
                .instance(instance(10, "NOT"))
                .wire(Wire.of(99, 0, 10, 0))
                .wire(Wire.of(10, 1, 98, 0))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getStatements()).extracting(PartStatement::render)
                .containsExactly("Not(in=unknown, out=unknown);");
        assertThat(result.countDiagnostics(DiagnosticKind.UNRESOLVED_OWNER)).isEqualTo(2);
        assertThat(result.hasErrors()).isTrue();
    }

    @Test
    void testCustomChipDrivingOutputGetsSynthesizedSignal() {
        ChipGraph graph = ChipGraph.builder()
                .name("Wrapper")
                .inputPin(new TopLevelPin(1, "A", 1))
                .outputPin(new TopLevelPin(3, "EQ", 1))
                .instance(instance(10, "Comparator"))
                .wire(Wire.of(1, 0, 10, 1))
                .wire(Wire.of(10, 0, 3, 0))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getStatements()).extracting(PartStatement::render)
                .containsExactly("Comparator(in=a, out=w1);");
        assertThat(result.countDiagnostics(DiagnosticKind.PASS_THROUGH_FALLBACK)).isEqualTo(1);
    }

    @Test
    void testOutputDrivingChipOutputAndPartBindsBoth() {
        ChipGraph graph = ChipGraph.builder()
                .name("Tap")
                .inputPin(new TopLevelPin(1, "A", 1))
                .inputPin(new TopLevelPin(2, "B", 1))
                .outputPin(new TopLevelPin(3, "OUT", 1))
                .outputPin(new TopLevelPin(4, "NOUT", 1))
                .instance(instance(10, "NAND"))
                .instance(instance(11, "NOT"))
                .wire(Wire.of(1, 0, 10, 0))
                .wire(Wire.of(2, 0, 10, 1))
                .wire(Wire.of(10, 2, 3, 0))
                .wire(Wire.of(10, 2, 11, 0))
                .wire(Wire.of(11, 1, 4, 0))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getStatements()).extracting(PartStatement::render).containsExactly(
                "Nand(a=a, b=b, out=out, out=w1);",
                "Not(in=w1, out=nout);");
    }

    @Test
    void testDeclaredOutputOrderDrivesBindingOrder() {
        ChipGraph graph = ChipGraph.builder()
                .name("Split")
                .inputPin(new TopLevelPin(1, "IN", 1))
                .inputPin(new TopLevelPin(2, "SEL", 1))
                .outputPin(new TopLevelPin(4, "X", 1))
                .outputPin(new TopLevelPin(5, "Y", 1))
                .instance(ComponentInstance.builder().id(10).rawTypeName("DMUX")
                        .declaredOutput(2).declaredOutput(3).build())
                .wire(Wire.of(1, 0, 10, 0))
                .wire(Wire.of(2, 0, 10, 1))
                .wire(Wire.of(10, 3, 5, 0))
                .wire(Wire.of(10, 2, 4, 0))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getStatements()).extracting(PartStatement::render)
                .containsExactly("DMux(in=in, sel=sel, a=x, b=y);");
    }

    @Test
    void testArityOverflowKeepsBindingAndReports() {
        ChipGraph graph = ChipGraph.builder()
                .name("Wide")
                .inputPin(new TopLevelPin(1, "A", 1))
                .inputPin(new TopLevelPin(2, "B", 1))
                .inputPin(new TopLevelPin(3, "C", 1))
                .instance(instance(10, "AND"))
                .wire(Wire.of(1, 0, 10, 0))
                .wire(Wire.of(2, 0, 10, 1))
                .wire(Wire.of(3, 0, 10, 2))
                .build();

        LoweringResult result = driver.lower(graph);

        assertThat(result.getStatements()).extracting(PartStatement::render)
                .containsExactly("And(a=a, b=b, in2=c);");
        assertThat(result.countDiagnostics(DiagnosticKind.ARITY_OVERFLOW)).isEqualTo(1);
    }

    @Test
    void testCustomHeaderLines() {
        LoweringResult result = new LoweringDriver(
                LoweringOptions.builder().headerLines(List.of("Generated")).build())
                .lower(ChipGraph.builder().name("Empty").build());

        assertThat(result.getModuleText()).startsWith("// Generated\n// Original chip: Empty\n\nCHIP Empty {\n");
    }

    static ChipGraph eightBitMux() {
        ChipGraph.ChipGraphBuilder graph = ChipGraph.builder()
                .name("MUX-16")
                .inputPin(new TopLevelPin(1, "A", 8))
                .inputPin(new TopLevelPin(2, "B", 8))
                .inputPin(new TopLevelPin(3, "SEL", 1))
                .outputPin(new TopLevelPin(4, "OUT", 8));
        for (int i = 0; i < 8; i++) {
            graph.instance(instance(100 + i, "MUX"));
        }
        for (int i = 0; i < 8; i++) {
            graph.wire(Wire.of(1, i, 100 + i, 0))
                    .wire(Wire.of(2, i, 100 + i, 1))
                    .wire(Wire.of(3, 0, 100 + i, 2))
                    .wire(Wire.of(100 + i, 3, 4, i));
        }
        return graph.build();
    }

    private static ChipGraph fanOutGraph() {
        return ChipGraph.builder()
                .name("Fan")
                .inputPin(new TopLevelPin(1, "A", 1))
                .inputPin(new TopLevelPin(2, "B", 1))
                .outputPin(new TopLevelPin(3, "OUT", 1))
                .instance(instance(10, "NAND"))
                .instance(instance(11, "NOT"))
                .instance(instance(12, "NOT"))
                .wire(Wire.of(1, 0, 10, 0))
                .wire(Wire.of(2, 0, 10, 1))
                .wire(Wire.of(10, 2, 11, 0))
                .wire(Wire.of(10, 2, 12, 0))
                .wire(Wire.of(11, 1, 3, 0))
                .build();
    }
}
