package com.chipsim.hdlgen.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.chipsim.hdlgen.lowering.LoweringResult;
import com.chipsim.hdlgen.lowering.PartStatement;
import com.chipsim.hdlgen.lowering.PartStatus;
import com.chipsim.hdlgen.lowering.SignaturePort;
import com.chipsim.hdlgen.model.ChipGraph;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import lombok.Value;

/**
 * Renders the human-readable conversion report for one lowered chip.
 */
public class ConversionReportGenerator {

    static final String TEMPLATE = "conversion-report.ftl";

    private final Configuration freemarkerConfig;

    public ConversionReportGenerator() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String generate(LoweringResult result) throws IOException {
        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(Map.of("report", toView(result)), out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    static ReportView toView(LoweringResult result) {
        ChipGraph graph = result.getGraph();
        Stats stats = new Stats(
                graph.getInputPins().size(),
                graph.getOutputPins().size(),
                graph.totalInputBits(),
                graph.totalOutputBits(),
                graph.getInstances().size(),
                graph.getWires().size(),
                result.getWireIdentifiers().size(),
                (int) result.countStatements(PartStatus.RESOLVED),
                (int) result.countStatements(PartStatus.SKIPPED),
                (int) result.countStatements(PartStatus.STUB));

        return new ReportView(
                graph.getName(),
                result.getModuleName(),
                result.getDiagnostics().stream().map(Object::toString).toList(),
                result.getSignature().getInputs().stream().map(ConversionReportGenerator::pinRow).toList(),
                result.getSignature().getOutputs().stream().map(ConversionReportGenerator::pinRow).toList(),
                stats,
                result.getStatements().stream().map(ConversionReportGenerator::partRow).toList(),
                result.getWireIdentifiers().entrySet().stream()
                        .map(e -> e.getValue() + " <- chip " + e.getKey().getOwnerId() + " pin " + e.getKey().getPinId())
                        .toList());
    }

    private static PinRow pinRow(SignaturePort port) {
        return new PinRow(port.getSourceName(), port.declaration(), port.getBitWidth(), port.getPinId());
    }

    private static PartRow partRow(PartStatement statement) {
        return new PartRow(
                statement.getStatus().name(),
                statement.getRawTypeName(),
                statement.getTypeName(),
                statement.getInstanceId(),
                pinLines(statement.getInputPinNames()),
                pinLines(statement.getOutputPinNames()));
    }

    private static List<String> pinLines(Map<Integer, String> names) {
        return names.entrySet().stream()
                .map(e -> "PinID " + e.getKey() + " -> " + e.getValue())
                .collect(Collectors.toList());
    }

    // ---- Template view model (FreeMarker reads it through getters) ----

    @Value
    public static class ReportView {
        String chipName;
        String moduleName;
        List<String> diagnostics;
        List<PinRow> inputs;
        List<PinRow> outputs;
        Stats stats;
        List<PartRow> parts;
        List<String> wireIdentifiers;
    }

    @Value
    public static class PinRow {
        String sourceName;
        String declaration;
        int bitWidth;
        int id;
    }

    @Value
    public static class PartRow {
        String status;
        String rawTypeName;
        String typeName;
        int instanceId;
        List<String> inputs;
        List<String> outputs;
    }

    @Value
    public static class Stats {
        int inputPins;
        int outputPins;
        int inputBits;
        int outputBits;
        int instances;
        int wires;
        int internalSignals;
        int resolvedParts;
        int skippedParts;
        int stubParts;
    }
}
