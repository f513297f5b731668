package com.chipsim.hdlgen.lowering;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chipsim.hdlgen.catalog.ChipNameNormalizer;
import com.chipsim.hdlgen.catalog.InterfaceCatalog;
import com.chipsim.hdlgen.catalog.TypeResolution;
import com.chipsim.hdlgen.diagnostics.DiagnosticCollector;
import com.chipsim.hdlgen.diagnostics.DiagnosticKind;
import com.chipsim.hdlgen.model.ChipGraph;
import com.chipsim.hdlgen.model.Wire;

/**
 * Lowers one flat chip graph to an HDL module.
 *
 * Each instance goes Pending -> Resolved | Skipped in registry order, which is
 * also the statement order. Nothing aborts the pass: every anomaly ends up in
 * the diagnostic list of the result.
 */
public class LoweringDriver {
    private static final Logger log = LoggerFactory.getLogger(LoweringDriver.class);

    private final ChipNameNormalizer normalizer;
    private final LoweringOptions options;
    private final PinNameResolver pinNameResolver = new PinNameResolver();

    public LoweringDriver() {
        this(new ChipNameNormalizer(InterfaceCatalog.hackChipSet()), LoweringOptions.defaults());
    }

    public LoweringDriver(LoweringOptions options) {
        this(new ChipNameNormalizer(InterfaceCatalog.hackChipSet()), options);
    }

    public LoweringDriver(ChipNameNormalizer normalizer, LoweringOptions options) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.options = Objects.requireNonNull(options, "options");
    }

    public LoweringResult lower(ChipGraph graph) {
        Objects.requireNonNull(graph, "graph");
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        NetlistIndex index = new NetlistIndexer(normalizer).index(graph, diagnostics);
        ModuleSignature signature = new SignatureBuilder(options.isDisambiguateOutputs()).build(index);
        Map<Integer, PinNameAssignment> assignments =
                pinNameResolver.resolveAll(index, options.isParallelPinResolution());

        WireIdentifierAllocator allocator = new WireIdentifierAllocator();
        WireIdentityResolver wires = new WireIdentityResolver(index, signature, allocator);

        List<PartStatement> statements = new ArrayList<>();
        for (IndexedInstance instance : index.getInstances()) {
            if (!instance.isSupported()) {
                statements.add(skipped(instance));
                continue;
            }
            PinNameAssignment names = assignments.get(instance.getId());
            diagnostics.addAll(names.getDiagnostics());
            statements.add(resolve(instance, names, wires, diagnostics));
        }

        String moduleName = normalizer.moduleName(graph.getName());
        String text = new HdlModuleWriter(options).write(graph.getName(), moduleName, signature, statements);

        log.debug("Lowered chip {} -> {}: {} parts, {} internal signals, {} diagnostics",
                graph.getName(), moduleName, statements.size(), allocator.allocatedCount(),
                diagnostics.getDiagnostics().size());

        return LoweringResult.builder()
                .graph(graph)
                .moduleName(moduleName)
                .signature(signature)
                .statements(List.copyOf(statements))
                .diagnostics(List.copyOf(diagnostics.getDiagnostics()))
                .wireIdentifiers(allocator.getIdentifiers())
                .moduleText(text)
                .build();
    }

    private static PartStatement skipped(IndexedInstance instance) {
        TypeResolution.Unsupported type = (TypeResolution.Unsupported) instance.getType();
        return PartStatement.builder()
                .instanceId(instance.getId())
                .rawTypeName(instance.getInstance().getRawTypeName())
                .typeName(instance.getTypeName())
                .status(PartStatus.SKIPPED)
                .skipReason(type.getReason())
                .build();
    }

    private static PartStatement resolve(IndexedInstance instance, PinNameAssignment names,
                                         WireIdentityResolver wires, DiagnosticCollector diagnostics) {
        PartStatement.PartStatementBuilder statement = PartStatement.builder()
                .instanceId(instance.getId())
                .rawTypeName(instance.getInstance().getRawTypeName())
                .typeName(instance.getTypeName())
                .inputPinNames(names.getInputNames())
                .outputPinNames(names.getOutputNames());

        int bindings = 0;
        for (Map.Entry<Integer, Wire> input : instance.getInputWires().entrySet()) {
            String expression = wires.sourceExpression(instance, input.getValue(), diagnostics);
            statement.binding(new PortBinding(names.inputName(input.getKey()), expression));
            bindings++;
        }
        for (Integer pinId : names.getOutputOrder()) {
            if (!instance.getOutputWires().containsKey(pinId)) {
                continue;
            }
            for (String expression : wires.outputExpressions(instance, pinId, diagnostics)) {
                statement.binding(new PortBinding(names.outputName(pinId), expression));
                bindings++;
            }
        }

        if (bindings == 0) {
            diagnostics.report(DiagnosticKind.EMPTY_CONNECTIONS, instance.getId(),
                    "%s (id %d): no connections".formatted(instance.getTypeName(), instance.getId()));
            return statement.status(PartStatus.STUB).build();
        }
        return statement.status(PartStatus.RESOLVED).build();
    }
}
