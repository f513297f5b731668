package com.chipsim.hdlgen.lowering;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.chipsim.hdlgen.diagnostics.DiagnosticCollector;
import com.chipsim.hdlgen.diagnostics.DiagnosticKind;
import com.chipsim.hdlgen.model.PinAddress;
import com.chipsim.hdlgen.model.Wire;

/**
 * Computes the text placed on the right-hand side of a part parameter.
 */
public class WireIdentityResolver {

    static final String UNKNOWN = "unknown";

    private final NetlistIndex index;
    private final ModuleSignature signature;
    private final WireIdentifierAllocator allocator;

    public WireIdentityResolver(NetlistIndex index, ModuleSignature signature, WireIdentifierAllocator allocator) {
        this.index = Objects.requireNonNull(index, "index");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    /**
     * Expression for the value a wire carries into an instance input. A source
     * instance that was skipped drives nothing, so its consumers read
     * {@code unknown} and are reported.
     */
    public String sourceExpression(IndexedInstance consumer, Wire wire, DiagnosticCollector diagnostics) {
        PinAddress source = wire.getSource();
        return switch (index.roleOf(source.getOwnerId())) {
            case INPUT_PIN -> signature.input(source.getOwnerId())
                    .map(port -> port.reference(source.getPinId()))
                    .orElse(UNKNOWN);
            case INSTANCE -> {
                IndexedInstance producer = index.instance(source.getOwnerId()).orElseThrow();
                if (!producer.isSupported()) {
                    diagnostics.report(DiagnosticKind.SKIPPED_SOURCE, consumer.getId(),
                            "%s (id %d): input pin %d is driven by skipped chip %s (id %d)"
                                    .formatted(consumer.getTypeName(), consumer.getId(), wire.getTarget().getPinId(),
                                            producer.getTypeName(), producer.getId()));
                    yield UNKNOWN;
                }
                yield allocator.identifierFor(source.getOwnerId(), source.getPinId());
            }
            default -> UNKNOWN;
        };
    }

    /**
     * Distinct expressions an instance output pin must be bound to, in the order
     * its wires were first seen. A chip output target is bound by name (pass-through);
     * instance targets share one allocated identifier.
     */
    public List<String> outputExpressions(IndexedInstance producer, int pinId, DiagnosticCollector diagnostics) {
        Set<String> expressions = new LinkedHashSet<>();
        boolean fallbackReported = false;

        for (Wire wire : producer.getOutputWires().getOrDefault(pinId, List.of())) {
            PinAddress target = wire.getTarget();
            switch (index.roleOf(target.getOwnerId())) {
                case OUTPUT_PIN -> {
                    if (producer.isCatalogType()) {
                        expressions.add(signature.output(target.getOwnerId())
                                .map(port -> port.reference(target.getPinId()))
                                .orElse(UNKNOWN));
                    } else {
                        expressions.add(allocator.identifierFor(producer.getId(), pinId));
                        if (!fallbackReported) {
                            diagnostics.report(DiagnosticKind.PASS_THROUGH_FALLBACK, producer.getId(),
                                    "%s (id %d): output pin %d drives a chip output but the chip is not in the catalog; using %s"
                                            .formatted(producer.getTypeName(), producer.getId(), pinId,
                                                    allocator.identifierFor(producer.getId(), pinId)));
                            fallbackReported = true;
                        }
                    }
                }
                case INSTANCE -> expressions.add(allocator.identifierFor(producer.getId(), pinId));
                default -> expressions.add(UNKNOWN);
            }
        }
        return new ArrayList<>(expressions);
    }
}
