package com.chipsim.hdlgen.lowering;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chipsim.hdlgen.catalog.ChipNameNormalizer;
import com.chipsim.hdlgen.catalog.TypeResolution;
import com.chipsim.hdlgen.diagnostics.DiagnosticCollector;
import com.chipsim.hdlgen.diagnostics.DiagnosticKind;
import com.chipsim.hdlgen.model.ChipGraph;
import com.chipsim.hdlgen.model.ComponentInstance;
import com.chipsim.hdlgen.model.TopLevelPin;
import com.chipsim.hdlgen.model.Wire;

/**
 * Builds the {@link NetlistIndex} for a chip graph.
 *
 * Registration order is inputs, outputs, instances. An owner id may be
 * registered once; later registrations are dropped and reported. Each
 * instance type is normalized exactly once here, so an unsupported instance
 * yields exactly one diagnostic.
 */
public class NetlistIndexer {
    private static final Logger log = LoggerFactory.getLogger(NetlistIndexer.class);

    private final ChipNameNormalizer normalizer;

    public NetlistIndexer(ChipNameNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public NetlistIndex index(ChipGraph graph, DiagnosticCollector diagnostics) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(diagnostics, "diagnostics");

        Map<Integer, String> registeredAs = new HashMap<>();

        List<TopLevelPin> inputs = new ArrayList<>();
        Map<Integer, Integer> inputIndex = new HashMap<>();
        for (TopLevelPin pin : graph.getInputPins()) {
            if (register(pin.getId(), "input pin " + pin.getName(), registeredAs, diagnostics)) {
                inputIndex.put(pin.getId(), inputs.size());
                inputs.add(pin);
            }
        }

        List<TopLevelPin> outputs = new ArrayList<>();
        Map<Integer, Integer> outputIndex = new HashMap<>();
        for (TopLevelPin pin : graph.getOutputPins()) {
            if (register(pin.getId(), "output pin " + pin.getName(), registeredAs, diagnostics)) {
                outputIndex.put(pin.getId(), outputs.size());
                outputs.add(pin);
            }
        }

        List<IndexedInstance> instances = new ArrayList<>();
        Map<Integer, Integer> instanceIndex = new HashMap<>();
        for (ComponentInstance instance : graph.getInstances()) {
            if (!register(instance.getId(), "chip " + instance.getRawTypeName(), registeredAs, diagnostics)) {
                continue;
            }
            TypeResolution type = normalizer.normalize(instance.getRawTypeName());
            if (type instanceof TypeResolution.Unsupported unsupported) {
                diagnostics.report(DiagnosticKind.UNSUPPORTED_TYPE, instance.getId(),
                        "%s (id %d): %s".formatted(instance.getRawTypeName(), instance.getId(), unsupported.getReason()));
            }
            instanceIndex.put(instance.getId(), instances.size());
            instances.add(new IndexedInstance(instance, type, normalizer.catalogEntry(type).orElse(null)));
        }

        NetlistIndex index = new NetlistIndex(graph, inputs, inputIndex, outputs, outputIndex, instances, instanceIndex);

        int wireNumber = 0;
        for (Wire wire : graph.getWires()) {
            bucketWire(index, wire, wireNumber++, diagnostics);
        }

        log.debug("Indexed chip {}: {} inputs, {} outputs, {} instances, {} wires",
                graph.getName(), inputs.size(), outputs.size(), instances.size(), graph.getWires().size());
        return index;
    }

    private boolean register(int id, String description, Map<Integer, String> registeredAs,
                             DiagnosticCollector diagnostics) {
        String existing = registeredAs.putIfAbsent(id, description);
        if (existing != null) {
            diagnostics.report(DiagnosticKind.DUPLICATE_OWNER, null,
                    "id %d of %s is already used by %s; ignoring the later one".formatted(id, description, existing));
            return false;
        }
        return true;
    }

    private void bucketWire(NetlistIndex index, Wire wire, int wireNumber, DiagnosticCollector diagnostics) {
        int sourceOwner = wire.getSource().getOwnerId();
        int targetOwner = wire.getTarget().getOwnerId();
        OwnerRole source = index.roleOf(sourceOwner);
        OwnerRole target = index.roleOf(targetOwner);

        Integer targetInstanceId = target == OwnerRole.INSTANCE ? targetOwner : null;
        Integer sourceInstanceId = source == OwnerRole.INSTANCE ? sourceOwner : null;

        if (source == OwnerRole.UNKNOWN) {
            diagnostics.report(DiagnosticKind.UNRESOLVED_OWNER, targetInstanceId,
                    "wire #%d (%s): source owner %d is not registered".formatted(wireNumber, wire, sourceOwner));
        }
        if (target == OwnerRole.UNKNOWN) {
            diagnostics.report(DiagnosticKind.UNRESOLVED_OWNER, sourceInstanceId,
                    "wire #%d (%s): target owner %d is not registered".formatted(wireNumber, wire, targetOwner));
        }

        if (source == OwnerRole.OUTPUT_PIN || target == OwnerRole.INPUT_PIN) {
            diagnostics.report(DiagnosticKind.UNROUTABLE_WIRE, null,
                    "wire #%d (%s) runs against pin direction".formatted(wireNumber, wire));
            return;
        }
        if (source != OwnerRole.INSTANCE && target != OwnerRole.INSTANCE) {
            if (source != OwnerRole.UNKNOWN && target != OwnerRole.UNKNOWN) {
                diagnostics.report(DiagnosticKind.UNROUTABLE_WIRE, null,
                        "wire #%d (%s) connects chip pins directly without a part".formatted(wireNumber, wire));
            }
            return;
        }

        if (targetInstanceId != null) {
            IndexedInstance consumer = index.instance(targetInstanceId).orElseThrow();
            int pinId = wire.getTarget().getPinId();
            if (!consumer.addInputWire(pinId, wire)) {
                diagnostics.report(DiagnosticKind.FAN_IN, targetInstanceId,
                        "%s (id %d): input pin %d is driven by more than one wire, keeping %s"
                                .formatted(consumer.getTypeName(), targetInstanceId, pinId,
                                        consumer.getInputWires().get(pinId)));
            }
        }
        if (sourceInstanceId != null) {
            index.instance(sourceInstanceId).orElseThrow().addOutputWire(wire.getSource().getPinId(), wire);
        }
    }
}
