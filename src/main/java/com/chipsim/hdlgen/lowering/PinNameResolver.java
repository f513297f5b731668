package com.chipsim.hdlgen.lowering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import com.chipsim.hdlgen.catalog.ChipInterface;
import com.chipsim.hdlgen.diagnostics.Diagnostic;
import com.chipsim.hdlgen.diagnostics.DiagnosticKind;

/**
 * Names the connected pins of an instance.
 *
 * Pin ids carry no meaning on their own: for catalog chips the n-th input pin
 * seen in the wire list takes the catalog's n-th input name, and outputs follow
 * the instance's declared output order when it has one. Pins beyond the
 * catalog's arity get {@code in<index>} / {@code out<index>}.
 */
public class PinNameResolver {

    public PinNameAssignment resolve(IndexedInstance instance) {
        List<Integer> inputOrder = new ArrayList<>(instance.getInputWires().keySet());
        List<Integer> outputOrder = outputOrder(instance);

        PinNameAssignment.PinNameAssignmentBuilder builder = PinNameAssignment.builder()
                .instanceId(instance.getId())
                .outputOrder(Collections.unmodifiableList(outputOrder));

        ChipInterface chip = instance.getChipInterface().orElse(null);
        if (chip == null) {
            List<Integer> firstSeenOutputs = new ArrayList<>(instance.getOutputWires().keySet());
            return builder
                    .inputNames(genericNames(inputOrder, "in"))
                    .outputNames(genericNames(firstSeenOutputs, "out"))
                    .build();
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<Integer, String> inputNames = catalogNames(instance, inputOrder, instance.getInputWires().keySet(),
                chip.getInputs(), "in", "inputs", diagnostics);
        Map<Integer, String> outputNames = catalogNames(instance, outputOrder, instance.getOutputWires().keySet(),
                chip.getOutputs(), "out", "outputs", diagnostics);
        return builder
                .inputNames(inputNames)
                .outputNames(outputNames)
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * Resolves every supported instance, keyed by instance id in registry order.
     * Instances are independent of each other, so {@code parallel} only changes
     * throughput, never the result.
     */
    public Map<Integer, PinNameAssignment> resolveAll(NetlistIndex index, boolean parallel) {
        Stream<IndexedInstance> stream = index.getInstances().stream();
        if (parallel) {
            stream = stream.parallel();
        }
        List<PinNameAssignment> assignments = stream
                .filter(IndexedInstance::isSupported)
                .map(this::resolve)
                .toList();

        Map<Integer, PinNameAssignment> byInstance = new LinkedHashMap<>();
        for (PinNameAssignment assignment : assignments) {
            byInstance.put(assignment.getInstanceId(), assignment);
        }
        return byInstance;
    }

    static List<Integer> outputOrder(IndexedInstance instance) {
        Set<Integer> order = new LinkedHashSet<>(instance.getInstance().getDeclaredOutputOrder());
        order.addAll(instance.getOutputWires().keySet());
        return new ArrayList<>(order);
    }

    /**
     * Positional names for {@code pinOrder}. Declared but unconnected pins keep
     * their position; only a connected pin past the catalog's arity is reported.
     */
    private static Map<Integer, String> catalogNames(IndexedInstance instance, List<Integer> pinOrder,
                                                     Set<Integer> connected, List<String> expected,
                                                     String fallbackPrefix, String side,
                                                     List<Diagnostic> diagnostics) {
        Map<Integer, String> names = new LinkedHashMap<>();
        boolean overflow = false;
        for (int idx = 0; idx < pinOrder.size(); idx++) {
            Integer pinId = pinOrder.get(idx);
            if (idx < expected.size()) {
                names.put(pinId, expected.get(idx));
            } else {
                names.put(pinId, fallbackPrefix + idx);
                overflow |= connected.contains(pinId);
            }
        }
        if (overflow) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.ARITY_OVERFLOW, instance.getId(),
                    "%s (id %d): %d %s found, catalog expects %d".formatted(
                            instance.getTypeName(), instance.getId(), pinOrder.size(), side, expected.size())));
        }
        return Collections.unmodifiableMap(names);
    }

    private static Map<Integer, String> genericNames(List<Integer> pinOrder, String prefix) {
        Map<Integer, String> names = new LinkedHashMap<>();
        for (int idx = 0; idx < pinOrder.size(); idx++) {
            names.put(pinOrder.get(idx), idx == 0 ? prefix : prefix + idx);
        }
        return Collections.unmodifiableMap(names);
    }
}
