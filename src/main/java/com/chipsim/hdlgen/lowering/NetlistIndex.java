package com.chipsim.hdlgen.lowering;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.chipsim.hdlgen.model.ChipGraph;
import com.chipsim.hdlgen.model.TopLevelPin;

import lombok.Getter;

/**
 * Arena-style view of a chip graph: elements live in registration-ordered
 * lists and are found through id -> index tables built once.
 */
public class NetlistIndex {

    @Getter
    private final ChipGraph graph;
    @Getter
    private final List<TopLevelPin> inputPins;
    @Getter
    private final List<TopLevelPin> outputPins;
    @Getter
    private final List<IndexedInstance> instances;

    private final Map<Integer, Integer> inputIndexById;
    private final Map<Integer, Integer> outputIndexById;
    private final Map<Integer, Integer> instanceIndexById;

    NetlistIndex(ChipGraph graph,
                 List<TopLevelPin> inputPins, Map<Integer, Integer> inputIndexById,
                 List<TopLevelPin> outputPins, Map<Integer, Integer> outputIndexById,
                 List<IndexedInstance> instances, Map<Integer, Integer> instanceIndexById) {
        this.graph = graph;
        this.inputPins = Collections.unmodifiableList(inputPins);
        this.inputIndexById = Collections.unmodifiableMap(inputIndexById);
        this.outputPins = Collections.unmodifiableList(outputPins);
        this.outputIndexById = Collections.unmodifiableMap(outputIndexById);
        this.instances = Collections.unmodifiableList(instances);
        this.instanceIndexById = Collections.unmodifiableMap(instanceIndexById);
    }

    public OwnerRole roleOf(int ownerId) {
        if (inputIndexById.containsKey(ownerId)) {
            return OwnerRole.INPUT_PIN;
        }
        if (outputIndexById.containsKey(ownerId)) {
            return OwnerRole.OUTPUT_PIN;
        }
        if (instanceIndexById.containsKey(ownerId)) {
            return OwnerRole.INSTANCE;
        }
        return OwnerRole.UNKNOWN;
    }

    public Optional<TopLevelPin> inputPin(int id) {
        Integer idx = inputIndexById.get(id);
        return idx == null ? Optional.empty() : Optional.of(inputPins.get(idx));
    }

    public Optional<TopLevelPin> outputPin(int id) {
        Integer idx = outputIndexById.get(id);
        return idx == null ? Optional.empty() : Optional.of(outputPins.get(idx));
    }

    public Optional<IndexedInstance> instance(int id) {
        Integer idx = instanceIndexById.get(id);
        return idx == null ? Optional.empty() : Optional.of(instances.get(idx));
    }

    /**
     * Registration position of an input pin, or -1.
     */
    public int inputIndexOf(int id) {
        return inputIndexById.getOrDefault(id, -1);
    }

    /**
     * Registration position of an output pin, or -1.
     */
    public int outputIndexOf(int id) {
        return outputIndexById.getOrDefault(id, -1);
    }
}
