package com.chipsim.hdlgen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Complete, immutable description of one flat chip: its interface pins, the
 * sub-chips placed inside it and the wires between them.
 */
@Value
@Builder(toBuilder = true)
public class ChipGraph {

    @NonNull
    String name;

    @Singular
    List<TopLevelPin> inputPins;

    @Singular
    List<TopLevelPin> outputPins;

    @Singular
    List<ComponentInstance> instances;

    @Singular
    List<Wire> wires;

    public int totalInputBits() {
        return inputPins.stream().mapToInt(TopLevelPin::getBitWidth).sum();
    }

    public int totalOutputBits() {
        return outputPins.stream().mapToInt(TopLevelPin::getBitWidth).sum();
    }
}
