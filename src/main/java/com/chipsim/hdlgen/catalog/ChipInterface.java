package com.chipsim.hdlgen.catalog;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Ordered parameter names of one catalog chip.
 */
@Value
public class ChipInterface {
    @NonNull
    String name;
    @NonNull
    List<String> inputs;
    @NonNull
    List<String> outputs;

    static ChipInterface of(String name, List<String> inputs, List<String> outputs) {
        return new ChipInterface(name, List.copyOf(inputs), List.copyOf(outputs));
    }
}
