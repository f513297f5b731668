package com.chipsim.hdlgen.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed table of the chips a Nand2tetris HDL module may instantiate.
 */
public final class InterfaceCatalog {

    private static final InterfaceCatalog HACK_CHIP_SET = new Builder()
            .chip("Nand", List.of("a", "b"), List.of("out"))
            .chip("Not", List.of("in"), List.of("out"))
            .chip("And", List.of("a", "b"), List.of("out"))
            .chip("Or", List.of("a", "b"), List.of("out"))
            .chip("Xor", List.of("a", "b"), List.of("out"))
            .chip("Mux", List.of("a", "b", "sel"), List.of("out"))
            .chip("DMux", List.of("in", "sel"), List.of("a", "b"))
            .chip("Not16", List.of("in"), List.of("out"))
            .chip("And16", List.of("a", "b"), List.of("out"))
            .chip("Or16", List.of("a", "b"), List.of("out"))
            .chip("Mux16", List.of("a", "b", "sel"), List.of("out"))
            .chip("Or8Way", List.of("in"), List.of("out"))
            .chip("Mux4Way16", List.of("a", "b", "c", "d", "sel"), List.of("out"))
            .chip("Mux8Way16", List.of("a", "b", "c", "d", "e", "f", "g", "h", "sel"), List.of("out"))
            .chip("DMux4Way", List.of("in", "sel"), List.of("a", "b", "c", "d"))
            .chip("DMux8Way", List.of("in", "sel"), List.of("a", "b", "c", "d", "e", "f", "g", "h"))
            .chip("HalfAdder", List.of("a", "b"), List.of("sum", "carry"))
            .chip("FullAdder", List.of("a", "b", "c"), List.of("sum", "carry"))
            .chip("Add16", List.of("a", "b"), List.of("out"))
            .chip("Inc16", List.of("in"), List.of("out"))
            .chip("ALU", List.of("x", "y", "zx", "nx", "zy", "ny", "f", "no"), List.of("out", "zr", "ng"))
            .chip("DFF", List.of("in"), List.of("out"))
            .chip("Bit", List.of("in", "load"), List.of("out"))
            .chip("Register", List.of("in", "load"), List.of("out"))
            .chip("RAM8", List.of("in", "load", "address"), List.of("out"))
            .chip("RAM64", List.of("in", "load", "address"), List.of("out"))
            .chip("RAM512", List.of("in", "load", "address"), List.of("out"))
            .chip("RAM4K", List.of("in", "load", "address"), List.of("out"))
            .chip("RAM16K", List.of("in", "load", "address"), List.of("out"))
            .chip("PC", List.of("in", "load", "inc", "reset"), List.of("out"))
            .build();

    private final Map<String, ChipInterface> chips;

    private InterfaceCatalog(Map<String, ChipInterface> chips) {
        this.chips = Collections.unmodifiableMap(new LinkedHashMap<>(chips));
    }

    /**
     * The standard Hack chip-set.
     */
    public static InterfaceCatalog hackChipSet() {
        return HACK_CHIP_SET;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ChipInterface> lookup(String canonicalName) {
        return Optional.ofNullable(chips.get(canonicalName));
    }

    public boolean contains(String canonicalName) {
        return chips.containsKey(canonicalName);
    }

    public Collection<ChipInterface> getChips() {
        return chips.values();
    }

    public static final class Builder {
        private final Map<String, ChipInterface> chips = new LinkedHashMap<>();

        public Builder chip(String name, List<String> inputs, List<String> outputs) {
            chips.put(name, ChipInterface.of(name, inputs, outputs));
            return this;
        }

        public InterfaceCatalog build() {
            return new InterfaceCatalog(chips);
        }
    }
}
