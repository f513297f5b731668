package com.chipsim.hdlgen.lowering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.chipsim.hdlgen.catalog.ChipInterface;
import com.chipsim.hdlgen.catalog.TypeResolution;
import com.chipsim.hdlgen.model.ComponentInstance;
import com.chipsim.hdlgen.model.Wire;

import lombok.Getter;
import lombok.NonNull;

/**
 * An instance together with its resolved type and its connection buckets.
 * Buckets are filled by {@link NetlistIndexer} and read-only afterwards; both
 * keep pin ids in the order they were first seen in the wire list.
 */
public class IndexedInstance {

    @Getter
    private final ComponentInstance instance;
    @Getter
    private final TypeResolution type;
    private final ChipInterface chipInterface;

    private final Map<Integer, Wire> inputWires = new LinkedHashMap<>();
    private final Map<Integer, List<Wire>> outputWires = new LinkedHashMap<>();

    IndexedInstance(@NonNull ComponentInstance instance, @NonNull TypeResolution type, ChipInterface chipInterface) {
        this.instance = instance;
        this.type = type;
        this.chipInterface = chipInterface;
    }

    public int getId() {
        return instance.getId();
    }

    public boolean isSupported() {
        return type.isSupported();
    }

    /**
     * Canonical type name for supported instances, otherwise the raw name.
     */
    public String getTypeName() {
        return type.isSupported() ? type.canonicalName() : instance.getRawTypeName();
    }

    public Optional<ChipInterface> getChipInterface() {
        return Optional.ofNullable(chipInterface);
    }

    public boolean isCatalogType() {
        return chipInterface != null;
    }

    public Map<Integer, Wire> getInputWires() {
        return Collections.unmodifiableMap(inputWires);
    }

    public Map<Integer, List<Wire>> getOutputWires() {
        return Collections.unmodifiableMap(outputWires);
    }

    public boolean hasConnections() {
        return !inputWires.isEmpty() || !outputWires.isEmpty();
    }

    /**
     * @return false when the pin was already driven (the first wire is kept)
     */
    boolean addInputWire(int pinId, Wire wire) {
        return inputWires.putIfAbsent(pinId, wire) == null;
    }

    void addOutputWire(int pinId, Wire wire) {
        outputWires.computeIfAbsent(pinId, k -> new ArrayList<>()).add(wire);
    }
}
