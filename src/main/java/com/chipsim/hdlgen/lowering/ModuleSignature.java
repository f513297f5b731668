package com.chipsim.hdlgen.lowering;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * Disambiguated IN / OUT ports of the module being emitted.
 */
@Getter
public class ModuleSignature {

    private final List<SignaturePort> inputs;
    private final List<SignaturePort> outputs;

    private final Map<Integer, SignaturePort> inputsByPinId;
    private final Map<Integer, SignaturePort> outputsByPinId;

    public ModuleSignature(List<SignaturePort> inputs, List<SignaturePort> outputs) {
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.inputsByPinId = byPinId(this.inputs);
        this.outputsByPinId = byPinId(this.outputs);
    }

    public Optional<SignaturePort> input(int pinId) {
        return Optional.ofNullable(inputsByPinId.get(pinId));
    }

    public Optional<SignaturePort> output(int pinId) {
        return Optional.ofNullable(outputsByPinId.get(pinId));
    }

    public String inputDeclaration() {
        return inputs.stream().map(SignaturePort::declaration).collect(Collectors.joining(", "));
    }

    public String outputDeclaration() {
        return outputs.stream().map(SignaturePort::declaration).collect(Collectors.joining(", "));
    }

    private static Map<Integer, SignaturePort> byPinId(List<SignaturePort> ports) {
        Map<Integer, SignaturePort> map = new LinkedHashMap<>();
        for (SignaturePort port : ports) {
            map.put(port.getPinId(), port);
        }
        return Collections.unmodifiableMap(map);
    }
}
