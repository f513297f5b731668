package com.chipsim.hdlgen.lowering;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.chipsim.hdlgen.model.TopLevelPin;

/**
 * Builds the module signature from the registered chip pins.
 *
 * Names are lower-cased with whitespace removed. The first pin with a given
 * name keeps it; the n-th repeat becomes {@code <name><n-1>}, or the next free
 * suffix when that name is already used by another pin.
 */
public class SignatureBuilder {

    private final boolean disambiguateOutputs;

    public SignatureBuilder(boolean disambiguateOutputs) {
        this.disambiguateOutputs = disambiguateOutputs;
    }

    public ModuleSignature build(NetlistIndex index) {
        return new ModuleSignature(
                ports(index.getInputPins(), true),
                ports(index.getOutputPins(), disambiguateOutputs));
    }

    private static List<SignaturePort> ports(List<TopLevelPin> pins, boolean disambiguate) {
        Map<String, Integer> occurrences = new HashMap<>();
        Set<String> taken = new HashSet<>();
        List<SignaturePort> ports = new ArrayList<>();
        for (TopLevelPin pin : pins) {
            String base = baseName(pin.getName());
            String name = base;
            if (disambiguate) {
                int seen = occurrences.merge(base, 1, Integer::sum);
                if (seen > 1) {
                    name = base + (seen - 1);
                }
                // a suffixed name may collide with a pin literally named that way
                int suffix = seen;
                while (taken.contains(name)) {
                    name = base + suffix++;
                }
                taken.add(name);
            }
            ports.add(new SignaturePort(pin.getId(), pin.getName(), name, pin.getBitWidth()));
        }
        return ports;
    }

    static String baseName(String pinName) {
        return pinName.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
    }
}
