package com.chipsim.hdlgen.lowering;

import java.util.List;
import java.util.Map;

import com.chipsim.hdlgen.diagnostics.Diagnostic;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Parameter names chosen for the connected pins of one instance.
 */
@Value
@Builder
public class PinNameAssignment {

    int instanceId;

    /** Input pin id -> parameter name, in first-seen order. */
    @NonNull
    Map<Integer, String> inputNames;

    /** Output pin id -> parameter name. */
    @NonNull
    Map<Integer, String> outputNames;

    /** Output pin ids in emission order: declared order first, then first-seen. */
    @NonNull
    List<Integer> outputOrder;

    @Singular
    List<Diagnostic> diagnostics;

    public String inputName(int pinId) {
        return inputNames.getOrDefault(pinId, "in" + pinId);
    }

    public String outputName(int pinId) {
        return outputNames.getOrDefault(pinId, "out" + pinId);
    }
}
