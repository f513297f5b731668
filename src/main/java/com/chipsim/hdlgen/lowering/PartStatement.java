package com.chipsim.hdlgen.lowering;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Lowered form of one instance, in the PARTS section.
 */
@Value
@Builder
public class PartStatement {

    int instanceId;

    @NonNull
    String rawTypeName;

    /** Canonical type name; the raw name for skipped parts. */
    @NonNull
    String typeName;

    @NonNull
    PartStatus status;

    @Singular
    List<PortBinding> bindings;

    String skipReason;

    /** Pin id -> parameter name, kept for reporting. */
    @Singular
    Map<Integer, String> inputPinNames;

    @Singular
    Map<Integer, String> outputPinNames;

    public String render() {
        return switch (status) {
            case SKIPPED -> "// SKIPPED: " + rawTypeName + " (" + skipReason + ")";
            case STUB -> typeName + "(); // no connections";
            case RESOLVED -> typeName + "(" + bindings.stream()
                    .map(PortBinding::toString)
                    .collect(Collectors.joining(", ")) + ");";
        };
    }
}
