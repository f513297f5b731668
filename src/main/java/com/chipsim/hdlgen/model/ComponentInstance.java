package com.chipsim.hdlgen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A sub-chip placed inside the chip being lowered.
 */
@Value
@Builder(toBuilder = true)
public class ComponentInstance {

    int id;

    /** Type name exactly as it appears in the source document. */
    @NonNull
    String rawTypeName;

    /**
     * Output pin ids in the order the source document lists them. Authoritative
     * for output identity when non-empty.
     */
    @Singular("declaredOutput")
    List<Integer> declaredOutputOrder;

    String label;

    public boolean hasDeclaredOutputOrder() {
        return !declaredOutputOrder.isEmpty();
    }
}
