package com.chipsim.hdlgen.lowering;

import lombok.NonNull;
import lombok.Value;

/**
 * One entry of the IN or OUT signature.
 */
@Value
public class SignaturePort {
    int pinId;
    /** Pin name as written in the source document. */
    @NonNull
    String sourceName;
    /** Identifier used in the module, unique within its side. */
    @NonNull
    String name;
    int bitWidth;

    public String declaration() {
        return bitWidth > 1 ? name + "[" + bitWidth + "]" : name;
    }

    /**
     * Expression addressing this port from a wire attached to {@code pinIndex}:
     * a single bit for buses when the index is in range, the whole port otherwise.
     */
    public String reference(int pinIndex) {
        if (bitWidth > 1 && pinIndex >= 0 && pinIndex < bitWidth) {
            return name + "[" + pinIndex + "]";
        }
        return name;
    }
}
