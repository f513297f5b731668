package com.chipsim.hdlgen.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Directed connection from a source pin to a target pin.
 */
@Value
public class Wire {
    @NonNull
    PinAddress source;
    @NonNull
    PinAddress target;

    public static Wire of(int sourceOwnerId, int sourcePinId, int targetOwnerId, int targetPinId) {
        return new Wire(new PinAddress(sourceOwnerId, sourcePinId), new PinAddress(targetOwnerId, targetPinId));
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
