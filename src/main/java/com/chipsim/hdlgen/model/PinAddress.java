package com.chipsim.hdlgen.model;

import lombok.Value;

/**
 * One wire endpoint: the owning chip element and the pin on it.
 */
@Value
public class PinAddress {
    int ownerId;
    int pinId;

    @Override
    public String toString() {
        return ownerId + ":" + pinId;
    }
}
