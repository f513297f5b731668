package com.chipsim.hdlgen.model;

import lombok.NonNull;
import lombok.Value;

/**
 * An interface pin of the enclosing chip. Several pins may share a name
 * (multi-pin buses are split into separate ids).
 */
@Value
public class TopLevelPin {
    int id;
    @NonNull
    String name;
    int bitWidth;

    public TopLevelPin(int id, @NonNull String name, int bitWidth) {
        if (bitWidth < 1) {
            throw new IllegalArgumentException("Pin " + id + " (" + name + ") has bit width " + bitWidth);
        }
        this.id = id;
        this.name = name;
        this.bitWidth = bitWidth;
    }

    public boolean isBus() {
        return bitWidth > 1;
    }
}
