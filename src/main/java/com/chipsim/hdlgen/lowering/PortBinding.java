package com.chipsim.hdlgen.lowering;

import lombok.NonNull;
import lombok.Value;

/**
 * One {@code parameter=expression} pair of a part statement.
 */
@Value
public class PortBinding {
    @NonNull
    String parameter;
    @NonNull
    String expression;

    @Override
    public String toString() {
        return parameter + "=" + expression;
    }
}
