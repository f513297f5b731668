package com.chipsim.hdlgen.lowering;

/**
 * Which registry a wire endpoint's owner id resolves to.
 */
public enum OwnerRole {
    INPUT_PIN,
    OUTPUT_PIN,
    INSTANCE,
    UNKNOWN
}
