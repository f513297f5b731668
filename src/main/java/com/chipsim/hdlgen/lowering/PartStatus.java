package com.chipsim.hdlgen.lowering;

public enum PartStatus {
    /** Instantiated with at least one binding. */
    RESOLVED,
    /** Type has no HDL equivalent; only a marker comment is emitted. */
    SKIPPED,
    /** Supported type without connections; emitted with no parameters. */
    STUB
}
