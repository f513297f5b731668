package com.chipsim.hdlgen.lowering;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Knobs of a lowering pass.
 */
@Value
@Builder(toBuilder = true)
public class LoweringOptions {

    public static final List<String> DEFAULT_HEADER = List.of(
            "Converted from Digital Logic Sim",
            "Nand2tetris HDL");

    /** Comment lines written at the top of the module, without the comment marker. */
    @NonNull
    @Builder.Default
    List<String> headerLines = DEFAULT_HEADER;

    /** Apply the duplicate-name suffix rule to OUT ports as well as IN ports. */
    @Builder.Default
    boolean disambiguateOutputs = true;

    /** Resolve per-instance pin names on the common fork-join pool. */
    @Builder.Default
    boolean parallelPinResolution = false;

    @NonNull
    @Builder.Default
    String indent = "    ";

    public static LoweringOptions defaults() {
        return LoweringOptions.builder().build();
    }
}
