package com.chipsim.hdlgen.codegen;

import java.nio.file.Path;
import java.util.List;

import com.chipsim.hdlgen.lowering.LoweringOptions;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a conversion run.
 */
@Data
@Builder
public class ConverterConfig {

    /**
     * Chip JSON files or directories containing them.
     */
    private List<Path> inputs;

    /**
     * Directory receiving the .hdl (and report) files.
     */
    private Path outputDir;

    /**
     * Whether to overwrite existing output files.
     */
    private boolean force;

    /**
     * Whether this is a dry run (no files written).
     */
    private boolean dryRun;

    /**
     * Whether to write a conversion report next to each module.
     */
    private boolean writeReport;

    /**
     * Whether any diagnostic fails the run.
     */
    private boolean strict;

    @Builder.Default
    private LoweringOptions loweringOptions = LoweringOptions.defaults();
}
