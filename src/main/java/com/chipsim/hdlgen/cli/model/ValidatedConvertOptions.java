package com.chipsim.hdlgen.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    Path normalizedOutputDir;
    List<Path> inputs;
}
