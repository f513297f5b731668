package com.chipsim.hdlgen.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the convert command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Parameters(arity = "1..*", paramLabel = "INPUT", description = "Chip JSON files, or directories containing them")
	private List<Path> inputs;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing .hdl files")
	private boolean force;

	@Option(names = { "--dry-run" }, description = "Lower and report, but do not write any file")
	private boolean dryRun;

	@Option(names = { "--report" }, description = "Write <Module>.report.txt next to each module")
	private boolean report;

	@Option(names = { "--strict" }, description = "Exit with code 2 when any diagnostic is reported")
	private boolean strict;

	@Option(names = { "--parallel" }, description = "Resolve pin names of large netlists in parallel")
	private boolean parallel;

	@Option(names = {
			"--keep-duplicate-outputs" }, description = "Do not suffix repeated output pin names (out, out1, ...)")
	private boolean keepDuplicateOutputs;

	@Option(names = { "--header" }, description = "Comment line for the module header (repeatable)")
	private List<String> headerLines;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
