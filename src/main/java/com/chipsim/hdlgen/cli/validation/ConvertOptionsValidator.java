package com.chipsim.hdlgen.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.chipsim.hdlgen.cli.exception.OptionsValidationException;
import com.chipsim.hdlgen.cli.model.ConvertOptions;
import com.chipsim.hdlgen.cli.model.ValidatedConvertOptions;

public class ConvertOptionsValidator {

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> inputs = new ArrayList<>();
		if (o.getInputs() == null || o.getInputs().isEmpty()) {
			errors.add("At least one chip file or directory is required.");
		} else {
			for (Path input : o.getInputs()) {
				if (!Files.exists(input)) {
					errors.add("Input does not exist: " + input);
				} else if (!Files.isDirectory(input) && !Files.isReadable(input)) {
					errors.add("Input is not readable: " + input);
				} else {
					inputs.add(input.toAbsolutePath().normalize());
				}
			}
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (o.isDryRun() && o.isForce()) {
			errors.add("--dry-run and --force cannot be combined.");
		}

		if (o.getHeaderLines() != null) {
			for (String line : o.getHeaderLines()) {
				if (line.contains("\n") || line.contains("\r")) {
					errors.add("Header lines must be single-line: " + line.strip());
				}
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedConvertOptions(normalizedOutputDir, List.copyOf(inputs));
	}
}
