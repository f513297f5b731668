package com.chipsim.hdlgen.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chipsim.hdlgen.cli.exception.OptionsValidationException;
import com.chipsim.hdlgen.cli.model.ConvertOptions;
import com.chipsim.hdlgen.cli.model.ValidatedConvertOptions;
import com.chipsim.hdlgen.cli.output.ConvertResultsPrinter;
import com.chipsim.hdlgen.cli.validation.ConvertOptionsValidator;
import com.chipsim.hdlgen.codegen.ConversionResult;
import com.chipsim.hdlgen.codegen.ConverterConfig;
import com.chipsim.hdlgen.codegen.HdlModuleGenerator;
import com.chipsim.hdlgen.lowering.LoweringOptions;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command converting Digital Logic Sim chips into Nand2tetris HDL modules.
 */
@Command(
        name = "hdlgen",
        mixinStandardHelpOptions = true,
        version = "chip-hdlgen 1.0.0",
        description = "Lowers Digital Logic Sim chip JSON files into Nand2tetris HDL modules."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_DIAGNOSTICS = 2;

    @Mixin
    private ConvertOptions options = new ConvertOptions();

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    @Override
    public Integer call() {
        ValidatedConvertOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return EXIT_FAILURE;
        }

        printer.printBanner(options, validated);

        try {
            ConversionResult result = new HdlModuleGenerator(toConfig(validated)).generate();
            if (!result.isSuccess()) {
                printer.printFailure(validated, result);
                return result.getFilesFailed() == 0 && !result.getFiles().isEmpty() ? EXIT_DIAGNOSTICS : EXIT_FAILURE;
            }
            printer.printSuccess(validated, result);
            return EXIT_OK;
        } catch (Exception e) {
            log.error("Conversion failed with exception", e);
            return EXIT_FAILURE;
        }
    }

    ConvertOptions getOptions() {
        return options;
    }

    ConverterConfig toConfig(ValidatedConvertOptions validated) {
        LoweringOptions.LoweringOptionsBuilder lowering = LoweringOptions.builder()
                .disambiguateOutputs(!options.isKeepDuplicateOutputs())
                .parallelPinResolution(options.isParallel());
        List<String> header = options.getHeaderLines();
        if (header != null && !header.isEmpty()) {
            lowering.headerLines(List.copyOf(header));
        }

        return ConverterConfig.builder()
                .inputs(validated.getInputs())
                .outputDir(validated.getNormalizedOutputDir())
                .force(options.isForce())
                .dryRun(options.isDryRun())
                .writeReport(options.isReport())
                .strict(options.isStrict())
                .loweringOptions(lowering.build())
                .build();
    }
}
