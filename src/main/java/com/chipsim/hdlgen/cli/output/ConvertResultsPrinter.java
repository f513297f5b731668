package com.chipsim.hdlgen.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chipsim.hdlgen.cli.model.ConvertOptions;
import com.chipsim.hdlgen.cli.model.ValidatedConvertOptions;
import com.chipsim.hdlgen.codegen.ConversionResult;
import com.chipsim.hdlgen.codegen.FileConversion;

/**
 * Responsible only for printing CLI output for the convert command.
 * No validation, no execution.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(ConvertOptions o, ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("Digital Logic Sim -> HDL Converter");
        log.info("=================================================");
        log.info("Inputs: {}", v.getInputs());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Force: {}", o.isForce());
        log.info("Dry Run: {}", o.isDryRun());
        log.info("Write Reports: {}", o.isReport());
        log.info("Strict: {}", o.isStrict());
        log.info("Disambiguate Outputs: {}", !o.isKeepDuplicateOutputs());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedConvertOptions v, ConversionResult result) {
        log.info("");
        log.info("=================================================");
        log.info("CONVERSION SUCCESSFUL");
        log.info("=================================================");
        printSummary(v, result);
        log.info("=================================================");
    }

    public void printFailure(ValidatedConvertOptions v, ConversionResult result) {
        log.error("Conversion failed: {}", result.getErrorMessage());
        if (result.getFiles() != null) {
            for (FileConversion file : result.getFiles()) {
                if (!file.isSuccess()) {
                    log.error("  {}: {}", file.getSource(), file.getErrorMessage());
                }
            }
            if (!result.getFiles().isEmpty()) {
                printSummary(v, result);
            }
        }
    }

    private void printSummary(ValidatedConvertOptions v, ConversionResult result) {
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Files Converted: {}", result.getFilesConverted());
        log.info("Files Failed: {}", result.getFilesFailed());
        log.info("Parts Emitted: {}", result.getPartsEmitted());
        log.info("Parts Skipped: {}", result.getPartsSkipped());
        log.info("Diagnostics: {} warning(s), {} error(s)", result.getWarningCount(), result.getErrorCount());
        for (FileConversion file : result.getFiles()) {
            if (file.isSuccess()) {
                log.info("  {} -> {} ({} diagnostic(s))", file.getSource().getFileName(), file.getModulePath(),
                        file.getDiagnostics().size());
            }
        }
    }
}
