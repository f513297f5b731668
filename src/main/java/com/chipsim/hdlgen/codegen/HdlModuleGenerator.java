package com.chipsim.hdlgen.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chipsim.hdlgen.codegen.util.FileWriteUtil;
import com.chipsim.hdlgen.diagnostics.Diagnostic;
import com.chipsim.hdlgen.lowering.LoweringDriver;
import com.chipsim.hdlgen.lowering.LoweringResult;
import com.chipsim.hdlgen.lowering.PartStatus;
import com.chipsim.hdlgen.model.ChipGraph;
import com.chipsim.hdlgen.parser.ChipDocumentException;
import com.chipsim.hdlgen.parser.ChipDocumentParser;

/**
 * Converts chip JSON files into HDL modules on disk.
 *
 * Files are processed independently: a file that cannot be read or parsed is
 * recorded as failed and the batch goes on.
 */
public class HdlModuleGenerator {
    private static final Logger log = LoggerFactory.getLogger(HdlModuleGenerator.class);

    static final String CHIP_EXTENSION = ".json";
    static final String MODULE_EXTENSION = ".hdl";
    static final String REPORT_SUFFIX = ".report.txt";

    private final ConverterConfig config;
    private final ChipDocumentParser parser;
    private final LoweringDriver driver;
    private final ConversionReportGenerator reportGenerator;

    public HdlModuleGenerator(ConverterConfig config) {
        this.config = config;
        this.parser = new ChipDocumentParser();
        this.driver = new LoweringDriver(config.getLoweringOptions());
        this.reportGenerator = new ConversionReportGenerator();
    }

    public ConversionResult generate() {
        List<Path> files;
        try {
            files = FileWriteUtil.expandInputs(config.getInputs(), CHIP_EXTENSION);
        } catch (IOException e) {
            log.error("Failed to list inputs", e);
            return ConversionResult.failure("Failed to list inputs: " + e.getMessage());
        }
        if (files.isEmpty()) {
            return ConversionResult.failure("No chip files found in " + config.getInputs());
        }

        log.info("Converting {} chip file(s)...", files.size());
        List<FileConversion> conversions = new ArrayList<>();
        for (Path file : files) {
            conversions.add(convert(file));
        }
        return summarize(conversions);
    }

    FileConversion convert(Path file) {
        try {
            // Step 1: Load chip graph
            ChipGraph graph = parser.parse(file);

            // Step 2: Lower
            LoweringResult result = driver.lower(graph);
            for (Diagnostic diagnostic : result.getDiagnostics()) {
                log.warn("{}: {}", file.getFileName(), diagnostic);
            }

            // Step 3: Write module and report
            Path modulePath = config.getOutputDir().resolve(result.getModuleName() + MODULE_EXTENSION);
            Path reportPath = config.isWriteReport()
                    ? config.getOutputDir().resolve(result.getModuleName() + REPORT_SUFFIX)
                    : null;

            if (config.isDryRun()) {
                log.info("Dry run, not writing {}", modulePath);
            } else {
                FileWriteUtil.writeString(modulePath, result.getModuleText(), config.isForce());
                log.info("Wrote {}", modulePath);
                if (reportPath != null) {
                    FileWriteUtil.writeString(reportPath, reportGenerator.generate(result), config.isForce());
                    log.info("Wrote {}", reportPath);
                }
            }

            return FileConversion.builder()
                    .source(file)
                    .success(true)
                    .moduleName(result.getModuleName())
                    .modulePath(modulePath)
                    .reportPath(reportPath)
                    .partsEmitted((int) (result.countStatements(PartStatus.RESOLVED) + result.countStatements(PartStatus.STUB)))
                    .partsSkipped((int) result.countStatements(PartStatus.SKIPPED))
                    .internalSignals(result.getWireIdentifiers().size())
                    .diagnostics(result.getDiagnostics())
                    .build();

        } catch (ChipDocumentException e) {
            log.error("Invalid chip document {}: {}", file, e.getMessage());
            return FileConversion.failure(file, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to convert {}", file, e);
            return FileConversion.failure(file, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ConversionResult summarize(List<FileConversion> conversions) {
        int converted = 0;
        int failed = 0;
        int emitted = 0;
        int skipped = 0;
        int warnings = 0;
        int errors = 0;
        for (FileConversion conversion : conversions) {
            if (!conversion.isSuccess()) {
                failed++;
                continue;
            }
            converted++;
            emitted += conversion.getPartsEmitted();
            skipped += conversion.getPartsSkipped();
            for (Diagnostic diagnostic : conversion.getDiagnostics()) {
                if (diagnostic.isError()) {
                    errors++;
                } else {
                    warnings++;
                }
            }
        }

        boolean success = failed == 0 && !(config.isStrict() && (warnings > 0 || errors > 0));
        String errorMessage = null;
        if (failed > 0) {
            errorMessage = failed + " of " + conversions.size() + " chip file(s) failed";
        } else if (!success) {
            errorMessage = "Strict mode: " + (warnings + errors) + " diagnostic(s) reported";
        }

        return ConversionResult.builder()
                .success(success)
                .errorMessage(errorMessage)
                .files(List.copyOf(conversions))
                .filesConverted(converted)
                .filesFailed(failed)
                .partsEmitted(emitted)
                .partsSkipped(skipped)
                .warningCount(warnings)
                .errorCount(errors)
                .build();
    }
}
