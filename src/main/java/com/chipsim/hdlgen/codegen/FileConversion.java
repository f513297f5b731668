package com.chipsim.hdlgen.codegen;

import java.nio.file.Path;
import java.util.List;

import com.chipsim.hdlgen.diagnostics.Diagnostic;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of converting one chip file.
 */
@Value
@Builder
public class FileConversion {
    Path source;
    boolean success;
    String errorMessage;

    String moduleName;
    Path modulePath;
    Path reportPath;

    int partsEmitted;
    int partsSkipped;
    int internalSignals;
    @Builder.Default
    List<Diagnostic> diagnostics = List.of();

    public static FileConversion failure(Path source, String errorMessage) {
        return FileConversion.builder()
                .source(source)
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
