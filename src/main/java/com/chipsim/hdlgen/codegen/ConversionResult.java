package com.chipsim.hdlgen.codegen;

import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a conversion run over one or more chip files.
 */
@Data
@Builder
public class ConversionResult {
    private boolean success;
    private String errorMessage;

    private List<FileConversion> files;

    private int filesConverted;
    private int filesFailed;
    private int partsEmitted;
    private int partsSkipped;
    private int warningCount;
    private int errorCount;

    public boolean hasDiagnostics() {
        return warningCount > 0 || errorCount > 0;
    }

    public static ConversionResult failure(String errorMessage) {
        return ConversionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .files(List.of())
                .build();
    }
}
