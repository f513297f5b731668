package com.chipsim.hdlgen.lowering;

import java.util.List;
import java.util.Map;

import com.chipsim.hdlgen.diagnostics.Diagnostic;
import com.chipsim.hdlgen.diagnostics.DiagnosticKind;
import com.chipsim.hdlgen.model.ChipGraph;
import com.chipsim.hdlgen.model.PinAddress;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything one lowering pass produced: the module text, the structured
 * statements behind it, and the diagnostics.
 */
@Value
@Builder
public class LoweringResult {

    @NonNull
    ChipGraph graph;

    @NonNull
    String moduleName;

    @NonNull
    ModuleSignature signature;

    @NonNull
    List<PartStatement> statements;

    @NonNull
    List<Diagnostic> diagnostics;

    /** Internal signal table in allocation order. */
    @NonNull
    Map<PinAddress, String> wireIdentifiers;

    @NonNull
    String moduleText;

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public long countDiagnostics(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.getKind() == kind).count();
    }

    public long countStatements(PartStatus status) {
        return statements.stream().filter(s -> s.getStatus() == status).count();
    }
}
