package com.chipsim.hdlgen.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Diagnostics accumulated during one lowering pass, in detection order.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
public class DiagnosticCollector {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(DiagnosticKind kind, Integer instanceId, String message) {
        diagnostics.add(Diagnostic.of(kind, instanceId, message));
    }

    public void addAll(List<Diagnostic> others) {
        diagnostics.addAll(others);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public long count(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.getKind() == kind).count();
    }
}
