package com.chipsim.hdlgen.diagnostics;

import lombok.NonNull;
import lombok.Value;

/**
 * One recorded anomaly. {@code instanceId} is null for anomalies that do not
 * belong to a single instance (wires, interface pins).
 */
@Value
public class Diagnostic {
    @NonNull
    Severity severity;
    @NonNull
    DiagnosticKind kind;
    Integer instanceId;
    @NonNull
    String message;

    public static Diagnostic of(DiagnosticKind kind, Integer instanceId, String message) {
        return new Diagnostic(kind.getDefaultSeverity(), kind, instanceId, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + kind + (instanceId != null ? " [" + instanceId + "]" : "") + ": " + message;
    }
}
