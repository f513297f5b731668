package com.chipsim.hdlgen.diagnostics;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Anomalies detected while lowering a chip. None of them aborts the pass.
 */
@Getter
@RequiredArgsConstructor
public enum DiagnosticKind {

    /**
     * Instance type is known to have no catalog equivalent; the instance is skipped.
     */
    UNSUPPORTED_TYPE(Severity.WARNING),

    /**
     * More connected pins on one side than the catalog declares.
     */
    ARITY_OVERFLOW(Severity.WARNING),

    /**
     * Instance has no resolvable connections and is emitted as a stub.
     */
    EMPTY_CONNECTIONS(Severity.WARNING),

    /**
     * An instance input is driven by a skipped instance and reads {@code unknown}.
     */
    SKIPPED_SOURCE(Severity.WARNING),

    /**
     * A wire endpoint names an owner id that is not registered anywhere.
     */
    UNRESOLVED_OWNER(Severity.ERROR),

    /**
     * More than one wire drives the same instance input pin.
     */
    FAN_IN(Severity.WARNING),

    /**
     * A non-catalog instance drives a chip output, so a synthesized signal is used.
     */
    PASS_THROUGH_FALLBACK(Severity.WARNING),

    /**
     * The same owner id is registered more than once.
     */
    DUPLICATE_OWNER(Severity.ERROR),

    /**
     * Wire touches no instance, or runs against pin direction.
     */
    UNROUTABLE_WIRE(Severity.WARNING);

    private final Severity defaultSeverity;
}
