package com.labware.echo.validation;

/**
 * Receives non-fatal advisories raised while reading documents.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void warn(String code, String message);

    static DiagnosticSink noop() {
        return (code, message) -> {
        };
    }

    static DiagnosticSink logging() {
        return new LoggingDiagnosticSink();
    }
}
