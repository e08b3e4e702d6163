package com.labware.echo.validation;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Value;

/**
 * Accumulates advisories for later inspection.
 *
 * Pure structure only: no logging, no formatting.
 */
@Getter
public class CollectingDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> warnings = new ArrayList<>();

    @Override
    public void warn(String code, String message) {
        warnings.add(new Diagnostic(code, message));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<String> getCodes() {
        return warnings.stream().map(Diagnostic::getCode).toList();
    }

    @Value
    public static class Diagnostic {
        String code;
        String message;
    }
}
