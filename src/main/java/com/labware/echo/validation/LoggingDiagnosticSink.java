package com.labware.echo.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: forwards advisories to SLF4J at WARN.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

    @Override
    public void warn(String code, String message) {
        log.warn("[{}] {}", code, message);
    }
}
