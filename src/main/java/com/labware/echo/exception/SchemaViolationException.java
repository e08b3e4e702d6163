package com.labware.echo.exception;

/**
 * A cross-field invariant does not hold. The document is treated as corrupt and
 * is never returned.
 */
public class SchemaViolationException extends EchoXmlException {

    private static final long serialVersionUID = 1L;

    public SchemaViolationException(String message) {
        super(message);
    }
}
