package com.labware.echo.exception;

/**
 * Base type for every failure raised while reading, validating or writing
 * Echo labware and plate survey documents.
 */
public class EchoXmlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EchoXmlException(String message) {
        super(message);
    }

    public EchoXmlException(String message, Throwable cause) {
        super(message, cause);
    }
}
