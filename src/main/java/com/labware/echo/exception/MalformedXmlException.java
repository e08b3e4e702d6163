package com.labware.echo.exception;

/**
 * The input is not well-formed XML, or its root element is not the one the
 * dialect requires.
 */
public class MalformedXmlException extends EchoXmlException {

    private static final long serialVersionUID = 1L;

    public MalformedXmlException(String message) {
        super(message);
    }

    public MalformedXmlException(String message, Throwable cause) {
        super(message, cause);
    }
}
