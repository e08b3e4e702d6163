package com.labware.echo.exception;

/**
 * A required attribute or child element is absent.
 */
public class MissingRequiredFieldException extends EchoXmlException {

    private static final long serialVersionUID = 1L;
    private final String elementTag;
    private final String fieldName;

    public MissingRequiredFieldException(String elementTag, String fieldName) {
        super("Element <" + elementTag + "> is missing required field '" + fieldName + "'");
        this.elementTag = elementTag;
        this.fieldName = fieldName;
    }

    public String getElementTag() {
        return elementTag;
    }

    public String getFieldName() {
        return fieldName;
    }
}
