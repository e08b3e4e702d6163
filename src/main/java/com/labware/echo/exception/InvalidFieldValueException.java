package com.labware.echo.exception;

/**
 * An attribute is present but its raw text cannot be decoded by the field's codec.
 */
public class InvalidFieldValueException extends EchoXmlException {

    private static final long serialVersionUID = 1L;
    private final String elementTag;
    private final String fieldName;
    private final String rawValue;

    public InvalidFieldValueException(String elementTag, String fieldName, String rawValue, Throwable cause) {
        super("Element <" + elementTag + "> has invalid value '" + rawValue + "' for '" + fieldName + "': "
                + cause.getMessage(), cause);
        this.elementTag = elementTag;
        this.fieldName = fieldName;
        this.rawValue = rawValue;
    }

    public String getElementTag() {
        return elementTag;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getRawValue() {
        return rawValue;
    }
}
