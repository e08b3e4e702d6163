package com.labware.echo.exception;

public class DuplicatePlateTypeException extends EchoXmlException {

    private static final long serialVersionUID = 1L;
    private final String platetype;

    public DuplicatePlateTypeException(String platetype) {
        super("Plate of type " + platetype + " already exists.");
        this.platetype = platetype;
    }

    public String getPlatetype() {
        return platetype;
    }
}
