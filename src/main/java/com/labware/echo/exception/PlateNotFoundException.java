package com.labware.echo.exception;

public class PlateNotFoundException extends EchoXmlException {

    private static final long serialVersionUID = 1L;
    private final String platetype;

    public PlateNotFoundException(String platetype) {
        super("No plate of type " + platetype);
        this.platetype = platetype;
    }

    public String getPlatetype() {
        return platetype;
    }
}
