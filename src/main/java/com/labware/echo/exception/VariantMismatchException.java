package com.labware.echo.exception;

/**
 * A labware document matched neither the generic (ELWX) nor the fixed-geometry
 * (ELW) layout.
 *
 * The message and cause are those of the fixed-geometry attempt, which is the
 * last one tried. The generic attempt's failure is kept as a suppressed
 * exception and through {@link #getGenericFailure()}.
 */
public class VariantMismatchException extends EchoXmlException {

    private static final long serialVersionUID = 1L;
    private final EchoXmlException genericFailure;
    private final EchoXmlException fixedGeometryFailure;

    public VariantMismatchException(EchoXmlException genericFailure, EchoXmlException fixedGeometryFailure) {
        super("Labware document matches neither the ELWX nor the ELW layout: "
                + fixedGeometryFailure.getMessage(), fixedGeometryFailure);
        this.genericFailure = genericFailure;
        this.fixedGeometryFailure = fixedGeometryFailure;
        addSuppressed(genericFailure);
    }

    public EchoXmlException getGenericFailure() {
        return genericFailure;
    }

    public EchoXmlException getFixedGeometryFailure() {
        return fixedGeometryFailure;
    }
}
