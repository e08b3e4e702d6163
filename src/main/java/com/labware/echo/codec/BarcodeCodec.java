package com.labware.echo.codec;

/**
 * Plate barcode, written as {@value #UNKNOWN_BARCODE} when the plate has none.
 *
 * A plate genuinely labelled with the sentinel text reads back as having no
 * barcode; the vendor format cannot tell the two apart.
 */
public class BarcodeCodec implements ScalarCodec<String> {

    public static final String UNKNOWN_BARCODE = "UnknownBarCode";

    @Override
    public String decode(String raw) {
        return UNKNOWN_BARCODE.equals(raw) ? null : raw;
    }

    @Override
    public String encode(String value) {
        return value == null ? UNKNOWN_BARCODE : value;
    }

    @Override
    public ScalarType type() {
        return ScalarType.STRING;
    }

    @Override
    public boolean encodesAbsence() {
        return true;
    }
}
