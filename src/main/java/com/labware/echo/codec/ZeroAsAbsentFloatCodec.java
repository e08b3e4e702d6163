package com.labware.echo.codec;

/**
 * Float where the instrument writes {@code 0} for "not measured".
 *
 * Decoding any zero yields {@code null}; encoding {@code null} yields {@code "0"}.
 * A measured volume of exactly zero is indistinguishable from an absent one.
 */
public class ZeroAsAbsentFloatCodec implements ScalarCodec<Double> {

    @Override
    public Double decode(String raw) {
        double value = Codecs.parseDouble(raw);
        return value == 0.0 ? null : value;
    }

    @Override
    public String encode(Double value) {
        return value == null ? "0" : Codecs.formatDouble(value);
    }

    @Override
    public ScalarType type() {
        return ScalarType.FLOAT;
    }

    @Override
    public boolean encodesAbsence() {
        return true;
    }
}
