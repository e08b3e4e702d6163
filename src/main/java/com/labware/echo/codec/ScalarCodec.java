package com.labware.echo.codec;

/**
 * Pure pair of functions between the raw text of an XML attribute and its
 * logical value.
 *
 * Implementations throw {@link IllegalArgumentException} when the raw text
 * cannot be decoded; the mapping engine turns that into an
 * {@link com.labware.echo.exception.InvalidFieldValueException} naming the element
 * and attribute.
 *
 * @param <T> logical value type
 */
public interface ScalarCodec<T> {

    T decode(String raw);

    String encode(T value);

    ScalarType type();

    /**
     * Whether {@link #encode(Object)} accepts {@code null}, i.e. the wire format has
     * a sentinel for "absent".
     */
    default boolean encodesAbsence() {
        return false;
    }
}
