package com.labware.echo.util;

/**
 * Argument checks shared by the model constructors.
 */
public final class ModelChecks {

    private ModelChecks() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static int nonNegative(String field, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must be non-negative, got " + value);
        }
        return value;
    }
}
