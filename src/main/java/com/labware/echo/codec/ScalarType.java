package com.labware.echo.codec;

import java.time.LocalDateTime;

/**
 * Logical type of a decoded scalar, used to type table columns.
 */
public enum ScalarType {
    STRING(String.class),
    INTEGER(Integer.class),
    FLOAT(Double.class),
    TIMESTAMP(LocalDateTime.class);

    private final Class<?> javaType;

    ScalarType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return javaType;
    }
}
