package com.labware.echo.labware;

import lombok.Value;

/**
 * Well grid dimensions of a plate type.
 */
@Value(staticConstructor = "of")
public class PlateShape {
    int rows;
    int cols;

    public int wellCount() {
        return rows * cols;
    }
}
