package com.labware.echo.table;

import com.labware.echo.codec.ScalarType;

import lombok.NonNull;
import lombok.Value;

@Value
public class TableColumn {
    @NonNull
    String name;
    @NonNull
    ScalarType type;
}
