package com.labware.echo.table;

import java.util.List;
import java.util.Map;

import com.labware.echo.labware.Labware;
import com.labware.echo.labware.LabwareSchemas;

/**
 * One row per plate, one column per {@code plateinfo} field.
 */
public final class LabwareTableProjection {

    public static final List<TableColumn> COLUMNS = ScalarColumns.of(LabwareSchemas.PLATE_INFO);

    private LabwareTableProjection() {
        // Utility class
    }

    public static Table project(Labware labware) {
        List<Map<String, Object>> rows = labware.getPlates().stream()
                .map(plate -> ScalarColumns.cells(LabwareSchemas.PLATE_INFO, LabwareSchemas.toRecord(plate)))
                .toList();
        return Table.fromRows(COLUMNS, rows);
    }
}
