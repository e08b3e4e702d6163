package com.labware.echo.table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.labware.echo.survey.EchoPlateSurvey;
import com.labware.echo.survey.SurveySchemas;
import com.labware.echo.survey.WellSurvey;

/**
 * One row per well: the well's scalar fields followed by every survey header
 * field, repeated on each row.
 */
public final class SurveyTableProjection {

    public static final List<TableColumn> COLUMNS = columns();

    private SurveyTableProjection() {
        // Utility class
    }

    public static Table project(EchoPlateSurvey survey) {
        Map<String, Object> header = ScalarColumns.cells(SurveySchemas.PLATE_SURVEY,
                SurveySchemas.headerRecord(survey));
        List<Map<String, Object>> rows = new ArrayList<>(survey.getWells().size());
        for (WellSurvey well : survey.getWells()) {
            Map<String, Object> row = new LinkedHashMap<>(
                    ScalarColumns.cells(SurveySchemas.WELL, SurveySchemas.toRecord(well)));
            row.putAll(header);
            rows.add(row);
        }
        return Table.fromRows(COLUMNS, rows);
    }

    private static List<TableColumn> columns() {
        List<TableColumn> columns = new ArrayList<>(ScalarColumns.of(SurveySchemas.WELL));
        columns.addAll(ScalarColumns.of(SurveySchemas.PLATE_SURVEY));
        return List.copyOf(columns);
    }
}
