package com.labware.echo.table;

import com.labware.echo.codec.ScalarType;
import com.labware.echo.survey.EchoPlateSurvey;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the one-row-per-well survey table.
 */
class SurveyTableProjectionTest {

    private static EchoPlateSurvey sample() throws IOException {
        try (InputStream in = SurveyTableProjectionTest.class.getResourceAsStream("/survey/platesurvey-sample.xml")) {
            return EchoPlateSurvey.fromBytes(in.readAllBytes());
        }
    }

    @Test
    void testWellColumnsComeBeforeHeaderColumns() {
        assertThat(SurveyTableProjection.COLUMNS.get(0).getName()).isEqualTo("row");
        assertThat(SurveyTableProjection.COLUMNS)
                .extracting(TableColumn::getName)
                .containsSubsequence("well", "volume", "fluid_thickness_inhomogeneous", "corrective_action",
                        "plate_type", "plate_barcode", "timestamp", "survey_total_wells", "comment");
    }

    @Test
    void testNoSignalColumns() {
        assertThat(SurveyTableProjection.COLUMNS)
                .extracting(TableColumn::getName)
                .doesNotContain("echo_signal", "features", "signal_type", "tof", "vpp", "wells");
    }

    @Test
    void testHeaderIsBroadcast() throws IOException {
        Table table = sample().toTable();

        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.column("plate_type")).containsOnly("384PP_DMSO2");
        assertThat(table.column("instrument_serial_number")).containsOnly("E5XX-1234");
        assertThat(table.column("timestamp")).containsOnly(LocalDateTime.of(2023, 4, 12, 15, 2, 33, 417_000_000));
        assertThat(table.column("plate_barcode")).containsExactly(null, null, null);
    }

    @Test
    void testWellValues() throws IOException {
        Table table = sample().toTable();

        assertThat(table.column("well")).containsExactly("A1", "A2", "A3");
        assertThat(table.column("column")).containsExactly(0, 1, 2);
        assertThat(table.column("volume")).containsExactly(41.25, null, 12.5);
        assertThat(table.get(0, "bottom_thickness")).isEqualTo(1.05);
    }

    @Test
    void testColumnTypes() throws IOException {
        Table table = sample().toTable();

        assertThat(table.getColumn("timestamp").getType()).isEqualTo(ScalarType.TIMESTAMP);
        assertThat(table.getColumn("volume").getType()).isEqualTo(ScalarType.FLOAT);
        assertThat(table.getColumn("survey_rows").getType()).isEqualTo(ScalarType.INTEGER);
        assertThatThrownBy(() -> table.getColumn("tof")).isInstanceOf(IllegalArgumentException.class);
    }
}
