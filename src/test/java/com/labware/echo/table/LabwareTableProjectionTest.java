package com.labware.echo.table;

import com.labware.echo.codec.ScalarType;
import com.labware.echo.labware.Labware;
import com.labware.echo.labware.PlateShape;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the one-row-per-plate labware table.
 */
class LabwareTableProjectionTest {

    private static Labware load(String name) throws IOException {
        try (InputStream in = LabwareTableProjectionTest.class.getResourceAsStream("/labware/" + name)) {
            return Labware.fromBytes(in.readAllBytes());
        }
    }

    @Test
    void testColumnsFollowPlateinfoFields() {
        assertThat(LabwareTableProjection.COLUMNS).hasSize(25);
        assertThat(LabwareTableProjection.COLUMNS.get(0)).isEqualTo(new TableColumn("platetype", ScalarType.STRING));
        assertThat(LabwareTableProjection.COLUMNS)
                .extracting(TableColumn::getName)
                .contains("plateformat", "usage", "welllength", "dropvolume");
    }

    @Test
    void testProjectElwx() throws IOException {
        Table table = load("elwx-sample.xml").toTable();

        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.columnCount()).isEqualTo(25);
        assertThat(table.column("platetype")).containsExactly("384PP_DMSO2", "6RES_AQ_BP2", "Corning_384PS");
        assertThat(table.column("usage")).containsExactly("SRC", "SRC", "DEST");

        Map<String, Object> first = table.getRow(0);
        assertThat(first.get("plateformat")).isEqualTo("384PP");
        assertThat(first.get("rows")).isEqualTo(16);
        assertThat(first.get("cols")).isEqualTo(24);
        assertThat(first.get("maxvoltotal")).isEqualTo(1000000.0);
    }

    @Test
    void testAbsentOptionalsAreNull() throws IOException {
        Table table = load("elwx-sample.xml").toTable();

        assertThat(table.get(2, "fluid")).isNull();
        assertThat(table.get(2, "minwellvol")).isNull();
        assertThat(table.getRow(2)).containsKey("dropvolume");
    }

    @Test
    void testProjectElwUsesDerivedValues() throws IOException {
        Table table = load("elw-sample.xml").toTable();

        assertThat(table.column("plateformat")).containsOnly("UNKNOWN");
        assertThat(table.column("welllength")).containsExactly(370, 336);
        assertThat(table.column("usage")).containsExactly("SRC", "DEST");
    }

    @Test
    void testPlateShape() throws IOException {
        Labware labware = load("elwx-sample.xml");

        assertThat(labware.getPlate("384PP_DMSO2").getShape()).isEqualTo(PlateShape.of(16, 24));
        assertThat(labware.getPlate("384PP_DMSO2").getShape().wellCount()).isEqualTo(384);
        assertThat(labware.getPlate("6RES_AQ_BP2").getShape().wellCount()).isEqualTo(6);
    }

    @Test
    void testEmptyLabware() {
        Table table = new Labware().toTable();

        assertThat(table.rowCount()).isZero();
        assertThat(table.columnCount()).isEqualTo(25);
    }

    @Test
    void testTableRejectsWrongTypes() {
        assertThatThrownBy(() -> Table.fromRows(LabwareTableProjection.COLUMNS, List.of(Map.of("rows", "16"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rows");
        assertThatThrownBy(() -> Table.fromRows(LabwareTableProjection.COLUMNS, List.of(Map.of("colour", "red"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("colour");
    }
}
