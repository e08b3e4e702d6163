package com.labware.echo.cli.output;

import com.labware.echo.codec.ScalarType;
import com.labware.echo.table.Table;
import com.labware.echo.table.TableColumn;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for CSV rendering of tables.
 */
class TableCsvRendererTest {

    @TempDir
    Path tempDir;

    private static final List<TableColumn> COLUMNS = List.of(
            new TableColumn("name", ScalarType.STRING),
            new TableColumn("count", ScalarType.INTEGER),
            new TableColumn("volume", ScalarType.FLOAT),
            new TableColumn("when", ScalarType.TIMESTAMP));

    private final TableCsvRenderer renderer = new TableCsvRenderer();

    @ParameterizedTest
    @CsvSource({
            "plain, plain",
            "'a,b', '\"a,b\"'",
            "'say \"hi\"', '\"say \"\"hi\"\"\"'",
            "'', ''"
    })
    void testQuote(String cell, String expected) {
        assertThat(TableCsvRenderer.quote(cell)).isEqualTo(expected);
    }

    @Test
    void testFormat() {
        assertThat(TableCsvRenderer.format(null)).isEmpty();
        assertThat(TableCsvRenderer.format(12.50)).isEqualTo("12.5");
        assertThat(TableCsvRenderer.format(3)).isEqualTo("3");
        assertThat(TableCsvRenderer.format(LocalDateTime.of(2023, 4, 12, 15, 2, 33)))
                .isEqualTo("2023-04-12 15:02:33");
    }

    @Test
    void testRender() throws IOException {
        Map<String, Object> second = new HashMap<>();
        second.put("name", "multi\nline");
        Table table = Table.fromRows(COLUMNS, List.of(
                Map.of("name", "A1", "count", 2, "volume", 41.25, "when", LocalDateTime.of(2023, 4, 12, 15, 2, 33)),
                second));

        String csv = renderer.render(table);

        assertThat(csv).isEqualTo("name,count,volume,when\n"
                + "A1,2,41.25,2023-04-12 15:02:33\n"
                + "\"multi\nline\",,,\n");
    }

    @Test
    void testRenderEmptyTable() throws IOException {
        assertThat(renderer.render(Table.fromRows(COLUMNS, List.of()))).isEqualTo("name,count,volume,when\n");
    }

    @Test
    void testWrite() throws IOException {
        Path target = tempDir.resolve("nested/table.csv");

        renderer.write(Table.fromRows(COLUMNS, List.of(Map.of("name", "x"))), target);

        assertThat(Files.readString(target)).isEqualTo("name,count,volume,when\nx,,,\n");
    }
}
