package com.labware.echo.cli.output;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.labware.echo.codec.Codecs;
import com.labware.echo.table.Table;
import com.labware.echo.table.TableColumn;
import com.labware.echo.util.FileWriteUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a {@link Table} as RFC 4180 CSV through the {@code table.csv.ftl} template.
 *
 * Cells are formatted and quoted here; the template only lays them out.
 * Absent values become empty cells.
 */
public class TableCsvRenderer {

    private static final String TEMPLATE = "table.csv.ftl";

    private final Configuration freemarkerConfig;

    public TableCsvRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(Table table) throws IOException {
        List<String> header = table.getColumnNames().stream().map(TableCsvRenderer::quote).toList();
        List<List<String>> rows = new ArrayList<>(table.rowCount());
        for (Map<String, Object> row : table.getRows()) {
            List<String> cells = new ArrayList<>(table.columnCount());
            for (TableColumn column : table.getColumns()) {
                cells.add(quote(format(row.get(column.getName()))));
            }
            rows.add(cells);
        }

        Map<String, Object> model = new HashMap<>();
        model.put("header", header);
        model.put("rows", rows);

        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE, e);
        }
        return out.toString();
    }

    public void write(Table table, Path path) throws IOException {
        FileWriteUtil.safeWriteString(path, render(table));
    }

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            return Codecs.formatDouble(d);
        }
        if (value instanceof LocalDateTime timestamp) {
            return Codecs.TIMESTAMP.encode(timestamp);
        }
        return value.toString();
    }

    static String quote(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }
}
