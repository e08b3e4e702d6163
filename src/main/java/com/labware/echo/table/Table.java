package com.labware.echo.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rows of named, typed scalar cells. Absent values are {@code null}.
 *
 * Every row holds a value (possibly {@code null}) for every column, and every
 * non-null value is an instance of its column's Java type.
 */
public final class Table {

    private final List<TableColumn> columns;
    private final List<Map<String, Object>> rows;

    private Table(List<TableColumn> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Builds a table from rows keyed by column name. Missing keys become {@code null}.
     *
     * @throws IllegalArgumentException on duplicate column names, unknown keys or
     *                                  values of the wrong type
     */
    public static Table fromRows(List<TableColumn> columns, List<? extends Map<String, ?>> rows) {
        Set<String> names = new HashSet<>();
        for (TableColumn column : columns) {
            if (!names.add(column.getName())) {
                throw new IllegalArgumentException("Duplicate column " + column.getName());
            }
        }
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            for (String key : row.keySet()) {
                if (!names.contains(key)) {
                    throw new IllegalArgumentException("Unknown column " + key);
                }
            }
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (TableColumn column : columns) {
                Object value = row.get(column.getName());
                if (value != null && !column.getType().getJavaType().isInstance(value)) {
                    throw new IllegalArgumentException("Column " + column.getName() + " expects "
                            + column.getType() + " but got " + value.getClass().getSimpleName());
                }
                normalized.put(column.getName(), value);
            }
            copied.add(Collections.unmodifiableMap(normalized));
        }
        return new Table(List.copyOf(columns), Collections.unmodifiableList(copied));
    }

    public List<TableColumn> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return columns.stream().map(TableColumn::getName).toList();
    }

    public TableColumn getColumn(String name) {
        return columns.stream()
                .filter(c -> c.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No column " + name));
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public Map<String, Object> getRow(int index) {
        return rows.get(index);
    }

    public Object get(int rowIndex, String column) {
        getColumn(column);
        return rows.get(rowIndex).get(column);
    }

    /**
     * All values of one column, in row order.
     */
    public List<Object> column(String name) {
        getColumn(name);
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(name));
        }
        return values;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }
}
